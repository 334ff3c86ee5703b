/*
 * Copyright 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.wirelet;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.wirelet.exception.HttpException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ServerTests {
	@Test
	public void plainResponseCarriesStandardHeaders() throws Exception {
		Router<Void> router = new Router<Void>()
				.add("/hello", request -> Response.text("hello, world"));

		try (Server<Void> server = startServer(router)) {
			TestSupport.RawResponse response = get(server, "/hello");

			Assertions.assertEquals("HTTP/1.1 200 OK", response.statusLine());
			Assertions.assertEquals(Optional.of("Wirelet"), response.header("Server"));
			Assertions.assertTrue(response.header("Date").isPresent());
			Assertions.assertEquals(Optional.of("12"), response.header("Content-Length"));
			Assertions.assertEquals(Optional.of("text/plain; charset=utf-8"), response.header("Content-Type"));
			Assertions.assertEquals("hello, world", response.bodyAsString());
		}
	}

	@Test
	public void jsonBodiesRoundTrip() throws Exception {
		Router<Void> router = new Router<Void>()
				.add("/echo", request -> Response.json(request.getJson()), HttpMethod.POST);

		try (Server<Void> server = startServer(router)) {
			TestSupport.RawResponse response = post(server, "/echo", "application/json", "{\"a\":\"1\"}");
			Assertions.assertEquals(200, response.statusCode());
			Assertions.assertEquals("{\"a\":\"1\"}", response.bodyAsString());
			Assertions.assertEquals(Optional.of("application/json"), response.header("Content-Type"));

			Assertions.assertEquals("{}", post(server, "/echo", "application/json", "{}").bodyAsString());
			// Unhandled parse errors surface like any other handler failure
			Assertions.assertEquals(500, post(server, "/echo", "application/json", "{not json").statusCode());
		}
	}

	@Test
	public void queryAndPathParametersReachHandlers() throws Exception {
		Router<Void> router = new Router<Void>()
				.add("/query", request -> Response.json(request.getQueryParameters()))
				.add("/people/:person/items/:item", request -> Response.json(request.getPathParameters()));

		try (Server<Void> server = startServer(router)) {
			JsonObject query = JsonParser.parseString(get(server, "/query?a=1&a=2&b=3").bodyAsString()).getAsJsonObject();
			Assertions.assertEquals(2, query.getAsJsonArray("a").size());
			Assertions.assertEquals("2", query.getAsJsonArray("a").get(1).getAsString());
			Assertions.assertEquals("3", query.getAsJsonArray("b").get(0).getAsString());

			JsonObject path = JsonParser.parseString(get(server, "/people/123/items/456/").bodyAsString()).getAsJsonObject();
			Assertions.assertEquals("123", path.get("person").getAsString());
			Assertions.assertEquals("456", path.get("item").getAsString());
		}
	}

	@Test
	public void middlewareRunsInRegistrationOrder() throws Exception {
		List<String> events = new CopyOnWriteArrayList<>();

		Middleware<Void> outer = next -> request -> {
			events.add("outer");
			Response response = next.handle(request);
			return response.header("X-Wrapped", "outer");
		};

		Middleware<Void> inner = next -> request -> {
			events.add("inner");
			return next.handle(request);
		};

		Router<Void> router = new Router<Void>()
				.add("/", request -> {
					events.add("handler");
					return Response.text("ok");
				});

		try (Server<Void> server = Server.<Void>withPort(TestSupport.findFreePort())
				.router(router)
				.middlewares(List.of(outer, inner))
				.build()) {
			server.start();

			TestSupport.RawResponse response = get(server, "/");
			Assertions.assertEquals(Optional.of("outer"), response.header("X-Wrapped"));
			Assertions.assertEquals(List.of("outer", "inner", "handler"), events);
		}
	}

	@Test
	public void basicAuthGuardsRoutes() throws Exception {
		Router<Void> router = new Router<Void>().add("/secret", request -> Response.text("classified"));

		try (Server<Void> server = Server.<Void>withPort(TestSupport.findFreePort())
				.router(router)
				.middlewares(List.of(Middleware.basicAuth("admin", "hunter2")))
				.build()) {
			server.start();

			Assertions.assertEquals(401, get(server, "/secret").statusCode());

			String credentials = Base64.getEncoder().encodeToString("admin:hunter2".getBytes(StandardCharsets.UTF_8));
			TestSupport.RawResponse response = TestSupport.exchange(port(server),
					"GET /secret HTTP/1.1\r\nHost: localhost\r\nAuthorization: Basic " + credentials + "\r\n\r\n");

			Assertions.assertEquals(200, response.statusCode());
			Assertions.assertEquals("classified", response.bodyAsString());
		}
	}

	@Test
	public void lifecycleHooksReceiveContext() throws Exception {
		AtomicReference<String> started = new AtomicReference<>();
		AtomicReference<String> stopped = new AtomicReference<>();

		Router<String> router = new Router<String>()
				.add("/context", request -> Response.text(request.getContext().orElse("none")));

		Server<String> server = Server.<String>withPort(TestSupport.findFreePort())
				.router(router)
				.context("application")
				.beforeStart(started::set)
				.afterStop(stopped::set)
				.build();

		server.start();

		try {
			Assertions.assertEquals("application", started.get());
			Assertions.assertNull(stopped.get());
			Assertions.assertEquals("application", get(server, "/context").bodyAsString());
		} finally {
			server.stop();
		}

		Assertions.assertEquals("application", stopped.get());
		Assertions.assertFalse(server.isStarted());
	}

	@Test
	public void errorsMapToStatusCodes() throws Exception {
		Router<Void> router = new Router<Void>()
				.add("/boom", request -> {
					throw new IllegalStateException("boom");
				})
				.add("/teapot", request -> {
					throw new HttpException(StatusCode.HTTP_418);
				});

		try (Server<Void> server = startServer(router)) {
			Assertions.assertEquals("HTTP/1.1 404 Not Found", get(server, "/missing").statusLine());
			Assertions.assertEquals(500, get(server, "/boom").statusCode());
			Assertions.assertEquals(418, get(server, "/teapot").statusCode());
			Assertions.assertEquals(404, post(server, "/boom", "text/plain", "x").statusCode());
			Assertions.assertEquals(400, TestSupport.exchange(port(server), "GARBAGE\r\n\r\n").statusCode());
		}
	}

	@Test
	public void sharedResponseInstancesAreServedToEveryRequest() throws Exception {
		Response pong = Response.text("pong");
		Router<Void> router = new Router<Void>().add("/ping", request -> pong);

		try (Server<Void> server = startServer(router)) {
			for (int i = 0; i < 3; i++) {
				TestSupport.RawResponse response = get(server, "/ping");

				Assertions.assertEquals("HTTP/1.1 200 OK", response.statusLine());
				Assertions.assertEquals(Optional.of("4"), response.header("Content-Length"));
				Assertions.assertEquals("pong", response.bodyAsString());
			}
		}
	}

	@Test
	public void cookiesAreWrittenAsSeparateLines() throws Exception {
		Router<Void> router = new Router<Void>()
				.add("/login", request -> Response.text("welcome")
						.cookie(ResponseCookie.with("session", "abc").path("/").build())
						.cookie(ResponseCookie.with("theme", "dark").build()));

		try (Server<Void> server = startServer(router)) {
			List<String> cookies = get(server, "/login").headerValues("Set-Cookie");

			Assertions.assertEquals(2, cookies.size());
			Assertions.assertTrue(cookies.get(0).startsWith("session=abc"));
			Assertions.assertTrue(cookies.get(1).startsWith("theme=dark"));
		}
	}

	@Test
	public void fileRoutesStreamDownloads(@TempDir Path directory) throws Exception {
		byte[] contents = new byte[200_000];

		for (int i = 0; i < contents.length; i++)
			contents[i] = (byte) (i % 251);

		Files.write(directory.resolve("data.bin"), contents);

		Router<Void> router = new Router<Void>().add(FileSystemRoute.of("/downloads", directory));

		try (Server<Void> server = Server.<Void>withPort(TestSupport.findFreePort())
				.router(router)
				.chunkSize(4_096)
				.build()) {
			server.start();

			TestSupport.RawResponse response = get(server, "/downloads/data.bin");

			Assertions.assertEquals(200, response.statusCode());
			Assertions.assertEquals(Optional.of("200000"), response.header("Content-Length"));
			Assertions.assertEquals(Optional.of("attachment; filename=\"data.bin\""), response.header("Content-Disposition"));
			Assertions.assertArrayEquals(contents, response.body());

			Assertions.assertEquals(404, get(server, "/downloads/missing.bin").statusCode());
			Assertions.assertEquals(404, get(server, "/downloads/%2e%2e/etc/passwd").statusCode());
		}
	}

	@Test
	public void stalledClientsAreDisconnected() throws Exception {
		Router<Void> router = new Router<Void>().add("/", request -> Response.text("ok"));

		try (Server<Void> server = Server.<Void>withPort(TestSupport.findFreePort())
				.router(router)
				.readTimeout(Duration.ofMillis(200))
				.build()) {
			server.start();

			try (Socket socket = TestSupport.connectWithRetry("127.0.0.1", port(server), 2_000)) {
				socket.setSoTimeout(5_000);
				OutputStream out = socket.getOutputStream();
				out.write("GET / HTTP/1.1\r\nHost: loc".getBytes(StandardCharsets.ISO_8859_1));
				out.flush();

				byte[] received;

				try {
					received = TestSupport.readAll(socket.getInputStream());
				} catch (IOException e) {
					// Connection reset
					received = new byte[0];
				}

				Assertions.assertEquals(0, received.length, "No response should be written for a stalled request");
			}

			// The server keeps serving other clients
			Assertions.assertEquals(200, get(server, "/").statusCode());
		}
	}

	@Test
	public void stopWaitsForInFlightRequests() throws Exception {
		CountDownLatch entered = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);

		Router<Void> router = new Router<Void>().add("/slow", request -> {
			entered.countDown();
			release.await();
			return Response.text("done");
		});

		Server<Void> server = startServer(router);
		AtomicReference<TestSupport.RawResponse> response = new AtomicReference<>();
		AtomicReference<Throwable> failure = new AtomicReference<>();

		Thread client = new Thread(() -> {
			try {
				response.set(get(server, "/slow"));
			} catch (Throwable t) {
				failure.set(t);
			}
		});

		client.start();
		Assertions.assertTrue(entered.await(5, TimeUnit.SECONDS));

		CountDownLatch stopped = new CountDownLatch(1);
		Thread stopper = new Thread(() -> {
			server.stop();
			stopped.countDown();
		});

		stopper.start();

		Assertions.assertFalse(stopped.await(300, TimeUnit.MILLISECONDS), "Stop returned while a request was in flight");

		release.countDown();

		Assertions.assertTrue(stopped.await(5, TimeUnit.SECONDS));
		client.join(5_000);

		Assertions.assertNull(failure.get());
		Assertions.assertEquals("done", response.get().bodyAsString());
	}

	@Test
	public void awaitShutdownReturnsOnceStopped() throws Exception {
		Server<Void> server = startServer(new Router<>());
		Thread stopper = new Thread(() -> {
			try {
				Thread.sleep(100);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}

			server.stop();
		});

		stopper.start();
		server.awaitShutdown();
		stopper.join(5_000);

		Assertions.assertFalse(server.isStarted());
	}

	@Test
	public void multipartUploadsAreParsed() throws Exception {
		Router<Void> router = new Router<Void>().add("/upload", request -> {
			UploadedFile file = request.getFiles().get(0);
			return Response.text(request.getFormParameter("title").orElse("?") + ":" + file.getFilename() + ":"
					+ new String(file.getBytes(), StandardCharsets.UTF_8));
		}, HttpMethod.POST);

		String body = "--XyZ\r\n"
				+ "Content-Disposition: form-data; name=\"title\"\r\n\r\n"
				+ "notes\r\n"
				+ "--XyZ\r\n"
				+ "Content-Disposition: form-data; name=\"file\"; filename=\"notes.txt\"\r\n"
				+ "Content-Type: text/plain\r\n\r\n"
				+ "line one\r\n"
				+ "--XyZ--\r\n";

		try (Server<Void> server = startServer(router)) {
			TestSupport.RawResponse response = post(server, "/upload", "multipart/form-data; boundary=XyZ", body);

			Assertions.assertEquals(200, response.statusCode());
			Assertions.assertEquals("notes:notes.txt:line one", response.bodyAsString());
		}
	}

	private static <C> Server<C> startServer(Router<C> router) throws IOException {
		Server<C> server = Server.<C>withPort(TestSupport.findFreePort())
				.router(router)
				.build();

		server.start();
		return server;
	}

	private static int port(Server<?> server) {
		return server.getBoundPort().orElseThrow();
	}

	private static TestSupport.RawResponse get(Server<?> server,
																						 String path) throws IOException, InterruptedException {
		return TestSupport.exchange(port(server), "GET " + path + " HTTP/1.1\r\nHost: localhost\r\n\r\n");
	}

	private static TestSupport.RawResponse post(Server<?> server,
																							String path,
																							String contentType,
																							String body) throws IOException, InterruptedException {
		byte[] bodyBytes = body.getBytes(StandardCharsets.UTF_8);
		String head = "POST " + path + " HTTP/1.1\r\nHost: localhost\r\nContent-Type: " + contentType
				+ "\r\nContent-Length: " + bodyBytes.length + "\r\n\r\n";

		return TestSupport.exchange(port(server), (head + body).getBytes(StandardCharsets.UTF_8));
	}
}
