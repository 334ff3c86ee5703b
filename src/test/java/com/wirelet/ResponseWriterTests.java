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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ResponseWriterTests {
	private static final Clock CLOCK = Clock.fixed(Instant.parse("1994-11-06T08:49:37Z"), ZoneOffset.UTC);

	@Test
	public void writesStatusLineHeadersAndBody() throws IOException {
		Response response = Response.text("hi")
				.cookie(ResponseCookie.with("session", "abc").path("/").httpOnly(true).build())
				.cookie(ResponseCookie.with("theme", "dark").build());

		String written = write(response);

		Assertions.assertEquals("HTTP/1.1 200 OK\r\n"
				+ "Content-Type: text/plain; charset=utf-8\r\n"
				+ "Server: Wirelet\r\n"
				+ "Date: Sun, 06 Nov 1994 08:49:37 GMT\r\n"
				+ "Content-Length: 2\r\n"
				+ "Set-Cookie: session=abc; Path=/; HttpOnly\r\n"
				+ "Set-Cookie: theme=dark\r\n"
				+ "\r\n"
				+ "hi", written);
		Assertions.assertTrue(response.isSealed());
	}

	@Test
	public void serverManagedHeadersAreOverwrittenInPlace() throws IOException {
		Response response = Response.withStatusCode(StatusCode.HTTP_204)
				.header("Date", "yesterday")
				.header("Server", "Impostor")
				.header("Content-Length", "999")
				.header("X-Custom", "1")
				.build();

		Assertions.assertEquals("HTTP/1.1 204 No Content\r\n"
				+ "Date: Sun, 06 Nov 1994 08:49:37 GMT\r\n"
				+ "Server: Wirelet\r\n"
				+ "Content-Length: 0\r\n"
				+ "X-Custom: 1\r\n"
				+ "\r\n", write(response));
	}

	@Test
	public void sharedResponsesCanBeWrittenRepeatedly() throws IOException {
		Response response = Response.text("pong");

		String first = write(response);
		String second = write(response);

		Assertions.assertEquals(first, second);
		Assertions.assertTrue(second.startsWith("HTTP/1.1 200 OK\r\n"));
		Assertions.assertTrue(second.endsWith("\r\n\r\npong"));
		Assertions.assertFalse(response.getHeaders().contains("Server"), "Injected headers belong to the written copy only");
		Assertions.assertThrows(IllegalStateException.class, () -> response.header("X-Late", "1"));
	}

	@Test
	public void streamedBodiesAreCopiedAndClosed() throws IOException {
		byte[] payload = new byte[10_000];

		for (int i = 0; i < payload.length; i++)
			payload[i] = (byte) (i % 251);

		AtomicBoolean closed = new AtomicBoolean(false);
		InputStream stream = new ByteArrayInputStream(payload) {
			@Override
			public void close() throws IOException {
				closed.set(true);
				super.close();
			}
		};

		Response response = Response.withStatusCode(StatusCode.HTTP_200).stream(stream).build();
		ByteArrayOutputStream outputStream = new ByteArrayOutputStream();

		new ResponseWriter(64, CLOCK).write(response, outputStream);

		byte[] written = outputStream.toByteArray();
		String head = new String(written, 0, written.length - payload.length, StandardCharsets.ISO_8859_1);

		Assertions.assertFalse(head.contains("Content-Length"), "Streamed bodies get no automatic Content-Length");
		Assertions.assertTrue(head.endsWith("\r\n\r\n"));
		Assertions.assertArrayEquals(payload, Arrays.copyOfRange(written, written.length - payload.length, written.length));
		Assertions.assertTrue(closed.get());
	}

	@Test
	public void bodyIsClosedWhenWritingFails() {
		AtomicBoolean closed = new AtomicBoolean(false);
		InputStream stream = new ByteArrayInputStream(new byte[]{1, 2, 3}) {
			@Override
			public void close() throws IOException {
				closed.set(true);
				super.close();
			}
		};

		OutputStream brokenOutputStream = new OutputStream() {
			@Override
			public void write(int b) throws IOException {
				throw new IOException("Broken pipe");
			}
		};

		Response response = Response.withStatusCode(StatusCode.HTTP_200).stream(stream).build();

		Assertions.assertThrows(IOException.class, () -> new ResponseWriter(16, CLOCK).write(response, brokenOutputStream));
		Assertions.assertTrue(closed.get());
	}

	private static String write(Response response) throws IOException {
		ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
		new ResponseWriter(1_024, CLOCK).write(response, outputStream);
		return outputStream.toString(StandardCharsets.ISO_8859_1);
	}
}
