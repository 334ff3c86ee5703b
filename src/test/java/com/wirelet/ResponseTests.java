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
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ResponseTests {
	@Test
	public void contentTypeFactories() {
		Response html = Response.html("<p>hi</p>");
		Assertions.assertEquals(StatusCode.HTTP_200, html.getStatusCode());
		Assertions.assertEquals(Optional.of("text/html; charset=utf-8"), html.getHeaders().getFirst("Content-Type"));

		Response text = Response.text("created", StatusCode.HTTP_201);
		Assertions.assertEquals(StatusCode.HTTP_201, text.getStatusCode());
		Assertions.assertEquals(Optional.of("text/plain; charset=utf-8"), text.getHeaders().getFirst("Content-Type"));
		Assertions.assertEquals("created", new String(text.getBody(), StandardCharsets.UTF_8));

		Response json = Response.json(Map.of("a", "1"));
		Assertions.assertEquals(Optional.of("application/json"), json.getHeaders().getFirst("Content-Type"));
		Assertions.assertEquals(JsonParser.parseString("{\"a\":\"1\"}"), JsonParser.parseString(new String(json.getBody(), StandardCharsets.UTF_8)));
		Assertions.assertEquals("{}", new String(Response.json(new JsonObject()).getBody(), StandardCharsets.UTF_8));
	}

	@Test
	public void redirectAndError() {
		Response redirect = Response.redirect("/elsewhere");
		Assertions.assertEquals(StatusCode.HTTP_301, redirect.getStatusCode());
		Assertions.assertEquals(Optional.of("/elsewhere"), redirect.getHeaders().getFirst("Location"));
		Assertions.assertEquals(StatusCode.HTTP_302, Response.redirect("/tmp", StatusCode.HTTP_302).getStatusCode());

		Response error = Response.error(StatusCode.HTTP_404);
		Assertions.assertEquals(StatusCode.HTTP_404, error.getStatusCode());
		Assertions.assertEquals("Not Found", new String(error.getBody(), StandardCharsets.UTF_8));
		Assertions.assertEquals(Optional.of("text/html; charset=utf-8"), error.getHeaders().getFirst("Content-Type"));
	}

	@Test
	public void bodyAndStreamAreExclusive() throws IOException {
		Response response = Response.withStatusCode(StatusCode.HTTP_200).body("bytes").build();
		Assertions.assertTrue(response.getStream().isEmpty());

		response.stream(new ByteArrayInputStream(new byte[]{1, 2}));
		Assertions.assertTrue(response.getStream().isPresent());
		Assertions.assertEquals(0, response.getBody().length);

		response.body("again");
		Assertions.assertTrue(response.getStream().isEmpty());
		Assertions.assertEquals("again", new String(response.getBody(), StandardCharsets.UTF_8));
		response.close();
	}

	@Test
	public void sealedResponseRejectsMutation() {
		Response response = Response.text("x");
		response.seal();

		Assertions.assertTrue(response.isSealed());
		Assertions.assertThrows(IllegalStateException.class, () -> response.header("X-Late", "1"));
		Assertions.assertThrows(IllegalStateException.class, () -> response.body("y"));
		Assertions.assertThrows(IllegalStateException.class, () -> response.statusCode(StatusCode.HTTP_500));
		Assertions.assertThrows(IllegalStateException.class, () -> response.getHeaders().add("X-Late", "1"));
	}

	@Test
	public void file(@TempDir Path directory) throws IOException {
		Path file = directory.resolve("quarterly report.pdf");
		Files.write(file, new byte[]{1, 2, 3, 4, 5});
		Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2024-01-02T03:04:05Z")));

		try (Response response = Response.file(file)) {
			Assertions.assertEquals(StatusCode.HTTP_200, response.getStatusCode());
			Assertions.assertEquals(Optional.of("attachment; filename=\"quarterly%20report.pdf\""), response.getHeaders().getFirst("Content-Disposition"));
			Assertions.assertEquals(Optional.of("5"), response.getHeaders().getFirst("Content-Length"));
			Assertions.assertEquals(Optional.of("Tue, 02 Jan 2024 03:04:05 GMT"), response.getHeaders().getFirst("Last-Modified"));
			Assertions.assertTrue(response.getHeaders().getFirst("Content-Type").isPresent());
			Assertions.assertArrayEquals(new byte[]{1, 2, 3, 4, 5}, TestSupport.readAll(response.getStream().orElseThrow()));
		}
	}

	@Test
	public void fileDownloadNameAndFallbackContentType(@TempDir Path directory) throws IOException {
		Path file = directory.resolve("blob");
		Files.write(file, new byte[]{9});

		try (Response response = Response.file(file, "data.unknownext")) {
			Assertions.assertEquals(Optional.of("attachment; filename=\"data.unknownext\""), response.getHeaders().getFirst("Content-Disposition"));
			Assertions.assertEquals(Optional.of("application/octet-stream"), response.getHeaders().getFirst("Content-Type"));
		}
	}

	@Test
	public void missingFileIsNotFound(@TempDir Path directory) {
		HttpException missing = Assertions.assertThrows(HttpException.class, () -> Response.file(directory.resolve("nope.txt")));
		Assertions.assertEquals(StatusCode.HTTP_404, missing.getStatusCode());

		HttpException notAFile = Assertions.assertThrows(HttpException.class, () -> Response.file(directory));
		Assertions.assertEquals(StatusCode.HTTP_404, notAFile.getStatusCode());
	}
}
