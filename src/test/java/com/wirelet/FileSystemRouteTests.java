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

import com.wirelet.exception.HttpException;
import com.wirelet.exception.RouteConfigurationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class FileSystemRouteTests {
	@Test
	public void matchesWholeSegmentsForGetOnly(@TempDir Path directory) {
		FileSystemRoute<Void> route = FileSystemRoute.of("/static/", directory);

		Assertions.assertEquals("/static", route.getPattern());
		Assertions.assertTrue(route.match("/static/css/site.css", HttpMethod.GET).isPresent());
		Assertions.assertTrue(route.match("/static", HttpMethod.GET).isPresent());
		Assertions.assertTrue(route.match("/staticky/x", HttpMethod.GET).isEmpty());
		Assertions.assertTrue(route.match("/static/css/site.css", HttpMethod.POST).isEmpty());
	}

	@Test
	public void servesFilesUnderTheDirectory(@TempDir Path directory) throws Exception {
		Files.createDirectories(directory.resolve("css"));
		Files.writeString(directory.resolve("css").resolve("site file.css"), "body{}");

		Router<Void> router = new Router<Void>().add(FileSystemRoute.of("/static", directory));
		RouteMatch<Void> routeMatch = router.match("/static/css/site%20file.css?v=2", "GET").orElseThrow();

		try (Response response = routeMatch.route().getHandler().handle(Request.<Void>with("GET", "/static/css/site%20file.css?v=2").build())) {
			Assertions.assertEquals(StatusCode.HTTP_200, response.getStatusCode());
			Assertions.assertEquals(Optional.of("6"), response.getHeaders().getFirst("Content-Length"));
			Assertions.assertEquals(Optional.of("attachment; filename=\"site%20file.css\""), response.getHeaders().getFirst("Content-Disposition"));
			Assertions.assertTrue(response.getHeaders().getFirst("Last-Modified").isPresent());
			Assertions.assertEquals("body{}", new String(TestSupport.readAll(response.getStream().orElseThrow()), StandardCharsets.UTF_8));
		}
	}

	@Test
	public void missingFilesAndEscapesAreNotFound(@TempDir Path root) throws IOException {
		Path directory = Files.createDirectories(root.resolve("public"));
		Files.writeString(root.resolve("secret.txt"), "top secret");

		FileSystemRoute<Void> route = FileSystemRoute.of("/files", directory);

		Assertions.assertEquals(Optional.empty(), route.resolve("/nope.txt"));
		Assertions.assertEquals(Optional.empty(), route.resolve("/../secret.txt"));
		Assertions.assertEquals(Optional.empty(), route.resolve("/%2e%2e/secret.txt"));
		Assertions.assertEquals(Optional.empty(), route.resolve(""));

		assertNotFound(route, "/files/nope.txt");
		assertNotFound(route, "/files/%2e%2e/secret.txt");
		assertNotFound(route, "/files");
	}

	@Test
	public void invalidTargetsFailAtRegistration(@TempDir Path directory) throws IOException {
		Path file = Files.writeString(directory.resolve("plain.txt"), "x");

		Assertions.assertThrows(RouteConfigurationException.class, () -> FileSystemRoute.of("/static", directory.resolve("missing")));
		Assertions.assertThrows(RouteConfigurationException.class, () -> FileSystemRoute.of("/static", file));
		Assertions.assertThrows(RouteConfigurationException.class, () -> FileSystemRoute.of("static", directory));
		Assertions.assertThrows(RouteConfigurationException.class, () -> FileSystemRoute.of("/static/:name", directory));
	}

	private static void assertNotFound(FileSystemRoute<Void> route, String path) {
		HttpException exception = Assertions.assertThrows(HttpException.class,
				() -> route.getHandler().handle(Request.<Void>with("GET", path).build()));
		Assertions.assertEquals(StatusCode.HTTP_404, exception.getStatusCode());
	}
}
