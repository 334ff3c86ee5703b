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
import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;

/**
 * Serves files from a directory for every {@code GET} under a path prefix.
 * <p>
 * With prefix {@code /static} and directory {@code /srv/assets}, a request for {@code /static/css/site.css} is answered
 * with {@link Response#file(Path)} for {@code /srv/assets/css/site.css}. The prefix only matches whole segments, so
 * {@code /staticky} is not served.
 * <p>
 * The remainder of the path is percent-decoded before it is resolved. Anything that resolves outside the directory,
 * whether through {@code ..} or a symbolic link, gets a {@code 404} just like a missing file.
 *
 * @param <C> the application context type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class FileSystemRoute<C> implements Route<C> {
	@NonNull
	private static final Logger logger = LoggerFactory.getLogger(FileSystemRoute.class);

	@NonNull
	private static final Set<@NonNull HttpMethod> HTTP_METHODS;

	static {
		HTTP_METHODS = unmodifiableSet(EnumSet.of(HttpMethod.GET));
	}

	@NonNull
	private final String prefix;
	@NonNull
	private final Path directory;
	@NonNull
	private final Handler<C> handler;

	/**
	 * Creates a route serving {@code directory} under {@code prefix}.
	 *
	 * @param prefix    the path prefix, which must start with {@code /}
	 * @param directory an existing, readable directory
	 * @param <C>       the application context type
	 * @return the route
	 * @throws RouteConfigurationException if the prefix is invalid or the directory is unusable
	 */
	@NonNull
	public static <C> FileSystemRoute<C> of(@NonNull String prefix,
																					@NonNull Path directory) {
		requireNonNull(prefix);
		requireNonNull(directory);

		return new FileSystemRoute<>(prefix, directory);
	}

	private FileSystemRoute(@NonNull String prefix,
													@NonNull Path directory) {
		RoutePattern routePattern = RoutePattern.of(prefix);

		if (routePattern.isParameterized())
			throw new RouteConfigurationException(format("File system route prefix '%s' cannot contain placeholders", prefix));

		if (!Files.isDirectory(directory) || !Files.isReadable(directory))
			throw new RouteConfigurationException(format("File system route target '%s' is not a readable directory", directory));

		try {
			this.directory = directory.toRealPath();
		} catch (IOException e) {
			throw new RouteConfigurationException(format("Unable to resolve file system route target '%s'", directory), e);
		}

		this.prefix = routePattern.getPattern();
		this.handler = this::serve;
	}

	@NonNull
	@Override
	public Optional<Map<@NonNull String, @NonNull String>> match(@NonNull String normalizedPath,
																															 @NonNull HttpMethod httpMethod) {
		requireNonNull(normalizedPath);
		requireNonNull(httpMethod);

		if (httpMethod != HttpMethod.GET || !isUnderPrefix(normalizedPath))
			return Optional.empty();

		return Optional.of(Map.of());
	}

	@NonNull
	private Boolean isUnderPrefix(@NonNull String normalizedPath) {
		if ("/".equals(getPrefix()))
			return true;

		return normalizedPath.equals(getPrefix()) || normalizedPath.startsWith(getPrefix() + "/");
	}

	@NonNull
	private Response serve(@NonNull Request<C> request) {
		requireNonNull(request);

		String normalizedPath = RoutePattern.normalizePath(request.getPath());

		if (!isUnderPrefix(normalizedPath))
			throw new HttpException(StatusCode.HTTP_404);

		Path file = resolve(normalizedPath.substring("/".equals(getPrefix()) ? 0 : getPrefix().length()))
				.orElseThrow(() -> new HttpException(StatusCode.HTTP_404));

		return Response.file(file);
	}

	/**
	 * Maps the part of a request path after the prefix to a file under the directory.
	 *
	 * @param remainder the path remainder, e.g. {@code /css/site.css}
	 * @return the file, or {@link Optional#empty()} if it would fall outside the directory or does not exist
	 */
	@NonNull
	Optional<Path> resolve(@NonNull String remainder) {
		requireNonNull(remainder);

		String relativePath = Utilities.percentDecode(remainder, StandardCharsets.UTF_8);

		while (relativePath.startsWith("/"))
			relativePath = relativePath.substring(1);

		if (relativePath.isEmpty() || relativePath.indexOf('\0') >= 0)
			return Optional.empty();

		Path candidate;

		try {
			candidate = getDirectory().resolve(relativePath).normalize();
		} catch (InvalidPathException e) {
			logger.debug("Rejecting unresolvable path '{}'", Utilities.printableString(relativePath));
			return Optional.empty();
		}

		if (!candidate.startsWith(getDirectory())) {
			logger.debug("Rejecting path '{}' which escapes {}", Utilities.printableString(relativePath), getDirectory());
			return Optional.empty();
		}

		if (!Files.exists(candidate))
			return Optional.empty();

		try {
			// Symbolic links inside the directory must not lead outside of it
			if (!candidate.toRealPath().startsWith(getDirectory()))
				return Optional.empty();
		} catch (IOException e) {
			logger.debug(format("Unable to resolve %s", candidate), e);
			return Optional.empty();
		}

		return Optional.of(candidate);
	}

	@NonNull
	public String getPrefix() {
		return this.prefix;
	}

	@NonNull
	public Path getDirectory() {
		return this.directory;
	}

	@NonNull
	@Override
	public String getPattern() {
		return getPrefix();
	}

	@NonNull
	@Override
	public Set<@NonNull HttpMethod> getHttpMethods() {
		return HTTP_METHODS;
	}

	@NonNull
	@Override
	public Handler<C> getHandler() {
		return this.handler;
	}

	@Override
	public String toString() {
		return format("%s{prefix=%s, directory=%s}", getClass().getSimpleName(), getPrefix(), getDirectory());
	}
}
