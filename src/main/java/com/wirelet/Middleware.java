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
import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Wraps a {@link Handler} with behavior that runs before and/or after it.
 * <p>
 * A middleware may short-circuit by returning its own response or throwing instead of calling the handler it wraps.
 * <p>
 * Per-route middleware is applied by wrapping a handler before registering it; server-wide middleware is
 * configured via {@link Server.Builder#middlewares(List)} and composed around whichever handler a request matches.
 *
 * @param <C> the application context type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface Middleware<C> {
	@NonNull
	Handler<C> wrap(@NonNull Handler<C> handler);

	/**
	 * Composes middlewares around a handler so the first in the list is the outermost layer.
	 * <p>
	 * Given {@code [m1, m2]} and {@code h}, the result is {@code m1(m2(h))}: {@code m1} sees the request first and
	 * the response last.
	 *
	 * @param middlewares the middlewares, outermost first
	 * @param handler     the innermost handler
	 * @param <C>         the application context type
	 * @return the composed handler, or {@code handler} itself if there are no middlewares
	 */
	@NonNull
	static <C> Handler<C> compose(@NonNull List<? extends Middleware<C>> middlewares,
																@NonNull Handler<C> handler) {
		requireNonNull(middlewares);
		requireNonNull(handler);

		Handler<C> composed = handler;
		List<Middleware<C>> reversed = new ArrayList<>(middlewares);

		for (int i = reversed.size() - 1; i >= 0; i--) {
			Middleware<C> middleware = requireNonNull(reversed.get(i));
			composed = requireNonNull(middleware.wrap(composed), format("%s returned a null handler", middleware));
		}

		return composed;
	}

	/**
	 * Requires HTTP Basic credentials matching {@code username} and {@code password}.
	 *
	 * @param username the expected username
	 * @param password the expected password
	 * @param <C>      the application context type
	 * @return a middleware that throws {@link HttpException} with {@link StatusCode#HTTP_401} on missing or wrong credentials
	 */
	@NonNull
	static <C> Middleware<C> basicAuth(@NonNull String username,
																		 @NonNull String password) {
		requireNonNull(username);
		requireNonNull(password);

		Logger logger = LoggerFactory.getLogger(Middleware.class);
		byte[] expected = format("%s:%s", username, password).getBytes(StandardCharsets.UTF_8);

		return (handler) -> (request) -> {
			String authorization = request.getHeader("Authorization").orElse(null);

			if (authorization == null)
				throw new HttpException(StatusCode.HTTP_401, "Missing Authorization header");

			String[] tokens = authorization.trim().split(" ", 2);

			if (tokens.length != 2 || !"basic".equalsIgnoreCase(tokens[0]))
				throw new HttpException(StatusCode.HTTP_401, "Unsupported authorization scheme");

			byte[] credentials;

			try {
				credentials = Base64.getDecoder().decode(tokens[1].trim());
			} catch (IllegalArgumentException e) {
				throw new HttpException(StatusCode.HTTP_401, "Malformed Basic credentials", e);
			}

			if (!MessageDigest.isEqual(expected, credentials)) {
				logger.debug("Rejected Basic credentials for {} {}", request.getMethod(), request.getPath());
				throw new HttpException(StatusCode.HTTP_401, "Invalid credentials");
			}

			return handler.handle(request);
		};
	}
}
