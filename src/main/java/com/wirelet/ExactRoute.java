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

import com.wirelet.exception.RouteConfigurationException;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Matches a single literal path, such as {@code /health}.
 *
 * @param <C> the application context type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ExactRoute<C> implements Route<C> {
	@NonNull
	private final RoutePattern routePattern;
	@NonNull
	private final Set<@NonNull HttpMethod> httpMethods;
	@NonNull
	private final Handler<C> handler;

	/**
	 * Creates a route for a literal path.
	 *
	 * @param pattern     the path, which must start with {@code /} and contain no placeholders
	 * @param handler     the handler to invoke
	 * @param httpMethods the methods this route accepts, at least one
	 * @param <C>         the application context type
	 * @return the route
	 * @throws RouteConfigurationException if the pattern or methods are invalid
	 */
	@NonNull
	public static <C> ExactRoute<C> of(@NonNull String pattern,
																		 @NonNull Handler<C> handler,
																		 @NonNull Set<@NonNull HttpMethod> httpMethods) {
		requireNonNull(pattern);
		requireNonNull(handler);
		requireNonNull(httpMethods);

		return new ExactRoute<>(RoutePattern.of(pattern), handler, httpMethods);
	}

	private ExactRoute(@NonNull RoutePattern routePattern,
										 @NonNull Handler<C> handler,
										 @NonNull Set<@NonNull HttpMethod> httpMethods) {
		if (routePattern.isParameterized())
			throw new RouteConfigurationException(format("Route pattern '%s' has placeholders; use %s instead",
					routePattern.getPattern(), ParameterizedRoute.class.getSimpleName()));

		this.routePattern = routePattern;
		this.handler = handler;
		this.httpMethods = Router.validatedHttpMethods(httpMethods, routePattern.getPattern());
	}

	@NonNull
	@Override
	public Optional<Map<@NonNull String, @NonNull String>> match(@NonNull String normalizedPath,
																															 @NonNull HttpMethod httpMethod) {
		requireNonNull(normalizedPath);
		requireNonNull(httpMethod);

		if (!getHttpMethods().contains(httpMethod) || !getPattern().equals(normalizedPath))
			return Optional.empty();

		return Optional.of(Map.of());
	}

	@NonNull
	@Override
	public String getPattern() {
		return this.routePattern.getPattern();
	}

	@NonNull
	@Override
	public Set<@NonNull HttpMethod> getHttpMethods() {
		return this.httpMethods;
	}

	@NonNull
	@Override
	public Handler<C> getHandler() {
		return this.handler;
	}

	@Override
	public String toString() {
		return format("%s{pattern=%s, httpMethods=%s}", getClass().getSimpleName(), getPattern(), getHttpMethods());
	}
}
