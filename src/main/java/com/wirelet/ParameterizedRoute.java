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
 * Matches paths against a template with named placeholders, such as {@code /person/:person/item/:item}.
 * <p>
 * The request path must have as many segments as the pattern. Literal segments must be equal and placeholder
 * segments bind the request's segment verbatim (no decoding).
 *
 * @param <C> the application context type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @see RoutePattern
 */
@ThreadSafe
public final class ParameterizedRoute<C> implements Route<C> {
	@NonNull
	private final RoutePattern routePattern;
	@NonNull
	private final Set<@NonNull HttpMethod> httpMethods;
	@NonNull
	private final Handler<C> handler;

	@NonNull
	public static <C> ParameterizedRoute<C> of(@NonNull String pattern,
																						 @NonNull Handler<C> handler,
																						 @NonNull Set<@NonNull HttpMethod> httpMethods) {
		requireNonNull(pattern);
		requireNonNull(handler);
		requireNonNull(httpMethods);

		return new ParameterizedRoute<>(RoutePattern.of(pattern), handler, httpMethods);
	}

	private ParameterizedRoute(@NonNull RoutePattern routePattern,
														 @NonNull Handler<C> handler,
														 @NonNull Set<@NonNull HttpMethod> httpMethods) {
		if (!routePattern.isParameterized())
			throw new RouteConfigurationException(format("Route pattern '%s' has no placeholders", routePattern.getPattern()));

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

		if (!getHttpMethods().contains(httpMethod))
			return Optional.empty();

		return getRoutePattern().match(normalizedPath);
	}

	@NonNull
	public RoutePattern getRoutePattern() {
		return this.routePattern;
	}

	@NonNull
	@Override
	public String getPattern() {
		return getRoutePattern().getPattern();
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
