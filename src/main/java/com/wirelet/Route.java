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

import org.jspecify.annotations.NonNull;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A rule mapping a path pattern and a set of methods to a {@link Handler}.
 * <p>
 * Routes never hold per-request state: {@link #match(String, HttpMethod)} returns the bound path parameters to the
 * caller, so a single route can be matched by any number of connections at once.
 *
 * @param <C> the application context type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @see Router
 */
public sealed interface Route<C> permits ExactRoute, ParameterizedRoute, FileSystemRoute {
	/**
	 * The normalized pattern, used together with {@link #getHttpMethods()} to detect duplicate registrations.
	 *
	 * @return the normalized pattern
	 */
	@NonNull
	String getPattern();

	@NonNull
	Set<@NonNull HttpMethod> getHttpMethods();

	@NonNull
	Handler<C> getHandler();

	/**
	 * Tests this route against a request.
	 *
	 * @param normalizedPath the request path with any query and trailing slashes removed
	 * @param httpMethod     the request method
	 * @return the path parameters bound by this route (possibly empty), or {@link Optional#empty()} if the route does not match
	 */
	@NonNull
	Optional<Map<@NonNull String, @NonNull String>> match(@NonNull String normalizedPath,
																												@NonNull HttpMethod httpMethod);
}
