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
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The standard <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods">HTTP request methods</a>
 * a route may be registered for.
 * <p>
 * Request lines carrying any other token still parse, but never match a route.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum HttpMethod {
	CONNECT,
	DELETE,
	GET,
	HEAD,
	OPTIONS,
	PATCH,
	POST,
	PUT,
	TRACE;

	@NonNull
	private static final Set<HttpMethod> VALUES_AS_SET;
	@NonNull
	private static final Map<String, HttpMethod> VALUES_BY_TOKEN;

	static {
		VALUES_AS_SET = Arrays.stream(HttpMethod.values()).collect(Collectors.toUnmodifiableSet());
		VALUES_BY_TOKEN = Arrays.stream(HttpMethod.values()).collect(Collectors.toUnmodifiableMap(HttpMethod::name, Function.identity()));
	}

	/**
	 * Exposes {@link HttpMethod#values()} as a {@link Set} for convenience.
	 *
	 * @return a {@link Set} representation of this enum's values
	 */
	@NonNull
	public static Set<HttpMethod> valuesAsSet() {
		return VALUES_AS_SET;
	}

	/**
	 * Resolves a request-line method token.
	 * <p>
	 * Matching is case-sensitive, as HTTP method tokens are.
	 *
	 * @param token the method token, e.g. {@code GET}
	 * @return the method, or {@link Optional#empty()} if the token is not a standard method
	 */
	@NonNull
	public static Optional<HttpMethod> fromToken(@Nullable String token) {
		if (token == null)
			return Optional.empty();

		return Optional.ofNullable(VALUES_BY_TOKEN.get(token));
	}
}
