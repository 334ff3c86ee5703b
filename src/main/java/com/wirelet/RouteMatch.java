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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * The result of a successful {@link Router#match(String, String)}: the route plus the parameters bound for this request only.
 *
 * @param <C> the application context type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record RouteMatch<C>(@NonNull Route<C> route,
														@NonNull Map<@NonNull String, @NonNull String> pathParameters) {
	public RouteMatch {
		requireNonNull(route);
		requireNonNull(pathParameters);
		pathParameters = Collections.unmodifiableMap(new LinkedHashMap<>(pathParameters));
	}
}
