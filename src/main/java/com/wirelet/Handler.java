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

/**
 * Turns a request into a response.
 * <p>
 * Handlers may throw {@link com.wirelet.exception.HttpException} to produce a specific error status; any other
 * exception becomes a {@code 500}.
 *
 * @param <C> the application context type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface Handler<C> {
	@NonNull
	Response handle(@NonNull Request<C> request) throws Exception;
}
