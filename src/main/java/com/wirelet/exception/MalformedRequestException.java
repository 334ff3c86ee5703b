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

package com.wirelet.exception;

import com.wirelet.StatusCode;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Thrown when the request line or header block is not well-formed HTTP/1.1.
 * Always maps to {@link StatusCode#HTTP_400}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public final class MalformedRequestException extends HttpException {
	public MalformedRequestException(@Nullable String message) {
		super(StatusCode.HTTP_400, message);
	}

	public MalformedRequestException(@Nullable String message,
																	 @Nullable Throwable cause) {
		super(StatusCode.HTTP_400, message, cause);
	}
}
