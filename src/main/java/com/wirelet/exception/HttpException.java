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
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Exception that short-circuits request handling with a specific HTTP status.
 * <p>
 * Handlers and middleware may throw this from anywhere; the connection handler turns it into the
 * standard error response for {@link #getStatusCode()}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class HttpException extends RuntimeException {
	@NonNull
	private final StatusCode statusCode;

	public HttpException(@NonNull StatusCode statusCode) {
		this(statusCode, null, null);
	}

	public HttpException(@NonNull StatusCode statusCode,
											 @Nullable String message) {
		this(statusCode, message, null);
	}

	public HttpException(@NonNull StatusCode statusCode,
											 @Nullable String message,
											 @Nullable Throwable cause) {
		super(message == null ? requireNonNull(statusCode).getReasonPhrase() : message, cause);
		this.statusCode = statusCode;
	}

	@NonNull
	public StatusCode getStatusCode() {
		return this.statusCode;
	}
}
