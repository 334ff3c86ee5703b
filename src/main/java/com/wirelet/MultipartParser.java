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

import java.io.IOException;
import java.io.InputStream;

/**
 * Contract for parsing HTML form fields encoded according to the <a href="https://datatracker.ietf.org/doc/html/rfc7578">{@code multipart/form-data}</a> specification.
 * <p>
 * A standard threadsafe implementation can be acquired via the {@link #defaultInstance()} factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface MultipartParser {
	/**
	 * Parses a {@code multipart/form-data} body.
	 * <p>
	 * Parts without a filename become form fields; parts with one become {@link UploadedFile}s.
	 *
	 * @param contentTypeHeaderValue the request's {@code Content-Type} header, which carries the boundary
	 * @param body                   the request body, positioned at its first byte
	 * @return the decoded fields and files
	 * @throws IOException if the body cannot be read
	 */
	@NonNull
	FormData parse(@NonNull String contentTypeHeaderValue,
								 @NonNull InputStream body) throws IOException;

	/**
	 * Acquires a threadsafe {@link MultipartParser} that spools uploads larger than
	 * {@link SpooledBuffer#DEFAULT_THRESHOLD} to disk.
	 * <p>
	 * The returned instance is guaranteed to be a JVM-wide singleton.
	 *
	 * @return a {@code MultipartParser} instance
	 */
	@NonNull
	static MultipartParser defaultInstance() {
		return DefaultMultipartParser.defaultInstance();
	}
}
