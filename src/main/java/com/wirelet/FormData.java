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

import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Decoded form fields and uploaded files from a request body.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record FormData(@NonNull Map<@NonNull String, @NonNull List<@NonNull String>> fields,
											 @NonNull List<@NonNull UploadedFile> files) {
	@NonNull
	private static final FormData EMPTY;

	static {
		EMPTY = new FormData(Map.of(), List.of());
	}

	public FormData {
		requireNonNull(fields);
		requireNonNull(files);

		files = List.copyOf(files);
	}

	/**
	 * The result for bodies that carry no form, e.g. a JSON body.
	 *
	 * @return an instance with no fields and no files
	 */
	@NonNull
	public static FormData empty() {
		return EMPTY;
	}
}
