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

import javax.annotation.concurrent.ThreadSafe;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Optional;

import static com.wirelet.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A file part of a {@code multipart/form-data} request body.
 * <p>
 * Content is held in a {@link SpooledBuffer}, so large uploads live on disk rather than in memory. The content is
 * released when the owning {@link Request} is closed.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class UploadedFile implements Closeable {
	@NonNull
	private final String fieldName;
	@NonNull
	private final String filename;
	@Nullable
	private final String contentType;
	@NonNull
	private final SpooledBuffer content;

	public UploadedFile(@NonNull String fieldName,
											@NonNull String filename,
											@Nullable String contentType,
											@NonNull SpooledBuffer content) {
		requireNonNull(fieldName);
		requireNonNull(filename);
		requireNonNull(content);

		this.fieldName = fieldName;
		this.filename = filename;
		this.contentType = trimAggressivelyToNull(contentType);
		this.content = content;
	}

	/**
	 * Opens a new stream over the uploaded bytes, starting at the first byte.
	 *
	 * @return the file content
	 */
	@NonNull
	public InputStream openInputStream() {
		try {
			return getContent().openInputStream();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	@NonNull
	public byte[] getBytes() {
		try {
			return getContent().toByteArray();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	@NonNull
	public Long getSize() {
		return getContent().getSize();
	}

	@Override
	public void close() throws IOException {
		getContent().close();
	}

	@Override
	public String toString() {
		return format("%s{fieldName=%s, filename=%s, contentType=%s, size=%s}", getClass().getSimpleName(),
				getFieldName(), getFilename(), getContentType().orElse(null), getSize());
	}

	/**
	 * The form field this file was submitted under.
	 *
	 * @return the field name
	 */
	@NonNull
	public String getFieldName() {
		return this.fieldName;
	}

	/**
	 * The filename the client supplied, which may be empty if the user submitted no file.
	 *
	 * @return the original filename
	 */
	@NonNull
	public String getFilename() {
		return this.filename;
	}

	@NonNull
	public Optional<String> getContentType() {
		return Optional.ofNullable(this.contentType);
	}

	@NonNull
	SpooledBuffer getContent() {
		return this.content;
	}
}
