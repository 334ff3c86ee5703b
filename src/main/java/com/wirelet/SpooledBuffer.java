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

import javax.annotation.concurrent.NotThreadSafe;
import java.io.BufferedOutputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A write-once, read-many byte buffer that lives in memory until it grows past a threshold, then spills to a
 * temporary file.
 * <p>
 * Bytes are appended with {@link #write(byte[], int, int)}; once writing is done, {@link #openInputStream()} may be
 * called any number of times and each call reads from the beginning. {@link #close()} deletes the temporary file, if any.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public final class SpooledBuffer implements Closeable {
	@NonNull
	public static final Integer DEFAULT_THRESHOLD;

	static {
		DEFAULT_THRESHOLD = 1_024 * 1_024;
	}

	@NonNull
	private final Integer threshold;
	@Nullable
	private final Path spillDirectory;
	@Nullable
	private ByteArrayOutputStream memoryBuffer;
	@Nullable
	private Path file;
	@Nullable
	private OutputStream fileOutputStream;
	@NonNull
	private Long size;
	@NonNull
	private Boolean closed;

	public SpooledBuffer() {
		this(DEFAULT_THRESHOLD);
	}

	public SpooledBuffer(@NonNull Integer threshold) {
		this(threshold, null);
	}

	/**
	 * @param threshold      the number of bytes held in memory before spilling
	 * @param spillDirectory where the temporary file is created, or {@code null} for the system default
	 */
	SpooledBuffer(@NonNull Integer threshold,
								@Nullable Path spillDirectory) {
		requireNonNull(threshold);

		if (threshold < 0)
			throw new IllegalArgumentException("Threshold must be >= 0");

		this.threshold = threshold;
		this.spillDirectory = spillDirectory;
		this.memoryBuffer = new ByteArrayOutputStream();
		this.size = 0L;
		this.closed = false;
	}

	/**
	 * Creates an in-memory buffer holding the given bytes.
	 *
	 * @param bytes the buffer contents
	 * @return a buffer that never spills
	 */
	@NonNull
	public static SpooledBuffer fromBytes(@NonNull byte[] bytes) {
		requireNonNull(bytes);

		SpooledBuffer spooledBuffer = new SpooledBuffer(Integer.MAX_VALUE);

		try {
			spooledBuffer.write(bytes, 0, bytes.length);
		} catch (IOException e) {
			// In-memory writes do not fail
			throw new IllegalStateException(e);
		}

		return spooledBuffer;
	}

	public void write(@NonNull byte[] bytes,
										int offset,
										int length) throws IOException {
		requireNonNull(bytes);

		if (this.closed)
			throw new IOException("Buffer is closed");

		if (length == 0)
			return;

		if (this.memoryBuffer != null && this.size + length > this.threshold)
			spillToFile();

		if (this.memoryBuffer != null)
			this.memoryBuffer.write(bytes, offset, length);
		else
			this.fileOutputStream.write(bytes, offset, length);

		this.size += length;
	}

	public void write(@NonNull InputStream inputStream) throws IOException {
		requireNonNull(inputStream);

		byte[] chunk = new byte[8_192];
		int read;

		while ((read = inputStream.read(chunk)) != -1)
			write(chunk, 0, read);
	}

	// Either fully switches to the file or leaves the buffer in memory with no file behind
	private void spillToFile() throws IOException {
		Path file = this.spillDirectory == null
				? Files.createTempFile("wirelet-", ".spool")
				: Files.createTempFile(this.spillDirectory, "wirelet-", ".spool");
		OutputStream fileOutputStream = null;

		try {
			fileOutputStream = new BufferedOutputStream(Files.newOutputStream(file));
			this.memoryBuffer.writeTo(fileOutputStream);
		} catch (IOException | RuntimeException e) {
			try {
				if (fileOutputStream != null)
					fileOutputStream.close();
			} catch (IOException closeException) {
				e.addSuppressed(closeException);
			} finally {
				Files.deleteIfExists(file);
			}

			throw e;
		}

		this.file = file;
		this.fileOutputStream = fileOutputStream;
		this.memoryBuffer = null;
	}

	/**
	 * Opens a new stream positioned at the first byte.
	 *
	 * @return a stream over the buffer contents
	 * @throws IOException if the spilled file cannot be read
	 */
	@NonNull
	public InputStream openInputStream() throws IOException {
		if (this.closed)
			throw new IOException("Buffer is closed");

		if (this.memoryBuffer != null)
			return new ByteArrayInputStream(this.memoryBuffer.toByteArray());

		this.fileOutputStream.flush();
		return Files.newInputStream(this.file);
	}

	@NonNull
	public byte[] toByteArray() throws IOException {
		if (this.memoryBuffer != null)
			return this.memoryBuffer.toByteArray();

		try (InputStream inputStream = openInputStream()) {
			return inputStream.readAllBytes();
		}
	}

	@NonNull
	public String toString(@NonNull Charset charset) throws IOException {
		requireNonNull(charset);
		return new String(toByteArray(), charset);
	}

	@NonNull
	public Long getSize() {
		return this.size;
	}

	@NonNull
	public Boolean isSpilled() {
		return this.file != null;
	}

	@NonNull
	public Optional<Path> getFile() {
		return Optional.ofNullable(this.file);
	}

	@Override
	public void close() throws IOException {
		if (this.closed)
			return;

		this.closed = true;
		this.memoryBuffer = null;

		if (this.file != null) {
			try {
				if (this.fileOutputStream != null)
					this.fileOutputStream.close();
			} finally {
				Files.deleteIfExists(this.file);
			}
		}
	}

	@Override
	public String toString() {
		return format("%s{size=%s, spilled=%s}", getClass().getSimpleName(), getSize(), isSpilled());
	}
}
