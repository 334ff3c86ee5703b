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

import com.wirelet.exception.HttpException;
import com.wirelet.exception.ReadTimeoutException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Buffered reader over a client connection's input stream.
 * <p>
 * Every byte comes in through {@link #fill()}, which is the only place a blocking read happens. On a socket the read is
 * bounded by {@code SO_TIMEOUT}, so any read that takes longer than the configured timeout surfaces as a
 * {@link ReadTimeoutException}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
final class ConnectionReader {
	@NonNull
	private final InputStream inputStream;
	@NonNull
	private final byte[] buffer;
	private int position;
	private int limit;
	@NonNull
	private Boolean endOfStream;

	ConnectionReader(@NonNull InputStream inputStream,
									 @NonNull Integer chunkSize) {
		requireNonNull(inputStream);
		requireNonNull(chunkSize);

		if (chunkSize <= 0)
			throw new IllegalArgumentException("Chunk size must be > 0");

		this.inputStream = inputStream;
		this.buffer = new byte[chunkSize];
		this.position = 0;
		this.limit = 0;
		this.endOfStream = false;
	}

	@NonNull
	static ConnectionReader forSocket(@NonNull Socket socket,
																		@NonNull Duration readTimeout,
																		@NonNull Integer chunkSize) throws IOException {
		requireNonNull(socket);
		requireNonNull(readTimeout);
		requireNonNull(chunkSize);

		socket.setSoTimeout((int) Math.min(Integer.MAX_VALUE, Math.max(1L, readTimeout.toMillis())));
		return new ConnectionReader(socket.getInputStream(), chunkSize);
	}

	// Refills the buffer. Returns false at end of stream.
	private boolean fill() throws IOException {
		if (this.endOfStream)
			return false;

		int read;

		try {
			read = this.inputStream.read(this.buffer, 0, this.buffer.length);
		} catch (SocketTimeoutException e) {
			throw new ReadTimeoutException("Timed out waiting for client data", e);
		}

		if (read == -1) {
			this.endOfStream = true;
			return false;
		}

		this.position = 0;
		this.limit = read;
		return true;
	}

	/**
	 * Reads one line terminated by {@code LF}, with an optional preceding {@code CR} stripped.
	 *
	 * @param maximumLength       the maximum number of bytes the line may hold, terminator excluded
	 * @param statusCodeIfTooLong the status to fail with when the line exceeds {@code maximumLength}
	 * @return the line bytes, or {@code null} if the stream ended before any byte was read
	 * @throws IOException   if reading fails or times out
	 * @throws HttpException if the line is too long
	 */
	@Nullable
	byte[] readLine(@NonNull Integer maximumLength,
									@NonNull StatusCode statusCodeIfTooLong) throws IOException {
		requireNonNull(maximumLength);
		requireNonNull(statusCodeIfTooLong);

		ByteArrayOutputStream line = new ByteArrayOutputStream(128);
		boolean sawAnyByte = false;

		while (true) {
			if (this.position >= this.limit && !fill())
				return sawAnyByte ? stripTrailingCarriageReturn(line.toByteArray()) : null;

			sawAnyByte = true;

			int start = this.position;

			while (this.position < this.limit && this.buffer[this.position] != '\n')
				++this.position;

			line.write(this.buffer, start, this.position - start);

			if (line.size() > maximumLength + 1)
				throw new HttpException(statusCodeIfTooLong, format("Line exceeds maximum length of %d bytes", maximumLength));

			if (this.position < this.limit) {
				// Consume the LF
				++this.position;
				byte[] bytes = stripTrailingCarriageReturn(line.toByteArray());

				if (bytes.length > maximumLength)
					throw new HttpException(statusCodeIfTooLong, format("Line exceeds maximum length of %d bytes", maximumLength));

				return bytes;
			}
		}
	}

	/**
	 * Copies up to {@code length} bytes of body into the given buffer, reading in chunks.
	 * <p>
	 * If the client closes the connection early, whatever arrived is kept.
	 *
	 * @param length      the number of bytes to read
	 * @param destination where to put them
	 * @return the number of bytes actually read
	 * @throws IOException if reading fails or times out
	 */
	@NonNull
	Long readBody(@NonNull Long length,
								@NonNull SpooledBuffer destination) throws IOException {
		requireNonNull(length);
		requireNonNull(destination);

		long remaining = length;

		while (remaining > 0) {
			if (this.position >= this.limit && !fill())
				break;

			int available = (int) Math.min(remaining, this.limit - this.position);
			destination.write(this.buffer, this.position, available);
			this.position += available;
			remaining -= available;
		}

		return length - remaining;
	}

	@NonNull
	private static byte[] stripTrailingCarriageReturn(@NonNull byte[] line) {
		if (line.length > 0 && line[line.length - 1] == '\r') {
			byte[] stripped = new byte[line.length - 1];
			System.arraycopy(line, 0, stripped, 0, stripped.length);
			return stripped;
		}

		return line;
	}
}
