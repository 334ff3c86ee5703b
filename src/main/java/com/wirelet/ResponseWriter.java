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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Serializes a {@link Response} onto a connection.
 * <p>
 * Output is the status line, the response's headers in insertion order, one {@code Set-Cookie} line per cookie,
 * a blank line and then the body. {@code Server} and {@code Date} are always written, replacing any values the
 * handler provided, and in-memory bodies get an exact {@code Content-Length}. Streamed bodies are copied in
 * fixed-size chunks.
 * <p>
 * The response is sealed before anything is written and closed afterwards, whether or not writing succeeded. The
 * injected headers are applied to a copy, so the response itself is left as the handler built it.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class ResponseWriter {
	@NonNull
	private static final Logger logger = LoggerFactory.getLogger(ResponseWriter.class);

	@NonNull
	static final String SERVER_NAME;
	@NonNull
	private static final byte[] CRLF;

	static {
		SERVER_NAME = "Wirelet";
		CRLF = new byte[]{'\r', '\n'};
	}

	@NonNull
	private final Integer chunkSize;
	@NonNull
	private final Clock clock;

	ResponseWriter(@NonNull Integer chunkSize) {
		this(chunkSize, Clock.systemUTC());
	}

	ResponseWriter(@NonNull Integer chunkSize,
								 @NonNull Clock clock) {
		requireNonNull(chunkSize);
		requireNonNull(clock);

		if (chunkSize <= 0)
			throw new IllegalArgumentException("Chunk size must be > 0");

		this.chunkSize = chunkSize;
		this.clock = clock;
	}

	void write(@NonNull Response response,
						 @NonNull OutputStream outputStream) throws IOException {
		requireNonNull(response);
		requireNonNull(outputStream);

		try {
			response.seal();

			// Server-managed headers go on a per-write copy so the same response can be written again
			Headers headers = response.getHeaders().mutableCopy();
			headers.set("Server", SERVER_NAME);
			headers.set("Date", Utilities.formatHttpDate(Instant.now(getClock())));

			if (response.getStream().isEmpty())
				headers.set("Content-Length", String.valueOf(response.getBody().length));

			OutputStream bufferedOutputStream = new BufferedOutputStream(outputStream, getChunkSize());
			StatusCode statusCode = response.getStatusCode();

			writeLine(bufferedOutputStream, format("HTTP/1.1 %d %s", statusCode.getStatusCode(), statusCode.getReasonPhrase()));

			for (Header header : headers)
				writeLine(bufferedOutputStream, format("%s: %s", header.name(), header.value()));

			for (ResponseCookie cookie : response.getCookies())
				writeLine(bufferedOutputStream, format("Set-Cookie: %s", cookie.toSetCookieHeaderRepresentation()));

			bufferedOutputStream.write(CRLF);

			InputStream stream = response.getStream().orElse(null);

			if (stream == null) {
				bufferedOutputStream.write(response.getBody());
			} else {
				byte[] chunk = new byte[getChunkSize()];
				int read;

				while ((read = stream.read(chunk)) != -1)
					bufferedOutputStream.write(chunk, 0, read);
			}

			bufferedOutputStream.flush();
			logger.debug("Wrote {} response", statusCode.getStatusCode());
		} finally {
			try {
				response.close();
			} catch (IOException e) {
				logger.warn("Unable to close response body", e);
			}
		}
	}

	private void writeLine(@NonNull OutputStream outputStream,
												 @NonNull String line) throws IOException {
		outputStream.write(line.getBytes(StandardCharsets.ISO_8859_1));
		outputStream.write(CRLF);
	}

	@NonNull
	private Integer getChunkSize() {
		return this.chunkSize;
	}

	@NonNull
	private Clock getClock() {
		return this.clock;
	}
}
