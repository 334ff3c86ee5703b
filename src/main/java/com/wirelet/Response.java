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

import com.google.gson.Gson;
import com.wirelet.exception.HttpException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URLConnection;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An HTTP response to be written back to the client.
 * <p>
 * The body is either held in memory ({@link #getBody()}) or streamed from an open {@link InputStream}
 * ({@link #getStream()}), never both. A response may be changed freely until the server writes it; after that every
 * mutator throws {@link IllegalStateException}.
 * <p>
 * Common shapes are available as factories:
 * <ul>
 *   <li>{@link #html(String)}, {@link #text(String)} and {@link #json(Object)}</li>
 *   <li>{@link #redirect(String)}</li>
 *   <li>{@link #file(Path)} for downloads</li>
 *   <li>{@link #error(StatusCode)} for the default error page</li>
 * </ul>
 * Anything else can be assembled with {@link #withStatusCode(StatusCode)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public final class Response implements Closeable {
	@NonNull
	private static final Logger logger = LoggerFactory.getLogger(Response.class);

	@NonNull
	private static final Gson GSON;
	@NonNull
	private static final String HTML_CONTENT_TYPE;
	@NonNull
	private static final String TEXT_CONTENT_TYPE;
	@NonNull
	private static final String JSON_CONTENT_TYPE;
	@NonNull
	private static final String DEFAULT_FILE_CONTENT_TYPE;

	static {
		GSON = new Gson();
		HTML_CONTENT_TYPE = "text/html; charset=utf-8";
		TEXT_CONTENT_TYPE = "text/plain; charset=utf-8";
		JSON_CONTENT_TYPE = "application/json";
		DEFAULT_FILE_CONTENT_TYPE = "application/octet-stream";
	}

	@NonNull
	private StatusCode statusCode;
	@NonNull
	private final Headers headers;
	@NonNull
	private final List<@NonNull ResponseCookie> cookies;
	@NonNull
	private byte[] body;
	@Nullable
	private InputStream stream;
	@NonNull
	private Boolean sealed;

	/**
	 * Acquires a builder for {@link Response} instances.
	 *
	 * @param statusCode the HTTP status code for this response
	 * @return the builder
	 */
	@NonNull
	public static Builder withStatusCode(@NonNull StatusCode statusCode) {
		requireNonNull(statusCode);
		return new Builder(statusCode);
	}

	@NonNull
	public static Response html(@NonNull String html) {
		return html(html, StatusCode.HTTP_200);
	}

	@NonNull
	public static Response html(@NonNull String html,
															@NonNull StatusCode statusCode) {
		requireNonNull(html);
		requireNonNull(statusCode);

		return withStatusCode(statusCode)
				.header("Content-Type", HTML_CONTENT_TYPE)
				.body(html)
				.build();
	}

	@NonNull
	public static Response text(@NonNull String text) {
		return text(text, StatusCode.HTTP_200);
	}

	@NonNull
	public static Response text(@NonNull String text,
															@NonNull StatusCode statusCode) {
		requireNonNull(text);
		requireNonNull(statusCode);

		return withStatusCode(statusCode)
				.header("Content-Type", TEXT_CONTENT_TYPE)
				.body(text)
				.build();
	}

	/**
	 * A JSON response whose body is {@code object} serialized with Gson.
	 *
	 * @param object the value to serialize, which may be a Gson {@link com.google.gson.JsonElement}
	 * @return the response
	 */
	@NonNull
	public static Response json(@Nullable Object object) {
		return json(object, StatusCode.HTTP_200);
	}

	@NonNull
	public static Response json(@Nullable Object object,
															@NonNull StatusCode statusCode) {
		requireNonNull(statusCode);

		return withStatusCode(statusCode)
				.header("Content-Type", JSON_CONTENT_TYPE)
				.body(GSON.toJson(object))
				.build();
	}

	/**
	 * A permanent ({@code 301}) redirect to {@code location}.
	 *
	 * @param location the URL to redirect to
	 * @return the response
	 */
	@NonNull
	public static Response redirect(@NonNull String location) {
		return redirect(location, StatusCode.HTTP_301);
	}

	@NonNull
	public static Response redirect(@NonNull String location,
																	@NonNull StatusCode statusCode) {
		requireNonNull(location);
		requireNonNull(statusCode);

		return withStatusCode(statusCode)
				.header("Location", location)
				.build();
	}

	/**
	 * The default error page for a status: an HTML body holding the reason phrase.
	 *
	 * @param statusCode the error status
	 * @return the response
	 */
	@NonNull
	public static Response error(@NonNull StatusCode statusCode) {
		requireNonNull(statusCode);
		return html(statusCode.getReasonPhrase(), statusCode);
	}

	@NonNull
	public static Response file(@NonNull Path file) {
		requireNonNull(file);

		Path filename = file.getFileName();
		return file(file, filename == null ? file.toString() : filename.toString());
	}

	/**
	 * A download of {@code file}, streamed from disk.
	 * <p>
	 * Sets {@code Content-Disposition: attachment; filename="..."} with the percent-encoded download name, along with
	 * {@code Content-Type}, {@code Content-Length} and {@code Last-Modified}. The file is opened here and closed once the
	 * response has been written.
	 *
	 * @param file             the file to send
	 * @param downloadFilename the filename the client should save as
	 * @return the response
	 * @throws HttpException with {@link StatusCode#HTTP_404} if the file does not exist or cannot be read
	 */
	@NonNull
	public static Response file(@NonNull Path file,
															@NonNull String downloadFilename) {
		requireNonNull(file);
		requireNonNull(downloadFilename);

		if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
			logger.debug("File not found: {}", file);
			throw new HttpException(StatusCode.HTTP_404);
		}

		long size;
		Instant lastModified;
		InputStream stream;

		try {
			size = Files.size(file);
			lastModified = Files.getLastModifiedTime(file).toInstant();
			stream = Files.newInputStream(file);
		} catch (IOException e) {
			logger.debug(format("Unable to open file %s", file), e);
			throw new HttpException(StatusCode.HTTP_404, null, e);
		}

		String contentType = URLConnection.guessContentTypeFromName(downloadFilename);

		return withStatusCode(StatusCode.HTTP_200)
				.header("Content-Type", contentType == null ? DEFAULT_FILE_CONTENT_TYPE : contentType)
				.header("Content-Disposition", format("attachment; filename=\"%s\"", Utilities.percentEncodeFilename(downloadFilename)))
				.header("Content-Length", String.valueOf(size))
				.header("Last-Modified", Utilities.formatHttpDate(lastModified))
				.stream(stream)
				.build();
	}

	private Response(@NonNull Builder builder) {
		requireNonNull(builder);

		this.statusCode = builder.statusCode;
		this.headers = builder.headers;
		this.cookies = new ArrayList<>(builder.cookies);
		this.body = builder.body == null ? Utilities.emptyByteArray() : builder.body;
		this.stream = builder.stream;
		this.sealed = false;
	}

	@NonNull
	public Response statusCode(@NonNull StatusCode statusCode) {
		requireNonNull(statusCode);
		ensureNotSealed();

		this.statusCode = statusCode;
		return this;
	}

	@NonNull
	public Response header(@NonNull String name,
												 @NonNull String value) {
		ensureNotSealed();
		getHeaders().set(name, value);
		return this;
	}

	@NonNull
	public Response cookie(@NonNull ResponseCookie cookie) {
		requireNonNull(cookie);
		ensureNotSealed();

		this.cookies.add(cookie);
		return this;
	}

	/**
	 * Replaces the body with in-memory bytes, discarding (and closing) any stream.
	 *
	 * @param body the body bytes
	 * @return this response
	 */
	@NonNull
	public Response body(@NonNull byte[] body) {
		requireNonNull(body);
		ensureNotSealed();

		closeStream();
		this.body = body;
		return this;
	}

	@NonNull
	public Response body(@NonNull String body) {
		requireNonNull(body);
		return body(body.getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * Replaces the body with a stream, discarding any in-memory bytes.
	 * <p>
	 * Streamed bodies get no automatic {@code Content-Length}; set one with {@link #header(String, String)} if the size is known.
	 *
	 * @param stream the stream to copy to the client
	 * @return this response
	 */
	@NonNull
	public Response stream(@NonNull InputStream stream) {
		requireNonNull(stream);
		ensureNotSealed();

		closeStream();
		this.body = Utilities.emptyByteArray();
		this.stream = stream;
		return this;
	}

	private void closeStream() {
		InputStream stream = this.stream;
		this.stream = null;

		if (stream == null)
			return;

		try {
			stream.close();
		} catch (IOException e) {
			logger.debug("Unable to close replaced response stream", e);
		}
	}

	// Called once the response is on the wire
	void seal() {
		this.sealed = true;
		getHeaders().freeze();
	}

	@NonNull
	public Boolean isSealed() {
		return this.sealed;
	}

	private void ensureNotSealed() {
		if (this.sealed)
			throw new IllegalStateException("Response has already been written");
	}

	/**
	 * Releases the body stream, if there is one.
	 *
	 * @throws IOException if the stream fails to close
	 */
	@Override
	public void close() throws IOException {
		InputStream stream = this.stream;

		if (stream != null)
			stream.close();
	}

	@Override
	public String toString() {
		return format("%s{statusCode=%s, headers=%s, cookies=%s, body=%s}", getClass().getSimpleName(),
				getStatusCode(), getHeaders(), getCookies(), getStream().isPresent() ? "[stream]" : format("[%d bytes]", getBody().length));
	}

	@NonNull
	public StatusCode getStatusCode() {
		return this.statusCode;
	}

	@NonNull
	public Headers getHeaders() {
		return this.headers;
	}

	@NonNull
	public List<@NonNull ResponseCookie> getCookies() {
		return Collections.unmodifiableList(this.cookies);
	}

	/**
	 * The in-memory body. Empty if the response streams its body instead.
	 *
	 * @return the body bytes; callers should not modify this array
	 */
	@NonNull
	public byte[] getBody() {
		return this.body;
	}

	@NonNull
	public Optional<InputStream> getStream() {
		return Optional.ofNullable(this.stream);
	}

	/**
	 * Builder used to construct instances of {@link Response} via {@link Response#withStatusCode(StatusCode)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final StatusCode statusCode;
		@NonNull
		private final Headers headers;
		@NonNull
		private final List<ResponseCookie> cookies;
		@Nullable
		private byte[] body;
		@Nullable
		private InputStream stream;

		private Builder(@NonNull StatusCode statusCode) {
			this.statusCode = statusCode;
			this.headers = new Headers();
			this.cookies = new ArrayList<>();
		}

		@NonNull
		public Builder header(@NonNull String name,
													@NonNull String value) {
			this.headers.set(name, value);
			return this;
		}

		@NonNull
		public Builder headers(@NonNull Headers headers) {
			requireNonNull(headers);

			for (Header header : headers)
				this.headers.add(header.name(), header.value());

			return this;
		}

		@NonNull
		public Builder cookie(@NonNull ResponseCookie cookie) {
			requireNonNull(cookie);
			this.cookies.add(cookie);
			return this;
		}

		@NonNull
		public Builder body(@Nullable byte[] body) {
			this.body = body;
			this.stream = null;
			return this;
		}

		@NonNull
		public Builder body(@Nullable String body) {
			return body(body == null ? null : body.getBytes(StandardCharsets.UTF_8));
		}

		@NonNull
		public Builder stream(@Nullable InputStream stream) {
			this.stream = stream;
			this.body = null;
			return this;
		}

		@NonNull
		public Response build() {
			return new Response(this);
		}
	}
}
