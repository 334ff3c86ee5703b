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
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonSyntaxException;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.wirelet.exception.HttpException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import static com.wirelet.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A single HTTP request, as read from one client connection.
 * <p>
 * Identity data (method, path, protocol, headers, path parameters, application context) is fixed at construction.
 * Everything derived from the query string, cookies or body is computed lazily the first time it is asked for, then
 * cached for the life of the request: calling {@link #getQueryParameters()}, {@link #getCookies()},
 * {@link #getBody()}, {@link #getJson()}, {@link #getForm()} or {@link #getFiles()} twice returns the same instance and
 * never reads the connection twice.
 * <p>
 * The body is read from the connection into a {@link SpooledBuffer} on first access. {@link #close()} releases the
 * buffer and any uploaded files; the server does this once the response has been written.
 *
 * @param <C> the application context type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Request<C> implements Closeable {
	@NonNull
	private static final Gson GSON;
	@NonNull
	private static final Long DEFAULT_MAXIMUM_BODY_SIZE;

	static {
		GSON = new Gson();
		DEFAULT_MAXIMUM_BODY_SIZE = 64L * 1_024 * 1_024;
	}

	@Nullable
	private final InetSocketAddress remoteAddress;
	@NonNull
	private final String method;
	@NonNull
	private final String path;
	@NonNull
	private final String protocol;
	@NonNull
	private final Headers headers;
	@NonNull
	private final Map<@NonNull String, @NonNull String> pathParameters;
	@Nullable
	private final C context;
	@NonNull
	private final BodyReader bodyReader;
	@NonNull
	private final MultipartParser multipartParser;
	@NonNull
	private final Long maximumBodySize;
	@NonNull
	private final ReentrantLock lock;

	@Nullable
	private volatile Map<String, List<String>> queryParameters = null;
	@Nullable
	private volatile Map<String, String> cookies = null;
	@Nullable
	private volatile SpooledBuffer body = null;
	@Nullable
	private volatile JsonElement json = null;
	@Nullable
	private volatile FormData formData = null;
	private volatile boolean closed = false;

	/**
	 * Acquires a builder for {@link Request} instances.
	 *
	 * @param method the request method token, e.g. {@code GET}
	 * @param path   the request target as it appears on the request line, including any query
	 * @param <C>    the application context type
	 * @return the builder
	 */
	@NonNull
	public static <C> Builder<C> with(@NonNull String method,
																		@NonNull String path) {
		requireNonNull(method);
		requireNonNull(path);

		return new Builder<>(method, path);
	}

	private Request(@NonNull Builder<C> builder) {
		requireNonNull(builder);

		this.remoteAddress = builder.remoteAddress;
		this.method = builder.method;
		this.path = builder.path;
		this.protocol = builder.protocol == null ? "HTTP/1.1" : builder.protocol;
		this.headers = builder.headers == null ? new Headers().readOnlyCopy() : builder.headers.readOnlyCopy();
		this.pathParameters = builder.pathParameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(builder.pathParameters));
		this.context = builder.context;
		this.multipartParser = builder.multipartParser == null ? MultipartParser.defaultInstance() : builder.multipartParser;
		this.maximumBodySize = builder.maximumBodySize == null ? DEFAULT_MAXIMUM_BODY_SIZE : builder.maximumBodySize;
		this.lock = new ReentrantLock();

		if (builder.bodyReader != null) {
			this.bodyReader = builder.bodyReader;
		} else {
			byte[] bodyBytes = builder.body == null ? Utilities.emptyByteArray() : builder.body;
			this.bodyReader = (contentLength) -> SpooledBuffer.fromBytes(bodyBytes);
		}
	}

	/**
	 * Query parameters parsed from the path, in order of appearance.
	 * <p>
	 * {@code ?a=1&a=2&b=3} yields {@code {a=[1, 2], b=[3]}}. Parameters with blank values are dropped.
	 *
	 * @return the query parameters, or an empty map if the path has no query
	 */
	@NonNull
	public Map<@NonNull String, @NonNull List<@NonNull String>> getQueryParameters() {
		Map<String, List<String>> result = this.queryParameters;

		if (result == null) {
			getLock().lock();
			try {
				result = this.queryParameters;

				if (result == null) {
					result = Utilities.extractQueryParametersFromQuery(Utilities.extractRawQueryFromRequestTarget(getPath()).orElse(null));
					this.queryParameters = result;
				}
			} finally {
				getLock().unlock();
			}
		}

		return result;
	}

	/**
	 * Convenience accessor for the first value of a query parameter.
	 *
	 * @param name the query parameter name
	 * @return the first value, or {@link Optional#empty()} if the parameter is absent
	 */
	@NonNull
	public Optional<String> getQueryParameter(@NonNull String name) {
		requireNonNull(name);

		List<String> values = getQueryParameters().get(name);
		return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
	}

	/**
	 * Cookies sent via the {@code Cookie} header. Values are taken literally; if a name repeats, the last value wins.
	 *
	 * @return the cookies, or an empty map if the header is absent
	 */
	@NonNull
	public Map<@NonNull String, @NonNull String> getCookies() {
		Map<String, String> result = this.cookies;

		if (result == null) {
			getLock().lock();
			try {
				result = this.cookies;

				if (result == null) {
					result = Utilities.extractCookiesFromHeaders(getHeaders());
					this.cookies = result;
				}
			} finally {
				getLock().unlock();
			}
		}

		return result;
	}

	@NonNull
	public Optional<String> getCookie(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(getCookies().get(name));
	}

	/**
	 * The request body, read from the connection on first access.
	 * <p>
	 * Exactly {@code Content-Length} bytes are read (zero if the header is missing or unparseable). Bodies larger than
	 * the configured threshold are spooled to a temporary file.
	 *
	 * @return the buffered body
	 * @throws HttpException        with {@link StatusCode#HTTP_413} if {@code Content-Length} exceeds the maximum body size
	 * @throws UncheckedIOException if the body could not be read
	 */
	@NonNull
	public SpooledBuffer getBody() {
		SpooledBuffer result = this.body;

		if (result == null) {
			getLock().lock();
			try {
				result = this.body;

				if (result == null) {
					if (this.closed)
						throw new IllegalStateException("Request is closed");

					long contentLength = getContentLength();

					if (contentLength > getMaximumBodySize())
						throw new HttpException(StatusCode.HTTP_413, format("Content-Length %d exceeds maximum body size of %d bytes", contentLength, getMaximumBodySize()));

					try {
						result = this.bodyReader.read(contentLength);
					} catch (IOException e) {
						throw new UncheckedIOException(e);
					}

					this.body = result;
				}
			} finally {
				getLock().unlock();
			}
		}

		return result;
	}

	/**
	 * Opens a new stream over the body, starting at its first byte.
	 *
	 * @return the body content
	 */
	@NonNull
	public InputStream getBodyAsInputStream() {
		try {
			return getBody().openInputStream();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	@NonNull
	public byte[] getBodyAsBytes() {
		try {
			return getBody().toByteArray();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	/**
	 * The body decoded as UTF-8.
	 *
	 * @return the body text
	 */
	@NonNull
	public String getBodyAsString() {
		return new String(getBodyAsBytes(), StandardCharsets.UTF_8);
	}

	/**
	 * The body parsed as JSON.
	 * <p>
	 * An empty body yields {@link JsonNull#INSTANCE}.
	 *
	 * @return the parsed JSON
	 * @throws JsonSyntaxException if the body is not valid JSON
	 */
	@NonNull
	public JsonElement getJson() {
		JsonElement result = this.json;

		if (result == null) {
			getLock().lock();
			try {
				result = this.json;

				if (result == null) {
					String bodyAsString = getBodyAsString();
					result = trimAggressivelyToNull(bodyAsString) == null ? JsonNull.INSTANCE : parseJson(bodyAsString);
					this.json = result;
				}
			} finally {
				getLock().unlock();
			}
		}

		return result;
	}

	// Strict RFC 8259 parsing: no unquoted names or values, single quotes, trailing commas or trailing content
	@NonNull
	private static JsonElement parseJson(@NonNull String json) {
		requireNonNull(json);

		try (JsonReader jsonReader = new JsonReader(new StringReader(json))) {
			jsonReader.setLenient(false);

			JsonElement jsonElement = GSON.getAdapter(JsonElement.class).read(jsonReader);

			if (jsonReader.peek() != JsonToken.END_DOCUMENT)
				throw new JsonSyntaxException("Unexpected content after JSON document");

			return jsonElement;
		} catch (IOException e) {
			// Includes MalformedJsonException
			throw new JsonSyntaxException(e);
		} catch (StackOverflowError e) {
			throw new JsonSyntaxException("JSON document is nested too deeply", e);
		}
	}

	/**
	 * The body parsed as JSON and bound to the given type with Gson.
	 *
	 * @param type the type to bind to
	 * @param <T>  the bound type
	 * @return the bound value, or {@link Optional#empty()} for an empty body
	 * @throws JsonSyntaxException if the body is not valid JSON for {@code type}
	 */
	@NonNull
	public <T> Optional<T> getJson(@NonNull Class<T> type) {
		requireNonNull(type);
		return Optional.ofNullable(GSON.fromJson(getJson(), type));
	}

	/**
	 * Form fields from an {@code application/x-www-form-urlencoded} or {@code multipart/form-data} body.
	 * <p>
	 * For any other content type this is an empty map.
	 *
	 * @return form field names mapped to their values, in order
	 */
	@NonNull
	public Map<@NonNull String, @NonNull List<@NonNull String>> getForm() {
		return getFormData().fields();
	}

	/**
	 * Convenience accessor for the first value of a form field.
	 *
	 * @param name the field name
	 * @return the first value, or {@link Optional#empty()} if the field is absent
	 */
	@NonNull
	public Optional<String> getFormParameter(@NonNull String name) {
		requireNonNull(name);

		List<String> values = getForm().get(name);
		return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
	}

	/**
	 * Files uploaded in a {@code multipart/form-data} body.
	 * <p>
	 * For any other content type this is an empty list.
	 *
	 * @return the uploaded files, in order of appearance
	 */
	@NonNull
	public List<@NonNull UploadedFile> getFiles() {
		return getFormData().files();
	}

	@NonNull
	private FormData getFormData() {
		FormData result = this.formData;

		if (result == null) {
			getLock().lock();
			try {
				result = this.formData;

				if (result == null) {
					result = parseFormData();
					this.formData = result;
				}
			} finally {
				getLock().unlock();
			}
		}

		return result;
	}

	@NonNull
	private FormData parseFormData() {
		String contentTypeHeaderValue = getHeaders().getFirst("Content-Type").orElse(null);
		String contentType = Utilities.extractContentTypeFromHeaderValue(contentTypeHeaderValue).orElse(null);

		if ("application/x-www-form-urlencoded".equals(contentType))
			return new FormData(Utilities.extractQueryParametersFromQuery(getBodyAsString()), List.of());

		if ("multipart/form-data".equals(contentType)) {
			try (InputStream inputStream = getBody().openInputStream()) {
				return getMultipartParser().parse(contentTypeHeaderValue, inputStream);
			} catch (IOException e) {
				throw new UncheckedIOException(e);
			}
		}

		return FormData.empty();
	}

	/**
	 * The declared body length.
	 *
	 * @return the {@code Content-Length} value, or {@code 0} if it is missing, unparseable or negative
	 */
	@NonNull
	public Long getContentLength() {
		String contentLength = trimAggressivelyToNull(getHeaders().getFirst("Content-Length").orElse(null));

		if (contentLength == null)
			return 0L;

		try {
			return Math.max(0L, Long.parseLong(contentLength));
		} catch (NumberFormatException e) {
			return 0L;
		}
	}

	/**
	 * Releases the body buffer and any uploaded files. Safe to call more than once.
	 *
	 * @throws IOException if a temporary file could not be deleted
	 */
	@Override
	public void close() throws IOException {
		getLock().lock();

		try {
			if (this.closed)
				return;

			this.closed = true;

			IOException failure = null;
			FormData formData = this.formData;

			if (formData != null) {
				for (UploadedFile file : formData.files()) {
					try {
						file.close();
					} catch (IOException e) {
						if (failure == null)
							failure = e;
						else
							failure.addSuppressed(e);
					}
				}
			}

			SpooledBuffer body = this.body;

			if (body != null) {
				try {
					body.close();
				} catch (IOException e) {
					if (failure == null)
						failure = e;
					else
						failure.addSuppressed(e);
				}
			}

			if (failure != null)
				throw failure;
		} finally {
			getLock().unlock();
		}
	}

	@Override
	public String toString() {
		return format("%s{method=%s, path=%s, protocol=%s, remoteAddress=%s}", getClass().getSimpleName(),
				getMethod(), getPath(), getProtocol(), getRemoteAddress().orElse(null));
	}

	@NonNull
	public Optional<InetSocketAddress> getRemoteAddress() {
		return Optional.ofNullable(this.remoteAddress);
	}

	/**
	 * The method token exactly as sent on the request line.
	 *
	 * @return the method token
	 */
	@NonNull
	public String getMethod() {
		return this.method;
	}

	@NonNull
	public Optional<HttpMethod> getHttpMethod() {
		return HttpMethod.fromToken(getMethod());
	}

	/**
	 * The request target exactly as sent on the request line, including any query, e.g. {@code /search?q=x}.
	 *
	 * @return the raw path
	 */
	@NonNull
	public String getPath() {
		return this.path;
	}

	@NonNull
	public String getProtocol() {
		return this.protocol;
	}

	@NonNull
	public Headers getHeaders() {
		return this.headers;
	}

	@NonNull
	public Optional<String> getHeader(@NonNull String name) {
		requireNonNull(name);
		return getHeaders().getFirst(name);
	}

	/**
	 * Values bound by the matched route, e.g. {@code {id=123}} for {@code /users/:id} and {@code /users/123}.
	 *
	 * @return the path parameters
	 */
	@NonNull
	public Map<@NonNull String, @NonNull String> getPathParameters() {
		return this.pathParameters;
	}

	@NonNull
	public Optional<String> getPathParameter(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(getPathParameters().get(name));
	}

	/**
	 * The application context the server was configured with.
	 *
	 * @return the context, or {@link Optional#empty()} if the server has none
	 */
	@NonNull
	public Optional<C> getContext() {
		return Optional.ofNullable(this.context);
	}

	@NonNull
	private MultipartParser getMultipartParser() {
		return this.multipartParser;
	}

	@NonNull
	private Long getMaximumBodySize() {
		return this.maximumBodySize;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	/**
	 * Reads the body from wherever it lives, given the declared length.
	 */
	@FunctionalInterface
	interface BodyReader {
		@NonNull
		SpooledBuffer read(@NonNull Long contentLength) throws IOException;
	}

	/**
	 * Builder used to construct instances of {@link Request} via {@link Request#with(String, String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @param <C> the application context type
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder<C> {
		@NonNull
		private final String method;
		@NonNull
		private final String path;
		@Nullable
		private String protocol;
		@Nullable
		private InetSocketAddress remoteAddress;
		@Nullable
		private Headers headers;
		@Nullable
		private Map<String, String> pathParameters;
		@Nullable
		private C context;
		@Nullable
		private byte[] body;
		@Nullable
		private BodyReader bodyReader;
		@Nullable
		private MultipartParser multipartParser;
		@Nullable
		private Long maximumBodySize;

		private Builder(@NonNull String method,
										@NonNull String path) {
			this.method = method;
			this.path = path;
		}

		@NonNull
		public Builder<C> protocol(@Nullable String protocol) {
			this.protocol = protocol;
			return this;
		}

		@NonNull
		public Builder<C> remoteAddress(@Nullable InetSocketAddress remoteAddress) {
			this.remoteAddress = remoteAddress;
			return this;
		}

		@NonNull
		public Builder<C> headers(@Nullable Headers headers) {
			this.headers = headers;
			return this;
		}

		@NonNull
		public Builder<C> pathParameters(@Nullable Map<String, String> pathParameters) {
			this.pathParameters = pathParameters;
			return this;
		}

		@NonNull
		public Builder<C> context(@Nullable C context) {
			this.context = context;
			return this;
		}

		/**
		 * An in-memory body, used as-is without consulting {@code Content-Length}.
		 *
		 * @param body the body bytes
		 * @return this builder
		 */
		@NonNull
		public Builder<C> body(@Nullable byte[] body) {
			this.body = body;
			return this;
		}

		@NonNull
		Builder<C> bodyReader(@Nullable BodyReader bodyReader) {
			this.bodyReader = bodyReader;
			return this;
		}

		@NonNull
		public Builder<C> multipartParser(@Nullable MultipartParser multipartParser) {
			this.multipartParser = multipartParser;
			return this;
		}

		@NonNull
		public Builder<C> maximumBodySize(@Nullable Long maximumBodySize) {
			this.maximumBodySize = maximumBodySize;
			return this;
		}

		@NonNull
		public Request<C> build() {
			return new Request<>(this);
		}
	}
}
