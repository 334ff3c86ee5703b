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

import com.wirelet.RequestParser.RequestHead;
import com.wirelet.exception.HttpException;
import com.wirelet.exception.ReadTimeoutException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Handles exactly one request per connection: parse, route, run middleware and handler, write, close.
 * <p>
 * Errors never escape {@link #handle(Socket)}. An {@link HttpException} becomes its status code's error page,
 * anything else becomes a {@code 500}. A read timeout at any point, including while a handler is reading the body,
 * drops the connection with a reset and no response.
 *
 * @param <C> the application context type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class ConnectionHandler<C> {
	@NonNull
	private static final Logger logger = LoggerFactory.getLogger(ConnectionHandler.class);

	@NonNull
	private final Router<C> router;
	@NonNull
	private final List<@NonNull Middleware<C>> middlewares;
	@Nullable
	private final C context;
	@NonNull
	private final RequestParser requestParser;
	@NonNull
	private final ResponseWriter responseWriter;
	@NonNull
	private final MultipartParser multipartParser;
	@NonNull
	private final Duration readTimeout;
	@NonNull
	private final Integer chunkSize;
	@NonNull
	private final Integer spoolThreshold;
	@NonNull
	private final Long maximumBodySize;

	ConnectionHandler(@NonNull Router<C> router,
										@NonNull List<@NonNull Middleware<C>> middlewares,
										@Nullable C context,
										@NonNull MultipartParser multipartParser,
										@NonNull Duration readTimeout,
										@NonNull Integer chunkSize,
										@NonNull Integer spoolThreshold,
										@NonNull Integer maximumHeaderSize,
										@NonNull Long maximumBodySize) {
		requireNonNull(router);
		requireNonNull(middlewares);
		requireNonNull(multipartParser);
		requireNonNull(readTimeout);
		requireNonNull(chunkSize);
		requireNonNull(spoolThreshold);
		requireNonNull(maximumHeaderSize);
		requireNonNull(maximumBodySize);

		this.router = router;
		this.middlewares = List.copyOf(middlewares);
		this.context = context;
		this.multipartParser = multipartParser;
		this.readTimeout = readTimeout;
		this.chunkSize = chunkSize;
		this.spoolThreshold = spoolThreshold;
		this.maximumBodySize = maximumBodySize;
		this.requestParser = new RequestParser(maximumHeaderSize);
		this.responseWriter = new ResponseWriter(chunkSize);
	}

	void handle(@NonNull Socket socket) {
		requireNonNull(socket);

		Request<C> request = null;

		try {
			Response response;

			try {
				ConnectionReader connectionReader = ConnectionReader.forSocket(socket, getReadTimeout(), getChunkSize());
				RequestHead requestHead = getRequestParser().parse(connectionReader);

				logger.debug("Received {} {} {}", requestHead.method(), Utilities.printableString(requestHead.path()), requestHead.protocol());

				RouteMatch<C> routeMatch = getRouter().match(requestHead.path(), requestHead.method())
						.orElseThrow(() -> new HttpException(StatusCode.HTTP_404,
								format("No route matches %s %s", requestHead.method(), Utilities.printableString(requestHead.path()))));

				logger.debug("Matched {}", routeMatch.route());

				request = Request.<C>with(requestHead.method(), requestHead.path())
						.protocol(requestHead.protocol())
						.remoteAddress(remoteAddress(socket))
						.headers(requestHead.headers())
						.pathParameters(routeMatch.pathParameters())
						.context(getContext())
						.multipartParser(getMultipartParser())
						.maximumBodySize(getMaximumBodySize())
						.bodyReader((contentLength) -> readBody(connectionReader, contentLength))
						.build();

				response = Middleware.compose(getMiddlewares(), routeMatch.route().getHandler()).handle(request);

				if (response == null)
					throw new IllegalStateException(format("%s returned a null response", routeMatch.route()));
			} catch (Exception e) {
				if (isReadTimeout(e)) {
					logger.debug("Read timed out; dropping connection from {}", socket.getRemoteSocketAddress());
					abort(socket);
					return;
				}

				response = errorResponse(e);
			}

			try {
				getResponseWriter().write(response, socket.getOutputStream());
			} catch (IOException | RuntimeException e) {
				logger.debug(format("Unable to write %s response", response.getStatusCode().getStatusCode()), e);
			}
		} finally {
			try {
				if (request != null)
					request.close();
			} catch (IOException | RuntimeException e) {
				logger.warn("Unable to release request resources", e);
			} finally {
				try {
					socket.close();
				} catch (IOException e) {
					logger.debug("Unable to close connection", e);
				}
			}
		}
	}

	@NonNull
	private SpooledBuffer readBody(@NonNull ConnectionReader connectionReader,
																 @NonNull Long contentLength) throws IOException {
		SpooledBuffer body = new SpooledBuffer(getSpoolThreshold());

		try {
			Long bytesRead = connectionReader.readBody(contentLength, body);

			if (bytesRead < contentLength)
				logger.debug("Client sent {} of {} declared body bytes", bytesRead, contentLength);

			return body;
		} catch (IOException | RuntimeException e) {
			try {
				body.close();
			} catch (IOException closeException) {
				e.addSuppressed(closeException);
			}

			throw e;
		}
	}

	@NonNull
	private Response errorResponse(@NonNull Exception exception) {
		if (exception instanceof HttpException httpException) {
			logger.debug("Request failed with {}: {}", httpException.getStatusCode().getStatusCode(), httpException.getMessage());
			return Response.error(httpException.getStatusCode());
		}

		logger.error("An unexpected error occurred during request handling", exception);
		return Response.error(StatusCode.HTTP_500);
	}

	@NonNull
	static Boolean isReadTimeout(@Nullable Throwable throwable) {
		Throwable current = throwable;
		int depth = 0;

		while (current != null && depth++ < 16) {
			if (current instanceof ReadTimeoutException)
				return true;

			current = current.getCause();
		}

		return false;
	}

	private void abort(@NonNull Socket socket) {
		try {
			// Linger 0 makes close() send a reset instead of an orderly shutdown
			socket.setSoLinger(true, 0);
		} catch (IOException e) {
			logger.debug("Unable to set linger on timed-out connection", e);
		}
	}

	@Nullable
	private static InetSocketAddress remoteAddress(@NonNull Socket socket) {
		SocketAddress socketAddress = socket.getRemoteSocketAddress();
		return socketAddress instanceof InetSocketAddress inetSocketAddress ? inetSocketAddress : null;
	}

	@NonNull
	private Router<C> getRouter() {
		return this.router;
	}

	@NonNull
	private List<@NonNull Middleware<C>> getMiddlewares() {
		return this.middlewares;
	}

	@Nullable
	private C getContext() {
		return this.context;
	}

	@NonNull
	private RequestParser getRequestParser() {
		return this.requestParser;
	}

	@NonNull
	private ResponseWriter getResponseWriter() {
		return this.responseWriter;
	}

	@NonNull
	private MultipartParser getMultipartParser() {
		return this.multipartParser;
	}

	@NonNull
	private Duration getReadTimeout() {
		return this.readTimeout;
	}

	@NonNull
	private Integer getChunkSize() {
		return this.chunkSize;
	}

	@NonNull
	private Integer getSpoolThreshold() {
		return this.spoolThreshold;
	}

	@NonNull
	private Long getMaximumBodySize() {
		return this.maximumBodySize;
	}
}
