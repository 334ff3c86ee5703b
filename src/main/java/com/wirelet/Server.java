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
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * An HTTP/1.1 server which answers one request per connection.
 * <p>
 * For example:
 * <pre>{@code  Router<Database> router = new Router<Database>()
 *   .add("/hello", (request) -> Response.text("Hello"))
 *   .add("/person/:id", (request) -> Response.json(lookup(request)), HttpMethod.GET);
 *
 * Server<Database> server = Server.<Database>withPort(8080)
 *   .router(router)
 *   .context(database)
 *   .beforeStart((db) -> db.connect())
 *   .afterStop((db) -> db.disconnect())
 *   .build();
 *
 * // Blocks until SIGINT/SIGTERM, then shuts down gracefully
 * server.run();}</pre>
 *
 * @param <C> the application context type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Server<C> extends AutoCloseable {
	/**
	 * Runs the {@code beforeStart} hook, binds the listening socket and begins accepting connections.
	 * <p>
	 * If the server is already started, no action is taken.
	 *
	 * @throws java.io.UncheckedIOException if the socket cannot be bound
	 */
	void start();

	/**
	 * Stops accepting connections, waits for in-flight connections to finish and then runs the {@code afterStop} hook.
	 * <p>
	 * In-flight requests are not interrupted. If the server is already stopped, no action is taken.
	 */
	void stop();

	@NonNull
	Boolean isStarted();

	/**
	 * Blocks until the JVM begins shutting down (for example on {@code SIGINT}) or {@link #stop()} is called, stopping
	 * the server in the former case.
	 *
	 * @throws InterruptedException if interrupted while waiting
	 */
	void awaitShutdown() throws InterruptedException;

	/**
	 * Starts the server and blocks until it has shut down.
	 *
	 * @throws InterruptedException if interrupted while waiting
	 */
	default void run() throws InterruptedException {
		start();
		awaitShutdown();
	}

	/**
	 * The port the server is listening on, which differs from the configured one when that was {@code 0}.
	 *
	 * @return the bound port, or {@link Optional#empty()} if the server is not started
	 */
	@NonNull
	Optional<Integer> getBoundPort();

	/**
	 * {@link AutoCloseable}-enabled synonym for {@link #stop()}.
	 */
	@Override
	default void close() {
		stop();
	}

	@NonNull
	static <C> Builder<C> withPort(@NonNull Integer port) {
		requireNonNull(port);
		return new Builder<>(port);
	}

	/**
	 * Builder used to construct a standard implementation of {@link Server}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @param <C> the application context type
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	final class Builder<C> {
		@NonNull
		Integer port;
		@Nullable
		String host;
		@Nullable
		Router<C> router;
		@Nullable
		List<Middleware<C>> middlewares;
		@Nullable
		LifecycleHook<C> beforeStart;
		@Nullable
		LifecycleHook<C> afterStop;
		@Nullable
		C context;
		@Nullable
		Duration readTimeout;
		@Nullable
		Integer spoolThreshold;
		@Nullable
		Integer chunkSize;
		@Nullable
		Integer maximumHeaderSize;
		@Nullable
		Long maximumBodySize;
		@Nullable
		Integer concurrency;
		@Nullable
		MultipartParser multipartParser;
		@Nullable
		Supplier<ExecutorService> executorServiceSupplier;

		private Builder(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
		}

		@NonNull
		public Builder<C> port(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
			return this;
		}

		@NonNull
		public Builder<C> host(@Nullable String host) {
			this.host = host;
			return this;
		}

		@NonNull
		public Builder<C> router(@Nullable Router<C> router) {
			this.router = router;
			return this;
		}

		/**
		 * Middleware applied to every matched route, outermost first.
		 *
		 * @param middlewares the server-wide middleware
		 * @return this builder
		 */
		@NonNull
		public Builder<C> middlewares(@Nullable List<Middleware<C>> middlewares) {
			this.middlewares = middlewares;
			return this;
		}

		@NonNull
		public Builder<C> beforeStart(@Nullable LifecycleHook<C> beforeStart) {
			this.beforeStart = beforeStart;
			return this;
		}

		@NonNull
		public Builder<C> afterStop(@Nullable LifecycleHook<C> afterStop) {
			this.afterStop = afterStop;
			return this;
		}

		@NonNull
		public Builder<C> context(@Nullable C context) {
			this.context = context;
			return this;
		}

		/**
		 * How long any single read from a client may block before the connection is dropped.
		 *
		 * @param readTimeout the per-read timeout
		 * @return this builder
		 */
		@NonNull
		public Builder<C> readTimeout(@Nullable Duration readTimeout) {
			this.readTimeout = readTimeout;
			return this;
		}

		@NonNull
		public Builder<C> spoolThreshold(@Nullable Integer spoolThreshold) {
			this.spoolThreshold = spoolThreshold;
			return this;
		}

		@NonNull
		public Builder<C> chunkSize(@Nullable Integer chunkSize) {
			this.chunkSize = chunkSize;
			return this;
		}

		@NonNull
		public Builder<C> maximumHeaderSize(@Nullable Integer maximumHeaderSize) {
			this.maximumHeaderSize = maximumHeaderSize;
			return this;
		}

		@NonNull
		public Builder<C> maximumBodySize(@Nullable Long maximumBodySize) {
			this.maximumBodySize = maximumBodySize;
			return this;
		}

		/**
		 * Size of the platform thread pool used when virtual threads are unavailable.
		 *
		 * @param concurrency the number of connection threads
		 * @return this builder
		 */
		@NonNull
		public Builder<C> concurrency(@Nullable Integer concurrency) {
			this.concurrency = concurrency;
			return this;
		}

		@NonNull
		public Builder<C> multipartParser(@Nullable MultipartParser multipartParser) {
			this.multipartParser = multipartParser;
			return this;
		}

		@NonNull
		public Builder<C> executorServiceSupplier(@Nullable Supplier<ExecutorService> executorServiceSupplier) {
			this.executorServiceSupplier = executorServiceSupplier;
			return this;
		}

		@NonNull
		public Server<C> build() {
			return new DefaultServer<>(this);
		}
	}
}
