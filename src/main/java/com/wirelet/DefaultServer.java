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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.BindException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Blocking-socket {@link Server}: one acceptor thread hands each connection to the connection executor, which uses
 * virtual threads when the runtime has them and a fixed pool of platform threads otherwise.
 *
 * @param <C> the application context type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultServer<C> implements Server<C> {
	@NonNull
	private static final Logger logger = LoggerFactory.getLogger(DefaultServer.class);

	@NonNull
	private static final String DEFAULT_HOST;
	@NonNull
	private static final Duration DEFAULT_READ_TIMEOUT;
	@NonNull
	private static final Integer DEFAULT_CHUNK_SIZE;
	@NonNull
	private static final Integer DEFAULT_MAXIMUM_HEADER_SIZE;
	@NonNull
	private static final Long DEFAULT_MAXIMUM_BODY_SIZE;
	@NonNull
	private static final Integer DEFAULT_CONCURRENCY;

	static {
		DEFAULT_HOST = "0.0.0.0";
		DEFAULT_READ_TIMEOUT = Duration.ofSeconds(60);
		DEFAULT_CHUNK_SIZE = 1_024 * 64;
		DEFAULT_MAXIMUM_HEADER_SIZE = 1_024 * 64;
		DEFAULT_MAXIMUM_BODY_SIZE = 1_024L * 1_024 * 64;
		// Connections block on I/O, so the platform-thread fallback needs many more threads than cores
		DEFAULT_CONCURRENCY = Runtime.getRuntime().availableProcessors() * 16;
	}

	@NonNull
	private final Integer port;
	@NonNull
	private final String host;
	@Nullable
	private final C context;
	@Nullable
	private final LifecycleHook<C> beforeStart;
	@Nullable
	private final LifecycleHook<C> afterStop;
	@NonNull
	private final ConnectionHandler<C> connectionHandler;
	@NonNull
	private final Supplier<ExecutorService> executorServiceSupplier;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final AtomicReference<CountDownLatch> awaitShutdownLatchReference;
	@Nullable
	private volatile ServerSocket serverSocket;
	@Nullable
	private volatile ExecutorService executorService;
	@Nullable
	private volatile Thread acceptorThread;

	DefaultServer(@NonNull Builder<C> builder) {
		requireNonNull(builder);

		this.lock = new ReentrantLock();
		this.awaitShutdownLatchReference = new AtomicReference<>(new CountDownLatch(1));

		this.port = builder.port;
		this.host = builder.host != null ? builder.host : DEFAULT_HOST;
		this.context = builder.context;
		this.beforeStart = builder.beforeStart;
		this.afterStop = builder.afterStop;

		Router<C> router = builder.router != null ? builder.router : new Router<>();
		List<Middleware<C>> middlewares = builder.middlewares != null ? builder.middlewares : List.of();
		Duration readTimeout = builder.readTimeout != null ? builder.readTimeout : DEFAULT_READ_TIMEOUT;
		Integer spoolThreshold = builder.spoolThreshold != null ? builder.spoolThreshold : SpooledBuffer.DEFAULT_THRESHOLD;
		Integer chunkSize = builder.chunkSize != null ? builder.chunkSize : DEFAULT_CHUNK_SIZE;
		Integer maximumHeaderSize = builder.maximumHeaderSize != null ? builder.maximumHeaderSize : DEFAULT_MAXIMUM_HEADER_SIZE;
		Long maximumBodySize = builder.maximumBodySize != null ? builder.maximumBodySize : DEFAULT_MAXIMUM_BODY_SIZE;
		Integer concurrency = builder.concurrency != null ? builder.concurrency : DEFAULT_CONCURRENCY;
		MultipartParser multipartParser = builder.multipartParser != null ? builder.multipartParser
				: (spoolThreshold.equals(SpooledBuffer.DEFAULT_THRESHOLD) ? MultipartParser.defaultInstance() : new DefaultMultipartParser(spoolThreshold));

		if (this.port < 0 || this.port > 65_535)
			throw new IllegalArgumentException(format("Illegal port %d", this.port));

		if (readTimeout.isNegative() || readTimeout.isZero())
			throw new IllegalArgumentException("Read timeout must be > 0");

		if (spoolThreshold < 0)
			throw new IllegalArgumentException("Spool threshold must be >= 0");

		if (chunkSize <= 0)
			throw new IllegalArgumentException("Chunk size must be > 0");

		if (maximumHeaderSize <= 0)
			throw new IllegalArgumentException("Maximum header size must be > 0");

		if (maximumBodySize < 0)
			throw new IllegalArgumentException("Maximum body size must be >= 0");

		if (concurrency <= 0)
			throw new IllegalArgumentException("Concurrency must be > 0");

		this.connectionHandler = new ConnectionHandler<>(router, middlewares, this.context, multipartParser,
				readTimeout, chunkSize, spoolThreshold, maximumHeaderSize, maximumBodySize);

		this.executorServiceSupplier = builder.executorServiceSupplier != null ? builder.executorServiceSupplier : () -> {
			String threadNamePrefix = "wirelet-connection-";

			if (Utilities.virtualThreadsAvailable())
				return Utilities.createVirtualThreadsNewThreadPerTaskExecutor(threadNamePrefix, (Thread thread, Throwable throwable) -> {
					logger.error(format("Unexpected exception on %s", thread.getName()), throwable);
				});

			return Executors.newFixedThreadPool(concurrency, new NonvirtualThreadFactory(threadNamePrefix));
		};
	}

	@Override
	public void start() {
		getLock().lock();

		try {
			if (isStarted())
				return;

			getAwaitShutdownLatchReference().set(new CountDownLatch(1));

			ServerSocket serverSocket = null;

			try {
				serverSocket = new ServerSocket();
				serverSocket.setReuseAddress(true);
				serverSocket.bind(new InetSocketAddress(getHost(), getPort()));
			} catch (BindException e) {
				closeQuietly(serverSocket);
				throw new UncheckedIOException(format("Unable to start server - port %d is already in use", getPort()), e);
			} catch (IOException e) {
				closeQuietly(serverSocket);
				throw new UncheckedIOException(format("Unable to start server on %s:%d", getHost(), getPort()), e);
			}

			ExecutorService executorService;

			try {
				// Bound but not yet accepting
				invokeHook(this.beforeStart, "beforeStart");
				executorService = getExecutorServiceSupplier().get();
			} catch (RuntimeException e) {
				closeQuietly(serverSocket);
				throw e;
			}

			ServerSocket boundServerSocket = serverSocket;
			Thread acceptorThread = new NonvirtualThreadFactory("wirelet-acceptor-").newThread(() -> accept(boundServerSocket, executorService));

			this.serverSocket = boundServerSocket;
			this.executorService = executorService;
			this.acceptorThread = acceptorThread;

			acceptorThread.start();

			logger.info("Wirelet listening on {}:{}", getHost(), boundServerSocket.getLocalPort());
		} finally {
			getLock().unlock();
		}
	}

	private void accept(@NonNull ServerSocket serverSocket,
											@NonNull ExecutorService executorService) {
		while (!serverSocket.isClosed()) {
			Socket socket;

			try {
				socket = serverSocket.accept();
			} catch (SocketException e) {
				if (serverSocket.isClosed())
					break;

				logger.warn("Unable to accept connection", e);
				continue;
			} catch (IOException e) {
				logger.warn("Unable to accept connection", e);
				continue;
			}

			try {
				executorService.execute(() -> getConnectionHandler().handle(socket));
			} catch (RejectedExecutionException e) {
				logger.warn("Connection executor rejected a connection", e);
				closeQuietly(socket);
			}
		}

		logger.debug("Stopped accepting connections");
	}

	/**
	 * Must not be called from a connection thread: it waits for every connection, including the caller's, to finish.
	 */
	@Override
	public void stop() {
		getLock().lock();

		try {
			if (!isStarted())
				return;

			logger.info("Wirelet shutting down...");

			closeQuietly(this.serverSocket);

			boolean interrupted = false;

			try {
				Thread acceptorThread = this.acceptorThread;

				if (acceptorThread != null)
					acceptorThread.join();

				ExecutorService executorService = this.executorService;

				if (executorService != null) {
					// In-flight connections finish on their own; nothing is cancelled
					executorService.shutdown();

					while (!executorService.awaitTermination(1, TimeUnit.SECONDS))
						logger.debug("Waiting for in-flight connections to finish...");
				}
			} catch (InterruptedException e) {
				interrupted = true;
				logger.warn("Interrupted while waiting for in-flight connections to finish");
			} finally {
				this.serverSocket = null;
				this.executorService = null;
				this.acceptorThread = null;

				if (interrupted)
					Thread.currentThread().interrupt();
			}

			try {
				invokeHook(this.afterStop, "afterStop");
			} catch (RuntimeException e) {
				logger.error("afterStop hook failed", e);
			}

			logger.info("Wirelet stopped");
		} finally {
			try {
				getAwaitShutdownLatchReference().get().countDown();
			} finally {
				getLock().unlock();
			}
		}
	}

	@NonNull
	@Override
	public Boolean isStarted() {
		getLock().lock();

		try {
			return this.serverSocket != null;
		} finally {
			getLock().unlock();
		}
	}

	@Override
	public void awaitShutdown() throws InterruptedException {
		Thread shutdownHook = new Thread(() -> {
			try {
				stop();
			} catch (Throwable throwable) {
				logger.error("Unable to stop server during JVM shutdown", throwable);
			}
		}, "wirelet-shutdown-hook");

		Runtime.getRuntime().addShutdownHook(shutdownHook);

		try {
			getAwaitShutdownLatchReference().get().await();
		} finally {
			try {
				Runtime.getRuntime().removeShutdownHook(shutdownHook);
			} catch (IllegalStateException ignored) {
				// JVM shutting down
			}
		}
	}

	@NonNull
	@Override
	public Optional<Integer> getBoundPort() {
		ServerSocket serverSocket = this.serverSocket;
		return serverSocket == null ? Optional.empty() : Optional.of(serverSocket.getLocalPort());
	}

	private void invokeHook(@Nullable LifecycleHook<C> hook,
													@NonNull String name) {
		if (hook == null)
			return;

		logger.debug("Invoking {} hook", name);

		try {
			hook.invoke(getContext());
		} catch (RuntimeException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException(format("%s hook failed", name), e);
		}
	}

	private static void closeQuietly(@Nullable AutoCloseable closeable) {
		if (closeable == null)
			return;

		try {
			closeable.close();
		} catch (Exception e) {
			logger.debug(format("Unable to close %s", closeable), e);
		}
	}

	@Override
	public String toString() {
		return format("%s{host=%s, port=%d}", getClass().getSimpleName(), getHost(), getPort());
	}

	@NonNull
	private Integer getPort() {
		return this.port;
	}

	@NonNull
	private String getHost() {
		return this.host;
	}

	@Nullable
	private C getContext() {
		return this.context;
	}

	@NonNull
	private ConnectionHandler<C> getConnectionHandler() {
		return this.connectionHandler;
	}

	@NonNull
	private Supplier<ExecutorService> getExecutorServiceSupplier() {
		return this.executorServiceSupplier;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	private AtomicReference<CountDownLatch> getAwaitShutdownLatchReference() {
		return this.awaitShutdownLatchReference;
	}

	@ThreadSafe
	private static final class NonvirtualThreadFactory implements ThreadFactory {
		@NonNull
		private final String namePrefix;
		@NonNull
		private final AtomicInteger idGenerator;

		NonvirtualThreadFactory(@NonNull String namePrefix) {
			requireNonNull(namePrefix);

			this.namePrefix = namePrefix;
			this.idGenerator = new AtomicInteger(0);
		}

		@Override
		@NonNull
		public Thread newThread(@NonNull Runnable runnable) {
			return new Thread(runnable, format("%s%d", this.namePrefix, this.idGenerator.incrementAndGet()));
		}
	}
}
