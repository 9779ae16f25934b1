/*
 * Copyright 2022-2026 Revetware LLC.
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

package com.gantry;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.BindException;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The standard {@link Server}: one {@link Listener} feeding a {@link WorkerPool} of blocking workers.
 * <p>
 * Each {@link #start()} builds a fresh listener, pool and set of counters, so a stopped server can be started again.
 */
@ThreadSafe
final class DefaultServer implements Server {
	@NonNull
	private final ServerConfig serverConfig;
	@NonNull
	private final Gateway gateway;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private volatile ServerCounters serverCounters;
	@Nullable
	private volatile WorkerPool workerPool;
	@Nullable
	private volatile Listener listener;
	@Nullable
	private volatile SocketAddress boundAddress;
	private volatile boolean started;

	DefaultServer(Server.@NonNull Builder builder) {
		requireNonNull(builder);

		this.serverConfig = builder.serverConfig;
		this.gateway = builder.gateway;
		this.lifecycleObserver = builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance();
		this.lock = new ReentrantLock();
		this.serverCounters = new ServerCounters();
	}

	@Override
	public void start() {
		getLock().lock();

		try {
			if (isStarted())
				return;

			notifyObserver(lifecycleObserver -> lifecycleObserver.willStartServer(this));

			ServerConfig serverConfig = getServerConfig();
			Consumer<LogEvent> logEventConsumer = this::safelyLog;
			ServerCounters serverCounters = new ServerCounters();
			WorkerPool workerPool = null;
			Listener listener = null;

			try {
				TlsAdapter tlsAdapter = serverConfig.getTlsConfig()
						.map(tlsConfig -> new TlsAdapter(tlsConfig, serverConfig.getServerName()))
						.orElse(null);

				workerPool = new WorkerPool(serverConfig.getMinimumWorkerCount(), serverConfig.getMaximumWorkerCount(),
						serverConfig.getWorkerIdleTimeout(), serverConfig.getAcceptedQueueSize(), serverConfig.getAcceptedQueueTimeout(),
						"gantry-worker", logEventConsumer);
				listener = new Listener(serverConfig, getGateway(), tlsAdapter, workerPool, serverCounters,
						getLifecycleObserver(), logEventConsumer);

				SocketAddress boundAddress;

				try {
					boundAddress = listener.bind();
				} catch (BindException e) {
					throw new UncheckedIOException(format("Unable to start the HTTP server - %s is already in use.", serverConfig.getBindAddress()), e);
				} catch (IOException e) {
					throw new UncheckedIOException(format("Unable to start the HTTP server on %s", serverConfig.getBindAddress()), e);
				}

				workerPool.start();
				listener.start();

				this.serverCounters = serverCounters;
				this.workerPool = workerPool;
				this.listener = listener;
				this.boundAddress = boundAddress;
				this.started = true;
			} catch (RuntimeException e) {
				cleanupFailedStart(listener, workerPool);
				notifyObserver(lifecycleObserver -> lifecycleObserver.didFailToStartServer(this, e));
				throw e;
			}

			notifyObserver(lifecycleObserver -> lifecycleObserver.didStartServer(this));
		} finally {
			getLock().unlock();
		}
	}

	@Override
	public void stop() {
		getLock().lock();

		try {
			if (!isStarted())
				return;

			notifyObserver(lifecycleObserver -> lifecycleObserver.willStopServer(this));

			try {
				Listener listener = this.listener;

				if (listener != null)
					listener.stop();

				WorkerPool workerPool = this.workerPool;

				if (workerPool != null && !workerPool.shutdown(getServerConfig().getShutdownTimeout()))
					safelyLog(LogEvent.with(LogEventType.SERVER_SHUTDOWN_INCOMPLETE,
							format("In-flight requests did not finish within %s and were aborted", getServerConfig().getShutdownTimeout())).build());
			} finally {
				this.started = false;
				this.listener = null;
				this.workerPool = null;
				this.boundAddress = null;
			}

			notifyObserver(lifecycleObserver -> lifecycleObserver.didStopServer(this));
		} finally {
			getLock().unlock();
		}
	}

	private void cleanupFailedStart(@Nullable Listener listener,
																	@Nullable WorkerPool workerPool) {
		if (listener != null)
			listener.stop();

		if (workerPool != null)
			workerPool.shutdown(Duration.ZERO);
	}

	@NonNull
	@Override
	public Boolean isStarted() {
		return this.started;
	}

	@NonNull
	@Override
	public Optional<SocketAddress> getBoundAddress() {
		return Optional.ofNullable(this.boundAddress);
	}

	@NonNull
	@Override
	public ServerStatistics getStatistics() {
		return this.serverCounters.snapshot(this.workerPool);
	}

	@NonNull
	@Override
	public ServerConfig getServerConfig() {
		return this.serverConfig;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{bindAddress=%s, started=%s}", getClass().getSimpleName(), getServerConfig().getBindAddress(), isStarted());
	}

	private void notifyObserver(@NonNull Consumer<LifecycleObserver> notification) {
		try {
			notification.accept(getLifecycleObserver());
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED, "Lifecycle observer threw an exception")
					.throwable(t)
					.build());
		}
	}

	private void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// The LifecycleObserver implementation errored out, but we can't let that affect us.
			// Not much else we can do here but dump to stderr
			throwable.printStackTrace(System.err);
		}
	}

	@NonNull
	private Gateway getGateway() {
		return this.gateway;
	}

	@NonNull
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}
}
