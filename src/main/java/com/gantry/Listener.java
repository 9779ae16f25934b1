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
import org.newsclub.net.unix.AFUNIXServerSocket;
import org.newsclub.net.unix.AFUNIXSocketAddress;

import javax.annotation.concurrent.ThreadSafe;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketAddress;
import java.net.SocketException;
import java.net.StandardSocketOptions;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Owns the listening socket and the acceptor thread, which hands each accepted connection to the {@link WorkerPool}.
 * <p>
 * The TLS handshake is not performed here; it runs on the worker so a slow client cannot stall accepting.
 */
@ThreadSafe
final class Listener {
	@NonNull
	private static final Duration MINIMUM_ACCEPT_BACKOFF;
	@NonNull
	private static final Duration MAXIMUM_ACCEPT_BACKOFF;
	@NonNull
	private static final Duration ACCEPTOR_JOIN_TIMEOUT;

	static {
		MINIMUM_ACCEPT_BACKOFF = Duration.ofMillis(10);
		MAXIMUM_ACCEPT_BACKOFF = Duration.ofSeconds(1);
		ACCEPTOR_JOIN_TIMEOUT = Duration.ofSeconds(2);
	}

	@NonNull
	private final ServerConfig serverConfig;
	@NonNull
	private final Gateway gateway;
	@Nullable
	private final TlsAdapter tlsAdapter;
	@NonNull
	private final WorkerPool workerPool;
	@NonNull
	private final ServerCounters serverCounters;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final Consumer<LogEvent> logEventConsumer;
	@NonNull
	private final AtomicLong connectionIdGenerator;
	@Nullable
	private volatile ServerSocket serverSocket;
	// The socket file to remove on stop, for filesystem Unix domain sockets
	@Nullable
	private volatile Path socketPath;
	@Nullable
	private volatile SocketAddress boundAddress;
	@Nullable
	private volatile Thread acceptorThread;
	private volatile boolean stopping;

	Listener(@NonNull ServerConfig serverConfig,
					 @NonNull Gateway gateway,
					 @Nullable TlsAdapter tlsAdapter,
					 @NonNull WorkerPool workerPool,
					 @NonNull ServerCounters serverCounters,
					 @NonNull LifecycleObserver lifecycleObserver,
					 @NonNull Consumer<LogEvent> logEventConsumer) {
		requireNonNull(serverConfig);
		requireNonNull(gateway);
		requireNonNull(workerPool);
		requireNonNull(serverCounters);
		requireNonNull(lifecycleObserver);
		requireNonNull(logEventConsumer);

		this.serverConfig = serverConfig;
		this.gateway = gateway;
		this.tlsAdapter = tlsAdapter;
		this.workerPool = workerPool;
		this.serverCounters = serverCounters;
		this.lifecycleObserver = lifecycleObserver;
		this.logEventConsumer = logEventConsumer;
		this.connectionIdGenerator = new AtomicLong();
	}

	/**
	 * Binds the listening socket on the calling thread, so bind failures surface to whoever starts the server.
	 *
	 * @return the address actually bound, with the ephemeral port resolved
	 */
	@NonNull
	SocketAddress bind() throws IOException {
		BindAddress bindAddress = this.serverConfig.getBindAddress();

		if (bindAddress.isUnixDomain())
			return bindUnixDomainSocket(bindAddress);

		ServerSocket serverSocket = new ServerSocket();

		try {
			serverSocket.setReuseAddress(true);

			if (this.serverConfig.getReusePort()) {
				if (!serverSocket.supportedOptions().contains(StandardSocketOptions.SO_REUSEPORT))
					throw new IllegalStateException("SO_REUSEPORT is not supported on this platform");

				serverSocket.setOption(StandardSocketOptions.SO_REUSEPORT, true);
			}

			String host = bindAddress.getHost().orElse(null);
			int port = bindAddress.getPort().orElse(0);
			InetSocketAddress socketAddress = host == null ? new InetSocketAddress(port) : new InetSocketAddress(host, port);

			serverSocket.bind(socketAddress, this.serverConfig.getSocketPendingConnectionLimit());
		} catch (IOException | RuntimeException e) {
			closeQuietly(serverSocket, e);
			throw e;
		}

		this.serverSocket = serverSocket;
		this.boundAddress = serverSocket.getLocalSocketAddress();
		return requireNonNull(this.boundAddress);
	}

	@NonNull
	private SocketAddress bindUnixDomainSocket(@NonNull BindAddress bindAddress) throws IOException {
		requireNonNull(bindAddress);

		Path path = bindAddress.getPath().orElse(null);
		AFUNIXSocketAddress socketAddress;

		if (path != null) {
			// A previous run may have left its socket file behind
			Files.deleteIfExists(path);
			socketAddress = AFUNIXSocketAddress.of(path);
		} else {
			// The factory adds the leading NUL itself
			socketAddress = AFUNIXSocketAddress.inAbstractNamespace(bindAddress.getAbstractName().orElseThrow().substring(1));
		}

		AFUNIXServerSocket serverSocket = AFUNIXServerSocket.newInstance();

		try {
			serverSocket.bind(socketAddress, this.serverConfig.getSocketPendingConnectionLimit());
		} catch (IOException | RuntimeException e) {
			closeQuietly(serverSocket, e);
			throw e;
		}

		if (path != null) {
			this.socketPath = path;

			try {
				Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rwxrwxrwx"));
			} catch (IOException | UnsupportedOperationException e) {
				this.logEventConsumer.accept(LogEvent.with(LogEventType.UNIX_SOCKET_CLEANUP_FAILED,
								format("Unable to make Unix domain socket %s world-accessible", path))
						.throwable(e)
						.build());
			}
		}

		this.serverSocket = serverSocket;
		this.boundAddress = serverSocket.getLocalSocketAddress();
		return requireNonNull(this.boundAddress);
	}

	/**
	 * Starts the acceptor thread. {@link #bind()} must have succeeded first.
	 */
	void start() {
		if (this.serverSocket == null)
			throw new IllegalStateException("Listener is not bound");

		Thread acceptorThread = new Thread(this::acceptLoop, "gantry-acceptor");
		this.acceptorThread = acceptorThread;
		acceptorThread.start();
	}

	/**
	 * Closes the listening socket, which unblocks the acceptor, then waits for the acceptor to exit.
	 */
	void stop() {
		this.stopping = true;

		ServerSocket serverSocket = this.serverSocket;

		if (serverSocket != null)
			closeQuietly(serverSocket, null);

		Thread acceptorThread = this.acceptorThread;

		if (acceptorThread != null && acceptorThread != Thread.currentThread()) {
			try {
				acceptorThread.join(ACCEPTOR_JOIN_TIMEOUT.toMillis());
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}

		Path socketPath = this.socketPath;

		if (socketPath != null) {
			try {
				Files.deleteIfExists(socketPath);
			} catch (IOException e) {
				this.logEventConsumer.accept(LogEvent.with(LogEventType.UNIX_SOCKET_CLEANUP_FAILED,
								format("Unable to remove Unix domain socket %s", socketPath))
						.throwable(e)
						.build());
			}
		}

		this.serverSocket = null;
		this.socketPath = null;
		this.acceptorThread = null;
	}

	@NonNull
	Optional<SocketAddress> getBoundAddress() {
		return Optional.ofNullable(this.boundAddress);
	}

	private void acceptLoop() {
		long backoffMillis = MINIMUM_ACCEPT_BACKOFF.toMillis();

		while (!this.stopping) {
			Transport transport;

			try {
				transport = acceptTransport();
				backoffMillis = MINIMUM_ACCEPT_BACKOFF.toMillis();
			} catch (IOException e) {
				if (this.stopping)
					break;

				this.serverCounters.socketError();
				this.logEventConsumer.accept(LogEvent.with(LogEventType.ACCEPT_FAILED,
								format("Unable to accept connection, retrying in %dms", backoffMillis))
						.throwable(e)
						.build());

				try {
					Thread.sleep(backoffMillis);
				} catch (InterruptedException interruptedException) {
					Thread.currentThread().interrupt();
					break;
				}

				backoffMillis = Math.min(backoffMillis * 2, MAXIMUM_ACCEPT_BACKOFF.toMillis());
				continue;
			}

			dispatch(transport);
		}
	}

	@NonNull
	private Transport acceptTransport() throws IOException {
		ServerSocket serverSocket = this.serverSocket;

		if (serverSocket == null)
			throw new SocketException("Listening socket is closed");

		Socket socket = serverSocket.accept();

		try {
			if (!this.serverConfig.getBindAddress().isUnixDomain())
				socket.setTcpNoDelay(this.serverConfig.getTcpNoDelay());

			return new SocketTransport(socket);
		} catch (IOException e) {
			closeQuietly(socket, e);
			throw e;
		}
	}

	private void dispatch(@NonNull Transport transport) {
		requireNonNull(transport);

		Long connectionId = this.connectionIdGenerator.incrementAndGet();
		this.serverCounters.connectionAccepted();

		HttpConnection connection = new HttpConnection(connectionId, transport, this.serverConfig, this.gateway,
				this.tlsAdapter, this.workerPool, this.serverCounters, this.lifecycleObserver);
		SocketAddress remoteAddress = transport.getRemoteAddress().orElse(null);

		notifyObserver(lifecycleObserver -> lifecycleObserver.didAcceptConnection(connectionId, remoteAddress));

		if (this.workerPool.submit(connection))
			return;

		this.serverCounters.connectionRejected();
		connection.reject();

		notifyObserver(lifecycleObserver -> lifecycleObserver.didRejectConnection(remoteAddress));

		if (!this.workerPool.isShuttingDown())
			this.logEventConsumer.accept(LogEvent.with(LogEventType.CONNECTION_REJECTED,
							format("Rejected connection from %s: no worker became available within %s", remoteAddress,
									this.serverConfig.getAcceptedQueueTimeout()))
					.connectionId(connectionId)
					.build());
	}

	private void notifyObserver(@NonNull Consumer<LifecycleObserver> notification) {
		try {
			notification.accept(this.lifecycleObserver);
		} catch (Throwable t) {
			this.logEventConsumer.accept(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED, "Lifecycle observer threw an exception")
					.throwable(t)
					.build());
		}
	}

	// Reports close failures unless they happen while unwinding another failure
	private void closeQuietly(@NonNull Closeable closeable,
														@Nullable Exception pending) {
		try {
			closeable.close();
		} catch (IOException e) {
			if (pending != null)
				pending.addSuppressed(e);
			else
				this.logEventConsumer.accept(LogEvent.with(LogEventType.CONNECTION_CLOSE_FAILED, "Unable to close socket")
						.throwable(e)
						.build());
		}
	}
}
