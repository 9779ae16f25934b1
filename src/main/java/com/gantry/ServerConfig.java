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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Immutable settings for a {@link Server}: where to listen, how many workers to run, and the limits and timeouts
 * applied to every connection.
 * <p>
 * Instances can be acquired via the {@link #withBindAddress(BindAddress)} and {@link #withPort(Integer)} builder
 * factory methods.
 */
@ThreadSafe
public final class ServerConfig {
	@NonNull
	private static final Integer DEFAULT_MINIMUM_WORKER_COUNT;
	@NonNull
	private static final Integer DEFAULT_MAXIMUM_WORKER_COUNT;
	@NonNull
	private static final Duration DEFAULT_WORKER_IDLE_TIMEOUT;
	@NonNull
	private static final Integer DEFAULT_ACCEPTED_QUEUE_SIZE;
	@NonNull
	private static final Duration DEFAULT_ACCEPTED_QUEUE_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_CONNECTION_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_KEEP_ALIVE_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_REQUEST_HEADER_TIMEOUT;
	@NonNull
	private static final Integer DEFAULT_MAXIMUM_HEADER_SIZE_IN_BYTES;
	@NonNull
	private static final Long DEFAULT_MAXIMUM_REQUEST_BODY_SIZE_IN_BYTES;
	@NonNull
	private static final Integer DEFAULT_READ_BUFFER_SIZE_IN_BYTES;
	@NonNull
	private static final Integer DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT;
	@NonNull
	private static final Duration DEFAULT_SHUTDOWN_TIMEOUT;
	@NonNull
	private static final String DEFAULT_SERVER_NAME;

	static {
		DEFAULT_MINIMUM_WORKER_COUNT = 10;
		DEFAULT_MAXIMUM_WORKER_COUNT = 100;
		DEFAULT_WORKER_IDLE_TIMEOUT = Duration.ofSeconds(30);
		DEFAULT_ACCEPTED_QUEUE_SIZE = 0;
		DEFAULT_ACCEPTED_QUEUE_TIMEOUT = Duration.ofSeconds(10);
		DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(10);
		DEFAULT_KEEP_ALIVE_TIMEOUT = Duration.ofSeconds(10);
		DEFAULT_REQUEST_HEADER_TIMEOUT = Duration.ofSeconds(30);
		DEFAULT_MAXIMUM_HEADER_SIZE_IN_BYTES = 1_024 * 64;
		DEFAULT_MAXIMUM_REQUEST_BODY_SIZE_IN_BYTES = 1_024L * 1_024L * 10L;
		DEFAULT_READ_BUFFER_SIZE_IN_BYTES = SocketStream.DEFAULT_BUFFER_SIZE_IN_BYTES;
		DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT = 128;
		DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
		DEFAULT_SERVER_NAME = "Gantry";
	}

	@NonNull
	private final BindAddress bindAddress;
	@NonNull
	private final Integer minimumWorkerCount;
	@NonNull
	private final Integer maximumWorkerCount;
	@NonNull
	private final Duration workerIdleTimeout;
	@NonNull
	private final Integer acceptedQueueSize;
	@NonNull
	private final Duration acceptedQueueTimeout;
	@NonNull
	private final Duration connectionTimeout;
	@NonNull
	private final Duration keepAliveTimeout;
	@NonNull
	private final Duration requestHeaderTimeout;
	@NonNull
	private final Integer maximumHeaderSizeInBytes;
	@NonNull
	private final Long maximumRequestBodySizeInBytes;
	@NonNull
	private final Integer readBufferSizeInBytes;
	@NonNull
	private final Integer socketPendingConnectionLimit;
	@NonNull
	private final Duration shutdownTimeout;
	@NonNull
	private final String serverName;
	@NonNull
	private final Boolean tcpNoDelay;
	@NonNull
	private final Boolean reusePort;
	@NonNull
	private final Boolean dropUnderscoreHeaders;
	@NonNull
	private final Boolean peerCredentialsEnabled;
	@NonNull
	private final Boolean peerCredentialsResolveEnabled;
	@Nullable
	private final TlsConfig tlsConfig;

	/**
	 * Acquires a builder for a server listening on the given address.
	 *
	 * @param bindAddress a TCP host and port, or a Unix domain socket
	 * @return the builder
	 */
	@NonNull
	public static Builder withBindAddress(@NonNull BindAddress bindAddress) {
		requireNonNull(bindAddress);
		return new Builder(bindAddress);
	}

	/**
	 * Acquires a builder for a server listening on all interfaces.
	 *
	 * @param port the TCP port, or {@code 0} for an ephemeral port
	 * @return the builder
	 */
	@NonNull
	public static Builder withPort(@NonNull Integer port) {
		requireNonNull(port);
		return new Builder(BindAddress.withPort(port));
	}

	private ServerConfig(@NonNull Builder builder) {
		requireNonNull(builder);

		this.bindAddress = builder.bindAddress;
		this.minimumWorkerCount = builder.minimumWorkerCount != null ? builder.minimumWorkerCount : DEFAULT_MINIMUM_WORKER_COUNT;

		if (builder.maximumWorkerCount != null)
			this.maximumWorkerCount = builder.maximumWorkerCount;
		else
			this.maximumWorkerCount = Math.max(DEFAULT_MAXIMUM_WORKER_COUNT, this.minimumWorkerCount);

		this.workerIdleTimeout = builder.workerIdleTimeout != null ? builder.workerIdleTimeout : DEFAULT_WORKER_IDLE_TIMEOUT;
		this.acceptedQueueSize = builder.acceptedQueueSize != null ? builder.acceptedQueueSize : DEFAULT_ACCEPTED_QUEUE_SIZE;
		this.acceptedQueueTimeout = builder.acceptedQueueTimeout != null ? builder.acceptedQueueTimeout : DEFAULT_ACCEPTED_QUEUE_TIMEOUT;
		this.connectionTimeout = builder.connectionTimeout != null ? builder.connectionTimeout : DEFAULT_CONNECTION_TIMEOUT;
		this.keepAliveTimeout = builder.keepAliveTimeout != null ? builder.keepAliveTimeout : DEFAULT_KEEP_ALIVE_TIMEOUT;
		this.requestHeaderTimeout = builder.requestHeaderTimeout != null ? builder.requestHeaderTimeout : DEFAULT_REQUEST_HEADER_TIMEOUT;
		this.maximumHeaderSizeInBytes = builder.maximumHeaderSizeInBytes != null ? builder.maximumHeaderSizeInBytes : DEFAULT_MAXIMUM_HEADER_SIZE_IN_BYTES;
		this.maximumRequestBodySizeInBytes = builder.maximumRequestBodySizeInBytes != null ? builder.maximumRequestBodySizeInBytes : DEFAULT_MAXIMUM_REQUEST_BODY_SIZE_IN_BYTES;
		this.readBufferSizeInBytes = builder.readBufferSizeInBytes != null ? builder.readBufferSizeInBytes : DEFAULT_READ_BUFFER_SIZE_IN_BYTES;
		this.socketPendingConnectionLimit = builder.socketPendingConnectionLimit != null ? builder.socketPendingConnectionLimit : DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT;
		this.shutdownTimeout = builder.shutdownTimeout != null ? builder.shutdownTimeout : DEFAULT_SHUTDOWN_TIMEOUT;
		this.serverName = builder.serverName != null ? builder.serverName : DEFAULT_SERVER_NAME;
		this.tcpNoDelay = builder.tcpNoDelay != null ? builder.tcpNoDelay : true;
		this.reusePort = builder.reusePort != null ? builder.reusePort : false;
		this.dropUnderscoreHeaders = builder.dropUnderscoreHeaders != null ? builder.dropUnderscoreHeaders : false;
		this.peerCredentialsEnabled = builder.peerCredentialsEnabled != null ? builder.peerCredentialsEnabled : false;
		// Names are resolved from the numeric IDs, so resolution needs the lookup itself
		this.peerCredentialsResolveEnabled = this.peerCredentialsEnabled
				&& (builder.peerCredentialsResolveEnabled != null ? builder.peerCredentialsResolveEnabled : false);
		this.tlsConfig = builder.tlsConfig;

		if (this.minimumWorkerCount < 1)
			throw new IllegalArgumentException("Minimum worker count must be > 0");

		if (this.maximumWorkerCount < this.minimumWorkerCount)
			throw new IllegalArgumentException(format("Maximum worker count (%d) must be >= minimum worker count (%d)",
					this.maximumWorkerCount, this.minimumWorkerCount));

		if (this.acceptedQueueSize < 0)
			throw new IllegalArgumentException("Accepted queue size must be >= 0");

		if (this.maximumHeaderSizeInBytes <= 0)
			throw new IllegalArgumentException("Maximum header size must be > 0");

		if (this.maximumRequestBodySizeInBytes < 0)
			throw new IllegalArgumentException("Maximum request body size must be >= 0");

		if (this.readBufferSizeInBytes <= 0)
			throw new IllegalArgumentException("Read buffer size must be > 0");

		if (this.socketPendingConnectionLimit < 0)
			throw new IllegalArgumentException("Socket pending connection limit must be >= 0");

		requirePositive(this.workerIdleTimeout, "Worker idle timeout");
		requirePositive(this.acceptedQueueTimeout, "Accepted queue timeout");
		requirePositive(this.connectionTimeout, "Connection timeout");
		requirePositive(this.keepAliveTimeout, "Keep-alive timeout");
		requirePositive(this.requestHeaderTimeout, "Request header timeout");

		if (this.shutdownTimeout.isNegative())
			throw new IllegalArgumentException("Shutdown timeout must be >= 0");

		if (this.serverName.contains("\r") || this.serverName.contains("\n"))
			throw new IllegalArgumentException("Server name must not contain CR or LF");

		if (this.tlsConfig != null && this.bindAddress.isUnixDomain())
			throw new IllegalArgumentException("TLS is not supported on Unix domain sockets");
	}

	private static void requirePositive(@NonNull Duration duration,
																			@NonNull String name) {
		if (duration.isNegative() || duration.isZero())
			throw new IllegalArgumentException(format("%s must be > 0", name));
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{bindAddress=%s, workers=%d..%d, tls=%s}", getClass().getSimpleName(), getBindAddress(),
				getMinimumWorkerCount(), getMaximumWorkerCount(), getTlsConfig().isPresent());
	}

	@NonNull
	public BindAddress getBindAddress() {
		return this.bindAddress;
	}

	/**
	 * Workers started eagerly and kept alive even when idle.
	 */
	@NonNull
	public Integer getMinimumWorkerCount() {
		return this.minimumWorkerCount;
	}

	/**
	 * Upper bound on concurrently running workers, and therefore on concurrently handled connections.
	 */
	@NonNull
	public Integer getMaximumWorkerCount() {
		return this.maximumWorkerCount;
	}

	/**
	 * How long a worker above the minimum may wait for work before it exits.
	 */
	@NonNull
	public Duration getWorkerIdleTimeout() {
		return this.workerIdleTimeout;
	}

	/**
	 * Capacity of the queue between the acceptor and the workers. {@code 0} means unbounded.
	 */
	@NonNull
	public Integer getAcceptedQueueSize() {
		return this.acceptedQueueSize;
	}

	@NonNull
	public Duration getAcceptedQueueTimeout() {
		return this.acceptedQueueTimeout;
	}

	/**
	 * How long a fresh connection may take to send the first byte of its first request. Also bounds individual blocking
	 * reads and writes once a request is underway.
	 */
	@NonNull
	public Duration getConnectionTimeout() {
		return this.connectionTimeout;
	}

	/**
	 * How long a kept-alive connection may sit idle between requests.
	 */
	@NonNull
	public Duration getKeepAliveTimeout() {
		return this.keepAliveTimeout;
	}

	/**
	 * Total time allowed for a request line and its headers to arrive, measured from the first byte.
	 */
	@NonNull
	public Duration getRequestHeaderTimeout() {
		return this.requestHeaderTimeout;
	}

	/**
	 * Upper bound on the request line plus header block, and separately on a chunked body's trailers.
	 */
	@NonNull
	public Integer getMaximumHeaderSizeInBytes() {
		return this.maximumHeaderSizeInBytes;
	}

	/**
	 * Upper bound on a request body. {@code 0} means unlimited.
	 */
	@NonNull
	public Long getMaximumRequestBodySizeInBytes() {
		return this.maximumRequestBodySizeInBytes;
	}

	@NonNull
	public Integer getReadBufferSizeInBytes() {
		return this.readBufferSizeInBytes;
	}

	/**
	 * The listen backlog. {@code 0} lets the operating system choose.
	 */
	@NonNull
	public Integer getSocketPendingConnectionLimit() {
		return this.socketPendingConnectionLimit;
	}

	/**
	 * Grace period given to in-flight requests when the server stops.
	 */
	@NonNull
	public Duration getShutdownTimeout() {
		return this.shutdownTimeout;
	}

	/**
	 * Value of the {@code Server} response header. Empty suppresses the header.
	 */
	@NonNull
	public String getServerName() {
		return this.serverName;
	}

	@NonNull
	public Boolean getTcpNoDelay() {
		return this.tcpNoDelay;
	}

	@NonNull
	public Boolean getReusePort() {
		return this.reusePort;
	}

	/**
	 * Should request headers whose names contain an underscore be discarded? Proxies commonly translate {@code -} and
	 * {@code _} into the same variable name, so such headers can be used to spoof ones set by the proxy.
	 */
	@NonNull
	public Boolean getDropUnderscoreHeaders() {
		return this.dropUnderscoreHeaders;
	}

	/**
	 * Should the process, user and group IDs of Unix domain socket peers be looked up and exposed on each
	 * {@link Request}? Ignored for TCP listeners.
	 */
	@NonNull
	public Boolean getPeerCredentialsEnabled() {
		return this.peerCredentialsEnabled;
	}

	/**
	 * Should peer user and group IDs also be resolved to account names? Only honored when
	 * {@link #getPeerCredentialsEnabled()} is.
	 */
	@NonNull
	public Boolean getPeerCredentialsResolveEnabled() {
		return this.peerCredentialsResolveEnabled;
	}

	@NonNull
	public Optional<TlsConfig> getTlsConfig() {
		return Optional.ofNullable(this.tlsConfig);
	}

	/**
	 * Builder used to construct instances of {@link ServerConfig}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final BindAddress bindAddress;
		@Nullable
		private Integer minimumWorkerCount;
		@Nullable
		private Integer maximumWorkerCount;
		@Nullable
		private Duration workerIdleTimeout;
		@Nullable
		private Integer acceptedQueueSize;
		@Nullable
		private Duration acceptedQueueTimeout;
		@Nullable
		private Duration connectionTimeout;
		@Nullable
		private Duration keepAliveTimeout;
		@Nullable
		private Duration requestHeaderTimeout;
		@Nullable
		private Integer maximumHeaderSizeInBytes;
		@Nullable
		private Long maximumRequestBodySizeInBytes;
		@Nullable
		private Integer readBufferSizeInBytes;
		@Nullable
		private Integer socketPendingConnectionLimit;
		@Nullable
		private Duration shutdownTimeout;
		@Nullable
		private String serverName;
		@Nullable
		private Boolean tcpNoDelay;
		@Nullable
		private Boolean reusePort;
		@Nullable
		private Boolean dropUnderscoreHeaders;
		@Nullable
		private Boolean peerCredentialsEnabled;
		@Nullable
		private Boolean peerCredentialsResolveEnabled;
		@Nullable
		private TlsConfig tlsConfig;

		private Builder(@NonNull BindAddress bindAddress) {
			requireNonNull(bindAddress);
			this.bindAddress = bindAddress;
		}

		@NonNull
		public Builder minimumWorkerCount(@Nullable Integer minimumWorkerCount) {
			this.minimumWorkerCount = minimumWorkerCount;
			return this;
		}

		@NonNull
		public Builder maximumWorkerCount(@Nullable Integer maximumWorkerCount) {
			this.maximumWorkerCount = maximumWorkerCount;
			return this;
		}

		@NonNull
		public Builder workerIdleTimeout(@Nullable Duration workerIdleTimeout) {
			this.workerIdleTimeout = workerIdleTimeout;
			return this;
		}

		@NonNull
		public Builder acceptedQueueSize(@Nullable Integer acceptedQueueSize) {
			this.acceptedQueueSize = acceptedQueueSize;
			return this;
		}

		@NonNull
		public Builder acceptedQueueTimeout(@Nullable Duration acceptedQueueTimeout) {
			this.acceptedQueueTimeout = acceptedQueueTimeout;
			return this;
		}

		@NonNull
		public Builder connectionTimeout(@Nullable Duration connectionTimeout) {
			this.connectionTimeout = connectionTimeout;
			return this;
		}

		@NonNull
		public Builder keepAliveTimeout(@Nullable Duration keepAliveTimeout) {
			this.keepAliveTimeout = keepAliveTimeout;
			return this;
		}

		@NonNull
		public Builder requestHeaderTimeout(@Nullable Duration requestHeaderTimeout) {
			this.requestHeaderTimeout = requestHeaderTimeout;
			return this;
		}

		@NonNull
		public Builder maximumHeaderSizeInBytes(@Nullable Integer maximumHeaderSizeInBytes) {
			this.maximumHeaderSizeInBytes = maximumHeaderSizeInBytes;
			return this;
		}

		@NonNull
		public Builder maximumRequestBodySizeInBytes(@Nullable Long maximumRequestBodySizeInBytes) {
			this.maximumRequestBodySizeInBytes = maximumRequestBodySizeInBytes;
			return this;
		}

		@NonNull
		public Builder readBufferSizeInBytes(@Nullable Integer readBufferSizeInBytes) {
			this.readBufferSizeInBytes = readBufferSizeInBytes;
			return this;
		}

		@NonNull
		public Builder socketPendingConnectionLimit(@Nullable Integer socketPendingConnectionLimit) {
			this.socketPendingConnectionLimit = socketPendingConnectionLimit;
			return this;
		}

		@NonNull
		public Builder shutdownTimeout(@Nullable Duration shutdownTimeout) {
			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		@NonNull
		public Builder serverName(@Nullable String serverName) {
			this.serverName = serverName;
			return this;
		}

		@NonNull
		public Builder tcpNoDelay(@Nullable Boolean tcpNoDelay) {
			this.tcpNoDelay = tcpNoDelay;
			return this;
		}

		@NonNull
		public Builder reusePort(@Nullable Boolean reusePort) {
			this.reusePort = reusePort;
			return this;
		}

		@NonNull
		public Builder dropUnderscoreHeaders(@Nullable Boolean dropUnderscoreHeaders) {
			this.dropUnderscoreHeaders = dropUnderscoreHeaders;
			return this;
		}

		@NonNull
		public Builder peerCredentialsEnabled(@Nullable Boolean peerCredentialsEnabled) {
			this.peerCredentialsEnabled = peerCredentialsEnabled;
			return this;
		}

		@NonNull
		public Builder peerCredentialsResolveEnabled(@Nullable Boolean peerCredentialsResolveEnabled) {
			this.peerCredentialsResolveEnabled = peerCredentialsResolveEnabled;
			return this;
		}

		@NonNull
		public Builder tlsConfig(@Nullable TlsConfig tlsConfig) {
			this.tlsConfig = tlsConfig;
			return this;
		}

		@NonNull
		public ServerConfig build() {
			return new ServerConfig(this);
		}
	}
}
