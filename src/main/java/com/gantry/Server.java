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
import java.net.SocketAddress;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * An embeddable HTTP/1.x server that hands each request to a {@link Gateway}.
 * <p>
 * For example:
 * <pre>{@code  ServerConfig serverConfig = ServerConfig.withPort(8080).build();
 * Gateway gateway = Gateway.withResponder(request ->
 *   Response.withStatusCode(200).body("hello").build());
 *
 * try (Server server = Server.withConfig(serverConfig, gateway).build()) {
 *   server.start();
 *   // ...
 * }}</pre>
 * <p>
 * Instances can be acquired via the {@link #withConfig(ServerConfig, Gateway)} builder factory method.
 */
public interface Server extends AutoCloseable {
	/**
	 * Binds the listening socket and starts accepting connections.
	 * <p>
	 * If the server is already started, no action is taken.
	 *
	 * @throws java.io.UncheckedIOException if the socket cannot be bound
	 */
	void start();

	/**
	 * Stops accepting connections, lets in-flight requests finish within the configured shutdown timeout, then closes
	 * everything that remains.
	 * <p>
	 * If the server is already stopped, no action is taken.
	 */
	void stop();

	@NonNull
	Boolean isStarted();

	/**
	 * The address the server is listening on, with any ephemeral port resolved.
	 *
	 * @return the bound address, or {@link Optional#empty()} if the server is not started
	 */
	@NonNull
	Optional<SocketAddress> getBoundAddress();

	/**
	 * A snapshot of the server's counters. Counters reset on each {@link #start()}.
	 *
	 * @return the current statistics
	 */
	@NonNull
	ServerStatistics getStatistics();

	@NonNull
	ServerConfig getServerConfig();

	/**
	 * {@link AutoCloseable}-enabled synonym for {@link #stop()}.
	 */
	@Override
	default void close() {
		stop();
	}

	/**
	 * Acquires a builder for {@link Server} instances.
	 *
	 * @param serverConfig listening address, limits and timeouts
	 * @param gateway      the application entry point invoked for every request
	 * @return the builder
	 */
	@NonNull
	static Builder withConfig(@NonNull ServerConfig serverConfig,
														@NonNull Gateway gateway) {
		requireNonNull(serverConfig);
		requireNonNull(gateway);

		return new Builder(serverConfig, gateway);
	}

	/**
	 * Builder used to construct instances of {@link Server} via {@link Server#withConfig(ServerConfig, Gateway)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	final class Builder {
		@NonNull
		final ServerConfig serverConfig;
		@NonNull
		final Gateway gateway;
		@Nullable
		LifecycleObserver lifecycleObserver;

		private Builder(@NonNull ServerConfig serverConfig,
										@NonNull Gateway gateway) {
			requireNonNull(serverConfig);
			requireNonNull(gateway);

			this.serverConfig = serverConfig;
			this.gateway = gateway;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public Server build() {
			return new DefaultServer(this);
		}
	}
}
