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

import javax.net.ssl.SSLSession;
import java.io.Closeable;
import java.io.IOException;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Optional;

/**
 * The raw byte pipe underneath a {@link SocketStream}: a TCP socket, a TLS socket, or a Unix domain socket.
 * <p>
 * Implementations are owned by exactly one connection at a time. {@link #close()} is the only method that may be invoked
 * from another thread, in order to unblock a pending read or write during shutdown.
 */
interface Transport extends Closeable {
	/**
	 * Blocks until at least one byte is available, the peer closes its side, or the timeout expires.
	 *
	 * @return the number of bytes read, or {@code -1} on end of stream
	 * @throws java.net.SocketTimeoutException if the timeout expires first
	 */
	int read(@NonNull byte[] buffer,
					 int offset,
					 int length,
					 @Nullable Duration timeout) throws IOException;

	void write(@NonNull byte[] buffer,
						 int offset,
						 int length) throws IOException;

	@NonNull
	Optional<SocketAddress> getRemoteAddress();

	@NonNull
	Optional<SocketAddress> getLocalAddress();

	/**
	 * Half-closes the write side so the peer sees end of stream while unread input can still be drained.
	 */
	void shutdownOutput() throws IOException;

	@NonNull
	default Optional<SSLSession> getSslSession() {
		return Optional.empty();
	}

	/**
	 * Asks the kernel who is on the other end. Only Unix domain sockets can answer.
	 *
	 * @throws IOException if the socket supports the lookup but it failed
	 */
	@NonNull
	default Optional<PeerCredentials> getPeerCredentials() throws IOException {
		return Optional.empty();
	}
}
