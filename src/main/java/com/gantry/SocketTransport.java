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
import org.newsclub.net.unix.AFUNIXSocket;
import org.newsclub.net.unix.AFUNIXSocketCredentials;

import javax.annotation.concurrent.NotThreadSafe;
import javax.net.ssl.SSLSession;
import javax.net.ssl.SSLSocket;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * {@link Transport} over a blocking {@link Socket}: a TCP socket, an {@link SSLSocket} once the TLS handshake
 * completes, or an {@link AFUNIXSocket} accepted from a Unix domain listener.
 */
@NotThreadSafe
final class SocketTransport implements Transport {
	@NonNull
	private final Socket socket;
	@NonNull
	private final InputStream inputStream;
	@NonNull
	private final OutputStream outputStream;
	// The SO_TIMEOUT currently applied to the socket, to avoid a syscall per read
	private int appliedTimeoutMillis;

	SocketTransport(@NonNull Socket socket) throws IOException {
		requireNonNull(socket);

		this.socket = socket;
		this.inputStream = socket.getInputStream();
		this.outputStream = socket.getOutputStream();
		this.appliedTimeoutMillis = socket.getSoTimeout();
	}

	@Override
	public int read(@NonNull byte[] buffer,
									int offset,
									int length,
									@Nullable Duration timeout) throws IOException {
		requireNonNull(buffer);

		int timeoutMillis = timeout == null ? 0 : (int) Math.max(1L, Math.min(Integer.MAX_VALUE, timeout.toMillis()));

		if (timeoutMillis != this.appliedTimeoutMillis) {
			getSocket().setSoTimeout(timeoutMillis);
			this.appliedTimeoutMillis = timeoutMillis;
		}

		return this.inputStream.read(buffer, offset, length);
	}

	@Override
	public void write(@NonNull byte[] buffer,
										int offset,
										int length) throws IOException {
		requireNonNull(buffer);
		this.outputStream.write(buffer, offset, length);
	}

	@NonNull
	@Override
	public Optional<SocketAddress> getRemoteAddress() {
		return Optional.ofNullable(getSocket().getRemoteSocketAddress());
	}

	@NonNull
	@Override
	public Optional<SocketAddress> getLocalAddress() {
		return Optional.ofNullable(getSocket().getLocalSocketAddress());
	}

	@NonNull
	@Override
	public Optional<SSLSession> getSslSession() {
		if (getSocket() instanceof SSLSocket sslSocket)
			return Optional.ofNullable(sslSocket.getSession());

		return Optional.empty();
	}

	@NonNull
	@Override
	public Optional<PeerCredentials> getPeerCredentials() throws IOException {
		if (!(getSocket() instanceof AFUNIXSocket unixSocket))
			return Optional.empty();

		AFUNIXSocketCredentials credentials = unixSocket.getPeerCredentials();

		if (credentials == null)
			return Optional.empty();

		// The native layer reports -1 for anything the platform does not provide
		return Optional.of(PeerCredentials.withIds(credentials.getPid() < 0 ? null : credentials.getPid(),
				credentials.getUid() < 0 ? null : credentials.getUid(),
				credentials.getGid() < 0 ? null : credentials.getGid()));
	}

	@Override
	public void shutdownOutput() throws IOException {
		// TLS sockets cannot half-close without ending the session
		if (!(getSocket() instanceof SSLSocket) && !getSocket().isOutputShutdown())
			getSocket().shutdownOutput();
	}

	@Override
	public void close() throws IOException {
		getSocket().close();
	}

	@NonNull
	Socket getSocket() {
		return this.socket;
	}
}
