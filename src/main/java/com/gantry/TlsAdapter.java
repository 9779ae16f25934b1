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

import com.gantry.exception.TlsHandshakeException;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;

import static java.util.Objects.requireNonNull;

/**
 * Performs the server side of a TLS handshake on an accepted socket.
 * <p>
 * The first byte is inspected before the handshake starts: anything other than a TLS handshake record means the client
 * is speaking plain HTTP, and it is answered with a plaintext {@code 400} instead of TLS alert noise.
 */
@ThreadSafe
final class TlsAdapter {
	private static final int TLS_HANDSHAKE_RECORD_TYPE = 0x16;
	private static final int PLAIN_HTTP_LINGER_READ_TIMEOUT_MILLIS = 250;
	private static final int PLAIN_HTTP_LINGER_MAXIMUM_BYTES = 64 * 1024;
	@NonNull
	private static final String PLAIN_HTTP_MESSAGE;

	static {
		PLAIN_HTTP_MESSAGE = "The client sent a plain HTTP request, but this server only speaks HTTPS on this port.";
	}

	@NonNull
	private final TlsConfig tlsConfig;
	@NonNull
	private final SSLSocketFactory sslSocketFactory;
	@NonNull
	private final String serverName;

	TlsAdapter(@NonNull TlsConfig tlsConfig,
						 @NonNull String serverName) {
		requireNonNull(tlsConfig);
		requireNonNull(serverName);

		SSLContext sslContext = tlsConfig.createSslContext();

		this.tlsConfig = tlsConfig;
		this.sslSocketFactory = sslContext.getSocketFactory();
		this.serverName = serverName;
	}

	/**
	 * Completes a handshake on {@code rawSocket} and returns a transport over the secured socket.
	 * <p>
	 * On failure the caller still owns {@code rawSocket} and must close it.
	 *
	 * @throws EOFException          if the client disconnected before sending anything
	 * @throws TlsHandshakeException if the client spoke plain HTTP or the handshake failed
	 */
	@NonNull
	SocketTransport wrap(@NonNull Socket rawSocket) throws IOException {
		requireNonNull(rawSocket);

		int handshakeTimeoutMillis = (int) Math.max(1L, Math.min(Integer.MAX_VALUE, this.tlsConfig.getHandshakeTimeout().toMillis()));
		rawSocket.setSoTimeout(handshakeTimeoutMillis);

		int firstByte;

		try {
			firstByte = rawSocket.getInputStream().read();
		} catch (SocketTimeoutException e) {
			throw new TlsHandshakeException("Timed out waiting for the TLS client hello", e);
		}

		if (firstByte < 0)
			throw new EOFException("Client disconnected before the TLS handshake");

		if (firstByte != TLS_HANDSHAKE_RECORD_TYPE) {
			rejectPlainHttp(rawSocket);
			throw new TlsHandshakeException("Client sent plain HTTP to a TLS port");
		}

		SSLSocket sslSocket = (SSLSocket) this.sslSocketFactory.createSocket(rawSocket,
				new ByteArrayInputStream(new byte[]{(byte) firstByte}), true);
		sslSocket.setUseClientMode(false);

		this.tlsConfig.getEnabledProtocols().ifPresent(protocols -> sslSocket.setEnabledProtocols(protocols.toArray(new String[0])));
		this.tlsConfig.getEnabledCipherSuites().ifPresent(cipherSuites -> sslSocket.setEnabledCipherSuites(cipherSuites.toArray(new String[0])));

		TlsConfig.ClientAuthentication clientAuthentication = this.tlsConfig.getClientAuthentication();

		if (clientAuthentication == TlsConfig.ClientAuthentication.REQUIRED)
			sslSocket.setNeedClientAuth(true);
		else if (clientAuthentication == TlsConfig.ClientAuthentication.OPTIONAL)
			sslSocket.setWantClientAuth(true);

		try {
			sslSocket.startHandshake();
		} catch (IOException e) {
			throw new TlsHandshakeException("TLS handshake failed", e);
		}

		// Per-read timeouts are managed by the transport from here on
		sslSocket.setSoTimeout(0);

		return new SocketTransport(sslSocket);
	}

	private void rejectPlainHttp(@NonNull Socket rawSocket) throws IOException {
		byte[] response = ResponseWriter.simpleResponse(StatusCode.HTTP_400, PLAIN_HTTP_MESSAGE, this.serverName);
		OutputStream outputStream = rawSocket.getOutputStream();
		outputStream.write(response);
		outputStream.flush();

		// Read off the rest of the request so closing does not reset the connection under the response
		rawSocket.shutdownOutput();
		rawSocket.setSoTimeout(PLAIN_HTTP_LINGER_READ_TIMEOUT_MILLIS);

		InputStream inputStream = rawSocket.getInputStream();
		byte[] scratch = new byte[4 * 1024];
		int total = 0;

		try {
			int count;

			while (total < PLAIN_HTTP_LINGER_MAXIMUM_BYTES && (count = inputStream.read(scratch)) >= 0)
				total += count;
		} catch (SocketTimeoutException e) {
			rawSocket.setSoTimeout(0);
		}
	}
}
