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

import com.gantry.RequestParser.RequestLine;
import com.gantry.exception.GatewayProtocolViolationException;
import com.gantry.exception.HttpProtocolException;
import com.gantry.exception.TlsHandshakeException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.EOFException;
import java.io.IOException;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.Objects.requireNonNullElse;

/**
 * Serves the sequence of requests arriving on one accepted connection.
 * <p>
 * Owned by a single worker while {@link #run()} executes. The pool may call {@link #closeIfIdle()} and {@link #abort()}
 * from another thread during shutdown; both work by closing the transport, which unblocks the worker.
 * <p>
 * No exception escapes {@link #run()}: protocol errors become error responses, gateway failures become {@code 500}
 * (or an aborted connection once the response is underway), and transport failures close the connection silently.
 */
@ThreadSafe
final class HttpConnection implements WorkerPool.Job {
	@NonNull
	private static final Duration LINGER_READ_TIMEOUT;
	@NonNull
	private static final Duration LINGER_TIMEOUT;
	private static final int LINGER_MAXIMUM_BYTES = 256 * 1024;

	static {
		LINGER_READ_TIMEOUT = Duration.ofMillis(250);
		LINGER_TIMEOUT = Duration.ofSeconds(1);
	}

	@NonNull
	private final Long connectionId;
	@NonNull
	private final ServerConfig serverConfig;
	@NonNull
	private final Gateway gateway;
	@Nullable
	private final TlsAdapter tlsAdapter;
	@NonNull
	private final RequestParser requestParser;
	@NonNull
	private final WorkerPool workerPool;
	@NonNull
	private final ServerCounters serverCounters;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final Instant createdAt;
	private final long createdAtNanos;
	@Nullable
	private final SocketAddress remoteAddress;
	// Claimed by whichever of run(), abort() or reject() gets here first
	@NonNull
	private final AtomicBoolean claimed;
	// True only while blocked waiting for the next request
	@NonNull
	private final AtomicBoolean idle;
	@NonNull
	private volatile Transport transport;
	@NonNull
	private volatile ConnectionState state;
	private volatile boolean aborted;
	private boolean tls;
	private int requestCount;
	@Nullable
	private SocketStream socketStream;
	@Nullable
	private ResponseWriter responseWriter;
	@Nullable
	private Integer failureStatusSent;
	@Nullable
	private PeerCredentials peerCredentials;

	HttpConnection(@NonNull Long connectionId,
								 @NonNull Transport transport,
								 @NonNull ServerConfig serverConfig,
								 @NonNull Gateway gateway,
								 @Nullable TlsAdapter tlsAdapter,
								 @NonNull WorkerPool workerPool,
								 @NonNull ServerCounters serverCounters,
								 @NonNull LifecycleObserver lifecycleObserver) {
		requireNonNull(connectionId);
		requireNonNull(transport);
		requireNonNull(serverConfig);
		requireNonNull(gateway);
		requireNonNull(workerPool);
		requireNonNull(serverCounters);
		requireNonNull(lifecycleObserver);

		this.connectionId = connectionId;
		this.transport = transport;
		this.serverConfig = serverConfig;
		this.gateway = gateway;
		this.tlsAdapter = tlsAdapter;
		this.requestParser = new RequestParser(serverConfig.getMaximumHeaderSizeInBytes(),
				serverConfig.getMaximumRequestBodySizeInBytes(), serverConfig.getDropUnderscoreHeaders());
		this.workerPool = workerPool;
		this.serverCounters = serverCounters;
		this.lifecycleObserver = lifecycleObserver;
		this.createdAt = Instant.now();
		this.createdAtNanos = System.nanoTime();
		this.remoteAddress = transport.getRemoteAddress().orElse(null);
		this.claimed = new AtomicBoolean(false);
		this.idle = new AtomicBoolean(false);
		this.state = ConnectionState.PENDING;

		serverCounters.connectionOpened();
	}

	@Override
	public void run() {
		if (!this.claimed.compareAndSet(false, true))
			return;

		ConnectionCloseReason closeReason = ConnectionCloseReason.INTERNAL_ERROR;

		try {
			closeReason = serve();
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.CONNECTION_INTERNAL_ERROR, "An unexpected error occurred while serving a connection")
					.throwable(t)
					.connectionId(getConnectionId())
					.build());
		} finally {
			closeTransport();

			if (this.aborted)
				closeReason = ConnectionCloseReason.SERVER_SHUTDOWN;

			finish(closeReason);
		}
	}

	@Override
	public void closeIfIdle() {
		if (this.idle.compareAndSet(true, false))
			closeTransport();
	}

	@Override
	public void abort() {
		this.aborted = true;

		if (this.claimed.compareAndSet(false, true)) {
			// Never reached a worker
			closeTransport();
			finish(ConnectionCloseReason.SERVER_SHUTDOWN);
		} else {
			closeTransport();
		}
	}

	/**
	 * Turns away a connection the pool would not take. Plain connections get a {@code 503} first.
	 */
	void reject() {
		if (!this.claimed.compareAndSet(false, true))
			return;

		long bytesWritten = 0;

		if (this.tlsAdapter == null) {
			byte[] response = ResponseWriter.simpleResponse(StatusCode.HTTP_503,
					"The server is too busy to accept this connection. Please try again later.", getServerConfig().getServerName());

			try {
				getTransport().write(response, 0, response.length);
				bytesWritten = response.length;
			} catch (IOException e) {
				getServerCounters().socketError();
			}
		}

		closeTransport();
		this.state = ConnectionState.CLOSED;
		getServerCounters().connectionClosed(0, bytesWritten);
	}

	@NonNull
	private ConnectionCloseReason serve() {
		if (this.tlsAdapter != null) {
			ConnectionCloseReason handshakeFailure = performTlsHandshake(this.tlsAdapter);

			if (handshakeFailure != null)
				return handshakeFailure;
		}

		if (getServerConfig().getPeerCredentialsEnabled() && getServerConfig().getBindAddress().isUnixDomain())
			this.peerCredentials = lookUpPeerCredentials();

		SocketStream socketStream = new SocketStream(getTransport(), getServerConfig().getReadBufferSizeInBytes());
		this.socketStream = socketStream;

		while (true) {
			ConnectionCloseReason closeReason = awaitRequest(socketStream, this.requestCount == 0
					? getServerConfig().getConnectionTimeout() : getServerConfig().getKeepAliveTimeout());

			if (closeReason != null)
				return closeReason;

			closeReason = handleRequest(socketStream);

			if (closeReason != null)
				return closeReason;

			this.state = ConnectionState.KEEP_ALIVE;
		}
	}

	@Nullable
	private ConnectionCloseReason performTlsHandshake(@NonNull TlsAdapter tlsAdapter) {
		requireNonNull(tlsAdapter);

		this.state = ConnectionState.TLS_HANDSHAKE;

		if (!(getTransport() instanceof SocketTransport socketTransport))
			throw new IllegalStateException("TLS requires a TCP socket transport");

		try {
			this.transport = tlsAdapter.wrap(socketTransport.getSocket());
			this.tls = true;
			return null;
		} catch (EOFException e) {
			return ConnectionCloseReason.CLIENT_CLOSED;
		} catch (TlsHandshakeException e) {
			if (this.aborted || getWorkerPool().isShuttingDown())
				return ConnectionCloseReason.SERVER_SHUTDOWN;

			getServerCounters().tlsHandshakeFailed();
			notifyObserver(lifecycleObserver -> lifecycleObserver.didFailTlsHandshake(getConnectionId(), e));
			safelyLog(LogEvent.with(LogEventType.TLS_HANDSHAKE_FAILED, format("TLS handshake with %s failed: %s", this.remoteAddress, e.getMessage()))
					.throwable(e)
					.connectionId(getConnectionId())
					.build());
			return ConnectionCloseReason.TLS_HANDSHAKE_FAILED;
		} catch (IOException e) {
			getServerCounters().socketError();
			return ConnectionCloseReason.CONNECTION_ERROR;
		}
	}

	// A failed name lookup keeps the IDs
	@Nullable
	private PeerCredentials lookUpPeerCredentials() {
		PeerCredentials peerCredentials;

		try {
			peerCredentials = getTransport().getPeerCredentials().orElse(null);
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.PEER_CREDENTIALS_UNAVAILABLE, "Unable to read peer credentials")
					.throwable(e)
					.connectionId(getConnectionId())
					.build());
			return null;
		}

		if (peerCredentials == null || !getServerConfig().getPeerCredentialsResolveEnabled())
			return peerCredentials;

		try {
			return peerCredentials.withResolvedNames();
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.PEER_CREDENTIALS_UNAVAILABLE, format("Unable to resolve account names for %s", peerCredentials))
					.throwable(e)
					.connectionId(getConnectionId())
					.build());
			return peerCredentials;
		}
	}

	// Returns null once the first byte of a request is available
	@Nullable
	private ConnectionCloseReason awaitRequest(@NonNull SocketStream socketStream,
																						 @NonNull Duration timeout) {
		this.state = ConnectionState.AWAITING_REQUEST;

		socketStream.setReadDeadline(null);
		socketStream.setReadTimeout(timeout);

		if (socketStream.hasBufferedInput())
			return getWorkerPool().isShuttingDown() ? ConnectionCloseReason.SERVER_SHUTDOWN : null;

		// Shutdown sets its flag before sweeping idle connections, so one of the two sides always notices the other
		this.idle.set(true);

		if (getWorkerPool().isShuttingDown()) {
			this.idle.set(false);
			return ConnectionCloseReason.SERVER_SHUTDOWN;
		}

		int firstByte;

		try {
			firstByte = socketStream.peek();
		} catch (SocketTimeoutException e) {
			return this.idle.compareAndSet(true, false) ? ConnectionCloseReason.IDLE_TIMEOUT : ConnectionCloseReason.SERVER_SHUTDOWN;
		} catch (IOException e) {
			if (!this.idle.compareAndSet(true, false))
				return ConnectionCloseReason.SERVER_SHUTDOWN;

			getServerCounters().socketError();
			return ConnectionCloseReason.CONNECTION_ERROR;
		}

		if (!this.idle.compareAndSet(true, false))
			return ConnectionCloseReason.SERVER_SHUTDOWN;

		return firstByte < 0 ? ConnectionCloseReason.CLIENT_CLOSED : null;
	}

	// Returns null if the connection may be reused
	@Nullable
	private ConnectionCloseReason handleRequest(@NonNull SocketStream socketStream) {
		this.state = ConnectionState.READING_HEADERS;

		Instant receivedAt = Instant.now();
		long receivedAtNanos = System.nanoTime();

		socketStream.setReadTimeout(getServerConfig().getConnectionTimeout());
		socketStream.setReadDeadline(getServerConfig().getRequestHeaderTimeout());

		RequestLine requestLine;
		Headers headers;
		RequestBody requestBody;
		boolean counted = false;

		try {
			requestLine = getRequestParser().parseRequestLine(socketStream);

			if (requestLine == null)
				return ConnectionCloseReason.CLIENT_CLOSED;

			countRequest();
			counted = true;

			int headerBudget = Math.max(0, getServerConfig().getMaximumHeaderSizeInBytes() - requestLine.sizeInBytes());
			headers = getRequestParser().parseHeaders(socketStream, headerBudget);

			this.state = ConnectionState.READING_BODY;

			RequestBody.ContinueSender continueSender = RequestParser.expectsContinue(requestLine, headers)
					? () -> requireNonNull(this.responseWriter).sendContinue() : null;

			requestBody = getRequestParser().createRequestBody(requestLine, headers, socketStream, continueSender);
		} catch (HttpProtocolException e) {
			if (!counted)
				countRequest();

			sendErrorResponse(socketStream, e.getStatusCode(), requireNonNullElse(e.getMessage(), e.getStatusCode().getReasonPhrase()));
			return ConnectionCloseReason.PROTOCOL_ERROR;
		} catch (SocketTimeoutException e) {
			// Something arrived, so the client is mid-request
			writeDirectly(ResponseWriter.simpleResponse(StatusCode.HTTP_408,
					"The server timed out waiting for the request headers.", getServerConfig().getServerName()));
			return ConnectionCloseReason.REQUEST_TIMEOUT;
		} catch (EOFException e) {
			return ConnectionCloseReason.CLIENT_CLOSED;
		} catch (IOException e) {
			getServerCounters().socketError();
			return ConnectionCloseReason.CONNECTION_ERROR;
		} finally {
			socketStream.setReadDeadline(null);
		}

		Request request = Request.withMethod(requestLine.method(), requestLine.target())
				.pathAndQueryString(requestLine.path(), requestLine.queryString())
				.httpVersion(requestLine.httpVersion())
				.headers(headers)
				.body(requestBody)
				.scheme(this.tls ? "https" : "http")
				.remoteAddress(this.remoteAddress)
				.localAddress(getTransport().getLocalAddress().orElse(null))
				.tlsSessionInfo(getTransport().getSslSession().map(TlsSessionInfo::fromSslSession).orElse(null))
				.peerCredentials(this.peerCredentials)
				.connectionId(getConnectionId())
				.receivedAt(receivedAt)
				.build();

		boolean keepAlive = clientPermitsKeepAlive(requestLine.httpVersion(), headers)
				&& !getWorkerPool().isSaturated()
				&& !getWorkerPool().isShuttingDown()
				&& !this.aborted;

		ResponseWriter responseWriter = new ResponseWriter(socketStream, request, getServerConfig().getServerName(),
				keepAlive, getServerConfig().getKeepAliveTimeout());
		this.responseWriter = responseWriter;

		notifyObserver(lifecycleObserver -> lifecycleObserver.willStartRequestHandling(request));

		Throwable failure = null;
		Integer statusSent = null;
		ConnectionCloseReason closeReason = null;

		try {
			writeResponse(request, responseWriter);
		} catch (Throwable t) {
			failure = t;
		}

		if (failure == null) {
			statusSent = responseWriter.getStatusCode();

			if (responseWriter.isCloseRequired())
				closeReason = ConnectionCloseReason.CONNECTION_CLOSE;
		} else {
			closeReason = handleFailure(request, socketStream, responseWriter, failure);
			statusSent = this.failureStatusSent != null ? this.failureStatusSent
					: responseWriter.isCommitted() ? responseWriter.getStatusCode() : null;
			this.failureStatusSent = null;
		}

		Duration duration = Duration.ofNanos(System.nanoTime() - receivedAtNanos);
		Integer finalStatusSent = statusSent;
		Throwable finalFailure = failure;

		notifyObserver(lifecycleObserver -> lifecycleObserver.didFinishRequestHandling(request, finalStatusSent, duration, finalFailure));

		this.responseWriter = null;
		return closeReason;
	}

	private void writeResponse(@NonNull Request request,
														 @NonNull ResponseWriter responseWriter) throws Exception {
		this.state = ConnectionState.DISPATCHING;

		ResponseBody responseBody = getGateway().handle(request, responseWriter);

		if (responseBody == null)
			responseBody = ResponseBody.empty();

		this.state = ConnectionState.WRITING_RESPONSE;

		try {
			responseWriter.applyKnownBodyLength(responseBody.getLength());

			byte[] chunk;

			while ((chunk = responseBody.nextChunk()) != null)
				if (chunk.length > 0)
					responseWriter.write(chunk, 0, chunk.length);

			responseWriter.finish();
		} finally {
			try {
				responseBody.close();
			} catch (Exception e) {
				safelyLog(LogEvent.with(LogEventType.RESPONSE_BODY_CLOSE_FAILED, "Unable to close response body")
						.throwable(e)
						.connectionId(getConnectionId())
						.request(request)
						.build());
			}
		}
	}

	@NonNull
	private ConnectionCloseReason handleFailure(@NonNull Request request,
																							@NonNull SocketStream socketStream,
																							@NonNull ResponseWriter responseWriter,
																							@NonNull Throwable failure) {
		// The peer went away or stalled; there is nobody left to tell
		if (socketStream.isBroken()) {
			getServerCounters().socketError();
			return ConnectionCloseReason.CONNECTION_ERROR;
		}

		if (failure instanceof EOFException && request.getBody().isFailed())
			return ConnectionCloseReason.CLIENT_CLOSED;

		if (failure instanceof HttpProtocolException httpProtocolException) {
			if (!responseWriter.isCommitted())
				sendFailureResponse(socketStream, httpProtocolException.getStatusCode(),
						requireNonNullElse(failure.getMessage(), httpProtocolException.getStatusCode().getReasonPhrase()));

			return ConnectionCloseReason.PROTOCOL_ERROR;
		}

		if (failure instanceof GatewayProtocolViolationException) {
			safelyLog(LogEvent.with(LogEventType.GATEWAY_PROTOCOL_VIOLATION, format("Gateway violated the response protocol: %s", failure.getMessage()))
					.throwable(failure)
					.connectionId(getConnectionId())
					.request(request)
					.build());
		} else {
			safelyLog(LogEvent.with(LogEventType.GATEWAY_FAILED, format("An error occurred while handling %s %s", request.getMethod(), request.getTarget()))
					.throwable(failure)
					.connectionId(getConnectionId())
					.request(request)
					.build());
		}

		if (!responseWriter.isCommitted())
			sendFailureResponse(socketStream, StatusCode.HTTP_500, "The server encountered an internal error.");

		return ConnectionCloseReason.GATEWAY_ERROR;
	}

	private void sendFailureResponse(@NonNull SocketStream socketStream,
																	 @NonNull StatusCode statusCode,
																	 @NonNull String message) {
		if (sendErrorResponse(socketStream, statusCode, message))
			this.failureStatusSent = statusCode.getStatusCode();
	}

	// Returns true if the response made it onto the wire
	private boolean sendErrorResponse(@NonNull SocketStream socketStream,
																		@NonNull StatusCode statusCode,
																		@NonNull String message) {
		if (socketStream.isBroken())
			return false;

		try {
			socketStream.write(ResponseWriter.simpleResponse(statusCode, message, getServerConfig().getServerName()));
			socketStream.flush();
		} catch (IOException e) {
			getServerCounters().socketError();
			return false;
		}

		lingerBeforeClose();
		return true;
	}

	// For use once the stream is unusable for reads; bypasses its buffer
	private void writeDirectly(@NonNull byte[] response) {
		try {
			getTransport().write(response, 0, response.length);
		} catch (IOException e) {
			getServerCounters().socketError();
		}
	}

	/**
	 * Half-closes and reads off whatever the client already sent, so closing does not reset the connection before the
	 * client has read the error response.
	 */
	private void lingerBeforeClose() {
		Transport transport = getTransport();
		byte[] scratch = new byte[8 * 1024];
		long deadlineNanos = System.nanoTime() + LINGER_TIMEOUT.toNanos();
		int total = 0;

		try {
			transport.shutdownOutput();

			while (total < LINGER_MAXIMUM_BYTES && System.nanoTime() < deadlineNanos) {
				int count = transport.read(scratch, 0, scratch.length, LINGER_READ_TIMEOUT);

				if (count < 0)
					break;

				total += count;
			}
		} catch (IOException e) {
			// Timed out or reset; the connection is being closed regardless
			this.state = ConnectionState.CLOSED;
		}
	}

	private void countRequest() {
		this.requestCount++;
		getServerCounters().requestRead();
	}

	@NonNull
	private static Boolean clientPermitsKeepAlive(@NonNull HttpVersion httpVersion,
																								@NonNull Headers headers) {
		if (headers.containsToken("Connection", "close"))
			return false;

		if (httpVersion.isPersistentByDefault())
			return true;

		return headers.containsToken("Connection", "keep-alive");
	}

	private void closeTransport() {
		try {
			getTransport().close();
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.CONNECTION_CLOSE_FAILED, "Unable to close connection")
					.throwable(e)
					.connectionId(getConnectionId())
					.build());
		}
	}

	private void finish(@NonNull ConnectionCloseReason closeReason) {
		this.state = ConnectionState.CLOSED;

		SocketStream socketStream = this.socketStream;
		long bytesRead = socketStream == null ? 0 : socketStream.getBytesRead();
		long bytesWritten = socketStream == null ? 0 : socketStream.getBytesWritten();

		getServerCounters().connectionClosed(bytesRead, bytesWritten);

		ConnectionSummary connectionSummary = new ConnectionSummary(getConnectionId(), this.remoteAddress, this.createdAt,
				Duration.ofNanos(System.nanoTime() - this.createdAtNanos), this.requestCount, bytesRead, bytesWritten, closeReason, this.tls);

		notifyObserver(lifecycleObserver -> lifecycleObserver.didCloseConnection(connectionSummary));
	}

	private void notifyObserver(@NonNull Consumer<LifecycleObserver> notification) {
		try {
			notification.accept(getLifecycleObserver());
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED, "Lifecycle observer threw an exception")
					.throwable(t)
					.connectionId(getConnectionId())
					.build());
		}
	}

	private void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// Not much else we can do here but dump to stderr
			throwable.printStackTrace(System.err);
		}
	}

	@NonNull
	Long getConnectionId() {
		return this.connectionId;
	}

	@NonNull
	ConnectionState getState() {
		return this.state;
	}

	@NonNull
	Integer getRequestCount() {
		return this.requestCount;
	}

	@NonNull
	private Transport getTransport() {
		return this.transport;
	}

	@NonNull
	private ServerConfig getServerConfig() {
		return this.serverConfig;
	}

	@NonNull
	private Gateway getGateway() {
		return this.gateway;
	}

	@NonNull
	private RequestParser getRequestParser() {
		return this.requestParser;
	}

	@NonNull
	private WorkerPool getWorkerPool() {
		return this.workerPool;
	}

	@NonNull
	private ServerCounters getServerCounters() {
		return this.serverCounters;
	}

	@NonNull
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}
}
