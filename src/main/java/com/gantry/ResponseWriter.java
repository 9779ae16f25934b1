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

import com.gantry.exception.GatewayProtocolViolationException;
import com.gantry.exception.HttpProtocolException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.OptionalLong;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Serializes one response onto a {@link SocketStream}, acting as the {@link ResponseStarter} and {@link BodyWriter} handed
 * to a {@link Gateway}.
 * <p>
 * Headers are held back until the first body write or {@link #finish()}. At that point the framing is fixed:
 * {@code Content-Length} if the gateway declared one, chunked encoding for HTTP/1.1, otherwise the end of the body is
 * signalled by closing the connection. If the connection is to be kept alive, any unread request body is drained first.
 */
@NotThreadSafe
final class ResponseWriter implements ResponseStarter, BodyWriter {
	@NonNull
	private static final DateTimeFormatter HTTP_DATE_FORMATTER;
	@NonNull
	private static final byte[] CONTINUE_RESPONSE;

	static {
		HTTP_DATE_FORMATTER = DateTimeFormatter.RFC_1123_DATE_TIME;
		CONTINUE_RESPONSE = "HTTP/1.1 100 Continue\r\n\r\n".getBytes(StandardCharsets.ISO_8859_1);
	}

	@NonNull
	private final SocketStream socketStream;
	@NonNull
	private final Request request;
	@NonNull
	private final String serverName;
	@NonNull
	private final Duration keepAliveTimeout;
	private final boolean keepAlive;
	private boolean closeConnection;
	@Nullable
	private Integer statusCode;
	@Nullable
	private String reasonPhrase;
	private Headers.@Nullable Builder headers;
	private boolean headersSent;
	private boolean framingFixed;
	private boolean chunked;
	private boolean bodySuppressed;
	@Nullable
	private Long remainingBytesOut;
	private long bodyBytesWritten;

	/**
	 * @param keepAlive whether the connection should survive this response, as far as the request and server policy are
	 *                  concerned. The response itself may still force a close
	 */
	ResponseWriter(@NonNull SocketStream socketStream,
								 @NonNull Request request,
								 @NonNull String serverName,
								 @NonNull Boolean keepAlive,
								 @NonNull Duration keepAliveTimeout) {
		requireNonNull(socketStream);
		requireNonNull(request);
		requireNonNull(serverName);
		requireNonNull(keepAlive);
		requireNonNull(keepAliveTimeout);

		this.socketStream = socketStream;
		this.request = request;
		this.serverName = serverName;
		this.keepAlive = keepAlive;
		this.closeConnection = !keepAlive;
		this.keepAliveTimeout = keepAliveTimeout;
	}

	@NonNull
	@Override
	public BodyWriter startResponse(@NonNull Integer statusCode,
																	@Nullable String reasonPhrase,
																	@NonNull Headers headers,
																	@Nullable Throwable error) {
		requireNonNull(statusCode);
		requireNonNull(headers);

		if (isStarted()) {
			if (error == null)
				throw new GatewayProtocolViolationException("startResponse was called a second time without an error indicator");

			if (this.headersSent)
				throw new GatewayProtocolViolationException("Response headers were already sent when the gateway reported an error", error);
		}

		if (statusCode < 100 || statusCode > 999)
			throw new GatewayProtocolViolationException(format("Illegal status code %d", statusCode));

		if (reasonPhrase != null && (reasonPhrase.indexOf('\r') >= 0 || reasonPhrase.indexOf('\n') >= 0))
			throw new GatewayProtocolViolationException("Reason phrase must not contain CR or LF");

		for (Headers.Entry entry : headers.getEntries()) {
			if (!RequestParser.isToken(entry.name()))
				throw new GatewayProtocolViolationException(format("Illegal response header name '%s'", entry.name()));

			if (entry.value().indexOf('\r') >= 0 || entry.value().indexOf('\n') >= 0)
				throw new GatewayProtocolViolationException(format("Response header '%s' must not contain CR or LF", entry.name()));
		}

		this.statusCode = statusCode;
		this.reasonPhrase = reasonPhrase;
		this.headers = headers.copy();
		this.framingFixed = false;
		this.chunked = false;
		this.bodySuppressed = false;
		this.remainingBytesOut = null;
		this.closeConnection = !this.keepAlive;

		return this;
	}

	@Override
	public void write(@NonNull byte[] bytes,
										int offset,
										int length) throws IOException {
		requireNonNull(bytes);

		if (!isStarted())
			throw new GatewayProtocolViolationException("Response body was written before startResponse was called");

		fixFraming();

		if (this.remainingBytesOut != null && length > this.remainingBytesOut)
			throw new GatewayProtocolViolationException(format("Response body exceeds its declared Content-Length by %d bytes",
					length - this.remainingBytesOut));

		commitHeaders();

		if (this.remainingBytesOut != null)
			this.remainingBytesOut -= length;

		if (this.bodySuppressed || length == 0)
			return;

		if (this.chunked)
			ChunkedEncoding.writeChunk(this.socketStream, bytes, offset, length);
		else
			this.socketStream.write(bytes, offset, length);

		this.bodyBytesWritten += length;
	}

	@Override
	public void flush() throws IOException {
		if (isStarted())
			commitHeaders();

		this.socketStream.flush();
	}

	/**
	 * Adds a {@code Content-Length} from a body whose size is known up front, unless the gateway already framed it.
	 */
	void applyKnownBodyLength(@NonNull OptionalLong length) {
		requireNonNull(length);

		if (this.framingFixed || this.headers == null || length.isEmpty())
			return;

		if (!this.headers.contains("Content-Length") && !this.headers.contains("Transfer-Encoding")
				&& StatusCode.permitsResponseBody(requireNonNull(this.statusCode)))
			this.headers.add("Content-Length", String.valueOf(length.getAsLong()));
	}

	/**
	 * Completes the response: sends headers if still pending, terminates chunked framing and flushes.
	 */
	void finish() throws IOException {
		if (!isStarted())
			throw new GatewayProtocolViolationException("Gateway returned without calling startResponse");

		commitHeaders();

		if (this.chunked && !this.bodySuppressed)
			ChunkedEncoding.writeLastChunk(this.socketStream);

		// A short body leaves the peer waiting for bytes that will never come
		if (this.remainingBytesOut != null && this.remainingBytesOut > 0 && !this.bodySuppressed)
			this.closeConnection = true;

		this.socketStream.flush();
	}

	/**
	 * Sends {@code 100 Continue}, unless the final response is already on its way.
	 */
	void sendContinue() throws IOException {
		if (this.headersSent)
			return;

		this.socketStream.write(CONTINUE_RESPONSE);
		this.socketStream.flush();
	}

	private void fixFraming() {
		if (this.framingFixed)
			return;

		this.framingFixed = true;

		Headers.Builder headers = requireNonNull(this.headers);
		int statusCode = requireNonNull(this.statusCode);

		this.bodySuppressed = this.request.getMethod().equals("HEAD") || !StatusCode.permitsResponseBody(statusCode);

		Headers snapshot = headers.build();

		if (snapshot.containsToken("Connection", "close"))
			this.closeConnection = true;

		if (!StatusCode.permitsResponseBody(statusCode)) {
			headers.remove("Transfer-Encoding");
			return;
		}

		String contentLength = snapshot.getFirst("Content-Length").orElse(null);

		// Transfer-Encoding overrides Content-Length, and the connection is not reused
		if (contentLength != null && snapshot.contains("Transfer-Encoding")) {
			headers.remove("Content-Length");
			this.closeConnection = true;
			contentLength = null;
		}

		if (contentLength != null) {
			try {
				this.remainingBytesOut = Long.parseLong(contentLength.trim());
			} catch (NumberFormatException e) {
				throw new GatewayProtocolViolationException(format("Illegal response Content-Length '%s'", contentLength), e);
			}

			if (this.remainingBytesOut < 0)
				throw new GatewayProtocolViolationException(format("Illegal response Content-Length '%s'", contentLength));

			return;
		}

		if (snapshot.contains("Transfer-Encoding")) {
			if (snapshot.containsToken("Transfer-Encoding", "chunked") && this.request.getHttpVersion() == HttpVersion.HTTP_1_1)
				this.chunked = true;
			else
				this.closeConnection = true;

			return;
		}

		if (this.request.getMethod().equals("HEAD"))
			return;

		if (this.request.getHttpVersion() == HttpVersion.HTTP_1_1) {
			this.chunked = true;
			headers.add("Transfer-Encoding", "chunked");
		} else {
			this.closeConnection = true;
		}
	}

	private void commitHeaders() throws IOException {
		if (this.headersSent)
			return;

		fixFraming();

		Headers.Builder headers = requireNonNull(this.headers);
		int statusCode = requireNonNull(this.statusCode);
		RequestBody requestBody = this.request.getBody();

		// The next request can only be parsed once this one's body is out of the way
		if (!this.closeConnection && !requestBody.isFullyConsumed()) {
			if (requestBody.isAwaitingContinue() || requestBody.isFailed()) {
				this.closeConnection = true;
			} else {
				try {
					requestBody.drain();
				} catch (IOException | HttpProtocolException e) {
					// The stream is no longer aligned on a request boundary, so this response is the last one
					this.closeConnection = true;
				}
			}
		}

		if (this.closeConnection) {
			headers.set("Connection", "close");
		} else if (this.request.getHttpVersion() == HttpVersion.HTTP_1_0) {
			headers.set("Connection", "Keep-Alive");

			if (!headers.contains("Keep-Alive"))
				headers.add("Keep-Alive", format("timeout=%d", Math.max(1L, this.keepAliveTimeout.toSeconds())));
		}

		if (!headers.contains("Date"))
			headers.add("Date", HTTP_DATE_FORMATTER.format(ZonedDateTime.now(ZoneOffset.UTC)));

		if (!headers.contains("Server") && !this.serverName.isEmpty())
			headers.add("Server", this.serverName);

		String reasonPhrase = this.reasonPhrase != null ? this.reasonPhrase
				: StatusCode.fromStatusCode(statusCode).map(StatusCode::getReasonPhrase).orElse("");

		ByteArrayOutputStream head = new ByteArrayOutputStream(256);
		writeAscii(head, format("HTTP/1.1 %d %s\r\n", statusCode, reasonPhrase));

		for (Headers.Entry entry : headers.build().getEntries())
			writeAscii(head, entry.name() + ": " + entry.value() + "\r\n");

		writeAscii(head, "\r\n");

		this.headersSent = true;
		this.socketStream.write(head.toByteArray());
	}

	/**
	 * Renders a complete, connection-closing plaintext response, used for errors the gateway never sees.
	 */
	@NonNull
	static byte[] simpleResponse(@NonNull StatusCode statusCode,
															 @NonNull String message,
															 @NonNull String serverName) {
		requireNonNull(statusCode);
		requireNonNull(message);
		requireNonNull(serverName);

		byte[] body = message.getBytes(StandardCharsets.UTF_8);
		ByteArrayOutputStream response = new ByteArrayOutputStream(256 + body.length);

		writeAscii(response, format("HTTP/1.1 %d %s\r\n", statusCode.getStatusCode(), statusCode.getReasonPhrase()));
		writeAscii(response, "Content-Type: text/plain; charset=utf-8\r\n");
		writeAscii(response, format("Content-Length: %d\r\n", body.length));
		writeAscii(response, "Connection: close\r\n");
		writeAscii(response, "Date: " + HTTP_DATE_FORMATTER.format(ZonedDateTime.now(ZoneOffset.UTC)) + "\r\n");

		if (!serverName.isEmpty())
			writeAscii(response, "Server: " + serverName + "\r\n");

		writeAscii(response, "\r\n");
		response.write(body, 0, body.length);

		return response.toByteArray();
	}

	private static void writeAscii(@NonNull ByteArrayOutputStream outputStream,
																 @NonNull String string) {
		byte[] bytes = string.getBytes(StandardCharsets.ISO_8859_1);
		outputStream.write(bytes, 0, bytes.length);
	}

	@NonNull
	Boolean isStarted() {
		return this.statusCode != null;
	}

	/**
	 * Have any bytes of the final response been handed to the socket?
	 */
	@NonNull
	Boolean isCommitted() {
		return this.headersSent;
	}

	@NonNull
	Boolean isCloseRequired() {
		return this.closeConnection;
	}

	@Nullable
	Integer getStatusCode() {
		return this.statusCode;
	}

	@NonNull
	Long getBodyBytesWritten() {
		return this.bodyBytesWritten;
	}
}
