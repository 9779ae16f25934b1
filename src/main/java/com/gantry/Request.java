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
import java.time.Instant;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A parsed HTTP request, handed to a {@link Gateway}.
 * <p>
 * A fresh instance is created for every request on a connection. Its {@link #getBody() body} reads directly from the
 * connection, so instances must not be used once the gateway has returned.
 * <p>
 * The server builds these itself; the {@link #withMethod(String, String)} builder exists for exercising gateways
 * off-network.
 */
@NotThreadSafe
public final class Request {
	@NonNull
	private final String method;
	@NonNull
	private final String target;
	@NonNull
	private final String path;
	@Nullable
	private final String queryString;
	@NonNull
	private final HttpVersion httpVersion;
	@NonNull
	private final Headers headers;
	@NonNull
	private final RequestBody body;
	@NonNull
	private final String scheme;
	@Nullable
	private final SocketAddress remoteAddress;
	@Nullable
	private final SocketAddress localAddress;
	@Nullable
	private final TlsSessionInfo tlsSessionInfo;
	@Nullable
	private final PeerCredentials peerCredentials;
	@NonNull
	private final String mountPath;
	@NonNull
	private final Long connectionId;
	@NonNull
	private final Instant receivedAt;

	/**
	 * Acquires a builder for {@link Request} instances.
	 *
	 * @param method the request method, for example {@code GET}
	 * @param target the request target as it would appear on the request line, for example {@code /widgets?color=red}
	 * @return the builder
	 */
	@NonNull
	public static Builder withMethod(@NonNull String method,
																	 @NonNull String target) {
		requireNonNull(method);
		requireNonNull(target);

		return new Builder(method, target);
	}

	private Request(@NonNull Builder builder) {
		requireNonNull(builder);

		this.method = builder.method;
		this.target = builder.target;

		if (builder.path != null) {
			this.path = builder.path;
			this.queryString = builder.queryString;
		} else {
			int queryIndex = builder.target.indexOf('?');
			this.path = queryIndex >= 0 ? builder.target.substring(0, queryIndex) : builder.target;
			this.queryString = queryIndex >= 0 ? builder.target.substring(queryIndex + 1) : null;
		}

		this.httpVersion = builder.httpVersion != null ? builder.httpVersion : HttpVersion.HTTP_1_1;
		this.headers = builder.headers != null ? builder.headers : Headers.empty();
		this.body = builder.body != null ? builder.body : RequestBody.empty();
		this.scheme = builder.scheme != null ? builder.scheme : "http";
		this.remoteAddress = builder.remoteAddress;
		this.localAddress = builder.localAddress;
		this.tlsSessionInfo = builder.tlsSessionInfo;
		this.peerCredentials = builder.peerCredentials;
		this.mountPath = builder.mountPath != null ? builder.mountPath : "";
		this.connectionId = builder.connectionId != null ? builder.connectionId : 0L;
		this.receivedAt = builder.receivedAt != null ? builder.receivedAt : Instant.now();
	}

	/**
	 * Acquires a builder seeded with this request's values, for adapters that hand a rewritten request to another
	 * gateway.
	 *
	 * @return a builder copy of this request
	 */
	@NonNull
	public Builder copy() {
		return new Builder(this);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{method=%s, target=%s, httpVersion=%s, connectionId=%s}", getClass().getSimpleName(),
				getMethod(), getTarget(), getHttpVersion().getProtocol(), getConnectionId());
	}

	@NonNull
	public String getMethod() {
		return this.method;
	}

	/**
	 * The request target exactly as it appeared on the request line.
	 *
	 * @return the raw request target
	 */
	@NonNull
	public String getTarget() {
		return this.target;
	}

	/**
	 * The percent-decoded path. Encoded slashes ({@code %2F}) are left encoded so path segments stay unambiguous.
	 *
	 * @return the decoded path
	 */
	@NonNull
	public String getPath() {
		return this.path;
	}

	/**
	 * The raw query string, without the leading {@code ?}.
	 *
	 * @return the query string, or {@link Optional#empty()} if the target had none
	 */
	@NonNull
	public Optional<String> getQueryString() {
		return Optional.ofNullable(this.queryString);
	}

	@NonNull
	public HttpVersion getHttpVersion() {
		return this.httpVersion;
	}

	@NonNull
	public Headers getHeaders() {
		return this.headers;
	}

	@NonNull
	public RequestBody getBody() {
		return this.body;
	}

	/**
	 * {@code https} for connections that completed a TLS handshake, {@code http} otherwise.
	 *
	 * @return the scheme
	 */
	@NonNull
	public String getScheme() {
		return this.scheme;
	}

	@NonNull
	public Optional<SocketAddress> getRemoteAddress() {
		return Optional.ofNullable(this.remoteAddress);
	}

	@NonNull
	public Optional<SocketAddress> getLocalAddress() {
		return Optional.ofNullable(this.localAddress);
	}

	@NonNull
	public Optional<TlsSessionInfo> getTlsSessionInfo() {
		return Optional.ofNullable(this.tlsSessionInfo);
	}

	/**
	 * Credentials of the connected process, present only for Unix domain socket connections when
	 * {@link ServerConfig#getPeerCredentialsEnabled()} is on.
	 *
	 * @return the peer credentials, or {@link Optional#empty()} if unavailable
	 */
	@NonNull
	public Optional<PeerCredentials> getPeerCredentials() {
		return Optional.ofNullable(this.peerCredentials);
	}

	/**
	 * The portion of the original path consumed by a {@link PathDispatcher} mount, or the empty string if the request
	 * was not routed through one. The mount path followed by {@link #getPath()} is the path the client sent.
	 *
	 * @return the mount path
	 */
	@NonNull
	public String getMountPath() {
		return this.mountPath;
	}

	/**
	 * Identifies the connection this request arrived on. Requests sharing a keep-alive connection share this value.
	 *
	 * @return the connection identifier
	 */
	@NonNull
	public Long getConnectionId() {
		return this.connectionId;
	}

	/**
	 * When the request line started arriving.
	 */
	@NonNull
	public Instant getReceivedAt() {
		return this.receivedAt;
	}

	/**
	 * Builder used to construct instances of {@link Request} via {@link Request#withMethod(String, String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String method;
		@NonNull
		private final String target;
		@Nullable
		private String path;
		@Nullable
		private String queryString;
		@Nullable
		private HttpVersion httpVersion;
		@Nullable
		private Headers headers;
		@Nullable
		private RequestBody body;
		@Nullable
		private String scheme;
		@Nullable
		private SocketAddress remoteAddress;
		@Nullable
		private SocketAddress localAddress;
		@Nullable
		private TlsSessionInfo tlsSessionInfo;
		@Nullable
		private PeerCredentials peerCredentials;
		@Nullable
		private String mountPath;
		@Nullable
		private Long connectionId;
		@Nullable
		private Instant receivedAt;

		private Builder(@NonNull String method,
										@NonNull String target) {
			requireNonNull(method);
			requireNonNull(target);

			this.method = method;
			this.target = target;
		}

		private Builder(@NonNull Request request) {
			requireNonNull(request);

			this.method = request.method;
			this.target = request.target;
			this.path = request.path;
			this.queryString = request.queryString;
			this.httpVersion = request.httpVersion;
			this.headers = request.headers;
			this.body = request.body;
			this.scheme = request.scheme;
			this.remoteAddress = request.remoteAddress;
			this.localAddress = request.localAddress;
			this.tlsSessionInfo = request.tlsSessionInfo;
			this.peerCredentials = request.peerCredentials;
			this.mountPath = request.mountPath;
			this.connectionId = request.connectionId;
			this.receivedAt = request.receivedAt;
		}

		/**
		 * Overrides the path and query string that would otherwise be split naively from the target.
		 */
		@NonNull
		public Builder pathAndQueryString(@NonNull String path,
																			@Nullable String queryString) {
			requireNonNull(path);
			this.path = path;
			this.queryString = queryString;
			return this;
		}

		@NonNull
		public Builder httpVersion(@Nullable HttpVersion httpVersion) {
			this.httpVersion = httpVersion;
			return this;
		}

		@NonNull
		public Builder headers(@Nullable Headers headers) {
			this.headers = headers;
			return this;
		}

		@NonNull
		public Builder body(@Nullable RequestBody body) {
			this.body = body;
			return this;
		}

		@NonNull
		public Builder scheme(@Nullable String scheme) {
			this.scheme = scheme;
			return this;
		}

		@NonNull
		public Builder remoteAddress(@Nullable SocketAddress remoteAddress) {
			this.remoteAddress = remoteAddress;
			return this;
		}

		@NonNull
		public Builder localAddress(@Nullable SocketAddress localAddress) {
			this.localAddress = localAddress;
			return this;
		}

		@NonNull
		public Builder tlsSessionInfo(@Nullable TlsSessionInfo tlsSessionInfo) {
			this.tlsSessionInfo = tlsSessionInfo;
			return this;
		}

		@NonNull
		public Builder peerCredentials(@Nullable PeerCredentials peerCredentials) {
			this.peerCredentials = peerCredentials;
			return this;
		}

		@NonNull
		public Builder mountPath(@Nullable String mountPath) {
			this.mountPath = mountPath;
			return this;
		}

		@NonNull
		public Builder connectionId(@Nullable Long connectionId) {
			this.connectionId = connectionId;
			return this;
		}

		@NonNull
		public Builder receivedAt(@Nullable Instant receivedAt) {
			this.receivedAt = receivedAt;
			return this;
		}

		@NonNull
		public Request build() {
			return new Request(this);
		}
	}
}
