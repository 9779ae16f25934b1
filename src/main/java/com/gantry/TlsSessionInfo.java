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
import javax.net.ssl.SSLPeerUnverifiedException;
import javax.net.ssl.SSLSession;
import java.security.Principal;
import java.security.cert.Certificate;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * What was negotiated during the TLS handshake for a connection.
 */
@ThreadSafe
public final class TlsSessionInfo {
	@NonNull
	private final String protocol;
	@NonNull
	private final String cipherSuite;
	@Nullable
	private final Principal peerPrincipal;
	@NonNull
	private final List<@NonNull Certificate> peerCertificates;

	@NonNull
	static TlsSessionInfo fromSslSession(@NonNull SSLSession sslSession) {
		requireNonNull(sslSession);

		Principal peerPrincipal;
		List<Certificate> peerCertificates;

		try {
			peerPrincipal = sslSession.getPeerPrincipal();
			peerCertificates = List.of(sslSession.getPeerCertificates());
		} catch (SSLPeerUnverifiedException e) {
			// No client certificate was presented
			peerPrincipal = null;
			peerCertificates = List.of();
		}

		return new TlsSessionInfo(sslSession.getProtocol(), sslSession.getCipherSuite(), peerPrincipal, peerCertificates);
	}

	private TlsSessionInfo(@NonNull String protocol,
												 @NonNull String cipherSuite,
												 @Nullable Principal peerPrincipal,
												 @NonNull List<@NonNull Certificate> peerCertificates) {
		requireNonNull(protocol);
		requireNonNull(cipherSuite);
		requireNonNull(peerCertificates);

		this.protocol = protocol;
		this.cipherSuite = cipherSuite;
		this.peerPrincipal = peerPrincipal;
		this.peerCertificates = peerCertificates;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{protocol=%s, cipherSuite=%s, peerPrincipal=%s}", getClass().getSimpleName(),
				getProtocol(), getCipherSuite(), getPeerPrincipal().orElse(null));
	}

	/**
	 * The negotiated protocol, for example {@code TLSv1.3}.
	 */
	@NonNull
	public String getProtocol() {
		return this.protocol;
	}

	@NonNull
	public String getCipherSuite() {
		return this.cipherSuite;
	}

	/**
	 * The client's identity, if it presented a certificate.
	 */
	@NonNull
	public Optional<Principal> getPeerPrincipal() {
		return Optional.ofNullable(this.peerPrincipal);
	}

	@NonNull
	public List<@NonNull Certificate> getPeerCertificates() {
		return this.peerCertificates;
	}
}
