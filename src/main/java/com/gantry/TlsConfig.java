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
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * TLS termination settings: where the server's certificate and key come from, and whether clients must authenticate.
 * <p>
 * Instances can be acquired via the {@link #withPemFiles(Path, Path)}, {@link #withPkcs12Keystore(Path, String)} and
 * {@link #withSslContext(SSLContext)} builder factory methods.
 */
@ThreadSafe
public final class TlsConfig {
	@NonNull
	private static final Duration DEFAULT_HANDSHAKE_TIMEOUT;

	static {
		DEFAULT_HANDSHAKE_TIMEOUT = Duration.ofSeconds(10);
	}

	/**
	 * Whether a client certificate is requested during the handshake.
	 */
	public enum ClientAuthentication {
		NONE,
		/**
		 * Requested but not required; the handshake succeeds without one.
		 */
		OPTIONAL,
		REQUIRED
	}

	@Nullable
	private final Path certificateChainFile;
	@Nullable
	private final Path privateKeyFile;
	@Nullable
	private final Path keystoreFile;
	@Nullable
	private final String keystorePassword;
	@Nullable
	private final SSLContext sslContext;
	@Nullable
	private final Path trustedCertificatesFile;
	@NonNull
	private final ClientAuthentication clientAuthentication;
	@Nullable
	private final List<@NonNull String> enabledProtocols;
	@Nullable
	private final List<@NonNull String> enabledCipherSuites;
	@NonNull
	private final Duration handshakeTimeout;

	/**
	 * Acquires a builder for a certificate chain and unencrypted PKCS#8 private key stored as PEM files.
	 *
	 * @param certificateChainFile PEM file holding the server certificate followed by any intermediates
	 * @param privateKeyFile       PEM file holding the matching {@code PRIVATE KEY}
	 * @return the builder
	 */
	@NonNull
	public static Builder withPemFiles(@NonNull Path certificateChainFile,
																		 @NonNull Path privateKeyFile) {
		requireNonNull(certificateChainFile);
		requireNonNull(privateKeyFile);

		Builder builder = new Builder();
		builder.certificateChainFile = certificateChainFile;
		builder.privateKeyFile = privateKeyFile;
		return builder;
	}

	@NonNull
	public static Builder withPkcs12Keystore(@NonNull Path keystoreFile,
																					 @NonNull String keystorePassword) {
		requireNonNull(keystoreFile);
		requireNonNull(keystorePassword);

		Builder builder = new Builder();
		builder.keystoreFile = keystoreFile;
		builder.keystorePassword = keystorePassword;
		return builder;
	}

	/**
	 * Acquires a builder for an {@link SSLContext} the application has already initialized.
	 * <p>
	 * {@link Builder#trustedCertificatesFile(Path)} is ignored in this case; trust comes from the context.
	 */
	@NonNull
	public static Builder withSslContext(@NonNull SSLContext sslContext) {
		requireNonNull(sslContext);

		Builder builder = new Builder();
		builder.sslContext = sslContext;
		return builder;
	}

	private TlsConfig(@NonNull Builder builder) {
		requireNonNull(builder);

		this.certificateChainFile = builder.certificateChainFile;
		this.privateKeyFile = builder.privateKeyFile;
		this.keystoreFile = builder.keystoreFile;
		this.keystorePassword = builder.keystorePassword;
		this.sslContext = builder.sslContext;
		this.trustedCertificatesFile = builder.trustedCertificatesFile;
		this.clientAuthentication = builder.clientAuthentication != null ? builder.clientAuthentication : ClientAuthentication.NONE;
		this.enabledProtocols = builder.enabledProtocols == null ? null : List.copyOf(builder.enabledProtocols);
		this.enabledCipherSuites = builder.enabledCipherSuites == null ? null : List.copyOf(builder.enabledCipherSuites);
		this.handshakeTimeout = builder.handshakeTimeout != null ? builder.handshakeTimeout : DEFAULT_HANDSHAKE_TIMEOUT;

		if (this.handshakeTimeout.isNegative() || this.handshakeTimeout.isZero())
			throw new IllegalArgumentException("Handshake timeout must be > 0");
	}

	/**
	 * Loads key material and builds the server's {@link SSLContext}.
	 *
	 * @throws IllegalArgumentException if the key material is unreadable or inconsistent
	 */
	@NonNull
	SSLContext createSslContext() {
		if (this.sslContext != null)
			return this.sslContext;

		try {
			char[] password;
			KeyStore keyStore;

			if (this.keystoreFile != null) {
				password = requireNonNull(this.keystorePassword).toCharArray();
				keyStore = KeyStore.getInstance("PKCS12");

				try (InputStream inputStream = Files.newInputStream(this.keystoreFile)) {
					keyStore.load(inputStream, password);
				}
			} else {
				List<X509Certificate> certificateChain = PemReader.readCertificates(requireNonNull(this.certificateChainFile));
				PrivateKey privateKey = PemReader.readPrivateKey(requireNonNull(this.privateKeyFile));

				// In-memory keystore only; the password never leaves this method
				password = "gantry".toCharArray();
				keyStore = KeyStore.getInstance("PKCS12");
				keyStore.load(null, null);
				keyStore.setKeyEntry("server", privateKey, password, certificateChain.toArray(new X509Certificate[0]));
			}

			KeyManagerFactory keyManagerFactory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
			keyManagerFactory.init(keyStore, password);

			TrustManager[] trustManagers = null;

			if (this.trustedCertificatesFile != null) {
				KeyStore trustStore = KeyStore.getInstance("PKCS12");
				trustStore.load(null, null);

				int index = 0;

				for (X509Certificate certificate : PemReader.readCertificates(this.trustedCertificatesFile))
					trustStore.setCertificateEntry(format("trusted-%d", index++), certificate);

				TrustManagerFactory trustManagerFactory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
				trustManagerFactory.init(trustStore);
				trustManagers = trustManagerFactory.getTrustManagers();
			}

			SSLContext sslContext = SSLContext.getInstance("TLS");
			sslContext.init(keyManagerFactory.getKeyManagers(), trustManagers, null);
			return sslContext;
		} catch (GeneralSecurityException e) {
			throw new IllegalArgumentException("Unable to initialize TLS from the configured key material", e);
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to read TLS key material", e);
		}
	}

	@Override
	@NonNull
	public String toString() {
		String source = this.sslContext != null ? "sslContext" : this.keystoreFile != null ? this.keystoreFile.toString()
				: format("%s + %s", this.certificateChainFile, this.privateKeyFile);

		return format("%s{source=%s, clientAuthentication=%s}", getClass().getSimpleName(), source, getClientAuthentication().name());
	}

	@NonNull
	public Optional<Path> getCertificateChainFile() {
		return Optional.ofNullable(this.certificateChainFile);
	}

	@NonNull
	public Optional<Path> getPrivateKeyFile() {
		return Optional.ofNullable(this.privateKeyFile);
	}

	@NonNull
	public Optional<Path> getKeystoreFile() {
		return Optional.ofNullable(this.keystoreFile);
	}

	/**
	 * PEM bundle of CAs used to verify client certificates.
	 */
	@NonNull
	public Optional<Path> getTrustedCertificatesFile() {
		return Optional.ofNullable(this.trustedCertificatesFile);
	}

	@NonNull
	public ClientAuthentication getClientAuthentication() {
		return this.clientAuthentication;
	}

	/**
	 * Protocols to enable, for example {@code TLSv1.3}. Empty means the JVM defaults.
	 */
	@NonNull
	public Optional<List<@NonNull String>> getEnabledProtocols() {
		return Optional.ofNullable(this.enabledProtocols);
	}

	@NonNull
	public Optional<List<@NonNull String>> getEnabledCipherSuites() {
		return Optional.ofNullable(this.enabledCipherSuites);
	}

	/**
	 * How long a client has to complete the handshake, including sending its first byte.
	 */
	@NonNull
	public Duration getHandshakeTimeout() {
		return this.handshakeTimeout;
	}

	/**
	 * Builder used to construct instances of {@link TlsConfig}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private Path certificateChainFile;
		@Nullable
		private Path privateKeyFile;
		@Nullable
		private Path keystoreFile;
		@Nullable
		private String keystorePassword;
		@Nullable
		private SSLContext sslContext;
		@Nullable
		private Path trustedCertificatesFile;
		@Nullable
		private ClientAuthentication clientAuthentication;
		@Nullable
		private List<@NonNull String> enabledProtocols;
		@Nullable
		private List<@NonNull String> enabledCipherSuites;
		@Nullable
		private Duration handshakeTimeout;

		private Builder() {
			// Only vended by TlsConfig factory methods
		}

		@NonNull
		public Builder trustedCertificatesFile(@Nullable Path trustedCertificatesFile) {
			this.trustedCertificatesFile = trustedCertificatesFile;
			return this;
		}

		@NonNull
		public Builder clientAuthentication(@Nullable ClientAuthentication clientAuthentication) {
			this.clientAuthentication = clientAuthentication;
			return this;
		}

		@NonNull
		public Builder enabledProtocols(@Nullable List<@NonNull String> enabledProtocols) {
			this.enabledProtocols = enabledProtocols;
			return this;
		}

		@NonNull
		public Builder enabledCipherSuites(@Nullable List<@NonNull String> enabledCipherSuites) {
			this.enabledCipherSuites = enabledCipherSuites;
			return this;
		}

		@NonNull
		public Builder handshakeTimeout(@Nullable Duration handshakeTimeout) {
			this.handshakeTimeout = handshakeTimeout;
			return this;
		}

		@NonNull
		public TlsConfig build() {
			return new TlsConfig(this);
		}
	}
}
