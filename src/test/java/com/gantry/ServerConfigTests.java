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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import javax.net.ssl.SSLContext;
import java.nio.file.Path;
import java.time.Duration;

@ThreadSafe
public class ServerConfigTests {
	@Test
	public void applies_defaults() {
		ServerConfig serverConfig = ServerConfig.withPort(8080).build();

		Assertions.assertEquals(BindAddress.withPort(8080), serverConfig.getBindAddress());
		Assertions.assertEquals(10, serverConfig.getMinimumWorkerCount());
		Assertions.assertEquals(100, serverConfig.getMaximumWorkerCount());
		Assertions.assertEquals(0, serverConfig.getAcceptedQueueSize());
		Assertions.assertEquals(Duration.ofSeconds(10), serverConfig.getConnectionTimeout());
		Assertions.assertEquals(64 * 1024, serverConfig.getMaximumHeaderSizeInBytes());
		Assertions.assertEquals(10L * 1024 * 1024, serverConfig.getMaximumRequestBodySizeInBytes());
		Assertions.assertEquals("Gantry", serverConfig.getServerName());
		Assertions.assertTrue(serverConfig.getTcpNoDelay());
		Assertions.assertFalse(serverConfig.getReusePort());
		Assertions.assertTrue(serverConfig.getTlsConfig().isEmpty());
	}

	@Test
	public void maximum_workers_follow_a_large_minimum() {
		ServerConfig serverConfig = ServerConfig.withPort(0).minimumWorkerCount(150).build();
		Assertions.assertEquals(150, serverConfig.getMaximumWorkerCount());
	}

	@Test
	public void rejects_invalid_values() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> ServerConfig.withPort(0).minimumWorkerCount(0).build());
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> ServerConfig.withPort(0).minimumWorkerCount(5).maximumWorkerCount(4).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> ServerConfig.withPort(0).acceptedQueueSize(-1).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> ServerConfig.withPort(0).maximumHeaderSizeInBytes(0).build());
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> ServerConfig.withPort(0).maximumRequestBodySizeInBytes(-1L).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> ServerConfig.withPort(0).connectionTimeout(Duration.ZERO).build());
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> ServerConfig.withPort(0).shutdownTimeout(Duration.ofSeconds(-1)).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> ServerConfig.withPort(0).serverName("Evil\r\nX: y").build());
	}

	@Test
	public void zero_body_limit_means_unlimited_and_is_accepted() {
		Assertions.assertEquals(0L, ServerConfig.withPort(0).maximumRequestBodySizeInBytes(0L).build().getMaximumRequestBodySizeInBytes());
	}

	@Test
	public void tls_is_refused_on_unix_domain_sockets() throws Exception {
		TlsConfig tlsConfig = TlsConfig.withSslContext(SSLContext.getDefault()).build();

		Assertions.assertThrows(IllegalArgumentException.class, () ->
				ServerConfig.withBindAddress(BindAddress.withUnixDomainSocketPath(Path.of("/tmp/gantry-test.sock")))
						.tlsConfig(tlsConfig)
						.build());
		Assertions.assertTrue(ServerConfig.withPort(0).tlsConfig(tlsConfig).build().getTlsConfig().isPresent());
	}

	@Test
	public void header_and_peer_credential_options_default_off() {
		ServerConfig serverConfig = ServerConfig.withPort(0).build();

		Assertions.assertFalse(serverConfig.getDropUnderscoreHeaders());
		Assertions.assertFalse(serverConfig.getPeerCredentialsEnabled());
		Assertions.assertFalse(serverConfig.getPeerCredentialsResolveEnabled());

		// Resolving names requires the credentials themselves
		Assertions.assertFalse(ServerConfig.withPort(0).peerCredentialsResolveEnabled(true).build()
				.getPeerCredentialsResolveEnabled());

		ServerConfig enabledConfig = ServerConfig.withPort(0)
				.dropUnderscoreHeaders(true)
				.peerCredentialsEnabled(true)
				.peerCredentialsResolveEnabled(true)
				.build();

		Assertions.assertTrue(enabledConfig.getDropUnderscoreHeaders());
		Assertions.assertTrue(enabledConfig.getPeerCredentialsEnabled());
		Assertions.assertTrue(enabledConfig.getPeerCredentialsResolveEnabled());
	}
}
