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

import com.gantry.TestSupport.QuietLifecycleObserver;
import com.gantry.TestSupport.RawResponse;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;
import org.newsclub.net.unix.AFSocket;
import org.newsclub.net.unix.AFSocketCapability;
import org.newsclub.net.unix.AFUNIXSocket;
import org.newsclub.net.unix.AFUNIXSocketAddress;

import javax.annotation.concurrent.ThreadSafe;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

import static com.gantry.TestSupport.bytes;
import static com.gantry.TestSupport.readResponse;

@ThreadSafe
public class UnixDomainSocketTests {
	@TempDir
	Path temporaryDirectory;

	@Test
	@Timeout(15)
	public void serves_requests_over_a_socket_file() throws IOException {
		Path socketPath = this.temporaryDirectory.resolve("gantry.sock");
		// A stale file from an earlier run is replaced
		Files.createFile(socketPath);

		ServerConfig serverConfig = ServerConfig.withBindAddress(BindAddress.withUnixDomainSocketPath(socketPath))
				.minimumWorkerCount(1)
				.maximumWorkerCount(2)
				.build();
		Gateway gateway = Gateway.withResponder(request -> Response.withStatusCode(200)
				.body(request.getScheme() + " " + request.getPath())
				.build());
		Server server = Server.withConfig(serverConfig, gateway).lifecycleObserver(new QuietLifecycleObserver()).build();

		server.start();

		try {
			Assertions.assertTrue(server.getBoundAddress().orElseThrow() instanceof AFUNIXSocketAddress);
			Assertions.assertTrue(Files.exists(socketPath));

			// Clients are not tied to the server's socket library
			try (SocketChannel socketChannel = SocketChannel.open(StandardProtocolFamily.UNIX)) {
				socketChannel.connect(UnixDomainSocketAddress.of(socketPath));

				OutputStream out = Channels.newOutputStream(socketChannel);
				InputStream in = new BufferedInputStream(Channels.newInputStream(socketChannel));

				out.write(bytes("GET /first HTTP/1.1\r\n\r\n"));
				RawResponse first = readResponse(in);

				out.write(bytes("GET /second HTTP/1.1\r\nConnection: close\r\n\r\n"));
				RawResponse second = readResponse(in);

				Assertions.assertEquals("http /first", first.body());
				Assertions.assertEquals("http /second", second.body());
			}
		} finally {
			server.stop();
		}

		Assertions.assertFalse(Files.exists(socketPath));
	}

	@Test
	@Timeout(15)
	public void serves_requests_over_an_abstract_name() throws IOException {
		Assumptions.assumeTrue(AFSocket.supports(AFSocketCapability.CAPABILITY_ABSTRACT_NAMESPACE),
				"Abstract socket names are Linux-only");

		String abstractName = "gantry-test-" + System.nanoTime();
		ServerConfig serverConfig = ServerConfig.withBindAddress(BindAddress.withAbstractName(abstractName))
				.minimumWorkerCount(1)
				.maximumWorkerCount(2)
				.build();
		Gateway gateway = Gateway.withResponder(request -> Response.withStatusCode(200)
				.body("abstract " + request.getPath())
				.build());
		Server server = Server.withConfig(serverConfig, gateway).lifecycleObserver(new QuietLifecycleObserver()).build();

		server.start();

		try (AFUNIXSocket socket = AFUNIXSocket.newInstance()) {
			socket.connect(AFUNIXSocketAddress.inAbstractNamespace(abstractName));

			OutputStream out = socket.getOutputStream();
			InputStream in = new BufferedInputStream(socket.getInputStream());

			out.write(bytes("GET /hello HTTP/1.1\r\nConnection: close\r\n\r\n"));
			RawResponse response = readResponse(in);

			Assertions.assertEquals(200, response.statusCode());
			Assertions.assertEquals("abstract /hello", response.body());
		} finally {
			server.stop();
		}

		Assertions.assertFalse(server.isStarted());
	}

	@Test
	@Timeout(15)
	public void peer_credentials_identify_the_connecting_process() throws IOException {
		Assumptions.assumeTrue(AFSocket.supports(AFSocketCapability.CAPABILITY_PEER_CREDENTIALS),
				"Peer credentials are not supported on this platform");

		Path socketPath = this.temporaryDirectory.resolve("credentials.sock");
		Path ownedFile = Files.createFile(this.temporaryDirectory.resolve("owned"));
		long expectedUserId = ((Number) Files.getAttribute(ownedFile, "unix:uid")).longValue();
		long expectedGroupId = ((Number) Files.getAttribute(ownedFile, "unix:gid")).longValue();
		String ownerName = Files.getOwner(ownedFile).getName();

		ServerConfig serverConfig = ServerConfig.withBindAddress(BindAddress.withUnixDomainSocketPath(socketPath))
				.minimumWorkerCount(1)
				.maximumWorkerCount(2)
				.peerCredentialsEnabled(true)
				.peerCredentialsResolveEnabled(true)
				.build();
		AtomicReference<PeerCredentials> observed = new AtomicReference<>();
		Gateway gateway = Gateway.withResponder(request -> {
			observed.set(request.getPeerCredentials().orElse(null));
			return Response.withStatusCode(204).build();
		});
		Server server = Server.withConfig(serverConfig, gateway).lifecycleObserver(new QuietLifecycleObserver()).build();

		server.start();

		try (AFUNIXSocket socket = AFUNIXSocket.newInstance()) {
			socket.connect(AFUNIXSocketAddress.of(socketPath));

			OutputStream out = socket.getOutputStream();
			InputStream in = new BufferedInputStream(socket.getInputStream());

			out.write(bytes("GET / HTTP/1.1\r\nConnection: close\r\n\r\n"));
			Assertions.assertEquals(204, readResponse(in).statusCode());
		} finally {
			server.stop();
		}

		PeerCredentials peerCredentials = observed.get();

		Assertions.assertNotNull(peerCredentials);
		Assertions.assertEquals(expectedUserId, peerCredentials.getUserId().orElseThrow());
		Assertions.assertEquals(expectedGroupId, peerCredentials.getGroupId().orElseThrow());
		peerCredentials.getProcessId().ifPresent(processId ->
				Assertions.assertEquals(ProcessHandle.current().pid(), processId));

		// The JDK reports a numeric owner when the account database has no entry
		if (ownerName.chars().allMatch(Character::isDigit))
			Assertions.assertTrue(peerCredentials.getUserName().isEmpty());
		else
			Assertions.assertEquals(ownerName, peerCredentials.getUserName().orElseThrow());
	}

	@Test
	@Timeout(15)
	public void peer_credentials_are_absent_unless_enabled() throws IOException {
		Path socketPath = this.temporaryDirectory.resolve("anonymous.sock");
		ServerConfig serverConfig = ServerConfig.withBindAddress(BindAddress.withUnixDomainSocketPath(socketPath))
				.minimumWorkerCount(1)
				.maximumWorkerCount(2)
				.build();
		Gateway gateway = Gateway.withResponder(request -> Response.withStatusCode(200)
				.body(String.valueOf(request.getPeerCredentials().isPresent()))
				.build());
		Server server = Server.withConfig(serverConfig, gateway).lifecycleObserver(new QuietLifecycleObserver()).build();

		server.start();

		try (AFUNIXSocket socket = AFUNIXSocket.newInstance()) {
			socket.connect(AFUNIXSocketAddress.of(socketPath));

			OutputStream out = socket.getOutputStream();
			InputStream in = new BufferedInputStream(socket.getInputStream());

			out.write(bytes("GET / HTTP/1.1\r\nConnection: close\r\n\r\n"));
			Assertions.assertEquals("false", readResponse(in).body());
		} finally {
			server.stop();
		}
	}
}
