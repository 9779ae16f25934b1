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
import java.nio.file.Path;

@ThreadSafe
public class BindAddressTests {
	@Test
	public void parses_host_and_port() {
		BindAddress bindAddress = BindAddress.parse("127.0.0.1:8080");

		Assertions.assertEquals(BindAddress.Type.TCP, bindAddress.getType());
		Assertions.assertEquals("127.0.0.1", bindAddress.getHost().orElse(null));
		Assertions.assertEquals(8080, bindAddress.getPort().orElse(null));
		Assertions.assertFalse(bindAddress.isUnixDomain());
	}

	@Test
	public void parses_port_only_as_all_interfaces() {
		BindAddress bindAddress = BindAddress.parse(":9000");

		Assertions.assertTrue(bindAddress.getHost().isEmpty());
		Assertions.assertEquals(9000, bindAddress.getPort().orElse(null));
		Assertions.assertEquals(BindAddress.withPort(9000), bindAddress);
	}

	@Test
	public void parses_bracketed_ipv6() {
		BindAddress bindAddress = BindAddress.parse("[::1]:8443");

		Assertions.assertEquals("::1", bindAddress.getHost().orElse(null));
		Assertions.assertEquals(8443, bindAddress.getPort().orElse(null));
		Assertions.assertEquals("[::1]:8443", bindAddress.toString());
	}

	@Test
	public void parses_unix_socket_path() {
		BindAddress bindAddress = BindAddress.parse("/tmp/gantry.sock");

		Assertions.assertEquals(BindAddress.Type.UNIX_DOMAIN, bindAddress.getType());
		Assertions.assertEquals(Path.of("/tmp/gantry.sock"), bindAddress.getPath().orElse(null));
		Assertions.assertTrue(bindAddress.isUnixDomain());
		Assertions.assertTrue(bindAddress.getPort().isEmpty());
	}

	@Test
	public void abstract_names_get_a_leading_nul() {
		BindAddress bindAddress = BindAddress.parse("@gantry");

		Assertions.assertEquals(BindAddress.Type.ABSTRACT_UNIX_DOMAIN, bindAddress.getType());
		Assertions.assertEquals("\0gantry", bindAddress.getAbstractName().orElse(null));
		Assertions.assertEquals("@gantry", bindAddress.toString());
		Assertions.assertTrue(bindAddress.getPath().isEmpty());
	}

	@Test
	public void rejects_unrecognizable_input() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> BindAddress.parse(""));
		Assertions.assertThrows(IllegalArgumentException.class, () -> BindAddress.parse("localhost"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> BindAddress.parse("localhost:http"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> BindAddress.parse("[::1]8080"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> BindAddress.parse("::1:8080"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> BindAddress.withPort(70000));
	}
}
