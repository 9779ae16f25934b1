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
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@ThreadSafe
public class PeerCredentialsTests {
	@TempDir
	Path temporaryDirectory;

	@Test
	public void names_are_resolved_from_account_databases() throws IOException {
		Path passwd = write("passwd", "# local accounts\n"
				+ "root:x:0:0:root:/root:/bin/bash\n"
				+ "svc:x:1000:1000::/home/svc:/bin/sh\n");
		Path group = write("group", "root:x:0:\n"
				+ "staff:x:50:svc\n");

		PeerCredentials peerCredentials = PeerCredentials.withIds(4242L, 1000L, 50L).withResolvedNames(passwd, group);

		Assertions.assertEquals(4242L, peerCredentials.getProcessId().orElseThrow());
		Assertions.assertEquals("svc", peerCredentials.getUserName().orElse(null));
		Assertions.assertEquals("staff", peerCredentials.getGroupName().orElse(null));
	}

	@Test
	public void unknown_ids_and_missing_databases_leave_names_absent() throws IOException {
		Path passwd = write("passwd", "root:x:0:0:root:/root:/bin/bash\n");

		PeerCredentials unknown = PeerCredentials.withIds(1L, 31337L, 31337L)
				.withResolvedNames(passwd, this.temporaryDirectory.resolve("missing-group"));

		Assertions.assertTrue(unknown.getUserName().isEmpty());
		Assertions.assertTrue(unknown.getGroupName().isEmpty());
		Assertions.assertEquals(31337L, unknown.getUserId().orElseThrow());

		PeerCredentials withoutIds = PeerCredentials.withIds(null, null, null).withResolvedNames(passwd, passwd);

		Assertions.assertEquals(PeerCredentials.withIds(null, null, null), withoutIds);
	}

	private Path write(String name, String content) throws IOException {
		return Files.writeString(this.temporaryDirectory.resolve(name), content, StandardCharsets.UTF_8);
	}
}
