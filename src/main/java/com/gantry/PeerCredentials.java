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

import javax.annotation.concurrent.Immutable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Identity of the process on the other end of a Unix domain socket, as reported by the kernel when it connected.
 * <p>
 * Available from {@link Request#getPeerCredentials()} when {@link ServerConfig#getPeerCredentialsEnabled()} is on.
 * Account names are present only if {@link ServerConfig#getPeerCredentialsResolveEnabled()} is also on and the IDs
 * have entries in the local account databases.
 */
@Immutable
public final class PeerCredentials {
	@NonNull
	private static final Path PASSWD_DATABASE;
	@NonNull
	private static final Path GROUP_DATABASE;

	static {
		PASSWD_DATABASE = Path.of("/etc/passwd");
		GROUP_DATABASE = Path.of("/etc/group");
	}

	@Nullable
	private final Long processId;
	@Nullable
	private final Long userId;
	@Nullable
	private final Long groupId;
	@Nullable
	private final String userName;
	@Nullable
	private final String groupName;

	/**
	 * @param processId the peer's process ID, or {@code null} if the platform does not report it
	 * @param userId    the peer's effective user ID, or {@code null} if unknown
	 * @param groupId   the peer's effective group ID, or {@code null} if unknown
	 * @return credentials without account names
	 */
	@NonNull
	public static PeerCredentials withIds(@Nullable Long processId,
																				@Nullable Long userId,
																				@Nullable Long groupId) {
		return new PeerCredentials(processId, userId, groupId, null, null);
	}

	private PeerCredentials(@Nullable Long processId,
													@Nullable Long userId,
													@Nullable Long groupId,
													@Nullable String userName,
													@Nullable String groupName) {
		this.processId = processId;
		this.userId = userId;
		this.groupId = groupId;
		this.userName = userName;
		this.groupName = groupName;
	}

	/**
	 * Looks the user and group IDs up in the system account databases.
	 *
	 * @return a copy carrying whichever names could be found
	 * @throws IOException if an account database exists but cannot be read
	 */
	@NonNull
	PeerCredentials withResolvedNames() throws IOException {
		return withResolvedNames(PASSWD_DATABASE, GROUP_DATABASE);
	}

	@NonNull
	PeerCredentials withResolvedNames(@NonNull Path passwdDatabase,
																		@NonNull Path groupDatabase) throws IOException {
		requireNonNull(passwdDatabase);
		requireNonNull(groupDatabase);

		String userName = this.userId == null ? null : findAccountName(passwdDatabase, this.userId).orElse(null);
		String groupName = this.groupId == null ? null : findAccountName(groupDatabase, this.groupId).orElse(null);

		return new PeerCredentials(this.processId, this.userId, this.groupId, userName, groupName);
	}

	// passwd and group share the layout name:password:id:...
	@NonNull
	private static Optional<String> findAccountName(@NonNull Path database,
																									@NonNull Long id) throws IOException {
		requireNonNull(database);
		requireNonNull(id);

		String expectedId = String.valueOf(id);

		try {
			for (String line : Files.readAllLines(database, StandardCharsets.UTF_8)) {
				if (line.isEmpty() || line.startsWith("#"))
					continue;

				String[] fields = line.split(":", -1);

				if (fields.length > 2 && fields[2].equals(expectedId))
					return Optional.of(fields[0]);
			}
		} catch (NoSuchFileException e) {
			return Optional.empty();
		}

		return Optional.empty();
	}

	@NonNull
	public Optional<Long> getProcessId() {
		return Optional.ofNullable(this.processId);
	}

	@NonNull
	public Optional<Long> getUserId() {
		return Optional.ofNullable(this.userId);
	}

	@NonNull
	public Optional<Long> getGroupId() {
		return Optional.ofNullable(this.groupId);
	}

	@NonNull
	public Optional<String> getUserName() {
		return Optional.ofNullable(this.userName);
	}

	@NonNull
	public Optional<String> getGroupName() {
		return Optional.ofNullable(this.groupName);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{processId=%s, userId=%s, groupId=%s, userName=%s, groupName=%s}", getClass().getSimpleName(),
				this.processId, this.userId, this.groupId, this.userName, this.groupName);
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof PeerCredentials peerCredentials))
			return false;

		return Objects.equals(this.processId, peerCredentials.processId)
				&& Objects.equals(this.userId, peerCredentials.userId)
				&& Objects.equals(this.groupId, peerCredentials.groupId)
				&& Objects.equals(this.userName, peerCredentials.userName)
				&& Objects.equals(this.groupName, peerCredentials.groupName);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.processId, this.userId, this.groupId, this.userName, this.groupName);
	}
}
