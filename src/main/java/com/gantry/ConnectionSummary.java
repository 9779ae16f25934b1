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

import java.net.SocketAddress;
import java.time.Duration;
import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * What happened over the lifetime of one client connection.
 *
 * @param connectionId  server-unique connection identifier
 * @param remoteAddress the peer's address, {@code null} for Unix domain sockets without one
 * @param createdAt     when the connection was accepted
 * @param duration      how long the connection was open
 * @param requestCount  requests read on this connection, including ones rejected as malformed
 * @param bytesRead     bytes read off the transport, TLS records excluded
 * @param bytesWritten  bytes written to the transport, TLS records excluded
 * @param closeReason   why the connection ended
 * @param tls           whether a TLS session was established
 */
public record ConnectionSummary(@NonNull Long connectionId,
																@Nullable SocketAddress remoteAddress,
																@NonNull Instant createdAt,
																@NonNull Duration duration,
																@NonNull Integer requestCount,
																@NonNull Long bytesRead,
																@NonNull Long bytesWritten,
																@NonNull ConnectionCloseReason closeReason,
																@NonNull Boolean tls) {
	public ConnectionSummary {
		requireNonNull(connectionId);
		requireNonNull(createdAt);
		requireNonNull(duration);
		requireNonNull(requestCount);
		requireNonNull(bytesRead);
		requireNonNull(bytesWritten);
		requireNonNull(closeReason);
		requireNonNull(tls);
	}
}
