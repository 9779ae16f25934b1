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

import static java.util.Objects.requireNonNull;

/**
 * A point-in-time snapshot of server counters and worker pool gauges.
 * <p>
 * Counters are cumulative since {@link Server#start()}. Gauges reflect the moment the snapshot was taken, and are not
 * mutually consistent under load.
 */
public record ServerStatistics(@NonNull Long acceptedConnections,
															 @NonNull Long rejectedConnections,
															 @NonNull Long socketErrors,
															 @NonNull Long tlsHandshakeFailures,
															 @NonNull Long requests,
															 @NonNull Long bytesRead,
															 @NonNull Long bytesWritten,
															 @NonNull Integer activeConnections,
															 @NonNull Integer workerCount,
															 @NonNull Integer idleWorkerCount,
															 @NonNull Integer busyWorkerCount,
															 @NonNull Integer queuedConnectionCount) {
	public ServerStatistics {
		requireNonNull(acceptedConnections);
		requireNonNull(rejectedConnections);
		requireNonNull(socketErrors);
		requireNonNull(tlsHandshakeFailures);
		requireNonNull(requests);
		requireNonNull(bytesRead);
		requireNonNull(bytesWritten);
		requireNonNull(activeConnections);
		requireNonNull(workerCount);
		requireNonNull(idleWorkerCount);
		requireNonNull(busyWorkerCount);
		requireNonNull(queuedConnectionCount);
	}
}
