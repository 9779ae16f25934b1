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
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Cumulative counters shared by the acceptor and all connections of one server run.
 */
@ThreadSafe
final class ServerCounters {
	@NonNull
	private final LongAdder acceptedConnections;
	@NonNull
	private final LongAdder rejectedConnections;
	@NonNull
	private final LongAdder socketErrors;
	@NonNull
	private final LongAdder tlsHandshakeFailures;
	@NonNull
	private final LongAdder requests;
	@NonNull
	private final LongAdder bytesRead;
	@NonNull
	private final LongAdder bytesWritten;
	@NonNull
	private final AtomicInteger activeConnections;

	ServerCounters() {
		this.acceptedConnections = new LongAdder();
		this.rejectedConnections = new LongAdder();
		this.socketErrors = new LongAdder();
		this.tlsHandshakeFailures = new LongAdder();
		this.requests = new LongAdder();
		this.bytesRead = new LongAdder();
		this.bytesWritten = new LongAdder();
		this.activeConnections = new AtomicInteger();
	}

	void connectionAccepted() {
		this.acceptedConnections.increment();
	}

	void connectionRejected() {
		this.rejectedConnections.increment();
	}

	void socketError() {
		this.socketErrors.increment();
	}

	void tlsHandshakeFailed() {
		this.tlsHandshakeFailures.increment();
	}

	void requestRead() {
		this.requests.increment();
	}

	void connectionOpened() {
		this.activeConnections.incrementAndGet();
	}

	void connectionClosed(long bytesRead,
												long bytesWritten) {
		this.activeConnections.decrementAndGet();
		this.bytesRead.add(bytesRead);
		this.bytesWritten.add(bytesWritten);
	}

	/**
	 * @param workerPool the running pool, or {@code null} if the server is stopped
	 */
	@NonNull
	ServerStatistics snapshot(@Nullable WorkerPool workerPool) {
		return new ServerStatistics(
				this.acceptedConnections.sum(),
				this.rejectedConnections.sum(),
				this.socketErrors.sum(),
				this.tlsHandshakeFailures.sum(),
				this.requests.sum(),
				this.bytesRead.sum(),
				this.bytesWritten.sum(),
				this.activeConnections.get(),
				workerPool == null ? 0 : workerPool.getWorkerCount(),
				workerPool == null ? 0 : workerPool.getIdleWorkerCount(),
				workerPool == null ? 0 : workerPool.getBusyWorkerCount(),
				workerPool == null ? 0 : workerPool.getQueuedCount()
		);
	}
}
