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
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A bounded set of platform threads fed from a queue of accepted connections.
 * <p>
 * {@code minimumWorkerCount} workers start eagerly. More are added, up to {@code maximumWorkerCount}, whenever work is
 * queued and no worker is idle. Workers above the minimum exit once they have gone {@code workerIdleTimeout} without
 * work.
 */
@ThreadSafe
final class WorkerPool {
	@NonNull
	private static final Duration POLL_INTERVAL;
	@NonNull
	private static final Duration STRAGGLER_JOIN_TIMEOUT;

	static {
		POLL_INTERVAL = Duration.ofMillis(200);
		STRAGGLER_JOIN_TIMEOUT = Duration.ofSeconds(1);
	}

	/**
	 * A unit of work that owns a resource the pool may need to reclaim during shutdown.
	 */
	interface Job {
		/**
		 * Runs to completion on a worker thread. Must not throw.
		 */
		void run();

		/**
		 * Closes the job's connection if it is waiting between requests. Called from the thread stopping the pool.
		 */
		void closeIfIdle();

		/**
		 * Forcibly releases the job's connection, whether or not it has started. Called from the thread stopping the pool.
		 */
		void abort();
	}

	@NonNull
	private final Integer minimumWorkerCount;
	@NonNull
	private final Integer maximumWorkerCount;
	@NonNull
	private final Duration workerIdleTimeout;
	@NonNull
	private final Duration acceptedQueueTimeout;
	@NonNull
	private final String threadNamePrefix;
	@NonNull
	private final Consumer<LogEvent> logEventConsumer;
	@NonNull
	private final BlockingQueue<Job> queue;
	@NonNull
	private final Set<Worker> workers;
	@NonNull
	private final AtomicInteger workerCount;
	@NonNull
	private final AtomicInteger idleWorkerCount;
	@NonNull
	private final AtomicInteger busyWorkerCount;
	@NonNull
	private final AtomicInteger threadIdGenerator;
	private volatile boolean started;
	private volatile boolean shuttingDown;

	/**
	 * @param acceptedQueueSize capacity of the job queue, {@code 0} for unbounded
	 * @param logEventConsumer  receives failures that escape a job
	 */
	WorkerPool(@NonNull Integer minimumWorkerCount,
						 @NonNull Integer maximumWorkerCount,
						 @NonNull Duration workerIdleTimeout,
						 @NonNull Integer acceptedQueueSize,
						 @NonNull Duration acceptedQueueTimeout,
						 @NonNull String threadNamePrefix,
						 @NonNull Consumer<LogEvent> logEventConsumer) {
		requireNonNull(minimumWorkerCount);
		requireNonNull(maximumWorkerCount);
		requireNonNull(workerIdleTimeout);
		requireNonNull(acceptedQueueSize);
		requireNonNull(acceptedQueueTimeout);
		requireNonNull(threadNamePrefix);
		requireNonNull(logEventConsumer);

		if (minimumWorkerCount < 1)
			throw new IllegalArgumentException("Minimum worker count must be > 0");

		if (maximumWorkerCount < minimumWorkerCount)
			throw new IllegalArgumentException("Maximum worker count must be >= minimum worker count");

		this.minimumWorkerCount = minimumWorkerCount;
		this.maximumWorkerCount = maximumWorkerCount;
		this.workerIdleTimeout = workerIdleTimeout;
		this.acceptedQueueTimeout = acceptedQueueTimeout;
		this.threadNamePrefix = threadNamePrefix;
		this.logEventConsumer = logEventConsumer;
		this.queue = acceptedQueueSize == 0 ? new LinkedBlockingQueue<>() : new LinkedBlockingQueue<>(acceptedQueueSize);
		this.workers = ConcurrentHashMap.newKeySet();
		this.workerCount = new AtomicInteger();
		this.idleWorkerCount = new AtomicInteger();
		this.busyWorkerCount = new AtomicInteger();
		this.threadIdGenerator = new AtomicInteger();
	}

	/**
	 * Starts the minimum number of workers. May only be called once.
	 */
	void start() {
		if (this.started)
			throw new IllegalStateException("Worker pool was already started");

		this.started = true;

		for (int i = 0; i < this.minimumWorkerCount; i++) {
			this.workerCount.incrementAndGet();
			startWorker();
		}
	}

	/**
	 * Hands a job to the pool, waiting up to {@code acceptedQueueTimeout} for queue space.
	 *
	 * @return {@code false} if the job was not accepted because the queue stayed full or the pool is shutting down. The
	 * caller still owns the job in that case
	 */
	@NonNull
	Boolean submit(@NonNull Job job) {
		requireNonNull(job);

		if (this.shuttingDown)
			return false;

		boolean queued = this.queue.offer(job);

		if (!queued) {
			growIfNeeded();

			try {
				queued = this.queue.offer(job, this.acceptedQueueTimeout.toNanos(), TimeUnit.NANOSECONDS);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return false;
			}
		}

		if (queued)
			growIfNeeded();

		return queued;
	}

	/**
	 * Stops the pool. Queued jobs are aborted, jobs idling between requests are closed, and in-flight jobs get until
	 * {@code gracePeriod} elapses to finish before they are aborted too.
	 *
	 * @return {@code true} if every worker exited within the grace period
	 */
	@NonNull
	Boolean shutdown(@NonNull Duration gracePeriod) {
		requireNonNull(gracePeriod);

		long deadlineNanos = System.nanoTime() + gracePeriod.toNanos();
		this.shuttingDown = true;

		abortQueuedJobs();

		List<Worker> workersSnapshot = new ArrayList<>(this.workers);

		for (Worker worker : workersSnapshot) {
			Job job = worker.getCurrentJob();

			if (job != null)
				job.closeIfIdle();
		}

		for (Worker worker : workersSnapshot)
			joinUntil(worker.getThread(), deadlineNanos);

		boolean clean = true;

		for (Worker worker : workersSnapshot) {
			if (!worker.getThread().isAlive())
				continue;

			clean = false;
			Job job = worker.getCurrentJob();

			if (job != null)
				job.abort();
		}

		for (Worker worker : workersSnapshot)
			hardenJoin(worker.getThread(), STRAGGLER_JOIN_TIMEOUT.toMillis());

		// Anything that raced in behind the first sweep
		abortQueuedJobs();

		return clean;
	}

	@NonNull
	Boolean isShuttingDown() {
		return this.shuttingDown;
	}

	/**
	 * Is every worker busy, the pool at its maximum size, and work still waiting?
	 */
	@NonNull
	Boolean isSaturated() {
		return !this.queue.isEmpty()
				&& this.workerCount.get() >= this.maximumWorkerCount
				&& this.idleWorkerCount.get() <= 0;
	}

	@NonNull
	Integer getWorkerCount() {
		return this.workerCount.get();
	}

	@NonNull
	Integer getIdleWorkerCount() {
		return Math.max(0, this.idleWorkerCount.get());
	}

	@NonNull
	Integer getBusyWorkerCount() {
		return this.busyWorkerCount.get();
	}

	@NonNull
	Integer getQueuedCount() {
		return this.queue.size();
	}

	private void growIfNeeded() {
		if (this.shuttingDown || this.queue.isEmpty() || this.idleWorkerCount.get() > 0)
			return;

		while (true) {
			int current = this.workerCount.get();

			if (current >= this.maximumWorkerCount)
				return;

			if (this.workerCount.compareAndSet(current, current + 1)) {
				startWorker();
				return;
			}
		}
	}

	// Caller has already reserved a slot in workerCount
	private void startWorker() {
		String name = format("%s-%d", this.threadNamePrefix, this.threadIdGenerator.incrementAndGet());
		Worker worker = new Worker();
		Thread thread = new Thread(worker, name);
		worker.setThread(thread);

		this.idleWorkerCount.incrementAndGet();
		this.workers.add(worker);
		thread.start();
	}

	// Gives up one slot above the minimum, if there is one
	private boolean tryRetire() {
		while (true) {
			int current = this.workerCount.get();

			if (current <= this.minimumWorkerCount)
				return false;

			if (this.workerCount.compareAndSet(current, current - 1))
				return true;
		}
	}

	private void abortQueuedJobs() {
		List<Job> queuedJobs = new ArrayList<>();
		this.queue.drainTo(queuedJobs);

		for (Job job : queuedJobs) {
			try {
				job.abort();
			} catch (RuntimeException e) {
				this.logEventConsumer.accept(LogEvent.with(LogEventType.WORKER_FAILED, "Unable to abort queued connection")
						.throwable(e)
						.build());
			}
		}
	}

	private void joinUntil(@NonNull Thread thread,
												 long deadlineNanos) {
		long remainingMillis = remainingMillis(deadlineNanos);

		if (remainingMillis <= 0 || thread == Thread.currentThread())
			return;

		try {
			thread.join(remainingMillis);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	private void hardenJoin(@Nullable Thread thread,
													@NonNull Long millis) {
		requireNonNull(millis);

		if (thread == null || !thread.isAlive() || thread == Thread.currentThread())
			return;

		thread.interrupt();

		try {
			thread.join(Math.max(100L, millis));
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	@NonNull
	private Long remainingMillis(long deadlineNanos) {
		long remaining = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
		return Math.max(0L, remaining);
	}

	private final class Worker implements Runnable {
		@Nullable
		private volatile Thread thread;
		@Nullable
		private volatile Job currentJob;

		@Override
		public void run() {
			long idleSinceNanos = System.nanoTime();
			boolean retired = false;

			try {
				while (!shuttingDown) {
					Job job;

					try {
						job = queue.poll(POLL_INTERVAL.toNanos(), TimeUnit.NANOSECONDS);
					} catch (InterruptedException e) {
						Thread.currentThread().interrupt();
						break;
					}

					if (job == null) {
						if (System.nanoTime() - idleSinceNanos >= workerIdleTimeout.toNanos() && tryRetire()) {
							retired = true;
							break;
						}

						continue;
					}

					idleWorkerCount.decrementAndGet();
					busyWorkerCount.incrementAndGet();
					this.currentJob = job;

					// Work may have queued up while this worker still counted as idle
					growIfNeeded();

					try {
						job.run();
					} catch (Throwable t) {
						logEventConsumer.accept(LogEvent.with(LogEventType.WORKER_FAILED, "Connection job failed unexpectedly")
								.throwable(t)
								.build());
					} finally {
						this.currentJob = null;
						busyWorkerCount.decrementAndGet();
						idleWorkerCount.incrementAndGet();
						idleSinceNanos = System.nanoTime();
					}
				}
			} finally {
				idleWorkerCount.decrementAndGet();

				if (!retired)
					workerCount.decrementAndGet();

				workers.remove(this);
			}
		}

		@NonNull
		Thread getThread() {
			return requireNonNull(this.thread);
		}

		void setThread(@NonNull Thread thread) {
			this.thread = thread;
		}

		@Nullable
		Job getCurrentJob() {
			return this.currentJob;
		}
	}
}
