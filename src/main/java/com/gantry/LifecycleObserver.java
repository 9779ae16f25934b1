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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.SocketAddress;
import java.time.Duration;

/**
 * Read-only hooks into a server's lifecycle and its connections.
 * <p>
 * Methods are invoked on server threads, connection hooks on the worker handling the connection, so implementations
 * must be threadsafe and should return quickly. Exceptions thrown from any method other than
 * {@link #didReceiveLogEvent(LogEvent)} are caught and reported via {@link #didReceiveLogEvent(LogEvent)} as
 * {@link LogEventType#LIFECYCLE_OBSERVER_FAILED}.
 * <p>
 * A standard threadsafe implementation can be acquired via the {@link #defaultInstance()} factory method.
 */
public interface LifecycleObserver {
	default void willStartServer(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called once the listening socket is bound and workers are running.
	 */
	default void didStartServer(@NonNull Server server) {
		// No-op by default
	}

	default void didFailToStartServer(@NonNull Server server,
																		@NonNull Throwable throwable) {
		// No-op by default
	}

	default void willStopServer(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called after the listener is closed and every worker has exited or been abandoned.
	 */
	default void didStopServer(@NonNull Server server) {
		// No-op by default
	}

	default void didAcceptConnection(@NonNull Long connectionId,
																	 @Nullable SocketAddress remoteAddress) {
		// No-op by default
	}

	/**
	 * Called when an accepted connection is turned away because no worker could take it in time.
	 */
	default void didRejectConnection(@Nullable SocketAddress remoteAddress) {
		// No-op by default
	}

	default void didFailTlsHandshake(@NonNull Long connectionId,
																	 @NonNull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called after a request's headers are parsed and before the {@link Gateway} sees it.
	 */
	default void willStartRequestHandling(@NonNull Request request) {
		// No-op by default
	}

	/**
	 * Called after the response has been written, or writing it has failed.
	 *
	 * @param statusCode the status sent, or {@code null} if no response line made it out
	 * @param duration   time from the request line arriving to the response being flushed
	 * @param throwable  the failure, if handling did not complete normally
	 */
	default void didFinishRequestHandling(@NonNull Request request,
																				@Nullable Integer statusCode,
																				@NonNull Duration duration,
																				@Nullable Throwable throwable) {
		// No-op by default
	}

	default void didCloseConnection(@NonNull ConnectionSummary connectionSummary) {
		// No-op by default
	}

	/**
	 * Called when the server emits a log event. The default implementation writes to {@code stderr}.
	 */
	default void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		String message = logEvent.getMessage();
		Throwable throwable = logEvent.getThrowable().orElse(null);

		if (throwable == null) {
			System.err.printf("%s::didReceiveLogEvent [%s]: %s\n", LifecycleObserver.class.getSimpleName(), logEvent.getLogEventType().name(), message);
		} else {
			StringWriter stringWriter = new StringWriter();
			PrintWriter printWriter = new PrintWriter(stringWriter);
			throwable.printStackTrace(printWriter);
			String throwableWithStackTrace = stringWriter.toString();

			System.err.printf("%s::didReceiveLogEvent [%s]: %s\n%s\n", LifecycleObserver.class.getSimpleName(), logEvent.getLogEventType().name(), message, throwableWithStackTrace);
		}
	}

	/**
	 * Acquires a threadsafe {@link LifecycleObserver} instance with sensible defaults.
	 *
	 * @return a {@code LifecycleObserver} with default settings
	 */
	@NonNull
	static LifecycleObserver defaultInstance() {
		return DefaultLifecycleObserver.defaultInstance();
	}
}
