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

/**
 * Kinds of {@link LogEvent} instances that a {@link Server} can produce.
 */
public enum LogEventType {
	/**
	 * Accepting a connection failed for a reason other than shutdown. The acceptor backs off and keeps going.
	 */
	ACCEPT_FAILED,
	/**
	 * An accepted connection could not be queued for a worker within the queue timeout and was turned away.
	 */
	CONNECTION_REJECTED,
	/**
	 * A client failed the TLS handshake, or spoke plain HTTP to a TLS port.
	 */
	TLS_HANDSHAKE_FAILED,
	/**
	 * {@link Gateway#handle(Request, ResponseStarter)} threw an exception.
	 */
	GATEWAY_FAILED,
	/**
	 * A {@link Gateway} misused the response API, for example by calling {@code startResponse} twice or writing more
	 * bytes than its declared {@code Content-Length}.
	 */
	GATEWAY_PROTOCOL_VIOLATION,
	/**
	 * {@link ResponseBody#close()} threw an exception.
	 */
	RESPONSE_BODY_CLOSE_FAILED,
	/**
	 * An unexpected exception escaped connection handling.
	 */
	CONNECTION_INTERNAL_ERROR,
	/**
	 * Closing a connection's socket threw an exception.
	 */
	CONNECTION_CLOSE_FAILED,
	/**
	 * A {@link LifecycleObserver} method threw an exception.
	 */
	LIFECYCLE_OBSERVER_FAILED,
	/**
	 * Shutdown gave up waiting for in-flight requests and aborted them.
	 */
	SERVER_SHUTDOWN_INCOMPLETE,
	/**
	 * A Unix domain socket file could not be removed after the server stopped.
	 */
	UNIX_SOCKET_CLEANUP_FAILED,
	/**
	 * Peer credentials were requested but could not be read from a Unix domain socket connection, or their account
	 * names could not be looked up. The connection is served without them.
	 */
	PEER_CREDENTIALS_UNAVAILABLE,
	/**
	 * A worker thread failed outside of any connection.
	 */
	WORKER_FAILED
}
