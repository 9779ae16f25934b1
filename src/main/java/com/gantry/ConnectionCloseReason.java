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
 * Why a connection ended, as reported by {@link LifecycleObserver#didCloseConnection(ConnectionSummary)}.
 */
public enum ConnectionCloseReason {
	/**
	 * The client closed its side between requests.
	 */
	CLIENT_CLOSED,
	/**
	 * No new request arrived within the connection or keep-alive timeout.
	 */
	IDLE_TIMEOUT,
	/**
	 * A request's headers did not arrive in time.
	 */
	REQUEST_TIMEOUT,
	/**
	 * The last response was not eligible for keep-alive.
	 */
	CONNECTION_CLOSE,
	/**
	 * The client sent something that could not be parsed.
	 */
	PROTOCOL_ERROR,
	/**
	 * The gateway failed or misused the response API.
	 */
	GATEWAY_ERROR,
	/**
	 * Reading or writing failed at the transport level.
	 */
	CONNECTION_ERROR,
	TLS_HANDSHAKE_FAILED,
	SERVER_SHUTDOWN,
	INTERNAL_ERROR
}
