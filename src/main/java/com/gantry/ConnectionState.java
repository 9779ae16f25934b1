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
 * Where an {@link HttpConnection} is in its request/response cycle.
 */
enum ConnectionState {
	/**
	 * Accepted and queued, not yet picked up by a worker.
	 */
	PENDING,
	TLS_HANDSHAKE,
	/**
	 * Waiting for the first byte of the next request, bounded by the connection or keep-alive timeout.
	 */
	AWAITING_REQUEST,
	READING_HEADERS,
	READING_BODY,
	DISPATCHING,
	WRITING_RESPONSE,
	KEEP_ALIVE,
	CLOSED
}
