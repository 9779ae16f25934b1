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

/**
 * The {@code start_response}-style callback a {@link Gateway} uses to fix a response's status line and headers.
 * <p>
 * Headers are not sent until the first body byte is written (or the gateway returns), so a gateway may call again with
 * an {@code error} to replace a response that has not gone out yet, for example to turn a {@code 200} into a
 * {@code 500} after a failure. Calling a second time without an {@code error} is a protocol violation.
 * <p>
 * The server supplies {@code Date} and {@code Server} headers when absent, and frames the body with {@code Content-Length}
 * if the gateway declares one, chunked encoding otherwise (HTTP/1.1), or by closing the connection (HTTP/1.0).
 */
public interface ResponseStarter {
	/**
	 * Starts the response.
	 *
	 * @param statusCode three-digit HTTP status code
	 * @param headers    response headers
	 * @return a writer for body bytes
	 * @throws com.gantry.exception.GatewayProtocolViolationException if a response was already started, or the status
	 *                                                                   or headers are malformed
	 */
	@NonNull
	default BodyWriter startResponse(@NonNull Integer statusCode,
																	 @NonNull Headers headers) {
		return startResponse(statusCode, null, headers, null);
	}

	/**
	 * Starts the response, or replaces one that has not been sent yet.
	 *
	 * @param statusCode   three-digit HTTP status code
	 * @param reasonPhrase reason phrase for the status line; the standard phrase is used if {@code null}
	 * @param headers      response headers
	 * @param error        the failure that prompted a replacement response, or {@code null} for a first call. If the
	 *                     original response's headers were already sent, the error is rethrown wrapped in a
	 *                     {@link com.gantry.exception.GatewayProtocolViolationException} and the connection is aborted
	 * @return a writer for body bytes
	 */
	@NonNull
	BodyWriter startResponse(@NonNull Integer statusCode,
													 @Nullable String reasonPhrase,
													 @NonNull Headers headers,
													 @Nullable Throwable error);
}
