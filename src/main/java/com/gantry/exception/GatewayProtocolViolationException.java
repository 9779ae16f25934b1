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

package com.gantry.exception;

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Thrown when a {@link com.gantry.Gateway} breaks the response contract, for example by starting a response twice,
 * writing body bytes before starting a response, or writing more bytes than its declared {@code Content-Length}.
 * <p>
 * The server answers with HTTP 500 if nothing has been sent yet, otherwise it aborts the connection.
 */
@NotThreadSafe
public class GatewayProtocolViolationException extends RuntimeException {
	public GatewayProtocolViolationException(@Nullable String message) {
		super(message);
	}

	public GatewayProtocolViolationException(@Nullable String message,
																					 @Nullable Throwable cause) {
		super(message, cause);
	}
}
