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

import com.gantry.StatusCode;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Abstract superclass for exceptions raised while reading a request off the wire which the server answers with an HTTP error status.
 * <p>
 * If no response bytes have been written yet, the server sends {@link #getStatusCode()} with a short plaintext explanation and closes the connection.
 */
@NotThreadSafe
public abstract class HttpProtocolException extends RuntimeException {
	@NonNull
	private final StatusCode statusCode;

	public HttpProtocolException(@NonNull StatusCode statusCode,
															 @Nullable String message) {
		super(message);
		requireNonNull(statusCode);
		this.statusCode = statusCode;
	}

	public HttpProtocolException(@NonNull StatusCode statusCode,
															 @Nullable String message,
															 @Nullable Throwable cause) {
		super(message, cause);
		requireNonNull(statusCode);
		this.statusCode = statusCode;
	}

	/**
	 * The status the server responds with when this exception is raised.
	 *
	 * @return the response status
	 */
	@NonNull
	public StatusCode getStatusCode() {
		return this.statusCode;
	}
}
