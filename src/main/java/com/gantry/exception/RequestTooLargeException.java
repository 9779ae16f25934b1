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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when some part of a request exceeds a configured size limit.
 * <p>
 * Results in HTTP 413 (body), 414 (request line) or 431 (header block), and the connection is always closed afterwards.
 */
@NotThreadSafe
public class RequestTooLargeException extends BadRequestException {
	/**
	 * Which part of the request was too large.
	 */
	public enum Component {
		REQUEST_LINE(StatusCode.HTTP_414),
		HEADERS(StatusCode.HTTP_431),
		BODY(StatusCode.HTTP_413);

		@NonNull
		private final StatusCode statusCode;

		Component(@NonNull StatusCode statusCode) {
			requireNonNull(statusCode);
			this.statusCode = statusCode;
		}

		@NonNull
		public StatusCode getStatusCode() {
			return this.statusCode;
		}
	}

	@NonNull
	private final Component component;
	@NonNull
	private final Long limitInBytes;

	public RequestTooLargeException(@NonNull Component component,
																	@NonNull Long limitInBytes) {
		this(component, limitInBytes, null);
	}

	public RequestTooLargeException(@NonNull Component component,
																	@NonNull Long limitInBytes,
																	@Nullable String message) {
		super(requireNonNull(component).getStatusCode(), message == null
				? format("Request %s exceeds the limit of %d bytes", component.name().toLowerCase().replace('_', ' '), limitInBytes)
				: message);
		requireNonNull(limitInBytes);

		this.component = component;
		this.limitInBytes = limitInBytes;
	}

	@NonNull
	public Component getComponent() {
		return this.component;
	}

	@NonNull
	public Long getLimitInBytes() {
		return this.limitInBytes;
	}
}
