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

import javax.annotation.concurrent.NotThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when the request line names an HTTP version this server cannot speak.
 * <p>
 * Results in an HTTP 505 (HTTP Version Not Supported) status code.
 */
@NotThreadSafe
public class HttpVersionNotSupportedException extends HttpProtocolException {
	@NonNull
	private final String protocol;

	public HttpVersionNotSupportedException(@NonNull String protocol) {
		super(StatusCode.HTTP_505, format("Cannot fulfill request for protocol %s", requireNonNull(protocol)));
		this.protocol = protocol;
	}

	@NonNull
	public String getProtocol() {
		return this.protocol;
	}
}
