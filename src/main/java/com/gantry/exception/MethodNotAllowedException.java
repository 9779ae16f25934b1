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
 * Thrown for request methods the server refuses outright, such as {@code CONNECT}.
 * <p>
 * Results in an HTTP 405 (Method Not Allowed) status code.
 */
@NotThreadSafe
public class MethodNotAllowedException extends HttpProtocolException {
	@NonNull
	private final String method;

	public MethodNotAllowedException(@NonNull String method) {
		super(StatusCode.HTTP_405, format("%s is not supported by this server", requireNonNull(method)));
		this.method = method;
	}

	@NonNull
	public String getMethod() {
		return this.method;
	}
}
