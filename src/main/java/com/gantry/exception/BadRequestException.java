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

/**
 * Thrown when request framing is malformed: a bad request line, a bad header, or a bad chunk.
 * <p>
 * Results in an HTTP 400 (Bad Request) status code.
 */
@NotThreadSafe
public class BadRequestException extends HttpProtocolException {
	public BadRequestException(@Nullable String message) {
		super(StatusCode.HTTP_400, message);
	}

	public BadRequestException(@Nullable String message,
														 @Nullable Throwable cause) {
		super(StatusCode.HTTP_400, message, cause);
	}

	protected BadRequestException(@NonNull StatusCode statusCode,
																@Nullable String message) {
		super(statusCode, message);
	}
}
