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
 * Thrown when a request declares a {@code Transfer-Encoding} other than {@code chunked}.
 * <p>
 * Results in an HTTP 501 (Not Implemented) status code.
 */
@NotThreadSafe
public class UnsupportedTransferCodingException extends HttpProtocolException {
	@NonNull
	private final String transferCoding;

	public UnsupportedTransferCodingException(@NonNull String transferCoding) {
		super(StatusCode.HTTP_501, format("Unsupported transfer-coding '%s'", requireNonNull(transferCoding)));
		this.transferCoding = transferCoding;
	}

	@NonNull
	public String getTransferCoding() {
		return this.transferCoding;
	}
}
