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
import java.io.IOException;

/**
 * Thrown when the server side of a TLS handshake fails, including when a client speaks plain HTTP to a TLS port.
 */
@NotThreadSafe
public class TlsHandshakeException extends IOException {
	public TlsHandshakeException(@Nullable String message) {
		super(message);
	}

	public TlsHandshakeException(@Nullable String message,
															 @Nullable Throwable cause) {
		super(message, cause);
	}
}
