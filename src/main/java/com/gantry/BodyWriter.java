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

import java.io.IOException;

import static java.util.Objects.requireNonNull;

/**
 * Pushes response body bytes to the client. The first write sends the status line and headers.
 */
public interface BodyWriter {
	void write(@NonNull byte[] bytes,
						 int offset,
						 int length) throws IOException;

	default void write(@NonNull byte[] bytes) throws IOException {
		requireNonNull(bytes);
		write(bytes, 0, bytes.length);
	}

	/**
	 * Sends anything buffered so far, including the headers if no body byte has been written yet.
	 */
	void flush() throws IOException;
}
