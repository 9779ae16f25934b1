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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.OptionalLong;

import static java.util.Objects.requireNonNull;

/**
 * A lazy producer of response body chunks, returned by a {@link Gateway}.
 * <p>
 * The server pulls chunks until {@link #nextChunk()} returns {@code null}, then calls {@link #close()} whether or not the
 * body was exhausted.
 */
public interface ResponseBody extends Closeable {
	/**
	 * The next piece of the body.
	 *
	 * @return the next chunk, or {@code null} when the body is exhausted
	 */
	@Nullable
	byte[] nextChunk() throws IOException;

	/**
	 * The total body length, if known up front.
	 *
	 * @return the length, or {@link OptionalLong#empty()} if unknown
	 */
	@NonNull
	default OptionalLong getLength() {
		return OptionalLong.empty();
	}

	@Override
	default void close() throws IOException {
		// No-op by default
	}

	@NonNull
	static ResponseBody empty() {
		return ByteArrayResponseBody.EMPTY;
	}

	@NonNull
	static ResponseBody ofBytes(@NonNull byte[] bytes) {
		requireNonNull(bytes);
		return new ByteArrayResponseBody(bytes);
	}

	@NonNull
	static ResponseBody ofString(@NonNull String string) {
		requireNonNull(string);
		return new ByteArrayResponseBody(string.getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * A body produced from a fixed sequence of chunks, for example a list built up by the application.
	 */
	@NonNull
	static ResponseBody ofChunks(@NonNull List<@NonNull byte[]> chunks) {
		requireNonNull(chunks);
		return new IterableResponseBody(chunks);
	}

	/**
	 * A body streamed from an {@link InputStream}, which is closed along with the body.
	 *
	 * @param inputStream the source
	 * @param length      the exact number of bytes the stream will produce, or {@code null} if unknown
	 */
	@NonNull
	static ResponseBody ofInputStream(@NonNull InputStream inputStream,
																		@Nullable Long length) {
		requireNonNull(inputStream);
		return new InputStreamResponseBody(inputStream, length);
	}
}
