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

import javax.annotation.concurrent.NotThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.OptionalLong;

import static java.util.Objects.requireNonNull;

/**
 * A body streamed from an {@link InputStream} in buffer-sized chunks.
 */
@NotThreadSafe
final class InputStreamResponseBody implements ResponseBody {
	@NonNull
	private static final Integer CHUNK_SIZE_IN_BYTES;

	static {
		CHUNK_SIZE_IN_BYTES = 8 * 1024;
	}

	@NonNull
	private final InputStream inputStream;
	@Nullable
	private final Long length;

	InputStreamResponseBody(@NonNull InputStream inputStream,
													@Nullable Long length) {
		requireNonNull(inputStream);

		if (length != null && length < 0)
			throw new IllegalArgumentException("Length must be >= 0");

		this.inputStream = inputStream;
		this.length = length;
	}

	@Nullable
	@Override
	public byte[] nextChunk() throws IOException {
		byte[] buffer = new byte[CHUNK_SIZE_IN_BYTES];
		int count = this.inputStream.read(buffer);

		while (count == 0)
			count = this.inputStream.read(buffer);

		if (count < 0)
			return null;

		return count == buffer.length ? buffer : Arrays.copyOf(buffer, count);
	}

	@NonNull
	@Override
	public OptionalLong getLength() {
		return this.length == null ? OptionalLong.empty() : OptionalLong.of(this.length);
	}

	@Override
	public void close() throws IOException {
		this.inputStream.close();
	}
}
