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
import java.util.OptionalLong;

import static java.util.Objects.requireNonNull;

/**
 * A body held entirely in memory, produced as a single chunk.
 */
@NotThreadSafe
final class ByteArrayResponseBody implements ResponseBody {
	@NonNull
	static final ResponseBody EMPTY;

	static {
		EMPTY = new ResponseBody() {
			@Nullable
			@Override
			public byte[] nextChunk() {
				return null;
			}

			@NonNull
			@Override
			public OptionalLong getLength() {
				return OptionalLong.of(0L);
			}
		};
	}

	@NonNull
	private final byte[] bytes;
	private boolean consumed;

	ByteArrayResponseBody(@NonNull byte[] bytes) {
		requireNonNull(bytes);
		this.bytes = bytes;
	}

	@Nullable
	@Override
	public byte[] nextChunk() {
		if (this.consumed)
			return null;

		this.consumed = true;
		return this.bytes;
	}

	@NonNull
	@Override
	public OptionalLong getLength() {
		return OptionalLong.of(this.bytes.length);
	}
}
