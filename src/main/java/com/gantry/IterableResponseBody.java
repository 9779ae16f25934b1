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
import java.util.Iterator;
import java.util.List;
import java.util.OptionalLong;

import static java.util.Objects.requireNonNull;

/**
 * A body produced from a list of chunks, one at a time.
 */
@NotThreadSafe
final class IterableResponseBody implements ResponseBody {
	@NonNull
	private final Iterator<@NonNull byte[]> chunks;
	private final long length;

	IterableResponseBody(@NonNull List<@NonNull byte[]> chunks) {
		requireNonNull(chunks);

		long length = 0;

		for (byte[] chunk : chunks)
			length += requireNonNull(chunk).length;

		this.chunks = List.copyOf(chunks).iterator();
		this.length = length;
	}

	@Nullable
	@Override
	public byte[] nextChunk() {
		return this.chunks.hasNext() ? this.chunks.next() : null;
	}

	@NonNull
	@Override
	public OptionalLong getLength() {
		return OptionalLong.of(this.length);
	}
}
