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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.OptionalLong;

import static java.util.Objects.requireNonNull;

/**
 * An in-memory body, for exercising gateways without a socket.
 */
@NotThreadSafe
final class ByteArrayRequestBody extends RequestBody {
	@NonNull
	private final byte[] bytes;
	private int position;

	ByteArrayRequestBody(@NonNull byte[] bytes) {
		super(null);
		requireNonNull(bytes);
		this.bytes = bytes.clone();
	}

	@Override
	public int read(@NonNull byte[] destination,
									int offset,
									int length) {
		requireNonNull(destination);

		if (length == 0)
			return 0;

		if (this.position >= this.bytes.length)
			return -1;

		int count = Math.min(length, this.bytes.length - this.position);
		System.arraycopy(this.bytes, this.position, destination, offset, count);
		this.position += count;
		return count;
	}

	@NonNull
	@Override
	public OptionalLong getContentLength() {
		return OptionalLong.of(this.bytes.length);
	}

	@NonNull
	@Override
	public Boolean isChunked() {
		return false;
	}

	@NonNull
	@Override
	public Boolean isFullyConsumed() {
		return this.position >= this.bytes.length;
	}
}
