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

import com.gantry.exception.UnexpectedEofException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.IOException;
import java.util.OptionalLong;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Exposes exactly {@code Content-Length} bytes of the underlying stream, then reports end of stream.
 */
@NotThreadSafe
final class LengthDelimitedRequestBody extends RequestBody {
	@NonNull
	private final SocketStream socketStream;
	private final long contentLength;
	private long remaining;

	LengthDelimitedRequestBody(@NonNull SocketStream socketStream,
														 @NonNull Long contentLength,
														 @Nullable ContinueSender continueSender) {
		super(continueSender);
		requireNonNull(socketStream);
		requireNonNull(contentLength);

		if (contentLength < 0)
			throw new IllegalArgumentException("Content length must be >= 0");

		this.socketStream = socketStream;
		this.contentLength = contentLength;
		this.remaining = contentLength;
	}

	@Override
	public int read(@NonNull byte[] destination,
									int offset,
									int length) throws IOException {
		requireNonNull(destination);

		if (length == 0)
			return 0;

		if (this.remaining == 0)
			return -1;

		ensureContinueSent();

		int count;

		try {
			count = this.socketStream.read(destination, offset, (int) Math.min(length, this.remaining));
		} catch (IOException e) {
			markFailed();
			throw e;
		}

		if (count < 0) {
			markFailed();
			throw new UnexpectedEofException(format("Connection closed with %d of %d body bytes unread", this.remaining, this.contentLength));
		}

		this.remaining -= count;
		return count;
	}

	@NonNull
	@Override
	public OptionalLong getContentLength() {
		return OptionalLong.of(this.contentLength);
	}

	@NonNull
	@Override
	public Boolean isChunked() {
		return false;
	}

	@NonNull
	@Override
	public Boolean isFullyConsumed() {
		return this.remaining == 0;
	}
}
