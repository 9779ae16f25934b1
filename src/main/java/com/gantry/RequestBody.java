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
import java.util.OptionalLong;

import static java.util.Objects.requireNonNull;

/**
 * A lazily-read request body.
 * <p>
 * Gateways read it incrementally like any {@link InputStream}. Before returning, a gateway should either read it to the
 * end or call {@link #discard()}; whatever remains is then drained by the server so the connection stays aligned on
 * request boundaries. A body that fails mid-read (bad chunk framing, size limit, premature end of stream) leaves the
 * connection unusable, and the server closes it after the response.
 * <p>
 * Instances for testing gateways can be acquired via {@link #ofBytes(byte[])} and {@link #empty()}.
 */
@NotThreadSafe
public abstract class RequestBody extends InputStream {
	@Nullable
	private final ContinueSender continueSender;
	private boolean continueSent;
	private boolean discarded;
	private boolean failed;

	/**
	 * Sends the interim {@code 100 Continue} response the first time the body is read.
	 */
	@FunctionalInterface
	interface ContinueSender {
		void sendContinue() throws IOException;
	}

	RequestBody(@Nullable ContinueSender continueSender) {
		this.continueSender = continueSender;
	}

	@NonNull
	public static RequestBody empty() {
		return new EmptyRequestBody();
	}

	@NonNull
	public static RequestBody ofBytes(@NonNull byte[] bytes) {
		requireNonNull(bytes);
		return new ByteArrayRequestBody(bytes);
	}

	/**
	 * The declared {@code Content-Length}, if the body is length-delimited.
	 *
	 * @return the length, or {@link OptionalLong#empty()} for chunked bodies
	 */
	@NonNull
	public abstract OptionalLong getContentLength();

	@NonNull
	public abstract Boolean isChunked();

	/**
	 * Has every byte of the body, including any chunked trailer, been read?
	 *
	 * @return {@code true} if the body has been read to its end
	 */
	@NonNull
	public abstract Boolean isFullyConsumed();

	/**
	 * Trailer fields that followed a chunked body. Available once the body is fully consumed.
	 *
	 * @return the trailers, empty for length-delimited bodies
	 */
	@NonNull
	public Headers getTrailers() {
		return Headers.empty();
	}

	/**
	 * Marks the rest of this body as unwanted. The server drains it after the response is started.
	 */
	public void discard() {
		this.discarded = true;
	}

	@NonNull
	public Boolean isDiscarded() {
		return this.discarded;
	}

	@Override
	public int read() throws IOException {
		byte[] single = new byte[1];

		while (true) {
			int count = read(single, 0, 1);

			if (count < 0)
				return -1;

			if (count == 1)
				return single[0] & 0xFF;
		}
	}

	/**
	 * Reads and throws away everything left in the body.
	 *
	 * @return the number of bytes discarded
	 */
	long drain() throws IOException {
		byte[] scratch = new byte[8 * 1024];
		long total = 0;
		int count;

		while ((count = read(scratch, 0, scratch.length)) >= 0)
			total += count;

		return total;
	}

	void ensureContinueSent() throws IOException {
		if (this.continueSender != null && !this.continueSent) {
			this.continueSent = true;
			this.continueSender.sendContinue();
		}
	}

	/**
	 * Is the client still waiting for {@code 100 Continue} before it sends the body?
	 */
	@NonNull
	Boolean isAwaitingContinue() {
		return this.continueSender != null && !this.continueSent && !isFullyConsumed();
	}

	void markFailed() {
		this.failed = true;
	}

	@NonNull
	Boolean isFailed() {
		return this.failed;
	}
}
