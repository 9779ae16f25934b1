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
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Arrays;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Buffered reads and writes over a {@link Transport}, with cumulative byte counts.
 * <p>
 * {@link #read(int)} returns an empty array only on a clean end of stream. Any transport failure, timeouts included,
 * surfaces as an {@link IOException} and marks the stream {@link #isBroken() broken}. Nothing is retried.
 */
@NotThreadSafe
final class SocketStream implements Closeable {
	@NonNull
	static final Integer DEFAULT_BUFFER_SIZE_IN_BYTES;

	static {
		DEFAULT_BUFFER_SIZE_IN_BYTES = 8 * 1024;
	}

	@NonNull
	private final Transport transport;
	@NonNull
	private final byte[] readBuffer;
	@NonNull
	private final byte[] writeBuffer;
	private int readPosition;
	private int readLimit;
	private int writePosition;
	private long bytesRead;
	private long bytesWritten;
	private boolean broken;
	private boolean endOfStream;
	@Nullable
	private Duration readTimeout;
	@Nullable
	private Long readDeadlineNanos;

	SocketStream(@NonNull Transport transport) {
		this(transport, DEFAULT_BUFFER_SIZE_IN_BYTES);
	}

	SocketStream(@NonNull Transport transport,
							 @NonNull Integer bufferSizeInBytes) {
		requireNonNull(transport);
		requireNonNull(bufferSizeInBytes);

		if (bufferSizeInBytes <= 0)
			throw new IllegalArgumentException("Buffer size must be > 0");

		this.transport = transport;
		this.readBuffer = new byte[bufferSizeInBytes];
		this.writeBuffer = new byte[bufferSizeInBytes];
	}

	/**
	 * Reads up to {@code maxBytes}, blocking until at least one byte is available.
	 *
	 * @param maxBytes upper bound on the number of bytes returned
	 * @return the bytes read, empty only on end of stream
	 */
	@NonNull
	byte[] read(int maxBytes) throws IOException {
		if (maxBytes <= 0)
			throw new IllegalArgumentException("maxBytes must be > 0");

		if (!fillIfEmpty())
			return new byte[0];

		int count = Math.min(maxBytes, this.readLimit - this.readPosition);
		byte[] bytes = Arrays.copyOfRange(this.readBuffer, this.readPosition, this.readPosition + count);
		this.readPosition += count;
		return bytes;
	}

	/**
	 * {@link java.io.InputStream}-style read into a caller-supplied array.
	 *
	 * @return the number of bytes read, or {@code -1} on end of stream
	 */
	int read(@NonNull byte[] destination,
					 int offset,
					 int length) throws IOException {
		requireNonNull(destination);

		if (length == 0)
			return 0;

		if (!fillIfEmpty())
			return -1;

		int count = Math.min(length, this.readLimit - this.readPosition);
		System.arraycopy(this.readBuffer, this.readPosition, destination, offset, count);
		this.readPosition += count;
		return count;
	}

	/**
	 * Blocks until a byte is available and returns it without consuming it.
	 *
	 * @return the next byte, or {@code -1} on end of stream
	 */
	int peek() throws IOException {
		if (!fillIfEmpty())
			return -1;

		return this.readBuffer[this.readPosition] & 0xFF;
	}

	/**
	 * Reads through the next {@code LF}, returning the line with its terminator.
	 *
	 * @param limitInBytes the longest acceptable line, terminator included
	 * @return the line, or an empty array if the stream ended before any byte was read. A line cut short by end of stream
	 * is returned without a terminator
	 * @throws LineTooLongException if no terminator appears within {@code limitInBytes}
	 */
	@NonNull
	byte[] readLine(int limitInBytes) throws IOException {
		ByteArrayOutputStream line = new ByteArrayOutputStream(Math.min(limitInBytes, 256));

		while (true) {
			if (!fillIfEmpty())
				return line.toByteArray();

			int start = this.readPosition;
			int end = start;

			while (end < this.readLimit && this.readBuffer[end] != '\n')
				end++;

			boolean foundTerminator = end < this.readLimit;
			int count = (foundTerminator ? end + 1 : end) - start;

			if (line.size() + count > limitInBytes)
				throw new LineTooLongException(limitInBytes);

			line.write(this.readBuffer, start, count);
			this.readPosition += count;

			if (foundTerminator)
				return line.toByteArray();
		}
	}

	void write(@NonNull byte[] bytes) throws IOException {
		requireNonNull(bytes);
		write(bytes, 0, bytes.length);
	}

	void write(@NonNull byte[] bytes,
						 int offset,
						 int length) throws IOException {
		requireNonNull(bytes);

		if (length >= this.writeBuffer.length) {
			flush();
			writeToTransport(bytes, offset, length);
			return;
		}

		if (this.writePosition + length > this.writeBuffer.length)
			flush();

		System.arraycopy(bytes, offset, this.writeBuffer, this.writePosition, length);
		this.writePosition += length;
	}

	void flush() throws IOException {
		if (this.writePosition == 0)
			return;

		int length = this.writePosition;
		this.writePosition = 0;
		writeToTransport(this.writeBuffer, 0, length);
	}

	private void writeToTransport(@NonNull byte[] bytes,
																int offset,
																int length) throws IOException {
		if (this.broken)
			throw new IOException("Connection is no longer usable");

		try {
			getTransport().write(bytes, offset, length);
			this.bytesWritten += length;
		} catch (IOException e) {
			this.broken = true;
			throw e;
		}
	}

	// Returns false on end of stream
	private boolean fillIfEmpty() throws IOException {
		if (this.readPosition < this.readLimit)
			return true;

		if (this.endOfStream)
			return false;

		if (this.broken)
			throw new IOException("Connection is no longer usable");

		Duration timeout = this.readTimeout;

		if (this.readDeadlineNanos != null) {
			long remainingNanos = this.readDeadlineNanos - System.nanoTime();

			if (remainingNanos <= 0) {
				this.broken = true;
				throw new SocketTimeoutException("Read deadline expired");
			}

			Duration remaining = Duration.ofNanos(remainingNanos);

			if (timeout == null || remaining.compareTo(timeout) < 0)
				timeout = remaining;
		}

		int count;

		try {
			count = getTransport().read(this.readBuffer, 0, this.readBuffer.length, timeout);
		} catch (IOException e) {
			this.broken = true;
			throw e;
		}

		if (count < 0) {
			this.endOfStream = true;
			return false;
		}

		this.readPosition = 0;
		this.readLimit = count;
		this.bytesRead += count;
		return count > 0 || fillIfEmpty();
	}

	/**
	 * Applies to each individual blocking read. {@code null} means wait forever.
	 */
	void setReadTimeout(@Nullable Duration readTimeout) {
		this.readTimeout = readTimeout;
	}

	/**
	 * Bounds the total time spent across reads until cleared. {@code null} clears the deadline.
	 */
	void setReadDeadline(@Nullable Duration fromNow) {
		this.readDeadlineNanos = fromNow == null ? null : System.nanoTime() + fromNow.toNanos();
	}

	@NonNull
	Boolean hasBufferedInput() {
		return this.readPosition < this.readLimit;
	}

	@NonNull
	Boolean isBroken() {
		return this.broken;
	}

	@NonNull
	Long getBytesRead() {
		return this.bytesRead;
	}

	@NonNull
	Long getBytesWritten() {
		return this.bytesWritten;
	}

	@NonNull
	Transport getTransport() {
		return this.transport;
	}

	@Override
	public void close() throws IOException {
		getTransport().close();
	}

	/**
	 * A line did not terminate within its size limit.
	 */
	static final class LineTooLongException extends IOException {
		LineTooLongException(int limitInBytes) {
			super(format("Line exceeds %d bytes", limitInBytes));
		}
	}
}
