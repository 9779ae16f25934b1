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

import com.gantry.exception.BadRequestException;
import com.gantry.exception.HttpProtocolException;
import com.gantry.exception.RequestTooLargeException;
import com.gantry.exception.RequestTooLargeException.Component;
import com.gantry.exception.UnexpectedEofException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.OptionalLong;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Decodes a {@code Transfer-Encoding: chunked} body.
 * <p>
 * Each chunk is a hex size line (extensions after {@code ;} are ignored), that many bytes, then {@code CRLF}. A zero-size
 * chunk ends the body and is followed by optional trailer fields and an empty line.
 */
@NotThreadSafe
final class ChunkedRequestBody extends RequestBody {
	@NonNull
	static final Integer MAXIMUM_CHUNK_SIZE_LINE_LENGTH_IN_BYTES;

	static {
		MAXIMUM_CHUNK_SIZE_LINE_LENGTH_IN_BYTES = 1024;
	}

	@NonNull
	private final SocketStream socketStream;
	// 0 means unlimited
	private final long maximumBodySizeInBytes;
	@NonNull
	private final Integer maximumTrailerSizeInBytes;
	private long chunkRemaining;
	private long totalBytes;
	private boolean chunkTerminatorPending;
	private boolean finished;
	@NonNull
	private Headers trailers;

	ChunkedRequestBody(@NonNull SocketStream socketStream,
										 @NonNull Long maximumBodySizeInBytes,
										 @NonNull Integer maximumTrailerSizeInBytes,
										 @Nullable ContinueSender continueSender) {
		super(continueSender);
		requireNonNull(socketStream);
		requireNonNull(maximumBodySizeInBytes);
		requireNonNull(maximumTrailerSizeInBytes);

		this.socketStream = socketStream;
		this.maximumBodySizeInBytes = maximumBodySizeInBytes;
		this.maximumTrailerSizeInBytes = maximumTrailerSizeInBytes;
		this.trailers = Headers.empty();
	}

	@Override
	public int read(@NonNull byte[] destination,
									int offset,
									int length) throws IOException {
		requireNonNull(destination);

		if (length == 0)
			return 0;

		if (this.finished)
			return -1;

		if (isFailed())
			throw new IOException("Chunked body is no longer readable");

		try {
			ensureContinueSent();

			if (this.chunkRemaining == 0) {
				if (this.chunkTerminatorPending) {
					readChunkTerminator();
					this.chunkTerminatorPending = false;
				}

				long chunkSize = readChunkSize();

				if (chunkSize == 0) {
					this.trailers = RequestParser.parseHeaderBlock(this.socketStream, this.maximumTrailerSizeInBytes, Component.HEADERS);
					this.finished = true;
					return -1;
				}

				if (this.maximumBodySizeInBytes > 0 && this.totalBytes + chunkSize > this.maximumBodySizeInBytes)
					throw new RequestTooLargeException(Component.BODY, this.maximumBodySizeInBytes);

				this.chunkRemaining = chunkSize;
				this.totalBytes += chunkSize;
			}

			int count = this.socketStream.read(destination, offset, (int) Math.min(length, this.chunkRemaining));

			if (count < 0)
				throw new UnexpectedEofException("Connection closed in the middle of a chunk");

			this.chunkRemaining -= count;

			if (this.chunkRemaining == 0)
				this.chunkTerminatorPending = true;

			return count;
		} catch (IOException | HttpProtocolException e) {
			markFailed();
			throw e;
		}
	}

	private long readChunkSize() throws IOException {
		byte[] line;

		try {
			line = this.socketStream.readLine(MAXIMUM_CHUNK_SIZE_LINE_LENGTH_IN_BYTES);
		} catch (SocketStream.LineTooLongException e) {
			throw new BadRequestException("Chunk size line is too long", e);
		}

		if (line.length == 0)
			throw new UnexpectedEofException("Connection closed before chunk size");

		if (!RequestParser.endsWithCrlf(line))
			throw new BadRequestException("Chunk size line must end with CRLF");

		String sizeLine = new String(line, 0, line.length - 2, StandardCharsets.ISO_8859_1);
		int extensionIndex = sizeLine.indexOf(';');
		String hex = (extensionIndex >= 0 ? sizeLine.substring(0, extensionIndex) : sizeLine).trim();

		if (hex.isEmpty() || hex.length() > 15)
			throw new BadRequestException(format("Bad chunked transfer size '%s'", hex));

		for (int i = 0; i < hex.length(); i++)
			if (Character.digit(hex.charAt(i), 16) < 0)
				throw new BadRequestException(format("Bad chunked transfer size '%s'", hex));

		return Long.parseLong(hex, 16);
	}

	private void readChunkTerminator() throws IOException {
		byte[] line;

		try {
			line = this.socketStream.readLine(2);
		} catch (SocketStream.LineTooLongException e) {
			throw new BadRequestException("Chunk data must be followed by CRLF", e);
		}

		if (line.length == 0)
			throw new UnexpectedEofException("Connection closed after chunk data");

		if (line.length != 2 || !RequestParser.endsWithCrlf(line))
			throw new BadRequestException("Chunk data must be followed by CRLF");
	}

	@NonNull
	@Override
	public OptionalLong getContentLength() {
		return OptionalLong.empty();
	}

	@NonNull
	@Override
	public Boolean isChunked() {
		return true;
	}

	@NonNull
	@Override
	public Boolean isFullyConsumed() {
		return this.finished;
	}

	@NonNull
	@Override
	public Headers getTrailers() {
		return this.trailers;
	}
}
