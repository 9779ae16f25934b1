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

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static java.util.Objects.requireNonNull;

/**
 * Writes response bodies with {@code Transfer-Encoding: chunked} framing.
 */
@ThreadSafe
final class ChunkedEncoding {
	@NonNull
	private static final byte[] CRLF;
	@NonNull
	private static final byte[] LAST_CHUNK;

	static {
		CRLF = "\r\n".getBytes(StandardCharsets.ISO_8859_1);
		LAST_CHUNK = "0\r\n\r\n".getBytes(StandardCharsets.ISO_8859_1);
	}

	private ChunkedEncoding() {
		// Non-instantiable
	}

	/**
	 * Writes one chunk. Zero-length input writes nothing, since an empty chunk would end the body.
	 */
	static void writeChunk(@NonNull SocketStream socketStream,
												 @NonNull byte[] bytes,
												 int offset,
												 int length) throws IOException {
		requireNonNull(socketStream);
		requireNonNull(bytes);

		if (length == 0)
			return;

		socketStream.write(chunkSizeLine(length));
		socketStream.write(bytes, offset, length);
		socketStream.write(CRLF);
	}

	static void writeLastChunk(@NonNull SocketStream socketStream) throws IOException {
		requireNonNull(socketStream);
		socketStream.write(LAST_CHUNK);
	}

	@NonNull
	static byte[] chunkSizeLine(int length) {
		return (Integer.toHexString(length).toUpperCase() + "\r\n").getBytes(StandardCharsets.ISO_8859_1);
	}
}
