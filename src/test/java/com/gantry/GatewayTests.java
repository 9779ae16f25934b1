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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.gantry.TestSupport.bytes;

@ThreadSafe
public class GatewayTests {
	@Test
	public void responder_adds_content_length_for_known_bodies() throws Exception {
		RecordingResponseStarter responseStarter = new RecordingResponseStarter();
		Gateway gateway = Gateway.withResponder(request -> Response.withStatusCode(201)
				.reasonPhrase("Made")
				.headers(Headers.with("Location", "/widgets/1").build())
				.body("{}")
				.build());

		ResponseBody responseBody = gateway.handle(Request.withMethod("POST", "/widgets").build(), responseStarter);

		Assertions.assertEquals(201, responseStarter.statusCode);
		Assertions.assertEquals("Made", responseStarter.reasonPhrase);
		Assertions.assertEquals("2", responseStarter.headers.getFirst("Content-Length").orElse(null));
		Assertions.assertEquals("/widgets/1", responseStarter.headers.getFirst("Location").orElse(null));
		Assertions.assertEquals("{}", drain(responseBody));
	}

	@Test
	public void responder_leaves_explicit_framing_alone() throws Exception {
		RecordingResponseStarter responseStarter = new RecordingResponseStarter();
		Gateway gateway = Gateway.withResponder(request -> Response.withStatusCode(200)
				.headers(Headers.with("Transfer-Encoding", "chunked").build())
				.body(ResponseBody.ofInputStream(new ByteArrayInputStream(bytes("streamed")), null))
				.build());

		gateway.handle(Request.withMethod("GET", "/").build(), responseStarter);

		Assertions.assertFalse(responseStarter.headers.contains("Content-Length"));
	}

	@Test
	public void responder_must_not_return_null() {
		Gateway gateway = Gateway.withResponder(request -> null);
		Assertions.assertThrows(IllegalStateException.class, () -> gateway.handle(Request.withMethod("GET", "/").build(), new RecordingResponseStarter()));
	}

	@Test
	public void input_stream_body_streams_and_closes() throws IOException {
		AtomicBoolean closed = new AtomicBoolean();
		ByteArrayInputStream inputStream = new ByteArrayInputStream(new byte[20_000]) {
			@Override
			public void close() throws IOException {
				closed.set(true);
				super.close();
			}
		};

		ResponseBody responseBody = ResponseBody.ofInputStream(inputStream, 20_000L);
		int chunks = 0;
		int total = 0;
		byte[] chunk;

		while ((chunk = responseBody.nextChunk()) != null) {
			chunks++;
			total += chunk.length;
		}

		responseBody.close();

		Assertions.assertEquals(20_000L, responseBody.getLength().orElse(-1));
		Assertions.assertEquals(20_000, total);
		Assertions.assertEquals(3, chunks);
		Assertions.assertTrue(closed.get());
	}

	@Test
	public void chunk_and_byte_bodies_report_their_length() throws IOException {
		ResponseBody chunks = ResponseBody.ofChunks(List.of(bytes("ab"), bytes("cde")));

		Assertions.assertEquals(5L, chunks.getLength().orElse(-1));
		Assertions.assertEquals("abcde", drain(chunks));
		Assertions.assertEquals(0L, ResponseBody.empty().getLength().orElse(-1));
		Assertions.assertNull(ResponseBody.empty().nextChunk());
		Assertions.assertEquals("héllo", drain(ResponseBody.ofString("héllo")));
	}

	@Test
	public void request_splits_target_when_no_path_is_given() {
		Request request = Request.withMethod("GET", "/search?q=gantry").build();

		Assertions.assertEquals("/search", request.getPath());
		Assertions.assertEquals("q=gantry", request.getQueryString().orElse(null));
		Assertions.assertEquals(HttpVersion.HTTP_1_1, request.getHttpVersion());
		Assertions.assertEquals("http", request.getScheme());
		Assertions.assertTrue(request.getTlsSessionInfo().isEmpty());
	}

	private static String drain(ResponseBody responseBody) throws IOException {
		ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
		byte[] chunk;

		while ((chunk = responseBody.nextChunk()) != null)
			outputStream.write(chunk);

		return outputStream.toString(StandardCharsets.UTF_8);
	}

	private static final class RecordingResponseStarter implements ResponseStarter {
		private Integer statusCode;
		private String reasonPhrase;
		private Headers headers;

		@Override
		public BodyWriter startResponse(Integer statusCode, String reasonPhrase, Headers headers, Throwable error) {
			this.statusCode = statusCode;
			this.reasonPhrase = reasonPhrase;
			this.headers = headers;

			return new BodyWriter() {
				@Override
				public void write(byte[] bytes, int offset, int length) {
					throw new UnsupportedOperationException();
				}

				@Override
				public void flush() {
					// Nothing buffered
				}
			};
		}
	}
}
