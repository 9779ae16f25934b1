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

import com.gantry.RequestParser.RequestLine;
import com.gantry.exception.BadRequestException;
import com.gantry.exception.HttpProtocolException;
import com.gantry.exception.HttpVersionNotSupportedException;
import com.gantry.exception.MethodNotAllowedException;
import com.gantry.exception.RequestTooLargeException;
import com.gantry.exception.UnsupportedTransferCodingException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static com.gantry.TestSupport.streamOf;

@ThreadSafe
public class RequestParserTests {
	private final RequestParser parser = new RequestParser(1024, 100L);

	@Test
	public void parses_origin_form_request_line() throws IOException {
		RequestLine requestLine = parser.parseRequestLine(streamOf("GET /widgets/a%20b?color=red HTTP/1.1\r\n"));

		Assertions.assertNotNull(requestLine);
		Assertions.assertEquals("GET", requestLine.method());
		Assertions.assertEquals("/widgets/a%20b?color=red", requestLine.target());
		Assertions.assertEquals("/widgets/a b", requestLine.path());
		Assertions.assertEquals("color=red", requestLine.queryString());
		Assertions.assertEquals(HttpVersion.HTTP_1_1, requestLine.httpVersion());
	}

	@Test
	public void keeps_encoded_slashes_encoded() throws IOException {
		RequestLine requestLine = parser.parseRequestLine(streamOf("GET /files/a%2Fb HTTP/1.0\r\n"));

		Assertions.assertEquals("/files/a%2Fb", requestLine.path());
		Assertions.assertEquals(HttpVersion.HTTP_1_0, requestLine.httpVersion());
	}

	@Test
	public void tolerates_one_leading_empty_line() throws IOException {
		RequestLine requestLine = parser.parseRequestLine(streamOf("\r\nGET / HTTP/1.1\r\n"));

		Assertions.assertEquals("/", requestLine.path());
		Assertions.assertEquals(18, requestLine.sizeInBytes());
	}

	@Test
	public void returns_null_when_peer_closes_first() throws IOException {
		Assertions.assertNull(parser.parseRequestLine(streamOf("")));
	}

	@Test
	public void reduces_absolute_form_to_path() throws IOException {
		RequestLine requestLine = parser.parseRequestLine(streamOf("GET http://example.com/a?b=c HTTP/1.1\r\n"));

		Assertions.assertEquals("/a", requestLine.path());
		Assertions.assertEquals("b=c", requestLine.queryString());
	}

	@Test
	public void asterisk_is_only_for_options() throws IOException {
		Assertions.assertEquals("*", parser.parseRequestLine(streamOf("OPTIONS * HTTP/1.1\r\n")).path());
		Assertions.assertThrows(BadRequestException.class, () -> parser.parseRequestLine(streamOf("GET * HTTP/1.1\r\n")));
	}

	@Test
	public void rejects_malformed_request_lines() {
		Assertions.assertThrows(BadRequestException.class, () -> parser.parseRequestLine(streamOf("GARBAGE\r\n")));
		Assertions.assertThrows(BadRequestException.class, () -> parser.parseRequestLine(streamOf("GET /\r\n")));
		Assertions.assertThrows(BadRequestException.class, () -> parser.parseRequestLine(streamOf("get / HTTP/1.1\r\n")));
		Assertions.assertThrows(BadRequestException.class, () -> parser.parseRequestLine(streamOf("GET / HTTP/1.1\n")));
		Assertions.assertThrows(BadRequestException.class, () -> parser.parseRequestLine(streamOf("GET /#frag HTTP/1.1\r\n")));
		Assertions.assertThrows(BadRequestException.class, () -> parser.parseRequestLine(streamOf("GET / HTTX/1.1\r\n")));
		Assertions.assertThrows(BadRequestException.class, () -> parser.parseRequestLine(streamOf("GET widgets HTTP/1.1\r\n")));
	}

	@Test
	public void maps_unsupported_versions_and_connect_to_their_statuses() {
		HttpProtocolException versionException = Assertions.assertThrows(HttpVersionNotSupportedException.class,
				() -> parser.parseRequestLine(streamOf("GET / HTTP/2.0\r\n")));
		Assertions.assertEquals(StatusCode.HTTP_505, versionException.getStatusCode());

		Assertions.assertThrows(HttpVersionNotSupportedException.class, () -> parser.parseRequestLine(streamOf("GET / HTTP/1.2\r\n")));

		HttpProtocolException connectException = Assertions.assertThrows(MethodNotAllowedException.class,
				() -> parser.parseRequestLine(streamOf("CONNECT example.com:443 HTTP/1.1\r\n")));
		Assertions.assertEquals(StatusCode.HTTP_405, connectException.getStatusCode());
	}

	@Test
	public void overlong_request_line_is_414() {
		RequestParser smallParser = new RequestParser(32, 0L);
		RequestTooLargeException exception = Assertions.assertThrows(RequestTooLargeException.class,
				() -> smallParser.parseRequestLine(streamOf("GET /" + "a".repeat(64) + " HTTP/1.1\r\n")));

		Assertions.assertEquals(RequestTooLargeException.Component.REQUEST_LINE, exception.getComponent());
		Assertions.assertEquals(StatusCode.HTTP_414, exception.getStatusCode());
	}

	@Test
	public void underscore_headers_are_dropped_only_when_configured() throws IOException {
		String rawHeaders = "Host: example.com\r\nX_Forwarded_User: mallory\r\nX-Forwarded-User: alice\r\n\r\n";

		Headers keptHeaders = parser.parseHeaders(streamOf(rawHeaders), 1024);
		Assertions.assertEquals("mallory", keptHeaders.getFirst("X_Forwarded_User").orElse(null));

		RequestParser droppingParser = new RequestParser(1024, 100L, true);
		Headers droppedHeaders = droppingParser.parseHeaders(streamOf(rawHeaders), 1024);

		Assertions.assertFalse(droppedHeaders.contains("X_Forwarded_User"));
		Assertions.assertEquals("alice", droppedHeaders.getFirst("X-Forwarded-User").orElse(null));
		Assertions.assertEquals("example.com", droppedHeaders.getFirst("Host").orElse(null));
	}

	@Test
	public void parses_headers_with_folding() throws IOException {
		Headers headers = parser.parseHeaders(streamOf("Host: example.com\r\nX-Long: first\r\n  second\r\n\r\n"), 1024);

		Assertions.assertEquals("example.com", headers.getFirst("host").orElse(null));
		Assertions.assertEquals("first second", headers.getFirst("X-Long").orElse(null));
	}

	@Test
	public void rejects_malformed_headers() {
		Assertions.assertThrows(BadRequestException.class, () -> parser.parseHeaders(streamOf("NoColon\r\n\r\n"), 1024));
		Assertions.assertThrows(BadRequestException.class, () -> parser.parseHeaders(streamOf(" folded\r\n\r\n"), 1024));
		Assertions.assertThrows(BadRequestException.class, () -> parser.parseHeaders(streamOf("Bad Name: x\r\n\r\n"), 1024));
		Assertions.assertThrows(BadRequestException.class, () -> parser.parseHeaders(streamOf("Host: x\r\n"), 1024));
	}

	@Test
	public void oversized_header_block_is_431() {
		RequestTooLargeException exception = Assertions.assertThrows(RequestTooLargeException.class,
				() -> parser.parseHeaders(streamOf("X-Big: " + "b".repeat(100) + "\r\n\r\n"), 50));

		Assertions.assertEquals(StatusCode.HTTP_431, exception.getStatusCode());
	}

	@Test
	public void content_length_body_is_length_delimited() throws IOException {
		SocketStream stream = streamOf("POST / HTTP/1.1\r\nContent-Length: 5\r\n\r\nhelloEXTRA");
		RequestLine requestLine = parser.parseRequestLine(stream);
		Headers headers = parser.parseHeaders(stream, 1024);
		RequestBody body = parser.createRequestBody(requestLine, headers, stream, null);

		Assertions.assertFalse(body.isChunked());
		Assertions.assertEquals(5L, body.getContentLength().orElse(-1));
		Assertions.assertEquals("hello", new String(body.readAllBytes(), StandardCharsets.ISO_8859_1));
		Assertions.assertTrue(body.isFullyConsumed());
	}

	@Test
	public void framing_conflicts_are_rejected() throws IOException {
		RequestLine http11 = parser.parseRequestLine(streamOf("POST / HTTP/1.1\r\n"));
		RequestLine http10 = parser.parseRequestLine(streamOf("POST / HTTP/1.0\r\n"));

		Assertions.assertThrows(BadRequestException.class, () -> parser.createRequestBody(http11,
				Headers.with("Content-Length", "3").add("Transfer-Encoding", "chunked").build(), streamOf(""), null));
		Assertions.assertThrows(BadRequestException.class, () -> parser.createRequestBody(http10,
				Headers.with("Transfer-Encoding", "chunked").build(), streamOf(""), null));
		Assertions.assertThrows(UnsupportedTransferCodingException.class, () -> parser.createRequestBody(http11,
				Headers.with("Transfer-Encoding", "gzip, chunked").build(), streamOf(""), null));
		Assertions.assertThrows(BadRequestException.class, () -> parser.createRequestBody(http11,
				Headers.with("Content-Length", "3").add("Content-Length", "4").build(), streamOf(""), null));
		Assertions.assertThrows(BadRequestException.class, () -> parser.createRequestBody(http11,
				Headers.with("Content-Length", "-1").build(), streamOf(""), null));

		RequestTooLargeException tooLarge = Assertions.assertThrows(RequestTooLargeException.class, () -> parser.createRequestBody(http11,
				Headers.with("Content-Length", "101").build(), streamOf(""), null));
		Assertions.assertEquals(StatusCode.HTTP_413, tooLarge.getStatusCode());
	}

	@Test
	public void agreeing_duplicate_content_lengths_are_accepted() throws IOException {
		RequestLine requestLine = parser.parseRequestLine(streamOf("POST / HTTP/1.1\r\n"));
		RequestBody body = parser.createRequestBody(requestLine, Headers.with("Content-Length", "3, 3").build(), streamOf("abc"), null);

		Assertions.assertEquals(3L, body.getContentLength().orElse(-1));
	}

	@Test
	public void no_framing_headers_means_empty_body() throws IOException {
		RequestLine requestLine = parser.parseRequestLine(streamOf("GET / HTTP/1.1\r\n"));
		RequestBody body = parser.createRequestBody(requestLine, Headers.empty(), streamOf("ignored"), null);

		Assertions.assertEquals(-1, body.read());
		Assertions.assertTrue(body.isFullyConsumed());
	}

	@Test
	public void expects_continue_only_on_http_1_1() throws IOException {
		Headers expect = Headers.with("Expect", "100-continue").build();

		Assertions.assertTrue(RequestParser.expectsContinue(parser.parseRequestLine(streamOf("PUT / HTTP/1.1\r\n")), expect));
		Assertions.assertFalse(RequestParser.expectsContinue(parser.parseRequestLine(streamOf("PUT / HTTP/1.0\r\n")), expect));
		Assertions.assertFalse(RequestParser.expectsContinue(parser.parseRequestLine(streamOf("PUT / HTTP/1.1\r\n")), Headers.empty()));
	}
}
