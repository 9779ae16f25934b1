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

import com.gantry.TestSupport.InMemoryTransport;
import com.gantry.exception.GatewayProtocolViolationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.OptionalLong;

import static com.gantry.TestSupport.bytes;

@ThreadSafe
public class ResponseWriterTests {
	@Test
	public void declared_content_length_keeps_connection_alive() throws IOException {
		InMemoryTransport transport = new InMemoryTransport(new byte[0]);
		ResponseWriter writer = writer(transport, Request.withMethod("GET", "/").build(), true);

		writer.startResponse(200, Headers.with("Content-Length", "5").build()).write(bytes("hello"));
		writer.finish();

		String output = transport.getOutput();
		Assertions.assertTrue(output.startsWith("HTTP/1.1 200 OK\r\n"), output);
		Assertions.assertTrue(output.contains("Content-Length: 5\r\n"), output);
		Assertions.assertTrue(output.contains("Server: Gantry\r\n"), output);
		Assertions.assertTrue(output.contains("Date: "), output);
		Assertions.assertFalse(output.contains("Connection: close"), output);
		Assertions.assertTrue(output.endsWith("\r\n\r\nhello"), output);
		Assertions.assertFalse(writer.isCloseRequired());
	}

	@Test
	public void unknown_length_on_http_1_1_is_chunked() throws IOException {
		InMemoryTransport transport = new InMemoryTransport(new byte[0]);
		ResponseWriter writer = writer(transport, Request.withMethod("GET", "/").build(), true);

		BodyWriter bodyWriter = writer.startResponse(200, Headers.empty());
		bodyWriter.write(bytes("abc"));
		bodyWriter.write(bytes("defgh"));
		writer.finish();

		String output = transport.getOutput();
		Assertions.assertTrue(output.contains("Transfer-Encoding: chunked\r\n"), output);
		Assertions.assertTrue(output.endsWith("\r\n\r\n3\r\nabc\r\n5\r\ndefgh\r\n0\r\n\r\n"), output);
		Assertions.assertEquals(8L, writer.getBodyBytesWritten());
	}

	@Test
	public void unknown_length_on_http_1_0_closes_the_connection() throws IOException {
		InMemoryTransport transport = new InMemoryTransport(new byte[0]);
		Request request = Request.withMethod("GET", "/").httpVersion(HttpVersion.HTTP_1_0).build();
		ResponseWriter writer = writer(transport, request, true);

		writer.startResponse(200, Headers.empty()).write(bytes("data"));
		writer.finish();

		String output = transport.getOutput();
		Assertions.assertTrue(output.contains("Connection: close\r\n"), output);
		Assertions.assertFalse(output.contains("Transfer-Encoding"), output);
		Assertions.assertTrue(output.endsWith("\r\n\r\ndata"), output);
		Assertions.assertTrue(writer.isCloseRequired());
	}

	@Test
	public void http_1_0_keep_alive_is_advertised() throws IOException {
		InMemoryTransport transport = new InMemoryTransport(new byte[0]);
		Request request = Request.withMethod("GET", "/").httpVersion(HttpVersion.HTTP_1_0).build();
		ResponseWriter writer = writer(transport, request, true);

		writer.startResponse(200, Headers.with("Content-Length", "0").build());
		writer.finish();

		String output = transport.getOutput();
		Assertions.assertTrue(output.contains("Connection: Keep-Alive\r\n"), output);
		Assertions.assertTrue(output.contains("Keep-Alive: timeout=10\r\n"), output);
	}

	@Test
	public void head_and_bodiless_statuses_suppress_the_body() throws IOException {
		InMemoryTransport headTransport = new InMemoryTransport(new byte[0]);
		ResponseWriter headWriter = writer(headTransport, Request.withMethod("HEAD", "/").build(), true);

		headWriter.startResponse(200, Headers.with("Content-Length", "5").build()).write(bytes("hello"));
		headWriter.finish();

		Assertions.assertTrue(headTransport.getOutput().contains("Content-Length: 5\r\n"));
		Assertions.assertTrue(headTransport.getOutput().endsWith("\r\n\r\n"));
		Assertions.assertFalse(headTransport.getOutput().contains("hello"));
		Assertions.assertFalse(headWriter.isCloseRequired());

		InMemoryTransport noContentTransport = new InMemoryTransport(new byte[0]);
		ResponseWriter noContentWriter = writer(noContentTransport, Request.withMethod("GET", "/").build(), true);

		noContentWriter.startResponse(204, Headers.with("Transfer-Encoding", "chunked").build());
		noContentWriter.finish();

		String output = noContentTransport.getOutput();
		Assertions.assertTrue(output.startsWith("HTTP/1.1 204 No Content\r\n"), output);
		Assertions.assertFalse(output.contains("Transfer-Encoding"), output);
		Assertions.assertTrue(output.endsWith("\r\n\r\n"), output);
	}

	@Test
	public void connection_close_from_gateway_is_honored() throws IOException {
		InMemoryTransport transport = new InMemoryTransport(new byte[0]);
		ResponseWriter writer = writer(transport, Request.withMethod("GET", "/").build(), true);

		writer.startResponse(200, Headers.with("Content-Length", "0").add("Connection", "close").build());
		writer.finish();

		Assertions.assertTrue(writer.isCloseRequired());
	}

	@Test
	public void custom_reason_phrase_is_used() throws IOException {
		InMemoryTransport transport = new InMemoryTransport(new byte[0]);
		ResponseWriter writer = writer(transport, Request.withMethod("GET", "/").build(), true);

		writer.startResponse(299, "Fine Indeed", Headers.with("Content-Length", "0").build(), null);
		writer.finish();

		Assertions.assertTrue(transport.getOutput().startsWith("HTTP/1.1 299 Fine Indeed\r\n"));
	}

	@Test
	public void second_start_requires_an_error_and_uncommitted_headers() throws IOException {
		InMemoryTransport transport = new InMemoryTransport(new byte[0]);
		ResponseWriter writer = writer(transport, Request.withMethod("GET", "/").build(), true);

		writer.startResponse(200, Headers.empty());
		Assertions.assertThrows(GatewayProtocolViolationException.class, () -> writer.startResponse(200, Headers.empty()));

		writer.startResponse(500, null, Headers.with("Content-Length", "0").build(), new IllegalStateException("boom"));
		Assertions.assertEquals(500, writer.getStatusCode());

		writer.flush();
		Assertions.assertTrue(writer.isCommitted());
		Assertions.assertThrows(GatewayProtocolViolationException.class,
				() -> writer.startResponse(503, null, Headers.empty(), new IllegalStateException("again")));
		Assertions.assertTrue(transport.getOutput().startsWith("HTTP/1.1 500 Internal Server Error\r\n"));
	}

	@Test
	public void rejects_malformed_responses() {
		ResponseWriter writer = writer(new InMemoryTransport(new byte[0]), Request.withMethod("GET", "/").build(), true);

		Assertions.assertThrows(GatewayProtocolViolationException.class, () -> writer.write(bytes("early"), 0, 5));
		Assertions.assertThrows(GatewayProtocolViolationException.class, writer::finish);
		Assertions.assertThrows(GatewayProtocolViolationException.class, () -> writer.startResponse(42, Headers.empty()));
		Assertions.assertThrows(GatewayProtocolViolationException.class,
				() -> writer.startResponse(200, Headers.with("X-Injected", "a\r\nb").build()));
		Assertions.assertThrows(GatewayProtocolViolationException.class,
				() -> writer.startResponse(200, "OK\r\nX: y", Headers.empty(), null));
	}

	@Test
	public void body_longer_than_content_length_is_a_violation() {
		ResponseWriter writer = writer(new InMemoryTransport(new byte[0]), Request.withMethod("GET", "/").build(), true);
		BodyWriter bodyWriter = writer.startResponse(200, Headers.with("Content-Length", "2").build());

		Assertions.assertThrows(GatewayProtocolViolationException.class, () -> bodyWriter.write(bytes("abc")));
	}

	@Test
	public void short_body_forces_close() throws IOException {
		ResponseWriter writer = writer(new InMemoryTransport(new byte[0]), Request.withMethod("GET", "/").build(), true);

		writer.startResponse(200, Headers.with("Content-Length", "10").build()).write(bytes("abc"));
		writer.finish();

		Assertions.assertTrue(writer.isCloseRequired());
	}

	@Test
	public void known_body_length_is_applied() throws IOException {
		InMemoryTransport transport = new InMemoryTransport(new byte[0]);
		ResponseWriter writer = writer(transport, Request.withMethod("GET", "/").build(), true);

		writer.startResponse(200, Headers.empty());
		writer.applyKnownBodyLength(OptionalLong.of(3));
		writer.write(bytes("xyz"), 0, 3);
		writer.finish();

		Assertions.assertTrue(transport.getOutput().contains("Content-Length: 3\r\n"));
		Assertions.assertFalse(transport.getOutput().contains("chunked"));
	}

	@Test
	public void unread_request_body_is_drained_before_headers() throws IOException {
		SocketStream socketStream = TestSupport.streamOf("bodyGET /next HTTP/1.1\r\n");
		Request request = Request.withMethod("POST", "/")
				.body(new LengthDelimitedRequestBody(socketStream, 4L, null))
				.build();
		ResponseWriter writer = new ResponseWriter(socketStream, request, "Gantry", true, Duration.ofSeconds(10));

		writer.startResponse(204, Headers.empty());
		writer.finish();

		Assertions.assertTrue(request.getBody().isFullyConsumed());
		Assertions.assertFalse(writer.isCloseRequired());
	}

	@Test
	public void content_length_is_dropped_when_transfer_encoding_is_also_set() throws IOException {
		InMemoryTransport transport = new InMemoryTransport(new byte[0]);
		ResponseWriter writer = writer(transport, Request.withMethod("GET", "/").build(), true);

		writer.startResponse(200, Headers.with("Content-Length", "5").add("Transfer-Encoding", "chunked").build())
				.write(bytes("hello"));
		writer.finish();

		String output = transport.getOutput();
		Assertions.assertFalse(output.contains("Content-Length"), output);
		Assertions.assertTrue(output.contains("Transfer-Encoding: chunked\r\n"), output);
		Assertions.assertTrue(output.contains("Connection: close\r\n"), output);
		Assertions.assertTrue(output.endsWith("\r\n\r\n5\r\nhello\r\n0\r\n\r\n"), output);
		Assertions.assertTrue(writer.isCloseRequired());
	}

	@Test
	public void failed_drain_keeps_the_response_but_closes() throws IOException {
		SocketStream socketStream = TestSupport.streamOf("short");
		Request request = Request.withMethod("POST", "/")
				.body(new LengthDelimitedRequestBody(socketStream, 100L, null))
				.build();
		InMemoryTransport output = new InMemoryTransport(new byte[0]);
		ResponseWriter writer = new ResponseWriter(new SocketStream(output), request, "Gantry", true, Duration.ofSeconds(10));

		writer.startResponse(204, Headers.empty());
		writer.finish();

		Assertions.assertTrue(output.getOutput().startsWith("HTTP/1.1 204 No Content\r\n"), output.getOutput());
		Assertions.assertTrue(output.getOutput().contains("Connection: close\r\n"), output.getOutput());
		Assertions.assertTrue(writer.isCloseRequired());
	}

	@Test
	public void body_awaiting_continue_forces_close_instead_of_drain() throws IOException {
		SocketStream socketStream = TestSupport.streamOf("");
		Request request = Request.withMethod("PUT", "/")
				.body(new LengthDelimitedRequestBody(socketStream, 100L, () -> {
					throw new AssertionError("100 Continue must not be sent");
				}))
				.build();
		ResponseWriter writer = new ResponseWriter(socketStream, request, "Gantry", true, Duration.ofSeconds(10));

		writer.startResponse(413, Headers.with("Content-Length", "0").build());
		writer.finish();

		Assertions.assertTrue(writer.isCloseRequired());
	}

	@Test
	public void simple_response_is_self_contained() {
		String response = new String(ResponseWriter.simpleResponse(StatusCode.HTTP_400, "Bad request", "Gantry"),
				StandardCharsets.ISO_8859_1);

		Assertions.assertTrue(response.startsWith("HTTP/1.1 400 Bad Request\r\n"), response);
		Assertions.assertTrue(response.contains("Content-Length: 11\r\n"), response);
		Assertions.assertTrue(response.contains("Connection: close\r\n"), response);
		Assertions.assertTrue(response.endsWith("\r\n\r\nBad request"), response);
	}

	private static ResponseWriter writer(InMemoryTransport transport,
																			 Request request,
																			 Boolean keepAlive) {
		return new ResponseWriter(new SocketStream(transport), request, "Gantry", keepAlive, Duration.ofSeconds(10));
	}
}
