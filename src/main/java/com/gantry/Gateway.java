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

import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * The boundary between the server and the application it hosts.
 * <p>
 * The server calls {@link #handle(Request, ResponseStarter)} exactly once per request. An implementation:
 * <ol>
 *   <li>may read {@link Request#getBody()} incrementally, and should either read it to the end or
 *   {@link RequestBody#discard() discard} it before returning</li>
 *   <li>must call {@link ResponseStarter#startResponse(Integer, Headers)} before any body bytes are produced</li>
 *   <li>returns the rest of the body as a {@link ResponseBody}, which the server drains and closes</li>
 * </ol>
 * <p>
 * Bytes may also be pushed directly through the {@link BodyWriter} returned by {@code startResponse}; they are sent
 * ahead of the returned body.
 * <p>
 * Any exception that escapes is answered with {@code 500 Internal Server Error} if nothing has been sent yet, and by
 * aborting the connection otherwise. Implementations are shared across worker threads and must be threadsafe.
 * <p>
 * For example:
 * <pre>{@code Gateway gateway = (request, responseStarter) -> {
 *   byte[] body = "hello".getBytes(StandardCharsets.UTF_8);
 *   responseStarter.startResponse(200, Headers.with("Content-Length", String.valueOf(body.length)).build());
 *   return ResponseBody.ofBytes(body);
 * };}</pre>
 */
@FunctionalInterface
public interface Gateway {
	/**
	 * Produces the response for a single request.
	 *
	 * @param request         the parsed request
	 * @param responseStarter the callback that fixes the response status and headers
	 * @return the response body to send after anything already written through the {@link BodyWriter}
	 * @throws Exception if the application fails to produce a response
	 */
	@NonNull
	ResponseBody handle(@NonNull Request request,
											@NonNull ResponseStarter responseStarter) throws Exception;

	/**
	 * Adapts a simple request-to-response function to the gateway contract.
	 * <p>
	 * If the response body length is known and the headers carry no {@code Content-Length}, one is added.
	 *
	 * @param responder produces a complete {@link Response} for each request
	 * @return a gateway backed by {@code responder}
	 */
	@NonNull
	static Gateway withResponder(@NonNull Function<@NonNull Request, @NonNull Response> responder) {
		requireNonNull(responder);

		return (request, responseStarter) -> {
			Response response = responder.apply(request);

			if (response == null)
				throw new IllegalStateException("Responder returned a null response");

			Headers headers = response.getHeaders();
			ResponseBody body = response.getBody();

			if (!headers.contains("Content-Length") && !headers.contains("Transfer-Encoding") && body.getLength().isPresent())
				headers = headers.copy().add("Content-Length", String.valueOf(body.getLength().getAsLong())).build();

			responseStarter.startResponse(response.getStatusCode(), response.getReasonPhrase().orElse(null), headers, null);
			return body;
		};
	}
}
