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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * HTTP status codes the server knows reason phrases for.
 * <p>
 * Gateways may respond with any three-digit status; codes not listed here are written with the reason phrase the
 * gateway supplies, or an empty one.
 */
public enum StatusCode {
	HTTP_100(100, "Continue"),
	HTTP_101(101, "Switching Protocols"),
	HTTP_200(200, "OK"),
	HTTP_201(201, "Created"),
	HTTP_202(202, "Accepted"),
	HTTP_203(203, "Non-Authoritative Information"),
	HTTP_204(204, "No Content"),
	HTTP_205(205, "Reset Content"),
	HTTP_206(206, "Partial Content"),
	HTTP_300(300, "Multiple Choices"),
	HTTP_301(301, "Moved Permanently"),
	HTTP_302(302, "Found"),
	HTTP_303(303, "See Other"),
	HTTP_304(304, "Not Modified"),
	HTTP_307(307, "Temporary Redirect"),
	HTTP_308(308, "Permanent Redirect"),
	/**
	 * Sent for malformed request lines, headers and chunk framing.
	 */
	HTTP_400(400, "Bad Request"),
	HTTP_401(401, "Unauthorized"),
	HTTP_403(403, "Forbidden"),
	HTTP_404(404, "Not Found"),
	/**
	 * Sent for {@code CONNECT} requests, which this server does not proxy.
	 */
	HTTP_405(405, "Method Not Allowed"),
	HTTP_406(406, "Not Acceptable"),
	/**
	 * Sent when a client starts a request but does not finish its header block before the header timeout expires.
	 */
	HTTP_408(408, "Request Timeout"),
	HTTP_409(409, "Conflict"),
	HTTP_410(410, "Gone"),
	HTTP_411(411, "Length Required"),
	HTTP_412(412, "Precondition Failed"),
	/**
	 * Sent when a request body exceeds the configured maximum.
	 */
	HTTP_413(413, "Content Too Large"),
	/**
	 * Sent when a request line exceeds the configured maximum header size.
	 */
	HTTP_414(414, "URI Too Long"),
	HTTP_415(415, "Unsupported Media Type"),
	HTTP_417(417, "Expectation Failed"),
	HTTP_422(422, "Unprocessable Content"),
	HTTP_429(429, "Too Many Requests"),
	/**
	 * Sent when the header block exceeds the configured maximum header size.
	 */
	HTTP_431(431, "Request Header Fields Too Large"),
	/**
	 * Sent when a gateway fails before any response bytes were written.
	 */
	HTTP_500(500, "Internal Server Error"),
	/**
	 * Sent for transfer-codings other than {@code chunked}.
	 */
	HTTP_501(501, "Not Implemented"),
	HTTP_502(502, "Bad Gateway"),
	/**
	 * Sent by the listener when the accepted-connection queue stays full.
	 */
	HTTP_503(503, "Service Unavailable"),
	HTTP_504(504, "Gateway Timeout"),
	HTTP_505(505, "HTTP Version Not Supported");

	@NonNull
	private static final Map<@NonNull Integer, @NonNull StatusCode> STATUS_CODES_BY_NUMBER;

	static {
		Map<Integer, StatusCode> statusCodesByNumber = new HashMap<>();

		for (StatusCode statusCode : StatusCode.values())
			statusCodesByNumber.put(statusCode.getStatusCode(), statusCode);

		STATUS_CODES_BY_NUMBER = Collections.unmodifiableMap(statusCodesByNumber);
	}

	@NonNull
	private final Integer statusCode;
	@NonNull
	private final String reasonPhrase;

	StatusCode(@NonNull Integer statusCode,
						 @NonNull String reasonPhrase) {
		requireNonNull(statusCode);
		requireNonNull(reasonPhrase);

		this.statusCode = statusCode;
		this.reasonPhrase = reasonPhrase;
	}

	/**
	 * Given an HTTP status code, return the corresponding enum value.
	 *
	 * @param statusCode the HTTP status code
	 * @return the enum value that corresponds to the provided HTTP status code, or {@link Optional#empty()} if none exists
	 */
	@NonNull
	public static Optional<StatusCode> fromStatusCode(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return Optional.ofNullable(STATUS_CODES_BY_NUMBER.get(statusCode));
	}

	/**
	 * May a response with the given status carry a message body?
	 * <p>
	 * Informational ({@code 1xx}), {@code 204} and {@code 304} responses never do.
	 *
	 * @param statusCode the HTTP status code
	 * @return {@code true} if a body is permitted
	 */
	@NonNull
	public static Boolean permitsResponseBody(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return !(statusCode < 200 || statusCode == 204 || statusCode == 304);
	}

	@Override
	public String toString() {
		return format("%s.%s{statusCode=%s, reasonPhrase=%s}", getClass().getSimpleName(), name(), getStatusCode(), getReasonPhrase());
	}

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	/**
	 * An English-language description for this HTTP status code, for example {@code Not Found} for {@link #HTTP_404}.
	 *
	 * @return English description for this HTTP status code
	 */
	@NonNull
	public String getReasonPhrase() {
		return this.reasonPhrase;
	}
}
