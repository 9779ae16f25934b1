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

import com.gantry.RequestBody.ContinueSender;
import com.gantry.exception.BadRequestException;
import com.gantry.exception.HttpVersionNotSupportedException;
import com.gantry.exception.MethodNotAllowedException;
import com.gantry.exception.RequestTooLargeException;
import com.gantry.exception.RequestTooLargeException.Component;
import com.gantry.exception.UnsupportedTransferCodingException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Reads a request line and header block off a {@link SocketStream} and decides how the body is framed.
 * <p>
 * The request line and headers together may not exceed {@code maximumHeaderSizeInBytes}.
 */
@ThreadSafe
final class RequestParser {
	@NonNull
	private static final Pattern PROTOCOL_PATTERN;
	@NonNull
	private static final String TOKEN_SEPARATORS;

	static {
		PROTOCOL_PATTERN = Pattern.compile("^HTTP/(\\d+)\\.(\\d+)$");
		TOKEN_SEPARATORS = "()<>@,;:\\\"/[]?={} \t";
	}

	@NonNull
	private final Integer maximumHeaderSizeInBytes;
	// 0 means unlimited
	@NonNull
	private final Long maximumRequestBodySizeInBytes;
	@NonNull
	private final Boolean dropUnderscoreHeaders;

	/**
	 * The three parts of a request line, plus the target split into a decoded path and raw query.
	 */
	record RequestLine(@NonNull String method,
										 @NonNull String target,
										 @NonNull String path,
										 @Nullable String queryString,
										 @NonNull HttpVersion httpVersion,
										 @NonNull Integer sizeInBytes) {
		RequestLine {
			requireNonNull(method);
			requireNonNull(target);
			requireNonNull(path);
			requireNonNull(httpVersion);
			requireNonNull(sizeInBytes);
		}
	}

	RequestParser(@NonNull Integer maximumHeaderSizeInBytes,
								@NonNull Long maximumRequestBodySizeInBytes) {
		this(maximumHeaderSizeInBytes, maximumRequestBodySizeInBytes, false);
	}

	/**
	 * @param dropUnderscoreHeaders whether request headers with {@code _} in their names are discarded
	 */
	RequestParser(@NonNull Integer maximumHeaderSizeInBytes,
								@NonNull Long maximumRequestBodySizeInBytes,
								@NonNull Boolean dropUnderscoreHeaders) {
		requireNonNull(maximumHeaderSizeInBytes);
		requireNonNull(maximumRequestBodySizeInBytes);
		requireNonNull(dropUnderscoreHeaders);

		this.maximumHeaderSizeInBytes = maximumHeaderSizeInBytes;
		this.maximumRequestBodySizeInBytes = maximumRequestBodySizeInBytes;
		this.dropUnderscoreHeaders = dropUnderscoreHeaders;
	}

	/**
	 * Reads the request line. A single empty line ahead of it is tolerated.
	 *
	 * @return the request line, or {@code null} if the peer closed the connection before sending one
	 */
	@Nullable
	RequestLine parseRequestLine(@NonNull SocketStream socketStream) throws IOException {
		requireNonNull(socketStream);

		byte[] line = readRequestLineBytes(socketStream);

		if (line.length == 0)
			return null;

		int leadingBytes = 0;

		if (line.length == 2 && endsWithCrlf(line)) {
			leadingBytes = line.length;
			line = readRequestLineBytes(socketStream);

			if (line.length == 0)
				return null;
		}

		if (!endsWithCrlf(line))
			throw new BadRequestException("HTTP requires CRLF terminators");

		String requestLine = new String(line, 0, line.length - 2, StandardCharsets.ISO_8859_1);
		String[] parts = requestLine.split(" ", -1);

		if (parts.length != 3 || parts[0].isEmpty() || parts[1].isEmpty())
			throw new BadRequestException("Malformed Request-Line");

		String method = parts[0];
		String target = parts[1];
		HttpVersion httpVersion = parseProtocol(parts[2]);

		if (!isToken(method))
			throw new BadRequestException("Malformed method name");

		if (!method.equals(method.toUpperCase(Locale.ROOT)))
			throw new BadRequestException("Malformed method name: method names are case-sensitive and uppercase");

		if (method.equals("CONNECT"))
			throw new MethodNotAllowedException(method);

		String pathAndQuery = extractPathAndQuery(method, target);
		int queryIndex = pathAndQuery.indexOf('?');
		String rawPath = queryIndex >= 0 ? pathAndQuery.substring(0, queryIndex) : pathAndQuery;
		String queryString = queryIndex >= 0 ? pathAndQuery.substring(queryIndex + 1) : null;

		return new RequestLine(method, target, decodePath(rawPath), queryString, httpVersion, leadingBytes + line.length);
	}

	/**
	 * Reads the header block that follows a request line.
	 *
	 * @param budgetInBytes how many header bytes remain after the request line
	 */
	@NonNull
	Headers parseHeaders(@NonNull SocketStream socketStream,
											 @NonNull Integer budgetInBytes) throws IOException {
		Headers headers = parseHeaderBlock(socketStream, budgetInBytes, Component.HEADERS);

		if (!this.dropUnderscoreHeaders)
			return headers;

		Headers.Builder allowedHeaders = null;

		for (String name : headers.getNames()) {
			if (name.indexOf('_') < 0)
				continue;

			if (allowedHeaders == null)
				allowedHeaders = headers.copy();

			allowedHeaders.remove(name);
		}

		return allowedHeaders == null ? headers : allowedHeaders.build();
	}

	/**
	 * Builds the body reader that matches the request's framing headers.
	 */
	@NonNull
	RequestBody createRequestBody(@NonNull RequestLine requestLine,
																@NonNull Headers headers,
																@NonNull SocketStream socketStream,
																@Nullable ContinueSender continueSender) {
		requireNonNull(requestLine);
		requireNonNull(headers);
		requireNonNull(socketStream);

		boolean hasTransferEncoding = headers.contains("Transfer-Encoding");
		Long contentLength = parseContentLength(headers);

		if (hasTransferEncoding && contentLength != null)
			throw new BadRequestException("Request has both Content-Length and Transfer-Encoding");

		if (hasTransferEncoding) {
			if (requestLine.httpVersion() != HttpVersion.HTTP_1_1)
				throw new BadRequestException("Transfer-Encoding is not allowed in HTTP/1.0 requests");

			List<String> codings = new ArrayList<>();

			for (String coding : headers.getCombined("Transfer-Encoding").orElse("").split(","))
				if (!coding.trim().isEmpty())
					codings.add(coding.trim().toLowerCase(Locale.ROOT));

			for (String coding : codings)
				if (!coding.equals("chunked"))
					throw new UnsupportedTransferCodingException(coding);

			if (codings.size() != 1)
				throw new BadRequestException("Malformed Transfer-Encoding header");

			return new ChunkedRequestBody(socketStream, this.maximumRequestBodySizeInBytes, this.maximumHeaderSizeInBytes, continueSender);
		}

		if (contentLength == null || contentLength == 0)
			return new EmptyRequestBody();

		if (this.maximumRequestBodySizeInBytes > 0 && contentLength > this.maximumRequestBodySizeInBytes)
			throw new RequestTooLargeException(Component.BODY, this.maximumRequestBodySizeInBytes);

		return new LengthDelimitedRequestBody(socketStream, contentLength, continueSender);
	}

	/**
	 * Does the request ask for an interim {@code 100 Continue} before sending its body?
	 */
	@NonNull
	static Boolean expectsContinue(@NonNull RequestLine requestLine,
																 @NonNull Headers headers) {
		requireNonNull(requestLine);
		requireNonNull(headers);

		return requestLine.httpVersion() == HttpVersion.HTTP_1_1 && headers.containsToken("Expect", "100-continue");
	}

	/**
	 * Reads {@code name: value} lines up to and including an empty line. Shared by request headers and chunked trailers.
	 */
	@NonNull
	static Headers parseHeaderBlock(@NonNull SocketStream socketStream,
																	@NonNull Integer budgetInBytes,
																	@NonNull Component component) throws IOException {
		requireNonNull(socketStream);
		requireNonNull(budgetInBytes);
		requireNonNull(component);

		Headers.Builder headers = Headers.empty().copy();
		int remaining = budgetInBytes;

		while (true) {
			if (remaining <= 0)
				throw new RequestTooLargeException(component, budgetInBytes.longValue());

			byte[] line;

			try {
				line = socketStream.readLine(remaining);
			} catch (SocketStream.LineTooLongException e) {
				throw new RequestTooLargeException(component, budgetInBytes.longValue());
			}

			if (line.length == 0)
				throw new BadRequestException("Illegal end of headers");

			remaining -= line.length;

			if (!endsWithCrlf(line))
				throw new BadRequestException("HTTP requires CRLF terminators");

			if (line.length == 2)
				return headers.build();

			String text = new String(line, 0, line.length - 2, StandardCharsets.ISO_8859_1);

			if (text.charAt(0) == ' ' || text.charAt(0) == '\t') {
				// Obsolete line folding
				if (headers.size() == 0)
					throw new BadRequestException("Illegal continuation line");

				headers.appendToLastValue(text.trim());
				continue;
			}

			int colonIndex = text.indexOf(':');

			if (colonIndex <= 0)
				throw new BadRequestException("Illegal header line");

			String name = text.substring(0, colonIndex);

			if (!isToken(name))
				throw new BadRequestException(format("Illegal header name '%s'", name.trim()));

			headers.add(name, text.substring(colonIndex + 1).trim());
		}
	}

	@NonNull
	static Boolean endsWithCrlf(@NonNull byte[] line) {
		requireNonNull(line);
		return line.length >= 2 && line[line.length - 2] == '\r' && line[line.length - 1] == '\n';
	}

	@NonNull
	static Boolean isToken(@NonNull String value) {
		requireNonNull(value);

		if (value.isEmpty())
			return false;

		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);

			if (c <= 32 || c >= 127 || TOKEN_SEPARATORS.indexOf(c) >= 0)
				return false;
		}

		return true;
	}

	@NonNull
	private byte[] readRequestLineBytes(@NonNull SocketStream socketStream) throws IOException {
		try {
			return socketStream.readLine(this.maximumHeaderSizeInBytes);
		} catch (SocketStream.LineTooLongException e) {
			throw new RequestTooLargeException(Component.REQUEST_LINE, this.maximumHeaderSizeInBytes.longValue());
		}
	}

	@NonNull
	private HttpVersion parseProtocol(@NonNull String protocol) {
		Matcher matcher = PROTOCOL_PATTERN.matcher(protocol);

		if (!matcher.matches())
			throw new BadRequestException("Malformed Request-Line: bad protocol");

		int major;
		int minor;

		try {
			major = Integer.parseInt(matcher.group(1));
			minor = Integer.parseInt(matcher.group(2));
		} catch (NumberFormatException e) {
			throw new HttpVersionNotSupportedException(protocol);
		}

		if (major != 1 || minor > 1)
			throw new HttpVersionNotSupportedException(protocol);

		return minor == 0 ? HttpVersion.HTTP_1_0 : HttpVersion.HTTP_1_1;
	}

	@NonNull
	private String extractPathAndQuery(@NonNull String method,
																		 @NonNull String target) {
		if (target.indexOf('#') >= 0)
			throw new BadRequestException("Illegal #fragment in Request-URI");

		if (target.equals("*")) {
			if (!method.equals("OPTIONS"))
				throw new BadRequestException("Asterisk-form target is only allowed for OPTIONS");

			return target;
		}

		if (target.startsWith("/"))
			return target;

		String lowercaseTarget = target.toLowerCase(Locale.ROOT);

		if (lowercaseTarget.startsWith("http://") || lowercaseTarget.startsWith("https://")) {
			try {
				URI uri = new URI(target);

				if (uri.getRawAuthority() == null)
					throw new BadRequestException("Absolute-form target has no authority");

				String rawPath = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
				return uri.getRawQuery() == null ? rawPath : rawPath + "?" + uri.getRawQuery();
			} catch (URISyntaxException e) {
				throw new BadRequestException("Malformed Request-URI", e);
			}
		}

		throw new BadRequestException("Invalid path in Request-URI");
	}

	// Percent-decodes everything except %2F, which would otherwise merge path segments
	@NonNull
	private String decodePath(@NonNull String rawPath) {
		if (rawPath.indexOf('%') < 0)
			return rawPath;

		StringBuilder decoded = new StringBuilder(rawPath.length());
		ByteArrayOutputStream pending = new ByteArrayOutputStream();
		int i = 0;

		while (i < rawPath.length()) {
			char c = rawPath.charAt(i);

			if (c != '%') {
				flushDecodedBytes(pending, decoded);
				decoded.append(c);
				i++;
				continue;
			}

			if (i + 2 >= rawPath.length())
				throw new BadRequestException("Malformed Request-URI");

			int high = Character.digit(rawPath.charAt(i + 1), 16);
			int low = Character.digit(rawPath.charAt(i + 2), 16);

			if (high < 0 || low < 0)
				throw new BadRequestException("Malformed Request-URI");

			int value = (high << 4) | low;

			if (value == '/') {
				flushDecodedBytes(pending, decoded);
				decoded.append(rawPath, i, i + 3);
			} else {
				pending.write(value);
			}

			i += 3;
		}

		flushDecodedBytes(pending, decoded);
		return decoded.toString();
	}

	private void flushDecodedBytes(@NonNull ByteArrayOutputStream pending,
																 @NonNull StringBuilder decoded) {
		if (pending.size() == 0)
			return;

		decoded.append(new String(pending.toByteArray(), StandardCharsets.UTF_8));
		pending.reset();
	}

	// Repeated Content-Length values are tolerated only if they agree
	@Nullable
	private Long parseContentLength(@NonNull Headers headers) {
		Long contentLength = null;

		for (String value : headers.getAll("Content-Length")) {
			for (String part : value.split(",", -1)) {
				String trimmed = part.trim();

				if (trimmed.isEmpty() || trimmed.length() > 18)
					throw new BadRequestException("Malformed Content-Length header");

				for (int i = 0; i < trimmed.length(); i++)
					if (!Character.isDigit(trimmed.charAt(i)) || trimmed.charAt(i) > '9')
						throw new BadRequestException("Malformed Content-Length header");

				long parsed = Long.parseLong(trimmed);

				if (contentLength != null && contentLength != parsed)
					throw new BadRequestException("Multiple differing Content-Length values");

				contentLength = parsed;
			}
		}

		return contentLength;
	}
}
