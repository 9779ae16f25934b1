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

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * HTTP protocol versions this server speaks.
 */
public enum HttpVersion {
	HTTP_1_0("HTTP/1.0"),
	HTTP_1_1("HTTP/1.1");

	@NonNull
	private final String protocol;

	HttpVersion(@NonNull String protocol) {
		requireNonNull(protocol);
		this.protocol = protocol;
	}

	/**
	 * Given a protocol string as it appears on a request line, for example {@code HTTP/1.1}, return the matching version.
	 *
	 * @param protocol the protocol string
	 * @return the version, or {@link Optional#empty()} if the protocol string is not one this server speaks
	 */
	@NonNull
	public static Optional<HttpVersion> fromProtocol(@NonNull String protocol) {
		requireNonNull(protocol);

		for (HttpVersion httpVersion : values())
			if (httpVersion.getProtocol().equals(protocol))
				return Optional.of(httpVersion);

		return Optional.empty();
	}

	/**
	 * Does this version keep connections open unless told otherwise?
	 *
	 * @return {@code true} for HTTP/1.1
	 */
	@NonNull
	public Boolean isPersistentByDefault() {
		return this == HTTP_1_1;
	}

	@NonNull
	public String getProtocol() {
		return this.protocol;
	}
}
