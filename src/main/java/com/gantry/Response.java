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
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A complete response: status, headers and body.
 * <p>
 * Used with {@link Gateway#withResponder(java.util.function.Function)} by applications that do not need to stream.
 * <p>
 * Instances can be acquired via the {@link #withStatusCode(Integer)} builder factory method.
 */
@NotThreadSafe
public final class Response {
	@NonNull
	private final Integer statusCode;
	@Nullable
	private final String reasonPhrase;
	@NonNull
	private final Headers headers;
	@NonNull
	private final ResponseBody body;

	/**
	 * Acquires a builder for {@link Response} instances.
	 *
	 * @param statusCode the HTTP status code for this response
	 * @return the builder
	 */
	@NonNull
	public static Builder withStatusCode(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return new Builder(statusCode);
	}

	private Response(@NonNull Builder builder) {
		requireNonNull(builder);

		this.statusCode = builder.statusCode;
		this.reasonPhrase = builder.reasonPhrase;
		this.headers = builder.headers != null ? builder.headers : Headers.empty();
		this.body = builder.body != null ? builder.body : ResponseBody.empty();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{statusCode=%s, headers=%s}", getClass().getSimpleName(), getStatusCode(), getHeaders());
	}

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@NonNull
	public Optional<String> getReasonPhrase() {
		return Optional.ofNullable(this.reasonPhrase);
	}

	@NonNull
	public Headers getHeaders() {
		return this.headers;
	}

	@NonNull
	public ResponseBody getBody() {
		return this.body;
	}

	/**
	 * Builder used to construct instances of {@link Response} via {@link Response#withStatusCode(Integer)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private Integer statusCode;
		@Nullable
		private String reasonPhrase;
		@Nullable
		private Headers headers;
		@Nullable
		private ResponseBody body;

		private Builder(@NonNull Integer statusCode) {
			requireNonNull(statusCode);
			this.statusCode = statusCode;
		}

		@NonNull
		public Builder statusCode(@NonNull Integer statusCode) {
			requireNonNull(statusCode);
			this.statusCode = statusCode;
			return this;
		}

		@NonNull
		public Builder reasonPhrase(@Nullable String reasonPhrase) {
			this.reasonPhrase = reasonPhrase;
			return this;
		}

		@NonNull
		public Builder headers(@Nullable Headers headers) {
			this.headers = headers;
			return this;
		}

		@NonNull
		public Builder body(@Nullable ResponseBody body) {
			this.body = body;
			return this;
		}

		@NonNull
		public Builder body(@Nullable byte[] body) {
			this.body = body == null ? null : ResponseBody.ofBytes(body);
			return this;
		}

		/**
		 * Sets a UTF-8 encoded body.
		 */
		@NonNull
		public Builder body(@Nullable String body) {
			this.body = body == null ? null : ResponseBody.ofBytes(body.getBytes(StandardCharsets.UTF_8));
			return this;
		}

		@NonNull
		public Response build() {
			return new Response(this);
		}
	}
}
