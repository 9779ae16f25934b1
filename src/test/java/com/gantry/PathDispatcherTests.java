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
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

@ThreadSafe
public class PathDispatcherTests {
	@Test
	public void longest_prefix_wins_and_is_moved_to_the_mount_path() throws Exception {
		PathDispatcher dispatcher = PathDispatcher.withMounts(mounts("/", "/api", "/api/v2"));

		Assertions.assertEquals("/api/v2|/widgets|q=1", dispatch(dispatcher, "/api/v2/widgets", "q=1").body());
		Assertions.assertEquals("/api|/v3/widgets|", dispatch(dispatcher, "/api/v3/widgets", null).body());
		Assertions.assertEquals("|/about|", dispatch(dispatcher, "/about", null).body());
	}

	@Test
	public void prefixes_match_whole_segments_only() throws Exception {
		PathDispatcher dispatcher = PathDispatcher.withMounts(mounts("/", "/api"));

		Assertions.assertEquals("|/apiary|", dispatch(dispatcher, "/apiary", null).body());
		Assertions.assertEquals("/api||", dispatch(dispatcher, "/api", null).body());
	}

	@Test
	public void trailing_slash_on_a_prefix_is_ignored() throws Exception {
		PathDispatcher dispatcher = PathDispatcher.withMounts(mounts("/admin/"));

		Assertions.assertEquals("/admin|/users|", dispatch(dispatcher, "/admin/users", null).body());
		Assertions.assertEquals("/admin|/|", dispatch(dispatcher, "/admin/", null).body());
	}

	@Test
	public void unmatched_paths_are_404() throws Exception {
		PathDispatcher dispatcher = PathDispatcher.withMounts(mounts("/api"));

		Dispatched dispatched = dispatch(dispatcher, "/other", null);

		Assertions.assertEquals(404, dispatched.statusCode());
		Assertions.assertEquals("text/plain", dispatched.headers().getFirst("Content-Type").orElse(null));
		Assertions.assertEquals("0", dispatched.headers().getFirst("Content-Length").orElse(null));
		Assertions.assertEquals("", dispatched.body());
	}

	@Test
	public void nested_dispatchers_accumulate_mount_paths() throws Exception {
		Map<String, Gateway> outerMounts = new LinkedHashMap<>();
		outerMounts.put("/tenants", PathDispatcher.withMounts(mounts("/acme")));
		PathDispatcher dispatcher = PathDispatcher.withMounts(outerMounts);

		Assertions.assertEquals("/tenants/acme|/reports|", dispatch(dispatcher, "/tenants/acme/reports", null).body());
	}

	@Test
	public void duplicate_and_relative_prefixes_are_rejected() {
		Gateway gateway = echoGateway();

		Assertions.assertThrows(IllegalArgumentException.class, () -> PathDispatcher.withMounts(Map.of("/a", gateway, "/a/", gateway)));
		Assertions.assertThrows(IllegalArgumentException.class, () -> PathDispatcher.withMounts(Map.of("api", gateway)));
	}

	private static Map<String, Gateway> mounts(String... prefixes) {
		Map<String, Gateway> mounts = new LinkedHashMap<>();

		for (String prefix : prefixes)
			mounts.put(prefix, echoGateway());

		return mounts;
	}

	// Echoes mountPath|path|queryString
	private static Gateway echoGateway() {
		return Gateway.withResponder(request -> Response.withStatusCode(200)
				.body(request.getMountPath() + "|" + request.getPath() + "|" + request.getQueryString().orElse(""))
				.build());
	}

	private static Dispatched dispatch(PathDispatcher dispatcher, String path, String queryString) throws Exception {
		Request request = Request.withMethod("GET", queryString == null ? path : path + "?" + queryString)
				.pathAndQueryString(path, queryString)
				.build();
		RecordingResponseStarter responseStarter = new RecordingResponseStarter();

		try (ResponseBody responseBody = dispatcher.handle(request, responseStarter)) {
			StringBuilder body = new StringBuilder();
			byte[] chunk;

			while ((chunk = responseBody.nextChunk()) != null)
				body.append(new String(chunk, StandardCharsets.UTF_8));

			return new Dispatched(responseStarter.statusCode, responseStarter.headers, body.toString());
		}
	}

	private record Dispatched(Integer statusCode, Headers headers, String body) {}

	private static final class RecordingResponseStarter implements ResponseStarter {
		private Integer statusCode;
		private Headers headers;

		@Override
		public BodyWriter startResponse(Integer statusCode, String reasonPhrase, Headers headers, Throwable error) {
			this.statusCode = statusCode;
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
