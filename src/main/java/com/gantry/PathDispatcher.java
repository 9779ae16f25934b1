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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A {@link Gateway} that hosts several gateways on one server, each mounted at a path prefix.
 * <p>
 * The longest prefix that matches a whole number of leading path segments wins. The matched gateway sees a request
 * whose {@link Request#getMountPath() mount path} has the prefix appended and whose {@link Request#getPath() path}
 * has it removed. Requests that match no prefix get an empty {@code 404 Not Found}.
 * <p>
 * For example:
 * <pre>{@code Gateway gateway = PathDispatcher.withMounts(Map.of(
 *   "/api", apiGateway,
 *   "/", siteGateway
 * ));}</pre>
 */
@ThreadSafe
public final class PathDispatcher implements Gateway {
	@NonNull
	private final List<@NonNull Mount> mounts;

	/**
	 * Creates a dispatcher over the given mounts.
	 * <p>
	 * A trailing {@code /} on a prefix is ignored, so {@code "/"} mounts a gateway at the root.
	 *
	 * @param mounts gateways keyed by the path prefix they serve
	 * @return the dispatcher
	 */
	@NonNull
	public static PathDispatcher withMounts(@NonNull Map<@NonNull String, @NonNull Gateway> mounts) {
		requireNonNull(mounts);
		return new PathDispatcher(mounts);
	}

	private PathDispatcher(@NonNull Map<@NonNull String, @NonNull Gateway> mounts) {
		requireNonNull(mounts);

		List<@NonNull Mount> normalizedMounts = new ArrayList<>(mounts.size());

		for (Map.Entry<@NonNull String, @NonNull Gateway> entry : mounts.entrySet()) {
			String prefix = requireNonNull(entry.getKey());
			Gateway gateway = requireNonNull(entry.getValue());

			if (!prefix.isEmpty() && !prefix.startsWith("/"))
				throw new IllegalArgumentException(format("Mount prefix '%s' must start with '/'", prefix));

			String normalizedPrefix = prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;

			for (Mount mount : normalizedMounts)
				if (mount.prefix().equals(normalizedPrefix))
					throw new IllegalArgumentException(format("More than one gateway is mounted at '%s'", prefix));

			normalizedMounts.add(new Mount(normalizedPrefix, gateway));
		}

		normalizedMounts.sort(Comparator.comparingInt((Mount mount) -> mount.prefix().length()).reversed());
		this.mounts = Collections.unmodifiableList(normalizedMounts);
	}

	@Override
	@NonNull
	public ResponseBody handle(@NonNull Request request,
														 @NonNull ResponseStarter responseStarter) throws Exception {
		requireNonNull(request);
		requireNonNull(responseStarter);

		String path = request.getPath().isEmpty() ? "/" : request.getPath();

		for (Mount mount : getMounts()) {
			String prefix = mount.prefix();

			if (path.equals(prefix) || path.startsWith(prefix + "/")) {
				Request mountedRequest = request.copy()
						.mountPath(request.getMountPath() + prefix)
						.pathAndQueryString(path.substring(prefix.length()), request.getQueryString().orElse(null))
						.build();

				return mount.gateway().handle(mountedRequest, responseStarter);
			}
		}

		responseStarter.startResponse(404, Headers.with("Content-Type", "text/plain")
				.add("Content-Length", "0")
				.build());

		return ResponseBody.empty();
	}

	@Override
	@NonNull
	public String toString() {
		List<@NonNull String> prefixes = new ArrayList<>(getMounts().size());

		for (Mount mount : getMounts())
			prefixes.add(mount.prefix().isEmpty() ? "/" : mount.prefix());

		return format("%s{mounts=%s}", getClass().getSimpleName(), prefixes);
	}

	@NonNull
	private List<@NonNull Mount> getMounts() {
		return this.mounts;
	}

	private record Mount(@NonNull String prefix,
											 @NonNull Gateway gateway) {
		Mount {
			requireNonNull(prefix);
			requireNonNull(gateway);
		}
	}
}
