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

import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Where a server listens: a TCP host and port, a Unix domain socket path, or an abstract-namespace Unix socket name.
 * <p>
 * Instances are usually acquired via {@link #parse(String)}, which understands:
 * <ul>
 *   <li>{@code host:port}, {@code [ipv6]:port} and {@code :port} (all interfaces)</li>
 *   <li>a filesystem path containing {@code /}, for example {@code /run/gantry.sock}</li>
 *   <li>{@code @name}, an abstract socket whose name is {@code name} prefixed with a NUL byte</li>
 * </ul>
 */
@ThreadSafe
public final class BindAddress {
	/**
	 * Kinds of listening socket.
	 */
	public enum Type {
		TCP,
		UNIX_DOMAIN,
		/**
		 * Linux abstract namespace: no filesystem entry, name begins with a NUL byte.
		 */
		ABSTRACT_UNIX_DOMAIN
	}

	@NonNull
	private final Type type;
	@Nullable
	private final String host;
	@Nullable
	private final Integer port;
	@Nullable
	private final String socketName;

	/**
	 * Listens on all interfaces.
	 *
	 * @param port the TCP port, {@code 0} for an ephemeral port
	 * @return the bind address
	 */
	@NonNull
	public static BindAddress withPort(@NonNull Integer port) {
		return withHostAndPort(null, port);
	}

	/**
	 * @param host the interface to listen on, or {@code null} for all interfaces
	 * @param port the TCP port, {@code 0} for an ephemeral port
	 * @return the bind address
	 */
	@NonNull
	public static BindAddress withHostAndPort(@Nullable String host,
																						@NonNull Integer port) {
		requireNonNull(port);

		if (port < 0 || port > 65535)
			throw new IllegalArgumentException(format("Illegal port %d", port));

		return new BindAddress(Type.TCP, host == null || host.isEmpty() ? null : host, port, null);
	}

	@NonNull
	public static BindAddress withUnixDomainSocketPath(@NonNull Path path) {
		requireNonNull(path);
		return new BindAddress(Type.UNIX_DOMAIN, null, null, path.toString());
	}

	/**
	 * @param name the abstract socket name, without the leading NUL byte
	 * @return the bind address
	 */
	@NonNull
	public static BindAddress withAbstractName(@NonNull String name) {
		requireNonNull(name);

		if (name.isEmpty())
			throw new IllegalArgumentException("Abstract socket name must not be empty");

		return new BindAddress(Type.ABSTRACT_UNIX_DOMAIN, null, null, "\0" + name);
	}

	/**
	 * Parses a bind location as it would appear on a command line or in a configuration file.
	 *
	 * @param bindAddress the bind location
	 * @return the parsed bind address
	 * @throws IllegalArgumentException if {@code bindAddress} is not a recognizable location
	 */
	@NonNull
	public static BindAddress parse(@NonNull String bindAddress) {
		requireNonNull(bindAddress);

		String trimmed = bindAddress.trim();

		if (trimmed.isEmpty())
			throw new IllegalArgumentException("Bind address must not be empty");

		if (trimmed.startsWith("@"))
			return withAbstractName(trimmed.substring(1));

		if (trimmed.startsWith("[")) {
			int closingBracketIndex = trimmed.indexOf(']');

			if (closingBracketIndex < 0 || closingBracketIndex + 1 >= trimmed.length() || trimmed.charAt(closingBracketIndex + 1) != ':')
				throw new IllegalArgumentException(format("Malformed IPv6 bind address '%s'; expected [address]:port", bindAddress));

			return withHostAndPort(trimmed.substring(1, closingBracketIndex), parsePort(trimmed.substring(closingBracketIndex + 2), bindAddress));
		}

		if (trimmed.contains("/"))
			return withUnixDomainSocketPath(Path.of(trimmed));

		int colonIndex = trimmed.lastIndexOf(':');

		if (colonIndex < 0 || trimmed.indexOf(':') != colonIndex)
			throw new IllegalArgumentException(format("Unrecognized bind address '%s'; expected host:port, a socket path, or @name", bindAddress));

		return withHostAndPort(trimmed.substring(0, colonIndex), parsePort(trimmed.substring(colonIndex + 1), bindAddress));
	}

	@NonNull
	private static Integer parsePort(@NonNull String port,
																	 @NonNull String bindAddress) {
		try {
			return Integer.parseInt(port);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(format("Illegal port in bind address '%s'", bindAddress), e);
		}
	}

	private BindAddress(@NonNull Type type,
											@Nullable String host,
											@Nullable Integer port,
											@Nullable String socketName) {
		requireNonNull(type);

		this.type = type;
		this.host = host;
		this.port = port;
		this.socketName = socketName;
	}

	@NonNull
	public Type getType() {
		return this.type;
	}

	@NonNull
	public Boolean isUnixDomain() {
		return getType() != Type.TCP;
	}

	/**
	 * The interface to listen on, for {@link Type#TCP} addresses that name one.
	 */
	@NonNull
	public Optional<String> getHost() {
		return Optional.ofNullable(this.host);
	}

	@NonNull
	public Optional<Integer> getPort() {
		return Optional.ofNullable(this.port);
	}

	/**
	 * The socket file, for {@link Type#UNIX_DOMAIN} addresses.
	 */
	@NonNull
	public Optional<Path> getPath() {
		return getType() == Type.UNIX_DOMAIN ? Optional.of(Path.of(requireNonNull(this.socketName))) : Optional.empty();
	}

	/**
	 * The socket name including its leading NUL byte, for {@link Type#ABSTRACT_UNIX_DOMAIN} addresses.
	 */
	@NonNull
	public Optional<String> getAbstractName() {
		return getType() == Type.ABSTRACT_UNIX_DOMAIN ? Optional.ofNullable(this.socketName) : Optional.empty();
	}

	@Override
	@NonNull
	public String toString() {
		if (getType() == Type.UNIX_DOMAIN)
			return requireNonNull(this.socketName);

		if (getType() == Type.ABSTRACT_UNIX_DOMAIN)
			return "@" + requireNonNull(this.socketName).substring(1);

		String host = this.host == null ? "" : (this.host.contains(":") ? "[" + this.host + "]" : this.host);
		return host + ":" + this.port;
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof BindAddress bindAddress))
			return false;

		return Objects.equals(getType(), bindAddress.getType())
				&& Objects.equals(this.host, bindAddress.host)
				&& Objects.equals(this.port, bindAddress.port)
				&& Objects.equals(this.socketName, bindAddress.socketName);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getType(), this.host, this.port, this.socketName);
	}
}
