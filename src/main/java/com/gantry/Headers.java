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
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An immutable HTTP header multimap.
 * <p>
 * Insertion order is preserved, names are matched case-insensitively, and a name may appear more than once.
 * <p>
 * Instances can be acquired via the {@link #with(String, String)} builder factory method or {@link #empty()}.
 */
@ThreadSafe
public final class Headers {
	@NonNull
	private static final Headers EMPTY;

	static {
		EMPTY = new Headers(List.of());
	}

	@NonNull
	private final List<@NonNull Entry> entries;

	/**
	 * A single header line.
	 *
	 * @param name  the header name, as it was supplied
	 * @param value the header value
	 */
	public record Entry(@NonNull String name, @NonNull String value) {
		public Entry {
			requireNonNull(name);
			requireNonNull(value);
		}

		@NonNull
		Boolean hasName(@NonNull String otherName) {
			return name().equalsIgnoreCase(otherName);
		}
	}

	@NonNull
	public static Headers empty() {
		return EMPTY;
	}

	/**
	 * Acquires a builder seeded with a single header.
	 *
	 * @param name  the header name
	 * @param value the header value
	 * @return the builder
	 */
	@NonNull
	public static Builder with(@NonNull String name,
														 @NonNull String value) {
		return new Builder().add(name, value);
	}

	private Headers(@NonNull List<@NonNull Entry> entries) {
		requireNonNull(entries);
		this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
	}

	/**
	 * Vends a mutable copy of these headers, suitable for building new instances.
	 *
	 * @return a builder seeded with this instance's entries
	 */
	@NonNull
	public Builder copy() {
		Builder builder = new Builder();
		builder.entries.addAll(this.entries);
		return builder;
	}

	/**
	 * The first value for the given header name.
	 *
	 * @param name the header name, matched case-insensitively
	 * @return the first value, or {@link Optional#empty()} if the header is absent
	 */
	@NonNull
	public Optional<String> getFirst(@NonNull String name) {
		requireNonNull(name);

		for (Entry entry : this.entries)
			if (entry.hasName(name))
				return Optional.of(entry.value());

		return Optional.empty();
	}

	/**
	 * Every value for the given header name, in the order received.
	 *
	 * @param name the header name, matched case-insensitively
	 * @return the values, empty if the header is absent
	 */
	@NonNull
	public List<@NonNull String> getAll(@NonNull String name) {
		requireNonNull(name);

		List<String> values = new ArrayList<>();

		for (Entry entry : this.entries)
			if (entry.hasName(name))
				values.add(entry.value());

		return Collections.unmodifiableList(values);
	}

	/**
	 * Every value for the given header name joined with {@code ", "}, which is how HTTP folds repeated list-valued headers.
	 *
	 * @param name the header name, matched case-insensitively
	 * @return the combined value, or {@link Optional#empty()} if the header is absent
	 */
	@NonNull
	public Optional<String> getCombined(@NonNull String name) {
		List<String> values = getAll(name);
		return values.isEmpty() ? Optional.empty() : Optional.of(String.join(", ", values));
	}

	@NonNull
	public Boolean contains(@NonNull String name) {
		return getFirst(name).isPresent();
	}

	/**
	 * Does any value of a comma-separated header contain the given token?
	 * <p>
	 * For example, {@code Connection: keep-alive, Upgrade} contains the token {@code upgrade}.
	 *
	 * @param name  the header name, matched case-insensitively
	 * @param token the token, matched case-insensitively
	 * @return {@code true} if the token is present
	 */
	@NonNull
	public Boolean containsToken(@NonNull String name,
															 @NonNull String token) {
		requireNonNull(name);
		requireNonNull(token);

		for (String value : getAll(name))
			for (String candidate : value.split(","))
				if (candidate.trim().equalsIgnoreCase(token))
					return true;

		return false;
	}

	/**
	 * Distinct header names in first-seen order, lowercased.
	 *
	 * @return the names
	 */
	@NonNull
	public Set<@NonNull String> getNames() {
		Set<@NonNull String> names = new LinkedHashSet<>();

		for (Entry entry : this.entries)
			names.add(entry.name().toLowerCase(Locale.ROOT));

		return Collections.unmodifiableSet(names);
	}

	@NonNull
	public List<@NonNull Entry> getEntries() {
		return this.entries;
	}

	@NonNull
	public Integer size() {
		return this.entries.size();
	}

	@NonNull
	public Boolean isEmpty() {
		return this.entries.isEmpty();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{entries=%s}", getClass().getSimpleName(), getEntries());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Headers headers))
			return false;

		return Objects.equals(getEntries(), headers.getEntries());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getEntries());
	}

	/**
	 * Builder used to construct instances of {@link Headers}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final List<@NonNull Entry> entries;

		private Builder() {
			this.entries = new ArrayList<>();
		}

		@NonNull
		public Builder add(@NonNull String name,
											 @NonNull String value) {
			this.entries.add(new Entry(name, value));
			return this;
		}

		/**
		 * Replaces every existing value for {@code name} with {@code value}.
		 */
		@NonNull
		public Builder set(@NonNull String name,
											 @NonNull String value) {
			remove(name);
			return add(name, value);
		}

		@NonNull
		public Builder remove(@NonNull String name) {
			requireNonNull(name);
			this.entries.removeIf(entry -> entry.hasName(name));
			return this;
		}

		@NonNull
		public Boolean contains(@NonNull String name) {
			requireNonNull(name);

			for (Entry entry : this.entries)
				if (entry.hasName(name))
					return true;

			return false;
		}

		@NonNull
		Integer size() {
			return this.entries.size();
		}

		// Used by the parser to unfold obsolete continuation lines
		void appendToLastValue(@NonNull String continuation) {
			requireNonNull(continuation);

			if (this.entries.isEmpty())
				throw new IllegalStateException("No header to continue");

			Entry last = this.entries.remove(this.entries.size() - 1);
			this.entries.add(new Entry(last.name(), last.value() + " " + continuation));
		}

		@NonNull
		public Headers build() {
			return this.entries.isEmpty() ? EMPTY : new Headers(this.entries);
		}
	}
}
