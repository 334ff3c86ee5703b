/*
 * Copyright 2022-2025 Revetware LLC.
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

package com.wirelet;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An ordered collection of HTTP headers.
 * <p>
 * Names are matched case-insensitively but written back exactly as added. A name may occur more than once:
 * {@link #getFirst(String)} returns the earliest value, {@link #getAll(String)} returns every value in
 * insertion order.
 * <p>
 * Request headers are exposed as a read-only instance; response headers stay mutable until the response is written.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public final class Headers implements Iterable<Header> {
	@NonNull
	private final List<Header> headers;
	@NonNull
	private Boolean readOnly;

	public Headers() {
		this(new ArrayList<>(), false);
	}

	private Headers(@NonNull List<Header> headers,
									@NonNull Boolean readOnly) {
		requireNonNull(headers);
		requireNonNull(readOnly);

		this.headers = headers;
		this.readOnly = readOnly;
	}

	/**
	 * Builds a mutable instance from a name-to-value map, preserving the map's iteration order.
	 *
	 * @param headers the headers to copy
	 * @return a new mutable instance
	 */
	@NonNull
	public static Headers of(@NonNull Map<@NonNull String, @NonNull String> headers) {
		requireNonNull(headers);

		Headers copy = new Headers();

		for (Entry<String, String> entry : headers.entrySet())
			copy.add(entry.getKey(), entry.getValue());

		return copy;
	}

	/**
	 * Adds a header, keeping any existing values for the same name.
	 *
	 * @param name  the header name
	 * @param value the header value
	 * @return this instance, for chaining
	 */
	@NonNull
	public Headers add(@NonNull String name,
										 @NonNull String value) {
		requireNonNull(name);
		requireNonNull(value);

		ensureMutable();
		Utilities.validateHeaderNameAndValue(name, value);

		this.headers.add(new Header(name, value));
		return this;
	}

	/**
	 * Sets a header, replacing existing values for the same name.
	 * <p>
	 * If the name is already present the new value takes the position of its first occurrence, otherwise it is appended.
	 *
	 * @param name  the header name
	 * @param value the header value
	 * @return this instance, for chaining
	 */
	@NonNull
	public Headers set(@NonNull String name,
										 @NonNull String value) {
		requireNonNull(name);
		requireNonNull(value);

		ensureMutable();
		Utilities.validateHeaderNameAndValue(name, value);

		int firstIndex = -1;

		for (int i = 0; i < this.headers.size(); ++i) {
			if (this.headers.get(i).hasName(name)) {
				firstIndex = i;
				break;
			}
		}

		if (firstIndex == -1) {
			this.headers.add(new Header(name, value));
			return this;
		}

		this.headers.set(firstIndex, new Header(this.headers.get(firstIndex).name(), value));

		for (int i = this.headers.size() - 1; i > firstIndex; --i)
			if (this.headers.get(i).hasName(name))
				this.headers.remove(i);

		return this;
	}

	// Headers as received off the wire are kept verbatim, so they skip validation.
	void addReceived(@NonNull String name,
									 @NonNull String value) {
		ensureMutable();
		this.headers.add(new Header(name, value));
	}

	// Obsolete line folding: continuation text joins the most recently received header.
	@NonNull
	Boolean appendToLastReceived(@NonNull String continuation) {
		requireNonNull(continuation);
		ensureMutable();

		if (this.headers.isEmpty())
			return false;

		int lastIndex = this.headers.size() - 1;
		Header last = this.headers.get(lastIndex);
		this.headers.set(lastIndex, new Header(last.name(), last.value().isEmpty() ? continuation : last.value() + " " + continuation));
		return true;
	}

	/**
	 * Removes every value for the given name.
	 *
	 * @param name the header name
	 * @return {@code true} if anything was removed
	 */
	@NonNull
	public Boolean remove(@NonNull String name) {
		requireNonNull(name);
		ensureMutable();
		return this.headers.removeIf(header -> header.hasName(name));
	}

	@NonNull
	public Optional<String> getFirst(@NonNull String name) {
		requireNonNull(name);

		for (Header header : this.headers)
			if (header.hasName(name))
				return Optional.of(header.value());

		return Optional.empty();
	}

	@NonNull
	public List<@NonNull String> getAll(@NonNull String name) {
		requireNonNull(name);

		List<String> values = new ArrayList<>();

		for (Header header : this.headers)
			if (header.hasName(name))
				values.add(header.value());

		return Collections.unmodifiableList(values);
	}

	@NonNull
	public Boolean contains(@NonNull String name) {
		return getFirst(name).isPresent();
	}

	/**
	 * Distinct header names in order of first appearance, cased as first seen.
	 *
	 * @return the header names
	 */
	@NonNull
	public Set<@NonNull String> getNames() {
		Set<String> lowercaseNames = new LinkedHashSet<>();
		Set<String> names = new LinkedHashSet<>();

		for (Header header : this.headers)
			if (lowercaseNames.add(header.name().toLowerCase(Locale.ROOT)))
				names.add(header.name());

		return Collections.unmodifiableSet(names);
	}

	@NonNull
	public List<@NonNull Header> getHeaders() {
		return Collections.unmodifiableList(this.headers);
	}

	@NonNull
	public Integer size() {
		return this.headers.size();
	}

	@NonNull
	public Boolean isEmpty() {
		return this.headers.isEmpty();
	}

	@NonNull
	public Boolean isReadOnly() {
		return this.readOnly;
	}

	// Once a response is written its headers can no longer change.
	void freeze() {
		this.readOnly = true;
	}

	/**
	 * Snapshot of these headers that rejects further mutation.
	 *
	 * @return a read-only copy
	 */
	@NonNull
	public Headers readOnlyCopy() {
		return new Headers(new ArrayList<>(this.headers), true);
	}

	/**
	 * Mutable copy of these headers.
	 *
	 * @return a mutable copy
	 */
	@NonNull
	public Headers mutableCopy() {
		return new Headers(new ArrayList<>(this.headers), false);
	}

	@Override
	@NonNull
	public Iterator<Header> iterator() {
		return getHeaders().iterator();
	}

	private void ensureMutable() {
		if (this.readOnly)
			throw new IllegalStateException("These headers are read-only");
	}

	@Override
	public String toString() {
		return format("%s{headers=%s}", getClass().getSimpleName(), this.headers);
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Headers headers))
			return false;

		return Objects.equals(this.headers, headers.headers);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.headers);
	}
}
