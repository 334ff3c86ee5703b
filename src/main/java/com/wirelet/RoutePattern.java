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

import com.wirelet.exception.RouteConfigurationException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * A route's path template, such as {@code /users/:userId/roles}.
 * <p>
 * Patterns must start with {@code /}. A segment beginning with {@code :} is a placeholder which binds the
 * corresponding request path segment verbatim; every other segment is literal and must match exactly.
 * <p>
 * Restrictions:
 * <ul>
 *   <li>A placeholder must span its entire {@code /}-delimited segment, and must be named ({@code /users/:} is invalid)</li>
 *   <li>A placeholder name may appear at most once ({@code /users/:id/other/:id} is invalid)</li>
 * </ul>
 * Trailing slashes are not significant: {@code /users/} and {@code /users} are the same pattern.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@Immutable
public final class RoutePattern {
	@NonNull
	static final Character PLACEHOLDER_MARKER;

	static {
		PLACEHOLDER_MARKER = ':';
	}

	@NonNull
	private final String pattern;
	@NonNull
	private final List<@NonNull Segment> segments;

	/**
	 * Parses and validates a pattern.
	 *
	 * @param pattern the pattern, e.g. {@code /person/:person/item/:item}
	 * @return the parsed pattern
	 * @throws RouteConfigurationException if the pattern is invalid
	 */
	@NonNull
	public static RoutePattern of(@NonNull String pattern) {
		requireNonNull(pattern);
		return new RoutePattern(pattern);
	}

	private RoutePattern(@NonNull String pattern) {
		requireNonNull(pattern);

		if (!pattern.startsWith("/"))
			throw new RouteConfigurationException(format("Route pattern '%s' must start with '/'", pattern));

		this.pattern = normalizePath(pattern);

		List<Segment> segments = extractSegments(this.pattern);
		Set<String> placeholderNames = new LinkedHashSet<>();

		for (Segment segment : segments) {
			if (segment.type() != SegmentType.PLACEHOLDER)
				continue;

			if (segment.value().isEmpty())
				throw new RouteConfigurationException(format("Unnamed placeholder in route pattern '%s'", pattern));

			if (!placeholderNames.add(segment.value()))
				throw new RouteConfigurationException(format("Duplicate placeholder name '%s' in route pattern '%s'", segment.value(), pattern));
		}

		this.segments = unmodifiableList(segments);
	}

	/**
	 * Strips any query component and trailing slashes. The root path stays {@code /}.
	 *
	 * @param path a request path or pattern
	 * @return the normalized path
	 */
	@NonNull
	static String normalizePath(@NonNull String path) {
		requireNonNull(path);

		int queryIndex = path.indexOf('?');

		if (queryIndex >= 0)
			path = path.substring(0, queryIndex);

		int end = path.length();

		while (end > 1 && path.charAt(end - 1) == '/')
			end--;

		path = path.substring(0, end);
		return path.isEmpty() ? "/" : path;
	}

	/**
	 * The {@code /}-delimited segments of an already-normalized path.
	 *
	 * @param normalizedPath a path produced by {@link #normalizePath(String)}
	 * @return the segments, or the empty list for {@code /}
	 */
	@NonNull
	static List<@NonNull String> splitSegments(@NonNull String normalizedPath) {
		requireNonNull(normalizedPath);

		if ("/".equals(normalizedPath))
			return emptyList();

		String withoutLeadingSlash = normalizedPath.startsWith("/") ? normalizedPath.substring(1) : normalizedPath;
		List<String> segments = new ArrayList<>();
		int start = 0;

		for (int i = 0; i <= withoutLeadingSlash.length(); i++) {
			if (i == withoutLeadingSlash.length() || withoutLeadingSlash.charAt(i) == '/') {
				segments.add(withoutLeadingSlash.substring(start, i));
				start = i + 1;
			}
		}

		return segments;
	}

	@NonNull
	private static List<@NonNull Segment> extractSegments(@NonNull String normalizedPattern) {
		List<Segment> segments = new ArrayList<>();

		for (String part : splitSegments(normalizedPattern)) {
			if (!part.isEmpty() && part.charAt(0) == PLACEHOLDER_MARKER)
				segments.add(new Segment(part.substring(1), SegmentType.PLACEHOLDER));
			else
				segments.add(new Segment(part, SegmentType.LITERAL));
		}

		return segments;
	}

	/**
	 * Binds placeholders against a normalized request path.
	 * <p>
	 * For example, {@code /person/:person/item/:item} against {@code /person/123/item/456} yields
	 * {@code {person=123, item=456}}.
	 *
	 * @param normalizedPath the request path, already normalized
	 * @return the placeholder values in pattern order, or {@link Optional#empty()} if the path does not match
	 */
	@NonNull
	public Optional<Map<@NonNull String, @NonNull String>> match(@NonNull String normalizedPath) {
		requireNonNull(normalizedPath);

		List<String> pathSegments = splitSegments(normalizedPath);

		if (pathSegments.size() != getSegments().size())
			return Optional.empty();

		Map<String, String> placeholders = null;

		for (int i = 0; i < pathSegments.size(); i++) {
			Segment segment = getSegments().get(i);
			String pathSegment = pathSegments.get(i);

			if (segment.type() == SegmentType.LITERAL) {
				if (!segment.value().equals(pathSegment))
					return Optional.empty();
			} else {
				if (placeholders == null)
					placeholders = new LinkedHashMap<>();

				placeholders.put(segment.value(), pathSegment);
			}
		}

		return Optional.of(placeholders == null ? Map.of() : Collections.unmodifiableMap(placeholders));
	}

	/**
	 * Does any segment of this pattern start with the placeholder marker?
	 *
	 * @return {@code true} if this pattern binds path parameters
	 */
	@NonNull
	public Boolean isParameterized() {
		for (Segment segment : getSegments())
			if (segment.type() == SegmentType.PLACEHOLDER)
				return true;

		return false;
	}

	@NonNull
	public String getPattern() {
		return this.pattern;
	}

	@NonNull
	public List<@NonNull Segment> getSegments() {
		return this.segments;
	}

	@Override
	public String toString() {
		return format("%s{pattern=%s}", getClass().getSimpleName(), getPattern());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RoutePattern routePattern))
			return false;

		return Objects.equals(getPattern(), routePattern.getPattern());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getPattern());
	}

	/**
	 * Is a segment literal text or a placeholder?
	 */
	public enum SegmentType {
		LITERAL,
		PLACEHOLDER
	}

	/**
	 * One {@code /}-delimited part of a {@link RoutePattern}. Placeholder values exclude the {@code :} marker.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	public record Segment(@NonNull String value,
												@NonNull SegmentType type) {
		public Segment {
			requireNonNull(value);
			requireNonNull(type);
		}
	}
}
