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

import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayOutputStream;
import java.lang.Thread.UncaughtExceptionHandler;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.invoke.MethodType;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A non-instantiable collection of utility methods.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Utilities {
	@NonNull
	private static final boolean VIRTUAL_THREADS_AVAILABLE;
	@NonNull
	private static final byte[] EMPTY_BYTE_ARRAY;
	@NonNull
	private static final Pattern HEAD_WHITESPACE_PATTERN;
	@NonNull
	private static final Pattern TAIL_WHITESPACE_PATTERN;
	@NonNull
	private static final DateTimeFormatter HTTP_DATE_FORMATTER;
	@NonNull
	private static final String UNRESERVED_FILENAME_CHARACTERS;

	static {
		EMPTY_BYTE_ARRAY = new byte[0];

		boolean virtualThreadsAvailable = false;

		try {
			// Detect if Virtual Threads are usable by feature testing via reflection.
			// Hat tip to https://github.com/javalin/javalin for this technique
			Class.forName("java.lang.Thread$Builder$OfVirtual");
			virtualThreadsAvailable = true;
		} catch (Exception ignored) {
			// We don't care why this failed, but if we're here we know JVM does not support virtual threads
		}

		VIRTUAL_THREADS_AVAILABLE = virtualThreadsAvailable;

		// \p{Z} or \p{Separator}: any kind of whitespace or invisible separator.
		HEAD_WHITESPACE_PATTERN = Pattern.compile("^(\\p{Z}|\\s)+");
		TAIL_WHITESPACE_PATTERN = Pattern.compile("(\\p{Z}|\\s)+$");

		// e.g. "Tue, 15 Nov 1994 08:12:31 GMT"
		HTTP_DATE_FORMATTER = DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US).withZone(ZoneOffset.UTC);

		UNRESERVED_FILENAME_CHARACTERS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789_.-~/";
	}

	private Utilities() {
		// Non-instantiable
	}

	/**
	 * Does the platform runtime support virtual threads (Java 21+)?
	 *
	 * @return {@code true} if the runtime supports virtual threads, {@code false} otherwise
	 */
	@NonNull
	static Boolean virtualThreadsAvailable() {
		return VIRTUAL_THREADS_AVAILABLE;
	}

	/**
	 * Provides a virtual-thread-per-task executor service if supported by the runtime.
	 * <p>
	 * Wirelet compiles against Java 17, so the executor is created through {@link MethodHandle} references rather than
	 * hard references to the virtual thread API.
	 * <p>
	 * <strong>You should not call this method if {@link Utilities#virtualThreadsAvailable()} is {@code false}.</strong>
	 *
	 * @param threadNamePrefix         thread name prefix for the virtual thread factory builder
	 * @param uncaughtExceptionHandler uncaught exception handler for the virtual thread factory builder
	 * @return a virtual-thread-per-task executor service
	 * @throws IllegalStateException if the runtime environment does not support virtual threads
	 */
	@NonNull
	static ExecutorService createVirtualThreadsNewThreadPerTaskExecutor(@NonNull String threadNamePrefix,
																																			@NonNull UncaughtExceptionHandler uncaughtExceptionHandler) {
		requireNonNull(threadNamePrefix);
		requireNonNull(uncaughtExceptionHandler);

		if (!virtualThreadsAvailable())
			throw new IllegalStateException("Virtual threads are not available in this runtime");

		Class<?> threadBuilderOfVirtualClass;

		try {
			threadBuilderOfVirtualClass = Class.forName("java.lang.Thread$Builder$OfVirtual");
		} catch (ClassNotFoundException e) {
			throw new IllegalStateException("Unable to load virtual thread builder class", e);
		}

		Lookup lookup = MethodHandles.publicLookup();

		MethodHandle methodHandleThreadOfVirtual;
		MethodHandle methodHandleThreadBuilderOfVirtualName;
		MethodHandle methodHandleThreadBuilderOfVirtualUncaughtExceptionHandler;
		MethodHandle methodHandleThreadBuilderOfVirtualFactory;
		MethodHandle methodHandleExecutorsNewThreadPerTaskExecutor;

		try {
			methodHandleThreadOfVirtual = lookup.findStatic(Thread.class, "ofVirtual", MethodType.methodType(threadBuilderOfVirtualClass));
			methodHandleThreadBuilderOfVirtualName = lookup.findVirtual(threadBuilderOfVirtualClass, "name", MethodType.methodType(threadBuilderOfVirtualClass, String.class, long.class));
			methodHandleThreadBuilderOfVirtualUncaughtExceptionHandler = lookup.findVirtual(threadBuilderOfVirtualClass, "uncaughtExceptionHandler", MethodType.methodType(threadBuilderOfVirtualClass, UncaughtExceptionHandler.class));
			methodHandleThreadBuilderOfVirtualFactory = lookup.findVirtual(threadBuilderOfVirtualClass, "factory", MethodType.methodType(ThreadFactory.class));
			methodHandleExecutorsNewThreadPerTaskExecutor = lookup.findStatic(Executors.class, "newThreadPerTaskExecutor", MethodType.methodType(ExecutorService.class, ThreadFactory.class));
		} catch (NoSuchMethodException | IllegalAccessException e) {
			throw new IllegalStateException("Unable to load method handle for virtual thread factory", e);
		}

		try {
			// Thread.ofVirtual()
			Object virtualThreadBuilder = methodHandleThreadOfVirtual.invoke();
			// .name(threadNamePrefix, start)
			methodHandleThreadBuilderOfVirtualName.invoke(virtualThreadBuilder, threadNamePrefix, 1L);
			// .uncaughtExceptionHandler(uncaughtExceptionHandler)
			methodHandleThreadBuilderOfVirtualUncaughtExceptionHandler.invoke(virtualThreadBuilder, uncaughtExceptionHandler);
			// .factory();
			ThreadFactory threadFactory = (ThreadFactory) methodHandleThreadBuilderOfVirtualFactory.invoke(virtualThreadBuilder);

			// return Executors.newThreadPerTaskExecutor(threadFactory);
			return (ExecutorService) methodHandleExecutorsNewThreadPerTaskExecutor.invoke(threadFactory);
		} catch (Throwable t) {
			throw new IllegalStateException("Unable to create virtual thread executor service", t);
		}
	}

	@NonNull
	static byte[] emptyByteArray() {
		return EMPTY_BYTE_ARRAY;
	}

	/**
	 * Parses a raw query string (or {@code application/x-www-form-urlencoded} body) into a map of names to values.
	 * <p>
	 * Rules:
	 * <ul>
	 *   <li>Pairs are separated by {@code &}; a pair's name and value by the first {@code =}.</li>
	 *   <li>{@code +} decodes to a space, then {@code %XX} escapes are decoded as UTF-8. Malformed escapes are kept literally.</li>
	 *   <li>Pairs whose name or value is blank are dropped, so {@code a=&b} yields nothing.</li>
	 *   <li>Repeated names keep every value, in order.</li>
	 * </ul>
	 * A leading {@code ?} is ignored.
	 *
	 * @param query the raw query, e.g. {@code a=1&a=2&b=3}
	 * @return an insertion-ordered, unmodifiable map of names to value lists
	 */
	@NonNull
	public static Map<@NonNull String, @NonNull List<@NonNull String>> extractQueryParametersFromQuery(@Nullable String query) {
		if (query == null)
			return Map.of();

		if (query.startsWith("?"))
			query = query.substring(1);

		if (query.isEmpty())
			return Map.of();

		Map<String, List<String>> queryParameters = new LinkedHashMap<>();

		for (String pair : query.split("&")) {
			if (pair.isEmpty())
				continue;

			int indexOfEquals = pair.indexOf('=');

			if (indexOfEquals == -1)
				continue;

			String name = decodeQueryComponent(pair.substring(0, indexOfEquals));
			String value = decodeQueryComponent(pair.substring(indexOfEquals + 1));

			if (name.isEmpty() || value.isEmpty())
				continue;

			queryParameters.computeIfAbsent(name, key -> new ArrayList<>()).add(value);
		}

		return unmodifiableCopy(queryParameters);
	}

	/**
	 * Extracts the raw (undecoded) query from a request target, if any.
	 *
	 * @param requestTarget the path from the request line, e.g. {@code /search?q=x}
	 * @return the text after the first {@code ?}, or {@link Optional#empty()} if there is none
	 */
	@NonNull
	public static Optional<String> extractRawQueryFromRequestTarget(@NonNull String requestTarget) {
		requireNonNull(requestTarget);

		int indexOfQuestionMark = requestTarget.indexOf('?');

		if (indexOfQuestionMark == -1)
			return Optional.empty();

		return Optional.of(requestTarget.substring(indexOfQuestionMark + 1));
	}

	@NonNull
	private static String decodeQueryComponent(@NonNull String string) {
		requireNonNull(string);

		if (string.isEmpty())
			return "";

		return percentDecode(string.replace('+', ' '), StandardCharsets.UTF_8);
	}

	/**
	 * Percent-decodes a string into bytes, then constructs a String using the provided charset.
	 * Invalid {@code %xy} sequences pass through untouched.
	 *
	 * @param string  the string to decode
	 * @param charset the charset used to interpret decoded bytes
	 * @return the decoded string
	 */
	@NonNull
	public static String percentDecode(@NonNull String string,
																		 @NonNull Charset charset) {
		requireNonNull(string);
		requireNonNull(charset);

		if (string.indexOf('%') == -1)
			return string;

		StringBuilder sb = new StringBuilder(string.length());
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();

		for (int i = 0; i < string.length(); ) {
			char c = string.charAt(i);

			if (c == '%') {
				// Consume consecutive valid %xx triplets into one byte run
				bytes.reset();
				int j = i;

				while (j + 2 < string.length() && string.charAt(j) == '%') {
					int hi = hex(string.charAt(j + 1));
					int lo = hex(string.charAt(j + 2));

					if (hi < 0 || lo < 0)
						break;

					bytes.write((hi << 4) | lo);
					j += 3;
				}

				if (bytes.size() == 0) {
					sb.append(c);
					++i;
					continue;
				}

				sb.append(new String(bytes.toByteArray(), charset));
				i = j;
				continue;
			}

			sb.append(c);
			++i;
		}

		return sb.toString();
	}

	private static int hex(char c) {
		if (c >= '0' && c <= '9') return c - '0';
		if (c >= 'A' && c <= 'F') return c - 'A' + 10;
		if (c >= 'a' && c <= 'f') return c - 'a' + 10;
		return -1;
	}

	/**
	 * Parses {@code Cookie} request headers into a map of cookie names to values.
	 * <p>
	 * Components are split on {@code ;} unless inside a quoted string, and quoted values are unquoted.
	 * Values are otherwise taken literally: no percent-decoding is performed. If a name repeats, the last value wins.
	 *
	 * @param headers the request headers
	 * @return an insertion-ordered, unmodifiable map of cookie names to values; empty if no {@code Cookie} header is present
	 */
	@NonNull
	public static Map<@NonNull String, @NonNull String> extractCookiesFromHeaders(@NonNull Headers headers) {
		requireNonNull(headers);

		Map<String, String> cookies = new LinkedHashMap<>();

		for (String headerValue : headers.getAll("Cookie")) {
			headerValue = trimAggressivelyToNull(headerValue);

			if (headerValue == null)
				continue;

			for (String cookieComponent : splitRespectingQuotes(headerValue, ';')) {
				cookieComponent = trimAggressivelyToNull(cookieComponent);

				if (cookieComponent == null)
					continue;

				String[] cookiePair = cookieComponent.split("=", 2);
				String cookieName = trimAggressivelyToNull(cookiePair[0]);

				if (cookieName == null || cookiePair.length != 2)
					continue;

				String rawValue = trimAggressivelyToEmpty(cookiePair[1]);

				cookies.put(cookieName, unquoteIfNeeded(rawValue));
			}
		}

		return Collections.unmodifiableMap(cookies);
	}

	// Splits on the separator only when not inside a quoted value. Backslash-escaped quotes stay inside the quoted value.
	@NonNull
	static List<@NonNull String> splitRespectingQuotes(@NonNull String headerValue,
																										 char separator) {
		List<String> parts = new ArrayList<>();
		StringBuilder current = new StringBuilder(headerValue.length());
		boolean inQuotes = false;
		boolean escape = false;

		for (int i = 0; i < headerValue.length(); i++) {
			char c = headerValue.charAt(i);

			if (escape) {
				current.append(c);
				escape = false;
				continue;
			}

			if (c == '\\') {
				escape = true;
				current.append(c);
				continue;
			}

			if (c == '"') {
				inQuotes = !inQuotes;
				current.append(c);
				continue;
			}

			if (c == separator && !inQuotes) {
				parts.add(current.toString());
				current.setLength(0);
				continue;
			}

			current.append(c);
		}

		if (current.length() > 0)
			parts.add(current.toString());

		return parts;
	}

	@NonNull
	static String unquoteIfNeeded(@NonNull String rawValue) {
		requireNonNull(rawValue);

		if (rawValue.length() < 2 || rawValue.charAt(0) != '"' || rawValue.charAt(rawValue.length() - 1) != '"')
			return rawValue;

		String inner = rawValue.substring(1, rawValue.length() - 1);
		StringBuilder sb = new StringBuilder(inner.length());
		boolean escape = false;

		for (int i = 0; i < inner.length(); i++) {
			char c = inner.charAt(i);

			if (escape) {
				sb.append(c);
				escape = false;
			} else if (c == '\\') {
				escape = true;
			} else {
				sb.append(c);
			}
		}

		// Dangling backslash
		if (escape)
			sb.append('\\');

		return sb.toString();
	}

	/**
	 * Extracts the media type (without parameters) from a {@code Content-Type} header value, lowercased.
	 * <p>
	 * For example, {@code "Application/JSON; charset=UTF-8"} → {@code "application/json"}.
	 *
	 * @param contentTypeHeaderValue the raw header value; may be {@code null} or blank
	 * @return the media type if present; otherwise {@link Optional#empty()}
	 */
	@NonNull
	public static Optional<@NonNull String> extractContentTypeFromHeaderValue(@Nullable String contentTypeHeaderValue) {
		contentTypeHeaderValue = trimAggressivelyToNull(contentTypeHeaderValue);

		if (contentTypeHeaderValue == null)
			return Optional.empty();

		int indexOfSemicolon = contentTypeHeaderValue.indexOf(";");
		String mediaType = indexOfSemicolon == -1 ? contentTypeHeaderValue : contentTypeHeaderValue.substring(0, indexOfSemicolon);

		return Optional.ofNullable(trimAggressivelyToNull(mediaType)).map(value -> value.toLowerCase(Locale.ROOT));
	}

	/**
	 * Extracts a named parameter from a header value such as {@code multipart/form-data; boundary="abc"}.
	 * <p>
	 * Parameter names match case-insensitively; surrounding quotes are removed from the value.
	 *
	 * @param headerValue   the raw header value
	 * @param parameterName the parameter to find, e.g. {@code boundary}
	 * @return the parameter value, or {@link Optional#empty()} if absent or blank
	 */
	@NonNull
	public static Optional<@NonNull String> extractHeaderParameter(@Nullable String headerValue,
																																 @NonNull String parameterName) {
		requireNonNull(parameterName);

		if (headerValue == null)
			return Optional.empty();

		List<String> components = splitRespectingQuotes(headerValue, ';');

		// First component is the main value, e.g. the media type
		for (int i = 1; i < components.size(); ++i) {
			String component = components.get(i);
			int indexOfEquals = component.indexOf('=');

			if (indexOfEquals == -1)
				continue;

			String name = trimAggressivelyToEmpty(component.substring(0, indexOfEquals));

			if (!name.equalsIgnoreCase(parameterName))
				continue;

			return Optional.ofNullable(trimAggressivelyToNull(unquoteIfNeeded(trimAggressivelyToEmpty(component.substring(indexOfEquals + 1)))));
		}

		return Optional.empty();
	}

	/**
	 * Formats an instant as an HTTP date, e.g. {@code Tue, 15 Nov 1994 08:12:31 GMT}.
	 *
	 * @param instant the instant to format
	 * @return the RFC 1123 representation in GMT
	 */
	@NonNull
	public static String formatHttpDate(@NonNull Instant instant) {
		requireNonNull(instant);
		return HTTP_DATE_FORMATTER.format(instant);
	}

	/**
	 * Percent-encodes a filename for use in a {@code Content-Disposition} header.
	 * <p>
	 * Letters, digits, {@code _.-~} and {@code /} are kept; every other UTF-8 byte becomes {@code %XX}.
	 *
	 * @param filename the filename to encode
	 * @return the encoded filename
	 */
	@NonNull
	public static String percentEncodeFilename(@NonNull String filename) {
		requireNonNull(filename);

		StringBuilder sb = new StringBuilder(filename.length());

		for (byte b : filename.getBytes(StandardCharsets.UTF_8)) {
			int unsigned = b & 0xFF;

			if (unsigned < 0x80 && UNRESERVED_FILENAME_CHARACTERS.indexOf(unsigned) != -1)
				sb.append((char) unsigned);
			else
				sb.append(format("%%%02X", unsigned));
		}

		return sb.toString();
	}

	/**
	 * A "stronger" version of {@link String#trim()} which discards any kind of whitespace or invisible separator.
	 *
	 * @param string the string to trim
	 * @return the trimmed string, or {@code null} if the input string is {@code null}
	 */
	@Nullable
	public static String trimAggressively(@Nullable String string) {
		if (string == null)
			return null;

		string = HEAD_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		if (string.length() == 0)
			return string;

		return TAIL_WHITESPACE_PATTERN.matcher(string).replaceAll("");
	}

	@Nullable
	public static String trimAggressivelyToNull(@Nullable String string) {
		if (string == null)
			return null;

		string = trimAggressively(string);
		return string.length() == 0 ? null : string;
	}

	@NonNull
	public static String trimAggressivelyToEmpty(@Nullable String string) {
		if (string == null)
			return "";

		return trimAggressively(string);
	}

	static void validateHeaderNameAndValue(@Nullable String name,
																				 @Nullable String value) {
		name = trimAggressivelyToNull(name);

		if (name == null)
			throw new IllegalArgumentException("Header name is blank");

		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);
			// RFC 9110 tchar: "!" / "#" / "$" / "%" / "&" / "'" / "*" / "+" / "-" / "." / "^" / "_" / "`" / "|" / "~" / DIGIT / ALPHA
			if (c > 0x7F || !(c == '!' || c == '#' || c == '$' || c == '%' || c == '&' || c == '\'' || c == '*' || c == '+' ||
					c == '-' || c == '.' || c == '^' || c == '_' || c == '`' || c == '|' || c == '~' ||
					Character.isLetterOrDigit(c))) {
				throw new IllegalArgumentException(format("Illegal header name '%s'. Offending character: '%s'", name, printableChar(c)));
			}
		}

		if (value == null)
			return;

		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);

			if (c == '\r' || c == '\n' || c > 0xFF || (c < 0x20 && c != '\t'))
				throw new IllegalArgumentException(format("Illegal header value '%s' for header name '%s'. Offending character: '%s'", printableString(value), name, printableChar(c)));
		}
	}

	@NonNull
	static String printableString(@NonNull String input) {
		requireNonNull(input);

		StringBuilder out = new StringBuilder(input.length() + 16);

		for (int i = 0; i < input.length(); i++)
			out.append(printableChar(input.charAt(i)));

		return out.toString();
	}

	@NonNull
	static String printableChar(char c) {
		if (c == '\r') return "\\r";
		if (c == '\n') return "\\n";
		if (c == '\t') return "\\t";
		if (c == 0) return "\\0";

		if (c < 0x20 || c == 0x7F || Character.isISOControl(c) || Character.getType(c) == Character.FORMAT)
			return format("\\u%04X", (int) c);

		return String.valueOf(c);
	}

	@NonNull
	private static Map<String, List<String>> unmodifiableCopy(@NonNull Map<String, List<String>> map) {
		Map<String, List<String>> copy = new LinkedHashMap<>(map.size());

		for (Entry<String, List<String>> entry : map.entrySet())
			copy.put(entry.getKey(), List.copyOf(entry.getValue()));

		return Collections.unmodifiableMap(copy);
	}
}
