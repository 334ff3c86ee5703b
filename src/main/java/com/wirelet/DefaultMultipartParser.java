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

import com.wirelet.exception.MalformedRequestException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.wirelet.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Streaming {@code multipart/form-data} parser.
 * <p>
 * The body is scanned once for boundary delimiters; file parts are copied straight into their own
 * {@link SpooledBuffer} so an upload never has to fit in memory.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultMultipartParser implements MultipartParser {
	@NonNull
	private static final Logger logger = LoggerFactory.getLogger(DefaultMultipartParser.class);

	@NonNull
	private static final Integer MAX_MULTIPART_PARTS;
	@NonNull
	private static final Integer MAX_PART_HEADER_LINE_LENGTH;
	@NonNull
	private static final Integer MAX_FIELD_LENGTH;
	@NonNull
	private static final DefaultMultipartParser DEFAULT_INSTANCE;

	static {
		MAX_MULTIPART_PARTS = 1_000;
		MAX_PART_HEADER_LINE_LENGTH = 8_192;
		MAX_FIELD_LENGTH = 1_024 * 1_024;
		DEFAULT_INSTANCE = new DefaultMultipartParser(SpooledBuffer.DEFAULT_THRESHOLD);
	}

	@NonNull
	private final Integer spoolThreshold;

	DefaultMultipartParser(@NonNull Integer spoolThreshold) {
		requireNonNull(spoolThreshold);
		this.spoolThreshold = spoolThreshold;
	}

	@NonNull
	public static DefaultMultipartParser defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	/**
	 * Validate boundary characters per RFC 2046.
	 */
	@NonNull
	private Boolean isValidBoundary(@NonNull String boundary) {
		requireNonNull(boundary);

		if (boundary.length() > 70)
			return false;

		for (int i = 0; i < boundary.length(); i++) {
			char c = boundary.charAt(i);

			boolean isAlphanumeric = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
			boolean isAllowedPunctuation = c == '\'' || c == '(' || c == ')' || c == '+' ||
					c == '_' || c == ',' || c == '-' || c == '.' ||
					c == '/' || c == ':' || c == '=' || c == '?' || c == ' ';

			if (!isAlphanumeric && !isAllowedPunctuation)
				return false;
		}

		return true;
	}

	@Override
	@NonNull
	public FormData parse(@NonNull String contentTypeHeaderValue,
												@NonNull InputStream body) throws IOException {
		requireNonNull(contentTypeHeaderValue);
		requireNonNull(body);

		String boundary = Utilities.extractHeaderParameter(contentTypeHeaderValue, "boundary").orElse(null);

		if (boundary == null)
			throw new MalformedRequestException("Multipart request must include a non-empty 'boundary' parameter in its Content-Type header");

		if (!isValidBoundary(boundary))
			throw new MalformedRequestException(format("Multipart boundary is not valid per RFC 2046: %s", boundary));

		InputStream input = new BufferedInputStream(body);
		byte[] firstDelimiter = ("--" + boundary).getBytes(StandardCharsets.ISO_8859_1);
		byte[] delimiter = ("\r\n--" + boundary).getBytes(StandardCharsets.ISO_8859_1);

		Map<String, List<String>> fields = new LinkedHashMap<>();
		List<UploadedFile> files = new ArrayList<>();

		try {
			// Preamble
			if (!readUntilDelimiter(input, firstDelimiter, OutputStream.nullOutputStream()))
				return FormData.empty();

			int partCount = 0;

			while (true) {
				if (isCloseDelimiter(input))
					break;

				if (++partCount > MAX_MULTIPART_PARTS)
					throw new MalformedRequestException(format("Too many multipart parts. Maximum allowed is %s", MAX_MULTIPART_PARTS));

				Headers partHeaders = readPartHeaders(input);
				String contentDisposition = partHeaders.getFirst("Content-Disposition").orElse(null);
				String name = trimAggressivelyToNull(Utilities.extractHeaderParameter(contentDisposition, "name").orElse(null));
				String filename = contentDisposition == null ? null : extractFilename(contentDisposition);

				if (filename != null && name != null) {
					SpooledBuffer content = new SpooledBuffer(getSpoolThreshold());
					files.add(new UploadedFile(name, filename, partHeaders.getFirst("Content-Type").orElse(null), content));

					if (!readUntilDelimiter(input, delimiter, new SpooledBufferOutputStream(content)))
						throw new MalformedRequestException("Multipart body ended before its closing boundary");
				} else {
					ByteArrayOutputStream value = new ByteArrayOutputStream();
					OutputStream sink = name == null ? OutputStream.nullOutputStream() : new LimitedOutputStream(value, MAX_FIELD_LENGTH);

					if (!readUntilDelimiter(input, delimiter, sink))
						throw new MalformedRequestException("Multipart body ended before its closing boundary");

					if (name != null)
						fields.computeIfAbsent(name, key -> new ArrayList<>()).add(value.toString(StandardCharsets.UTF_8));
					else
						logger.debug("Ignoring multipart part without a name");
				}
			}
		} catch (IOException | RuntimeException e) {
			for (UploadedFile file : files)
				closeQuietly(file);

			throw e;
		}

		Map<String, List<String>> unmodifiableFields = new LinkedHashMap<>(fields.size());

		for (Map.Entry<String, List<String>> entry : fields.entrySet())
			unmodifiableFields.put(entry.getKey(), List.copyOf(entry.getValue()));

		return new FormData(Collections.unmodifiableMap(unmodifiableFields), files);
	}

	@Nullable
	private String extractFilename(@NonNull String contentDisposition) {
		requireNonNull(contentDisposition);

		// A present-but-empty filename still marks a file part
		for (String component : Utilities.splitRespectingQuotes(contentDisposition, ';')) {
			int indexOfEquals = component.indexOf('=');

			if (indexOfEquals == -1)
				continue;

			if (!Utilities.trimAggressivelyToEmpty(component.substring(0, indexOfEquals)).equalsIgnoreCase("filename"))
				continue;

			String filename = Utilities.unquoteIfNeeded(Utilities.trimAggressivelyToEmpty(component.substring(indexOfEquals + 1)));

			// Some browsers send the full client-side path
			int lastSeparator = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
			return lastSeparator == -1 ? filename : filename.substring(lastSeparator + 1);
		}

		return null;
	}

	// After a delimiter, "--" means the body is over; otherwise skip the rest of the delimiter line.
	@NonNull
	private Boolean isCloseDelimiter(@NonNull InputStream input) throws IOException {
		input.mark(2);
		int first = input.read();
		int second = input.read();

		if (first == '-' && second == '-')
			return true;

		if (first == -1)
			throw new MalformedRequestException("Multipart body ended before its closing boundary");

		input.reset();

		// Transport padding, then CRLF
		int b;

		while ((b = input.read()) != -1 && b != '\n') {
			// Skip
		}

		if (b == -1)
			throw new MalformedRequestException("Multipart body ended before its closing boundary");

		return false;
	}

	@NonNull
	private Headers readPartHeaders(@NonNull InputStream input) throws IOException {
		requireNonNull(input);

		Headers headers = new Headers();

		while (true) {
			ByteArrayOutputStream line = new ByteArrayOutputStream(128);
			int b;

			while ((b = input.read()) != -1 && b != '\n') {
				line.write(b);

				if (line.size() > MAX_PART_HEADER_LINE_LENGTH)
					throw new MalformedRequestException("Multipart part header line is too long");
			}

			if (b == -1)
				throw new MalformedRequestException("Multipart body ended inside part headers");

			byte[] bytes = line.toByteArray();
			int length = bytes.length > 0 && bytes[bytes.length - 1] == '\r' ? bytes.length - 1 : bytes.length;

			if (length == 0)
				return headers;

			String headerLine = new String(bytes, 0, length, StandardCharsets.UTF_8);
			int indexOfColon = headerLine.indexOf(':');

			if (indexOfColon <= 0)
				continue;

			headers.addReceived(headerLine.substring(0, indexOfColon).trim(), headerLine.substring(indexOfColon + 1).trim());
		}
	}

	/**
	 * Copies bytes to {@code sink} until {@code delimiter} is seen, consuming the delimiter.
	 * <p>
	 * Matching is Knuth-Morris-Pratt over the stream, so bytes that looked like the start of a delimiter but were not
	 * are written out in order.
	 *
	 * @return {@code true} if the delimiter was found, {@code false} if the stream ended first
	 */
	@NonNull
	private Boolean readUntilDelimiter(@NonNull InputStream input,
																		 @NonNull byte[] delimiter,
																		 @NonNull OutputStream sink) throws IOException {
		int[] failure = failureTable(delimiter);
		OutputStream out = new BufferedOutputStream(sink, 8_192);
		int matched = 0;
		int b;

		try {
			while ((b = input.read()) != -1) {
				while (matched > 0 && b != (delimiter[matched] & 0xFF)) {
					int fallback = failure[matched - 1];
					out.write(delimiter, 0, matched - fallback);
					matched = fallback;
				}

				if (b == (delimiter[matched] & 0xFF)) {
					if (++matched == delimiter.length)
						return true;
				} else {
					out.write(b);
				}
			}

			out.write(delimiter, 0, matched);
			return false;
		} finally {
			out.flush();
		}
	}

	@NonNull
	private static int[] failureTable(@NonNull byte[] pattern) {
		int[] failure = new int[pattern.length];
		int k = 0;

		for (int i = 1; i < pattern.length; ++i) {
			while (k > 0 && pattern[i] != pattern[k])
				k = failure[k - 1];

			if (pattern[i] == pattern[k])
				++k;

			failure[i] = k;
		}

		return failure;
	}

	private void closeQuietly(@NonNull UploadedFile file) {
		try {
			file.close();
		} catch (IOException e) {
			logger.warn(format("Unable to release upload buffer for %s", file.getFilename()), e);
		}
	}

	@NonNull
	private Integer getSpoolThreshold() {
		return this.spoolThreshold;
	}

	private static final class SpooledBufferOutputStream extends OutputStream {
		@NonNull
		private final SpooledBuffer spooledBuffer;

		private SpooledBufferOutputStream(@NonNull SpooledBuffer spooledBuffer) {
			this.spooledBuffer = spooledBuffer;
		}

		@Override
		public void write(int b) throws IOException {
			this.spooledBuffer.write(new byte[]{(byte) b}, 0, 1);
		}

		@Override
		public void write(@NonNull byte[] bytes, int offset, int length) throws IOException {
			this.spooledBuffer.write(bytes, offset, length);
		}
	}

	private static final class LimitedOutputStream extends OutputStream {
		@NonNull
		private final OutputStream delegate;
		private final int limit;
		private int written;

		private LimitedOutputStream(@NonNull OutputStream delegate,
																int limit) {
			this.delegate = delegate;
			this.limit = limit;
		}

		@Override
		public void write(int b) throws IOException {
			write(new byte[]{(byte) b}, 0, 1);
		}

		@Override
		public void write(@NonNull byte[] bytes, int offset, int length) throws IOException {
			this.written += length;

			if (this.written > this.limit)
				throw new MalformedRequestException(format("Multipart form field exceeds maximum length of %d bytes", this.limit));

			this.delegate.write(bytes, offset, length);
		}
	}
}
