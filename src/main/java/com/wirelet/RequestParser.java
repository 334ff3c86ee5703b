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

import com.wirelet.exception.HttpException;
import com.wirelet.exception.MalformedRequestException;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Reads the start line and header block of an HTTP/1.1 request, leaving the body unread.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class RequestParser {
	@NonNull
	private final Integer maximumHeaderSize;

	RequestParser(@NonNull Integer maximumHeaderSize) {
		requireNonNull(maximumHeaderSize);

		if (maximumHeaderSize <= 0)
			throw new IllegalArgumentException("Maximum header size must be > 0");

		this.maximumHeaderSize = maximumHeaderSize;
	}

	/**
	 * The parsed start line and headers of a request.
	 */
	record RequestHead(@NonNull String method,
										 @NonNull String path,
										 @NonNull String protocol,
										 @NonNull Headers headers) {
		RequestHead {
			requireNonNull(method);
			requireNonNull(path);
			requireNonNull(protocol);
			requireNonNull(headers);
		}
	}

	@NonNull
	RequestHead parse(@NonNull ConnectionReader connectionReader) throws IOException {
		requireNonNull(connectionReader);

		byte[] startLineBytes = connectionReader.readLine(getMaximumHeaderSize(), StatusCode.HTTP_414);

		if (startLineBytes == null)
			throw new MalformedRequestException("Connection closed before a request line was received");

		String[] startLineTokens = parseStartLine(new String(startLineBytes, StandardCharsets.ISO_8859_1));
		Headers headers = parseHeaders(connectionReader);

		return new RequestHead(startLineTokens[0], startLineTokens[1], startLineTokens[2], headers.readOnlyCopy());
	}

	/**
	 * Splits a request line on single spaces into method, path and protocol.
	 *
	 * @param startLine the request line without its terminator
	 * @return exactly three tokens
	 * @throws MalformedRequestException if the line does not hold exactly three tokens
	 */
	@NonNull
	static String[] parseStartLine(@NonNull String startLine) {
		requireNonNull(startLine);

		String[] tokens = startLine.split(" ", -1);

		if (tokens.length != 3)
			throw new MalformedRequestException(format("Malformed request line '%s'", Utilities.printableString(startLine)));

		for (String token : tokens)
			if (token.isEmpty())
				throw new MalformedRequestException(format("Malformed request line '%s'", Utilities.printableString(startLine)));

		return tokens;
	}

	@NonNull
	private Headers parseHeaders(@NonNull ConnectionReader connectionReader) throws IOException {
		requireNonNull(connectionReader);

		Headers headers = new Headers();
		int remainingHeaderBytes = getMaximumHeaderSize();

		while (true) {
			byte[] line = connectionReader.readLine(remainingHeaderBytes, StatusCode.HTTP_431);

			// Client stopped sending before the blank line; treat what we have as the full header block
			if (line == null || line.length == 0)
				return headers;

			remainingHeaderBytes -= line.length + 2;

			if (remainingHeaderBytes < 0)
				throw new HttpException(StatusCode.HTTP_431);

			if (line[0] == ' ' || line[0] == '\t') {
				String continuation = Utilities.trimAggressivelyToEmpty(new String(line, StandardCharsets.ISO_8859_1));

				if (!headers.appendToLastReceived(continuation))
					throw new MalformedRequestException("Header continuation line without a preceding header");

				continue;
			}

			Header header = parseHeaderLine(line);
			headers.addReceived(header.name(), header.value());
		}
	}

	@NonNull
	static Header parseHeaderLine(@NonNull byte[] line) {
		requireNonNull(line);

		int colonIndex = indexOfColon(line);

		if (colonIndex <= 0)
			throw new MalformedRequestException("Malformed header line");

		for (int i = 0; i < colonIndex; i++) {
			int b = line[i] & 0xFF;

			if (b > 0x7F || b <= 0x20)
				throw new MalformedRequestException("Illegal character in header name");
		}

		int valueStart = colonIndex + 1;

		// Advance beyond variable-length whitespace prefix
		while (valueStart < line.length && (line[valueStart] == ' ' || line[valueStart] == '\t'))
			valueStart++;

		int valueEnd = line.length;

		while (valueEnd > valueStart && (line[valueEnd - 1] == ' ' || line[valueEnd - 1] == '\t'))
			valueEnd--;

		return new Header(
				new String(line, 0, colonIndex, StandardCharsets.US_ASCII),
				new String(line, valueStart, valueEnd - valueStart, StandardCharsets.ISO_8859_1));
	}

	private static int indexOfColon(@NonNull byte[] line) {
		for (int i = 0; i < line.length; i++)
			if (line[i] == ':')
				return i;

		return -1;
	}

	@NonNull
	Integer getMaximumHeaderSize() {
		return this.maximumHeaderSize;
	}
}
