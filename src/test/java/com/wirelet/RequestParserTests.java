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

import com.wirelet.RequestParser.RequestHead;
import com.wirelet.exception.HttpException;
import com.wirelet.exception.MalformedRequestException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class RequestParserTests {
	@Test
	public void parsesStartLineAndHeaders() throws IOException {
		RequestHead requestHead = parse("GET /search?q=a HTTP/1.1\r\nHost: localhost\r\nAccept: */*\r\nX-Multi: 1\r\nx-multi: 2\r\n\r\nbody");

		Assertions.assertEquals("GET", requestHead.method());
		Assertions.assertEquals("/search?q=a", requestHead.path());
		Assertions.assertEquals("HTTP/1.1", requestHead.protocol());
		Assertions.assertEquals(Optional.of("localhost"), requestHead.headers().getFirst("host"));
		Assertions.assertEquals(List.of("1", "2"), requestHead.headers().getAll("X-Multi"));
		Assertions.assertTrue(requestHead.headers().isReadOnly());
	}

	@Test
	public void acceptsBareLineFeeds() throws IOException {
		RequestHead requestHead = parse("POST /x HTTP/1.0\nContent-Length: 0\n\n");

		Assertions.assertEquals("POST", requestHead.method());
		Assertions.assertEquals(Optional.of("0"), requestHead.headers().getFirst("Content-Length"));
	}

	@Test
	public void startLineMustHaveExactlyThreeTokens() {
		Assertions.assertThrows(MalformedRequestException.class, () -> parse("GET /\r\n\r\n"));
		Assertions.assertThrows(MalformedRequestException.class, () -> parse("GET / HTTP/1.1 extra\r\n\r\n"));
		Assertions.assertThrows(MalformedRequestException.class, () -> parse("GET  / HTTP/1.1\r\n\r\n"));
		Assertions.assertThrows(MalformedRequestException.class, () -> parse(""));
	}

	@Test
	public void malformedHeaderLines() {
		Assertions.assertThrows(MalformedRequestException.class, () -> parse("GET / HTTP/1.1\r\nNoColonHere\r\n\r\n"));
		Assertions.assertThrows(MalformedRequestException.class, () -> parse("GET / HTTP/1.1\r\n: empty-name\r\n\r\n"));
		Assertions.assertThrows(MalformedRequestException.class, () -> parse("GET / HTTP/1.1\r\nBad Name: x\r\n\r\n"));
		Assertions.assertThrows(MalformedRequestException.class, () -> parse("GET / HTTP/1.1\r\n folded-first\r\n\r\n"));
	}

	@Test
	public void foldedHeadersJoinPreviousValue() throws IOException {
		RequestHead requestHead = parse("GET / HTTP/1.1\r\nX-Long: first\r\n\tsecond\r\n\r\n");
		Assertions.assertEquals(Optional.of("first second"), requestHead.headers().getFirst("X-Long"));
	}

	@Test
	public void oversizedHeaderBlock() {
		String hugeHeader = "X-Big: " + "a".repeat(200) + "\r\n";

		HttpException startLineException = Assertions.assertThrows(HttpException.class,
				() -> parse("GET /" + "a".repeat(200) + " HTTP/1.1\r\n\r\n", 128));
		Assertions.assertEquals(StatusCode.HTTP_414, startLineException.getStatusCode());

		HttpException headerException = Assertions.assertThrows(HttpException.class,
				() -> parse("GET / HTTP/1.1\r\n" + hugeHeader + "\r\n", 128));
		Assertions.assertEquals(StatusCode.HTTP_431, headerException.getStatusCode());
	}

	@Test
	public void bodyIsLeftForTheReader() throws IOException {
		ConnectionReader connectionReader = reader("PUT /x HTTP/1.1\r\nContent-Length: 5\r\n\r\nhello trailing");
		new RequestParser(1_024).parse(connectionReader);

		try (SpooledBuffer body = new SpooledBuffer()) {
			Assertions.assertEquals(5L, connectionReader.readBody(5L, body));
			Assertions.assertEquals("hello", body.toString(StandardCharsets.UTF_8));
		}
	}

	@Test
	public void earlyEndOfBodyKeepsReceivedBytes() throws IOException {
		ConnectionReader connectionReader = reader("abc");

		try (SpooledBuffer body = new SpooledBuffer()) {
			Assertions.assertEquals(3L, connectionReader.readBody(10L, body));
			Assertions.assertEquals("abc", body.toString(StandardCharsets.UTF_8));
		}
	}

	private RequestHead parse(String request) throws IOException {
		return parse(request, 8_192);
	}

	private RequestHead parse(String request, int maximumHeaderSize) throws IOException {
		return new RequestParser(maximumHeaderSize).parse(reader(request));
	}

	private ConnectionReader reader(String request) {
		// A tiny chunk size exercises lines that straddle buffer refills
		return new ConnectionReader(new ByteArrayInputStream(request.getBytes(StandardCharsets.ISO_8859_1)), 7);
	}
}
