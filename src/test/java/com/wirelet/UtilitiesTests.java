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

import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class UtilitiesTests {
	@Test
	public void queryParametersPreserveRepeatedNames() {
		assertEquals(Map.of("a", List.of("1", "2"), "b", List.of("3")), Utilities.extractQueryParametersFromQuery("?a=1&a=2&b=3"));
		assertEquals(List.of("a", "b"), List.copyOf(Utilities.extractQueryParametersFromQuery("a=1&b=3&a=2").keySet()));
	}

	@Test
	public void queryParametersAbsentOrBlank() {
		assertTrue(Utilities.extractQueryParametersFromQuery(null).isEmpty());
		assertTrue(Utilities.extractQueryParametersFromQuery("").isEmpty());
		assertTrue(Utilities.extractQueryParametersFromQuery("?").isEmpty());
		// Blank values, missing '=' and blank names are all dropped
		assertEquals(Map.of("c", List.of("3")), Utilities.extractQueryParametersFromQuery("a=&b&=2&c=3"));
	}

	@Test
	public void queryParametersDecoding() {
		assertEquals(Map.of("q", List.of("hello world & more")), Utilities.extractQueryParametersFromQuery("q=hello+world%20%26%20more"));
		assertEquals(Map.of("name", List.of("José")), Utilities.extractQueryParametersFromQuery("name=Jos%C3%A9"));
		// Malformed escapes pass through
		assertEquals(Map.of("p", List.of("100%")), Utilities.extractQueryParametersFromQuery("p=100%"));
		assertEquals(Map.of("p", List.of("%zz")), Utilities.extractQueryParametersFromQuery("p=%zz"));
	}

	@Test
	public void rawQueryFromRequestTarget() {
		assertEquals(Optional.of("a=1"), Utilities.extractRawQueryFromRequestTarget("/x?a=1"));
		assertEquals(Optional.of(""), Utilities.extractRawQueryFromRequestTarget("/x?"));
		assertEquals(Optional.empty(), Utilities.extractRawQueryFromRequestTarget("/x"));
	}

	@Test
	public void cookies() {
		Headers headers = new Headers()
				.add("Cookie", "session=abc; theme=\"dark; blue\"")
				.add("Cookie", "session=def; junk; lang=en");

		Map<String, String> cookies = Utilities.extractCookiesFromHeaders(headers);

		assertEquals("def", cookies.get("session"));
		assertEquals("dark; blue", cookies.get("theme"));
		assertEquals("en", cookies.get("lang"));
		assertEquals(3, cookies.size());
		assertTrue(Utilities.extractCookiesFromHeaders(new Headers()).isEmpty());
	}

	@Test
	public void contentTypeAndParameters() {
		assertEquals(Optional.of("multipart/form-data"), Utilities.extractContentTypeFromHeaderValue("Multipart/Form-Data; boundary=xyz"));
		assertEquals(Optional.empty(), Utilities.extractContentTypeFromHeaderValue("  "));
		assertEquals(Optional.of("a;b"), Utilities.extractHeaderParameter("multipart/form-data; BOUNDARY=\"a;b\"", "boundary"));
		assertEquals(Optional.empty(), Utilities.extractHeaderParameter("text/plain", "charset"));
	}

	@Test
	public void httpDate() {
		assertEquals("Sun, 06 Nov 1994 08:49:37 GMT", Utilities.formatHttpDate(Instant.parse("1994-11-06T08:49:37Z")));
	}

	@Test
	public void filenameEncoding() {
		assertEquals("report-2024_v1.pdf", Utilities.percentEncodeFilename("report-2024_v1.pdf"));
		assertEquals("my%20file%22.txt", Utilities.percentEncodeFilename("my file\".txt"));
		assertEquals("caf%C3%A9.txt", Utilities.percentEncodeFilename("café.txt"));
	}

	@Test
	public void percentDecode() {
		assertEquals("a b/c", Utilities.percentDecode("a%20b%2Fc", StandardCharsets.UTF_8));
		assertEquals("plain", Utilities.percentDecode("plain", StandardCharsets.UTF_8));
	}
}
