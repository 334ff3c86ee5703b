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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class HeadersTests {
	@Test
	public void caseInsensitiveLookupPreservesInsertionOrder() {
		Headers headers = new Headers()
				.add("Accept", "text/html")
				.add("X-Trace", "a")
				.add("x-trace", "b");

		Assertions.assertEquals(Optional.of("a"), headers.getFirst("X-TRACE"));
		Assertions.assertEquals(List.of("a", "b"), headers.getAll("x-Trace"));
		Assertions.assertEquals(Set.of("Accept", "X-Trace"), headers.getNames());
		Assertions.assertEquals(3, headers.size());
		Assertions.assertEquals(Optional.empty(), headers.getFirst("Missing"));
	}

	@Test
	public void setReplacesInPlace() {
		Headers headers = new Headers()
				.add("A", "1")
				.add("Date", "old")
				.add("B", "2")
				.add("date", "older");

		headers.set("DATE", "new");

		Assertions.assertEquals(List.of("A", "Date", "B"), headers.getHeaders().stream().map(Header::name).toList());
		Assertions.assertEquals(List.of("new"), headers.getAll("Date"));
	}

	@Test
	public void readOnlyCopyRejectsMutation() {
		Headers headers = new Headers().add("A", "1");
		Headers readOnly = headers.readOnlyCopy();

		Assertions.assertTrue(readOnly.isReadOnly());
		Assertions.assertThrows(IllegalStateException.class, () -> readOnly.add("B", "2"));
		Assertions.assertThrows(IllegalStateException.class, () -> readOnly.remove("A"));

		Headers mutable = readOnly.mutableCopy();
		mutable.add("B", "2");

		Assertions.assertEquals(1, readOnly.size());
		Assertions.assertEquals(2, mutable.size());
	}

	@Test
	public void illegalHeaderCharactersRejected() {
		Headers headers = new Headers();

		Assertions.assertThrows(IllegalArgumentException.class, () -> headers.add("Bad Name", "x"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> headers.add("X-Injected", "a\r\nSet-Cookie: b=c"));
	}
}
