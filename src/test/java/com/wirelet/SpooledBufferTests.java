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
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class SpooledBufferTests {
	@Test
	public void staysInMemoryBelowThreshold() throws IOException {
		try (SpooledBuffer buffer = new SpooledBuffer(16)) {
			byte[] bytes = "hello".getBytes(StandardCharsets.UTF_8);
			buffer.write(bytes, 0, bytes.length);

			Assertions.assertFalse(buffer.isSpilled());
			Assertions.assertEquals(5L, buffer.getSize());
			Assertions.assertEquals("hello", buffer.toString(StandardCharsets.UTF_8));
		}
	}

	@Test
	public void spillsToDiskAndDeletesOnClose() throws IOException {
		byte[] bytes = new byte[100];

		for (int i = 0; i < bytes.length; i++)
			bytes[i] = (byte) i;

		Path file;

		try (SpooledBuffer buffer = new SpooledBuffer(32)) {
			buffer.write(new ByteArrayInputStream(bytes));

			Assertions.assertTrue(buffer.isSpilled());
			Assertions.assertEquals(100L, buffer.getSize());

			file = buffer.getFile().orElseThrow();
			Assertions.assertTrue(Files.exists(file));

			// Re-readable from the start
			Assertions.assertArrayEquals(bytes, buffer.toByteArray());

			try (InputStream inputStream = buffer.openInputStream()) {
				Assertions.assertArrayEquals(bytes, TestSupport.readAll(inputStream));
			}
		}

		Assertions.assertFalse(Files.exists(file), "Spool file should be deleted on close");
	}

	@Test
	public void closedBufferRejectsReads() throws IOException {
		SpooledBuffer buffer = SpooledBuffer.fromBytes(new byte[]{1, 2, 3});
		buffer.close();

		Assertions.assertThrows(IOException.class, buffer::openInputStream);
	}

	@Test
	public void failedSpillLeavesBufferInMemoryAndClosable(@TempDir Path directory) throws IOException {
		Path missingDirectory = directory.resolve("missing");
		SpooledBuffer buffer = new SpooledBuffer(4, missingDirectory);
		byte[] small = "abc".getBytes(StandardCharsets.UTF_8);
		byte[] large = "defghij".getBytes(StandardCharsets.UTF_8);

		buffer.write(small, 0, small.length);

		Assertions.assertThrows(IOException.class, () -> buffer.write(large, 0, large.length));
		Assertions.assertFalse(buffer.isSpilled());
		Assertions.assertEquals(3L, buffer.getSize());
		Assertions.assertEquals("abc", buffer.toString(StandardCharsets.UTF_8));

		Assertions.assertDoesNotThrow(buffer::close);
		Assertions.assertFalse(Files.exists(missingDirectory));
	}

	@Test
	public void spillsIntoConfiguredDirectory(@TempDir Path directory) throws IOException {
		byte[] bytes = "more than four".getBytes(StandardCharsets.UTF_8);

		try (SpooledBuffer buffer = new SpooledBuffer(4, directory)) {
			buffer.write(bytes, 0, bytes.length);

			Assertions.assertTrue(buffer.isSpilled());

			try (Stream<Path> files = Files.list(directory)) {
				Assertions.assertEquals(1L, files.count());
			}
		}

		try (Stream<Path> files = Files.list(directory)) {
			Assertions.assertEquals(0L, files.count(), "Spill file should be deleted on close");
		}
	}
}
