/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
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

package com.phonepe.engram.filesystem.utils;

import com.phonepe.engram.core.errors.StorageException;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void testEnsurePathCreate() {
        final Path path = tempDir.resolve("new-dir").resolve("nested");
        final Path ensured = FileUtils.ensurePath(path, true, true);
        assertNotNull(ensured);
        assertTrue(Files.exists(ensured));
        assertTrue(Files.isDirectory(ensured));
        assertTrue(ensured.isAbsolute());
    }

    @Test
    void testEnsurePathExisting() {
        final Path path = tempDir.resolve("existing-dir");
        FileUtils.ensurePath(path, true, true);
        final Path ensured = FileUtils.ensurePath(path, false, true);
        assertEquals(path.toAbsolutePath().normalize(), ensured);
    }

    @Test
    @SneakyThrows
    void testEnsurePathIsFile() {
        final Path path = tempDir.resolve("a-file");
        Files.writeString(path, "content");
        assertThrows(IllegalArgumentException.class, () -> FileUtils.ensurePath(path, true, true));
    }

    @Test
    void testEnsurePathNotExistsNoCreate() {
        final Path path = tempDir.resolve("not-exists");
        assertThrows(IllegalArgumentException.class, () -> FileUtils.ensurePath(path, false, true));
    }

    @Test
    @SneakyThrows
    void testWriteAtomically() {
        final Path path = tempDir.resolve("test-file");
        FileUtils.writeAtomically(path, "hello".getBytes(StandardCharsets.UTF_8));
        FileUtils.writeAtomically(path, "world".getBytes(StandardCharsets.UTF_8));
        assertEquals("world", Files.readString(path));
        try (final var files = Files.list(tempDir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void testWriteIntoMissingDirectory() {
        final Path path = tempDir.resolve("missing").resolve("file");
        assertThrows(StorageException.class, () -> FileUtils.writeAtomically(path, new byte[]{1}));
    }

    @Test
    @SneakyThrows
    void testAppend() {
        final Path path = tempDir.resolve("journal.jsonl");
        FileUtils.append(path, "a\n".getBytes(StandardCharsets.UTF_8));
        FileUtils.append(path, "b\n".getBytes(StandardCharsets.UTF_8));
        assertEquals("a\nb\n", Files.readString(path));
        assertArrayEquals("a\nb\n".getBytes(StandardCharsets.UTF_8), FileUtils.read(path));
    }

    @Test
    void testReadMissing() {
        assertThrows(StorageException.class, () -> FileUtils.read(tempDir.resolve("nothing")));
    }

    @Test
    @SneakyThrows
    void testDeleteRecursively() {
        final Path root = FileUtils.ensurePath(tempDir.resolve("tree/a/b"), true, true);
        Files.writeString(root.resolve("leaf"), "x");
        Files.writeString(tempDir.resolve("tree/top"), "y");
        assertTrue(FileUtils.deleteRecursively(tempDir.resolve("tree")));
        assertFalse(Files.exists(tempDir.resolve("tree")));
        assertFalse(FileUtils.deleteRecursively(tempDir.resolve("tree")));
    }
}
