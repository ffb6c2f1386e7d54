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

package com.phonepe.engram.filesystem.branch;

import com.phonepe.engram.core.branch.BranchHandle;
import com.phonepe.engram.core.branch.PointerEntry;
import com.phonepe.engram.core.entity.EntityRef;
import com.phonepe.engram.core.errors.AlreadyExistsException;
import com.phonepe.engram.core.errors.InvalidInputException;
import com.phonepe.engram.core.errors.NotFoundException;
import com.phonepe.engram.core.errors.StorageException;
import com.phonepe.engram.core.store.ContentDigests;
import lombok.SneakyThrows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSystemBranchStoreTest {
    private static final EntityRef FIRST = EntityRef.of("task", "t1");
    private static final EntityRef SECOND = EntityRef.of("task", "t2");

    @TempDir
    Path tempDir;

    private FileSystemBranchStore store;

    @BeforeEach
    void setUp() {
        store = FileSystemBranchStore.builder()
                .baseDir(tempDir)
                .build();
    }

    @Test
    void testPointersSurviveReopen() {
        final var initial = entry("v1");
        final var table = store.create(handle("main"), Map.of(FIRST, initial));
        assertTrue(table.compareAndSet(SECOND, null, entry("v2")));
        assertTrue(table.compareAndSet(FIRST, initial, entry("v3")));
        assertFalse(table.compareAndSet(FIRST, initial, entry("v4")));

        final var reopened = new FileSystemBranchStore(tempDir, null).pointers("main");
        assertEquals(2, reopened.size());
        assertEquals(entry("v3"), reopened.get(FIRST).orElseThrow());
        assertEquals(entry("v2"), reopened.get(SECOND).orElseThrow());
        assertEquals(List.of(FIRST, SECOND), List.copyOf(reopened.snapshot().keySet()));
    }

    @Test
    void testMetadata() {
        store.create(handle("main"), Map.of());
        store.create(handle("bob"), Map.of());
        store.create(handle("alice"), Map.of());
        assertEquals("main", store.read("main").orElseThrow().getName());
        assertEquals("agent", store.read("bob").orElseThrow().getOwner());
        assertTrue(store.read("carol").isEmpty());
        assertEquals(List.of("alice", "bob", "main"),
                     store.list().stream().map(BranchHandle::getName).toList());
        assertThrows(AlreadyExistsException.class, () -> store.create(handle("bob"), Map.of()));
    }

    @Test
    void testActiveBranch() {
        assertTrue(store.activeBranch().isEmpty());
        store.saveActiveBranch("alice");
        assertEquals("alice", new FileSystemBranchStore(tempDir, null).activeBranch().orElseThrow());
    }

    @Test
    void testDelete() {
        store.create(handle("alice"), Map.of(FIRST, entry("v1")));
        assertTrue(store.delete("alice"));
        assertTrue(store.read("alice").isEmpty());
        assertThrows(NotFoundException.class, () -> store.pointers("alice"));
        assertFalse(store.delete("alice"));
    }

    @Test
    @SneakyThrows
    void testCorruptJournalFailsLoudly() {
        final var table = (FileSystemPointerTable) store.create(handle("main"), Map.of(FIRST, entry("v1")));
        Files.write(table.getJournal(),
                    "{not json\n".getBytes(StandardCharsets.UTF_8),
                    StandardOpenOption.APPEND);
        final var reopened = new FileSystemBranchStore(tempDir, null);
        final var error = assertThrows(StorageException.class, () -> reopened.pointers("main"));
        assertTrue(error.getMessage().contains("line 2"));
    }

    @Test
    void testBranchNamesCannotEscapeTheStore() {
        assertThrows(InvalidInputException.class, () -> store.read("../outside"));
        assertThrows(InvalidInputException.class, () -> store.create(handle(".."), Map.of()));
        assertThrows(InvalidInputException.class, () -> store.delete("a/b"));
    }

    private static BranchHandle handle(String name) {
        return BranchHandle.builder()
                .name(name)
                .owner("agent")
                .createdAt(Instant.parse("2025-01-15T09:00:00Z"))
                .build();
    }

    private static PointerEntry entry(String version) {
        return PointerEntry.of(ContentDigests.digest(version.getBytes(StandardCharsets.UTF_8)),
                               ContentDigests.digest(("rev-" + version).getBytes(StandardCharsets.UTF_8)));
    }
}
