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

package com.phonepe.engram.core.branch;

import com.phonepe.engram.core.entity.EntityRef;
import com.phonepe.engram.core.errors.AlreadyExistsException;
import com.phonepe.engram.core.errors.InvalidInputException;
import com.phonepe.engram.core.errors.NotFoundException;
import com.phonepe.engram.core.utils.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BranchManagerTest {

    private static final PointerEntry POINTER = PointerEntry.of("a".repeat(64), "b".repeat(64));

    private InMemoryBranchStore branchStore;
    private BranchManager branches;

    @BeforeEach
    void setUp() {
        branchStore = new InMemoryBranchStore();
        branches = new BranchManager(branchStore, "main", "system", Clock.fixed(TestUtils.T0, ZoneOffset.UTC));
    }

    @Test
    void testDefaultBranchCreated() {
        final var active = branches.active();
        assertEquals("main", active.getName());
        assertEquals("system", active.getOwner());
        assertEquals(TestUtils.T0, active.getCreatedAt());
    }

    @Test
    void testNewBranchCopiesPointers() {
        final var ref = EntityRef.of("task", "t1");
        branches.pointers("main").compareAndSet(ref, null, POINTER);

        final var alice = branches.createBranch("alice", "alice");
        assertEquals("main", alice.getParent());
        assertEquals(POINTER, branches.pointers("alice").get(ref).orElseThrow());

        final var moved = PointerEntry.of("c".repeat(64), "d".repeat(64));
        assertTrue(branches.pointers("alice").compareAndSet(ref, POINTER, moved));
        assertEquals(POINTER, branches.pointers("main").get(ref).orElseThrow());
    }

    @Test
    void testCreateFromOtherBranch() {
        branches.createBranch("alice", "alice");
        branches.pointers("alice").compareAndSet(EntityRef.of("task", "t1"), null, POINTER);
        final var review = branches.createBranch("review", "carol", "alice");
        assertEquals("alice", review.getParent());
        assertEquals(1, branches.pointers("review").size());
        assertEquals(0, branches.pointers("main").size());
    }

    @Test
    void testDuplicateAndInvalidNames() {
        branches.createBranch("alice", "alice");
        assertThrows(AlreadyExistsException.class, () -> branches.createBranch("alice", "alice"));
        assertThrows(InvalidInputException.class, () -> branches.createBranch("has space", "alice"));
        assertThrows(InvalidInputException.class, () -> branches.createBranch("..", "alice"));
        assertThrows(InvalidInputException.class, () -> branches.createBranch("ok", ""));
        assertThrows(NotFoundException.class, () -> branches.createBranch("ok", "alice", "missing"));
    }

    @Test
    void testSwitchAndList() {
        branches.createBranch("bob", "bob");
        branches.createBranch("alice", "alice");
        assertEquals("bob", branches.switchTo("bob").getName());
        assertEquals("bob", branches.activeName());
        assertEquals("bob", branchStore.activeBranch().orElseThrow());
        assertEquals(List.of("alice", "bob", "main"),
                     branches.list().stream().map(BranchHandle::getName).toList());
        assertThrows(NotFoundException.class, () -> branches.switchTo("carol"));
    }

    @Test
    void testActiveBranchRestored() {
        branches.createBranch("alice", "alice");
        branches.switchTo("alice");
        final var reopened = new BranchManager(branchStore, "main", "system", Clock.systemUTC());
        assertEquals("alice", reopened.activeName());
    }

    @Test
    void testDelete() {
        branches.createBranch("alice", "alice");
        assertThrows(InvalidInputException.class, () -> branches.delete("main"));
        assertThrows(InvalidInputException.class, () -> branches.delete(null));
        assertThrows(InvalidInputException.class, () -> branches.delete("../alice"));
        assertTrue(branches.delete("alice"));
        assertFalse(branches.delete("alice"));
        assertTrue(branches.find("alice").isEmpty());
        assertThrows(NotFoundException.class, () -> branches.pointers("alice"));
    }

    @Test
    void testPointerSnapshotKeepsInsertionOrder() {
        final var table = branches.pointers("main");
        table.compareAndSet(EntityRef.of("task", "z"), null, POINTER);
        table.compareAndSet(EntityRef.of("task", "a"), null, POINTER);
        final var moved = PointerEntry.of("e".repeat(64), "f".repeat(64));
        table.compareAndSet(EntityRef.of("task", "z"), POINTER, moved);
        assertFalse(table.compareAndSet(EntityRef.of("task", "a"), moved, moved));
        assertEquals(List.of(EntityRef.of("task", "z"), EntityRef.of("task", "a")),
                     List.copyOf(table.snapshot().keySet()));
        assertEquals(3, table.generation());
    }
}
