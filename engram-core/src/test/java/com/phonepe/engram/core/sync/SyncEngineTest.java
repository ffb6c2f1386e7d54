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

package com.phonepe.engram.core.sync;

import com.fasterxml.jackson.databind.node.TextNode;
import com.phonepe.engram.core.Engram;
import com.phonepe.engram.core.branch.InMemoryBranchStore;
import com.phonepe.engram.core.entity.EntityRef;
import com.phonepe.engram.core.entity.EntityStore;
import com.phonepe.engram.core.entity.types.Task;
import com.phonepe.engram.core.entity.types.TaskPriority;
import com.phonepe.engram.core.errors.InvalidInputException;
import com.phonepe.engram.core.errors.NotFoundException;
import com.phonepe.engram.core.errors.UnknownStrategyException;
import com.phonepe.engram.core.graph.CreateRelationshipRequest;
import com.phonepe.engram.core.graph.model.RelationshipConstraints;
import com.phonepe.engram.core.graph.model.RelationshipTypes;
import com.phonepe.engram.core.store.InMemoryContentStore;
import com.phonepe.engram.core.sync.strategies.LatestWinsStrategy;
import com.phonepe.engram.core.utils.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class SyncEngineTest {

    private static final EntityRef T1 = TestUtils.taskRef("t1");
    private static final List<String> ALICE_AND_BOB = List.of("alice", "bob");

    private InMemoryContentStore contentStore;
    private Engram engram;
    private EntityStore entities;

    @BeforeEach
    void setUp() {
        contentStore = spy(new InMemoryContentStore());
        engram = Engram.builder()
                .contentStore(contentStore)
                .branchStore(new InMemoryBranchStore())
                .build();
        entities = engram.getEntities();
        entities.store(TestUtils.task("t1", "Write docs", "system", TestUtils.T0));
        engram.createBranch("alice", "alice");
        engram.createBranch("bob", "bob");
    }

    @Test
    void testLatestWins() {
        edit("alice", base().description("alice version"), "10:00:00");
        edit("bob", base().description("bob version"), "10:05:00");

        final var result = engram.sync(ALICE_AND_BOB, "latest_wins");

        assertEquals(SyncStatus.SYNCHRONIZED, result.getStatus());
        assertTrue(result.getConflicts().isEmpty());
        assertEquals(1, result.getEntitiesMerged());
        assertEquals("bob version", ((Task) result.getMergedState().get(T1)).getDescription());
        final var resolution = result.getResolutions().get(0);
        assertEquals("bob", resolution.getWinner());
        assertEquals(LatestWinsStrategy.NAME, resolution.getStrategy());
        assertEquals("bob version", read("alice").getDescription());
        assertEquals(entities.pointer("alice", T1), entities.pointer("bob", T1));
        assertEquals(resolution.getContentHash(), entities.pointer("bob", T1).orElseThrow().getContentHash());
        assertEquals("Write docs", read("main").getTitle());
        assertNull(read("main").getDescription());
    }

    @Test
    void testLatestWinsTieGoesToSmallestBranchName() {
        edit("alice", base().description("alice version"), "10:00:00");
        edit("bob", base().description("bob version"), "10:00:00");
        final var result = engram.sync(ALICE_AND_BOB, "latest_wins");
        assertEquals("alice version", read("bob").getDescription());
        assertEquals("alice", result.getResolutions().get(0).getWinner());
    }

    @Test
    void testSecondSyncChangesNothing() {
        edit("alice", base().description("alice version"), "10:00:00");
        edit("bob", base().description("bob version"), "10:05:00");
        engram.sync(ALICE_AND_BOB, "latest_wins");
        final var pointer = entities.pointer("alice", T1);

        final var again = engram.sync(ALICE_AND_BOB, "latest_wins");

        assertEquals(SyncStatus.SYNCHRONIZED, again.getStatus());
        assertEquals(0, again.getEntitiesExamined());
        assertEquals(0, again.getPointersUpdated());
        assertTrue(again.getMergedState().isEmpty());
        assertEquals(pointer, entities.pointer("alice", T1));
    }

    @Test
    void testIntelligentMergeCombinesDisjointChanges() {
        edit("alice", base().description("Details from alice"), "10:00:00");
        edit("bob", base().priority(TaskPriority.HIGH), "10:05:00");

        final var result = engram.sync(ALICE_AND_BOB, "intelligent_merge");

        assertEquals(SyncStatus.SYNCHRONIZED, result.getStatus());
        assertEquals(0, result.getConflicts().size());
        for (final var branch : ALICE_AND_BOB) {
            final var merged = read(branch);
            assertEquals("Details from alice", merged.getDescription());
            assertEquals(TaskPriority.HIGH, merged.getPriority());
            assertEquals(TestUtils.at("10:05:00"), merged.getUpdatedAt());
            assertEquals("bob", merged.getAgent());
            assertEquals(TestUtils.T0, merged.getCreatedAt());
        }
        final var revision = entities.revisions("alice", T1).get(entities.revisions("alice", T1).size() - 1);
        assertEquals(2, revision.getParents().size());
    }

    @Test
    void testIntelligentMergeKeepsAncestorOnConflict() {
        edit("alice", base().title("Write the docs"), "10:00:00");
        edit("bob", base().title("Write better docs"), "10:05:00");

        final var result = engram.sync(ALICE_AND_BOB, "intelligent_merge");

        assertEquals(SyncStatus.SYNCHRONIZED_WITH_CONFLICTS, result.getStatus());
        assertEquals(1, result.getConflicts().size());
        final var conflict = result.getConflicts().get(0);
        assertEquals(ConflictKind.FIELD, conflict.getKind());
        assertEquals("title", conflict.getField());
        assertEquals("t1", conflict.getEntityId());
        assertEquals(TextNode.valueOf("Write docs"), conflict.getAncestor());
        assertEquals(Map.of("alice", TextNode.valueOf("Write the docs"),
                            "bob", TextNode.valueOf("Write better docs")),
                     conflict.getCandidates());
        assertEquals("Write docs", read("alice").getTitle());
        assertEquals("Write docs", read("bob").getTitle());
    }

    @Test
    void testIntelligentMergeWithoutAncestorKeepsLatest() {
        entities.store("alice", TestUtils.task("t2", "Alice's idea", "alice", TestUtils.at("10:00:00")));
        entities.store("bob", TestUtils.task("t2", "Bob's idea", "bob", TestUtils.at("10:05:00")));

        final var result = engram.sync(ALICE_AND_BOB, "intelligent_merge");

        assertEquals(1, result.getConflicts().size());
        assertNull(result.getConflicts().get(0).getAncestor());
        assertEquals("Bob's idea", ((Task) entities.get("alice", TestUtils.taskRef("t2"))).getTitle());
    }

    @Test
    void testConflictResolutionStrategyEscalates() {
        edit("alice", base().title("Write the docs"), "10:00:00");
        edit("bob", base().title("Write better docs"), "10:05:00");

        final var result = engram.sync(ALICE_AND_BOB, "merge_with_conflict_resolution");

        assertEquals(SyncStatus.SYNCHRONIZED_WITH_CONFLICTS, result.getStatus());
        final var conflict = result.getConflicts().get(0);
        assertEquals(ConflictKind.ENTITY, conflict.getKind());
        assertNull(conflict.getField());
        assertFalse(result.getMergedState().containsKey(T1));
        assertEquals("Write the docs", read("alice").getTitle());
        assertEquals("Write better docs", read("bob").getTitle());
    }

    @Test
    void testConflictResolutionStrategyMergesDisjointChanges() {
        edit("alice", base().description("Details"), "10:00:00");
        edit("bob", base().priority(TaskPriority.LOW), "10:05:00");
        final var result = engram.sync(ALICE_AND_BOB, "merge_with_conflict_resolution");
        assertEquals(SyncStatus.SYNCHRONIZED, result.getStatus());
        assertEquals(TaskPriority.LOW, read("alice").getPriority());
        assertEquals("Details", read("bob").getDescription());
    }

    @Test
    void testPriorityWins() {
        edit("alice", base().title("Alice's title"), "10:00:00");
        edit("bob", base().title("Bob's title"), "10:05:00");

        final var result = engram.sync(ALICE_AND_BOB, "priority_wins:alice");

        assertEquals("priority_wins:alice", result.getStrategy());
        assertTrue(result.getConflicts().isEmpty());
        assertEquals("Alice's title", read("bob").getTitle());
        assertEquals("alice", result.getResolutions().get(0).getWinner());
    }

    @Test
    void testFastForward() {
        edit("alice", base().description("only alice"), "10:00:00");
        entities.store("alice", TestUtils.task("t2", "New on alice", "alice", TestUtils.at("10:01:00")));

        final var result = engram.sync(ALICE_AND_BOB, "merge_with_conflict_resolution");

        assertEquals(SyncStatus.SYNCHRONIZED, result.getStatus());
        assertEquals(2, result.getFastForwards());
        assertEquals(0, result.getEntitiesMerged());
        assertEquals(2, result.getPointersUpdated());
        assertEquals(entities.pointer("alice", T1), entities.pointer("bob", T1));
        assertTrue(entities.exists("bob", TestUtils.taskRef("t2")));
        assertEquals(2, entities.history("bob", T1).size());
    }

    @Test
    void testThreeBranches() {
        edit("alice", base().description("alice version"), "10:00:00");
        edit("bob", base().description("bob version"), "10:05:00");
        final var result = engram.sync(List.of("main", "alice", "bob"), "latest_wins");
        assertEquals(List.of("alice", "bob", "main"), result.getBranches());
        assertEquals(3, result.getPointersUpdated());
        assertEquals("bob version", read("main").getDescription());
    }

    @Test
    void testRelationshipViolatingConstraintsAfterMerge() {
        final var a = TestUtils.taskRef("a");
        final var b = TestUtils.taskRef("b");
        entities.store("alice", TestUtils.task("a", "A"));
        entities.store("alice", TestUtils.task("b", "B"));
        engram.sync(ALICE_AND_BOB, "latest_wins");

        final var noCycles = RelationshipConstraints.builder().allowCycles(false).build();
        final var graph = engram.getGraph();
        graph.createRelationship("alice", CreateRelationshipRequest.builder()
                .id("r1").source(a).target(b).relationshipType(RelationshipTypes.DEPENDS_ON).constraints(noCycles)
                .build());
        graph.createRelationship("bob", CreateRelationshipRequest.builder()
                .id("r2").source(b).target(a).relationshipType(RelationshipTypes.DEPENDS_ON).constraints(noCycles)
                .build());

        final var result = engram.sync(ALICE_AND_BOB, "latest_wins");

        assertEquals(SyncStatus.SYNCHRONIZED_WITH_CONFLICTS, result.getStatus());
        assertEquals(List.of("r1", "r2"), result.getConflicts().stream().map(SyncConflict::getEntityId).toList());
        assertTrue(result.getConflicts().stream().allMatch(c -> c.getKind() == ConflictKind.CONSTRAINT));
        assertFalse(entities.exists("bob", EntityRef.of("relationship", "r1")));
        assertFalse(entities.exists("alice", EntityRef.of("relationship", "r2")));
    }

    @Test
    void testDryRunWritesNothing() {
        edit("alice", base().description("Details"), "10:00:00");
        edit("bob", base().priority(TaskPriority.HIGH), "10:05:00");
        final var alicePointer = entities.pointer("alice", T1);
        clearInvocations(contentStore);

        final var result = engram.getSyncEngine().sync(ALICE_AND_BOB, "intelligent_merge", true);

        assertTrue(result.isDryRun());
        assertEquals(0, result.getPointersUpdated());
        final var merged = (Task) result.getMergedState().get(T1);
        assertEquals("Details", merged.getDescription());
        assertEquals(TaskPriority.HIGH, merged.getPriority());
        assertEquals(alicePointer, entities.pointer("alice", T1));
        verify(contentStore, never()).put(any());
    }

    @Test
    void testSingleBranchHasNothingToSynchronize() {
        final var result = engram.sync(List.of("alice"), "latest_wins");
        assertEquals(SyncStatus.NOTHING_TO_SYNCHRONIZE, result.getStatus());
        assertTrue(result.getMergedState().isEmpty());
    }

    @Test
    void testInvalidRequests() {
        assertThrows(InvalidInputException.class, () -> engram.sync(List.of(), "latest_wins"));
        final var unknown = assertThrows(UnknownStrategyException.class,
                                         () -> engram.sync(ALICE_AND_BOB, "coin_flip"));
        assertTrue(unknown.getMessage().contains("latest_wins"));
        assertThrows(NotFoundException.class, () -> engram.sync(List.of("alice", "carol"), "latest_wins"));
    }

    private static Task.TaskBuilder base() {
        return Task.builder()
                .id("t1")
                .title("Write docs")
                .createdAt(TestUtils.T0);
    }

    private void edit(String branch, Task.TaskBuilder builder, String time) {
        final Instant updatedAt = TestUtils.at(time);
        entities.store(branch, builder.agent(branch).updatedAt(updatedAt).build());
    }

    private Task read(String branch) {
        return entities.get(branch, T1, Task.class);
    }
}
