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

package com.phonepe.engram.filesystem;

import com.phonepe.engram.core.branch.BranchHandle;
import com.phonepe.engram.core.config.EngramSetup;
import com.phonepe.engram.core.entity.EntityRef;
import com.phonepe.engram.core.entity.EntityTypes;
import com.phonepe.engram.core.entity.types.Task;
import com.phonepe.engram.core.graph.CreateRelationshipRequest;
import com.phonepe.engram.core.graph.PathAlgorithm;
import com.phonepe.engram.core.graph.model.RelationshipTypes;
import com.phonepe.engram.core.sync.SyncStatus;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSystemEngramTest {
    private static final EntityRef DOCS = EntityRef.of(EntityTypes.TASK, "docs");
    private static final EntityRef REVIEW = EntityRef.of(EntityTypes.TASK, "review");

    @TempDir
    Path tempDir;

    @Test
    void testStateSurvivesReopen() {
        final var engram = FileSystemEngram.open(tempDir);
        engram.store(task("docs", "Write docs"));
        engram.createBranch("alice", "alice");
        engram.createBranch("bob", "bob");

        engram.switchBranch("alice");
        engram.store(task("docs", "Write better docs"));
        engram.switchBranch("bob");
        engram.store(task("review", "Review docs"));
        engram.createRelationship(CreateRelationshipRequest.builder()
                                          .agent("bob")
                                          .source(REVIEW)
                                          .target(DOCS)
                                          .relationshipType(RelationshipTypes.DEPENDS_ON)
                                          .build());

        final var result = engram.sync(List.of("alice", "bob"), "latest_wins");
        assertEquals(SyncStatus.SYNCHRONIZED, result.getStatus());

        final var reopened = FileSystemEngram.open(tempDir);
        assertEquals("bob", reopened.getBranches().activeName());
        final var docs = (Task) reopened.get(EntityTypes.TASK, "docs");
        assertEquals("Write better docs", docs.getTitle());
        assertEquals(2, reopened.getEntities().history(EntityTypes.TASK, "docs").size());
        assertTrue(reopened.getEntities().exists("alice", REVIEW));
        assertTrue(reopened.findPath(REVIEW, DOCS, PathAlgorithm.BFS).isPresent());
        assertEquals(List.of("alice", "bob", "main"),
                     reopened.getBranches().list().stream().map(BranchHandle::getName).toList());
    }

    @Test
    @SneakyThrows
    void testSetupFileIsLoaded() {
        Files.writeString(tempDir.resolve(FileSystemEngram.SETUP_FILE),
                          "{\"defaultBranch\": \"trunk\", \"defaultAgent\": \"planner\"}");
        final var engram = FileSystemEngram.open(tempDir);
        assertEquals("trunk", engram.getBranches().activeName());
        engram.store(task("docs", "Write docs"));
        assertEquals("planner", engram.get(EntityTypes.TASK, "docs").getAgent());
        assertTrue(Files.isDirectory(tempDir.resolve("branches").resolve("trunk")));
    }

    @Test
    void testExplicitSetupWins() {
        final var engram = FileSystemEngram.open(tempDir, EngramSetup.defaults().withDefaultBranch("dev"));
        assertEquals("dev", engram.getBranches().activeName());
    }

    private static Task task(String id, String title) {
        return Task.builder()
                .id(id)
                .title(title)
                .build();
    }
}
