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

package com.phonepe.engram.core.sync.strategies;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.phonepe.engram.core.sync.MergeCandidate;
import com.phonepe.engram.core.utils.JsonUtils;
import lombok.SneakyThrows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldMergerTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = JsonUtils.createMapper();
    }

    @Test
    void testDisjointChanges() {
        final var ancestor = state("{\"title\":\"Docs\",\"size\":1,\"agent\":\"system\","
                                           + "\"createdAt\":\"2025-01-15T09:00:00Z\","
                                           + "\"updatedAt\":\"2025-01-15T09:00:00Z\"}");
        final var alice = candidate("alice", "{\"title\":\"Docs\",\"size\":2,\"agent\":\"alice\","
                + "\"createdAt\":\"2025-01-15T09:00:00Z\",\"updatedAt\":\"2025-01-15T10:00:00Z\"}");
        final var bob = candidate("bob", "{\"title\":\"Docs\",\"size\":1,\"note\":\"new\",\"agent\":\"bob\","
                + "\"createdAt\":\"2025-01-15T09:00:00Z\",\"updatedAt\":\"2025-01-15T09:30:00Z\"}");

        final var result = FieldMerger.merge(ancestor, List.of(alice, bob));

        assertTrue(result.clean());
        final var merged = result.merged();
        assertEquals(IntNode.valueOf(2), merged.get("size"));
        assertEquals(TextNode.valueOf("new"), merged.get("note"));
        assertEquals("alice", merged.get("agent").asText());
        assertEquals("2025-01-15T10:00:00Z", merged.get("updatedAt").asText());
        assertEquals("2025-01-15T09:00:00Z", merged.get("createdAt").asText());
        assertEquals("task", merged.get("entityType").asText());
    }

    @Test
    void testRemovalOnOneSide() {
        final var ancestor = state("{\"title\":\"Docs\",\"description\":\"old\"}");
        final var alice = candidate("alice", "{\"title\":\"Docs\",\"updatedAt\":\"2025-01-15T10:00:00Z\"}");
        final var bob = candidate("bob", "{\"title\":\"Docs\",\"description\":\"old\","
                + "\"updatedAt\":\"2025-01-15T10:05:00Z\"}");
        final var result = FieldMerger.merge(ancestor, List.of(alice, bob));
        assertTrue(result.clean());
        assertFalse(result.merged().has("description"));
    }

    @Test
    void testSameChangeOnBothSidesIsNoConflict() {
        final var ancestor = state("{\"title\":\"Docs\"}");
        final var result = FieldMerger.merge(ancestor, List.of(candidate("alice", "{\"title\":\"Guide\"}"),
                                                               candidate("bob", "{\"title\":\"Guide\"}")));
        assertTrue(result.clean());
        assertEquals("Guide", result.merged().get("title").asText());
    }

    @Test
    void testConflictKeepsAncestor() {
        final var ancestor = state("{\"title\":\"Docs\"}");
        final var result = FieldMerger.merge(ancestor, List.of(candidate("alice", "{\"title\":\"A\"}"),
                                                               candidate("bob", "{\"title\":\"B\"}")));
        assertEquals("Docs", result.merged().get("title").asText());
        assertEquals(List.of("title"), List.copyOf(result.conflictingFields().keySet()));
        assertEquals(TextNode.valueOf("A"), result.conflictingFields().get("title").get("alice"));
    }

    @Test
    void testConflictWithoutAncestorKeepsLatest() {
        final var alice = candidate("alice", "{\"title\":\"A\",\"updatedAt\":\"2025-01-15T10:09:00Z\"}");
        final var bob = candidate("bob", "{\"title\":\"B\",\"updatedAt\":\"2025-01-15T10:05:00Z\"}");
        final var result = FieldMerger.merge(null, List.of(alice, bob));
        assertFalse(result.clean());
        assertEquals("A", result.merged().get("title").asText());
    }

    @Test
    void testNeedsCandidates() {
        assertThrows(IllegalArgumentException.class, () -> FieldMerger.merge(null, List.of()));
    }

    private MergeCandidate candidate(String branch, String json) {
        return MergeCandidate.builder()
                .branch(branch)
                .owner(branch)
                .revisionId(branch + "-rev")
                .contentHash(branch + "-hash")
                .state(state(json))
                .build();
    }

    @SneakyThrows
    private ObjectNode state(String json) {
        final var node = (ObjectNode) objectMapper.readTree(json);
        node.put("entityType", "task");
        node.put("id", "t1");
        return node;
    }
}
