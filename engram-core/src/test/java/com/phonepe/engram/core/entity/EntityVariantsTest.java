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

package com.phonepe.engram.core.entity;

import com.phonepe.engram.core.entity.types.DecisionRecord;
import com.phonepe.engram.core.entity.types.Knowledge;
import com.phonepe.engram.core.entity.types.Reasoning;
import com.phonepe.engram.core.entity.types.Session;
import com.phonepe.engram.core.entity.types.Standard;
import com.phonepe.engram.core.entity.types.Task;
import com.phonepe.engram.core.entity.types.Workflow;
import com.phonepe.engram.core.errors.EntityValidationException;
import com.phonepe.engram.core.utils.TestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EntityVariantsTest {

    @Test
    void testEnvelopeChecks() {
        assertAll(
                () -> assertField("id", Task.builder().title("x").agent("a").build()),
                () -> assertField("id", Task.builder().id("has space").title("x").agent("a").build()),
                () -> assertField("agent", Task.builder().id("t1").title("x").build()),
                () -> assertField("updatedAt", Task.builder()
                        .id("t1")
                        .title("x")
                        .agent("a")
                        .createdAt(TestUtils.at("10:00:00"))
                        .updatedAt(TestUtils.at("09:00:00"))
                        .build()));
    }

    @Test
    void testTask() {
        assertField("title", Task.builder().id("t1").agent("a").build());
        assertField("parent", Task.builder().id("t1").agent("a").title("x").parent("t1").build());
        assertValid(Task.builder().id("t2").agent("a").title("x").parent("t1").build());
    }

    @Test
    void testFractions() {
        assertField("confidence", Knowledge.builder()
                .id("k1").agent("a").title("x").content("y").confidence(1.5).build());
        assertField("taskId", Reasoning.builder().id("r1").agent("a").title("x").build());
        assertValid(Reasoning.builder().id("r1").agent("a").taskId("t1").title("x").confidence(0.8).build());
    }

    @Test
    void testSessionWindow() {
        assertField("endedAt", Session.builder()
                .id("s1")
                .agent("a")
                .title("x")
                .startedAt(TestUtils.at("10:00:00"))
                .endedAt(TestUtils.at("09:59:59"))
                .build());
    }

    @Test
    void testDecisionRecord() {
        assertField("decision", DecisionRecord.builder().id("adr-1").agent("a").title("Use jsonl").build());
        assertField("supersededBy", DecisionRecord.builder()
                .id("adr-1")
                .agent("a")
                .title("Use jsonl")
                .decision("yes")
                .status(DecisionRecord.Status.SUPERSEDED)
                .build());
        assertField("number", DecisionRecord.builder()
                .id("adr-1").agent("a").title("t").decision("d").number(0).build());
    }

    @Test
    void testStandardRequirementsUnique() {
        assertField("requirements", Standard.builder()
                .id("std-1")
                .agent("a")
                .title("Logging")
                .requirements(List.of("use slf4j", "use slf4j"))
                .build());
    }

    @Test
    void testWorkflowStates() {
        final var base = Workflow.builder()
                .id("wf-1")
                .agent("a")
                .title("Review")
                .states(List.of("open", "review", "closed"))
                .initialState("open");
        assertValid(base.transitions(Map.of("open", List.of("review"), "review", List.of("closed"))).build());
        assertField("initialState", base.initialState("draft").transitions(null).build());
        assertField("transitions", base.initialState("open")
                .transitions(Map.of("open", List.of("merged")))
                .build());
        assertField("states", Workflow.builder().id("wf-2").agent("a").title("Empty").build());
    }

    private static void assertValid(Entity entity) {
        assertDoesNotThrow((Executable) entity::validate);
    }

    private static void assertField(String field, Entity entity) {
        final var error = assertThrows(EntityValidationException.class, entity::validate);
        assertEquals(field, error.getField());
    }
}
