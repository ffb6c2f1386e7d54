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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.engram.core.entity.types.CustomEntity;
import com.phonepe.engram.core.entity.types.Task;
import com.phonepe.engram.core.entity.types.TaskPriority;
import com.phonepe.engram.core.errors.AlreadyExistsException;
import com.phonepe.engram.core.errors.EntityValidationException;
import com.phonepe.engram.core.graph.model.Relationship;
import com.phonepe.engram.core.graph.model.RelationshipStrength;
import com.phonepe.engram.core.utils.JsonUtils;
import com.phonepe.engram.core.utils.TestUtils;
import lombok.SneakyThrows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EntityCodecTest {

    private ObjectMapper objectMapper;
    private EntityTypeRegistry registry;
    private EntityCodec codec;

    @BeforeEach
    void setUp() {
        objectMapper = JsonUtils.createMapper();
        registry = new EntityTypeRegistry();
        codec = new EntityCodec(objectMapper, registry);
    }

    @Test
    void testCanonicalForm() {
        final var task = TestUtils.task("t1", "Write docs", "alice", TestUtils.at("10:00:00"));
        final var json = new String(codec.toBytes(task), StandardCharsets.UTF_8);
        assertEquals("{\"agent\":\"alice\",\"archived\":false,\"createdAt\":\"2025-01-15T09:00:00Z\","
                             + "\"entityType\":\"task\",\"id\":\"t1\",\"priority\":\"MEDIUM\",\"status\":\"TODO\","
                             + "\"title\":\"Write docs\",\"updatedAt\":\"2025-01-15T10:00:00Z\"}",
                     json);
    }

    @Test
    void testEqualValuesHaveEqualBytes() {
        final var first = Task.builder()
                .id("t1")
                .title("Plan")
                .metadata(Map.of("zeta", "1", "alpha", "2", "mid", "3"))
                .build();
        final var second = Task.builder()
                .id("t1")
                .title("Plan")
                .metadata(Map.of("mid", "3", "zeta", "1", "alpha", "2"))
                .build();
        assertArrayEquals(codec.toBytes(first), codec.toBytes(second));
    }

    @Test
    void testRoundTripKeepsVariant() {
        final var task = Task.builder()
                .id("t1")
                .title("Ship it")
                .agent("bob")
                .priority(TaskPriority.HIGH)
                .createdAt(TestUtils.T0)
                .updatedAt(TestUtils.T0)
                .build();
        final var read = codec.fromBytes(codec.toBytes(task));
        assertInstanceOf(Task.class, read);
        assertEquals(task, read);
    }

    @Test
    void testRelationshipDefaults() {
        final var relationship = codec.fromTree(codec.readTree(
                ("{\"entityType\":\"relationship\",\"id\":\"r1\",\"agent\":\"a\","
                        + "\"source\":{\"type\":\"task\",\"id\":\"a\"},"
                        + "\"target\":{\"type\":\"task\",\"id\":\"b\"},"
                        + "\"relationshipType\":\"depends_on\"}").getBytes(StandardCharsets.UTF_8)));
        final var read = assertInstanceOf(Relationship.class, relationship);
        assertEquals(RelationshipStrength.MEDIUM, read.getStrength());
        assertEquals(Boolean.TRUE, read.getActive());
        assertEquals(EntityRef.of("task", "b"), read.getTarget());
    }

    @Test
    @SneakyThrows
    void testUnknownTypeNamesEntityTypeField() {
        final var tree = objectMapper.readTree("{\"entityType\":\"meeting\",\"id\":\"m1\"}");
        final var error = assertThrows(EntityValidationException.class, () -> codec.fromTree(tree));
        assertEquals("entityType", error.getField());
    }

    @Test
    @SneakyThrows
    void testWrongShapeNamesField() {
        final var tree = objectMapper.readTree("{\"entityType\":\"task\",\"id\":\"t1\",\"status\":\"SOMEDAY\"}");
        final var error = assertThrows(EntityValidationException.class, () -> codec.fromTree(tree));
        assertEquals("status", error.getField());
    }

    @Test
    @SneakyThrows
    void testCustomType() {
        registry.registerCustomType("meeting");
        final var tree = objectMapper.readTree(
                "{\"entityType\":\"meeting\",\"id\":\"m1\",\"agent\":\"a\",\"data\":{\"room\":\"4A\"}}");
        final var entity = assertInstanceOf(CustomEntity.class, codec.fromTree(tree));
        assertEquals("meeting", entity.getEntityType());
        assertEquals("4A", entity.getData().get("room"));
        assertEquals(entity, codec.fromBytes(codec.toBytes(entity)));
    }

    @Test
    void testBuiltInTagCannotBeRegistered() {
        assertThrows(AlreadyExistsException.class, () -> registry.registerCustomType("task"));
        assertThrows(EntityValidationException.class, () -> registry.registerCustomType("Not A Tag"));
    }

    @Test
    void testPayloadMustBeObject() {
        final var error = assertThrows(EntityValidationException.class,
                                       () -> codec.fromBytes("[1,2]".getBytes(StandardCharsets.UTF_8)));
        assertEquals("entityType", error.getField());
    }
}
