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

import com.phonepe.engram.core.entity.types.ComplianceRecord;
import com.phonepe.engram.core.entity.types.Context;
import com.phonepe.engram.core.entity.types.CustomEntity;
import com.phonepe.engram.core.entity.types.DecisionRecord;
import com.phonepe.engram.core.entity.types.Knowledge;
import com.phonepe.engram.core.entity.types.Reasoning;
import com.phonepe.engram.core.entity.types.Rule;
import com.phonepe.engram.core.entity.types.Session;
import com.phonepe.engram.core.entity.types.Standard;
import com.phonepe.engram.core.entity.types.Task;
import com.phonepe.engram.core.entity.types.Workflow;
import com.phonepe.engram.core.errors.AlreadyExistsException;
import com.phonepe.engram.core.graph.model.Relationship;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps entity type tags to their Java variant. Custom tags registered at runtime are carried by
 * {@link CustomEntity}.
 */
@Slf4j
public class EntityTypeRegistry {
    private static final Map<String, Class<? extends Entity>> BUILT_IN = Map.ofEntries(
            Map.entry(EntityTypes.TASK, Task.class),
            Map.entry(EntityTypes.CONTEXT, Context.class),
            Map.entry(EntityTypes.REASONING, Reasoning.class),
            Map.entry(EntityTypes.KNOWLEDGE, Knowledge.class),
            Map.entry(EntityTypes.SESSION, Session.class),
            Map.entry(EntityTypes.COMPLIANCE, ComplianceRecord.class),
            Map.entry(EntityTypes.RULE, Rule.class),
            Map.entry(EntityTypes.STANDARD, Standard.class),
            Map.entry(EntityTypes.ADR, DecisionRecord.class),
            Map.entry(EntityTypes.WORKFLOW, Workflow.class),
            Map.entry(EntityTypes.RELATIONSHIP, Relationship.class));

    private final Map<String, Class<? extends Entity>> types = new ConcurrentHashMap<>(BUILT_IN);

    /**
     * Registers a custom entity type. Registering the same custom tag twice is a no-op.
     *
     * @param name Lower case tag for the new type
     * @throws AlreadyExistsException if the tag belongs to a built in variant
     */
    public void registerCustomType(String name) {
        Validations.requireTypeTag("entityType", name);
        final var existing = types.putIfAbsent(name, CustomEntity.class);
        if (existing != null && existing != CustomEntity.class) {
            throw new AlreadyExistsException("built in entity type " + name);
        }
        if (existing == null) {
            log.info("Registered custom entity type {}", name);
        }
    }

    public Optional<Class<? extends Entity>> typeOf(String name) {
        return Optional.ofNullable(null == name ? null : types.get(name));
    }

    public boolean isRegistered(String name) {
        return typeOf(name).isPresent();
    }

    public Set<String> names() {
        return new TreeSet<>(types.keySet());
    }
}
