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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.phonepe.engram.core.entity.types.ComplianceRecord;
import com.phonepe.engram.core.entity.types.Context;
import com.phonepe.engram.core.entity.types.DecisionRecord;
import com.phonepe.engram.core.entity.types.Knowledge;
import com.phonepe.engram.core.entity.types.Reasoning;
import com.phonepe.engram.core.entity.types.Rule;
import com.phonepe.engram.core.entity.types.Session;
import com.phonepe.engram.core.entity.types.Standard;
import com.phonepe.engram.core.entity.types.Task;
import com.phonepe.engram.core.entity.types.Workflow;
import com.phonepe.engram.core.graph.model.Relationship;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * A typed record held in the store. The {@code entityType} tag selects the concrete variant.
 * Instances are immutable; every change is written as a new version.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "entityType",
        visible = true)
@JsonSubTypes({
        @JsonSubTypes.Type(name = EntityTypes.TASK, value = Task.class),
        @JsonSubTypes.Type(name = EntityTypes.CONTEXT, value = Context.class),
        @JsonSubTypes.Type(name = EntityTypes.REASONING, value = Reasoning.class),
        @JsonSubTypes.Type(name = EntityTypes.KNOWLEDGE, value = Knowledge.class),
        @JsonSubTypes.Type(name = EntityTypes.SESSION, value = Session.class),
        @JsonSubTypes.Type(name = EntityTypes.COMPLIANCE, value = ComplianceRecord.class),
        @JsonSubTypes.Type(name = EntityTypes.RULE, value = Rule.class),
        @JsonSubTypes.Type(name = EntityTypes.STANDARD, value = Standard.class),
        @JsonSubTypes.Type(name = EntityTypes.ADR, value = DecisionRecord.class),
        @JsonSubTypes.Type(name = EntityTypes.WORKFLOW, value = Workflow.class),
        @JsonSubTypes.Type(name = EntityTypes.RELATIONSHIP, value = Relationship.class),
})
public abstract class Entity {
    private final String entityType;
    private final String id;
    private final String agent;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final boolean archived;

    protected Entity(String entityType,
                     String id,
                     String agent,
                     Instant createdAt,
                     Instant updatedAt,
                     boolean archived) {
        this.entityType = entityType;
        this.id = id;
        this.agent = agent;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.archived = archived;
    }

    public final EntityRef ref() {
        return EntityRef.of(entityType, id);
    }

    /**
     * Checks the envelope and then the variant specific payload.
     *
     * @throws com.phonepe.engram.core.errors.EntityValidationException naming the first invalid field
     */
    public final void validate() {
        Validations.requireTypeTag("entityType", entityType);
        Validations.requireIdentifier("id", id);
        Validations.requireText("agent", agent);
        Validations.requireOrdered("updatedAt", createdAt, updatedAt);
        validatePayload();
    }

    protected abstract void validatePayload();
}
