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

package com.phonepe.engram.core.graph.model;

import com.phonepe.engram.core.entity.Entity;
import com.phonepe.engram.core.entity.EntityRef;
import com.phonepe.engram.core.entity.EntityTypes;
import com.phonepe.engram.core.entity.Validations;
import com.phonepe.engram.core.errors.EntityValidationException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Directed (or bidirectional) typed edge between two entities. Stored like any other entity under the
 * {@code relationship} type.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Relationship extends Entity {
    EntityRef source;
    EntityRef target;
    String relationshipType;
    RelationshipDirection direction;
    RelationshipStrength strength;
    String description;
    Map<String, String> metadata;
    Boolean active;
    RelationshipConstraints constraints;

    @Builder
    @Jacksonized
    public Relationship(String id,
                        String agent,
                        Instant createdAt,
                        Instant updatedAt,
                        boolean archived,
                        EntityRef source,
                        EntityRef target,
                        String relationshipType,
                        RelationshipDirection direction,
                        RelationshipStrength strength,
                        String description,
                        Map<String, String> metadata,
                        Boolean active,
                        RelationshipConstraints constraints) {
        super(EntityTypes.RELATIONSHIP, id, agent, createdAt, updatedAt, archived);
        this.source = source;
        this.target = target;
        this.relationshipType = relationshipType;
        this.direction = Objects.requireNonNullElse(direction, RelationshipDirection.UNIDIRECTIONAL);
        this.strength = Objects.requireNonNullElse(strength, RelationshipStrength.MEDIUM);
        this.description = description;
        this.metadata = metadata;
        this.active = Objects.requireNonNullElse(active, Boolean.TRUE);
        this.constraints = Objects.requireNonNullElse(constraints, RelationshipConstraints.DEFAULT);
    }

    public boolean live() {
        return Boolean.TRUE.equals(active) && !isArchived();
    }

    public boolean bidirectional() {
        return direction == RelationshipDirection.BIDIRECTIONAL;
    }

    public boolean involves(EntityRef ref) {
        return source.equals(ref) || target.equals(ref);
    }

    /**
     * The node reached when walking this edge from {@code from}, honouring direction.
     */
    public Optional<EntityRef> traverseFrom(EntityRef from) {
        if (source.equals(from)) {
            return Optional.of(target);
        }
        if (bidirectional() && target.equals(from)) {
            return Optional.of(source);
        }
        return Optional.empty();
    }

    @Override
    protected void validatePayload() {
        validateEnd("source", source);
        validateEnd("target", target);
        Validations.requireTypeTag("relationshipType", relationshipType);
        if (source.equals(target)) {
            throw new EntityValidationException("target", "self relationships are not allowed");
        }
        constraints.validate(source, target);
    }

    private static void validateEnd(String field, EntityRef ref) {
        if (null == ref) {
            throw EntityValidationException.missing(field);
        }
        Validations.requireTypeTag(field, ref.getType());
        Validations.requireIdentifier(field, ref.getId());
    }
}
