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

package com.phonepe.engram.core.graph;

import com.phonepe.engram.core.entity.EntityRef;
import com.phonepe.engram.core.graph.model.Relationship;
import com.phonepe.engram.core.graph.model.RelationshipDirection;
import com.phonepe.engram.core.graph.model.RelationshipStrength;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Criteria for {@link RelationshipGraph#query(RelationshipFilter)}. Unset criteria match everything.
 */
@Value
@Builder
public class RelationshipFilter {
    EntityRef source;
    EntityRef target;
    EntityRef involving;
    Set<String> relationshipTypes;
    RelationshipDirection direction;
    RelationshipStrength minStrength;
    String agent;
    boolean includeInactive;

    public boolean matches(Relationship relationship) {
        return (includeInactive || relationship.live())
                && (source == null || source.equals(relationship.getSource()))
                && (target == null || target.equals(relationship.getTarget()))
                && (involving == null || relationship.involves(involving))
                && (relationshipTypes == null || relationshipTypes.isEmpty()
                || relationshipTypes.contains(relationship.getRelationshipType()))
                && (direction == null || direction == relationship.getDirection())
                && (minStrength == null || relationship.getStrength().compareTo(minStrength) >= 0)
                && (agent == null || agent.equals(relationship.getAgent()));
    }
}
