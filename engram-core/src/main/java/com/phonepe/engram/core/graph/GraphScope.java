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

import com.phonepe.engram.core.graph.model.Relationship;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Limits the edges considered by {@link RelationshipGraph#stats(GraphScope)}. Empty sets mean no restriction.
 * An edge is in an entity type scope when either end has one of the types.
 */
@Value
@Builder
public class GraphScope {
    public static final GraphScope ALL = GraphScope.builder().build();

    Set<String> relationshipTypes;
    Set<String> entityTypes;
    boolean includeInactive;

    boolean includes(Relationship relationship) {
        if (!includeInactive && !relationship.live()) {
            return false;
        }
        if (relationshipTypes != null && !relationshipTypes.isEmpty()
                && !relationshipTypes.contains(relationship.getRelationshipType())) {
            return false;
        }
        return entityTypes == null || entityTypes.isEmpty()
                || entityTypes.contains(relationship.getSource().getType())
                || entityTypes.contains(relationship.getTarget().getType());
    }
}
