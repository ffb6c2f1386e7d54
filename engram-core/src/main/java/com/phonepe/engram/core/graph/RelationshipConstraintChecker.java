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
import com.phonepe.engram.core.errors.CyclePreventedException;
import com.phonepe.engram.core.errors.LimitExceededException;
import com.phonepe.engram.core.graph.model.CycleScope;
import com.phonepe.engram.core.graph.model.Relationship;
import lombok.NonNull;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.function.Predicate;

/**
 * Checks a candidate edge against the constraints it declares, using the current graph. The candidate itself is
 * ignored if the index already contains it.
 */
public class RelationshipConstraintChecker {
    private final CycleScope defaultCycleScope;

    public RelationshipConstraintChecker(@NonNull CycleScope defaultCycleScope) {
        this.defaultCycleScope = defaultCycleScope;
    }

    /**
     * @throws CyclePreventedException if cycles are disallowed and the edge would close one
     * @throws LimitExceededException  if the source or target is already at its limit for the relationship type
     */
    public void check(@NonNull Relationship candidate, @NonNull RelationshipIndex index) {
        final var constraints = candidate.getConstraints();
        final Predicate<Relationship> others = relationship -> !relationship.getId().equals(candidate.getId());
        final Predicate<Relationship> sameType = relationship -> relationship.getRelationshipType()
                .equals(candidate.getRelationshipType());

        if (!constraints.cyclesAllowed()) {
            final var scope = constraints.effectiveCycleScope(defaultCycleScope);
            final var considered = scope == CycleScope.SAME_TYPE ? others.and(sameType) : others;
            if (reachable(index, candidate.getTarget(), candidate.getSource(), considered)
                    || (candidate.bidirectional()
                    && reachable(index, candidate.getSource(), candidate.getTarget(), considered))) {
                throw new CyclePreventedException(candidate.getRelationshipType(),
                                                  candidate.getSource().toString(),
                                                  candidate.getTarget().toString());
            }
        }
        final var maxOutbound = constraints.getMaxOutbound();
        if (maxOutbound != null) {
            final var existing = index.outbound(candidate.getSource())
                    .stream()
                    .filter(others.and(sameType))
                    .count();
            if (existing >= maxOutbound) {
                throw new LimitExceededException("%s already has %d outbound '%s' relationships (max %d)"
                                                         .formatted(candidate.getSource(), existing,
                                                                    candidate.getRelationshipType(), maxOutbound));
            }
        }
        final var maxInbound = constraints.getMaxInbound();
        if (maxInbound != null) {
            final var existing = index.inbound(candidate.getTarget())
                    .stream()
                    .filter(others.and(sameType))
                    .count();
            if (existing >= maxInbound) {
                throw new LimitExceededException("%s already has %d inbound '%s' relationships (max %d)"
                                                         .formatted(candidate.getTarget(), existing,
                                                                    candidate.getRelationshipType(), maxInbound));
            }
        }
    }

    static boolean reachable(RelationshipIndex index,
                             EntityRef from,
                             EntityRef to,
                             Predicate<Relationship> filter) {
        final var visited = new HashSet<EntityRef>();
        final var queue = new ArrayDeque<EntityRef>();
        queue.add(from);
        visited.add(from);
        while (!queue.isEmpty()) {
            final var node = queue.poll();
            if (node.equals(to)) {
                return true;
            }
            for (final var step : index.neighbours(node, filter)) {
                if (visited.add(step.to())) {
                    queue.add(step.to());
                }
            }
        }
        return false;
    }
}
