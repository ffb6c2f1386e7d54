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
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Adjacency lists derived from the relationship entities of a branch. Never persisted: it is rebuilt whenever the
 * branch's write generation moves past the one it was built at.
 */
public class RelationshipIndex {
    private static final Comparator<GraphStep> STEP_ORDER = Comparator
            .comparing((GraphStep step) -> step.to().toString())
            .thenComparing(step -> step.via().getId());

    private final long generation;
    private final Map<String, Relationship> byId;
    private final Map<EntityRef, List<Relationship>> outbound = new HashMap<>();
    private final Map<EntityRef, List<Relationship>> inbound = new HashMap<>();

    private RelationshipIndex(long generation, Map<String, Relationship> byId) {
        this.generation = generation;
        this.byId = byId;
        byId.values()
                .stream()
                .filter(Relationship::live)
                .forEach(relationship -> {
                    outbound.computeIfAbsent(relationship.getSource(), key -> new ArrayList<>()).add(relationship);
                    inbound.computeIfAbsent(relationship.getTarget(), key -> new ArrayList<>()).add(relationship);
                });
    }

    /**
     * @param generation    Branch generation the relationships were read at
     * @param relationships Relationships in creation order
     */
    public static RelationshipIndex build(long generation, @NonNull Collection<Relationship> relationships) {
        final var byId = new LinkedHashMap<String, Relationship>();
        relationships.forEach(relationship -> byId.put(relationship.getId(), relationship));
        return new RelationshipIndex(generation, byId);
    }

    public long generation() {
        return generation;
    }

    /**
     * Every relationship, live or not, in creation order
     */
    public Collection<Relationship> all() {
        return byId.values();
    }

    public Optional<Relationship> byId(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public List<Relationship> outbound(EntityRef ref) {
        return outbound.getOrDefault(ref, List.of());
    }

    public List<Relationship> inbound(EntityRef ref) {
        return inbound.getOrDefault(ref, List.of());
    }

    /**
     * Nodes reachable in one hop from {@code from}: targets of outbound edges plus sources of inbound bidirectional
     * edges. Sorted by {@code type/id} of the node reached, then by relationship id.
     */
    public List<GraphStep> neighbours(EntityRef from, Predicate<Relationship> filter) {
        final var steps = new ArrayList<GraphStep>();
        Stream.concat(outbound(from).stream(), inbound(from).stream().filter(Relationship::bidirectional))
                .filter(filter)
                .forEach(relationship -> relationship.traverseFrom(from)
                        .ifPresent(to -> steps.add(new GraphStep(to, relationship))));
        steps.sort(STEP_ORDER);
        return steps;
    }
}
