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

import com.google.common.base.Strings;
import com.phonepe.engram.core.branch.BranchManager;
import com.phonepe.engram.core.config.EngramSetup;
import com.phonepe.engram.core.entity.EntityRef;
import com.phonepe.engram.core.entity.EntityStore;
import com.phonepe.engram.core.entity.EntityTypes;
import com.phonepe.engram.core.errors.AlreadyExistsException;
import com.phonepe.engram.core.errors.NotFoundException;
import com.phonepe.engram.core.graph.model.Relationship;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.StampedLock;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Relationship graph over the entities of a branch. Edges are stored as {@link Relationship} entities; the adjacency
 * index is derived from them and rebuilt lazily whenever the branch changes.
 * Creation holds the branch's write lock so constraint checks and the write see the same graph. Queries hold the
 * read lock. Operations without an explicit branch work on the active branch.
 */
@Slf4j
public class RelationshipGraph {
    private static final class BranchGraph {
        private final StampedLock lock = new StampedLock();
        private volatile RelationshipIndex index;
    }

    private final EntityStore entities;
    private final BranchManager branches;
    private final EngramSetup setup;
    private final RelationshipConstraintChecker constraintChecker;
    private final Clock clock;
    private final Map<String, BranchGraph> graphs = new ConcurrentHashMap<>();

    @Builder
    public RelationshipGraph(@NonNull EntityStore entities,
                             @NonNull BranchManager branches,
                             @NonNull EngramSetup setup,
                             @NonNull Clock clock) {
        this.entities = entities;
        this.branches = branches;
        this.setup = setup;
        this.constraintChecker = new RelationshipConstraintChecker(setup.getDefaultCycleScope());
        this.clock = clock;
    }

    public String createRelationship(CreateRelationshipRequest request) {
        return createRelationship(branches.activeName(), request);
    }

    /**
     * Validates and stores a new edge.
     *
     * @param branch  Branch to create the edge on
     * @param request Edge definition
     * @return Id of the new relationship
     * @throws com.phonepe.engram.core.errors.EntityValidationException on malformed input or a self relationship
     * @throws NotFoundException                                        if an endpoint does not exist
     * @throws AlreadyExistsException                                   if the explicit id is taken
     * @throws com.phonepe.engram.core.errors.CyclePreventedException   if the edge would close a forbidden cycle
     * @throws com.phonepe.engram.core.errors.LimitExceededException    if a cardinality limit is reached
     */
    public String createRelationship(String branch, @NonNull CreateRelationshipRequest request) {
        final var graph = graphFor(branch);
        final var stamp = graph.lock.writeLock();
        try {
            final var now = clock.instant();
            final var relationship = Relationship.builder()
                    .id(Strings.isNullOrEmpty(request.getId()) ? UUID.randomUUID().toString() : request.getId())
                    .agent(Objects.requireNonNullElse(request.getAgent(), setup.getDefaultAgent()))
                    .createdAt(now)
                    .updatedAt(now)
                    .source(request.getSource())
                    .target(request.getTarget())
                    .relationshipType(request.getRelationshipType())
                    .direction(request.getDirection())
                    .strength(request.getStrength())
                    .description(request.getDescription())
                    .metadata(request.getMetadata())
                    .constraints(request.getConstraints())
                    .build();
            relationship.validate();
            requireEndpoint(branch, relationship.getSource());
            requireEndpoint(branch, relationship.getTarget());
            if (entities.exists(branch, relationship.ref())) {
                throw new AlreadyExistsException("relationship " + relationship.getId());
            }
            constraintChecker.check(relationship, index(branch, graph));
            entities.compareAndStore(branch, relationship, null);
            log.info("Created {} relationship {}: {} -> {} on {}",
                     relationship.getRelationshipType(), relationship.getId(),
                     relationship.getSource(), relationship.getTarget(), branch);
            return relationship.getId();
        }
        finally {
            graph.lock.unlockWrite(stamp);
        }
    }

    /**
     * Stores a complete relationship entity, new or updated, after the same checks as
     * {@link #createRelationship(String, CreateRelationshipRequest)}. Edges that are inactive or archived add nothing
     * to the graph and skip the cycle and cardinality checks.
     *
     * @return Content hash of the stored version
     * @throws com.phonepe.engram.core.errors.EntityValidationException if the relationship is invalid or an endpoint
     *                                                                  is missing
     * @throws com.phonepe.engram.core.errors.CyclePreventedException   if the edge would close a forbidden cycle
     * @throws com.phonepe.engram.core.errors.LimitExceededException    if a cardinality limit is reached
     */
    public String storeRelationship(String branch, @NonNull Relationship relationship) {
        final var graph = graphFor(branch);
        final var stamp = graph.lock.writeLock();
        try {
            final var prepared = (Relationship) entities.prepare(branch, relationship);
            if (prepared.live()) {
                constraintChecker.check(prepared, index(branch, graph));
            }
            final var contentHash = entities.store(branch, prepared);
            log.debug("Stored relationship {} on {} as {}", prepared.getId(), branch, contentHash);
            return contentHash;
        }
        finally {
            graph.lock.unlockWrite(stamp);
        }
    }

    public Optional<Relationship> getRelationship(String id) {
        return getRelationship(branches.activeName(), id);
    }

    public Optional<Relationship> getRelationship(String branch, String id) {
        return read(branch, index -> index.byId(id));
    }

    /**
     * Deactivates an edge. The relationship entity and its history are kept.
     *
     * @return false if the edge was already inactive
     */
    public boolean deleteRelationship(String id, String agent) {
        return deleteRelationship(branches.activeName(), id, agent);
    }

    public boolean deleteRelationship(String branch, String id, String agent) {
        final var graph = graphFor(branch);
        final var stamp = graph.lock.writeLock();
        try {
            final var ref = EntityRef.of(EntityTypes.RELATIONSHIP, id);
            final var existing = entities.get(branch, ref, Relationship.class);
            if (!existing.live()) {
                return false;
            }
            entities.modify(branch, ref, agent, tree -> tree.put("active", false));
            log.info("Deactivated relationship {} on {}", id, branch);
            return true;
        }
        finally {
            graph.lock.unlockWrite(stamp);
        }
    }

    public List<Relationship> listRelationships(EntityRef ref, String relationshipType) {
        return listRelationships(branches.activeName(), ref, relationshipType);
    }

    /**
     * Live edges touching an entity in creation order.
     *
     * @param relationshipType Only edges of this type when not null
     */
    public List<Relationship> listRelationships(String branch, @NonNull EntityRef ref, String relationshipType) {
        return query(branch, RelationshipFilter.builder()
                .involving(ref)
                .relationshipTypes(relationshipType == null ? null : Set.of(relationshipType))
                .build());
    }

    public List<Relationship> query(RelationshipFilter filter) {
        return query(branches.activeName(), filter);
    }

    public List<Relationship> query(String branch, @NonNull RelationshipFilter filter) {
        return read(branch, index -> index.all()
                .stream()
                .filter(filter::matches)
                .toList());
    }

    public Optional<EntityPath> findPath(EntityRef source, EntityRef target, PathAlgorithm algorithm) {
        return findPath(branches.activeName(), source, target, algorithm, null);
    }

    /**
     * Finds a path over live edges. Not finding one is not an error.
     *
     * @param relationshipTypes Only walk edges of these types when not empty
     */
    public Optional<EntityPath> findPath(String branch,
                                         @NonNull EntityRef source,
                                         @NonNull EntityRef target,
                                         @NonNull PathAlgorithm algorithm,
                                         Set<String> relationshipTypes) {
        return read(branch, index -> PathFinder.find(index, source, target, algorithm, typeFilter(relationshipTypes)));
    }

    public List<EntityRef> connected(EntityRef ref, String relationshipType) {
        return connected(branches.activeName(), ref, relationshipType);
    }

    /**
     * Entities one hop away: targets of outbound edges, plus the other end of bidirectional edges.
     */
    public List<EntityRef> connected(String branch, @NonNull EntityRef ref, String relationshipType) {
        final var filter = typeFilter(relationshipType == null ? null : Set.of(relationshipType));
        return read(branch, index -> index.neighbours(ref, filter)
                .stream()
                .map(GraphStep::to)
                .distinct()
                .toList());
    }

    public List<EntityRef> traverse(EntityRef start, PathAlgorithm algorithm, int maxDepth) {
        return traverse(branches.activeName(), start, algorithm, maxDepth);
    }

    public List<EntityRef> traverse(String branch, @NonNull EntityRef start, @NonNull PathAlgorithm algorithm,
                                    int maxDepth) {
        return read(branch, index -> PathFinder.traverse(index, start, algorithm, maxDepth, relationship -> true));
    }

    public GraphStats stats(GraphScope scope) {
        return stats(branches.activeName(), scope);
    }

    public GraphStats stats(String branch, GraphScope scope) {
        final var effectiveScope = Objects.requireNonNullElse(scope, GraphScope.ALL);
        return read(branch, index -> {
            final var included = index.all()
                    .stream()
                    .filter(effectiveScope::includes)
                    .toList();
            final var byType = new TreeMap<String, Long>();
            final var degrees = new HashMap<EntityRef, Long>();
            included.forEach(relationship -> {
                byType.merge(relationship.getRelationshipType(), 1L, Long::sum);
                degrees.merge(relationship.getSource(), 1L, Long::sum);
                degrees.merge(relationship.getTarget(), 1L, Long::sum);
            });
            final var mostConnected = degrees.entrySet()
                    .stream()
                    .min(Comparator.<Map.Entry<EntityRef, Long>>comparingLong(entry -> entry.getValue())
                                 .reversed()
                                 .thenComparing(entry -> entry.getKey()));
            final long edges = included.size();
            final long nodes = degrees.size();
            return GraphStats.builder()
                    .relationshipCount(edges)
                    .entityCount(nodes)
                    .byType(byType)
                    .mostConnected(mostConnected.map(Map.Entry::getKey).orElse(null))
                    .mostConnectedDegree(mostConnected.map(Map.Entry::getValue).orElse(0L))
                    .density(nodes < 2 ? 0.0 : (double) edges / (nodes * (nodes - 1)))
                    .bidirectionalCount(included.stream().filter(Relationship::bidirectional).count())
                    .averageConnections(nodes == 0 ? 0.0 : (2.0 * edges) / nodes)
                    .build();
        });
    }

    public boolean hasRelationshipsTo(EntityRef ref, Set<String> entityTypes) {
        return hasRelationshipsTo(branches.activeName(), ref, entityTypes);
    }

    /**
     * Whether any live edge connects the entity to an entity of one of the given types, in either direction.
     */
    public boolean hasRelationshipsTo(String branch, @NonNull EntityRef ref, @NonNull Set<String> entityTypes) {
        return read(branch, index -> index.all()
                .stream()
                .filter(Relationship::live)
                .filter(relationship -> relationship.involves(ref))
                .map(relationship -> relationship.getSource().equals(ref)
                                     ? relationship.getTarget()
                                     : relationship.getSource())
                .anyMatch(other -> entityTypes.contains(other.getType())));
    }

    /**
     * Drops the cached index of a branch, for example after the branch was deleted
     */
    public void invalidate(String branch) {
        graphs.remove(branch);
    }

    private <T> T read(String branch, Function<RelationshipIndex, T> query) {
        final var graph = graphFor(branch);
        final var stamp = graph.lock.readLock();
        try {
            return query.apply(index(branch, graph));
        }
        finally {
            graph.lock.unlockRead(stamp);
        }
    }

    private RelationshipIndex index(String branch, BranchGraph graph) {
        final var generation = entities.generation(branch);
        final var current = graph.index;
        if (current != null && current.generation() == generation) {
            return current;
        }
        final var rebuilt = RelationshipIndex.build(
                generation, entities.list(branch, EntityTypes.RELATIONSHIP, Relationship.class));
        log.debug("Rebuilt relationship index for {} at generation {} with {} edges",
                  branch, generation, rebuilt.all().size());
        graph.index = rebuilt;
        return rebuilt;
    }

    private BranchGraph graphFor(String branch) {
        branches.require(branch);
        return graphs.computeIfAbsent(branch, name -> new BranchGraph());
    }

    private void requireEndpoint(String branch, EntityRef ref) {
        if (!entities.exists(branch, ref)) {
            throw NotFoundException.entity(ref);
        }
    }

    private static Predicate<Relationship> typeFilter(Set<String> relationshipTypes) {
        if (relationshipTypes == null || relationshipTypes.isEmpty()) {
            return relationship -> true;
        }
        return relationship -> relationshipTypes.contains(relationship.getRelationshipType());
    }
}
