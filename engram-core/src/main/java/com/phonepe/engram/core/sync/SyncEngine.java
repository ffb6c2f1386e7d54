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

package com.phonepe.engram.core.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.base.Stopwatch;
import com.phonepe.engram.core.branch.BranchManager;
import com.phonepe.engram.core.branch.PointerEntry;
import com.phonepe.engram.core.config.EngramSetup;
import com.phonepe.engram.core.entity.Entity;
import com.phonepe.engram.core.entity.EntityCodec;
import com.phonepe.engram.core.entity.EntityRef;
import com.phonepe.engram.core.entity.EntityTypes;
import com.phonepe.engram.core.errors.CyclePreventedException;
import com.phonepe.engram.core.errors.EntityValidationException;
import com.phonepe.engram.core.errors.InvalidInputException;
import com.phonepe.engram.core.errors.LimitExceededException;
import com.phonepe.engram.core.graph.RelationshipConstraintChecker;
import com.phonepe.engram.core.graph.RelationshipIndex;
import com.phonepe.engram.core.graph.model.Relationship;
import com.phonepe.engram.core.history.Revision;
import com.phonepe.engram.core.history.RevisionLog;
import com.phonepe.engram.core.store.ContentDigests;
import com.phonepe.engram.core.store.ContentStore;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reconciles the state of several branches.
 * Every branch's pointer table is snapshotted first. For each entity whose heads differ, the common ancestor
 * revision is located and the branches that changed since then become merge candidates. A single line of change is
 * fast forwarded; diverging lines are handed to the selected {@link MergeStrategy}. Accepted results are written as
 * one merge revision that all participating branches then point to, so running the same sync again changes nothing.
 * Pointers are moved with compare-and-swap against the snapshot; an entity written concurrently is skipped on that
 * branch and picked up by the next sync.
 */
@Slf4j
public class SyncEngine {
    private record Plan(PointerEntry target, Entity entity, boolean merge) {
    }

    private final ContentStore contentStore;
    private final EntityCodec codec;
    private final RevisionLog revisionLog;
    private final BranchManager branches;
    private final MergeStrategies strategies;
    private final RelationshipConstraintChecker constraintChecker;
    private final Clock clock;
    private final ReentrantLock syncLock = new ReentrantLock();

    @Builder
    public SyncEngine(@NonNull ContentStore contentStore,
                      @NonNull EntityCodec codec,
                      @NonNull RevisionLog revisionLog,
                      @NonNull BranchManager branches,
                      @NonNull MergeStrategies strategies,
                      @NonNull EngramSetup setup,
                      @NonNull Clock clock) {
        this.contentStore = contentStore;
        this.codec = codec;
        this.revisionLog = revisionLog;
        this.branches = branches;
        this.strategies = strategies;
        this.constraintChecker = new RelationshipConstraintChecker(setup.getDefaultCycleScope());
        this.clock = clock;
    }

    public SyncResult sync(Collection<String> branchNames, String strategyName) {
        return sync(branchNames, strategyName, false);
    }

    /**
     * Synchronizes the given branches.
     *
     * @param branchNames  Branches to reconcile
     * @param strategyName Strategy used for entities that diverged
     * @param dryRun       Compute the result without writing anything
     * @return Merged state, conflicts and counters
     * @throws InvalidInputException                                     if no branch is given
     * @throws com.phonepe.engram.core.errors.UnknownStrategyException if the strategy name is not known
     * @throws com.phonepe.engram.core.errors.NotFoundException        if a branch does not exist
     */
    public SyncResult sync(Collection<String> branchNames, String strategyName, boolean dryRun) {
        if (null == branchNames || branchNames.isEmpty()) {
            throw new InvalidInputException("at least one branch is required to synchronize");
        }
        if (branchNames.stream().anyMatch(Objects::isNull)) {
            throw new InvalidInputException("branch names must not be null");
        }
        final var strategy = strategies.resolve(strategyName);
        final var names = new TreeSet<>(branchNames);
        names.forEach(branches::require);
        if (names.size() == 1) {
            log.info("Nothing to synchronize for single branch {}", names.first());
            return SyncResult.builder()
                    .status(SyncStatus.NOTHING_TO_SYNCHRONIZE)
                    .strategy(strategy.name())
                    .branches(List.copyOf(names))
                    .dryRun(dryRun)
                    .mergedState(Map.of())
                    .conflicts(List.of())
                    .resolutions(List.of())
                    .duration(Duration.ZERO)
                    .build();
        }
        syncLock.lock();
        try {
            return run(names, strategy, dryRun);
        }
        finally {
            syncLock.unlock();
        }
    }

    private SyncResult run(SortedSet<String> names, MergeStrategy strategy, boolean dryRun) {
        final var stopwatch = Stopwatch.createStarted();
        final var startedAt = clock.instant();
        log.info("Synchronizing {} with {}{}", names, strategy.name(), dryRun ? " (dry run)" : "");

        final var snapshots = new TreeMap<String, Map<EntityRef, PointerEntry>>();
        final var owners = new TreeMap<String, String>();
        names.forEach(name -> {
            snapshots.put(name, branches.pointers(name).snapshot());
            owners.put(name, branches.require(name).getOwner());
        });
        final var keys = new TreeSet<EntityRef>();
        snapshots.values().forEach(snapshot -> keys.addAll(snapshot.keySet()));

        final var cache = revisionLog.newCache();
        final var plans = new LinkedHashMap<EntityRef, Plan>();
        final var conflicts = new ArrayList<SyncConflict>();
        final var resolutions = new ArrayList<SyncResolution>();
        final var unresolved = new HashSet<EntityRef>();
        var examined = 0;

        for (final var key : keys) {
            final var heads = new TreeMap<String, PointerEntry>();
            snapshots.forEach((branch, snapshot) -> {
                final var entry = snapshot.get(key);
                if (entry != null) {
                    heads.put(branch, entry);
                }
            });
            final var headRevisions = new TreeSet<String>();
            heads.values().forEach(entry -> headRevisions.add(entry.getRevisionId()));
            if (heads.size() == names.size() && headRevisions.size() == 1) {
                continue;
            }
            examined++;
            final var base = revisionLog.mergeBase(headRevisions, cache);
            final var candidates = new ArrayList<MergeCandidate>();
            heads.forEach((branch, entry) -> {
                if (!entry.getRevisionId().equals(base)) {
                    candidates.add(MergeCandidate.builder()
                                           .branch(branch)
                                           .owner(owners.get(branch))
                                           .revisionId(entry.getRevisionId())
                                           .contentHash(entry.getContentHash())
                                           .state(codec.readTree(contentStore.get(entry.getContentHash())))
                                           .build());
                }
            });
            final var candidateRevisions = new TreeSet<String>();
            candidates.forEach(candidate -> candidateRevisions.add(candidate.getRevisionId()));
            if (candidateRevisions.size() <= 1) {
                final var target = candidates.isEmpty()
                                   ? heads.values().iterator().next()
                                   : PointerEntry.of(candidates.get(0).getContentHash(),
                                                     candidates.get(0).getRevisionId());
                plans.put(key, new Plan(target, codec.fromBytes(contentStore.get(target.getContentHash())), false));
                continue;
            }

            final var contents = new TreeSet<String>();
            candidates.forEach(candidate -> contents.add(candidate.getContentHash()));
            var merged = candidates.get(0).getState();
            MergeDecision decision = null;
            if (contents.size() > 1) {
                final var ancestor = base == null
                                     ? null
                                     : codec.readTree(contentStore.get(revisionLog.cached(base, cache)
                                                                               .getContentHash()));
                decision = strategy.merge(MergeContext.builder()
                                                            .ref(key)
                                                            .ancestor(ancestor)
                                                            .candidates(List.copyOf(candidates))
                                                            .build());
                conflicts.addAll(decision.getConflicts());
                if (decision.escalated()) {
                    log.info("{} left unmerged: {}", key, decision.getDetail());
                    unresolved.add(key);
                    continue;
                }
                merged = decision.getMerged();
            }
            final Entity entity;
            try {
                entity = codec.fromTree(merged);
                entity.validate();
            }
            catch (EntityValidationException e) {
                conflicts.add(SyncConflict.builder()
                                      .entityType(key.getType())
                                      .entityId(key.getId())
                                      .kind(ConflictKind.ENTITY)
                                      .candidates(candidateStates(candidates))
                                      .outcome("not merged, merged version is invalid: " + e.getMessage())
                                      .build());
                unresolved.add(key);
                continue;
            }
            final var target = writeMerge(entity, candidateRevisions, cache, startedAt, dryRun);
            plans.put(key, new Plan(target, entity, true));
            if (decision != null) {
                resolutions.add(SyncResolution.builder()
                                        .entityType(key.getType())
                                        .entityId(key.getId())
                                        .strategy(strategy.name())
                                        .winner(decision.getWinner())
                                        .contentHash(target.getContentHash())
                                        .detail(decision.getDetail())
                                        .build());
            }
        }

        revalidateRelationships(keys, snapshots, plans, unresolved, conflicts);

        var updated = 0;
        var skipped = 0;
        if (!dryRun) {
            for (final var planned : plans.entrySet()) {
                for (final var name : names) {
                    final var expected = snapshots.get(name).get(planned.getKey());
                    final var target = planned.getValue().target();
                    if (target.equals(expected)) {
                        continue;
                    }
                    if (branches.pointers(name).compareAndSet(planned.getKey(), expected, target)) {
                        updated++;
                    }
                    else {
                        skipped++;
                        log.warn("Skipped {} on {}: it changed after the sync snapshot was taken",
                                 planned.getKey(), name);
                    }
                }
            }
        }

        final var mergedState = new TreeMap<EntityRef, Entity>();
        plans.forEach((key, plan) -> mergedState.put(key, plan.entity()));
        final var appliedResolutions = resolutions.stream()
                .filter(resolution -> plans.containsKey(EntityRef.of(resolution.getEntityType(),
                                                                     resolution.getEntityId())))
                .toList();
        final var merges = (int) plans.values().stream().filter(Plan::merge).count();
        final var result = SyncResult.builder()
                .status(conflicts.isEmpty() ? SyncStatus.SYNCHRONIZED : SyncStatus.SYNCHRONIZED_WITH_CONFLICTS)
                .strategy(strategy.name())
                .branches(List.copyOf(names))
                .dryRun(dryRun)
                .mergedState(mergedState)
                .conflicts(List.copyOf(conflicts))
                .resolutions(appliedResolutions)
                .entitiesExamined(examined)
                .entitiesMerged(merges)
                .fastForwards(plans.size() - merges)
                .pointersUpdated(updated)
                .skippedStale(skipped)
                .duration(Duration.ofNanos(stopwatch.elapsed(TimeUnit.NANOSECONDS)))
                .build();
        log.info("Synchronized {} in {}: {} examined, {} merged, {} fast forwarded, {} conflicts, {} skipped",
                 names, stopwatch, examined, merges, plans.size() - merges, conflicts.size(), skipped);
        return result;
    }

    private PointerEntry writeMerge(Entity entity,
                                    SortedSet<String> parents,
                                    Map<String, Revision> cache,
                                    Instant timestamp,
                                    boolean dryRun) {
        final var bytes = codec.toBytes(entity);
        final var contentHash = dryRun ? ContentDigests.digest(bytes) : contentStore.put(bytes);
        final var generation = parents.stream()
                .mapToLong(parent -> revisionLog.cached(parent, cache).getGeneration())
                .max()
                .orElse(0L) + 1;
        final var revision = Revision.builder()
                .entityType(entity.getEntityType())
                .entityId(entity.getId())
                .contentHash(contentHash)
                .parents(List.copyOf(parents))
                .generation(generation)
                .agent(entity.getAgent())
                .timestamp(timestamp)
                .build();
        final var revisionId = dryRun ? revisionLog.idOf(revision) : revisionLog.write(revision);
        return PointerEntry.of(contentHash, revisionId);
    }

    /**
     * Checks every relationship about to be moved against the union of all participating graphs. Offending
     * relationships are dropped from the plan and reported. They stay on the branches that already have them, so
     * they remain part of the graph the other candidates are checked against.
     */
    private void revalidateRelationships(Set<EntityRef> keys,
                                         Map<String, Map<EntityRef, PointerEntry>> snapshots,
                                         Map<EntityRef, Plan> plans,
                                         Set<EntityRef> unresolved,
                                         List<SyncConflict> conflicts) {
        final var planned = plans.entrySet()
                .stream()
                .filter(entry -> entry.getKey().getType().equals(EntityTypes.RELATIONSHIP))
                .filter(entry -> entry.getValue().entity() instanceof Relationship relationship
                        && relationship.live())
                .map(entry -> (Relationship) entry.getValue().entity())
                .toList();
        if (planned.isEmpty()) {
            return;
        }
        final var mergedGraph = new LinkedHashMap<String, Relationship>();
        for (final var key : keys) {
            if (!key.getType().equals(EntityTypes.RELATIONSHIP) || unresolved.contains(key)) {
                continue;
            }
            final var plan = plans.get(key);
            final var entity = plan != null ? plan.entity() : agreedVersion(key, snapshots);
            if (entity instanceof Relationship relationship) {
                mergedGraph.put(relationship.getId(), relationship);
            }
        }
        final var index = RelationshipIndex.build(0, mergedGraph.values());
        for (final var relationship : planned) {
            final var violation = violation(relationship, keys, index);
            if (violation == null) {
                continue;
            }
            log.info("Relationship {} not synchronized: {}", relationship.getId(), violation);
            plans.remove(relationship.ref());
            conflicts.add(SyncConflict.builder()
                                  .entityType(EntityTypes.RELATIONSHIP)
                                  .entityId(relationship.getId())
                                  .kind(ConflictKind.CONSTRAINT)
                                  .candidates(Map.of())
                                  .outcome(violation)
                                  .build());
        }
    }

    private String violation(Relationship relationship, Set<EntityRef> keys, RelationshipIndex index) {
        if (!keys.contains(relationship.getSource())) {
            return "source " + relationship.getSource() + " does not exist";
        }
        if (!keys.contains(relationship.getTarget())) {
            return "target " + relationship.getTarget() + " does not exist";
        }
        try {
            constraintChecker.check(relationship, index);
            return null;
        }
        catch (CyclePreventedException | LimitExceededException e) {
            return e.getMessage();
        }
    }

    private Entity agreedVersion(EntityRef key, Map<String, Map<EntityRef, PointerEntry>> snapshots) {
        return snapshots.values()
                .stream()
                .map(snapshot -> snapshot.get(key))
                .filter(Objects::nonNull)
                .findFirst()
                .map(entry -> codec.fromBytes(contentStore.get(entry.getContentHash())))
                .orElse(null);
    }

    private static Map<String, JsonNode> candidateStates(List<MergeCandidate> candidates) {
        final var states = new TreeMap<String, JsonNode>();
        candidates.forEach(candidate -> states.put(candidate.getBranch(),
                                                   TextNode.valueOf(candidate.getContentHash())));
        return states;
    }
}
