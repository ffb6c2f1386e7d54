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

package com.phonepe.engram.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.engram.core.branch.BranchHandle;
import com.phonepe.engram.core.branch.BranchManager;
import com.phonepe.engram.core.branch.BranchStore;
import com.phonepe.engram.core.branch.InMemoryBranchStore;
import com.phonepe.engram.core.config.EngramSetup;
import com.phonepe.engram.core.entity.Entity;
import com.phonepe.engram.core.entity.EntityCodec;
import com.phonepe.engram.core.entity.EntityRef;
import com.phonepe.engram.core.entity.EntityStore;
import com.phonepe.engram.core.entity.EntityTypeRegistry;
import com.phonepe.engram.core.graph.CreateRelationshipRequest;
import com.phonepe.engram.core.graph.EntityPath;
import com.phonepe.engram.core.graph.PathAlgorithm;
import com.phonepe.engram.core.graph.RelationshipGraph;
import com.phonepe.engram.core.graph.model.Relationship;
import com.phonepe.engram.core.history.RevisionLog;
import com.phonepe.engram.core.store.ContentStore;
import com.phonepe.engram.core.store.InMemoryContentStore;
import com.phonepe.engram.core.sync.MergeStrategies;
import com.phonepe.engram.core.sync.SyncEngine;
import com.phonepe.engram.core.sync.SyncResult;
import com.phonepe.engram.core.transfer.EntityTransfer;
import com.phonepe.engram.core.utils.JsonUtils;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point. Wires the content store, entity layer, branches, relationship graph and synchronization engine
 * over a pair of storage backends.
 */
@Slf4j
@Getter
public class Engram {
    private final EngramSetup setup;
    private final ObjectMapper mapper;
    private final ContentStore contentStore;
    private final EntityTypeRegistry typeRegistry;
    private final EntityCodec codec;
    private final RevisionLog revisionLog;
    private final BranchManager branches;
    private final EntityStore entities;
    private final RelationshipGraph graph;
    private final MergeStrategies mergeStrategies;
    private final SyncEngine syncEngine;
    private final EntityTransfer transfer;

    @Builder
    public Engram(EngramSetup setup,
                  ObjectMapper mapper,
                  @NonNull ContentStore contentStore,
                  @NonNull BranchStore branchStore,
                  Clock clock,
                  Set<String> customEntityTypes) {
        this.setup = Objects.requireNonNullElseGet(setup, EngramSetup::defaults);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        final var effectiveClock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.contentStore = contentStore;
        this.typeRegistry = new EntityTypeRegistry();
        Objects.requireNonNullElse(customEntityTypes, Set.<String>of()).forEach(typeRegistry::registerCustomType);
        this.codec = new EntityCodec(this.mapper, typeRegistry);
        this.revisionLog = new RevisionLog(contentStore, codec);
        this.branches = new BranchManager(branchStore,
                                          this.setup.getDefaultBranch(),
                                          this.setup.getDefaultAgent(),
                                          effectiveClock);
        this.entities = EntityStore.builder()
                .contentStore(contentStore)
                .codec(codec)
                .revisionLog(revisionLog)
                .branches(branches)
                .setup(this.setup)
                .clock(effectiveClock)
                .build();
        this.graph = RelationshipGraph.builder()
                .entities(entities)
                .branches(branches)
                .setup(this.setup)
                .clock(effectiveClock)
                .build();
        this.mergeStrategies = new MergeStrategies();
        this.syncEngine = SyncEngine.builder()
                .contentStore(contentStore)
                .codec(codec)
                .revisionLog(revisionLog)
                .branches(branches)
                .strategies(mergeStrategies)
                .setup(this.setup)
                .clock(effectiveClock)
                .build();
        this.transfer = EntityTransfer.builder()
                .entities(entities)
                .graph(graph)
                .contentStore(contentStore)
                .codec(codec)
                .branches(branches)
                .clock(effectiveClock)
                .build();
        log.info("Engram started on branch {}", branches.activeName());
    }

    /**
     * Heap only instance
     */
    public static Engram inMemory() {
        return inMemory(EngramSetup.defaults());
    }

    public static Engram inMemory(EngramSetup setup) {
        return Engram.builder()
                .setup(setup)
                .contentStore(new InMemoryContentStore())
                .branchStore(new InMemoryBranchStore())
                .build();
    }

    /**
     * Stores an entity on the active branch. Relationships go through the graph so their constraints are enforced.
     */
    public String store(Entity entity) {
        if (entity instanceof Relationship relationship) {
            return graph.storeRelationship(branches.activeName(), relationship);
        }
        return entities.store(entity);
    }

    public Entity get(String type, String id) {
        return entities.get(type, id);
    }

    public Optional<Entity> find(String type, String id) {
        return entities.find(type, id);
    }

    public String createRelationship(CreateRelationshipRequest request) {
        return graph.createRelationship(request);
    }

    public Optional<EntityPath> findPath(EntityRef source, EntityRef target, PathAlgorithm algorithm) {
        return graph.findPath(source, target, algorithm);
    }

    public BranchHandle createBranch(String name, String owner) {
        return branches.createBranch(name, owner);
    }

    public BranchHandle switchBranch(String name) {
        return branches.switchTo(name);
    }

    public boolean deleteBranch(String name) {
        final var deleted = branches.delete(name);
        graph.invalidate(name);
        return deleted;
    }

    public SyncResult sync(Collection<String> branchNames, String strategy) {
        return syncEngine.sync(branchNames, strategy);
    }

    public void registerEntityType(String name) {
        typeRegistry.registerCustomType(name);
    }
}
