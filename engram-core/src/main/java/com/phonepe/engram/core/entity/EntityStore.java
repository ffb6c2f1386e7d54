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

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phonepe.engram.core.branch.BranchManager;
import com.phonepe.engram.core.branch.PointerEntry;
import com.phonepe.engram.core.branch.PointerTable;
import com.phonepe.engram.core.config.EngramSetup;
import com.phonepe.engram.core.errors.EntityValidationException;
import com.phonepe.engram.core.errors.NotFoundException;
import com.phonepe.engram.core.errors.StaleEntityException;
import com.phonepe.engram.core.graph.model.Relationship;
import com.phonepe.engram.core.history.Revision;
import com.phonepe.engram.core.history.RevisionLog;
import com.phonepe.engram.core.store.ContentStore;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Entity layer. Serializes entities canonically, stores them in the content store, records a revision per change
 * and moves the per branch latest pointer with compare-and-swap.
 * Operations without an explicit branch work on the active branch.
 */
@Slf4j
public class EntityStore {
    private final ContentStore contentStore;
    private final EntityCodec codec;
    private final RevisionLog revisionLog;
    private final BranchManager branches;
    private final EngramSetup setup;
    private final Clock clock;

    @Builder
    public EntityStore(@NonNull ContentStore contentStore,
                       @NonNull EntityCodec codec,
                       @NonNull RevisionLog revisionLog,
                       @NonNull BranchManager branches,
                       @NonNull EngramSetup setup,
                       @NonNull Clock clock) {
        this.contentStore = contentStore;
        this.codec = codec;
        this.revisionLog = revisionLog;
        this.branches = branches;
        this.setup = setup;
        this.clock = clock;
    }

    /**
     * Stores a new version of the entity on the active branch.
     *
     * @param entity Entity to store. Missing agent and timestamps are filled in.
     * @return Content hash of the stored version
     * @throws EntityValidationException if the entity is invalid
     * @throws StaleEntityException      if concurrent writers kept winning for every retry
     */
    public String store(Entity entity) {
        return store(branches.activeName(), entity);
    }

    public String store(String branch, Entity entity) {
        return write(branch, entity, false, null);
    }

    /**
     * Stores the entity only if its current content hash on the active branch is the expected one.
     *
     * @param entity              Entity to store
     * @param expectedContentHash Hash the caller last read, null if the entity must not exist yet
     * @return Content hash of the stored version
     * @throws StaleEntityException if the entity changed since the caller read it
     */
    public String compareAndStore(Entity entity, String expectedContentHash) {
        return compareAndStore(branches.activeName(), entity, expectedContentHash);
    }

    public String compareAndStore(String branch, Entity entity, String expectedContentHash) {
        return write(branch, entity, true, expectedContentHash);
    }

    public Entity get(String type, String id) {
        return get(branches.activeName(), EntityRef.of(type, id));
    }

    public Entity get(String branch, EntityRef ref) {
        return find(branch, ref).orElseThrow(() -> NotFoundException.entity(ref));
    }

    public <T extends Entity> T get(String branch, EntityRef ref, Class<T> type) {
        final var entity = get(branch, ref);
        if (!type.isInstance(entity)) {
            throw new EntityValidationException("entityType",
                                                "%s is a %s, not a %s".formatted(ref,
                                                                                 entity.getClass().getSimpleName(),
                                                                                 type.getSimpleName()));
        }
        return type.cast(entity);
    }

    public Optional<Entity> find(String type, String id) {
        return find(branches.activeName(), EntityRef.of(type, id));
    }

    public Optional<Entity> find(String branch, EntityRef ref) {
        return branches.pointers(branch)
                .get(ref)
                .map(pointer -> getVersion(pointer.getContentHash()));
    }

    public boolean exists(String branch, EntityRef ref) {
        return branches.pointers(branch).get(ref).isPresent();
    }

    public boolean exists(String type, String id) {
        return exists(branches.activeName(), EntityRef.of(type, id));
    }

    /**
     * Reads any stored version by content hash, regardless of branch
     */
    public Entity getVersion(String contentHash) {
        return codec.fromBytes(contentStore.get(contentHash));
    }

    public List<Entity> list(String type) {
        return list(branches.activeName(), type);
    }

    /**
     * Entities of one type on a branch, in first insertion order
     */
    public List<Entity> list(String branch, String type) {
        return branches.pointers(branch)
                .snapshot()
                .entrySet()
                .stream()
                .filter(e -> e.getKey().getType().equals(type))
                .map(e -> getVersion(e.getValue().getContentHash()))
                .toList();
    }

    public <T extends Entity> List<T> list(String branch, String type, Class<T> entityClass) {
        return list(branch, type).stream()
                .filter(entityClass::isInstance)
                .map(entityClass::cast)
                .toList();
    }

    public List<EntityRef> keys() {
        return keys(branches.activeName());
    }

    public List<EntityRef> keys(String branch) {
        return List.copyOf(branches.pointers(branch).snapshot().keySet());
    }

    /**
     * Soft deletes an entity by storing a version marked as archived.
     */
    public String archive(String type, String id, String agent) {
        return modify(branches.activeName(), EntityRef.of(type, id), agent, tree -> tree.put("archived", true));
    }

    /**
     * Applies a change to the JSON form of the latest version and stores the result conditionally on that version.
     */
    public String modify(String branch, EntityRef ref, String agent, Consumer<ObjectNode> mutation) {
        final var current = pointer(branch, ref).orElseThrow(() -> NotFoundException.entity(ref));
        final var tree = codec.readTree(contentStore.get(current.getContentHash()));
        mutation.accept(tree);
        tree.put("agent", Objects.requireNonNullElse(agent, setup.getDefaultAgent()));
        tree.put("updatedAt", clock.instant().toString());
        return compareAndStore(branch, codec.fromTree(tree), current.getContentHash());
    }

    public List<String> history(String type, String id) {
        return history(branches.activeName(), EntityRef.of(type, id));
    }

    /**
     * Content hashes of every version along the first parent chain, oldest first.
     */
    public List<String> history(String branch, EntityRef ref) {
        return revisions(branch, ref).stream()
                .map(Revision::getContentHash)
                .toList();
    }

    public List<Revision> revisions(String type, String id) {
        return revisions(branches.activeName(), EntityRef.of(type, id));
    }

    public List<Revision> revisions(String branch, EntityRef ref) {
        final var head = pointer(branch, ref).orElseThrow(() -> NotFoundException.entity(ref));
        return revisionLog.firstParentChain(head.getRevisionId());
    }

    public Optional<PointerEntry> pointer(String branch, EntityRef ref) {
        return branches.pointers(branch).get(ref);
    }

    public long generation(String branch) {
        return branches.pointers(branch).generation();
    }

    /**
     * Fills in the agent and timestamps the way a write would and validates the result without storing anything.
     *
     * @throws EntityValidationException if the entity is invalid or, for a relationship, an endpoint is missing
     */
    public Entity prepare(String branch, Entity entity) {
        return normalize(branches.pointers(branch), entity);
    }

    private String write(String branch, Entity entity, boolean conditional, String expected) {
        final var table = branches.pointers(branch);
        final var normalized = normalize(table, entity);
        final var ref = normalized.ref();
        final var contentHash = contentStore.put(codec.toBytes(normalized));
        for (int attempt = 1; ; attempt++) {
            final var current = table.get(ref).orElse(null);
            final var currentHash = current == null ? null : current.getContentHash();
            if (conditional && !Objects.equals(currentHash, expected)) {
                throw new StaleEntityException(ref.toString(), expected, currentHash);
            }
            if (contentHash.equals(currentHash)) {
                log.debug("{} on {} is unchanged at {}", ref, branch, contentHash);
                return contentHash;
            }
            final var revisionId = revisionLog.write(nextRevision(branch, normalized, contentHash, current));
            if (table.compareAndSet(ref, current, PointerEntry.of(contentHash, revisionId))) {
                log.debug("Stored {} on {} as {} (revision {})", ref, branch, contentHash, revisionId);
                return contentHash;
            }
            if (conditional || attempt >= setup.getMaxStoreRetries()) {
                final var latest = table.get(ref).map(PointerEntry::getContentHash).orElse(null);
                throw new StaleEntityException(ref.toString(), currentHash, latest);
            }
            log.debug("Lost pointer race for {} on {}, attempt {}", ref, branch, attempt);
        }
    }

    private Revision nextRevision(String branch, Entity entity, String contentHash, PointerEntry current) {
        final var parent = current == null ? null : revisionLog.read(current.getRevisionId());
        return Revision.builder()
                .entityType(entity.getEntityType())
                .entityId(entity.getId())
                .contentHash(contentHash)
                .parents(parent == null ? List.of() : List.of(current.getRevisionId()))
                .generation(parent == null ? 1 : parent.getGeneration() + 1)
                .agent(entity.getAgent())
                .branch(branch)
                .timestamp(clock.instant())
                .build();
    }

    /**
     * Fills in the agent and timestamps, then validates. Nothing has been written when this throws.
     */
    private Entity normalize(PointerTable table, @NonNull Entity entity) {
        final var tree = codec.toTree(entity);
        final var now = clock.instant();
        if (!tree.hasNonNull("agent")) {
            tree.put("agent", setup.getDefaultAgent());
        }
        if (!tree.hasNonNull("createdAt")) {
            final var existingCreatedAt = existingCreatedAt(table, entity);
            tree.put("createdAt", existingCreatedAt.orElse(now.toString()));
        }
        if (!tree.hasNonNull("updatedAt")) {
            tree.put("updatedAt", now.toString());
        }
        final var normalized = codec.fromTree(tree);
        normalized.validate();
        if (normalized instanceof Relationship relationship) {
            requireEndpoint(table, "source", relationship.getSource());
            requireEndpoint(table, "target", relationship.getTarget());
        }
        return normalized;
    }

    private static void requireEndpoint(PointerTable table, String field, EntityRef ref) {
        if (table.get(ref).isEmpty()) {
            throw new EntityValidationException(field, ref + " does not exist on branch " + table.branch());
        }
    }

    private Optional<String> existingCreatedAt(PointerTable table, Entity entity) {
        if (entity.getEntityType() == null || entity.getId() == null) {
            return Optional.empty();
        }
        return table.get(entity.ref())
                .map(pointer -> codec.readTree(contentStore.get(pointer.getContentHash())))
                .map(tree -> tree.path("createdAt").asText(null));
    }
}
