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

package com.phonepe.engram.core.transfer;

import com.phonepe.engram.core.branch.BranchManager;
import com.phonepe.engram.core.entity.EntityCodec;
import com.phonepe.engram.core.entity.EntityStore;
import com.phonepe.engram.core.entity.EntityTypes;
import com.phonepe.engram.core.errors.CyclePreventedException;
import com.phonepe.engram.core.errors.EntityValidationException;
import com.phonepe.engram.core.errors.InvalidInputException;
import com.phonepe.engram.core.errors.LimitExceededException;
import com.phonepe.engram.core.errors.StaleEntityException;
import com.phonepe.engram.core.graph.RelationshipGraph;
import com.phonepe.engram.core.graph.model.Relationship;
import com.phonepe.engram.core.store.ContentStore;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Bulk export and import of a branch's latest entities, used for backup and restore.
 * Imported entities go through the same validation as any other write; relationships are checked against the
 * graph's cycle and cardinality constraints.
 */
@Slf4j
public class EntityTransfer {
    private final EntityStore entities;
    private final RelationshipGraph graph;
    private final ContentStore contentStore;
    private final EntityCodec codec;
    private final BranchManager branches;
    private final Clock clock;

    @Builder
    public EntityTransfer(@NonNull EntityStore entities,
                          @NonNull RelationshipGraph graph,
                          @NonNull ContentStore contentStore,
                          @NonNull EntityCodec codec,
                          @NonNull BranchManager branches,
                          @NonNull Clock clock) {
        this.entities = entities;
        this.graph = graph;
        this.contentStore = contentStore;
        this.codec = codec;
        this.branches = branches;
        this.clock = clock;
    }

    /**
     * Exports the latest version of every entity on a branch.
     *
     * @param branch               Branch to export, the active branch when null
     * @param includeRelationships Whether relationship entities are exported
     * @param includeHistory       Whether the content hash history of each entity is included
     */
    public ExportBundle export(String branch, boolean includeRelationships, boolean includeHistory) {
        final var name = Objects.requireNonNullElse(branch, branches.activeName());
        final var exported = new ArrayList<ExportedEntity>();
        branches.pointers(name).snapshot().forEach((ref, pointer) -> {
            if (!includeRelationships && ref.getType().equals(EntityTypes.RELATIONSHIP)) {
                return;
            }
            exported.add(ExportedEntity.builder()
                                 .entityType(ref.getType())
                                 .entityId(ref.getId())
                                 .contentHash(pointer.getContentHash())
                                 .payload(codec.readTree(contentStore.get(pointer.getContentHash())))
                                 .history(includeHistory ? entities.history(name, ref) : null)
                                 .build());
        });
        log.info("Exported {} entities from {}", exported.size(), name);
        return ExportBundle.builder()
                .formatVersion(ExportBundle.FORMAT_VERSION)
                .branch(name)
                .exportedAt(clock.instant())
                .entities(List.copyOf(exported))
                .build();
    }

    public ImportReport importBundle(ExportBundle bundle, String agent) {
        return importBundle(bundle, branches.activeName(), agent);
    }

    /**
     * Writes every entity of a bundle to a branch. Plain entities are imported before relationships so that
     * relationship endpoints resolve. Entities that fail validation are reported and skipped.
     *
     * @param bundle Bundle produced by {@link #export(String, boolean, boolean)}
     * @param branch Branch to import into
     * @param agent  Agent recorded on entities that carry none
     */
    public ImportReport importBundle(@NonNull ExportBundle bundle, @NonNull String branch, String agent) {
        if (bundle.getFormatVersion() != ExportBundle.FORMAT_VERSION) {
            throw new InvalidInputException("unsupported export format version " + bundle.getFormatVersion());
        }
        branches.require(branch);
        final var ordered = new ArrayList<>(Objects.requireNonNullElse(bundle.getEntities(), List.of()));
        ordered.sort(Comparator.comparing(entry -> EntityTypes.RELATIONSHIP.equals(entry.getEntityType())));

        final var report = ImportReport.builder().branch(branch);
        var imported = 0;
        var unchanged = 0;
        for (final var entry : ordered) {
            try {
                if (null == entry.getPayload()) {
                    throw EntityValidationException.missing("payload");
                }
                final var payload = entry.getPayload().deepCopy();
                if (!payload.hasNonNull("agent") && agent != null) {
                    payload.put("agent", agent);
                }
                final var entity = codec.fromTree(payload);
                final var before = entities.pointer(branch, entity.ref()).orElse(null);
                final var contentHash = entity instanceof Relationship relationship
                                        ? graph.storeRelationship(branch, relationship)
                                        : entities.store(branch, entity);
                if (before != null && before.getContentHash().equals(contentHash)) {
                    unchanged++;
                }
                else {
                    imported++;
                }
            }
            catch (EntityValidationException e) {
                log.warn("Rejected {}/{} during import: {}", entry.getEntityType(), entry.getEntityId(),
                         e.getMessage());
                report.failure(new ImportReport.Failure(entry.getEntityType(), entry.getEntityId(), e.getField(),
                                                        e.getReason()));
            }
            catch (CyclePreventedException | LimitExceededException | StaleEntityException e) {
                log.warn("Could not import {}/{}: {}", entry.getEntityType(), entry.getEntityId(), e.getMessage());
                report.failure(new ImportReport.Failure(entry.getEntityType(), entry.getEntityId(), null,
                                                        e.getMessage()));
            }
        }
        log.info("Imported {} entities into {} ({} unchanged)", imported, branch, unchanged);
        return report.imported(imported).unchanged(unchanged).build();
    }
}
