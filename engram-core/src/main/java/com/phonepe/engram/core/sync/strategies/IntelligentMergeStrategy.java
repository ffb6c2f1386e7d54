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

package com.phonepe.engram.core.sync.strategies;

import com.phonepe.engram.core.sync.ConflictKind;
import com.phonepe.engram.core.sync.MergeContext;
import com.phonepe.engram.core.sync.MergeDecision;
import com.phonepe.engram.core.sync.MergeStrategy;
import com.phonepe.engram.core.sync.SyncConflict;

/**
 * Field level three way merge. Non overlapping changes are combined; overlapping ones are reported as field
 * conflicts and settled provisionally.
 */
public class IntelligentMergeStrategy implements MergeStrategy {
    public static final String NAME = "intelligent_merge";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public MergeDecision merge(MergeContext context) {
        final var ancestor = context.getAncestor();
        final var result = FieldMerger.merge(ancestor, context.getCandidates());
        final var outcome = ancestor != null
                            ? "kept common ancestor value"
                            : "kept value from latest candidate on " + context.latest().getBranch();
        final var conflicts = result.conflictingFields()
                .entrySet()
                .stream()
                .map(entry -> SyncConflict.builder()
                        .entityType(context.getRef().getType())
                        .entityId(context.getRef().getId())
                        .field(entry.getKey())
                        .kind(ConflictKind.FIELD)
                        .candidates(entry.getValue())
                        .ancestor(ancestor == null ? null : ancestor.get(entry.getKey()))
                        .outcome(outcome)
                        .build())
                .toList();
        return MergeDecision.resolved(result.merged(),
                                      null,
                                      conflicts,
                                      "merged %d field conflict(s)".formatted(conflicts.size()));
    }
}
