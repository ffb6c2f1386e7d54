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

import java.util.List;

/**
 * Merges only when the changes do not overlap. Any disagreement is escalated as a whole entity conflict for a
 * human or agent to resolve, and every branch keeps its own version.
 */
public class ConflictReportingStrategy implements MergeStrategy {
    public static final String NAME = "merge_with_conflict_resolution";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public MergeDecision merge(MergeContext context) {
        final var result = FieldMerger.merge(context.getAncestor(), context.getCandidates());
        if (result.clean()) {
            return MergeDecision.resolved(result.merged(), null, List.of(), "changes did not overlap");
        }
        final var fields = String.join(", ", result.conflictingFields().keySet());
        return MergeDecision.escalated(
                List.of(SyncConflict.builder()
                                .entityType(context.getRef().getType())
                                .entityId(context.getRef().getId())
                                .kind(ConflictKind.ENTITY)
                                .candidates(FieldMerger.statesByBranch(context.getCandidates()))
                                .ancestor(context.getAncestor())
                                .outcome("not merged, conflicting fields: " + fields)
                                .build()),
                "conflicting fields: " + fields);
    }
}
