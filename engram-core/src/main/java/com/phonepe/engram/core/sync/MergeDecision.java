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

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a strategy for one entity. Either a merged state to apply, possibly with conflicts that were settled
 * provisionally, or an escalation that leaves every branch as it is.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MergeDecision {
    ObjectNode merged;
    String winner;
    List<SyncConflict> conflicts;
    String detail;

    public static MergeDecision resolved(ObjectNode merged, String winner, List<SyncConflict> conflicts,
                                         String detail) {
        return new MergeDecision(merged, winner, List.copyOf(conflicts), detail);
    }

    public static MergeDecision escalated(List<SyncConflict> conflicts, String detail) {
        return new MergeDecision(null, null, List.copyOf(conflicts), detail);
    }

    public boolean escalated() {
        return merged == null;
    }
}
