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
import com.phonepe.engram.core.entity.EntityRef;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Input to a {@link MergeStrategy}: the common ancestor (null when the branches created the entity independently)
 * and at least two candidates with different content, ordered by branch name.
 */
@Value
@Builder
public class MergeContext {
    EntityRef ref;
    ObjectNode ancestor;
    List<MergeCandidate> candidates;

    public MergeCandidate latest() {
        return candidates.stream()
                .min(MergeCandidate.LATEST_FIRST)
                .orElseThrow();
    }
}
