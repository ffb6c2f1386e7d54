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
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Comparator;

/**
 * Version of an entity on one branch that differs from the merge base
 */
@Value
@Builder
public class MergeCandidate {
    /**
     * Most recently updated first, ties going to the smallest branch name
     */
    public static final Comparator<MergeCandidate> LATEST_FIRST = Comparator
            .comparing(MergeCandidate::updatedAt).reversed()
            .thenComparing(MergeCandidate::getBranch);

    String branch;
    String owner;
    String revisionId;
    String contentHash;
    ObjectNode state;

    public Instant updatedAt() {
        final var value = state.path("updatedAt").asText(null);
        if (null == value) {
            return Instant.EPOCH;
        }
        try {
            return Instant.parse(value);
        }
        catch (DateTimeParseException e) {
            return Instant.EPOCH;
        }
    }
}
