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
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * A disagreement found while synchronizing. {@code field} is null for whole entity conflicts. {@code candidates}
 * maps branch name to the value seen on that branch.
 */
@Value
@Builder
@Jacksonized
public class SyncConflict {
    String entityType;
    String entityId;
    String field;
    ConflictKind kind;
    Map<String, JsonNode> candidates;
    JsonNode ancestor;
    String outcome;
}
