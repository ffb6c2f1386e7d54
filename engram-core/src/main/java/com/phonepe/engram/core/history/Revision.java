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

package com.phonepe.engram.core.history;

import com.phonepe.engram.core.entity.EntityRef;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Links one version of an entity to the version(s) it was derived from. Revisions are content addressed, so the
 * identifier of a revision also covers its whole ancestry.
 */
@Value
@Builder
@Jacksonized
public class Revision {
    String entityType;
    String entityId;
    String contentHash;
    List<String> parents;
    long generation;
    String agent;
    String branch;
    Instant timestamp;

    public EntityRef ref() {
        return EntityRef.of(entityType, entityId);
    }

    public Optional<String> firstParent() {
        return parents == null || parents.isEmpty() ? Optional.empty() : Optional.of(parents.get(0));
    }

    public List<String> parentIds() {
        return parents == null ? List.of() : parents;
    }
}
