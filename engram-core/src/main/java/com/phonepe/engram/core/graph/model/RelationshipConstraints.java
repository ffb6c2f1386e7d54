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

package com.phonepe.engram.core.graph.model;

import com.phonepe.engram.core.entity.EntityRef;
import com.phonepe.engram.core.errors.EntityValidationException;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;

/**
 * Rules checked against the existing graph when an edge is created. They are not re-applied to edges that already
 * exist.
 */
@Value
@Builder
@With
@Jacksonized
public class RelationshipConstraints {
    public static final RelationshipConstraints DEFAULT = RelationshipConstraints.builder().build();

    Boolean allowCycles;
    CycleScope cycleScope;
    Integer maxOutbound;
    Integer maxInbound;
    List<String> sourceTypes;
    List<String> targetTypes;

    public boolean cyclesAllowed() {
        return !Boolean.FALSE.equals(allowCycles);
    }

    public CycleScope effectiveCycleScope(CycleScope fallback) {
        return Objects.requireNonNullElse(cycleScope, fallback);
    }

    void validate(EntityRef source, EntityRef target) {
        if (maxOutbound != null && maxOutbound < 0) {
            throw new EntityValidationException("constraints", "maxOutbound must not be negative");
        }
        if (maxInbound != null && maxInbound < 0) {
            throw new EntityValidationException("constraints", "maxInbound must not be negative");
        }
        if (sourceTypes != null && !sourceTypes.isEmpty() && !sourceTypes.contains(source.getType())) {
            throw new EntityValidationException("source",
                                                "type '%s' is not one of %s".formatted(source.getType(), sourceTypes));
        }
        if (targetTypes != null && !targetTypes.isEmpty() && !targetTypes.contains(target.getType())) {
            throw new EntityValidationException("target",
                                                "type '%s' is not one of %s".formatted(target.getType(), targetTypes));
        }
    }
}
