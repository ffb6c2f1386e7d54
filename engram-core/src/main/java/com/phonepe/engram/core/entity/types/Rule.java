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

package com.phonepe.engram.core.entity.types;

import com.phonepe.engram.core.entity.Entity;
import com.phonepe.engram.core.entity.EntityTypes;
import com.phonepe.engram.core.entity.Validations;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Objects;

/**
 * Condition/action pair that agents are expected to follow
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Rule extends Entity {
    String title;
    String condition;
    String action;
    Integer priority;
    Boolean enabled;

    @Builder
    @Jacksonized
    public Rule(String id,
                String agent,
                Instant createdAt,
                Instant updatedAt,
                boolean archived,
                String title,
                String condition,
                String action,
                Integer priority,
                Boolean enabled) {
        super(EntityTypes.RULE, id, agent, createdAt, updatedAt, archived);
        this.title = title;
        this.condition = condition;
        this.action = action;
        this.priority = priority;
        this.enabled = Objects.requireNonNullElse(enabled, Boolean.TRUE);
    }

    @Override
    protected void validatePayload() {
        Validations.requireText("title", title);
        Validations.requireText("condition", condition);
        Validations.requireText("action", action);
    }
}
