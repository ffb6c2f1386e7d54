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
import com.phonepe.engram.core.errors.EntityValidationException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of work tracked by an agent
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Task extends Entity {
    String title;
    String description;
    TaskStatus status;
    TaskPriority priority;
    String parent;
    List<String> tags;
    String outcome;
    Map<String, String> metadata;

    @Builder
    @Jacksonized
    public Task(String id,
                String agent,
                Instant createdAt,
                Instant updatedAt,
                boolean archived,
                String title,
                String description,
                TaskStatus status,
                TaskPriority priority,
                String parent,
                List<String> tags,
                String outcome,
                Map<String, String> metadata) {
        super(EntityTypes.TASK, id, agent, createdAt, updatedAt, archived);
        this.title = title;
        this.description = description;
        this.status = Objects.requireNonNullElse(status, TaskStatus.TODO);
        this.priority = Objects.requireNonNullElse(priority, TaskPriority.MEDIUM);
        this.parent = parent;
        this.tags = tags;
        this.outcome = outcome;
        this.metadata = metadata;
    }

    @Override
    protected void validatePayload() {
        Validations.requireText("title", title);
        if (parent != null) {
            Validations.requireIdentifier("parent", parent);
            if (parent.equals(getId())) {
                throw new EntityValidationException("parent", "a task cannot be its own parent");
            }
        }
    }
}
