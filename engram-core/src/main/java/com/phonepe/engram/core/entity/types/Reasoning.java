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
import java.util.List;

/**
 * Chain of thought recorded against a task
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Reasoning extends Entity {
    String taskId;
    String title;
    List<String> steps;
    String conclusion;
    Double confidence;

    @Builder
    @Jacksonized
    public Reasoning(String id,
                     String agent,
                     Instant createdAt,
                     Instant updatedAt,
                     boolean archived,
                     String taskId,
                     String title,
                     List<String> steps,
                     String conclusion,
                     Double confidence) {
        super(EntityTypes.REASONING, id, agent, createdAt, updatedAt, archived);
        this.taskId = taskId;
        this.title = title;
        this.steps = steps;
        this.conclusion = conclusion;
        this.confidence = confidence;
    }

    @Override
    protected void validatePayload() {
        Validations.requireIdentifier("taskId", taskId);
        Validations.requireText("title", title);
        Validations.requireFraction("confidence", confidence);
    }
}
