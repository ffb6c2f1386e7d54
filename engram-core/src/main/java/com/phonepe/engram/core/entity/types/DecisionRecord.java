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
import java.util.Objects;

/**
 * Architecture decision record
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class DecisionRecord extends Entity {
    public enum Status {
        PROPOSED,
        ACCEPTED,
        DEPRECATED,
        SUPERSEDED
    }

    Integer number;
    String title;
    Status status;
    String context;
    String decision;
    List<String> consequences;
    String supersededBy;

    @Builder
    @Jacksonized
    public DecisionRecord(String id,
                          String agent,
                          Instant createdAt,
                          Instant updatedAt,
                          boolean archived,
                          Integer number,
                          String title,
                          Status status,
                          String context,
                          String decision,
                          List<String> consequences,
                          String supersededBy) {
        super(EntityTypes.ADR, id, agent, createdAt, updatedAt, archived);
        this.number = number;
        this.title = title;
        this.status = Objects.requireNonNullElse(status, Status.PROPOSED);
        this.context = context;
        this.decision = decision;
        this.consequences = consequences;
        this.supersededBy = supersededBy;
    }

    @Override
    protected void validatePayload() {
        Validations.requireText("title", title);
        Validations.requireText("decision", decision);
        if (number != null && number <= 0) {
            throw new EntityValidationException("number", "must be positive");
        }
        if (status == Status.SUPERSEDED) {
            Validations.requireIdentifier("supersededBy", supersededBy);
        }
    }
}
