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

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.phonepe.engram.core.entity.Entity;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Carrier for entity types registered at runtime. The payload is free form.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonTypeInfo(use = JsonTypeInfo.Id.NONE)
public class CustomEntity extends Entity {
    Map<String, Object> data;

    @Builder
    @Jacksonized
    public CustomEntity(String entityType,
                        String id,
                        String agent,
                        Instant createdAt,
                        Instant updatedAt,
                        boolean archived,
                        Map<String, Object> data) {
        super(entityType, id, agent, createdAt, updatedAt, archived);
        this.data = data;
    }

    @Override
    protected void validatePayload() {
        // free form
    }
}
