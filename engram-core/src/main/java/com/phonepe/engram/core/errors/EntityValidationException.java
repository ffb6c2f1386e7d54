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

package com.phonepe.engram.core.errors;

import lombok.Getter;

/**
 * An entity failed validation. Nothing is persisted when this is thrown.
 */
@Getter
public class EntityValidationException extends EngramException {
    private final String field;
    private final String reason;

    public EntityValidationException(String field, String reason) {
        this(field, reason, null);
    }

    public EntityValidationException(String field, String reason, Throwable cause) {
        super(ErrorType.VALIDATION_ERROR, ErrorType.VALIDATION_ERROR.getMessage().formatted(field, reason), cause);
        this.field = field;
        this.reason = reason;
    }

    public static EntityValidationException missing(String field) {
        return new EntityValidationException(field, "is required");
    }
}
