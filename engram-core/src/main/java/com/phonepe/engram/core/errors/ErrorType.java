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

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Failure categories raised by the store. Retryable errors are expected to succeed when the caller re-reads state
 * and tries again.
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    NOT_FOUND("Not found: %s", false),
    VALIDATION_ERROR("Validation failed for field '%s': %s", false),
    STALE("Stale write for %s. Expected version %s but found %s", true),
    CYCLE_PREVENTED("Relationship %s from %s to %s would create a cycle", false),
    LIMIT_EXCEEDED("Limit exceeded: %s", false),
    ALREADY_EXISTS("Already exists: %s", false),
    INVALID_INPUT("Invalid input: %s", false),
    UNKNOWN_STRATEGY("Unknown merge strategy '%s'. Valid options: %s", false),
    STORAGE_FAILURE("Storage operation failed: %s", true),
    SERIALIZATION_ERROR("Error serializing object to JSON. Error: %s", false),
    ;

    private final String message;
    private final boolean retryable;
}
