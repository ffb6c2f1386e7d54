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
 * The latest pointer moved between read and compare-and-swap
 */
@Getter
public class StaleEntityException extends EngramException {
    private final String key;
    private final String expected;
    private final String actual;

    public StaleEntityException(String key, String expected, String actual) {
        super(ErrorType.STALE, ErrorType.STALE.getMessage().formatted(key, describe(expected), describe(actual)));
        this.key = key;
        this.expected = expected;
        this.actual = actual;
    }

    private static String describe(String hash) {
        return hash == null ? "<absent>" : hash;
    }
}
