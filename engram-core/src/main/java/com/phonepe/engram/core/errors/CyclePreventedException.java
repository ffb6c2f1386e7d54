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

@Getter
public class CyclePreventedException extends EngramException {
    private final String source;
    private final String target;
    private final String relationshipType;

    public CyclePreventedException(String relationshipType, String source, String target) {
        super(ErrorType.CYCLE_PREVENTED,
              ErrorType.CYCLE_PREVENTED.getMessage().formatted(relationshipType, source, target));
        this.source = source;
        this.target = target;
        this.relationshipType = relationshipType;
    }
}
