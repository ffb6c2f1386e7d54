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

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Strength of a link. Stronger links are cheaper to traverse when searching for weighted paths.
 */
@Getter
@AllArgsConstructor
public enum RelationshipStrength {
    WEAK(0.25, 4),
    MEDIUM(0.5, 3),
    STRONG(0.75, 2),
    CRITICAL(1.0, 1),
    ;

    private final double weight;
    private final int cost;
}
