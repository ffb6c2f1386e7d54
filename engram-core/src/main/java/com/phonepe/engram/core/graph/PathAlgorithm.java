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

package com.phonepe.engram.core.graph;

import com.phonepe.engram.core.errors.InvalidInputException;

import java.util.Arrays;
import java.util.Locale;

public enum PathAlgorithm {
    BFS,
    DFS,
    DIJKSTRA,
    ;

    public static PathAlgorithm fromName(String name) {
        if (name != null) {
            final var normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
            for (final var algorithm : values()) {
                if (algorithm.name().equals(normalized)) {
                    return algorithm;
                }
            }
        }
        throw new InvalidInputException("unknown path algorithm '" + name + "', expected one of "
                                                + Arrays.toString(values()));
    }
}
