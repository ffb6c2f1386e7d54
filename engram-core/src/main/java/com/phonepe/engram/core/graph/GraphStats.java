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

import com.phonepe.engram.core.entity.EntityRef;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class GraphStats {
    long relationshipCount;
    long entityCount;
    Map<String, Long> byType;
    EntityRef mostConnected;
    long mostConnectedDegree;
    /**
     * edges / (nodes * (nodes - 1)), zero for fewer than two nodes
     */
    double density;
    long bidirectionalCount;
    double averageConnections;
}
