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
import lombok.Value;

import java.util.List;

/**
 * A path through the graph. {@code cost} is the hop count for BFS and DFS and the summed strength cost for
 * Dijkstra.
 */
@Value
public class EntityPath {
    List<EntityRef> entities;
    List<String> relationshipIds;
    long cost;
    PathAlgorithm algorithm;

    public int length() {
        return relationshipIds.size();
    }
}
