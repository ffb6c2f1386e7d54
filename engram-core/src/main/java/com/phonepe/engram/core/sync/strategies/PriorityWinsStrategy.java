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

package com.phonepe.engram.core.sync.strategies;

import com.phonepe.engram.core.sync.MergeContext;
import com.phonepe.engram.core.sync.MergeDecision;
import com.phonepe.engram.core.sync.MergeStrategy;

import java.util.List;

/**
 * The version from a branch owned by the preferred agent wins. Falls back to the latest version when that agent
 * did not change the entity.
 */
public class PriorityWinsStrategy implements MergeStrategy {
    public static final String PREFIX = "priority_wins";

    private final String agent;

    public PriorityWinsStrategy(String agent) {
        this.agent = agent;
    }

    @Override
    public String name() {
        return PREFIX + ":" + agent;
    }

    @Override
    public MergeDecision merge(MergeContext context) {
        return context.getCandidates()
                .stream()
                .filter(candidate -> agent.equals(candidate.getOwner()))
                .findFirst()
                .map(candidate -> MergeDecision.resolved(candidate.getState(),
                                                         candidate.getBranch(),
                                                         List.of(),
                                                         "preferred agent " + agent))
                .orElseGet(() -> {
                    final var latest = context.latest();
                    return MergeDecision.resolved(latest.getState(),
                                                  latest.getBranch(),
                                                  List.of(),
                                                  agent + " did not change it, latest update on "
                                                          + latest.getBranch());
                });
    }
}
