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
 * The most recently updated version wins as a whole. Never reports conflicts.
 */
public class LatestWinsStrategy implements MergeStrategy {
    public static final String NAME = "latest_wins";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public MergeDecision merge(MergeContext context) {
        final var latest = context.latest();
        return MergeDecision.resolved(latest.getState(),
                                      latest.getBranch(),
                                      List.of(),
                                      "latest update at " + latest.updatedAt() + " on " + latest.getBranch());
    }
}
