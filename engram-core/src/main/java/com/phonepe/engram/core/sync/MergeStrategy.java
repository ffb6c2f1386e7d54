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

package com.phonepe.engram.core.sync;

/**
 * Decides the merged state of one entity that diverged across branches
 */
public interface MergeStrategy {

    /**
     * Name used to select the strategy when synchronizing
     */
    String name();

    /**
     * @param context Ancestor and diverging candidates for one entity
     * @return The decision. Must not modify the states in the context.
     */
    MergeDecision merge(MergeContext context);
}
