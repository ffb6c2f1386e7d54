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

package com.phonepe.engram.core.branch;

import com.phonepe.engram.core.entity.EntityRef;

import java.util.Map;
import java.util.Optional;

/**
 * Latest pointer per entity for one branch. Updates are compare-and-swap per key, so writers on different keys
 * never block each other.
 */
public interface PointerTable {

    String branch();

    Optional<PointerEntry> get(EntityRef ref);

    /**
     * Atomically replaces the pointer for a key.
     *
     * @param ref      Entity key
     * @param expected Pointer the caller last read, null if the caller saw no entity
     * @param update   New pointer
     * @return true if the pointer was swapped, false if it had moved since the caller read it
     */
    boolean compareAndSet(EntityRef ref, PointerEntry expected, PointerEntry update);

    /**
     * Point in time copy of the table in first insertion order
     */
    Map<EntityRef, PointerEntry> snapshot();

    /**
     * Counter bumped on every successful update. Used to invalidate derived caches.
     */
    long generation();

    int size();
}
