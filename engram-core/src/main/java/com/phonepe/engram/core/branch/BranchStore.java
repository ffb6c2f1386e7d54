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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence for branch metadata and pointer tables
 */
public interface BranchStore {

    /**
     * Creates a branch with a copy of the given pointers.
     *
     * @param handle          Branch metadata
     * @param initialPointers Pointers the branch starts with
     * @return The pointer table of the new branch
     * @throws com.phonepe.engram.core.errors.AlreadyExistsException if a branch with the name exists
     */
    PointerTable create(BranchHandle handle, Map<EntityRef, PointerEntry> initialPointers);

    Optional<BranchHandle> read(String name);

    /**
     * All branches ordered by name
     */
    List<BranchHandle> list();

    /**
     * @throws com.phonepe.engram.core.errors.NotFoundException if the branch does not exist
     */
    PointerTable pointers(String name);

    boolean delete(String name);

    Optional<String> activeBranch();

    void saveActiveBranch(String name);
}
