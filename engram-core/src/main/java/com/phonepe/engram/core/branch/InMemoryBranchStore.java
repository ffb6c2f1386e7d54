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
import com.phonepe.engram.core.errors.AlreadyExistsException;
import com.phonepe.engram.core.errors.NotFoundException;
import lombok.NonNull;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

public class InMemoryBranchStore implements BranchStore {
    private record StoredBranch(BranchHandle handle, PointerTable pointers) {
    }

    private final Map<String, StoredBranch> branches = new ConcurrentHashMap<>();
    private final AtomicReference<String> active = new AtomicReference<>();

    @Override
    public PointerTable create(@NonNull BranchHandle handle, @NonNull Map<EntityRef, PointerEntry> initialPointers) {
        final var branch = new StoredBranch(handle, new InMemoryPointerTable(handle.getName(), initialPointers));
        if (branches.putIfAbsent(handle.getName(), branch) != null) {
            throw new AlreadyExistsException("branch " + handle.getName());
        }
        return branch.pointers();
    }

    @Override
    public Optional<BranchHandle> read(String name) {
        return Optional.ofNullable(branches.get(name)).map(StoredBranch::handle);
    }

    @Override
    public List<BranchHandle> list() {
        return branches.values()
                .stream()
                .map(StoredBranch::handle)
                .sorted(Comparator.comparing(BranchHandle::getName))
                .toList();
    }

    @Override
    public PointerTable pointers(String name) {
        final var branch = branches.get(name);
        if (null == branch) {
            throw NotFoundException.branch(name);
        }
        return branch.pointers();
    }

    @Override
    public boolean delete(String name) {
        return branches.remove(name) != null;
    }

    @Override
    public Optional<String> activeBranch() {
        return Optional.ofNullable(active.get());
    }

    @Override
    public void saveActiveBranch(String name) {
        active.set(name);
    }
}
