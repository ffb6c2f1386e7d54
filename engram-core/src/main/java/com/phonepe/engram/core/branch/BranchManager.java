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

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.phonepe.engram.core.errors.AlreadyExistsException;
import com.phonepe.engram.core.errors.InvalidInputException;
import com.phonepe.engram.core.errors.NotFoundException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Keeps one isolated line of history per agent. Every branch has its own pointer table; writes to one branch are
 * invisible to the others until they are synchronized.
 */
@Slf4j
public class BranchManager {
    public static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9._-]+");

    private final BranchStore branchStore;
    private final Clock clock;
    private volatile String active;

    public BranchManager(@NonNull BranchStore branchStore,
                         @NonNull String defaultBranch,
                         @NonNull String defaultOwner,
                         @NonNull Clock clock) {
        this.branchStore = branchStore;
        this.clock = clock;
        requireValidName(defaultBranch);
        if (branchStore.read(defaultBranch).isEmpty()) {
            branchStore.create(BranchHandle.builder()
                                       .name(defaultBranch)
                                       .owner(defaultOwner)
                                       .createdAt(clock.instant())
                                       .build(),
                               Map.of());
            log.info("Created default branch {}", defaultBranch);
        }
        this.active = branchStore.activeBranch()
                .filter(name -> branchStore.read(name).isPresent())
                .orElse(defaultBranch);
    }

    /**
     * Creates a branch starting from the current state of the active branch.
     */
    public BranchHandle createBranch(String name, String owner) {
        return createBranch(name, owner, null);
    }

    /**
     * Creates a branch starting from a copy of another branch's pointers.
     *
     * @param name  Name of the new branch
     * @param owner Agent owning the branch
     * @param from  Branch to start from, the active branch when null
     * @return Metadata of the new branch
     * @throws AlreadyExistsException if the name is taken
     * @throws NotFoundException      if {@code from} does not exist
     */
    public synchronized BranchHandle createBranch(String name, String owner, String from) {
        requireValidName(name);
        if (Strings.isNullOrEmpty(owner)) {
            throw new InvalidInputException("branch owner is required");
        }
        if (branchStore.read(name).isPresent()) {
            throw new AlreadyExistsException("branch " + name);
        }
        final var source = Strings.isNullOrEmpty(from) ? active : from;
        final var pointers = branchStore.pointers(source).snapshot();
        final var handle = BranchHandle.builder()
                .name(name)
                .owner(owner)
                .parent(source)
                .createdAt(clock.instant())
                .build();
        branchStore.create(handle, pointers);
        log.info("Created branch {} for {} from {} with {} entities", name, owner, source, pointers.size());
        return handle;
    }

    public synchronized BranchHandle switchTo(String name) {
        final var handle = require(name);
        branchStore.saveActiveBranch(name);
        active = name;
        log.info("Switched active branch to {}", name);
        return handle;
    }

    public BranchHandle active() {
        return require(active);
    }

    public String activeName() {
        return active;
    }

    public Optional<BranchHandle> find(String name) {
        return Strings.isNullOrEmpty(name) ? Optional.empty() : branchStore.read(name);
    }

    public BranchHandle require(String name) {
        return find(name).orElseThrow(() -> NotFoundException.branch(name));
    }

    public List<BranchHandle> list() {
        return branchStore.list();
    }

    /**
     * Deletes a branch. Objects it referenced stay in the content store.
     *
     * @throws InvalidInputException if the name is invalid or the branch is the active one
     */
    public synchronized boolean delete(String name) {
        requireValidName(name);
        if (name.equals(active)) {
            throw new InvalidInputException("cannot delete the active branch " + name);
        }
        final var deleted = branchStore.delete(name);
        if (deleted) {
            log.info("Deleted branch {}", name);
        }
        return deleted;
    }

    public PointerTable pointers(String name) {
        return branchStore.pointers(name);
    }

    private static void requireValidName(String name) {
        if (Strings.isNullOrEmpty(name)
                || !NAME_PATTERN.matcher(name).matches()
                || CharMatcher.is('.').matchesAllOf(name)) {
            throw new InvalidInputException("branch name '" + name + "' must match " + NAME_PATTERN.pattern());
        }
    }
}
