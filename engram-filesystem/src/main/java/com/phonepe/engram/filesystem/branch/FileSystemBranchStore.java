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

package com.phonepe.engram.filesystem.branch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.engram.core.branch.BranchHandle;
import com.phonepe.engram.core.branch.BranchStore;
import com.phonepe.engram.core.branch.PointerEntry;
import com.phonepe.engram.core.branch.PointerTable;
import com.phonepe.engram.core.entity.EntityRef;
import com.phonepe.engram.core.errors.AlreadyExistsException;
import com.phonepe.engram.core.errors.InvalidInputException;
import com.phonepe.engram.core.errors.NotFoundException;
import com.phonepe.engram.core.errors.StorageException;
import com.phonepe.engram.core.utils.JsonUtils;
import com.phonepe.engram.filesystem.utils.FileUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Branches on disk:
 * <pre>
 * branches/&lt;name&gt;/branch.json     branch metadata, written last when a branch is created
 * branches/&lt;name&gt;/pointers.jsonl  pointer journal
 * active-branch                   name of the active branch
 * </pre>
 * Pointer tables are loaded lazily and cached for the lifetime of the store.
 */
@Slf4j
public class FileSystemBranchStore implements BranchStore {
    private static final String BRANCHES_DIR = "branches";
    private static final String METADATA_FILE = "branch.json";
    private static final String JOURNAL_FILE = "pointers.jsonl";
    private static final String ACTIVE_BRANCH_FILE = "active-branch";

    private final Path baseDir;
    private final Path branchesRoot;
    private final ObjectMapper mapper;
    private final Map<String, FileSystemPointerTable> tables = new ConcurrentHashMap<>();

    @Builder
    public FileSystemBranchStore(@NonNull Path baseDir, ObjectMapper mapper) {
        this.baseDir = FileUtils.ensurePath(baseDir, true, true);
        this.branchesRoot = FileUtils.ensurePath(this.baseDir.resolve(BRANCHES_DIR), true, true);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
    }

    @Override
    public synchronized PointerTable create(@NonNull BranchHandle handle,
                                            @NonNull Map<EntityRef, PointerEntry> initialPointers) {
        final var name = handle.getName();
        final var branchDir = branchDir(name);
        if (Files.exists(branchDir.resolve(METADATA_FILE))) {
            throw new AlreadyExistsException("branch " + name);
        }
        FileUtils.ensurePath(branchDir, true, true);
        final var table = FileSystemPointerTable.create(name, branchDir.resolve(JOURNAL_FILE), mapper, initialPointers);
        FileUtils.writeAtomically(branchDir.resolve(METADATA_FILE), toBytes(handle));
        tables.put(name, table);
        log.debug("Branch {} written to {}", name, branchDir);
        return table;
    }

    @Override
    public Optional<BranchHandle> read(String name) {
        final var metadata = branchDir(name).resolve(METADATA_FILE);
        if (!Files.exists(metadata)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(FileUtils.read(metadata), BranchHandle.class));
        }
        catch (IOException e) {
            throw new StorageException("Failed to read branch metadata " + metadata, e);
        }
    }

    @Override
    public List<BranchHandle> list() {
        try (final var dirs = Files.list(branchesRoot)) {
            return dirs.filter(Files::isDirectory)
                    .map(dir -> read(dir.getFileName().toString()))
                    .flatMap(Optional::stream)
                    .sorted(Comparator.comparing(BranchHandle::getName))
                    .toList();
        }
        catch (IOException e) {
            throw new StorageException("Failed to list branches under " + branchesRoot, e);
        }
    }

    @Override
    public PointerTable pointers(String name) {
        if (read(name).isEmpty()) {
            throw NotFoundException.branch(name);
        }
        return tables.computeIfAbsent(name, branch -> new FileSystemPointerTable(branch,
                                                                              branchDir(branch).resolve(JOURNAL_FILE),
                                                                              mapper));
    }

    @Override
    public synchronized boolean delete(String name) {
        tables.remove(name);
        return FileUtils.deleteRecursively(branchDir(name));
    }

    @Override
    public Optional<String> activeBranch() {
        final var file = baseDir.resolve(ACTIVE_BRANCH_FILE);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Stream.of(new String(FileUtils.read(file), StandardCharsets.UTF_8).trim())
                .filter(name -> !name.isEmpty())
                .findFirst();
    }

    @Override
    public void saveActiveBranch(@NonNull String name) {
        FileUtils.writeAtomically(baseDir.resolve(ACTIVE_BRANCH_FILE), name.getBytes(StandardCharsets.UTF_8));
    }

    private Path branchDir(String name) {
        final var dir = branchesRoot.resolve(Objects.requireNonNullElse(name, "")).normalize();
        if (!branchesRoot.equals(dir.getParent())) {
            throw new InvalidInputException("'" + name + "' is not a usable branch name");
        }
        return dir;
    }

    private byte[] toBytes(BranchHandle handle) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(handle);
        }
        catch (IOException e) {
            throw StorageException.serialization(e);
        }
    }
}
