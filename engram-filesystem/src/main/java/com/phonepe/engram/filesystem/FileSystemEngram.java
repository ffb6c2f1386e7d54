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

package com.phonepe.engram.filesystem;

import com.phonepe.engram.core.Engram;
import com.phonepe.engram.core.config.EngramSetup;
import com.phonepe.engram.core.utils.JsonUtils;
import com.phonepe.engram.filesystem.branch.FileSystemBranchStore;
import com.phonepe.engram.filesystem.store.FileSystemContentStore;
import com.phonepe.engram.filesystem.utils.FileUtils;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Opens an {@link Engram} persisted under a directory. If the directory contains an {@code engram.json} file and no
 * setup is passed, the setup is read from it.
 */
@UtilityClass
@Slf4j
public class FileSystemEngram {
    public static final String SETUP_FILE = "engram.json";

    public static Engram open(Path baseDir) {
        return open(baseDir, null, Clock.systemUTC());
    }

    public static Engram open(Path baseDir, EngramSetup setup) {
        return open(baseDir, setup, Clock.systemUTC());
    }

    public static Engram open(Path baseDir, EngramSetup setup, Clock clock) {
        final var root = FileUtils.ensurePath(baseDir, true, true);
        final var mapper = JsonUtils.createMapper();
        var effectiveSetup = setup;
        if (null == effectiveSetup) {
            final var setupFile = root.resolve(SETUP_FILE);
            effectiveSetup = Files.exists(setupFile)
                             ? EngramSetup.load(setupFile, mapper)
                             : EngramSetup.defaults();
        }
        log.info("Opening engram store at {}", root);
        return Engram.builder()
                .setup(effectiveSetup)
                .mapper(mapper)
                .clock(clock)
                .contentStore(new FileSystemContentStore(root))
                .branchStore(new FileSystemBranchStore(root, mapper))
                .build();
    }
}
