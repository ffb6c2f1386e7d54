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

package com.phonepe.engram.filesystem.store;

import com.phonepe.engram.core.errors.NotFoundException;
import com.phonepe.engram.core.errors.StorageException;
import com.phonepe.engram.core.store.ContentDigests;
import com.phonepe.engram.core.store.ContentStore;
import com.phonepe.engram.filesystem.utils.FileUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Content store laid out as {@code objects/<first two hex chars>/<remaining hex chars>}.
 * Objects are written to a temporary file and moved into place, so a failed put never leaves a readable partial
 * object. Reads verify the digest of what is on disk.
 */
@Slf4j
public class FileSystemContentStore implements ContentStore {
    private static final String OBJECTS_DIR = "objects";

    private final Path objectsRoot;

    @Builder
    public FileSystemContentStore(@NonNull Path baseDir) {
        this.objectsRoot = FileUtils.ensurePath(baseDir.resolve(OBJECTS_DIR), true, true);
    }

    @Override
    public String put(@NonNull byte[] content) {
        final var digest = ContentDigests.digest(content);
        final var path = pathOf(digest);
        if (Files.exists(path)) {
            return digest;
        }
        FileUtils.ensurePath(path.getParent(), true, true);
        FileUtils.writeAtomically(path, content);
        log.trace("Wrote object {} ({} bytes)", digest, content.length);
        return digest;
    }

    @Override
    public byte[] get(String digest) {
        final var path = pathOf(ContentDigests.requireDigest(digest));
        if (!Files.exists(path)) {
            throw NotFoundException.object(digest);
        }
        final var content = FileUtils.read(path);
        final var actual = ContentDigests.digest(content);
        if (!actual.equals(digest)) {
            throw new StorageException("Object " + digest + " is corrupt, content hashes to " + actual, null);
        }
        return content;
    }

    @Override
    public boolean contains(String digest) {
        return ContentDigests.isDigest(digest) && Files.exists(pathOf(digest));
    }

    Path pathOf(String digest) {
        return objectsRoot.resolve(digest.substring(0, 2)).resolve(digest.substring(2));
    }
}
