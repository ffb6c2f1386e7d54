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

package com.phonepe.engram.core.store;

import com.phonepe.engram.core.errors.NotFoundException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap backed content store. Mostly useful for tests and ephemeral agents.
 */
@Slf4j
public class InMemoryContentStore implements ContentStore {
    private final ConcurrentHashMap<String, byte[]> objects = new ConcurrentHashMap<>();

    @Override
    public String put(@NonNull byte[] content) {
        final var digest = ContentDigests.digest(content);
        if (objects.putIfAbsent(digest, Arrays.copyOf(content, content.length)) == null) {
            log.trace("Stored object {} ({} bytes)", digest, content.length);
        }
        return digest;
    }

    @Override
    public byte[] get(String digest) {
        final var content = objects.get(ContentDigests.requireDigest(digest));
        if (null == content) {
            throw NotFoundException.object(digest);
        }
        return Arrays.copyOf(content, content.length);
    }

    @Override
    public boolean contains(String digest) {
        return ContentDigests.isDigest(digest) && objects.containsKey(digest);
    }

    public int size() {
        return objects.size();
    }
}
