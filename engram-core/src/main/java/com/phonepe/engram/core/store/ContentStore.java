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

import java.util.Optional;

/**
 * Append-only store of immutable byte payloads addressed by the SHA-256 digest of their content.
 * Implementations must be safe for concurrent use.
 */
public interface ContentStore {

    /**
     * Stores the payload if it is not already present.
     *
     * @param content Bytes to store
     * @return Lower case hex SHA-256 digest of the content
     */
    String put(byte[] content);

    /**
     * Reads a payload back.
     *
     * @param digest Identifier returned by {@link #put(byte[])}
     * @return The stored bytes
     * @throws com.phonepe.engram.core.errors.NotFoundException if nothing is stored under the digest
     */
    byte[] get(String digest);

    boolean contains(String digest);

    default Optional<byte[]> find(String digest) {
        return contains(digest) ? Optional.of(get(digest)) : Optional.empty();
    }
}
