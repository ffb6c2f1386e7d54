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

import com.phonepe.engram.core.errors.ErrorType;
import com.phonepe.engram.core.errors.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryContentStoreTest {

    private InMemoryContentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryContentStore();
    }

    @Test
    void testPutAndGet() {
        final var content = "hello engram".getBytes(StandardCharsets.UTF_8);
        final var digest = store.put(content);
        assertTrue(ContentDigests.isDigest(digest));
        assertArrayEquals(content, store.get(digest));
        assertTrue(store.contains(digest));
    }

    @Test
    void testSameBytesSameDigest() {
        final var first = store.put("same".getBytes(StandardCharsets.UTF_8));
        final var second = store.put("same".getBytes(StandardCharsets.UTF_8));
        assertEquals(first, second);
        assertEquals(1, store.size());
        assertNotEquals(first, store.put("different".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testKnownDigest() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                     store.put(new byte[0]));
    }

    @Test
    void testStoredBytesCannotBeChangedByCaller() {
        final var content = "immutable".getBytes(StandardCharsets.UTF_8);
        final var digest = store.put(content);
        content[0] = 'X';
        store.get(digest)[1] = 'Y';
        assertArrayEquals("immutable".getBytes(StandardCharsets.UTF_8), store.get(digest));
    }

    @Test
    void testMissingObject() {
        final var digest = ContentDigests.digest("never stored".getBytes(StandardCharsets.UTF_8));
        final var error = assertThrows(NotFoundException.class, () -> store.get(digest));
        assertEquals(ErrorType.NOT_FOUND, error.getErrorType());
        assertFalse(store.contains(digest));
        assertTrue(store.find(digest).isEmpty());
        assertFalse(store.contains("not-a-digest"));
    }
}
