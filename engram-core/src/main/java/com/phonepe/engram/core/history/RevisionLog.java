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

package com.phonepe.engram.core.history;

import com.google.common.base.Preconditions;
import com.phonepe.engram.core.entity.EntityCodec;
import com.phonepe.engram.core.store.ContentDigests;
import com.phonepe.engram.core.store.ContentStore;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads and writes {@link Revision} objects in the content store and walks the resulting graph.
 */
@Slf4j
public class RevisionLog {
    private final ContentStore contentStore;
    private final EntityCodec codec;

    public RevisionLog(@NonNull ContentStore contentStore, @NonNull EntityCodec codec) {
        this.contentStore = contentStore;
        this.codec = codec;
    }

    public String write(@NonNull Revision revision) {
        return contentStore.put(codec.writeRecord(revision));
    }

    /**
     * Identifier the revision would get if written
     */
    public String idOf(@NonNull Revision revision) {
        return ContentDigests.digest(codec.writeRecord(revision));
    }

    public Revision read(String revisionId) {
        return codec.readRecord(contentStore.get(revisionId), Revision.class);
    }

    /**
     * Walks first parents from the head back to the root.
     *
     * @return Revisions ordered oldest first, ending with the head
     */
    public List<Revision> firstParentChain(String headId) {
        final var chain = new ArrayList<Revision>();
        final var seen = new HashSet<String>();
        var current = headId;
        while (current != null) {
            Preconditions.checkState(seen.add(current), "Revision graph loops back to %s", current);
            final var revision = read(current);
            chain.add(revision);
            current = revision.firstParent().orElse(null);
        }
        Collections.reverse(chain);
        return chain;
    }

    /**
     * Finds the best common ancestor of the given heads: the common ancestor with the highest generation, ties
     * going to the smallest revision id.
     *
     * @param heads Distinct head revision ids
     * @param cache Revisions already read in this pass, filled as a side effect
     * @return The merge base, or null if the heads share no history
     */
    public String mergeBase(@NonNull Collection<String> heads, @NonNull Map<String, Revision> cache) {
        if (heads.isEmpty()) {
            return null;
        }
        if (heads.size() == 1) {
            return heads.iterator().next();
        }
        Set<String> common = null;
        for (final var head : heads) {
            final var ancestors = ancestorsOf(head, cache);
            if (common == null) {
                common = ancestors;
            }
            else {
                common.retainAll(ancestors);
            }
            if (common.isEmpty()) {
                return null;
            }
        }
        return common.stream()
                .min(Comparator.<String>comparingLong(id -> cached(id, cache).getGeneration())
                             .reversed()
                             .thenComparing(Comparator.naturalOrder()))
                .orElse(null);
    }

    /**
     * All revisions reachable from the head, the head included
     */
    public Set<String> ancestorsOf(String headId, Map<String, Revision> cache) {
        final var visited = new HashSet<String>();
        final var queue = new ArrayDeque<String>();
        queue.add(headId);
        while (!queue.isEmpty()) {
            final var id = queue.poll();
            if (visited.add(id)) {
                queue.addAll(cached(id, cache).parentIds());
            }
        }
        return visited;
    }

    public Revision cached(String revisionId, Map<String, Revision> cache) {
        return cache.computeIfAbsent(revisionId, this::read);
    }

    public Map<String, Revision> newCache() {
        return new HashMap<>();
    }
}
