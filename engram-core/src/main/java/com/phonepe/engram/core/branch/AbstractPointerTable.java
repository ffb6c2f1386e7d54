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
import lombok.NonNull;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pointer table kept in a {@link ConcurrentHashMap}. Subclasses make updates durable through
 * {@link #persist(EntityRef, PointerEntry)}, which runs while the key is locked: if it throws, the swap does not
 * happen.
 */
public abstract class AbstractPointerTable implements PointerTable {
    private record Slot(PointerEntry entry, long sequence) {
    }

    private final String branch;
    private final ConcurrentHashMap<EntityRef, Slot> slots = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong generation = new AtomicLong();

    protected AbstractPointerTable(@NonNull String branch) {
        this.branch = branch;
    }

    protected abstract void persist(EntityRef ref, PointerEntry entry);

    /**
     * Installs a pointer without persisting it. Used while loading existing state.
     */
    protected final void load(@NonNull EntityRef ref, @NonNull PointerEntry entry) {
        slots.compute(ref, (key, current) -> new Slot(entry,
                                                      current == null ? sequence.incrementAndGet() : current.sequence()));
    }

    @Override
    public String branch() {
        return branch;
    }

    @Override
    public Optional<PointerEntry> get(EntityRef ref) {
        return Optional.ofNullable(slots.get(ref)).map(Slot::entry);
    }

    @Override
    public boolean compareAndSet(@NonNull EntityRef ref, PointerEntry expected, @NonNull PointerEntry update) {
        final var swapped = new AtomicBoolean(false);
        slots.compute(ref, (key, current) -> {
            final var currentEntry = current == null ? null : current.entry();
            if (!Objects.equals(currentEntry, expected)) {
                return current;
            }
            persist(key, update);
            swapped.set(true);
            return new Slot(update, current == null ? sequence.incrementAndGet() : current.sequence());
        });
        if (swapped.get()) {
            generation.incrementAndGet();
        }
        return swapped.get();
    }

    @Override
    public Map<EntityRef, PointerEntry> snapshot() {
        final var ordered = new LinkedHashMap<EntityRef, PointerEntry>();
        slots.entrySet()
                .stream()
                .sorted(Comparator.comparingLong(e -> e.getValue().sequence()))
                .forEach(e -> ordered.put(e.getKey(), e.getValue().entry()));
        return Collections.unmodifiableMap(ordered);
    }

    @Override
    public long generation() {
        return generation.get();
    }

    @Override
    public int size() {
        return slots.size();
    }
}
