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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.engram.core.branch.AbstractPointerTable;
import com.phonepe.engram.core.branch.PointerEntry;
import com.phonepe.engram.core.entity.EntityRef;
import com.phonepe.engram.core.errors.ErrorType;
import com.phonepe.engram.core.errors.StorageException;
import com.phonepe.engram.filesystem.utils.FileUtils;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.locks.StampedLock;

/**
 * Pointer table backed by an append only jsonl journal. Every successful swap appends one line; the journal is
 * replayed on startup and the last line for a key wins.
 */
@Slf4j
public class FileSystemPointerTable extends AbstractPointerTable {
    private final ObjectMapper mapper;
    @Getter
    private final Path journal;
    private final StampedLock lock = new StampedLock();

    FileSystemPointerTable(@NonNull String branch, @NonNull Path journal, @NonNull ObjectMapper mapper) {
        super(branch);
        this.journal = journal;
        this.mapper = mapper;
        replay();
    }

    /**
     * Writes the initial pointers of a new branch to its journal and opens it.
     */
    static FileSystemPointerTable create(String branch,
                                         Path journal,
                                         ObjectMapper mapper,
                                         Map<EntityRef, PointerEntry> initialPointers) {
        final var lines = new StringBuilder();
        initialPointers.forEach((ref, entry) -> lines.append(toLine(mapper, ref, entry)));
        FileUtils.writeAtomically(journal, lines.toString().getBytes(StandardCharsets.UTF_8));
        return new FileSystemPointerTable(branch, journal, mapper);
    }

    @Override
    protected void persist(EntityRef ref, PointerEntry entry) {
        final var line = toLine(mapper, ref, entry).getBytes(StandardCharsets.UTF_8);
        final var stamp = lock.writeLock();
        try {
            FileUtils.append(journal, line);
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    private void replay() {
        if (!Files.exists(journal)) {
            log.debug("No pointer journal at {}", journal);
            return;
        }
        final var stamp = lock.readLock();
        try (final var lines = Files.lines(journal, StandardCharsets.UTF_8)) {
            final var lineNumber = new int[]{0};
            lines.forEach(line -> {
                lineNumber[0]++;
                if (line.isBlank()) {
                    return;
                }
                final var record = parse(line, lineNumber[0]);
                load(record.getRef(), record.getEntry());
            });
            log.debug("Loaded {} pointers for branch {} from {} journal lines", size(), branch(), lineNumber[0]);
        }
        catch (IOException e) {
            throw new StorageException("Failed to read pointer journal " + journal, e);
        }
        finally {
            lock.unlockRead(stamp);
        }
    }

    private PointerJournalRecord parse(String line, int lineNumber) {
        try {
            final var record = mapper.readValue(line, PointerJournalRecord.class);
            if (null == record.getRef() || null == record.getEntry()) {
                throw new StorageException(ErrorType.SERIALIZATION_ERROR,
                                           "Incomplete record at line %d of %s".formatted(lineNumber, journal),
                                           null);
            }
            return record;
        }
        catch (JsonProcessingException e) {
            throw new StorageException(ErrorType.SERIALIZATION_ERROR,
                                       "Corrupt record at line %d of %s".formatted(lineNumber, journal),
                                       e);
        }
    }

    private static String toLine(ObjectMapper mapper, EntityRef ref, PointerEntry entry) {
        try {
            return mapper.writeValueAsString(PointerJournalRecord.builder()
                                                     .ref(ref)
                                                     .entry(entry)
                                                     .build()) + System.lineSeparator();
        }
        catch (JsonProcessingException e) {
            throw StorageException.serialization(e);
        }
    }
}
