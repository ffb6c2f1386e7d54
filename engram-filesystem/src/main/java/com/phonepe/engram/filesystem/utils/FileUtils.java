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

package com.phonepe.engram.filesystem.utils;


import com.phonepe.engram.core.errors.StorageException;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.UUID;

@UtilityClass
@Slf4j
public class FileUtils {

    /**
     * Ensures that the provided path exists and is a readable, writable directory. If the path does not exist and
     * createIfNotExists is true, the directory is created.
     *
     * @param path              The path to check or create.
     * @param createIfNotExists Whether to create the directory if it does not exist.
     * @param writeCheck        Whether to check for write permissions on an existing directory.
     * @return The absolute, normalized Path object representing the directory.
     * @throws IllegalArgumentException If the path is not a usable directory
     * @throws StorageException         If the directory could not be created
     */
    public static Path ensurePath(Path path, boolean createIfNotExists, boolean writeCheck) {
        final var absolutePath = path.toAbsolutePath().normalize();
        if (Files.exists(absolutePath)) {
            if (!Files.isDirectory(absolutePath)
                    || !Files.isReadable(absolutePath)
                    || (writeCheck && !Files.isWritable(absolutePath))) {
                throw new IllegalArgumentException(
                        "Sanity check for %s Failed. Please check it exists and has the required permissions"
                                .formatted(absolutePath));
            }
        }
        else if (createIfNotExists) {
            try {
                Files.createDirectories(absolutePath);
            }
            catch (IOException e) {
                throw new StorageException("Failed to create directory: " + absolutePath, e);
            }
        }
        else {
            throw new IllegalArgumentException("Provided path does not exist: " + absolutePath);
        }
        return absolutePath;
    }

    /**
     * Writes the data to a temporary file next to the target and moves it into place, so readers never observe a
     * partially written file.
     *
     * @param filePath Target file
     * @param data     Bytes to write
     */
    public static void writeAtomically(Path filePath, byte[] data) {
        final var tempFile = filePath.resolveSibling("." + filePath.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.write(tempFile, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE,
                        StandardOpenOption.SYNC);
            try {
                Files.move(tempFile, filePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            }
            catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", filePath);
                Files.move(tempFile, filePath, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        catch (IOException e) {
            throw new StorageException("Failed to write " + filePath, e);
        }
        finally {
            deleteQuietly(tempFile);
        }
    }

    /**
     * Appends the data to the file, creating it if needed, and forces it to disk.
     */
    public static void append(Path filePath, byte[] data) {
        try {
            Files.write(filePath, data, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                        StandardOpenOption.APPEND, StandardOpenOption.SYNC);
        }
        catch (IOException e) {
            throw new StorageException("Failed to append to " + filePath, e);
        }
    }

    public static byte[] read(Path filePath) {
        try {
            return Files.readAllBytes(filePath);
        }
        catch (IOException e) {
            throw new StorageException("Failed to read " + filePath, e);
        }
    }

    /**
     * Deletes a directory tree.
     *
     * @return false if the directory did not exist
     */
    public static boolean deleteRecursively(Path directory) {
        if (!Files.exists(directory)) {
            return false;
        }
        try {
            Files.walkFileTree(directory, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    if (exc != null) {
                        throw exc;
                    }
                    Files.delete(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
            return true;
        }
        catch (IOException e) {
            throw new StorageException("Failed to delete " + directory, e);
        }
    }

    private static void deleteQuietly(Path tempFile) {
        try {
            Files.deleteIfExists(tempFile);
        }
        catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", tempFile, e.getMessage());
        }
    }
}
