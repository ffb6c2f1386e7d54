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

package com.phonepe.engram.core.errors;

/**
 * Wraps I/O and serialization failures of the underlying stores
 */
public class StorageException extends EngramException {
    public StorageException(String detail, Throwable cause) {
        this(ErrorType.STORAGE_FAILURE, detail, cause);
    }

    public StorageException(ErrorType errorType, String detail, Throwable cause) {
        super(errorType, errorType.getMessage().formatted(detail), cause);
    }

    public static StorageException serialization(Throwable cause) {
        return new StorageException(ErrorType.SERIALIZATION_ERROR, cause.getMessage(), cause);
    }
}
