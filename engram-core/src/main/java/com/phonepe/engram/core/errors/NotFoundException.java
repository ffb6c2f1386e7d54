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
 * Raised when a content object, entity, relationship or branch does not exist
 */
public class NotFoundException extends EngramException {
    public NotFoundException(String what) {
        super(ErrorType.NOT_FOUND, ErrorType.NOT_FOUND.getMessage().formatted(what));
    }

    public static NotFoundException entity(Object ref) {
        return new NotFoundException("entity " + ref);
    }

    public static NotFoundException branch(String name) {
        return new NotFoundException("branch " + name);
    }

    public static NotFoundException object(String digest) {
        return new NotFoundException("content object " + digest);
    }
}
