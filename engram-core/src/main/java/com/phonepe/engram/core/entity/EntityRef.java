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

package com.phonepe.engram.core.entity;

import com.phonepe.engram.core.errors.InvalidInputException;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Key of an entity: its type tag plus id. Ordered by the {@code type/id} string form.
 */
@Value
@Builder
@Jacksonized
public class EntityRef implements Comparable<EntityRef> {
    @NonNull
    String type;
    @NonNull
    String id;

    public static EntityRef of(String type, String id) {
        return new EntityRef(type, id);
    }

    public static EntityRef parse(String value) {
        final var separator = null == value ? -1 : value.indexOf('/');
        if (separator <= 0 || separator == value.length() - 1) {
            throw new InvalidInputException("'" + value + "' is not of the form type/id");
        }
        return of(value.substring(0, separator), value.substring(separator + 1));
    }

    @Override
    public int compareTo(EntityRef other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public String toString() {
        return type + "/" + id;
    }
}
