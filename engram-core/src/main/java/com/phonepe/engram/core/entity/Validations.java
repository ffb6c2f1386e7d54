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

import com.google.common.base.Strings;
import com.phonepe.engram.core.errors.EntityValidationException;
import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.regex.Pattern;

/**
 * Field checks shared by the entity variants. All failures name the offending field.
 */
@UtilityClass
public class Validations {
    public static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._:-]*");
    public static final Pattern TYPE_PATTERN = Pattern.compile("[a-z][a-z0-9_-]*");

    public static void requireText(String field, String value) {
        if (Strings.isNullOrEmpty(value) || value.isBlank()) {
            throw EntityValidationException.missing(field);
        }
    }

    public static void requireNonNull(String field, Object value) {
        if (null == value) {
            throw EntityValidationException.missing(field);
        }
    }

    public static void requireIdentifier(String field, String value) {
        requireText(field, value);
        if (!ID_PATTERN.matcher(value).matches()) {
            throw new EntityValidationException(field, "'" + value + "' must match " + ID_PATTERN.pattern());
        }
    }

    public static void requireTypeTag(String field, String value) {
        requireText(field, value);
        if (!TYPE_PATTERN.matcher(value).matches()) {
            throw new EntityValidationException(field, "'" + value + "' must match " + TYPE_PATTERN.pattern());
        }
    }

    public static void requireFraction(String field, Double value) {
        if (value != null && (value.isNaN() || value < 0.0 || value > 1.0)) {
            throw new EntityValidationException(field, "must be between 0.0 and 1.0, got " + value);
        }
    }

    public static void requireOrdered(String field, Instant from, Instant to) {
        if (from != null && to != null && to.isBefore(from)) {
            throw new EntityValidationException(field, "must not be before " + from);
        }
    }

    public static void requireUnique(String field, Collection<String> values) {
        if (values == null) {
            return;
        }
        final var seen = new HashSet<String>();
        for (final var value : values) {
            requireText(field, value);
            if (!seen.add(value)) {
                throw new EntityValidationException(field, "duplicate value '" + value + "'");
            }
        }
    }
}
