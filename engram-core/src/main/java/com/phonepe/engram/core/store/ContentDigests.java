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

import com.google.common.base.Strings;
import com.google.common.hash.Hashing;
import com.phonepe.engram.core.errors.InvalidInputException;
import lombok.experimental.UtilityClass;

import java.util.regex.Pattern;

@UtilityClass
public class ContentDigests {
    private static final Pattern DIGEST_PATTERN = Pattern.compile("[0-9a-f]{64}");

    public static String digest(byte[] content) {
        return Hashing.sha256().hashBytes(content).toString();
    }

    public static boolean isDigest(String value) {
        return !Strings.isNullOrEmpty(value) && DIGEST_PATTERN.matcher(value).matches();
    }

    public static String requireDigest(String value) {
        if (!isDigest(value)) {
            throw new InvalidInputException("'" + value + "' is not a content digest");
        }
        return value;
    }
}
