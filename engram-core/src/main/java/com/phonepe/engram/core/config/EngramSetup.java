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

package com.phonepe.engram.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.phonepe.engram.core.errors.StorageException;
import com.phonepe.engram.core.graph.model.CycleScope;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Tunables for a store instance. Missing values fall back to defaults.
 */
@Value
@With
public class EngramSetup {
    public static final String DEFAULT_BRANCH = "main";
    public static final String DEFAULT_AGENT = "system";
    public static final int DEFAULT_MAX_STORE_RETRIES = 3;

    /**
     * Branch created on first start and used as the active branch when none was saved
     */
    String defaultBranch;

    /**
     * Agent stamped on writes that do not carry one
     */
    String defaultAgent;

    /**
     * How many times an unconditional store retries a lost compare-and-swap before failing as stale
     */
    int maxStoreRetries;

    /**
     * Cycle scope used by relationships that do not set one
     */
    CycleScope defaultCycleScope;

    @Builder
    @Jacksonized
    public EngramSetup(String defaultBranch,
                       String defaultAgent,
                       Integer maxStoreRetries,
                       CycleScope defaultCycleScope) {
        this.defaultBranch = Objects.requireNonNullElse(defaultBranch, DEFAULT_BRANCH);
        this.defaultAgent = Objects.requireNonNullElse(defaultAgent, DEFAULT_AGENT);
        this.maxStoreRetries = Objects.requireNonNullElse(maxStoreRetries, DEFAULT_MAX_STORE_RETRIES);
        this.defaultCycleScope = Objects.requireNonNullElse(defaultCycleScope, CycleScope.SAME_TYPE);
        Preconditions.checkArgument(this.maxStoreRetries >= 1, "maxStoreRetries must be at least 1");
    }

    public static EngramSetup defaults() {
        return EngramSetup.builder().build();
    }

    /**
     * Reads a setup from a JSON file.
     *
     * @param path   JSON file
     * @param mapper Mapper to read with
     * @return The setup with defaults filled in
     */
    public static EngramSetup load(@NonNull Path path, @NonNull ObjectMapper mapper) {
        try {
            return mapper.readValue(path.toFile(), EngramSetup.class);
        }
        catch (IOException e) {
            throw new StorageException("Could not read setup from " + path, e);
        }
    }
}
