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

package com.phonepe.engram.core.sync;

import com.google.common.base.Strings;
import com.phonepe.engram.core.errors.UnknownStrategyException;
import com.phonepe.engram.core.sync.strategies.ConflictReportingStrategy;
import com.phonepe.engram.core.sync.strategies.IntelligentMergeStrategy;
import com.phonepe.engram.core.sync.strategies.LatestWinsStrategy;
import com.phonepe.engram.core.sync.strategies.PriorityWinsStrategy;
import lombok.NonNull;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Looks up merge strategies by name. Names are case insensitive and dashes are read as underscores, so
 * {@code latest-wins} selects {@code latest_wins}. {@code priority_wins:<agent>} builds a priority strategy for
 * the given agent.
 */
public class MergeStrategies {
    private final Map<String, MergeStrategy> strategies = new ConcurrentHashMap<>();

    public MergeStrategies() {
        register(new LatestWinsStrategy());
        register(new IntelligentMergeStrategy());
        register(new ConflictReportingStrategy());
    }

    public void register(@NonNull MergeStrategy strategy) {
        strategies.put(normalize(strategy.name()), strategy);
    }

    /**
     * @throws UnknownStrategyException if no strategy has the name
     */
    public MergeStrategy resolve(String name) {
        if (Strings.isNullOrEmpty(name) || name.isBlank()) {
            throw new UnknownStrategyException(String.valueOf(name), names());
        }
        final var trimmed = name.trim();
        final var separator = trimmed.indexOf(':');
        final var head = normalize(separator < 0 ? trimmed : trimmed.substring(0, separator));
        if (separator >= 0) {
            final var agent = trimmed.substring(separator + 1).trim();
            if (head.equals(PriorityWinsStrategy.PREFIX) && !agent.isEmpty()) {
                return new PriorityWinsStrategy(agent);
            }
            throw new UnknownStrategyException(name, names());
        }
        final var strategy = strategies.get(head);
        if (null == strategy) {
            throw new UnknownStrategyException(name, names());
        }
        return strategy;
    }

    public Set<String> names() {
        final var names = new TreeSet<>(strategies.keySet());
        names.add(PriorityWinsStrategy.PREFIX + ":<agent>");
        return names;
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT).replace('-', '_');
    }
}
