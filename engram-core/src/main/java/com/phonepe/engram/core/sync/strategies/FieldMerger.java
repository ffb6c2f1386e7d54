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

package com.phonepe.engram.core.sync.strategies;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phonepe.engram.core.sync.MergeCandidate;
import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Three way merge of top level entity fields against a common ancestor. A field changed on one side only takes
 * that change. A field changed to different values on several sides is a conflict: the ancestor value is kept, or
 * the latest candidate's value when there is no ancestor.
 */
@UtilityClass
public class FieldMerger {
    public static final Set<String> ENVELOPE_FIELDS = Set.of("entityType", "id", "agent", "createdAt", "updatedAt");

    /**
     * @param merged            Merged state
     * @param conflictingFields Per conflicting field, the value on each candidate branch
     */
    public record Result(ObjectNode merged, SortedMap<String, SortedMap<String, JsonNode>> conflictingFields) {
        public boolean clean() {
            return conflictingFields.isEmpty();
        }
    }

    public static Result merge(ObjectNode ancestor, List<MergeCandidate> candidates) {
        final var latest = candidates.stream()
                .min(MergeCandidate.LATEST_FIRST)
                .orElseThrow(() -> new IllegalArgumentException("at least one candidate is required"));
        final var merged = JsonNodeFactory.instance.objectNode();
        final var conflicts = new TreeMap<String, SortedMap<String, JsonNode>>();

        final var fields = new TreeSet<String>();
        if (ancestor != null) {
            ancestor.fieldNames().forEachRemaining(fields::add);
        }
        candidates.forEach(candidate -> candidate.getState().fieldNames().forEachRemaining(fields::add));
        fields.removeAll(ENVELOPE_FIELDS);

        for (final var field : fields) {
            final var base = ancestor == null ? null : ancestor.get(field);
            final var changed = new HashSet<JsonNode>();
            var anyChange = false;
            for (final var candidate : candidates) {
                final var value = candidate.getState().get(field);
                if (!Objects.equals(value, base)) {
                    anyChange = true;
                    changed.add(value);
                }
            }
            JsonNode resolved;
            if (!anyChange) {
                resolved = base;
            }
            else if (changed.size() == 1) {
                resolved = changed.iterator().next();
            }
            else {
                final var values = new TreeMap<String, JsonNode>();
                candidates.forEach(candidate -> values.put(
                        candidate.getBranch(),
                        Objects.requireNonNullElse(candidate.getState().get(field), NullNode.getInstance())));
                conflicts.put(field, values);
                resolved = ancestor != null ? base : latest.getState().get(field);
            }
            if (resolved != null) {
                merged.set(field, resolved.deepCopy());
            }
        }

        merged.put("entityType", latest.getState().path("entityType").asText());
        merged.put("id", latest.getState().path("id").asText());
        copyIfPresent(latest.getState(), merged, "agent");
        final var timestamps = new ArrayList<ObjectNode>();
        if (ancestor != null) {
            timestamps.add(ancestor);
        }
        candidates.forEach(candidate -> timestamps.add(candidate.getState()));
        instants(timestamps, "createdAt").min(Comparator.naturalOrder())
                .ifPresent(value -> merged.put("createdAt", value.toString()));
        instants(timestamps, "updatedAt").max(Comparator.naturalOrder())
                .ifPresent(value -> merged.put("updatedAt", value.toString()));
        return new Result(merged, conflicts);
    }

    private static void copyIfPresent(ObjectNode from, ObjectNode to, String field) {
        if (from.hasNonNull(field)) {
            to.set(field, from.get(field).deepCopy());
        }
    }

    private static Stream<Instant> instants(List<ObjectNode> states, String field) {
        return states.stream()
                .map(state -> parse(state.path(field).asText(null)))
                .flatMap(Optional::stream);
    }

    private static Optional<Instant> parse(String value) {
        if (null == value) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(value));
        }
        catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    static Map<String, JsonNode> statesByBranch(List<MergeCandidate> candidates) {
        final var states = new TreeMap<String, JsonNode>();
        candidates.forEach(candidate -> states.put(candidate.getBranch(), candidate.getState()));
        return states;
    }
}
