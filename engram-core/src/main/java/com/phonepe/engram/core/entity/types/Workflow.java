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

package com.phonepe.engram.core.entity.types;

import com.phonepe.engram.core.entity.Entity;
import com.phonepe.engram.core.entity.EntityTypes;
import com.phonepe.engram.core.entity.Validations;
import com.phonepe.engram.core.errors.EntityValidationException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * State machine definition. {@code transitions} maps a state to the states reachable from it.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Workflow extends Entity {
    String title;
    String description;
    List<String> states;
    String initialState;
    Map<String, List<String>> transitions;

    @Builder
    @Jacksonized
    public Workflow(String id,
                    String agent,
                    Instant createdAt,
                    Instant updatedAt,
                    boolean archived,
                    String title,
                    String description,
                    List<String> states,
                    String initialState,
                    Map<String, List<String>> transitions) {
        super(EntityTypes.WORKFLOW, id, agent, createdAt, updatedAt, archived);
        this.title = title;
        this.description = description;
        this.states = states;
        this.initialState = initialState;
        this.transitions = transitions;
    }

    @Override
    protected void validatePayload() {
        Validations.requireText("title", title);
        if (states == null || states.isEmpty()) {
            throw EntityValidationException.missing("states");
        }
        Validations.requireUnique("states", states);
        Validations.requireText("initialState", initialState);
        if (!states.contains(initialState)) {
            throw new EntityValidationException("initialState", "'" + initialState + "' is not a declared state");
        }
        if (transitions != null) {
            transitions.forEach((from, targets) -> {
                if (!states.contains(from)) {
                    throw new EntityValidationException("transitions", "unknown state '" + from + "'");
                }
                if (targets != null) {
                    targets.stream()
                            .filter(to -> !states.contains(to))
                            .findFirst()
                            .ifPresent(to -> {
                                throw new EntityValidationException("transitions", "unknown state '" + to + "'");
                            });
                }
            });
        }
    }
}
