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

import lombok.experimental.UtilityClass;

import java.util.Set;

/**
 * Tags of the built in entity variants
 */
@UtilityClass
public class EntityTypes {
    public static final String TASK = "task";
    public static final String CONTEXT = "context";
    public static final String REASONING = "reasoning";
    public static final String KNOWLEDGE = "knowledge";
    public static final String SESSION = "session";
    public static final String COMPLIANCE = "compliance";
    public static final String RULE = "rule";
    public static final String STANDARD = "standard";
    public static final String ADR = "adr";
    public static final String WORKFLOW = "workflow";
    public static final String RELATIONSHIP = "relationship";

    public static final Set<String> BUILT_IN = Set.of(
            TASK, CONTEXT, REASONING, KNOWLEDGE, SESSION, COMPLIANCE, RULE, STANDARD, ADR, WORKFLOW, RELATIONSHIP);
}
