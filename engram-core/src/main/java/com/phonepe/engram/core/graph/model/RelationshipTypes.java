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

package com.phonepe.engram.core.graph.model;

import lombok.experimental.UtilityClass;

import java.util.Set;

@UtilityClass
public class RelationshipTypes {
    public static final String DEPENDS_ON = "depends_on";
    public static final String CONTAINS = "contains";
    public static final String REFERENCES = "references";
    public static final String FULFILLS = "fulfills";
    public static final String IMPLEMENTS = "implements";
    public static final String SUPERSEDES = "supersedes";
    public static final String ASSOCIATED_WITH = "associated_with";
    public static final String INFLUENCES = "influences";

    public static final Set<String> BUILT_IN = Set.of(
            DEPENDS_ON, CONTAINS, REFERENCES, FULFILLS, IMPLEMENTS, SUPERSEDES, ASSOCIATED_WITH, INFLUENCES);
}
