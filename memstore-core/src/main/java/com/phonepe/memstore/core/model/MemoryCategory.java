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

package com.phonepe.memstore.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Fixed set of categories a memory can belong to
 */
@Getter
@AllArgsConstructor
public enum MemoryCategory {
    /**
     * Explicit likes, dislikes and ways of working
     */
    PREFERENCES("preferences"),
    /**
     * Facts about the user, their projects, tools or environment
     */
    FACTS("facts"),
    /**
     * Assumptions or behaviour that was corrected
     */
    CORRECTIONS("corrections"),
    /**
     * Technical or design decisions, with rationale where available
     */
    DECISIONS("decisions"),
    /**
     * Architecture, conventions and structure of a specific project
     */
    PROJECT_KNOWLEDGE("project-knowledge"),
    /**
     * Connections between concepts, people, tools or projects
     */
    RELATIONSHIPS("relationships"),
    /**
     * Workflows and techniques that worked
     */
    PROCEDURES("procedures"),
    ;

    @JsonValue
    private final String value;

    /**
     * Exact lookup on the wire value. Unknown values are never coerced.
     */
    public static Optional<MemoryCategory> fromValue(final String value) {
        return Arrays.stream(values())
                .filter(category -> category.value.equals(value))
                .findFirst();
    }

    @JsonCreator
    public static MemoryCategory parse(final String value) {
        return fromValue(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown memory category: " + value));
    }

    public static String validValues() {
        return Arrays.stream(values())
                .map(MemoryCategory::getValue)
                .sorted()
                .collect(Collectors.joining(", "));
    }
}
