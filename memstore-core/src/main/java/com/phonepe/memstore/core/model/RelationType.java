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
 * Type of a directed edge between two memories
 */
@Getter
@AllArgsConstructor
public enum RelationType {
    CONTRADICTS("contradicts"),
    SUPPORTS("supports"),
    REFINES("refines"),
    SUPERSEDES("supersedes"),
    ;

    @JsonValue
    private final String value;

    public static Optional<RelationType> fromValue(final String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst();
    }

    @JsonCreator
    public static RelationType parse(final String value) {
        return fromValue(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown relation type: " + value));
    }

    public static String validValues() {
        return Arrays.stream(values())
                .map(RelationType::getValue)
                .sorted()
                .collect(Collectors.joining(", "));
    }
}
