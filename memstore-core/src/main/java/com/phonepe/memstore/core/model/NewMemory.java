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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Caller supplied input for storing a memory. Category is kept as raw text so that it can be validated at the
 * boundary.
 */
@Value
@Builder
public class NewMemory {
    public static final String DEFAULT_CATEGORY = "facts";
    public static final double DEFAULT_IMPORTANCE = 0.5;
    public static final double DEFAULT_CONFIDENCE = 0.8;

    String content;

    @Builder.Default
    String category = DEFAULT_CATEGORY;

    String project;

    @Builder.Default
    double importance = DEFAULT_IMPORTANCE;

    @Builder.Default
    double confidence = DEFAULT_CONFIDENCE;

    @Singular
    List<String> tags;

    String context;

    String sourceSession;
}
