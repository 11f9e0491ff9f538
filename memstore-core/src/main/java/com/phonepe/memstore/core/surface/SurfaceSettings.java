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

package com.phonepe.memstore.core.surface;

import com.phonepe.memstore.core.model.MemoryCategory;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class SurfaceSettings {
    public static final int DEFAULT_CATEGORY_CAP = 8;

    public static final SurfaceSettings DEFAULT = SurfaceSettings.builder()
            .categoryCap(MemoryCategory.PREFERENCES, 8)
            .categoryCap(MemoryCategory.CORRECTIONS, 5)
            .categoryCap(MemoryCategory.FACTS, 6)
            .categoryCap(MemoryCategory.DECISIONS, 5)
            .categoryCap(MemoryCategory.PROCEDURES, 5)
            .categoryCap(MemoryCategory.RELATIONSHIPS, 4)
            .categoryCap(MemoryCategory.PROJECT_KNOWLEDGE, 8)
            .build();

    /**
     * Maximum number of memories shown per category. Categories not present here use
     * {@value #DEFAULT_CATEGORY_CAP}.
     */
    @Singular
    Map<MemoryCategory, Integer> categoryCaps;

    @Builder.Default
    int projectSectionCap = 8;

    @Builder.Default
    int maxLines = 120;

    public int capFor(final MemoryCategory category) {
        return categoryCaps.getOrDefault(category, DEFAULT_CATEGORY_CAP);
    }
}
