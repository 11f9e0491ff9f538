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
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of the highest scoring active memories, ready to be rendered for a new session
 */
@Value
@Builder
public class SurfaceView {
    /**
     * Best memories per category, descending score. Empty categories are absent.
     */
    Map<MemoryCategory, List<ScoredMemory>> byCategory;

    /**
     * Current project, null when the session is not tied to one
     */
    String project;

    /**
     * Memories scoped to the current project, excluding preferences and corrections
     */
    List<ScoredMemory> projectMemories;

    long totalActive;

    public List<ScoredMemory> section(final MemoryCategory category) {
        return byCategory.getOrDefault(category, List.of());
    }
}
