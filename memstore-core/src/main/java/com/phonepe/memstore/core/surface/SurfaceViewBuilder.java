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
import com.phonepe.memstore.core.scoring.MemoryScorer;
import com.phonepe.memstore.core.store.MemoryRecordStore;
import com.phonepe.memstore.core.utils.MemoryUtils;
import lombok.NonNull;

import java.time.Clock;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds the {@link SurfaceView} from the active records in a store
 */
public class SurfaceViewBuilder {
    private static final EnumSet<MemoryCategory> GLOBAL_ONLY_CATEGORIES
            = EnumSet.of(MemoryCategory.PREFERENCES, MemoryCategory.CORRECTIONS);

    private final MemoryRecordStore store;
    private final SurfaceSettings settings;
    private final Clock clock;

    public SurfaceViewBuilder(@NonNull MemoryRecordStore store, SurfaceSettings settings, Clock clock) {
        this.store = store;
        this.settings = Objects.requireNonNullElse(settings, SurfaceSettings.DEFAULT);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
    }

    public SurfaceView build(String project) {
        final var now = clock.instant();
        final var active = store.active();
        final var scored = active.stream()
                .map(record -> new ScoredMemory(record, MemoryScorer.score(record, now)))
                .sorted(Comparator.comparingDouble(ScoredMemory::getScore)
                                .reversed()
                                .thenComparingLong(memory -> memory.getRecord().getId()))
                .toList();
        final Map<MemoryCategory, List<ScoredMemory>> byCategory = scored.stream()
                .collect(Collectors.groupingBy(memory -> memory.getRecord().getCategory(),
                                               () -> new EnumMap<>(MemoryCategory.class),
                                               Collectors.toList()));
        final var capped = new EnumMap<MemoryCategory, List<ScoredMemory>>(MemoryCategory.class);
        byCategory.forEach((category, memories) -> capped.put(
                category,
                List.copyOf(memories.subList(0, Math.min(memories.size(), Math.max(0, settings.capFor(category)))))));
        final var currentProject = MemoryUtils.isBlank(project) ? null : project;
        final var projectMemories = null == currentProject
                                    ? List.<ScoredMemory>of()
                                    : scored.stream()
                                            .filter(memory -> currentProject.equals(memory.getRecord().getProject()))
                                            .filter(memory -> !GLOBAL_ONLY_CATEGORIES.contains(
                                                    memory.getRecord().getCategory()))
                                            .limit(Math.max(0, settings.getProjectSectionCap()))
                                            .toList();
        return SurfaceView.builder()
                .byCategory(capped)
                .project(currentProject)
                .projectMemories(projectMemories)
                .totalActive(active.size())
                .build();
    }
}
