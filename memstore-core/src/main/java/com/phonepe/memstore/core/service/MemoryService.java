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

package com.phonepe.memstore.core.service;

import com.phonepe.memstore.core.consolidation.ConsolidationSettings;
import com.phonepe.memstore.core.consolidation.ConsolidationSweep;
import com.phonepe.memstore.core.consolidation.SweepReport;
import com.phonepe.memstore.core.correction.CorrectionManager;
import com.phonepe.memstore.core.correction.CorrectionOutcome;
import com.phonepe.memstore.core.errors.ErrorType;
import com.phonepe.memstore.core.errors.MemoryStoreException;
import com.phonepe.memstore.core.errors.OperationResult;
import com.phonepe.memstore.core.model.LifecycleState;
import com.phonepe.memstore.core.model.MemoryCategory;
import com.phonepe.memstore.core.model.MemoryRecord;
import com.phonepe.memstore.core.model.MemoryStats;
import com.phonepe.memstore.core.model.NewMemory;
import com.phonepe.memstore.core.model.Relation;
import com.phonepe.memstore.core.model.SortOrder;
import com.phonepe.memstore.core.search.KeywordSearchOracle;
import com.phonepe.memstore.core.search.SearchFilter;
import com.phonepe.memstore.core.search.SearchOracle;
import com.phonepe.memstore.core.store.MemoryRecordStore;
import com.phonepe.memstore.core.surface.MarkdownSurfaceRenderer;
import com.phonepe.memstore.core.surface.SurfaceSettings;
import com.phonepe.memstore.core.surface.SurfaceView;
import com.phonepe.memstore.core.surface.SurfaceViewBuilder;
import com.phonepe.memstore.core.utils.MemoryUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Entry point for callers. Every operation reports validation problems, missing records and store failures
 * through the returned {@link OperationResult}; nothing is thrown across this boundary.
 */
@Slf4j
public class MemoryService {
    public static final int DEFAULT_RECALL_LIMIT = 10;
    public static final int DEFAULT_LIST_LIMIT = 20;
    public static final int MOST_ACCESSED_COUNT = 5;

    private final MemoryRecordStore store;
    private final SearchOracle searchOracle;
    private final Clock clock;
    private final CorrectionManager correctionManager;
    private final ConsolidationSweep consolidationSweep;
    private final SurfaceViewBuilder surfaceViewBuilder;
    private final MarkdownSurfaceRenderer surfaceRenderer;

    @Builder
    public MemoryService(@NonNull MemoryRecordStore store,
                         SearchOracle searchOracle,
                         Clock clock,
                         ConsolidationSettings consolidationSettings,
                         SurfaceSettings surfaceSettings) {
        this.store = store;
        this.searchOracle = Objects.requireNonNullElseGet(searchOracle, () -> new KeywordSearchOracle(store));
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.correctionManager = new CorrectionManager(store);
        this.consolidationSweep = new ConsolidationSweep(store, consolidationSettings, this.clock);
        this.surfaceViewBuilder = new SurfaceViewBuilder(store, surfaceSettings, this.clock);
        this.surfaceRenderer = new MarkdownSurfaceRenderer(surfaceSettings);
    }

    public OperationResult<MemoryRecord> remember(@NonNull NewMemory memory) {
        final var category = MemoryCategory.fromValue(memory.getCategory()).orElse(null);
        if (null == category) {
            return OperationResult.failure(ErrorType.INVALID_CATEGORY,
                                           memory.getCategory(),
                                           MemoryCategory.validValues());
        }
        if (MemoryUtils.isBlank(memory.getContent())) {
            return OperationResult.failure(ErrorType.INVALID_INPUT, "content must not be blank");
        }
        return guarded(() -> {
            final var stored = store.create(MemoryRecord.builder()
                                                    .content(memory.getContent())
                                                    .category(category)
                                                    .project(memory.getProject())
                                                    .importance(memory.getImportance())
                                                    .confidence(memory.getConfidence())
                                                    .context(memory.getContext())
                                                    .sourceSession(memory.getSourceSession())
                                                    .build());
            final var tags = MemoryUtils.normalizeTags(memory.getTags(), 0);
            if (!tags.isEmpty()) {
                store.addTags(stored.getId(), tags);
            }
            log.info("Stored memory #{} [{}] (importance={}, confidence={})",
                     stored.getId(), category.getValue(), stored.getImportance(), stored.getConfidence());
            return OperationResult.success(stored);
        });
    }

    /**
     * Search memories. Every returned record has its access count incremented.
     *
     * @param category        optional category filter
     * @param project         optional project filter, global memories always match
     * @param limit           maximum results, non-positive for {@value #DEFAULT_RECALL_LIMIT}
     * @param includeInactive also return superseded and retired memories
     */
    public OperationResult<List<RecalledMemory>> recall(String query,
                                                        String category,
                                                        String project,
                                                        int limit,
                                                        boolean includeInactive) {
        if (MemoryUtils.isBlank(query)) {
            return OperationResult.failure(ErrorType.INVALID_INPUT, "query must not be blank");
        }
        final var categoryFilter = parseOptionalCategory(category);
        if (categoryFilter.isEmpty()) {
            return OperationResult.failure(ErrorType.INVALID_CATEGORY, category, MemoryCategory.validValues());
        }
        final var filter = SearchFilter.builder()
                .category(categoryFilter.get().orElse(null))
                .project(MemoryUtils.isBlank(project) ? null : project)
                .includeInactive(includeInactive)
                .build();
        final var maxResults = limit > 0 ? limit : DEFAULT_RECALL_LIMIT;
        return guarded(() -> {
            final var results = new ArrayList<RecalledMemory>();
            final var seen = new HashSet<Long>();
            for (final var hit : searchOracle.search(query, filter, maxResults)) {
                if (results.size() >= maxResults || !seen.add(hit.getMemoryId())) {
                    continue;
                }
                final var current = store.get(hit.getMemoryId()).orElse(null);
                if (null == current || !filter.matches(current)) {
                    continue;
                }
                final var accessed = recordAccess(current.getId()).orElse(current);
                results.add(new RecalledMemory(accessed, hit.getRelevance(), !accessed.isActive()));
            }
            log.debug("Recall for '{}' returned {} memories", query, results.size());
            return OperationResult.success(List.copyOf(results));
        });
    }

    /**
     * Active memories in the requested order. Listing counts as an access for every returned record.
     *
     * @param sort one of {@code score}, {@code recency}, {@code importance}, {@code accessed}. Anything else sorts
     *             by score.
     */
    public OperationResult<List<MemoryRecord>> list(String category, String project, int limit, String sort) {
        final var categoryFilter = parseOptionalCategory(category);
        if (categoryFilter.isEmpty()) {
            return OperationResult.failure(ErrorType.INVALID_CATEGORY, category, MemoryCategory.validValues());
        }
        final var filter = SearchFilter.builder()
                .category(categoryFilter.get().orElse(null))
                .project(MemoryUtils.isBlank(project) ? null : project)
                .build();
        final var order = SortOrder.fromValue(sort).comparator(clock.instant());
        return guarded(() -> {
            final var listed = store.query(filter::matches, order, limit > 0 ? limit : DEFAULT_LIST_LIMIT);
            return OperationResult.success(listed.stream()
                                                   .map(record -> recordAccess(record.getId()).orElse(record))
                                                   .toList());
        });
    }

    public OperationResult<MemoryStats> stats() {
        return guarded(() -> {
            final var all = store.query(record -> true, Comparator.comparingLong(MemoryRecord::getId), 0);
            final var byState = all.stream()
                    .collect(Collectors.groupingBy(LifecycleState::of, Collectors.counting()));
            final var active = all.stream().filter(MemoryRecord::isActive).toList();
            final var mostAccessedOrder = SortOrder.ACCESSED.comparator(clock.instant());
            final Map<String, Long> byCategory = active.stream()
                    .collect(Collectors.groupingBy(record -> record.getCategory().getValue(),
                                                   TreeMap::new,
                                                   Collectors.counting()));
            final Map<String, Long> byProject = active.stream()
                    .collect(Collectors.groupingBy(record -> Objects.requireNonNullElse(record.getProject(),
                                                                                        MemoryStats.GLOBAL_PROJECT),
                                                   TreeMap::new,
                                                   Collectors.counting()));
            return OperationResult.success(MemoryStats.builder()
                                                   .totalActive(byState.getOrDefault(LifecycleState.ACTIVE, 0L))
                                                   .totalSuperseded(byState.getOrDefault(LifecycleState.SUPERSEDED,
                                                                                         0L))
                                                   .totalRetired(byState.getOrDefault(LifecycleState.RETIRED, 0L))
                                                   .byCategory(byCategory)
                                                   .byProject(byProject)
                                                   .mostAccessed(active.stream()
                                                                         .sorted(mostAccessedOrder)
                                                                         .limit(MOST_ACCESSED_COUNT)
                                                                         .toList())
                                                   .build());
        });
    }

    public OperationResult<List<Relation>> relations(long id) {
        return guarded(() -> {
            if (!store.exists(id)) {
                return OperationResult.failure(ErrorType.NOT_FOUND, id);
            }
            return OperationResult.success(store.relations(id));
        });
    }

    /**
     * The supersession chain starting at the given record: the record itself followed by each replacement in turn.
     * Retired records end the chain.
     */
    public OperationResult<List<MemoryRecord>> history(long id) {
        return guarded(() -> {
            final var start = store.get(id).orElse(null);
            if (null == start) {
                return OperationResult.failure(ErrorType.NOT_FOUND, id);
            }
            final var chain = new ArrayList<MemoryRecord>();
            final var visited = new HashSet<Long>();
            var current = start;
            while (current != null && visited.add(current.getId())) {
                chain.add(current);
                current = LifecycleState.of(current) == LifecycleState.SUPERSEDED
                          ? store.get(current.getSupersededBy()).orElse(null)
                          : null;
            }
            return OperationResult.success(List.copyOf(chain));
        });
    }

    public OperationResult<CorrectionOutcome> correct(long oldId, String newContent, String reason,
                                                      String sourceSession) {
        return guarded(() -> correctionManager.correct(oldId, newContent, reason, sourceSession));
    }

    public OperationResult<MemoryRecord> forget(long id) {
        return guarded(() -> correctionManager.forget(id));
    }

    public OperationResult<Relation> relate(long fromId, long toId, String relationType) {
        return guarded(() -> correctionManager.relate(fromId, toId, relationType));
    }

    /**
     * Run consolidation. Never fails: an unavailable store, an overlapping run or any other store failure yields a
     * skipped report.
     */
    public SweepReport consolidate() {
        try {
            return consolidationSweep.run();
        }
        catch (MemoryStoreException e) {
            log.warn("Consolidation failed: {}", e.getMessage());
            return SweepReport.skipped();
        }
    }

    public OperationResult<SurfaceView> surfaceView(String project) {
        return guarded(() -> OperationResult.success(surfaceViewBuilder.build(project)));
    }

    public OperationResult<String> renderSurface(String project) {
        return guarded(() -> OperationResult.success(surfaceRenderer.render(surfaceViewBuilder.build(project))));
    }

    private Optional<MemoryRecord> recordAccess(final long id) {
        final var now = clock.instant();
        return store.update(id, record -> record.withAccessCount(record.getAccessCount() + 1)
                .withLastAccessed(now));
    }

    /**
     * Empty when the value is not a valid category, an empty inner optional when no filter is requested
     */
    private static Optional<Optional<MemoryCategory>> parseOptionalCategory(final String category) {
        if (MemoryUtils.isBlank(category)) {
            return Optional.of(Optional.empty());
        }
        return MemoryCategory.fromValue(category).map(Optional::of);
    }

    private static <T> OperationResult<T> guarded(final Supplier<OperationResult<T>> operation) {
        try {
            return operation.get();
        }
        catch (MemoryStoreException e) {
            log.warn("Memory operation failed: {}", e.getMessage());
            return OperationResult.failure(e);
        }
    }
}
