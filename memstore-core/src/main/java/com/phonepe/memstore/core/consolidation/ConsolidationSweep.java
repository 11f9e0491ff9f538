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

package com.phonepe.memstore.core.consolidation;

import com.google.common.base.Stopwatch;
import com.phonepe.memstore.core.errors.ErrorType;
import com.phonepe.memstore.core.errors.MemoryStoreException;
import com.phonepe.memstore.core.lifecycle.MemoryLifecycle;
import com.phonepe.memstore.core.model.MemoryRecord;
import com.phonepe.memstore.core.store.MemoryRecordStore;
import com.phonepe.memstore.core.utils.MemoryUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Background maintenance over all active records. Three passes run in order:
 * <ol>
 *     <li>Decay: unaccessed records older than the decay age lose a fixed fraction of importance, at most once per
 *     decay interval</li>
 *     <li>Retirement: unaccessed records that are old enough and have decayed below the retirement importance are
 *     retired</li>
 *     <li>Deduplication: active records with the same normalized content are merged into the one with the highest
 *     (access count, importance); remaining ties go to the lowest id</li>
 * </ol>
 * Each record is updated atomically on its own; there is no table wide lock, so readers may observe a partially
 * applied sweep. Repeating the sweep converges, a second immediate run changes nothing.
 * Runs never overlap: a run requested while another is in progress is skipped.
 */
@Slf4j
public class ConsolidationSweep {

    /**
     * Keeper selection for duplicates: max of this order wins
     */
    static final Comparator<MemoryRecord> KEEPER_ORDER = Comparator.comparingInt(MemoryRecord::getAccessCount)
            .thenComparingDouble(MemoryRecord::getImportance)
            .thenComparing(Comparator.comparingLong(MemoryRecord::getId).reversed());

    private final MemoryRecordStore store;
    private final ConsolidationSettings settings;
    private final Clock clock;
    private final ReentrantLock runLock = new ReentrantLock();

    public ConsolidationSweep(@NonNull MemoryRecordStore store, ConsolidationSettings settings, Clock clock) {
        this.store = store;
        this.settings = Objects.requireNonNullElse(settings, ConsolidationSettings.DEFAULT);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
    }

    public SweepReport run() {
        if (!runLock.tryLock()) {
            log.warn("Consolidation sweep already in progress, skipping this run");
            return SweepReport.skipped();
        }
        try {
            final var stopwatch = Stopwatch.createStarted();
            final var now = clock.instant();
            final var decayed = decay(now);
            final var retired = retire(now);
            final var merged = deduplicate();
            final var report = new SweepReport(true, decayed, retired, merged, stopwatch.elapsed(TimeUnit.MILLISECONDS));
            log.info("Consolidation sweep completed. Decayed: {} Retired: {} Merged: {} Time: {} ms",
                     decayed, retired, merged, report.getElapsedMillis());
            return report;
        }
        catch (MemoryStoreException e) {
            if (e.getErrorType() == ErrorType.STORE_UNAVAILABLE) {
                log.warn("Skipping consolidation sweep: {}", MemoryUtils.rootCause(e).getMessage());
                return SweepReport.skipped();
            }
            throw e;
        }
        finally {
            runLock.unlock();
        }
    }

    boolean decayable(final MemoryRecord record, final Instant now) {
        return record.isActive()
                && record.getAccessCount() == 0
                && record.getImportance() > settings.getDecayFloor()
                && olderThan(record.getCreatedAt(), now, settings.getDecayAge())
                && (record.getLastDecayedAt() == null
                        || olderThan(record.getLastDecayedAt(), now, settings.getDecayInterval()));
    }

    boolean retirable(final MemoryRecord record, final Instant now) {
        return record.isActive()
                && record.getAccessCount() == 0
                && record.getImportance() < settings.getRetirementImportance()
                && olderThan(record.getCreatedAt(), now, settings.getRetirementAge());
    }

    private int decay(final Instant now) {
        return applyToMatching(
                record -> decayable(record, now),
                record -> {
                    log.debug("Decaying memory #{} from importance {}", record.getId(), record.getImportance());
                    return record.withImportance(record.getImportance() * settings.getDecayFactor())
                            .withLastDecayedAt(now);
                });
    }

    private int retire(final Instant now) {
        return applyToMatching(
                record -> retirable(record, now),
                record -> {
                    log.debug("Retiring memory #{} with importance {}", record.getId(), record.getImportance());
                    return MemoryLifecycle.retire(record);
                });
    }

    private int deduplicate() {
        final var groups = new TreeMap<String, List<MemoryRecord>>();
        store.active()
                .forEach(record -> groups.computeIfAbsent(MemoryUtils.normalizeContent(record.getContent()),
                                                          key -> new ArrayList<>())
                        .add(record));
        var merged = 0;
        for (final var group : groups.values()) {
            if (group.size() < 2) {
                continue;
            }
            final var keeper = group.stream().max(KEEPER_ORDER).orElseThrow();
            for (final var duplicate : group) {
                if (duplicate.getId() == keeper.getId()) {
                    continue;
                }
                final var changed = new AtomicBoolean();
                store.update(duplicate.getId(), current -> {
                    if (!current.isActive()) {
                        return current;
                    }
                    changed.set(true);
                    return MemoryLifecycle.supersede(current, keeper.getId());
                });
                if (changed.get()) {
                    log.debug("Merged duplicate memory #{} into #{}", duplicate.getId(), keeper.getId());
                    merged++;
                }
            }
        }
        return merged;
    }

    /**
     * Re-checks the predicate inside the atomic update so that concurrent changes made after the query are respected
     */
    private int applyToMatching(final Predicate<MemoryRecord> predicate,
                                final UnaryOperator<MemoryRecord> change) {
        var count = 0;
        for (final var candidate : store.query(predicate, Comparator.comparingLong(MemoryRecord::getId), 0)) {
            final var changed = new AtomicBoolean();
            store.update(candidate.getId(), current -> {
                if (!predicate.test(current)) {
                    return current;
                }
                changed.set(true);
                return change.apply(current);
            });
            if (changed.get()) {
                count++;
            }
        }
        return count;
    }

    private static boolean olderThan(final Instant timestamp, final Instant now, final Duration age) {
        return timestamp != null && !timestamp.isAfter(now.minus(age));
    }
}
