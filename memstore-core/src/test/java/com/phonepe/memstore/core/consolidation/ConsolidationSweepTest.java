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

import com.phonepe.memstore.core.errors.ErrorType;
import com.phonepe.memstore.core.errors.MemoryStoreException;
import com.phonepe.memstore.core.model.LifecycleState;
import com.phonepe.memstore.core.model.MemoryCategory;
import com.phonepe.memstore.core.model.MemoryRecord;
import com.phonepe.memstore.core.store.InMemoryMemoryRecordStore;
import com.phonepe.memstore.core.store.MemoryRecordStore;
import com.phonepe.memstore.core.utils.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.phonepe.memstore.core.utils.TestUtils.NOW;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

class ConsolidationSweepTest {
    private TestUtils.MutableClock clock;
    private InMemoryMemoryRecordStore store;
    private ConsolidationSweep sweep;

    @BeforeEach
    void setUp() {
        clock = new TestUtils.MutableClock(NOW);
        store = new InMemoryMemoryRecordStore(clock);
        sweep = new ConsolidationSweep(store, ConsolidationSettings.DEFAULT, clock);
    }

    private MemoryRecord save(String content, double importance, int accessCount, Duration age) {
        return TestUtils.save(store, content, MemoryCategory.FACTS, importance, accessCount, NOW.minus(age));
    }

    private MemoryRecord reload(MemoryRecord record) {
        return store.get(record.getId()).orElseThrow();
    }

    @Test
    void testIdleRecordDecays() {
        final var idle = save("idle fact", 0.5, 0, Duration.ofDays(35));
        final var report = sweep.run();
        assertTrue(report.isExecuted());
        assertEquals(1, report.getDecayed());
        final var decayed = reload(idle);
        assertEquals(0.45, decayed.getImportance(), 1e-9);
        assertTrue(decayed.isActive());
        assertEquals(NOW, decayed.getLastDecayedAt());
    }

    @Test
    void testRecentOrAccessedRecordsDoNotDecay() {
        final var recent = save("recent fact", 0.5, 0, Duration.ofDays(29));
        final var accessed = save("accessed fact", 0.5, 1, Duration.ofDays(60));
        final var atFloor = save("floor fact", 0.1, 0, Duration.ofDays(60));
        assertEquals(0, sweep.run().getDecayed());
        assertEquals(0.5, reload(recent).getImportance());
        assertEquals(0.5, reload(accessed).getImportance());
        assertEquals(0.1, reload(atFloor).getImportance());
    }

    @Test
    void testDecayAgeIsInclusive() {
        final var exactlyThirtyDays = save("boundary", 0.5, 0, Duration.ofDays(30));
        sweep.run();
        assertEquals(0.45, reload(exactlyThirtyDays).getImportance(), 1e-9);
    }

    @Test
    void testDecayCompoundsOncePerInterval() {
        final var idle = save("idle fact", 0.5, 0, Duration.ofDays(35));
        sweep.run();
        clock.advance(Duration.ofDays(10));
        sweep.run();
        assertEquals(0.45, reload(idle).getImportance(), 1e-9);
        clock.advance(Duration.ofDays(20));
        sweep.run();
        assertEquals(0.405, reload(idle).getImportance(), 1e-9);
    }

    @Test
    void testOldUnimportantRecordIsRetired() {
        final var stale = save("stale fact", 0.05, 0, Duration.ofDays(100));
        final var report = sweep.run();
        assertEquals(1, report.getRetired());
        final var retired = reload(stale);
        assertEquals(LifecycleState.RETIRED, retired.state());
        assertEquals(MemoryRecord.RETIRED_SENTINEL, retired.getSupersededBy());
    }

    @Test
    void testRetirementNeedsAgeAndNoAccess() {
        final var young = save("young", 0.05, 0, Duration.ofDays(80));
        final var accessed = save("accessed", 0.05, 2, Duration.ofDays(200));
        assertEquals(0, sweep.run().getRetired());
        assertTrue(reload(young).isActive());
        assertTrue(reload(accessed).isActive());
    }

    @Test
    void testDecayedBelowThresholdIsRetiredInSameRun() {
        final var fading = save("fading", 0.105, 0, Duration.ofDays(120));
        final var report = sweep.run();
        assertEquals(1, report.getDecayed());
        assertEquals(1, report.getRetired());
        assertEquals(LifecycleState.RETIRED, reload(fading).state());
    }

    @Test
    void testRecordsWithoutCreationTimeAreLeftAlone() {
        final var unknownAge = MemoryRecord.builder()
                .id(1)
                .category(MemoryCategory.FACTS)
                .content("unknown age")
                .importance(0.05)
                .build();
        assertFalse(sweep.decayable(unknownAge, NOW));
        assertFalse(sweep.retirable(unknownAge, NOW));
    }

    @Test
    void testDuplicatesMergeIntoMostAccessed() {
        final var popular = save("Prefers tabs over spaces", 0.4, 3, Duration.ofDays(1));
        final var important = save("  prefers TABS over spaces ", 0.9, 1, Duration.ofDays(1));
        final var unrelated = save("Uses vim", 0.9, 1, Duration.ofDays(1));
        final var report = sweep.run();
        assertEquals(1, report.getMerged());
        assertTrue(reload(popular).isActive());
        assertEquals(popular.getId(), reload(important).getSupersededBy());
        assertEquals(LifecycleState.SUPERSEDED, reload(important).state());
        assertTrue(reload(unrelated).isActive());
    }

    @Test
    void testDuplicateTieGoesToLowestId() {
        final var first = save("same", 0.5, 0, Duration.ofDays(1));
        final var second = save("same", 0.5, 0, Duration.ofDays(1));
        final var third = save("SAME", 0.5, 0, Duration.ofDays(1));
        assertEquals(2, sweep.run().getMerged());
        assertTrue(reload(first).isActive());
        assertEquals(first.getId(), reload(second).getSupersededBy());
        assertEquals(first.getId(), reload(third).getSupersededBy());
    }

    @Test
    void testSecondSweepIsNoOp() {
        save("idle fact", 0.5, 0, Duration.ofDays(35));
        save("stale fact", 0.05, 0, Duration.ofDays(100));
        save("fading", 0.105, 0, Duration.ofDays(120));
        save("duplicate", 0.4, 3, Duration.ofDays(40));
        save("Duplicate", 0.9, 0, Duration.ofDays(40));
        assertTrue(sweep.run().changes() > 0);
        final var afterFirst = store.query(record -> true, Comparator.comparingLong(MemoryRecord::getId), 0);
        final var second = sweep.run();
        assertTrue(second.isExecuted());
        assertEquals(0, second.changes());
        assertEquals(afterFirst, store.query(record -> true, Comparator.comparingLong(MemoryRecord::getId), 0));
    }

    @Test
    void testUnavailableStoreSkipsSweep() {
        final var failing = Mockito.mock(MemoryRecordStore.class);
        when(failing.query(any(), any(), anyInt()))
                .thenThrow(MemoryStoreException.unavailable("disk gone", new IllegalStateException("disk gone")));
        final var report = new ConsolidationSweep(failing, null, clock).run();
        assertFalse(report.isExecuted());
        assertEquals(0, report.changes());
    }

    @Test
    void testOtherStoreErrorsPropagate() {
        final var failing = Mockito.mock(MemoryRecordStore.class);
        when(failing.query(any(), any(), anyInt()))
                .thenThrow(new MemoryStoreException(ErrorType.INVALID_INPUT, "bad"));
        final var consolidation = new ConsolidationSweep(failing, null, clock);
        assertThrows(MemoryStoreException.class, consolidation::run);
    }

    @Test
    void testRunsDoNotOverlap() throws Exception {
        final var entered = new CountDownLatch(1);
        final var release = new CountDownLatch(1);
        final var slow = Mockito.mock(MemoryRecordStore.class);
        when(slow.query(any(), any(), anyInt())).thenAnswer(invocation -> {
            entered.countDown();
            assertTrue(release.await(10, TimeUnit.SECONDS));
            return List.of();
        });
        final var consolidation = new ConsolidationSweep(slow, null, clock);
        final var first = CompletableFuture.supplyAsync(consolidation::run);
        assertTrue(entered.await(10, TimeUnit.SECONDS));
        assertFalse(consolidation.run().isExecuted());
        release.countDown();
        assertTrue(first.get(10, TimeUnit.SECONDS).isExecuted());
    }
}
