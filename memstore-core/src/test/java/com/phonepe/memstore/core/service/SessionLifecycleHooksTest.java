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

import com.phonepe.memstore.core.consolidation.SweepReport;
import com.phonepe.memstore.core.errors.ErrorType;
import com.phonepe.memstore.core.errors.MemoryStoreException;
import com.phonepe.memstore.core.errors.OperationResult;
import com.phonepe.memstore.core.extraction.CandidateIngestor;
import com.phonepe.memstore.core.extraction.ExtractedCandidate;
import com.phonepe.memstore.core.model.NewMemory;
import com.phonepe.memstore.core.store.InMemoryMemoryRecordStore;
import com.phonepe.memstore.core.utils.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static com.phonepe.memstore.core.utils.TestUtils.NOW;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

class SessionLifecycleHooksTest {
    private InMemoryMemoryRecordStore store;
    private MemoryService service;

    @BeforeEach
    void setUp() {
        final var clock = new TestUtils.MutableClock(NOW);
        store = new InMemoryMemoryRecordStore(clock);
        service = MemoryService.builder().store(store).clock(clock).build();
    }

    @Test
    void testSessionStartRendersSurface() {
        service.remember(NewMemory.builder().content("Prefers tabs").category("preferences").build());
        service.remember(NewMemory.builder().content("Billing uses Postgres").category("project-knowledge")
                                 .project("billing").build());
        final var hooks = SessionLifecycleHooks.builder().memoryService(service).build();
        final var rendered = hooks.onSessionStart("billing");
        assertTrue(rendered.contains("## Preferences"));
        assertTrue(rendered.contains("## Current Project: billing"));
        assertTrue(rendered.contains("- [project-knowledge] Billing uses Postgres"));
    }

    @Test
    void testSessionStartSurvivesFailures() {
        final var failing = Mockito.mock(MemoryService.class);
        when(failing.renderSurface("billing"))
                .thenReturn(OperationResult.failure(ErrorType.STORE_UNAVAILABLE, "offline"));
        assertEquals("", new SessionLifecycleHooks(failing, null).onSessionStart("billing"));
    }

    @Test
    void testStopExtracts() {
        final var ingestor = CandidateIngestor.builder()
                .store(store)
                .producer(excerpt -> List.of(ExtractedCandidate.builder()
                                                     .content("Runs integration tests nightly")
                                                     .category("procedures")
                                                     .build()))
                .build();
        final var hooks = new SessionLifecycleHooks(service, ingestor);
        assertEquals(1, hooks.onStop("assistant: ".repeat(50), "session-9", null));
        assertEquals("session-9", store.active().get(0).getSourceSession());
    }

    @Test
    void testStopWithoutIngestorDoesNothing() {
        assertEquals(0, new SessionLifecycleHooks(service, null).onStop("assistant: ".repeat(50), "s", null));
        assertTrue(store.active().isEmpty());
    }

    @Test
    void testSessionEndConsolidates() {
        assertTrue(new SessionLifecycleHooks(service, null).onSessionEnd().isExecuted());

        final var failing = Mockito.mock(MemoryService.class);
        when(failing.consolidate()).thenThrow(new MemoryStoreException(ErrorType.INVALID_INPUT, "broken"));
        final SweepReport report = new SessionLifecycleHooks(failing, null).onSessionEnd();
        assertFalse(report.isExecuted());
    }
}
