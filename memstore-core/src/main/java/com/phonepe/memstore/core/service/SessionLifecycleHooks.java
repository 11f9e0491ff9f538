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
import com.phonepe.memstore.core.errors.MemoryStoreException;
import com.phonepe.memstore.core.extraction.CandidateIngestor;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Maintenance triggered at session boundaries:
 * <ul>
 *     <li>start: render the memory document injected into the new session</li>
 *     <li>stop: extract memories from the transcript so far</li>
 *     <li>end: run consolidation</li>
 * </ul>
 * Hooks never throw. A session must not be disturbed by memory maintenance.
 */
@Slf4j
public class SessionLifecycleHooks {
    private final MemoryService memoryService;
    private final CandidateIngestor candidateIngestor;

    /**
     * @param candidateIngestor optional, extraction is skipped when absent
     */
    @Builder
    public SessionLifecycleHooks(@NonNull MemoryService memoryService, CandidateIngestor candidateIngestor) {
        this.memoryService = memoryService;
        this.candidateIngestor = candidateIngestor;
    }

    /**
     * @return the rendered memory document, empty if it could not be produced
     */
    public String onSessionStart(String project) {
        final var rendered = memoryService.renderSurface(project);
        if (!rendered.isSuccess()) {
            log.warn("Could not render memory surface: {}", rendered.getError().getMessage());
            return "";
        }
        return rendered.getData();
    }

    /**
     * @return number of memories extracted
     */
    public int onStop(String transcript, String sessionId, String project) {
        if (null == candidateIngestor) {
            log.debug("No candidate ingestor configured, skipping extraction");
            return 0;
        }
        return candidateIngestor.ingest(transcript, sessionId, project);
    }

    public SweepReport onSessionEnd() {
        try {
            return memoryService.consolidate();
        }
        catch (MemoryStoreException e) {
            log.warn("Consolidation failed at session end: {}", e.getMessage());
            return SweepReport.skipped();
        }
    }
}
