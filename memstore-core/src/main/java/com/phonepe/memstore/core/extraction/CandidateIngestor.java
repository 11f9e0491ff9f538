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

package com.phonepe.memstore.core.extraction;

import com.phonepe.memstore.core.model.MemoryCategory;
import com.phonepe.memstore.core.model.MemoryRecord;
import com.phonepe.memstore.core.store.MemoryRecordStore;
import com.phonepe.memstore.core.utils.MemoryUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Best-effort insertion of producer proposed memories. Unknown categories fall back to
 * {@link MemoryCategory#FACTS}, scores are clamped, short content is skipped. Any failure, from the producer or
 * from the store, is logged and the remainder of the batch is dropped; nothing is ever thrown to the caller.
 */
@Slf4j
public class CandidateIngestor {
    private final MemoryRecordStore store;
    private final CandidateProducer producer;
    private final ExtractionSettings settings;

    @Builder
    public CandidateIngestor(@NonNull MemoryRecordStore store,
                             @NonNull CandidateProducer producer,
                             ExtractionSettings settings) {
        this.store = store;
        this.producer = producer;
        this.settings = Objects.requireNonNullElse(settings, ExtractionSettings.DEFAULT);
    }

    /**
     * @return number of memories stored
     */
    public int ingest(String transcript, String sessionId, String project) {
        if (MemoryUtils.isBlank(transcript)) {
            return 0;
        }
        final var excerpt = transcript.length() > settings.getExcerptLength()
                            ? transcript.substring(transcript.length() - settings.getExcerptLength())
                            : transcript;
        if (excerpt.strip().length() < settings.getMinExcerptLength()) {
            log.debug("Transcript excerpt too short for extraction, skipping");
            return 0;
        }
        try {
            final var candidates = Objects.requireNonNullElseGet(producer.produce(excerpt),
                                                                 List::<ExtractedCandidate>of);
            return store(candidates, sessionId, project);
        }
        catch (Exception e) {
            log.warn("Memory extraction failed for session {}: {}", sessionId, MemoryUtils.rootCause(e).getMessage());
            return 0;
        }
    }

    private int store(final List<ExtractedCandidate> candidates, final String sessionId, final String project) {
        var stored = 0;
        for (final var candidate : candidates.stream().limit(settings.getMaxCandidates()).toList()) {
            if (candidate == null) {
                continue;
            }
            final var content = candidate.getContent() == null ? "" : candidate.getContent().strip();
            if (content.length() < settings.getMinContentLength()) {
                continue;
            }
            final var category = MemoryCategory.fromValue(candidate.getCategory()).orElse(MemoryCategory.FACTS);
            final var record = store.create(MemoryRecord.builder()
                                                    .content(content)
                                                    .category(category)
                                                    .project(project)
                                                    .importance(Objects.requireNonNullElse(
                                                            candidate.getImportance(),
                                                            settings.getDefaultImportance()))
                                                    .confidence(Objects.requireNonNullElse(
                                                            candidate.getConfidence(),
                                                            settings.getDefaultConfidence()))
                                                    .context(settings.getContext())
                                                    .sourceSession(sessionId)
                                                    .build());
            final var tags = MemoryUtils.normalizeTags(
                    Objects.requireNonNullElseGet(candidate.getTags(), List::<Object>of)
                            .stream()
                            .filter(String.class::isInstance)
                            .map(String.class::cast)
                            .toList(),
                    settings.getMaxTags());
            if (!tags.isEmpty()) {
                store.addTags(record.getId(), tags);
            }
            stored++;
        }
        log.info("Stored {} extracted memories for session {}", stored, sessionId);
        return stored;
    }
}
