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

package com.phonepe.memstore.core.correction;

import com.phonepe.memstore.core.errors.ErrorType;
import com.phonepe.memstore.core.errors.MemoryError;
import com.phonepe.memstore.core.errors.MemoryStoreException;
import com.phonepe.memstore.core.errors.OperationResult;
import com.phonepe.memstore.core.lifecycle.MemoryLifecycle;
import com.phonepe.memstore.core.model.MemoryRecord;
import com.phonepe.memstore.core.model.Relation;
import com.phonepe.memstore.core.model.RelationType;
import com.phonepe.memstore.core.store.MemoryRecordStore;
import com.phonepe.memstore.core.utils.MemoryUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Corrections, explicit forgetting and typed relations between memories
 */
@Slf4j
public class CorrectionManager {
    public static final double MIN_CORRECTION_IMPORTANCE = 0.7;
    public static final double CORRECTION_CONFIDENCE = 0.9;

    private final MemoryRecordStore store;

    public CorrectionManager(@NonNull MemoryRecordStore store) {
        this.store = store;
    }

    /**
     * Replace an active memory with a new one carrying the given content. The replacement inherits category,
     * project and tags, gets importance of at least {@value #MIN_CORRECTION_IMPORTANCE} and confidence
     * {@value #CORRECTION_CONFIDENCE}, and points at the old record through a {@link RelationType#SUPERSEDES} edge.
     * The old record is marked superseded only after the replacement and the edge exist. If any step after the
     * replacement is created fails, the replacement is retired and the failure is returned.
     *
     * @param reason optional note stored as context of the replacement
     */
    public OperationResult<CorrectionOutcome> correct(long oldId, String newContent, String reason, String sourceSession) {
        if (MemoryUtils.isBlank(newContent)) {
            return OperationResult.failure(ErrorType.INVALID_INPUT, "corrected content must not be blank");
        }
        final var old = store.get(oldId).orElse(null);
        if (null == old) {
            return OperationResult.failure(ErrorType.NOT_FOUND, oldId);
        }
        if (!old.isActive()) {
            return OperationResult.failure(ErrorType.ILLEGAL_TRANSITION,
                                           oldId,
                                           old.state().name().toLowerCase(Locale.ROOT),
                                           "corrected");
        }
        final var replacement = store.create(MemoryRecord.builder()
                                                     .category(old.getCategory())
                                                     .project(old.getProject())
                                                     .content(newContent)
                                                     .importance(Math.max(old.getImportance(),
                                                                          MIN_CORRECTION_IMPORTANCE))
                                                     .confidence(CORRECTION_CONFIDENCE)
                                                     .context(MemoryUtils.isBlank(reason)
                                                              ? "Correction of #%d".formatted(oldId)
                                                              : reason)
                                                     .sourceSession(sourceSession)
                                                     .build());
        try {
            final var oldTags = store.tags(oldId);
            if (!oldTags.isEmpty()) {
                store.addTags(replacement.getId(), oldTags);
            }
            store.addRelation(Relation.of(replacement.getId(), oldId, RelationType.SUPERSEDES));
            final var superseded = store.update(oldId,
                                                current -> MemoryLifecycle.supersede(current, replacement.getId()))
                    .orElseThrow(() -> MemoryStoreException.notFound(oldId));
            log.info("Memory #{} superseded by #{}", oldId, replacement.getId());
            return OperationResult.success(new CorrectionOutcome(superseded, replacement));
        }
        catch (MemoryStoreException e) {
            log.warn("Could not complete correction of memory #{}, retiring replacement #{}: {}",
                     oldId, replacement.getId(), e.getMessage());
            retireReplacement(replacement.getId());
            return OperationResult.failure(e);
        }
    }

    private void retireReplacement(long replacementId) {
        try {
            store.update(replacementId, MemoryLifecycle::forget);
        }
        catch (MemoryStoreException e) {
            log.error("Could not retire replacement #{} after a failed correction: {}", replacementId, e.getMessage());
        }
    }

    /**
     * Retire an active memory with no replacement. Unknown and already inactive memories are reported as not found
     * and left untouched.
     */
    public OperationResult<MemoryRecord> forget(long id) {
        final var existing = store.get(id).orElse(null);
        if (null == existing || !existing.isActive()) {
            return OperationResult.failure(notFoundOrForgotten(id));
        }
        try {
            final var forgotten = store.update(id, MemoryLifecycle::forget)
                    .orElseThrow(() -> MemoryStoreException.notFound(id));
            log.info("Forgotten memory #{}", id);
            return OperationResult.success(forgotten);
        }
        catch (MemoryStoreException e) {
            if (e.getErrorType() == ErrorType.ILLEGAL_TRANSITION || e.getErrorType() == ErrorType.NOT_FOUND) {
                return OperationResult.failure(notFoundOrForgotten(id));
            }
            throw e;
        }
    }

    /**
     * Link two existing memories. Inserting an edge that already exists is a successful no-op.
     *
     * @param relationType one of the {@link RelationType} wire values
     */
    public OperationResult<Relation> relate(long fromId, long toId, String relationType) {
        final var type = RelationType.fromValue(relationType).orElse(null);
        if (null == type) {
            return OperationResult.failure(ErrorType.INVALID_RELATION_TYPE, relationType, RelationType.validValues());
        }
        for (final var id : new long[]{fromId, toId}) {
            if (!store.exists(id)) {
                return OperationResult.failure(ErrorType.NOT_FOUND, id);
            }
        }
        final var relation = Relation.of(fromId, toId, type);
        if (store.addRelation(relation)) {
            log.info("Linked #{} --{}--> #{}", fromId, type.getValue(), toId);
        }
        else {
            log.debug("Relation #{} --{}--> #{} already exists", fromId, type.getValue(), toId);
        }
        return OperationResult.success(relation);
    }

    private static MemoryError notFoundOrForgotten(long id) {
        return new MemoryError(ErrorType.NOT_FOUND,
                               "Memory #%d not found or already forgotten".formatted(id));
    }
}
