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

package com.phonepe.memstore.core.store;

import com.phonepe.memstore.core.errors.ErrorType;
import com.phonepe.memstore.core.errors.MemoryStoreException;
import com.phonepe.memstore.core.model.MemoryCategory;
import com.phonepe.memstore.core.model.MemoryRecord;
import com.phonepe.memstore.core.model.Relation;
import com.phonepe.memstore.core.utils.MemoryUtils;
import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.LongPredicate;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Rules shared by all {@link MemoryRecordStore} implementations
 */
@UtilityClass
public class MemoryRecords {

    public static final Comparator<Relation> RELATION_ORDER = Comparator.comparingLong(Relation::getFromId)
            .thenComparingLong(Relation::getToId)
            .thenComparing(Relation::getType);

    public static MemoryRecord prepareForCreate(final MemoryRecord record, long id, final Instant now) {
        if (record.getCategory() == null) {
            throw new MemoryStoreException(ErrorType.INVALID_CATEGORY,
                                           "null",
                                           MemoryCategory.validValues());
        }
        if (MemoryUtils.isBlank(record.getContent())) {
            throw new MemoryStoreException(ErrorType.INVALID_INPUT, "content must not be blank");
        }
        return record.toBuilder()
                .id(id)
                .importance(MemoryUtils.clampUnit(record.getImportance()))
                .confidence(MemoryUtils.clampUnit(record.getConfidence()))
                .accessCount(Math.max(0, record.getAccessCount()))
                .createdAt(Objects.requireNonNullElse(record.getCreatedAt(), now))
                .updatedAt(now)
                .supersededBy(null)
                .lastDecayedAt(null)
                .build();
    }

    /**
     * Validates the output of an update mutator against the stored version and stamps {@code updatedAt}.
     *
     * @param exists used to check that a replacement id points to an existing record
     */
    public static MemoryRecord prepareForUpdate(final MemoryRecord before,
                                                final MemoryRecord after,
                                                final LongPredicate exists,
                                                final Instant now) {
        Objects.requireNonNull(after, "Mutator must not return null");
        if (after.getId() != before.getId()
                || !Objects.equals(after.getCreatedAt(), before.getCreatedAt())
                || !Objects.equals(after.getSourceSession(), before.getSourceSession())
                || Double.compare(after.getConfidence(), before.getConfidence()) != 0) {
            throw new MemoryStoreException(ErrorType.INVALID_INPUT,
                                           "id, createdAt, sourceSession and confidence of #%d are immutable"
                                                   .formatted(before.getId()));
        }
        if (!before.isActive() && !Objects.equals(before.getSupersededBy(), after.getSupersededBy())) {
            throw new MemoryStoreException(ErrorType.ILLEGAL_TRANSITION,
                                           before.getId(),
                                           before.state().name().toLowerCase(Locale.ROOT),
                                           "moved to another state");
        }
        final var supersededBy = after.getSupersededBy();
        if (supersededBy != null
                && supersededBy > 0
                && supersededBy != before.getId()
                && !exists.test(supersededBy)) {
            throw MemoryStoreException.notFound(supersededBy);
        }
        return after.withUpdatedAt(now);
    }

    public static List<MemoryRecord> select(final Stream<MemoryRecord> records,
                                            final Predicate<MemoryRecord> predicate,
                                            final Comparator<MemoryRecord> order,
                                            int limit) {
        var stream = records.filter(predicate == null ? r -> true : predicate);
        if (order != null) {
            stream = stream.sorted(order);
        }
        if (limit > 0) {
            stream = stream.limit(limit);
        }
        return stream.toList();
    }
}
