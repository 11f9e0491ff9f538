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

package com.phonepe.memstore.core.model;

import com.phonepe.memstore.core.scoring.MemoryScorer;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;

/**
 * Orderings supported when listing memories
 */
@Getter
@AllArgsConstructor
public enum SortOrder {
    SCORE("score"),
    RECENCY("recency"),
    IMPORTANCE("importance"),
    ACCESSED("accessed"),
    ;

    private final String value;

    /**
     * Unknown or missing values fall back to {@link #SCORE}
     */
    public static SortOrder fromValue(final String value) {
        return Arrays.stream(values())
                .filter(order -> order.value.equals(value))
                .findFirst()
                .orElse(SCORE);
    }

    public Comparator<MemoryRecord> comparator(final Instant now) {
        final Comparator<MemoryRecord> byId = Comparator.comparingLong(MemoryRecord::getId);
        return switch (this) {
            case SCORE -> MemoryScorer.byScoreDescending(now);
            case RECENCY -> Comparator.comparing(MemoryRecord::getCreatedAt,
                                                 Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
                    .reversed()
                    .thenComparing(byId.reversed());
            case IMPORTANCE -> Comparator.comparingDouble(MemoryRecord::getImportance)
                    .reversed()
                    .thenComparing(byId);
            case ACCESSED -> Comparator.comparingInt(MemoryRecord::getAccessCount)
                    .reversed()
                    .thenComparing(byId);
        };
    }
}
