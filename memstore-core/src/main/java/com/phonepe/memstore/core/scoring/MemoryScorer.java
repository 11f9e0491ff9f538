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

package com.phonepe.memstore.core.scoring;

import com.phonepe.memstore.core.model.MemoryRecord;
import lombok.experimental.UtilityClass;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;

/**
 * Relevance score of a memory:
 * <pre>
 *     importance * confidence * (1 + accessCount * 0.1) * 0.998 ^ ageInHours
 * </pre>
 * Pure function of the record and the supplied instant. Nothing is read from or written to the store.
 */
@UtilityClass
public class MemoryScorer {
    public static final double ACCESS_BOOST_PER_HIT = 0.1;
    public static final double HOURLY_DECAY_BASE = 0.998;
    /**
     * Used when the creation time is unknown
     */
    public static final double UNKNOWN_AGE_DECAY = 0.5;

    private static final double MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();

    public static double score(final MemoryRecord record, final Instant now) {
        return record.getImportance()
                * record.getConfidence()
                * frequencyBoost(record.getAccessCount())
                * timeDecay(record.getCreatedAt(), now);
    }

    public static double frequencyBoost(int accessCount) {
        return 1.0 + Math.max(0, accessCount) * ACCESS_BOOST_PER_HIT;
    }

    /**
     * In (0, 1]. Records created in the future are treated as brand new.
     */
    public static double timeDecay(final Instant createdAt, final Instant now) {
        if (createdAt == null || now == null) {
            return UNKNOWN_AGE_DECAY;
        }
        final var ageHours = Duration.between(createdAt, now).toMillis() / MILLIS_PER_HOUR;
        return Math.pow(HOURLY_DECAY_BASE, Math.max(0.0, ageHours));
    }

    /**
     * Highest score first, ties broken by lower id
     */
    public static Comparator<MemoryRecord> byScoreDescending(final Instant now) {
        return Comparator.<MemoryRecord>comparingDouble(record -> score(record, now))
                .reversed()
                .thenComparingLong(MemoryRecord::getId);
    }
}
