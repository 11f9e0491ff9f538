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

package com.phonepe.memstore.core.utils;

import com.phonepe.memstore.core.model.MemoryCategory;
import com.phonepe.memstore.core.model.MemoryRecord;
import com.phonepe.memstore.core.store.MemoryRecordStore;
import lombok.experimental.UtilityClass;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

@UtilityClass
public class TestUtils {
    public static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");

    /**
     * Clock that only moves when told to
     */
    public static class MutableClock extends Clock {
        private Instant instant;

        public MutableClock(Instant instant) {
            this.instant = instant;
        }

        public void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }

    public static MemoryRecord save(MemoryRecordStore store, String content, double importance) {
        return save(store, content, MemoryCategory.FACTS, importance, 0, NOW);
    }

    public static MemoryRecord save(MemoryRecordStore store,
                                    String content,
                                    MemoryCategory category,
                                    double importance,
                                    int accessCount,
                                    Instant createdAt) {
        return store.create(MemoryRecord.builder()
                                    .content(content)
                                    .category(category)
                                    .importance(importance)
                                    .confidence(0.8)
                                    .accessCount(accessCount)
                                    .createdAt(createdAt)
                                    .build());
    }
}
