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

/**
 * Lifecycle state of a memory record. Derived from {@link MemoryRecord#getSupersededBy()}.
 */
public enum LifecycleState {
    /**
     * No replacement and not retired. Eligible for retrieval and ranking.
     */
    ACTIVE,
    /**
     * Replaced by another record through a correction or a deduplication merge
     */
    SUPERSEDED,
    /**
     * Removed from circulation with no replacement, either forgotten or retired by decay
     */
    RETIRED,
    ;

    public static LifecycleState of(final MemoryRecord record) {
        final var supersededBy = record.getSupersededBy();
        if (supersededBy == null) {
            return ACTIVE;
        }
        if (supersededBy <= 0 || supersededBy == record.getId()) {
            return RETIRED;
        }
        return SUPERSEDED;
    }
}
