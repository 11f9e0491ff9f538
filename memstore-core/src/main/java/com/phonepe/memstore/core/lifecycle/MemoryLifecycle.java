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

package com.phonepe.memstore.core.lifecycle;

import com.phonepe.memstore.core.errors.ErrorType;
import com.phonepe.memstore.core.errors.MemoryStoreException;
import com.phonepe.memstore.core.model.LifecycleState;
import com.phonepe.memstore.core.model.MemoryRecord;
import lombok.experimental.UtilityClass;

import java.util.Locale;

/**
 * Legal lifecycle transitions. Only {@link LifecycleState#ACTIVE} records can move, and they can only move to one of
 * the two terminal states:
 * <ul>
 *     <li>ACTIVE -&gt; SUPERSEDED: correction or deduplication merge, pointing at the replacement</li>
 *     <li>ACTIVE -&gt; RETIRED: explicit forget (own id) or decay driven retirement ({@link MemoryRecord#RETIRED_SENTINEL})</li>
 * </ul>
 * Every method returns a new copy meant to be used as a store mutator; the input is never modified.
 */
@UtilityClass
public class MemoryLifecycle {

    public static MemoryRecord supersede(final MemoryRecord record, long replacementId) {
        ensureActive(record, "superseded");
        if (replacementId <= 0 || replacementId == record.getId()) {
            throw new MemoryStoreException(ErrorType.INVALID_INPUT,
                                           "replacement of #%d must be another existing memory, got #%d"
                                                   .formatted(record.getId(), replacementId));
        }
        return record.withSupersededBy(replacementId);
    }

    public static MemoryRecord forget(final MemoryRecord record) {
        ensureActive(record, "forgotten");
        return record.withSupersededBy(record.getId());
    }

    public static MemoryRecord retire(final MemoryRecord record) {
        ensureActive(record, "retired");
        return record.withSupersededBy(MemoryRecord.RETIRED_SENTINEL);
    }

    private static void ensureActive(final MemoryRecord record, final String action) {
        final var state = record.state();
        if (state != LifecycleState.ACTIVE) {
            throw new MemoryStoreException(ErrorType.ILLEGAL_TRANSITION,
                                           record.getId(),
                                           state.name().toLowerCase(Locale.ROOT),
                                           action);
        }
    }
}
