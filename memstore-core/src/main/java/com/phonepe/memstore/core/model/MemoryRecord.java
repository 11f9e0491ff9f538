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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A single stored memory. Instances are immutable; every mutation produces a new copy that the store swaps in
 * atomically.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class MemoryRecord {
    /**
     * Value of {@link #supersededBy} for records retired by decay
     */
    public static final long RETIRED_SENTINEL = -1L;

    /**
     * Assigned by the store, monotonically increasing
     */
    long id;

    MemoryCategory category;

    String content;

    /**
     * Where or when this was learned
     */
    String context;

    /**
     * Project scope. Null means the memory is global.
     */
    String project;

    double importance;

    double confidence;

    int accessCount;

    Instant lastAccessed;

    Instant createdAt;

    Instant updatedAt;

    String sourceSession;

    /**
     * Null when active, id of the replacement when superseded, own id or {@link #RETIRED_SENTINEL} when retired
     */
    Long supersededBy;

    /**
     * Last time the consolidation sweep reduced the importance of this record
     */
    Instant lastDecayedAt;

    @JsonIgnore
    public LifecycleState state() {
        return LifecycleState.of(this);
    }

    @JsonIgnore
    public boolean isActive() {
        return supersededBy == null;
    }
}
