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

package com.phonepe.memstore.core.search;

import com.phonepe.memstore.core.model.MemoryCategory;
import com.phonepe.memstore.core.model.MemoryRecord;
import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Filters applied to a search. A project filter also admits global (unscoped) memories.
 */
@Value
@Builder
public class SearchFilter {
    public static final SearchFilter ACTIVE_ONLY = SearchFilter.builder().build();

    MemoryCategory category;
    String project;
    boolean includeInactive;

    public boolean matches(final MemoryRecord record) {
        if (!includeInactive && !record.isActive()) {
            return false;
        }
        if (category != null && record.getCategory() != category) {
            return false;
        }
        return project == null
                || record.getProject() == null
                || Objects.equals(project, record.getProject());
    }
}
