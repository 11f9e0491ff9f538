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

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Counts over the store. Breakdowns cover active records only.
 */
@Value
@Builder
public class MemoryStats {
    public static final String GLOBAL_PROJECT = "global";

    long totalActive;
    long totalSuperseded;
    long totalRetired;
    Map<String, Long> byCategory;
    /**
     * Unscoped memories are counted under {@link #GLOBAL_PROJECT}
     */
    Map<String, Long> byProject;
    List<MemoryRecord> mostAccessed;
}
