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

package com.phonepe.memstore.core.service;

import com.phonepe.memstore.core.model.MemoryRecord;
import lombok.Value;

/**
 * A search result. The record reflects the access bookkeeping done for this retrieval.
 */
@Value
public class RecalledMemory {
    MemoryRecord record;
    double relevance;
    /**
     * True for superseded or retired records, which are only returned when explicitly requested
     */
    boolean inactive;
}
