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
import lombok.extern.jackson.Jacksonized;

/**
 * Directed, typed edge between two memories. A (from, to, type) triple is stored at most once.
 */
@Value
@Builder
@Jacksonized
public class Relation {
    long fromId;
    long toId;
    RelationType type;

    public static Relation of(long fromId, long toId, RelationType type) {
        return new Relation(fromId, toId, type);
    }

    public boolean touches(long id) {
        return fromId == id || toId == id;
    }
}
