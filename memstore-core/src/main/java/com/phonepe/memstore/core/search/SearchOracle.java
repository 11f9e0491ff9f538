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

import java.util.List;

/**
 * Locates candidate memories for a text query. Results are a hint: callers re-apply lifecycle filtering and access
 * bookkeeping on whatever is returned.
 */
public interface SearchOracle {
    /**
     * @return hits ordered best first, at most {@code limit} of them
     */
    List<SearchHit> search(String query, SearchFilter filter, int limit);
}
