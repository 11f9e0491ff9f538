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

import com.google.common.base.Strings;
import com.phonepe.memstore.core.model.MemoryRecord;
import com.phonepe.memstore.core.store.MemoryRecordStore;
import com.phonepe.memstore.core.utils.MemoryUtils;
import lombok.NonNull;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Scans the store and matches records containing every whitespace separated term of the query, case-insensitively,
 * in content, context or category. Relevance is the total number of term occurrences.
 */
public class KeywordSearchOracle implements SearchOracle {
    private final MemoryRecordStore store;

    public KeywordSearchOracle(@NonNull MemoryRecordStore store) {
        this.store = store;
    }

    @Override
    public List<SearchHit> search(String query, SearchFilter filter, int limit) {
        final var terms = terms(query);
        if (terms.isEmpty()) {
            return List.of();
        }
        final var effectiveFilter = Objects.requireNonNullElse(filter, SearchFilter.ACTIVE_ONLY);
        return store.query(effectiveFilter::matches, null, 0)
                .stream()
                .map(record -> new SearchHit(record.getId(), relevance(record, terms)))
                .filter(hit -> hit.getRelevance() > 0)
                .sorted(Comparator.comparingDouble(SearchHit::getRelevance)
                                .reversed()
                                .thenComparingLong(SearchHit::getMemoryId))
                .limit(limit > 0 ? limit : Long.MAX_VALUE)
                .toList();
    }

    private static List<String> terms(final String query) {
        if (MemoryUtils.isBlank(query)) {
            return List.of();
        }
        return Arrays.stream(query.toLowerCase(Locale.ROOT).trim().split("\\s+"))
                .filter(term -> !term.isEmpty())
                .distinct()
                .toList();
    }

    /**
     * Zero unless every term occurs at least once
     */
    private static double relevance(final MemoryRecord record, final List<String> terms) {
        final var haystack = String.join(" ",
                                         Strings.nullToEmpty(record.getContent()),
                                         Strings.nullToEmpty(record.getContext()),
                                         record.getCategory().getValue())
                .toLowerCase(Locale.ROOT);
        var total = 0;
        for (final var term : terms) {
            final var occurrences = occurrences(haystack, term);
            if (occurrences == 0) {
                return 0;
            }
            total += occurrences;
        }
        return total;
    }

    private static int occurrences(final String haystack, final String term) {
        var count = 0;
        var from = haystack.indexOf(term);
        while (from >= 0) {
            count++;
            from = haystack.indexOf(term, from + term.length());
        }
        return count;
    }
}
