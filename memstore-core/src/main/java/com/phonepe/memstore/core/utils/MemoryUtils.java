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

import com.google.common.base.Strings;
import lombok.experimental.UtilityClass;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

@UtilityClass
public class MemoryUtils {

    public static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Key used to detect duplicate content: trimmed and lower-cased
     */
    public static String normalizeContent(final String content) {
        return Strings.nullToEmpty(content).trim().toLowerCase(Locale.ROOT);
    }

    public static String normalizeTag(final String tag) {
        return Strings.nullToEmpty(tag).trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Normalizes tags, drops blanks and duplicates and keeps at most {@code limit} of them in input order.
     * A non-positive limit keeps everything.
     */
    public static Set<String> normalizeTags(final Collection<String> tags, int limit) {
        final var normalized = new LinkedHashSet<String>();
        if (tags == null) {
            return normalized;
        }
        for (final var tag : tags) {
            if (limit > 0 && normalized.size() >= limit) {
                break;
            }
            final var clean = normalizeTag(tag);
            if (!clean.isEmpty()) {
                normalized.add(clean);
            }
        }
        return normalized;
    }

    public static boolean isBlank(final String value) {
        return Strings.isNullOrEmpty(value) || value.isBlank();
    }

    public static Throwable rootCause(final Throwable leaf) {
        Throwable cause = Objects.requireNonNull(leaf);
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
