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

package com.phonepe.memstore.core.extraction;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.memstore.core.utils.JsonUtils;
import com.phonepe.memstore.core.utils.MemoryUtils;
import lombok.SneakyThrows;

import java.util.List;
import java.util.Objects;

/**
 * Reads candidates out of model output: a JSON array, optionally wrapped in a Markdown code fence. Anything that is
 * not an array yields no candidates.
 */
public class JsonCandidateParser {
    private static final String FENCE = "```";

    private final ObjectMapper mapper;

    public JsonCandidateParser() {
        this(null);
    }

    public JsonCandidateParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
    }

    @SneakyThrows
    public List<ExtractedCandidate> parse(String modelOutput) {
        if (MemoryUtils.isBlank(modelOutput)) {
            return List.of();
        }
        final var json = mapper.readTree(stripFence(modelOutput.trim()));
        if (json == null || !json.isArray()) {
            return List.of();
        }
        return mapper.convertValue(json, new TypeReference<List<ExtractedCandidate>>() {
        });
    }

    static String stripFence(final String text) {
        if (!text.startsWith(FENCE)) {
            return text;
        }
        final var firstNewLine = text.indexOf('\n');
        if (firstNewLine < 0) {
            return "";
        }
        final var body = text.substring(firstNewLine + 1);
        final var closing = body.lastIndexOf(FENCE);
        return (closing < 0 ? body : body.substring(0, closing)).trim();
    }
}
