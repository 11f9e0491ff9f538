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

import com.fasterxml.jackson.annotation.JsonClassDescription;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A memory proposed by a {@link CandidateProducer}. Values are untrusted and are validated on ingestion.
 */
@Value
@Builder
@Jacksonized
@JsonClassDescription("Knowledge worth remembering across sessions")
public class ExtractedCandidate {
    @JsonPropertyDescription("Concise statement (1-2 sentences). Written as a reusable fact, not as a narrative.")
    String content;

    @JsonPropertyDescription("One of: preferences, facts, corrections, decisions, project-knowledge, relationships, procedures")
    String category;

    @JsonPropertyDescription("0.0-1.0. Preferences/corrections: 0.7-0.9, decisions: 0.5-0.8, facts: 0.3-0.7")
    Double importance;

    @JsonPropertyDescription("0.0-1.0. Explicit statement: 0.9+, inferred: 0.6-0.8")
    Double confidence;

    @JsonPropertyDescription("1-3 relevant keywords")
    List<Object> tags;
}
