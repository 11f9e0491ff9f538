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

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExtractionSettings {
    public static final ExtractionSettings DEFAULT = ExtractionSettings.builder().build();

    /**
     * Only the tail of the transcript is sent to the producer
     */
    @Builder.Default
    int excerptLength = 4000;

    /**
     * Excerpts with fewer non-blank characters are not worth extracting from
     */
    @Builder.Default
    int minExcerptLength = 200;

    @Builder.Default
    int maxCandidates = 5;

    @Builder.Default
    int minContentLength = 10;

    @Builder.Default
    int maxTags = 5;

    @Builder.Default
    double defaultImportance = 0.5;

    @Builder.Default
    double defaultConfidence = 0.8;

    @Builder.Default
    String context = "Auto-extracted";
}
