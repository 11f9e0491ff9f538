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

package com.phonepe.memstore.core.consolidation;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Thresholds used by the {@link ConsolidationSweep}
 */
@Value
@Builder
public class ConsolidationSettings {
    public static final ConsolidationSettings DEFAULT = ConsolidationSettings.builder().build();

    /**
     * Minimum age of an unaccessed record before its importance starts decaying
     */
    @Builder.Default
    Duration decayAge = Duration.ofDays(30);

    /**
     * Minimum time between two decays of the same record
     */
    @Builder.Default
    Duration decayInterval = Duration.ofDays(30);

    @Builder.Default
    double decayFactor = 0.9;

    /**
     * Importance at or below which decay stops
     */
    @Builder.Default
    double decayFloor = 0.1;

    /**
     * Records below this importance are retired once old enough
     */
    @Builder.Default
    double retirementImportance = 0.1;

    @Builder.Default
    Duration retirementAge = Duration.ofDays(90);
}
