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

package com.phonepe.memstore.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ErrorType {
    SUCCESS("Success"),
    NOT_FOUND("Memory #%s not found"),
    INVALID_CATEGORY("Invalid category '%s'. Use one of: %s"),
    INVALID_RELATION_TYPE("Invalid relation '%s'. Use one of: %s"),
    ILLEGAL_TRANSITION("Memory #%s is %s and cannot be %s"),
    INVALID_INPUT("Invalid input: %s"),
    STORE_UNAVAILABLE("Memory store unavailable: %s"),
    ;

    private final String message;
}
