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

import lombok.Value;

/**
 * Outcome of a caller facing operation. Exactly one of {@link #data} and a non-success {@link #error} is meaningful.
 */
@Value
public class OperationResult<T> {
    T data;
    MemoryError error;

    public static <T> OperationResult<T> success(T data) {
        return new OperationResult<>(data, MemoryError.success());
    }

    public static <T> OperationResult<T> failure(MemoryError error) {
        return new OperationResult<>(null, error);
    }

    public static <T> OperationResult<T> failure(ErrorType errorType, Object... args) {
        return failure(MemoryError.error(errorType, args));
    }

    public static <T> OperationResult<T> failure(MemoryStoreException exception) {
        return failure(MemoryError.from(exception));
    }

    public boolean isSuccess() {
        return error.getErrorType() == ErrorType.SUCCESS;
    }
}
