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

import lombok.Getter;

/**
 * Raised by stores and lifecycle transitions. Converted to a {@link MemoryError} at the service boundary.
 */
@Getter
public class MemoryStoreException extends RuntimeException {
    private final ErrorType errorType;

    public MemoryStoreException(ErrorType errorType, Object... args) {
        super(String.format(errorType.getMessage(), args));
        this.errorType = errorType;
    }

    public MemoryStoreException(ErrorType errorType, Throwable cause, Object... args) {
        super(String.format(errorType.getMessage(), args), cause);
        this.errorType = errorType;
    }

    public static MemoryStoreException notFound(long id) {
        return new MemoryStoreException(ErrorType.NOT_FOUND, id);
    }

    public static MemoryStoreException unavailable(String reason, Throwable cause) {
        return new MemoryStoreException(ErrorType.STORE_UNAVAILABLE, cause, reason);
    }
}
