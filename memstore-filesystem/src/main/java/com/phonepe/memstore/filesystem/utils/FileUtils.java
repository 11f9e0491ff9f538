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

package com.phonepe.memstore.filesystem.utils;


import com.phonepe.memstore.core.errors.MemoryStoreException;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@UtilityClass
@Slf4j
public class FileUtils {

    /**
     * Ensures that the provided path exists and is a readable and writable directory, creating it if needed.
     *
     * @param path The path to check or create.
     * @return The absolute, normalized Path object representing the directory.
     * @throws MemoryStoreException with {@link com.phonepe.memstore.core.errors.ErrorType#STORE_UNAVAILABLE} if the
     *                              directory cannot be created or does not have the required permissions.
     */
    public static Path ensureDirectory(Path path) {
        final var absolutePath = path.toAbsolutePath().normalize();
        if (!Files.exists(absolutePath)) {
            try {
                Files.createDirectories(absolutePath);
            }
            catch (IOException e) {
                throw MemoryStoreException.unavailable("failed to create directory " + absolutePath, e);
            }
        }
        if (!Files.isDirectory(absolutePath) || !Files.isReadable(absolutePath) || !Files.isWritable(absolutePath)) {
            throw MemoryStoreException.unavailable(
                    "%s is not a readable and writable directory".formatted(absolutePath), null);
        }
        return absolutePath;
    }

    /**
     * Writes data to a temporary file next to the target and then moves it into place, so that readers never see a
     * partially written file.
     *
     * @param filePath The path of the file to write to.
     * @param data     The byte array data to write.
     */
    public static void writeAtomically(Path filePath, byte[] data) {
        final var directory = filePath.toAbsolutePath().getParent();
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, filePath.getFileName().toString(), ".tmp");
            Files.write(temp, data);
            try {
                Files.move(temp, filePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            }
            catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to plain replace", filePath);
                Files.move(temp, filePath, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        catch (IOException e) {
            deleteQuietly(temp);
            throw MemoryStoreException.unavailable("failed to write " + filePath, e);
        }
    }

    private static void deleteQuietly(Path path) {
        if (null == path) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        }
        catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", path, e.getMessage());
        }
    }
}
