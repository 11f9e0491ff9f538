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

package com.phonepe.memstore.filesystem.store;

import com.phonepe.memstore.core.errors.ErrorType;
import com.phonepe.memstore.core.errors.MemoryStoreException;
import com.phonepe.memstore.core.lifecycle.MemoryLifecycle;
import com.phonepe.memstore.core.model.MemoryCategory;
import com.phonepe.memstore.core.model.MemoryRecord;
import com.phonepe.memstore.core.model.NewMemory;
import com.phonepe.memstore.core.model.Relation;
import com.phonepe.memstore.core.model.RelationType;
import com.phonepe.memstore.core.service.MemoryService;
import com.phonepe.memstore.core.utils.JsonUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSystemMemoryRecordStoreTest {
    private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private Clock clock;
    private FileSystemMemoryRecordStore store;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = open();
    }

    private FileSystemMemoryRecordStore open() {
        return FileSystemMemoryRecordStore.builder()
                .baseDir(tempDir.toString())
                .mapper(JsonUtils.createMapper())
                .clock(clock)
                .build();
    }

    private MemoryRecord save(String content, double importance) {
        return store.create(MemoryRecord.builder()
                                    .content(content)
                                    .category(MemoryCategory.DECISIONS)
                                    .project("billing")
                                    .context("design review")
                                    .importance(importance)
                                    .confidence(0.7)
                                    .sourceSession("session-1")
                                    .createdAt(NOW.minus(Duration.ofDays(3)))
                                    .build());
    }

    @Test
    void testLayoutOnDisk() {
        final var stored = save("Use the outbox pattern", 0.6);
        store.addTags(stored.getId(), List.of("Kafka"));
        assertTrue(Files.exists(tempDir.resolve("records").resolve(stored.getId() + ".json")));
        assertTrue(Files.exists(tempDir.resolve("tags.json")));
        assertFalse(Files.exists(tempDir.resolve("relations.json")));
    }

    @Test
    void testStateSurvivesReopen() {
        final var first = save("Use the outbox pattern", 0.6);
        final var second = save("Publish events through Kafka", 0.8);
        store.addTags(first.getId(), List.of(" Kafka ", "Events"));
        store.addRelation(Relation.of(second.getId(), first.getId(), RelationType.REFINES));
        final var forgotten = store.update(second.getId(), MemoryLifecycle::forget).orElseThrow();

        final var reopened = open();

        assertEquals(first, reopened.get(first.getId()).orElseThrow());
        assertEquals(forgotten, reopened.get(second.getId()).orElseThrow());
        assertEquals(Set.of("kafka", "events"), reopened.tags(first.getId()));
        assertEquals(List.of(Relation.of(second.getId(), first.getId(), RelationType.REFINES)),
                     reopened.relations(first.getId()));
        assertEquals(1, reopened.active().size());
        assertEquals(3, reopened.create(MemoryRecord.builder()
                                                .content("after reopen")
                                                .category(MemoryCategory.FACTS)
                                                .build()).getId());
    }

    @Test
    void testCorruptRecordIsSkippedAndItsIdNotReused() throws Exception {
        save("first", 0.5);
        final var second = save("second", 0.5);
        Files.writeString(tempDir.resolve("records").resolve(second.getId() + ".json"), "{not json");

        final var reopened = open();

        assertTrue(reopened.get(second.getId()).isEmpty());
        assertEquals(1, reopened.active().size());
        assertEquals(3, reopened.create(MemoryRecord.builder()
                                                .content("third")
                                                .category(MemoryCategory.FACTS)
                                                .build()).getId());
    }

    @Test
    void testRelationIdempotence() {
        final var first = save("first", 0.5);
        final var second = save("second", 0.5);
        assertTrue(store.addRelation(Relation.of(first.getId(), second.getId(), RelationType.SUPPORTS)));
        assertFalse(store.addRelation(Relation.of(first.getId(), second.getId(), RelationType.SUPPORTS)));
        assertEquals(1, open().relations(second.getId()).size());
        assertEquals(ErrorType.NOT_FOUND,
                     assertThrows(MemoryStoreException.class,
                                  () -> store.addRelation(Relation.of(first.getId(), 9, RelationType.SUPPORTS)))
                             .getErrorType());
    }

    @Test
    void testFailedUpdateLeavesRecordUntouched() {
        final var stored = save("first", 0.5);
        assertThrows(MemoryStoreException.class,
                     () -> store.update(stored.getId(), record -> MemoryLifecycle.supersede(record, 42)));
        assertEquals(stored, open().get(stored.getId()).orElseThrow());
    }

    @Test
    void testUnusableDirectoryIsUnavailable() throws Exception {
        final var file = Files.writeString(tempDir.resolve("not-a-directory"), "x");
        final var error = assertThrows(MemoryStoreException.class,
                                       () -> FileSystemMemoryRecordStore.builder()
                                               .baseDir(file.toString())
                                               .build());
        assertEquals(ErrorType.STORE_UNAVAILABLE, error.getErrorType());
    }

    @Test
    void testWorksBehindMemoryService() {
        final var service = MemoryService.builder().store(store).clock(clock).build();
        final var original = service.remember(NewMemory.builder()
                                                      .content("Service runs on Java 11")
                                                      .category("facts")
                                                      .tag("runtime")
                                                      .build())
                .getData();
        final var corrected = service.correct(original.getId(), "Service runs on Java 17", "upgrade", null);
        assertTrue(corrected.isSuccess());

        final var reopened = MemoryService.builder().store(open()).clock(clock).build();
        final var history = reopened.history(original.getId()).getData();
        assertEquals(2, history.size());
        assertEquals("Service runs on Java 17", history.get(1).getContent());
        final var recalled = reopened.recall("java", null, null, 10, false).getData();
        assertEquals(1, recalled.size());
        assertEquals(corrected.getData().getReplacement().getId(), recalled.get(0).getRecord().getId());
        assertEquals(Set.of("runtime"), open().tags(corrected.getData().getReplacement().getId()));
    }
}
