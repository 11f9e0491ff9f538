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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.primitives.Longs;
import com.phonepe.memstore.core.errors.MemoryStoreException;
import com.phonepe.memstore.core.model.MemoryRecord;
import com.phonepe.memstore.core.model.Relation;
import com.phonepe.memstore.core.store.MemoryRecordStore;
import com.phonepe.memstore.core.store.MemoryRecords;
import com.phonepe.memstore.core.utils.JsonUtils;
import com.phonepe.memstore.core.utils.MemoryUtils;
import com.phonepe.memstore.filesystem.utils.FileUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.StampedLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Durable store keeping every record as a JSON document under {@code records/<id>.json}, and tags and relations in
 * {@code tags.json} and {@code relations.json}. Everything is cached in memory and loaded when the store is opened;
 * opening an existing directory again is safe. Files are replaced atomically, a failed write leaves both the file and
 * the cache untouched.
 * <p>
 * A single process is expected to own the directory.
 */
@Slf4j
public class FileSystemMemoryRecordStore implements MemoryRecordStore {
    private static final String RECORDS_DIR = "records";
    private static final String TAGS_FILE = "tags.json";
    private static final String RELATIONS_FILE = "relations.json";
    private static final String RECORD_SUFFIX = ".json";

    private final Path recordsRoot;
    private final Path tagsFile;
    private final Path relationsFile;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final ConcurrentHashMap<Long, MemoryRecord> records = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, Set<String>> tags = new ConcurrentHashMap<>();
    private final Set<Relation> relations = ConcurrentHashMap.newKeySet();
    private final AtomicLong sequence = new AtomicLong();
    private final StampedLock lock = new StampedLock();

    @Builder
    public FileSystemMemoryRecordStore(@NonNull String baseDir, ObjectMapper mapper, Clock clock) {
        final var root = FileUtils.ensureDirectory(Path.of(baseDir));
        this.recordsRoot = FileUtils.ensureDirectory(root.resolve(RECORDS_DIR));
        this.tagsFile = root.resolve(TAGS_FILE);
        this.relationsFile = root.resolve(RELATIONS_FILE);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        loadRecords();
        loadTags();
        loadRelations();
        log.info("Opened memory store at {} with {} records", root, records.size());
    }

    @Override
    public MemoryRecord create(@NonNull MemoryRecord record) {
        final var stamp = lock.writeLock();
        try {
            final var stored = MemoryRecords.prepareForCreate(record, sequence.get() + 1, clock.instant());
            persistRecord(stored);
            sequence.set(stored.getId());
            records.put(stored.getId(), stored);
            log.debug("Created memory #{} [{}]", stored.getId(), stored.getCategory().getValue());
            return stored;
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public Optional<MemoryRecord> get(long id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public Optional<MemoryRecord> update(long id, @NonNull UnaryOperator<MemoryRecord> mutator) {
        final var stamp = lock.writeLock();
        try {
            final var existing = records.get(id);
            if (null == existing) {
                return Optional.empty();
            }
            final var mutated = mutator.apply(existing);
            if (mutated == existing) {
                return Optional.of(existing);
            }
            final var updated = MemoryRecords.prepareForUpdate(existing, mutated, records::containsKey,
                                                               clock.instant());
            persistRecord(updated);
            records.put(id, updated);
            return Optional.of(updated);
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public List<MemoryRecord> query(Predicate<MemoryRecord> predicate, Comparator<MemoryRecord> order, int limit) {
        return MemoryRecords.select(records.values().stream(), predicate, order, limit);
    }

    @Override
    public Set<String> addTags(long id, Collection<String> newTags) {
        final var stamp = lock.writeLock();
        try {
            if (!records.containsKey(id)) {
                throw MemoryStoreException.notFound(id);
            }
            final var merged = new TreeSet<>(tags.getOrDefault(id, Set.of()));
            if (!merged.addAll(MemoryUtils.normalizeTags(newTags, 0))) {
                return merged;
            }
            final var snapshot = new TreeMap<Long, Set<String>>(tags);
            snapshot.put(id, merged);
            write(tagsFile, snapshot);
            tags.put(id, Set.copyOf(merged));
            return merged;
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public Set<String> tags(long id) {
        return new TreeSet<>(tags.getOrDefault(id, Set.of()));
    }

    @Override
    public boolean addRelation(@NonNull Relation relation) {
        final var stamp = lock.writeLock();
        try {
            if (!records.containsKey(relation.getFromId())) {
                throw MemoryStoreException.notFound(relation.getFromId());
            }
            if (!records.containsKey(relation.getToId())) {
                throw MemoryStoreException.notFound(relation.getToId());
            }
            if (relations.contains(relation)) {
                return false;
            }
            final var snapshot = new ArrayList<>(relations);
            snapshot.add(relation);
            snapshot.sort(MemoryRecords.RELATION_ORDER);
            write(relationsFile, snapshot);
            relations.add(relation);
            return true;
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public List<Relation> relations(long id) {
        return relations.stream()
                .filter(relation -> relation.touches(id))
                .sorted(MemoryRecords.RELATION_ORDER)
                .toList();
    }

    private void persistRecord(final MemoryRecord record) {
        write(recordsRoot.resolve(record.getId() + RECORD_SUFFIX), record);
    }

    private void write(final Path file, final Object value) {
        final byte[] data;
        try {
            data = mapper.writeValueAsBytes(value);
        }
        catch (IOException e) {
            throw MemoryStoreException.unavailable("failed to serialize " + file.getFileName(), e);
        }
        FileUtils.writeAtomically(file, data);
    }

    private void loadRecords() {
        try (final var paths = Files.list(recordsRoot)) {
            paths.filter(path -> path.getFileName().toString().endsWith(RECORD_SUFFIX))
                    .forEach(path -> {
                        idFromFileName(path).ifPresent(id -> sequence.accumulateAndGet(id, Math::max));
                        try {
                            final var record = mapper.readValue(path.toFile(), MemoryRecord.class);
                            records.put(record.getId(), record);
                            sequence.accumulateAndGet(record.getId(), Math::max);
                        }
                        catch (Exception e) {
                            log.error("Failed to load memory record from path: {}", path, e);
                        }
                    });
        }
        catch (IOException e) {
            throw MemoryStoreException.unavailable("failed to read " + recordsRoot, e);
        }
    }

    /**
     * Ids of unreadable files are never handed out again
     */
    private static Optional<Long> idFromFileName(final Path path) {
        final var name = path.getFileName().toString();
        return Optional.ofNullable(Longs.tryParse(name.substring(0, name.length() - RECORD_SUFFIX.length())));
    }

    private void loadTags() {
        if (!Files.exists(tagsFile)) {
            return;
        }
        try {
            final Map<Long, Set<String>> stored = mapper.readValue(tagsFile.toFile(),
                                                                   new TypeReference<Map<Long, Set<String>>>() {
                                                                   });
            stored.forEach((id, recordTags) -> {
                if (records.containsKey(id)) {
                    tags.put(id, Set.copyOf(recordTags));
                }
                else {
                    log.warn("Ignoring tags of unknown memory #{}", id);
                }
            });
        }
        catch (IOException e) {
            throw MemoryStoreException.unavailable("failed to read " + tagsFile, e);
        }
    }

    private void loadRelations() {
        if (!Files.exists(relationsFile)) {
            return;
        }
        try {
            final List<Relation> stored = mapper.readValue(relationsFile.toFile(),
                                                           new TypeReference<List<Relation>>() {
                                                           });
            stored.stream()
                    .filter(relation -> records.containsKey(relation.getFromId())
                            && records.containsKey(relation.getToId()))
                    .forEach(relations::add);
        }
        catch (IOException e) {
            throw MemoryStoreException.unavailable("failed to read " + relationsFile, e);
        }
    }
}
