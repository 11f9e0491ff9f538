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

package com.phonepe.memstore.core.store;

import com.phonepe.memstore.core.errors.MemoryStoreException;
import com.phonepe.memstore.core.model.MemoryRecord;
import com.phonepe.memstore.core.model.Relation;
import com.phonepe.memstore.core.utils.MemoryUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Non durable store. Useful for tests and short-lived processes.
 */
@Slf4j
public class InMemoryMemoryRecordStore implements MemoryRecordStore {

    private final Map<Long, MemoryRecord> records = new ConcurrentHashMap<>();
    private final Map<Long, Set<String>> tags = new ConcurrentHashMap<>();
    private final Set<Relation> relations = ConcurrentHashMap.newKeySet();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryMemoryRecordStore() {
        this(Clock.systemUTC());
    }

    public InMemoryMemoryRecordStore(@NonNull Clock clock) {
        this.clock = clock;
    }

    @Override
    public MemoryRecord create(@NonNull MemoryRecord record) {
        final var stored = MemoryRecords.prepareForCreate(record, sequence.incrementAndGet(), clock.instant());
        records.put(stored.getId(), stored);
        log.debug("Created memory #{} [{}]", stored.getId(), stored.getCategory().getValue());
        return stored;
    }

    @Override
    public Optional<MemoryRecord> get(long id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public Optional<MemoryRecord> update(long id, @NonNull UnaryOperator<MemoryRecord> mutator) {
        return Optional.ofNullable(records.computeIfPresent(id, (key, existing) -> {
            final var mutated = mutator.apply(existing);
            if (mutated == existing) {
                return existing;
            }
            return MemoryRecords.prepareForUpdate(existing, mutated, records::containsKey, clock.instant());
        }));
    }

    @Override
    public List<MemoryRecord> query(Predicate<MemoryRecord> predicate, Comparator<MemoryRecord> order, int limit) {
        return MemoryRecords.select(records.values().stream(), predicate, order, limit);
    }

    @Override
    public Set<String> addTags(long id, Collection<String> newTags) {
        if (!records.containsKey(id)) {
            throw MemoryStoreException.notFound(id);
        }
        final var normalized = MemoryUtils.normalizeTags(newTags, 0);
        final var updated = tags.compute(id, (key, existing) -> {
            final var merged = existing == null ? new TreeSet<String>() : new TreeSet<>(existing);
            merged.addAll(normalized);
            return Set.copyOf(merged);
        });
        return new TreeSet<>(updated);
    }

    @Override
    public Set<String> tags(long id) {
        return new TreeSet<>(tags.getOrDefault(id, Set.of()));
    }

    @Override
    public boolean addRelation(@NonNull Relation relation) {
        if (!records.containsKey(relation.getFromId())) {
            throw MemoryStoreException.notFound(relation.getFromId());
        }
        if (!records.containsKey(relation.getToId())) {
            throw MemoryStoreException.notFound(relation.getToId());
        }
        return relations.add(relation);
    }

    @Override
    public List<Relation> relations(long id) {
        return relations.stream()
                .filter(relation -> relation.touches(id))
                .sorted(MemoryRecords.RELATION_ORDER)
                .toList();
    }
}
