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

import com.phonepe.memstore.core.model.MemoryRecord;
import com.phonepe.memstore.core.model.Relation;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Durable home of memory records, their tags and the relations between them. This is the only shared mutable
 * state; every other component talks to the others through it.
 * <p>
 * Implementations must guarantee that:
 * <ul>
 *     <li>an update of a single record is atomic and readers see it fully before or fully after</li>
 *     <li>ids are assigned monotonically and never reused</li>
 *     <li>records are never physically removed</li>
 * </ul>
 * Failures to reach the underlying storage are reported as
 * {@link com.phonepe.memstore.core.errors.ErrorType#STORE_UNAVAILABLE}.
 */
public interface MemoryRecordStore {

    /**
     * Store a new record. The store assigns the id and {@code updatedAt}, sets {@code createdAt} to now unless the
     * record already carries one, and clamps importance and confidence into [0, 1].
     *
     * @param record record to save. Id and lifecycle fields are ignored; new records are always active.
     * @return the record as stored
     */
    MemoryRecord create(MemoryRecord record);

    Optional<MemoryRecord> get(long id);

    /**
     * Atomically replace a record with the output of the mutator. If the mutator returns the very same instance
     * nothing is written. Exceptions thrown by the mutator abort the update and are propagated.
     *
     * @return the record after the update, empty if no such record exists
     */
    Optional<MemoryRecord> update(long id, UnaryOperator<MemoryRecord> mutator);

    /**
     * @param limit maximum number of records to return, non-positive for no limit
     */
    List<MemoryRecord> query(Predicate<MemoryRecord> predicate, Comparator<MemoryRecord> order, int limit);

    /**
     * Attach tags to a record. Tags already present are ignored.
     *
     * @return the full set of tags on the record after the operation
     */
    Set<String> addTags(long id, Collection<String> tags);

    Set<String> tags(long id);

    /**
     * Insert an edge. Both endpoints must exist at this point.
     *
     * @return true if the edge was created, false if an identical one already existed
     */
    boolean addRelation(Relation relation);

    /**
     * All edges starting or ending at the given record
     */
    List<Relation> relations(long id);

    default boolean exists(long id) {
        return get(id).isPresent();
    }

    default List<MemoryRecord> active() {
        return query(MemoryRecord::isActive, Comparator.comparingLong(MemoryRecord::getId), 0);
    }
}
