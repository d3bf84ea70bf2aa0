/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.aegis.workflow.store;

import dev.mars.aegis.core.ExecutionRecord;
import dev.mars.aegis.core.ExecutionStatus;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Sink for execution snapshots, used for status queries, audit and resumption.
 * Saving a record replaces any earlier record with the same execution ID.
 *
 * <p>Implementations must be safe for concurrent use. Storage failures surface as unchecked
 * exceptions.</p>
 */
public interface ExecutionStore {

    void save(ExecutionRecord record);

    Optional<ExecutionRecord> find(String executionId);

    List<ExecutionRecord> findAll();

    List<ExecutionRecord> findByStatus(ExecutionStatus status);

    boolean remove(String executionId);

    /**
     * Removes terminal records that ended more than {@code maxAge} ago.
     *
     * @return the number of records removed
     */
    int cleanupTerminated(Duration maxAge);
}
