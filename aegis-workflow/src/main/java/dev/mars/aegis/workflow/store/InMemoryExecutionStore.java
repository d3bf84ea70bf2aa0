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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Execution store backed by a concurrent map. Records do not survive the process.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public class InMemoryExecutionStore implements ExecutionStore {

    private static final Logger logger = Logger.getLogger(InMemoryExecutionStore.class.getName());

    private final Map<String, ExecutionRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryExecutionStore() {
        this(Clock.systemUTC());
    }

    public InMemoryExecutionStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    @Override
    public void save(ExecutionRecord record) {
        Objects.requireNonNull(record, "Execution record cannot be null");
        records.put(record.executionId(), record);
    }

    @Override
    public Optional<ExecutionRecord> find(String executionId) {
        return executionId == null ? Optional.empty() : Optional.ofNullable(records.get(executionId));
    }

    @Override
    public List<ExecutionRecord> findAll() {
        return records.values().stream()
                .sorted(Comparator.comparing(ExecutionRecord::startedAt))
                .collect(Collectors.toList());
    }

    @Override
    public List<ExecutionRecord> findByStatus(ExecutionStatus status) {
        return records.values().stream()
                .filter(record -> record.status() == status)
                .sorted(Comparator.comparing(ExecutionRecord::startedAt))
                .collect(Collectors.toList());
    }

    @Override
    public boolean remove(String executionId) {
        return executionId != null && records.remove(executionId) != null;
    }

    @Override
    public int cleanupTerminated(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        List<String> expired = new ArrayList<>();
        for (ExecutionRecord record : records.values()) {
            if (record.isTerminal() && record.endedAt() != null && record.endedAt().isBefore(cutoff)) {
                expired.add(record.executionId());
            }
        }
        expired.forEach(records::remove);
        if (!expired.isEmpty()) {
            logger.info("Removed " + expired.size() + " terminated execution records older than " + maxAge);
        }
        return expired.size();
    }
}
