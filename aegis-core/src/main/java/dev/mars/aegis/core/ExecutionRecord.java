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

package dev.mars.aegis.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of an execution, as exposed by the status interface and kept by the
 * execution store.
 *
 * <p>This is the unit written to disk for audit and read back when a RUNNING execution has
 * to be resumed after the process that drove it went away: {@link #currentState()} and
 * {@link #payload()} are exactly what the interpreter needs to pick up again.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionRecord(
        String executionId,
        String workflowName,
        ExecutionStatus status,
        String currentState,
        JsonNode payload,
        List<ExecutionEvent> history,
        Instant startedAt,
        Instant deadline,
        Instant endedAt,
        String error,
        String cause) {

    public ExecutionRecord {
        Objects.requireNonNull(executionId, "executionId");
        Objects.requireNonNull(workflowName, "workflowName");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(startedAt, "startedAt");
        history = history != null ? List.copyOf(history) : List.of();
        payload = payload != null ? payload.deepCopy() : null;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    @JsonIgnore
    public Optional<Duration> getDuration() {
        return endedAt != null ? Optional.of(Duration.between(startedAt, endedAt)) : Optional.empty();
    }

    /**
     * Returns the history entries of one kind, in recorded order.
     */
    public List<ExecutionEvent> eventsOfKind(EventKind kind) {
        return history.stream().filter(event -> event.kind() == kind).toList();
    }
}
