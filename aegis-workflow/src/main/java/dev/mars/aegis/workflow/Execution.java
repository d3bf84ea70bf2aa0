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

package dev.mars.aegis.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.mars.aegis.core.ErrorNames;
import dev.mars.aegis.core.EventKind;
import dev.mars.aegis.core.ExecutionEvent;
import dev.mars.aegis.core.ExecutionRecord;
import dev.mars.aegis.core.ExecutionStatus;
import dev.mars.aegis.core.WorkflowDefinition;
import dev.mars.aegis.core.exceptions.InvalidTransitionException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One run of a workflow definition.
 *
 * <p>Only the interpreter driving the execution mutates it; other threads read it through
 * {@link #snapshot()}. The history is append-only and the status can leave {@code RUNNING}
 * exactly once.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public class Execution {

    private final String executionId;
    private final WorkflowDefinition definition;
    private final Instant startedAt;
    private final Instant deadline;
    private final Clock clock;
    private final List<ExecutionEvent> history;

    private volatile ExecutionStatus status;
    private volatile String currentState;
    private volatile JsonNode payload;
    private volatile Instant endedAt;
    private volatile String error;
    private volatile String cause;

    private Execution(String executionId, WorkflowDefinition definition, JsonNode payload, String currentState,
                      List<ExecutionEvent> history, Instant startedAt, Instant deadline, Clock clock) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.definition = Objects.requireNonNull(definition, "Workflow definition cannot be null");
        this.startedAt = Objects.requireNonNull(startedAt, "Start time cannot be null");
        this.deadline = Objects.requireNonNull(deadline, "Deadline cannot be null");
        this.clock = clock;
        this.history = Collections.synchronizedList(new ArrayList<>(history));
        this.payload = payload != null ? payload.deepCopy() : JsonNodeFactory.instance.objectNode();
        this.currentState = currentState;
        this.status = ExecutionStatus.RUNNING;
    }

    /**
     * A new execution positioned on the definition's start state.
     */
    public static Execution start(String executionId, WorkflowDefinition definition, JsonNode input,
                                  Instant deadline, Clock clock) {
        return new Execution(executionId, definition, input, definition.getStartState(), List.of(),
                clock.instant(), deadline, clock);
    }

    /**
     * Rebuilds a persisted {@code RUNNING} execution so it can continue from its current state.
     */
    public static Execution restore(ExecutionRecord record, WorkflowDefinition definition, Clock clock) {
        if (record.status() != ExecutionStatus.RUNNING) {
            throw new IllegalStateException("Only running executions can be restored: "
                    + record.executionId() + " is " + record.status());
        }
        if (!definition.getName().equals(record.workflowName())) {
            throw new IllegalArgumentException("Record " + record.executionId() + " belongs to workflow "
                    + record.workflowName() + ", not " + definition.getName());
        }
        String resumeAt = record.currentState() != null ? record.currentState() : definition.getStartState();
        return new Execution(record.executionId(), definition, record.payload(), resumeAt, record.history(),
                record.startedAt(), record.deadline(), clock);
    }

    public String getExecutionId() {
        return executionId;
    }

    public WorkflowDefinition getDefinition() {
        return definition;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public String getCurrentState() {
        return currentState;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public String getError() {
        return error;
    }

    public String getCause() {
        return cause;
    }

    public List<ExecutionEvent> getHistory() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    void enter(String stateName) {
        this.currentState = stateName;
        record(stateName, EventKind.ENTERED, null);
    }

    void setPayload(JsonNode payload) {
        this.payload = payload;
    }

    void record(String stateName, EventKind kind, String detail) {
        history.add(new ExecutionEvent(clock.instant(), stateName, kind, detail));
    }

    void succeed() {
        transitionTo(ExecutionStatus.SUCCEEDED, null, null);
    }

    void fail(String error, String cause) {
        transitionTo(ExecutionStatus.FAILED,
                error != null && !error.isBlank() ? error : ErrorNames.RUNTIME,
                cause != null && !cause.isBlank() ? cause : "Execution failed in state " + currentState);
    }

    void timeOut() {
        transitionTo(ExecutionStatus.TIMED_OUT, ErrorNames.TIMEOUT,
                "Execution exceeded its deadline of " + deadline);
    }

    void cancel() {
        transitionTo(ExecutionStatus.CANCELLED, ErrorNames.CANCELLED, "Execution was cancelled");
    }

    private synchronized void transitionTo(ExecutionStatus target, String error, String cause) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(executionId, status, target);
        }
        this.error = error;
        this.cause = cause;
        this.endedAt = clock.instant();
        this.status = target;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public ExecutionRecord snapshot() {
        return new ExecutionRecord(executionId, definition.getName(), status, currentState, payload,
                getHistory(), startedAt, deadline, endedAt, error, cause);
    }

    @Override
    public String toString() {
        return "Execution{" +
               "executionId='" + executionId + '\'' +
               ", workflow='" + definition.getName() + '\'' +
               ", status=" + status +
               ", currentState='" + currentState + '\'' +
               '}';
    }
}
