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


package dev.mars.aegis.workflow.observability;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.mars.aegis.core.ExecutionRecord;
import dev.mars.aegis.core.ExecutionStatus;
import dev.mars.aegis.core.StateSpec;
import dev.mars.aegis.core.exceptions.TaskInvocationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WorkflowMetrics. The instance is shared, so assertions are relative to the
 * gauge value seen at the start of each test.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
class WorkflowMetricsTest {

    private WorkflowMetrics metrics;
    private long baseline;

    @BeforeEach
    void setUp() {
        metrics = WorkflowMetrics.getInstance();
        baseline = metrics.getActiveWorkflows();
    }

    private static ExecutionRecord record(String id, ExecutionStatus status) {
        Instant started = Instant.parse("2026-03-09T10:00:00Z");
        return new ExecutionRecord(id, "NaturalDisasterResponseWorkflow", status, "AssessEmergency",
                JsonNodeFactory.instance.objectNode(), List.of(), started, started.plusSeconds(1800),
                status.isTerminal() ? started.plusSeconds(42) : null,
                status == ExecutionStatus.FAILED ? "Report.Unavailable" : null, null);
    }

    @Test
    void testSingleton() {
        assertSame(metrics, WorkflowMetrics.getInstance());
    }

    @Test
    void testActiveGaugeFollowsLifecycle() {
        metrics.onExecutionStarted(record("m-1", ExecutionStatus.RUNNING));
        metrics.onExecutionStarted(record("m-2", ExecutionStatus.RUNNING));
        assertEquals(baseline + 2, metrics.getActiveWorkflows());

        metrics.onExecutionCompleted(record("m-1", ExecutionStatus.SUCCEEDED));
        assertEquals(baseline + 1, metrics.getActiveWorkflows());

        metrics.onExecutionCompleted(record("m-2", ExecutionStatus.FAILED));
        assertEquals(baseline, metrics.getActiveWorkflows());
    }

    @Test
    void testEveryTerminalStatusIsAccepted() {
        for (ExecutionStatus status : List.of(ExecutionStatus.TIMED_OUT, ExecutionStatus.CANCELLED)) {
            metrics.onExecutionStarted(record("m-" + status, ExecutionStatus.RUNNING));
            assertDoesNotThrow(() -> metrics.onExecutionCompleted(record("m-" + status, status)));
        }
        assertEquals(baseline, metrics.getActiveWorkflows());
    }

    @Test
    void testStateCallbacksDoNotTouchGauge() {
        ExecutionRecord running = record("m-3", ExecutionStatus.RUNNING);
        StateSpec.Succeed state = new StateSpec.Succeed("Done");

        metrics.onStateEntered(running, state);
        metrics.onStateFailed(running, state, new TaskInvocationException("States.TaskFailed", "boom"));

        assertEquals(baseline, metrics.getActiveWorkflows());
    }
}
