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

import dev.mars.aegis.core.ExecutionRecord;
import dev.mars.aegis.core.StateSpec;
import dev.mars.aegis.core.exceptions.WorkflowErrorException;
import dev.mars.aegis.workflow.ExecutionListener;
import dev.mars.aegis.workflow.PolicyDecision;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the Aegis workflow engine, fed as an {@link ExecutionListener}.
 *
 * Provides the following metrics:
 * - aegis.workflow.active (gauge) - Currently running executions
 * - aegis.workflow.total (counter) - Executions started or resumed
 * - aegis.workflow.completed (counter) - Executions ending SUCCEEDED
 * - aegis.workflow.failed (counter) - Executions ending FAILED
 * - aegis.workflow.timed_out (counter) - Executions ending TIMED_OUT
 * - aegis.workflow.cancelled (counter) - Executions ending CANCELLED
 * - aegis.workflow.states.total (counter) - States entered, by state type
 * - aegis.workflow.states.failed (counter) - State failures, by error name
 * - aegis.workflow.retries (counter) - Retries scheduled by retry policies
 * - aegis.workflow.duration.seconds (histogram) - Execution duration distribution
 *
 * Without an OpenTelemetry SDK installed the global meter is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-27
 * @version 2.0
 */
public class WorkflowMetrics implements ExecutionListener {

    private static final Logger logger = Logger.getLogger(WorkflowMetrics.class.getName());
    private static final String METER_NAME = "aegis-workflow";

    // Singleton instance
    private static WorkflowMetrics instance;

    // Counters
    private final LongCounter workflowsTotal;
    private final LongCounter workflowsCompleted;
    private final LongCounter workflowsFailed;
    private final LongCounter workflowsTimedOut;
    private final LongCounter workflowsCancelled;
    private final LongCounter statesTotal;
    private final LongCounter statesFailed;
    private final LongCounter retries;

    // Histograms
    private final DoubleHistogram workflowDuration;

    // Gauges (backed by AtomicLong)
    private final AtomicLong activeWorkflows = new AtomicLong(0);

    // Attribute keys
    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> STATE_TYPE_KEY = AttributeKey.stringKey("state.type");
    private static final AttributeKey<String> ERROR_NAME_KEY = AttributeKey.stringKey("error.name");

    private WorkflowMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        workflowsTotal = counter(meter, "aegis.workflow.total", "Total number of executions started or resumed");
        workflowsCompleted = counter(meter, "aegis.workflow.completed", "Number of executions that succeeded");
        workflowsFailed = counter(meter, "aegis.workflow.failed", "Number of executions that failed");
        workflowsTimedOut = counter(meter, "aegis.workflow.timed_out", "Number of executions that exceeded their deadline");
        workflowsCancelled = counter(meter, "aegis.workflow.cancelled", "Number of cancelled executions");
        statesTotal = counter(meter, "aegis.workflow.states.total", "Total number of states entered");
        statesFailed = counter(meter, "aegis.workflow.states.failed", "Number of state failures");
        retries = counter(meter, "aegis.workflow.retries", "Number of retries scheduled by retry policies");

        workflowDuration = meter.histogramBuilder("aegis.workflow.duration.seconds")
                .setDescription("Execution duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("aegis.workflow.active")
                .setDescription("Number of currently running executions")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeWorkflows.get()));

        logger.info("WorkflowMetrics initialized");
    }

    private static LongCounter counter(Meter meter, String name, String description) {
        return meter.counterBuilder(name)
                .setDescription(description)
                .setUnit("1")
                .build();
    }

    /**
     * Get the singleton instance of WorkflowMetrics.
     */
    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics();
        }
        return instance;
    }

    @Override
    public void onExecutionStarted(ExecutionRecord record) {
        workflowsTotal.add(1, workflowAttributes(record));
        activeWorkflows.incrementAndGet();
    }

    @Override
    public void onStateEntered(ExecutionRecord record, StateSpec state) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, record.workflowName())
                .put(STATE_TYPE_KEY, state.type().getValue())
                .build();
        statesTotal.add(1, attrs);
    }

    @Override
    public void onStateFailed(ExecutionRecord record, StateSpec state, WorkflowErrorException error) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, record.workflowName())
                .put(STATE_TYPE_KEY, state.type().getValue())
                .put(ERROR_NAME_KEY, error.getErrorName())
                .build();
        statesFailed.add(1, attrs);
    }

    @Override
    public void onRetry(ExecutionRecord record, StateSpec state, PolicyDecision.Retry retry) {
        retries.add(1, workflowAttributes(record));
    }

    @Override
    public void onExecutionCompleted(ExecutionRecord record) {
        activeWorkflows.decrementAndGet();
        Attributes attrs = workflowAttributes(record);

        switch (record.status()) {
            case SUCCEEDED:
                workflowsCompleted.add(1, attrs);
                break;
            case FAILED:
                workflowsFailed.add(1, Attributes.builder()
                        .put(WORKFLOW_NAME_KEY, record.workflowName())
                        .put(ERROR_NAME_KEY, record.error() != null ? record.error() : "unknown")
                        .build());
                break;
            case TIMED_OUT:
                workflowsTimedOut.add(1, attrs);
                break;
            case CANCELLED:
                workflowsCancelled.add(1, attrs);
                break;
            default:
                logger.warning("Execution " + record.executionId() + " reported completion while " + record.status());
                return;
        }
        record.getDuration().ifPresent(duration -> workflowDuration.record(duration.toMillis() / 1000.0, attrs));
    }

    /**
     * Get the current number of running executions.
     */
    public long getActiveWorkflows() {
        return activeWorkflows.get();
    }

    private static Attributes workflowAttributes(ExecutionRecord record) {
        return Attributes.of(WORKFLOW_NAME_KEY, record.workflowName());
    }
}
