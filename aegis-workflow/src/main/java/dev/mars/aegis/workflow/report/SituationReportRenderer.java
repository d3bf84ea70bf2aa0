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

package dev.mars.aegis.workflow.report;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.aegis.core.ExecutionEvent;
import dev.mars.aegis.core.ExecutionRecord;

import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Renders an execution as a plain-text situation report.
 *
 * <p>Incident details (type, location, severity, time reported) are read from the execution's
 * payload when present. The timeline lists the execution history in order.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 */
public class SituationReportRenderer {

    private static final String NOT_AVAILABLE = "UNKNOWN";

    public String render(ExecutionRecord record) {
        Objects.requireNonNull(record, "Execution record cannot be null");
        JsonNode payload = record.payload();
        StringBuilder sb = new StringBuilder();

        sb.append("# Situation Report\n\n");

        sb.append("## Executive Summary\n");
        sb.append(field(payload, "emergency_type")).append(" at ").append(field(payload, "location"))
          .append(" with ").append(field(payload, "severity")).append(" severity.\n\n");

        sb.append("## Situation Overview\n");
        sb.append("Emergency ").append(field(payload, "emergency_id"))
          .append(" reported at ").append(field(payload, "timestamp")).append(".\n");
        sb.append("Handled by workflow ").append(record.workflowName())
          .append(" (execution ").append(record.executionId()).append(").\n\n");

        sb.append("## Current Status\n");
        sb.append("Current status is ").append(record.status());
        if (record.currentState() != null) {
            sb.append(" at state ").append(record.currentState());
        }
        sb.append(".\n");
        sb.append("Started: ").append(DateTimeFormatter.ISO_INSTANT.format(record.startedAt())).append('\n');
        if (record.endedAt() != null) {
            sb.append("Ended: ").append(DateTimeFormatter.ISO_INSTANT.format(record.endedAt())).append('\n');
        }
        record.getDuration().ifPresent(duration ->
                sb.append("Duration: ").append(duration.toMillis()).append(" ms\n"));
        sb.append('\n');

        sb.append("## Resource Allocation\n");
        sb.append(countAllocatedResources(payload)).append(" resources have been allocated.\n\n");

        sb.append("## Timeline\n");
        if (record.history().isEmpty()) {
            sb.append("No events recorded.\n");
        }
        for (ExecutionEvent event : record.history()) {
            sb.append("- ").append(DateTimeFormatter.ISO_INSTANT.format(event.timestamp()))
              .append(' ').append(event.kind())
              .append(' ').append(event.stateName());
            if (!event.detail().isEmpty()) {
                sb.append(": ").append(event.detail());
            }
            sb.append('\n');
        }
        sb.append('\n');

        if (record.error() != null) {
            sb.append("## Errors\n");
            sb.append(record.error()).append(": ").append(record.cause() != null ? record.cause() : "").append("\n\n");
        }

        sb.append("## Next Steps and Recommendations\n");
        sb.append(recommendation(record)).append('\n');
        return sb.toString();
    }

    private static String recommendation(ExecutionRecord record) {
        switch (record.status()) {
            case SUCCEEDED:
                return "Continue monitoring the situation.";
            case RUNNING:
                return "Response is in progress; check again once the workflow completes.";
            case TIMED_OUT:
                return "The response exceeded its time limit. Review the pending steps and escalate manually.";
            case CANCELLED:
                return "The response was cancelled by an operator. Confirm that no further action is required.";
            default:
                return "The response failed. Investigate the errors above and re-dispatch the emergency.";
        }
    }

    private static String field(JsonNode payload, String name) {
        if (payload != null && payload.hasNonNull(name)) {
            return payload.get(name).asText();
        }
        return NOT_AVAILABLE;
    }

    /**
     * Counts entries of every {@code allocated_resources} array in the payload, including those
     * nested in Parallel branch outputs.
     */
    static int countAllocatedResources(JsonNode payload) {
        if (payload == null) {
            return 0;
        }
        int count = 0;
        for (JsonNode allocated : payload.findValues("allocated_resources")) {
            if (allocated.isArray()) {
                count += allocated.size();
            }
        }
        return count;
    }
}
