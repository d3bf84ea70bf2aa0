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

package dev.mars.aegis.workflow.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.aegis.workflow.WorkflowEngine;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Entry point for incoming incidents: classifies them, rates their severity and starts the
 * matching response workflow.
 *
 * <p>Event data may arrive bare or wrapped in a {@code detail} object. Recognised fields:</p>
 * <ul>
 *   <li>{@code emergency_type}: used as-is; otherwise the event text is classified by keyword</li>
 *   <li>{@code severity}: used as-is; otherwise derived from {@code impact_score} and
 *       {@code urgency_score} (both default to 3)</li>
 *   <li>{@code location}: defaults to {@code UNKNOWN}</li>
 *   <li>{@code affected_resources}: defaults to an empty list</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 */
public class EmergencyDispatcher {

    private static final Logger logger = Logger.getLogger(EmergencyDispatcher.class.getName());

    public static final String UNKNOWN_LOCATION = "UNKNOWN";

    private final WorkflowEngine engine;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    public EmergencyDispatcher(WorkflowEngine engine) {
        this(engine, Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    public EmergencyDispatcher(WorkflowEngine engine, Clock clock, Supplier<String> idGenerator) {
        this.engine = Objects.requireNonNull(engine, "Workflow engine cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "ID generator cannot be null");
    }

    public DispatchResult dispatch(JsonNode event) throws DispatchException {
        if (event == null || !event.isObject()) {
            throw new DispatchException(null, "Event data must be a JSON object");
        }
        JsonNode eventData = event.hasNonNull("detail") && event.get("detail").isObject() ? event.get("detail") : event;

        String emergencyType = classify(eventData);
        String severity = rateSeverity(eventData);
        String workflowName = EmergencyType.fromName(emergencyType)
                .flatMap(EmergencyType::getWorkflowName)
                .orElseThrow(() -> new DispatchException(emergencyType,
                        "No workflow defined for emergency type: " + emergencyType));

        String emergencyId = idGenerator.get();
        ObjectNode input = JsonNodeFactory.instance.objectNode();
        input.put("emergency_id", emergencyId);
        input.put("emergency_type", emergencyType);
        input.put("severity", severity);
        input.put("location", eventData.hasNonNull("location") ? eventData.get("location").asText() : UNKNOWN_LOCATION);
        input.put("timestamp", DateTimeFormatter.ISO_INSTANT.format(clock.instant()));
        input.set("affected_resources", eventData.hasNonNull("affected_resources")
                ? eventData.get("affected_resources").deepCopy()
                : JsonNodeFactory.instance.arrayNode());

        String executionId;
        try {
            executionId = engine.start(workflowName, input);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new DispatchException(emergencyType,
                    "Failed to start " + workflowName + " for emergency " + emergencyId + ": " + e.getMessage(), e);
        }

        logger.info("Dispatched emergency " + emergencyId + " (" + emergencyType + ", " + severity
                + ") to " + workflowName + " as execution " + executionId);
        return new DispatchResult(emergencyId, executionId, workflowName, emergencyType, severity, input);
    }

    String classify(JsonNode eventData) {
        if (eventData.hasNonNull("emergency_type")) {
            return eventData.get("emergency_type").asText();
        }
        return EmergencyType.classify(eventData.toString()).name();
    }

    String rateSeverity(JsonNode eventData) {
        if (eventData.hasNonNull("severity")) {
            return eventData.get("severity").asText();
        }
        int impact = eventData.path("impact_score").asInt(Severity.DEFAULT_SCORE);
        int urgency = eventData.path("urgency_score").asInt(Severity.DEFAULT_SCORE);
        return Severity.fromScores(impact, urgency).name();
    }
}
