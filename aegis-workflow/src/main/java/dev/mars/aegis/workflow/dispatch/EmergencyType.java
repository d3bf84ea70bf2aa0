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

import dev.mars.aegis.workflow.WorkflowRegistry;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Incident categories and the response workflow each one starts.
 *
 * <p>Classification is a keyword scan over the lower-cased event text; categories are tried in
 * declaration order and the first with a matching keyword wins.</p>
 */
public enum EmergencyType {

    NATURAL_DISASTER(WorkflowRegistry.NATURAL_DISASTER_WORKFLOW,
            List.of("flood", "earthquake", "hurricane", "tornado", "wildfire", "tsunami")),

    INFRASTRUCTURE_FAILURE(WorkflowRegistry.INFRASTRUCTURE_FAILURE_WORKFLOW,
            List.of("outage", "failure", "downtime", "unavailable", "crash")),

    SECURITY_INCIDENT(WorkflowRegistry.SECURITY_INCIDENT_WORKFLOW,
            List.of("breach", "attack", "hack", "malware", "ransomware", "phishing")),

    /** Anything no keyword matched. No workflow handles it. */
    GENERAL_EMERGENCY(null, List.of());

    private final String workflowName;
    private final List<String> keywords;

    EmergencyType(String workflowName, List<String> keywords) {
        this.workflowName = workflowName;
        this.keywords = keywords;
    }

    public Optional<String> getWorkflowName() {
        return Optional.ofNullable(workflowName);
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public static EmergencyType classify(String eventText) {
        String text = eventText == null ? "" : eventText.toLowerCase(Locale.ROOT);
        for (EmergencyType type : values()) {
            for (String keyword : type.keywords) {
                if (text.contains(keyword)) {
                    return type;
                }
            }
        }
        return GENERAL_EMERGENCY;
    }

    /**
     * Looks a type up by its name, as supplied in {@code emergency_type}.
     */
    public static Optional<EmergencyType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (EmergencyType type : values()) {
            if (type.name().equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
