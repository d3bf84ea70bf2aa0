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

/**
 * What a dispatch started.
 *
 * @param emergencyId   ID assigned to the incident
 * @param executionId   ID of the workflow execution handling it
 * @param workflowName  the workflow started
 * @param emergencyType the category, as supplied or classified
 * @param severity      the severity, as supplied or computed
 * @param workflowInput the payload the workflow was started with
 */
public record DispatchResult(String emergencyId, String executionId, String workflowName,
                             String emergencyType, String severity, JsonNode workflowInput) {
}
