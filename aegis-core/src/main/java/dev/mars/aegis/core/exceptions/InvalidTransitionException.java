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

package dev.mars.aegis.core.exceptions;

import dev.mars.aegis.core.ExecutionStatus;

import java.util.Set;

/**
 * Thrown when an execution is asked to leave an absorbing status.
 *
 * <p>Captures the execution, its current status, the requested status and the set of
 * valid targets. Unlike the rest of the hierarchy this is unchecked: only the interpreter
 * moves an execution between statuses, so a rejected move is a programming error.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-20
 * @version 1.1
 */
public class InvalidTransitionException extends IllegalStateException {

    private final String executionId;
    private final ExecutionStatus currentStatus;
    private final ExecutionStatus requestedStatus;

    public InvalidTransitionException(String executionId, ExecutionStatus currentStatus,
                                      ExecutionStatus requestedStatus) {
        super(String.format("Invalid transition for '%s': %s → %s. Valid targets: %s",
                executionId, currentStatus, requestedStatus,
                formatTransitions(currentStatus.getValidTransitions())));
        this.executionId = executionId;
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }

    public String getExecutionId() {
        return executionId;
    }

    public ExecutionStatus getCurrentStatus() {
        return currentStatus;
    }

    public ExecutionStatus getRequestedStatus() {
        return requestedStatus;
    }

    private static String formatTransitions(Set<ExecutionStatus> transitions) {
        if (transitions.isEmpty()) {
            return "[]";
        }
        StringBuilder sb = new StringBuilder("[");
        int i = 0;
        for (ExecutionStatus status : transitions) {
            if (i++ > 0) {
                sb.append(", ");
            }
            sb.append(status.name());
        }
        sb.append("]");
        return sb.toString();
    }
}
