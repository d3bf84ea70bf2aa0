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

import java.time.Instant;

/**
 * Thrown at a suspension point once the workflow-level deadline has passed.
 * Never matched by {@code Retry} or {@code Catch} policies.
 */
public class ExecutionTimedOutException extends AegisException {

    private final String executionId;
    private final Instant deadline;

    public ExecutionTimedOutException(String executionId, Instant deadline) {
        super("Execution " + executionId + " exceeded its deadline of " + deadline);
        this.executionId = executionId;
        this.deadline = deadline;
    }

    public String getExecutionId() {
        return executionId;
    }

    public Instant getDeadline() {
        return deadline;
    }
}
