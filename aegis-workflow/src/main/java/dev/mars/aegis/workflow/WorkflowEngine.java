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
import dev.mars.aegis.core.ExecutionRecord;
import dev.mars.aegis.core.WorkflowDefinition;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

public interface WorkflowEngine {

    /**
     * Starts a registered workflow and returns without waiting for it.
     *
     * @param workflowName name the definition was registered under
     * @param input the initial payload
     * @return the new execution ID
     * @throws IllegalArgumentException if no workflow is registered under that name
     * @throws IllegalStateException if the engine has been shut down
     */
    String start(String workflowName, JsonNode input);

    /**
     * Validates and executes a definition that need not be registered.
     *
     * @param definition the workflow definition to execute
     * @param input the initial payload
     * @return future containing the final execution record; fails with a
     *         {@link dev.mars.aegis.core.exceptions.ValidationException} for an invalid definition
     */
    CompletableFuture<ExecutionRecord> execute(WorkflowDefinition definition, JsonNode input);

    /**
     * Current status, current state and history of an execution, running or finished.
     *
     * @param executionId the execution ID
     * @return a snapshot, or empty if the ID is unknown
     */
    Optional<ExecutionRecord> describe(String executionId);

    /**
     * Blocks until the execution reaches a terminal status.
     *
     * @throws IllegalArgumentException if the ID is unknown
     * @throws TimeoutException if the execution is still running when the timeout elapses
     */
    ExecutionRecord awaitCompletion(String executionId, Duration timeout)
            throws InterruptedException, TimeoutException;

    /**
     * Requests cancellation of a running execution. Cancellation is observed at the next
     * suspension point and reaches every running branch.
     *
     * @param executionId the execution ID
     * @return true if the execution was running and has been asked to stop
     */
    boolean cancel(String executionId);

    /**
     * Continues a persisted execution that was still running when its process went away,
     * from its current state and with its saved payload and original deadline.
     *
     * @param executionId the execution ID
     * @return future containing the final execution record; fails with an
     *         {@link IllegalStateException} if the execution cannot be resumed
     */
    CompletableFuture<ExecutionRecord> resume(String executionId);

    /**
     * Cancels running executions and releases the engine's threads.
     */
    void shutdown();
}
