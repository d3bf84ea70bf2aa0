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

package dev.mars.aegis.task;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Port through which the interpreter executes a named unit of work against an external
 * collaborator (assessment, notification, resource allocation, report generation...).
 *
 * <p>Implementations must be safe to call concurrently for unrelated executions and must
 * not hang past {@code timeout}: the returned future completes normally with the result
 * payload, or exceptionally with a
 * {@link dev.mars.aegis.core.exceptions.TaskInvocationException} carrying the error
 * identifier, or a {@link dev.mars.aegis.core.exceptions.TaskTimeoutException}. Wrap a
 * handler that cannot guarantee the timeout in a {@link TimeLimitedTaskInvoker}.</p>
 *
 * <p>The payload passed in is a private copy; implementations may keep or mutate it.</p>
 */
@FunctionalInterface
public interface TaskInvoker {

    /**
     * Starts the task asynchronously.
     *
     * @param task    the resource named by the Task state
     * @param payload the current payload of the execution
     * @param timeout how long the caller is prepared to wait for the result
     * @return future completed with the result payload or the task's error
     */
    CompletableFuture<JsonNode> invoke(TaskRef task, JsonNode payload, Duration timeout);
}
