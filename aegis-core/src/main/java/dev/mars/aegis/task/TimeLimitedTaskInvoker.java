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
import dev.mars.aegis.core.ErrorNames;
import dev.mars.aegis.core.exceptions.TaskInvocationException;
import dev.mars.aegis.core.exceptions.TaskTimeoutException;
import dev.mars.aegis.core.exceptions.WorkflowErrorException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decorator that makes any invoker honour the timeout contract of {@link TaskInvoker}.
 *
 * <p>A handler that has not answered within the timeout yields a
 * {@link TaskTimeoutException}; any other failure that does not already carry an error
 * identifier is reported as {@code States.TaskFailed}.</p>
 */
public class TimeLimitedTaskInvoker implements TaskInvoker {

    private final TaskInvoker delegate;

    public TimeLimitedTaskInvoker(TaskInvoker delegate) {
        this.delegate = Objects.requireNonNull(delegate, "Delegate invoker cannot be null");
    }

    @Override
    public CompletableFuture<JsonNode> invoke(TaskRef task, JsonNode payload, Duration timeout) {
        CompletableFuture<JsonNode> invocation;
        try {
            invocation = delegate.invoke(task, payload, timeout);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(normalize(task, e));
        }

        return invocation
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, failure) -> {
                    if (failure == null) {
                        return result;
                    }
                    Throwable cause = unwrap(failure);
                    if (cause instanceof TimeoutException) {
                        throw new CompletionException(new TaskTimeoutException(task.resource(), timeout));
                    }
                    throw new CompletionException(normalize(task, cause));
                });
    }

    private static WorkflowErrorException normalize(TaskRef task, Throwable failure) {
        if (failure instanceof WorkflowErrorException) {
            return (WorkflowErrorException) failure;
        }
        return new TaskInvocationException(ErrorNames.TASK_FAILED,
                "Task " + task.resource() + " failed: " + failure.getMessage(), failure);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
