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

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Explicit binding of task resources to their invokers.
 *
 * <p>Passed to the interpreter at construction; there is no process-wide lookup. Failures
 * that happen before a handler produced a future (unbound resource, handler throwing
 * synchronously, handler returning {@code null}) are turned into failed futures so the
 * interpreter only has to deal with one failure channel.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 */
public class TaskInvokerRegistry implements TaskInvoker {

    private static final Logger logger = Logger.getLogger(TaskInvokerRegistry.class.getName());

    private final Map<String, TaskInvoker> invokers = new ConcurrentHashMap<>();

    public TaskInvokerRegistry register(String resource, TaskInvoker invoker) {
        TaskRef ref = TaskRef.of(resource);
        Objects.requireNonNull(invoker, "Task invoker cannot be null");
        TaskInvoker previous = invokers.put(ref.resource(), invoker);
        if (previous != null) {
            logger.info("Replaced task handler for resource: " + resource);
        } else {
            logger.fine("Registered task handler for resource: " + resource);
        }
        return this;
    }

    public boolean unregister(String resource) {
        return invokers.remove(resource) != null;
    }

    public boolean isRegistered(String resource) {
        return invokers.containsKey(resource);
    }

    public Set<String> getRegisteredResources() {
        return Set.copyOf(invokers.keySet());
    }

    @Override
    public CompletableFuture<JsonNode> invoke(TaskRef task, JsonNode payload, Duration timeout) {
        TaskInvoker invoker = invokers.get(task.resource());
        if (invoker == null) {
            return CompletableFuture.failedFuture(new TaskInvocationException(ErrorNames.RUNTIME,
                    "No task handler registered for resource: " + task.resource()));
        }

        try {
            CompletableFuture<JsonNode> future = invoker.invoke(task, payload, timeout);
            if (future == null) {
                return CompletableFuture.failedFuture(new TaskInvocationException(ErrorNames.RUNTIME,
                        "Task handler for " + task.resource() + " returned no result future"));
            }
            return future;
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Task handler for " + task.resource() + " threw before starting: " + e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Task handler exception details for: " + task.resource(), e);
            }
            return CompletableFuture.failedFuture(new TaskInvocationException(ErrorNames.TASK_FAILED,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), e));
        }
    }
}
