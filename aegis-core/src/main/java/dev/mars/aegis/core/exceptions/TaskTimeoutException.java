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

import dev.mars.aegis.core.ErrorNames;

import java.time.Duration;

/**
 * Thrown when a single task invocation does not produce a result within its timeout.
 * Matched as {@code States.Timeout}, so it can be retried or caught like any task error.
 */
public class TaskTimeoutException extends WorkflowErrorException {

    private final String resource;
    private final Duration timeout;

    public TaskTimeoutException(String resource, Duration timeout) {
        super(ErrorNames.TIMEOUT, String.format("Task %s did not complete within %d ms",
                resource, timeout.toMillis()));
        this.resource = resource;
        this.timeout = timeout;
    }

    public String getResource() {
        return resource;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
