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

/**
 * Raised once the last retry attempt permitted by a matching retrier has also failed.
 *
 * <p>Keeps the error identifier of the final failure so that {@code Catch} matchers still
 * see the original error; the retry count is only added to the detail.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class RetryExhaustedException extends WorkflowErrorException {

    private final int attempts;

    public RetryExhaustedException(WorkflowErrorException lastFailure, int attempts) {
        super(lastFailure.getErrorName(),
                lastFailure.getDetail() + " (gave up after " + attempts + " retries)",
                lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * Returns the failure of the final attempt.
     */
    public WorkflowErrorException getLastFailure() {
        return (WorkflowErrorException) getCause();
    }
}
