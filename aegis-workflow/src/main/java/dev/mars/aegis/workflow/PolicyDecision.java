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
import dev.mars.aegis.core.CatchPolicy;
import dev.mars.aegis.core.exceptions.WorkflowErrorException;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of applying a state's retry and catch policies to one failure.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public sealed interface PolicyDecision
        permits PolicyDecision.Retry,
                PolicyDecision.Catch,
                PolicyDecision.Propagate {

    /**
     * Re-run the state after {@code delay}.
     *
     * @param retrierIndex  index of the retrier that matched
     * @param attemptNumber 1-based number of this retry for that retrier
     */
    record Retry(int retrierIndex, int attemptNumber, Duration delay) implements PolicyDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay");
        }
    }

    /**
     * Merge {@code errorOutput} into the payload at the catcher's result path and go to its next state.
     */
    record Catch(int catcherIndex, CatchPolicy catcher, JsonNode errorOutput) implements PolicyDecision {
        public Catch {
            Objects.requireNonNull(catcher, "catcher");
            Objects.requireNonNull(errorOutput, "errorOutput");
        }
    }

    /**
     * Nothing handles the error locally; hand it to the enclosing scope.
     */
    record Propagate(WorkflowErrorException error) implements PolicyDecision {
        public Propagate {
            Objects.requireNonNull(error, "error");
        }
    }
}
