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

package dev.mars.aegis.core;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.aegis.task.TaskRef;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Sealed interface for the nodes of a workflow graph.
 *
 * <p>Each permitted subtype carries only the fields relevant to its variant. Unknown
 * {@code Type} values never make it this far: the parser rejects them when the definition
 * is loaded.</p>
 *
 * <h3>Permitted subtypes</h3>
 * <ul>
 *   <li>{@link Task} - invoke an external task handler</li>
 *   <li>{@link Parallel} - run nested definitions concurrently and join them</li>
 *   <li>{@link Pass} - inject or forward a payload without invoking anything</li>
 *   <li>{@link Succeed} - terminal, ends the execution successfully</li>
 *   <li>{@link Fail} - terminal, ends the execution with an error</li>
 * </ul>
 *
 * <p>States that continue somewhere implement {@link Chained}; states with {@code Retry}
 * and {@code Catch} lists implement {@link Guarded}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-02
 */
public sealed interface StateSpec
        permits StateSpec.Task,
                StateSpec.Parallel,
                StateSpec.Pass,
                StateSpec.Succeed,
                StateSpec.Fail {

    /** Common accessor: every state is keyed by its name. */
    String name();

    StateType type();

    default boolean isTerminal() {
        return false;
    }

    /**
     * A state that either names its successor or ends the execution.
     */
    interface Chained {
        /** The next state, or {@code null} when {@link #end()} is set. */
        String next();

        boolean end();
    }

    /**
     * A state whose failures go through the retry/catch policy engine.
     */
    interface Guarded {
        List<RetryPolicy> retriers();

        List<CatchPolicy> catchers();
    }

    /**
     * Invoke a task handler with the current payload.
     *
     * @param name       state name
     * @param resource   the handler to invoke
     * @param next       successor, {@code null} if {@code end}
     * @param end        whether reaching this state's exit ends the execution
     * @param resultPath where the handler's result goes
     * @param timeout    per-invocation timeout, {@code null} for the configured default
     * @param retriers   retry policies in declared order
     * @param catchers   catch policies in declared order
     */
    record Task(String name, TaskRef resource, String next, boolean end, ResultPath resultPath,
                Duration timeout, List<RetryPolicy> retriers, List<CatchPolicy> catchers)
            implements StateSpec, Chained, Guarded {

        public Task {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(resource, "resource");
            resultPath = resultPath != null ? resultPath : ResultPath.ROOT;
            retriers = retriers != null ? List.copyOf(retriers) : List.of();
            catchers = catchers != null ? List.copyOf(catchers) : List.of();
        }

        @Override
        public StateType type() {
            return StateType.TASK;
        }
    }

    /**
     * Run every branch concurrently on a copy of the payload and join the outputs in
     * declaration order.
     */
    record Parallel(String name, List<WorkflowDefinition> branches, String next, boolean end,
                    ResultPath resultPath, List<RetryPolicy> retriers, List<CatchPolicy> catchers)
            implements StateSpec, Chained, Guarded {

        public Parallel {
            Objects.requireNonNull(name, "name");
            branches = branches != null ? List.copyOf(branches) : List.of();
            resultPath = resultPath != null ? resultPath : ResultPath.ROOT;
            retriers = retriers != null ? List.copyOf(retriers) : List.of();
            catchers = catchers != null ? List.copyOf(catchers) : List.of();
        }

        @Override
        public StateType type() {
            return StateType.PARALLEL;
        }
    }

    /**
     * Forward the payload, optionally merging a static {@code result} into it.
     *
     * @param result the static value, {@code null} to pass the input through
     */
    record Pass(String name, JsonNode result, ResultPath resultPath, String next, boolean end)
            implements StateSpec, Chained {

        public Pass {
            Objects.requireNonNull(name, "name");
            result = result != null ? result.deepCopy() : null;
            resultPath = resultPath != null ? resultPath : ResultPath.ROOT;
        }

        /** A copy of the static value; the definition keeps its own. */
        @Override
        public JsonNode result() {
            return result != null ? result.deepCopy() : null;
        }

        @Override
        public StateType type() {
            return StateType.PASS;
        }
    }

    record Succeed(String name) implements StateSpec {

        public Succeed {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public StateType type() {
            return StateType.SUCCEED;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    /**
     * @param error identifier recorded on the execution, {@code States.Fail} when absent
     * @param cause human-readable message recorded on the execution
     */
    record Fail(String name, String error, String cause) implements StateSpec {

        public Fail {
            Objects.requireNonNull(name, "name");
            error = error != null && !error.isBlank() ? error : ErrorNames.FAIL;
            cause = cause != null && !cause.isBlank() ? cause : "Fail state " + name + " reached";
        }

        @Override
        public StateType type() {
            return StateType.FAIL;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}
