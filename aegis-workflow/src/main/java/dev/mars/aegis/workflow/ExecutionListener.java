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

import dev.mars.aegis.core.ExecutionRecord;
import dev.mars.aegis.core.StateSpec;
import dev.mars.aegis.core.exceptions.WorkflowErrorException;

import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Callbacks fired by the interpreter for a top-level execution. Implementations must not throw;
 * a listener failure is logged and does not affect the execution.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public interface ExecutionListener {

    ExecutionListener NONE = new ExecutionListener() { };

    default void onExecutionStarted(ExecutionRecord record) {
    }

    default void onStateEntered(ExecutionRecord record, StateSpec state) {
    }

    default void onStateFailed(ExecutionRecord record, StateSpec state, WorkflowErrorException error) {
    }

    default void onRetry(ExecutionRecord record, StateSpec state, PolicyDecision.Retry retry) {
    }

    default void onExecutionCompleted(ExecutionRecord record) {
    }

    static ExecutionListener composite(List<ExecutionListener> listeners) {
        List<ExecutionListener> copy = List.copyOf(listeners);
        return new ExecutionListener() {
            @Override
            public void onExecutionStarted(ExecutionRecord record) {
                each(copy, "onExecutionStarted", listener -> listener.onExecutionStarted(record));
            }

            @Override
            public void onStateEntered(ExecutionRecord record, StateSpec state) {
                each(copy, "onStateEntered", listener -> listener.onStateEntered(record, state));
            }

            @Override
            public void onStateFailed(ExecutionRecord record, StateSpec state, WorkflowErrorException error) {
                each(copy, "onStateFailed", listener -> listener.onStateFailed(record, state, error));
            }

            @Override
            public void onRetry(ExecutionRecord record, StateSpec state, PolicyDecision.Retry retry) {
                each(copy, "onRetry", listener -> listener.onRetry(record, state, retry));
            }

            @Override
            public void onExecutionCompleted(ExecutionRecord record) {
                each(copy, "onExecutionCompleted", listener -> listener.onExecutionCompleted(record));
            }
        };
    }

    /**
     * Delivers one callback to every listener, logging and skipping any listener that throws.
     */
    private static void each(List<ExecutionListener> listeners, String callback,
                             Consumer<ExecutionListener> delivery) {
        for (ExecutionListener listener : listeners) {
            try {
                delivery.accept(listener);
            } catch (RuntimeException e) {
                Logger logger = Logger.getLogger(ExecutionListener.class.getName());
                logger.log(Level.WARNING, "Listener " + listener.getClass().getName() + " failed in "
                        + callback + ": " + e.getMessage());
                if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "Listener failure details", e);
                }
            }
        }
    }
}
