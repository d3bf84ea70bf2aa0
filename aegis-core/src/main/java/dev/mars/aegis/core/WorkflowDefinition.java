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

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed, immutable representation of a workflow graph.
 *
 * <p>The same instance is shared read-only by every execution of the workflow, and
 * Parallel branches are themselves {@code WorkflowDefinition}s. Structural rules (start
 * state present, no dangling references, reachability) are not enforced on construction;
 * they are checked by the definition validator so that every violation can be reported.</p>
 */
public class WorkflowDefinition {

    private final String name;
    private final String comment;
    private final String startState;
    private final Duration timeout;
    private final Map<String, StateSpec> states;

    public WorkflowDefinition(String name, String comment, String startState, Duration timeout,
                              Map<String, StateSpec> states) {
        this.name = Objects.requireNonNull(name, "Workflow name cannot be null");
        this.comment = comment;
        this.startState = startState;
        this.timeout = timeout;
        this.states = states != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(states))
                : Map.of();
    }

    public String getName() {
        return name;
    }

    public Optional<String> getComment() {
        return Optional.ofNullable(comment);
    }

    public String getStartState() {
        return startState;
    }

    /**
     * Workflow-level deadline relative to the start of an execution, if the definition sets one.
     */
    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    /**
     * States in declaration order.
     */
    public Map<String, StateSpec> getStates() {
        return states;
    }

    public StateSpec getState(String stateName) {
        return states.get(stateName);
    }

    public boolean hasState(String stateName) {
        return stateName != null && states.containsKey(stateName);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return Objects.equals(name, that.name) &&
               Objects.equals(comment, that.comment) &&
               Objects.equals(startState, that.startState) &&
               Objects.equals(timeout, that.timeout) &&
               Objects.equals(states, that.states);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, comment, startState, timeout, states);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
               "name='" + name + '\'' +
               ", startState='" + startState + '\'' +
               ", states=" + states.keySet() +
               '}';
    }

    /**
     * Builder for WorkflowDefinition. The first state added becomes the start state unless
     * {@link #startAt(String)} says otherwise.
     */
    public static class Builder {
        private final String name;
        private String comment;
        private String startState;
        private Duration timeout;
        private final Map<String, StateSpec> states = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder comment(String comment) {
            this.comment = comment;
            return this;
        }

        public Builder startAt(String startState) {
            this.startState = startState;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder state(StateSpec state) {
            if (states.containsKey(state.name())) {
                throw new IllegalArgumentException("Duplicate state name: " + state.name());
            }
            if (startState == null) {
                startState = state.name();
            }
            states.put(state.name(), state);
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(name, comment, startState, timeout, states);
        }
    }
}
