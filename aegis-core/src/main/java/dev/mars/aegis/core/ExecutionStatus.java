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

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a workflow execution.
 *
 * <h3>State Transition Flow:</h3>
 * <pre>
 * RUNNING → {SUCCEEDED | FAILED | TIMED_OUT | CANCELLED}
 * </pre>
 *
 * <p>Every status other than {@link #RUNNING} is absorbing. {@link #TIMED_OUT} and
 * {@link #CANCELLED} are kept apart from {@link #FAILED} so that operators can tell a
 * deadline or an operator action from a failure of the response procedure itself.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @see dev.mars.aegis.core.exceptions.InvalidTransitionException
 */
public enum ExecutionStatus {

    /** The interpreter is walking the graph; exactly one state is open. */
    RUNNING,

    /** A Succeed state, or a state marked {@code End}, was reached without error. */
    SUCCEEDED,

    /** A Fail state was reached or an error propagated past the top level. */
    FAILED,

    /** The workflow deadline passed while the execution was running. */
    TIMED_OUT,

    /** A cancellation request was observed at a suspension point. */
    CANCELLED;

    private static final Map<ExecutionStatus, Set<ExecutionStatus>> TRANSITIONS;

    static {
        Map<ExecutionStatus, Set<ExecutionStatus>> map = new EnumMap<>(ExecutionStatus.class);
        map.put(RUNNING, Collections.unmodifiableSet(EnumSet.of(SUCCEEDED, FAILED, TIMED_OUT, CANCELLED)));
        map.put(SUCCEEDED, Collections.unmodifiableSet(EnumSet.noneOf(ExecutionStatus.class)));
        map.put(FAILED, Collections.unmodifiableSet(EnumSet.noneOf(ExecutionStatus.class)));
        map.put(TIMED_OUT, Collections.unmodifiableSet(EnumSet.noneOf(ExecutionStatus.class)));
        map.put(CANCELLED, Collections.unmodifiableSet(EnumSet.noneOf(ExecutionStatus.class)));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public boolean isSuccessful() {
        return this == SUCCEEDED;
    }

    /**
     * Checks whether a transition from this status to the given target status is valid.
     *
     * @param target the status to move to
     * @return {@code true} if the transition is valid
     */
    public boolean canTransitionTo(ExecutionStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    /**
     * Returns all valid target statuses that this status can transition to.
     *
     * @return unmodifiable set of valid targets (empty for absorbing statuses)
     */
    public Set<ExecutionStatus> getValidTransitions() {
        return TRANSITIONS.get(this);
    }
}
