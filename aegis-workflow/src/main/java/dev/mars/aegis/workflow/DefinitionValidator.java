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

import dev.mars.aegis.core.CatchPolicy;
import dev.mars.aegis.core.ErrorNames;
import dev.mars.aegis.core.RetryPolicy;
import dev.mars.aegis.core.StateSpec;
import dev.mars.aegis.core.ValidationResult;
import dev.mars.aegis.core.WorkflowDefinition;
import dev.mars.aegis.core.exceptions.ValidationException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks on a {@link WorkflowDefinition}.
 *
 * <p>Validation is pure: the same definition always yields an equal {@link ValidationResult}.
 * Parallel branches are validated recursively and must be able to terminate on their own.
 * Every issue carries a field path such as {@code States.Notify.Catch[0].Next}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class DefinitionValidator {

    public ValidationResult validate(WorkflowDefinition definition) {
        ValidationResult result = new ValidationResult();
        validateDefinition(definition, "", false, result);
        return result;
    }

    /**
     * @throws ValidationException listing every error when the definition is not valid
     */
    public void requireValid(WorkflowDefinition definition) throws ValidationException {
        ValidationResult result = validate(definition);
        if (!result.isValid()) {
            throw new ValidationException(definition.getName(), result);
        }
    }

    private void validateDefinition(WorkflowDefinition definition, String prefix, boolean isBranch,
                                    ValidationResult result) {
        Map<String, StateSpec> states = definition.getStates();
        if (states.isEmpty()) {
            result.addError(prefix + "States", "Workflow '" + definition.getName() + "' defines no states");
            return;
        }

        String start = definition.getStartState();
        if (start == null || !states.containsKey(start)) {
            result.addError(prefix + "StartAt", "StartAt references unknown state '" + start + "'");
        }

        for (StateSpec state : states.values()) {
            String path = prefix + "States." + state.name();
            validateState(definition, state, path, result);
        }

        if (start == null || !states.containsKey(start)) {
            return;
        }

        Set<String> reachable = reachableFrom(definition, start);
        for (String stateName : states.keySet()) {
            if (!reachable.contains(stateName)) {
                result.addError(prefix + "States." + stateName,
                        "State '" + stateName + "' is not reachable from StartAt '" + start + "'");
            }
        }

        boolean terminates = reachable.stream()
                .map(states::get)
                .anyMatch(DefinitionValidator::endsExecution);
        if (!terminates) {
            String message = "No terminal state is reachable from StartAt '" + start + "'";
            if (isBranch) {
                result.addError(prefix + "States", message);
            } else {
                result.addWarning(prefix + "States", message);
            }
        }
    }

    private void validateState(WorkflowDefinition definition, StateSpec state, String path,
                               ValidationResult result) {
        if (state instanceof StateSpec.Chained) {
            StateSpec.Chained chained = (StateSpec.Chained) state;
            boolean hasNext = chained.next() != null;
            if (hasNext && chained.end()) {
                result.addError(path, "State '" + state.name() + "' sets both Next and End");
            } else if (!hasNext && !chained.end()) {
                result.addError(path, "State '" + state.name() + "' must set either Next or End: true");
            }
            if (hasNext && !definition.hasState(chained.next())) {
                result.addError(path + ".Next",
                        "State '" + state.name() + "' references unknown state '" + chained.next() + "'");
            }
        }

        if (state instanceof StateSpec.Task) {
            StateSpec.Task task = (StateSpec.Task) state;
            if (task.timeout() != null && (task.timeout().isNegative() || task.timeout().isZero())) {
                result.addError(path + ".TimeoutSeconds", "Task state '" + state.name() + "' needs a positive timeout");
            }
        }

        if (state instanceof StateSpec.Guarded) {
            StateSpec.Guarded guarded = (StateSpec.Guarded) state;
            validateRetriers(state.name(), guarded.retriers(), path, result);
            validateCatchers(definition, state.name(), guarded.catchers(), path, result);
        }

        if (state instanceof StateSpec.Parallel) {
            StateSpec.Parallel parallel = (StateSpec.Parallel) state;
            if (parallel.branches().isEmpty()) {
                result.addError(path + ".Branches", "Parallel state '" + state.name() + "' needs at least one branch");
            }
            for (int i = 0; i < parallel.branches().size(); i++) {
                validateDefinition(parallel.branches().get(i), path + ".Branches[" + i + "].", true, result);
            }
        }
    }

    private void validateRetriers(String stateName, List<RetryPolicy> retriers, String path,
                                  ValidationResult result) {
        for (int i = 0; i < retriers.size(); i++) {
            RetryPolicy retrier = retriers.get(i);
            String entryPath = path + ".Retry[" + i + "]";
            validateErrorEquals(stateName, retrier.errorEquals(), i == retriers.size() - 1, entryPath, result);
            if (!(retrier.intervalSeconds() > 0)) {
                result.addError(entryPath + ".IntervalSeconds",
                        "State '" + stateName + "': IntervalSeconds must be greater than 0");
            }
            if (retrier.maxAttempts() < 0) {
                result.addError(entryPath + ".MaxAttempts",
                        "State '" + stateName + "': MaxAttempts must not be negative");
            }
            if (!(retrier.backoffRate() >= 1.0)) {
                result.addError(entryPath + ".BackoffRate",
                        "State '" + stateName + "': BackoffRate must be at least 1.0");
            }
        }
    }

    private void validateCatchers(WorkflowDefinition definition, String stateName, List<CatchPolicy> catchers,
                                  String path, ValidationResult result) {
        for (int i = 0; i < catchers.size(); i++) {
            CatchPolicy catcher = catchers.get(i);
            String entryPath = path + ".Catch[" + i + "]";
            validateErrorEquals(stateName, catcher.errorEquals(), i == catchers.size() - 1, entryPath, result);
            if (catcher.next() == null || !definition.hasState(catcher.next())) {
                result.addError(entryPath + ".Next",
                        "State '" + stateName + "' catches to unknown state '" + catcher.next() + "'");
            }
        }
    }

    private void validateErrorEquals(String stateName, List<String> errorEquals, boolean isLast, String path,
                                     ValidationResult result) {
        if (errorEquals.isEmpty()) {
            result.addError(path + ".ErrorEquals", "State '" + stateName + "': ErrorEquals must not be empty");
            return;
        }
        if (errorEquals.contains(ErrorNames.ALL)) {
            if (errorEquals.size() > 1) {
                result.addError(path + ".ErrorEquals",
                        "State '" + stateName + "': " + ErrorNames.ALL + " must appear alone in ErrorEquals");
            }
            if (!isLast) {
                result.addError(path + ".ErrorEquals",
                        "State '" + stateName + "': " + ErrorNames.ALL + " must be in the last entry of its list");
            }
        }
    }

    private static Set<String> reachableFrom(WorkflowDefinition definition, String start) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.push(start);
        while (!pending.isEmpty()) {
            String current = pending.pop();
            StateSpec state = definition.getState(current);
            if (state == null || !visited.add(current)) {
                continue;
            }
            for (String successor : successors(state)) {
                if (!visited.contains(successor)) {
                    pending.push(successor);
                }
            }
        }
        return visited;
    }

    private static List<String> successors(StateSpec state) {
        List<String> successors = new ArrayList<>();
        if (state instanceof StateSpec.Chained && ((StateSpec.Chained) state).next() != null) {
            successors.add(((StateSpec.Chained) state).next());
        }
        if (state instanceof StateSpec.Guarded) {
            for (CatchPolicy catcher : ((StateSpec.Guarded) state).catchers()) {
                if (catcher.next() != null) {
                    successors.add(catcher.next());
                }
            }
        }
        return successors;
    }

    private static boolean endsExecution(StateSpec state) {
        if (state == null) {
            return false;
        }
        if (state.isTerminal()) {
            return true;
        }
        return state instanceof StateSpec.Chained && ((StateSpec.Chained) state).end();
    }
}
