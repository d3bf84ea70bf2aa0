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
import dev.mars.aegis.core.ErrorNames;
import dev.mars.aegis.core.EventKind;
import dev.mars.aegis.core.ExecutionRecord;
import dev.mars.aegis.core.ResultPath;
import dev.mars.aegis.core.StateSpec;
import dev.mars.aegis.core.exceptions.BranchFailureException;
import dev.mars.aegis.core.exceptions.ExecutionCancelledException;
import dev.mars.aegis.core.exceptions.ExecutionTimedOutException;
import dev.mars.aegis.core.exceptions.WorkflowErrorException;
import dev.mars.aegis.task.TaskInvoker;
import dev.mars.aegis.task.TimeLimitedTaskInvoker;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives one {@link Execution} through its workflow graph.
 *
 * <p>The interpreter is a loop over the current state rather than a recursion, so cyclic graphs
 * run in constant stack depth. A state is entered, run under its retry and catch policies, and
 * yields either the name of the next state or the end of the execution. Waiting only ever
 * happens through the {@link ExecutionControl}, which is where cancellation and the workflow
 * deadline are observed.</p>
 *
 * <p>Instances hold no per-execution state and can drive any number of executions concurrently.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public class StateMachineInterpreter {

    private static final Logger logger = Logger.getLogger(StateMachineInterpreter.class.getName());

    private final TaskInvoker taskInvoker;
    private final BranchCoordinator branchCoordinator;
    private final RetryCatchPolicyEngine policyEngine;
    private final BackoffSleeper backoffSleeper;
    private final Duration defaultTaskTimeout;
    private final ExecutionListener listener;

    public StateMachineInterpreter(TaskInvoker taskInvoker, BranchCoordinator branchCoordinator,
                                   RetryCatchPolicyEngine policyEngine, BackoffSleeper backoffSleeper,
                                   Duration defaultTaskTimeout, ExecutionListener listener) {
        Objects.requireNonNull(taskInvoker, "Task invoker cannot be null");
        this.taskInvoker = taskInvoker instanceof TimeLimitedTaskInvoker
                ? taskInvoker
                : new TimeLimitedTaskInvoker(taskInvoker);
        this.branchCoordinator = Objects.requireNonNull(branchCoordinator, "Branch coordinator cannot be null");
        this.policyEngine = Objects.requireNonNull(policyEngine, "Policy engine cannot be null");
        this.backoffSleeper = Objects.requireNonNull(backoffSleeper, "Backoff sleeper cannot be null");
        this.defaultTaskTimeout = Objects.requireNonNull(defaultTaskTimeout, "Default task timeout cannot be null");
        this.listener = listener != null ? listener : ExecutionListener.NONE;
    }

    /**
     * The interpreter used for Parallel branches: same collaborators, no listener.
     */
    StateMachineInterpreter forBranches() {
        if (listener == ExecutionListener.NONE) {
            return this;
        }
        return new StateMachineInterpreter(taskInvoker, branchCoordinator, policyEngine, backoffSleeper,
                defaultTaskTimeout, ExecutionListener.NONE);
    }

    /**
     * Runs the execution from its current state until it reaches a terminal status.
     * Never throws; every outcome is recorded on the execution.
     */
    public ExecutionRecord run(Execution execution, ExecutionControl control) {
        notifyListener(() -> listener.onExecutionStarted(execution.snapshot()));
        String stateName = execution.getCurrentState();

        try {
            while (stateName != null) {
                control.checkpoint();
                StateSpec state = execution.getDefinition().getState(stateName);
                if (state == null) {
                    throw new IllegalStateException("Unknown state '" + stateName + "' in workflow "
                            + execution.getDefinition().getName());
                }

                execution.enter(stateName);
                logger.fine("Execution " + execution.getExecutionId() + " entered " + state.type().getValue()
                        + " state '" + stateName + "'");
                notifyListener(() -> listener.onStateEntered(execution.snapshot(), state));

                if (state instanceof StateSpec.Succeed) {
                    execution.succeed();
                    break;
                }
                if (state instanceof StateSpec.Fail) {
                    StateSpec.Fail fail = (StateSpec.Fail) state;
                    execution.fail(fail.error(), fail.cause());
                    break;
                }

                stateName = runState(execution, control, state);
                if (stateName == null) {
                    execution.succeed();
                }
            }
        } catch (ExecutionCancelledException e) {
            logger.info("Execution " + execution.getExecutionId() + " cancelled in state '"
                    + execution.getCurrentState() + "'");
            execution.cancel();
        } catch (ExecutionTimedOutException e) {
            logger.warning("Execution " + execution.getExecutionId() + " timed out in state '"
                    + execution.getCurrentState() + "'");
            execution.timeOut();
        } catch (WorkflowErrorException e) {
            logger.warning("Execution " + execution.getExecutionId() + " failed in state '"
                    + execution.getCurrentState() + "': " + e.getMessage());
            execution.fail(e.getErrorName(), e.getDetail());
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Execution " + execution.getExecutionId() + " aborted: " + e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Execution abort details for: " + execution.getExecutionId(), e);
            }
            if (!execution.isTerminal()) {
                execution.fail(ErrorNames.RUNTIME, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }

        ExecutionRecord result = execution.snapshot();
        logger.fine("Execution " + execution.getExecutionId() + " finished with status " + result.status());
        notifyListener(() -> listener.onExecutionCompleted(result));
        return result;
    }

    /**
     * Runs a non-terminal state under its policies.
     *
     * @return the next state, or {@code null} if the execution ends here
     */
    private String runState(Execution execution, ExecutionControl control, StateSpec state)
            throws WorkflowErrorException, ExecutionCancelledException, ExecutionTimedOutException {
        if (state instanceof StateSpec.Pass) {
            StateSpec.Pass pass = (StateSpec.Pass) state;
            if (pass.result() != null) {
                execution.setPayload(pass.resultPath().apply(execution.getPayload(), pass.result()));
            }
            return exit(execution, pass.name(), pass);
        }

        StateSpec.Guarded guarded = (StateSpec.Guarded) state;
        StateSpec.Chained chained = (StateSpec.Chained) state;
        RetryAttempts attempts = new RetryAttempts();

        while (true) {
            try {
                JsonNode result;
                ResultPath resultPath;
                if (state instanceof StateSpec.Task) {
                    StateSpec.Task task = (StateSpec.Task) state;
                    result = invokeTask(execution, control, task);
                    resultPath = task.resultPath();
                } else {
                    StateSpec.Parallel parallel = (StateSpec.Parallel) state;
                    result = runBranches(execution, control, parallel);
                    resultPath = parallel.resultPath();
                }
                execution.setPayload(resultPath.apply(execution.getPayload(), result));
                return exit(execution, state.name(), chained);

            } catch (WorkflowErrorException error) {
                // a failure caused by the deadline or a stop request is not the state's to handle
                control.checkpoint();
                notifyListener(() -> listener.onStateFailed(execution.snapshot(), state, error));

                PolicyDecision decision = policyEngine.decide(error, guarded.retriers(), guarded.catchers(), attempts);
                if (decision instanceof PolicyDecision.Retry) {
                    PolicyDecision.Retry retry = (PolicyDecision.Retry) decision;
                    attempts.record(retry.retrierIndex());
                    execution.record(state.name(), EventKind.RETRIED, "retry " + retry.attemptNumber()
                            + " after " + retry.delay().toMillis() + " ms (" + error.getErrorName() + ")");
                    logger.fine("Retrying state '" + state.name() + "' of " + execution.getExecutionId()
                            + " in " + retry.delay().toMillis() + " ms: " + error.getMessage());
                    notifyListener(() -> listener.onRetry(execution.snapshot(), state, retry));
                    control.await(backoffSleeper.after(retry.delay()));
                    continue;
                }
                if (decision instanceof PolicyDecision.Catch) {
                    PolicyDecision.Catch caught = (PolicyDecision.Catch) decision;
                    execution.setPayload(caught.catcher().resultPath()
                            .apply(execution.getPayload(), caught.errorOutput()));
                    execution.record(state.name(), EventKind.CAUGHT,
                            error.getErrorName() + " -> " + caught.catcher().next());
                    logger.info("State '" + state.name() + "' of " + execution.getExecutionId() + " caught "
                            + error.getErrorName() + ", continuing at '" + caught.catcher().next() + "'");
                    return caught.catcher().next();
                }
                throw ((PolicyDecision.Propagate) decision).error();
            }
        }
    }

    private JsonNode invokeTask(Execution execution, ExecutionControl control, StateSpec.Task task)
            throws WorkflowErrorException, ExecutionCancelledException, ExecutionTimedOutException {
        Duration timeout = task.timeout() != null ? task.timeout() : defaultTaskTimeout;
        Duration remaining = control.remaining();
        if (remaining.compareTo(timeout) < 0) {
            // a clipped invocation must not expire ahead of the deadline it was clipped to
            timeout = remaining.plusMillis(1);
        }
        control.checkpoint();
        CompletableFuture<JsonNode> invocation =
                taskInvoker.invoke(task.resource(), execution.getPayload().deepCopy(), timeout);
        return control.await(invocation);
    }

    private JsonNode runBranches(Execution execution, ExecutionControl control, StateSpec.Parallel parallel)
            throws WorkflowErrorException, ExecutionCancelledException, ExecutionTimedOutException {
        try {
            JsonNode outputs = control.await(branchCoordinator.fork(parallel, execution, control, forBranches()));
            execution.record(parallel.name(), EventKind.JOINED, outputs.size() + " branches joined");
            return outputs;
        } catch (BranchFailureException e) {
            execution.record(parallel.name(), EventKind.JOINED,
                    "branch " + e.getBranchIndex() + " failed with " + e.getErrorName());
            throw e;
        }
    }

    private static String exit(Execution execution, String stateName, StateSpec.Chained chained) {
        String next = chained.end() ? null : chained.next();
        execution.record(stateName, EventKind.EXITED, next != null ? "next: " + next : "end");
        return next;
    }

    private void notifyListener(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Execution listener failed: " + e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Execution listener exception details", e);
            }
        }
    }
}
