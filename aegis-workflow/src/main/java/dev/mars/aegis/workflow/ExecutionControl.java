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

import dev.mars.aegis.core.ErrorNames;
import dev.mars.aegis.core.ExecutionStatus;
import dev.mars.aegis.core.exceptions.ExecutionCancelledException;
import dev.mars.aegis.core.exceptions.ExecutionTimedOutException;
import dev.mars.aegis.core.exceptions.TaskInvocationException;
import dev.mars.aegis.core.exceptions.WorkflowErrorException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Deadline and stop signal shared by the suspension points of one execution.
 *
 * <p>Every wait goes through {@link #await(CompletableFuture)}, which returns as soon as the
 * work completes, the execution is stopped, or the deadline passes, whichever comes first.
 * Stopping is one-shot: the first reason recorded wins and is pushed down to every child
 * control, so cancelling or timing out a parent reaches all of its Parallel branches.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public class ExecutionControl {

    private static final Logger logger = Logger.getLogger(ExecutionControl.class.getName());

    private final String executionId;
    private final Instant deadline;
    private final Clock clock;
    private final CompletableFuture<ExecutionStatus> stopSignal = new CompletableFuture<>();
    private final Set<ExecutionControl> children = ConcurrentHashMap.newKeySet();

    public ExecutionControl(String executionId, Instant deadline) {
        this(executionId, deadline, Clock.systemUTC());
    }

    public ExecutionControl(String executionId, Instant deadline, Clock clock) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.deadline = Objects.requireNonNull(deadline, "Deadline cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Creates a control for a branch. It shares this control's deadline and is stopped whenever
     * this one is, including when this one has already stopped. The child stays attached until
     * {@link #release(ExecutionControl)} is called for it.
     */
    public ExecutionControl child(String childExecutionId) {
        ExecutionControl child = new ExecutionControl(childExecutionId, deadline, clock);
        children.add(child);
        // a stop racing with the add above must still reach the child
        getStopReason().ifPresent(child::stop);
        return child;
    }

    /**
     * Detaches a finished branch control so it is no longer reachable from this one.
     */
    public void release(ExecutionControl child) {
        children.remove(child);
    }

    int getChildCount() {
        return children.size();
    }

    public String getExecutionId() {
        return executionId;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Requests cooperative cancellation. Returns {@code false} if the execution was already stopped.
     */
    public boolean cancel() {
        return stop(ExecutionStatus.CANCELLED);
    }

    boolean stop(ExecutionStatus reason) {
        boolean first = stopSignal.complete(reason);
        if (first) {
            logger.fine("Execution " + executionId + " stopped: " + reason);
        }
        ExecutionStatus effective = stopSignal.getNow(reason);
        for (ExecutionControl child : children) {
            child.stop(effective);
        }
        return first;
    }

    public boolean isStopped() {
        return stopSignal.isDone();
    }

    public Optional<ExecutionStatus> getStopReason() {
        return Optional.ofNullable(stopSignal.getNow(null));
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(deadline);
    }

    public Duration remaining() {
        Duration remaining = Duration.between(clock.instant(), deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Throws if the execution has been stopped or has run past its deadline.
     */
    public void checkpoint() throws ExecutionCancelledException, ExecutionTimedOutException {
        if (!isStopped() && isExpired()) {
            stop(ExecutionStatus.TIMED_OUT);
        }
        ExecutionStatus reason = stopSignal.getNow(null);
        if (reason == ExecutionStatus.TIMED_OUT) {
            throw new ExecutionTimedOutException(executionId, deadline);
        }
        if (reason != null) {
            throw new ExecutionCancelledException(executionId);
        }
    }

    /**
     * Waits for {@code work} within the remaining deadline.
     *
     * <p>If the execution stops first, {@code work} is cancelled and its eventual result discarded.
     * Failures carrying an error name are rethrown as they are; anything else becomes a
     * {@code States.Runtime} error.</p>
     */
    public <T> T await(CompletableFuture<T> work)
            throws WorkflowErrorException, ExecutionCancelledException, ExecutionTimedOutException {
        checkpoint();
        try {
            CompletableFuture.anyOf(work, stopSignal).get(remainingMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            stop(ExecutionStatus.TIMED_OUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop(ExecutionStatus.CANCELLED);
        } catch (ExecutionException e) {
            // the work failed; inspected below
            logger.finest("Awaited work for " + executionId + " failed: " + e.getMessage());
        }

        if (isStopped() || isExpired()) {
            work.cancel(true);
            checkpoint();
        }

        try {
            return work.join();
        } catch (CompletionException | CancellationException e) {
            throw asWorkflowError(e);
        }
    }

    private long remainingMillis() {
        Duration remaining = remaining();
        // round up so the wait never ends just short of the deadline
        return remaining.toMillis() + (remaining.toNanosPart() % 1_000_000 > 0 ? 1 : 0);
    }

    private WorkflowErrorException asWorkflowError(RuntimeException failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
        if (cause instanceof WorkflowErrorException) {
            return (WorkflowErrorException) cause;
        }
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new TaskInvocationException(ErrorNames.RUNTIME, detail, cause);
    }

    @Override
    public String toString() {
        return "ExecutionControl{" +
               "executionId='" + executionId + '\'' +
               ", deadline=" + deadline +
               ", stopReason=" + getStopReason().orElse(null) +
               '}';
    }
}
