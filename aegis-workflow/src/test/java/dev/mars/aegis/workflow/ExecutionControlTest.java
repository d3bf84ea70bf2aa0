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
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class ExecutionControlTest {

    @Test
    void awaitReturnsCompletedResult() throws Exception {
        ExecutionControl control = new ExecutionControl("exec", Instant.now().plusSeconds(5));

        assertEquals("done", control.await(CompletableFuture.completedFuture("done")));
        assertFalse(control.isStopped());
    }

    @Test
    void awaitRethrowsNamedErrors() {
        ExecutionControl control = new ExecutionControl("exec", Instant.now().plusSeconds(5));
        CompletableFuture<String> failed = CompletableFuture.failedFuture(
                new TaskInvocationException("Custom.Error", "boom"));

        WorkflowErrorException e = assertThrows(WorkflowErrorException.class, () -> control.await(failed));
        assertEquals("Custom.Error", e.getErrorName());
    }

    @Test
    void awaitTurnsUnnamedFailuresIntoRuntimeErrors() {
        ExecutionControl control = new ExecutionControl("exec", Instant.now().plusSeconds(5));
        CompletableFuture<String> failed = CompletableFuture.failedFuture(new IllegalStateException("oops"));

        WorkflowErrorException e = assertThrows(WorkflowErrorException.class, () -> control.await(failed));
        assertEquals(ErrorNames.RUNTIME, e.getErrorName());
        assertEquals("oops", e.getDetail());
    }

    @Test
    void deadlineEndsWaitAndCancelsWork() {
        ExecutionControl control = new ExecutionControl("exec", Instant.now().plusMillis(200));
        CompletableFuture<String> never = new CompletableFuture<>();

        assertThrows(ExecutionTimedOutException.class, () -> control.await(never));
        assertTrue(never.isCancelled());
        assertEquals(Optional.of(ExecutionStatus.TIMED_OUT), control.getStopReason());
    }

    @Test
    void cancelFromAnotherThreadEndsWait() {
        ExecutionControl control = new ExecutionControl("exec", Instant.now().plusSeconds(30));
        CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS).execute(control::cancel);

        assertThrows(ExecutionCancelledException.class, () -> control.await(new CompletableFuture<String>()));
        assertFalse(control.cancel());
    }

    @Test
    void checkpointDetectsExpiredDeadline() {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        ExecutionControl control = new ExecutionControl("exec", now, Clock.fixed(now, ZoneOffset.UTC));

        assertTrue(control.isExpired());
        assertEquals(Duration.ZERO, control.remaining());
        assertThrows(ExecutionTimedOutException.class, control::checkpoint);
    }

    @Test
    void stoppingParentStopsChildrenWithSameReason() {
        ExecutionControl parent = new ExecutionControl("exec", Instant.now().plusSeconds(30));
        ExecutionControl child = parent.child("exec/Respond[0]");

        parent.stop(ExecutionStatus.TIMED_OUT);

        await().atMost(Duration.ofSeconds(2)).until(child::isStopped);
        assertEquals(Optional.of(ExecutionStatus.TIMED_OUT), child.getStopReason());
        assertThrows(ExecutionTimedOutException.class, child::checkpoint);
    }

    @Test
    void childOfStoppedParentStartsStopped() {
        ExecutionControl parent = new ExecutionControl("exec", Instant.now().plusSeconds(30));
        parent.cancel();

        ExecutionControl child = parent.child("exec/Respond[1]");

        assertTrue(child.isStopped());
        assertThrows(ExecutionCancelledException.class, child::checkpoint);
    }

    @Test
    void cancellingChildLeavesParentRunning() throws Exception {
        ExecutionControl parent = new ExecutionControl("exec", Instant.now().plusSeconds(30));
        ExecutionControl child = parent.child("exec/Respond[2]");

        child.cancel();

        assertFalse(parent.isStopped());
        parent.checkpoint();
    }

    @Test
    void releasedChildIsNoLongerStoppedByParent() {
        ExecutionControl parent = new ExecutionControl("exec", Instant.now().plusSeconds(30));
        ExecutionControl kept = parent.child("exec/Respond[0]");
        ExecutionControl released = parent.child("exec/Respond[1]");

        parent.release(released);
        parent.cancel();

        assertEquals(1, parent.getChildCount());
        assertTrue(kept.isStopped());
        assertFalse(released.isStopped());
    }
}
