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

import dev.mars.aegis.core.exceptions.InvalidTransitionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the execution status state machine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
class ExecutionStatusTest {

    @Test
    void runningMayEndInAnyTerminalStatus() {
        assertEquals(EnumSet.of(ExecutionStatus.SUCCEEDED, ExecutionStatus.FAILED,
                        ExecutionStatus.TIMED_OUT, ExecutionStatus.CANCELLED),
                ExecutionStatus.RUNNING.getValidTransitions());
        assertFalse(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.RUNNING));
        assertFalse(ExecutionStatus.RUNNING.isTerminal());
    }

    @ParameterizedTest
    @EnumSource(value = ExecutionStatus.class, names = {"SUCCEEDED", "FAILED", "TIMED_OUT", "CANCELLED"})
    void terminalStatusesAreAbsorbing(ExecutionStatus status) {
        assertTrue(status.isTerminal());
        assertTrue(status.getValidTransitions().isEmpty());
        for (ExecutionStatus target : ExecutionStatus.values()) {
            assertFalse(status.canTransitionTo(target), status + " -> " + target);
        }
    }

    @Test
    void onlySucceededIsSuccessful() {
        assertTrue(ExecutionStatus.SUCCEEDED.isSuccessful());
        assertFalse(ExecutionStatus.FAILED.isSuccessful());
        assertFalse(ExecutionStatus.TIMED_OUT.isSuccessful());
    }

    @Test
    void invalidTransitionExceptionDescribesTargets() {
        InvalidTransitionException e = new InvalidTransitionException("exec-1",
                ExecutionStatus.FAILED, ExecutionStatus.SUCCEEDED);

        assertEquals("exec-1", e.getExecutionId());
        assertEquals(ExecutionStatus.FAILED, e.getCurrentStatus());
        assertEquals(ExecutionStatus.SUCCEEDED, e.getRequestedStatus());
        assertTrue(e.getMessage().contains("Valid targets: []"));
    }
}
