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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.mars.aegis.core.ExecutionRecord;
import dev.mars.aegis.core.ExecutionStatus;
import dev.mars.aegis.core.StateSpec;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ExecutionListenerTest {

    private static ExecutionRecord record() {
        Instant started = Instant.parse("2026-03-09T10:00:00Z");
        return new ExecutionRecord("exec-1", "NaturalDisasterResponseWorkflow", ExecutionStatus.RUNNING,
                "AssessEmergency", JsonNodeFactory.instance.objectNode(), List.of(), started,
                started.plusSeconds(1800), null, null, null);
    }

    @Test
    void failingListenerDoesNotStopTheOthers() {
        ExecutionRecord record = record();
        StateSpec state = new StateSpec.Succeed("Done");
        ExecutionListener broken = mock(ExecutionListener.class);
        ExecutionListener store = mock(ExecutionListener.class);
        doThrow(new IllegalStateException("disk full")).when(broken).onExecutionStarted(record);
        doThrow(new IllegalStateException("disk full")).when(broken).onStateEntered(record, state);
        doThrow(new IllegalStateException("disk full")).when(broken).onExecutionCompleted(record);

        ExecutionListener composite = ExecutionListener.composite(List.of(broken, store));

        assertDoesNotThrow(() -> composite.onExecutionStarted(record));
        assertDoesNotThrow(() -> composite.onStateEntered(record, state));
        assertDoesNotThrow(() -> composite.onExecutionCompleted(record));
        verify(store).onExecutionStarted(record);
        verify(store).onStateEntered(record, state);
        verify(store).onExecutionCompleted(record);
    }
}
