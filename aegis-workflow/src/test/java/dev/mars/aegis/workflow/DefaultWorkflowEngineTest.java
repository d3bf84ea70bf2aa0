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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.aegis.config.AegisConfiguration;
import dev.mars.aegis.core.ErrorNames;
import dev.mars.aegis.core.EventKind;
import dev.mars.aegis.core.ExecutionEvent;
import dev.mars.aegis.core.ExecutionRecord;
import dev.mars.aegis.core.ExecutionStatus;
import dev.mars.aegis.core.WorkflowDefinition;
import dev.mars.aegis.core.exceptions.TaskInvocationException;
import dev.mars.aegis.core.exceptions.ValidationException;
import dev.mars.aegis.task.TaskInvokerRegistry;
import dev.mars.aegis.workflow.store.ExecutionStore;
import dev.mars.aegis.workflow.store.FileExecutionStore;
import dev.mars.aegis.workflow.store.InMemoryExecutionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the engine running the bundled emergency-response workflows.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-08
 */
class DefaultWorkflowEngineTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    private final ObjectMapper mapper = new ObjectMapper();

    private WorkflowRegistry registry;
    private TaskInvokerRegistry tasks;
    private DefaultWorkflowEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        registry = new WorkflowRegistry();
        registry.loadBundledDefinitions();
        tasks = new TaskInvokerRegistry();
        registerHealthyHandlers();
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.shutdown();
        }
    }

    private void registerHealthyHandlers() {
        tasks.register("emergency-assessment", (task, payload, timeout) -> CompletableFuture.completedFuture(
                JsonNodeFactory.instance.objectNode().put("impact", "widespread")));
        tasks.register("notification", (task, payload, timeout) -> CompletableFuture.completedFuture(
                JsonNodeFactory.instance.objectNode().put("teams_notified", 4)));
        tasks.register("resource-allocation", (task, payload, timeout) -> {
            ObjectNode unit = JsonNodeFactory.instance.objectNode().put("unit", "ambulance-1");
            return CompletableFuture.completedFuture(JsonNodeFactory.instance.arrayNode().add(unit).add(unit));
        });
        tasks.register("report-generation", (task, payload, timeout) -> CompletableFuture.completedFuture(
                JsonNodeFactory.instance.textNode("report-url")));
    }

    private DefaultWorkflowEngine newEngine(ExecutionStore store) {
        Properties properties = new Properties();
        properties.setProperty(AegisConfiguration.METRICS_ENABLED, "false");
        properties.setProperty(AegisConfiguration.MAX_CONCURRENT_EXECUTIONS, "4");
        return DefaultWorkflowEngine.builder()
                .registry(registry)
                .taskInvoker(tasks)
                .configuration(new AegisConfiguration(properties))
                .store(store)
                .backoffSleeper(delay -> CompletableFuture.completedFuture(null))
                .build();
    }

    private JsonNode incident() throws Exception {
        return mapper.readTree("""
                {"emergency_id": "E-100", "emergency_type": "NATURAL_DISASTER", "severity": "HIGH",
                 "location": "River District"}
                """);
    }

    @Nested
    @DisplayName("Bundled workflows")
    class BundledWorkflows {

        @BeforeEach
        void createEngine() {
            engine = newEngine(new InMemoryExecutionStore());
        }

        @Test
        @DisplayName("Natural disaster response runs to completion")
        void naturalDisasterHappyPath() throws Exception {
            String id = engine.start(WorkflowRegistry.NATURAL_DISASTER_WORKFLOW, incident());

            ExecutionRecord record = engine.awaitCompletion(id, WAIT);

            assertEquals(ExecutionStatus.SUCCEEDED, record.status());
            JsonNode payload = record.payload();
            assertEquals("widespread", payload.get("assessment").get("impact").asText());
            assertEquals(4, payload.get("notification").get("teams_notified").asInt());
            assertEquals(3, payload.get("response_actions").size());
            assertEquals(2, payload.get("response_actions").get(0).get("allocated_resources").size());
            assertEquals("EVACUATION", payload.get("response_actions").get(2).get("action").asText());
            assertEquals("report-url", payload.get("report").asText());
            assertEquals("River District", payload.get("location").asText());

            assertThat(record.history().stream().filter(e -> e.kind() == EventKind.ENTERED)
                    .map(ExecutionEvent::stateName))
                    .containsExactly("AssessEmergency", "NotifyEmergencyTeams", "ParallelResponse",
                            "GenerateSituationReport");
            assertEquals(record, engine.describe(id).orElseThrow());
            assertEquals(0, engine.getActiveExecutionCount());
        }

        @Test
        @DisplayName("Failed notification is caught and the response continues")
        void notificationFailureIsCaught() throws Exception {
            AtomicInteger attempts = new AtomicInteger();
            tasks.register("notification", (task, payload, timeout) -> {
                attempts.incrementAndGet();
                return CompletableFuture.failedFuture(
                        new TaskInvocationException(ErrorNames.TASK_FAILED, "pager gateway down"));
            });

            String id = engine.start(WorkflowRegistry.SECURITY_INCIDENT_WORKFLOW, incident());
            ExecutionRecord record = engine.awaitCompletion(id, WAIT);

            assertEquals(ExecutionStatus.SUCCEEDED, record.status());
            assertEquals(4, attempts.get());
            assertEquals(3, record.eventsOfKind(EventKind.RETRIED).size());
            assertEquals(ErrorNames.TASK_FAILED, record.payload().get("notification_error").get("Error").asText());
            assertNotNull(record.payload().get("report"));
        }

        @Test
        @DisplayName("Failed report generation ends in the Report.Unavailable state")
        void reportFailure() throws Exception {
            tasks.register("report-generation", (task, payload, timeout) -> CompletableFuture.failedFuture(
                    new TaskInvocationException("Report.TemplateMissing", "no template")));

            String id = engine.start(WorkflowRegistry.INFRASTRUCTURE_FAILURE_WORKFLOW, incident());
            ExecutionRecord record = engine.awaitCompletion(id, WAIT);

            assertEquals(ExecutionStatus.FAILED, record.status());
            assertEquals("Report.Unavailable", record.error());
            assertEquals("ReportUnavailable", record.currentState());
            assertEquals("Report.TemplateMissing", record.payload().get("report_error").get("Error").asText());
        }

        @Test
        @DisplayName("Resource allocation failure is caught at the Parallel state")
        void allocationFailureCaughtAtParallel() throws Exception {
            tasks.register("resource-allocation", (task, payload, timeout) -> CompletableFuture.failedFuture(
                    new TaskInvocationException("Resource.Exhausted", "no units available")));

            String id = engine.start(WorkflowRegistry.NATURAL_DISASTER_WORKFLOW, incident());
            ExecutionRecord record = engine.awaitCompletion(id, WAIT);

            assertEquals(ExecutionStatus.SUCCEEDED, record.status());
            assertEquals("Resource.Exhausted", record.payload().get("response_error").get("Error").asText());
            assertNull(record.payload().get("response_actions"));
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @BeforeEach
        void createEngine() {
            engine = newEngine(new InMemoryExecutionStore());
        }

        @Test
        void unknownWorkflowIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> engine.start("NoSuchWorkflow", incident()));
        }

        @Test
        void invalidAdHocDefinitionFailsFuture() {
            WorkflowDefinition broken = WorkflowDefinition.builder("broken").startAt("Missing").build();

            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> engine.execute(broken, incident()).get(5, TimeUnit.SECONDS));
            assertInstanceOf(ValidationException.class, e.getCause());
        }

        @Test
        void cancelStopsRunningExecution() throws Exception {
            AtomicBoolean invoked = new AtomicBoolean();
            tasks.register("emergency-assessment", (task, payload, timeout) -> {
                invoked.set(true);
                return new CompletableFuture<>();
            });

            String id = engine.start(WorkflowRegistry.NATURAL_DISASTER_WORKFLOW, incident());
            await().atMost(WAIT).untilTrue(invoked);

            assertEquals(ExecutionStatus.RUNNING, engine.describe(id).orElseThrow().status());
            assertEquals("AssessEmergency", engine.describe(id).orElseThrow().currentState());
            assertTrue(engine.cancel(id));

            ExecutionRecord record = engine.awaitCompletion(id, WAIT);
            assertEquals(ExecutionStatus.CANCELLED, record.status());
            assertFalse(engine.cancel(id));
        }

        @Test
        void workflowDeadlineTimesOut() throws Exception {
            tasks.register("hang", (task, payload, timeout) -> new CompletableFuture<>());
            WorkflowDefinition definition = new JsonWorkflowDefinitionParser().parseFromString("slow", """
                    {"StartAt": "Hang", "TimeoutSeconds": 1,
                     "States": {"Hang": {"Type": "Task", "Resource": "hang", "End": true}}}
                    """);

            ExecutionRecord record = engine.execute(definition, incident()).get(5, TimeUnit.SECONDS);

            assertEquals(ExecutionStatus.TIMED_OUT, record.status());
            assertEquals(ErrorNames.TIMEOUT, record.error());
        }

        @Test
        void awaitCompletionTimesOutWhileRunning() throws Exception {
            tasks.register("emergency-assessment", (task, payload, timeout) -> new CompletableFuture<>());

            String id = engine.start(WorkflowRegistry.NATURAL_DISASTER_WORKFLOW, incident());

            assertThrows(TimeoutException.class, () -> engine.awaitCompletion(id, Duration.ofMillis(100)));
            engine.cancel(id);
        }

        @Test
        void unknownExecutionIsReported() {
            assertTrue(engine.describe("nope").isEmpty());
            assertFalse(engine.cancel("nope"));
            assertThrows(IllegalArgumentException.class, () -> engine.awaitCompletion("nope", WAIT));
        }

        @Test
        void extraListenersAreNotified() throws Exception {
            List<ExecutionRecord> completed = new CopyOnWriteArrayList<>();
            engine.shutdown();
            engine = DefaultWorkflowEngine.builder()
                    .registry(registry)
                    .taskInvoker(tasks)
                    .configuration(new AegisConfiguration(new Properties()))
                    .store(new InMemoryExecutionStore())
                    .listener(new ExecutionListener() {
                        @Override
                        public void onExecutionCompleted(ExecutionRecord record) {
                            completed.add(record);
                        }
                    })
                    .build();

            String id = engine.start(WorkflowRegistry.SECURITY_INCIDENT_WORKFLOW, incident());
            engine.awaitCompletion(id, WAIT);

            assertEquals(1, completed.size());
            assertEquals(id, completed.get(0).executionId());
        }

        @Test
        void startAfterShutdownIsRejected() {
            engine.shutdown();

            assertThrows(IllegalStateException.class,
                    () -> engine.start(WorkflowRegistry.NATURAL_DISASTER_WORKFLOW, incident()));
        }
    }

    @Nested
    @DisplayName("Resume")
    class Resume {

        @TempDir
        Path storeDirectory;

        private ExecutionRecord interruptedRecord(String id, String currentState) throws Exception {
            Instant started = Instant.now().minusSeconds(30);
            JsonNode payload = mapper.readTree("""
                    {"emergency_id": "E-200", "assessment": {"impact": "local"},
                     "response_actions": [{"action": "EVACUATION"}]}
                    """);
            List<ExecutionEvent> history = List.of(
                    new ExecutionEvent(started, "AssessEmergency", EventKind.ENTERED, ""),
                    new ExecutionEvent(started.plusSeconds(10), currentState, EventKind.ENTERED, ""));
            return new ExecutionRecord(id, WorkflowRegistry.NATURAL_DISASTER_WORKFLOW, ExecutionStatus.RUNNING,
                    currentState, payload, history, started, started.plusSeconds(1800), null, null, null);
        }

        @Test
        @DisplayName("A persisted RUNNING execution continues from its current state")
        void resumeFromStore() throws Exception {
            FileExecutionStore store = new FileExecutionStore(storeDirectory);
            store.save(interruptedRecord("crashed-1", "GenerateSituationReport"));
            AtomicInteger assessments = new AtomicInteger();
            tasks.register("emergency-assessment", (task, payload, timeout) -> {
                assessments.incrementAndGet();
                return CompletableFuture.completedFuture(payload);
            });
            engine = newEngine(store);

            ExecutionRecord record = engine.resume("crashed-1").get(10, TimeUnit.SECONDS);

            assertEquals(ExecutionStatus.SUCCEEDED, record.status());
            assertEquals("report-url", record.payload().get("report").asText());
            assertEquals("local", record.payload().get("assessment").get("impact").asText());
            assertEquals(0, assessments.get());
            assertEquals(3, record.eventsOfKind(EventKind.ENTERED).size());
            assertEquals(ExecutionStatus.SUCCEEDED, store.find("crashed-1").orElseThrow().status());
        }

        @Test
        @DisplayName("resumeInterrupted picks up every RUNNING record")
        void resumeInterrupted() throws Exception {
            FileExecutionStore store = new FileExecutionStore(storeDirectory);
            store.save(interruptedRecord("crashed-1", "GenerateSituationReport"));
            store.save(interruptedRecord("crashed-2", "ParallelResponse"));
            engine = newEngine(store);

            List<String> resumed = engine.resumeInterrupted();

            assertThat(resumed).containsExactlyInAnyOrder("crashed-1", "crashed-2");
            assertEquals(ExecutionStatus.SUCCEEDED, engine.awaitCompletion("crashed-1", WAIT).status());
            assertEquals(ExecutionStatus.SUCCEEDED, engine.awaitCompletion("crashed-2", WAIT).status());
        }

        @Test
        @DisplayName("Finished executions cannot be resumed")
        void terminalRecordIsNotResumed() throws Exception {
            engine = newEngine(new FileExecutionStore(storeDirectory));
            String id = engine.start(WorkflowRegistry.NATURAL_DISASTER_WORKFLOW, incident());
            engine.awaitCompletion(id, WAIT);

            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> engine.resume(id).get(5, TimeUnit.SECONDS));
            assertInstanceOf(IllegalStateException.class, e.getCause());
            assertThrows(ExecutionException.class, () -> engine.resume("unknown").get(5, TimeUnit.SECONDS));
        }
    }
}
