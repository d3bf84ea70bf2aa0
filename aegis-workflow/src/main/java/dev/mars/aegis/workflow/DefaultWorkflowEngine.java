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
import dev.mars.aegis.config.AegisConfiguration;
import dev.mars.aegis.core.ExecutionRecord;
import dev.mars.aegis.core.ExecutionStatus;
import dev.mars.aegis.core.StateSpec;
import dev.mars.aegis.core.WorkflowDefinition;
import dev.mars.aegis.core.exceptions.ValidationException;
import dev.mars.aegis.task.TaskInvoker;
import dev.mars.aegis.workflow.observability.WorkflowMetrics;
import dev.mars.aegis.workflow.store.ExecutionStore;
import dev.mars.aegis.workflow.store.FileExecutionStore;
import dev.mars.aegis.workflow.store.InMemoryExecutionStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Workflow engine running each execution on a bounded pool and each Parallel branch on a
 * separate cached pool.
 *
 * <p>Snapshots are written to the {@link ExecutionStore} on every state entry and on completion,
 * so {@link #describe(String)} works for finished executions and a crashed process leaves
 * {@code RUNNING} records behind that {@link #resume(String)} can continue.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public class DefaultWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = Logger.getLogger(DefaultWorkflowEngine.class.getName());

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final WorkflowRegistry registry;
    private final ExecutionStore store;
    private final AegisConfiguration configuration;
    private final Clock clock;
    private final DefinitionValidator validator;
    private final StateMachineInterpreter interpreter;
    private final ExecutorService executionExecutor;
    private final ExecutorService branchExecutor;
    private final Map<String, ActiveExecution> activeExecutions = new ConcurrentHashMap<>();
    private volatile boolean shutdown = false;

    private DefaultWorkflowEngine(Builder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "Workflow registry cannot be null");
        this.configuration = builder.configuration != null ? builder.configuration : new AegisConfiguration();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.store = builder.store != null ? builder.store : defaultStore(configuration, clock);
        this.validator = new DefinitionValidator();

        this.executionExecutor = Executors.newFixedThreadPool(configuration.getMaxConcurrentExecutions(),
                namedThreads("aegis-execution"));
        this.branchExecutor = Executors.newCachedThreadPool(namedThreads("aegis-branch"));

        List<ExecutionListener> listeners = new ArrayList<>();
        listeners.add(new StoreWriter(store));
        if (configuration.isMetricsEnabled()) {
            listeners.add(WorkflowMetrics.getInstance());
        }
        listeners.addAll(builder.listeners);

        this.interpreter = new StateMachineInterpreter(
                Objects.requireNonNull(builder.taskInvoker, "Task invoker cannot be null"),
                new BranchCoordinator(branchExecutor),
                new RetryCatchPolicyEngine(),
                builder.backoffSleeper != null ? builder.backoffSleeper : BackoffSleeper.SCHEDULED,
                configuration.getTaskTimeout(),
                ExecutionListener.composite(listeners));

        logger.info("DefaultWorkflowEngine started: " + configuration);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String start(String workflowName, JsonNode input) {
        WorkflowDefinition definition = registry.get(workflowName)
                .orElseThrow(() -> new IllegalArgumentException("No workflow registered under name: " + workflowName));
        Execution execution = newExecution(definition, input);
        launch(execution);
        return execution.getExecutionId();
    }

    @Override
    public CompletableFuture<ExecutionRecord> execute(WorkflowDefinition definition, JsonNode input) {
        try {
            validator.requireValid(definition);
            return launch(newExecution(definition, input));
        } catch (ValidationException | RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public Optional<ExecutionRecord> describe(String executionId) {
        ActiveExecution active = activeExecutions.get(executionId);
        if (active != null) {
            return Optional.of(active.execution.snapshot());
        }
        return store.find(executionId);
    }

    @Override
    public ExecutionRecord awaitCompletion(String executionId, Duration timeout)
            throws InterruptedException, TimeoutException {
        ActiveExecution active = activeExecutions.get(executionId);
        if (active == null) {
            ExecutionRecord record = store.find(executionId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown execution: " + executionId));
            if (record.isTerminal()) {
                return record;
            }
            throw new TimeoutException("Execution " + executionId + " is not running in this engine");
        }
        try {
            return active.completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Execution " + executionId + " ended abnormally", e.getCause());
        }
    }

    @Override
    public boolean cancel(String executionId) {
        ActiveExecution active = activeExecutions.get(executionId);
        if (active == null) {
            logger.fine("Cancel requested for execution that is not running: " + executionId);
            return false;
        }
        boolean cancelled = active.control.cancel();
        if (cancelled) {
            logger.info("Cancelling workflow execution: " + executionId);
        }
        return cancelled;
    }

    @Override
    public CompletableFuture<ExecutionRecord> resume(String executionId) {
        if (activeExecutions.containsKey(executionId)) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Execution " + executionId + " is already running"));
        }
        Optional<ExecutionRecord> record = store.find(executionId);
        if (record.isEmpty()) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("No persisted record for execution " + executionId));
        }
        if (record.get().status() != ExecutionStatus.RUNNING) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                    "Execution " + executionId + " already finished with status " + record.get().status()));
        }
        Optional<WorkflowDefinition> definition = registry.get(record.get().workflowName());
        if (definition.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                    "Workflow " + record.get().workflowName() + " is not registered; cannot resume " + executionId));
        }

        try {
            Execution execution = Execution.restore(record.get(), definition.get(), clock);
            logger.info("Resuming execution " + executionId + " at state '" + execution.getCurrentState() + "'");
            return launch(execution);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Resumes every persisted {@code RUNNING} execution this engine is not already driving.
     *
     * @return the IDs of the executions resumed
     */
    public List<String> resumeInterrupted() {
        List<String> resumed = new ArrayList<>();
        for (ExecutionRecord record : store.findByStatus(ExecutionStatus.RUNNING)) {
            if (activeExecutions.containsKey(record.executionId())) {
                continue;
            }
            CompletableFuture<ExecutionRecord> future = resume(record.executionId());
            if (future.isCompletedExceptionally()) {
                future.whenComplete((ignored, failure) ->
                        logger.warning("Could not resume " + record.executionId() + ": " + failure.getMessage()));
            } else {
                resumed.add(record.executionId());
            }
        }
        return resumed;
    }

    /**
     * Drops terminal records older than the configured retention.
     *
     * @return the number of records removed
     */
    public int purgeExpiredRecords() {
        return store.cleanupTerminated(configuration.getStoreRetention());
    }

    public int getActiveExecutionCount() {
        return activeExecutions.size();
    }

    public ExecutionStore getStore() {
        return store;
    }

    @Override
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        activeExecutions.values().forEach(active -> active.control.cancel());
        shutdownExecutor(executionExecutor);
        shutdownExecutor(branchExecutor);
        logger.info("DefaultWorkflowEngine shutdown complete");
    }

    private Execution newExecution(WorkflowDefinition definition, JsonNode input) {
        Duration timeout = definition.getTimeout().orElse(configuration.getWorkflowTimeout());
        Instant deadline = clock.instant().plus(timeout);
        return Execution.start(UUID.randomUUID().toString(), definition, input, deadline, clock);
    }

    private CompletableFuture<ExecutionRecord> launch(Execution execution) {
        if (shutdown) {
            throw new IllegalStateException("Workflow engine is shutdown");
        }

        String executionId = execution.getExecutionId();
        ExecutionControl control = new ExecutionControl(executionId, execution.getDeadline(), clock);
        CompletableFuture<ExecutionRecord> completion = new CompletableFuture<>();
        activeExecutions.put(executionId, new ActiveExecution(execution, control, completion));
        store.save(execution.snapshot());

        try {
            executionExecutor.execute(() -> {
                try {
                    ExecutionRecord result = interpreter.run(execution, control);
                    activeExecutions.remove(executionId);
                    completion.complete(result);
                } catch (RuntimeException e) {
                    activeExecutions.remove(executionId);
                    completion.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            activeExecutions.remove(executionId);
            store.remove(executionId);
            throw new IllegalStateException("Workflow engine is shutdown", e);
        }

        logger.info("Started execution " + executionId + " of workflow " + execution.getDefinition().getName());
        return completion;
    }

    private static void shutdownExecutor(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ExecutionStore defaultStore(AegisConfiguration configuration, Clock clock) {
        return configuration.getStoreDirectory()
                .<ExecutionStore>map(directory -> new FileExecutionStore(directory, clock))
                .orElseGet(() -> new InMemoryExecutionStore(clock));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class ActiveExecution {
        private final Execution execution;
        private final ExecutionControl control;
        private final CompletableFuture<ExecutionRecord> completion;

        private ActiveExecution(Execution execution, ExecutionControl control,
                                CompletableFuture<ExecutionRecord> completion) {
            this.execution = execution;
            this.control = control;
            this.completion = completion;
        }
    }

    /**
     * Persists a snapshot whenever a state is entered and when the execution ends.
     */
    private static final class StoreWriter implements ExecutionListener {
        private final ExecutionStore store;

        private StoreWriter(ExecutionStore store) {
            this.store = store;
        }

        @Override
        public void onStateEntered(ExecutionRecord record, StateSpec state) {
            save(record);
        }

        @Override
        public void onExecutionCompleted(ExecutionRecord record) {
            save(record);
        }

        private void save(ExecutionRecord record) {
            try {
                store.save(record);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Failed to persist execution " + record.executionId() + ": " + e.getMessage());
                if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "Execution store failure details for: " + record.executionId(), e);
                }
            }
        }
    }

    public static class Builder {
        private WorkflowRegistry registry;
        private TaskInvoker taskInvoker;
        private AegisConfiguration configuration;
        private ExecutionStore store;
        private BackoffSleeper backoffSleeper;
        private Clock clock;
        private final List<ExecutionListener> listeners = new ArrayList<>();

        private Builder() {
        }

        public Builder registry(WorkflowRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Usually a {@link dev.mars.aegis.task.TaskInvokerRegistry}.
         */
        public Builder taskInvoker(TaskInvoker taskInvoker) {
            this.taskInvoker = taskInvoker;
            return this;
        }

        public Builder configuration(AegisConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder store(ExecutionStore store) {
            this.store = store;
            return this;
        }

        public Builder backoffSleeper(BackoffSleeper backoffSleeper) {
            this.backoffSleeper = backoffSleeper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder listener(ExecutionListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
            return this;
        }

        public DefaultWorkflowEngine build() {
            return new DefaultWorkflowEngine(this);
        }
    }
}
