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

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.mars.aegis.core.ErrorNames;
import dev.mars.aegis.core.EventKind;
import dev.mars.aegis.core.ExecutionRecord;
import dev.mars.aegis.core.ExecutionStatus;
import dev.mars.aegis.core.StateSpec;
import dev.mars.aegis.core.WorkflowDefinition;
import dev.mars.aegis.core.exceptions.BranchFailureException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the branches of a Parallel state and joins their results.
 *
 * <p>Each branch gets its own child {@link Execution}, a deep copy of the parent payload and a
 * child {@link ExecutionControl}, and is driven by a nested interpreter on the branch executor.
 * The returned future completes once every branch has finished:</p>
 * <ul>
 *   <li>all succeeded: an array of branch outputs in declaration order</li>
 *   <li>any failed: a {@link BranchFailureException} for the lowest-index failed branch; the
 *       first failure cancels the branches still running</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public class BranchCoordinator {

    private static final Logger logger = Logger.getLogger(BranchCoordinator.class.getName());

    private final Executor branchExecutor;

    public BranchCoordinator(Executor branchExecutor) {
        this.branchExecutor = Objects.requireNonNull(branchExecutor, "Branch executor cannot be null");
    }

    public CompletableFuture<ArrayNode> fork(StateSpec.Parallel parallel, Execution parent,
                                             ExecutionControl parentControl, StateMachineInterpreter interpreter) {
        List<WorkflowDefinition> branches = parallel.branches();
        List<Execution> executions = new ArrayList<>(branches.size());
        List<ExecutionControl> controls = new ArrayList<>(branches.size());
        List<CompletableFuture<ExecutionRecord>> results = new ArrayList<>(branches.size());

        // every control exists before any branch runs, so an early failure can reach all siblings
        for (int i = 0; i < branches.size(); i++) {
            String branchId = parent.getExecutionId() + "/" + parallel.name() + "[" + i + "]";
            executions.add(Execution.start(branchId, branches.get(i), parent.getPayload().deepCopy(),
                    parent.getDeadline(), parentControl.getClock()));
            controls.add(parentControl.child(branchId));
            parent.record(parallel.name(), EventKind.BRANCHED, "branch " + i + " started as " + branchId);
            logger.fine("Forked branch " + branchId);
        }

        for (int i = 0; i < branches.size(); i++) {
            Execution branch = executions.get(i);
            ExecutionControl control = controls.get(i);
            CompletableFuture<ExecutionRecord> result = CompletableFuture
                    .supplyAsync(() -> interpreter.run(branch, control), branchExecutor);
            result.whenComplete((record, failure) -> {
                if (failure != null || record.status() == ExecutionStatus.FAILED) {
                    cancelSiblings(controls, control);
                }
            });
            results.add(result);
        }

        return CompletableFuture.allOf(results.toArray(new CompletableFuture<?>[0]))
                .handle((ignored, failure) -> {
                    try {
                        return join(parallel, results);
                    } finally {
                        controls.forEach(parentControl::release);
                    }
                });
    }

    private static void cancelSiblings(List<ExecutionControl> controls, ExecutionControl failed) {
        for (ExecutionControl control : controls) {
            if (control != failed && control.cancel()) {
                logger.fine("Cancelled sibling branch " + control.getExecutionId());
            }
        }
    }

    private ArrayNode join(StateSpec.Parallel parallel, List<CompletableFuture<ExecutionRecord>> results) {
        ArrayNode outputs = JsonNodeFactory.instance.arrayNode();
        BranchFailureException interrupted = null;

        for (int i = 0; i < results.size(); i++) {
            ExecutionRecord record;
            try {
                record = results.get(i).join();
            } catch (CompletionException e) {
                logger.log(Level.WARNING, "Branch " + i + " of " + parallel.name() + " crashed: " + e.getMessage());
                if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "Branch crash details for: " + parallel.name(), e);
                }
                throw new CompletionException(new BranchFailureException(parallel.name(), i,
                        ErrorNames.RUNTIME, String.valueOf(e.getCause())));
            }

            switch (record.status()) {
                case SUCCEEDED:
                    outputs.add(record.payload());
                    break;
                case FAILED:
                    throw new CompletionException(new BranchFailureException(parallel.name(), i,
                            record.error(), record.cause()));
                default:
                    if (interrupted == null) {
                        interrupted = new BranchFailureException(parallel.name(), i,
                                record.error() != null ? record.error() : ErrorNames.CANCELLED,
                                record.cause() != null ? record.cause() : "Branch did not complete");
                    }
            }
        }

        if (interrupted != null) {
            throw new CompletionException(interrupted);
        }
        return outputs;
    }
}
