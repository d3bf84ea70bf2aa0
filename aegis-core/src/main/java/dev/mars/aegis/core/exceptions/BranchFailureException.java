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

package dev.mars.aegis.core.exceptions;

/**
 * Failure of a Parallel state caused by one of its branches ending in FAILED.
 *
 * <p>Carries the error identifier and cause of the lowest-index failed branch unchanged,
 * so the Parallel state's own retriers and catchers match on the branch's error.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class BranchFailureException extends WorkflowErrorException {

    private final String parallelState;
    private final int branchIndex;

    public BranchFailureException(String parallelState, int branchIndex, String errorName, String detail) {
        super(errorName, detail);
        this.parallelState = parallelState;
        this.branchIndex = branchIndex;
    }

    public String getParallelState() {
        return parallelState;
    }

    public int getBranchIndex() {
        return branchIndex;
    }
}
