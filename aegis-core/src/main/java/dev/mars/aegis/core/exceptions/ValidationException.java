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

import dev.mars.aegis.core.ValidationResult;

import java.util.Objects;

/**
 * Exception thrown when a workflow definition cannot be loaded because it is malformed.
 *
 * <p>Raised at load time only, never in the middle of an execution. The message lists every
 * issue that was found, not only the first one, so authors can fix a definition in one pass.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 2.0
 */
public class ValidationException extends AegisException {

    private final String workflowName;
    private final transient ValidationResult result;

    public ValidationException(String workflowName, ValidationResult result) {
        super(describe(result));
        this.workflowName = workflowName;
        this.result = Objects.requireNonNull(result, "Validation result cannot be null");
    }

    public ValidationException(String workflowName, String reason, Throwable cause) {
        super(reason, cause);
        this.workflowName = workflowName;
        this.result = new ValidationResult();
        this.result.addError(reason);
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public ValidationResult getResult() {
        return result;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (workflowName != null) {
            sb.append("Workflow '").append(workflowName).append("': ");
        }

        sb.append(super.getMessage());

        return sb.toString();
    }

    private static String describe(ValidationResult result) {
        StringBuilder sb = new StringBuilder("Workflow definition is invalid (")
                .append(result.getErrorCount()).append(result.getErrorCount() == 1 ? " error)" : " errors)");
        for (ValidationResult.Issue issue : result.getErrors()) {
            sb.append("\n  - ").append(issue);
        }
        return sb.toString();
    }
}
