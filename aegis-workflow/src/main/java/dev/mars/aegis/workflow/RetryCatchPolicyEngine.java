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
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.aegis.core.CatchPolicy;
import dev.mars.aegis.core.RetryPolicy;
import dev.mars.aegis.core.exceptions.RetryExhaustedException;
import dev.mars.aegis.core.exceptions.WorkflowErrorException;

import java.util.List;

/**
 * Decides what happens to a failed state.
 *
 * <p>Retriers are scanned in declared order and the first one that matches the error and still
 * has attempts left wins. When no retrier applies, catchers are scanned in declared order and the
 * first match wins. Otherwise the error propagates; if some retrier matched but had run out of
 * attempts, it propagates as a {@link RetryExhaustedException} that keeps the original error
 * name, so enclosing catchers still match on it.</p>
 *
 * <p>The engine holds no state. Callers record the retry in their {@link RetryAttempts} when they
 * act on a {@link PolicyDecision.Retry}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class RetryCatchPolicyEngine {

    public static final String ERROR_FIELD = "Error";
    public static final String CAUSE_FIELD = "Cause";

    public PolicyDecision decide(WorkflowErrorException error, List<RetryPolicy> retriers,
                                 List<CatchPolicy> catchers, RetryAttempts attempts) {
        String errorName = error.getErrorName();

        int exhaustedAttempts = -1;
        for (int i = 0; i < retriers.size(); i++) {
            RetryPolicy retrier = retriers.get(i);
            if (!retrier.matches(errorName)) {
                continue;
            }
            int used = attempts.count(i);
            if (used < retrier.maxAttempts()) {
                int attemptNumber = used + 1;
                return new PolicyDecision.Retry(i, attemptNumber, retrier.delayBeforeRetry(attemptNumber));
            }
            if (exhaustedAttempts < 0) {
                exhaustedAttempts = used;
            }
        }

        WorkflowErrorException effective = exhaustedAttempts >= 0 && !(error instanceof RetryExhaustedException)
                ? new RetryExhaustedException(error, exhaustedAttempts)
                : error;

        for (int i = 0; i < catchers.size(); i++) {
            CatchPolicy catcher = catchers.get(i);
            if (catcher.matches(errorName)) {
                return new PolicyDecision.Catch(i, catcher, errorOutput(effective));
            }
        }

        return new PolicyDecision.Propagate(effective);
    }

    /**
     * The {@code {Error, Cause}} object merged into the payload when an error is caught.
     */
    public static ObjectNode errorOutput(WorkflowErrorException error) {
        ObjectNode output = JsonNodeFactory.instance.objectNode();
        output.put(ERROR_FIELD, error.getErrorName());
        output.put(CAUSE_FIELD, error.getDetail());
        return output;
    }
}
