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

import dev.mars.aegis.core.CatchPolicy;
import dev.mars.aegis.core.ErrorNames;
import dev.mars.aegis.core.ResultPath;
import dev.mars.aegis.core.RetryPolicy;
import dev.mars.aegis.core.exceptions.RetryExhaustedException;
import dev.mars.aegis.core.exceptions.TaskInvocationException;
import dev.mars.aegis.core.exceptions.WorkflowErrorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RetryCatchPolicyEngineTest {

    private static final WorkflowErrorException TIMEOUT =
            new TaskInvocationException(ErrorNames.TIMEOUT, "no answer");

    private RetryCatchPolicyEngine engine;
    private RetryAttempts attempts;

    @BeforeEach
    void setUp() {
        engine = new RetryCatchPolicyEngine();
        attempts = new RetryAttempts();
    }

    @Test
    void firstMatchingRetrierWithAttemptsLeftWins() {
        List<RetryPolicy> retriers = List.of(
                new RetryPolicy(List.of("Other.Error"), 9, 3, 2.0),
                new RetryPolicy(List.of(ErrorNames.TIMEOUT), 2, 3, 2.0),
                new RetryPolicy(List.of(ErrorNames.ALL), 5, 3, 2.0));

        PolicyDecision decision = engine.decide(TIMEOUT, retriers, List.of(), attempts);

        assertThat(decision).isEqualTo(new PolicyDecision.Retry(1, 1, Duration.ofSeconds(2)));
    }

    @Test
    void attemptNumberAdvancesWithRecordedRetries() {
        List<RetryPolicy> retriers = List.of(new RetryPolicy(List.of(ErrorNames.TIMEOUT), 2, 3, 2.0));
        attempts.record(0);
        attempts.record(0);

        PolicyDecision decision = engine.decide(TIMEOUT, retriers, List.of(), attempts);

        assertThat(decision).isEqualTo(new PolicyDecision.Retry(0, 3, Duration.ofSeconds(8)));
    }

    @Test
    void exhaustedRetrierFallsThroughToNextMatchingRetrier() {
        List<RetryPolicy> retriers = List.of(
                new RetryPolicy(List.of(ErrorNames.TIMEOUT), 1, 1, 2.0),
                new RetryPolicy(List.of(ErrorNames.ALL), 4, 2, 2.0));
        attempts.record(0);

        PolicyDecision decision = engine.decide(TIMEOUT, retriers, List.of(), attempts);

        assertThat(decision).isEqualTo(new PolicyDecision.Retry(1, 1, Duration.ofSeconds(4)));
    }

    @Test
    void zeroMaxAttemptsNeverRetries() {
        List<RetryPolicy> retriers = List.of(new RetryPolicy(List.of(ErrorNames.ALL), 1, 0, 2.0));

        PolicyDecision decision = engine.decide(TIMEOUT, retriers, List.of(), attempts);

        assertThat(decision).isInstanceOf(PolicyDecision.Propagate.class);
    }

    @Test
    void firstMatchingCatcherWinsWithErrorOutput() {
        List<CatchPolicy> catchers = List.of(
                new CatchPolicy(List.of("Other.Error"), ResultPath.ROOT, "Ignored"),
                new CatchPolicy(List.of(ErrorNames.TIMEOUT), ResultPath.of("$.error"), "Fallback"),
                new CatchPolicy(List.of(ErrorNames.ALL), ResultPath.ROOT, "CatchAll"));

        PolicyDecision decision = engine.decide(TIMEOUT, List.of(), catchers, attempts);

        assertThat(decision).isInstanceOf(PolicyDecision.Catch.class);
        PolicyDecision.Catch caught = (PolicyDecision.Catch) decision;
        assertThat(caught.catcherIndex()).isEqualTo(1);
        assertThat(caught.catcher().next()).isEqualTo("Fallback");
        assertThat(caught.errorOutput().get("Error").asText()).isEqualTo(ErrorNames.TIMEOUT);
        assertThat(caught.errorOutput().get("Cause").asText()).isEqualTo("no answer");
    }

    @Test
    void unmatchedErrorPropagatesUnchanged() {
        PolicyDecision decision = engine.decide(TIMEOUT,
                List.of(RetryPolicy.of(List.of("Other.Error"))),
                List.of(new CatchPolicy(List.of("Other.Error"), null, "Fallback")),
                attempts);

        assertThat(decision).isEqualTo(new PolicyDecision.Propagate(TIMEOUT));
    }

    @Test
    void exhaustedRetriesPropagateKeepingTheErrorName() {
        List<RetryPolicy> retriers = List.of(new RetryPolicy(List.of(ErrorNames.TIMEOUT), 1, 2, 2.0));
        attempts.record(0);
        attempts.record(0);

        PolicyDecision decision = engine.decide(TIMEOUT, retriers, List.of(), attempts);

        assertThat(decision).isInstanceOf(PolicyDecision.Propagate.class);
        WorkflowErrorException error = ((PolicyDecision.Propagate) decision).error();
        assertThat(error).isInstanceOf(RetryExhaustedException.class);
        assertThat(error.getErrorName()).isEqualTo(ErrorNames.TIMEOUT);
        assertThat(((RetryExhaustedException) error).getAttempts()).isEqualTo(2);
        assertThat(((RetryExhaustedException) error).getLastFailure()).isSameAs(TIMEOUT);
        assertThat(attempts.total()).isEqualTo(2);
    }
}
