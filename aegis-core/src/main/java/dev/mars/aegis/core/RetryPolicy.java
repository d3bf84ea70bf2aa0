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

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * One entry of a state's {@code Retry} list.
 *
 * <p>Numeric ranges ({@code intervalSeconds > 0}, {@code maxAttempts >= 0},
 * {@code backoffRate >= 1}) are checked by the definition validator rather than here, so
 * that a definition with several bad policies reports all of them at once.</p>
 *
 * @param errorEquals     error identifiers this retrier applies to ({@code States.ALL} matches all)
 * @param intervalSeconds delay before the first retry
 * @param maxAttempts     number of retries allowed per state entry; 0 disables retrying
 * @param backoffRate     multiplier applied to the delay after each retry
 */
public record RetryPolicy(List<String> errorEquals, double intervalSeconds, int maxAttempts, double backoffRate) {

    public static final double DEFAULT_INTERVAL_SECONDS = 1.0;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final double DEFAULT_BACKOFF_RATE = 2.0;

    public RetryPolicy {
        Objects.requireNonNull(errorEquals, "errorEquals");
        errorEquals = List.copyOf(errorEquals);
    }

    public static RetryPolicy of(List<String> errorEquals) {
        return new RetryPolicy(errorEquals, DEFAULT_INTERVAL_SECONDS, DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF_RATE);
    }

    public boolean matches(String errorName) {
        return ErrorNames.matches(errorEquals, errorName);
    }

    /**
     * Delay to wait before the given retry.
     *
     * @param retryNumber 1 for the first retry, 2 for the second, ...
     * @return {@code intervalSeconds * backoffRate^(retryNumber - 1)}
     */
    public Duration delayBeforeRetry(int retryNumber) {
        if (retryNumber < 1) {
            throw new IllegalArgumentException("Retry number starts at 1: " + retryNumber);
        }
        double seconds = intervalSeconds * Math.pow(backoffRate, retryNumber - 1);
        return Duration.ofMillis(Math.round(seconds * 1000.0));
    }
}
