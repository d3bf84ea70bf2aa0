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

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Source of retry backoff delays. The interpreter waits on the returned future through its
 * {@link ExecutionControl}, so a backoff can always be cut short by cancellation or the deadline.
 */
@FunctionalInterface
public interface BackoffSleeper {

    /** Completes after the delay on the common delayed executor. */
    BackoffSleeper SCHEDULED = delay -> {
        CompletableFuture<Void> timer = new CompletableFuture<>();
        return timer.completeOnTimeout(null, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
    };

    CompletableFuture<Void> after(Duration delay);
}
