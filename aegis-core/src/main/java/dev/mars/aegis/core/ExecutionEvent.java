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

import java.time.Instant;
import java.util.Objects;

/**
 * One append-only entry of an execution's audit trail.
 *
 * @param timestamp when the event happened
 * @param stateName the state the event belongs to
 * @param kind      what happened
 * @param detail    free-form detail (attempt number, error identifier, branch index...)
 */
public record ExecutionEvent(Instant timestamp, String stateName, EventKind kind, String detail) {

    public ExecutionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(stateName, "stateName");
        Objects.requireNonNull(kind, "kind");
        detail = detail != null ? detail : "";
    }
}
