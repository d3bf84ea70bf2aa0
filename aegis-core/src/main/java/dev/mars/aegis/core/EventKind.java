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

/**
 * Kinds of entries appended to an execution's history.
 */
public enum EventKind {
    /** A state was entered; recorded exactly once per entry, before processing starts. */
    ENTERED,
    /** A failed attempt is going to be retried after a backoff delay. */
    RETRIED,
    /** An error was routed to a fallback state by a catcher. */
    CAUGHT,
    /** A Parallel state started one of its branches. */
    BRANCHED,
    /** A Parallel state finished waiting for all of its branches. */
    JOINED,
    /** A state finished and the execution left it. */
    EXITED
}
