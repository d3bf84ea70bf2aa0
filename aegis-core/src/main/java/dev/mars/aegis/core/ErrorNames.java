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

import java.util.Collection;

/**
 * Well-known error identifiers and the matcher rule used by {@code Retry} and {@code Catch}.
 */
public final class ErrorNames {

    /** Wildcard matcher, matches every error identifier. */
    public static final String ALL = "States.ALL";

    /** A task invocation or the whole workflow ran past its time budget. */
    public static final String TIMEOUT = "States.Timeout";

    /** Default identifier for handler failures that do not name their own error. */
    public static final String TASK_FAILED = "States.TaskFailed";

    /** The engine could not run the state at all, e.g. no handler bound to a resource. */
    public static final String RUNTIME = "States.Runtime";

    public static final String CANCELLED = "States.Cancelled";

    /** Default identifier recorded by a Fail state that does not set {@code Error}. */
    public static final String FAIL = "States.Fail";

    private ErrorNames() {
    }

    /**
     * Checks whether any of the matchers selects the given error identifier.
     *
     * @param matchers the {@code ErrorEquals} list of a retrier or catcher
     * @param errorName the identifier of the error being handled
     * @return true if the wildcard or an exact identifier is present
     */
    public static boolean matches(Collection<String> matchers, String errorName) {
        for (String matcher : matchers) {
            if (ALL.equals(matcher) || matcher.equals(errorName)) {
                return true;
            }
        }
        return false;
    }
}
