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

import java.util.List;
import java.util.Objects;

/**
 * One entry of a state's {@code Catch} list.
 *
 * @param errorEquals error identifiers this catcher applies to ({@code States.ALL} matches all)
 * @param resultPath  where {@code {"Error": ..., "Cause": ...}} is merged into the payload
 * @param next        the fallback state to transition to
 */
public record CatchPolicy(List<String> errorEquals, ResultPath resultPath, String next) {

    public CatchPolicy {
        Objects.requireNonNull(errorEquals, "errorEquals");
        errorEquals = List.copyOf(errorEquals);
        resultPath = resultPath != null ? resultPath : ResultPath.ROOT;
    }

    public boolean matches(String errorName) {
        return ErrorNames.matches(errorEquals, errorName);
    }
}
