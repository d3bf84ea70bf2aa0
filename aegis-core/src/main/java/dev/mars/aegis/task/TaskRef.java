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

package dev.mars.aegis.task;

import java.util.Objects;

/**
 * Reference to an external unit of work, as written in a Task state's {@code Resource}.
 *
 * @param resource the handler identifier, e.g. {@code emergency-assessment}
 */
public record TaskRef(String resource) {

    public TaskRef {
        Objects.requireNonNull(resource, "resource");
        if (resource.isBlank()) {
            throw new IllegalArgumentException("Task resource cannot be blank");
        }
    }

    public static TaskRef of(String resource) {
        return new TaskRef(resource);
    }

    @Override
    public String toString() {
        return resource;
    }
}
