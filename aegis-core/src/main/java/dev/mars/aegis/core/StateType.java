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
 * The {@code Type} values accepted in a definition's {@code States} map.
 */
public enum StateType {
    TASK("Task"),
    PARALLEL("Parallel"),
    PASS("Pass"),
    SUCCEED("Succeed"),
    FAIL("Fail");

    private final String value;

    StateType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Parse a type from its definition value.
     *
     * @param value the {@code Type} field, compared case-sensitively
     * @return the corresponding type
     * @throws IllegalArgumentException if the value is {@code null} or not recognized
     */
    public static StateType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("State type must not be null");
        }
        for (StateType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown state type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
