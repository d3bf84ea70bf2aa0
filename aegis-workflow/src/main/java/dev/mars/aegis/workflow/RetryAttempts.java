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

import java.util.HashMap;
import java.util.Map;

/**
 * Retry counts for a single entry into a state, kept per retrier index.
 * A fresh instance is used every time the state is entered.
 */
public class RetryAttempts {

    private final Map<Integer, Integer> counts = new HashMap<>();

    public int count(int retrierIndex) {
        return counts.getOrDefault(retrierIndex, 0);
    }

    /**
     * @return the count after recording
     */
    public int record(int retrierIndex) {
        return counts.merge(retrierIndex, 1, Integer::sum);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    @Override
    public String toString() {
        return "RetryAttempts" + counts;
    }
}
