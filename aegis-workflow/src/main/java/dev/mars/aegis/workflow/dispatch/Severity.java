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


package dev.mars.aegis.workflow.dispatch;

/**
 * Incident severity derived from impact and urgency scores.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static final int DEFAULT_SCORE = 3;

    /**
     * Maps {@code impact * urgency} onto a severity: 12 and above is critical, 8 high, 4 medium.
     */
    public static Severity fromScores(int impact, int urgency) {
        int score = impact * urgency;
        if (score >= 12) {
            return CRITICAL;
        }
        if (score >= 8) {
            return HIGH;
        }
        if (score >= 4) {
            return MEDIUM;
        }
        return LOW;
    }
}
