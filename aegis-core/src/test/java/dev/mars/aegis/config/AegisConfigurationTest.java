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

package dev.mars.aegis.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class AegisConfigurationTest {

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        private final AegisConfiguration config = new AegisConfiguration(new Properties());

        @Test
        void timeoutsDefaultToHalfAnHourAndOneMinute() {
            assertEquals(Duration.ofMinutes(30), config.getWorkflowTimeout());
            assertEquals(Duration.ofSeconds(60), config.getTaskTimeout());
        }

        @Test
        void storeDefaultsToMemoryWithOneDayRetention() {
            assertEquals(Optional.empty(), config.getStoreDirectory());
            assertEquals(Duration.ofDays(1), config.getStoreRetention());
        }

        @Test
        void engineDefaults() {
            assertEquals(50, config.getMaxConcurrentExecutions());
            assertTrue(config.isMetricsEnabled());
        }
    }

    @Nested
    @DisplayName("Overrides")
    class Overrides {

        @Test
        void givenPropertiesOverrideDefaults() {
            Properties props = new Properties();
            props.setProperty(AegisConfiguration.WORKFLOW_TIMEOUT_SECONDS, "120");
            props.setProperty(AegisConfiguration.TASK_TIMEOUT_SECONDS, "5");
            props.setProperty(AegisConfiguration.MAX_CONCURRENT_EXECUTIONS, "4");
            props.setProperty(AegisConfiguration.STORE_DIRECTORY, " /var/lib/aegis ");
            props.setProperty(AegisConfiguration.METRICS_ENABLED, "false");

            AegisConfiguration config = new AegisConfiguration(props);

            assertEquals(Duration.ofMinutes(2), config.getWorkflowTimeout());
            assertEquals(Duration.ofSeconds(5), config.getTaskTimeout());
            assertEquals(4, config.getMaxConcurrentExecutions());
            assertEquals(Optional.of(Paths.get("/var/lib/aegis")), config.getStoreDirectory());
            assertFalse(config.isMetricsEnabled());
        }

        @Test
        void invalidOrNonPositiveValuesFallBackToDefaults() {
            Properties props = new Properties();
            props.setProperty(AegisConfiguration.WORKFLOW_TIMEOUT_SECONDS, "soon");
            props.setProperty(AegisConfiguration.TASK_TIMEOUT_SECONDS, "-1");
            props.setProperty(AegisConfiguration.MAX_CONCURRENT_EXECUTIONS, "many");

            AegisConfiguration config = new AegisConfiguration(props);

            assertEquals(Duration.ofMinutes(30), config.getWorkflowTimeout());
            assertEquals(Duration.ofSeconds(60), config.getTaskTimeout());
            assertEquals(50, config.getMaxConcurrentExecutions());
        }

        @Test
        void setPropertyTakesEffectImmediately() {
            AegisConfiguration config = new AegisConfiguration(new Properties());
            config.setProperty(AegisConfiguration.STORE_RETENTION_SECONDS, "60");

            assertEquals(Duration.ofMinutes(1), config.getStoreRetention());
            assertEquals("60", config.getProperty(AegisConfiguration.STORE_RETENTION_SECONDS));
        }
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        String key = AegisConfiguration.TASK_TIMEOUT_SECONDS;
        String previous = System.getProperty(key);
        System.setProperty(key, "7");
        try {
            assertEquals(Duration.ofSeconds(7), new AegisConfiguration().getTaskTimeout());
        } finally {
            if (previous == null) {
                System.clearProperty(key);
            } else {
                System.setProperty(key, previous);
            }
        }
    }
}
