package dev.mars.aegis.config;

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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Settings for the Aegis engine, backed by {@link Properties}.
 *
 * <p>Later sources override earlier ones: built-in defaults, then the first readable
 * {@code aegis.properties} ({@code ./}, {@code ./config/}, {@code ~/.aegis/}, {@code /etc/aegis/},
 * then the classpath), then {@code aegis.*} system properties. Malformed or non-positive numbers
 * are logged and replaced by their default.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 2.0
 */
public class AegisConfiguration {
    private static final Logger logger = Logger.getLogger(AegisConfiguration.class.getName());

    public static final String WORKFLOW_TIMEOUT_SECONDS = "aegis.workflow.timeout.seconds";
    public static final String TASK_TIMEOUT_SECONDS = "aegis.task.timeout.seconds";
    public static final String MAX_CONCURRENT_EXECUTIONS = "aegis.engine.max.concurrent.executions";
    public static final String STORE_DIRECTORY = "aegis.store.directory";
    public static final String STORE_RETENTION_SECONDS = "aegis.store.retention.seconds";
    public static final String METRICS_ENABLED = "aegis.metrics.enabled";

    private static final String FILE_NAME = "aegis.properties";
    private static final String SYSTEM_PREFIX = "aegis.";

    private static final Map<String, Long> NUMERIC_DEFAULTS = new LinkedHashMap<>();

    static {
        NUMERIC_DEFAULTS.put(WORKFLOW_TIMEOUT_SECONDS, Duration.ofMinutes(30).toSeconds());
        NUMERIC_DEFAULTS.put(TASK_TIMEOUT_SECONDS, 60L);
        NUMERIC_DEFAULTS.put(MAX_CONCURRENT_EXECUTIONS, 50L);
        NUMERIC_DEFAULTS.put(STORE_RETENTION_SECONDS, Duration.ofDays(1).toSeconds());
    }

    private final Properties properties = new Properties();

    public AegisConfiguration() {
        applyDefaults();
        loadFirstFile();
        applySystemOverrides();
    }

    public AegisConfiguration(Properties overrides) {
        applyDefaults();
        if (overrides != null) {
            properties.putAll(overrides);
        }
    }

    /**
     * Deadline for executions whose definition has no {@code TimeoutSeconds}.
     */
    public Duration getWorkflowTimeout() {
        return Duration.ofSeconds(positive(WORKFLOW_TIMEOUT_SECONDS));
    }

    /**
     * Invocation timeout for Task states without their own {@code TimeoutSeconds}.
     */
    public Duration getTaskTimeout() {
        return Duration.ofSeconds(positive(TASK_TIMEOUT_SECONDS));
    }

    public int getMaxConcurrentExecutions() {
        return (int) Math.min(Integer.MAX_VALUE, positive(MAX_CONCURRENT_EXECUTIONS));
    }

    /**
     * Directory for file-backed execution records. Empty keeps records in memory.
     */
    public Optional<Path> getStoreDirectory() {
        String value = properties.getProperty(STORE_DIRECTORY);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(Paths.get(value.trim()));
    }

    public Duration getStoreRetention() {
        return Duration.ofSeconds(positive(STORE_RETENTION_SECONDS));
    }

    public boolean isMetricsEnabled() {
        return Boolean.parseBoolean(properties.getProperty(METRICS_ENABLED, "true").trim());
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private long positive(String key) {
        long fallback = NUMERIC_DEFAULTS.get(key);
        String raw = properties.getProperty(key);
        if (raw == null) {
            return fallback;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value > 0) {
                return value;
            }
        } catch (NumberFormatException e) {
            logger.fine("Unparseable number for " + key + ": " + e.getMessage());
        }
        logger.warning("Ignoring " + key + "=" + raw + ", expected a positive whole number. Using " + fallback);
        return fallback;
    }

    private void applyDefaults() {
        NUMERIC_DEFAULTS.forEach((key, value) -> properties.setProperty(key, String.valueOf(value)));
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadFirstFile() {
        List<Path> candidates = List.of(
                Paths.get(FILE_NAME),
                Paths.get("config", FILE_NAME),
                Paths.get(System.getProperty("user.home"), ".aegis", FILE_NAME),
                Paths.get("/etc/aegis", FILE_NAME));

        for (Path candidate : candidates) {
            if (Files.isReadable(candidate)) {
                try (InputStream input = Files.newInputStream(candidate)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + candidate);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + candidate + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = AegisConfiguration.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void applySystemOverrides() {
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(SYSTEM_PREFIX)) {
                properties.setProperty(key, System.getProperty(key));
                logger.fine("Override from system property: " + key);
            }
        }
    }

    @Override
    public String toString() {
        return "AegisConfiguration{workflowTimeout=" + getWorkflowTimeout()
                + ", taskTimeout=" + getTaskTimeout()
                + ", maxConcurrentExecutions=" + getMaxConcurrentExecutions()
                + ", storeDirectory=" + getStoreDirectory().map(Path::toString).orElse("<memory>")
                + ", metricsEnabled=" + isMetricsEnabled() + '}';
    }
}
