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

package dev.mars.aegis.workflow.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.aegis.core.ExecutionRecord;
import dev.mars.aegis.core.ExecutionStatus;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Execution store that keeps one JSON document per execution in a directory.
 *
 * <p>Each save writes a temporary file next to the target and moves it into place, so a crash
 * leaves either the previous or the new document, never a partial one. Records left in
 * {@code RUNNING} by a crashed process are what the engine resumes from.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public class FileExecutionStore implements ExecutionStore {

    private static final Logger logger = Logger.getLogger(FileExecutionStore.class.getName());

    private static final String EXTENSION = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FileExecutionStore(Path directory) {
        this(directory, Clock.systemUTC());
    }

    public FileExecutionStore(Path directory, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "Store directory cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create execution store directory " + directory, e);
        }
        logger.info("File execution store initialized at " + directory.toAbsolutePath());
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public void save(ExecutionRecord record) {
        Objects.requireNonNull(record, "Execution record cannot be null");
        Path target = fileFor(record.executionId());
        try {
            Path temp = Files.createTempFile(directory, fileStem(record.executionId()) + "_", ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), record);
                moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save execution record " + record.executionId(), e);
        }
    }

    @Override
    public Optional<ExecutionRecord> find(String executionId) {
        if (executionId == null) {
            return Optional.empty();
        }
        Path file = fileFor(executionId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.ofNullable(read(file));
    }

    @Override
    public List<ExecutionRecord> findAll() {
        List<ExecutionRecord> records = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : files) {
                ExecutionRecord record = read(file);
                if (record != null) {
                    records.add(record);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list execution records in " + directory, e);
        }
        records.sort(Comparator.comparing(ExecutionRecord::startedAt));
        return records;
    }

    @Override
    public List<ExecutionRecord> findByStatus(ExecutionStatus status) {
        return findAll().stream()
                .filter(record -> record.status() == status)
                .collect(Collectors.toList());
    }

    @Override
    public boolean remove(String executionId) {
        if (executionId == null) {
            return false;
        }
        try {
            return Files.deleteIfExists(fileFor(executionId));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove execution record " + executionId, e);
        }
    }

    @Override
    public int cleanupTerminated(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        for (ExecutionRecord record : findAll()) {
            if (record.isTerminal() && record.endedAt() != null && record.endedAt().isBefore(cutoff)
                    && remove(record.executionId())) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("Removed " + removed + " terminated execution records older than " + maxAge);
        }
        return removed;
    }

    /**
     * Reads one record; unreadable documents are logged and skipped.
     */
    private ExecutionRecord read(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), ExecutionRecord.class);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Skipping unreadable execution record " + file + ": " + e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Execution record read failure details for: " + file, e);
            }
            return null;
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.fine("Atomic move not supported in " + directory + ", falling back to replace");
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path fileFor(String executionId) {
        return directory.resolve(fileStem(executionId) + EXTENSION);
    }

    private static String fileStem(String executionId) {
        return executionId.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
