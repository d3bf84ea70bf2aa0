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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Issues found while loading or validating a workflow definition, in the order they were found.
 *
 * <p>Paths name the offending field the way it appears in the document, for example
 * {@code States.Notify.Catch[0].Next} or {@code States.Respond.Branches[1].States}. Errors make
 * a definition unusable; warnings (such as a top-level graph with no terminal state) do not.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ValidationResult {

    public enum Severity {
        ERROR, WARNING
    }

    /**
     * One problem with a definition. {@code path} is null when the problem concerns the
     * document as a whole.
     */
    public record Issue(Severity severity, String path, String message) {

        public Issue {
            Objects.requireNonNull(severity, "severity");
            Objects.requireNonNull(message, "message");
        }

        @Override
        public String toString() {
            return path == null ? severity + ": " + message : severity + " [" + path + "]: " + message;
        }
    }

    private final List<Issue> issues = new ArrayList<>();

    public void addError(String message) {
        addError(null, message);
    }

    public void addError(String path, String message) {
        issues.add(new Issue(Severity.ERROR, path, message));
    }

    public void addWarning(String path, String message) {
        issues.add(new Issue(Severity.WARNING, path, message));
    }

    /**
     * Appends every issue of {@code other}, keeping its order.
     */
    public void merge(ValidationResult other) {
        issues.addAll(other.issues);
    }

    public List<Issue> getIssues() {
        return List.copyOf(issues);
    }

    public List<Issue> getErrors() {
        return withSeverity(Severity.ERROR);
    }

    public List<Issue> getWarnings() {
        return withSeverity(Severity.WARNING);
    }

    public boolean isValid() {
        return getErrorCount() == 0;
    }

    public boolean hasWarnings() {
        return issues.stream().anyMatch(issue -> issue.severity() == Severity.WARNING);
    }

    public int getErrorCount() {
        return (int) issues.stream().filter(issue -> issue.severity() == Severity.ERROR).count();
    }

    private List<Issue> withSeverity(Severity severity) {
        return issues.stream().filter(issue -> issue.severity() == severity).collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationResult)) return false;
        return issues.equals(((ValidationResult) o).issues);
    }

    @Override
    public int hashCode() {
        return issues.hashCode();
    }

    @Override
    public String toString() {
        return "ValidationResult{errors=" + getErrorCount() + ", warnings=" + getWarnings().size() + "}";
    }
}
