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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.aegis.core.CatchPolicy;
import dev.mars.aegis.core.ResultPath;
import dev.mars.aegis.core.RetryPolicy;
import dev.mars.aegis.core.StateSpec;
import dev.mars.aegis.core.StateType;
import dev.mars.aegis.core.ValidationResult;
import dev.mars.aegis.core.WorkflowDefinition;
import dev.mars.aegis.core.exceptions.ValidationException;
import dev.mars.aegis.task.TaskRef;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Turns a generic document tree into a {@link WorkflowDefinition}.
 *
 * <p>Subclasses only decide how text becomes a Jackson tree. Every structural problem found
 * while converting the tree is collected, so a broken document is reported in one go; the
 * converted definition is then run through the {@link DefinitionValidator}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public abstract class AbstractWorkflowDefinitionParser implements WorkflowDefinitionParser {

    private static final Logger logger = Logger.getLogger(AbstractWorkflowDefinitionParser.class.getName());

    static final String DEFAULT_WORKFLOW_NAME = "unnamed-workflow";

    private final DefinitionValidator validator;

    protected AbstractWorkflowDefinitionParser() {
        this(new DefinitionValidator());
    }

    protected AbstractWorkflowDefinitionParser(DefinitionValidator validator) {
        this.validator = validator;
    }

    /**
     * Reads raw document text into a tree.
     *
     * @throws IllegalArgumentException if the text is not well-formed in the parser's format
     */
    protected abstract JsonNode readTree(String content);

    /**
     * Human-readable name of the document format, used in error messages.
     */
    protected abstract String formatName();

    @Override
    public WorkflowDefinition parse(Path file) throws ValidationException {
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new ValidationException(fileStem(file), "Failed to read " + formatName() + " file: " + file, e);
        }
        return parseDocument(fileStem(file), false, content);
    }

    @Override
    public WorkflowDefinition parseFromString(String content) throws ValidationException {
        return parseDocument(DEFAULT_WORKFLOW_NAME, false, content);
    }

    @Override
    public WorkflowDefinition parseFromString(String workflowName, String content) throws ValidationException {
        return parseDocument(workflowName, true, content);
    }

    private WorkflowDefinition parseDocument(String fallbackName, boolean nameIsExplicit, String content)
            throws ValidationException {
        if (content == null || content.isBlank()) {
            throw new ValidationException(fallbackName, "Empty " + formatName() + " content", null);
        }

        JsonNode root;
        try {
            root = readTree(content);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(fallbackName, formatName() + " parsing failed: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException(fallbackName, "Workflow document must be an object", null);
        }

        String name = fallbackName;
        if (!nameIsExplicit && root.hasNonNull("Name") && root.get("Name").isTextual()) {
            name = root.get("Name").asText();
        }

        ValidationResult issues = new ValidationResult();
        WorkflowDefinition definition = readDefinition(name, root, "", issues);
        if (!issues.isValid()) {
            throw new ValidationException(name, issues);
        }

        validator.requireValid(definition);
        logger.fine("Parsed workflow '" + name + "' with " + definition.getStates().size() + " states");
        return definition;
    }

    private WorkflowDefinition readDefinition(String name, JsonNode node, String prefix, ValidationResult issues) {
        WorkflowDefinition.Builder builder = WorkflowDefinition.builder(name);

        builder.comment(optionalText(node, "Comment", prefix, issues));
        builder.timeout(optionalSeconds(node, "TimeoutSeconds", prefix, issues));

        String startAt = optionalText(node, "StartAt", prefix, issues);
        if (startAt == null) {
            issues.addError(prefix + "StartAt", "StartAt is required");
        }
        builder.startAt(startAt);

        JsonNode states = node.get("States");
        if (states == null || !states.isObject()) {
            issues.addError(prefix + "States", "States is required and must be an object");
            return builder.build();
        }

        Iterator<Map.Entry<String, JsonNode>> fields = states.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String statePath = prefix + "States." + field.getKey();
            StateSpec state = readState(name, field.getKey(), field.getValue(), statePath, issues);
            if (state != null) {
                builder.state(state);
            }
        }

        // keep a missing StartAt missing instead of defaulting to the first state
        builder.startAt(startAt);
        return builder.build();
    }

    private StateSpec readState(String workflowName, String stateName, JsonNode node, String path,
                                ValidationResult issues) {
        if (!node.isObject()) {
            issues.addError(path, "State '" + stateName + "' must be an object");
            return null;
        }

        String typeValue = optionalText(node, "Type", path, issues);
        if (typeValue == null) {
            issues.addError(path + ".Type", "State '" + stateName + "' has no Type");
            return null;
        }

        StateType type;
        try {
            type = StateType.fromValue(typeValue);
        } catch (IllegalArgumentException e) {
            issues.addError(path + ".Type", "State '" + stateName + "' has unknown Type '" + typeValue + "'");
            return null;
        }

        String next = optionalText(node, "Next", path, issues);
        boolean end = optionalBoolean(node, "End", path, issues);
        ResultPath resultPath = readResultPath(node, path, issues);

        switch (type) {
            case TASK: {
                String resource = optionalText(node, "Resource", path, issues);
                if (resource == null || resource.isBlank()) {
                    issues.addError(path + ".Resource", "Task state '" + stateName + "' requires a Resource");
                    return null;
                }
                Duration timeout = optionalSeconds(node, "TimeoutSeconds", path, issues);
                return new StateSpec.Task(stateName, TaskRef.of(resource), next, end, resultPath, timeout,
                        readRetriers(node, path, issues), readCatchers(node, path, issues));
            }
            case PARALLEL: {
                JsonNode branchesNode = node.get("Branches");
                if (branchesNode == null || !branchesNode.isArray()) {
                    issues.addError(path + ".Branches", "Parallel state '" + stateName + "' requires a Branches array");
                    return null;
                }
                List<WorkflowDefinition> branches = new ArrayList<>();
                for (int i = 0; i < branchesNode.size(); i++) {
                    String branchPath = path + ".Branches[" + i + "]";
                    JsonNode branch = branchesNode.get(i);
                    if (!branch.isObject()) {
                        issues.addError(branchPath, "Branch must be an object");
                        continue;
                    }
                    branches.add(readDefinition(workflowName + "." + stateName + "[" + i + "]",
                            branch, branchPath + ".", issues));
                }
                return new StateSpec.Parallel(stateName, branches, next, end, resultPath,
                        readRetriers(node, path, issues), readCatchers(node, path, issues));
            }
            case PASS:
                return new StateSpec.Pass(stateName, node.get("Result"), resultPath, next, end);
            case SUCCEED:
                return new StateSpec.Succeed(stateName);
            case FAIL:
                return new StateSpec.Fail(stateName,
                        optionalText(node, "Error", path, issues),
                        optionalText(node, "Cause", path, issues));
            default:
                throw new IllegalStateException("Unhandled state type: " + type);
        }
    }

    private List<RetryPolicy> readRetriers(JsonNode node, String path, ValidationResult issues) {
        JsonNode retry = node.get("Retry");
        List<RetryPolicy> retriers = new ArrayList<>();
        if (retry == null) {
            return retriers;
        }
        if (!retry.isArray()) {
            issues.addError(path + ".Retry", "Retry must be an array");
            return retriers;
        }
        for (int i = 0; i < retry.size(); i++) {
            String entryPath = path + ".Retry[" + i + "]";
            JsonNode entry = retry.get(i);
            if (!entry.isObject()) {
                issues.addError(entryPath, "Retrier must be an object");
                continue;
            }
            retriers.add(new RetryPolicy(
                    readErrorEquals(entry, entryPath, issues),
                    optionalNumber(entry, "IntervalSeconds", RetryPolicy.DEFAULT_INTERVAL_SECONDS, entryPath, issues),
                    optionalCount(entry, "MaxAttempts", RetryPolicy.DEFAULT_MAX_ATTEMPTS, entryPath, issues),
                    optionalNumber(entry, "BackoffRate", RetryPolicy.DEFAULT_BACKOFF_RATE, entryPath, issues)));
        }
        return retriers;
    }

    private List<CatchPolicy> readCatchers(JsonNode node, String path, ValidationResult issues) {
        JsonNode catchNode = node.get("Catch");
        List<CatchPolicy> catchers = new ArrayList<>();
        if (catchNode == null) {
            return catchers;
        }
        if (!catchNode.isArray()) {
            issues.addError(path + ".Catch", "Catch must be an array");
            return catchers;
        }
        for (int i = 0; i < catchNode.size(); i++) {
            String entryPath = path + ".Catch[" + i + "]";
            JsonNode entry = catchNode.get(i);
            if (!entry.isObject()) {
                issues.addError(entryPath, "Catcher must be an object");
                continue;
            }
            String next = optionalText(entry, "Next", entryPath, issues);
            if (next == null) {
                issues.addError(entryPath + ".Next", "Catcher requires a Next state");
            }
            catchers.add(new CatchPolicy(readErrorEquals(entry, entryPath, issues),
                    readResultPath(entry, entryPath, issues), next));
        }
        return catchers;
    }

    private List<String> readErrorEquals(JsonNode entry, String path, ValidationResult issues) {
        JsonNode errorEquals = entry.get("ErrorEquals");
        List<String> matchers = new ArrayList<>();
        if (errorEquals == null || !errorEquals.isArray()) {
            issues.addError(path + ".ErrorEquals", "ErrorEquals is required and must be an array of strings");
            return matchers;
        }
        for (JsonNode matcher : errorEquals) {
            if (matcher.isTextual()) {
                matchers.add(matcher.asText());
            } else {
                issues.addError(path + ".ErrorEquals", "ErrorEquals entries must be strings: " + matcher);
            }
        }
        return matchers;
    }

    private ResultPath readResultPath(JsonNode node, String path, ValidationResult issues) {
        if (!node.has("ResultPath")) {
            return ResultPath.ROOT;
        }
        JsonNode value = node.get("ResultPath");
        if (value.isNull()) {
            return ResultPath.DISCARD;
        }
        if (!value.isTextual() || !ResultPath.isValid(value.asText())) {
            issues.addError(path + ".ResultPath", "Invalid ResultPath: " + value);
            return ResultPath.ROOT;
        }
        return ResultPath.of(value.asText());
    }

    private static String optionalText(JsonNode node, String field, String path, ValidationResult issues) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            issues.addError(path(path, field), field + " must be a string");
            return null;
        }
        return value.asText();
    }

    private static boolean optionalBoolean(JsonNode node, String field, String path, ValidationResult issues) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return false;
        }
        if (!value.isBoolean()) {
            issues.addError(path(path, field), field + " must be a boolean");
            return false;
        }
        return value.asBoolean();
    }

    private static double optionalNumber(JsonNode node, String field, double defaultValue, String path,
                                         ValidationResult issues) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isNumber()) {
            issues.addError(path(path, field), field + " must be a number");
            return defaultValue;
        }
        return value.asDouble();
    }

    private static int optionalCount(JsonNode node, String field, int defaultValue, String path,
                                     ValidationResult issues) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            issues.addError(path(path, field), field + " must be a whole number");
            return defaultValue;
        }
        return value.intValue();
    }

    private static Duration optionalSeconds(JsonNode node, String field, String path, ValidationResult issues) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isIntegralNumber() || value.asLong() <= 0) {
            issues.addError(path(path, field), field + " must be a positive integer");
            return null;
        }
        return Duration.ofSeconds(value.asLong());
    }

    private static String path(String prefix, String field) {
        if (prefix.isEmpty() || prefix.endsWith(".")) {
            return prefix + field;
        }
        return prefix + "." + field;
    }

    private static String fileStem(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
