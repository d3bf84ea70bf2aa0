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

import dev.mars.aegis.core.WorkflowDefinition;
import dev.mars.aegis.core.exceptions.ValidationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Named, validated workflow definitions available to the engine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public class WorkflowRegistry {

    private static final Logger logger = Logger.getLogger(WorkflowRegistry.class.getName());

    public static final String NATURAL_DISASTER_WORKFLOW = "NaturalDisasterResponseWorkflow";
    public static final String INFRASTRUCTURE_FAILURE_WORKFLOW = "InfrastructureFailureResponseWorkflow";
    public static final String SECURITY_INCIDENT_WORKFLOW = "SecurityIncidentResponseWorkflow";

    static final String BUNDLED_LOCATION = "workflows/";
    static final List<String> BUNDLED_WORKFLOWS = List.of(
            NATURAL_DISASTER_WORKFLOW,
            INFRASTRUCTURE_FAILURE_WORKFLOW,
            SECURITY_INCIDENT_WORKFLOW);

    private final Map<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();
    private final DefinitionValidator validator;
    private final WorkflowDefinitionParser jsonParser;
    private final WorkflowDefinitionParser yamlParser;

    public WorkflowRegistry() {
        this(new DefinitionValidator());
    }

    public WorkflowRegistry(DefinitionValidator validator) {
        this.validator = Objects.requireNonNull(validator, "Validator cannot be null");
        this.jsonParser = new JsonWorkflowDefinitionParser();
        this.yamlParser = new YamlWorkflowDefinitionParser();
    }

    /**
     * Validates and registers a definition, replacing any previous one with the same name.
     */
    public WorkflowRegistry register(WorkflowDefinition definition) throws ValidationException {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        validator.requireValid(definition);
        WorkflowDefinition previous = definitions.put(definition.getName(), definition);
        if (previous != null) {
            logger.info("Replaced workflow definition: " + definition.getName());
        } else {
            logger.fine("Registered workflow definition: " + definition.getName());
        }
        return this;
    }

    /**
     * Parses a {@code .json}, {@code .yaml} or {@code .yml} file and registers the result.
     */
    public WorkflowDefinition register(Path file) throws ValidationException {
        String fileName = file.getFileName().toString().toLowerCase();
        WorkflowDefinitionParser parser = fileName.endsWith(".yaml") || fileName.endsWith(".yml")
                ? yamlParser
                : jsonParser;
        WorkflowDefinition definition = parser.parse(file);
        register(definition);
        return definition;
    }

    /**
     * Registers the emergency-response definitions shipped on the classpath under
     * {@code workflows/}.
     *
     * @return the number of definitions loaded
     */
    public int loadBundledDefinitions() throws ValidationException {
        for (String name : BUNDLED_WORKFLOWS) {
            String resource = BUNDLED_LOCATION + name + ".json";
            try (InputStream input = WorkflowRegistry.class.getClassLoader().getResourceAsStream(resource)) {
                if (input == null) {
                    throw new ValidationException(name, "Bundled definition not found on classpath: " + resource, null);
                }
                String content = new String(input.readAllBytes(), StandardCharsets.UTF_8);
                register(jsonParser.parseFromString(name, content));
            } catch (IOException e) {
                throw new ValidationException(name, "Failed to read bundled definition " + resource, e);
            }
        }
        logger.info("Loaded " + BUNDLED_WORKFLOWS.size() + " bundled workflow definitions");
        return BUNDLED_WORKFLOWS.size();
    }

    public Optional<WorkflowDefinition> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(definitions.get(name));
    }

    public boolean contains(String name) {
        return name != null && definitions.containsKey(name);
    }

    public boolean unregister(String name) {
        return definitions.remove(name) != null;
    }

    public Set<String> getWorkflowNames() {
        return new TreeSet<>(definitions.keySet());
    }
}
