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

import dev.mars.aegis.core.StateSpec;
import dev.mars.aegis.core.WorkflowDefinition;
import dev.mars.aegis.core.exceptions.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowRegistryTest {

    private WorkflowRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new WorkflowRegistry();
    }

    @Test
    void bundledDefinitionsLoadAndValidate() throws Exception {
        assertEquals(3, registry.loadBundledDefinitions());

        assertEquals(Set.of(WorkflowRegistry.NATURAL_DISASTER_WORKFLOW,
                        WorkflowRegistry.INFRASTRUCTURE_FAILURE_WORKFLOW,
                        WorkflowRegistry.SECURITY_INCIDENT_WORKFLOW),
                registry.getWorkflowNames());

        WorkflowDefinition natural = registry.get(WorkflowRegistry.NATURAL_DISASTER_WORKFLOW).orElseThrow();
        assertEquals("AssessEmergency", natural.getStartState());
        assertEquals(Duration.ofMinutes(30), natural.getTimeout().orElseThrow());
        StateSpec.Parallel parallel = (StateSpec.Parallel) natural.getState("ParallelResponse");
        assertEquals(3, parallel.branches().size());
    }

    @Test
    void registeringInvalidDefinitionFails() {
        WorkflowDefinition broken = WorkflowDefinition.builder("broken")
                .state(new StateSpec.Pass("Start", null, null, "Nowhere", false))
                .build();

        assertThrows(ValidationException.class, () -> registry.register(broken));
        assertFalse(registry.contains("broken"));
    }

    @Test
    void registeringSameNameReplaces() throws Exception {
        registry.register(WorkflowDefinition.builder("wf").state(new StateSpec.Succeed("A")).build());
        registry.register(WorkflowDefinition.builder("wf").state(new StateSpec.Succeed("B")).build());

        assertEquals("B", registry.get("wf").orElseThrow().getStartState());
    }

    @Test
    void filesArePickedUpByExtension(@TempDir Path dir) throws Exception {
        Path json = dir.resolve("json-flow.json");
        Files.writeString(json, "{\"StartAt\": \"Done\", \"States\": {\"Done\": {\"Type\": \"Succeed\"}}}");
        Path yaml = dir.resolve("yaml-flow.yaml");
        Files.writeString(yaml, "StartAt: Done\nStates:\n  Done:\n    Type: Succeed\n");

        registry.register(json);
        registry.register(yaml);

        assertTrue(registry.contains("json-flow"));
        assertTrue(registry.contains("yaml-flow"));
    }

    @Test
    void unregisterRemovesDefinition() throws Exception {
        registry.register(WorkflowDefinition.builder("wf").state(new StateSpec.Succeed("A")).build());

        assertTrue(registry.unregister("wf"));
        assertTrue(registry.get("wf").isEmpty());
        assertTrue(registry.get(null).isEmpty());
    }
}
