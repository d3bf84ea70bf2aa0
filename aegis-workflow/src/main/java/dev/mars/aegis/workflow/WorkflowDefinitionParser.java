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

import java.nio.file.Path;

public interface WorkflowDefinitionParser {

    /**
     * Parses a definition file. The workflow is named after the file, without its extension,
     * unless the document carries a top-level {@code Name}.
     */
    WorkflowDefinition parse(Path file) throws ValidationException;

    WorkflowDefinition parseFromString(String content) throws ValidationException;

    WorkflowDefinition parseFromString(String workflowName, String content) throws ValidationException;
}
