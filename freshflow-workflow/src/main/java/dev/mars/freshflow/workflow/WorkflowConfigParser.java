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

package dev.mars.freshflow.workflow;

import java.nio.file.Path;

/**
 * Interface for parsing workflow configuration documents.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public interface WorkflowConfigParser {

    /**
     * Parses a workflow configuration from a file.
     *
     * @param file the file containing the configuration
     * @return the parsed configuration
     * @throws WorkflowParseException if the file cannot be read or is not a valid document
     */
    WorkflowConfig parse(Path file) throws WorkflowParseException;

    /**
     * Parses a workflow configuration from its text form.
     *
     * @param content the document text
     * @return the parsed configuration
     * @throws WorkflowParseException if the content is not a valid document
     */
    WorkflowConfig parseFromString(String content) throws WorkflowParseException;
}
