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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON implementation of WorkflowConfigParser, backed by Jackson.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public class JsonWorkflowConfigParser extends AbstractWorkflowConfigParser {

    private final ObjectMapper objectMapper;

    public JsonWorkflowConfigParser() {
        this(new ObjectMapper());
    }

    public JsonWorkflowConfigParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    protected JsonNode readTree(String content) throws WorkflowParseException {
        try {
            return objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new WorkflowParseException("JSON parsing failed: " + e.getOriginalMessage(), e);
        }
    }
}
