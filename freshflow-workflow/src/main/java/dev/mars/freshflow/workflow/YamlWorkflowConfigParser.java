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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * YAML implementation of WorkflowConfigParser.
 * Loads the document with SnakeYAML's safe constructor and converts it to a Jackson tree.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public class YamlWorkflowConfigParser extends AbstractWorkflowConfigParser {

    private final Yaml yaml;
    private final ObjectMapper objectMapper;

    public YamlWorkflowConfigParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
        this.objectMapper = new ObjectMapper();
    }

    @Override
    protected JsonNode readTree(String content) throws WorkflowParseException {
        Object data;
        try {
            data = yaml.load(content);
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed", e);
        }
        if (data == null) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }
        try {
            return objectMapper.valueToTree(data);
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException("YAML content cannot be represented as a workflow document", e);
        }
    }
}
