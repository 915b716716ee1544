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

package dev.mars.freshflow.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.freshflow.core.TaskInput;
import dev.mars.freshflow.core.TaskResult;

import java.time.Instant;
import java.util.List;

/**
 * Built-in handler that turns a user's query into a workflow input.
 * <p>
 * Output shape: {@code {"input": {"query": ..., "metadata": {"timestamp": ..., "source": "user_input"}}}}.
 */
public class UserInputTaskHandler implements TaskHandler {

    public static final String IDENTIFIER = "user_input";

    @Override
    public String getIdentifier() {
        return IDENTIFIER;
    }

    @Override
    public List<String> getRequiredFields() {
        return List.of("query");
    }

    @Override
    public TaskResult execute(TaskInput input) {
        JsonNode query = input.getUserConfig().get("query");
        if (query == null || query.isNull() || (query.isTextual() && query.textValue().isBlank())) {
            return TaskResult.failed("No query provided");
        }

        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        metadata.put("timestamp", Instant.now().toString());
        metadata.put("source", IDENTIFIER);

        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.set("query", query.deepCopy());
        payload.set("metadata", metadata);

        ObjectNode output = JsonNodeFactory.instance.objectNode();
        output.set("input", payload);
        return TaskResult.completed(output);
    }
}
