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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.freshflow.core.TaskInput;
import dev.mars.freshflow.core.TaskResult;
import dev.mars.freshflow.core.TaskStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class UserInputTaskHandlerTest {

    private final UserInputTaskHandler handler = new UserInputTaskHandler();

    @Test
    void wrapsQueryWithMetadata() {
        ObjectNode config = JsonNodeFactory.instance.objectNode();
        config.put("query", "What is Freshflow?");

        TaskResult result = handler.execute(new TaskInput("input_001", "user_input", config));

        assertThat(result.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(result.getOutput().at("/input/query").asText()).isEqualTo("What is Freshflow?");
        assertThat(result.getOutput().at("/input/metadata/source").asText()).isEqualTo("user_input");
        assertThat(result.getOutput().at("/input/metadata/timestamp").isMissingNode()).isFalse();
    }

    @Test
    void failsWithoutQuery() {
        TaskResult result = handler.execute(
                new TaskInput("input_001", "user_input", JsonNodeFactory.instance.objectNode()));

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getErrorMessage()).isEqualTo("No query provided");
    }

    @Test
    void declaresQueryAsRequired() {
        assertThat(handler.getRequiredFields()).containsExactly("query");
    }
}
