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

package dev.mars.freshflow.core;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.freshflow.core.exceptions.ErrorCategory;
import dev.mars.freshflow.core.exceptions.MissingOutputKeyException;
import dev.mars.freshflow.core.exceptions.TaskExecutionException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TaskResult and ModuleError conversions.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-09-02
 */
class TaskResultTest {

    @Test
    void testCompletedResult() {
        ObjectNode output = JsonNodeFactory.instance.objectNode().put("content", "text");

        TaskResult result = TaskResult.completed(output);

        assertTrue(result.isSuccessful());
        assertEquals(TaskStatus.COMPLETED, result.getStatus());
        assertEquals("text", result.getOutput().get("content").textValue());
    }

    @Test
    void testFailedResultCarriesErrorField() {
        TaskResult result = TaskResult.failed("No query provided");

        assertFalse(result.isSuccessful());
        assertEquals("No query provided", result.getOutput().get(TaskResult.ERROR_FIELD).textValue());
        assertEquals("No query provided", result.getErrorMessage());
    }

    @Test
    void testFailedResultWithoutErrorField() {
        TaskResult result = new TaskResult(TaskStatus.FAILED, null);

        assertTrue(result.getOutput().isEmpty());
        assertEquals("Task reported failure without an error message", result.getErrorMessage());
    }

    @Test
    void testModuleErrorFromResult() {
        ModuleError error = ModuleError.fromResult(TaskResult.failed("bad input"));

        assertEquals("bad input", error.getMessage());
        assertEquals("TaskFailed", error.getErrorType());
        assertEquals(ErrorCategory.HANDLER, error.getCategory());
        assertFalse(error.getDetail().isPresent());
    }

    @Test
    void testModuleErrorFromException() {
        ModuleError resolution = ModuleError.fromException(new MissingOutputKeyException("s3", "content"));
        ModuleError handler = ModuleError.fromException(
                new TaskExecutionException("proc", "crashed", new IllegalStateException("disk full")));

        assertEquals("MissingOutputKeyException", resolution.getErrorType());
        assertEquals(ErrorCategory.RESOLUTION, resolution.getCategory());
        assertEquals("Task proc failed: crashed", handler.getMessage());
        assertTrue(handler.getDetail().orElseThrow().contains("disk full"));
    }

    @Test
    void testTaskInputNode() {
        ObjectNode config = JsonNodeFactory.instance.objectNode().put("query", "q");
        TaskInput input = new TaskInput("m1", "user_input", config);

        ObjectNode node = input.toNode();

        assertEquals(List.of("module_id", "identifier", "user_config"), fieldNames(node));
        assertEquals("q", node.get("user_config").get("query").textValue());
    }

    private static List<String> fieldNames(ObjectNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
