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

import dev.mars.freshflow.core.TaskInput;
import dev.mars.freshflow.core.TaskResult;
import dev.mars.freshflow.core.exceptions.UnknownHandlerTypeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskHandlerRegistryTest {

    private TaskHandlerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TaskHandlerRegistry();
    }

    private static TaskHandler handler(String identifier) {
        return new TaskHandler() {
            @Override
            public String getIdentifier() {
                return identifier;
            }

            @Override
            public TaskResult execute(TaskInput input) {
                return TaskResult.completed(null);
            }
        };
    }

    @Test
    void testDefaultHandlersRegistered() {
        TaskHandler handler = registry.getHandler("user_input");
        assertNotNull(handler);
        assertTrue(handler instanceof UserInputTaskHandler);
    }

    @Test
    void testRegistryWithoutDefaults() {
        TaskHandlerRegistry empty = new TaskHandlerRegistry(false);
        assertFalse(empty.isHandlerRegistered("user_input"));
        assertTrue(empty.getRegisteredIdentifiers().isEmpty());
    }

    @Test
    void testRegisterHandler() {
        TaskHandler downloader = handler("s3_downloader");
        registry.registerHandler(downloader);

        assertTrue(registry.isHandlerRegistered("s3_downloader"));
        assertSame(downloader, registry.getHandler("s3_downloader"));
    }

    @Test
    void testRegisterAlias() {
        TaskHandler chunker = handler("document_chunker");
        registry.registerHandler(chunker);
        registry.registerAlias("chunker", chunker);

        assertSame(chunker, registry.getHandler("chunker"));
        assertEquals("document_chunker", registry.getHandler("chunker").getIdentifier());
    }

    @Test
    void testIdentifiersAreCaseSensitive() {
        assertFalse(registry.isHandlerRegistered("USER_INPUT"));
        assertNull(registry.getHandler("User_Input"));
    }

    @Test
    void testNullIdentifier() {
        assertNull(registry.getHandler(null));
        assertFalse(registry.isHandlerRegistered(null));
    }

    @Test
    void testRequireHandlerFailsForUnknownIdentifier() {
        UnknownHandlerTypeException ex = assertThrows(UnknownHandlerTypeException.class,
                () -> registry.requireHandler("mod1", "llm_call"));

        assertEquals("mod1", ex.getModuleId());
        assertEquals("llm_call", ex.getIdentifier());
        assertTrue(ex.getMessage().contains("llm_call"));
    }

    @Test
    void testUnregisterHandler() {
        registry.registerHandler(handler("temp"));
        registry.unregisterHandler("temp");

        assertFalse(registry.isHandlerRegistered("temp"));
    }
}
