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

import dev.mars.freshflow.core.exceptions.UnknownHandlerTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registration table from module identifier to {@link TaskHandler}.
 * Identifiers are case-sensitive.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class TaskHandlerRegistry {
    private static final Logger logger = LoggerFactory.getLogger(TaskHandlerRegistry.class);

    private final Map<String, TaskHandler> handlers = new ConcurrentHashMap<>();

    public TaskHandlerRegistry() {
        this(true);
    }

    /**
     * @param registerDefaults whether to register the built-in handlers
     */
    public TaskHandlerRegistry(boolean registerDefaults) {
        if (registerDefaults) {
            registerDefaultHandlers();
        }
    }

    private void registerDefaultHandlers() {
        registerHandler(new UserInputTaskHandler());
        logger.info("Registered default task handlers: {}", UserInputTaskHandler.IDENTIFIER);
    }

    public void registerHandler(TaskHandler handler) {
        Objects.requireNonNull(handler, "Handler cannot be null");
        handlers.put(handler.getIdentifier(), handler);
        logger.info("Registered task handler: {}", handler.getIdentifier());
    }

    /**
     * Register a handler under an additional identifier
     */
    public void registerAlias(String alias, TaskHandler handler) {
        Objects.requireNonNull(alias, "Alias cannot be null");
        Objects.requireNonNull(handler, "Handler cannot be null");
        handlers.put(alias, handler);
        logger.info("Registered task handler alias: {} -> {}", alias, handler.getIdentifier());
    }

    public TaskHandler getHandler(String identifier) {
        if (identifier == null) {
            return null;
        }
        return handlers.get(identifier);
    }

    /**
     * Looks up the handler for a module, failing if none is registered.
     */
    public TaskHandler requireHandler(String moduleId, String identifier) throws UnknownHandlerTypeException {
        TaskHandler handler = getHandler(identifier);
        if (handler == null) {
            throw new UnknownHandlerTypeException(moduleId, identifier);
        }
        return handler;
    }

    public boolean isHandlerRegistered(String identifier) {
        return identifier != null && handlers.containsKey(identifier);
    }

    public Set<String> getRegisteredIdentifiers() {
        return Set.copyOf(handlers.keySet());
    }

    public void unregisterHandler(String identifier) {
        if (identifier != null && handlers.remove(identifier) != null) {
            logger.info("Unregistered task handler: {}", identifier);
        }
    }
}
