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

package dev.mars.freshflow.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.mars.freshflow.core.ModuleReference;

import java.util.List;

/**
 * Callbacks invoked by {@link ConfigTraversal} at each reference site of a configuration tree.
 * <p>
 * Every hook returns the node that replaces the site in the rebuilt tree.
 *
 * @param <X> the checked exception a visitor may raise
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public interface ConfigVisitor<X extends Exception> {

    /**
     * A structured reference object or a string that is exactly one template.
     */
    JsonNode visitReference(ModuleReference reference, JsonNode site) throws X;

    /**
     * A string with template matches that do not cover the whole string.
     */
    JsonNode visitEmbeddedTemplate(TextNode site, List<ModuleReference> references) throws X;

    /**
     * An object that carries only one of {@code module_id} and {@code output_key},
     * or carries them with non-string or blank values.
     *
     * @return the replacement node, or null to traverse the object as ordinary data
     */
    default JsonNode visitIncompleteReference(ObjectNode site, String reason) throws X {
        return null;
    }
}
