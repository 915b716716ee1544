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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.mars.freshflow.core.ModuleReference;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * The single recursive walk over module configuration trees.
 * <p>
 * Values are visited, keys never are. The walk rebuilds the tree as it goes:
 * reference sites are replaced by whatever the visitor returns and every other
 * leaf is carried over unchanged. The input tree is never modified.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class ConfigTraversal {

    private ConfigTraversal() {
    }

    public static <X extends Exception> JsonNode walk(JsonNode node, ConfigVisitor<X> visitor) throws X {
        if (node == null) {
            return null;
        }
        if (node.isObject()) {
            return walkObject((ObjectNode) node, visitor);
        }
        if (node.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode(node.size());
            for (JsonNode element : node) {
                copy.add(walk(element, visitor));
            }
            return copy;
        }
        if (node.isTextual()) {
            return walkText((TextNode) node, visitor);
        }
        return node;
    }

    private static <X extends Exception> JsonNode walkObject(ObjectNode node, ConfigVisitor<X> visitor) throws X {
        boolean hasModuleId = node.has(ModuleReference.FIELD_MODULE_ID);
        boolean hasOutputKey = node.has(ModuleReference.FIELD_OUTPUT_KEY);

        if (hasModuleId && hasOutputKey && node.size() == 2) {
            JsonNode moduleId = node.get(ModuleReference.FIELD_MODULE_ID);
            JsonNode outputKey = node.get(ModuleReference.FIELD_OUTPUT_KEY);
            if (isUsableText(moduleId) && isUsableText(outputKey)) {
                return visitor.visitReference(new ModuleReference(moduleId.asText(), outputKey.asText()), node);
            }
            JsonNode replacement = visitor.visitIncompleteReference(node,
                    "Reference fields must be non-blank strings");
            if (replacement != null) {
                return replacement;
            }
        } else if (hasModuleId != hasOutputKey) {
            JsonNode replacement = visitor.visitIncompleteReference(node, hasModuleId
                    ? "Reference is missing " + ModuleReference.FIELD_OUTPUT_KEY
                    : "Reference is missing " + ModuleReference.FIELD_MODULE_ID);
            if (replacement != null) {
                return replacement;
            }
        }

        ObjectNode copy = JsonNodeFactory.instance.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            copy.set(field.getKey(), walk(field.getValue(), visitor));
        }
        return copy;
    }

    private static <X extends Exception> JsonNode walkText(TextNode node, ConfigVisitor<X> visitor) throws X {
        String text = node.textValue();
        Matcher matcher = ModuleReference.TEMPLATE_PATTERN.matcher(text);
        if (matcher.matches()) {
            return visitor.visitReference(new ModuleReference(matcher.group(1), matcher.group(2)), node);
        }

        List<ModuleReference> embedded = new ArrayList<>();
        matcher.reset();
        while (matcher.find()) {
            embedded.add(new ModuleReference(matcher.group(1), matcher.group(2)));
        }
        if (embedded.isEmpty()) {
            return node;
        }
        return visitor.visitEmbeddedTemplate(node, embedded);
    }

    private static boolean isUsableText(JsonNode value) {
        return value != null && value.isTextual() && !value.textValue().isBlank();
    }
}
