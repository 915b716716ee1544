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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.freshflow.core.ModuleDefinition;
import dev.mars.freshflow.core.ModuleReference;
import dev.mars.freshflow.core.TaskInput;
import dev.mars.freshflow.core.exceptions.ErrorCategory;
import dev.mars.freshflow.core.exceptions.InvalidReferenceSyntaxException;
import dev.mars.freshflow.core.exceptions.MissingOutputKeyException;
import dev.mars.freshflow.core.exceptions.ReferenceException;
import dev.mars.freshflow.core.exceptions.UnresolvedDependencyException;
import dev.mars.freshflow.state.InMemoryStateStore;
import dev.mars.freshflow.state.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ReferenceResolver covering detection, resolution and syntax validation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
@DisplayName("ReferenceResolver")
class ReferenceResolverTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ReferenceResolver resolver;
    private StateStore store;

    @BeforeEach
    void setUp() {
        resolver = new ReferenceResolver();
        store = new InMemoryStateStore();
    }

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    private static ObjectNode object(String text) throws Exception {
        return (ObjectNode) MAPPER.readTree(text);
    }

    @Nested
    @DisplayName("Detection")
    class Detection {

        @Test
        @DisplayName("finds structured references")
        void findsStructuredReference() throws Exception {
            JsonNode config = json("""
                    {"text": {"module_id": "s3", "output_key": "content"}, "size": 3}
                    """);

            assertThat(resolver.detectReferences(config)).containsExactly("s3");
        }

        @Test
        @DisplayName("finds template references")
        void findsTemplateReference() throws Exception {
            JsonNode config = json("""
                    {"text": "${s3.output.content}"}
                    """);

            assertThat(resolver.findReferences(config))
                    .containsExactly(new ModuleReference("s3", "content"));
        }

        @Test
        @DisplayName("descends into nested objects and arrays")
        void descendsIntoNestedContainers() throws Exception {
            JsonNode config = json("""
                    {"outer": {"inner": [1, {"module_id": "a", "output_key": "x"}, ["${b.output.y}"]]}}
                    """);

            assertThat(resolver.detectReferences(config)).containsExactly("a", "b");
        }

        @Test
        @DisplayName("records every template in a string, embedded or not")
        void recordsMultipleEmbeddedTemplates() throws Exception {
            JsonNode config = json("""
                    {"prompt": "Use ${a.output.x} and ${b.output.y}"}
                    """);

            assertThat(resolver.detectReferences(config)).containsExactly("a", "b");
        }

        @Test
        @DisplayName("ignores keys that look like templates")
        void ignoresKeys() throws Exception {
            JsonNode config = json("""
                    {"${a.output.x}": "plain"}
                    """);

            assertThat(resolver.detectReferences(config)).isEmpty();
        }

        @Test
        @DisplayName("does not treat objects with extra keys as references")
        void objectWithExtraKeysIsNotReference() throws Exception {
            JsonNode config = json("""
                    {"ref": {"module_id": "a", "output_key": "x", "note": "extra"}}
                    """);

            assertThat(resolver.detectReferences(config)).isEmpty();
        }

        @Test
        @DisplayName("returns each module once in order of first appearance")
        void deduplicatesInOrder() throws Exception {
            JsonNode config = json("""
                    {"p": "${b.output.x}", "q": {"module_id": "a", "output_key": "y"}, "r": "${b.output.z}"}
                    """);

            assertThat(resolver.detectReferences(config)).containsExactly("b", "a");
        }

        @Test
        @DisplayName("is idempotent")
        void detectionIsIdempotent() throws Exception {
            JsonNode config = json("""
                    {"p": "${b.output.x}", "q": [{"module_id": "a", "output_key": "y"}]}
                    """);
            JsonNode before = config.deepCopy();

            assertThat(resolver.detectReferences(config)).isEqualTo(resolver.detectReferences(config));
            assertThat(config).isEqualTo(before);
        }
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        @Test
        @DisplayName("replaces structured references with the stored value")
        void resolvesStructuredReference() throws Exception {
            store.setOutput("s3", object("""
                    {"content": "hello world", "content_length": 11}
                    """));
            JsonNode config = json("""
                    {"text": {"module_id": "s3", "output_key": "content"}, "size": 3}
                    """);

            JsonNode resolved = resolver.resolve(config, store);

            assertThat(resolved).isEqualTo(json("""
                    {"text": "hello world", "size": 3}
                    """));
        }

        @Test
        @DisplayName("replaces whole-string templates with the raw value, keeping its type")
        void resolvesTemplateKeepingType() throws Exception {
            store.setOutput("chunker", object("""
                    {"chunks": [{"id": 1}, {"id": 2}], "total": 2}
                    """));
            JsonNode config = json("""
                    {"items": "${chunker.output.chunks}", "count": "${chunker.output.total}"}
                    """);

            JsonNode resolved = resolver.resolve(config, store);

            assertThat(resolved.get("items").isArray()).isTrue();
            assertThat(resolved.get("items")).hasSize(2);
            assertThat(resolved.get("count").isInt()).isTrue();
            assertThat(resolved.get("count").asInt()).isEqualTo(2);
        }

        @Test
        @DisplayName("resolves references inside arrays")
        void resolvesInsideArrays() throws Exception {
            store.setOutput("a", object("{\"x\": true}"));
            JsonNode config = json("""
                    {"flags": ["${a.output.x}", false]}
                    """);

            assertThat(resolver.resolve(config, store)).isEqualTo(json("{\"flags\": [true, false]}"));
        }

        @Test
        @DisplayName("fails with UnresolvedDependency before the module has output")
        void failsBeforeOutputExists() throws Exception {
            JsonNode config = json("""
                    {"text": {"module_id": "s3", "output_key": "content"}}
                    """);

            assertThatThrownBy(() -> resolver.resolve(config, store))
                    .isInstanceOf(UnresolvedDependencyException.class)
                    .satisfies(e -> {
                        UnresolvedDependencyException ex = (UnresolvedDependencyException) e;
                        assertThat(ex.getReferencedModuleId()).isEqualTo("s3");
                        assertThat(ex.getCategory()).isEqualTo(ErrorCategory.RESOLUTION);
                    });
        }

        @Test
        @DisplayName("fails with MissingOutputKey when the key is absent")
        void failsOnMissingKey() throws Exception {
            store.setOutput("s3", object("{\"content\": \"x\"}"));
            JsonNode config = json("""
                    {"text": "${s3.output.missing}"}
                    """);

            assertThatThrownBy(() -> resolver.resolve(config, store))
                    .isInstanceOf(MissingOutputKeyException.class)
                    .hasMessageContaining("missing")
                    .hasMessageContaining("s3");
        }

        @Test
        @DisplayName("rejects templates embedded in longer strings")
        void rejectsEmbeddedTemplate() throws Exception {
            store.setOutput("a", object("{\"x\": \"value\"}"));
            JsonNode config = json("""
                    {"prompt": "prefix ${a.output.x} suffix"}
                    """);

            assertThatThrownBy(() -> resolver.resolve(config, store))
                    .isInstanceOf(InvalidReferenceSyntaxException.class);
        }

        @Test
        @DisplayName("leaves the input tree and the store untouched")
        void resolutionIsIdempotent() throws Exception {
            store.setOutput("a", object("{\"x\": {\"nested\": 1}}"));
            JsonNode config = json("""
                    {"value": "${a.output.x}"}
                    """);
            JsonNode before = config.deepCopy();

            JsonNode first = resolver.resolve(config, store);
            ((ObjectNode) first.get("value")).put("nested", 99);
            JsonNode second = resolver.resolve(config, store);

            assertThat(config).isEqualTo(before);
            assertThat(second.get("value").get("nested").asInt()).isEqualTo(1);
        }

        @Test
        @DisplayName("builds TaskInput from a module definition")
        void resolvesTaskInput() throws Exception {
            store.setOutput("s3", object("{\"content\": \"hello\"}"));
            ModuleDefinition module = new ModuleDefinition("proc", "processor", object("""
                    {"text": {"module_id": "s3", "output_key": "content"}}
                    """));

            TaskInput input = resolver.resolveInput(module, store);

            assertThat(input.getModuleId()).isEqualTo("proc");
            assertThat(input.getIdentifier()).isEqualTo("processor");
            assertThat(input.getUserConfig().get("text").asText()).isEqualTo("hello");
            assertThat(input.toNode().get("user_config").get("text").asText()).isEqualTo("hello");
        }

        @Test
        @DisplayName("accepts a user_config that is itself a reference to an object")
        void resolvesWholeConfigReference() throws Exception {
            store.setOutput("a", object("{\"settings\": {\"chunk_size\": 200}}"));
            ModuleDefinition module = new ModuleDefinition("chunker", "chunker", object("""
                    {"module_id": "a", "output_key": "settings"}
                    """));

            TaskInput input = resolver.resolveInput(module, store);

            assertThat(input.getUserConfig().get("chunk_size").asInt()).isEqualTo(200);
        }

        @Test
        @DisplayName("fails with a resolution error when a whole-config reference is not an object")
        void rejectsNonObjectWholeConfigReference() throws Exception {
            store.setOutput("a", object("{\"x\": \"text\"}"));
            ModuleDefinition module = new ModuleDefinition("b", "processor", object("""
                    {"module_id": "a", "output_key": "x"}
                    """));

            assertThatThrownBy(() -> resolver.resolveInput(module, store))
                    .isInstanceOf(ReferenceException.class)
                    .hasMessageContaining("'b'")
                    .hasMessageContaining("STRING")
                    .satisfies(e -> {
                        ReferenceException ex = (ReferenceException) e;
                        assertThat(ex.getReferencedModuleId()).isEqualTo("a");
                        assertThat(ex.getCategory()).isEqualTo(ErrorCategory.RESOLUTION);
                    });
        }
    }

    @Nested
    @DisplayName("Syntax validation")
    class SyntaxValidation {

        @Test
        @DisplayName("accepts well-formed references")
        void acceptsWellFormed() throws Exception {
            JsonNode config = json("""
                    {"a": {"module_id": "m", "output_key": "k"}, "b": "${m.output.k}", "c": "plain"}
                    """);

            assertThatCode(() -> resolver.validateSyntax("mod", config)).doesNotThrowAnyException();
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "{\"ref\": {\"module_id\": \"m\"}}",
                "{\"ref\": {\"output_key\": \"k\"}}",
                "{\"ref\": {\"module_id\": 42, \"output_key\": \"k\"}}",
                "{\"ref\": {\"module_id\": \"m\", \"output_key\": \"  \"}}",
                "{\"ref\": \"see ${m.output.k} here\"}"
        })
        @DisplayName("rejects malformed references")
        void rejectsMalformed(String text) throws Exception {
            JsonNode config = json(text);

            assertThatThrownBy(() -> resolver.validateSyntax("mod", config))
                    .isInstanceOf(InvalidReferenceSyntaxException.class)
                    .hasMessageContaining("mod");
        }
    }
}
