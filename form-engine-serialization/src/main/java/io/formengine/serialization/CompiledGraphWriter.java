package io.formengine.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.formengine.core.ast.node.Node;
import io.formengine.core.ast.node.PseudoNode;
import io.formengine.core.ast.registry.ReadOnlyMetadataRegistry;
import io.formengine.core.ast.registry.ReadOnlyNodeRegistry;
import io.formengine.core.ast.registry.RegistryEntry;
import io.formengine.core.compilation.CompiledStep;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/// Writes compiled node graphs and step artefacts as JSON for diagnostics.
///
/// ### Usage
/// {@snippet :
/// String tree = CompiledGraphWriter.toJson(form.getSharedCompilation().root());
/// String step = CompiledGraphWriter.toJson(form.compileStep(stepId));
/// }
///
/// A single node is written as a full tree. Registries and compiled steps list every node
/// once and write child nodes as `{"ref": "<id>"}`.
///
/// @implNote Thread-safe. A mapper is created per call via {@link #createMapper()}.
///
/// @see FormEngineJacksonModule for the registered type handlers
public final class CompiledGraphWriter {

    private CompiledGraphWriter() {}

    /// Serializes a node and all nodes below it.
    ///
    /// @param node root of the tree to write, not null
    /// @return pretty-printed JSON, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Node node) {
        try {
            return createMapper().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize node: " + e.getMessage(), e);
        }
    }

    /// Serializes every registry entry with its path, child nodes as references.
    ///
    /// @param registry registry to write, not null
    /// @return pretty-printed JSON, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ReadOnlyNodeRegistry registry) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("size", registry.size());
        document.put("entries", entries(registry));
        return writeShallow(document, "registry");
    }

    /// Serializes a compiled step: its relevant nodes, created pseudo-nodes, the ids of its
    /// journey metadata nodes and the metadata of its relevant nodes.
    ///
    /// @param step compiled step to write, not null
    /// @return pretty-printed JSON, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(CompiledStep step) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("stepId", step.getStepId());
        document.put("path", step.getStep().getPath());
        document.put("compiledAt", step.getCompiledAt());
        document.put("durationMillis", step.getDuration().toMillis());

        List<String> created = new ArrayList<>();
        for (PseudoNode pseudo : step.getCreatedPseudoNodes()) {
            created.add(pseudo.getId());
        }
        document.put("createdPseudoNodes", created);
        document.put("relevantNodes", step.relevantNodes());
        List<String> journeyMetadata = new ArrayList<>();
        for (Node node : step.journeyMetadataNodes()) {
            journeyMetadata.add(node.getId());
        }
        document.put("journeyMetadataNodes", journeyMetadata);
        document.put("metadata", metadataOf(step.relevantNodes(), step.metadata()));
        return writeShallow(document, "compiled step");
    }

    /// Creates an ObjectMapper configured for graph output.
    ///
    /// Registers:
    /// - `FormEngineJacksonModule` for the node hierarchy
    /// - `JavaTimeModule` for `Instant` fields, written as ISO-8601 strings
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new FormEngineJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static List<Map<String, Object>> entries(ReadOnlyNodeRegistry registry) {
        List<Map<String, Object>> entries = new ArrayList<>(registry.size());
        for (String id : registry.getIds()) {
            RegistryEntry entry = registry.getEntry(id);
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("path", entry.path());
            item.put("node", entry.node());
            entries.add(item);
        }
        return entries;
    }

    private static Map<String, Object> metadataOf(
            List<Node> nodes, ReadOnlyMetadataRegistry metadata) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Node node : nodes) {
            Map<String, Object> values = metadata.getAll(node.getId());
            if (!values.isEmpty()) {
                result.put(node.getId(), new TreeMap<>(values));
            }
        }
        return result;
    }

    private static String writeShallow(Object document, String what) {
        try {
            return createMapper()
                    .writer()
                    .withAttribute(NodeSerializer.SHALLOW, Boolean.TRUE)
                    .writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize " + what + ": " + e.getMessage(), e);
        }
    }
}
