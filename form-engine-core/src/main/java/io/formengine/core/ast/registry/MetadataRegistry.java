package io.formengine.core.ast.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Per-node key/value side table for facts derived after nodes became immutable.
///
/// Holds parent linkage and step-scope flags (see {@link MetadataKeys}). Queries for
/// unknown nodes or keys return the caller's default and never fail.
///
/// @implNote **Not thread-safe** for writers. Like {@link NodeRegistry}, an instance is
/// written during compilation only and forked with {@link #clone()} per step.
public final class MetadataRegistry implements ReadOnlyMetadataRegistry {

    private final Map<String, Map<String, Object>> metadata;

    public MetadataRegistry() {
        this.metadata = new LinkedHashMap<>();
    }

    private MetadataRegistry(MetadataRegistry source) {
        this.metadata = new LinkedHashMap<>();
        source.metadata.forEach((nodeId, values) -> metadata.put(nodeId, new HashMap<>(values)));
    }

    /// Sets a metadata value; the last write for a (node, key) pair wins.
    ///
    /// @param nodeId node identifier, not null
    /// @param key metadata key, not null
    /// @param value metadata value, may be null
    public void set(String nodeId, String key, Object value) {
        metadata.computeIfAbsent(nodeId, k -> new HashMap<>()).put(key, value);
    }

    /// Returns a metadata value or a default.
    ///
    /// @param nodeId node identifier, not null
    /// @param key metadata key, not null
    /// @param defaultValue value returned when absent, may be null
    /// @param <T> expected value type
    /// @return stored value, or `defaultValue` if the node or key has none
    /// @throws ClassCastException if the stored value is not of the default's type
    @SuppressWarnings("unchecked")
    public <T> T get(String nodeId, String key, T defaultValue) {
        Map<String, Object> values = metadata.get(nodeId);
        if (values == null || !values.containsKey(key)) {
            return defaultValue;
        }
        return (T) values.get(key);
    }

    /// Returns a boolean flag, defaulting to false.
    ///
    /// @param nodeId node identifier, not null
    /// @param key metadata key, not null
    /// @return true only if the flag is set to true
    public boolean isFlagged(String nodeId, String key) {
        return Boolean.TRUE.equals(get(nodeId, key, Boolean.FALSE));
    }

    public boolean has(String nodeId, String key) {
        Map<String, Object> values = metadata.get(nodeId);
        return values != null && values.containsKey(key);
    }

    /// Returns all metadata of one node.
    ///
    /// @param nodeId node identifier, not null
    /// @return unmodifiable map, empty for unknown nodes
    public Map<String, Object> getAll(String nodeId) {
        Map<String, Object> values = metadata.get(nodeId);
        return values != null ? Collections.unmodifiableMap(values) : Map.of();
    }

    /// Returns the ids of nodes whose metadata has the given value for a key.
    ///
    /// @param key metadata key, not null
    /// @param value expected value, may be null
    /// @return node ids in first-write order, never null
    public List<String> findNodesWhere(String key, Object value) {
        List<String> result = new ArrayList<>();
        metadata.forEach(
                (nodeId, values) -> {
                    if (values.containsKey(key) && Objects.equals(values.get(key), value)) {
                        result.add(nodeId);
                    }
                });
        return result;
    }

    /// Returns the ids of all nodes that have any metadata.
    ///
    /// @return node ids in first-write order, never null
    public List<String> getNodeIds() {
        return new ArrayList<>(metadata.keySet());
    }

    /// Returns a live view that cannot write to this registry.
    ///
    /// @return read-only view, never null
    public ReadOnlyMetadataRegistry readOnlyView() {
        return new View(this);
    }

    /// Creates an independent copy; per-node maps are copied, values are shared.
    ///
    /// @return new registry, never null
    @Override
    public MetadataRegistry clone() {
        return new MetadataRegistry(this);
    }

    private static final class View implements ReadOnlyMetadataRegistry {

        private final MetadataRegistry registry;

        private View(MetadataRegistry registry) {
            this.registry = registry;
        }

        @Override
        public <T> T get(String nodeId, String key, T defaultValue) {
            return registry.get(nodeId, key, defaultValue);
        }

        @Override
        public boolean isFlagged(String nodeId, String key) {
            return registry.isFlagged(nodeId, key);
        }

        @Override
        public boolean has(String nodeId, String key) {
            return registry.has(nodeId, key);
        }

        @Override
        public Map<String, Object> getAll(String nodeId) {
            return registry.getAll(nodeId);
        }

        @Override
        public List<String> findNodesWhere(String key, Object value) {
            return registry.findNodesWhere(key, value);
        }

        @Override
        public List<String> getNodeIds() {
            return registry.getNodeIds();
        }

        @Override
        public MetadataRegistry clone() {
            return registry.clone();
        }
    }
}
