package io.formengine.core.ast.registry;

import java.util.List;
import java.util.Map;

/// Query side of a {@link MetadataRegistry}.
///
/// @see MetadataRegistry#readOnlyView()
public interface ReadOnlyMetadataRegistry {

    <T> T get(String nodeId, String key, T defaultValue);

    boolean isFlagged(String nodeId, String key);

    boolean has(String nodeId, String key);

    Map<String, Object> getAll(String nodeId);

    List<String> findNodesWhere(String key, Object value);

    List<String> getNodeIds();

    /// Creates a writable copy of the registry's content.
    ///
    /// @return new registry, independent of this one, never null
    MetadataRegistry clone();
}
