package io.formengine.core.ast.normalize;

import io.formengine.core.ast.id.NodeIdCategory;
import io.formengine.core.ast.id.NodeIdGenerator;
import io.formengine.core.ast.node.Node;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Deep-copies values that embed nodes, giving every copied node a fresh id.
///
/// Used when a pass places an existing subtree at a second location; the copy can then be
/// registered alongside the original.
public final class NodeCloner {

    private final NodeIdGenerator idGenerator;
    private final NodeIdCategory idCategory;

    public NodeCloner(NodeIdGenerator idGenerator, NodeIdCategory idCategory) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "ID generator required");
        this.idCategory = Objects.requireNonNull(idCategory, "ID category required");
    }

    /// Copies a value.
    ///
    /// @param value node, list, map or primitive, may be null
    /// @return the copy; primitives and null are returned as is
    public Object cloneValue(Object value) {
        if (value instanceof Node node) {
            Map<String, Object> properties = new LinkedHashMap<>();
            node.getProperties().forEach((key, item) -> properties.put(key, cloneValue(item)));
            return node.rebuild(idGenerator.next(idCategory), properties);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(cloneValue(item)));
            return copy;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, item) -> copy.put(String.valueOf(key), cloneValue(item)));
            return copy;
        }
        return value;
    }

    /// Mints an id for a node a pass creates from scratch.
    ///
    /// @return new id of this cloner's category, never null
    public String nextId() {
        return idGenerator.next(idCategory);
    }
}
