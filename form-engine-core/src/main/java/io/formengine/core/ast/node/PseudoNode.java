package io.formengine.core.ast.node;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A synthesized node standing for a runtime data source.
///
/// Pseudo-nodes have no counterpart in the raw definition. Each is keyed by
/// (type, lookup key); the key is stored under {@link PseudoNodeType#keyProperty()}.
///
/// @see io.formengine.core.compilation.pseudo.PseudoNodeFactory for creation
public final class PseudoNode extends Node {

    private final PseudoNodeType pseudoNodeType;

    private PseudoNode(String id, PseudoNodeType pseudoNodeType, Map<String, Object> properties) {
        super(id, properties, null);
        this.pseudoNodeType = pseudoNodeType;
    }

    /// Creates a pseudo-node with its lookup key and optional extra properties.
    ///
    /// @param id node identifier, not null
    /// @param type pseudo-node type, not null
    /// @param key lookup key, not null
    /// @param extra additional properties, e.g. `fieldNodeId`, not null (may be empty)
    /// @return new pseudo-node, never null
    public static PseudoNode of(
            String id, PseudoNodeType type, String key, Map<String, Object> extra) {
        Objects.requireNonNull(type, "Pseudo node type required");
        Objects.requireNonNull(key, "Lookup key required");
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(type.keyProperty(), key);
        properties.putAll(extra);
        return new PseudoNode(id, type, properties);
    }

    @Override
    public PseudoNode rebuild(String id, Map<String, Object> properties) {
        return new PseudoNode(id, pseudoNodeType, properties);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.PSEUDO;
    }

    @Override
    public NodeKind getKind() {
        return pseudoNodeType;
    }

    public PseudoNodeType getPseudoNodeType() {
        return pseudoNodeType;
    }

    /// Returns the lookup key for this pseudo-node.
    ///
    /// @return field code, parameter name or base property, never null
    public String getLookupKey() {
        return (String) getProperty(pseudoNodeType.keyProperty());
    }

    /// Returns the id of the field block an answer-local node was created from.
    ///
    /// @return field node id, or null when not created from a field block
    public String getFieldNodeId() {
        return getProperty("fieldNodeId") instanceof String fieldNodeId ? fieldNodeId : null;
    }

    @Override
    public String toString() {
        return "PseudoNode{id='"
                + id
                + "', type="
                + pseudoNodeType
                + ", key='"
                + getLookupKey()
                + "'}";
    }
}
