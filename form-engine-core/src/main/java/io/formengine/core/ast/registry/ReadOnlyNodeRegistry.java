package io.formengine.core.ast.registry;

import io.formengine.core.ast.node.Node;
import io.formengine.core.ast.node.NodeKind;
import io.formengine.core.ast.node.PseudoNode;
import io.formengine.core.ast.node.PseudoNodeType;
import java.util.List;
import java.util.Map;

/// Query side of a {@link NodeRegistry}.
///
/// Published compilation artefacts hand out this type, so cached registries cannot be
/// written to. {@link #clone()} yields a private, writable fork.
///
/// @see NodeRegistry#readOnlyView()
public interface ReadOnlyNodeRegistry {

    Node get(String id);

    RegistryEntry getEntry(String id);

    boolean has(String id);

    int size();

    List<String> getIds();

    Map<String, Node> getAll();

    List<Node> findByType(NodeKind kind);

    <T extends Node> List<T> findByType(NodeKind kind, Class<T> nodeClass);

    PseudoNode findPseudoNode(PseudoNodeType type, String key);

    /// Creates a writable copy of the registry's content.
    ///
    /// @return new registry, independent of this one, never null
    NodeRegistry clone();
}
