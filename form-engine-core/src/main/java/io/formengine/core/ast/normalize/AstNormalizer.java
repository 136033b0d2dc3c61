package io.formengine.core.ast.normalize;

import io.formengine.core.ast.node.Node;

/// A rewrite pass over a transformed graph, run before the graph is registered.
///
/// Nodes are immutable, so a pass returns a new root whenever anything below it changed.
/// Nodes that are rewritten keep their ids; nodes a pass adds get fresh ones.
@FunctionalInterface
public interface AstNormalizer {

    /// Normalizes the graph under `root`.
    ///
    /// @param root graph root, not null
    /// @return normalized root, the same instance if nothing changed, never null
    /// @throws io.formengine.core.exception.AstTransformationException if the graph holds a
    ///     construct the pass cannot resolve
    Node normalize(Node root);
}
