package io.formengine.core.ast.traverse;

/// Controls how a {@link StructuralTraverser} proceeds after a visitor callback.
public enum VisitResult {
    /// Descend into the node's children.
    CONTINUE,
    /// Skip the node's children; its exit callback still runs.
    SKIP,
    /// Abort the whole walk.
    STOP
}
