package io.formengine.core.ast.node;

/// Discriminant of a node, either a top-level category or a category-specific sub-kind.
///
/// Implemented by {@link NodeType} and the per-category sub-kind enums. The
/// {@link #discriminant()} string is the value the evaluation engine dispatches on and
/// must not change.
///
/// @see io.formengine.core.ast.registry.NodeRegistry#findByType(NodeKind)
public interface NodeKind {

    /// Returns the top-level category this kind belongs to.
    ///
    /// @return node category, never null
    NodeType nodeType();

    /// Returns the stable discriminant string.
    ///
    /// @return discriminant, never null
    String discriminant();
}
