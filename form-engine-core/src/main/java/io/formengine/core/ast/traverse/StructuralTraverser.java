package io.formengine.core.ast.traverse;

import io.formengine.core.ast.node.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Depth-first walk over a node graph.
///
/// Children are found in node properties at any depth: directly, inside lists and inside
/// plain maps. Properties are walked in definition order and list elements by index.
///
/// ### Contracts
/// - **Postcondition**: `exitNode` runs for every entered node unless the walk was stopped
/// - **Postcondition**: {@link VisitResult#SKIP} prunes the subtree only
/// - **Postcondition**: {@link VisitResult#STOP} aborts the whole walk
/// - **Postcondition**: a property skipped by `enterProperty` is not walked at all
///
/// @implNote Stateless; each call keeps its own path and ancestor stack.
public final class StructuralTraverser {

    private StructuralTraverser() {}

    /// Walks the graph under `root`, root included.
    ///
    /// @param root start node, not null
    /// @param visitor callbacks, not null
    /// @return {@link VisitResult#STOP} if a callback stopped the walk, otherwise
    ///     {@link VisitResult#CONTINUE}
    public static VisitResult traverse(Node root, StructuralVisitor visitor) {
        Objects.requireNonNull(root, "Root node required");
        Objects.requireNonNull(visitor, "Visitor required");
        return visitNode(root, new ArrayList<>(), new ArrayList<>(), visitor);
    }

    private static VisitResult visitNode(
            Node node, List<Object> path, List<Node> ancestors, StructuralVisitor visitor) {
        TraversalContext context = new TraversalContext(List.copyOf(path), List.copyOf(ancestors));

        VisitResult enter = visitor.enterNode(node, context);
        if (enter == VisitResult.STOP) {
            return VisitResult.STOP;
        }

        if (enter == VisitResult.CONTINUE) {
            ancestors.add(node);
            try {
                for (Map.Entry<String, Object> property : node.getProperties().entrySet()) {
                    VisitResult filter = visitor.enterProperty(node, property.getKey(), context);
                    if (filter == VisitResult.STOP) {
                        return VisitResult.STOP;
                    }
                    if (filter == VisitResult.SKIP) {
                        continue;
                    }
                    path.add(property.getKey());
                    VisitResult result = visitValue(property.getValue(), path, ancestors, visitor);
                    path.remove(path.size() - 1);
                    if (result == VisitResult.STOP) {
                        return VisitResult.STOP;
                    }
                }
            } finally {
                ancestors.remove(ancestors.size() - 1);
            }
        }

        return visitor.exitNode(node, context) == VisitResult.STOP
                ? VisitResult.STOP
                : VisitResult.CONTINUE;
    }

    private static VisitResult visitValue(
            Object value, List<Object> path, List<Node> ancestors, StructuralVisitor visitor) {
        if (value instanceof Node child) {
            return visitNode(child, path, ancestors, visitor);
        }
        if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                path.add(i);
                VisitResult result = visitValue(list.get(i), path, ancestors, visitor);
                path.remove(path.size() - 1);
                if (result == VisitResult.STOP) {
                    return VisitResult.STOP;
                }
            }
        } else if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                path.add(String.valueOf(entry.getKey()));
                VisitResult result = visitValue(entry.getValue(), path, ancestors, visitor);
                path.remove(path.size() - 1);
                if (result == VisitResult.STOP) {
                    return VisitResult.STOP;
                }
            }
        }
        return VisitResult.CONTINUE;
    }
}
