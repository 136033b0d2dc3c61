package io.formengine.core.ast.traverse;

import io.formengine.core.ast.node.Node;
import java.util.List;

/// Position of the visited node within the walk.
///
/// @param path property keys (strings) and list indices (integers) from the root, never null
/// @param ancestors enclosing nodes from the root down to the direct parent, never null
public record TraversalContext(List<Object> path, List<Node> ancestors) {

    /// Returns the nearest enclosing node.
    ///
    /// @return parent node, or null for the root
    public Node parent() {
        return ancestors.isEmpty() ? null : ancestors.get(ancestors.size() - 1);
    }

    public int depth() {
        return ancestors.size();
    }

    /// Returns the parent property the node hangs under.
    ///
    /// Scans the path backwards and skips list indices, so a node at
    /// `blocks[2]` reports `blocks`.
    ///
    /// @return nearest string path segment, or null for the root
    public String parentProperty() {
        for (int i = path.size() - 1; i >= 0; i--) {
            if (path.get(i) instanceof String property) {
                return property;
            }
        }
        return null;
    }
}
