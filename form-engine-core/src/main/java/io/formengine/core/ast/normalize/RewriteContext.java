package io.formengine.core.ast.normalize;

import io.formengine.core.ast.node.Node;
import java.util.List;

/// Position of a node being rewritten.
///
/// @param path property keys (strings) and list indices (integers) from the root, never null
/// @param ancestors enclosing nodes from the root down to the direct parent, as they were
///     before the pass, never null
/// @param ancestorProperties for each ancestor, the property the walk descended through;
///     same size as `ancestors`, never null
public record RewriteContext(
        List<Object> path, List<Node> ancestors, List<String> ancestorProperties) {

    /// Returns the property of `ancestor` that holds the current node.
    ///
    /// @param ancestor one of {@link #ancestors()}, compared by identity
    /// @return property name, or null if `ancestor` is not on the chain
    public String propertyUnder(Node ancestor) {
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            if (ancestors.get(i) == ancestor) {
                return ancestorProperties.get(i);
            }
        }
        return null;
    }
}
