package io.formengine.core.ast.traverse;

import io.formengine.core.ast.node.Node;
import io.formengine.core.ast.registry.NodeRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/// Registers every node of a graph, with its structural path, into a {@link NodeRegistry}.
public final class RegistrationTraverser {

    private static final Logger logger = Logger.getLogger(RegistrationTraverser.class.getName());

    private RegistrationTraverser() {}

    /// Registers `root` and all its descendants.
    ///
    /// @param root graph root, not null
    /// @param registry target registry, not null
    /// @return number of nodes registered
    /// @throws io.formengine.core.exception.DuplicateNodeIdException if a node id is taken
    public static int register(Node root, NodeRegistry registry) {
        return register(root, List.of(), registry);
    }

    /// Registers a subtree whose root sits at `basePath` within a larger graph.
    ///
    /// @param root subtree root, not null
    /// @param basePath path of `root` from the graph root, not null
    /// @param registry target registry, not null
    /// @return number of nodes registered
    public static int register(Node root, List<Object> basePath, NodeRegistry registry) {
        int[] count = {0};
        StructuralTraverser.traverse(
                root,
                new StructuralVisitor() {
                    @Override
                    public VisitResult enterNode(Node node, TraversalContext context) {
                        List<Object> path = new ArrayList<>(basePath);
                        path.addAll(context.path());
                        registry.register(node.getId(), node, path);
                        count[0]++;
                        return VisitResult.CONTINUE;
                    }
                });
        logger.fine("Registered " + count[0] + " nodes under " + root.getId());
        return count[0];
    }
}
