package io.formengine.core.compilation.metadata;

import io.formengine.core.ast.node.Node;
import io.formengine.core.ast.registry.MetadataKeys;
import io.formengine.core.ast.registry.MetadataRegistry;
import io.formengine.core.ast.registry.NodeRegistry;
import io.formengine.core.ast.traverse.StructuralTraverser;
import io.formengine.core.ast.traverse.StructuralVisitor;
import io.formengine.core.ast.traverse.TraversalContext;
import io.formengine.core.ast.traverse.VisitResult;
import java.util.Objects;
import java.util.logging.Logger;

/// Derives structural metadata for nodes of a compiled graph.
///
/// Two kinds of facts are written into a {@link MetadataRegistry}:
/// - **Parent linkage** ({@link MetadataKeys#ATTACHED_TO_PARENT_NODE},
///   {@link MetadataKeys#ATTACHED_TO_PARENT_PROPERTY}), set once for the whole graph
/// - **Step scope** ({@link MetadataKeys#IS_CURRENT_STEP},
///   {@link MetadataKeys#IS_ANCESTOR_OF_STEP}, {@link MetadataKeys#IS_DESCENDANT_OF_STEP}),
///   set per compiled step on a forked registry
///
/// @implNote Step scope follows parent links upward and walks the step subtree downward, so
/// its cost is the ancestor chain plus the subtree, never the whole graph.
public final class MetadataTraverser {

    private static final Logger logger = Logger.getLogger(MetadataTraverser.class.getName());

    private final NodeRegistry nodeRegistry;
    private final MetadataRegistry metadataRegistry;

    public MetadataTraverser(NodeRegistry nodeRegistry, MetadataRegistry metadataRegistry) {
        this.nodeRegistry = Objects.requireNonNull(nodeRegistry, "Node registry required");
        this.metadataRegistry =
                Objects.requireNonNull(metadataRegistry, "Metadata registry required");
    }

    /// Records the parent node and parent property of every non-root node.
    ///
    /// @param root graph root, not null
    public void setParentMetadata(Node root) {
        StructuralTraverser.traverse(root, new ParentLinkVisitor(root, null, null));
    }

    /// Marks a step, its ancestors and its descendants.
    ///
    /// @apiNote **Side effects**:
    /// - The step gets all three scope flags
    /// - Every node on the parent chain gets {@link MetadataKeys#IS_ANCESTOR_OF_STEP}
    /// - Every node under the step gets {@link MetadataKeys#IS_DESCENDANT_OF_STEP}
    ///
    /// @param root graph root, not null
    /// @param step step to mark, not null
    /// @throws IllegalStateException if parent metadata was not set for a non-root step, or
    ///     a parent link points outside the node registry
    public void setStepScopeMetadata(Node root, Node step) {
        String stepId = step.getId();
        if (step != root && !metadataRegistry.has(stepId, MetadataKeys.ATTACHED_TO_PARENT_NODE)) {
            throw new IllegalStateException(
                    "Parent metadata not set for step " + stepId + "; run setParentMetadata first");
        }

        metadataRegistry.set(stepId, MetadataKeys.IS_CURRENT_STEP, true);
        metadataRegistry.set(stepId, MetadataKeys.IS_ANCESTOR_OF_STEP, true);
        metadataRegistry.set(stepId, MetadataKeys.IS_DESCENDANT_OF_STEP, true);

        int ancestors = 0;
        String parentId =
                metadataRegistry.get(stepId, MetadataKeys.ATTACHED_TO_PARENT_NODE, (String) null);
        while (parentId != null) {
            if (!nodeRegistry.has(parentId)) {
                throw new IllegalStateException(
                        "Parent " + parentId + " of step " + stepId + " is not registered");
            }
            metadataRegistry.set(parentId, MetadataKeys.IS_ANCESTOR_OF_STEP, true);
            ancestors++;
            parentId =
                    metadataRegistry.get(
                            parentId, MetadataKeys.ATTACHED_TO_PARENT_NODE, (String) null);
        }

        int ancestorCount = ancestors;
        int[] descendants = {0};
        StructuralTraverser.traverse(
                step,
                new StructuralVisitor() {
                    @Override
                    public VisitResult enterNode(Node node, TraversalContext context) {
                        if (node != step) {
                            metadataRegistry.set(
                                    node.getId(), MetadataKeys.IS_DESCENDANT_OF_STEP, true);
                            descendants[0]++;
                        }
                        return VisitResult.CONTINUE;
                    }
                });

        logger.fine(
                () ->
                        "Step scope for "
                                + stepId
                                + ": "
                                + ancestorCount
                                + " ancestors, "
                                + descendants[0]
                                + " descendants");
    }

    /// Links a subtree created after compilation into the existing graph.
    ///
    /// The subtree root is attached to `parentId` under `property`, and every node below it
    /// is linked to its own parent. If the parent lies in the current step, the subtree is
    /// marked as descending from the step too.
    ///
    /// @param subtreeRoot root of the new subtree, not null
    /// @param parentId id of the node the subtree hangs under, may be null for a detached tree
    /// @param property parent property holding the subtree, may be null
    public void setSubtreeMetadata(Node subtreeRoot, String parentId, String property) {
        boolean inStep =
                parentId != null
                        && metadataRegistry.isFlagged(parentId, MetadataKeys.IS_DESCENDANT_OF_STEP);
        StructuralTraverser.traverse(
                subtreeRoot,
                new ParentLinkVisitor(subtreeRoot, parentId, property) {
                    @Override
                    public VisitResult enterNode(Node node, TraversalContext context) {
                        if (inStep) {
                            metadataRegistry.set(
                                    node.getId(), MetadataKeys.IS_DESCENDANT_OF_STEP, true);
                        }
                        return super.enterNode(node, context);
                    }
                });
    }

    private class ParentLinkVisitor implements StructuralVisitor {

        private final Node root;
        private final String rootParentId;
        private final String rootProperty;

        ParentLinkVisitor(Node root, String rootParentId, String rootProperty) {
            this.root = root;
            this.rootParentId = rootParentId;
            this.rootProperty = rootProperty;
        }

        @Override
        public VisitResult enterNode(Node node, TraversalContext context) {
            if (node == root) {
                if (rootParentId != null) {
                    link(node, rootParentId, rootProperty);
                }
            } else {
                link(node, context.parent().getId(), context.parentProperty());
            }
            return VisitResult.CONTINUE;
        }

        private void link(Node node, String parentId, String property) {
            metadataRegistry.set(node.getId(), MetadataKeys.ATTACHED_TO_PARENT_NODE, parentId);
            metadataRegistry.set(node.getId(), MetadataKeys.ATTACHED_TO_PARENT_PROPERTY, property);
        }
    }
}
