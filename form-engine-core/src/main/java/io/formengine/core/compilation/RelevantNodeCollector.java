package io.formengine.core.compilation;

import io.formengine.core.ast.node.BlockNode;
import io.formengine.core.ast.node.ExpressionType;
import io.formengine.core.ast.node.Node;
import io.formengine.core.ast.node.NodeType;
import io.formengine.core.ast.node.PseudoNode;
import io.formengine.core.ast.node.TransitionType;
import io.formengine.core.ast.registry.MetadataKeys;
import io.formengine.core.ast.registry.ReadOnlyMetadataRegistry;
import io.formengine.core.ast.registry.ReadOnlyNodeRegistry;
import io.formengine.core.ast.traverse.StructuralTraverser;
import io.formengine.core.ast.traverse.StructuralVisitor;
import io.formengine.core.ast.traverse.TraversalContext;
import io.formengine.core.ast.traverse.VisitResult;
import io.formengine.core.compilation.pseudo.ReferenceSource;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/// Selects the nodes a compiled step needs at runtime.
///
/// For the step artefact, see {@link #collect}, a node is relevant when it is:
/// - a journey on the step's ancestor chain
/// - the step itself or anything below it
/// - inside a load transition owned by an ancestor journey
/// - a pseudo-node referenced from any of the above, or backing a field of the step
///
/// Sibling steps and their subtrees are left out.
///
/// The journey metadata artefact, see {@link #collectJourneyMetadata}, spans every journey
/// and step instead, but only through the properties that describe navigation.
final class RelevantNodeCollector {

    private static final Set<String> JOURNEY_PROPERTIES =
            Set.of("path", "title", "description", "journeys", "children", "steps", "onLoad");
    private static final Set<String> STEP_PROPERTIES =
            Set.of("path", "title", "description", "entry", "onSubmission", "blocks", "onLoad");
    private static final Set<String> BLOCK_PROPERTIES =
            Set.of("code", "validate", "dependent", "formatPipeline", "defaultValue");

    private RelevantNodeCollector() {}

    static List<Node> collect(
            Node root,
            ReadOnlyNodeRegistry nodeRegistry,
            ReadOnlyMetadataRegistry metadataRegistry) {
        NodeCollection collection = new NodeCollection();

        StructuralTraverser.traverse(
                root,
                new StructuralVisitor() {
                    @Override
                    public VisitResult enterNode(Node node, TraversalContext context) {
                        if (node.getKind() == TransitionType.LOAD) {
                            Node owner = owningStructure(context);
                            if (owner != null && isAncestorOfStep(owner, metadataRegistry)) {
                                collection.addSubtree(node);
                            }
                            return VisitResult.SKIP;
                        }
                        if (node.getNodeType() == NodeType.STEP
                                && isAncestorOfStep(node, metadataRegistry)) {
                            collection.addSubtree(node);
                            return VisitResult.SKIP;
                        }
                        if (node.getNodeType() == NodeType.JOURNEY
                                && isAncestorOfStep(node, metadataRegistry)) {
                            collection.add(node);
                        }
                        return VisitResult.CONTINUE;
                    }
                });

        return collection.withPseudoNodes(nodeRegistry);
    }

    static List<Node> collectJourneyMetadata(
            Node root,
            ReadOnlyNodeRegistry nodeRegistry,
            ReadOnlyMetadataRegistry metadataRegistry) {
        NodeCollection collection = new NodeCollection();

        StructuralTraverser.traverse(
                root,
                new StructuralVisitor() {
                    @Override
                    public VisitResult enterNode(Node node, TraversalContext context) {
                        if (node.getKind() == TransitionType.LOAD) {
                            Node owner = owningStructure(context);
                            if (owner != null && isAncestorOfStep(owner, metadataRegistry)) {
                                collection.addSubtree(node);
                            }
                            return VisitResult.SKIP;
                        }
                        if (node.getKind() == TransitionType.SUBMIT) {
                            if (owningStep(context) != null) {
                                collection.addSubtree(node);
                            }
                            return VisitResult.SKIP;
                        }
                        collection.add(node);
                        return VisitResult.CONTINUE;
                    }

                    @Override
                    public VisitResult enterProperty(
                            Node owner, String property, TraversalContext context) {
                        Set<String> allowed;
                        switch (owner.getNodeType()) {
                            case JOURNEY:
                                allowed = JOURNEY_PROPERTIES;
                                break;
                            case STEP:
                                allowed = STEP_PROPERTIES;
                                break;
                            case BLOCK:
                                allowed = BLOCK_PROPERTIES;
                                break;
                            default:
                                return VisitResult.CONTINUE;
                        }
                        return allowed.contains(property) ? VisitResult.CONTINUE : VisitResult.SKIP;
                    }
                });

        return collection.withPseudoNodes(nodeRegistry);
    }

    private static boolean isAncestorOfStep(Node node, ReadOnlyMetadataRegistry metadata) {
        return metadata.isFlagged(node.getId(), MetadataKeys.IS_ANCESTOR_OF_STEP);
    }

    private static Node owningStep(TraversalContext context) {
        List<Node> ancestors = context.ancestors();
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            if (ancestors.get(i).getNodeType() == NodeType.STEP) {
                return ancestors.get(i);
            }
        }
        return null;
    }

    private static Node owningStructure(TraversalContext context) {
        List<Node> ancestors = context.ancestors();
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            NodeType type = ancestors.get(i).getNodeType();
            if (type == NodeType.JOURNEY || type == NodeType.STEP) {
                return ancestors.get(i);
            }
        }
        return null;
    }

    private static List<PseudoNode> referencedPseudoNodes(
            List<Node> nodes, ReadOnlyNodeRegistry nodeRegistry) {
        Set<String> baseKeys = new HashSet<>();
        Set<String> queryKeys = new HashSet<>();
        Set<String> paramKeys = new HashSet<>();

        for (Node node : nodes) {
            if (node instanceof BlockNode block && block.hasLiteralCode()) {
                baseKeys.add((String) block.getProperty("code"));
            }
            if (node.getKind() != ExpressionType.REFERENCE
                    || !(node.getProperty("path") instanceof List<?> path)
                    || path.size() < 2
                    || !(path.get(1) instanceof String key)) {
                continue;
            }
            ReferenceSource.fromTag(path.get(0))
                    .ifPresent(
                            source -> {
                                String lookupKey = source.lookupKey(key);
                                switch (source) {
                                    case QUERY:
                                        queryKeys.add(lookupKey);
                                        break;
                                    case PARAMS:
                                        paramKeys.add(lookupKey);
                                        break;
                                    default:
                                        baseKeys.add(lookupKey);
                                }
                            });
        }

        List<PseudoNode> result = new ArrayList<>();
        for (Node node : nodeRegistry.findByType(NodeType.PSEUDO)) {
            PseudoNode pseudo = (PseudoNode) node;
            String key = pseudo.getLookupKey();
            boolean relevant;
            switch (pseudo.getPseudoNodeType()) {
                case QUERY:
                    relevant = queryKeys.contains(key);
                    break;
                case PARAMS:
                    relevant = paramKeys.contains(key);
                    break;
                default:
                    relevant = baseKeys.contains(key);
            }
            if (relevant) {
                result.add(pseudo);
            }
        }
        return result;
    }

    /// Nodes in first-seen order, without duplicates.
    private static final class NodeCollection {

        private final List<Node> nodes = new ArrayList<>();
        private final Set<String> seen = new HashSet<>();

        void add(Node node) {
            if (seen.add(node.getId())) {
                nodes.add(node);
            }
        }

        void addSubtree(Node subtreeRoot) {
            StructuralTraverser.traverse(
                    subtreeRoot,
                    new StructuralVisitor() {
                        @Override
                        public VisitResult enterNode(Node child, TraversalContext context) {
                            add(child);
                            return VisitResult.CONTINUE;
                        }
                    });
        }

        List<Node> withPseudoNodes(ReadOnlyNodeRegistry nodeRegistry) {
            List<Node> result = new ArrayList<>(nodes);
            result.addAll(referencedPseudoNodes(nodes, nodeRegistry));
            return result;
        }
    }
}
