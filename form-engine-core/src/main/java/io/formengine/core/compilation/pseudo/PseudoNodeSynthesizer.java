package io.formengine.core.compilation.pseudo;

import io.formengine.core.ast.node.BlockNode;
import io.formengine.core.ast.node.BlockType;
import io.formengine.core.ast.node.ExpressionNode;
import io.formengine.core.ast.node.ExpressionType;
import io.formengine.core.ast.node.Node;
import io.formengine.core.ast.node.PseudoNode;
import io.formengine.core.ast.node.PseudoNodeType;
import io.formengine.core.ast.registry.MetadataKeys;
import io.formengine.core.ast.registry.MetadataRegistry;
import io.formengine.core.ast.registry.NodeRegistry;
import io.formengine.core.ast.traverse.StructuralTraverser;
import io.formengine.core.ast.traverse.StructuralVisitor;
import io.formengine.core.ast.traverse.TraversalContext;
import io.formengine.core.ast.traverse.VisitResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Creates pseudo-nodes for the runtime data sources a form depends on.
///
/// Sources are found in two places:
/// - **Field blocks** of the current step yield `POST` and `ANSWER_LOCAL` for their code
/// - **Reference expressions** `[source, key, ...]` yield a node per recognized source, see
///   {@link ReferenceSource}
///
/// ### Contracts
/// - **Invariant**: at most one pseudo-node per (type, key) in the target registry
/// - **Invariant**: no `ANSWER_REMOTE` is created for a key that has an `ANSWER_LOCAL`, and
///   one left over from before the local answer existed is unregistered
/// - **Postcondition**: new nodes are registered with an empty path
/// - **Postcondition**: repeating a pass creates nothing
///
/// Field codes that are expressions are only known at runtime and are skipped here; see
/// {@link io.formengine.core.compilation.runtime.RuntimeNodeOverlay}.
///
/// @implNote Dedup is checked against the registry itself, so nodes created earlier in the
/// same pass, or by an earlier pass, are never duplicated.
public final class PseudoNodeSynthesizer {

    private static final Logger logger = Logger.getLogger(PseudoNodeSynthesizer.class.getName());

    private final NodeRegistry nodeRegistry;
    private final MetadataRegistry metadataRegistry;
    private final PseudoNodeFactory factory;
    private final boolean warnOnUnknownSource;

    public PseudoNodeSynthesizer(
            NodeRegistry nodeRegistry,
            MetadataRegistry metadataRegistry,
            PseudoNodeFactory factory) {
        this(nodeRegistry, metadataRegistry, factory, false);
    }

    /// Creates a synthesizer writing into `nodeRegistry`.
    ///
    /// @param nodeRegistry target registry, not null
    /// @param metadataRegistry source of step-scope flags, not null
    /// @param factory pseudo-node factory, not null
    /// @param warnOnUnknownSource log references with unrecognized source tags at WARNING
    public PseudoNodeSynthesizer(
            NodeRegistry nodeRegistry,
            MetadataRegistry metadataRegistry,
            PseudoNodeFactory factory,
            boolean warnOnUnknownSource) {
        this.nodeRegistry = Objects.requireNonNull(nodeRegistry, "Node registry required");
        this.metadataRegistry =
                Objects.requireNonNull(metadataRegistry, "Metadata registry required");
        this.factory = Objects.requireNonNull(factory, "Pseudo node factory required");
        this.warnOnUnknownSource = warnOnUnknownSource;
    }

    /// Runs a synthesis pass over every registered node.
    ///
    /// Field blocks are processed before references, so a field on the step always wins
    /// over a remote answer reference to the same code.
    ///
    /// @param scope which sources to synthesize, not null
    /// @return pseudo-nodes created by this pass, in creation order, never null
    public List<PseudoNode> synthesize(SynthesisScope scope) {
        List<PseudoNode> created = new ArrayList<>();
        if (scope == SynthesisScope.STEP) {
            for (Node field : List.copyOf(nodeRegistry.findByType(BlockType.FIELD))) {
                processField((BlockNode) field, created);
            }
        }
        for (Node reference : List.copyOf(nodeRegistry.findByType(ExpressionType.REFERENCE))) {
            processReference((ExpressionNode) reference, scope, created);
        }
        logger.fine(() -> scope + " synthesis created " + created.size() + " pseudo nodes");
        return created;
    }

    /// Runs a step-scope pass over one subtree only.
    ///
    /// Used for subtrees attached after compilation.
    ///
    /// @param subtreeRoot root of the subtree, not null
    /// @return pseudo-nodes created, never null
    public List<PseudoNode> synthesizeWithin(Node subtreeRoot) {
        List<Node> fields = new ArrayList<>();
        List<Node> references = new ArrayList<>();
        StructuralTraverser.traverse(
                subtreeRoot,
                new StructuralVisitor() {
                    @Override
                    public VisitResult enterNode(Node node, TraversalContext context) {
                        if (node.getKind() == BlockType.FIELD) {
                            fields.add(node);
                        } else if (node.getKind() == ExpressionType.REFERENCE) {
                            references.add(node);
                        }
                        return VisitResult.CONTINUE;
                    }
                });

        List<PseudoNode> created = new ArrayList<>();
        fields.forEach(field -> processField((BlockNode) field, created));
        references.forEach(
                reference ->
                        processReference((ExpressionNode) reference, SynthesisScope.STEP, created));
        return created;
    }

    /// Looks up the pseudo-node for a (type, key) pair.
    ///
    /// Answer lookups prefer the `ANSWER_LOCAL` of the key: an `ANSWER_REMOTE` lookup is
    /// answered with it whenever one exists.
    ///
    /// @param type pseudo-node type, not null
    /// @param key lookup key, not null
    /// @return matching pseudo-node, or empty if none exists
    public Optional<PseudoNode> find(PseudoNodeType type, String key) {
        if (type == PseudoNodeType.ANSWER_REMOTE) {
            PseudoNode local = nodeRegistry.findPseudoNode(PseudoNodeType.ANSWER_LOCAL, key);
            if (local != null) {
                return Optional.of(local);
            }
        }
        return Optional.ofNullable(nodeRegistry.findPseudoNode(type, key));
    }

    /// Returns the pseudo-node for a (type, key) pair, creating it if needed.
    ///
    /// @param type pseudo-node type, not null
    /// @param key lookup key, not null
    /// @return existing or new pseudo-node, never null
    public PseudoNode ensure(PseudoNodeType type, String key) {
        Optional<PseudoNode> existing = find(type, key);
        if (existing.isPresent()) {
            return existing.get();
        }
        return create(type, key, null, new ArrayList<>());
    }

    /// Creates the `POST` and `ANSWER_LOCAL` nodes of a field whose code is known.
    ///
    /// Used once an expression-valued field code has been evaluated.
    ///
    /// @param code evaluated field code, not null
    /// @param fieldNodeId id of the field block, not null
    /// @return pseudo-nodes created, empty if both already exist, never null
    public List<PseudoNode> ensureFieldSources(String code, String fieldNodeId) {
        List<PseudoNode> created = new ArrayList<>();
        addFieldSources(code, fieldNodeId, created);
        return created;
    }

    private void processField(BlockNode field, List<PseudoNode> created) {
        if (!metadataRegistry.isFlagged(field.getId(), MetadataKeys.IS_DESCENDANT_OF_STEP)) {
            return;
        }
        if (!field.hasLiteralCode()) {
            logger.finer(() -> "Deferring expression-valued field code of " + field.getId());
            return;
        }
        addFieldSources((String) field.getProperty("code"), field.getId(), created);
    }

    private void addFieldSources(String code, String fieldNodeId, List<PseudoNode> created) {
        if (nodeRegistry.findPseudoNode(PseudoNodeType.POST, code) == null) {
            create(PseudoNodeType.POST, code, null, created);
        }
        if (nodeRegistry.findPseudoNode(PseudoNodeType.ANSWER_LOCAL, code) == null) {
            create(PseudoNodeType.ANSWER_LOCAL, code, fieldNodeId, created);
        }
    }

    private void processReference(
            ExpressionNode reference, SynthesisScope scope, List<PseudoNode> created) {
        if (!(reference.getProperty("path") instanceof List<?> path)
                || path.size() < 2
                || !(path.get(1) instanceof String key)) {
            return;
        }

        Optional<ReferenceSource> source = ReferenceSource.fromTag(path.get(0));
        if (source.isEmpty()) {
            Level level = warnOnUnknownSource ? Level.WARNING : Level.FINEST;
            if (logger.isLoggable(level)) {
                logger.log(
                        level,
                        "Skipping reference " + reference.getId() + " with source " + path.get(0));
            }
            return;
        }
        if (source.get() == ReferenceSource.ANSWERS && scope != SynthesisScope.STEP) {
            return;
        }

        PseudoNodeType type = source.get().pseudoNodeType();
        String lookupKey = source.get().lookupKey(key);
        if (find(type, lookupKey).isEmpty()) {
            create(type, lookupKey, null, created);
        }
    }

    private PseudoNode create(
            PseudoNodeType type, String key, String fieldNodeId, List<PseudoNode> created) {
        PseudoNode node;
        switch (type) {
            case POST:
                node = factory.createPost(key);
                break;
            case ANSWER_LOCAL:
                node = factory.createAnswerLocal(key, fieldNodeId);
                break;
            case ANSWER_REMOTE:
                node = factory.createAnswerRemote(key);
                break;
            case QUERY:
                node = factory.createQuery(key);
                break;
            case PARAMS:
                node = factory.createParams(key);
                break;
            case DATA:
                node = factory.createData(key);
                break;
            default:
                throw new IllegalArgumentException("Unsupported pseudo node type: " + type);
        }
        if (type == PseudoNodeType.ANSWER_LOCAL) {
            retireRemoteAnswer(key, created);
        }
        nodeRegistry.register(node.getId(), node, List.of());
        created.add(node);
        logger.fine(() -> "Created " + node);
        return node;
    }

    private void retireRemoteAnswer(String key, List<PseudoNode> created) {
        PseudoNode remote = nodeRegistry.findPseudoNode(PseudoNodeType.ANSWER_REMOTE, key);
        if (remote != null) {
            nodeRegistry.unregister(remote.getId());
            created.removeIf(node -> node == remote);
            logger.fine(() -> "Retired " + remote + " in favour of the local answer");
        }
    }
}
