package io.formengine.core.compilation.runtime;

import io.formengine.core.ast.id.NodeIdCategory;
import io.formengine.core.ast.id.NodeIdGenerator;
import io.formengine.core.ast.node.Node;
import io.formengine.core.ast.node.PseudoNode;
import io.formengine.core.ast.node.PseudoNodeType;
import io.formengine.core.ast.normalize.NormalizationPipeline;
import io.formengine.core.ast.registry.MetadataRegistry;
import io.formengine.core.ast.registry.NodeRegistry;
import io.formengine.core.ast.registry.RegistryEntry;
import io.formengine.core.ast.transform.AstTransformer;
import io.formengine.core.ast.traverse.RegistrationTraverser;
import io.formengine.core.compilation.CompiledStep;
import io.formengine.core.compilation.metadata.MetadataTraverser;
import io.formengine.core.compilation.pseudo.PseudoNodeFactory;
import io.formengine.core.compilation.pseudo.PseudoNodeSynthesizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Per-request layer over a {@link CompiledStep} for nodes that only exist at runtime.
///
/// Two things are known only while serving a request:
/// - **Evaluated field codes**: a field whose `code` is an expression gets its `POST` and
///   `ANSWER_LOCAL` pseudo-nodes once the code has been evaluated
/// - **Generated subtrees**: definitions produced at runtime, e.g. by a generator function,
///   are transformed, registered and linked under an existing node
///
/// All additions go into registry forks owned by the overlay, with `RUNTIME_AST` and
/// `RUNTIME_PSEUDO` ids. The cached compiled step is never touched, so overlays of
/// concurrent requests are independent.
///
/// @implNote **Not thread-safe**. One overlay serves one request.
public final class RuntimeNodeOverlay {

    private static final Logger logger = Logger.getLogger(RuntimeNodeOverlay.class.getName());

    private final CompiledStep step;
    private final NodeRegistry nodeRegistry;
    private final MetadataRegistry metadataRegistry;
    private final AstTransformer transformer;
    private final NormalizationPipeline normalizer;
    private final PseudoNodeSynthesizer synthesizer;
    private final boolean createAllowed;
    private final List<PseudoNode> createdNodes = new ArrayList<>();

    /// Opens an overlay; prefer {@link CompiledStep#openOverlay()}.
    ///
    /// @param step compiled step to layer over, not null
    /// @param idGenerator id source shared with the form instance, not null
    /// @param createAllowed whether pseudo-nodes may be created, or only looked up
    public RuntimeNodeOverlay(
            CompiledStep step, NodeIdGenerator idGenerator, boolean createAllowed) {
        this.step = Objects.requireNonNull(step, "Compiled step required");
        this.nodeRegistry = step.getNodeRegistry().clone();
        this.metadataRegistry = step.metadata().clone();
        this.transformer = new AstTransformer(idGenerator, NodeIdCategory.RUNTIME_AST);
        this.normalizer = NormalizationPipeline.standard(idGenerator, NodeIdCategory.RUNTIME_AST);
        this.synthesizer =
                new PseudoNodeSynthesizer(
                        nodeRegistry,
                        metadataRegistry,
                        new PseudoNodeFactory(idGenerator, NodeIdCategory.RUNTIME_PSEUDO));
        this.createAllowed = createAllowed;
    }

    /// Returns the pseudo-node for a (type, key) pair, creating it in this overlay if needed.
    ///
    /// An `ANSWER_REMOTE` request resolves to the step's `ANSWER_LOCAL` for the same key.
    ///
    /// @param type pseudo-node type, not null
    /// @param key lookup key, not null
    /// @return existing or new pseudo-node; empty only if creation is disabled and none exists
    public Optional<PseudoNode> ensurePseudoNode(PseudoNodeType type, String key) {
        Optional<PseudoNode> existing = synthesizer.find(type, key);
        if (existing.isPresent() || !createAllowed) {
            return existing;
        }
        PseudoNode created = synthesizer.ensure(type, key);
        createdNodes.add(created);
        logger.fine(() -> "Created runtime " + created + " for step " + step.getStepId());
        return Optional.of(created);
    }

    /// Records the evaluated code of a field whose code is an expression.
    ///
    /// @apiNote **Side effects**:
    /// - Creates `POST` and `ANSWER_LOCAL` pseudo-nodes for the code, if missing
    /// - Unregisters an `ANSWER_REMOTE` for the same code, which the local answer supersedes
    ///
    /// @param fieldNodeId id of the field block, not null
    /// @param evaluatedCode the code the expression evaluated to, not null
    /// @return pseudo-nodes created, empty if creation is disabled or both exist
    /// @throws IllegalArgumentException if the field block is not registered
    public List<PseudoNode> resolveFieldCode(String fieldNodeId, String evaluatedCode) {
        Objects.requireNonNull(evaluatedCode, "Evaluated code required");
        if (!nodeRegistry.has(fieldNodeId)) {
            throw new IllegalArgumentException("Unknown field node: " + fieldNodeId);
        }
        if (!createAllowed) {
            return List.of();
        }
        List<PseudoNode> created = synthesizer.ensureFieldSources(evaluatedCode, fieldNodeId);
        createdNodes.removeIf(node -> !nodeRegistry.has(node.getId()));
        createdNodes.addAll(created);
        return created;
    }

    /// Transforms a runtime definition fragment and attaches it under an existing node.
    ///
    /// The fragment goes through the same normalization passes as a compiled definition.
    ///
    /// @apiNote **Side effects**:
    /// - Registers the new nodes in this overlay's registry
    /// - Links them to `parentId` and marks them as step descendants when the parent is one
    /// - Synthesizes pseudo-nodes for their fields and references, if creation is enabled
    ///
    /// @param parentId id of the node the fragment hangs under, not null
    /// @param property parent property holding the fragment, not null
    /// @param rawDefinition raw fragment, not null
    /// @return root of the attached subtree, never null
    /// @throws IllegalArgumentException if the parent is not registered
    /// @throws io.formengine.core.exception.AstTransformationException if the fragment is
    ///     malformed
    public Node attachSubtree(
            String parentId, String property, Map<String, Object> rawDefinition) {
        RegistryEntry parent = nodeRegistry.getEntry(parentId);
        if (parent == null) {
            throw new IllegalArgumentException("Unknown parent node: " + parentId);
        }

        Node subtree = normalizer.normalize(transformer.transform(rawDefinition));
        List<Object> basePath = new ArrayList<>(parent.path());
        basePath.add(property);
        int registered = RegistrationTraverser.register(subtree, basePath, nodeRegistry);
        new MetadataTraverser(nodeRegistry, metadataRegistry)
                .setSubtreeMetadata(subtree, parentId, property);

        if (createAllowed) {
            createdNodes.addAll(synthesizer.synthesizeWithin(subtree));
        }
        logger.fine(
                () ->
                        "Attached "
                                + registered
                                + " runtime nodes under "
                                + parentId
                                + "."
                                + property);
        return subtree;
    }

    public NodeRegistry getNodeRegistry() {
        return nodeRegistry;
    }

    public MetadataRegistry getMetadataRegistry() {
        return metadataRegistry;
    }

    /// Returns the pseudo-nodes this overlay created.
    ///
    /// @return unmodifiable view in creation order, never null
    public List<PseudoNode> getCreatedNodes() {
        return Collections.unmodifiableList(createdNodes);
    }
}
