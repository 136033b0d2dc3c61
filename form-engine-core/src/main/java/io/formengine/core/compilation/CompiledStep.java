package io.formengine.core.compilation;

import io.formengine.core.ast.id.NodeIdGenerator;
import io.formengine.core.ast.node.Node;
import io.formengine.core.ast.node.PseudoNode;
import io.formengine.core.ast.node.PseudoNodeType;
import io.formengine.core.ast.node.StepNode;
import io.formengine.core.ast.registry.MetadataRegistry;
import io.formengine.core.ast.registry.NodeRegistry;
import io.formengine.core.ast.registry.ReadOnlyMetadataRegistry;
import io.formengine.core.ast.registry.ReadOnlyNodeRegistry;
import io.formengine.core.compilation.runtime.RuntimeNodeOverlay;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// Compilation artefact of a single step.
///
/// Holds a registry forked from the shared compilation plus the step's own pseudo-nodes,
/// and a metadata fork carrying the step-scope flags. Computed once per step by
/// {@link FormInstance#compileStep(String)} and cached for the life of the instance.
///
/// @implNote Never mutated after construction. Request-time additions go into a
/// {@link RuntimeNodeOverlay} from {@link #openOverlay()}, which forks the registries again.
public final class CompiledStep {

    private final StepNode step;
    private final Node root;
    private final ReadOnlyNodeRegistry nodeRegistry;
    private final ReadOnlyMetadataRegistry metadataRegistry;
    private final List<PseudoNode> createdPseudoNodes;
    private final List<Node> relevantNodes;
    private final List<Node> journeyMetadataNodes;
    private final NodeIdGenerator idGenerator;
    private final boolean runtimePseudoNodes;
    private final Instant compiledAt;
    private final Duration duration;

    CompiledStep(
            StepNode step,
            Node root,
            NodeRegistry nodeRegistry,
            MetadataRegistry metadataRegistry,
            List<PseudoNode> createdPseudoNodes,
            NodeIdGenerator idGenerator,
            boolean runtimePseudoNodes,
            Instant compiledAt,
            Duration duration) {
        this.step = Objects.requireNonNull(step, "Step required");
        this.root = Objects.requireNonNull(root, "Root required");
        this.nodeRegistry =
                Objects.requireNonNull(nodeRegistry, "Node registry required").readOnlyView();
        this.metadataRegistry =
                Objects.requireNonNull(metadataRegistry, "Metadata registry required")
                        .readOnlyView();
        this.createdPseudoNodes = List.copyOf(createdPseudoNodes);
        this.idGenerator = Objects.requireNonNull(idGenerator, "ID generator required");
        this.runtimePseudoNodes = runtimePseudoNodes;
        this.compiledAt = Objects.requireNonNull(compiledAt, "Compilation time required");
        this.duration = Objects.requireNonNull(duration, "Duration required");
        this.relevantNodes =
                List.copyOf(
                        RelevantNodeCollector.collect(
                                root, this.nodeRegistry, this.metadataRegistry));
        this.journeyMetadataNodes =
                List.copyOf(
                        RelevantNodeCollector.collectJourneyMetadata(
                                root, this.nodeRegistry, this.metadataRegistry));
    }

    public StepNode getStep() {
        return step;
    }

    public String getStepId() {
        return step.getId();
    }

    /// Returns the journey root the step belongs to.
    ///
    /// @return root node, never null
    public Node getRoot() {
        return root;
    }

    /// Returns the step's registry: shared nodes plus step-local pseudo-nodes.
    ///
    /// @return read-only view, never null; `clone()` it to get a writable fork
    public ReadOnlyNodeRegistry getNodeRegistry() {
        return nodeRegistry;
    }

    /// Returns the step-scoped metadata view.
    ///
    /// @return read-only metadata with parent linkage and this step's scope flags, never null
    public ReadOnlyMetadataRegistry metadata() {
        return metadataRegistry;
    }

    /// Looks up a pseudo-node visible to this step.
    ///
    /// @param type pseudo-node type, not null
    /// @param key lookup key, not null
    /// @return the pseudo-node, or null if none exists
    public PseudoNode findPseudoNode(PseudoNodeType type, String key) {
        return nodeRegistry.findPseudoNode(type, key);
    }

    /// Returns the nodes this step needs at runtime.
    ///
    /// @return ancestor journeys, the step subtree, ancestor load transitions and the
    ///     pseudo-nodes they reference; unmodifiable, never null
    public List<Node> relevantNodes() {
        return relevantNodes;
    }

    /// Returns the nodes needed to compute journey navigation metadata from this step.
    ///
    /// Covers the structure of every journey and step, restricted to the properties that
    /// describe navigation, plus the submit transitions of all steps, the load transitions
    /// owned by the step's ancestors, and the pseudo-nodes these reference.
    ///
    /// @return unmodifiable list, never null
    public List<Node> journeyMetadataNodes() {
        return journeyMetadataNodes;
    }

    /// Returns the pseudo-nodes created by this step's own synthesis pass.
    ///
    /// @return unmodifiable list, never null
    public List<PseudoNode> getCreatedPseudoNodes() {
        return createdPseudoNodes;
    }

    public Instant getCompiledAt() {
        return compiledAt;
    }

    public Duration getDuration() {
        return duration;
    }

    /// Opens a per-request overlay on top of this step.
    ///
    /// @return new overlay with its own registry forks, never null
    public RuntimeNodeOverlay openOverlay() {
        return new RuntimeNodeOverlay(this, idGenerator, runtimePseudoNodes);
    }

    @Override
    public String toString() {
        return "CompiledStep{step='"
                + step.getId()
                + "', nodes="
                + nodeRegistry.size()
                + ", pseudoNodes="
                + createdPseudoNodes.size()
                + "}";
    }
}
