package io.formengine.core.compilation;

import io.formengine.core.FormEngineConfig;
import io.formengine.core.ast.id.NodeIdCategory;
import io.formengine.core.ast.id.NodeIdGenerator;
import io.formengine.core.ast.node.JourneyNode;
import io.formengine.core.ast.node.Node;
import io.formengine.core.ast.node.NodeType;
import io.formengine.core.ast.node.PseudoNode;
import io.formengine.core.ast.node.StepNode;
import io.formengine.core.ast.normalize.NormalizationPipeline;
import io.formengine.core.ast.registry.MetadataRegistry;
import io.formengine.core.ast.registry.NodeRegistry;
import io.formengine.core.ast.transform.AstTransformer;
import io.formengine.core.ast.traverse.RegistrationTraverser;
import io.formengine.core.ast.traverse.StructuralTraverser;
import io.formengine.core.ast.traverse.StructuralVisitor;
import io.formengine.core.ast.traverse.TraversalContext;
import io.formengine.core.ast.traverse.VisitResult;
import io.formengine.core.compilation.metadata.MetadataTraverser;
import io.formengine.core.compilation.pseudo.PseudoNodeFactory;
import io.formengine.core.compilation.pseudo.PseudoNodeSynthesizer;
import io.formengine.core.compilation.pseudo.SynthesisScope;
import io.formengine.core.exception.InvalidNodeException;
import io.formengine.core.exception.MissingStepException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// A compiled form definition with lazily compiled, cached steps.
///
/// Construction runs the shared compilation: transformation, normalization, registration,
/// parent metadata, step indexing and global pseudo-node synthesis. A failure aborts
/// construction, so no partially compiled instance is ever observable.
///
/// Steps are compiled on first request. Each step compiles against clones of the shared
/// registries, so step-scope flags and step-local pseudo-nodes never leak between steps.
///
/// ### Contracts
/// - **Invariant**: the shared artefact never changes after construction
/// - **Invariant**: at most one {@link CompiledStep} exists per step id, even when the first
///   requests for a step race
///
/// @implNote **Thread-safe**. The shared artefact is published through a final field and
/// step artefacts through a {@link ConcurrentHashMap}. Pseudo-node ids come from one
/// generator shared by all steps, so they are unique across the instance.
///
/// @see FormCompilationFactory#createInstance(Map)
public final class FormInstance {

    private static final Logger logger = Logger.getLogger(FormInstance.class.getName());

    private final FormEngineConfig config;
    private final CompilationListener listener;
    private final NodeIdGenerator idGenerator;
    private final SharedCompilation shared;
    private final ConcurrentHashMap<String, CompiledStep> compiledSteps;

    FormInstance(
            Map<String, Object> rawDefinition,
            FormEngineConfig config,
            CompilationListener listener) {
        this.config = Objects.requireNonNull(config, "Config required");
        this.listener = Objects.requireNonNull(listener, "Listener required");
        this.idGenerator = new NodeIdGenerator();
        this.compiledSteps = new ConcurrentHashMap<>();
        this.shared = compileShared(Objects.requireNonNull(rawDefinition, "Definition required"));
        listener.onSharedCompiled(shared);

        if (config.isEagerStepCompilation()) {
            compileAllSteps();
        }
    }

    private SharedCompilation compileShared(Map<String, Object> rawDefinition) {
        Instant start = Instant.now();

        Node transformed = new AstTransformer(idGenerator).transform(rawDefinition);
        if (!(transformed instanceof JourneyNode)) {
            throw new InvalidNodeException(
                    NodeType.JOURNEY.discriminant(),
                    transformed.getKind().discriminant(),
                    List.of());
        }
        JourneyNode root =
                (JourneyNode)
                        NormalizationPipeline.standard(idGenerator, NodeIdCategory.COMPILE_AST)
                                .normalize(transformed);

        NodeRegistry nodeRegistry = new NodeRegistry();
        RegistrationTraverser.register(root, nodeRegistry);

        MetadataRegistry metadataRegistry = new MetadataRegistry();
        new MetadataTraverser(nodeRegistry, metadataRegistry).setParentMetadata(root);

        Map<String, StepNode> stepIndex = new LinkedHashMap<>();
        for (StepNode step : nodeRegistry.findByType(NodeType.STEP, StepNode.class)) {
            stepIndex.put(step.getId(), step);
        }
        Map<String, String> stepPaths = indexStepPaths(root);

        List<PseudoNode> globalPseudoNodes =
                new PseudoNodeSynthesizer(
                                nodeRegistry,
                                metadataRegistry,
                                new PseudoNodeFactory(idGenerator),
                                config.isWarnOnUnknownReferenceSource())
                        .synthesize(SynthesisScope.GLOBAL);

        Instant end = Instant.now();
        SharedCompilation result =
                new SharedCompilation(
                        root,
                        nodeRegistry.readOnlyView(),
                        metadataRegistry.readOnlyView(),
                        Collections.unmodifiableMap(stepIndex),
                        Collections.unmodifiableMap(stepPaths),
                        List.copyOf(globalPseudoNodes),
                        end,
                        Duration.between(start, end));

        logger.info(
                "Compiled form "
                        + root.getCode()
                        + ": "
                        + nodeRegistry.size()
                        + " nodes, "
                        + stepIndex.size()
                        + " steps, "
                        + globalPseudoNodes.size()
                        + " global pseudo nodes in "
                        + result.duration().toMillis()
                        + "ms");
        return result;
    }

    /// Returns the compiled artefact of a step, compiling it on first request.
    ///
    /// @apiNote **Side effects**:
    /// - On first request, notifies {@link CompilationListener#onStepCompiled}
    ///
    /// @param stepId step node id, not null
    /// @return cached step artefact, never null
    /// @throws MissingStepException if the id is not a step of this form
    public CompiledStep compileStep(String stepId) {
        Objects.requireNonNull(stepId, "Step ID required");
        StepNode step = shared.stepIndex().get(stepId);
        if (step == null) {
            throw new MissingStepException(stepId);
        }
        return compiledSteps.computeIfAbsent(stepId, id -> doCompileStep(step));
    }

    /// Compiles every step that has no cached artefact yet.
    ///
    /// @return compiled steps in definition order, never null
    public List<CompiledStep> compileAllSteps() {
        List<CompiledStep> steps = new ArrayList<>(shared.stepIndex().size());
        for (String stepId : shared.stepIndex().keySet()) {
            steps.add(compileStep(stepId));
        }
        return steps;
    }

    private CompiledStep doCompileStep(StepNode step) {
        Instant start = Instant.now();

        NodeRegistry nodeRegistry = shared.nodeRegistry().clone();
        MetadataRegistry metadataRegistry = shared.metadataRegistry().clone();

        new MetadataTraverser(nodeRegistry, metadataRegistry)
                .setStepScopeMetadata(shared.root(), step);

        List<PseudoNode> created =
                new PseudoNodeSynthesizer(
                                nodeRegistry,
                                metadataRegistry,
                                new PseudoNodeFactory(idGenerator),
                                config.isWarnOnUnknownReferenceSource())
                        .synthesize(SynthesisScope.STEP);

        Instant end = Instant.now();
        CompiledStep compiled =
                new CompiledStep(
                        step,
                        shared.root(),
                        nodeRegistry,
                        metadataRegistry,
                        created,
                        idGenerator,
                        config.isRuntimePseudoNodes(),
                        end,
                        Duration.between(start, end));

        logger.info(
                "Compiled step "
                        + step.getId()
                        + " ("
                        + step.getPath()
                        + "): "
                        + created.size()
                        + " step pseudo nodes, "
                        + compiled.relevantNodes().size()
                        + " relevant nodes in "
                        + compiled.getDuration().toMillis()
                        + "ms");
        listener.onStepCompiled(compiled);
        return compiled;
    }

    /// Returns the ids of all steps, in definition order.
    ///
    /// @return unmodifiable list, never null
    public List<String> getStepIds() {
        return List.copyOf(shared.stepIndex().keySet());
    }

    /// Finds a step by its full URL path.
    ///
    /// The full path joins the paths of all enclosing journeys with the step's own path,
    /// e.g. journey `/apply` and step `/contact` give `/apply/contact`.
    ///
    /// @param path full path, with or without leading and trailing slashes, not null
    /// @return the step, or empty if no step has that path
    public Optional<StepNode> findStepByPath(String path) {
        String stepId = shared.stepPaths().get(joinPath(List.of(path)));
        return Optional.ofNullable(stepId).map(id -> shared.stepIndex().get(id));
    }

    /// Returns whether a step already has a cached artefact.
    ///
    /// @param stepId step node id, not null
    /// @return true once {@link #compileStep(String)} has completed for the step
    public boolean isStepCompiled(String stepId) {
        return compiledSteps.containsKey(stepId);
    }

    public FormInstanceState getState() {
        return !shared.stepIndex().isEmpty()
                        && compiledSteps.size() == shared.stepIndex().size()
                ? FormInstanceState.STEPS_COMPILED
                : FormInstanceState.SHARED_READY;
    }

    public SharedCompilation getSharedCompilation() {
        return shared;
    }

    private static Map<String, String> indexStepPaths(Node root) {
        Map<String, String> stepPaths = new LinkedHashMap<>();
        StructuralTraverser.traverse(
                root,
                new StructuralVisitor() {
                    @Override
                    public VisitResult enterNode(Node node, TraversalContext context) {
                        if (!(node instanceof StepNode step) || step.getPath() == null) {
                            return VisitResult.CONTINUE;
                        }
                        List<String> segments = new ArrayList<>();
                        for (Node ancestor : context.ancestors()) {
                            if (ancestor instanceof JourneyNode journey
                                    && journey.getPath() != null) {
                                segments.add(journey.getPath());
                            }
                        }
                        segments.add(step.getPath());
                        stepPaths.putIfAbsent(joinPath(segments), step.getId());
                        return VisitResult.SKIP;
                    }
                });
        return stepPaths;
    }

    private static String joinPath(List<String> segments) {
        StringBuilder sb = new StringBuilder();
        for (String segment : segments) {
            for (String part : segment.split("/")) {
                if (!part.isEmpty()) {
                    sb.append('/').append(part);
                }
            }
        }
        return sb.length() == 0 ? "/" : sb.toString();
    }
}
