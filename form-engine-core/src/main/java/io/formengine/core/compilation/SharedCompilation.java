package io.formengine.core.compilation;

import io.formengine.core.ast.node.JourneyNode;
import io.formengine.core.ast.node.PseudoNode;
import io.formengine.core.ast.node.StepNode;
import io.formengine.core.ast.registry.ReadOnlyMetadataRegistry;
import io.formengine.core.ast.registry.ReadOnlyNodeRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/// Step-independent result of compiling a form definition.
///
/// Built once per {@link FormInstance}. Every compiled step starts from clones of the
/// registries held here.
///
/// @implNote The registries are read-only views; a step forks them with `clone()`.
///
/// @param root transformed journey root, not null
/// @param nodeRegistry every AST node plus global pseudo-nodes, not null
/// @param metadataRegistry parent linkage of every node, not null
/// @param stepIndex steps by id in definition order, unmodifiable, not null
/// @param stepPaths step ids by full URL path, unmodifiable, not null
/// @param globalPseudoNodes pseudo-nodes created by the global pass, not null
/// @param compiledAt completion time, not null
/// @param duration time spent compiling, not null
public record SharedCompilation(
        JourneyNode root,
        ReadOnlyNodeRegistry nodeRegistry,
        ReadOnlyMetadataRegistry metadataRegistry,
        Map<String, StepNode> stepIndex,
        Map<String, String> stepPaths,
        List<PseudoNode> globalPseudoNodes,
        Instant compiledAt,
        Duration duration) {}
