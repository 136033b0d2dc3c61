package io.formengine.core.ast.registry;

import io.formengine.core.ast.node.Node;
import java.util.List;

/// A registered node with its structural path from the root.
///
/// @param node the registered node, not null
/// @param path property keys (strings) and array indices (integers); empty for the root
///     and for pseudo-nodes
public record RegistryEntry(Node node, List<Object> path) {}
