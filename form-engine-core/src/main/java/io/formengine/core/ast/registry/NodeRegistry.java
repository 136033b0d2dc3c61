package io.formengine.core.ast.registry;

import io.formengine.core.ast.node.Node;
import io.formengine.core.ast.node.NodeKind;
import io.formengine.core.ast.node.PseudoNode;
import io.formengine.core.ast.node.PseudoNodeType;
import io.formengine.core.exception.DuplicateNodeIdException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Canonical store of the nodes of a compiled form.
///
/// Nodes are indexed by id, by category and sub-kind, and pseudo-nodes additionally by
/// (type, lookup key). All indices are maintained on {@link #register}, so lookups never
/// rescan the registry.
///
/// ### Contracts
/// - **Invariant**: ids are unique; a duplicate registration fails and changes nothing
/// - **Invariant**: at most one pseudo-node per (type, key)
/// - **Postcondition**: {@link #findByType} returns nodes in registration order
///
/// @implNote **Not thread-safe** for writers. A registry is written only while it is
/// private to one compilation and is read-only once published.
///
/// @see MetadataRegistry for derived per-node facts
/// @see #readOnlyView() for publishing a registry
public final class NodeRegistry implements ReadOnlyNodeRegistry {

    private static final Logger logger = Logger.getLogger(NodeRegistry.class.getName());

    private final Map<String, RegistryEntry> entries;
    private final Map<NodeKind, List<Node>> typeIndex;
    private final Map<PseudoNodeType, Map<String, PseudoNode>> pseudoIndex;

    public NodeRegistry() {
        this.entries = new LinkedHashMap<>();
        this.typeIndex = new HashMap<>();
        this.pseudoIndex = new EnumMap<>(PseudoNodeType.class);
    }

    private NodeRegistry(NodeRegistry source) {
        this.entries = new LinkedHashMap<>(source.entries);
        this.typeIndex = new HashMap<>();
        source.typeIndex.forEach((kind, nodes) -> typeIndex.put(kind, new ArrayList<>(nodes)));
        this.pseudoIndex = new EnumMap<>(PseudoNodeType.class);
        source.pseudoIndex.forEach((type, nodes) -> pseudoIndex.put(type, new HashMap<>(nodes)));
    }

    /// Registers a node with an empty path.
    ///
    /// @param id node identifier, not null
    /// @param node node to register, not null
    /// @throws DuplicateNodeIdException if the id is already registered
    public void register(String id, Node node) {
        register(id, node, List.of());
    }

    /// Registers a node with its structural path.
    ///
    /// @apiNote **Side effects**:
    /// - Adds the node to the id, type and (for pseudo-nodes) pseudo indices
    ///
    /// @param id node identifier, not null
    /// @param node node to register, not null
    /// @param path structural path from the root, not null
    /// @throws DuplicateNodeIdException if the id is already registered
    /// @throws IllegalStateException if a pseudo-node with the same type and key exists
    public void register(String id, Node node, List<Object> path) {
        if (entries.containsKey(id)) {
            throw new DuplicateNodeIdException(id);
        }
        if (node instanceof PseudoNode pseudo
                && findPseudoNode(pseudo.getPseudoNodeType(), pseudo.getLookupKey()) != null) {
            throw new IllegalStateException(
                    "Pseudo node "
                            + pseudo.getPseudoNodeType()
                            + " for key '"
                            + pseudo.getLookupKey()
                            + "' is already registered");
        }

        entries.put(id, new RegistryEntry(node, List.copyOf(path)));
        typeIndex.computeIfAbsent(node.getNodeType(), k -> new ArrayList<>()).add(node);
        if (node.getKind() != node.getNodeType()) {
            typeIndex.computeIfAbsent(node.getKind(), k -> new ArrayList<>()).add(node);
        }
        if (node instanceof PseudoNode pseudo) {
            pseudoIndex
                    .computeIfAbsent(pseudo.getPseudoNodeType(), k -> new HashMap<>())
                    .put(pseudo.getLookupKey(), pseudo);
        }

        if (logger.isLoggable(Level.FINEST)) {
            logger.finest("Registered " + node + " at " + path);
        }
    }

    /// Returns a node by id.
    ///
    /// @param id node identifier, not null
    /// @return the node, or null if not registered
    public Node get(String id) {
        RegistryEntry entry = entries.get(id);
        return entry != null ? entry.node() : null;
    }

    /// Returns a node with its path.
    ///
    /// @param id node identifier, not null
    /// @return the entry, or null if not registered
    public RegistryEntry getEntry(String id) {
        return entries.get(id);
    }

    public boolean has(String id) {
        return entries.containsKey(id);
    }

    public int size() {
        return entries.size();
    }

    /// Returns all ids in registration order.
    ///
    /// @return new list of ids, never null
    public List<String> getIds() {
        return new ArrayList<>(entries.keySet());
    }

    /// Returns all nodes keyed by id, in registration order.
    ///
    /// @return new map, never null
    public Map<String, Node> getAll() {
        Map<String, Node> all = new LinkedHashMap<>();
        entries.forEach((id, entry) -> all.put(id, entry.node()));
        return all;
    }

    /// Returns all nodes of a category or sub-kind.
    ///
    /// Passing a {@link io.formengine.core.ast.node.NodeType} matches every node of that
    /// category; passing a sub-kind such as `BlockType.FIELD` matches only that sub-kind.
    ///
    /// @param kind category or sub-kind, not null
    /// @return unmodifiable live view in registration order, never null
    public List<Node> findByType(NodeKind kind) {
        List<Node> nodes = typeIndex.get(kind);
        return nodes != null ? Collections.unmodifiableList(nodes) : List.of();
    }

    /// Returns all nodes of a kind cast to the expected node class.
    ///
    /// @param kind category or sub-kind, not null
    /// @param nodeClass expected node class, not null
    /// @param <T> node class
    /// @return new list in registration order, never null
    public <T extends Node> List<T> findByType(NodeKind kind, Class<T> nodeClass) {
        List<T> result = new ArrayList<>();
        for (Node node : findByType(kind)) {
            result.add(nodeClass.cast(node));
        }
        return result;
    }

    /// Returns the pseudo-node for a (type, key) pair.
    ///
    /// @param type pseudo-node type, not null
    /// @param key lookup key, not null
    /// @return the pseudo-node, or null if none exists
    public PseudoNode findPseudoNode(PseudoNodeType type, String key) {
        Map<String, PseudoNode> byKey = pseudoIndex.get(type);
        return byKey != null ? byKey.get(key) : null;
    }

    /// Removes a node from every index.
    ///
    /// Only for registries private to one request, where a pseudo-node has been superseded,
    /// e.g. an `ANSWER_REMOTE` replaced by the `ANSWER_LOCAL` of a field resolved at runtime.
    ///
    /// @param id node identifier, not null
    /// @return the removed node, or null if not registered
    public Node unregister(String id) {
        RegistryEntry entry = entries.remove(id);
        if (entry == null) {
            return null;
        }
        Node node = entry.node();
        removeFromIndex(node.getNodeType(), node);
        removeFromIndex(node.getKind(), node);
        if (node instanceof PseudoNode pseudo) {
            Map<String, PseudoNode> byKey = pseudoIndex.get(pseudo.getPseudoNodeType());
            if (byKey != null) {
                byKey.remove(pseudo.getLookupKey(), pseudo);
            }
        }
        logger.fine(() -> "Unregistered " + node);
        return node;
    }

    private void removeFromIndex(NodeKind kind, Node node) {
        List<Node> nodes = typeIndex.get(kind);
        if (nodes != null) {
            nodes.removeIf(indexed -> indexed == node);
        }
    }

    /// Returns a view that answers queries from this registry but cannot write to it.
    ///
    /// The view is live: later registrations on this registry show through it.
    ///
    /// @return read-only view, never null
    public ReadOnlyNodeRegistry readOnlyView() {
        return new View(this);
    }

    /// Creates an independent copy of this registry.
    ///
    /// Node values are shared, since nodes are immutable. Every index is copied, so
    /// registrations on the clone never affect this registry.
    ///
    /// @return new registry with the same content, never null
    @Override
    public NodeRegistry clone() {
        return new NodeRegistry(this);
    }

    private static final class View implements ReadOnlyNodeRegistry {

        private final NodeRegistry registry;

        private View(NodeRegistry registry) {
            this.registry = registry;
        }

        @Override
        public Node get(String id) {
            return registry.get(id);
        }

        @Override
        public RegistryEntry getEntry(String id) {
            return registry.getEntry(id);
        }

        @Override
        public boolean has(String id) {
            return registry.has(id);
        }

        @Override
        public int size() {
            return registry.size();
        }

        @Override
        public List<String> getIds() {
            return registry.getIds();
        }

        @Override
        public Map<String, Node> getAll() {
            return registry.getAll();
        }

        @Override
        public List<Node> findByType(NodeKind kind) {
            return registry.findByType(kind);
        }

        @Override
        public <T extends Node> List<T> findByType(NodeKind kind, Class<T> nodeClass) {
            return registry.findByType(kind, nodeClass);
        }

        @Override
        public PseudoNode findPseudoNode(PseudoNodeType type, String key) {
            return registry.findPseudoNode(type, key);
        }

        @Override
        public NodeRegistry clone() {
            return registry.clone();
        }

        @Override
        public String toString() {
            return "ReadOnlyNodeRegistry{size=" + registry.size() + "}";
        }
    }
}
