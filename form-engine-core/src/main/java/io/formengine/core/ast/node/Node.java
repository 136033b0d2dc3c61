package io.formengine.core.ast.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Base class for all nodes of a compiled form graph.
///
/// A node has an identifier, a category ({@link NodeType}), a category-specific sub-kind
/// ({@link NodeKind}) and an ordered bag of properties. Property values are primitives,
/// nested plain data (lists and maps) or child nodes.
///
/// ### Node Types
/// - {@link JourneyNode} - top-level flow container
/// - {@link StepNode} - single page within a journey
/// - {@link BlockNode} - UI block (basic, field, collection, composite)
/// - {@link ExpressionNode} - references, pipelines, logic and function calls
/// - {@link TransitionNode} - load, access and submit lifecycle hooks
/// - {@link PseudoNode} - synthesized runtime data source
///
/// ### Equality
/// Equality is structural: concrete class, sub-kind and properties, compared recursively.
/// The identifier and the raw fragment take no part in it, so two transformations of the
/// same definition yield equal but distinct nodes.
///
/// @implNote Immutable after construction. Properties are deep-copied into unmodifiable
/// collections; derived facts belong in
/// {@link io.formengine.core.ast.registry.MetadataRegistry}, never on the node.
///
/// @see NodeKind for the discriminants preserved for the evaluation engine
public abstract class Node {

    protected final String id;
    private final Map<String, Object> properties;
    private final Object raw;

    /// Creates a node.
    ///
    /// @param id unique node identifier, not null
    /// @param properties node properties, not null (copied)
    /// @param raw raw definition fragment for diagnostics, may be null
    protected Node(String id, Map<String, Object> properties, Object raw) {
        this.id = Objects.requireNonNull(id, "Node ID required");
        this.properties = freezeMap(Objects.requireNonNull(properties, "Properties required"));
        this.raw = raw;
    }

    /// Returns the unique node identifier.
    ///
    /// @return node ID, never null
    public String getId() {
        return id;
    }

    /// Returns the node category.
    ///
    /// @return category, never null
    public abstract NodeType getNodeType();

    /// Returns the category-specific sub-kind.
    ///
    /// @return sub-kind, never null; equal to {@link #getNodeType()} for journeys and steps
    public abstract NodeKind getKind();

    /// Returns all properties in definition order.
    ///
    /// @return unmodifiable property map, never null
    public Map<String, Object> getProperties() {
        return properties;
    }

    /// Returns a single property value.
    ///
    /// @param name property name, not null
    /// @return value, or null if absent
    public Object getProperty(String name) {
        return properties.get(name);
    }

    /// Returns whether a property is present, even with a null value.
    ///
    /// @param name property name, not null
    /// @return true if present
    public boolean hasProperty(String name) {
        return properties.containsKey(name);
    }

    /// Returns the raw definition fragment this node was built from.
    ///
    /// Only for diagnostics. Compilation logic never reads it.
    ///
    /// @return raw fragment, or null for synthesized nodes
    public Object getRaw() {
        return raw;
    }

    /// Returns a copy of this node with another id and property map.
    ///
    /// Sub-kind, variant and raw fragment are kept. Normalization passes use this to
    /// rewrite the immutable graph bottom-up.
    ///
    /// @param id identifier of the copy, not null
    /// @param properties properties of the copy, not null (copied)
    /// @return new node of the same class, never null
    public abstract Node rebuild(String id, Map<String, Object> properties);

    /// Returns a copy of this node, same id, with replaced properties.
    ///
    /// @param properties properties of the copy, not null (copied)
    /// @return new node, never null
    public final Node withProperties(Map<String, Object> properties) {
        return rebuild(id, properties);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node node = (Node) o;
        return getKind() == node.getKind() && properties.equals(node.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKind(), properties);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id='" + id + "', kind=" + getKind() + "}";
    }

    private static Map<String, Object> freezeMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(String.valueOf(key), freeze(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
