package io.formengine.core.ast.node;

import java.util.Map;

/// A single page within a journey, containing blocks and lifecycle transitions.
public final class StepNode extends Node {

    public StepNode(String id, Map<String, Object> properties, Object raw) {
        super(id, properties, raw);
    }

    @Override
    public StepNode rebuild(String id, Map<String, Object> properties) {
        return new StepNode(id, properties, getRaw());
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.STEP;
    }

    @Override
    public NodeKind getKind() {
        return NodeType.STEP;
    }

    /// Returns the URL path segment of this step, relative to its journey.
    ///
    /// @return path, or null if not declared
    public String getPath() {
        return getProperty("path") instanceof String path ? path : null;
    }
}
