package io.formengine.core.ast.node;

import java.util.Map;

/// Top-level form flow container.
///
/// Holds `steps`, nested `children` journeys and journey-level transitions such as
/// `onLoad` and `onAccess`.
public final class JourneyNode extends Node {

    public JourneyNode(String id, Map<String, Object> properties, Object raw) {
        super(id, properties, raw);
    }

    @Override
    public JourneyNode rebuild(String id, Map<String, Object> properties) {
        return new JourneyNode(id, properties, getRaw());
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.JOURNEY;
    }

    @Override
    public NodeKind getKind() {
        return NodeType.JOURNEY;
    }

    /// Returns the URL path segment of this journey.
    ///
    /// @return path, or null if not declared
    public String getPath() {
        return getProperty("path") instanceof String path ? path : null;
    }

    /// Returns the journey code.
    ///
    /// @return code, or null if not declared
    public String getCode() {
        return getProperty("code") instanceof String code ? code : null;
    }
}
