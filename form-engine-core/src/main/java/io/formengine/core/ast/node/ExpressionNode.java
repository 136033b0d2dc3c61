package io.formengine.core.ast.node;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A dynamic value or logic expression.
///
/// Reference expressions keep their `path` verbatim: a source tag followed by a key,
/// e.g. `["answers", "address.street"]`.
public final class ExpressionNode extends Node {

    private final ExpressionType expressionType;

    public ExpressionNode(
            String id, ExpressionType expressionType, Map<String, Object> properties, Object raw) {
        super(id, properties, raw);
        this.expressionType = Objects.requireNonNull(expressionType, "Expression type required");
    }

    @Override
    public ExpressionNode rebuild(String id, Map<String, Object> properties) {
        return new ExpressionNode(id, expressionType, properties, getRaw());
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.EXPRESSION;
    }

    @Override
    public NodeKind getKind() {
        return expressionType;
    }

    public ExpressionType getExpressionType() {
        return expressionType;
    }

    /// Returns the reference path of a reference expression.
    ///
    /// @return path segments, or an empty list for other expression kinds
    public List<Object> getReferencePath() {
        if (expressionType == ExpressionType.REFERENCE
                && getProperty("path") instanceof List<?> path) {
            @SuppressWarnings("unchecked")
            List<Object> segments = (List<Object>) path;
            return segments;
        }
        return List.of();
    }
}
