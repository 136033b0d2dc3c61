package io.formengine.core.ast.transform;

import io.formengine.core.ast.node.BlockType;
import io.formengine.core.ast.node.ExpressionType;
import io.formengine.core.ast.node.NodeType;
import io.formengine.core.ast.node.TransitionType;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Shape predicates over raw definition fragments.
///
/// A raw fragment is a `Map` whose `type` string names its kind. Each predicate also checks
/// the fields that kind requires, so a fragment with a known `type` but a broken shape
/// matches nothing and is reported as unknown by {@link AstTransformer}.
public final class DefinitionShapes {

    static final String TYPE = "type";

    private static final List<String> NODE_NAMESPACES =
            List.of(
                    "StructureType.",
                    "ExpressionType.",
                    "LogicType.",
                    "PredicateType.",
                    "FunctionType.",
                    "TransitionType.");

    private DefinitionShapes() {}

    public static boolean isJourney(Map<?, ?> raw) {
        return NodeType.JOURNEY.discriminant().equals(raw.get(TYPE));
    }

    public static boolean isStep(Map<?, ?> raw) {
        return NodeType.STEP.discriminant().equals(raw.get(TYPE));
    }

    public static boolean isBlock(Map<?, ?> raw) {
        return NodeType.BLOCK.discriminant().equals(raw.get(TYPE))
                && raw.get("variant") instanceof String;
    }

    /// Classifies a block fragment; the first matching rule wins.
    ///
    /// @param raw block fragment, not null
    /// @return `FIELD` with a `code`, `COLLECTION` with a `collection`, `COMPOSITE` with
    ///     `blocks` or `template`, otherwise `BASIC`
    public static BlockType blockTypeOf(Map<?, ?> raw) {
        if (raw.containsKey("code")) {
            return BlockType.FIELD;
        }
        if (raw.containsKey("collection")) {
            return BlockType.COLLECTION;
        }
        if (raw.containsKey("blocks") || raw.containsKey("template")) {
            return BlockType.COMPOSITE;
        }
        return BlockType.BASIC;
    }

    /// Returns the expression kind of a fragment whose required fields are all present.
    ///
    /// @param raw candidate fragment, not null
    /// @return expression kind, or empty if the fragment is not a well-formed expression
    public static Optional<ExpressionType> expressionTypeOf(Map<?, ?> raw) {
        Optional<ExpressionType> type = ExpressionType.fromDiscriminant(typeOf(raw));
        return type.filter(t -> hasExpressionShape(t, raw));
    }

    private static boolean hasExpressionShape(ExpressionType type, Map<?, ?> raw) {
        switch (type) {
            case REFERENCE:
                return raw.get("path") instanceof List;
            case PIPELINE:
                return raw.containsKey("input") && raw.get("steps") instanceof List;
            case CONDITIONAL:
            case VALIDATION:
                return true;
            case PREDICATE_TEST:
                return raw.containsKey("subject") && raw.containsKey("condition");
            case PREDICATE_NOT:
                return raw.containsKey("operand");
            case PREDICATE_AND:
            case PREDICATE_OR:
            case PREDICATE_XOR:
                return raw.get("operands") instanceof List;
            default:
                return raw.get("name") instanceof String && raw.get("arguments") instanceof List;
        }
    }

    /// Returns the transition kind of a well-formed transition fragment.
    ///
    /// @param raw candidate fragment, not null
    /// @return transition kind, or empty if not a well-formed transition
    public static Optional<TransitionType> transitionTypeOf(Map<?, ?> raw) {
        Optional<TransitionType> type = TransitionType.fromDiscriminant(typeOf(raw));
        return type.filter(t -> t != TransitionType.LOAD || raw.get("effects") instanceof List);
    }

    /// Returns whether a fragment matches any node shape.
    ///
    /// @param raw candidate fragment, not null
    /// @return true for journeys, steps, blocks, expressions and transitions
    public static boolean isNode(Map<?, ?> raw) {
        return isJourney(raw)
                || isStep(raw)
                || isBlock(raw)
                || expressionTypeOf(raw).isPresent()
                || transitionTypeOf(raw).isPresent();
    }

    /// Returns whether a fragment claims to be a node through its `type` namespace.
    ///
    /// Such fragments are transformed as nodes even in value position, so a misspelled or
    /// malformed node fails loudly instead of passing through as plain data.
    ///
    /// @param raw candidate fragment, not null
    /// @return true if `type` starts with a node namespace such as `ExpressionType.`
    public static boolean isNodeCandidate(Map<?, ?> raw) {
        String type = typeOf(raw);
        if (type == null) {
            return false;
        }
        for (String namespace : NODE_NAMESPACES) {
            if (type.startsWith(namespace)) {
                return true;
            }
        }
        return false;
    }

    static String typeOf(Map<?, ?> raw) {
        return raw.get(TYPE) instanceof String type ? type : null;
    }
}
