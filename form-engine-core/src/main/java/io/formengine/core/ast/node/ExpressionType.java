package io.formengine.core.ast.node;

import java.util.Optional;

/// Expression sub-kinds with the `type` strings used in raw definitions.
public enum ExpressionType implements NodeKind {
    REFERENCE("ExpressionType.Reference"),
    PIPELINE("ExpressionType.Pipeline"),
    CONDITIONAL("LogicType.Conditional"),
    VALIDATION("ExpressionType.Validation"),
    PREDICATE_TEST("PredicateType.Test"),
    PREDICATE_AND("PredicateType.And"),
    PREDICATE_OR("PredicateType.Or"),
    PREDICATE_XOR("PredicateType.Xor"),
    PREDICATE_NOT("PredicateType.Not"),
    FUNCTION_CONDITION("FunctionType.Condition"),
    FUNCTION_TRANSFORMER("FunctionType.Transformer"),
    FUNCTION_EFFECT("FunctionType.Effect"),
    FUNCTION_GENERATOR("FunctionType.Generator");

    private final String discriminant;

    ExpressionType(String discriminant) {
        this.discriminant = discriminant;
    }

    @Override
    public NodeType nodeType() {
        return NodeType.EXPRESSION;
    }

    @Override
    public String discriminant() {
        return discriminant;
    }

    /// Returns whether this is one of the boolean predicate operators.
    ///
    /// @return true for `PREDICATE_*` kinds
    public boolean isPredicate() {
        return name().startsWith("PREDICATE_");
    }

    /// Returns whether this is a registered function call.
    ///
    /// @return true for `FUNCTION_*` kinds
    public boolean isFunction() {
        return name().startsWith("FUNCTION_");
    }

    /// Looks up an expression kind by its raw `type` string.
    ///
    /// @param discriminant raw type value, may be null
    /// @return matching kind, or empty if unknown
    public static Optional<ExpressionType> fromDiscriminant(String discriminant) {
        for (ExpressionType type : values()) {
            if (type.discriminant.equals(discriminant)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
