package io.formengine.core.ast.node;

import java.util.Optional;

/// Lifecycle transition sub-kinds.
public enum TransitionType implements NodeKind {
    LOAD("TransitionType.Load"),
    ACCESS("TransitionType.Access"),
    SUBMIT("TransitionType.Submit");

    private final String discriminant;

    TransitionType(String discriminant) {
        this.discriminant = discriminant;
    }

    @Override
    public NodeType nodeType() {
        return NodeType.TRANSITION;
    }

    @Override
    public String discriminant() {
        return discriminant;
    }

    /// Looks up a transition kind by its raw `type` string.
    ///
    /// @param discriminant raw type value, may be null
    /// @return matching kind, or empty if unknown
    public static Optional<TransitionType> fromDiscriminant(String discriminant) {
        for (TransitionType type : values()) {
            if (type.discriminant.equals(discriminant)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
