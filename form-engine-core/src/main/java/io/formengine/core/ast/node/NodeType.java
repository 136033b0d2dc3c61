package io.formengine.core.ast.node;

/// Top-level node categories.
///
/// `JOURNEY` and `STEP` have no sub-kinds, so they act as their own {@link NodeKind}.
public enum NodeType implements NodeKind {
    JOURNEY("StructureType.Journey"),
    STEP("StructureType.Step"),
    BLOCK("StructureType.Block"),
    EXPRESSION("ASTNodeType.Expression"),
    TRANSITION("ASTNodeType.Transition"),
    PSEUDO("ASTNodeType.Pseudo");

    private final String discriminant;

    NodeType(String discriminant) {
        this.discriminant = discriminant;
    }

    @Override
    public NodeType nodeType() {
        return this;
    }

    @Override
    public String discriminant() {
        return discriminant;
    }
}
