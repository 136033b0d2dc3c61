package io.formengine.core.ast.node;

/// Structural classification of a block, derived from its shape.
public enum BlockType implements NodeKind {
    BASIC("basic"),
    FIELD("field"),
    COLLECTION("collection"),
    COMPOSITE("composite");

    private final String discriminant;

    BlockType(String discriminant) {
        this.discriminant = discriminant;
    }

    @Override
    public NodeType nodeType() {
        return NodeType.BLOCK;
    }

    @Override
    public String discriminant() {
        return discriminant;
    }
}
