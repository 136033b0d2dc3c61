package io.formengine.core.ast.node;

/// Runtime data sources represented by synthesized pseudo-nodes.
///
/// Each type names the property that holds its lookup key:
///
/// ```
/// Type           │ Key property   │ Key form
/// ───────────────┼────────────────┼───────────────────────────
/// POST           │ baseFieldCode  │ base segment of field code
/// ANSWER_LOCAL   │ baseFieldCode  │ base segment of field code
/// ANSWER_REMOTE  │ baseFieldCode  │ base segment of field code
/// QUERY          │ paramName      │ full, possibly dotted key
/// PARAMS         │ paramName      │ full, possibly dotted key
/// DATA           │ baseProperty   │ base segment of property
/// ```
public enum PseudoNodeType implements NodeKind {
    POST("PseudoNodeType.Post", "baseFieldCode"),
    ANSWER_LOCAL("PseudoNodeType.AnswerLocal", "baseFieldCode"),
    ANSWER_REMOTE("PseudoNodeType.AnswerRemote", "baseFieldCode"),
    QUERY("PseudoNodeType.Query", "paramName"),
    PARAMS("PseudoNodeType.Params", "paramName"),
    DATA("PseudoNodeType.Data", "baseProperty");

    private final String discriminant;
    private final String keyProperty;

    PseudoNodeType(String discriminant, String keyProperty) {
        this.discriminant = discriminant;
        this.keyProperty = keyProperty;
    }

    @Override
    public NodeType nodeType() {
        return NodeType.PSEUDO;
    }

    @Override
    public String discriminant() {
        return discriminant;
    }

    /// Returns the property name under which the lookup key is stored.
    ///
    /// @return key property name, never null
    public String keyProperty() {
        return keyProperty;
    }
}
