package io.formengine.core.compilation.pseudo;

import io.formengine.core.ast.id.NodeIdCategory;
import io.formengine.core.ast.id.NodeIdGenerator;
import io.formengine.core.ast.node.PseudoNode;
import io.formengine.core.ast.node.PseudoNodeType;
import java.util.Map;
import java.util.Objects;

/// Creates pseudo-nodes with ids from a shared {@link NodeIdGenerator}.
///
/// Compilation uses `COMPILE_PSEUDO` ids; request overlays use `RUNTIME_PSEUDO`.
public final class PseudoNodeFactory {

    private final NodeIdGenerator idGenerator;
    private final NodeIdCategory idCategory;

    public PseudoNodeFactory(NodeIdGenerator idGenerator) {
        this(idGenerator, NodeIdCategory.COMPILE_PSEUDO);
    }

    public PseudoNodeFactory(NodeIdGenerator idGenerator, NodeIdCategory idCategory) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "ID generator required");
        this.idCategory = Objects.requireNonNull(idCategory, "ID category required");
    }

    private PseudoNode create(PseudoNodeType type, String key) {
        return PseudoNode.of(idGenerator.next(idCategory), type, key, Map.of());
    }

    /// Creates the submitted-value node of a field on the current step.
    ///
    /// @param fieldCode field code, not null
    /// @return new, unregistered pseudo-node, never null
    public PseudoNode createPost(String fieldCode) {
        return create(PseudoNodeType.POST, fieldCode);
    }

    /// Creates the answer node of a field on the current step.
    ///
    /// @param fieldCode field code, not null
    /// @param fieldNodeId id of the field block, may be null when unknown
    /// @return new, unregistered pseudo-node, never null
    public PseudoNode createAnswerLocal(String fieldCode, String fieldNodeId) {
        if (fieldNodeId == null) {
            return create(PseudoNodeType.ANSWER_LOCAL, fieldCode);
        }
        return PseudoNode.of(
                idGenerator.next(idCategory),
                PseudoNodeType.ANSWER_LOCAL,
                fieldCode,
                Map.of("fieldNodeId", fieldNodeId));
    }

    /// Creates the answer node of a field owned by another step.
    ///
    /// @param fieldCode field code, not null
    /// @return new, unregistered pseudo-node, never null
    public PseudoNode createAnswerRemote(String fieldCode) {
        return create(PseudoNodeType.ANSWER_REMOTE, fieldCode);
    }

    public PseudoNode createQuery(String paramName) {
        return create(PseudoNodeType.QUERY, paramName);
    }

    public PseudoNode createParams(String paramName) {
        return create(PseudoNodeType.PARAMS, paramName);
    }

    public PseudoNode createData(String baseProperty) {
        return create(PseudoNodeType.DATA, baseProperty);
    }
}
