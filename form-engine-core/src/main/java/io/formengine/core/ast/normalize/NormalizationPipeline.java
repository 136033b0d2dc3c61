package io.formengine.core.ast.normalize;

import io.formengine.core.ast.id.NodeIdCategory;
import io.formengine.core.ast.id.NodeIdGenerator;
import io.formengine.core.ast.node.Node;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Runs the normalization passes in their required order.
///
/// 1. {@link AddSelfValueToFieldsNormalizer}
/// 2. {@link AttachValidationBlockCodeNormalizer}
/// 3. {@link ConvertFormattersToPipelineNormalizer}
/// 4. {@link ResolveSelfReferencesNormalizer}
///
/// Self references are resolved last, so the ones added by the first pass are covered.
public final class NormalizationPipeline implements AstNormalizer {

    private static final Logger logger = Logger.getLogger(NormalizationPipeline.class.getName());

    private final List<AstNormalizer> normalizers;

    private NormalizationPipeline(List<AstNormalizer> normalizers) {
        this.normalizers = List.copyOf(normalizers);
    }

    /// Creates the standard pipeline.
    ///
    /// @param idGenerator shared id source, not null
    /// @param idCategory `COMPILE_AST` or `RUNTIME_AST`, not null
    /// @return pipeline, never null
    public static NormalizationPipeline standard(
            NodeIdGenerator idGenerator, NodeIdCategory idCategory) {
        NodeCloner cloner = new NodeCloner(idGenerator, idCategory);
        return new NormalizationPipeline(
                List.of(
                        new AddSelfValueToFieldsNormalizer(cloner),
                        new AttachValidationBlockCodeNormalizer(cloner),
                        new ConvertFormattersToPipelineNormalizer(cloner),
                        new ResolveSelfReferencesNormalizer(cloner)));
    }

    @Override
    public Node normalize(Node root) {
        Objects.requireNonNull(root, "Root node required");
        Node current = root;
        for (AstNormalizer normalizer : normalizers) {
            current = normalizer.normalize(current);
        }
        Node normalized = current;
        logger.fine(() -> "Normalized " + normalized);
        return normalized;
    }
}
