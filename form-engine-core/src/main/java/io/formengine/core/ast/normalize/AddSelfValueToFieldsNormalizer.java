package io.formengine.core.ast.normalize;

import io.formengine.core.ast.node.BlockNode;
import io.formengine.core.ast.node.BlockType;
import io.formengine.core.ast.node.ExpressionNode;
import io.formengine.core.ast.node.ExpressionType;
import io.formengine.core.ast.node.Node;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Gives every field block without a `value` the reference `answers.@self`.
///
/// A field then reads back its own answer by default. The `@self` segment is resolved to
/// the field code by {@link ResolveSelfReferencesNormalizer}, which must run afterwards.
public final class AddSelfValueToFieldsNormalizer extends RewritingNormalizer {

    /// Placeholder segment standing for the code of the enclosing field.
    public static final String SELF = "@self";

    private final NodeCloner cloner;

    public AddSelfValueToFieldsNormalizer(NodeCloner cloner) {
        this.cloner = Objects.requireNonNull(cloner, "Node cloner required");
    }

    @Override
    protected Node rewrite(Node node, RewriteContext context) {
        if (!(node instanceof BlockNode block)
                || block.getBlockType() != BlockType.FIELD
                || block.hasProperty("value")) {
            return node;
        }
        Map<String, Object> properties = new LinkedHashMap<>(block.getProperties());
        properties.put("value", selfReference());
        return block.withProperties(properties);
    }

    private ExpressionNode selfReference() {
        return new ExpressionNode(
                cloner.nextId(),
                ExpressionType.REFERENCE,
                Map.of("path", List.of("answers", SELF)),
                null);
    }
}
