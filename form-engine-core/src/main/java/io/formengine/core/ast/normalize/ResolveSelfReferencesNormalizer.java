package io.formengine.core.ast.normalize;

import io.formengine.core.ast.node.BlockNode;
import io.formengine.core.ast.node.BlockType;
import io.formengine.core.ast.node.ExpressionNode;
import io.formengine.core.ast.node.ExpressionType;
import io.formengine.core.ast.node.Node;
import io.formengine.core.exception.InvalidNodeException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Replaces the `@self` segment of `answers.@self` references with the enclosing field code.
///
/// The nearest field block among the reference's ancestors supplies the code. An expression
/// code is cloned with fresh ids, so the same subtree never appears twice in the graph.
///
/// ### Contracts
/// - **Precondition**: every `answers.@self` reference sits inside a field block
/// - **Precondition**: that field has a `code`
/// - **Precondition**: the reference is not part of the field's own `code`
///
/// A violated precondition raises {@link InvalidNodeException} at the reference's path.
public final class ResolveSelfReferencesNormalizer extends RewritingNormalizer {

    private final NodeCloner cloner;

    public ResolveSelfReferencesNormalizer(NodeCloner cloner) {
        this.cloner = Objects.requireNonNull(cloner, "Node cloner required");
    }

    @Override
    protected Node rewrite(Node node, RewriteContext context) {
        if (!(node instanceof ExpressionNode reference)
                || reference.getExpressionType() != ExpressionType.REFERENCE) {
            return node;
        }
        List<Object> path = reference.getReferencePath();
        if (path.size() < 2
                || !"answers".equals(path.get(0))
                || !AddSelfValueToFieldsNormalizer.SELF.equals(path.get(1))) {
            return node;
        }

        BlockNode field = nearestField(context);
        if (field == null) {
            throw new InvalidNodeException(
                    "inside FieldBlock", "no containing field", context.path());
        }
        Object code = field.getProperty("code");
        if (code == null) {
            throw new InvalidNodeException(
                    "field.properties[\"code\"]", "undefined", context.path());
        }
        if ("code".equals(context.propertyUnder(field))) {
            throw new InvalidNodeException(
                    "code without Self()", "Self() in code", context.path());
        }

        List<Object> resolved = new ArrayList<>(path);
        resolved.set(1, cloner.cloneValue(code));
        Map<String, Object> properties = new LinkedHashMap<>(reference.getProperties());
        properties.put("path", resolved);
        return reference.withProperties(properties);
    }

    private static BlockNode nearestField(RewriteContext context) {
        List<Node> ancestors = context.ancestors();
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            if (ancestors.get(i) instanceof BlockNode block
                    && block.getBlockType() == BlockType.FIELD) {
                return block;
            }
        }
        return null;
    }
}
