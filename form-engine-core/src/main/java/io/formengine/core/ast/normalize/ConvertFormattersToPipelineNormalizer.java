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

/// Turns a field's `formatters` list into a `formatPipeline` over the submitted value.
///
/// The pipeline input is the reference `post.<code>` and its steps are the formatter
/// expressions, in order. The `formatters` property is removed. Fields without formatters,
/// or with an empty list, are left unchanged.
public final class ConvertFormattersToPipelineNormalizer extends RewritingNormalizer {

    private final NodeCloner cloner;

    public ConvertFormattersToPipelineNormalizer(NodeCloner cloner) {
        this.cloner = Objects.requireNonNull(cloner, "Node cloner required");
    }

    @Override
    protected Node rewrite(Node node, RewriteContext context) {
        if (!(node instanceof BlockNode block)
                || block.getBlockType() != BlockType.FIELD
                || block.getProperty("code") == null
                || !(block.getProperty("formatters") instanceof List<?> formatters)
                || formatters.isEmpty()) {
            return node;
        }

        ExpressionNode input =
                new ExpressionNode(
                        cloner.nextId(),
                        ExpressionType.REFERENCE,
                        Map.of(
                                "path",
                                List.of("post", cloner.cloneValue(block.getProperty("code")))),
                        null);
        Map<String, Object> pipeline = new LinkedHashMap<>();
        pipeline.put("input", input);
        pipeline.put("steps", formatters);

        Map<String, Object> properties = new LinkedHashMap<>(block.getProperties());
        properties.remove("formatters");
        properties.put(
                "formatPipeline",
                new ExpressionNode(cloner.nextId(), ExpressionType.PIPELINE, pipeline, null));
        return block.withProperties(properties);
    }
}
