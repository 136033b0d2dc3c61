package io.formengine.core.ast.normalize;

import io.formengine.core.ast.node.BlockNode;
import io.formengine.core.ast.node.BlockType;
import io.formengine.core.ast.node.ExpressionNode;
import io.formengine.core.ast.node.ExpressionType;
import io.formengine.core.ast.node.Node;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Copies a field's code onto the validation expressions in its `validate` list.
///
/// Each validation then knows which field an error belongs to, as `blockCode`. A literal code
/// is copied as is; an expression code is cloned with fresh ids. Validations that already
/// carry a `blockCode` are left alone.
public final class AttachValidationBlockCodeNormalizer extends RewritingNormalizer {

    private final NodeCloner cloner;

    public AttachValidationBlockCodeNormalizer(NodeCloner cloner) {
        this.cloner = Objects.requireNonNull(cloner, "Node cloner required");
    }

    @Override
    protected Node rewrite(Node node, RewriteContext context) {
        if (!(node instanceof BlockNode block)
                || block.getBlockType() != BlockType.FIELD
                || block.getProperty("code") == null
                || !(block.getProperty("validate") instanceof List<?> validate)) {
            return node;
        }

        List<Object> attached = new ArrayList<>(validate.size());
        boolean changed = false;
        for (Object item : validate) {
            if (item instanceof ExpressionNode validation
                    && validation.getExpressionType() == ExpressionType.VALIDATION
                    && !validation.hasProperty("blockCode")) {
                Map<String, Object> properties = new LinkedHashMap<>(validation.getProperties());
                properties.put("blockCode", cloner.cloneValue(block.getProperty("code")));
                attached.add(validation.withProperties(properties));
                changed = true;
            } else {
                attached.add(item);
            }
        }
        if (!changed) {
            return node;
        }

        Map<String, Object> properties = new LinkedHashMap<>(block.getProperties());
        properties.put("validate", attached);
        return block.withProperties(properties);
    }
}
