package io.formengine.core.ast.normalize;

import io.formengine.core.ast.node.Node;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Base for passes that rewrite single nodes.
///
/// The walk is post-order: a node's properties are rewritten first, at any depth inside
/// lists and plain maps, then {@link #rewrite} sees the node rebuilt with those results.
/// Unchanged containers and nodes are kept as the same instances.
///
/// @implNote Stateless between calls; each walk keeps its own path and ancestor stacks.
public abstract class RewritingNormalizer implements AstNormalizer {

    @Override
    public final Node normalize(Node root) {
        Objects.requireNonNull(root, "Root node required");
        return rewriteNode(root, new ArrayList<>(), new ArrayList<>(), new ArrayList<>());
    }

    /// Rewrites a node whose properties have already been normalized.
    ///
    /// @param node node to rewrite, not null
    /// @param context position of the node, not null
    /// @return replacement node, or `node` itself to keep it, never null
    protected abstract Node rewrite(Node node, RewriteContext context);

    private Node rewriteNode(
            Node node, List<Object> path, List<Node> ancestors, List<String> via) {
        RewriteContext context =
                new RewriteContext(List.copyOf(path), List.copyOf(ancestors), List.copyOf(via));

        Map<String, Object> properties = new LinkedHashMap<>();
        boolean changed = false;
        ancestors.add(node);
        try {
            for (Map.Entry<String, Object> property : node.getProperties().entrySet()) {
                path.add(property.getKey());
                via.add(property.getKey());
                Object value = rewriteValue(property.getValue(), path, ancestors, via);
                via.remove(via.size() - 1);
                path.remove(path.size() - 1);
                changed |= value != property.getValue();
                properties.put(property.getKey(), value);
            }
        } finally {
            ancestors.remove(ancestors.size() - 1);
        }

        return rewrite(changed ? node.withProperties(properties) : node, context);
    }

    private Object rewriteValue(
            Object value, List<Object> path, List<Node> ancestors, List<String> via) {
        if (value instanceof Node child) {
            return rewriteNode(child, path, ancestors, via);
        }
        if (value instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            boolean changed = false;
            for (int i = 0; i < list.size(); i++) {
                path.add(i);
                Object item = rewriteValue(list.get(i), path, ancestors, via);
                path.remove(path.size() - 1);
                changed |= item != list.get(i);
                result.add(item);
            }
            return changed ? result : value;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            boolean changed = false;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                path.add(key);
                Object item = rewriteValue(entry.getValue(), path, ancestors, via);
                path.remove(path.size() - 1);
                changed |= item != entry.getValue();
                result.put(key, item);
            }
            return changed ? result : value;
        }
        return value;
    }
}
