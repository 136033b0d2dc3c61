package io.formengine.core.ast.node;

import java.util.Map;
import java.util.Objects;

/// A lifecycle transition attached to a journey or step.
public final class TransitionNode extends Node {

    private final TransitionType transitionType;

    public TransitionNode(
            String id, TransitionType transitionType, Map<String, Object> properties, Object raw) {
        super(id, properties, raw);
        this.transitionType = Objects.requireNonNull(transitionType, "Transition type required");
    }

    @Override
    public TransitionNode rebuild(String id, Map<String, Object> properties) {
        return new TransitionNode(id, transitionType, properties, getRaw());
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.TRANSITION;
    }

    @Override
    public NodeKind getKind() {
        return transitionType;
    }

    public TransitionType getTransitionType() {
        return transitionType;
    }
}
