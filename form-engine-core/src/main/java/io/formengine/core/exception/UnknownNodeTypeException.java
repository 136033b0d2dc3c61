package io.formengine.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when an object matches none of the known node shapes.
public class UnknownNodeTypeException extends AstTransformationException {
    @Serial private static final long serialVersionUID = 8842160127519322710L;

    public static final List<String> VALID_TYPES =
            List.of("Journey", "Step", "Block", "Expression", "Transition");

    private final String nodeType;

    public UnknownNodeTypeException(String nodeType, List<Object> path) {
        super("Unknown node type '" + nodeType + "', expected one of " + VALID_TYPES, path);
        this.nodeType = nodeType;
    }

    /// Returns the offending `type` value.
    ///
    /// @return raw type, or null if the object had none
    public String getNodeType() {
        return nodeType;
    }
}
