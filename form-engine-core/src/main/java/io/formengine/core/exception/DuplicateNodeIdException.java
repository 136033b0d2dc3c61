package io.formengine.core.exception;

import java.io.Serial;

/// Thrown when a node id is registered twice.
///
/// Always a programming error in id generation, never caused by user input.
public class DuplicateNodeIdException extends RuntimeException {
    @Serial private static final long serialVersionUID = -6170413580722384522L;

    private final String nodeId;

    public DuplicateNodeIdException(String nodeId) {
        super("Node with ID \"" + nodeId + "\" is already registered");
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
