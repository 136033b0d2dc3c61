package io.formengine.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when a value in a node position is not a classifiable object.
public class InvalidNodeException extends AstTransformationException {
    @Serial private static final long serialVersionUID = -1672208911467304655L;

    private final String expected;
    private final String actual;

    public InvalidNodeException(String expected, String actual, List<Object> path) {
        super("Invalid node: expected " + expected + ", got " + actual, path);
        this.expected = expected;
        this.actual = actual;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
