package io.formengine.core.exception;

import java.io.Serial;

public class MissingStepException extends RuntimeException {
    @Serial private static final long serialVersionUID = 5521906344152207183L;

    private final String stepId;

    public MissingStepException(String stepId) {
        super("Step not found: " + stepId);
        this.stepId = stepId;
    }

    public String getStepId() {
        return stepId;
    }
}
