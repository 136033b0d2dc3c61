package io.formengine.core.compilation.pseudo;

/// Which pseudo-nodes a synthesis pass may create.
public enum SynthesisScope {
    /// Step-independent sources: query, params, data and post from references.
    GLOBAL,
    /// Everything that depends on the compiled step: field answers and post values of the
    /// step's fields, and remote answers for referenced fields not on the step.
    STEP
}
