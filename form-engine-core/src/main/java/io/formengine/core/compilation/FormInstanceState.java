package io.formengine.core.compilation;

/// Lifecycle state of a {@link FormInstance}.
///
/// An instance is never observable before its shared compilation completes, so there is no
/// uninitialized state.
public enum FormInstanceState {
    /// Shared artefact built; some steps are not compiled yet.
    SHARED_READY,
    /// Every step of the form has a cached artefact.
    STEPS_COMPILED
}
