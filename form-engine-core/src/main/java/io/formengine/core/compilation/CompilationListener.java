package io.formengine.core.compilation;

/// Listener for form compilation lifecycle events.
///
/// All methods have default no-op implementations, allowing listeners to override only
/// the events they care about.
///
/// @implNote Step callbacks may arrive from several threads at once when steps are first
/// requested concurrently. A callback runs while the step's cache slot is being computed,
/// so it must not call back into the same {@link FormInstance}.
public interface CompilationListener {

    /// Listener that ignores every event.
    CompilationListener NONE = new CompilationListener() {};

    /// Called once the shared compilation of a form instance is complete.
    ///
    /// @param shared the shared artefact, not null
    default void onSharedCompiled(SharedCompilation shared) {}

    /// Called once per step, when its artefact is first computed.
    ///
    /// @param step the compiled step, not null
    default void onStepCompiled(CompiledStep step) {}
}
