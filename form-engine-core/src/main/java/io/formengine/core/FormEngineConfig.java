package io.formengine.core;

/// Configuration options for form compilation.
///
/// Use the {@link Builder} for fluent configuration or construct directly with setters.
///
/// ### Default Values
/// - `eagerStepCompilation`: `false` (steps compile on first request)
/// - `runtimePseudoNodes`: `true` (request overlays may create pseudo-nodes)
/// - `warnOnUnknownReferenceSource`: `false`
///
/// @implNote **Not thread-safe**. This is a mutable configuration object intended to be
/// configured before passing to {@link io.formengine.core.compilation.FormCompilationFactory}.
/// Do not modify after the factory is built.
///
/// @see Builder
public class FormEngineConfig {
    private boolean eagerStepCompilation = false;
    private boolean runtimePseudoNodes = true;
    private boolean warnOnUnknownReferenceSource = false;

    /// Creates a configuration with default values.
    public FormEngineConfig() {}

    /// Returns whether every step is compiled when a form instance is created.
    ///
    /// @return `true` for eager compilation, `false` to compile steps on first request
    public boolean isEagerStepCompilation() {
        return eagerStepCompilation;
    }

    public void setEagerStepCompilation(boolean eagerStepCompilation) {
        this.eagerStepCompilation = eagerStepCompilation;
    }

    /// Returns whether request overlays may create pseudo-nodes for keys found at runtime.
    ///
    /// When disabled, overlays only look up pseudo-nodes created at compile time.
    ///
    /// @return `true` if runtime creation is allowed
    public boolean isRuntimePseudoNodes() {
        return runtimePseudoNodes;
    }

    public void setRuntimePseudoNodes(boolean runtimePseudoNodes) {
        this.runtimePseudoNodes = runtimePseudoNodes;
    }

    /// Returns whether references with unrecognized source tags are logged at WARNING.
    ///
    /// @return `true` to warn, `false` to log at FINEST only
    public boolean isWarnOnUnknownReferenceSource() {
        return warnOnUnknownReferenceSource;
    }

    public void setWarnOnUnknownReferenceSource(boolean warnOnUnknownReferenceSource) {
        this.warnOnUnknownReferenceSource = warnOnUnknownReferenceSource;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link FormEngineConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final FormEngineConfig config = new FormEngineConfig();

        public Builder eagerStepCompilation(boolean eagerStepCompilation) {
            config.eagerStepCompilation = eagerStepCompilation;
            return this;
        }

        public Builder runtimePseudoNodes(boolean runtimePseudoNodes) {
            config.runtimePseudoNodes = runtimePseudoNodes;
            return this;
        }

        public Builder warnOnUnknownReferenceSource(boolean warnOnUnknownReferenceSource) {
            config.warnOnUnknownReferenceSource = warnOnUnknownReferenceSource;
            return this;
        }

        /// Builds and returns the configured instance.
        ///
        /// @return the configured instance, never null
        public FormEngineConfig build() {
            return config;
        }
    }
}
