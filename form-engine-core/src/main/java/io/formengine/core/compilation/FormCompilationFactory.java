package io.formengine.core.compilation;

import io.formengine.core.FormEngineConfig;
import java.util.Map;
import java.util.Objects;

/// Creates {@link FormInstance}s from raw form definitions.
///
/// ### Usage
/// {@snippet :
/// FormCompilationFactory factory = FormCompilationFactory.builder()
///     .config(FormEngineConfig.builder().eagerStepCompilation(true).build())
///     .listener(listener)
///     .build();
/// FormInstance form = factory.createInstance(definition);
/// CompiledStep step = form.compileStep(form.getStepIds().get(0));
/// }
///
/// @implNote Stateless apart from its configuration; one factory may create any number of
/// instances from any thread.
///
/// @see Builder
public final class FormCompilationFactory {

    private final FormEngineConfig config;
    private final CompilationListener listener;

    private FormCompilationFactory(Builder builder) {
        this.config = builder.config;
        this.listener = builder.listener;
    }

    /// Creates a factory with default configuration and no listener.
    public FormCompilationFactory() {
        this(new Builder());
    }

    /// Compiles a raw definition into a new form instance.
    ///
    /// @param rawDefinition raw journey definition, not null
    /// @return instance whose shared compilation has completed, never null
    /// @throws io.formengine.core.exception.AstTransformationException if the definition is
    ///     malformed
    /// @throws io.formengine.core.exception.DuplicateNodeIdException if node ids collide
    public FormInstance createInstance(Map<String, Object> rawDefinition) {
        return new FormInstance(rawDefinition, config, listener);
    }

    public FormEngineConfig getConfig() {
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link FormCompilationFactory}.
    public static final class Builder {
        private FormEngineConfig config = new FormEngineConfig();
        private CompilationListener listener = CompilationListener.NONE;

        private Builder() {}

        public Builder config(FormEngineConfig config) {
            this.config = Objects.requireNonNull(config, "Config required");
            return this;
        }

        public Builder listener(CompilationListener listener) {
            this.listener = Objects.requireNonNull(listener, "Listener required");
            return this;
        }

        public FormCompilationFactory build() {
            return new FormCompilationFactory(this);
        }
    }
}
