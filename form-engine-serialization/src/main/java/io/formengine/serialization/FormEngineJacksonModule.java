package io.formengine.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.formengine.core.ast.node.Node;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the form engine type handlers.
///
/// - `Node` and all subtypes: {@link NodeSerializer}, discriminators `"nodeType"` and
///   `"kind"`
///
/// Nodes are written for diagnostics only; there is no deserializer. Definitions are read
/// as raw trees by {@link FormDefinitionReader} and compiled again.
///
/// @see CompiledGraphWriter for the convenience factory API
public class FormEngineJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4127305521937786604L;

    public FormEngineJacksonModule() {
        super("FormEngineJacksonModule");

        addSerializer(Node.class, new NodeSerializer());
    }
}
