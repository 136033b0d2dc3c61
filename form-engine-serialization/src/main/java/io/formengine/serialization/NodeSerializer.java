package io.formengine.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.formengine.core.ast.node.BlockNode;
import io.formengine.core.ast.node.Node;
import java.io.IOException;
import java.io.Serial;
import java.util.List;
import java.util.Map;

/// Serializes all `Node` subtypes to JSON.
///
/// Every object begins with `"id"`, `"nodeType"` and `"kind"` (the discriminant strings),
/// followed by `"variant"` for blocks and then `"properties"`.
///
/// With the {@link #SHALLOW} writer attribute set to `true`, child nodes inside properties
/// are written as `{"ref": "<id>"}` instead of in full. Registry dumps use this so each
/// node appears exactly once.
///
/// @implNote Package-private. Registered by {@link FormEngineJacksonModule}.
class NodeSerializer extends StdSerializer<Node> {

    @Serial private static final long serialVersionUID = -6093187440125839711L;

    /// Writer attribute selecting reference-only output for child nodes.
    static final String SHALLOW = "formengine.shallowNodes";

    NodeSerializer() {
        super(Node.class);
    }

    @Override
    public void serialize(Node node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        boolean shallow = Boolean.TRUE.equals(provider.getAttribute(SHALLOW));
        writeNode(node, gen, provider, shallow);
    }

    private void writeNode(
            Node node, JsonGenerator gen, SerializerProvider provider, boolean shallow)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", node.getId());
        gen.writeStringField("nodeType", node.getNodeType().discriminant());
        gen.writeStringField("kind", node.getKind().discriminant());
        if (node instanceof BlockNode block) {
            gen.writeStringField("variant", block.getVariant());
        }
        gen.writeFieldName("properties");
        writeValue(node.getProperties(), gen, provider, shallow);
        gen.writeEndObject();
    }

    private void writeValue(
            Object value, JsonGenerator gen, SerializerProvider provider, boolean shallow)
            throws IOException {
        if (value instanceof Node child) {
            if (shallow) {
                gen.writeStartObject();
                gen.writeStringField("ref", child.getId());
                gen.writeEndObject();
            } else {
                writeNode(child, gen, provider, false);
            }
        } else if (value instanceof Map<?, ?> map) {
            gen.writeStartObject();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                gen.writeFieldName(String.valueOf(entry.getKey()));
                writeValue(entry.getValue(), gen, provider, shallow);
            }
            gen.writeEndObject();
        } else if (value instanceof List<?> list) {
            gen.writeStartArray();
            for (Object item : list) {
                writeValue(item, gen, provider, shallow);
            }
            gen.writeEndArray();
        } else {
            provider.defaultSerializeValue(value, gen);
        }
    }
}
