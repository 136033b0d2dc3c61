package io.formengine.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.formengine.core.compilation.FormCompilationFactory;
import io.formengine.core.compilation.FormInstance;
import io.formengine.core.exception.InvalidNodeException;
import java.io.IOException;
import java.io.Reader;
import java.util.List;
import java.util.Map;

/// Reads JSON form definitions into the raw tree the compiler consumes.
///
/// The result is made of `LinkedHashMap`, `ArrayList` and JSON scalars, keeping the key
/// order of the source document.
///
/// ### Usage
/// {@snippet :
/// Map<String, Object> definition = FormDefinitionReader.read(json);
/// FormInstance form = FormDefinitionReader.createInstance(factory, json);
/// }
///
/// @implNote Thread-safe. A mapper is created per call via {@link #createMapper()}.
public final class FormDefinitionReader {

    private static final TypeReference<Map<String, Object>> RAW_TREE = new TypeReference<>() {};

    private FormDefinitionReader() {}

    /// Parses a JSON definition.
    ///
    /// @param json JSON text, not null
    /// @return raw definition tree, never null
    /// @throws InvalidNodeException if the top level is not a JSON object
    /// @throws IllegalArgumentException if the text is not valid JSON
    public static Map<String, Object> read(String json) {
        try {
            return toRawTree(createMapper().readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to read form definition: " + e.getOriginalMessage(), e);
        }
    }

    /// Parses a JSON definition from a reader.
    ///
    /// @param reader source of JSON text, not null; not closed
    /// @return raw definition tree, never null
    /// @throws InvalidNodeException if the top level is not a JSON object
    /// @throws IllegalArgumentException if the text is not valid JSON or cannot be read
    public static Map<String, Object> read(Reader reader) {
        try {
            return toRawTree(createMapper().readTree(reader));
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to read form definition: " + e.getMessage(), e);
        }
    }

    /// Parses a JSON definition and compiles it.
    ///
    /// @param factory compilation factory, not null
    /// @param json JSON text, not null
    /// @return compiled form instance, never null
    public static FormInstance createInstance(FormCompilationFactory factory, String json) {
        return factory.createInstance(read(json));
    }

    /// Creates an ObjectMapper configured for reading definitions.
    ///
    /// Floating point numbers are read as `Double`, integers as the smallest fitting type.
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .disable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    private static Map<String, Object> toRawTree(JsonNode tree) {
        if (tree == null || !tree.isObject()) {
            String actual =
                    tree == null ? "empty document" : tree.getNodeType().name().toLowerCase();
            throw new InvalidNodeException("object", actual, List.of());
        }
        return createMapper().convertValue(tree, RAW_TREE);
    }
}
