package io.formengine.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.formengine.core.compilation.CompiledStep;
import io.formengine.core.compilation.FormCompilationFactory;
import io.formengine.core.compilation.FormInstance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CompiledGraphWriterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private FormInstance form;

    @BeforeEach
    void setUp() {
        form =
                FormDefinitionReader.createInstance(
                        new FormCompilationFactory(), FormDefinitionReaderTest.JOURNEY);
    }

    @Test
    void toJson_nodeWritesFullTree() throws Exception {
        JsonNode root =
                mapper.readTree(CompiledGraphWriter.toJson(form.getSharedCompilation().root()));

        assertThat(root.get("nodeType").asText()).isEqualTo("StructureType.Journey");
        assertThat(root.get("properties").get("code").asText()).isEqualTo("apply");

        JsonNode field = root.at("/properties/steps/0/properties/blocks/0");
        assertThat(field.get("kind").asText()).isEqualTo("field");
        assertThat(field.get("variant").asText()).isEqualTo("govukInput");
        assertThat(field.at("/properties/code").asText()).isEqualTo("email");

        JsonNode reference = root.at("/properties/steps/0/properties/blocks/1/properties/content");
        assertThat(reference.get("kind").asText()).isEqualTo("ExpressionType.Reference");
        assertThat(reference.at("/properties/path/0").asText()).isEqualTo("query");
    }

    @Test
    void toJson_registryWritesEachNodeOnceWithReferences() throws Exception {
        JsonNode registry =
                mapper.readTree(
                        CompiledGraphWriter.toJson(form.getSharedCompilation().nodeRegistry()));

        int size = registry.get("size").asInt();
        assertThat(registry.get("entries")).hasSize(size);

        JsonNode first = registry.at("/entries/0");
        assertThat(first.get("path")).isEmpty();
        assertThat(first.at("/node/properties/steps/0").has("ref")).isTrue();
        assertThat(first.at("/node/properties/steps/0").has("properties")).isFalse();
    }

    @Test
    void toJson_compiledStepWritesScopeAndTiming() throws Exception {
        CompiledStep check = form.compileStep(form.getStepIds().get(1));

        JsonNode document = mapper.readTree(CompiledGraphWriter.toJson(check));

        assertThat(document.get("stepId").asText()).isEqualTo(check.getStepId());
        assertThat(document.get("path").asText()).isEqualTo("/check");
        assertThat(document.get("compiledAt").isTextual()).isTrue();
        assertThat(document.get("createdPseudoNodes")).hasSize(1);
        assertThat(document.get("relevantNodes")).hasSize(check.relevantNodes().size());
        assertThat(document.get("journeyMetadataNodes"))
                .hasSize(check.journeyMetadataNodes().size());
        assertThat(document.at("/metadata/" + check.getStepId() + "/isCurrentStep").asBoolean())
                .isTrue();
    }
}
