package io.formengine.core.ast.normalize;

import static io.formengine.core.FormDefinitions.block;
import static io.formengine.core.FormDefinitions.function;
import static io.formengine.core.FormDefinitions.journey;
import static io.formengine.core.FormDefinitions.list;
import static io.formengine.core.FormDefinitions.step;
import static io.formengine.core.FormDefinitions.validation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import io.formengine.core.ast.id.NodeIdCategory;
import io.formengine.core.ast.id.NodeIdGenerator;
import io.formengine.core.ast.node.BlockNode;
import io.formengine.core.ast.node.BlockType;
import io.formengine.core.ast.node.ExpressionNode;
import io.formengine.core.ast.node.Node;
import io.formengine.core.ast.registry.NodeRegistry;
import io.formengine.core.ast.transform.AstTransformer;
import io.formengine.core.ast.traverse.RegistrationTraverser;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NormalizationPipelineTest {

    private NodeIdGenerator idGenerator;
    private Node root;

    @BeforeEach
    void setUp() {
        idGenerator = new NodeIdGenerator();
        root =
                new AstTransformer(idGenerator)
                        .transform(
                                journey(
                                        "apply",
                                        "/apply",
                                        step(
                                                "/postcode",
                                                block(
                                                        "govukInput",
                                                        "code",
                                                        function(
                                                                "Transformer",
                                                                "concat",
                                                                "address_",
                                                                "postcode"),
                                                        "formatters",
                                                        list(function("Transformer", "trim")),
                                                        "validate",
                                                        list(validation(null, "Required"))))));
    }

    private static BlockNode onlyField(NodeRegistry registry) {
        return registry.findByType(BlockType.FIELD, BlockNode.class).get(0);
    }

    @Test
    void shouldApplyEveryPassToField() {
        // When
        Node normalized =
                NormalizationPipeline.standard(idGenerator, NodeIdCategory.COMPILE_AST)
                        .normalize(root);

        // Then
        NodeRegistry registry = new NodeRegistry();
        RegistrationTraverser.register(normalized, registry);
        BlockNode field = onlyField(registry);
        Node code = (Node) field.getProperty("code");

        ExpressionNode value = (ExpressionNode) field.getProperty("value");
        assertThat(value.getReferencePath().get(0)).isEqualTo("answers");
        assertThat(value.getReferencePath().get(1)).isEqualTo(code).isNotSameAs(code);

        ExpressionNode pipeline = (ExpressionNode) field.getProperty("formatPipeline");
        ExpressionNode input = (ExpressionNode) pipeline.getProperty("input");
        assertThat(input.getReferencePath().get(1)).isEqualTo(code);
        assertThat(field.hasProperty("formatters")).isFalse();

        ExpressionNode rule =
                (ExpressionNode) ((List<?>) field.getProperty("validate")).get(0);
        assertThat(rule.getProperty("blockCode")).isEqualTo(code);
    }

    @Test
    void shouldKeepNodeIdsUniqueAcrossGraph() {
        // Given
        Node normalized =
                NormalizationPipeline.standard(idGenerator, NodeIdCategory.COMPILE_AST)
                        .normalize(root);
        NodeRegistry registry = new NodeRegistry();

        // When / Then
        assertThatCode(() -> RegistrationTraverser.register(normalized, registry))
                .doesNotThrowAnyException();
        assertThat(normalized.getId()).isEqualTo(root.getId());
    }
}
