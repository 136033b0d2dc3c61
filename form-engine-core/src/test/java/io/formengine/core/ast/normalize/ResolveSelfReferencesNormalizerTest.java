package io.formengine.core.ast.normalize;

import static io.formengine.core.FormDefinitions.answer;
import static io.formengine.core.FormDefinitions.block;
import static io.formengine.core.FormDefinitions.function;
import static io.formengine.core.FormDefinitions.reference;
import static io.formengine.core.FormDefinitions.step;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formengine.core.ast.id.NodeIdCategory;
import io.formengine.core.ast.id.NodeIdGenerator;
import io.formengine.core.ast.node.BlockNode;
import io.formengine.core.ast.node.ExpressionNode;
import io.formengine.core.ast.node.Node;
import io.formengine.core.ast.transform.AstTransformer;
import io.formengine.core.exception.InvalidNodeException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ResolveSelfReferencesNormalizerTest {

    private NodeIdGenerator idGenerator;
    private ResolveSelfReferencesNormalizer normalizer;

    @BeforeEach
    void setUp() {
        idGenerator = new NodeIdGenerator();
        normalizer =
                new ResolveSelfReferencesNormalizer(
                        new NodeCloner(idGenerator, NodeIdCategory.COMPILE_AST));
    }

    private Node transform(Map<String, Object> definition) {
        return new AstTransformer(idGenerator).transform(definition);
    }

    private static Map<String, Object> self() {
        return reference("answers", "@self");
    }

    @Nested
    class ResolutionTest {

        @Test
        void shouldReplaceSelfWithLiteralFieldCode() {
            // Given
            BlockNode field =
                    (BlockNode) transform(block("govukInput", "code", "email", "hint", self()));
            ExpressionNode before = (ExpressionNode) field.getProperty("hint");

            // When
            BlockNode normalized = (BlockNode) normalizer.normalize(field);

            // Then
            ExpressionNode hint = (ExpressionNode) normalized.getProperty("hint");
            assertThat(hint.getReferencePath()).containsExactly("answers", "email");
            assertThat(hint.getId()).isEqualTo(before.getId());
            assertThat(normalized.getId()).isEqualTo(field.getId());
        }

        @Test
        void shouldCloneExpressionCodeWithFreshIds() {
            // Given
            BlockNode field =
                    (BlockNode)
                            transform(
                                    block(
                                            "govukInput",
                                            "code",
                                            function("Transformer", "concat", "item_", "1"),
                                            "hint",
                                            self()));
            ExpressionNode code = (ExpressionNode) field.getProperty("code");

            // When
            BlockNode normalized = (BlockNode) normalizer.normalize(field);

            // Then
            List<Object> path =
                    ((ExpressionNode) normalized.getProperty("hint")).getReferencePath();
            assertThat(path.get(1)).isEqualTo(code).isNotSameAs(code);
            assertThat(((Node) path.get(1)).getId()).isNotEqualTo(code.getId());
            assertThat(normalized.getProperty("code")).isSameAs(code);
        }

        @Test
        void shouldUseNearestEnclosingField() {
            // Given
            Node composite =
                    transform(
                            block(
                                    "govukInput",
                                    "code",
                                    "outer",
                                    "conditional",
                                    block("govukInput", "code", "inner", "hint", self())));

            // When
            Node normalized = normalizer.normalize(composite);

            // Then
            BlockNode inner = (BlockNode) normalized.getProperty("conditional");
            assertThat(((ExpressionNode) inner.getProperty("hint")).getReferencePath())
                    .containsExactly("answers", "inner");
        }

        @Test
        void shouldReturnSameGraphWhenNothingToResolve() {
            // Given
            Node root = transform(step("/one", block("html", "content", answer("email"))));

            // When / Then
            assertThat(normalizer.normalize(root)).isSameAs(root);
        }
    }

    @Nested
    class RejectionTest {

        @Test
        void shouldRejectSelfOutsideField() {
            // Given
            Node root = transform(step("/one", block("html", "content", self())));

            // When / Then
            assertThatThrownBy(() -> normalizer.normalize(root))
                    .isInstanceOfSatisfying(
                            InvalidNodeException.class,
                            e -> {
                                assertThat(e.getExpected()).isEqualTo("inside FieldBlock");
                                assertThat(e.getActual()).isEqualTo("no containing field");
                                assertThat(e.getPath()).containsExactly("blocks", 0, "content");
                            });
        }

        @Test
        void shouldRejectFieldWithoutCode() {
            // Given
            Node field = transform(block("govukInput", "code", null, "hint", self()));

            // When / Then
            assertThatThrownBy(() -> normalizer.normalize(field))
                    .isInstanceOf(InvalidNodeException.class)
                    .hasMessageContaining("field.properties[\"code\"]")
                    .hasMessageContaining("undefined");
        }

        @Test
        void shouldRejectSelfInsideFieldsOwnCode() {
            // Given
            Node field =
                    transform(
                            block(
                                    "govukInput",
                                    "code",
                                    function("Transformer", "upper", self())));

            // When / Then
            assertThatThrownBy(() -> normalizer.normalize(field))
                    .isInstanceOf(InvalidNodeException.class)
                    .hasMessageContaining("code without Self()")
                    .hasMessageContaining("Self() in code");
        }
    }
}
