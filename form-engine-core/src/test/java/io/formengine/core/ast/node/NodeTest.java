package io.formengine.core.ast.node;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class NodeTest {

    @Nested
    class ImmutabilityTest {

        @Test
        void shouldCopyPropertiesOnConstruction() {
            // Given
            List<Object> path = new ArrayList<>(List.of("answers", "email"));
            Map<String, Object> properties = new LinkedHashMap<>();
            properties.put("path", path);

            // When
            ExpressionNode node =
                    new ExpressionNode("compile_ast:1", ExpressionType.REFERENCE, properties, null);
            path.add("extra");
            properties.put("other", "value");

            // Then
            assertThat(node.getReferencePath()).containsExactly("answers", "email");
            assertThat(node.hasProperty("other")).isFalse();
        }

        @Test
        void shouldRejectMutationOfNestedCollections() {
            // Given
            Map<String, Object> nested = new LinkedHashMap<>();
            nested.put("items", new ArrayList<>(List.of("a")));
            BlockNode node =
                    new BlockNode(
                            "compile_ast:1",
                            "govukRadios",
                            BlockType.BASIC,
                            Map.of("options", nested),
                            null);

            // When
            @SuppressWarnings("unchecked")
            Map<String, Object> options = (Map<String, Object>) node.getProperty("options");
            @SuppressWarnings("unchecked")
            List<Object> items = (List<Object>) options.get("items");

            // Then
            assertThatThrownBy(() -> options.put("x", 1))
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> items.add("b"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    class EqualityTest {

        @Test
        void shouldIgnoreIdInEquality() {
            // Given
            Map<String, Object> properties = Map.of("path", List.of("query", "ref"));

            // When
            ExpressionNode first =
                    new ExpressionNode("compile_ast:1", ExpressionType.REFERENCE, properties, null);
            ExpressionNode second =
                    new ExpressionNode("compile_ast:2", ExpressionType.REFERENCE, properties, null);

            // Then
            assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
            assertThat(first.getId()).isNotEqualTo(second.getId());
        }

        @Test
        void shouldDistinguishKinds() {
            // Given
            Map<String, Object> properties = Map.of("name", "isEmail", "arguments", List.of());

            // When
            ExpressionNode condition =
                    new ExpressionNode(
                            "compile_ast:1", ExpressionType.FUNCTION_CONDITION, properties, null);
            ExpressionNode effect =
                    new ExpressionNode(
                            "compile_ast:2", ExpressionType.FUNCTION_EFFECT, properties, null);

            // Then
            assertThat(condition).isNotEqualTo(effect);
        }

        @Test
        void shouldDistinguishBlockVariants() {
            // Given
            BlockNode input =
                    new BlockNode("a", "govukInput", BlockType.FIELD, Map.of("code", "x"), null);
            BlockNode textarea =
                    new BlockNode("b", "govukTextarea", BlockType.FIELD, Map.of("code", "x"), null);

            // Then
            assertThat(input).isNotEqualTo(textarea);
        }
    }

    @Nested
    class PseudoNodeTest {

        @Test
        void shouldStoreKeyUnderTypeSpecificProperty() {
            // When
            PseudoNode query = PseudoNode.of("p:1", PseudoNodeType.QUERY, "ref", Map.of());
            PseudoNode data = PseudoNode.of("p:2", PseudoNodeType.DATA, "user", Map.of());
            PseudoNode local =
                    PseudoNode.of(
                            "p:3",
                            PseudoNodeType.ANSWER_LOCAL,
                            "email",
                            Map.of("fieldNodeId", "compile_ast:7"));

            // Then
            assertThat(query.getProperty("paramName")).isEqualTo("ref");
            assertThat(data.getProperty("baseProperty")).isEqualTo("user");
            assertThat(local.getProperty("baseFieldCode")).isEqualTo("email");
            assertThat(local.getFieldNodeId()).isEqualTo("compile_ast:7");
            assertThat(query.getFieldNodeId()).isNull();
            assertThat(local.getNodeType()).isEqualTo(NodeType.PSEUDO);
            assertThat(local.getKind().discriminant()).isEqualTo("PseudoNodeType.AnswerLocal");
        }
    }
}
