package io.formengine.core.ast.transform;

import static io.formengine.core.FormDefinitions.answer;
import static io.formengine.core.FormDefinitions.block;
import static io.formengine.core.FormDefinitions.composite;
import static io.formengine.core.FormDefinitions.condition;
import static io.formengine.core.FormDefinitions.effect;
import static io.formengine.core.FormDefinitions.field;
import static io.formengine.core.FormDefinitions.function;
import static io.formengine.core.FormDefinitions.journey;
import static io.formengine.core.FormDefinitions.list;
import static io.formengine.core.FormDefinitions.map;
import static io.formengine.core.FormDefinitions.predicateTest;
import static io.formengine.core.FormDefinitions.query;
import static io.formengine.core.FormDefinitions.reference;
import static io.formengine.core.FormDefinitions.step;
import static io.formengine.core.FormDefinitions.validation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formengine.core.ast.id.NodeIdCategory;
import io.formengine.core.ast.id.NodeIdGenerator;
import io.formengine.core.ast.node.BlockNode;
import io.formengine.core.ast.node.BlockType;
import io.formengine.core.ast.node.ExpressionNode;
import io.formengine.core.ast.node.ExpressionType;
import io.formengine.core.ast.node.JourneyNode;
import io.formengine.core.ast.node.Node;
import io.formengine.core.ast.node.NodeKind;
import io.formengine.core.ast.node.StepNode;
import io.formengine.core.ast.node.TransitionNode;
import io.formengine.core.ast.node.TransitionType;
import io.formengine.core.exception.AstTransformationException;
import io.formengine.core.exception.InvalidNodeException;
import io.formengine.core.exception.UnknownNodeTypeException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class AstTransformerTest {

    private AstTransformer transformer;

    @BeforeEach
    void setUp() {
        transformer = new AstTransformer(new NodeIdGenerator());
    }

    @Nested
    class StructureTest {

        @Test
        void shouldTransformJourneyWithStepsAndBlocks() {
            // Given
            Map<String, Object> definition =
                    journey("apply", "/apply", step("/name", field("govukInput", "firstName")));

            // When
            Node root = transformer.transform(definition);

            // Then
            assertThat(root).isInstanceOf(JourneyNode.class);
            JourneyNode journey = (JourneyNode) root;
            assertThat(journey.getCode()).isEqualTo("apply");
            assertThat(journey.hasProperty("type")).isFalse();

            List<?> steps = (List<?>) journey.getProperty("steps");
            StepNode step = (StepNode) steps.get(0);
            assertThat(step.getPath()).isEqualTo("/name");

            BlockNode block = (BlockNode) ((List<?>) step.getProperty("blocks")).get(0);
            assertThat(block.getVariant()).isEqualTo("govukInput");
            assertThat(block.getBlockType()).isEqualTo(BlockType.FIELD);
            assertThat(block.hasProperty("variant")).isFalse();
            assertThat(block.getProperty("code")).isEqualTo("firstName");
        }

        @Test
        void shouldClassifyBlocksByShape() {
            // Given
            Map<String, Object> definition =
                    step(
                            "/s",
                            field("govukInput", "a"),
                            block("list", "collection", reference("data", "items")),
                            composite("fieldset", block("html")),
                            block("template", "template", map("x", 1)),
                            block("html", "content", "Hello"));

            // When
            StepNode step = (StepNode) transformer.transform(definition);

            // Then
            assertThat((List<?>) step.getProperty("blocks"))
                    .extracting(b -> ((BlockNode) b).getBlockType())
                    .containsExactly(
                            BlockType.FIELD,
                            BlockType.COLLECTION,
                            BlockType.COMPOSITE,
                            BlockType.COMPOSITE,
                            BlockType.BASIC);
        }

        @Test
        void shouldPreferFieldOverCompositeWhenBothMatch() {
            // Given
            Map<String, Object> definition =
                    block("govukCheckboxes", "code", "choices", "blocks", list(block("html")));

            // When
            BlockNode block = (BlockNode) transformer.transform(definition);

            // Then
            assertThat(block.getBlockType()).isEqualTo(BlockType.FIELD);
        }

        @Test
        void shouldFindNodesNestedInPlainObjects() {
            // Given
            Map<String, Object> definition =
                    block(
                            "govukRadios",
                            "code",
                            "choice",
                            "items",
                            list(map("text", "Yes", "conditional", map("html", answer("name")))));

            // When
            BlockNode block = (BlockNode) transformer.transform(definition);

            // Then
            List<?> items = (List<?>) block.getProperty("items");
            @SuppressWarnings("unchecked")
            Map<String, Object> item = (Map<String, Object>) items.get(0);
            @SuppressWarnings("unchecked")
            Map<String, Object> conditional = (Map<String, Object>) item.get("conditional");
            assertThat(item.get("text")).isEqualTo("Yes");
            assertThat(conditional.get("html")).isInstanceOf(ExpressionNode.class);
        }
    }

    @Nested
    class ExpressionTest {

        @Test
        void shouldKeepLiteralReferenceSegments() {
            // When
            ExpressionNode node =
                    (ExpressionNode) transformer.transform(reference("post", "address.street"));

            // Then
            assertThat(node.getExpressionType()).isEqualTo(ExpressionType.REFERENCE);
            assertThat(node.getReferencePath()).containsExactly("post", "address.street");
        }

        @Test
        void shouldTransformNestedReferenceSegmentsIntoExpressions() {
            // When
            ExpressionNode node =
                    (ExpressionNode) transformer.transform(reference("answers", query("itemId")));

            // Then
            List<Object> segments = node.getReferencePath();
            assertThat(segments).hasSize(2);
            assertThat(segments.get(0)).isEqualTo("answers");
            assertThat(segments.get(1)).isInstanceOf(ExpressionNode.class);
            ExpressionNode nested = (ExpressionNode) segments.get(1);
            assertThat(nested.getExpressionType()).isEqualTo(ExpressionType.REFERENCE);
            assertThat(nested.getReferencePath()).containsExactly("query", "itemId");
            assertThat(nested.getId()).isNotEqualTo(node.getId());
        }

        @Test
        void shouldMapConditionalBranches() {
            // Given
            Map<String, Object> definition =
                    map(
                            "type", "LogicType.Conditional",
                            "predicate", predicateTest(answer("age"), condition("isAdult")),
                            "then", "Adult",
                            "else", answer("fallback"));

            // When
            ExpressionNode node = (ExpressionNode) transformer.transform(definition);

            // Then
            assertThat(node.getExpressionType()).isEqualTo(ExpressionType.CONDITIONAL);
            assertThat(node.getKind().discriminant()).isEqualTo("LogicType.Conditional");
            assertThat(node.getProperty("predicate")).isInstanceOf(ExpressionNode.class);
            assertThat(node.getProperty("thenValue")).isEqualTo("Adult");
            assertThat(node.getProperty("elseValue")).isInstanceOf(ExpressionNode.class);
            assertThat(node.hasProperty("then")).isFalse();
        }

        @Test
        void shouldDefaultValidationMessageToEmpty() {
            // Given
            Map<String, Object> definition = validation(condition("isRequired"), null);

            // When
            ExpressionNode node = (ExpressionNode) transformer.transform(definition);

            // Then
            assertThat(node.getProperty("message")).isEqualTo("");
            assertThat(node.getProperty("when")).isInstanceOf(ExpressionNode.class);
        }

        @Test
        void shouldMapPipelineSteps() {
            // Given
            Map<String, Object> definition =
                    map(
                            "type", "ExpressionType.Pipeline",
                            "input", answer("postcode"),
                            "steps",
                                    list(map("name", "trim"), map("name", "pad", "args", list(8))));

            // When
            ExpressionNode node = (ExpressionNode) transformer.transform(definition);

            // Then
            List<?> steps = (List<?>) node.getProperty("steps");
            Map<?, ?> trim = (Map<?, ?>) steps.get(0);
            Map<?, ?> pad = (Map<?, ?>) steps.get(1);
            assertThat(steps).hasSize(2);
            assertThat(node.getProperty("input")).isInstanceOf(ExpressionNode.class);
            assertThat(trim.get("name")).isEqualTo("trim");
            assertThat(trim.containsKey("args")).isFalse();
            assertThat(pad.get("args")).isEqualTo(List.of(8));
        }

        @Test
        void shouldMapLogicalOperands() {
            // Given
            Map<String, Object> definition =
                    map(
                            "type", "PredicateType.Or",
                            "operands", list(condition("a"), condition("b")));

            // When
            ExpressionNode node = (ExpressionNode) transformer.transform(definition);

            // Then
            assertThat(node.getExpressionType()).isEqualTo(ExpressionType.PREDICATE_OR);
            assertThat((List<?>) node.getProperty("operands"))
                    .allMatch(ExpressionNode.class::isInstance);
        }
    }

    @Nested
    class TransitionTest {

        @Test
        void shouldMapSubmitTransitionWithDefaults() {
            // Given
            Map<String, Object> next =
                    map(
                            "type", "FunctionType.Generator",
                            "name", "goto",
                            "arguments", list("/done"));
            Map<String, Object> definition =
                    map(
                            "type", "TransitionType.Submit",
                            "onValid", map("effects", list(effect("save")), "next", list(next)));

            // When
            TransitionNode node = (TransitionNode) transformer.transform(definition);

            // Then
            assertThat(node.getTransitionType()).isEqualTo(TransitionType.SUBMIT);
            assertThat(node.getProperty("validate")).isEqualTo(true);
            @SuppressWarnings("unchecked")
            Map<String, Object> onValid = (Map<String, Object>) node.getProperty("onValid");
            assertThat((List<?>) onValid.get("effects")).hasSize(1);
            assertThat((List<?>) onValid.get("next")).hasSize(1);
            assertThat(node.hasProperty("onInvalid")).isFalse();
        }

        @Test
        void shouldRespectExplicitValidateFalse() {
            // When
            TransitionNode node =
                    (TransitionNode)
                            transformer.transform(
                                    map("type", "TransitionType.Submit", "validate", false));

            // Then
            assertThat(node.getProperty("validate")).isEqualTo(false);
        }
    }

    @Nested
    class IdentityTest {

        @Test
        void shouldProduceEqualButDistinctNodesForSameInput() {
            // Given
            Map<String, Object> definition = answer("email");

            // When
            Node first = transformer.transform(definition);
            Node second = transformer.transform(definition);

            // Then
            assertThat(first).isEqualTo(second);
            assertThat(first.getId()).isNotEqualTo(second.getId());
        }

        @Test
        void shouldMintRuntimeIdsWhenConfigured() {
            // Given
            AstTransformer runtime =
                    new AstTransformer(new NodeIdGenerator(), NodeIdCategory.RUNTIME_AST);

            // When
            Node node = runtime.transform(answer("email"));

            // Then
            assertThat(node.getId()).startsWith("runtime_ast:");
        }
    }

    @Nested
    class ErrorTest {

        @Test
        void shouldRejectNonObjectRoot() {
            assertThatThrownBy(() -> transformer.transform("journey"))
                    .isInstanceOf(InvalidNodeException.class)
                    .satisfies(
                            e -> {
                                InvalidNodeException error = (InvalidNodeException) e;
                                assertThat(error.getExpected()).isEqualTo("object");
                                assertThat(error.getActual()).isEqualTo("string");
                                assertThat(error.getPath()).isEmpty();
                            });
        }

        @Test
        void shouldReportPathOfUnknownNodeType() {
            // Given
            Map<String, Object> definition =
                    journey(
                            "apply",
                            "/apply",
                            step("/a"),
                            step("/b"),
                            step(
                                    "/c",
                                    block(
                                            "govukInput",
                                            "code",
                                            "email",
                                            "validate",
                                            list(
                                                    validation(condition("isRequired"), "Required"),
                                                    map("type", "ExpressionType.Bogus")))));

            // When / Then
            assertThatThrownBy(() -> transformer.transform(definition))
                    .isInstanceOf(UnknownNodeTypeException.class)
                    .satisfies(
                            e -> {
                                UnknownNodeTypeException error = (UnknownNodeTypeException) e;
                                assertThat(error.getNodeType()).isEqualTo("ExpressionType.Bogus");
                                assertThat(error.getPath())
                                        .containsExactly("steps", 2, "blocks", 0, "validate", 1);
                                assertThat(error.getFormattedPath())
                                        .isEqualTo(
                                                "root → steps[2] → blocks[0] → validate[1]");
                            });
        }

        @Test
        void shouldRejectMalformedNodeInNodePosition() {
            // Given
            Map<String, Object> definition =
                    map("type", "PredicateType.Not", "operand", "not-a-node");

            // When / Then
            assertThatThrownBy(() -> transformer.transform(definition))
                    .isInstanceOf(InvalidNodeException.class)
                    .hasMessageContaining("operand");
        }

        @Test
        void shouldTreatUnnamespacedTypeAsPlainData() {
            // Given
            Map<String, Object> definition = block("html", "options", map("type", "inline"));

            // When
            BlockNode block = (BlockNode) transformer.transform(definition);

            // Then
            assertThat(block.getProperty("options")).isEqualTo(Map.of("type", "inline"));
        }

        @Test
        void shouldShareBaseType() {
            assertThat(new UnknownNodeTypeException("x", List.of()))
                    .isInstanceOf(AstTransformationException.class);
        }
    }

    @Nested
    class KindCoverageTest {

        @ParameterizedTest(name = "{0}")
        @MethodSource("minimalDefinitions")
        void shouldTransformMinimalDefinitionOfEveryKind(
                NodeKind kind, Map<String, Object> definition) {
            // When
            Node first = transformer.transform(definition);
            Node second = transformer.transform(definition);

            // Then
            assertThat(first.getKind()).isEqualTo(kind);
            assertThat(second).isEqualTo(first).isNotSameAs(first);
            assertThat(second.hashCode()).isEqualTo(first.hashCode());
            assertThat(second.getId()).isNotEqualTo(first.getId());
        }

        @Test
        void shouldCoverEveryBlockExpressionAndTransitionKind() {
            // Given
            Set<NodeKind> expected = new HashSet<>();
            expected.addAll(List.of(BlockType.values()));
            expected.addAll(List.of(ExpressionType.values()));
            expected.addAll(List.of(TransitionType.values()));

            // When
            Set<NodeKind> covered = new HashSet<>();
            minimalDefinitions().forEach(arguments -> covered.add((NodeKind) arguments.get()[0]));

            // Then
            assertThat(covered).isEqualTo(expected);
        }

        static Stream<Arguments> minimalDefinitions() {
            return Stream.of(
                    Arguments.of(BlockType.BASIC, block("html")),
                    Arguments.of(BlockType.FIELD, field("govukInput", "email")),
                    Arguments.of(BlockType.COLLECTION, block("list", "collection", list())),
                    Arguments.of(BlockType.COMPOSITE, composite("govukFieldset")),
                    Arguments.of(ExpressionType.REFERENCE, reference("query", "ref")),
                    Arguments.of(
                            ExpressionType.PIPELINE,
                            map(
                                    "type", "ExpressionType.Pipeline",
                                    "input", answer("name"),
                                    "steps", list(map("name", "trim")))),
                    Arguments.of(
                            ExpressionType.CONDITIONAL,
                            map("type", "LogicType.Conditional", "then", "yes")),
                    Arguments.of(
                            ExpressionType.VALIDATION,
                            map("type", "ExpressionType.Validation", "message", "Required")),
                    Arguments.of(
                            ExpressionType.PREDICATE_TEST,
                            predicateTest(answer("age"), condition("isAdult"))),
                    Arguments.of(
                            ExpressionType.PREDICATE_AND,
                            map("type", "PredicateType.And", "operands", list())),
                    Arguments.of(
                            ExpressionType.PREDICATE_OR,
                            map("type", "PredicateType.Or", "operands", list())),
                    Arguments.of(
                            ExpressionType.PREDICATE_XOR,
                            map("type", "PredicateType.Xor", "operands", list())),
                    Arguments.of(
                            ExpressionType.PREDICATE_NOT,
                            map("type", "PredicateType.Not", "operand", condition("isEmpty"))),
                    Arguments.of(ExpressionType.FUNCTION_CONDITION, condition("isEmpty")),
                    Arguments.of(
                            ExpressionType.FUNCTION_TRANSFORMER, function("Transformer", "trim")),
                    Arguments.of(ExpressionType.FUNCTION_EFFECT, effect("save")),
                    Arguments.of(
                            ExpressionType.FUNCTION_GENERATOR, function("Generator", "items")),
                    Arguments.of(
                            TransitionType.LOAD,
                            map("type", "TransitionType.Load", "effects", list())),
                    Arguments.of(TransitionType.ACCESS, map("type", "TransitionType.Access")),
                    Arguments.of(TransitionType.SUBMIT, map("type", "TransitionType.Submit")));
        }
    }
}
