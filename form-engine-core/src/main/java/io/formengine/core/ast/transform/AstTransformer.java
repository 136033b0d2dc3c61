package io.formengine.core.ast.transform;

import io.formengine.core.ast.id.NodeIdCategory;
import io.formengine.core.ast.id.NodeIdGenerator;
import io.formengine.core.ast.node.BlockNode;
import io.formengine.core.ast.node.ExpressionNode;
import io.formengine.core.ast.node.ExpressionType;
import io.formengine.core.ast.node.JourneyNode;
import io.formengine.core.ast.node.Node;
import io.formengine.core.ast.node.StepNode;
import io.formengine.core.ast.node.TransitionNode;
import io.formengine.core.ast.node.TransitionType;
import io.formengine.core.exception.InvalidNodeException;
import io.formengine.core.exception.UnknownNodeTypeException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Converts raw definition trees into immutable {@link Node} graphs.
///
/// The raw tree is built from `Map<String, Object>`, `List<Object>` and primitives, as
/// produced by a JSON parser. Fragments are classified by {@link DefinitionShapes} in a
/// fixed order: journey, step, block, expression, transition.
///
/// ### Contracts
/// - **Precondition**: the root is a map
/// - **Postcondition**: every nested fragment matching a node shape becomes a node, at any
///   depth, including inside lists and plain maps
/// - **Postcondition**: failures carry the structural path of the offending fragment
///
/// @implNote Never touches a registry. Ids come from the shared {@link NodeIdGenerator}
/// under the category given at construction, `COMPILE_AST` for compilation and
/// `RUNTIME_AST` for subtrees attached at runtime. Thread-safe as long as the input is not
/// mutated concurrently.
///
/// @see io.formengine.core.ast.traverse.RegistrationTraverser for registering the result
public final class AstTransformer {

    private static final Logger logger = Logger.getLogger(AstTransformer.class.getName());

    private final NodeIdGenerator idGenerator;
    private final NodeIdCategory idCategory;

    /// Creates a compile-time transformer.
    ///
    /// @param idGenerator shared id source, not null
    public AstTransformer(NodeIdGenerator idGenerator) {
        this(idGenerator, NodeIdCategory.COMPILE_AST);
    }

    /// Creates a transformer minting ids of the given category.
    ///
    /// @param idGenerator shared id source, not null
    /// @param idCategory `COMPILE_AST` or `RUNTIME_AST`, not null
    public AstTransformer(NodeIdGenerator idGenerator, NodeIdCategory idCategory) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "ID generator required");
        this.idCategory = Objects.requireNonNull(idCategory, "ID category required");
    }

    /// Transforms a raw definition into a node graph.
    ///
    /// @param raw raw definition root, expected to be a map
    /// @return root node, never null
    /// @throws InvalidNodeException if the root, or any fragment in node position, is not a
    ///     map
    /// @throws io.formengine.core.exception.UnknownNodeTypeException if a node fragment
    ///     matches no known shape
    public Node transform(Object raw) {
        Node root = transformNode(raw, new ArrayList<>());
        logger.fine(() -> "Transformed definition into " + root);
        return root;
    }

    private Node transformNode(Object raw, List<Object> path) {
        if (!(raw instanceof Map<?, ?> map)) {
            throw new InvalidNodeException("object", describe(raw), path);
        }

        if (DefinitionShapes.isJourney(map)) {
            return new JourneyNode(nextId(), structureProperties(map, path, false), raw);
        }
        if (DefinitionShapes.isStep(map)) {
            return new StepNode(nextId(), structureProperties(map, path, false), raw);
        }
        if (DefinitionShapes.isBlock(map)) {
            return new BlockNode(
                    nextId(),
                    (String) map.get("variant"),
                    DefinitionShapes.blockTypeOf(map),
                    structureProperties(map, path, true),
                    raw);
        }

        Optional<ExpressionType> expressionType = DefinitionShapes.expressionTypeOf(map);
        if (expressionType.isPresent()) {
            ExpressionType type = expressionType.get();
            return new ExpressionNode(nextId(), type, expressionProperties(type, map, path), raw);
        }

        Optional<TransitionType> transitionType = DefinitionShapes.transitionTypeOf(map);
        if (transitionType.isPresent()) {
            TransitionType type = transitionType.get();
            return new TransitionNode(nextId(), type, transitionProperties(type, map, path), raw);
        }

        throw new UnknownNodeTypeException(DefinitionShapes.typeOf(map), path);
    }

    private Map<String, Object> structureProperties(
            Map<?, ?> raw, List<Object> path, boolean block) {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (DefinitionShapes.TYPE.equals(key) || (block && "variant".equals(key))) {
                continue;
            }
            properties.put(key, transformValue(entry.getValue(), append(path, key)));
        }
        return properties;
    }

    private Map<String, Object> expressionProperties(
            ExpressionType type, Map<?, ?> raw, List<Object> path) {
        Map<String, Object> properties = new LinkedHashMap<>();
        switch (type) {
            case REFERENCE:
                properties.put("path", transformValue(raw.get("path"), append(path, "path")));
                break;
            case PIPELINE:
                properties.put("input", transformNode(raw.get("input"), append(path, "input")));
                properties.put("steps", pipelineSteps((List<?>) raw.get("steps"), path));
                break;
            case CONDITIONAL:
                if (raw.get("predicate") != null) {
                    properties.put(
                            "predicate",
                            transformNode(raw.get("predicate"), append(path, "predicate")));
                }
                if (raw.containsKey("then")) {
                    properties.put(
                            "thenValue", transformValue(raw.get("then"), append(path, "then")));
                }
                if (raw.containsKey("else")) {
                    properties.put(
                            "elseValue", transformValue(raw.get("else"), append(path, "else")));
                }
                break;
            case VALIDATION:
                if (raw.get("when") != null) {
                    properties.put("when", transformNode(raw.get("when"), append(path, "when")));
                }
                Object message = raw.get("message");
                properties.put("message", message != null ? message : "");
                if (raw.containsKey("submissionOnly")) {
                    properties.put("submissionOnly", raw.get("submissionOnly"));
                }
                if (raw.get("details") != null) {
                    properties.put("details", raw.get("details"));
                }
                break;
            case PREDICATE_TEST:
                properties.put(
                        "subject", transformNode(raw.get("subject"), append(path, "subject")));
                properties.put("negate", raw.get("negate"));
                properties.put(
                        "condition",
                        transformNode(raw.get("condition"), append(path, "condition")));
                break;
            case PREDICATE_NOT:
                properties.put(
                        "operand", transformNode(raw.get("operand"), append(path, "operand")));
                break;
            case PREDICATE_AND:
            case PREDICATE_OR:
            case PREDICATE_XOR:
                List<?> operands = (List<?>) raw.get("operands");
                properties.put("operands", transformNodes(operands, path, "operands"));
                break;
            default:
                properties.put("name", raw.get("name"));
                properties.put(
                        "arguments",
                        transformValue(raw.get("arguments"), append(path, "arguments")));
        }
        return properties;
    }

    private List<Object> pipelineSteps(List<?> steps, List<Object> path) {
        List<Object> result = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            List<Object> stepPath = append(append(path, "steps"), i);
            if (!(steps.get(i) instanceof Map<?, ?> step)) {
                throw new InvalidNodeException("pipeline step", describe(steps.get(i)), stepPath);
            }
            Map<String, Object> transformed = new LinkedHashMap<>();
            transformed.put("name", step.get("name"));
            if (step.get("args") != null) {
                transformed.put("args", transformValue(step.get("args"), append(stepPath, "args")));
            }
            result.add(transformed);
        }
        return result;
    }

    private Map<String, Object> transitionProperties(
            TransitionType type, Map<?, ?> raw, List<Object> path) {
        Map<String, Object> properties = new LinkedHashMap<>();
        switch (type) {
            case LOAD:
                properties.put(
                        "effects", transformNodes((List<?>) raw.get("effects"), path, "effects"));
                break;
            case ACCESS:
                if (raw.get("guards") != null) {
                    properties.put(
                            "guards", transformNode(raw.get("guards"), append(path, "guards")));
                }
                if (raw.get("effects") instanceof List<?> effects) {
                    properties.put("effects", transformNodes(effects, path, "effects"));
                }
                if (raw.get("redirect") instanceof List<?> redirect) {
                    properties.put("redirect", transformNodes(redirect, path, "redirect"));
                }
                break;
            default:
                if (raw.get("when") != null) {
                    properties.put("when", transformNode(raw.get("when"), append(path, "when")));
                }
                if (raw.get("guards") != null) {
                    properties.put(
                            "guards", transformNode(raw.get("guards"), append(path, "guards")));
                }
                properties.put("validate", !Boolean.FALSE.equals(raw.get("validate")));
                for (String branch : List.of("onAlways", "onValid", "onInvalid")) {
                    if (raw.get(branch) instanceof Map<?, ?> branchRaw) {
                        properties.put(
                                branch, submitBranch(branchRaw, append(path, branch)));
                    }
                }
        }
        return properties;
    }

    private Map<String, Object> submitBranch(Map<?, ?> branch, List<Object> path) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (branch.get("effects") instanceof List<?> effects) {
            result.put("effects", transformNodes(effects, path, "effects"));
        }
        if (branch.get("next") instanceof List<?> next) {
            result.put("next", transformNodes(next, path, "next"));
        }
        return result;
    }

    private List<Object> transformNodes(List<?> items, List<Object> path, String property) {
        List<Object> propertyPath = append(path, property);
        List<Object> result = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            result.add(transformNode(items.get(i), append(propertyPath, i)));
        }
        return result;
    }

    private Object transformValue(Object value, List<Object> path) {
        if (value instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                result.add(transformValue(list.get(i), append(path, i)));
            }
            return result;
        }
        if (value instanceof Map<?, ?> map) {
            if (DefinitionShapes.isNode(map) || DefinitionShapes.isNodeCandidate(map)) {
                return transformNode(map, path);
            }
            Map<String, Object> result = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                result.put(key, transformValue(entry.getValue(), append(path, key)));
            }
            return result;
        }
        return value;
    }

    private String nextId() {
        return idGenerator.next(idCategory);
    }

    private static List<Object> append(List<Object> path, Object segment) {
        List<Object> extended = new ArrayList<>(path.size() + 1);
        extended.addAll(path);
        extended.add(segment);
        return extended;
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof List) {
            return "array";
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        return value.getClass().getSimpleName();
    }
}
