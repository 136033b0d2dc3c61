package io.formengine.core.ast.node;

import java.util.Map;
import java.util.Objects;

/// A UI block rendered within a step.
///
/// The `variant` names the rendering component and is kept out of the property map.
/// The {@link BlockType} is derived from the block's shape at transformation time.
public final class BlockNode extends Node {

    private final String variant;
    private final BlockType blockType;

    public BlockNode(
            String id,
            String variant,
            BlockType blockType,
            Map<String, Object> properties,
            Object raw) {
        super(id, properties, raw);
        this.variant = Objects.requireNonNull(variant, "Variant required");
        this.blockType = Objects.requireNonNull(blockType, "Block type required");
    }

    @Override
    public BlockNode rebuild(String id, Map<String, Object> properties) {
        return new BlockNode(id, variant, blockType, properties, getRaw());
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.BLOCK;
    }

    @Override
    public NodeKind getKind() {
        return blockType;
    }

    /// Returns the rendering component variant, e.g. `govukTextInput`.
    ///
    /// @return variant, never null
    public String getVariant() {
        return variant;
    }

    /// Returns the structural block classification.
    ///
    /// @return block type, never null
    public BlockType getBlockType() {
        return blockType;
    }

    /// Returns whether this field block has a literal string code.
    ///
    /// Expression-valued codes are only known at runtime.
    ///
    /// @return true for field blocks whose `code` is a string
    public boolean hasLiteralCode() {
        return blockType == BlockType.FIELD && getProperty("code") instanceof String;
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && variant.equals(((BlockNode) o).variant);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + variant.hashCode();
    }

    @Override
    public String toString() {
        return "BlockNode{id='" + id + "', variant='" + variant + "', blockType=" + blockType + "}";
    }
}
