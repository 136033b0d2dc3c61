package io.formengine.core.ast.registry;

/// Metadata keys written by the compilation passes.
public final class MetadataKeys {

    private MetadataKeys() {}

    /// Id of the structural parent node.
    public static final String ATTACHED_TO_PARENT_NODE = "attachedToParentNode";

    /// Property of the parent under which the node hangs.
    public static final String ATTACHED_TO_PARENT_PROPERTY = "attachedToParentProperty";

    public static final String IS_ANCESTOR_OF_STEP = "isAncestorOfStep";
    public static final String IS_DESCENDANT_OF_STEP = "isDescendantOfStep";
    public static final String IS_CURRENT_STEP = "isCurrentStep";
}
