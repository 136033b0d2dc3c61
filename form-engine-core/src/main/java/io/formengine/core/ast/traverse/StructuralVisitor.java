package io.formengine.core.ast.traverse;

import io.formengine.core.ast.node.Node;

/// Callback for {@link StructuralTraverser} walks.
///
/// All callbacks default to {@link VisitResult#CONTINUE}, so implementations override only
/// what they need.
public interface StructuralVisitor {

    /// Called before the node's children are walked.
    ///
    /// @param node visited node, not null
    /// @param context position of the node, not null
    /// @return how to proceed, never null
    default VisitResult enterNode(Node node, TraversalContext context) {
        return VisitResult.CONTINUE;
    }

    /// Called before a property of an entered node is walked.
    ///
    /// @param owner node holding the property, not null
    /// @param property property name, not null
    /// @param context position of the owner, not null
    /// @return {@link VisitResult#SKIP} to leave the property out, {@link VisitResult#STOP}
    ///     to abort, {@link VisitResult#CONTINUE} to walk it
    default VisitResult enterProperty(Node owner, String property, TraversalContext context) {
        return VisitResult.CONTINUE;
    }

    /// Called after the node's children are walked, or skipped.
    ///
    /// @param node visited node, not null
    /// @param context position of the node, not null
    /// @return {@link VisitResult#STOP} to abort, anything else to go on
    default VisitResult exitNode(Node node, TraversalContext context) {
        return VisitResult.CONTINUE;
    }
}
