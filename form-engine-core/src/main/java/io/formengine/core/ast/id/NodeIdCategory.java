package io.formengine.core.ast.id;

import java.util.Optional;

/// Partitions of the node identifier space.
///
/// The prefix makes ids minted during one-time compilation distinguishable from ids
/// minted while serving a request, e.g. `compile_ast:12` vs `runtime_pseudo:3`.
public enum NodeIdCategory {
    COMPILE_AST("compile_ast"),
    COMPILE_PSEUDO("compile_pseudo"),
    RUNTIME_AST("runtime_ast"),
    RUNTIME_PSEUDO("runtime_pseudo");

    private final String prefix;

    NodeIdCategory(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    /// Returns whether ids of this category are minted at request time.
    ///
    /// @return true for runtime categories
    public boolean isRuntime() {
        return this == RUNTIME_AST || this == RUNTIME_PSEUDO;
    }

    /// Recovers the category of an identifier from its prefix.
    ///
    /// @param id node identifier, may be null
    /// @return category, or empty if the id was not minted by {@link NodeIdGenerator}
    public static Optional<NodeIdCategory> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        int separator = id.indexOf(':');
        if (separator < 0) {
            return Optional.empty();
        }
        String prefix = id.substring(0, separator);
        for (NodeIdCategory category : values()) {
            if (category.prefix.equals(prefix)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
