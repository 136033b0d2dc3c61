package io.formengine.core.ast.id;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/// Issues unique, categorized node identifiers of the form `<prefix>:<n>`.
///
/// Each {@link NodeIdCategory} has its own counter starting at 1. Since the prefix is part
/// of the id, ids from different categories never collide.
///
/// ### Contracts
/// - **Postcondition**: no two calls on the same generator return the same id
/// - **Invariant**: counters only increase
///
/// @implNote Thread-safe. A single generator is shared by the shared compilation and
/// every per-step compilation of a form instance, which may run concurrently.
public final class NodeIdGenerator {

    private final Map<NodeIdCategory, AtomicLong> counters = new EnumMap<>(NodeIdCategory.class);

    public NodeIdGenerator() {
        for (NodeIdCategory category : NodeIdCategory.values()) {
            counters.put(category, new AtomicLong());
        }
    }

    /// Returns the next identifier in the given category.
    ///
    /// @param category id category, not null
    /// @return new unique identifier, never null
    public String next(NodeIdCategory category) {
        return category.prefix() + ":" + counters.get(category).incrementAndGet();
    }

    /// Returns how many ids have been issued in a category.
    ///
    /// @param category id category, not null
    /// @return issued count, always non-negative
    public long issued(NodeIdCategory category) {
        return counters.get(category).get();
    }
}
