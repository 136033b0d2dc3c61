package io.formengine.core.compilation.pseudo;

import io.formengine.core.ast.node.PseudoNodeType;
import java.util.Optional;

/// Source tags recognized as the first segment of a reference path.
public enum ReferenceSource {
    QUERY("query", PseudoNodeType.QUERY, false),
    PARAMS("params", PseudoNodeType.PARAMS, false),
    POST("post", PseudoNodeType.POST, true),
    DATA("data", PseudoNodeType.DATA, true),
    ANSWERS("answers", PseudoNodeType.ANSWER_REMOTE, true);

    private final String tag;
    private final PseudoNodeType pseudoNodeType;
    private final boolean keyedByBase;

    ReferenceSource(String tag, PseudoNodeType pseudoNodeType, boolean keyedByBase) {
        this.tag = tag;
        this.pseudoNodeType = pseudoNodeType;
        this.keyedByBase = keyedByBase;
    }

    public String tag() {
        return tag;
    }

    /// Returns the pseudo-node type created for references from this source.
    ///
    /// @return pseudo-node type, never null
    public PseudoNodeType pseudoNodeType() {
        return pseudoNodeType;
    }

    /// Returns the lookup key for a reference key.
    ///
    /// Query and path parameters keep the full key, since dotted names are legal parameter
    /// names. Other sources collapse `address.postcode` to `address`.
    ///
    /// @param key second path segment, not null
    /// @return lookup key, never null
    public String lookupKey(String key) {
        if (!keyedByBase) {
            return key;
        }
        int dot = key.indexOf('.');
        return dot < 0 ? key : key.substring(0, dot);
    }

    /// Looks up a source by its path tag.
    ///
    /// @param tag first path segment, may be null
    /// @return matching source, or empty if unrecognized
    public static Optional<ReferenceSource> fromTag(Object tag) {
        for (ReferenceSource source : values()) {
            if (source.tag.equals(tag)) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }
}
