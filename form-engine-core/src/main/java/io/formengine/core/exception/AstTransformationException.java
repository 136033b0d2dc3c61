package io.formengine.core.exception;

import java.io.Serial;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Base class for failures while transforming a raw definition into nodes.
///
/// Carries the structural path reached when the failure happened, so callers can report
/// locations such as `root → steps[2] → blocks[0] → validate[1]`.
public class AstTransformationException extends RuntimeException {
    @Serial private static final long serialVersionUID = 3018542236017724893L;

    private final List<Object> path;

    public AstTransformationException(String message, List<Object> path) {
        super(message + " at " + formatPath(path));
        this.path = Collections.unmodifiableList(new ArrayList<>(path));
    }

    /// Returns the structural path of the failing value.
    ///
    /// @return property keys (strings) and array indices (integers), never null
    public List<Object> getPath() {
        return path;
    }

    /// Returns the path in human-readable form.
    ///
    /// @return formatted path, e.g. `root → steps[0] → blocks[1]`
    public String getFormattedPath() {
        return formatPath(path);
    }

    /// Formats a structural path, folding array indices into the preceding property.
    ///
    /// @param path path segments, not null
    /// @return formatted path, `root` for an empty path
    public static String formatPath(List<Object> path) {
        StringBuilder sb = new StringBuilder("root");
        for (Object segment : path) {
            if (segment instanceof Integer index) {
                sb.append('[').append(index).append(']');
            } else {
                sb.append(" → ").append(segment);
            }
        }
        return sb.toString();
    }
}
