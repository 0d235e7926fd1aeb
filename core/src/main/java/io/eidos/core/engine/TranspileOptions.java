package io.eidos.core.engine;

import java.util.Objects;

/**
 * Pipeline options. Immutable.
 *
 * @param closePolicy which end lines close the innermost block (default: {@link ClosePolicy#ANY_END})
 * @param indentUnit  text emitted once per nesting level (default: four spaces)
 */
public record TranspileOptions(ClosePolicy closePolicy, String indentUnit) {

    public static final String DEFAULT_INDENT = "    ";

    /** Original behaviour: any end closes, four-space indent. */
    public static final TranspileOptions DEFAULT = new TranspileOptions(ClosePolicy.ANY_END, DEFAULT_INDENT);

    public TranspileOptions {
        Objects.requireNonNull(closePolicy, "closePolicy must not be null");
        Objects.requireNonNull(indentUnit, "indentUnit must not be null");
        if (!indentUnit.isBlank()) {
            throw new IllegalArgumentException("indentUnit must consist of whitespace only");
        }
    }

    public TranspileOptions withClosePolicy(ClosePolicy policy) {
        return new TranspileOptions(policy, indentUnit);
    }

    public TranspileOptions withIndentUnit(String unit) {
        return new TranspileOptions(closePolicy, unit);
    }
}
