package io.eidos.core.model;

import java.util.Objects;

/**
 * A nesting construct delimited by a start line and an end line. The rendered children replace the
 * {@link #BODY_PLACEHOLDER} in {@code template}.
 *
 * @param start    literal, non-empty prefix of the opening line
 * @param end      literal, non-empty prefix of the closing line
 * @param template target-language text containing {@code {body}}
 */
public record BlockRule(String start, String end, String template) {

    public static final String BODY_PLACEHOLDER = "{body}";

    public BlockRule {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        Objects.requireNonNull(template, "template must not be null");
        if (start.isEmpty() || end.isEmpty()) {
            throw new IllegalArgumentException("block start and end must not be empty");
        }
    }
}
