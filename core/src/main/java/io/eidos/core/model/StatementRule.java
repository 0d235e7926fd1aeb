package io.eidos.core.model;

import java.util.Objects;

/**
 * A single-line construct of the source language. A line matches when it starts with
 * {@code pattern}; the rest of the line is split on whitespace into positional arguments that are
 * substituted into {@code template} ({@code {0}}, {@code {1}}, ...).
 *
 * @param pattern  literal, non-empty line prefix
 * @param template target-language text with positional placeholders
 */
public record StatementRule(String pattern, String template) {

    public StatementRule {
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(template, "template must not be null");
        if (pattern.isEmpty()) {
            throw new IllegalArgumentException("statement pattern must not be empty");
        }
    }
}
