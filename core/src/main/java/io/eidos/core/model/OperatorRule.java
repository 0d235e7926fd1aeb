package io.eidos.core.model;

import java.util.Objects;

/**
 * Operator definition ({@code symbol} plus render {@code template}). Loaded and validated with the
 * rest of the definition but not consulted by the renderer; reserved for expression-level
 * substitution.
 */
public record OperatorRule(String symbol, String template) {

    public OperatorRule {
        Objects.requireNonNull(symbol, "symbol must not be null");
        Objects.requireNonNull(template, "template must not be null");
        if (symbol.isEmpty()) {
            throw new IllegalArgumentException("operator symbol must not be empty");
        }
    }
}
