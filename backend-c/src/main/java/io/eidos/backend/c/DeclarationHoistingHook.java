package io.eidos.backend.c;

import io.eidos.core.model.StatementNode;
import io.eidos.core.spi.RenderContext;
import io.eidos.core.spi.RenderHook;
import java.util.List;
import java.util.Objects;

/**
 * Emits a declaration ({@code int x;}) in front of the first assignment to each variable. The
 * variable is the first argument of statements matched by the assignment rule; names already
 * declared earlier in the same render are skipped.
 */
public final class DeclarationHoistingHook implements RenderHook {

    public static final String DEFAULT_RULE = "assignment";
    public static final String DEFAULT_TYPE = "int";

    private final String assignmentRule;
    private final String declaredType;

    public DeclarationHoistingHook(String assignmentRule, String declaredType) {
        this.assignmentRule = Objects.requireNonNull(assignmentRule, "assignmentRule must not be null");
        this.declaredType = Objects.requireNonNull(declaredType, "declaredType must not be null");
    }

    public DeclarationHoistingHook() {
        this(DEFAULT_RULE, DEFAULT_TYPE);
    }

    @Override
    public List<String> beforeStatement(StatementNode node, RenderContext context) {
        if (!assignmentRule.equals(node.ruleName()) || node.arguments().isEmpty()) {
            return List.of();
        }
        String variable = node.arguments().get(0);
        if (!context.declare(variable)) {
            return List.of();
        }
        return List.of(declaredType + " " + variable + ";");
    }
}
