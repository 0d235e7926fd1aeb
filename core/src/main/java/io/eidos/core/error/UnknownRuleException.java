package io.eidos.core.error;

/**
 * Thrown when a syntax-tree node names a rule that the language definition does not contain. Raised
 * at parse time when the default {@code print} rule is missing, and at render time for any node
 * whose rule cannot be resolved.
 */
public final class UnknownRuleException extends TranspileException {

    private static final long serialVersionUID = 1L;

    /** Which rule mapping the lookup was made in. */
    public enum RuleKind {
        STATEMENT,
        BLOCK
    }

    private final String ruleName;
    private final RuleKind ruleKind;
    private final int lineNumber;

    public UnknownRuleException(
            String message, Phase phase, String source, String ruleName, RuleKind ruleKind, int lineNumber) {
        super(message, phase, source);
        this.ruleName = ruleName;
        this.ruleKind = ruleKind;
        this.lineNumber = lineNumber;
    }

    public String ruleName() {
        return ruleName;
    }

    public RuleKind ruleKind() {
        return ruleKind;
    }

    /** 1-based source line of the node, or {@code 0} if the node carries no position. */
    public int lineNumber() {
        return lineNumber;
    }
}
