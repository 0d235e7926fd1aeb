package io.eidos.core.engine;

import java.util.List;
import java.util.Objects;

/** Classification of one source line by {@link LineClassifier}. */
public sealed interface MatchOutcome {

    /** The line opens a block of the named rule. */
    record OpenBlock(String ruleName) implements MatchOutcome {
        public OpenBlock {
            Objects.requireNonNull(ruleName, "ruleName must not be null");
        }
    }

    /** The line closes the innermost open block; {@code ruleName} is the rule whose end matched. */
    record CloseBlock(String ruleName) implements MatchOutcome {
        public CloseBlock {
            Objects.requireNonNull(ruleName, "ruleName must not be null");
        }
    }

    /** The line matched a statement rule. */
    record Statement(String ruleName, List<String> arguments) implements MatchOutcome {
        public Statement {
            Objects.requireNonNull(ruleName, "ruleName must not be null");
            arguments = List.copyOf(arguments);
        }
    }

    /** No rule matched; the whole line becomes the single argument of the default statement. */
    record DefaultStatement(String line) implements MatchOutcome {
        public DefaultStatement {
            Objects.requireNonNull(line, "line must not be null");
        }
    }
}
