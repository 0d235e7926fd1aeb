package io.eidos.core.engine;

import io.eidos.core.model.BlockRule;
import io.eidos.core.model.LanguageDefinition;
import io.eidos.core.model.StatementRule;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decides what a single source line is: a block opener, a block closer, a statement, or a line for
 * the default rule. Pure: the outcome depends only on the line, the definition, the innermost open
 * block and the close policy.
 *
 * <p>
 * Precedence: block start, then block end (only while a block is open), then statement patterns,
 * then the default rule. Within each step candidates are tried in the definition's match order
 * (longest prefix first, then rule name), so the first hit is deterministic.
 */
public final class LineClassifier {

    private final LanguageDefinition definition;
    private final ClosePolicy closePolicy;

    public LineClassifier(LanguageDefinition definition, ClosePolicy closePolicy) {
        this.definition = Objects.requireNonNull(definition, "definition must not be null");
        this.closePolicy = Objects.requireNonNull(closePolicy, "closePolicy must not be null");
    }

    public LineClassifier(LanguageDefinition definition) {
        this(definition, ClosePolicy.ANY_END);
    }

    /**
     * Classifies a stripped, non-empty line.
     *
     * @param line      the line, already stripped of surrounding whitespace
     * @param openBlock rule name of the innermost open block, or {@code null} at top level
     * @return exactly one outcome, never null
     */
    public MatchOutcome classify(String line, String openBlock) {
        Objects.requireNonNull(line, "line must not be null");

        for (String name : definition.blockStartMatchOrder()) {
            if (line.startsWith(definition.blocks().get(name).start())) {
                return new MatchOutcome.OpenBlock(name);
            }
        }

        if (openBlock != null) {
            String closer = matchClose(line, openBlock);
            if (closer != null) {
                return new MatchOutcome.CloseBlock(closer);
            }
        }

        for (String name : definition.statementMatchOrder()) {
            StatementRule rule = definition.statements().get(name);
            if (line.startsWith(rule.pattern())) {
                return new MatchOutcome.Statement(name, splitArguments(line.substring(rule.pattern().length())));
            }
        }

        return new MatchOutcome.DefaultStatement(line);
    }

    public ClosePolicy closePolicy() {
        return closePolicy;
    }

    private String matchClose(String line, String openBlock) {
        if (closePolicy == ClosePolicy.MATCHING_END) {
            BlockRule open = definition.blocks().get(openBlock);
            return open != null && line.startsWith(open.end()) ? openBlock : null;
        }
        for (String name : definition.blockEndMatchOrder()) {
            if (line.startsWith(definition.blocks().get(name).end())) {
                return name;
            }
        }
        return null;
    }

    /** Splits on runs of {@link Character#isWhitespace} code points, the same set {@code strip()} removes. */
    static List<String> splitArguments(String remainder) {
        List<String> arguments = new ArrayList<>();
        int start = -1;
        int i = 0;
        while (i < remainder.length()) {
            int cp = remainder.codePointAt(i);
            if (Character.isWhitespace(cp)) {
                if (start >= 0) {
                    arguments.add(remainder.substring(start, i));
                    start = -1;
                }
            } else if (start < 0) {
                start = i;
            }
            i += Character.charCount(cp);
        }
        if (start >= 0) {
            arguments.add(remainder.substring(start));
        }
        return List.copyOf(arguments);
    }
}
