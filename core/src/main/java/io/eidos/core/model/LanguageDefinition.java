package io.eidos.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * A loaded language definition: named statement, block and operator rules. Immutable once built;
 * created by {@code LanguageDefinitionLoader} or {@link #builder()} and shared read-only by the
 * classifier, tree builder and renderer.
 *
 * <p>
 * Rule names are unique within their own mapping; a statement and a block may share a name.
 *
 * <p>
 * Besides the mappings, the definition keeps each rule set in <em>match order</em>: longest pattern
 * first, ties broken by rule name. The classifier walks these lists, so which rule wins when several
 * prefixes match never depends on map iteration order.
 */
public final class LanguageDefinition {

    /** Statement rule used for lines that no rule matches. */
    public static final String DEFAULT_STATEMENT = "print";

    private final Map<String, StatementRule> statements;
    private final Map<String, BlockRule> blocks;
    private final Map<String, OperatorRule> operators;

    private final List<String> statementMatchOrder;
    private final List<String> blockStartMatchOrder;
    private final List<String> blockEndMatchOrder;

    private LanguageDefinition(
            Map<String, StatementRule> statements, Map<String, BlockRule> blocks, Map<String, OperatorRule> operators) {
        this.statements = Collections.unmodifiableMap(new TreeMap<>(statements));
        this.blocks = Collections.unmodifiableMap(new TreeMap<>(blocks));
        this.operators = Collections.unmodifiableMap(new TreeMap<>(operators));
        this.statementMatchOrder = matchOrder(this.statements, StatementRule::pattern);
        this.blockStartMatchOrder = matchOrder(this.blocks, BlockRule::start);
        this.blockEndMatchOrder = matchOrder(this.blocks, BlockRule::end);
    }

    /**
     * Creates a definition from the three rule mappings. The maps are copied.
     *
     * @throws NullPointerException if any mapping is null
     */
    public static LanguageDefinition of(
            Map<String, StatementRule> statements, Map<String, BlockRule> blocks, Map<String, OperatorRule> operators) {
        Objects.requireNonNull(statements, "statements must not be null");
        Objects.requireNonNull(blocks, "blocks must not be null");
        Objects.requireNonNull(operators, "operators must not be null");
        return new LanguageDefinition(statements, blocks, operators);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Statement rules by name, sorted by name. */
    public Map<String, StatementRule> statements() {
        return statements;
    }

    /** Block rules by name, sorted by name. */
    public Map<String, BlockRule> blocks() {
        return blocks;
    }

    /** Operator rules by name, sorted by name. */
    public Map<String, OperatorRule> operators() {
        return operators;
    }

    public Optional<StatementRule> statement(String name) {
        return Optional.ofNullable(statements.get(name));
    }

    public Optional<BlockRule> block(String name) {
        return Optional.ofNullable(blocks.get(name));
    }

    /** {@code true} if lines that match no rule can be rendered. */
    public boolean hasDefaultStatement() {
        return statements.containsKey(DEFAULT_STATEMENT);
    }

    /** Statement rule names, longest pattern first, then by name. */
    public List<String> statementMatchOrder() {
        return statementMatchOrder;
    }

    /** Block rule names, longest start prefix first, then by name. */
    public List<String> blockStartMatchOrder() {
        return blockStartMatchOrder;
    }

    /** Block rule names, longest end prefix first, then by name. */
    public List<String> blockEndMatchOrder() {
        return blockEndMatchOrder;
    }

    private static <R> List<String> matchOrder(Map<String, R> rules, Function<R, String> prefix) {
        List<String> names = new ArrayList<>(rules.keySet());
        names.sort(Comparator.<String>comparingInt(
                        name -> prefix.apply(rules.get(name)).length())
                .reversed()
                .thenComparing(Comparator.naturalOrder()));
        return List.copyOf(names);
    }

    @Override
    public String toString() {
        return "LanguageDefinition[statements=" + statements.keySet() + ", blocks=" + blocks.keySet()
                + ", operators=" + operators.keySet() + "]";
    }

    /** Incremental builder, mainly for tests and programmatic definitions. */
    public static final class Builder {

        private final Map<String, StatementRule> statements = new TreeMap<>();
        private final Map<String, BlockRule> blocks = new TreeMap<>();
        private final Map<String, OperatorRule> operators = new TreeMap<>();

        private Builder() {}

        /** @throws IllegalArgumentException if a statement with this name was already added */
        public Builder statement(String name, String pattern, String template) {
            putUnique(statements, name, new StatementRule(pattern, template), "statement");
            return this;
        }

        /** @throws IllegalArgumentException if a block with this name was already added */
        public Builder block(String name, String start, String end, String template) {
            putUnique(blocks, name, new BlockRule(start, end, template), "block");
            return this;
        }

        /** @throws IllegalArgumentException if an operator with this name was already added */
        public Builder operator(String name, String symbol, String template) {
            putUnique(operators, name, new OperatorRule(symbol, template), "operator");
            return this;
        }

        public LanguageDefinition build() {
            return new LanguageDefinition(statements, blocks, operators);
        }

        private static <R> void putUnique(Map<String, R> rules, String name, R rule, String kind) {
            Objects.requireNonNull(name, kind + " name must not be null");
            if (rules.putIfAbsent(name, rule) != null) {
                throw new IllegalArgumentException("Duplicate " + kind + " rule name: '" + name + "'");
            }
        }
    }
}
