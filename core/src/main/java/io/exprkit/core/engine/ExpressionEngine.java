package io.exprkit.core.engine;

import io.exprkit.core.config.EngineConfig;
import io.exprkit.core.error.ExpressionParseException;
import io.exprkit.core.model.ParsedExpression;
import io.exprkit.core.model.Symbol;
import io.exprkit.core.spi.SymbolEvaluator;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configured entry point: one parser (and cache), one option set, and one symbol table shared by
 * every expression it compiles. Symbol names are validated when they are registered.
 *
 * <p>
 * Thread-safe and immutable once built.
 */
public final class ExpressionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionEngine.class);

    /** Structural operator names that are not scannable operator tokens. */
    private static final Set<String> STRUCTURAL_OPERATORS = Set.of("()", "[]");

    private final EngineConfig config;
    private final ExpressionParser parser;
    private final Map<Symbol, SymbolEvaluator> symbols;
    private final Map<String, double[]> arrays;

    private ExpressionEngine(EngineConfig config, ExpressionParser parser, Map<Symbol, SymbolEvaluator> symbols) {
        this.config = config;
        this.parser = parser;
        this.symbols = Collections.unmodifiableMap(new LinkedHashMap<>(symbols));
        Map<String, double[]> converted = new LinkedHashMap<>();
        config.arrays().forEach((name, values) -> converted.put(name, toArray(values)));
        this.arrays = Collections.unmodifiableMap(converted);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** An engine with {@code config} and no caller symbols. */
    public static ExpressionEngine create(EngineConfig config) {
        return builder().config(config).build();
    }

    /** Parses {@code source} through this engine's parser. Never throws on bad syntax. */
    public ParsedExpression parse(String source) {
        return parser.parse(source);
    }

    /**
     * Parses and binds {@code source}. Never throws on bad syntax: the error is raised when the
     * result is evaluated.
     */
    public Expression compile(String source) {
        return bind(parser.parse(source));
    }

    /**
     * Parses and binds {@code source}.
     *
     * @throws ExpressionParseException if the text is not a valid expression
     */
    public Expression compileStrict(String source) {
        return bind(parser.parseStrict(source));
    }

    private Expression bind(ParsedExpression parsed) {
        return Expression.builder(parsed)
                .options(config.options())
                .constants(config.constants())
                .arrays(arrays)
                .symbols(symbols)
                .build();
    }

    public EngineConfig config() {
        return config;
    }

    public ExpressionParser parser() {
        return parser;
    }

    /** Registered caller symbols, in registration order. */
    public Map<Symbol, SymbolEvaluator> symbols() {
        return symbols;
    }

    private static double[] toArray(List<Double> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return array;
    }

    /**
     * Builder for {@link ExpressionEngine}. Registering the same symbol twice keeps the last
     * evaluator.
     */
    public static final class Builder {

        private EngineConfig config = EngineConfig.DEFAULT;
        private ExpressionParser parser;
        private final Map<Symbol, SymbolEvaluator> symbols = new LinkedHashMap<>();

        private Builder() {}

        public Builder config(EngineConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /** Uses {@code parser} instead of a new one built from the configuration. */
        public Builder parser(ExpressionParser parser) {
            this.parser = Objects.requireNonNull(parser, "parser must not be null");
            return this;
        }

        /**
         * Registers a caller symbol.
         *
         * @throws NullPointerException     if either argument is null
         * @throws IllegalArgumentException if the name is not a valid identifier (variables,
         *     functions, arrays) or operator (infix, prefix, postfix)
         */
        public Builder symbol(Symbol symbol, SymbolEvaluator evaluator) {
            Objects.requireNonNull(symbol, "symbol must not be null");
            Objects.requireNonNull(evaluator, "evaluator must not be null");
            validateName(symbol);
            symbols.put(symbol, evaluator);
            return this;
        }

        public Builder symbols(Map<Symbol, SymbolEvaluator> added) {
            added.forEach(this::symbol);
            return this;
        }

        public ExpressionEngine build() {
            ExpressionParser resolvedParser = parser != null ? parser : new ExpressionParser(config);
            ExpressionEngine engine = new ExpressionEngine(config, resolvedParser, symbols);
            for (Symbol symbol : engine.symbols.keySet()) {
                LOG.debug("Registered {}", symbol);
            }
            LOG.info(
                    "Expression engine created: options={}, constants={}, arrays={}, symbols={}",
                    config.options(),
                    config.constants().size(),
                    config.arrays().size(),
                    engine.symbols.size());
            return engine;
        }

        private static void validateName(Symbol symbol) {
            String name = symbol.name();
            boolean valid;
            if (symbol instanceof Symbol.Variable
                    || symbol instanceof Symbol.Function
                    || symbol instanceof Symbol.Array) {
                valid = Expression.isValidIdentifier(name);
            } else {
                valid = Expression.isValidOperator(name)
                        || (symbol instanceof Symbol.Infix && STRUCTURAL_OPERATORS.contains(name));
            }
            if (!valid) {
                throw new IllegalArgumentException("Invalid name for " + symbol.description() + ": '" + name + "'");
            }
        }
    }
}
