package io.exprkit.core.engine;

import io.exprkit.core.error.ExpressionEvalException;
import io.exprkit.core.model.ExpressionError;
import io.exprkit.core.model.Node;
import io.exprkit.core.model.ParsedExpression;
import io.exprkit.core.model.Symbol;
import io.exprkit.core.parse.Cursor;
import io.exprkit.core.parse.TokenScanner;
import io.exprkit.core.spi.SymbolEvaluator;
import io.exprkit.core.spi.SymbolResolver;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A parsed expression with every symbol bound to an evaluator, ready to evaluate.
 *
 * <p>
 * Construction never fails. Syntax errors, undefined symbols and arity mismatches are bound as
 * evaluators that throw, and surface as an {@link ExpressionEvalException} from
 * {@link #evaluate()}.
 *
 * <p>
 * Instances are immutable and may be evaluated concurrently, provided every caller-supplied
 * evaluator is itself safe to call from several threads.
 *
 * <pre>{@code
 * Expression expression = Expression.builder("max(a[0], x) * 2")
 *         .array("a", 3, 4)
 *         .symbol(Symbol.variable("x"), args -> 5)
 *         .build();
 * expression.evaluate(); // 10.0
 * }</pre>
 */
public final class Expression {

    /** Highest exact arity tried when reporting an arity mismatch for a caller-resolved function. */
    private static final int MAX_TRIED_ARITY = 10;

    private final Node root;

    private Expression(Node root) {
        this.root = root;
    }

    // --- Factories ---

    /** Parses (through the shared cache) and binds {@code source} with the built-in math symbols. */
    public static Expression of(String source) {
        return builder(source).build();
    }

    /** A builder for {@code source}, parsed through the shared cache. */
    public static Builder builder(String source) {
        return new Builder(ExpressionParser.shared().parse(source));
    }

    public static Builder builder(ParsedExpression parsed) {
        return new Builder(Objects.requireNonNull(parsed, "parsed must not be null"));
    }

    /**
     * Binds {@code parsed} with caller-controlled resolution. Impure evaluators are never folded.
     * Symbols neither resolver knows fall back to the built-in math and boolean tables; anything
     * left over raises at evaluation time.
     */
    public static Expression bind(ParsedExpression parsed, SymbolResolver impure, SymbolResolver pure) {
        Objects.requireNonNull(parsed, "parsed must not be null");
        Objects.requireNonNull(impure, "impure resolver must not be null");
        Objects.requireNonNull(pure, "pure resolver must not be null");
        Optimizer optimizer = new Optimizer(impure, symbol -> resolvePure(symbol, impure, pure));
        return new Expression(optimizer.optimize(parsed.root()));
    }

    /** Binds {@code parsed} treating every resolved symbol as pure. */
    public static Expression bindPure(ParsedExpression parsed, SymbolResolver pure) {
        return bind(parsed, SymbolResolver.NONE, pure);
    }

    private static SymbolEvaluator resolvePure(Symbol symbol, SymbolResolver impure, SymbolResolver pure) {
        Optional<SymbolEvaluator> fn = pure.resolve(symbol);
        if (fn.isEmpty()) {
            fn = BuiltinSymbols.lookup(symbol);
        }
        if (fn.isPresent()) {
            return fn.get();
        }
        if (symbol instanceof Symbol.Function function) {
            for (int i = 0; i <= MAX_TRIED_ARITY; i++) {
                Symbol candidate = Symbol.function(function.name(), i);
                if (impure.resolve(candidate).isPresent() || pure.resolve(candidate).isPresent()) {
                    return BuiltinSymbols.raising(ExpressionError.arityMismatch(candidate));
                }
            }
        }
        return BuiltinSymbols.errorEvaluator(symbol);
    }

    // --- Evaluation ---

    /**
     * Evaluates the expression.
     *
     * @throws ExpressionEvalException if a syntax error, an unbound symbol or a failing evaluator is
     *     reached
     */
    public double evaluate() {
        return root.evaluate();
    }

    /** Pretty-printed source; the original text if it failed to parse. */
    public String description() {
        return root.description();
    }

    /** Symbols still referenced after binding; folded symbols are not reported. */
    public Set<Symbol> symbols() {
        return root.symbols();
    }

    /** The bound tree. */
    public Node root() {
        return root;
    }

    @Override
    public String toString() {
        return description();
    }

    // --- Name validation ---

    /** Returns {@code true} if {@code name} is exactly one identifier, plain or quoted. */
    public static boolean isValidIdentifier(String name) {
        Cursor cursor = Cursor.of(name);
        Node token = TokenScanner.scanIdentifier(cursor);
        if (token == null) {
            token = TokenScanner.scanEscapedIdentifier(cursor);
        }
        return token instanceof Node.SymbolNode symbolNode
                && symbolNode.symbol() instanceof Symbol.Variable
                && cursor.isEmpty();
    }

    /** Returns {@code true} if {@code name} is exactly one operator token other than a bracket. */
    public static boolean isValidOperator(String name) {
        Cursor cursor = Cursor.of(name);
        Node token = TokenScanner.scanOperator(cursor);
        if (!(token instanceof Node.SymbolNode symbolNode) || !(symbolNode.symbol() instanceof Symbol.Infix)) {
            return false;
        }
        String op = symbolNode.symbol().name();
        return !op.equals("(") && !op.equals("[") && cursor.isEmpty();
    }

    // --- Default binding ---

    /**
     * Binds an expression from options, constants, arrays and a symbol table.
     *
     * <p>
     * Constants and arrays are pure and shadow same-named symbols. Other caller symbols are impure
     * unless {@link ExpressionOption#PURE_SYMBOLS} is set; variables and arrays from the symbol
     * table are always impure. Remaining symbols come from the built-in tables.
     */
    public static final class Builder {
        private final ParsedExpression parsed;
        private final Set<ExpressionOption> options = EnumSet.noneOf(ExpressionOption.class);
        private final Map<String, Double> constants = new HashMap<>();
        private final Map<String, double[]> arrays = new HashMap<>();
        private final Map<Symbol, SymbolEvaluator> symbols = new LinkedHashMap<>();

        private Builder(ParsedExpression parsed) {
            this.parsed = parsed;
        }

        public Builder option(ExpressionOption option) {
            options.add(Objects.requireNonNull(option, "option must not be null"));
            return this;
        }

        public Builder options(Set<ExpressionOption> added) {
            added.forEach(this::option);
            return this;
        }

        public Builder constant(String name, double value) {
            constants.put(Objects.requireNonNull(name, "name must not be null"), value);
            return this;
        }

        public Builder constants(Map<String, Double> added) {
            added.forEach(this::constant);
            return this;
        }

        public Builder array(String name, double... values) {
            arrays.put(Objects.requireNonNull(name, "name must not be null"), values.clone());
            return this;
        }

        public Builder arrays(Map<String, double[]> added) {
            added.forEach(this::array);
            return this;
        }

        public Builder symbol(Symbol symbol, SymbolEvaluator evaluator) {
            symbols.put(
                    Objects.requireNonNull(symbol, "symbol must not be null"),
                    Objects.requireNonNull(evaluator, "evaluator must not be null"));
            return this;
        }

        public Builder symbols(Map<Symbol, SymbolEvaluator> added) {
            added.forEach(this::symbol);
            return this;
        }

        public Expression build() {
            DefaultResolution resolution = new DefaultResolution(
                    EnumSet.copyOf(options),
                    Map.copyOf(constants),
                    Map.copyOf(arrays),
                    new HashMap<>(symbols));
            return bind(parsed, resolution::impure, symbol -> Optional.of(resolution.pure(symbol)));
        }
    }

    /** Resolution policy behind {@link Builder}; captured by the bound evaluators. */
    private static final class DefaultResolution {
        private final Map<String, Double> constants;
        private final Map<String, double[]> arrays;
        private final Map<Symbol, SymbolEvaluator> symbols;
        private final Map<Symbol, SymbolEvaluator> boolSymbols;
        private final boolean optimize;
        private final boolean pureSymbols;

        DefaultResolution(
                Set<ExpressionOption> options,
                Map<String, Double> constants,
                Map<String, double[]> arrays,
                Map<Symbol, SymbolEvaluator> symbols) {
            this.constants = constants;
            this.arrays = arrays;
            this.symbols = symbols;
            this.boolSymbols = options.contains(ExpressionOption.BOOL_SYMBOLS) ? BuiltinSymbols.BOOLEAN : Map.of();
            this.optimize = !options.contains(ExpressionOption.NO_OPTIMIZE);
            this.pureSymbols = options.contains(ExpressionOption.PURE_SYMBOLS);
        }

        Optional<SymbolEvaluator> impure(Symbol symbol) {
            if (symbol instanceof Symbol.Variable) {
                if (!constants.containsKey(symbol.name()) && symbols.containsKey(symbol)) {
                    return Optional.of(symbols.get(symbol));
                }
            } else if (symbol instanceof Symbol.Array) {
                if (!arrays.containsKey(symbol.name()) && symbols.containsKey(symbol)) {
                    return Optional.of(symbols.get(symbol));
                }
            } else if (!pureSymbols) {
                SymbolEvaluator fn = symbolEvaluator(symbol);
                if (fn != null) {
                    return Optional.of(fn);
                }
            }
            return optimize ? Optional.empty() : Optional.of(pure(symbol));
        }

        SymbolEvaluator pure(Symbol symbol) {
            if (symbol instanceof Symbol.Variable) {
                Double constant = constants.get(symbol.name());
                if (constant != null) {
                    double value = constant;
                    return args -> value;
                }
            } else if (symbol instanceof Symbol.Array) {
                double[] array = arrays.get(symbol.name());
                if (array != null) {
                    return args -> element(symbol, array, args[0]);
                }
            } else {
                SymbolEvaluator fn = symbolEvaluator(symbol);
                if (fn != null) {
                    return fn;
                }
            }
            SymbolEvaluator fn = BuiltinSymbols.MATH.get(symbol);
            if (fn == null) {
                fn = boolSymbols.get(symbol);
            }
            if (fn != null) {
                return fn;
            }
            if (symbol instanceof Symbol.Function called) {
                for (Symbol key : symbols.keySet()) {
                    if (key instanceof Symbol.Function declared && declared.name().equals(called.name())) {
                        return BuiltinSymbols.raising(ExpressionError.arityMismatch(declared));
                    }
                }
            }
            return BuiltinSymbols.errorEvaluator(symbol);
        }

        /** A caller symbol, or a ternary assembled from caller-supplied {@code ?} and {@code :}. */
        private SymbolEvaluator symbolEvaluator(Symbol symbol) {
            SymbolEvaluator fn = symbols.get(symbol);
            if (fn != null) {
                return fn;
            }
            if (boolSymbols.isEmpty() && symbol.equals(Symbol.infix("?:"))) {
                SymbolEvaluator condition = symbols.get(Symbol.infix("?"));
                SymbolEvaluator choice = symbols.get(Symbol.infix(":"));
                if (condition != null && choice != null) {
                    return args -> {
                        if (args.length != 3) {
                            throw new ExpressionEvalException(ExpressionError.arityMismatch(symbol));
                        }
                        return choice.evaluate(new double[] {condition.evaluate(new double[] {args[0], args[1]}), args[2]});
                    };
                }
            }
            return null;
        }

        private static double element(Symbol symbol, double[] array, double index) {
            double floored = Math.floor(index);
            if (Double.isNaN(floored) || floored < 0 || floored >= array.length) {
                throw new ExpressionEvalException(ExpressionError.arrayBounds(symbol, index));
            }
            return array[(int) floored];
        }
    }
}
