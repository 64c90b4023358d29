package io.exprkit.core.engine;

import io.exprkit.core.error.ExpressionEvalException;
import io.exprkit.core.model.Arity;
import io.exprkit.core.model.ExpressionError;
import io.exprkit.core.model.Symbol;
import io.exprkit.core.spi.SymbolEvaluator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in pure symbol tables. {@link #MATH} is always available; {@link #BOOLEAN} is opt-in via
 * {@link ExpressionOption#BOOL_SYMBOLS} (and always available to the advanced binder).
 *
 * <p>
 * Boolean results are {@code 1.0} for true and {@code 0.0} for false; any non-zero argument is
 * truthy. Logical operators do not short-circuit.
 */
public final class BuiltinSymbols {

    /** Standard math constants, operators and functions. */
    public static final Map<Symbol, SymbolEvaluator> MATH = buildMath();

    /** Standard boolean constants and operators, including the ternary operator. */
    public static final Map<Symbol, SymbolEvaluator> BOOLEAN = buildBoolean();

    private BuiltinSymbols() {}

    private static Map<Symbol, SymbolEvaluator> buildMath() {
        Map<Symbol, SymbolEvaluator> symbols = new HashMap<>();

        // constants
        symbols.put(Symbol.variable("pi"), args -> Math.PI);

        // infix operators
        symbols.put(Symbol.infix("+"), args -> args[0] + args[1]);
        symbols.put(Symbol.infix("-"), args -> args[0] - args[1]);
        symbols.put(Symbol.infix("*"), args -> args[0] * args[1]);
        symbols.put(Symbol.infix("/"), args -> args[0] / args[1]);
        symbols.put(Symbol.infix("%"), args -> args[0] % args[1]);

        // prefix operators
        symbols.put(Symbol.prefix("-"), args -> -args[0]);

        // functions - arity 1
        symbols.put(Symbol.function("sqrt", 1), args -> Math.sqrt(args[0]));
        symbols.put(Symbol.function("floor", 1), args -> Math.floor(args[0]));
        symbols.put(Symbol.function("ceil", 1), args -> Math.ceil(args[0]));
        symbols.put(Symbol.function("round", 1), args -> roundHalfAwayFromZero(args[0]));
        symbols.put(Symbol.function("cos", 1), args -> Math.cos(args[0]));
        symbols.put(Symbol.function("acos", 1), args -> Math.acos(args[0]));
        symbols.put(Symbol.function("sin", 1), args -> Math.sin(args[0]));
        symbols.put(Symbol.function("asin", 1), args -> Math.asin(args[0]));
        symbols.put(Symbol.function("tan", 1), args -> Math.tan(args[0]));
        symbols.put(Symbol.function("atan", 1), args -> Math.atan(args[0]));
        symbols.put(Symbol.function("abs", 1), args -> Math.abs(args[0]));

        // functions - arity 2
        symbols.put(Symbol.function("pow", 2), args -> Math.pow(args[0], args[1]));
        symbols.put(Symbol.function("atan2", 2), args -> Math.atan2(args[0], args[1]));
        symbols.put(Symbol.function("mod", 2), args -> args[0] % args[1]);

        // functions - variadic
        symbols.put(Symbol.function("max", Arity.atLeast(2)), args -> {
            double result = args[0];
            for (double arg : args) {
                result = Math.max(result, arg);
            }
            return result;
        });
        symbols.put(Symbol.function("min", Arity.atLeast(2)), args -> {
            double result = args[0];
            for (double arg : args) {
                result = Math.min(result, arg);
            }
            return result;
        });
        return Map.copyOf(symbols);
    }

    private static Map<Symbol, SymbolEvaluator> buildBoolean() {
        Map<Symbol, SymbolEvaluator> symbols = new HashMap<>();

        // constants
        symbols.put(Symbol.variable("true"), args -> 1);
        symbols.put(Symbol.variable("false"), args -> 0);

        // comparison and logical infix operators
        symbols.put(Symbol.infix("=="), args -> truth(args[0] == args[1]));
        symbols.put(Symbol.infix("!="), args -> truth(args[0] != args[1]));
        symbols.put(Symbol.infix(">"), args -> truth(args[0] > args[1]));
        symbols.put(Symbol.infix(">="), args -> truth(args[0] >= args[1]));
        symbols.put(Symbol.infix("<"), args -> truth(args[0] < args[1]));
        symbols.put(Symbol.infix("<="), args -> truth(args[0] <= args[1]));
        symbols.put(Symbol.infix("&&"), args -> truth(args[0] != 0 && args[1] != 0));
        symbols.put(Symbol.infix("||"), args -> truth(args[0] != 0 || args[1] != 0));

        // prefix operators
        symbols.put(Symbol.prefix("!"), args -> truth(args[0] == 0));

        // ternary; the two-argument form is `a ?: b`
        symbols.put(Symbol.infix("?:"), args -> {
            if (args.length == 3) {
                return args[0] != 0 ? args[1] : args[2];
            }
            return args[0] != 0 ? args[0] : args[1];
        });
        return Map.copyOf(symbols);
    }

    /** Looks up {@code symbol} in the math table, then the boolean table. */
    static Optional<SymbolEvaluator> lookup(Symbol symbol) {
        SymbolEvaluator fn = MATH.get(symbol);
        if (fn == null) {
            fn = BOOLEAN.get(symbol);
        }
        return Optional.ofNullable(fn);
    }

    /**
     * The evaluator bound when nothing else resolves {@code symbol}: it always throws. Structural
     * symbols that were never given a meaning report the token that introduced them; a function
     * known to the built-in tables under another arity reports that arity; everything else is
     * undefined.
     */
    static SymbolEvaluator errorEvaluator(Symbol symbol) {
        if (symbol.equals(Symbol.infix(","))
                || symbol.equals(Symbol.infix("[]"))
                || symbol.equals(Symbol.infix("()"))
                || (symbol instanceof Symbol.Function && symbol.name().equals("[]"))) {
            return raising(ExpressionError.unexpectedToken(symbol.name().substring(0, 1)));
        }
        if (symbol instanceof Symbol.Function called) {
            Optional<Symbol> declared = declaredFunction(called);
            if (declared.isPresent()) {
                return raising(ExpressionError.arityMismatch(declared.get()));
            }
        }
        return raising(ExpressionError.undefinedSymbol(symbol));
    }

    private static Optional<Symbol> declaredFunction(Symbol.Function called) {
        for (Map<Symbol, SymbolEvaluator> table : java.util.List.of(MATH, BOOLEAN)) {
            for (Symbol key : table.keySet()) {
                if (key instanceof Symbol.Function declared
                        && declared.name().equals(called.name())
                        && !declared.arity().matches(called.arity())) {
                    return Optional.of(declared);
                }
            }
        }
        return Optional.empty();
    }

    static SymbolEvaluator raising(ExpressionError error) {
        return args -> {
            throw new ExpressionEvalException(error);
        };
    }

    private static double truth(boolean value) {
        return value ? 1 : 0;
    }

    /** Rounds half away from zero, unlike {@link Math#round(double)}. */
    private static double roundHalfAwayFromZero(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return Math.signum(value) * Math.floor(Math.abs(value) + 0.5);
    }
}
