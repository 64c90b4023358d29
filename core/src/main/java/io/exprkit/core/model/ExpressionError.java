package io.exprkit.core.model;

import io.exprkit.core.parse.ExpressionPrinter;
import java.util.Objects;

/**
 * Typed description of a parse or evaluation failure. Errors are plain values: the parser embeds
 * them in the tree as {@link Node.ErrorNode} leaves and evaluators raise them wrapped in an
 * {@link io.exprkit.core.error.ExpressionEvalException}.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface ExpressionError {

    /** The error reported for an empty expression (an unexpected token of {@code ""}). */
    ExpressionError EMPTY_EXPRESSION = new UnexpectedToken("");

    /** Human-readable rendering of this error. */
    String description();

    static ExpressionError message(String text) {
        return new Message(text);
    }

    static ExpressionError unexpectedToken(String token) {
        return new UnexpectedToken(token);
    }

    static ExpressionError missingDelimiter(String delimiter) {
        return new MissingDelimiter(delimiter);
    }

    static ExpressionError undefinedSymbol(Symbol symbol) {
        return new UndefinedSymbol(symbol);
    }

    static ExpressionError arityMismatch(Symbol symbol) {
        return new ArityMismatch(symbol);
    }

    static ExpressionError arrayBounds(Symbol symbol, double index) {
        return new ArrayBounds(symbol, index);
    }

    // ── Implementations ──

    /** An application-specific error raised by a caller or library evaluator. */
    record Message(String text) implements ExpressionError {
        public Message {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public String description() {
            return text;
        }
    }

    /** A sequence of characters the parser did not expect at that position. */
    record UnexpectedToken(String token) implements ExpressionError {
        public UnexpectedToken {
            Objects.requireNonNull(token, "token must not be null");
        }

        @Override
        public String description() {
            if (token.isEmpty()) {
                return "Empty expression";
            }
            return "Unexpected token `" + token + "`";
        }
    }

    /** An expected closing delimiter never appeared. */
    record MissingDelimiter(String delimiter) implements ExpressionError {
        public MissingDelimiter {
            Objects.requireNonNull(delimiter, "delimiter must not be null");
        }

        @Override
        public String description() {
            return "Missing `" + delimiter + "`";
        }
    }

    /** No evaluator was bound for the symbol. */
    record UndefinedSymbol(Symbol symbol) implements ExpressionError {
        public UndefinedSymbol {
            Objects.requireNonNull(symbol, "symbol must not be null");
        }

        @Override
        public String description() {
            return "Undefined " + symbol.description();
        }
    }

    /**
     * A symbol was used with the wrong number of arguments. For functions the carried symbol holds
     * the <em>expected</em> arity.
     */
    record ArityMismatch(Symbol symbol) implements ExpressionError {
        public ArityMismatch {
            Objects.requireNonNull(symbol, "symbol must not be null");
        }

        /** The arity the symbol expects. */
        public Arity expected() {
            if (symbol instanceof Symbol.Function function) {
                return function.arity();
            } else if (symbol instanceof Symbol.Infix) {
                switch (symbol.name()) {
                    case "()":
                        return Arity.atLeast(1);
                    case "[]":
                        return Arity.exactly(1);
                    case "?:":
                        return Arity.exactly(3);
                    default:
                        return Arity.exactly(2);
                }
            } else if (symbol instanceof Symbol.Variable) {
                return Arity.exactly(0);
            }
            return Arity.exactly(1);
        }

        @Override
        public String description() {
            String text = symbol.description();
            return Character.toUpperCase(text.charAt(0)) + text.substring(1) + " expects " + expected().description();
        }
    }

    /** An array was indexed outside its valid range. */
    record ArrayBounds(Symbol symbol, double index) implements ExpressionError {
        public ArrayBounds {
            Objects.requireNonNull(symbol, "symbol must not be null");
        }

        @Override
        public String description() {
            return "Index " + ExpressionPrinter.formatNumber(index) + " out of bounds for " + symbol.description();
        }
    }
}
