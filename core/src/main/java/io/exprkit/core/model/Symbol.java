package io.exprkit.core.model;

import io.exprkit.core.parse.TokenScanner;
import java.util.Objects;

/**
 * A named element of an expression: a variable, an operator, a function or an array.
 *
 * <p>
 * Equality is by kind and name (case-sensitive). {@link Function} symbols additionally compare
 * their arity using {@link Arity#matches(Arity)}, so {@code function("max", exactly(3))} equals
 * {@code function("max", atLeast(2))}. Hash codes depend on the name alone, which keeps lookups of
 * a call-site function against a variadic declaration working in hash-based tables.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface Symbol {

    /** The raw symbol name, including the delimiters of a quoted identifier. */
    String name();

    static Symbol variable(String name) {
        return new Variable(name);
    }

    static Symbol infix(String name) {
        return new Infix(name);
    }

    static Symbol prefix(String name) {
        return new Prefix(name);
    }

    static Symbol postfix(String name) {
        return new Postfix(name);
    }

    static Symbol function(String name, int arity) {
        return new Function(name, Arity.exactly(arity));
    }

    static Symbol function(String name, Arity arity) {
        return new Function(name, arity);
    }

    static Symbol array(String name) {
        return new Array(name);
    }

    /** The name as it is printed in an expression, escaping quoted identifiers. */
    default String escapedName() {
        return TokenScanner.escapeIdentifier(name());
    }

    /** Human-readable description, e.g. {@code variable x} or {@code function pow()}. */
    default String description() {
        if (this instanceof Variable) {
            return "variable " + escapedName();
        } else if (this instanceof Infix) {
            switch (name()) {
                case "?:":
                    return "ternary operator " + escapedName();
                case "[]":
                    return "subscript operator " + escapedName();
                case "()":
                    return "function call operator " + escapedName();
                default:
                    return "infix operator " + escapedName();
            }
        } else if (this instanceof Prefix) {
            return "prefix operator " + escapedName();
        } else if (this instanceof Postfix) {
            return "postfix operator " + escapedName();
        } else if (this instanceof Function) {
            return "function " + escapedName() + "()";
        }
        return "array " + escapedName() + "[]";
    }

    // ── Implementations ──

    /** A named value. */
    record Variable(String name) implements Symbol {
        public Variable {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String toString() {
            return description();
        }
    }

    /** A binary operator written between its operands. */
    record Infix(String name) implements Symbol {
        public Infix {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String toString() {
            return description();
        }
    }

    /** A unary operator written before its operand. */
    record Prefix(String name) implements Symbol {
        public Prefix {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String toString() {
            return description();
        }
    }

    /** A unary operator written after its operand. */
    record Postfix(String name) implements Symbol {
        public Postfix {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String toString() {
            return description();
        }
    }

    /**
     * A function accepting the number of arguments given by {@code arity}.
     *
     * @param name  function name
     * @param arity accepted argument count
     */
    record Function(String name, Arity arity) implements Symbol {
        public Function {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(arity, "arity must not be null");
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            return o instanceof Function other && name.equals(other.name) && arity.matches(other.arity);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return description();
        }
    }

    /** An array of values accessed by index. */
    record Array(String name) implements Symbol {
        public Array {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String toString() {
            return description();
        }
    }
}
