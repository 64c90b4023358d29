package io.exprkit.core.model;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The result of parsing alone, before any symbol is bound. Cannot be evaluated; bind it with
 * {@link io.exprkit.core.engine.Expression} first. Parsing never throws: a syntax error is the
 * root {@link Node.ErrorNode}, reported by {@link #error()}.
 *
 * <p>
 * Thread-safe and immutable.
 *
 * @param root the unbound tree
 */
public record ParsedExpression(Node root) {

    public ParsedExpression {
        Objects.requireNonNull(root, "root must not be null");
    }

    /** The pretty-printed expression, or the original text if it failed to parse. */
    public String description() {
        return root.description();
    }

    /** All symbols referenced by the expression. */
    public Set<Symbol> symbols() {
        return root.symbols();
    }

    /** The parse error, if the expression is invalid. */
    public Optional<ExpressionError> error() {
        if (root instanceof Node.ErrorNode errorNode) {
            return Optional.of(errorNode.error());
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return description();
    }
}
