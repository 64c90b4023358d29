package io.exprkit.core.model;

import io.exprkit.core.error.ExpressionEvalException;
import io.exprkit.core.error.ExpressionException;
import io.exprkit.core.parse.ExpressionPrinter;
import io.exprkit.core.spi.SymbolEvaluator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A node of the expression tree. The hierarchy is sealed: a literal value, a symbol applied to
 * argument nodes, or an error captured during parsing.
 *
 * <p>
 * Nodes are immutable. Binding produces a new tree rather than mutating this one, so a bound tree
 * can be evaluated repeatedly and from several threads at once.
 */
public sealed interface Node {

    /**
     * Returns {@code true} if this node can stand where a value is expected. Bare, un-applied
     * operators are the only nodes that cannot.
     */
    boolean isOperand();

    /**
     * Evaluates this subtree.
     *
     * @return the numeric result
     * @throws ExpressionEvalException if any node on the evaluation path fails
     */
    double evaluate();

    /** All distinct symbols reachable from this node, in depth-first order. */
    default Set<Symbol> symbols() {
        Set<Symbol> symbols = new LinkedHashSet<>();
        collectSymbols(this, symbols);
        return symbols;
    }

    /** Pretty-printed source text that re-parses to an equivalent tree. */
    default String description() {
        return ExpressionPrinter.print(this);
    }

    private static void collectSymbols(Node node, Set<Symbol> into) {
        if (node instanceof SymbolNode symbolNode) {
            into.add(symbolNode.symbol());
            for (Node arg : symbolNode.args()) {
                collectSymbols(arg, into);
            }
        }
    }

    // ── Implementations ──

    /** A numeric constant. */
    record LiteralNode(double value) implements Node {

        @Override
        public boolean isOperand() {
            return true;
        }

        @Override
        public double evaluate() {
            return value;
        }

        @Override
        public String toString() {
            return description();
        }
    }

    /**
     * A symbol applied to its arguments.
     *
     * @param symbol    the symbol
     * @param args      argument nodes; empty for variables and for bare operators
     * @param evaluator the bound evaluator, or {@code null} before binding
     */
    record SymbolNode(Symbol symbol, List<Node> args, SymbolEvaluator evaluator) implements Node {

        public SymbolNode {
            Objects.requireNonNull(symbol, "symbol must not be null");
            args = List.copyOf(args);
        }

        /** An unbound node. */
        public SymbolNode(Symbol symbol, List<Node> args) {
            this(symbol, args, null);
        }

        /** Returns a copy of this node bound to {@code evaluator} with the given arguments. */
        public SymbolNode bind(List<Node> boundArgs, SymbolEvaluator boundEvaluator) {
            return new SymbolNode(symbol, boundArgs, boundEvaluator);
        }

        @Override
        public boolean isOperand() {
            if (!args.isEmpty()) {
                return true;
            }
            return !(symbol instanceof Symbol.Infix
                    || symbol instanceof Symbol.Prefix
                    || symbol instanceof Symbol.Postfix);
        }

        @Override
        public double evaluate() {
            if (evaluator == null) {
                throw new ExpressionEvalException(ExpressionError.undefinedSymbol(symbol));
            }
            double[] values = new double[args.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = args.get(i).evaluate();
            }
            try {
                return evaluator.evaluate(values);
            } catch (ExpressionEvalException e) {
                throw e;
            } catch (ExpressionException e) {
                throw new ExpressionEvalException(e.error(), e);
            } catch (RuntimeException e) {
                String text = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                throw new ExpressionEvalException(ExpressionError.message(text), e);
            }
        }

        @Override
        public String toString() {
            return description();
        }
    }

    /**
     * A parse failure kept as a leaf value.
     *
     * @param error  the parse error
     * @param source the offending source text, printed verbatim by {@link #description()}
     */
    record ErrorNode(ExpressionError error, String source) implements Node {

        public ErrorNode {
            Objects.requireNonNull(error, "error must not be null");
            Objects.requireNonNull(source, "source must not be null");
        }

        @Override
        public boolean isOperand() {
            return true;
        }

        @Override
        public double evaluate() {
            throw new ExpressionEvalException(error);
        }

        @Override
        public String toString() {
            return description();
        }
    }
}
