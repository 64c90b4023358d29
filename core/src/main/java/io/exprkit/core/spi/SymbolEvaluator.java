package io.exprkit.core.spi;

/**
 * Computes the value of a symbol from its already-evaluated arguments.
 *
 * <p>
 * Implementations bound to an {@link io.exprkit.core.engine.Expression} that is shared across
 * threads MUST be safe for concurrent invocation. The engine cannot enforce this.
 *
 * <p>
 * To report a failure, throw {@link io.exprkit.core.error.ExpressionEvalException}. Any other
 * runtime exception is wrapped into one by the evaluator walk.
 */
@FunctionalInterface
public interface SymbolEvaluator {

    /**
     * Evaluates the symbol.
     *
     * @param args argument values in source order; empty for variables. Implementations must not
     *     modify the array.
     * @return the result value
     * @throws io.exprkit.core.error.ExpressionEvalException if the symbol cannot be evaluated
     */
    double evaluate(double[] args);
}
