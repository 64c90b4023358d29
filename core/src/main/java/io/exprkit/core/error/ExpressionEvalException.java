package io.exprkit.core.error;

import io.exprkit.core.model.ExpressionError;

/**
 * Thrown when evaluating an expression fails: a parse error reached at run time, an undefined
 * symbol, an arity mismatch, an array index out of bounds, or a failure raised by a bound
 * evaluator. Symbol evaluators throw this to report their own errors, typically with {@link
 * ExpressionError#message(String)}.
 */
public final class ExpressionEvalException extends ExpressionException {

    private static final long serialVersionUID = 1L;

    public ExpressionEvalException(ExpressionError error) {
        super(error, Phase.EVALUATION);
    }

    public ExpressionEvalException(ExpressionError error, Throwable cause) {
        super(error, cause, Phase.EVALUATION);
    }
}
