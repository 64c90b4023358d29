package io.exprkit.core.error;

import io.exprkit.core.model.ExpressionError;
import java.util.Objects;

/**
 * Abstract base for all exprkit exceptions. Never thrown directly; use {@link
 * ExpressionParseException} or {@link ExpressionEvalException}. Every instance carries the typed
 * {@link ExpressionError} that caused it; the exception message is the error's description.
 */
public abstract class ExpressionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error surfaced. */
    public enum Phase {
        PARSE,
        EVALUATION
    }

    private final transient ExpressionError error;
    private final Phase phase;

    protected ExpressionException(ExpressionError error, Phase phase) {
        super(Objects.requireNonNull(error, "error must not be null").description());
        this.error = error;
        this.phase = phase;
    }

    protected ExpressionException(ExpressionError error, Throwable cause, Phase phase) {
        super(Objects.requireNonNull(error, "error must not be null").description(), cause);
        this.error = error;
        this.phase = phase;
    }

    /** The typed error value. */
    public ExpressionError error() {
        return error;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error surfaced. */
    public Phase phase() {
        return phase;
    }
}
