package io.exprkit.core.error;

import io.exprkit.core.model.ExpressionError;

/**
 * Thrown when an expression has a structural problem (unexpected token, missing delimiter). The
 * non-throwing parse entry points embed the error in the tree instead; this exception only escapes
 * from the strict entry points. Carries the offending {@code source} text when known.
 */
public final class ExpressionParseException extends ExpressionException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public ExpressionParseException(ExpressionError error) {
        this(error, null);
    }

    public ExpressionParseException(ExpressionError error, String source) {
        super(error, Phase.PARSE);
        this.source = source;
    }

    /** The source text that failed to parse, or {@code null} if not recorded. */
    public String source() {
        return source;
    }
}
