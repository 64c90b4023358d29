package io.exprkit.core.spi;

import io.exprkit.core.model.Symbol;
import java.util.Optional;

/**
 * Symbol-resolution policy used when binding a parsed expression. Returns the evaluator for a
 * symbol, or empty if this resolver does not know it.
 *
 * <p>
 * Binding consults two resolvers. Evaluators returned by the <em>impure</em> resolver are always
 * bound live and re-run on every evaluation, so they may read external mutable state. Evaluators
 * returned by the <em>pure</em> resolver are deterministic and may be folded into constants.
 */
@FunctionalInterface
public interface SymbolResolver {

    /** A resolver that knows no symbols. */
    SymbolResolver NONE = symbol -> Optional.empty();

    Optional<SymbolEvaluator> resolve(Symbol symbol);
}
