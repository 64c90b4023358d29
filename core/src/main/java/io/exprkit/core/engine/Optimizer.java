package io.exprkit.core.engine;

import io.exprkit.core.model.Node;
import io.exprkit.core.model.Symbol;
import io.exprkit.core.spi.SymbolEvaluator;
import io.exprkit.core.spi.SymbolResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds evaluators to an unbound tree and folds constant sub-trees.
 *
 * <p>
 * Binding is bottom-up. For each symbol node the impure resolver is consulted first; an impure
 * evaluator is bound as is and its arguments stay live. Otherwise the pure resolver supplies the
 * evaluator, and when every argument is already a literal the node is replaced by a literal of the
 * result. A fold that throws leaves the node bound but unfolded, so the failure surfaces at
 * evaluation time.
 */
final class Optimizer {

    private static final Logger LOG = LoggerFactory.getLogger(Optimizer.class);

    private final SymbolResolver impure;
    private final Function<Symbol, SymbolEvaluator> pure;

    /**
     * @param impure resolver for symbols that must never be folded
     * @param pure   total resolver for everything else; must not return {@code null}
     */
    Optimizer(SymbolResolver impure, Function<Symbol, SymbolEvaluator> pure) {
        this.impure = Objects.requireNonNull(impure, "impure resolver must not be null");
        this.pure = Objects.requireNonNull(pure, "pure resolver must not be null");
    }

    Node optimize(Node node) {
        if (!(node instanceof Node.SymbolNode symbolNode)) {
            return node;
        }
        List<Node> args = new ArrayList<>(symbolNode.args().size());
        for (Node arg : symbolNode.args()) {
            args.add(optimize(arg));
        }
        Symbol symbol = symbolNode.symbol();
        Optional<SymbolEvaluator> impureFn = impure.resolve(symbol);
        if (impureFn.isPresent()) {
            return symbolNode.bind(args, impureFn.get());
        }
        SymbolEvaluator fn = Objects.requireNonNull(pure.apply(symbol), "pure resolver returned null");
        double[] values = new double[args.size()];
        for (int i = 0; i < values.length; i++) {
            if (!(args.get(i) instanceof Node.LiteralNode literal)) {
                return symbolNode.bind(args, fn);
            }
            values[i] = literal.value();
        }
        try {
            return new Node.LiteralNode(fn.evaluate(values));
        } catch (RuntimeException e) {
            LOG.debug("Not folding {}: {}", symbol, e.getMessage());
            return symbolNode.bind(args, fn);
        }
    }
}
