package io.exprkit.core.engine;

import io.exprkit.core.config.EngineConfig;
import io.exprkit.core.error.ExpressionParseException;
import io.exprkit.core.model.ExpressionError;
import io.exprkit.core.model.Node;
import io.exprkit.core.model.ParsedExpression;
import io.exprkit.core.parse.Cursor;
import io.exprkit.core.parse.SubExpressionParser;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses source text into unbound trees, optionally through an {@link ExpressionCache}.
 *
 * <p>
 * {@link #parse(String)} never throws: a syntax error becomes the root {@link Node.ErrorNode} of
 * the result, printing as the original text. {@link #parseStrict(String)} raises it instead.
 * Trees deeper than the configured maximum are rejected the same way, so binding, evaluating and
 * printing a returned tree never run out of call stack.
 *
 * <p>
 * Thread-safe. {@link #shared()} is a convenience instance with default limits; applications that
 * want an isolated cache construct their own.
 */
public final class ExpressionParser {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionParser.class);

    private static final ExpressionParser SHARED = new ExpressionParser(EngineConfig.DEFAULT);

    private final ExpressionCache cache;
    private final boolean cacheEnabled;
    private final int maxNestingDepth;
    private final int maxTreeDepth;
    private final int maxSourceLength;
    private final AtomicLong tokenizerRuns = new AtomicLong();

    /** A parser with its own cache and the limits of {@code config}. */
    public ExpressionParser(EngineConfig config) {
        this(config, new ExpressionCache());
    }

    public ExpressionParser(EngineConfig config, ExpressionCache cache) {
        Objects.requireNonNull(config, "config must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.cacheEnabled = config.cacheEnabled();
        this.maxNestingDepth = config.maxNestingDepth();
        this.maxTreeDepth = config.maxTreeDepth();
        this.maxSourceLength = config.maxSourceLength();
    }

    /** The process-wide default parser. */
    public static ExpressionParser shared() {
        return SHARED;
    }

    // --- Parsing ---

    /** Parses {@code source}, using the cache when it is enabled. Never throws on bad syntax. */
    public ParsedExpression parse(String source) {
        return parse(source, true);
    }

    /**
     * Parses {@code source}. With {@code useCache} (and the cache enabled) an identical earlier
     * parse is reused without running the tokenizer.
     */
    public ParsedExpression parse(String source, boolean useCache) {
        Objects.requireNonNull(source, "source must not be null");
        boolean cached = useCache && cacheEnabled;
        if (cached) {
            Node root = cache.get(source);
            if (root != null) {
                LOG.debug("Cache hit for '{}'", source);
                return new ParsedExpression(root);
            }
            LOG.debug("Cache miss for '{}'", source);
        }
        Node root = parseRoot(source);
        if (cached) {
            cache.put(source, root);
        }
        return new ParsedExpression(root);
    }

    /**
     * Parses {@code source} like {@link #parse(String)}, but raises a syntax error.
     *
     * @throws ExpressionParseException if the text is not a valid expression
     */
    public ParsedExpression parseStrict(String source) {
        ParsedExpression parsed = parse(source);
        if (parsed.root() instanceof Node.ErrorNode error) {
            throw new ExpressionParseException(error.error(), source);
        }
        return parsed;
    }

    /**
     * Parses an expression embedded in a larger text, stopping before any of {@code delimiters}.
     * The cursor is left after the consumed text; on failure the error leaf holds the consumed
     * text. Never cached.
     */
    public ParsedExpression parseSubExpression(Cursor cursor, String... delimiters) {
        Objects.requireNonNull(cursor, "cursor must not be null");
        int start = cursor.position();
        tokenizerRuns.incrementAndGet();
        try {
            Node root = SubExpressionParser.parse(cursor, List.of(delimiters), maxNestingDepth);
            return new ParsedExpression(checkDepth(root));
        } catch (ExpressionParseException e) {
            String consumed = cursor.text(start, cursor.position());
            LOG.debug("Failed to parse sub-expression '{}': {}", consumed, e.detail());
            return new ParsedExpression(new Node.ErrorNode(e.error(), consumed));
        }
    }

    private Node parseRoot(String source) {
        tokenizerRuns.incrementAndGet();
        if (source.length() > maxSourceLength) {
            ExpressionError error = ExpressionError.message(
                    "Expression length " + source.length() + " exceeds maximum of " + maxSourceLength);
            LOG.debug("Rejected expression: {}", error.description());
            return new Node.ErrorNode(error, source);
        }
        try {
            return checkDepth(SubExpressionParser.parse(Cursor.of(source), List.of(), maxNestingDepth));
        } catch (ExpressionParseException e) {
            LOG.debug("Failed to parse '{}': {}", source, e.detail());
            return new Node.ErrorNode(e.error(), source);
        }
    }

    /**
     * Returns {@code root} if no path in it is longer than {@code maxTreeDepth} nodes. Walks the tree
     * with an explicit stack and stops at the first path over the limit.
     */
    private Node checkDepth(Node root) {
        Deque<Node> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(1);
        while (!nodes.isEmpty()) {
            Node node = nodes.pop();
            int depth = depths.pop();
            if (depth > maxTreeDepth) {
                throw new ExpressionParseException(
                        ExpressionError.message("Expression tree depth exceeds maximum of " + maxTreeDepth));
            }
            if (node instanceof Node.SymbolNode symbolNode) {
                for (Node arg : symbolNode.args()) {
                    nodes.push(arg);
                    depths.push(depth + 1);
                }
            }
        }
        return root;
    }

    // --- Cache management ---

    /** Empties the cache. */
    public void clearCache() {
        cache.clear();
    }

    /** Removes the cached entry for {@code source}, if any. */
    public void clearCache(String source) {
        Objects.requireNonNull(source, "source must not be null");
        cache.remove(source);
    }

    public boolean isCached(String source) {
        return cache.contains(source);
    }

    public int cacheSize() {
        return cache.size();
    }

    /** Number of times the tokenizer has run; cache hits do not count. */
    public long tokenizerRuns() {
        return tokenizerRuns.get();
    }
}
