package io.exprkit.core.engine;

import io.exprkit.core.model.Node;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Source text to parsed tree map. Every read, write and clear goes through one lock. Two threads
 * parsing the same uncached text may both store a result; the last write wins.
 */
public final class ExpressionCache {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionCache.class);

    private final Object lock = new Object();
    private final Map<String, Node> entries = new HashMap<>();

    /** The cached tree for {@code source}, or {@code null}. */
    public Node get(String source) {
        Objects.requireNonNull(source, "source must not be null");
        synchronized (lock) {
            return entries.get(source);
        }
    }

    public void put(String source, Node root) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(root, "root must not be null");
        synchronized (lock) {
            entries.put(source, root);
        }
    }

    public boolean contains(String source) {
        synchronized (lock) {
            return entries.containsKey(source);
        }
    }

    /** Removes one entry; returns {@code true} if it was present. */
    public boolean remove(String source) {
        boolean removed;
        synchronized (lock) {
            removed = entries.remove(source) != null;
        }
        LOG.debug("Removed cached expression '{}': {}", source, removed);
        return removed;
    }

    /** Removes every entry. */
    public void clear() {
        int removed;
        synchronized (lock) {
            removed = entries.size();
            entries.clear();
        }
        LOG.debug("Cleared expression cache ({} entries)", removed);
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }
}
