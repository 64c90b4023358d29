package io.exprkit.core.parse;

import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * A scanning position over a fixed buffer of Unicode code points. A cursor is a start/end pair of
 * offsets into an immutable backing array, so range views share the buffer and cost O(1).
 *
 * <p>
 * Cursors are mutable (scanning advances the start offset) and not thread-safe. Save a position
 * with {@link #position()} and restore it with {@link #reset(int)} to backtrack.
 */
public final class Cursor {

    /** Returned by {@link #first()} and {@link #popFirst()} when the cursor is empty. */
    public static final int EOF = -1;

    private final int[] codePoints;
    private int start;
    private final int end;

    private Cursor(int[] codePoints, int start, int end) {
        this.codePoints = codePoints;
        this.start = start;
        this.end = end;
    }

    /** Creates a cursor over the whole of {@code text}. */
    public static Cursor of(String text) {
        Objects.requireNonNull(text, "text must not be null");
        int[] codePoints = text.codePoints().toArray();
        return new Cursor(codePoints, 0, codePoints.length);
    }

    /** The first code point, or {@link #EOF} if empty. */
    public int first() {
        return isEmpty() ? EOF : codePoints[start];
    }

    public boolean isEmpty() {
        return start >= end;
    }

    /** Consumes and returns the first code point, or {@link #EOF} if empty. */
    public int popFirst() {
        if (isEmpty()) {
            return EOF;
        }
        return codePoints[start++];
    }

    /** The current start offset into the backing buffer. */
    public int position() {
        return start;
    }

    /** The end offset into the backing buffer. */
    public int endPosition() {
        return end;
    }

    /** Moves the start offset back (or forward) to a previously saved {@link #position()}. */
    public void reset(int position) {
        if (position < 0 || position > end) {
            throw new IllegalArgumentException("position " + position + " outside [0, " + end + "]");
        }
        this.start = position;
    }

    /** A view of this cursor's characters up to, but excluding, {@code index}. */
    public Cursor prefixUpTo(int index) {
        checkIndex(index);
        return new Cursor(codePoints, start, index);
    }

    /** A view of this cursor's characters from {@code index} to the end. */
    public Cursor suffixFrom(int index) {
        checkIndex(index);
        return new Cursor(codePoints, index, end);
    }

    /** The number of code points remaining. */
    public int length() {
        return Math.max(0, end - start);
    }

    /**
     * Consumes the longest prefix whose code points all satisfy {@code matching}.
     *
     * @return the consumed text, or {@code null} if the first code point does not match (the
     *     cursor is left unmoved)
     */
    public String scanCharacters(IntPredicate matching) {
        int index = start;
        while (index < end && matching.test(codePoints[index])) {
            index++;
        }
        if (index == start) {
            return null;
        }
        String text = text(start, index);
        start = index;
        return text;
    }

    /**
     * Consumes a single code point if it satisfies {@code matching}.
     *
     * @return the consumed code point as a string, or {@code null} if nothing matched
     */
    public String scanCharacter(IntPredicate matching) {
        if (!isEmpty() && matching.test(codePoints[start])) {
            return new String(codePoints, start++, 1);
        }
        return null;
    }

    /** Consumes the next code point if it equals {@code codePoint}. */
    public boolean scanCharacter(int codePoint) {
        if (!isEmpty() && codePoints[start] == codePoint) {
            start++;
            return true;
        }
        return false;
    }

    /** The text between two offsets of the backing buffer. */
    public String text(int from, int to) {
        return new String(codePoints, from, to - from);
    }

    /** The remaining text. */
    @Override
    public String toString() {
        return isEmpty() ? "" : text(start, end);
    }

    private void checkIndex(int index) {
        if (index < start || index > end) {
            throw new IndexOutOfBoundsException("index " + index + " outside [" + start + ", " + end + "]");
        }
    }
}
