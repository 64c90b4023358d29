package io.exprkit.core.model;

/**
 * The number of arguments accepted by a function or operator: either an exact count or a minimum
 * count.
 *
 * <p>
 * Record equality is structural. Use {@link #matches(Arity)} for the call-site comparison, where
 * "at least N" is satisfied by any exact count of N or more. That rule lets a variadic
 * declaration such as {@code max(...)} match a call with three arguments.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface Arity {

    /** Any number of arguments, including none. */
    Arity ANY = atLeast(0);

    static Arity exactly(int count) {
        return new Exactly(count);
    }

    static Arity atLeast(int count) {
        return new AtLeast(count);
    }

    /**
     * Returns {@code true} if this arity is compatible with {@code other}. Two exact arities (or two
     * minimums) match when their counts are equal; an exact arity matches a minimum when the exact
     * count is not below it.
     */
    boolean matches(Arity other);

    /** Human-readable text, e.g. {@code 1 argument} or {@code at least 2 arguments}. */
    String description();

    /** Exactly {@code count} arguments. */
    record Exactly(int count) implements Arity {
        public Exactly {
            if (count < 0) {
                throw new IllegalArgumentException("arity must not be negative, got: " + count);
            }
        }

        @Override
        public boolean matches(Arity other) {
            if (other instanceof Exactly exactly) {
                return count == exactly.count;
            }
            return count >= ((AtLeast) other).count;
        }

        @Override
        public String description() {
            return count + (count == 1 ? " argument" : " arguments");
        }
    }

    /** At least {@code count} arguments. */
    record AtLeast(int count) implements Arity {
        public AtLeast {
            if (count < 0) {
                throw new IllegalArgumentException("arity must not be negative, got: " + count);
            }
        }

        @Override
        public boolean matches(Arity other) {
            if (other instanceof AtLeast atLeast) {
                return count == atLeast.count;
            }
            return ((Exactly) other).count >= count;
        }

        @Override
        public String description() {
            return "at least " + count + (count == 1 ? " argument" : " arguments");
        }
    }
}
