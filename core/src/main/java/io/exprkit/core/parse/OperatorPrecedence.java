package io.exprkit.core.parse;

import java.util.HashMap;
import java.util.Map;

/**
 * Static precedence and associativity table for infix operators. Higher precedence binds tighter.
 * Operators not in the table (e.g. {@code + - | ^}) have precedence 0 and are left-associative.
 *
 * <p>
 * Used both by the parser, to collapse the operand/operator stack, and by the printer, to decide
 * where parentheses are needed.
 */
public final class OperatorPrecedence {

    /**
     * Precedence entry.
     *
     * @param precedence        numeric precedence
     * @param rightAssociative  whether equal-precedence chains group from the right
     */
    public record Entry(int precedence, boolean rightAssociative) {}

    private static final Entry DEFAULT = new Entry(0, false);
    private static final Map<String, Entry> TABLE = buildTable();

    private OperatorPrecedence() {}

    private static Map<String, Entry> buildTable() {
        Map<String, Entry> table = new HashMap<>();
        left(table, 100, "[]");
        left(table, 2, "<<", ">>", ">>>");
        left(table, 1, "*", "/", "%", "&");
        left(table, -1, "..", "...", "..<");
        left(table, -2, "is", "as", "isa");
        left(table, -3, "??", "?:");
        right(table, -4, "<", "<=", ">=", ">", "==", "!=", "<>", "===", "!==");
        right(table, -4, "lt", "le", "lte", "gt", "ge", "gte", "eq", "ne");
        left(table, -5, "&&", "and");
        left(table, -6, "||", "or");
        left(table, -7, "?", ":");
        right(table, -8, "=", "*=", "/=", "%=", "+=", "-=", "<<=", ">>=", "&=", "^=", "|=", ":=");
        left(table, -100, ",");
        return Map.copyOf(table);
    }

    private static void left(Map<String, Entry> table, int precedence, String... operators) {
        for (String op : operators) {
            table.put(op, new Entry(precedence, false));
        }
    }

    private static void right(Map<String, Entry> table, int precedence, String... operators) {
        for (String op : operators) {
            table.put(op, new Entry(precedence, true));
        }
    }

    /** The entry for {@code operator}, or the default (0, left-associative). */
    public static Entry of(String operator) {
        return TABLE.getOrDefault(operator, DEFAULT);
    }

    /**
     * Returns {@code true} if {@code lhs}, appearing to the left of {@code rhs}, should be applied
     * first. Ties go to the left operator unless it is right-associative.
     */
    public static boolean takesPrecedence(String lhs, String rhs) {
        Entry left = of(lhs);
        Entry right = of(rhs);
        if (left.precedence() == right.precedence()) {
            return !left.rightAssociative();
        }
        return left.precedence() > right.precedence();
    }
}
