package io.exprkit.core.parse;

import io.exprkit.core.model.Node;
import io.exprkit.core.model.Symbol;
import java.util.List;
import java.util.StringJoiner;

/**
 * Pretty-prints a tree back to source text with minimal parentheses. Uses the same precedence
 * table as the parser, so printing then re-parsing yields the same grouping. Error leaves print
 * their captured source verbatim.
 *
 * <p>
 * Stateless; all methods are static.
 */
public final class ExpressionPrinter {

    /** Precedence name of an assembled {@code a ? b : c}; the parser builds it at the {@code ?} level. */
    private static final String TERNARY = "?";

    /** Integral doubles below this magnitude print without a fraction. */
    private static final double LONG_LIMIT = 0x1p63;

    private ExpressionPrinter() {}

    /** Prints {@code node} as expression source. */
    public static String print(Node node) {
        if (node instanceof Node.LiteralNode literal) {
            return formatNumber(literal.value());
        } else if (node instanceof Node.ErrorNode error) {
            return error.source();
        }
        Node.SymbolNode symbolNode = (Node.SymbolNode) node;
        Symbol symbol = symbolNode.symbol();
        if (!symbolNode.isOperand()) {
            return symbol.escapedName();
        }
        List<Node> args = symbolNode.args();
        if (symbol instanceof Symbol.Prefix) {
            String operand = print(args.get(0));
            if (needsParentheses(args.get(0)) || needsSeparation(symbol.name(), operand)) {
                return symbol.escapedName() + "(" + operand + ")";
            }
            return symbol.escapedName() + operand;
        } else if (symbol instanceof Symbol.Postfix) {
            String operand = print(args.get(0));
            if (needsParentheses(args.get(0)) || needsSeparation(operand, symbol.name())) {
                return "(" + operand + ")" + symbol.escapedName();
            }
            return operand + symbol.escapedName();
        } else if (symbol instanceof Symbol.Infix) {
            return printInfix(symbol, args);
        } else if (symbol instanceof Symbol.Variable) {
            return symbol.escapedName();
        } else if (symbol instanceof Symbol.Function) {
            if (symbol.name().equals("[]")) {
                return "[" + arguments(args) + "]";
            }
            return symbol.escapedName() + "(" + arguments(args) + ")";
        }
        return symbol.escapedName() + "[" + arguments(args) + "]";
    }

    private static String printInfix(Symbol symbol, List<Node> args) {
        switch (symbol.name()) {
            case ",":
                return print(args.get(0)) + ", " + print(args.get(1));
            case "()":
                return callee(args.get(0)) + "(" + arguments(args.subList(1, args.size())) + ")";
            case "[]":
                return callee(args.get(0)) + "[" + print(args.get(1)) + "]";
            case "?:":
                if (args.size() == 3) {
                    return ternaryOperand(args.get(0), true)
                            + " ? "
                            + ternaryOperand(args.get(1), false)
                            + " : "
                            + ternaryOperand(args.get(2), false);
                }
                break;
            default:
                break;
        }
        String name = symbol.name();
        Node lhs = args.get(0);
        String left = print(lhs);
        if (infixName(lhs) != null && !OperatorPrecedence.takesPrecedence(infixName(lhs), name)) {
            left = "(" + left + ")";
        }
        Node rhs = args.get(1);
        String right = print(rhs);
        if (infixName(rhs) != null && OperatorPrecedence.takesPrecedence(name, infixName(rhs))) {
            right = "(" + right + ")";
        }
        return left + " " + symbol.escapedName() + " " + right;
    }

    /**
     * An operand of {@code a ? b : c}. The condition may be a left-nested ternary; the branches must
     * bind tighter than {@code ?} or they would re-attach to the outer operator.
     */
    private static String ternaryOperand(Node node, boolean condition) {
        String text = print(node);
        String name = infixName(node);
        if (name == null) {
            return text;
        }
        boolean grouped = condition
                ? !OperatorPrecedence.takesPrecedence(name, TERNARY)
                : OperatorPrecedence.of(name).precedence() <= OperatorPrecedence.of(TERNARY).precedence();
        return grouped ? "(" + text + ")" : text;
    }

    /** The receiver of a call or subscript; operator applications need grouping. */
    private static String callee(Node node) {
        String text = print(node);
        return needsParentheses(node) || isPrefix(node) ? "(" + text + ")" : text;
    }

    private static String arguments(List<Node> args) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Node arg : args) {
            String text = print(arg);
            joiner.add(",".equals(infixName(arg)) ? "(" + text + ")" : text);
        }
        return joiner.toString();
    }

    private static boolean needsParentheses(Node node) {
        if (node instanceof Node.ErrorNode) {
            return true;
        }
        return node instanceof Node.SymbolNode symbolNode
                && (symbolNode.symbol() instanceof Symbol.Infix || symbolNode.symbol() instanceof Symbol.Postfix);
    }

    private static boolean isPrefix(Node node) {
        return node instanceof Node.SymbolNode symbolNode && symbolNode.symbol() instanceof Symbol.Prefix;
    }

    /** Two adjacent tokens would fuse (or split differently) unless separated. */
    private static boolean needsSeparation(String lhs, String rhs) {
        if (lhs.isEmpty() || rhs.isEmpty()) {
            return false;
        }
        int last = lhs.codePointBefore(lhs.length());
        int first = rhs.codePointAt(0);
        return last == '.' || isOperatorLike(last) == isOperatorLike(first);
    }

    private static boolean isOperatorLike(int c) {
        return CharacterClasses.isOperator(c) || c == '-';
    }

    /** The precedence-table name of an infix node, or {@code null} for anything else. */
    private static String infixName(Node node) {
        if (node instanceof Node.SymbolNode symbolNode && symbolNode.symbol() instanceof Symbol.Infix) {
            String name = symbolNode.symbol().name();
            return name.equals("?:") && symbolNode.args().size() == 3 ? TERNARY : name;
        }
        return null;
    }

    /** Formats a number the way the printer writes literals: integral values without a fraction. */
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < LONG_LIMIT) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
