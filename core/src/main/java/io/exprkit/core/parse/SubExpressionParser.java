package io.exprkit.core.parse;

import io.exprkit.core.error.ExpressionParseException;
import io.exprkit.core.model.ExpressionError;
import io.exprkit.core.model.Node;
import io.exprkit.core.model.Symbol;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Operand/operator stack parser. Tokens are pushed onto a stack as they are scanned; the stack is
 * then collapsed into a single tree using {@link OperatorPrecedence}.
 *
 * <p>
 * Operator fixity is decided by whitespace adjacency, not by a grammar: an operator with
 * whitespace on both sides or on neither side is infix, whitespace only before makes it prefix,
 * whitespace only after makes it postfix. The collapse step then repairs the cases this heuristic
 * gets wrong (an operator that turns out to have no right operand, two operators in a row).
 *
 * <p>
 * Structural problems are thrown as {@link ExpressionParseException}; callers that want the
 * deferred behaviour wrap the result in an {@link Node.ErrorNode}.
 *
 * <p>
 * Not thread-safe: one instance parses one cursor.
 */
public final class SubExpressionParser {

    /** Operators that, followed by another bare operator, make that operator a prefix. */
    private static final Set<String> INFIX_BEFORE_PREFIX = Set.of("+", "/", "*");

    private final Cursor cursor;
    private final int maxNestingDepth;

    private SubExpressionParser(Cursor cursor, int maxNestingDepth) {
        this.cursor = cursor;
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Parses an expression from {@code cursor}, stopping before any of {@code delimiters} or at the
     * end of input. The cursor is advanced past the consumed text.
     *
     * @param cursor          the input, advanced in place
     * @param delimiters      strings that end the expression; may be empty
     * @param maxNestingDepth maximum bracket nesting
     * @return the unbound tree
     * @throws ExpressionParseException if the text is not a valid expression
     */
    public static Node parse(Cursor cursor, List<String> delimiters, int maxNestingDepth) {
        return new SubExpressionParser(cursor, maxNestingDepth).parseSubExpression(delimiters, 0);
    }

    private Node parseSubExpression(List<String> delimiters, int depth) {
        if (depth > maxNestingDepth) {
            throw failure(ExpressionError.message("Expression nesting exceeds maximum depth of " + maxNestingDepth));
        }
        List<Node> stack = new ArrayList<>();
        TokenScanner.skipWhitespace(cursor);
        boolean operandPosition = true;
        boolean precededByWhitespace = true;
        while (!TokenScanner.atDelimiter(cursor, delimiters)) {
            Node expression = nextToken();
            if (expression == null) {
                break;
            }
            boolean followedByWhitespace = TokenScanner.skipWhitespace(cursor) || cursor.isEmpty();

            if (isBare(expression, Symbol.Infix.class)) {
                String name = symbolOf(expression).name();
                switch (name) {
                    case "(":
                        openParenthesis(stack, depth);
                        operandPosition = false;
                        followedByWhitespace = TokenScanner.skipWhitespace(cursor);
                        break;
                    case ",":
                        Node previous = last(stack);
                        if (previous != null && isBare(previous, Symbol.Infix.class)) {
                            // an infix operator with nothing after it before a separator
                            stack.set(stack.size() - 1, bare(Symbol.postfix(symbolOf(previous).name())));
                        }
                        stack.add(expression);
                        operandPosition = true;
                        followedByWhitespace = TokenScanner.skipWhitespace(cursor);
                        break;
                    case "[":
                        openBracket(stack, depth);
                        operandPosition = false;
                        followedByWhitespace = TokenScanner.skipWhitespace(cursor);
                        break;
                    default:
                        if (precededByWhitespace == followedByWhitespace) {
                            stack.add(expression);
                        } else if (precededByWhitespace) {
                            stack.add(bare(Symbol.prefix(name)));
                        } else {
                            stack.add(bare(Symbol.postfix(name)));
                        }
                        operandPosition = true;
                }
            } else if (!operandPosition && isBare(expression, Symbol.Variable.class)) {
                // a word where an operator is expected, e.g. `a and b`
                operandPosition = true;
                stack.add(bare(Symbol.infix(symbolOf(expression).name())));
            } else {
                operandPosition = false;
                stack.add(expression);
            }
            precededByWhitespace = followedByWhitespace;
        }

        int start = cursor.position();
        if (!TokenScanner.atDelimiter(cursor, delimiters)) {
            String junk = TokenScanner.scanToEndOfToken(cursor);
            if (junk != null) {
                cursor.reset(start);
                throw failure(ExpressionError.unexpectedToken(junk));
            }
        }

        collapse(stack);
        if (stack.isEmpty()) {
            throw failure(ExpressionError.EMPTY_EXPRESSION);
        }
        Node result = stack.get(0);
        if (result instanceof Node.ErrorNode error) {
            throw failure(error.error());
        }
        if (isOperand(result)) {
            return result;
        }
        throw failure(ExpressionError.unexpectedToken(result.description()));
    }

    private Node nextToken() {
        Node token = TokenScanner.scanNumericLiteral(cursor);
        if (token == null) {
            token = TokenScanner.scanIdentifier(cursor);
        }
        if (token == null) {
            token = TokenScanner.scanOperator(cursor);
        }
        if (token == null) {
            token = TokenScanner.scanEscapedIdentifier(cursor);
        }
        return token;
    }

    private void openParenthesis(List<Node> stack, int depth) {
        Node last = last(stack);
        if (last != null && isBare(last, Symbol.Variable.class)) {
            List<Node> args = scanArguments(')', depth);
            Symbol function = Symbol.function(symbolOf(last).name(), args.size());
            stack.set(stack.size() - 1, new Node.SymbolNode(function, args));
        } else if (last != null && isOperand(last)) {
            List<Node> args = scanArguments(')', depth);
            List<Node> callArgs = new ArrayList<>(args.size() + 1);
            callArgs.add(last);
            callArgs.addAll(args);
            stack.set(stack.size() - 1, new Node.SymbolNode(Symbol.infix("()"), callArgs));
        } else {
            stack.add(parseSubExpression(List.of(")"), depth + 1));
            if (!cursor.scanCharacter(')')) {
                throw failure(ExpressionError.missingDelimiter(")"));
            }
        }
    }

    private void openBracket(List<Node> stack, int depth) {
        List<Node> args = scanArguments(']', depth);
        Node last = last(stack);
        if (last != null && isBare(last, Symbol.Variable.class)) {
            Symbol array = Symbol.array(symbolOf(last).name());
            if (args.size() != 1) {
                throw failure(ExpressionError.arityMismatch(array));
            }
            stack.set(stack.size() - 1, new Node.SymbolNode(array, args));
        } else if (last != null && isOperand(last)) {
            if (args.size() != 1) {
                throw failure(ExpressionError.arityMismatch(Symbol.infix("[]")));
            }
            stack.set(stack.size() - 1, new Node.SymbolNode(Symbol.infix("[]"), List.of(last, args.get(0))));
        } else {
            stack.add(new Node.SymbolNode(Symbol.function("[]", args.size()), args));
        }
    }

    private List<Node> scanArguments(int delimiter, int depth) {
        List<Node> args = new ArrayList<>();
        if (cursor.first() != delimiter) {
            List<String> delimiters = List.of(",", new String(Character.toChars(delimiter)));
            do {
                try {
                    args.add(parseSubExpression(delimiters, depth + 1));
                } catch (ExpressionParseException e) {
                    if (!ExpressionError.EMPTY_EXPRESSION.equals(e.error())) {
                        throw e;
                    }
                    String token = cursor.scanCharacter(c -> true);
                    if (token != null) {
                        throw failure(ExpressionError.unexpectedToken(token));
                    }
                }
            } while (cursor.scanCharacter(','));
        }
        if (!cursor.scanCharacter(delimiter)) {
            throw failure(ExpressionError.missingDelimiter(new String(Character.toChars(delimiter))));
        }
        return args;
    }

    /**
     * Collapses the stack into a single node. Reduction restarts from the bottom of the stack
     * after every rewrite; skipping ahead to a later index defers to the operator on the right.
     */
    private static void collapse(List<Node> stack) {
        int i = 0;
        while (stack.size() > i + 1) {
            Node lhs = stack.get(i);
            Node rhs = stack.get(i + 1);
            if (isOperand(lhs)) {
                if (isOperand(rhs)) {
                    if (!(lhs instanceof Node.SymbolNode postfix && postfix.symbol() instanceof Symbol.Postfix)) {
                        throw failure(ExpressionError.unexpectedToken(rhs.description()));
                    }
                    // the postfix operator was really infix
                    stack.set(i, postfix.args().get(0));
                    stack.add(i + 1, bare(Symbol.infix(postfix.symbol().name())));
                    continue;
                }
                if (rhs instanceof Node.ErrorNode error) {
                    throw failure(error.error());
                }
                Symbol symbol = symbolOf(rhs);
                if (stack.size() <= i + 2 || symbol instanceof Symbol.Postfix) {
                    replace(stack, i, 2, new Node.SymbolNode(Symbol.postfix(symbol.name()), List.of(lhs)));
                    i = 0;
                    continue;
                }
                Node next = stack.get(i + 2);
                if (isOperand(next)) {
                    if (stack.size() > i + 3) {
                        Node after = stack.get(i + 3);
                        if (isOperand(after)
                                || !isBare(after, Symbol.Infix.class)
                                || !OperatorPrecedence.takesPrecedence(symbol.name(), symbolOf(after).name())) {
                            i += 2;
                            continue;
                        }
                    }
                    Node combined;
                    if (symbol.name().equals(":")
                            && lhs instanceof Node.SymbolNode condition
                            && condition.symbol().equals(Symbol.infix("?"))) {
                        combined = new Node.SymbolNode(
                                Symbol.infix("?:"),
                                List.of(condition.args().get(0), condition.args().get(1), next));
                    } else {
                        combined = new Node.SymbolNode(Symbol.infix(symbol.name()), List.of(lhs, next));
                    }
                    replace(stack, i, 3, combined);
                    i = 0;
                } else if (next instanceof Node.ErrorNode error) {
                    throw failure(error.error());
                } else if (symbolOf(next) instanceof Symbol.Prefix) {
                    i += 2;
                } else if (INFIX_BEFORE_PREFIX.contains(symbol.name())) {
                    stack.set(i + 2, bare(Symbol.prefix(symbolOf(next).name())));
                    i += 2;
                } else {
                    stack.set(i + 1, bare(Symbol.postfix(symbol.name())));
                }
            } else if (lhs instanceof Node.ErrorNode error) {
                throw failure(error.error());
            } else if (isOperand(rhs)) {
                // a bare operator with no left operand is a prefix operator
                replace(stack, i, 2, new Node.SymbolNode(Symbol.prefix(symbolOf(lhs).name()), List.of(rhs)));
                i = 0;
            } else if (rhs instanceof Node.ErrorNode error) {
                throw failure(error.error());
            } else {
                // nested prefix operator
                i += 1;
            }
        }
    }

    // --- Helpers ---

    /** Operand test for stack entries. Error tokens are raised by the collapse, never absorbed. */
    private static boolean isOperand(Node node) {
        return !(node instanceof Node.ErrorNode) && node.isOperand();
    }

    private static boolean isBare(Node node, Class<? extends Symbol> kind) {
        return node instanceof Node.SymbolNode symbolNode
                && symbolNode.args().isEmpty()
                && kind.isInstance(symbolNode.symbol());
    }

    private static Symbol symbolOf(Node node) {
        return ((Node.SymbolNode) node).symbol();
    }

    private static Node bare(Symbol symbol) {
        return new Node.SymbolNode(symbol, List.of());
    }

    private static Node last(List<Node> stack) {
        return stack.isEmpty() ? null : stack.get(stack.size() - 1);
    }

    private static void replace(List<Node> stack, int from, int count, Node node) {
        stack.subList(from, from + count).clear();
        stack.add(from, node);
    }

    private static ExpressionParseException failure(ExpressionError error) {
        return new ExpressionParseException(error);
    }
}
