package io.exprkit.core.parse;

import io.exprkit.core.model.ExpressionError;
import io.exprkit.core.model.Node;
import io.exprkit.core.model.Symbol;
import java.math.BigInteger;
import java.util.List;

/**
 * Token scanners built on {@link Cursor}. Each scanner either consumes one token and returns it as
 * a {@link Node}, or returns {@code null} and leaves the cursor where it was. A token that is
 * recognized but malformed comes back as an {@link Node.ErrorNode} rather than an exception.
 *
 * <p>
 * Operators and identifiers are returned as bare, unbound {@link Node.SymbolNode}s: operators as
 * {@link Symbol.Infix} (the parser reclassifies them), identifiers as {@link Symbol.Variable}.
 *
 * <p>
 * Stateless; all methods are static.
 */
public final class TokenScanner {

    private static final String QUOTES = "`'\"";
    private static final String STRUCTURAL = "([,";

    private TokenScanner() {}

    // --- Whitespace and delimiters ---

    /** Skips whitespace; returns {@code true} if any was skipped. */
    public static boolean skipWhitespace(Cursor cursor) {
        return cursor.scanCharacters(CharacterClasses::isWhitespace) != null;
    }

    /** Consumes everything up to the next whitespace. */
    public static String scanToEndOfToken(Cursor cursor) {
        return cursor.scanCharacters(c -> !CharacterClasses.isWhitespace(c));
    }

    /** Returns {@code true} if one of {@code delimiters} starts at the cursor. Never consumes. */
    public static boolean atDelimiter(Cursor cursor, List<String> delimiters) {
        int start = cursor.position();
        for (String delimiter : delimiters) {
            boolean matched = delimiter.codePoints().allMatch(cursor::scanCharacter);
            cursor.reset(start);
            if (matched) {
                return true;
            }
        }
        return false;
    }

    // --- Numbers ---

    /**
     * Scans a numeric literal: a {@code 0x} hexadecimal integer, or a decimal integer or fraction
     * with an optional {@code [eE][+-]?digits} exponent.
     *
     * @return a literal node, an error node if the text is not a finite number, or {@code null}
     */
    public static Node scanNumericLiteral(Cursor cursor) {
        String number = scanNumber(cursor);
        if (number == null) {
            return null;
        }
        double value;
        if (number.startsWith("0x")) {
            String hex = number.substring(2);
            if (hex.isEmpty()) {
                return new Node.ErrorNode(ExpressionError.unexpectedToken(number), number);
            }
            value = new BigInteger(hex, 16).doubleValue();
        } else {
            value = Double.parseDouble(number);
        }
        if (Double.isInfinite(value)) {
            return new Node.ErrorNode(ExpressionError.unexpectedToken(number), number);
        }
        return new Node.LiteralNode(value);
    }

    private static String scanNumber(Cursor cursor) {
        int endOfInt = cursor.position();
        String number;
        String integer = cursor.scanCharacters(CharacterClasses::isDigit);
        if (integer != null) {
            if (integer.equals("0") && cursor.scanCharacter('x')) {
                String hex = cursor.scanCharacters(CharacterClasses::isHexDigit);
                return "0x" + (hex != null ? hex : "");
            }
            endOfInt = cursor.position();
            if (cursor.scanCharacter('.')) {
                String fraction = cursor.scanCharacters(CharacterClasses::isDigit);
                if (fraction == null) {
                    cursor.reset(endOfInt);
                    return integer;
                }
                number = integer + "." + fraction;
            } else {
                number = integer;
            }
        } else if (cursor.scanCharacter('.')) {
            String fraction = cursor.scanCharacters(CharacterClasses::isDigit);
            if (fraction == null) {
                cursor.reset(endOfInt);
                return null;
            }
            number = "." + fraction;
        } else {
            return null;
        }
        String exponent = scanExponent(cursor);
        return exponent != null ? number + exponent : number;
    }

    private static String scanExponent(Cursor cursor) {
        int start = cursor.position();
        String e = cursor.scanCharacter(c -> c == 'e' || c == 'E');
        if (e != null) {
            String sign = cursor.scanCharacter(c -> c == '-' || c == '+');
            String digits = cursor.scanCharacters(CharacterClasses::isDigit);
            if (digits != null) {
                return e + (sign != null ? sign : "") + digits;
            }
        }
        cursor.reset(start);
        return null;
    }

    // --- Operators ---

    /**
     * Scans an operator: a run of operator characters, a single {@code (}, {@code [} or {@code ,},
     * or a run of {@code .} or {@code -} followed by any operator characters.
     */
    public static Node scanOperator(Cursor cursor) {
        String op = cursor.scanCharacters(c -> c == '.');
        if (op == null) {
            op = cursor.scanCharacters(c -> c == '-');
        }
        if (op != null) {
            String tail = cursor.scanCharacters(CharacterClasses::isOperator);
            return bare(Symbol.infix(tail != null ? op + tail : op));
        }
        op = cursor.scanCharacters(CharacterClasses::isOperator);
        if (op == null) {
            op = cursor.scanCharacter(c -> STRUCTURAL.indexOf(c) >= 0);
        }
        return op != null ? bare(Symbol.infix(op)) : null;
    }

    // --- Identifiers ---

    /**
     * Scans an identifier. It starts with an identifier-head character or a single {@code .},
     * may contain single internal dots, never ends with a dot (a trailing dot is left unconsumed)
     * and may end with one {@code '}.
     */
    public static Node scanIdentifier(Cursor cursor) {
        int start = cursor.position();
        StringBuilder identifier = new StringBuilder();
        if (cursor.scanCharacter('.')) {
            identifier.append('.');
        } else {
            String head = cursor.scanCharacter(CharacterClasses::isIdentifierHead);
            if (head == null) {
                return null;
            }
            identifier.append(head);
            start = cursor.position();
            if (cursor.scanCharacter('.')) {
                identifier.append('.');
            }
        }
        String tail;
        while ((tail = cursor.scanCharacters(CharacterClasses::isIdentifier)) != null) {
            identifier.append(tail);
            start = cursor.position();
            if (cursor.scanCharacter('.')) {
                identifier.append('.');
            }
        }
        int last = identifier.length() - 1;
        if (identifier.charAt(last) == '.') {
            cursor.reset(start);
            if (last == 0) {
                return null;
            }
            identifier.setLength(last);
        } else if (cursor.scanCharacter('\'')) {
            identifier.append('\'');
        }
        return bare(Symbol.variable(identifier.toString()));
    }

    /**
     * Scans an identifier quoted with {@code `}, {@code '} or {@code "}. The resulting variable
     * name keeps its delimiters. A backslash introduces an escape: {@code 0 t n r} for the control characters,
     * {@code u{HEX}} for a code point, and any other character taken literally.
     *
     * @return a variable node, an error node for unterminated or malformed text, or {@code null}
     */
    public static Node scanEscapedIdentifier(Cursor cursor) {
        int delimiter = cursor.first();
        if (delimiter == Cursor.EOF || QUOTES.indexOf(delimiter) < 0) {
            return null;
        }
        cursor.popFirst();
        StringBuilder string = new StringBuilder().appendCodePoint(delimiter);
        while (!cursor.isEmpty() && cursor.first() != delimiter) {
            String part = cursor.scanCharacters(c -> c != delimiter && c != '\\');
            if (part != null) {
                string.append(part);
                continue;
            }
            cursor.popFirst();
            int c = cursor.popFirst();
            switch (c) {
                case Cursor.EOF:
                    break;
                case '0':
                    string.append('\0');
                    break;
                case 't':
                    string.append('\t');
                    break;
                case 'n':
                    string.append('\n');
                    break;
                case 'r':
                    string.append('\r');
                    break;
                case 'u':
                    if (!cursor.scanCharacter('{')) {
                        string.append('u');
                        break;
                    }
                    Node error = scanCodePointEscape(cursor, string);
                    if (error != null) {
                        return error;
                    }
                    break;
                default:
                    string.appendCodePoint(c);
            }
        }
        if (!cursor.scanCharacter(delimiter)) {
            String text = string.toString();
            ExpressionError error = text.equals(new String(Character.toChars(delimiter)))
                    ? ExpressionError.unexpectedToken(text)
                    : ExpressionError.missingDelimiter(new String(Character.toChars(delimiter)));
            return new Node.ErrorNode(error, text);
        }
        string.appendCodePoint(delimiter);
        return bare(Symbol.variable(string.toString()));
    }

    /** Scans the hex digits and closing brace of a code point escape; returns an error node on failure. */
    private static Node scanCodePointEscape(Cursor cursor, StringBuilder string) {
        String hex = cursor.scanCharacters(CharacterClasses::isHexDigit);
        if (hex == null) {
            hex = "";
        }
        if (!cursor.scanCharacter('}')) {
            String junk = scanToEndOfToken(cursor);
            if (junk == null) {
                return new Node.ErrorNode(ExpressionError.missingDelimiter("}"), string.toString());
            }
            return new Node.ErrorNode(ExpressionError.unexpectedToken(junk), string.toString());
        }
        if (hex.isEmpty()) {
            return new Node.ErrorNode(ExpressionError.unexpectedToken("}"), string.toString());
        }
        int codePoint = hex.length() > 6 ? -1 : Integer.parseInt(hex, 16);
        if (!Character.isValidCodePoint(codePoint) || Character.getType(codePoint) == Character.SURROGATE) {
            return new Node.ErrorNode(ExpressionError.unexpectedToken(hex), string.toString());
        }
        string.appendCodePoint(codePoint);
        return null;
    }

    /**
     * Escapes an identifier for display. Names that do not start with a quote are returned as is;
     * quoted names get the exact escapes {@link #scanEscapedIdentifier} understands, so scanning
     * the result yields the same name.
     */
    public static String escapeIdentifier(String name) {
        if (name.isEmpty() || QUOTES.indexOf(name.codePointAt(0)) < 0) {
            return name;
        }
        int delimiter = name.codePointAt(0);
        int[] codePoints = name.codePoints().toArray();
        StringBuilder result = new StringBuilder().appendCodePoint(delimiter);
        for (int i = 1; i < codePoints.length; i++) {
            int c = codePoints[i];
            boolean closing = i == codePoints.length - 1 && c == delimiter;
            if (c == 0) {
                result.append("\\0");
            } else if (c == '\t') {
                result.append("\\t");
            } else if (c == '\n') {
                result.append("\\n");
            } else if (c == '\r') {
                result.append("\\r");
            } else if (c == '\\' || (c == delimiter && !closing)) {
                result.append('\\').appendCodePoint(c);
            } else if ((c >= 0x20 && c < 0x7F) || CharacterClasses.isOperator(c) || CharacterClasses.isIdentifier(c)) {
                result.appendCodePoint(c);
            } else {
                result.append("\\u{").append(Integer.toHexString(c).toUpperCase()).append('}');
            }
        }
        return result.toString();
    }

    private static Node bare(Symbol symbol) {
        return new Node.SymbolNode(symbol, List.of());
    }
}
