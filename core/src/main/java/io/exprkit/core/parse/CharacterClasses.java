package io.exprkit.core.parse;

/**
 * Code point classes used by the tokenizer. Operator characters and identifier characters are
 * disjoint, except that {@code U+00AD} (soft hyphen) is checked as an operator first.
 *
 * <p>
 * {@code -} and {@code .} are deliberately not operator characters; {@link TokenScanner} treats a
 * leading run of either specially.
 */
public final class CharacterClasses {

    private static final String ASCII_OPERATORS = "/=\u00AD+!*%<>&|^~?:";

    private CharacterClasses() {}

    public static boolean isWhitespace(int c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    public static boolean isOperator(int c) {
        if (ASCII_OPERATORS.indexOf(c) >= 0) {
            return true;
        }
        return (c >= 0x00A1 && c <= 0x00A7)
                || c == 0x00A9
                || c == 0x00AB
                || c == 0x00AC
                || c == 0x00AE
                || (c >= 0x00B0 && c <= 0x00B1)
                || c == 0x00B6
                || c == 0x00BB
                || c == 0x00BF
                || c == 0x00D7
                || c == 0x00F7
                || (c >= 0x2016 && c <= 0x2017)
                || (c >= 0x2020 && c <= 0x2027)
                || (c >= 0x2030 && c <= 0x203E)
                || (c >= 0x2041 && c <= 0x2053)
                || (c >= 0x2055 && c <= 0x205E)
                || (c >= 0x2190 && c <= 0x23FF)
                || (c >= 0x2500 && c <= 0x2775)
                || (c >= 0x2794 && c <= 0x2BFF)
                || (c >= 0x2E00 && c <= 0x2E7F)
                || (c >= 0x3001 && c <= 0x3003)
                || (c >= 0x3008 && c <= 0x3030);
    }

    public static boolean isIdentifierHead(int c) {
        if (c == '_' || c == '#' || c == '$' || c == '@') {
            return true;
        }
        if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z')) {
            return true;
        }
        if (c >= 0x10000 && c <= 0xEFFFD) {
            // each supplementary plane except its last two code points
            return (c & 0xFFFF) <= 0xFFFD;
        }
        return c == 0x00A8
                || c == 0x00AA
                || c == 0x00AD
                || c == 0x00AF
                || (c >= 0x00B2 && c <= 0x00B5)
                || (c >= 0x00B7 && c <= 0x00BA)
                || (c >= 0x00BC && c <= 0x00BE)
                || (c >= 0x00C0 && c <= 0x00D6)
                || (c >= 0x00D8 && c <= 0x00F6)
                || (c >= 0x00F8 && c <= 0x00FF)
                || (c >= 0x0100 && c <= 0x02FF)
                || (c >= 0x0370 && c <= 0x167F)
                || (c >= 0x1681 && c <= 0x180D)
                || (c >= 0x180F && c <= 0x1DBF)
                || (c >= 0x1E00 && c <= 0x1FFF)
                || (c >= 0x200B && c <= 0x200D)
                || (c >= 0x202A && c <= 0x202E)
                || (c >= 0x203F && c <= 0x2040)
                || c == 0x2054
                || (c >= 0x2060 && c <= 0x206F)
                || (c >= 0x2070 && c <= 0x20CF)
                || (c >= 0x2100 && c <= 0x218F)
                || (c >= 0x2460 && c <= 0x24FF)
                || (c >= 0x2776 && c <= 0x2793)
                || (c >= 0x2C00 && c <= 0x2DFF)
                || (c >= 0x2E80 && c <= 0x2FFF)
                || (c >= 0x3004 && c <= 0x3007)
                || (c >= 0x3021 && c <= 0x302F)
                || (c >= 0x3031 && c <= 0x303F)
                || (c >= 0x3040 && c <= 0xD7FF)
                || (c >= 0xF900 && c <= 0xFD3D)
                || (c >= 0xFD40 && c <= 0xFDCF)
                || (c >= 0xFDF0 && c <= 0xFE1F)
                || (c >= 0xFE30 && c <= 0xFE44)
                || (c >= 0xFE47 && c <= 0xFFFD);
    }

    public static boolean isIdentifier(int c) {
        return (c >= '0' && c <= '9')
                || (c >= 0x0300 && c <= 0x036F)
                || (c >= 0x1DC0 && c <= 0x1DFF)
                || (c >= 0x20D0 && c <= 0x20FF)
                || (c >= 0xFE20 && c <= 0xFE2F)
                || isIdentifierHead(c);
    }

    static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    static boolean isHexDigit(int c) {
        return (c >= '0' && c <= '9') || (c >= 'A' && c <= 'F') || (c >= 'a' && c <= 'f');
    }
}
