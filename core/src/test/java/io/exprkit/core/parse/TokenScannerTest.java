package io.exprkit.core.parse;

import static org.assertj.core.api.Assertions.assertThat;

import io.exprkit.core.model.ExpressionError;
import io.exprkit.core.model.Node;
import io.exprkit.core.model.Symbol;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class TokenScannerTest {

    private static Node bare(Symbol symbol) {
        return new Node.SymbolNode(symbol, List.of());
    }

    @Nested
    @DisplayName("numeric literals")
    class NumericLiterals {

        @ParameterizedTest
        @CsvSource({
            "42, 42.0",
            "3.25, 3.25",
            ".5, 0.5",
            "1e3, 1000.0",
            "2.5E-1, 0.25",
            "0x1F, 31.0",
            "0xff, 255.0"
        })
        void scansNumbers(String source, double expected) {
            Cursor cursor = Cursor.of(source);

            assertThat(TokenScanner.scanNumericLiteral(cursor)).isEqualTo(new Node.LiteralNode(expected));
            assertThat(cursor.isEmpty()).isTrue();
        }

        @Test
        void trailingDotIsNotPartOfTheNumber() {
            Cursor cursor = Cursor.of("5.");

            assertThat(TokenScanner.scanNumericLiteral(cursor)).isEqualTo(new Node.LiteralNode(5));
            assertThat(cursor).hasToString(".");
        }

        @Test
        void incompleteExponentIsLeftUnconsumed() {
            Cursor cursor = Cursor.of("2e+");

            assertThat(TokenScanner.scanNumericLiteral(cursor)).isEqualTo(new Node.LiteralNode(2));
            assertThat(cursor).hasToString("e+");
        }

        @Test
        void hexPrefixWithoutDigitsIsAnError() {
            Node token = TokenScanner.scanNumericLiteral(Cursor.of("0x"));

            assertThat(token).isEqualTo(new Node.ErrorNode(ExpressionError.unexpectedToken("0x"), "0x"));
        }

        @Test
        void overflowingLiteralIsAnError() {
            Node token = TokenScanner.scanNumericLiteral(Cursor.of("1e999"));

            assertThat(token).isInstanceOf(Node.ErrorNode.class);
        }

        @Test
        void nonNumberLeavesCursorUntouched() {
            Cursor cursor = Cursor.of(".x");

            assertThat(TokenScanner.scanNumericLiteral(cursor)).isNull();
            assertThat(cursor).hasToString(".x");
        }
    }

    @Nested
    @DisplayName("operators")
    class Operators {

        @ParameterizedTest
        @CsvSource({"'+', +", "'<=', <=", "'-', -", "'--', --", "'->', ->", "'...', ...", "'..<', ..<", "'(', (", "',', ','"})
        void scansOperatorTokens(String source, String expected) {
            assertThat(TokenScanner.scanOperator(Cursor.of(source))).isEqualTo(bare(Symbol.infix(expected)));
        }

        @Test
        void structuralCharactersAreSingleTokens() {
            Cursor cursor = Cursor.of("((");

            assertThat(TokenScanner.scanOperator(cursor)).isEqualTo(bare(Symbol.infix("(")));
            assertThat(cursor).hasToString("(");
        }

        @Test
        void closingBracketIsNotAnOperator() {
            assertThat(TokenScanner.scanOperator(Cursor.of(")"))).isNull();
        }
    }

    @Nested
    @DisplayName("identifiers")
    class Identifiers {

        @ParameterizedTest
        @ValueSource(strings = {"x", "_tmp", "$0", "@foo", "a.b.c", "f'", "ünïcödé", ".leading"})
        void scansWholeIdentifier(String source) {
            Cursor cursor = Cursor.of(source);

            assertThat(TokenScanner.scanIdentifier(cursor)).isEqualTo(bare(Symbol.variable(source)));
            assertThat(cursor.isEmpty()).isTrue();
        }

        @Test
        void trailingDotIsLeftForTheNextToken() {
            Cursor cursor = Cursor.of("a.");

            assertThat(TokenScanner.scanIdentifier(cursor)).isEqualTo(bare(Symbol.variable("a")));
            assertThat(cursor).hasToString(".");
        }

        @Test
        void digitCannotStartAnIdentifier() {
            assertThat(TokenScanner.scanIdentifier(Cursor.of("1a"))).isNull();
        }
    }

    @Nested
    @DisplayName("quoted identifiers")
    class QuotedIdentifiers {

        @Test
        void keepsDelimiters() {
            Cursor cursor = Cursor.of("`my var` + 1");

            assertThat(TokenScanner.scanEscapedIdentifier(cursor)).isEqualTo(bare(Symbol.variable("`my var`")));
            assertThat(cursor).hasToString(" + 1");
        }

        @Test
        void decodesEscapes() {
            Node token = TokenScanner.scanEscapedIdentifier(Cursor.of("'\\t\\n\\'\\u{41}\\\\'"));

            assertThat(token).isEqualTo(bare(Symbol.variable("'\t\n'A\\'")));
        }

        @Test
        void unterminatedNameIsMissingDelimiter() {
            Node token = TokenScanner.scanEscapedIdentifier(Cursor.of("\"abc"));

            assertThat(token).isEqualTo(new Node.ErrorNode(ExpressionError.missingDelimiter("\""), "\"abc"));
        }

        @Test
        void loneQuoteIsUnexpectedToken() {
            Node token = TokenScanner.scanEscapedIdentifier(Cursor.of("'"));

            assertThat(token).isEqualTo(new Node.ErrorNode(ExpressionError.unexpectedToken("'"), "'"));
        }

        @Test
        void emptyCodePointEscapeIsAnError() {
            Node token = TokenScanner.scanEscapedIdentifier(Cursor.of("'\\u{}'"));

            assertThat(token).isInstanceOf(Node.ErrorNode.class);
            assertThat(((Node.ErrorNode) token).error()).isEqualTo(ExpressionError.unexpectedToken("}"));
        }

        @Test
        void escapingRoundTrips() {
            String name = "'it's a\ttab \\ and \u0007'";
            String escaped = TokenScanner.escapeIdentifier(name);

            assertThat(escaped).isEqualTo("'it\\'s a\\ttab \\\\ and \\u{7}'");
            assertThat(TokenScanner.scanEscapedIdentifier(Cursor.of(escaped))).isEqualTo(bare(Symbol.variable(name)));
        }
    }

    @Test
    void atDelimiterNeverConsumes() {
        Cursor cursor = Cursor.of(", x");

        assertThat(TokenScanner.atDelimiter(cursor, List.of(")", ","))).isTrue();
        assertThat(TokenScanner.atDelimiter(cursor, List.of(")"))).isFalse();
        assertThat(cursor).hasToString(", x");
    }

    @Test
    void skipWhitespaceReportsWhetherAnythingWasSkipped() {
        Cursor cursor = Cursor.of(" \t\nx");

        assertThat(TokenScanner.skipWhitespace(cursor)).isTrue();
        assertThat(TokenScanner.skipWhitespace(cursor)).isFalse();
        assertThat(cursor).hasToString("x");
    }
}
