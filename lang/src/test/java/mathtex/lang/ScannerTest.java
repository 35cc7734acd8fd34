package mathtex.lang;

import static mathtex.lang.Token.Type.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class ScannerTest {

    private static List<Token> scan(String source) {
        return new Scanner(source).getTokens();
    }

    @Test
    void expression() {
        assertEquals(List.of(
                new Token(IDENTIFIER, "x", 1),
                new Token(OPERATOR, "^", 2),
                new Token(NUMBER, "2", 3),
                new Token(OPERATOR, "+", 5),
                new Token(NUMBER, "1.5", 7),
                new Token(EOF, "", 10)),
            scan("x^2 + 1.5"));
    }

    @Test
    void functionCall() {
        assertEquals(List.of(
                new Token(FUNCTION, "sin", 1),
                new Token(PAREN_LEFT, "(", 4),
                new Token(FUNCTION, "theta", 5),
                new Token(PAREN_RIGHT, ")", 10),
                new Token(EOF, "", 11)),
            scan("sin(theta)"));
    }

    @Test
    void empty() {
        assertEquals(List.of(new Token(EOF, "", 1)), scan(""));
        assertEquals(List.of(new Token(EOF, "", 4)), scan(" \t "));
    }

    @Test
    void brackets() {
        assertEquals(List.of(
                new Token(BRACE_LEFT, "{", 1),
                new Token(BRACE_RIGHT, "}", 2),
                new Token(BRACKET_LEFT, "[", 3),
                new Token(BRACKET_RIGHT, "]", 4),
                new Token(EOF, "", 5)),
            scan("{}[]"));
    }

    @Test
    void unknownCharacters() {
        assertEquals(List.of(
                new Token(IDENTIFIER, "a", 1),
                new Token(UNKNOWN, "=", 3),
                new Token(IDENTIFIER, "b", 5),
                new Token(UNKNOWN, ",", 6),
                new Token(UNKNOWN, "#", 8),
                new Token(EOF, "", 9)),
            scan("a = b, #"));
    }

    @Test
    void numberSwallowsEveryDot() {
        assertEquals(List.of(new Token(NUMBER, "1.2.3", 1), new Token(EOF, "", 6)), scan("1.2.3"));
    }

    @Test
    void numberThenIdentifier() {
        assertEquals(List.of(
                new Token(NUMBER, "2", 1),
                new Token(IDENTIFIER, "x", 2),
                new Token(EOF, "", 3)),
            scan("2x"));
    }

    @ParameterizedTest
    @CsvSource({
        "x, IDENTIFIER",
        "x_1, IDENTIFIER",
        "foo, IDENTIFIER",
        "Sin, IDENTIFIER",
        "sqrt, FUNCTION",
        "prod, FUNCTION",
        "lim, FUNCTION",
        "alpha, FUNCTION",
        "infinity, FUNCTION",
        "théta, IDENTIFIER",
    })
    void words(String word, Token.Type type) {
        assertEquals(List.of(new Token(type, word, 1), new Token(EOF, "", word.length() + 1)), scan(word));
    }

    @ParameterizedTest
    @CsvSource({"+", "-", "*", "/", "^"})
    void operators(String operator) {
        assertEquals(new Token(OPERATOR, operator, 2), scan("(" + operator).get(1));
    }

    @Test
    void underscoreAfterNumberIsOperator() {
        assertEquals(List.of(
                new Token(NUMBER, "2", 1),
                new Token(OPERATOR, "_", 2),
                new Token(NUMBER, "3", 3),
                new Token(EOF, "", 4)),
            scan("2_3"));
    }

    @Test
    void lettersOutsideBasicPlane() {
        // U+1D465 is two chars, positions still count chars
        assertEquals(List.of(
                new Token(IDENTIFIER, "\uD835\uDC65", 1),
                new Token(OPERATOR, "+", 3),
                new Token(NUMBER, "1", 4),
                new Token(EOF, "", 5)),
            scan("\uD835\uDC65+1"));
    }

    @Test
    void digitsOutsideAsciiAreUnknown() {
        assertEquals(new Token(UNKNOWN, "\u0663", 1), scan("\u0663").get(0));
    }
}
