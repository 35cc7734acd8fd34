package mathtex.lang;

import static mathtex.lang.Token.Type.EOF;
import static mathtex.lang.Token.Type.IDENTIFIER;
import static mathtex.lang.Token.Type.NUMBER;
import static mathtex.lang.Token.Type.OPERATOR;
import static mathtex.lang.Token.Type.PAREN_LEFT;
import static mathtex.lang.Token.Type.PAREN_RIGHT;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TokenStreamTest {

    TokenStream stream;

    boolean expectAtEnd;

    private void assertNextToken(Token expect) {
        assertEquals(expectAtEnd, stream.isAtEnd());
        assertEquals(expect, stream.peek());
        assertEquals(expect, stream.advance());
        assertEquals(expect, stream.previous());
    }

    @BeforeEach
    void setUp() {
        var scanner = new Scanner("a + (12)");
        stream = new TokenStream(scanner.getTokens());
        expectAtEnd = false;
    }

    @Test
    void visible() {
        assertNextToken(new Token(IDENTIFIER, "a", 1));
        assertNextToken(new Token(OPERATOR, "+", 3));
        assertNextToken(new Token(PAREN_LEFT, "(", 5));
        assertNextToken(new Token(NUMBER, "12", 6));
        assertNextToken(new Token(PAREN_RIGHT, ")", 8));
        expectAtEnd = true;
        assertNextToken(new Token(EOF, "", 9));
    }

    @Test
    void staysOnEof() {
        for (var i = 0; i < 5; i++) {
            stream.advance();
        }
        var eof = new Token(EOF, "", 9);
        assertEquals(eof, stream.advance());
        assertEquals(eof, stream.advance());
        assertEquals(eof, stream.peek());
        assertEquals(eof, stream.peekNext());
    }

    @Test
    void previousBeforeFirstAdvance() {
        assertEquals(new Token(IDENTIFIER, "a", 1), stream.previous());
        assertEquals(new Token(OPERATOR, "+", 3), stream.peekNext());
    }

    @Test
    void requiresEof() {
        var tokens = List.of(new Token(IDENTIFIER, "a", 1));
        assertThrows(IllegalArgumentException.class, () -> new TokenStream(tokens));
        assertThrows(IllegalArgumentException.class, () -> new TokenStream(List.of()));
    }
}
