package mathtex.lang;

import lombok.Getter;

/**
 * Raised by the parser when the token it needs is not there: a missing
 * operand, an unbalanced parenthesis, or input left over after the expression.
 */
@Getter
public class ParseError extends RuntimeException {

    private final String expected;
    private final Token token;

    ParseError(String expected, Token token) {
        super("Expected " + expected + ", got " + token);
        this.expected = expected;
        this.token = token;
    }
}
