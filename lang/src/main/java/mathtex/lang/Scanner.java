package mathtex.lang;

import static mathtex.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Splits one math expression into tokens. Never fails: characters it does not
 * know become {@link Token.Type#UNKNOWN} tokens and the parser decides what to
 * do with them.
 */
@RequiredArgsConstructor
final class Scanner {

    static final Set<String> FUNCTIONS = Set.of(
        "sqrt", "sin", "cos", "tan", "log", "ln", "exp",
        "sum", "int", "prod", "lim", "max", "min",
        "alpha", "beta", "gamma", "delta", "theta", "pi", "infinity",
        "lambda", "mu", "nu", "sigma", "omega");

    private final @NonNull String source;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;

    List<Token> getTokens() {
        if (!tokens.isEmpty()) {
            return tokens;
        }

        while (!isAtEnd()) {
            start = current;
            scanToken();
        }

        start = current; // EOF sits one past the last character
        tokens.add(new Token(EOF, "", getPosition()));
        return tokens;
    }

    private int getPosition() {
        return 1 + start;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private void scanToken() {
        var c = advance();
        switch (c) {
        case '(':
            addToken(PAREN_LEFT);
            break;
        case ')':
            addToken(PAREN_RIGHT);
            break;
        case '{':
            addToken(BRACE_LEFT);
            break;
        case '}':
            addToken(BRACE_RIGHT);
            break;
        case '[':
            addToken(BRACKET_LEFT);
            break;
        case ']':
            addToken(BRACKET_RIGHT);
            break;
        case '+':
        case '-':
        case '*':
        case '/':
        case '^':
        case '_':
            addToken(OPERATOR);
            break;

        default:
            if (Character.isWhitespace(c)) {
                // completely ignore
            } else if (isDigit(c)) {
                number();
            } else if (Character.isLetter(c)) {
                identifier();
            } else {
                addToken(UNKNOWN);
            }
        }
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWordPart(int c) {
        return Character.isLetter(c) || isDigit(c) || c == '_';
    }

    private void identifier() {
        while (!isAtEnd() && isWordPart(peek())) {
            advance();
        }
        var text = source.substring(start, current);
        addToken(FUNCTIONS.contains(text) ? FUNCTION : IDENTIFIER);
    }

    private void number() {
        // no exponent or sign, and "1.2.3" stays a single token
        while (!isAtEnd() && (isDigit(peek()) || peek() == '.')) {
            advance();
        }
        addToken(NUMBER);
    }

    // code points, so letters outside the BMP stay a single token
    private int advance() {
        var c = source.codePointAt(current);
        current += Character.charCount(c);
        return c;
    }

    private int peek() {
        if (isAtEnd()) {
            return '\0';
        }
        return source.codePointAt(current);
    }

    private void addToken(Token.Type type) {
        var text = source.substring(start, current);
        tokens.add(new Token(type, text, getPosition()));
    }
}
