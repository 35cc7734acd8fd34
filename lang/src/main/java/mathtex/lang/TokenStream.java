package mathtex.lang;

import static mathtex.lang.Token.Type.*;

import java.util.List;

import lombok.NonNull;

/**
 * Cursor over a scanned token list. The list must end with an EOF token; the
 * cursor never moves past it.
 */
public final class TokenStream {

    private final List<Token> tokens;

    private int current = 0;
    private Token previous = null;

    public TokenStream(@NonNull List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != EOF) {
            throw new IllegalArgumentException("token list must end with EOF");
        }
        this.tokens = List.copyOf(tokens);
    }

    public Token previous() {
        return previous != null ? previous : peek();
    }

    public boolean isAtEnd() {
        return peek().type() == EOF;
    }

    public Token peek() {
        return tokens.get(current);
    }

    public Token peekNext() {
        if (isAtEnd()) {
            return peek();
        }
        return tokens.get(current + 1);
    }

    public Token advance() {
        previous = tokens.get(current);
        if (!isAtEnd()) {
            current++;
        }
        return previous;
    }
}
