package mathtex.lang;

import lombok.NonNull;

public record Token(
    @NonNull Type type,
    @NonNull String lexeme,
    int position) {

    boolean is(Type type, String lexeme) {
        return this.type == type && this.lexeme.equals(lexeme);
    }

    @Override
    public String toString() {
        return "(Token " + type + " \"" + lexeme + "\" " + position + ")";
    }

    public enum Type {
        PAREN_LEFT,
        PAREN_RIGHT,
        BRACE_LEFT,
        BRACE_RIGHT,
        BRACKET_LEFT,
        BRACKET_RIGHT,

        // + - * / ^ _
        OPERATOR,

        // literals
        NUMBER,
        IDENTIFIER,

        // recognized function and greek-letter names
        FUNCTION,

        UNKNOWN,

        // end-of-input
        EOF;
    }
}
