package mathtex.lang;

import lombok.Getter;

public class CompileError extends RuntimeException {
    @Getter
    private final Token token;

    CompileError(Token token, String message) {
        super(message);
        this.token = token;
    }
}
