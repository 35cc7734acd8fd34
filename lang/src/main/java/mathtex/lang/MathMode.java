package mathtex.lang;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** How a compiled expression is delimited in the output. */
@Getter
@RequiredArgsConstructor
public enum MathMode {
    INLINE("$"),
    DISPLAY("$$");

    private final String delimiter;

    public String wrap(String latex) {
        return delimiter + latex + delimiter;
    }
}
