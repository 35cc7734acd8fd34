package mathtex.lang;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Finds {@code $...$} spans in a line of free text and compiles each of them.
 * Text outside the spans is copied as is, and every line gets a trailing
 * LaTeX line break.
 */
@RequiredArgsConstructor
final class MixedContentScanner {

    private static final Logger logger = LoggerFactory.getLogger(MixedContentScanner.class);

    static final char DELIMITER = '$';
    static final String LINE_BREAK = "\\\\";

    private final @NonNull Transpiler transpiler;

    String scanLine(@NonNull String line) {
        if (line.isBlank()) {
            return LINE_BREAK;
        }

        if (line.indexOf(DELIMITER) < 0) {
            return line + LINE_BREAK;
        }

        var result = new StringBuilder(line.length() + 16);
        var current = 0;
        while (current < line.length()) {
            var c = line.charAt(current);
            if (c != DELIMITER) {
                result.append(c);
                current++;
                continue;
            }

            var start = current + 1;
            var end = line.indexOf(DELIMITER, start);
            if (end < 0) {
                // unterminated, keep the rest as it is
                result.append(line, current, line.length());
                break;
            }

            result.append(DELIMITER)
                .append(span(line.substring(start, end)))
                .append(DELIMITER);
            current = end + 1;
        }

        return result.append(LINE_BREAK).toString();
    }

    private String span(String expression) {
        if (expression.isBlank()) {
            return "";
        }
        try {
            return transpiler.compileBare(expression);
        } catch (ParseError | CompileError ex) {
            logger.warn("Failed to compile math expression: '{}'", expression, ex);
            return expression;
        }
    }
}
