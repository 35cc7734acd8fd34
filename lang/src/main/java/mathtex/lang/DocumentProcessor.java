package mathtex.lang;

import java.util.ArrayList;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Converts a whole text document line by line. Lines are handled either as
 * mixed content ({@code $...$} spans in prose) or as whole-line expressions
 * picked out by {@link MathLineClassifier}.
 */
@RequiredArgsConstructor
public final class DocumentProcessor {

    private static final Logger logger = LoggerFactory.getLogger(DocumentProcessor.class);

    public static final String PLACEHOLDER = "{{ generated }}";

    static final String MATH_PREFIX = "MATH:";

    private static final Pattern DELIMITED = Pattern.compile("\\$|```math");
    private static final Pattern OPERATOR = Pattern.compile("[+\\-*/^_]");
    private static final Pattern PUNCTUATION_BEFORE_OPERATOR = Pattern.compile("[.,:;!?].*[+\\-*/^_]");
    private static final Pattern URL = Pattern.compile("http|www|\\.com|\\.org");

    private static final String DOCUMENT_HEADER = String.join("\n",
        "\\documentclass{article}",
        "\\usepackage{amsmath}",
        "\\usepackage{amssymb}",
        "\\usepackage{amsfonts}",
        "\\usepackage{mathtools}",
        "",
        "\\begin{document}",
        "",
        "");
    private static final String DOCUMENT_FOOTER = String.join("\n",
        "",
        "",
        "\\end{document}",
        "");

    /**
     * @param mode         delimiters for whole-line expressions
     * @param mixedContent scan for {@code $...$} spans instead of classifying whole lines
     * @param wrapDocument surround the result with a minimal LaTeX document
     * @param template     text containing {@link #PLACEHOLDER}; takes precedence
     *                     over {@code wrapDocument} when not {@code null}
     */
    public record Options(
        @NonNull MathMode mode,
        boolean mixedContent,
        boolean wrapDocument,
        String template) {

        public static Options defaults() {
            return new Options(MathMode.INLINE, true, false, null);
        }
    }

    private final @NonNull Transpiler transpiler;
    private final @NonNull Options options;

    public String process(@NonNull String content) {
        var lines = content.split("\n", -1);
        var processed = new ArrayList<String>(lines.length);
        for (var i = 0; i < lines.length; i++) {
            var line = lines[i];
            try {
                processed.add(options.mixedContent()
                    ? transpiler.scanLine(line)
                    : processLine(line));
            } catch (RuntimeException ex) {
                logger.warn("Error processing line {}: '{}'", i + 1, line, ex);
                processed.add(line);
            }
        }
        return wrap(String.join("\n", processed));
    }

    /**
     * Whole-line handling: a line starting with {@code MATH:} is compiled
     * explicitly, a line the classifier accepts is compiled as a whole, and
     * anything else is returned untouched.
     */
    public String processLine(@NonNull String line) {
        if (DELIMITED.matcher(line).find()) {
            return line;
        }

        var stripped = line.strip();
        if (stripped.startsWith(MATH_PREFIX)) {
            var expression = stripped.substring(MATH_PREFIX.length()).strip();
            if (expression.isEmpty()) {
                return line;
            }
            return transpiler.compileOrOriginal(expression, options.mode());
        }

        if (isCandidate(line) && transpiler.looksLikeMath(stripped)) {
            return transpiler.compileOrOriginal(stripped, options.mode());
        }
        return line;
    }

    private static boolean isCandidate(String line) {
        return !line.isBlank()
            && OPERATOR.matcher(line).find()
            && !PUNCTUATION_BEFORE_OPERATOR.matcher(line).find()
            && !URL.matcher(line).find();
    }

    private String wrap(String content) {
        if (options.template() != null) {
            return applyTemplate(options.template(), content);
        }
        if (options.wrapDocument()) {
            return DOCUMENT_HEADER + content + DOCUMENT_FOOTER;
        }
        return content;
    }

    /**
     * Replaces every {@link #PLACEHOLDER} in {@code template} with {@code content}.
     *
     * @throws IllegalArgumentException if the template is blank
     */
    public static String applyTemplate(@NonNull String template, @NonNull String content) {
        if (template.isBlank()) {
            throw new IllegalArgumentException("Template is empty");
        }
        if (!template.contains(PLACEHOLDER)) {
            logger.warn("Template has no '{}' placeholder, generated content is dropped", PLACEHOLDER);
        }
        return template.replace(PLACEHOLDER, content);
    }

    /** A titled article template with {@link #PLACEHOLDER} in its body. */
    public static String sampleTemplate() {
        return String.join("\n",
            "\\documentclass{article}",
            "\\usepackage{amsmath}",
            "\\usepackage{amssymb}",
            "\\usepackage{amsfonts}",
            "\\usepackage{mathtools}",
            "",
            "\\title{Mathematical Expressions}",
            "\\author{LaTeX Transpiler}",
            "\\date{\\today}",
            "",
            "\\begin{document}",
            "",
            "\\maketitle",
            "",
            "\\section{Generated Mathematical Expressions}",
            "",
            PLACEHOLDER,
            "",
            "\\end{document}",
            "");
    }

    /**
     * A short mixed-content document: spans in prose, lines that are a single
     * span, one malformed span and a paragraph without math.
     */
    public static String sampleDocument() {
        return String.join("\n",
            "Some text here $a+b$",
            "",
            "$x^2 + y^2 = r^2$",
            "$sin(theta) + cos(theta)$",
            "$sqrt(sin(alpha+1)/inf))$",
            "",
            "More text here with $sqrt(x^2 + y^2)$ inline math.",
            "",
            "Final paragraph with no math expressions.");
    }
}

