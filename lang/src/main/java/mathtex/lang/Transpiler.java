package mathtex.lang;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.Getter;
import lombok.NonNull;

/**
 * Entry points of the expression pipeline: scan, parse, generate.
 *
 * <p>Instances hold nothing but their symbol table and can be shared between
 * threads; every call builds its own scanner and parser.
 */
public final class Transpiler {

    private static final Logger logger = LoggerFactory.getLogger(Transpiler.class);

    @Getter
    private final LatexGenerator generator;
    private final MixedContentScanner lineScanner;

    public Transpiler(@NonNull SymbolTable symbols) {
        this.generator = new LatexGenerator(symbols);
        this.lineScanner = new MixedContentScanner(this);
    }

    /** A transpiler using the definitions bundled on the classpath. */
    public static Transpiler withDefaultSymbols() {
        return new Transpiler(SymbolTable.load());
    }

    public List<Token> tokenize(@NonNull String expression) {
        return new Scanner(expression).getTokens();
    }

    /**
     * @throws ParseError if the expression is malformed or has trailing input
     */
    public Ast parse(@NonNull String expression) {
        return new Parser(new TokenStream(tokenize(expression))).parse();
    }

    /**
     * Compiles an expression to LaTeX without math delimiters.
     *
     * @throws ParseError if the expression cannot be parsed
     */
    public String compileBare(@NonNull String expression) {
        return generator.generate(parse(expression));
    }

    /**
     * Compiles an expression and wraps it in the delimiters of {@code mode}.
     *
     * @throws ParseError if the expression cannot be parsed
     */
    public String compile(@NonNull String expression, @NonNull MathMode mode) {
        return mode.wrap(compileBare(expression));
    }

    /**
     * Like {@link #compile(String, MathMode)}, but logs a failure and returns
     * the expression unchanged instead of throwing.
     */
    public String compileOrOriginal(@NonNull String expression, @NonNull MathMode mode) {
        try {
            return compile(expression, mode);
        } catch (ParseError | CompileError ex) {
            logger.warn("Failed to compile expression: '{}'", expression, ex);
            return expression;
        }
    }

    /**
     * Compiles every {@code $...$} span of a line and appends the LaTeX line
     * break. Never throws.
     */
    public String scanLine(@NonNull String line) {
        return lineScanner.scanLine(line);
    }

    public boolean looksLikeMath(@NonNull String line) {
        return MathLineClassifier.looksLikeMath(line);
    }
}
