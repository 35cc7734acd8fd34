package mathtex.lang;

import static lombok.AccessLevel.PRIVATE;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor(access = PRIVATE)
public class MathTex {

    private static final int EX_USAGE = 64;

    static final String DEFAULT_TEMPLATE_FILE = "template.tex";
    static final String DEFAULT_SAMPLE_FILE = "sample.txt";

    private static final String CLEAR_SCREEN = "\033[2J\033[H";

    record Sample(String category, String expression) {}

    static final List<Sample> SAMPLES = List.of(
        new Sample("Basic algebra", "x^2 + 3*y - 5"),
        new Sample("Fractions", "(a + b) / (c - d)"),
        new Sample("Square root", "sqrt(x^2 + y^2)"),
        new Sample("Trigonometry", "sin(x) + cos(y)"),
        new Sample("Logarithm", "log(x) + ln(y)"),
        new Sample("Exponential", "e^(x^2)"),
        new Sample("Complex", "sqrt((a + b)^2 + (c - d)^2)"),
        new Sample("Greek letters", "alpha + beta * gamma"));

    public static void main(String[] args) throws IOException {
        System.exit(run(args));
    }

    static int run(String[] args) throws IOException {
        if (args.length == 0) {
            return runPrompt(Transpiler.withDefaultSymbols(), new Flags());
        }

        var flags = new Flags();
        for (var i = 0; i < args.length; i++) {
            var arg = args[i];
            switch (arg) {
                case "--help":
                case "-h":
                    printUsage();
                    return 0;
                case "--interactive":
                case "-i":
                    flags.interactive = true;
                    break;
                case "--inline":
                    flags.mode = MathMode.INLINE;
                    break;
                case "--display":
                    flags.mode = MathMode.DISPLAY;
                    break;
                case "--whole-line":
                    flags.mixedContent = false;
                    break;
                case "--document-wrapper":
                    flags.wrapDocument = true;
                    break;
                case "--create-template":
                    flags.createTemplate = hasArgument(args, i) ? args[++i] : DEFAULT_TEMPLATE_FILE;
                    break;
                case "--create-sample":
                case "--create_sample":
                    flags.createSample = hasArgument(args, i) ? args[++i] : DEFAULT_SAMPLE_FILE;
                    break;
                case "--compile":
                case "--template":
                case "--symbols":
                case "--output":
                case "-o":
                    if (i + 1 >= args.length) {
                        System.err.println("Error: " + arg + " requires an argument");
                        return EX_USAGE;
                    }
                    flags.set(arg, args[++i]);
                    break;
                default:
                    if (arg.startsWith("--") || flags.input != null) {
                        System.err.println("Unknown option: " + arg);
                        printUsage();
                        return EX_USAGE;
                    }
                    flags.input = arg;
            }
        }

        if (flags.createTemplate != null || flags.createSample != null) {
            if (flags.createTemplate != null) {
                createFile(Paths.get(flags.createTemplate), DocumentProcessor.sampleTemplate());
                System.out.println("Keep the '" + DocumentProcessor.PLACEHOLDER + "' placeholder where the expressions go");
            }
            if (flags.createSample != null) {
                createFile(Paths.get(flags.createSample), DocumentProcessor.sampleDocument());
            }
            return 0;
        }

        var symbols = flags.symbols != null
            ? SymbolTable.load(Paths.get(flags.symbols))
            : SymbolTable.load();
        var transpiler = new Transpiler(symbols);

        if (flags.interactive) {
            return runPrompt(transpiler, flags);
        }
        if (flags.expression != null) {
            return runCompile(transpiler, flags);
        }
        if (flags.input != null) {
            return runFile(transpiler, flags);
        }
        printUsage();
        return EX_USAGE;
    }

    private static int runCompile(Transpiler transpiler, Flags flags) {
        try {
            System.out.println("LaTeX:  " + transpiler.compile(flags.expression, flags.mode));
            return 0;
        } catch (ParseError | CompileError error) {
            report(error);
            return 1;
        }
    }

    // the next argument, unless it is missing or another option
    private static boolean hasArgument(String[] args, int i) {
        return i + 1 < args.length && !args[i + 1].startsWith("-");
    }

    private static void createFile(Path path, String content) throws IOException {
        Files.writeString(path, content, StandardCharsets.UTF_8);
        System.out.println("Created: " + path);
    }

    private static int runFile(Transpiler transpiler, Flags flags) throws IOException {
        String content;
        if ("-".equals(flags.input)) {
            content = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        } else {
            var path = Paths.get(flags.input);
            if (!Files.isRegularFile(path)) {
                System.err.println("Error: Input file '" + path + "' does not exist");
                return 1;
            }
            content = Files.readString(path, StandardCharsets.UTF_8);
        }

        String template = null;
        if (flags.template != null) {
            var templatePath = Paths.get(flags.template);
            if (!Files.isRegularFile(templatePath)) {
                System.err.println("Error: Template file '" + templatePath + "' does not exist");
                return 1;
            }
            template = Files.readString(templatePath, StandardCharsets.UTF_8);
        }

        var options = new DocumentProcessor.Options(flags.mode, flags.mixedContent, flags.wrapDocument, template);
        String output;
        try {
            output = new DocumentProcessor(transpiler, options).process(content);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            return 1;
        }

        var target = outputPath(flags);
        if (target == null) {
            System.out.print(output);
        } else {
            Files.writeString(target, output, StandardCharsets.UTF_8);
            System.err.println("Output saved to: " + target);
        }
        return 0;
    }

    /** {@code null} means standard output. */
    private static Path outputPath(Flags flags) {
        if (flags.output != null) {
            return "-".equals(flags.output) ? null : Paths.get(flags.output);
        }
        if ("-".equals(flags.input)) {
            return null;
        }
        var name = flags.input;
        var dot = name.lastIndexOf('.');
        var slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        var base = dot > slash ? name.substring(0, dot) : name;
        return Paths.get(base + ".tex");
    }

    private static int runPrompt(Transpiler transpiler, Flags flags) throws IOException {
        var reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        System.out.println("Enter math expressions to convert to LaTeX, 'help' for commands, ':q' to exit.");
        for (;;) {
            System.out.print("math> ");
            var line = reader.readLine();
            if (line == null) {
                break;
            }
            line = line.strip();

            if (isQuit(line)) {
                break;
            } else if ("help".equals(line) || "h".equals(line)) {
                System.out.print(promptHelp());
            } else if ("sample".equals(line) || "samples".equals(line)) {
                System.out.print(samples(transpiler, flags.mode));
            } else if ("clear".equals(line) || "cls".equals(line)) {
                System.out.print(CLEAR_SCREEN);
                System.out.flush();
            } else if (line.startsWith(":tok")) {
                flags.printTokens = toggle(line.substring(4), flags.printTokens);
                System.out.println("print tokens: " + flags.printTokens);
            } else if (line.startsWith(":ast")) {
                flags.printAst = toggle(line.substring(4), flags.printAst);
                System.out.println("print ast: " + flags.printAst);
            } else if (line.startsWith(":display")) {
                var display = toggle(line.substring(8), flags.mode == MathMode.DISPLAY);
                flags.mode = display ? MathMode.DISPLAY : MathMode.INLINE;
                System.out.println("mode: " + flags.mode);
            } else if (!line.isBlank()) {
                evaluate(transpiler, line, flags);
            }
        }
        return 0;
    }

    static boolean isQuit(String line) {
        switch (line) {
            case ":q":
            case "q":
            case "quit":
            case "exit":
                return true;
            default:
                return false;
        }
    }

    static String promptHelp() {
        return String.join("\n",
            "Enter a math expression to convert it to LaTeX.",
            "  Operators:  + - * / ^ _ and parentheses for grouping, e.g. (a + b) * c",
            "  Functions:  sqrt(x), sqrt(x, n), sin(x), cos(x), log(x), exp(x), ...",
            "  Symbols:    alpha, beta, gamma, theta, pi, inf, ...",
            "",
            "Commands:",
            "  help, h                Show this help",
            "  sample, samples        Show example expressions",
            "  clear, cls             Clear the screen",
            "  :tok [true|false]      Print tokens",
            "  :ast [true|false]      Print the syntax tree",
            "  :display [true|false]  Use display delimiters",
            "  quit, exit, q, :q      Exit",
            "");
    }

    /** Every sample expression next to its LaTeX, or the reason it failed. */
    static String samples(Transpiler transpiler, MathMode mode) {
        var out = new StringBuilder();
        for (var sample : SAMPLES) {
            out.append(sample.category()).append(":\n")
                .append("  Input:  ").append(sample.expression()).append('\n');
            try {
                out.append("  LaTeX:  ").append(transpiler.compile(sample.expression(), mode));
            } catch (ParseError | CompileError error) {
                out.append("  Error:  ").append(error.getMessage());
            }
            out.append("\n\n");
        }
        return out.toString();
    }

    private static boolean toggle(String arg, boolean current) {
        arg = arg.trim();
        return arg.isBlank() ? current : Boolean.parseBoolean(arg);
    }

    private static void evaluate(Transpiler transpiler, String expression, Flags flags) {
        if (flags.printTokens) {
            transpiler.tokenize(expression).forEach(System.out::println);
        }
        try {
            var ast = transpiler.parse(expression);
            if (flags.printAst) {
                System.out.print(AstPrinter.print(ast));
            }
            System.out.println("LaTeX: " + transpiler.getGenerator().generate(ast, flags.mode));
        } catch (ParseError | CompileError error) {
            report(error);
        }
    }

    private static void report(RuntimeException error) {
        if (error instanceof ParseError parseError) {
            report("parser", error, parseError.getToken());
        } else if (error instanceof CompileError compileError) {
            report("compiler", error, compileError.getToken());
        }
    }

    private static void report(String stage, RuntimeException error, Token token) {
        System.err.println(stage + ": " + error.getMessage() + " [col " + token.position() + "]");
    }

    private static void printUsage() {
        System.out.println("Usage: mathtex [options] [input|-]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --compile EXPR        Compile a single expression");
        System.out.println("  --interactive, -i     Start the interactive prompt (default without arguments)");
        System.out.println("  --inline              Use inline math delimiters (default)");
        System.out.println("  --display             Use display math delimiters");
        System.out.println("  --whole-line          Detect whole-line expressions instead of $...$ spans");
        System.out.println("  --document-wrapper    Wrap the output in a LaTeX document");
        System.out.println("  --template FILE       Insert the output at '" + DocumentProcessor.PLACEHOLDER + "' in FILE");
        System.out.println("  --symbols FILE        Read symbol definitions from FILE");
        System.out.println("  --output, -o FILE     Output file ('-' for stdout, default: input with .tex)");
        System.out.println("  --create-template [FILE]  Write a sample template (default: " + DEFAULT_TEMPLATE_FILE + ")");
        System.out.println("  --create-sample [FILE]    Write a sample input file (default: " + DEFAULT_SAMPLE_FILE + ")");
        System.out.println("  --help, -h            Show this help");
    }

    private static class Flags {
        boolean interactive = false;
        boolean printTokens = false;
        boolean printAst = false;
        boolean mixedContent = true;
        boolean wrapDocument = false;
        MathMode mode = MathMode.INLINE;
        String expression;
        String template;
        String symbols;
        String output;
        String input;
        String createTemplate;
        String createSample;

        void set(String option, String value) {
            switch (option) {
                case "--compile":
                    expression = value;
                    break;
                case "--template":
                    template = value;
                    break;
                case "--symbols":
                    symbols = value;
                    break;
                default:
                    output = value;
            }
        }
    }
}
