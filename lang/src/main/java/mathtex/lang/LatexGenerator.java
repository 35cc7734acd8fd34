package mathtex.lang;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Turns a syntax tree into LaTeX. Identifiers and function names go through
 * the {@link SymbolTable}; names it does not know are written as they are.
 */
@RequiredArgsConstructor
public final class LatexGenerator implements Ast.Visitor<String> {

    @Getter
    private final @NonNull SymbolTable symbols;

    public String generate(Ast ast) {
        return ast.accept(this);
    }

    public String generate(Ast ast, MathMode mode) {
        return mode.wrap(generate(ast));
    }

    @Override
    public String visitNumberAst(Ast.Number ast) {
        return ast.value().lexeme();
    }

    @Override
    public String visitVariableAst(Ast.Variable ast) {
        return symbols.resolve(ast.name().lexeme());
    }

    @Override
    public String visitBinaryAst(Ast.Binary ast) {
        var left = generate(ast.left());
        var right = generate(ast.right());

        switch (ast.operator().lexeme()) {
            case "+":
                return left + " + " + right;
            case "-":
                return left + " - " + right;
            case "*":
                return left + " \\cdot " + right;
            case "/":
                return "\\frac{" + left + "}{" + right + "}";
            case "^":
                return left + "^{" + right + "}";
            case "_":
                return left + "_{" + right + "}";
            default:
                throw new CompileError(ast.operator(), "Unknown binary operator: " + ast.operator().lexeme());
        }
    }

    @Override
    public String visitUnaryAst(Ast.Unary ast) {
        var operand = generate(ast.operand());

        switch (ast.operator().lexeme()) {
            case "+":
                return "+" + operand;
            case "-":
                return "-" + operand;
            default:
                throw new CompileError(ast.operator(), "Unknown unary operator: " + ast.operator().lexeme());
        }
    }

    @Override
    public String visitCallAst(Ast.Call ast) {
        var name = ast.name().lexeme();
        var function = symbols.resolve(name);

        if (ast.arguments().isEmpty()) {
            return function;
        }

        var args = ast.arguments().stream()
            .map(this::generate)
            .collect(Collectors.toList());

        switch (name) {
            case "sqrt":
                if (args.size() == 1) {
                    return function + "{" + args.get(0) + "}";
                }
                if (args.size() == 2) {
                    return function + "[" + args.get(1) + "]{" + args.get(0) + "}";
                }
                break;
            case "sum":
            case "prod":
            case "int":
                // a lone argument follows the operator without parentheses
                if (args.size() == 1) {
                    return function + " " + args.get(0);
                }
                break;
            case "lim":
                if (args.size() >= 2) {
                    return function + "_{" + args.get(0) + "} " + args.get(1);
                }
                return function + " " + args.get(0);
            default:
                break;
        }
        return applied(function, args);
    }

    private static String applied(String function, List<String> args) {
        return function + "\\left(" + String.join(", ", args) + "\\right)";
    }
}
