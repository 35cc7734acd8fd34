package mathtex.lang;

/**
 * Indented dump of a syntax tree, one node per line:
 *
 * <pre>
 * BinaryOp: +
 *   Variable: x
 *   Number: 1
 * </pre>
 */
final class AstPrinter implements Ast.Visitor<Void> {

    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    static String print(Ast ast) {
        var printer = new AstPrinter();
        ast.accept(printer);
        return printer.out.toString();
    }

    @Override
    public Void visitNumberAst(Ast.Number ast) {
        line("Number: " + ast.value().lexeme());
        return null;
    }

    @Override
    public Void visitVariableAst(Ast.Variable ast) {
        line("Variable: " + ast.name().lexeme());
        return null;
    }

    @Override
    public Void visitBinaryAst(Ast.Binary ast) {
        line("BinaryOp: " + ast.operator().lexeme());
        children(ast.left(), ast.right());
        return null;
    }

    @Override
    public Void visitUnaryAst(Ast.Unary ast) {
        line("UnaryOp: " + ast.operator().lexeme());
        children(ast.operand());
        return null;
    }

    @Override
    public Void visitCallAst(Ast.Call ast) {
        line("FunctionCall: " + ast.name().lexeme());
        children(ast.arguments().toArray(Ast[]::new));
        return null;
    }

    private void children(Ast... nodes) {
        depth++;
        for (var node : nodes) {
            node.accept(this);
        }
        depth--;
    }

    private void line(String text) {
        out.append("  ".repeat(depth)).append(text).append('\n');
    }
}
