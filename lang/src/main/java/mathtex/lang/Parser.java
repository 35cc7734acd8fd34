package mathtex.lang;

import static mathtex.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.stream.Collectors;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
final class Parser {

    /**
     * Deepest tree, and deepest parenthesis or sign nesting, the parser
     * accepts. Keeps the recursive parser and generator well inside the
     * default thread stack.
     */
    static final int MAX_DEPTH = 500;

    private final @NonNull TokenStream tokens;

    private int nesting = 0;

    /**
     * Parses one expression and requires the whole token stream to be used.
     *
     * @throws ParseError when the grammar is violated, tokens are left over, or
     *                    the expression nests deeper than {@link #MAX_DEPTH}
     */
    public Ast parse() {
        var ast = expression().ast();
        if (!isAtEnd()) {
            throw error(peek(), "end of input");
        }
        return ast;
    }

    /**
     * Parses one expression and stops at the first token that cannot continue
     * it. Whatever follows is left in the stream for the caller to inspect.
     */
    public Ast parseExpression() {
        return expression().ast();
    }

    //// grammar rules ////

    /**
     * <pre>
     *  expression  :: term ( ( "+" | "-" ) term )*
     * </pre>
     */
    private Parsed expression() {
        var left = term();
        while (matchOperator("+", "-")) {
            var operator = previous();
            var right = term();
            left = node(new Ast.Binary(left.ast(), operator, right.ast()), operator, left, right);
        }
        return left;
    }

    /**
     * <pre>
     *  term        :: power ( ( "*" | "/" ) power )*
     * </pre>
     */
    private Parsed term() {
        var left = power();
        while (matchOperator("*", "/")) {
            var operator = previous();
            var right = power();
            left = node(new Ast.Binary(left.ast(), operator, right.ast()), operator, left, right);
        }
        return left;
    }

    /**
     * <pre>
     *  power       :: unary ( ( "^" | "_" ) unary )*
     * </pre>
     *
     * Left-associative: {@code a^b^c} is {@code (a^b)^c}.
     */
    private Parsed power() {
        var left = unary();
        while (matchOperator("^", "_")) {
            var operator = previous();
            var right = unary();
            left = node(new Ast.Binary(left.ast(), operator, right.ast()), operator, left, right);
        }
        return left;
    }

    /**
     * <pre>
     *  unary       :: ( ( "+" | "-" ) unary ) | primary
     * </pre>
     */
    private Parsed unary() {
        if (matchOperator("+", "-")) {
            var operator = previous();
            enter(operator);
            var operand = unary();
            nesting--;
            return node(new Ast.Unary(operator, operand.ast()), operator, operand);
        }
        return primary();
    }

    /**
     * <pre>
     *  primary     :: NUMBER
     *              | ( ( ID | FUNCTION ) ( "(" arguments? ")" )? )
     *              | ( "(" expression ")" )
     * </pre>
     */
    private Parsed primary() {
        if (match(NUMBER)) {
            return new Parsed(new Ast.Number(previous()), 1);
        }
        if (match(IDENTIFIER, FUNCTION)) {
            var name = previous();
            if (match(PAREN_LEFT)) {
                return call(name);
            }
            return new Parsed(new Ast.Variable(name), 1);
        }
        if (match(PAREN_LEFT)) {
            enter(previous());
            var expression = expression();
            consume(PAREN_RIGHT, "')'");
            nesting--;
            return expression;
        }
        throw error(peek(), "primary expression");
    }

    /**
     * <pre>
     *  arguments   :: expression ( "," expression )*
     * </pre>
     */
    private Parsed call(Token name) {
        enter(previous());
        var arguments = new ArrayList<Parsed>();
        if (!check(PAREN_RIGHT)) {
            do {
                arguments.add(expression());
            } while (matchSeparator());
        }
        consume(PAREN_RIGHT, "')'");
        nesting--;
        var asts = arguments.stream().map(Parsed::ast).collect(Collectors.toList());
        return node(new Ast.Call(name, asts), name, arguments.toArray(Parsed[]::new));
    }

    //// depth limits ////

    // a subtree and its height, so the height never has to be recomputed
    private static record Parsed(Ast ast, int depth) {}

    private void enter(Token token) {
        if (++nesting > MAX_DEPTH) {
            throw error(token, "shallower nesting");
        }
    }

    private Parsed node(Ast ast, Token token, Parsed... children) {
        var depth = 0;
        for (var child : children) {
            depth = Math.max(depth, child.depth());
        }
        if (depth + 1 > MAX_DEPTH) {
            throw error(token, "shallower nesting");
        }
        return new Parsed(ast, depth + 1);
    }

    //// utility methods ////

    private Token consume(Token.Type type, String expected) {
        if (check(type)) {
            return advance();
        }

        throw error(peek(), expected);
    }

    private ParseError error(Token token, String expected) {
        return new ParseError(expected, token);
    }

    private boolean match(Token.Type... types) {
        for (var type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }

        return false;
    }

    private boolean matchOperator(String... lexemes) {
        for (var lexeme : lexemes) {
            if (peek().is(OPERATOR, lexeme)) {
                advance();
                return true;
            }
        }

        return false;
    }

    // the scanner has no comma token, it arrives as UNKNOWN
    private boolean matchSeparator() {
        if (peek().is(UNKNOWN, ",")) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(Token.Type type) {
        return !isAtEnd() && peek().type() == type;
    }

    private Token advance() {
        return tokens.advance();
    }

    private boolean isAtEnd() {
        return tokens.isAtEnd();
    }

    private Token peek() {
        return tokens.peek();
    }

    private Token previous() {
        return tokens.previous();
    }
}
