package mathtex.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class AstPrinterTest {

    @Test
    void print() {
        var ast = new Parser(new TokenStream(new Scanner("sin(x)+-2").getTokens())).parse();
        assertEquals("BinaryOp: +\n"
            + "  FunctionCall: sin\n"
            + "    Variable: x\n"
            + "  UnaryOp: -\n"
            + "    Number: 2\n",
            AstPrinter.print(ast));
    }

    @Test
    void emptyCallHasNoChildren() {
        var ast = new Parser(new TokenStream(new Scanner("f()").getTokens())).parse();
        assertEquals("FunctionCall: f\n", AstPrinter.print(ast));
    }
}
