package mathtex.lang;

import java.util.List;

import lombok.NonNull;

/**
 * Syntax tree of one math expression. Nodes keep the token they were built
 * from so errors can point back at the source.
 */
public sealed interface Ast {

    <R> R accept(Visitor<R> visitor);

    /** Numeric literal, kept as written. */
    record Number(@NonNull Token value) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumberAst(this);
        }
    }

    record Variable(@NonNull Token name) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariableAst(this);
        }
    }

    /** {@code + - * / ^ _} between two operands. */
    record Binary(@NonNull Ast left, @NonNull Token operator, @NonNull Ast right) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryAst(this);
        }
    }

    /** Prefix {@code +} or {@code -}. */
    record Unary(@NonNull Token operator, @NonNull Ast operand) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryAst(this);
        }
    }

    /** Name applied to a parenthesized, possibly empty argument list. */
    record Call(@NonNull Token name, @NonNull List<Ast> arguments) implements Ast {

        public Call {
            arguments = List.copyOf(arguments);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCallAst(this);
        }
    }

    interface Visitor<R> {
        R visitNumberAst(Number ast);
        R visitVariableAst(Variable ast);
        R visitBinaryAst(Binary ast);
        R visitUnaryAst(Unary ast);
        R visitCallAst(Call ast);
    }
}
