package tbasic.ast.expr;

import java.util.Objects;

/**
 * {@code operator} is the source symbol ({@code + - * /}). It is kept as text
 * rather than an enum so the code generator stays the one place that decides
 * which operators it can lower.
 */
public record BinaryOp(
        Expr left,
        String operator,
        Expr right
) implements Expr {
    public BinaryOp {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(right, "right");
    }
}
