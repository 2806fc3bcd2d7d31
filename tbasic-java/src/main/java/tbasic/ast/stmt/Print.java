package tbasic.ast.stmt;

import tbasic.ast.expr.Expr;

import java.util.Objects;

public record Print(Expr value) implements Stmt {
    public Print {
        Objects.requireNonNull(value, "value");
    }
}
