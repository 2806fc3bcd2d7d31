package tbasic.ast.expr;

import java.util.List;
import java.util.Objects;

public record Call(
        String name,
        List<Expr> args
) implements Expr {
    public Call {
        Objects.requireNonNull(name, "name");
        args = List.copyOf(args);
    }
}
