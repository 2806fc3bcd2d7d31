package tbasic.ast.stmt;

import tbasic.ast.Node;
import tbasic.ast.expr.Expr;

import java.util.List;
import java.util.Objects;

/** {@code FOR variable = start TO end ... NEXT}, ascending with step 1. */
public record CountedLoop(
        String variable,
        Expr start,
        Expr end,
        List<Node> body
) implements Stmt {
    public CountedLoop {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        body = List.copyOf(body);
    }
}
