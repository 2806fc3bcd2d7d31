package tbasic.ast.stmt;

import tbasic.ast.Node;
import tbasic.ast.expr.Expr;

import java.util.List;
import java.util.Objects;

public record Conditional(
        Expr condition,
        List<Node> thenBody,
        List<Node> elseBody      // null when there is no ELSE clause
) implements Stmt {
    public Conditional {
        Objects.requireNonNull(condition, "condition");
        thenBody = List.copyOf(thenBody);
        elseBody = elseBody == null ? null : List.copyOf(elseBody);
    }

    public boolean hasElse() {
        return elseBody != null;
    }
}
