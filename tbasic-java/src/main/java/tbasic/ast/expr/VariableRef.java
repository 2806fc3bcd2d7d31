package tbasic.ast.expr;

import java.util.Objects;

public record VariableRef(String name) implements Expr {
    public VariableRef {
        Objects.requireNonNull(name, "name");
    }
}
