package tbasic.ast.stmt;

import java.util.Objects;

/** {@code DIM name}: reserves a storage slot. */
public record Declare(String name) implements Stmt {
    public Declare {
        Objects.requireNonNull(name, "name");
    }
}
