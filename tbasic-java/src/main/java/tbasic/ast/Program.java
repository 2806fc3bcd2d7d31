package tbasic.ast;

import java.util.List;

public record Program(List<Node> statements) {
    public Program {
        statements = List.copyOf(statements);
    }
}
