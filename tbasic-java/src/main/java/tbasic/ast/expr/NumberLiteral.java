package tbasic.ast.expr;

public record NumberLiteral(double value) implements Expr {}
