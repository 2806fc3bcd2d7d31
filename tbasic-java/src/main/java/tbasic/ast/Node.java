package tbasic.ast;

/**
 * Anything that may appear in a statement list: expressions are valid statements.
 * The closed hierarchies are {@link tbasic.ast.expr.Expr} and {@link tbasic.ast.stmt.Stmt}.
 */
public interface Node {}
