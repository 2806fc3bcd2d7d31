package tbasic.parser;

import org.junit.jupiter.api.Test;
import tbasic.ast.Node;
import tbasic.ast.Program;
import tbasic.ast.expr.BinaryOp;
import tbasic.ast.expr.Expr;
import tbasic.ast.expr.NumberLiteral;
import tbasic.ast.expr.VariableRef;
import tbasic.ast.stmt.Conditional;
import tbasic.ast.stmt.CountedLoop;
import tbasic.ast.stmt.Declare;
import tbasic.ast.stmt.Print;
import tbasic.lexer.Lexer;
import tbasic.lexer.LexerException;
import tbasic.lexer.TokenType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static Program parse(String src) {
        return new Parser(new Lexer(src)).parseProgram();
    }

    private static Node single(String src) {
        var statements = parse(src).statements();
        assertEquals(1, statements.size(), () -> "statements: " + statements);
        return statements.get(0);
    }

    private static NumberLiteral num(double v) {
        return new NumberLiteral(v);
    }

    private static VariableRef var(String name) {
        return new VariableRef(name);
    }

    private static BinaryOp bin(Expr l, String op, Expr r) {
        return new BinaryOp(l, op, r);
    }

    @Test
    void parse_empty_program() {
        assertTrue(parse("").statements().isEmpty());
        assertTrue(parse("  \n ").statements().isEmpty());
    }

    @Test
    void parse_expr_precedence() {
        assertEquals(bin(num(2), "+", bin(num(3), "*", num(4))), single("2+3*4"));
        assertEquals(bin(bin(num(2), "*", num(3)), "-", num(4)), single("2*3-4"));
    }

    @Test
    void parse_parentheses_override_precedence() {
        assertEquals(bin(bin(num(2), "+", num(3)), "*", num(4)), single("(2+3)*4"));
        assertEquals(num(5), single("((5))"));
    }

    @Test
    void parse_binary_operators_left_associative() {
        assertEquals(bin(bin(num(8), "-", num(3)), "-", num(2)), single("8-3-2"));
        assertEquals(bin(bin(num(8), "/", num(4)), "/", num(2)), single("8/4/2"));
    }

    @Test
    void parse_dim_and_print() {
        var p = parse("DIM X PRINT X + 1");
        assertEquals(List.of(new Declare("X"), new Print(bin(var("X"), "+", num(1)))), p.statements());
    }

    @Test
    void parse_statements_are_not_line_sensitive() {
        assertEquals(parse("DIM X PRINT X"), parse("DIM\nX\n\nPRINT\n   X"));
    }

    @Test
    void parse_if_without_else_or_end() {
        assertEquals(new Conditional(var("X"), List.of(new Print(var("X"))), null),
                single("IF X THEN PRINT X"));
    }

    @Test
    void parse_if_else_end() {
        var p = parse("""
                IF X THEN PRINT 1
                ELSE PRINT 2
                END
                PRINT 3
                """);
        assertEquals(2, p.statements().size());

        var c = (Conditional) p.statements().get(0);
        assertTrue(c.hasElse());
        assertEquals(List.of(new Print(num(1))), c.thenBody());
        assertEquals(List.of(new Print(num(2))), c.elseBody());
        assertEquals(new Print(num(3)), p.statements().get(1));
    }

    @Test
    void parse_if_end_without_else() {
        var p = parse("IF X THEN PRINT 1 END PRINT 2");
        assertEquals(2, p.statements().size());
        assertNull(((Conditional) p.statements().get(0)).elseBody());
    }

    @Test
    void parse_if_with_empty_branches() {
        var c = (Conditional) single("IF 1 THEN ELSE END");
        assertTrue(c.thenBody().isEmpty());
        assertNotNull(c.elseBody());
        assertTrue(c.elseBody().isEmpty());
    }

    @Test
    void parse_if_without_end_swallows_following_statements() {
        // no terminator: everything after ELSE belongs to the else-branch
        var c = (Conditional) single("IF X THEN PRINT 1 ELSE PRINT 2 PRINT 3");
        assertEquals(2, c.elseBody().size());
    }

    @Test
    void parse_nested_if_closes_innermost_first() {
        var outer = (Conditional) single("IF A THEN IF B THEN PRINT 1 END PRINT 2 END");
        assertEquals(2, outer.thenBody().size());
        assertTrue(outer.thenBody().get(0) instanceof Conditional);
        assertEquals(new Print(num(2)), outer.thenBody().get(1));
    }

    @Test
    void parse_for_with_next() {
        var p = parse("FOR I = 1 TO 3 PRINT I NEXT PRINT 0");
        assertEquals(2, p.statements().size());
        assertEquals(new CountedLoop("I", num(1), num(3), List.of(new Print(var("I")))), p.statements().get(0));
    }

    @Test
    void parse_for_bounds_are_expressions() {
        var loop = (CountedLoop) single("FOR K = N - 1 TO (N + 1) * 2 NEXT");
        assertEquals(bin(var("N"), "-", num(1)), loop.start());
        assertEquals(bin(bin(var("N"), "+", num(1)), "*", num(2)), loop.end());
        assertTrue(loop.body().isEmpty());
    }

    @Test
    void parse_for_without_next_runs_to_end_of_input() {
        var loop = (CountedLoop) single("FOR I = 1 TO 2 PRINT I PRINT 5");
        assertEquals(2, loop.body().size());
    }

    @Test
    void parse_next_variable_name_is_not_checked() {
        // "NEXT I" ends the loop; the I that follows is an ordinary expression statement
        var p = parse("FOR I = 1 TO 3 NEXT I");
        assertEquals(2, p.statements().size());
        assertEquals(var("I"), p.statements().get(1));
    }

    @Test
    void parse_if_inside_for() {
        var loop = (CountedLoop) single("FOR I = 1 TO 10 IF I - 5 THEN PRINT I END NEXT");
        assertEquals(1, loop.body().size());
        assertTrue(loop.body().get(0) instanceof Conditional);
    }

    // ---------- errors ----------

    @Test
    void parse_dim_requires_identifier() {
        var e = assertThrows(ParseException.class, () -> parse("DIM 5"));
        assertEquals(ParseException.Kind.UNEXPECTED_TOKEN, e.kind());
        assertEquals(TokenType.NUMBER, e.found().type());
        assertTrue(e.expected().contains("variable name"));
        assertTrue(e.getMessage().startsWith("[1:5]"));
    }

    @Test
    void parse_print_at_end_of_input() {
        var e = assertThrows(ParseException.class, () -> parse("PRINT"));
        assertEquals(ParseException.Kind.UNEXPECTED_END_OF_INPUT, e.kind());
        assertTrue(e.found().isEof());
    }

    @Test
    void parse_missing_closing_paren() {
        var e = assertThrows(ParseException.class, () -> parse("PRINT (1+2"));
        assertEquals(ParseException.Kind.UNEXPECTED_END_OF_INPUT, e.kind());
        assertEquals("SYMBOL ')'", e.expected());
    }

    @Test
    void parse_if_requires_then() {
        var e = assertThrows(ParseException.class, () -> parse("IF X PRINT X"));
        assertEquals(ParseException.Kind.UNEXPECTED_TOKEN, e.kind());
        assertEquals("KEYWORD 'THEN'", e.expected());
        assertEquals("PRINT", e.found().lexeme());
    }

    @Test
    void parse_for_requires_assign_and_to() {
        assertThrows(ParseException.class, () -> parse("FOR I 1 TO 3"));
        assertThrows(ParseException.class, () -> parse("FOR I = 1 3"));
        assertThrows(ParseException.class, () -> parse("FOR 1 = 1 TO 3"));
    }

    @Test
    void parse_stray_keyword_is_not_an_expression() {
        var e = assertThrows(ParseException.class, () -> parse("THEN"));
        assertEquals("expression", e.expected());
    }

    @Test
    void parse_no_assignment_statement() {
        // "=" only appears inside FOR
        assertThrows(ParseException.class, () -> parse("X = 5"));
    }

    @Test
    void parse_next_inside_unterminated_if_is_an_error() {
        // the then-branch only stops at ELSE, END or end of input
        assertThrows(ParseException.class, () -> parse("FOR I = 1 TO 3 IF I THEN PRINT I NEXT"));
    }

    @Test
    void parse_lexer_errors_propagate() {
        assertThrows(LexerException.class, () -> parse("PRINT 1 $"));
    }
}
