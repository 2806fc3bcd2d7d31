package tbasic.parser;

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
import tbasic.lexer.Token;
import tbasic.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser pulling tokens from the lexer one at a time.
 * Only {@link #current} is looked at; the first structural error aborts.
 */
public final class Parser {

    private static final Token DIM = Token.keyword("DIM");
    private static final Token PRINT = Token.keyword("PRINT");
    private static final Token IF = Token.keyword("IF");
    private static final Token THEN = Token.keyword("THEN");
    private static final Token ELSE = Token.keyword("ELSE");
    private static final Token FOR = Token.keyword("FOR");
    private static final Token TO = Token.keyword("TO");
    private static final Token NEXT = Token.keyword("NEXT");

    // END is not a keyword; the block terminator is spelled as a plain identifier
    private static final Token END = Token.identifier("END");

    private static final Token ASSIGN = Token.symbol("=");
    private static final Token LPAREN = Token.symbol("(");
    private static final Token RPAREN = Token.symbol(")");

    private final Lexer lexer;
    private Token current;

    public Parser(Lexer lexer) {
        this.lexer = lexer;
        this.current = lexer.next();
    }

    // ---------- entry ----------
    public Program parseProgram() {
        List<Node> statements = new ArrayList<>();
        while (!current.isEof()) {
            statements.add(parseStatement());
        }
        return new Program(statements);
    }

    // ---------- statements ----------
    private Node parseStatement() {
        if (check(DIM)) return parseDim();
        if (check(PRINT)) return parsePrint();
        if (check(IF)) return parseIf();
        if (check(FOR)) return parseFor();
        return parseExpr();
    }

    private Declare parseDim() {
        expect(DIM);
        return new Declare(expectIdentifier("variable name after DIM"));
    }

    private Print parsePrint() {
        expect(PRINT);
        return new Print(parseExpr());
    }

    private Conditional parseIf() {
        expect(IF);
        Expr condition = parseExpr();
        expect(THEN);

        List<Node> thenBody = new ArrayList<>();
        while (!check(ELSE) && !check(END) && !current.isEof()) {
            thenBody.add(parseStatement());
        }

        List<Node> elseBody = null;
        if (check(ELSE)) {
            expect(ELSE);
            elseBody = new ArrayList<>();
            while (!check(END) && !current.isEof()) {
                elseBody.add(parseStatement());
            }
        }

        if (check(END)) expect(END);
        return new Conditional(condition, thenBody, elseBody);
    }

    private CountedLoop parseFor() {
        expect(FOR);
        String variable = expectIdentifier("loop variable after FOR");
        expect(ASSIGN);
        Expr start = parseExpr();
        expect(TO);
        Expr end = parseExpr();

        List<Node> body = new ArrayList<>();
        while (!check(NEXT) && !current.isEof()) {
            body.add(parseStatement());
        }

        if (check(NEXT)) expect(NEXT);
        return new CountedLoop(variable, start, end, body);
    }

    // ---------- expressions (precedence climbing) ----------
    private Expr parseExpr() {
        Expr e = parseTerm();
        while (current.is(TokenType.SYMBOL, "+") || current.is(TokenType.SYMBOL, "-")) {
            String op = advance().lexeme();
            e = new BinaryOp(e, op, parseTerm());
        }
        return e;
    }

    private Expr parseTerm() {
        Expr e = parseFactor();
        while (current.is(TokenType.SYMBOL, "*") || current.is(TokenType.SYMBOL, "/")) {
            String op = advance().lexeme();
            e = new BinaryOp(e, op, parseFactor());
        }
        return e;
    }

    private Expr parseFactor() {
        switch (current.type()) {
            case NUMBER -> {
                return new NumberLiteral(advance().number());
            }
            case IDENTIFIER -> {
                return new VariableRef(advance().lexeme());
            }
            default -> {
                if (check(LPAREN)) {
                    expect(LPAREN);
                    Expr e = parseExpr();
                    expect(RPAREN);
                    return e;
                }
                throw new ParseException("expression", current);
            }
        }
    }

    // ---------- helpers ----------
    private boolean check(Token expected) {
        return current.equals(expected);
    }

    private Token expect(Token expected) {
        if (check(expected)) return advance();
        throw new ParseException(expected.describe(), current);
    }

    private String expectIdentifier(String what) {
        if (current.type() != TokenType.IDENTIFIER) throw new ParseException(what, current);
        return advance().lexeme();
    }

    private Token advance() {
        Token consumed = current;
        current = lexer.next();
        return consumed;
    }
}
