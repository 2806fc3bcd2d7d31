package tbasic.parser;

import tbasic.CompileException;
import tbasic.lexer.Token;

public final class ParseException extends CompileException {

    public enum Kind {
        UNEXPECTED_TOKEN,
        UNEXPECTED_END_OF_INPUT
    }

    private final Kind kind;
    private final String expected;
    private final Token found;

    public ParseException(String expected, Token found) {
        super("[" + found.line() + ":" + found.column() + "] Expected " + expected
                + " (got " + found.describe() + ")");
        this.kind = found.isEof() ? Kind.UNEXPECTED_END_OF_INPUT : Kind.UNEXPECTED_TOKEN;
        this.expected = expected;
        this.found = found;
    }

    public Kind kind() { return kind; }

    public String expected() { return expected; }

    public Token found() { return found; }
}
