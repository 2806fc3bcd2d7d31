package tbasic.lexer;

import tbasic.CompileException;

public final class LexerException extends CompileException {

    public enum Kind {
        UNKNOWN_CHARACTER,
        MALFORMED_NUMBER
    }

    private final Kind kind;
    private final String text;
    private final int line;
    private final int column;

    public LexerException(Kind kind, String text, int line, int column, String message) {
        super("[" + line + ":" + column + "] " + message);
        this.kind = kind;
        this.text = text;
        this.line = line;
        this.column = column;
    }

    public Kind kind() { return kind; }

    /** The offending character or numeral. */
    public String text() { return text; }

    public int line() { return line; }

    public int column() { return column; }
}
