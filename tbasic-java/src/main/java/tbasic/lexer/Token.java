package tbasic.lexer;

import java.util.Objects;

/**
 * A lexical unit. {@code number} is only meaningful for {@link TokenType#NUMBER},
 * whose identity is its value; other tokens are identified by their lexeme.
 * Line and column are diagnostics only and are ignored by {@link #equals(Object)},
 * so the parser can compare a scanned token against an expected one.
 */
public record Token(TokenType type, String lexeme, double number, int line, int column) {

    public static Token number(double value) {
        return new Token(TokenType.NUMBER, Double.toString(value), value, 0, 0);
    }

    public static Token identifier(String name) {
        return new Token(TokenType.IDENTIFIER, name, 0, 0, 0);
    }

    public static Token keyword(String word) {
        return new Token(TokenType.KEYWORD, word, 0, 0, 0);
    }

    public static Token symbol(String symbol) {
        return new Token(TokenType.SYMBOL, symbol, 0, 0, 0);
    }

    public static Token eof() {
        return new Token(TokenType.EOF, "", 0, 0, 0);
    }

    public boolean is(TokenType type, String lexeme) {
        return this.type == type && this.lexeme.equals(lexeme);
    }

    public boolean isEof() {
        return type == TokenType.EOF;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token other)) return false;
        if (type != other.type) return false;
        return type == TokenType.NUMBER
                ? Double.compare(number, other.number) == 0
                : lexeme.equals(other.lexeme);
    }

    @Override
    public int hashCode() {
        return type == TokenType.NUMBER ? Objects.hash(type, number) : Objects.hash(type, lexeme);
    }

    /** Short form used in diagnostics, e.g. {@code KEYWORD 'THEN'}. */
    public String describe() {
        return switch (type) {
            case NUMBER -> "NUMBER '" + lexeme + "'";
            case EOF -> "end of input";
            default -> type + " '" + lexeme + "'";
        };
    }

    @Override
    public String toString() {
        return switch (type) {
            case NUMBER -> "NUMBER(" + number + ")@" + line + ":" + column;
            default -> type + "('" + lexeme + "')@" + line + ":" + column;
        };
    }
}
