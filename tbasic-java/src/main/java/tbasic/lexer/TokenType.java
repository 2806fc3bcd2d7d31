package tbasic.lexer;

public enum TokenType {
    NUMBER,
    IDENTIFIER,
    KEYWORD,
    SYMBOL,

    EOF
}
