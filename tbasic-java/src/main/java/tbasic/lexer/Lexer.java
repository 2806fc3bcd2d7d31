package tbasic.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * On-demand scanner: every {@link #next()} call produces exactly one token.
 * Once the input is exhausted it keeps returning {@code EOF}.
 */
public class Lexer {

    private static final Set<String> keywords = Set.of(
            "DIM", "PRINT", "IF", "THEN", "ELSE", "FOR", "NEXT", "TO"
    );

    private static final String SYMBOLS = "+-*/()=<>:";

    private final String source;

    private int pos = 0;
    private int line = 1;
    private int col = 1;

    public Lexer(String source) {
        this.source = source;
    }

    public Token next() {
        skipWhitespace();

        int startLine = line;
        int startCol = col;

        if (isAtEnd()) return new Token(TokenType.EOF, "", 0, startLine, startCol);

        char c = peek();

        if (isDigit(c)) return numberLiteral(startLine, startCol);
        if (isAlpha(c)) return identifierOrKeyword(startLine, startCol);

        if (SYMBOLS.indexOf(c) >= 0) {
            advance();
            return new Token(TokenType.SYMBOL, String.valueOf(c), 0, startLine, startCol);
        }

        throw new LexerException(LexerException.Kind.UNKNOWN_CHARACTER, String.valueOf(c),
                startLine, startCol, "Unknown character: '" + c + "'");
    }

    /** Scans the whole input; the last element is always the {@code EOF} token. */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token t;
        do {
            t = next();
            tokens.add(t);
        } while (!t.isEof());
        return tokens;
    }

    // ================= helpers =================

    // digits and dots are taken greedily, so "1.2.3" reaches the float parser and fails there
    private Token numberLiteral(int line, int col) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && (isDigit(peek()) || peek() == '.')) {
            sb.append(advance());
        }

        String text = sb.toString();
        try {
            return new Token(TokenType.NUMBER, text, Double.parseDouble(text), line, col);
        } catch (NumberFormatException e) {
            throw new LexerException(LexerException.Kind.MALFORMED_NUMBER, text,
                    line, col, "Malformed number: '" + text + "'");
        }
    }

    private Token identifierOrKeyword(int line, int col) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && isAlphaNumeric(peek())) {
            sb.append(advance());
        }

        String text = sb.toString();
        TokenType type = keywords.contains(text) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
        return new Token(type, text, 0, line, col);
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            switch (c) {
                case ' ', '\t', '\r', '\f', '\u000B' -> advance();
                case '\n' -> {
                    advance();
                    line++;
                    col = 1;
                }
                default -> { return; }
            }
        }
    }

    private char advance() {
        char c = source.charAt(pos++);
        col++;
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
