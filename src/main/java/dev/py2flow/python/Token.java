package dev.py2flow.python;

/**
 * A lexical token. {@code text} is the raw source slice, so string tokens keep
 * their prefix and quotes.
 */
public record Token(TokenType type, String text, int line, int start, int end) {

    public boolean is(TokenType expected, String value) {
        return type == expected && text.equals(value);
    }

    public boolean isOp(String value) {
        return is(TokenType.OP, value);
    }

    public boolean isKeyword(String value) {
        return is(TokenType.NAME, value);
    }

    public Span span() {
        return new Span(line, start, end);
    }
}
