package dev.py2flow.python;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Turns Python source into a token stream with explicit NEWLINE, INDENT and
 * DEDENT tokens. Newlines inside brackets and after a backslash continuation
 * are not significant.
 */
public final class PythonLexer {

    private static final String[] OPERATORS_3 = {"**=", "//=", ">>=", "<<=", "..."};
    private static final String[] OPERATORS_2 = {
        "**", "//", "==", "!=", "<=", ">=", "<<", ">>", "+=", "-=", "*=", "/=",
        "%=", "&=", "|=", "^=", "@=", "->", ":="
    };
    private static final String OPERATORS_1 = "+-*/%@&|^~<>()[]{},:.;=!";
    private static final int TAB_SIZE = 8;

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int pos;
    private int line = 1;
    private int depth;

    private PythonLexer(String source) {
        this.source = source.startsWith("\uFEFF") ? source.substring(1) : source;
    }

    /**
     * Tokenize a complete module.
     *
     * @throws PythonSyntaxException on unterminated strings, unmatched brackets
     *                               closing below zero or inconsistent dedents
     */
    public static List<Token> tokenize(String source) {
        return new PythonLexer(source).run();
    }

    private List<Token> run() {
        indents.push(0);
        boolean atLineStart = true;

        while (pos < source.length()) {
            if (atLineStart && depth == 0) {
                if (!handleIndentation()) {
                    continue;
                }
                atLineStart = false;
            }
            char c = source.charAt(pos);
            if (c == '\n') {
                if (depth == 0) {
                    emitNewline();
                    atLineStart = true;
                }
                pos++;
                line++;
            } else if (c == '\r' || c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\' && isLineBreakAt(pos + 1)) {
                pos += source.charAt(pos + 1) == '\r' && pos + 2 < source.length()
                    && source.charAt(pos + 2) == '\n' ? 3 : 2;
                line++;
            } else if (startsString()) {
                lexString();
            } else if (Character.isDigit(c)
                    || (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
                lexNumber();
            } else if (Character.isLetter(c) || c == '_') {
                lexName();
            } else {
                lexOperator();
            }
        }

        if (depth > 0) {
            throw new PythonSyntaxException("unexpected end of file inside brackets", line);
        }
        emitNewline();
        while (indents.peek() > 0) {
            indents.pop();
            tokens.add(new Token(TokenType.DEDENT, "", line, pos, pos));
        }
        tokens.add(new Token(TokenType.EOF, "", line, pos, pos));
        return tokens;
    }

    /**
     * Measures the indentation of the line starting at {@code pos}. Returns
     * false when the line is blank or a comment and has been consumed.
     */
    private boolean handleIndentation() {
        int column = 0;
        int p = pos;
        while (p < source.length()) {
            char c = source.charAt(p);
            if (c == ' ') {
                column++;
            } else if (c == '\t') {
                column = (column / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                column = 0;
            } else {
                break;
            }
            p++;
        }
        if (p >= source.length()) {
            pos = p;
            return false;
        }
        char c = source.charAt(p);
        if (c == '#' || c == '\n' || c == '\r') {
            pos = p;
            skipComment();
            if (pos < source.length() && source.charAt(pos) == '\r') {
                pos++;
            }
            if (pos < source.length() && source.charAt(pos) == '\n') {
                pos++;
                line++;
            }
            return false;
        }
        pos = p;
        int current = indents.peek();
        if (column > current) {
            indents.push(column);
            tokens.add(new Token(TokenType.INDENT, "", line, pos, pos));
        } else if (column < current) {
            while (column < indents.peek()) {
                indents.pop();
                tokens.add(new Token(TokenType.DEDENT, "", line, pos, pos));
            }
            if (column != indents.peek()) {
                throw new PythonSyntaxException("unindent does not match any outer indentation level", line);
            }
        }
        return true;
    }

    private void emitNewline() {
        if (tokens.isEmpty()) {
            return;
        }
        TokenType last = tokens.get(tokens.size() - 1).type();
        if (last != TokenType.NEWLINE && last != TokenType.INDENT && last != TokenType.DEDENT) {
            tokens.add(new Token(TokenType.NEWLINE, "", line, pos, pos));
        }
    }

    private void skipComment() {
        while (pos < source.length() && source.charAt(pos) != '\n' && source.charAt(pos) != '\r') {
            pos++;
        }
    }

    private boolean isLineBreakAt(int index) {
        return index < source.length() && (source.charAt(index) == '\n' || source.charAt(index) == '\r');
    }

    private boolean startsString() {
        int p = pos;
        int prefix = 0;
        while (p < source.length() && prefix < 2 && "rRbBuUfF".indexOf(source.charAt(p)) >= 0) {
            p++;
            prefix++;
        }
        return p < source.length() && (source.charAt(p) == '\'' || source.charAt(p) == '"');
    }

    private void lexString() {
        int start = pos;
        int startLine = line;
        while ("rRbBuUfF".indexOf(source.charAt(pos)) >= 0) {
            pos++;
        }
        char quote = source.charAt(pos);
        boolean triple = source.startsWith(String.valueOf(quote).repeat(3), pos);
        pos += triple ? 3 : 1;

        while (true) {
            if (pos >= source.length()) {
                throw new PythonSyntaxException("unterminated string literal", startLine);
            }
            char c = source.charAt(pos);
            if (c == '\\') {
                if (pos + 1 < source.length() && source.charAt(pos + 1) == '\n') {
                    line++;
                }
                pos += 2;
                continue;
            }
            if (c == '\n') {
                if (!triple) {
                    throw new PythonSyntaxException("unterminated string literal", startLine);
                }
                line++;
            }
            if (c == quote) {
                if (!triple) {
                    pos++;
                    break;
                }
                if (source.startsWith(String.valueOf(quote).repeat(3), pos)) {
                    pos += 3;
                    break;
                }
            }
            pos++;
        }
        tokens.add(new Token(TokenType.STRING, source.substring(start, pos), startLine, start, pos));
    }

    private void lexNumber() {
        int start = pos;
        if (source.charAt(pos) == '0' && pos + 1 < source.length()
                && "xXoObB".indexOf(source.charAt(pos + 1)) >= 0) {
            pos += 2;
            while (pos < source.length() && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
        } else {
            consumeDigits();
            if (pos < source.length() && source.charAt(pos) == '.') {
                pos++;
                consumeDigits();
            }
            if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
                int mark = pos;
                pos++;
                if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    consumeDigits();
                } else {
                    pos = mark;
                }
            }
            if (pos < source.length() && (source.charAt(pos) == 'j' || source.charAt(pos) == 'J')) {
                pos++;
            }
        }
        tokens.add(new Token(TokenType.NUMBER, source.substring(start, pos), line, start, pos));
    }

    private void consumeDigits() {
        while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
    }

    private void lexName() {
        int start = pos;
        while (pos < source.length() && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        tokens.add(new Token(TokenType.NAME, source.substring(start, pos), line, start, pos));
    }

    private void lexOperator() {
        for (String op : OPERATORS_3) {
            if (source.startsWith(op, pos)) {
                addOperator(op);
                return;
            }
        }
        for (String op : OPERATORS_2) {
            if (source.startsWith(op, pos)) {
                addOperator(op);
                return;
            }
        }
        char c = source.charAt(pos);
        if (OPERATORS_1.indexOf(c) < 0) {
            throw new PythonSyntaxException("unexpected character '%s'".formatted(c), line);
        }
        if (c == '(' || c == '[' || c == '{') {
            depth++;
        } else if (c == ')' || c == ']' || c == '}') {
            if (depth == 0) {
                throw new PythonSyntaxException("unmatched '%s'".formatted(c), line);
            }
            depth--;
        }
        addOperator(String.valueOf(c));
    }

    private void addOperator(String op) {
        tokens.add(new Token(TokenType.OP, op, line, pos, pos + op.length()));
        pos += op.length();
    }
}
