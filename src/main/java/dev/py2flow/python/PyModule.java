package dev.py2flow.python;

import java.util.List;

/**
 * A parsed source file. Keeps the text so that nodes can be printed back.
 */
public record PyModule(String source, List<PyStmt> body) {

    public PyModule {
        body = List.copyOf(body);
    }

    public String text(Span span) {
        int end = Math.min(span.end(), source.length());
        return source.substring(Math.min(span.start(), end), end);
    }

    public String text(PyExpr expr) {
        return text(expr.span());
    }

    public String text(PyStmt stmt) {
        return text(stmt.span());
    }
}
