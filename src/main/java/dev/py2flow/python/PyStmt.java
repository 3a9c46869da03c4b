package dev.py2flow.python;

import java.util.List;

/**
 * Statement nodes of the parsed Python subset.
 */
public sealed interface PyStmt {

    Span span();

    /** {@code a = b = value}; each target may itself be a tuple. */
    record Assign(Span span, List<PyExpr> targets, PyExpr value) implements PyStmt {

        public Assign {
            targets = List.copyOf(targets);
        }
    }

    record AugAssign(Span span, PyExpr target, String op, PyExpr value) implements PyStmt {}

    record ExprStmt(Span span, PyExpr value) implements PyStmt {}

    /** {@code import a as b} when {@code module} is null, otherwise {@code from module import ...}. */
    record Import(Span span, String module, List<Alias> names) implements PyStmt {

        public Import {
            names = List.copyOf(names);
        }
    }

    record Alias(String name, String asName) {

        public String boundName() {
            if (asName != null) {
                return asName;
            }
            int dot = name.indexOf('.');
            return dot < 0 ? name : name.substring(0, dot);
        }
    }

    record If(Span span, PyExpr test, List<PyStmt> body, List<PyStmt> orElse) implements PyStmt {}

    record For(Span span, PyExpr target, PyExpr iter, List<PyStmt> body, List<PyStmt> orElse) implements PyStmt {}

    record While(Span span, PyExpr test, List<PyStmt> body, List<PyStmt> orElse) implements PyStmt {}

    record With(Span span, List<WithItem> items, List<PyStmt> body) implements PyStmt {}

    record WithItem(PyExpr context, PyExpr target) {}

    record Try(Span span, List<PyStmt> body, List<ExceptHandler> handlers,
               List<PyStmt> orElse, List<PyStmt> finalBody) implements PyStmt {}

    record ExceptHandler(PyExpr type, String name, List<PyStmt> body) {}

    record FunctionDef(Span span, String name, List<String> params, List<PyStmt> body) implements PyStmt {}

    record ClassDef(Span span, String name, List<PyStmt> body) implements PyStmt {}

    record Delete(Span span, List<PyExpr> targets) implements PyStmt {}

    record Return(Span span, PyExpr value) implements PyStmt {}

    /** {@code pass}, {@code break}, {@code raise ...} and other statements without data semantics. */
    record Simple(Span span, String keyword) implements PyStmt {}

    /** A statement the parser could not read; parsing resumed at the next line. */
    record Invalid(Span span, String message) implements PyStmt {}
}
