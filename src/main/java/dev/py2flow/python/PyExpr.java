package dev.py2flow.python;

import java.util.List;

/**
 * Expression nodes of the parsed Python subset.
 */
public sealed interface PyExpr {

    Span span();

    record Name(Span span, String id) implements PyExpr {}

    /**
     * A literal. {@code value} holds the decoded text for strings, the literal
     * text for numbers and {@code True}/{@code False}/{@code None} otherwise.
     */
    record Constant(Span span, ConstantKind kind, String value) implements PyExpr {

        public boolean isString() {
            return kind == ConstantKind.STRING || kind == ConstantKind.FSTRING;
        }
    }

    record Attribute(Span span, PyExpr value, String attr) implements PyExpr {}

    record Call(Span span, PyExpr func, List<PyExpr> args, List<Keyword> keywords) implements PyExpr {

        public Call {
            args = List.copyOf(args);
            keywords = List.copyOf(keywords);
        }

        /** The keyword argument with this name, or null. */
        public PyExpr keyword(String name) {
            for (Keyword keyword : keywords) {
                if (name.equals(keyword.name())) {
                    return keyword.value();
                }
            }
            return null;
        }

        /** Positional argument {@code index}, falling back to the named keyword. */
        public PyExpr argument(int index, String name) {
            PyExpr byName = name == null ? null : keyword(name);
            if (byName != null) {
                return byName;
            }
            return index < args.size() && !(args.get(index) instanceof Starred) ? args.get(index) : null;
        }
    }

    /** A call keyword argument; {@code name} is null for {@code **kwargs}. */
    record Keyword(String name, PyExpr value) {}

    record Subscript(Span span, PyExpr value, PyExpr index) implements PyExpr {}

    record Slice(Span span, PyExpr lower, PyExpr upper, PyExpr step) implements PyExpr {}

    record ListExpr(Span span, List<PyExpr> elements) implements PyExpr {

        public ListExpr {
            elements = List.copyOf(elements);
        }
    }

    record TupleExpr(Span span, List<PyExpr> elements) implements PyExpr {

        public TupleExpr {
            elements = List.copyOf(elements);
        }
    }

    record SetExpr(Span span, List<PyExpr> elements) implements PyExpr {

        public SetExpr {
            elements = List.copyOf(elements);
        }
    }

    /** Dict display; a null key marks a {@code **mapping} entry. */
    record DictExpr(Span span, List<PyExpr> keys, List<PyExpr> values) implements PyExpr {}

    record BinOp(Span span, PyExpr left, String op, PyExpr right) implements PyExpr {}

    record UnaryOp(Span span, String op, PyExpr operand) implements PyExpr {}

    record BoolOp(Span span, String op, List<PyExpr> values) implements PyExpr {

        public BoolOp {
            values = List.copyOf(values);
        }
    }

    record Compare(Span span, PyExpr left, List<String> ops, List<PyExpr> comparators) implements PyExpr {

        public Compare {
            ops = List.copyOf(ops);
            comparators = List.copyOf(comparators);
        }
    }

    record IfExp(Span span, PyExpr test, PyExpr body, PyExpr orElse) implements PyExpr {}

    record Lambda(Span span, PyExpr body) implements PyExpr {}

    /**
     * List/set/dict comprehension or generator expression. {@code parts} holds
     * the iterables and conditions of every {@code for}/{@code if} clause.
     */
    record Comprehension(Span span, String kind, PyExpr element, List<PyExpr> parts) implements PyExpr {

        public Comprehension {
            parts = List.copyOf(parts);
        }
    }

    record Starred(Span span, PyExpr value) implements PyExpr {}

    enum ConstantKind {
        STRING,
        FSTRING,
        BYTES,
        NUMBER,
        BOOLEAN,
        NONE,
        ELLIPSIS
    }
}
