package dev.py2flow.analyzer;

import dev.py2flow.python.PyExpr;
import dev.py2flow.python.PyExpr.*;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Static helpers for reading literal arguments and column references out of
 * expression trees.
 */
final class Expressions {

    private Expressions() {}

    /** {@code a.b.c} for a name/attribute path, otherwise null. */
    static String dottedName(PyExpr expr) {
        if (expr instanceof Name name) {
            return name.id();
        }
        if (expr instanceof Attribute attribute) {
            String head = dottedName(attribute.value());
            return head == null ? null : head + "." + attribute.attr();
        }
        return null;
    }

    /** The value of a string literal or of a variable holding one, otherwise null. */
    static String stringValue(PyExpr expr, SymbolTable symbols) {
        if (expr instanceof Constant constant && constant.kind() == ConstantKind.STRING) {
            return constant.value();
        }
        if (expr instanceof Name name) {
            SymbolTable.Binding binding = symbols.get(name.id());
            if (binding != null && binding.kind() == SymbolTable.Kind.CONSTANT && binding.detail() != null) {
                return binding.detail();
            }
        }
        return null;
    }

    /**
     * Strings of a literal string, list or tuple of strings, or of a variable
     * bound to one. Returns null when any element is not a known string.
     */
    static List<String> stringList(PyExpr expr, SymbolTable symbols) {
        if (expr == null) {
            return null;
        }
        String single = stringValue(expr, symbols);
        if (single != null) {
            return List.of(single);
        }
        List<PyExpr> elements = null;
        if (expr instanceof ListExpr list) {
            elements = list.elements();
        } else if (expr instanceof TupleExpr tuple) {
            elements = tuple.elements();
        } else if (expr instanceof Name name) {
            SymbolTable.Binding binding = symbols.get(name.id());
            if (binding != null && binding.kind() == SymbolTable.Kind.CONSTANT && !binding.values().isEmpty()) {
                return binding.values();
            }
        }
        if (elements == null) {
            return null;
        }
        List<String> values = new ArrayList<>();
        for (PyExpr element : elements) {
            String value = stringValue(element, symbols);
            if (value == null) {
                return null;
            }
            values.add(value);
        }
        return values;
    }

    /**
     * Column names given by {@code expr}; unknown expressions become a single
     * {@code {text}} placeholder so the step still records what was referenced.
     */
    static List<String> columnNames(PyExpr expr, SymbolTable symbols, String text) {
        List<String> values = stringList(expr, symbols);
        return values != null ? values : List.of(placeholder(text));
    }

    static String columnName(PyExpr expr, SymbolTable symbols, String text) {
        String value = stringValue(expr, symbols);
        return value != null ? value : placeholder(text);
    }

    static String placeholder(String text) {
        return "{" + text.strip() + "}";
    }

    static boolean isTrue(PyExpr expr) {
        return expr instanceof Constant constant && constant.kind() == ConstantKind.BOOLEAN
            && constant.value().equals("True");
    }

    static boolean isFalse(PyExpr expr) {
        return expr instanceof Constant constant && constant.kind() == ConstantKind.BOOLEAN
            && constant.value().equals("False");
    }

    static boolean isNone(PyExpr expr) {
        return expr instanceof Constant constant && constant.kind() == ConstantKind.NONE;
    }

    /** Integer value of a numeric literal, or null. */
    static Integer intValue(PyExpr expr) {
        if (expr instanceof Constant constant && constant.kind() == ConstantKind.NUMBER) {
            try {
                return Integer.valueOf(constant.value().replace("_", ""));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (expr instanceof UnaryOp unary && unary.op().equals("-")) {
            Integer value = intValue(unary.operand());
            return value == null ? null : -value;
        }
        return null;
    }

    /** True for {@code axis=1} or {@code axis="columns"}. */
    static boolean isColumnAxis(PyExpr expr) {
        if (expr == null) {
            return false;
        }
        Integer value = intValue(expr);
        if (value != null) {
            return value == 1;
        }
        return expr instanceof Constant constant && constant.value().equals("columns");
    }

    static void forEachChild(PyExpr expr, Consumer<PyExpr> visitor) {
        if (expr instanceof Attribute e) {
            visitor.accept(e.value());
        } else if (expr instanceof Call e) {
            visitor.accept(e.func());
            e.args().forEach(visitor);
            e.keywords().forEach(k -> visitor.accept(k.value()));
        } else if (expr instanceof Subscript e) {
            visitor.accept(e.value());
            visitor.accept(e.index());
        } else if (expr instanceof Slice e) {
            acceptIfPresent(e.lower(), visitor);
            acceptIfPresent(e.upper(), visitor);
            acceptIfPresent(e.step(), visitor);
        } else if (expr instanceof ListExpr e) {
            e.elements().forEach(visitor);
        } else if (expr instanceof TupleExpr e) {
            e.elements().forEach(visitor);
        } else if (expr instanceof SetExpr e) {
            e.elements().forEach(visitor);
        } else if (expr instanceof DictExpr e) {
            e.keys().forEach(k -> acceptIfPresent(k, visitor));
            e.values().forEach(visitor);
        } else if (expr instanceof BinOp e) {
            visitor.accept(e.left());
            visitor.accept(e.right());
        } else if (expr instanceof UnaryOp e) {
            visitor.accept(e.operand());
        } else if (expr instanceof BoolOp e) {
            e.values().forEach(visitor);
        } else if (expr instanceof Compare e) {
            visitor.accept(e.left());
            e.comparators().forEach(visitor);
        } else if (expr instanceof IfExp e) {
            visitor.accept(e.test());
            visitor.accept(e.body());
            visitor.accept(e.orElse());
        } else if (expr instanceof Lambda e) {
            visitor.accept(e.body());
        } else if (expr instanceof Comprehension e) {
            visitor.accept(e.element());
            e.parts().forEach(visitor);
        } else if (expr instanceof Starred e) {
            visitor.accept(e.value());
        }
    }

    private static void acceptIfPresent(PyExpr expr, Consumer<PyExpr> visitor) {
        if (expr != null) {
            visitor.accept(expr);
        }
    }

    /** True when any node of the tree satisfies {@code predicate}. */
    static boolean anyNode(PyExpr expr, Predicate<PyExpr> predicate) {
        if (predicate.test(expr)) {
            return true;
        }
        boolean[] found = {false};
        forEachChild(expr, child -> {
            if (!found[0] && anyNode(child, predicate)) {
                found[0] = true;
            }
        });
        return found[0];
    }

    /** True when the tree reads any variable accepted by {@code filter}. */
    static boolean referencesName(PyExpr expr, Predicate<String> filter) {
        return anyNode(expr, node -> node instanceof Name name && filter.test(name.id()));
    }

    /**
     * Columns of {@code frame} read by the expression: {@code frame["c"]},
     * {@code frame.c} and {@code frame.loc[..., "c"]}.
     */
    static Set<String> referencedColumns(PyExpr expr, String frame, SymbolTable symbols) {
        Set<String> columns = new LinkedHashSet<>();
        collectColumns(expr, frame, symbols, columns);
        return columns;
    }

    private static void collectColumns(PyExpr expr, String frame, SymbolTable symbols, Set<String> out) {
        if (expr instanceof Subscript subscript && isName(subscript.value(), frame)) {
            List<String> names = stringList(subscript.index(), symbols);
            if (names != null) {
                out.addAll(names);
                return;
            }
        }
        if (expr instanceof Subscript subscript && subscript.value() instanceof Attribute attribute
                && isName(attribute.value(), frame) && attribute.attr().equals("loc")
                && subscript.index() instanceof TupleExpr tuple && tuple.elements().size() == 2) {
            List<String> names = stringList(tuple.elements().get(1), symbols);
            if (names != null) {
                out.addAll(names);
            }
            collectColumns(tuple.elements().get(0), frame, symbols, out);
            return;
        }
        if (expr instanceof Attribute attribute && isName(attribute.value(), frame)
                && !DataFrameMethods.isKnownAttribute(attribute.attr())) {
            out.add(attribute.attr());
            return;
        }
        forEachChild(expr, child -> collectColumns(child, frame, symbols, out));
    }

    static boolean isName(PyExpr expr, String id) {
        return expr instanceof Name name && name.id().equals(id);
    }
}
