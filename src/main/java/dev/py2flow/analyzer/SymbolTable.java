package dev.py2flow.analyzer;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * What each script variable currently denotes, as far as the analyzer is
 * concerned. Which dataset a dataframe variable denotes is tracked by the flow
 * builder, not here.
 */
final class SymbolTable {

    enum Kind {
        DATAFRAME,
        /** An estimator or transformer that has not been fitted. */
        ESTIMATOR,
        /** A fitted estimator; denotes a model dataset in the flow. */
        MODEL,
        /** A boolean row mask; {@code detail} is the mask expression. */
        MASK,
        MODULE,
        IMPORTED,
        CONSTANT,
        FUNCTION,
        /** Assigned by a statement that could not be converted. */
        UNRESOLVED,
        OTHER
    }

    /**
     * @param kind   binding kind
     * @param detail qualified module or import name, estimator class, mask expression or string constant value
     * @param values string items when the variable holds a list of string constants
     */
    record Binding(Kind kind, String detail, List<String> values) {

        Binding {
            values = values == null ? List.of() : List.copyOf(values);
        }
    }

    private final Map<String, Binding> bindings = new HashMap<>();

    SymbolTable() {
        // Conventional aliases, so that snippets without imports still resolve.
        bindings.put("pd", new Binding(Kind.MODULE, "pandas", null));
        bindings.put("np", new Binding(Kind.MODULE, "numpy", null));
    }

    Binding get(String name) {
        return bindings.get(name);
    }

    boolean is(String name, Kind kind) {
        Binding binding = bindings.get(name);
        return binding != null && binding.kind() == kind;
    }

    boolean isDataFrame(String name) {
        return is(name, Kind.DATAFRAME);
    }

    void bind(String name, Kind kind, String detail) {
        bindings.put(name, new Binding(kind, detail, null));
    }

    void bindConstant(String name, String value, List<String> values) {
        bindings.put(name, new Binding(Kind.CONSTANT, value, values));
    }

    void bindMask(String name, String expression, List<String> columns) {
        bindings.put(name, new Binding(Kind.MASK, expression, columns));
    }

    void bindDataFrame(String name) {
        bind(name, Kind.DATAFRAME, null);
    }

    void markUnresolved(String name) {
        bind(name, Kind.UNRESOLVED, null);
    }

    void unbind(String name) {
        bindings.remove(name);
    }

    /**
     * Resolves a dotted name such as {@code pd.read_csv} or {@code train_test_split}
     * to its qualified form, e.g. {@code pandas.read_csv} or
     * {@code sklearn.model_selection.train_test_split}. Unknown heads are kept as written.
     */
    String qualify(String dotted) {
        int dot = dotted.indexOf('.');
        String head = dot < 0 ? dotted : dotted.substring(0, dot);
        Binding binding = bindings.get(head);
        if (binding == null || (binding.kind() != Kind.MODULE && binding.kind() != Kind.IMPORTED)) {
            return dotted;
        }
        return dot < 0 ? binding.detail() : binding.detail() + dotted.substring(dot);
    }
}
