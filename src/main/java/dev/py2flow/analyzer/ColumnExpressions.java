package dev.py2flow.analyzer;

import dev.py2flow.model.FieldEffect;
import dev.py2flow.model.StepType;
import dev.py2flow.model.SubStep;
import dev.py2flow.python.PyExpr;
import dev.py2flow.python.PyExpr.*;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Classifies the right-hand side of {@code df[col] = expr} into a prepare
 * processor, or into a window step for running and partitioned computations.
 * Rules are evaluated in order; arithmetic and anything unrecognized fall
 * through to a formula.
 */
final class ColumnExpressions {

    private static final Set<String> STRING_MODES = Set.of(
        "upper", "lower", "title", "capitalize", "strip", "lstrip", "rstrip", "swapcase", "casefold");

    private static final Set<String> NUMPY_FUNCTIONS = Set.of(
        "log", "log1p", "log2", "log10", "exp", "sqrt", "abs", "square", "floor", "ceil", "sign", "round");

    private static final Set<String> UDF_METHODS = Set.of("apply", "map", "applymap", "transform", "pipe");


    /** The classified step; {@code window} steps become window recipes instead of prepare steps. */
    record ColumnStep(SubStep step, boolean window) {}

    private record Context(PyExpr value, Chain chain, List<String> targets, List<String> sources,
                           AnalysisSession session) {

        /** Name of the final method call, or an empty string. */
        String lastMethod() {
            return chain.isEmpty() ? ""
                : chain.link(chain.size() - 1) instanceof Chain.Link.MethodCall call ? call.name() : "";
        }

        Call lastCall() {
            return chain.link(chain.size() - 1) instanceof Chain.Link.MethodCall call ? call.node() : null;
        }

        boolean hasMethod(Set<String> names) {
            return chain.links().stream().anyMatch(l -> l instanceof Chain.Link.MethodCall call
                && names.contains(call.name()));
        }

        String text(PyExpr expr) {
            return session.text(expr);
        }

        List<FieldEffect> computed() {
            return targets.stream().map(t -> FieldEffect.computed(t, sources)).toList();
        }

        ColumnStep step(StepType type, Map<String, String> params) {
            return new ColumnStep(new SubStep(type, sources.isEmpty() ? targets : sources, params, computed()), false);
        }
    }

    private record Rule(String name, Predicate<Context> matcher, Function<Context, ColumnStep> builder) {}

    private static final List<Rule> RULES = List.of(
        new Rule("transformer", ColumnExpressions::isTransformer, ColumnExpressions::transformer),
        new Rule("group-window", c -> c.hasMethod(Set.of("groupby")) && DataFrameMethods.GROUP_WINDOW_METHODS.contains(c.lastMethod()),
            ColumnExpressions::groupWindow),
        new Rule("rolling", c -> c.hasMethod(Set.of("rolling", "expanding", "ewm")), ColumnExpressions::rolling),
        new Rule("series-window", c -> DataFrameMethods.WINDOW_METHODS.contains(c.lastMethod()),
            c -> window(c, Map.of("function", c.lastMethod()))),
        new Rule("string-method", ColumnExpressions::isStringMethod, ColumnExpressions::stringMethod),
        new Rule("fillna", c -> "fillna".equals(c.lastMethod()),
            c -> c.step(StepType.FILL_EMPTY, params("value", text(c, c.lastCall().argument(0, "value"))))),
        new Rule("astype", c -> "astype".equals(c.lastMethod()) && c.lastCall().argument(0, "dtype") != null,
            ColumnExpressions::astype),
        new Rule("to-datetime", c -> isFunction(c, "pandas.to_datetime"),
            c -> c.step(StepType.DATE_PARSER, params("format", text(c, firstCall(c).keyword("format"))))),
        new Rule("round", c -> "round".equals(c.lastMethod()),
            c -> c.step(StepType.ROUND_COLUMN, params("decimals", text(c, c.lastCall().argument(0, "decimals"))))),
        new Rule("abs", c -> "abs".equals(c.lastMethod()), c -> c.step(StepType.ABS_COLUMN, Map.of())),
        new Rule("clip", c -> "clip".equals(c.lastMethod()),
            c -> c.step(StepType.CLIP_COLUMN, params(
                "lower", text(c, c.lastCall().argument(0, "lower")),
                "upper", text(c, c.lastCall().argument(1, "upper"))))),
        new Rule("numpy-function", ColumnExpressions::isNumpyFunction,
            c -> c.step(StepType.NUMERICAL_TRANSFORMER, params("function", numpyFunction(c)))),
        new Rule("map-dict", c -> ("map".equals(c.lastMethod()) || "replace".equals(c.lastMethod()))
            && c.lastCall().argument(0, null) instanceof DictExpr,
            c -> c.step(StepType.FIND_REPLACE, params("mapping", c.text(c.lastCall().argument(0, null))))),
        new Rule("python-udf", c -> UDF_METHODS.contains(c.lastMethod()), ColumnExpressions::pythonUdf),
        new Rule("copy", ColumnExpressions::isCopy, ColumnExpressions::copy));

    private ColumnExpressions() {}

    /**
     * Classify {@code value} assigned to {@code targets} of dataframe {@code frame}.
     */
    static ColumnStep classify(PyExpr value, List<String> targets, String frame, AnalysisSession session) {
        var context = new Context(value, Chain.of(value), List.copyOf(targets),
            sourceColumns(value, frame, session.symbols()), session);
        for (Rule rule : RULES) {
            if (rule.matcher().test(context)) {
                return rule.builder().apply(context);
            }
        }
        return new ColumnStep(new SubStep(StepType.FORMULA, targets,
            params("expression", session.text(value)), context.computed()), false);
    }

    /**
     * Columns read by an expression. Inside lambdas the frame parameter has
     * another name, so any {@code x["col"]} subscript counts there.
     */
    static List<String> sourceColumns(PyExpr expr, String frame, SymbolTable symbols) {
        Set<String> columns = new LinkedHashSet<>();
        if (frame != null) {
            columns.addAll(Expressions.referencedColumns(expr, frame, symbols));
        }
        if (frame == null || Expressions.anyNode(expr, node -> node instanceof Lambda)) {
            collectSubscripts(expr, symbols, columns);
        }
        return List.copyOf(columns);
    }

    private static void collectSubscripts(PyExpr expr, SymbolTable symbols, Set<String> out) {
        if (expr instanceof Subscript subscript && subscript.value() instanceof Name) {
            String column = Expressions.stringValue(subscript.index(), symbols);
            if (column != null) {
                out.add(column);
                return;
            }
        }
        Expressions.forEachChild(expr, child -> collectSubscripts(child, symbols, out));
    }

    private static Map<String, String> params(String... pairs) {
        var params = new LinkedHashMap<String, String>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            if (pairs[i + 1] != null) {
                params.put(pairs[i], pairs[i + 1]);
            }
        }
        return params;
    }

    private static String text(Context context, PyExpr expr) {
        return expr == null ? null : context.text(expr);
    }

    private static Call firstCall(Context context) {
        Chain.Link first = context.chain().link(0);
        if (first instanceof Chain.Link.FunctionCall call) {
            return call.node();
        }
        return ((Chain.Link.MethodCall) first).node();
    }

    private static String qualifiedFirst(Context context) {
        Chain chain = context.chain();
        if (chain.isEmpty()) {
            return null;
        }
        SymbolTable symbols = context.session().symbols();
        if (chain.link(0) instanceof Chain.Link.FunctionCall call) {
            return symbols.qualify(call.name());
        }
        if (chain.root() != null && chain.link(0) instanceof Chain.Link.MethodCall call) {
            return symbols.qualify(chain.root() + "." + call.name());
        }
        return null;
    }

    private static boolean isFunction(Context context, String qualified) {
        return qualified.equals(qualifiedFirst(context));
    }

    private static ColumnStep window(Context context, Map<String, String> params) {
        return new ColumnStep(new SubStep(StepType.WINDOW, context.sources(), params, context.computed()), true);
    }

    private static boolean isTransformer(Context context) {
        String root = context.chain().root();
        if (root == null || context.chain().size() != 1) {
            return false;
        }
        SymbolTable.Binding binding = context.session().symbols().get(root);
        return binding != null && (binding.kind() == SymbolTable.Kind.ESTIMATOR || binding.kind() == SymbolTable.Kind.MODEL)
            && binding.detail() != null && SklearnCatalog.isTransformer(binding.detail())
            && ("fit_transform".equals(context.lastMethod()) || "transform".equals(context.lastMethod()));
    }

    private static ColumnStep transformer(Context context) {
        String estimator = context.session().symbols().get(context.chain().root()).detail();
        StepType type = SklearnCatalog.isEncoder(estimator) ? StepType.CATEGORICAL_ENCODER : StepType.NORMALIZER;
        return context.step(type, params("method", SklearnCatalog.transformerMethod(estimator), "estimator", estimator));
    }

    private static ColumnStep groupWindow(Context context) {
        String partition = null;
        for (Chain.Link link : context.chain().links()) {
            if (link instanceof Chain.Link.MethodCall call && call.name().equals("groupby")) {
                PyExpr by = call.node().argument(0, "by");
                partition = by == null ? null : String.join(", ",
                    Expressions.columnNames(by, context.session().symbols(), context.text(by)));
            }
        }
        String function = context.lastMethod();
        if (function.equals("transform")) {
            PyExpr func = context.lastCall().argument(0, "func");
            String named = func == null ? null : Expressions.stringValue(func, context.session().symbols());
            function = named != null ? named : func == null ? function : context.text(func);
        }
        String normalized = DataFrameMethods.aggregation(function);
        return window(context, params("partition", partition, "function", normalized != null ? normalized : function));
    }

    private static ColumnStep rolling(Context context) {
        String frame = null;
        String window = null;
        for (Chain.Link link : context.chain().links()) {
            if (link instanceof Chain.Link.MethodCall call && Set.of("rolling", "expanding", "ewm").contains(call.name())) {
                frame = call.name();
                PyExpr size = call.node().argument(0, call.name().equals("ewm") ? "span" : "window");
                window = text(context, size);
            }
        }
        String function = context.lastMethod();
        String normalized = DataFrameMethods.aggregation(function);
        return window(context, params("frame", frame, "window", window,
            "function", normalized != null ? normalized : function.isEmpty() ? null : function));
    }

    private static boolean isStringMethod(Context context) {
        Chain chain = context.chain();
        return chain.size() >= 2 && !context.lastMethod().isEmpty()
            && chain.link(chain.size() - 2) instanceof Chain.Link.AttributeAccess access && access.name().equals("str");
    }

    private static ColumnStep stringMethod(Context context) {
        String method = context.lastMethod();
        if (STRING_MODES.contains(method)) {
            return context.step(StepType.STRING_TRANSFORMER, params("mode", method.toUpperCase(Locale.ROOT)));
        }
        Call call = context.lastCall();
        if (method.equals("replace")) {
            return context.step(StepType.FIND_REPLACE, params(
                "from", text(context, call.argument(0, "pat")),
                "to", text(context, call.argument(1, "repl"))));
        }
        return context.step(StepType.FORMULA, params("expression", context.text(context.value())));
    }

    private static ColumnStep astype(Context context) {
        PyExpr dtype = context.lastCall().argument(0, "dtype");
        String name = Expressions.stringValue(dtype, context.session().symbols());
        if (name == null) {
            name = Expressions.dottedName(dtype);
        }
        String type = name == null ? context.text(dtype) : DataFrameMethods.storageType(SklearnCatalog.simpleName(name));
        return context.step(StepType.TYPE_SETTER, params("type", type));
    }

    private static boolean isNumpyFunction(Context context) {
        String qualified = qualifiedFirst(context);
        return context.chain().size() == 1 && qualified != null && qualified.startsWith("numpy.")
            && NUMPY_FUNCTIONS.contains(SklearnCatalog.simpleName(qualified));
    }

    private static String numpyFunction(Context context) {
        return SklearnCatalog.simpleName(qualifiedFirst(context));
    }

    private static ColumnStep pythonUdf(Context context) {
        var effects = context.targets().stream().map(FieldEffect::opaque).toList();
        var step = new SubStep(StepType.PYTHON_UDF, context.sources().isEmpty() ? context.targets() : context.sources(),
            params("expression", context.text(context.value())), effects);
        return new ColumnStep(step, false);
    }

    private static boolean isCopy(Context context) {
        return context.value() instanceof Subscript && context.chain().size() == 1
            && context.sources().size() == 1 && context.targets().size() == 1
            && !context.targets().get(0).equals(context.sources().get(0));
    }

    private static ColumnStep copy(Context context) {
        String source = context.sources().get(0);
        String target = context.targets().get(0);
        var step = new SubStep(StepType.COLUMN_COPIER, List.of(source), Map.of(),
            List.of(FieldEffect.rename(source, target)));
        return new ColumnStep(step, false);
    }
}
