package dev.py2flow.analyzer;

import dev.py2flow.model.FieldEffect;
import dev.py2flow.model.JoinType;
import dev.py2flow.model.StepType;
import dev.py2flow.model.SubStep;
import dev.py2flow.python.PyExpr;
import dev.py2flow.python.PyExpr.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * pandas rows of the idiom table. Module-level functions ({@code pd.read_csv},
 * {@code pd.merge}, ...) match at the root of a chain; the rest match method
 * calls, attributes and subscripts applied to a dataframe.
 */
final class PandasIdioms {

    private static final Set<String> MASK_METHODS = Set.of(
        "isin", "between", "notna", "notnull", "isna", "isnull", "duplicated", "contains", "startswith",
        "endswith", "match", "eq", "ne", "gt", "ge", "lt", "le");


    private static final Set<String> QUERY_WORDS = Set.of("and", "or", "not", "in", "is", "True", "False", "None");

    private static final Pattern QUERY_IDENTIFIER = Pattern.compile("(?<![@.\\w])[A-Za-z_]\\w*(?!\\s*\\()");
    private static final Pattern QUERY_QUOTED = Pattern.compile("'[^']*'|\"[^\"]*\"");
    private static final Pattern QUERY_BACKTICK = Pattern.compile("`([^`]+)`");

    private PandasIdioms() {}

    static void register(IdiomTable table) {
        // module-level functions
        table.add(new Idiom("read", OperationTag.READ, PandasIdioms::isRead, PandasIdioms::read));
        table.add(new Idiom("dataframe-literal", OperationTag.READ,
            site -> site.isPandasFunction("DataFrame"), PandasIdioms::dataFrameLiteral));
        table.add(new Idiom("merge-function", OperationTag.JOIN,
            site -> site.isPandasFunction("merge"), PandasIdioms::mergeFunction));
        table.add(new Idiom("concat", OperationTag.STACK,
            site -> site.isPandasFunction("concat"), PandasIdioms::concat));
        table.add(new Idiom("pivot-function", OperationTag.RESHAPE,
            site -> site.isPandasFunction("pivot", "pivot_table"), site -> pivot(site, site.frame(site.call().argument(0, "data")))));
        table.add(new Idiom("melt-function", OperationTag.RESHAPE,
            site -> site.isPandasFunction("melt"), site -> melt(site, site.frame(site.call().argument(0, "frame")))));
        table.add(new Idiom("script-function", OperationTag.CUSTOM, PandasIdioms::isScriptFunction, PandasIdioms::scriptFunction));

        // dataframe methods
        table.add(new Idiom("passthrough", OperationTag.BIND,
            site -> site.onFrame() && (site.isMethodIn(DataFrameMethods.PASSTHROUGH) || "values".equals(site.attribute(0))),
            site -> Idiom.Match.passthrough(site, 1)));
        table.add(new Idiom("write", OperationTag.WRITE,
            site -> site.onFrame() && site.method() != null && DataFrameMethods.writeFormat(site.method()) != null,
            PandasIdioms::write));
        table.add(new Idiom("query", OperationTag.FILTER,
            site -> site.onFrame() && site.isMethod("query") && site.string(site.call().argument(0, "expr")) != null,
            PandasIdioms::query));
        table.add(new Idiom("dropna", OperationTag.FILTER,
            site -> site.onFrame() && site.isMethod("dropna") && !Expressions.isColumnAxis(site.call().keyword("axis")),
            PandasIdioms::dropna));
        table.add(new Idiom("row-mask", OperationTag.FILTER,
            site -> site.onFrame() && isMask(site.index(0), site.symbols()), PandasIdioms::rowMask));
        table.add(new Idiom("loc", OperationTag.FILTER,
            site -> site.onFrame() && "loc".equals(site.attribute(0)) && site.index(1) != null, PandasIdioms::loc));
        table.add(new Idiom("iloc-head", OperationTag.SAMPLE,
            site -> site.onFrame() && "iloc".equals(site.attribute(0)) && leadingSliceSize(site.index(1)) != null,
            PandasIdioms::ilocHead));
        table.add(new Idiom("column-value-counts", OperationTag.AGGREGATE,
            site -> site.onFrame() && site.strings(site.index(0)) != null && "value_counts".equals(site.method(1)),
            PandasIdioms::columnValueCounts));
        table.add(new Idiom("column-selection", OperationTag.DERIVE_COLUMN,
            site -> site.onFrame() && site.index(0) != null && site.strings(site.index(0)) != null,
            site -> select(site, site.strings(site.index(0)), 1)));
        table.add(new Idiom("attribute-column", OperationTag.DERIVE_COLUMN,
            site -> site.onFrame() && site.attribute(0) != null && !DataFrameMethods.isKnownAttribute(site.attribute(0)),
            site -> select(site, List.of(site.attribute(0)), 1)));
        table.add(new Idiom("fillna", OperationTag.DERIVE_COLUMN,
            site -> site.onFrame() && site.isMethod("fillna", "ffill", "bfill"), PandasIdioms::fillna));
        table.add(new Idiom("rename", OperationTag.DERIVE_COLUMN,
            site -> site.onFrame() && site.isMethod("rename") && renameMapping(site) != null, PandasIdioms::rename));
        table.add(new Idiom("drop-columns", OperationTag.DERIVE_COLUMN, PandasIdioms::isDropColumns, PandasIdioms::dropColumns));
        table.add(new Idiom("astype", OperationTag.DERIVE_COLUMN,
            site -> site.onFrame() && site.isMethod("astype") && site.call().argument(0, "dtype") != null, PandasIdioms::astype));
        table.add(new Idiom("assign", OperationTag.DERIVE_COLUMN,
            site -> site.onFrame() && site.isMethod("assign") && !site.call().keywords().isEmpty(), PandasIdioms::assign));
        table.add(new Idiom("replace", OperationTag.DERIVE_COLUMN,
            site -> site.onFrame() && site.isMethod("replace"), PandasIdioms::replace));
        table.add(new Idiom("numeric", OperationTag.DERIVE_COLUMN,
            site -> site.onFrame() && site.isMethod("round", "abs", "clip"), PandasIdioms::numeric));
        table.add(new Idiom("merge", OperationTag.JOIN,
            site -> site.onFrame() && site.isMethod("merge"), PandasIdioms::merge));
        table.add(new Idiom("join", OperationTag.JOIN,
            site -> site.onFrame() && site.isMethod("join"), PandasIdioms::join));
        table.add(new Idiom("groupby-window", OperationTag.RESHAPE, PandasIdioms::isGroupWindow, PandasIdioms::groupWindow));
        table.add(new Idiom("groupby-aggregate", OperationTag.AGGREGATE,
            site -> site.onFrame() && site.isMethod("groupby"), PandasIdioms::groupAggregate));
        table.add(new Idiom("value-counts", OperationTag.AGGREGATE,
            site -> site.onFrame() && site.isMethod("value_counts"), PandasIdioms::valueCounts));
        table.add(new Idiom("sort", OperationTag.SORT,
            site -> site.onFrame() && site.isMethod("sort_values", "sort_index"), PandasIdioms::sort));
        table.add(new Idiom("dedupe", OperationTag.DEDUPE,
            site -> site.onFrame() && site.isMethod("drop_duplicates"), PandasIdioms::dedupe));
        table.add(new Idiom("head-tail", OperationTag.SAMPLE,
            site -> site.onFrame() && site.isMethod("head", "tail"), PandasIdioms::headTail));
        table.add(new Idiom("largest-smallest", OperationTag.SAMPLE,
            site -> site.onFrame() && site.isMethod("nlargest", "nsmallest"), PandasIdioms::largestSmallest));
        table.add(new Idiom("sample", OperationTag.SAMPLE,
            site -> site.onFrame() && site.isMethod("sample"), PandasIdioms::randomSample));
        table.add(new Idiom("pivot", OperationTag.RESHAPE,
            site -> site.onFrame() && site.isMethod("pivot", "pivot_table"), site -> pivot(site, site.receiverVariable())));
        table.add(new Idiom("melt", OperationTag.RESHAPE,
            site -> site.onFrame() && site.isMethod("melt"), site -> melt(site, site.receiverVariable())));
        table.add(new Idiom("rolling", OperationTag.RESHAPE,
            site -> site.onFrame() && site.isMethod("rolling", "expanding", "ewm") && site.method(1) != null,
            PandasIdioms::rolling));
        table.add(new Idiom("window-function", OperationTag.RESHAPE,
            site -> site.onFrame() && site.isMethodIn(DataFrameMethods.WINDOW_METHODS), PandasIdioms::windowFunction));
        table.add(new Idiom("python-only", OperationTag.CUSTOM,
            site -> site.onFrame() && site.isMethodIn(DataFrameMethods.PYTHON_ONLY), PandasIdioms::pythonOnly));
    }

    // ---- shared helpers ----

    private static Idiom.Match filter(IdiomSite site, String input, SubStep step, int consumed) {
        return Idiom.Match.frame(new Operation.Filter(site.origin(), input, site.output(consumed), step), consumed);
    }

    private static Idiom.Match derive(IdiomSite site, SubStep step, int consumed) {
        return Idiom.Match.frame(
            new Operation.DeriveColumn(site.origin(), site.receiverVariable(), site.output(consumed), step), consumed);
    }

    private static Idiom.Match select(IdiomSite site, List<String> columns, int consumed) {
        return derive(site, SubStep.of(StepType.COLUMNS_SELECTOR, columns), consumed);
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

    private static String textOrNull(IdiomSite site, PyExpr expr) {
        return expr == null ? null : site.text(expr);
    }

    /**
     * True for expressions that evaluate to a boolean row mask: comparisons,
     * {@code &}/{@code |}/{@code ~} combinations, mask-producing methods and
     * variables bound to such an expression.
     */
    static boolean isMask(PyExpr expr, SymbolTable symbols) {
        if (expr instanceof Compare || expr instanceof BoolOp) {
            return true;
        }
        if (expr instanceof UnaryOp unary) {
            return (unary.op().equals("~") || unary.op().equals("not")) && isMask(unary.operand(), symbols);
        }
        if (expr instanceof BinOp binOp && (binOp.op().equals("&") || binOp.op().equals("|"))) {
            return true;
        }
        if (expr instanceof Call call && call.func() instanceof Attribute attribute) {
            return MASK_METHODS.contains(attribute.attr());
        }
        return expr instanceof Name name && symbols.is(name.id(), SymbolTable.Kind.MASK);
    }

    private static String maskText(IdiomSite site, PyExpr mask) {
        if (mask instanceof Name name && site.symbols().is(name.id(), SymbolTable.Kind.MASK)) {
            return site.symbols().get(name.id()).detail();
        }
        return site.text(mask);
    }

    private static List<String> maskColumns(IdiomSite site, PyExpr mask) {
        if (mask instanceof Name name && site.symbols().is(name.id(), SymbolTable.Kind.MASK)) {
            return site.symbols().get(name.id()).values();
        }
        return List.copyOf(Expressions.referencedColumns(mask, site.rootName(), site.symbols()));
    }

    // ---- module-level functions ----

    private static boolean isRead(IdiomSite site) {
        String function = site.function();
        return function != null && function.startsWith("pandas.")
            && DataFrameMethods.readFormat(SklearnCatalog.simpleName(function)) != null;
    }

    private static Idiom.Match read(IdiomSite site) {
        Call call = site.call();
        String function = site.functionName();
        String format = DataFrameMethods.readFormat(function);
        PyExpr source = call.argument(0, null);
        for (String keyword : List.of("filepath_or_buffer", "path", "io", "path_or_buf", "table_name", "sql")) {
            if (source == null) {
                source = call.keyword(keyword);
            }
        }
        String path = site.string(source);
        if ("sql".equals(format) && !function.equals("read_sql_table") && path != null
                && path.strip().contains(" ")) {
            // a query, not a table name
            path = null;
        }
        List<String> columns = site.strings(call.keyword("usecols"));
        return Idiom.Match.frame(new Operation.Read(site.origin(), site.output(1), path, format, columns), 1);
    }

    private static Idiom.Match dataFrameLiteral(IdiomSite site) {
        Call call = site.call();
        List<String> columns = site.strings(call.keyword("columns"));
        if (columns == null && call.argument(0, "data") instanceof DictExpr dict) {
            columns = new ArrayList<>();
            for (PyExpr key : dict.keys()) {
                String name = site.string(key);
                if (name != null) {
                    columns.add(name);
                }
            }
        }
        return Idiom.Match.frame(new Operation.Read(site.origin(), site.output(1), null, "inline", columns), 1);
    }

    private static Idiom.Match mergeFunction(IdiomSite site) {
        Call call = site.call();
        String left = site.frame(call.argument(0, "left"));
        String right = site.frame(call.argument(1, "right"));
        if (left == null || right == null) {
            return null;
        }
        return joinMatch(site, left, right, call, "inner");
    }

    private static Idiom.Match concat(IdiomSite site) {
        Call call = site.call();
        PyExpr objects = call.argument(0, "objs");
        List<PyExpr> elements = null;
        if (objects instanceof ListExpr list) {
            elements = list.elements();
        } else if (objects instanceof TupleExpr tuple) {
            elements = tuple.elements();
        }
        if (elements == null || elements.isEmpty()) {
            return null;
        }
        List<String> sources = site.frames(elements);
        if (sources == null) {
            return null;
        }
        String output = site.output(1);
        if (Expressions.isColumnAxis(call.keyword("axis"))) {
            return Idiom.Match.frame(new Operation.Custom(site.origin(), sources, List.of(output), "concat",
                site.text(call)), 1);
        }
        return Idiom.Match.frame(new Operation.Stack(site.origin(), sources, output), 1);
    }

    private static boolean isScriptFunction(IdiomSite site) {
        return site.atFunctionRoot() && site.link() instanceof Chain.Link.FunctionCall call
            && site.symbols().is(call.name(), SymbolTable.Kind.FUNCTION);
    }

    private static Idiom.Match scriptFunction(IdiomSite site) {
        var link = (Chain.Link.FunctionCall) site.link();
        List<String> sources = site.frameArguments(link.node());
        if (sources.isEmpty()) {
            return null;
        }
        return Idiom.Match.frame(new Operation.Custom(site.origin(), sources, List.of(site.output(1)), link.name(),
            site.functionSource(link.name())), 1);
    }

    // ---- dataframe methods ----

    private static Idiom.Match write(IdiomSite site) {
        Call call = site.call();
        String format = DataFrameMethods.writeFormat(site.method());
        PyExpr destination = call.argument(0, null);
        for (String keyword : List.of("path_or_buf", "path", "excel_writer", "name")) {
            if (destination == null) {
                destination = call.keyword(keyword);
            }
        }
        var write = new Operation.Write(site.origin(), site.receiverVariable(), site.string(destination), format);
        return new Idiom.Match(List.of(write), 1, Idiom.Value.none());
    }

    private static Idiom.Match query(IdiomSite site) {
        PyExpr argument = site.call().argument(0, "expr");
        if (argument == null) {
            return null;
        }
        String expression = site.string(argument);
        List<String> columns = expression == null ? List.of() : queryColumns(expression);
        var step = new SubStep(StepType.FILTER_ON_FORMULA, columns,
            params("expression", expression == null ? site.text(argument) : expression), null);
        return filter(site, site.receiverVariable(), step, 1);
    }

    /** Column names referenced by a {@code DataFrame.query} expression. */
    static List<String> queryColumns(String expression) {
        Set<String> columns = new LinkedHashSet<>();
        Matcher backtick = QUERY_BACKTICK.matcher(expression);
        while (backtick.find()) {
            columns.add(backtick.group(1));
        }
        String plain = QUERY_QUOTED.matcher(QUERY_BACKTICK.matcher(expression).replaceAll(" ")).replaceAll(" ");
        Matcher identifier = QUERY_IDENTIFIER.matcher(plain);
        while (identifier.find()) {
            if (!QUERY_WORDS.contains(identifier.group())) {
                columns.add(identifier.group());
            }
        }
        return List.copyOf(columns);
    }

    private static Idiom.Match dropna(IdiomSite site) {
        Call call = site.call();
        List<String> subset = site.columns(call.keyword("subset"));
        var step = new SubStep(StepType.REMOVE_ROWS_ON_EMPTY, subset,
            params("how", site.string(call.keyword("how")), "thresh", textOrNull(site, call.keyword("thresh"))), null);
        return filter(site, site.receiverVariable(), step, 1);
    }

    private static Idiom.Match rowMask(IdiomSite site) {
        PyExpr mask = site.index(0);
        var step = new SubStep(StepType.FILTER_ON_FORMULA, maskColumns(site, mask),
            params("expression", maskText(site, mask)), null);
        return filter(site, site.receiverVariable(), step, 1);
    }

    private static Idiom.Match loc(IdiomSite site) {
        PyExpr index = site.index(1);
        PyExpr rows = index;
        PyExpr columns = null;
        if (index instanceof TupleExpr tuple && tuple.elements().size() == 2) {
            rows = tuple.elements().get(0);
            columns = tuple.elements().get(1);
        }
        boolean allRows = rows instanceof Slice slice && slice.lower() == null && slice.upper() == null
            && slice.step() == null;
        List<String> selected = columns == null ? null : site.strings(columns);
        if (columns != null && selected == null) {
            return null;
        }
        if (allRows) {
            return selected == null ? null : select(site, selected, 2);
        }
        if (!isMask(rows, site.symbols())) {
            return null;
        }
        var step = new SubStep(StepType.FILTER_ON_FORMULA, maskColumns(site, rows),
            params("expression", maskText(site, rows)), null);
        if (selected == null) {
            return filter(site, site.receiverVariable(), step, 2);
        }
        String filtered = site.temporary();
        var ops = List.<Operation>of(
            new Operation.Filter(site.origin(), site.receiverVariable(), filtered, step),
            new Operation.DeriveColumn(site.origin(), filtered, site.output(2), SubStep.of(StepType.COLUMNS_SELECTOR, selected)));
        return Idiom.Match.frames(ops, 2);
    }

    /** {@code n} for an index of the form {@code [:n]} or {@code [0:n]}, else null. */
    private static Integer leadingSliceSize(PyExpr index) {
        if (index instanceof Slice slice && slice.step() == null && slice.upper() != null) {
            Integer lower = slice.lower() == null ? Integer.valueOf(0) : Expressions.intValue(slice.lower());
            Integer upper = Expressions.intValue(slice.upper());
            if (lower != null && lower == 0 && upper != null && upper > 0) {
                return upper;
            }
        }
        return null;
    }

    private static Idiom.Match ilocHead(IdiomSite site) {
        String size = String.valueOf(leadingSliceSize(site.index(1)));
        return Idiom.Match.frame(new Operation.Sample(site.origin(), site.receiverVariable(), site.output(2),
            Operation.SampleMode.HEAD, size, null), 2);
    }

    private static Idiom.Match columnValueCounts(IdiomSite site) {
        List<String> keys = site.strings(site.index(0));
        var aggregations = List.of(new Aggregation(keys.get(0), "COUNT", "count"));
        return Idiom.Match.frame(new Operation.Aggregate(site.origin(), site.receiverVariable(), site.output(2), keys,
            aggregations), 2);
    }

    private static Idiom.Match fillna(IdiomSite site) {
        Call call = site.call();
        String method = site.method().equals("fillna") ? site.string(call.keyword("method")) : site.method();
        PyExpr value = site.method().equals("fillna") ? call.argument(0, "value") : null;
        List<String> columns = List.of();
        List<FieldEffect> effects = new ArrayList<>();
        if (value instanceof DictExpr dict) {
            columns = new ArrayList<>();
            for (PyExpr key : dict.keys()) {
                String column = key == null ? null : site.string(key);
                if (column == null) {
                    return null;
                }
                columns.add(column);
                effects.add(FieldEffect.computed(column, List.of(column)));
            }
        }
        var step = new SubStep(StepType.FILL_EMPTY, columns,
            params("value", textOrNull(site, value), "method", method), effects);
        return derive(site, step, 1);
    }

    private static Map<String, String> renameMapping(IdiomSite site) {
        Call call = site.call();
        PyExpr mapping = call.keyword("columns");
        if (mapping == null && Expressions.isColumnAxis(call.keyword("axis"))) {
            mapping = call.argument(0, "mapper");
        }
        if (!(mapping instanceof DictExpr dict)) {
            return null;
        }
        var renames = new LinkedHashMap<String, String>();
        for (int i = 0; i < dict.keys().size(); i++) {
            String from = dict.keys().get(i) == null ? null : site.string(dict.keys().get(i));
            String to = site.string(dict.values().get(i));
            if (from == null || to == null) {
                return null;
            }
            renames.put(from, to);
        }
        return renames;
    }

    private static Idiom.Match rename(IdiomSite site) {
        Map<String, String> renames = renameMapping(site);
        var effects = renames.entrySet().stream()
            .map(e -> FieldEffect.rename(e.getKey(), e.getValue()))
            .toList();
        var step = new SubStep(StepType.COLUMN_RENAMER, List.copyOf(renames.keySet()), null, effects);
        return derive(site, step, 1);
    }

    private static boolean isDropColumns(IdiomSite site) {
        if (!site.onFrame() || !site.isMethod("drop")) {
            return false;
        }
        Call call = site.call();
        return call.keyword("columns") != null
            || (Expressions.isColumnAxis(call.keyword("axis")) && call.argument(0, "labels") != null);
    }

    private static Idiom.Match dropColumns(IdiomSite site) {
        Call call = site.call();
        PyExpr columns = call.keyword("columns") != null ? call.keyword("columns") : call.argument(0, "labels");
        return derive(site, SubStep.of(StepType.COLUMN_DELETER, site.columns(columns)), 1);
    }

    private static Idiom.Match astype(IdiomSite site) {
        PyExpr dtype = site.call().argument(0, "dtype");
        if (!(dtype instanceof DictExpr dict)) {
            var step = new SubStep(StepType.TYPE_SETTER, List.of(), params("type", storageType(site, dtype)), null);
            return derive(site, step, 1);
        }
        List<Operation> ops = new ArrayList<>();
        String input = site.receiverVariable();
        for (int i = 0; i < dict.keys().size(); i++) {
            String column = dict.keys().get(i) == null ? null : site.string(dict.keys().get(i));
            if (column == null) {
                return null;
            }
            String output = i == dict.keys().size() - 1 ? site.output(1) : site.temporary();
            var step = new SubStep(StepType.TYPE_SETTER, List.of(column),
                params("type", storageType(site, dict.values().get(i))), null);
            ops.add(new Operation.DeriveColumn(site.origin(), input, output, step));
            input = output;
        }
        return ops.isEmpty() ? null : Idiom.Match.frames(ops, 1);
    }

    static String storageType(IdiomSite site, PyExpr dtype) {
        String name = site.string(dtype);
        if (name == null) {
            name = Expressions.dottedName(dtype);
        }
        if (name == null) {
            return site.text(dtype);
        }
        return DataFrameMethods.storageType(SklearnCatalog.simpleName(name));
    }

    private static Idiom.Match assign(IdiomSite site) {
        List<Keyword> keywords = site.call().keywords().stream().filter(k -> k.name() != null).toList();
        if (keywords.isEmpty()) {
            return null;
        }
        List<Operation> ops = new ArrayList<>();
        String input = site.receiverVariable();
        for (int i = 0; i < keywords.size(); i++) {
            Keyword keyword = keywords.get(i);
            List<String> sources = ColumnExpressions.sourceColumns(keyword.value(), site.rootName(), site.symbols());
            var step = new SubStep(StepType.FORMULA, List.of(keyword.name()),
                params("expression", site.text(keyword.value())),
                List.of(FieldEffect.computed(keyword.name(), sources)));
            String output = i == keywords.size() - 1 ? site.output(1) : site.temporary();
            ops.add(new Operation.DeriveColumn(site.origin(), input, output, step));
            input = output;
        }
        return Idiom.Match.frames(ops, 1);
    }

    private static Idiom.Match replace(IdiomSite site) {
        Call call = site.call();
        PyExpr toReplace = call.argument(0, "to_replace");
        PyExpr value = call.argument(1, "value");
        List<String> columns = new ArrayList<>();
        if (toReplace instanceof DictExpr dict && !dict.values().isEmpty()
                && dict.values().stream().allMatch(v -> v instanceof DictExpr)) {
            for (PyExpr key : dict.keys()) {
                String column = key == null ? null : site.string(key);
                if (column != null) {
                    columns.add(column);
                }
            }
        }
        var step = new SubStep(StepType.FIND_REPLACE, columns,
            params("from", textOrNull(site, toReplace), "to", textOrNull(site, value)), null);
        return derive(site, step, 1);
    }

    private static Idiom.Match numeric(IdiomSite site) {
        Call call = site.call();
        return switch (site.method()) {
            case "round" -> {
                PyExpr decimals = call.argument(0, "decimals");
                List<String> columns = List.of();
                if (decimals instanceof DictExpr dict) {
                    columns = dict.keys().stream().map(site::string).filter(Objects::nonNull).toList();
                }
                yield derive(site, new SubStep(StepType.ROUND_COLUMN, columns,
                    params("decimals", decimals instanceof DictExpr ? null : textOrNull(site, decimals)), null), 1);
            }
            case "abs" -> derive(site, SubStep.of(StepType.ABS_COLUMN, List.of()), 1);
            default -> derive(site, new SubStep(StepType.CLIP_COLUMN, List.of(),
                params("lower", textOrNull(site, call.argument(0, "lower")),
                    "upper", textOrNull(site, call.argument(1, "upper"))), null), 1);
        };
    }

    private static Idiom.Match merge(IdiomSite site) {
        Call call = site.call();
        String right = site.frame(call.argument(0, "right"));
        return right == null ? null : joinMatch(site, site.receiverVariable(), right, call, "inner");
    }

    private static Idiom.Match join(IdiomSite site) {
        Call call = site.call();
        String right = site.frame(call.argument(0, "other"));
        return right == null ? null : joinMatch(site, site.receiverVariable(), right, call, "left");
    }

    private static Idiom.Match joinMatch(IdiomSite site, String left, String right, Call call, String defaultHow) {
        List<String> leftKeys;
        List<String> rightKeys;
        if (call.keyword("on") != null) {
            leftKeys = site.columns(call.keyword("on"));
            rightKeys = leftKeys;
        } else {
            leftKeys = site.columns(call.keyword("left_on"));
            rightKeys = call.keyword("right_on") == null ? leftKeys : site.columns(call.keyword("right_on"));
        }
        String how = site.string(call.keyword("how"));
        var type = JoinType.fromPandas(how == null ? defaultHow : how);
        return Idiom.Match.frame(new Operation.Join(site.origin(), left, right, site.output(1), type, leftKeys,
            rightKeys), 1);
    }

    // ---- grouping ----

    private static List<String> groupKeys(IdiomSite site) {
        Call call = site.call();
        PyExpr by = call.argument(0, "by");
        if (by == null) {
            return call.keyword("level") != null ? List.of(Expressions.placeholder("index")) : null;
        }
        return site.columns(by);
    }

    /** Offset of the link after {@code groupby(...)} and an optional column selection. */
    private static int afterSelection(IdiomSite site) {
        return site.index(1) != null && site.strings(site.index(1)) != null ? 2 : 1;
    }

    private static boolean isGroupWindow(IdiomSite site) {
        if (!site.onFrame() || !site.isMethod("groupby")) {
            return false;
        }
        String method = site.method(afterSelection(site));
        return method != null && DataFrameMethods.GROUP_WINDOW_METHODS.contains(method);
    }

    private static Idiom.Match groupWindow(IdiomSite site) {
        List<String> keys = groupKeys(site);
        if (keys == null) {
            return null;
        }
        int offset = afterSelection(site);
        List<String> columns = offset == 2 ? site.strings(site.index(1)) : List.of();
        Call call = site.call(offset);
        String function = site.method(offset);
        PyExpr func = call.argument(0, "func");
        if (function.equals("transform") && func != null) {
            String named = site.string(func);
            function = named != null ? named : site.text(func);
        }
        String normalized = DataFrameMethods.aggregation(function);
        List<FieldEffect> effects = columns.stream()
            .map(c -> FieldEffect.computed(c, List.of(c)))
            .toList();
        var step = new SubStep(StepType.WINDOW, columns,
            params("partition", String.join(", ", keys), "function", normalized != null ? normalized : function), effects);
        return Idiom.Match.frame(new Operation.Reshape(site.origin(), site.receiverVariable(), site.output(offset + 1),
            Operation.ReshapeMode.WINDOW, step), offset + 1);
    }

    private static Idiom.Match groupAggregate(IdiomSite site) {
        List<String> keys = groupKeys(site);
        if (keys == null) {
            return null;
        }
        int offset = afterSelection(site);
        List<String> selected = offset == 2 ? site.strings(site.index(1)) : List.of();
        String method = site.method(offset);
        if (method == null) {
            return null;
        }
        List<Aggregation> aggregations;
        if (method.equals("agg") || method.equals("aggregate")) {
            aggregations = aggregations(site, site.call(offset), selected);
        } else if (method.equals("size")) {
            aggregations = List.of(new Aggregation("*", "COUNT", "count"));
        } else if (DataFrameMethods.isAggregation(method)) {
            aggregations = applyAll(selected, List.of(method));
        } else {
            return null;
        }
        if (aggregations == null || aggregations.isEmpty()) {
            return null;
        }
        return Idiom.Match.frame(new Operation.Aggregate(site.origin(), site.receiverVariable(),
            site.output(offset + 1), keys, aggregations), offset + 1);
    }

    private static List<Aggregation> aggregations(IdiomSite site, Call call, List<String> selected) {
        List<Aggregation> result = new ArrayList<>();
        PyExpr spec = call.argument(0, "func");
        if (spec instanceof DictExpr dict) {
            for (int i = 0; i < dict.keys().size(); i++) {
                String column = dict.keys().get(i) == null ? null : site.string(dict.keys().get(i));
                List<String> functions = functionNames(site, dict.values().get(i));
                if (column == null || functions == null) {
                    return null;
                }
                result.addAll(applyAll(List.of(column), functions));
            }
        } else if (spec != null) {
            List<String> functions = functionNames(site, spec);
            if (functions == null) {
                return null;
            }
            result.addAll(applyAll(selected, functions));
        }
        for (Keyword keyword : call.keywords()) {
            if (keyword.name() == null || keyword.name().equals("func")) {
                continue;
            }
            Aggregation named = namedAggregation(site, keyword);
            if (named == null) {
                return null;
            }
            result.add(named);
        }
        return result;
    }

    /** Aggregation functions given as a string, a list of strings or function references. */
    private static List<String> functionNames(IdiomSite site, PyExpr expr) {
        List<String> names = site.strings(expr);
        if (names != null) {
            return names;
        }
        List<PyExpr> elements = expr instanceof ListExpr list ? list.elements() : List.of(expr);
        List<String> resolved = new ArrayList<>();
        for (PyExpr element : elements) {
            String dotted = Expressions.dottedName(element);
            if (dotted == null) {
                resolved.add(Expressions.placeholder(site.text(element)));
            } else {
                resolved.add(SklearnCatalog.simpleName(dotted));
            }
        }
        return resolved;
    }

    private static List<Aggregation> applyAll(List<String> columns, List<String> functions) {
        List<String> targets = columns.isEmpty() ? List.of("*") : columns;
        List<Aggregation> result = new ArrayList<>();
        for (String column : targets) {
            for (String function : functions) {
                String normalized = DataFrameMethods.aggregation(function);
                String output = functions.size() == 1 ? column : column + "_" + function;
                result.add(new Aggregation(column, normalized != null ? normalized : "CUSTOM", output));
            }
        }
        return result;
    }

    /** {@code out=("col", "func")} or {@code out=pd.NamedAgg(column=..., aggfunc=...)}. */
    private static Aggregation namedAggregation(IdiomSite site, Keyword keyword) {
        PyExpr column = null;
        PyExpr function = null;
        if (keyword.value() instanceof TupleExpr tuple && tuple.elements().size() == 2) {
            column = tuple.elements().get(0);
            function = tuple.elements().get(1);
        } else if (keyword.value() instanceof Call call) {
            column = call.argument(0, "column");
            function = call.argument(1, "aggfunc");
        }
        String columnName = site.string(column);
        if (columnName == null || function == null) {
            return null;
        }
        List<String> functions = functionNames(site, function);
        String normalized = DataFrameMethods.aggregation(functions.get(0));
        return new Aggregation(columnName, normalized != null ? normalized : "CUSTOM", keyword.name());
    }

    private static Idiom.Match valueCounts(IdiomSite site) {
        List<String> keys = site.columns(site.call().argument(0, "subset"));
        if (keys.isEmpty()) {
            keys = List.of("*");
        }
        var aggregations = List.of(new Aggregation(keys.get(0), "COUNT", "count"));
        return Idiom.Match.frame(new Operation.Aggregate(site.origin(), site.receiverVariable(), site.output(1), keys,
            aggregations), 1);
    }

    // ---- ordering, dedupe, sampling ----

    private static Idiom.Match sort(IdiomSite site) {
        Call call = site.call();
        List<String> columns = site.method().equals("sort_index")
            ? List.of(Expressions.placeholder("index"))
            : site.columns(call.argument(0, "by"));
        if (columns.isEmpty()) {
            return null;
        }
        PyExpr ascending = call.keyword("ascending");
        List<Boolean> order = new ArrayList<>();
        if (ascending instanceof ListExpr list && list.elements().size() == columns.size()) {
            list.elements().forEach(e -> order.add(!Expressions.isFalse(e)));
        } else {
            boolean value = !Expressions.isFalse(ascending);
            columns.forEach(c -> order.add(value));
        }
        return Idiom.Match.frame(new Operation.Sort(site.origin(), site.receiverVariable(), site.output(1), columns,
            order), 1);
    }

    private static Idiom.Match dedupe(IdiomSite site) {
        Call call = site.call();
        PyExpr keep = call.keyword("keep");
        String keepValue = keep == null ? "first" : Expressions.isFalse(keep) ? "none" : site.string(keep);
        return Idiom.Match.frame(new Operation.Dedupe(site.origin(), site.receiverVariable(), site.output(1),
            site.columns(call.argument(0, "subset")), keepValue), 1);
    }

    private static Idiom.Match headTail(IdiomSite site) {
        PyExpr n = site.call().argument(0, "n");
        var mode = site.method().equals("head") ? Operation.SampleMode.HEAD : Operation.SampleMode.TAIL;
        return Idiom.Match.frame(new Operation.Sample(site.origin(), site.receiverVariable(), site.output(1), mode,
            n == null ? "5" : site.text(n), null), 1);
    }

    private static Idiom.Match largestSmallest(IdiomSite site) {
        Call call = site.call();
        PyExpr n = call.argument(0, "n");
        var mode = site.method().equals("nlargest") ? Operation.SampleMode.LARGEST : Operation.SampleMode.SMALLEST;
        return Idiom.Match.frame(new Operation.Sample(site.origin(), site.receiverVariable(), site.output(1), mode,
            n == null ? "5" : site.text(n), site.columns(call.argument(1, "columns"))), 1);
    }

    private static Idiom.Match randomSample(IdiomSite site) {
        Call call = site.call();
        PyExpr n = call.argument(0, "n");
        PyExpr fraction = call.keyword("frac");
        String size = n != null ? site.text(n) : fraction != null ? site.text(fraction) : "1";
        return Idiom.Match.frame(new Operation.Sample(site.origin(), site.receiverVariable(), site.output(1),
            Operation.SampleMode.RANDOM, size, null), 1);
    }

    // ---- reshaping ----

    private static Idiom.Match pivot(IdiomSite site, String input) {
        if (input == null) {
            return null;
        }
        Call call = site.call();
        int shift = site.atFunctionRoot() ? 1 : 0;
        PyExpr values = call.argument(shift, "values");
        PyExpr index = call.argument(shift + 1, "index");
        PyExpr columns = call.argument(shift + 2, "columns");
        if (site.method() != null && site.method().equals("pivot") || "pivot".equals(site.functionName())) {
            index = call.argument(shift, "index");
            columns = call.argument(shift + 1, "columns");
            values = call.argument(shift + 2, "values");
        }
        Set<String> touched = new LinkedHashSet<>();
        touched.addAll(site.columns(index));
        touched.addAll(site.columns(columns));
        touched.addAll(site.columns(values));
        var step = new SubStep(StepType.PIVOT, List.copyOf(touched), params(
            "index", textOrNull(site, index),
            "columns", textOrNull(site, columns),
            "values", textOrNull(site, values),
            "aggfunc", textOrNull(site, call.keyword("aggfunc"))), null);
        return Idiom.Match.frame(new Operation.Reshape(site.origin(), input, site.output(1),
            Operation.ReshapeMode.PIVOT, step), 1);
    }

    private static Idiom.Match melt(IdiomSite site, String input) {
        if (input == null) {
            return null;
        }
        Call call = site.call();
        int shift = site.atFunctionRoot() ? 1 : 0;
        List<String> idVars = site.columns(call.argument(shift, "id_vars"));
        List<String> valueVars = site.columns(call.argument(shift + 1, "value_vars"));
        String varName = site.string(call.keyword("var_name"));
        String valueName = site.string(call.keyword("value_name"));
        varName = varName == null ? "variable" : varName;
        valueName = valueName == null ? "value" : valueName;
        List<String> columns = new ArrayList<>(idVars);
        columns.addAll(valueVars);
        var effects = List.of(
            FieldEffect.computed(varName, valueVars),
            FieldEffect.computed(valueName, valueVars));
        var step = new SubStep(StepType.UNPIVOT, columns,
            params("id_vars", String.join(", ", idVars), "var_name", varName, "value_name", valueName), effects);
        return Idiom.Match.frame(new Operation.Reshape(site.origin(), input, site.output(1),
            Operation.ReshapeMode.UNPIVOT, step), 1);
    }

    private static Idiom.Match rolling(IdiomSite site) {
        String function = site.method(1);
        if (function.equals("agg") || function.equals("aggregate") || function.equals("apply")) {
            PyExpr argument = site.call(1).argument(0, "func");
            String named = site.string(argument);
            function = named != null ? named : argument == null ? function : site.text(argument);
        }
        String normalized = DataFrameMethods.aggregation(function);
        PyExpr window = site.call().argument(0, site.method().equals("ewm") ? "span" : "window");
        var step = new SubStep(StepType.WINDOW, List.of(), params(
            "frame", site.method(),
            "window", textOrNull(site, window),
            "function", normalized != null ? normalized : function), null);
        return Idiom.Match.frame(new Operation.Reshape(site.origin(), site.receiverVariable(), site.output(2),
            Operation.ReshapeMode.WINDOW, step), 2);
    }

    private static Idiom.Match windowFunction(IdiomSite site) {
        PyExpr periods = site.call().argument(0, "periods");
        var step = new SubStep(StepType.WINDOW, List.of(),
            params("function", site.method(), "periods", textOrNull(site, periods)), null);
        return Idiom.Match.frame(new Operation.Reshape(site.origin(), site.receiverVariable(), site.output(1),
            Operation.ReshapeMode.WINDOW, step), 1);
    }

    private static Idiom.Match pythonOnly(IdiomSite site) {
        Call call = site.call();
        List<String> sources = new ArrayList<>();
        sources.add(site.receiverVariable());
        String function = site.method();
        String code = site.text(call);
        if (function.equals("pipe") && call.argument(0, "func") instanceof Name name
                && site.functionSource(name.id()) != null) {
            function = name.id();
            code = site.functionSource(name.id());
        }
        return Idiom.Match.frame(new Operation.Custom(site.origin(), sources, List.of(site.output(1)), function, code), 1);
    }
}
