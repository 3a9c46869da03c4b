package dev.py2flow.analyzer;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Name tables for pandas methods that the idiom table does not turn into
 * operations directly.
 */
final class DataFrameMethods {

    /** Methods returning the same data; the target simply aliases the receiver. */
    static final Set<String> PASSTHROUGH = Set.of(
        "copy", "reset_index", "set_index", "to_frame", "infer_objects", "reindex",
        "convert_dtypes", "squeeze", "to_numpy");

    /** Calls used for inspection only; as expression statements they produce nothing. */
    static final Set<String> INSPECTION = Set.of(
        "head", "tail", "info", "describe", "sample", "nunique", "value_counts", "isnull", "isna",
        "notnull", "notna", "memory_usage", "count", "sum", "mean", "corr", "plot", "hist", "to_string");

    /** Builtins that only look at their arguments. */
    static final Set<String> INSPECTION_FUNCTIONS = Set.of(
        "print", "display", "len", "type", "isinstance", "repr", "str", "list", "id", "dir", "help");

    /** Methods with no visual-recipe equivalent; they become custom-code recipes. */
    static final Set<String> PYTHON_ONLY = Set.of(
        "apply", "applymap", "map", "pipe", "transform", "eval", "explode", "stack", "unstack",
        "iterrows", "itertuples", "interpolate", "resample", "swaplevel", "transpose", "describe", "corr", "cov");

    /** Attributes that are never column names. */
    private static final Set<String> KNOWN_ATTRIBUTES = Set.of(
        "loc", "iloc", "at", "iat", "str", "dt", "cat", "shape", "columns", "index", "values", "dtypes",
        "T", "empty", "size", "ndim", "axes", "plot");

    /** Window-style methods computed along rows. */
    static final Set<String> WINDOW_METHODS = Set.of(
        "cumsum", "cumprod", "cummax", "cummin", "diff", "shift", "rank", "pct_change");

    /** Reductions that turn a column or frame into a scalar. */
    static final Set<String> SCALAR_METHODS = Set.of(
        "mean", "sum", "max", "min", "std", "var", "median", "count", "nunique", "quantile", "idxmax", "idxmin",
        "any", "all", "item", "tolist", "to_list", "to_dict", "unique", "mode", "prod", "memory_usage");

    /** Attributes holding metadata rather than data. */
    static final Set<String> METADATA_ATTRIBUTES = Set.of(
        "shape", "columns", "dtypes", "index", "size", "empty", "ndim", "axes");

    /** Methods after {@code groupby(...)} that keep one row per input row. */
    static final Set<String> GROUP_WINDOW_METHODS = Set.of(
        "transform", "cumsum", "cumprod", "cummax", "cummin", "cumcount", "rank", "shift", "diff", "pct_change");

    private static final Map<String, String> AGGREGATIONS = Map.ofEntries(
        Map.entry("sum", "SUM"),
        Map.entry("mean", "AVG"),
        Map.entry("avg", "AVG"),
        Map.entry("average", "AVG"),
        Map.entry("count", "COUNT"),
        Map.entry("size", "COUNT"),
        Map.entry("nunique", "COUNT_DISTINCT"),
        Map.entry("min", "MIN"),
        Map.entry("max", "MAX"),
        Map.entry("first", "FIRST"),
        Map.entry("last", "LAST"),
        Map.entry("std", "STDDEV"),
        Map.entry("var", "VAR"),
        Map.entry("median", "MEDIAN"),
        Map.entry("prod", "PRODUCT"),
        Map.entry("any", "ANY"),
        Map.entry("all", "ALL"));

    private static final Map<String, String> STORAGE_TYPES = Map.ofEntries(
        Map.entry("int", "bigint"),
        Map.entry("int64", "bigint"),
        Map.entry("int32", "int"),
        Map.entry("Int64", "bigint"),
        Map.entry("float", "double"),
        Map.entry("float64", "double"),
        Map.entry("float32", "float"),
        Map.entry("str", "string"),
        Map.entry("string", "string"),
        Map.entry("object", "string"),
        Map.entry("bool", "boolean"),
        Map.entry("boolean", "boolean"),
        Map.entry("category", "string"),
        Map.entry("datetime64", "date"),
        Map.entry("datetime64[ns]", "date"));

    private static final Map<String, String> READ_FORMATS = Map.ofEntries(
        Map.entry("read_csv", "csv"),
        Map.entry("read_table", "csv"),
        Map.entry("read_excel", "excel"),
        Map.entry("read_parquet", "parquet"),
        Map.entry("read_json", "json"),
        Map.entry("read_feather", "feather"),
        Map.entry("read_pickle", "pickle"),
        Map.entry("read_sql", "sql"),
        Map.entry("read_sql_query", "sql"),
        Map.entry("read_sql_table", "sql"));

    private static final Map<String, String> WRITE_FORMATS = Map.ofEntries(
        Map.entry("to_csv", "csv"),
        Map.entry("to_excel", "excel"),
        Map.entry("to_parquet", "parquet"),
        Map.entry("to_json", "json"),
        Map.entry("to_feather", "feather"),
        Map.entry("to_pickle", "pickle"),
        Map.entry("to_sql", "sql"));

    private DataFrameMethods() {}

    static boolean isKnownAttribute(String name) {
        return KNOWN_ATTRIBUTES.contains(name);
    }

    /** Normalized aggregation name, or null when unknown. */
    static String aggregation(String pandasName) {
        return pandasName == null ? null : AGGREGATIONS.get(pandasName.toLowerCase(Locale.ROOT));
    }

    static boolean isAggregation(String name) {
        return aggregation(name) != null;
    }

    /** Storage type for an astype() argument; unknown types are kept as written. */
    static String storageType(String pandasType) {
        return STORAGE_TYPES.getOrDefault(pandasType, pandasType);
    }

    static String readFormat(String function) {
        return READ_FORMATS.get(function);
    }

    static String writeFormat(String method) {
        return WRITE_FORMATS.get(method);
    }
}
