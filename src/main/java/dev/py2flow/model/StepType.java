package dev.py2flow.model;

/**
 * Sub-step types. Prepare processors keep their Dataiku names; the remaining
 * entries describe the single step carried by non-prepare recipes.
 */
public enum StepType {
    // prepare processors
    COLUMN_RENAMER("ColumnRenamer"),
    COLUMN_DELETER("ColumnsDeleter"),
    COLUMNS_SELECTOR("ColumnsSelector"),
    COLUMN_COPIER("ColumnCopier"),
    FILL_EMPTY("FillEmptyWithValue"),
    REMOVE_ROWS_ON_EMPTY("RemoveRowsOnEmpty"),
    FILTER_ON_FORMULA("FilterOnFormula"),
    FILTER_ON_VALUE("FilterOnValue"),
    STRING_TRANSFORMER("StringTransformer"),
    NUMERICAL_TRANSFORMER("NumericalTransformer"),
    ROUND_COLUMN("RoundColumn"),
    ABS_COLUMN("AbsColumn"),
    CLIP_COLUMN("ClipColumn"),
    TYPE_SETTER("TypeSetter"),
    DATE_PARSER("DateParser"),
    FORMULA("CreateColumnWithGREL"),
    FIND_REPLACE("FindReplace"),
    NORMALIZER("Normalizer"),
    CATEGORICAL_ENCODER("CategoricalEncoder"),
    PYTHON_UDF("PythonUDF"),

    // recipe-level steps
    SYNC("Sync"),
    JOIN("Join"),
    STACK("Stack"),
    GROUP_KEYS("GroupingKeys"),
    AGGREGATE("Aggregation"),
    SORT("Sort"),
    DISTINCT("Distinct"),
    TOP_N("TopN"),
    SAMPLE("Sampling"),
    PIVOT("Pivot"),
    UNPIVOT("Unpivot"),
    WINDOW("Window"),
    SPLIT("Split"),
    TRAIN("Train"),
    SCORE("Score"),
    EVALUATE("Evaluate"),
    PYTHON_CODE("PythonCode");

    private final String dssName;

    StepType(String dssName) {
        this.dssName = dssName;
    }

    public String dssName() {
        return dssName;
    }

    /** True for steps that drop rows without touching columns. */
    public boolean isRowFilter() {
        return this == REMOVE_ROWS_ON_EMPTY || this == FILTER_ON_FORMULA || this == FILTER_ON_VALUE;
    }

    public static StepType fromDssName(String name) {
        for (StepType type : values()) {
            if (type.dssName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown step type: " + name);
    }
}
