package dev.py2flow.model;

/**
 * Recipe kinds, named after the Dataiku visual recipes they become.
 */
public enum RecipeKind {
    SYNC("sync", "sync", "sync", "SY"),
    PREPARE("prepare", "prepare", "shaker", "PR"),
    JOIN("join", "join", "join", "JN"),
    STACK("stack", "stack", "vstack", "ST"),
    GROUP("group", "group", "grouping", "GR"),
    SPLIT("split", "split", "split", "SP"),
    SORT("sort", "sort", "sort", "SO"),
    DISTINCT("distinct", "distinct", "distinct", "DI"),
    TOP_N("top-n", "topn", "topn", "TN"),
    SAMPLE("sample", "sample", "sampling", "SA"),
    PIVOT("pivot", "pivot", "pivot", "PV"),
    WINDOW("window", "window", "window", "WI"),
    CUSTOM_CODE("custom-code", "python", "python", "PY"),
    TRAIN("train", "train", "prediction_training", "TR"),
    SCORE("score", "score", "prediction_scoring", "SC"),
    EVALUATE("evaluate", "evaluate", "evaluation", "EV");

    private final String value;
    private final String namePrefix;
    private final String dssType;
    private final String icon;

    RecipeKind(String value, String namePrefix, String dssType, String icon) {
        this.value = value;
        this.namePrefix = namePrefix;
        this.dssType = dssType;
        this.icon = icon;
    }

    /** Serialized name, e.g. {@code top-n}. */
    public String value() {
        return value;
    }

    /** Prefix used when deriving recipe names from their first output. */
    public String namePrefix() {
        return namePrefix;
    }

    public String dssType() {
        return dssType;
    }

    /** Two-letter badge used by the diagram renderers. */
    public String icon() {
        return icon;
    }

    /** Pure ingestion recipes may have no input dataset. */
    public boolean allowsNoInputs() {
        return this == SYNC;
    }

    public static RecipeKind fromValue(String value) {
        for (RecipeKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown recipe kind: " + value);
    }
}
