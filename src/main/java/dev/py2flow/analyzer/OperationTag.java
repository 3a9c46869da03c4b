package dev.py2flow.analyzer;

/**
 * Tag of an {@link Operation} record.
 */
public enum OperationTag {
    READ("read"),
    WRITE("write"),
    FILTER("filter"),
    DERIVE_COLUMN("derive-column"),
    JOIN("join"),
    STACK("stack"),
    AGGREGATE("aggregate"),
    SORT("sort"),
    DEDUPE("dedupe"),
    SAMPLE("sample"),
    RESHAPE("reshape"),
    SPLIT("split"),
    MODEL_FIT("model-fit"),
    MODEL_APPLY("model-apply"),
    CUSTOM("custom"),
    BIND("bind");

    private final String value;

    OperationTag(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static OperationTag fromValue(String value) {
        for (OperationTag tag : values()) {
            if (tag.value.equals(value)) {
                return tag;
            }
        }
        throw new IllegalArgumentException("Unknown operation tag: " + value);
    }
}
