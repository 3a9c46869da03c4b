package dev.py2flow.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One ordered step inside a recipe, e.g. a single column operation of a
 * prepare recipe, or the join definition of a join recipe.
 *
 * @param type    step type
 * @param columns columns the step reads or targets
 * @param params  string parameters in insertion order
 * @param effects lineage metadata for every output field the step creates or changes
 */
public record SubStep(StepType type, List<String> columns, Map<String, String> params, List<FieldEffect> effects) {

    public SubStep {
        Objects.requireNonNull(type, "type");
        columns = columns == null ? List.of() : List.copyOf(columns);
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        effects = effects == null ? List.of() : List.copyOf(effects);
    }

    public static SubStep of(StepType type, List<String> columns) {
        return new SubStep(type, columns, Map.of(), List.of());
    }

    public String param(String key) {
        return params.get(key);
    }

    /** The effect that produces {@code field}, or null when the field passes through unchanged. */
    public FieldEffect effectFor(String field) {
        for (FieldEffect effect : effects) {
            if (effect.field().equals(field)) {
                return effect;
            }
        }
        return null;
    }

    /** True when the step reads, writes or derives from {@code field}. */
    public boolean mentions(String field) {
        return columns.contains(field)
            || effects.stream().anyMatch(e -> e.field().equals(field) || e.sources().contains(field));
    }

    /**
     * Human-readable one-liner used in lineage chains and diagrams.
     */
    public String description() {
        String cols = String.join(", ", columns);
        return switch (type) {
            case COLUMN_RENAMER -> "rename " + String.join(", ", effects.stream()
                .map(e -> e.sources().isEmpty() ? e.field() : e.sources().get(0) + " -> " + e.field())
                .toList());
            case COLUMN_DELETER -> "drop columns " + cols;
            case COLUMNS_SELECTOR -> "keep columns " + cols;
            case COLUMN_COPIER -> "copy " + cols;
            case FILL_EMPTY -> "fill empty " + (cols.isEmpty() ? "values" : cols)
                + " with " + params.getOrDefault("value", "?");
            case REMOVE_ROWS_ON_EMPTY -> "remove rows with empty " + (cols.isEmpty() ? "values" : cols);
            case FILTER_ON_FORMULA, FILTER_ON_VALUE -> "keep rows where " + params.getOrDefault("expression", cols);
            case STRING_TRANSFORMER -> params.getOrDefault("mode", "transform").toLowerCase() + " " + cols;
            case NUMERICAL_TRANSFORMER -> params.getOrDefault("function", "transform") + "(" + cols + ")";
            case ROUND_COLUMN -> "round " + cols;
            case ABS_COLUMN -> "abs " + cols;
            case CLIP_COLUMN -> "clip " + cols;
            case TYPE_SETTER -> "cast " + cols + " to " + params.getOrDefault("type", "?");
            case DATE_PARSER -> "parse date " + cols;
            case FORMULA -> outputs() + " = " + params.getOrDefault("expression", cols);
            case FIND_REPLACE -> "replace values in " + (cols.isEmpty() ? "all columns" : cols);
            case NORMALIZER -> params.getOrDefault("method", "normalize") + " " + cols;
            case CATEGORICAL_ENCODER -> "encode " + cols;
            case PYTHON_UDF -> outputs() + " = python(" + params.getOrDefault("expression", cols) + ")";
            case SYNC -> "copy from " + params.getOrDefault("path", "source");
            case JOIN -> params.getOrDefault("type", "INNER").toLowerCase() + " join on " + cols;
            case STACK -> "stack inputs";
            case GROUP_KEYS -> "group by " + cols;
            case AGGREGATE -> params.getOrDefault("function", "?") + "(" + cols + ") as " + outputs();
            case SORT -> "sort by " + cols;
            case DISTINCT -> "distinct" + (cols.isEmpty() ? "" : " on " + cols);
            case TOP_N -> "top " + params.getOrDefault("n", "?") + (cols.isEmpty() ? "" : " by " + cols);
            case SAMPLE -> "sample " + params.getOrDefault("size", "");
            case PIVOT -> "pivot " + cols;
            case UNPIVOT -> "unpivot " + cols;
            case WINDOW -> params.getOrDefault("function", "window") + "(" + cols + ")"
                + (effects.isEmpty() ? "" : " as " + outputs());
            case SPLIT -> "split rows" + (params.containsKey("test_size") ? " test_size=" + params.get("test_size") : "");
            case TRAIN -> "train " + params.getOrDefault("algorithm", "model");
            case SCORE -> params.getOrDefault("method", "predict") + " with model";
            case EVALUATE -> "evaluate " + params.getOrDefault("metric", "model");
            case PYTHON_CODE -> "python " + params.getOrDefault("function", "code");
        };
    }

    private String outputs() {
        return effects.isEmpty() ? String.join(", ", columns)
            : String.join(", ", effects.stream().map(FieldEffect::field).toList());
    }
}
