package dev.py2flow.analyzer;

import java.util.Objects;

/**
 * One aggregated output column of a group operation.
 *
 * @param column   input column
 * @param function normalized function name (SUM, AVG, COUNT_DISTINCT...)
 * @param output   output column name
 */
public record Aggregation(String column, String function, String output) {

    public Aggregation {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(function, "function");
        output = output == null ? column : output;
    }
}
