package dev.py2flow.model;

import java.util.Objects;

/**
 * A field of a named dataset.
 */
public record FieldRef(String dataset, String field) {

    public FieldRef {
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(field, "field");
    }

    @Override
    public String toString() {
        return dataset + "." + field;
    }
}
