package dev.py2flow.model;

import java.util.Objects;

/**
 * One column of a dataset schema with its inferred storage type.
 */
public record FieldSchema(String name, String type) {

    public static final String DEFAULT_TYPE = "string";

    public FieldSchema {
        Objects.requireNonNull(name, "name");
        type = type == null || type.isBlank() ? DEFAULT_TYPE : type;
    }
}
