package dev.py2flow.model;

import java.util.Locale;

/**
 * Position of a dataset in the flow.
 */
public enum DatasetRole {
    INPUT,
    INTERMEDIATE,
    OUTPUT;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DatasetRole fromValue(String value) {
        for (DatasetRole role : values()) {
            if (role.value().equals(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown dataset role: " + value);
    }
}
