package dev.py2flow.model;

import java.util.Locale;

/**
 * How a step produces one output field from its input fields.
 */
public enum EffectKind {
    IDENTITY,
    RENAME,
    COMPUTED,
    AGGREGATED,
    OPAQUE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EffectKind fromValue(String value) {
        for (EffectKind kind : values()) {
            if (kind.value().equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown field effect: " + value);
    }
}
