package dev.py2flow.model;

import java.util.Objects;

/**
 * A suggestion attached to a flow, e.g. to replace a Python fallback recipe.
 *
 * @param type     category such as PYTHON_FALLBACK or PERFORMANCE
 * @param priority HIGH, MEDIUM or LOW
 * @param message  human-readable advice
 * @param recipe   recipe the advice is about, or null
 */
public record Recommendation(String type, String priority, String message, String recipe) {

    public Recommendation {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(message, "message");
        priority = priority == null ? "MEDIUM" : priority;
    }
}
