package dev.py2flow.model;

import java.util.List;
import java.util.Objects;

/**
 * Per-field lineage metadata of a sub-step: {@code field} in the step output
 * comes from {@code sources} in the step input.
 */
public record FieldEffect(String field, EffectKind kind, List<String> sources) {

    public FieldEffect {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(kind, "kind");
        sources = sources == null ? List.of() : List.copyOf(sources);
        if (kind == EffectKind.RENAME && sources.size() != 1) {
            throw new IllegalArgumentException("A rename of '%s' needs exactly one source".formatted(field));
        }
    }

    public static FieldEffect identity(String field) {
        return new FieldEffect(field, EffectKind.IDENTITY, List.of(field));
    }

    public static FieldEffect rename(String from, String to) {
        return new FieldEffect(to, EffectKind.RENAME, List.of(from));
    }

    public static FieldEffect computed(String field, List<String> sources) {
        return new FieldEffect(field, EffectKind.COMPUTED, sources);
    }

    public static FieldEffect aggregated(String field, List<String> sources) {
        return new FieldEffect(field, EffectKind.AGGREGATED, sources);
    }

    public static FieldEffect opaque(String field) {
        return new FieldEffect(field, EffectKind.OPAQUE, List.of());
    }
}
