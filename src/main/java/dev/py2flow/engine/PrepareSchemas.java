package dev.py2flow.engine;

import dev.py2flow.model.EffectKind;
import dev.py2flow.model.FieldEffect;
import dev.py2flow.model.FieldSchema;
import dev.py2flow.model.StepType;
import dev.py2flow.model.SubStep;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output schema of a sequence of column steps.
 *
 * <p>An empty list means "unknown". A column selection fully determines the
 * schema even when the input is unknown; every other step needs a known
 * input.</p>
 */
final class PrepareSchemas {

    private PrepareSchemas() {}

    static List<FieldSchema> apply(List<FieldSchema> input, List<SubStep> steps) {
        List<FieldSchema> schema = input;
        for (SubStep step : steps) {
            schema = apply(schema, step);
        }
        return schema;
    }

    private static List<FieldSchema> apply(List<FieldSchema> schema, SubStep step) {
        if (step.type() == StepType.COLUMNS_SELECTOR) {
            var fields = index(schema);
            return step.columns().stream().map(c -> fields.getOrDefault(c, new FieldSchema(c, null))).toList();
        }
        if (schema.isEmpty() || step.type().isRowFilter()) {
            return schema;
        }
        var fields = index(schema);
        switch (step.type()) {
            case COLUMN_DELETER -> step.columns().forEach(fields::remove);
            case COLUMN_RENAMER -> {
                if ("positional".equals(step.param("mode"))) {
                    if (step.columns().size() != schema.size()) {
                        return List.of();
                    }
                    var renamed = new ArrayList<FieldSchema>();
                    for (int i = 0; i < schema.size(); i++) {
                        renamed.add(new FieldSchema(step.columns().get(i), schema.get(i).type()));
                    }
                    return renamed;
                }
                return rename(schema, step.effects());
            }
            case TYPE_SETTER -> {
                String type = step.param("type");
                List<String> targets = step.columns().isEmpty() ? List.copyOf(fields.keySet()) : step.columns();
                targets.forEach(c -> fields.put(c, new FieldSchema(c, type)));
            }
            default -> {
                for (FieldEffect effect : step.effects()) {
                    if (effect.kind() != EffectKind.IDENTITY) {
                        fields.putIfAbsent(effect.field(), new FieldSchema(effect.field(), null));
                    }
                }
            }
        }
        return List.copyOf(fields.values());
    }

    private static List<FieldSchema> rename(List<FieldSchema> schema, List<FieldEffect> effects) {
        var renames = new LinkedHashMap<String, String>();
        for (FieldEffect effect : effects) {
            if (effect.kind() == EffectKind.RENAME) {
                renames.put(effect.sources().get(0), effect.field());
            }
        }
        return schema.stream()
            .map(f -> renames.containsKey(f.name()) ? new FieldSchema(renames.get(f.name()), f.type()) : f)
            .toList();
    }

    private static Map<String, FieldSchema> index(List<FieldSchema> schema) {
        var fields = new LinkedHashMap<String, FieldSchema>();
        schema.forEach(f -> fields.put(f.name(), f));
        return fields;
    }
}
