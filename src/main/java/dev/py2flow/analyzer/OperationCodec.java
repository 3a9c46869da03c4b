package dev.py2flow.analyzer;

import com.fasterxml.jackson.databind.JsonNode;
import dev.py2flow.model.JoinType;
import dev.py2flow.model.SubStep;
import dev.py2flow.serialization.FlowDocuments;
import dev.py2flow.serialization.SerializationFormatException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads operation records from the JSON objects a model returns.
 *
 * <p>Every object carries {@code op} (an {@link OperationTag} value),
 * {@code line} and {@code text}, plus the fields of its record in snake
 * case. Steps use the flow document step shape.</p>
 */
final class OperationCodec {

    private OperationCodec() {}

    /**
     * @param statement position used for the operation origin
     * @throws IllegalArgumentException naming the offending field when the object is malformed
     */
    static Operation decode(JsonNode node, String path, int statement) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException(path + ": expected an object");
        }
        var fields = new Fields(node, path);
        OperationTag tag;
        try {
            tag = OperationTag.fromValue(fields.text("op"));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(path + ".op: " + e.getMessage(), e);
        }
        var origin = new Origin(statement, fields.integer("line"), fields.optional("text", ""));
        return switch (tag) {
            case READ -> new Operation.Read(origin, fields.text("output"), fields.optional("path", null),
                fields.optional("format", null), fields.texts("columns"));
            case WRITE -> new Operation.Write(origin, fields.text("input"), fields.optional("path", null),
                fields.optional("format", null));
            case FILTER -> new Operation.Filter(origin, fields.text("input"), fields.text("output"), fields.step());
            case DERIVE_COLUMN -> new Operation.DeriveColumn(origin, fields.text("input"), fields.text("output"),
                fields.step());
            case JOIN -> join(origin, fields);
            case STACK -> new Operation.Stack(origin, fields.texts("sources"), fields.text("output"));
            case AGGREGATE -> new Operation.Aggregate(origin, fields.text("input"), fields.text("output"),
                fields.texts("keys"), aggregations(node, path));
            case SORT -> sort(origin, fields, node, path);
            case DEDUPE -> new Operation.Dedupe(origin, fields.text("input"), fields.text("output"),
                fields.texts("subset"), fields.optional("keep", "first"));
            case SAMPLE -> new Operation.Sample(origin, fields.text("input"), fields.text("output"),
                fields.mode("mode", Operation.SampleMode.class), fields.optional("size", null),
                fields.texts("ranking_columns"));
            case RESHAPE -> new Operation.Reshape(origin, fields.text("input"), fields.text("output"),
                fields.mode("mode", Operation.ReshapeMode.class), fields.step());
            case SPLIT -> new Operation.Split(origin, fields.texts("sources"), fields.texts("outputs"),
                fields.optional("test_size", null));
            case MODEL_FIT -> new Operation.ModelFit(origin, fields.texts("sources"), fields.text("model"),
                fields.optional("algorithm", null));
            case MODEL_APPLY -> new Operation.ModelApply(origin, fields.mode("mode", Operation.ApplyMode.class),
                fields.optional("model", null), fields.texts("sources"), fields.text("output"),
                fields.optional("method", null));
            case CUSTOM -> new Operation.Custom(origin, fields.texts("sources"), fields.texts("outputs"),
                fields.optional("function", null), fields.optional("code", origin.text()));
            case BIND -> new Operation.Bind(origin, fields.text("source"), fields.text("target"));
        };
    }

    private static Operation join(Origin origin, Fields fields) {
        List<String> on = fields.texts("on");
        List<String> leftKeys = fields.texts("left_on");
        List<String> rightKeys = fields.texts("right_on");
        return new Operation.Join(origin, fields.text("left"), fields.text("right"), fields.text("output"),
            JoinType.fromPandas(fields.optional("how", "inner")),
            leftKeys.isEmpty() ? on : leftKeys, rightKeys.isEmpty() ? on : rightKeys);
    }

    private static Operation sort(Origin origin, Fields fields, JsonNode node, String path) {
        List<String> columns = fields.texts("columns");
        var ascending = new ArrayList<Boolean>();
        JsonNode flags = node.get("ascending");
        if (flags != null && flags.isArray()) {
            flags.forEach(f -> ascending.add(f.asBoolean(true)));
        } else if (flags != null && flags.isBoolean()) {
            columns.forEach(c -> ascending.add(flags.asBoolean()));
        } else if (flags != null && !flags.isNull()) {
            throw new IllegalArgumentException(path + ".ascending: expected a boolean or a list");
        }
        while (ascending.size() < columns.size()) {
            ascending.add(Boolean.TRUE);
        }
        return new Operation.Sort(origin, fields.text("input"), fields.text("output"), columns,
            ascending.subList(0, columns.size()));
    }

    private static List<Aggregation> aggregations(JsonNode node, String path) {
        JsonNode list = node.get("aggregations");
        if (list == null || list.isNull()) {
            return List.of();
        }
        if (!list.isArray()) {
            throw new IllegalArgumentException(path + ".aggregations: expected a list");
        }
        var aggregations = new ArrayList<Aggregation>();
        for (int i = 0; i < list.size(); i++) {
            var fields = new Fields(list.get(i), "%s.aggregations[%d]".formatted(path, i));
            aggregations.add(new Aggregation(fields.text("column"),
                fields.text("function").toUpperCase(Locale.ROOT), fields.optional("output", null)));
        }
        return aggregations;
    }

    /** Field access with the path of the object for error messages. */
    private static final class Fields {

        private final JsonNode node;
        private final String path;

        Fields(JsonNode node, String path) {
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException(path + ": expected an object");
            }
            this.node = node;
            this.path = path;
        }

        String text(String key) {
            JsonNode value = node.get(key);
            if (value == null || !value.isTextual() || value.asText().isBlank()) {
                throw new IllegalArgumentException("%s.%s: expected a non-empty string".formatted(path, key));
            }
            return value.asText();
        }

        String optional(String key, String fallback) {
            JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                return fallback;
            }
            if (!value.isValueNode()) {
                throw new IllegalArgumentException("%s.%s: expected a scalar".formatted(path, key));
            }
            return value.asText();
        }

        int integer(String key) {
            JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                return 0;
            }
            if (!value.canConvertToInt()) {
                throw new IllegalArgumentException("%s.%s: expected an integer".formatted(path, key));
            }
            return value.asInt();
        }

        List<String> texts(String key) {
            JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                return List.of();
            }
            if (value.isTextual()) {
                return List.of(value.asText());
            }
            if (!value.isArray()) {
                throw new IllegalArgumentException("%s.%s: expected a list of strings".formatted(path, key));
            }
            var values = new ArrayList<String>();
            for (JsonNode item : value) {
                if (!item.isTextual()) {
                    throw new IllegalArgumentException("%s.%s: expected a list of strings".formatted(path, key));
                }
                values.add(item.asText());
            }
            return values;
        }

        <E extends Enum<E>> E mode(String key, Class<E> type) {
            String value = text(key);
            try {
                return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("%s.%s: unknown mode '%s'".formatted(path, key, value), e);
            }
        }

        SubStep step() {
            try {
                return FlowDocuments.readStep(node.get("step"), path + ".step");
            } catch (SerializationFormatException e) {
                throw new IllegalArgumentException(e.getMessage(), e);
            }
        }
    }
}
