package dev.py2flow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import dev.py2flow.model.Dataset;
import dev.py2flow.model.DatasetRole;
import dev.py2flow.model.EffectKind;
import dev.py2flow.model.FieldEffect;
import dev.py2flow.model.FieldSchema;
import dev.py2flow.model.Flow;
import dev.py2flow.model.Recipe;
import dev.py2flow.model.RecipeKind;
import dev.py2flow.model.Recommendation;
import dev.py2flow.model.StepType;
import dev.py2flow.model.SubStep;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * JSON and YAML documents for flows.
 *
 * <p>Both formats share one tree layout; keys are written in a fixed order
 * and absent optional values are left out, so documents are stable and
 * {@code fromJson(toJson(flow))} equals {@code flow}.</p>
 */
public final class FlowDocuments {

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final YAMLMapper YAML = new YAMLMapper();
    /** Dataset and recipe names become file names on export. */
    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_]+");

    private FlowDocuments() {}

    public static String toJson(Flow flow) {
        return write(JSON, flow);
    }

    public static String toYaml(Flow flow) {
        return write(YAML, flow);
    }

    /**
     * @throws SerializationFormatException when the text is not a valid flow document
     */
    public static Flow fromJson(String json) {
        return read(JSON, json);
    }

    /**
     * @throws SerializationFormatException when the text is not a valid flow document
     */
    public static Flow fromYaml(String yaml) {
        return read(YAML, yaml);
    }

    private static String write(ObjectMapper mapper, Flow flow) {
        try {
            return mapper.writeValueAsString(toTree(mapper, flow));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Flow read(ObjectMapper mapper, String text) {
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new SerializationFormatException("$", "unparsable document: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new SerializationFormatException("$", "expected an object");
        }
        return parseFlow(root);
    }

    // ---- writing ----

    /** The document tree of a flow. */
    public static ObjectNode toTree(ObjectMapper mapper, Flow flow) {
        ObjectNode root = mapper.createObjectNode();
        root.put("flow_name", flow.name());
        root.put("total_datasets", flow.datasets().size());
        root.put("total_recipes", flow.recipes().size());
        ArrayNode datasets = root.putArray("datasets");
        for (Dataset dataset : flow.datasets()) {
            datasets.add(datasetTree(mapper, dataset));
        }
        ArrayNode recipes = root.putArray("recipes");
        for (Recipe recipe : flow.recipes()) {
            recipes.add(recipeTree(mapper, recipe));
        }
        strings(root.putArray("warnings"), flow.warnings());
        ArrayNode recommendations = root.putArray("recommendations");
        for (Recommendation recommendation : flow.recommendations()) {
            ObjectNode node = recommendations.addObject();
            node.put("type", recommendation.type());
            node.put("priority", recommendation.priority());
            node.put("message", recommendation.message());
            putIfPresent(node, "recipe", recommendation.recipe());
        }
        strings(root.putArray("optimization_notes"), flow.optimizationNotes());
        return root;
    }

    private static ObjectNode datasetTree(ObjectMapper mapper, Dataset dataset) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", dataset.name());
        node.put("role", dataset.role().value());
        if (dataset.hasSchema()) {
            ArrayNode schema = node.putArray("schema");
            for (FieldSchema field : dataset.schema()) {
                schema.addObject().put("name", field.name()).put("type", field.type());
            }
        }
        putIfPresent(node, "format_hint", dataset.formatHint());
        putIfPresent(node, "location", dataset.location());
        putIfPresent(node, "source_variable", dataset.sourceVariable());
        if (dataset.sourceLine() != null) {
            node.put("source_line", dataset.sourceLine());
        }
        return node;
    }

    private static ObjectNode recipeTree(ObjectMapper mapper, Recipe recipe) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", recipe.name());
        node.put("kind", recipe.kind().value());
        strings(node.putArray("inputs"), recipe.inputs());
        strings(node.putArray("outputs"), recipe.outputs());
        ArrayNode steps = node.putArray("steps");
        for (SubStep step : recipe.steps()) {
            ObjectNode stepNode = steps.addObject();
            stepNode.put("processor", step.type().dssName());
            if (!step.columns().isEmpty()) {
                strings(stepNode.putArray("columns"), step.columns());
            }
            if (!step.params().isEmpty()) {
                ObjectNode params = stepNode.putObject("params");
                step.params().forEach(params::put);
            }
            if (!step.effects().isEmpty()) {
                ArrayNode effects = stepNode.putArray("effects");
                for (FieldEffect effect : step.effects()) {
                    ObjectNode effectNode = effects.addObject();
                    effectNode.put("field", effect.field());
                    effectNode.put("kind", effect.kind().value());
                    if (!effect.sources().isEmpty()) {
                        strings(effectNode.putArray("sources"), effect.sources());
                    }
                }
            }
        }
        putIfPresent(node, "code", recipe.code());
        if (!recipe.sourceLines().isEmpty()) {
            ArrayNode lines = node.putArray("source_lines");
            recipe.sourceLines().forEach(lines::add);
        }
        return node;
    }

    private static void strings(ArrayNode array, List<String> values) {
        values.forEach(array::add);
    }

    private static void putIfPresent(ObjectNode node, String key, String value) {
        if (value != null) {
            node.put(key, value);
        }
    }

    // ---- reading ----

    private static Flow parseFlow(JsonNode root) {
        var flow = new Flow(text(root, "$", "flow_name"));
        List<JsonNode> datasets = array(root, "$", "datasets", true);
        List<JsonNode> recipes = array(root, "$", "recipes", true);
        checkTotal(root, "total_datasets", datasets.size());
        checkTotal(root, "total_recipes", recipes.size());
        for (int i = 0; i < datasets.size(); i++) {
            String path = "$.datasets[%d]".formatted(i);
            Dataset dataset = parseDataset(datasets.get(i), path);
            try {
                flow.addDataset(dataset);
            } catch (IllegalArgumentException e) {
                throw new SerializationFormatException(path + ".name", e.getMessage(), e);
            }
        }
        for (int i = 0; i < recipes.size(); i++) {
            String path = "$.recipes[%d]".formatted(i);
            Recipe recipe = parseRecipe(recipes.get(i), path);
            try {
                flow.addRecipe(recipe);
            } catch (IllegalArgumentException e) {
                throw new SerializationFormatException(path, e.getMessage(), e);
            }
        }
        textList(root, "$", "warnings").forEach(flow::addWarning);
        List<JsonNode> recommendations = array(root, "$", "recommendations", false);
        for (int i = 0; i < recommendations.size(); i++) {
            String path = "$.recommendations[%d]".formatted(i);
            JsonNode node = object(recommendations.get(i), path);
            flow.addRecommendation(new Recommendation(text(node, path, "type"), optionalText(node, path, "priority"),
                text(node, path, "message"), optionalText(node, path, "recipe")));
        }
        textList(root, "$", "optimization_notes").forEach(flow::addOptimizationNote);
        return flow;
    }

    private static void checkTotal(JsonNode root, String key, int actual) {
        JsonNode total = root.get(key);
        if (total == null) {
            return;
        }
        if (!total.isIntegralNumber()) {
            throw new SerializationFormatException("$." + key, "expected an integer");
        }
        if (total.asInt() != actual) {
            throw new SerializationFormatException("$." + key,
                "declares %d but the document has %d".formatted(total.asInt(), actual));
        }
    }

    private static Dataset parseDataset(JsonNode raw, String path) {
        JsonNode node = object(raw, path);
        String name = name(node, path);
        DatasetRole role = parseEnum(node, path, "role", DatasetRole::fromValue);
        var schema = new ArrayList<FieldSchema>();
        List<JsonNode> fields = array(node, path, "schema", false);
        for (int i = 0; i < fields.size(); i++) {
            String fieldPath = "%s.schema[%d]".formatted(path, i);
            JsonNode field = object(fields.get(i), fieldPath);
            schema.add(new FieldSchema(text(field, fieldPath, "name"), optionalText(field, fieldPath, "type")));
        }
        Integer line = null;
        JsonNode lineNode = node.get("source_line");
        if (lineNode != null && !lineNode.isNull()) {
            if (!lineNode.isIntegralNumber()) {
                throw new SerializationFormatException(path + ".source_line", "expected an integer");
            }
            line = lineNode.asInt();
        }
        try {
            return new Dataset(name, role, schema, optionalText(node, path, "format_hint"),
                optionalText(node, path, "location"), optionalText(node, path, "source_variable"), line);
        } catch (IllegalArgumentException e) {
            throw new SerializationFormatException(path + ".name", e.getMessage(), e);
        }
    }

    private static Recipe parseRecipe(JsonNode raw, String path) {
        JsonNode node = object(raw, path);
        String name = name(node, path);
        RecipeKind kind = parseEnum(node, path, "kind", RecipeKind::fromValue);
        var steps = new ArrayList<SubStep>();
        List<JsonNode> stepNodes = array(node, path, "steps", false);
        for (int i = 0; i < stepNodes.size(); i++) {
            steps.add(readStep(stepNodes.get(i), "%s.steps[%d]".formatted(path, i)));
        }
        var lines = new ArrayList<Integer>();
        List<JsonNode> lineNodes = array(node, path, "source_lines", false);
        for (int i = 0; i < lineNodes.size(); i++) {
            if (!lineNodes.get(i).isIntegralNumber()) {
                throw new SerializationFormatException("%s.source_lines[%d]".formatted(path, i), "expected an integer");
            }
            lines.add(lineNodes.get(i).asInt());
        }
        try {
            return new Recipe(name, kind, textList(node, path, "inputs"), textList(node, path, "outputs"), steps,
                optionalText(node, path, "code"), lines);
        } catch (IllegalArgumentException e) {
            throw new SerializationFormatException(path + ".name", e.getMessage(), e);
        }
    }

    private static String name(JsonNode node, String path) {
        String name = text(node, path, "name");
        if (!NAME.matcher(name).matches()) {
            throw new SerializationFormatException(path + ".name",
                "'%s' may only contain letters, digits and underscores".formatted(name));
        }
        return name;
    }

    /**
     * Read one step object ({@code processor}, {@code columns}, {@code params},
     * {@code effects}) found at {@code path}.
     *
     * @throws SerializationFormatException when the object is malformed
     */
    public static SubStep readStep(JsonNode raw, String path) {
        JsonNode node = object(raw, path);
        StepType type = parseEnum(node, path, "processor", StepType::fromDssName);
        Map<String, String> params = new LinkedHashMap<>();
        JsonNode paramsNode = node.get("params");
        if (paramsNode != null && !paramsNode.isNull()) {
            object(paramsNode, path + ".params");
            for (var entry : paramsNode.properties()) {
                if (!entry.getValue().isTextual()) {
                    throw new SerializationFormatException(path + ".params." + entry.getKey(), "expected a string");
                }
                params.put(entry.getKey(), entry.getValue().asText());
            }
        }
        var effects = new ArrayList<FieldEffect>();
        List<JsonNode> effectNodes = array(node, path, "effects", false);
        for (int i = 0; i < effectNodes.size(); i++) {
            String effectPath = "%s.effects[%d]".formatted(path, i);
            JsonNode effect = object(effectNodes.get(i), effectPath);
            try {
                effects.add(new FieldEffect(text(effect, effectPath, "field"),
                    parseEnum(effect, effectPath, "kind", EffectKind::fromValue),
                    textList(effect, effectPath, "sources")));
            } catch (IllegalArgumentException e) {
                throw new SerializationFormatException(effectPath, e.getMessage(), e);
            }
        }
        return new SubStep(type, textList(node, path, "columns"), params, effects);
    }

    // ---- node access ----

    private static JsonNode object(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw new SerializationFormatException(path, "expected an object");
        }
        return node;
    }

    private static String text(JsonNode node, String path, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            throw new SerializationFormatException(path + "." + key, "missing required field");
        }
        if (!value.isTextual()) {
            throw new SerializationFormatException(path + "." + key, "expected a string");
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String path, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new SerializationFormatException(path + "." + key, "expected a string");
        }
        return value.asText();
    }

    private static List<JsonNode> array(JsonNode node, String path, String key, boolean required) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            if (required) {
                throw new SerializationFormatException(path + "." + key, "missing required field");
            }
            return List.of();
        }
        if (!value.isArray()) {
            throw new SerializationFormatException(path + "." + key, "expected a list");
        }
        var items = new ArrayList<JsonNode>();
        value.forEach(items::add);
        return items;
    }

    private static List<String> textList(JsonNode node, String path, String key) {
        List<JsonNode> items = array(node, path, key, false);
        var values = new ArrayList<String>();
        for (int i = 0; i < items.size(); i++) {
            if (!items.get(i).isTextual()) {
                throw new SerializationFormatException("%s.%s[%d]".formatted(path, key, i), "expected a string");
            }
            values.add(items.get(i).asText());
        }
        return values;
    }

    private static <T> T parseEnum(JsonNode node, String path, String key, Function<String, T> parser) {
        String value = text(node, path, key);
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new SerializationFormatException(path + "." + key, e.getMessage(), e);
        }
    }
}
