package dev.py2flow.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.py2flow.model.Dataset;
import dev.py2flow.model.DatasetRole;
import dev.py2flow.model.FieldSchema;
import dev.py2flow.model.Flow;
import dev.py2flow.model.Recipe;
import dev.py2flow.model.Recommendation;
import dev.py2flow.model.StepType;
import dev.py2flow.model.SubStep;

import java.util.List;

/**
 * JSON payloads of a DSS project bundle.
 */
final class DssDocuments {

    static final String OWNER = "py2flow";

    private final ObjectMapper mapper;
    private final String projectKey;
    private final String connection;
    private final long timestamp;

    DssDocuments(ObjectMapper mapper, String projectKey, String connection, long timestamp) {
        this.mapper = mapper;
        this.projectKey = projectKey;
        this.connection = connection;
        this.timestamp = timestamp;
    }

    ObjectNode project(Flow flow) {
        ObjectNode node = mapper.createObjectNode();
        node.put("projectKey", projectKey);
        node.put("name", flow.name());
        node.put("owner", OWNER);
        node.put("projectStatus", "Sandbox");
        node.put("projectAppType", "REGULAR");
        node.put("description", "Converted from a Python script by py2flow");
        node.put("shortDesc", "Generated from flow " + flow.name());
        node.putArray("tags").add("py2flow").add("auto-generated");
        node.set("creationTag", tag(0));
        node.set("versionTag", tag(1));
        ObjectNode counts = node.putObject("counts");
        counts.put("datasets", flow.datasets().size());
        counts.put("recipes", flow.recipes().size());
        return node;
    }

    ObjectNode params() {
        ObjectNode node = mapper.createObjectNode();
        ObjectNode variables = node.putObject("projectVariables");
        variables.putObject("standard");
        variables.putObject("local");
        node.putObject("projectResourcesStorage").put("cleanPolicy", "KEEP_ALL");
        return node;
    }

    ObjectNode dataset(Dataset dataset) {
        boolean input = dataset.role() == DatasetRole.INPUT;
        ObjectNode node = mapper.createObjectNode();
        node.put("type", input ? "Filesystem" : "Managed");
        node.put("managed", !input);
        node.put("name", dataset.name());
        node.put("projectKey", projectKey);
        node.put("formatType", dataset.formatHint() == null ? "csv" : dataset.formatHint());
        ObjectNode params = node.putObject("params");
        params.put("connection", connection);
        if (input) {
            params.put("path", dataset.location() == null ? "/" + dataset.name() : dataset.location());
        } else {
            params.put("path", "/%s/%s".formatted(projectKey, dataset.name()));
        }
        if (dataset.hasSchema()) {
            ObjectNode schema = node.putObject("schema");
            ArrayNode columns = schema.putArray("columns");
            for (FieldSchema field : dataset.schema()) {
                columns.addObject().put("name", field.name()).put("type", field.type());
            }
            schema.put("userModified", false);
        }
        node.putObject("partitioning").putArray("dimensions");
        node.set("creationTag", tag(0));
        return node;
    }

    ObjectNode recipe(Recipe recipe) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", recipe.name());
        node.put("projectKey", projectKey);
        node.put("type", recipe.kind().dssType());
        node.set("inputs", roleItems(recipe.inputs()));
        node.set("outputs", roleItems(recipe.outputs()));
        node.set("params", payload(recipe));
        if (!recipe.sourceLines().isEmpty()) {
            ArrayNode lines = node.putObject("customMeta").putArray("sourceLines");
            recipe.sourceLines().forEach(lines::add);
        }
        node.set("creationTag", tag(0));
        return node;
    }

    ObjectNode zones(Flow flow) {
        ObjectNode node = mapper.createObjectNode();
        ObjectNode zone = node.putArray("zones").addObject();
        zone.put("id", "default");
        zone.put("name", "Default");
        zone.put("color", "#2980b9");
        ArrayNode items = zone.putArray("items");
        flow.datasets().forEach(d -> items.addObject().put("objectType", "DATASET").put("objectId", d.name()));
        node.putArray("zonesOrder").add("default");
        return node;
    }

    ObjectNode manifest(Flow flow, List<Recipe> buildOrder) {
        ObjectNode node = mapper.createObjectNode();
        node.put("projectKey", projectKey);
        node.put("flowName", flow.name());
        node.put("generatedBy", OWNER);
        node.put("generatedOn", timestamp);
        ArrayNode datasets = node.putArray("datasets");
        flow.datasets().forEach(d -> datasets.add("datasets/%s.json".formatted(d.name())));
        ArrayNode recipes = node.putArray("recipes");
        buildOrder.forEach(r -> recipes.add("recipes/%s.json".formatted(r.name())));
        return node;
    }

    String readme(Flow flow, String generatedOn) {
        var sb = new StringBuilder();
        sb.append("# DSS project export: ").append(projectKey).append("\n\n");
        sb.append("Generated: ").append(generatedOn).append('\n');
        sb.append("Flow: ").append(flow.name()).append("\n\n");
        sb.append("## Contents\n\n");
        sb.append("- Datasets: ").append(flow.datasets().size()).append('\n');
        sb.append("- Recipes: ").append(flow.recipes().size()).append("\n\n");
        sb.append("## Import\n\n");
        sb.append("In DSS, open Projects > Import project and upload the bundle zip,\n");
        sb.append("or use the public API:\n\n");
        sb.append("```python\n");
        sb.append("import dataikuapi\n");
        sb.append("client = dataikuapi.DSSClient(host, api_key)\n");
        sb.append("client.prepare_project_import(open('").append(projectKey).append(".zip', 'rb')).execute()\n");
        sb.append("```\n");
        if (!flow.recommendations().isEmpty()) {
            sb.append("\n## Recommendations\n\n");
            for (Recommendation recommendation : flow.recommendations()) {
                sb.append("- [").append(recommendation.priority()).append("] ").append(recommendation.message())
                    .append('\n');
            }
        }
        if (!flow.warnings().isEmpty()) {
            sb.append("\n## Warnings\n\n");
            flow.warnings().forEach(w -> sb.append("- ").append(w).append('\n'));
        }
        return sb.toString();
    }

    // ---- recipe payloads ----

    private ObjectNode payload(Recipe recipe) {
        return switch (recipe.kind()) {
            case PREPARE -> preparePayload(recipe);
            case JOIN -> joinPayload(recipe);
            case GROUP -> groupPayload(recipe);
            case SORT -> sortPayload(recipe);
            case CUSTOM_CODE -> pythonPayload(recipe);
            default -> stepsPayload(recipe);
        };
    }

    private ObjectNode preparePayload(Recipe recipe) {
        ObjectNode node = mapper.createObjectNode();
        node.put("mode", "BATCH");
        ArrayNode steps = node.putArray("steps");
        for (SubStep step : recipe.steps()) {
            ObjectNode stepNode = steps.addObject();
            stepNode.put("metaType", "PROCESSOR");
            stepNode.put("type", step.type().dssName());
            stepNode.put("disabled", false);
            stepNode.set("params", stepParams(step));
        }
        node.putObject("columnsSelection").put("mode", "ALL");
        return node;
    }

    private ObjectNode joinPayload(Recipe recipe) {
        ObjectNode node = mapper.createObjectNode();
        ArrayNode virtualInputs = node.putArray("virtualInputs");
        for (int i = 0; i < recipe.inputs().size(); i++) {
            virtualInputs.addObject().put("index", i).put("originLabel", recipe.inputs().get(i));
        }
        ArrayNode joins = node.putArray("joins");
        for (SubStep step : stepsOf(recipe, StepType.JOIN)) {
            ObjectNode join = joins.addObject();
            join.put("table1", 0);
            join.put("table2", 1);
            join.put("type", step.params().getOrDefault("type", "INNER"));
            join.put("conditionsMode", "AND");
            String rightKeys = step.param("right_keys");
            List<String> right = rightKeys == null ? step.columns() : List.of(rightKeys.split(","));
            ArrayNode on = join.putArray("on");
            for (int i = 0; i < step.columns().size(); i++) {
                ObjectNode condition = on.addObject();
                condition.putObject("column1").put("table", 0).put("name", step.columns().get(i));
                condition.putObject("column2").put("table", 1)
                    .put("name", i < right.size() ? right.get(i) : step.columns().get(i));
                condition.put("type", "EQ");
            }
        }
        node.put("outputColumnsSelectionMode", "AUTO_NON_CONFLICTING");
        return node;
    }

    private ObjectNode groupPayload(Recipe recipe) {
        ObjectNode node = mapper.createObjectNode();
        ArrayNode keys = node.putArray("keys");
        stepsOf(recipe, StepType.GROUP_KEYS).forEach(s -> s.columns().forEach(c -> keys.addObject().put("column", c)));
        ArrayNode values = node.putArray("values");
        for (SubStep step : stepsOf(recipe, StepType.AGGREGATE)) {
            ObjectNode value = values.addObject();
            value.put("column", step.columns().isEmpty() ? "*" : step.columns().get(0));
            value.put("function", step.params().getOrDefault("function", "count"));
            if (!step.effects().isEmpty()) {
                value.put("outputName", step.effects().get(0).field());
            }
        }
        node.put("globalCount", keys.isEmpty());
        return node;
    }

    private ObjectNode sortPayload(Recipe recipe) {
        ObjectNode node = mapper.createObjectNode();
        ArrayNode orders = node.putArray("orders");
        for (SubStep step : stepsOf(recipe, StepType.SORT)) {
            String[] directions = step.params().getOrDefault("order", "").split(",");
            for (int i = 0; i < step.columns().size(); i++) {
                boolean desc = i < directions.length && directions[i].trim().equalsIgnoreCase("desc");
                orders.addObject().put("column", step.columns().get(i)).put("desc", desc);
            }
        }
        return node;
    }

    private ObjectNode pythonPayload(Recipe recipe) {
        ObjectNode node = mapper.createObjectNode();
        var code = new StringBuilder("# Generated by py2flow\n");
        if (!recipe.sourceLines().isEmpty()) {
            code.append("# Source lines: ").append(recipe.sourceLines()).append('\n');
        }
        code.append('\n').append(recipe.code() == null ? "" : recipe.code());
        node.put("code", code.toString());
        node.putObject("envSelection").put("envMode", "INHERIT");
        return node;
    }

    private ObjectNode stepsPayload(Recipe recipe) {
        ObjectNode node = mapper.createObjectNode();
        ArrayNode steps = node.putArray("steps");
        for (SubStep step : recipe.steps()) {
            ObjectNode stepNode = steps.addObject();
            stepNode.put("type", step.type().dssName());
            stepNode.set("params", stepParams(step));
        }
        return node;
    }

    private ObjectNode stepParams(SubStep step) {
        ObjectNode params = mapper.createObjectNode();
        if (!step.columns().isEmpty()) {
            ArrayNode columns = params.putArray("columns");
            step.columns().forEach(columns::add);
        }
        step.params().forEach(params::put);
        return params;
    }

    private static List<SubStep> stepsOf(Recipe recipe, StepType type) {
        return recipe.steps().stream().filter(s -> s.type() == type).toList();
    }

    private ObjectNode roleItems(List<String> datasets) {
        ObjectNode node = mapper.createObjectNode();
        ArrayNode items = node.putObject("main").putArray("items");
        for (String dataset : datasets) {
            items.addObject().put("ref", dataset).putArray("deps");
        }
        return node;
    }

    private ObjectNode tag(int version) {
        ObjectNode node = mapper.createObjectNode();
        node.put("versionNumber", version);
        node.putObject("lastModifiedBy").put("login", OWNER);
        node.put("lastModifiedOn", timestamp);
        return node;
    }
}
