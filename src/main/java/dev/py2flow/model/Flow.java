package dev.py2flow.model;

import dev.py2flow.engine.ColumnLineageTracer;
import dev.py2flow.engine.FlowGraph;
import dev.py2flow.engine.FlowValidator;
import dev.py2flow.render.FlowRenderers;
import dev.py2flow.render.RenderFormat;
import dev.py2flow.serialization.FlowDocuments;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The pipeline graph: datasets and recipes in creation order.
 *
 * <p>Storage is append-only. Entities live in indexed lists owned by the flow
 * and are looked up by name; nothing outside the flow holds positions into
 * them. The only in-place edit is {@link #replaceDataset}, which swaps an
 * immutable dataset for another one with the same name.</p>
 *
 * <p>A flow is not required to be acyclic. Ordering-dependent operations
 * report cycles instead of looping.</p>
 */
public final class Flow {

    private final String name;
    private final List<Dataset> datasets = new ArrayList<>();
    private final Map<String, Integer> datasetIndex = new HashMap<>();
    private final List<Recipe> recipes = new ArrayList<>();
    private final Map<String, Integer> recipeIndex = new HashMap<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<Recommendation> recommendations = new ArrayList<>();
    private final List<String> optimizationNotes = new ArrayList<>();

    public Flow(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    // ---- construction ----

    /**
     * Append a dataset.
     *
     * @throws IllegalArgumentException if a dataset with the same name exists
     */
    public Dataset addDataset(Dataset dataset) {
        Objects.requireNonNull(dataset, "dataset");
        if (datasetIndex.containsKey(dataset.name())) {
            throw new IllegalArgumentException("Duplicate dataset name: " + dataset.name());
        }
        datasetIndex.put(dataset.name(), datasets.size());
        datasets.add(dataset);
        return dataset;
    }

    /**
     * Replace the dataset that has the same name, keeping its position.
     *
     * @throws IllegalArgumentException if no such dataset exists
     */
    public Dataset replaceDataset(Dataset dataset) {
        Integer index = datasetIndex.get(dataset.name());
        if (index == null) {
            throw new IllegalArgumentException("Unknown dataset: " + dataset.name());
        }
        datasets.set(index, dataset);
        return dataset;
    }

    /**
     * Append a recipe. Every input and output must name an existing dataset.
     *
     * @throws IllegalArgumentException on a duplicate name, an unknown dataset
     *                                  reference or a missing input/output
     */
    public Recipe addRecipe(Recipe recipe) {
        Objects.requireNonNull(recipe, "recipe");
        if (recipeIndex.containsKey(recipe.name())) {
            throw new IllegalArgumentException("Duplicate recipe name: " + recipe.name());
        }
        for (String ref : recipe.inputs()) {
            requireDataset(recipe, ref);
        }
        for (String ref : recipe.outputs()) {
            requireDataset(recipe, ref);
        }
        if (recipe.outputs().isEmpty()) {
            throw new IllegalArgumentException("Recipe '%s' has no output".formatted(recipe.name()));
        }
        if (recipe.inputs().isEmpty() && !recipe.kind().allowsNoInputs()) {
            throw new IllegalArgumentException("Recipe '%s' of kind %s has no input"
                .formatted(recipe.name(), recipe.kind().value()));
        }
        recipeIndex.put(recipe.name(), recipes.size());
        recipes.add(recipe);
        return recipe;
    }

    private void requireDataset(Recipe recipe, String ref) {
        if (!datasetIndex.containsKey(ref)) {
            throw new IllegalArgumentException("Recipe '%s' references unknown dataset '%s'"
                .formatted(recipe.name(), ref));
        }
    }

    public void addWarning(String warning) {
        warnings.add(Objects.requireNonNull(warning));
    }

    public void addRecommendation(Recommendation recommendation) {
        recommendations.add(Objects.requireNonNull(recommendation));
    }

    public void addOptimizationNote(String note) {
        optimizationNotes.add(Objects.requireNonNull(note));
    }

    // ---- lookup ----

    public List<Dataset> datasets() {
        return Collections.unmodifiableList(datasets);
    }

    public List<Recipe> recipes() {
        return Collections.unmodifiableList(recipes);
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public List<Recommendation> recommendations() {
        return Collections.unmodifiableList(recommendations);
    }

    public List<String> optimizationNotes() {
        return Collections.unmodifiableList(optimizationNotes);
    }

    public Optional<Dataset> dataset(String datasetName) {
        Integer index = datasetIndex.get(datasetName);
        return index == null ? Optional.empty() : Optional.of(datasets.get(index));
    }

    public Optional<Recipe> recipe(String recipeName) {
        Integer index = recipeIndex.get(recipeName);
        return index == null ? Optional.empty() : Optional.of(recipes.get(index));
    }

    /** Creation position of a dataset, or -1. */
    public int datasetPosition(String datasetName) {
        return datasetIndex.getOrDefault(datasetName, -1);
    }

    /** Creation position of a recipe, or -1. */
    public int recipePosition(String recipeName) {
        return recipeIndex.getOrDefault(recipeName, -1);
    }

    public List<Dataset> datasetsWithRole(DatasetRole role) {
        return datasets.stream().filter(d -> d.role() == role).toList();
    }

    public List<Recipe> recipesOfKind(RecipeKind kind) {
        return recipes.stream().filter(r -> r.kind() == kind).toList();
    }

    // ---- graph queries ----

    /** A graph view over the current contents. */
    public FlowGraph graph() {
        return new FlowGraph(this);
    }

    /**
     * Trace a field of the last output dataset that carries it.
     */
    public ColumnLineage getColumnLineage(String field) {
        return ColumnLineageTracer.trace(this, field);
    }

    public ColumnLineage getColumnLineage(String datasetName, String field) {
        return ColumnLineageTracer.trace(this, datasetName, field);
    }

    public List<ValidationIssue> validate() {
        return FlowValidator.validate(this);
    }

    /** Counts by role and kind, in a stable order. */
    public Map<String, Object> summary() {
        var summary = new LinkedHashMap<String, Object>();
        summary.put("flow_name", name);
        summary.put("total_datasets", datasets.size());
        summary.put("total_recipes", recipes.size());
        var roles = new LinkedHashMap<String, Integer>();
        for (DatasetRole role : DatasetRole.values()) {
            roles.put(role.value(), datasetsWithRole(role).size());
        }
        summary.put("datasets_by_role", roles);
        var kinds = new LinkedHashMap<String, Integer>();
        for (Recipe recipe : recipes) {
            kinds.merge(recipe.kind().value(), 1, Integer::sum);
        }
        summary.put("recipes_by_kind", kinds);
        summary.put("warnings", warnings.size());
        summary.put("recommendations", recommendations.size());
        return summary;
    }

    // ---- serialization and rendering ----

    public String toJson() {
        return FlowDocuments.toJson(this);
    }

    public String toYaml() {
        return FlowDocuments.toYaml(this);
    }

    public static Flow fromJson(String json) {
        return FlowDocuments.fromJson(json);
    }

    public static Flow fromYaml(String yaml) {
        return FlowDocuments.fromYaml(yaml);
    }

    public String visualize(RenderFormat format) {
        return FlowRenderers.render(this, format);
    }

    public String visualize(String format) {
        return visualize(RenderFormat.fromName(format));
    }

    public Path toSvg(Path path) throws IOException {
        return Files.writeString(path, visualize(RenderFormat.SVG), StandardCharsets.UTF_8);
    }

    public Path toHtml(Path path) throws IOException {
        return Files.writeString(path, visualize(RenderFormat.HTML), StandardCharsets.UTF_8);
    }

    // ---- equality ----

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Flow other)) {
            return false;
        }
        return name.equals(other.name)
            && datasets.equals(other.datasets)
            && recipes.equals(other.recipes)
            && warnings.equals(other.warnings)
            && recommendations.equals(other.recommendations)
            && optimizationNotes.equals(other.optimizationNotes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, datasets, recipes, warnings, recommendations, optimizationNotes);
    }

    @Override
    public String toString() {
        return "Flow[%s: %d datasets, %d recipes]".formatted(name, datasets.size(), recipes.size());
    }
}
