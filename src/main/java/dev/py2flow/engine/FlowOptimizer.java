package dev.py2flow.engine;

import dev.py2flow.model.Dataset;
import dev.py2flow.model.DatasetRole;
import dev.py2flow.model.Flow;
import dev.py2flow.model.Recipe;
import dev.py2flow.model.RecipeKind;
import dev.py2flow.model.Recommendation;
import dev.py2flow.model.SubStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Simplifies a flow without changing what it computes.
 *
 * <ul>
 *   <li>Level 0: no change.</li>
 *   <li>Level 1: merge a prepare recipe into the prepare recipe that is the
 *       only consumer of its only output, and drop the dataset in between.</li>
 *   <li>Level 2: level 1 plus PERFORMANCE recommendations.</li>
 * </ul>
 *
 * <p>The input flow is never modified.</p>
 */
public final class FlowOptimizer {

    private static final Logger LOG = LoggerFactory.getLogger(FlowOptimizer.class);

    private FlowOptimizer() {}

    public static OptimizationResult optimize(Flow flow, int level) {
        List<Dataset> datasets = new ArrayList<>(flow.datasets());
        List<Recipe> recipes = new ArrayList<>(flow.recipes());
        var log = new ArrayList<String>();
        int merged = 0;
        int removed = 0;

        if (level >= 1) {
            Optional<int[]> pair;
            while ((pair = mergeablePair(datasets, recipes)).isPresent()) {
                Recipe first = recipes.get(pair.get()[0]);
                Recipe second = recipes.get(pair.get()[1]);
                String between = first.outputs().get(0);
                recipes.set(pair.get()[1], merge(first, second));
                recipes.remove(pair.get()[0]);
                datasets.removeIf(d -> d.name().equals(between));
                merged++;
                removed++;
                log.add("Merged prepare recipe '%s' into '%s'".formatted(first.name(), second.name()));
                log.add("Removed intermediate dataset '%s'".formatted(between));
            }
        }

        var result = new Flow(flow.name());
        datasets.forEach(result::addDataset);
        recipes.forEach(result::addRecipe);
        flow.warnings().forEach(result::addWarning);
        flow.recommendations().forEach(result::addRecommendation);
        flow.optimizationNotes().forEach(result::addOptimizationNote);

        int recommended = 0;
        if (level >= 2) {
            for (Recommendation recommendation : performanceHints(result)) {
                result.addRecommendation(recommendation);
                log.add(recommendation.message());
                recommended++;
            }
        }
        log.forEach(result::addOptimizationNote);
        if (merged > 0 || recommended > 0) {
            LOG.info("Optimized flow '{}' at level {}: {} recipe(s) merged, {} dataset(s) removed, {} hint(s)",
                flow.name(), level, merged, removed, recommended);
        }
        return new OptimizationResult(result, merged, removed, recommended, log);
    }

    /** Positions of the first prepare pair linked by a private intermediate dataset. */
    private static Optional<int[]> mergeablePair(List<Dataset> datasets, List<Recipe> recipes) {
        Map<String, List<Integer>> consumers = new HashMap<>();
        for (int i = 0; i < recipes.size(); i++) {
            for (String input : new LinkedHashSet<>(recipes.get(i).inputs())) {
                consumers.computeIfAbsent(input, k -> new ArrayList<>()).add(i);
            }
        }
        for (int i = 0; i < recipes.size(); i++) {
            Recipe first = recipes.get(i);
            if (first.kind() != RecipeKind.PREPARE || first.outputs().size() != 1) {
                continue;
            }
            String between = first.outputs().get(0);
            List<Integer> readers = consumers.getOrDefault(between, List.of());
            if (readers.size() != 1 || !isIntermediate(datasets, between)) {
                continue;
            }
            Recipe second = recipes.get(readers.get(0));
            if (second.kind() == RecipeKind.PREPARE && second.inputs().size() == 1 && readers.get(0) != i) {
                return Optional.of(new int[] {i, readers.get(0)});
            }
        }
        return Optional.empty();
    }

    private static boolean isIntermediate(List<Dataset> datasets, String name) {
        return datasets.stream().anyMatch(d -> d.name().equals(name) && d.role() == DatasetRole.INTERMEDIATE);
    }

    private static Recipe merge(Recipe first, Recipe second) {
        List<SubStep> steps = new ArrayList<>(first.steps());
        steps.addAll(second.steps());
        Set<Integer> lines = new LinkedHashSet<>(first.sourceLines());
        lines.addAll(second.sourceLines());
        return new Recipe(second.name(), RecipeKind.PREPARE, first.inputs(), second.outputs(), steps, null,
            List.copyOf(lines));
    }

    private static List<Recommendation> performanceHints(Flow flow) {
        FlowGraph graph = flow.graph();
        var hints = new ArrayList<Recommendation>();
        for (Recipe recipe : flow.recipes()) {
            if (recipe.kind() == RecipeKind.PREPARE && !recipe.steps().isEmpty()
                    && recipe.steps().stream().allMatch(s -> s.type().isRowFilter())) {
                Optional<Recipe> producer = graph.producer(recipe.inputs().get(0));
                if (producer.isPresent() && producer.get().kind() == RecipeKind.JOIN) {
                    hints.add(new Recommendation("PERFORMANCE", "MEDIUM",
                        "Recipe '%s' filters the output of join '%s'; filtering the join inputs first reduces the rows joined"
                            .formatted(recipe.name(), producer.get().name()), recipe.name()));
                }
            }
            if (recipe.kind() == RecipeKind.GROUP || recipe.kind() == RecipeKind.DISTINCT) {
                Optional<Recipe> producer = graph.producer(recipe.inputs().get(0));
                if (producer.isPresent() && producer.get().kind() == RecipeKind.SORT) {
                    hints.add(new Recommendation("PERFORMANCE", "LOW",
                        "Sort recipe '%s' feeds %s recipe '%s', which does not keep row order"
                            .formatted(producer.get().name(), recipe.kind().value(), recipe.name()),
                        producer.get().name()));
                }
            }
        }
        return hints;
    }
}
