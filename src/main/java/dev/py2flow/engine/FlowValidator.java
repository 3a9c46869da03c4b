package dev.py2flow.engine;

import dev.py2flow.model.Dataset;
import dev.py2flow.model.DatasetRole;
import dev.py2flow.model.Flow;
import dev.py2flow.model.Recipe;
import dev.py2flow.model.RecipeKind;
import dev.py2flow.model.ValidationIssue;
import dev.py2flow.model.ValidationIssue.Severity;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks over a flow. Returns an empty list for a sound flow.
 */
public final class FlowValidator {

    private FlowValidator() {}

    public static List<ValidationIssue> validate(Flow flow) {
        var issues = new ArrayList<ValidationIssue>();
        Set<String> datasetNames = new HashSet<>();
        flow.datasets().forEach(d -> datasetNames.add(d.name()));

        // Datasets and recipes share one namespace in DSS
        for (Recipe recipe : flow.recipes()) {
            if (datasetNames.contains(recipe.name())) {
                issues.add(error("DUPLICATE_NAME",
                    "Recipe '%s' has the same name as a dataset".formatted(recipe.name()), recipe.name()));
            }
        }

        boolean dangling = false;
        for (Recipe recipe : flow.recipes()) {
            List<String> references = new ArrayList<>(recipe.inputs());
            references.addAll(recipe.outputs());
            for (String reference : references) {
                if (!datasetNames.contains(reference)) {
                    dangling = true;
                    issues.add(error("MISSING_DATASET",
                        "Recipe '%s' references unknown dataset '%s'".formatted(recipe.name(), reference),
                        recipe.name()));
                }
            }
            if (recipe.outputs().isEmpty()
                    || recipe.inputs().isEmpty() && !recipe.kind().allowsNoInputs()) {
                issues.add(error("EMPTY_RECIPE",
                    "Recipe '%s' needs at least one input and one output".formatted(recipe.name()), recipe.name()));
            }
            if (recipe.kind() == RecipeKind.CUSTOM_CODE) {
                issues.add(warning("PYTHON_FALLBACK",
                    "Recipe '%s' runs Python code instead of a visual recipe".formatted(recipe.name()),
                    recipe.name()));
            }
        }

        FlowGraph graph = flow.graph();
        for (Dataset dataset : flow.datasets()) {
            issues.addAll(roleIssues(graph, dataset));
        }

        if (!dangling) {
            for (List<FlowEdge> cycle : graph.detectCycles()) {
                issues.add(error("CYCLE_DETECTED", "Cycle: " + CycleDetectedException.describe(List.of(cycle)),
                    cycle.get(0).from().name()));
            }
        }

        List<FlowComponent> components = graph.findDisconnectedSubgraphs();
        if (components.size() > 1) {
            issues.add(warning("DISCONNECTED_FLOW",
                "Flow has %d disconnected parts".formatted(components.size()), null));
        }
        return issues;
    }

    private static List<ValidationIssue> roleIssues(FlowGraph graph, Dataset dataset) {
        var issues = new ArrayList<ValidationIssue>();
        int producers = graph.producers(dataset.name()).size();
        int consumers = graph.consumers(dataset.name()).size();
        String name = dataset.name();
        if (dataset.role() == DatasetRole.INPUT && producers > 0) {
            issues.add(error("ROLE_VIOLATION", "Input dataset '%s' has a producing recipe".formatted(name), name));
        }
        if (dataset.role() == DatasetRole.OUTPUT && consumers > 0) {
            issues.add(error("ROLE_VIOLATION", "Output dataset '%s' is consumed by a recipe".formatted(name), name));
        }
        if (dataset.role() == DatasetRole.INTERMEDIATE && producers != 1) {
            issues.add(error("ROLE_VIOLATION",
                "Intermediate dataset '%s' has %d producing recipes".formatted(name, producers), name));
        }
        if (dataset.role() == DatasetRole.INTERMEDIATE && consumers == 0) {
            issues.add(error("ROLE_VIOLATION", "Intermediate dataset '%s' is never consumed".formatted(name), name));
        }
        if (dataset.role() == DatasetRole.OUTPUT && producers > 1) {
            issues.add(error("ROLE_VIOLATION",
                "Output dataset '%s' has %d producing recipes".formatted(name, producers), name));
        }
        return issues;
    }

    private static ValidationIssue error(String code, String message, String subject) {
        return new ValidationIssue(code, Severity.ERROR, message, subject);
    }

    private static ValidationIssue warning(String code, String message, String subject) {
        return new ValidationIssue(code, Severity.WARNING, message, subject);
    }
}
