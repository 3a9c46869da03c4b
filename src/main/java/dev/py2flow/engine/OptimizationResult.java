package dev.py2flow.engine;

import dev.py2flow.model.Flow;

import java.util.List;

/**
 * Outcome of {@link FlowOptimizer#optimize}: the new flow plus what changed.
 */
public record OptimizationResult(
    Flow flow,
    int recipesMerged,
    int datasetsRemoved,
    int recommendationsAdded,
    List<String> log
) {

    public OptimizationResult {
        log = List.copyOf(log);
    }

    public boolean changed() {
        return recipesMerged > 0 || datasetsRemoved > 0 || recommendationsAdded > 0;
    }
}
