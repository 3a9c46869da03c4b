package dev.py2flow.engine;

import java.util.List;

/**
 * One connected component, members in creation order.
 */
public record FlowComponent(List<String> datasets, List<String> recipes) {

    public FlowComponent {
        datasets = List.copyOf(datasets);
        recipes = List.copyOf(recipes);
    }

    public int size() {
        return datasets.size() + recipes.size();
    }
}
