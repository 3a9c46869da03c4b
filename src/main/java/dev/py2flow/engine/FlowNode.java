package dev.py2flow.engine;

/**
 * A dataset or recipe vertex of the bipartite flow graph.
 */
public record FlowNode(String name, Type type) {

    public enum Type {
        DATASET,
        RECIPE
    }

    public static FlowNode dataset(String name) {
        return new FlowNode(name, Type.DATASET);
    }

    public static FlowNode recipe(String name) {
        return new FlowNode(name, Type.RECIPE);
    }

    public boolean isDataset() {
        return type == Type.DATASET;
    }

    @Override
    public String toString() {
        return name;
    }
}
