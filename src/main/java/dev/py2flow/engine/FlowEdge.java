package dev.py2flow.engine;

/**
 * A directed edge: recipe to the dataset it produces, or dataset to the recipe consuming it.
 */
public record FlowEdge(FlowNode from, FlowNode to) {

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
