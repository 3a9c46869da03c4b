package dev.py2flow.render;

import java.util.List;
import java.util.Optional;

/**
 * Node positions of a flow diagram.
 *
 * @param width   canvas width
 * @param height  canvas height
 * @param layers  node names per layer, left to right
 * @param nodes   every placed node, datasets then recipes in creation order
 */
public record FlowLayout(int width, int height, List<List<String>> layers, List<NodeBox> nodes) {

    public FlowLayout {
        layers = layers.stream().map(List::copyOf).toList();
        nodes = List.copyOf(nodes);
    }

    public Optional<NodeBox> dataset(String name) {
        return nodes.stream().filter(n -> n.dataset() && n.name().equals(name)).findFirst();
    }

    public Optional<NodeBox> recipe(String name) {
        return nodes.stream().filter(n -> !n.dataset() && n.name().equals(name)).findFirst();
    }
}
