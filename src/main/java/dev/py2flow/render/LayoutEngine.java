package dev.py2flow.render;

import dev.py2flow.model.Dataset;
import dev.py2flow.model.Flow;
import dev.py2flow.model.Recipe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Layered left-to-right layout.
 *
 * <p>Datasets without a producer sit in layer 0. A recipe is one layer after
 * its deepest input and a produced dataset one layer after its deepest
 * producer. Nodes keep creation order within a layer, datasets first.</p>
 */
public final class LayoutEngine {

    private static final Logger LOG = LoggerFactory.getLogger(LayoutEngine.class);

    public static final int DATASET_WIDTH = 160;
    public static final int DATASET_HEIGHT = 50;
    public static final int RECIPE_SIZE = 70;
    public static final int LAYER_SPACING = 240;
    public static final int NODE_SPACING = 100;
    public static final int PADDING = 40;

    private LayoutEngine() {}

    /**
     * @throws dev.py2flow.engine.CycleDetectedException when the flow has a cycle
     */
    public static FlowLayout layout(Flow flow) {
        List<Recipe> ordered = flow.graph().topologicalSort();
        Map<String, Integer> datasetLayers = new HashMap<>();
        Map<String, Integer> recipeLayers = new HashMap<>();
        for (Dataset dataset : flow.datasets()) {
            datasetLayers.put(dataset.name(), 0);
        }
        for (Recipe recipe : ordered) {
            int layer = 1;
            for (String input : recipe.inputs()) {
                layer = Math.max(layer, datasetLayers.get(input) + 1);
            }
            recipeLayers.put(recipe.name(), layer);
            for (String output : recipe.outputs()) {
                datasetLayers.merge(output, layer + 1, Math::max);
            }
        }

        int layerCount = 1;
        for (int layer : datasetLayers.values()) {
            layerCount = Math.max(layerCount, layer + 1);
        }
        for (int layer : recipeLayers.values()) {
            layerCount = Math.max(layerCount, layer + 1);
        }
        List<List<String>> layers = new ArrayList<>();
        for (int i = 0; i < layerCount; i++) {
            layers.add(new ArrayList<>());
        }

        var nodes = new ArrayList<NodeBox>();
        for (Dataset dataset : flow.datasets()) {
            int layer = datasetLayers.get(dataset.name());
            nodes.add(place(dataset.name(), true, layer, layers));
        }
        for (Recipe recipe : flow.recipes()) {
            int layer = recipeLayers.get(recipe.name());
            nodes.add(place(recipe.name(), false, layer, layers));
        }

        int rows = 1;
        for (List<String> layer : layers) {
            rows = Math.max(rows, layer.size());
        }
        int width = 2 * PADDING + (layerCount - 1) * LAYER_SPACING + DATASET_WIDTH;
        int height = 2 * PADDING + (rows - 1) * NODE_SPACING + RECIPE_SIZE;
        LOG.debug("Laid out flow '{}' in {} layer(s), {}x{}", flow.name(), layerCount, width, height);
        return new FlowLayout(width, height, layers, nodes);
    }

    private static NodeBox place(String name, boolean dataset, int layer, List<List<String>> layers) {
        int row = layers.get(layer).size();
        int centerX = PADDING + layer * LAYER_SPACING + DATASET_WIDTH / 2;
        int centerY = PADDING + RECIPE_SIZE / 2 + row * NODE_SPACING;
        int width = dataset ? DATASET_WIDTH : RECIPE_SIZE;
        int height = dataset ? DATASET_HEIGHT : RECIPE_SIZE;
        var box = new NodeBox(name, dataset, layer, centerX - width / 2, centerY - height / 2, width, height);
        layers.get(layer).add(name);
        return box;
    }
}
