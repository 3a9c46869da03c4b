package dev.py2flow.render;

import dev.py2flow.model.Dataset;
import dev.py2flow.model.DatasetRole;
import dev.py2flow.model.Flow;
import dev.py2flow.model.Recipe;

import java.util.List;

/**
 * Plain-text diagram: datasets and recipes layer by layer, followed by the
 * recipe connections in build order.
 */
public final class AsciiRenderer implements FlowRenderer {

    private static final int DESCRIPTION_WIDTH = 60;

    @Override
    public RenderFormat format() {
        return RenderFormat.ASCII;
    }

    @Override
    public String render(Flow flow) {
        FlowLayout layout = LayoutEngine.layout(flow);
        var sb = new StringBuilder();
        String title = "Flow: " + flow.name();
        sb.append(title).append('\n').append("=".repeat(title.length())).append('\n');
        sb.append("Datasets: %d (%d input, %d intermediate, %d output) | Recipes: %d\n".formatted(
            flow.datasets().size(),
            flow.datasetsWithRole(DatasetRole.INPUT).size(),
            flow.datasetsWithRole(DatasetRole.INTERMEDIATE).size(),
            flow.datasetsWithRole(DatasetRole.OUTPUT).size(),
            flow.recipes().size()));

        List<List<String>> layers = layout.layers();
        for (int i = 0; i < layers.size(); i++) {
            if (layers.get(i).isEmpty()) {
                continue;
            }
            sb.append('\n').append("Layer ").append(i).append('\n');
            for (NodeBox node : layout.nodes()) {
                if (node.layer() != i) {
                    continue;
                }
                if (node.dataset()) {
                    Dataset dataset = flow.dataset(node.name()).orElseThrow();
                    sb.append("  ").append(datasetLabel(dataset));
                    if (dataset.hasSchema()) {
                        sb.append("  (").append(dataset.schema().size()).append(" fields)");
                    }
                } else {
                    Recipe recipe = flow.recipe(node.name()).orElseThrow();
                    sb.append("  ").append(recipeLabel(recipe)).append("  ")
                        .append(Markup.truncate(recipe.description(), DESCRIPTION_WIDTH));
                }
                sb.append('\n');
            }
        }

        if (!flow.recipes().isEmpty()) {
            sb.append('\n').append("Connections").append('\n');
            for (String line : compactLines(flow)) {
                sb.append("  ").append(line).append('\n');
            }
        }
        if (!flow.warnings().isEmpty()) {
            sb.append('\n').append("Warnings").append('\n');
            flow.warnings().forEach(w -> sb.append("  ! ").append(w).append('\n'));
        }
        return sb.toString();
    }

    /**
     * One line per recipe in build order, e.g.
     * {@code customers + orders --> (JN) join_merged --> merged}.
     */
    public String renderCompact(Flow flow) {
        return String.join("\n", compactLines(flow)) + "\n";
    }

    private static List<String> compactLines(Flow flow) {
        return flow.graph().topologicalSort().stream()
            .map(r -> "%s --> %s --> %s".formatted(
                r.inputs().isEmpty() ? "(none)" : String.join(" + ", r.inputs()),
                recipeLabel(r),
                String.join(" + ", r.outputs())))
            .toList();
    }

    private static String datasetLabel(Dataset dataset) {
        return switch (dataset.role()) {
            case INPUT -> "[IN]  " + dataset.name();
            case OUTPUT -> "[OUT] " + dataset.name();
            case INTERMEDIATE -> "[ ]   " + dataset.name();
        };
    }

    private static String recipeLabel(Recipe recipe) {
        return "(%s) %s".formatted(recipe.kind().icon(), recipe.name());
    }
}
