package dev.py2flow.render;

import dev.py2flow.model.Dataset;
import dev.py2flow.model.Flow;
import dev.py2flow.model.Recipe;

/**
 * Static SVG diagram: rounded boxes for datasets, circles with a kind badge
 * for recipes, curved connections left to right.
 */
public final class SvgRenderer implements FlowRenderer {

    private static final int LABEL_WIDTH = 22;

    private final Theme theme;

    public SvgRenderer(Theme theme) {
        this.theme = theme;
    }

    @Override
    public RenderFormat format() {
        return RenderFormat.SVG;
    }

    @Override
    public String render(Flow flow) {
        FlowLayout layout = LayoutEngine.layout(flow);
        var sb = new StringBuilder();
        sb.append("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"%d\" height=\"%d\" viewBox=\"0 0 %d %d\">\n"
            .formatted(layout.width(), layout.height(), layout.width(), layout.height()));
        sb.append("  <title>").append(Markup.xml(flow.name())).append("</title>\n");
        sb.append("  <defs>\n");
        sb.append("    <marker id=\"arrow\" viewBox=\"0 0 10 10\" refX=\"9\" refY=\"5\" markerWidth=\"8\""
            + " markerHeight=\"8\" orient=\"auto\">\n");
        sb.append("      <path d=\"M0,0 L10,5 L0,10 z\" fill=\"%s\"/>\n".formatted(theme.edge()));
        sb.append("    </marker>\n");
        sb.append("  </defs>\n");
        sb.append("  <rect class=\"background\" width=\"100%\" height=\"100%\" fill=\"")
            .append(theme.background()).append("\"/>\n");
        sb.append("  <g id=\"flow\" font-family=\"").append(Markup.xml(theme.fontFamily())).append("\">\n");

        sb.append("    <g class=\"edges\">\n");
        for (Recipe recipe : flow.recipes()) {
            NodeBox node = layout.recipe(recipe.name()).orElseThrow();
            for (String input : recipe.inputs()) {
                edge(sb, layout.dataset(input).orElseThrow(), node);
            }
            for (String output : recipe.outputs()) {
                edge(sb, node, layout.dataset(output).orElseThrow());
            }
        }
        sb.append("    </g>\n");

        sb.append("    <g class=\"datasets\">\n");
        for (Dataset dataset : flow.datasets()) {
            datasetNode(sb, dataset, layout.dataset(dataset.name()).orElseThrow());
        }
        sb.append("    </g>\n");

        sb.append("    <g class=\"recipes\">\n");
        for (Recipe recipe : flow.recipes()) {
            recipeNode(sb, recipe, layout.recipe(recipe.name()).orElseThrow());
        }
        sb.append("    </g>\n");
        sb.append("  </g>\n");
        sb.append("</svg>\n");
        return sb.toString();
    }

    private void edge(StringBuilder sb, NodeBox from, NodeBox to) {
        int x1 = from.right();
        int y1 = from.centerY();
        int x2 = to.x();
        int y2 = to.centerY();
        int bend = Math.max(20, (x2 - x1) / 2);
        sb.append("      <path class=\"edge\" data-from=\"%s\" data-to=\"%s\" d=\"M%d,%d C%d,%d %d,%d %d,%d\""
                .formatted(Markup.xml(from.name()), Markup.xml(to.name()), x1, y1, x1 + bend, y1, x2 - bend, y2, x2, y2))
            .append(" fill=\"none\" stroke=\"%s\" stroke-width=\"2\" marker-end=\"url(#arrow)\"/>\n"
                .formatted(theme.edge()));
    }

    private void datasetNode(StringBuilder sb, Dataset dataset, NodeBox box) {
        Theme.Palette palette = theme.dataset(dataset.role());
        sb.append("      <g class=\"node dataset %s\" data-kind=\"dataset\" data-name=\"%s\">\n"
            .formatted(dataset.role().value(), Markup.xml(dataset.name())));
        sb.append("        <rect x=\"%d\" y=\"%d\" width=\"%d\" height=\"%d\" rx=\"6\" fill=\"%s\" stroke=\"%s\""
            .formatted(box.x(), box.y(), box.width(), box.height(), palette.fill(), palette.stroke()))
            .append(" stroke-width=\"2\"/>\n");
        sb.append("        <text x=\"%d\" y=\"%d\" text-anchor=\"middle\" font-size=\"13\" fill=\"%s\">%s</text>\n"
            .formatted(box.centerX(), box.centerY() + 4, palette.text(),
                Markup.xml(Markup.truncate(dataset.name(), LABEL_WIDTH))));
        sb.append("      </g>\n");
    }

    private void recipeNode(StringBuilder sb, Recipe recipe, NodeBox box) {
        Theme.Palette palette = theme.recipe(recipe.kind());
        sb.append("      <g class=\"node recipe %s\" data-kind=\"recipe\" data-name=\"%s\">\n"
            .formatted(recipe.kind().value(), Markup.xml(recipe.name())));
        sb.append("        <title>%s</title>\n".formatted(Markup.xml(recipe.description())));
        sb.append("        <circle cx=\"%d\" cy=\"%d\" r=\"%d\" fill=\"%s\" stroke=\"%s\" stroke-width=\"2\"/>\n"
            .formatted(box.centerX(), box.centerY(), box.width() / 2, palette.fill(), palette.stroke()));
        sb.append("        <text x=\"%d\" y=\"%d\" text-anchor=\"middle\" font-size=\"20\" font-weight=\"bold\""
                .formatted(box.centerX(), box.centerY() + 7))
            .append(" fill=\"%s\">%s</text>\n".formatted(palette.text(), recipe.kind().icon()));
        sb.append("        <text x=\"%d\" y=\"%d\" text-anchor=\"middle\" font-size=\"11\" fill=\"%s\">%s</text>\n"
            .formatted(box.centerX(), box.y() + box.height() + 14, palette.text(),
                Markup.xml(Markup.truncate(recipe.name(), LABEL_WIDTH))));
        sb.append("      </g>\n");
    }
}
