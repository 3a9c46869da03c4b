package dev.py2flow.render;

import dev.py2flow.model.Dataset;
import dev.py2flow.model.Flow;
import dev.py2flow.model.Recipe;

/**
 * PlantUML component diagram. Does not need layers, so cyclic flows render too.
 */
public final class PlantUmlRenderer implements FlowRenderer {

    private final Theme theme;

    public PlantUmlRenderer(Theme theme) {
        this.theme = theme;
    }

    @Override
    public RenderFormat format() {
        return RenderFormat.PLANTUML;
    }

    @Override
    public String render(Flow flow) {
        var sb = new StringBuilder();
        sb.append("@startuml\n");
        sb.append("title ").append(flow.name()).append('\n');
        sb.append("left to right direction\n");
        sb.append("skinparam backgroundColor ").append(theme.background()).append('\n');
        sb.append("skinparam ArrowColor ").append(theme.edge()).append('\n');
        for (Dataset dataset : flow.datasets()) {
            Theme.Palette palette = theme.dataset(dataset.role());
            sb.append("database \"%s\" as %s <<%s>> %s\n".formatted(Markup.quoted(dataset.name()),
                Markup.datasetId(flow, dataset.name()), dataset.role().value(), palette.fill()));
        }
        for (Recipe recipe : flow.recipes()) {
            Theme.Palette palette = theme.recipe(recipe.kind());
            sb.append("rectangle \"[%s] %s\" as %s <<%s>> %s\n".formatted(recipe.kind().icon(),
                Markup.quoted(recipe.name()), Markup.recipeId(flow, recipe.name()), recipe.kind().value(),
                palette.fill()));
        }
        for (Recipe recipe : flow.recipes()) {
            String id = Markup.recipeId(flow, recipe.name());
            for (String input : recipe.inputs()) {
                sb.append(Markup.datasetId(flow, input)).append(" --> ").append(id).append('\n');
            }
            for (String output : recipe.outputs()) {
                sb.append(id).append(" --> ").append(Markup.datasetId(flow, output)).append('\n');
            }
        }
        sb.append("@enduml\n");
        return sb.toString();
    }
}
