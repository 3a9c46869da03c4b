package dev.py2flow.render;

import dev.py2flow.model.Dataset;
import dev.py2flow.model.DatasetRole;
import dev.py2flow.model.Flow;
import dev.py2flow.model.Recipe;

/**
 * Mermaid flowchart. Does not need layers, so cyclic flows render too.
 */
public final class MermaidRenderer implements FlowRenderer {

    private final Theme theme;

    public MermaidRenderer(Theme theme) {
        this.theme = theme;
    }

    @Override
    public RenderFormat format() {
        return RenderFormat.MERMAID;
    }

    @Override
    public String render(Flow flow) {
        var sb = new StringBuilder();
        sb.append("flowchart LR\n");
        for (Dataset dataset : flow.datasets()) {
            sb.append("    %s[\"%s\"]:::%s\n".formatted(Markup.datasetId(flow, dataset.name()),
                Markup.quoted(dataset.name()), dataset.role().value()));
        }
        for (Recipe recipe : flow.recipes()) {
            sb.append("    %s((\"%s %s\")):::%s\n".formatted(Markup.recipeId(flow, recipe.name()),
                recipe.kind().icon(), Markup.quoted(recipe.name()), styleClass(recipe)));
        }
        for (Recipe recipe : flow.recipes()) {
            String id = Markup.recipeId(flow, recipe.name());
            for (String input : recipe.inputs()) {
                sb.append("    %s --> %s\n".formatted(Markup.datasetId(flow, input), id));
            }
            for (String output : recipe.outputs()) {
                sb.append("    %s --> %s\n".formatted(id, Markup.datasetId(flow, output)));
            }
        }
        for (DatasetRole role : DatasetRole.values()) {
            Theme.Palette palette = theme.dataset(role);
            sb.append("    classDef %s fill:%s,stroke:%s,color:%s\n".formatted(role.value(), palette.fill(),
                palette.stroke(), palette.text()));
        }
        flow.recipes().stream().map(Recipe::kind).distinct().forEach(kind -> {
            Theme.Palette palette = theme.recipe(kind);
            sb.append("    classDef %s fill:%s,stroke:%s,color:%s\n".formatted("recipe_" + kind.namePrefix(),
                palette.fill(), palette.stroke(), palette.text()));
        });
        return sb.toString();
    }

    private static String styleClass(Recipe recipe) {
        return "recipe_" + recipe.kind().namePrefix();
    }
}
