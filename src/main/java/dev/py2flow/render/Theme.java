package dev.py2flow.render;

import dev.py2flow.model.DatasetRole;
import dev.py2flow.model.RecipeKind;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Colour palette for diagrams, modelled on the Dataiku flow view.
 *
 * @param name       theme name
 * @param background canvas colour
 * @param edge       connection colour
 * @param fontFamily CSS font stack
 * @param datasets   colours per dataset role
 * @param recipes    colours per recipe kind; kinds without an entry use {@code fallback}
 * @param fallback   default recipe colours
 */
public record Theme(
    String name,
    String background,
    String edge,
    String fontFamily,
    Map<DatasetRole, Palette> datasets,
    Map<RecipeKind, Palette> recipes,
    Palette fallback
) {

    /** Fill, border and text colour of one node style. */
    public record Palette(String fill, String stroke, String text) {}

    private static final String FONT = "Arial, Helvetica, sans-serif";

    public static final Theme LIGHT = new Theme("light", "#FAFAFA", "#90A4AE", FONT,
        roles(
            new Palette("#E3F2FD", "#4A90D9", "#1565C0"),
            new Palette("#ECEFF1", "#78909C", "#455A64"),
            new Palette("#E8F5E9", "#43A047", "#2E7D32")),
        kinds(new String[][] {
            {"sync", "#ECEFF1", "#607D8B", "#37474F"},
            {"prepare", "#FFF3E0", "#FF9800", "#E65100"},
            {"join", "#E3F2FD", "#2196F3", "#1565C0"},
            {"stack", "#F3E5F5", "#9C27B0", "#6A1B9A"},
            {"group", "#E8F5E9", "#4CAF50", "#2E7D32"},
            {"split", "#FCE4EC", "#E91E63", "#AD1457"},
            {"sort", "#FFFDE7", "#FFC107", "#FF8F00"},
            {"distinct", "#EFEBE9", "#795548", "#4E342E"},
            {"top-n", "#FFF8E1", "#FFB300", "#FF6F00"},
            {"sample", "#F1F8E9", "#8BC34A", "#558B2F"},
            {"pivot", "#E1F5FE", "#03A9F4", "#0277BD"},
            {"window", "#E0F7FA", "#00BCD4", "#00838F"},
            {"custom-code", "#E8EAF6", "#3F51B5", "#283593"},
            {"train", "#EDE7F6", "#673AB7", "#4527A0"},
            {"score", "#E0F2F1", "#009688", "#00695C"},
            {"evaluate", "#FBE9E7", "#FF5722", "#D84315"},
        }),
        new Palette("#F5F5F5", "#9E9E9E", "#616161"));

    public static final Theme DARK = new Theme("dark", "#1E1E1E", "#546E7A", FONT,
        roles(
            new Palette("#1E3A5F", "#4A90D9", "#90CAF9"),
            new Palette("#2D2D2D", "#78909C", "#B0BEC5"),
            new Palette("#1B3D1B", "#43A047", "#A5D6A7")),
        kinds(new String[][] {
            {"sync", "#263238", "#607D8B", "#90A4AE"},
            {"prepare", "#3E2723", "#FF9800", "#FFB74D"},
            {"join", "#1A237E", "#2196F3", "#64B5F6"},
            {"stack", "#4A148C", "#9C27B0", "#CE93D8"},
            {"group", "#1B5E20", "#4CAF50", "#81C784"},
            {"split", "#880E4F", "#E91E63", "#F48FB1"},
            {"sort", "#F57F17", "#FFC107", "#FFD54F"},
            {"distinct", "#3E2723", "#795548", "#A1887F"},
            {"top-n", "#E65100", "#FFB300", "#FFD54F"},
            {"sample", "#33691E", "#8BC34A", "#AED581"},
            {"pivot", "#01579B", "#03A9F4", "#4FC3F7"},
            {"window", "#006064", "#00BCD4", "#4DD0E1"},
            {"custom-code", "#1A237E", "#3F51B5", "#7986CB"},
            {"train", "#311B92", "#673AB7", "#B39DDB"},
            {"score", "#004D40", "#009688", "#80CBC4"},
            {"evaluate", "#BF360C", "#FF5722", "#FF8A65"},
        }),
        new Palette("#424242", "#9E9E9E", "#BDBDBD"));

    public Theme {
        datasets = Map.copyOf(datasets);
        recipes = Map.copyOf(recipes);
    }

    public Palette dataset(DatasetRole role) {
        return datasets.getOrDefault(role, fallback);
    }

    public Palette recipe(RecipeKind kind) {
        return recipes.getOrDefault(kind, fallback);
    }

    /**
     * @throws IllegalArgumentException for a name other than light or dark
     */
    public static Theme fromName(String name) {
        return switch (name == null ? "" : name.toLowerCase(Locale.ROOT)) {
            case "light", "dataiku-light" -> LIGHT;
            case "dark", "dataiku-dark" -> DARK;
            default -> throw new IllegalArgumentException("Unknown theme: " + name);
        };
    }

    private static Map<DatasetRole, Palette> roles(Palette input, Palette intermediate, Palette output) {
        Map<DatasetRole, Palette> map = new EnumMap<>(DatasetRole.class);
        map.put(DatasetRole.INPUT, input);
        map.put(DatasetRole.INTERMEDIATE, intermediate);
        map.put(DatasetRole.OUTPUT, output);
        return map;
    }

    private static Map<RecipeKind, Palette> kinds(String[][] rows) {
        Map<RecipeKind, Palette> map = new EnumMap<>(RecipeKind.class);
        for (String[] row : rows) {
            map.put(RecipeKind.fromValue(row[0]), new Palette(row[1], row[2], row[3]));
        }
        return map;
    }
}
