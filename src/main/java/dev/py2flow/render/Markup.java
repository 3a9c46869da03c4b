package dev.py2flow.render;

import dev.py2flow.model.Flow;

/**
 * Escaping and node ids shared by the text-based renderers.
 */
final class Markup {

    private Markup() {}

    static String xml(String text) {
        if (text == null) {
            return "";
        }
        var sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#39;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /** Diagram-safe id; creation positions keep ids unique whatever the names contain. */
    static String datasetId(Flow flow, String dataset) {
        return "d" + flow.datasetPosition(dataset);
    }

    static String recipeId(Flow flow, String recipe) {
        return "r" + flow.recipePosition(recipe);
    }

    static String quoted(String text) {
        return text.replace("\"", "'");
    }

    static String truncate(String text, int max) {
        if (text.length() <= max) {
            return text;
        }
        return text.substring(0, max - 3) + "...";
    }
}
