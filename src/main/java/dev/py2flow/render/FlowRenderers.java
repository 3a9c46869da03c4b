package dev.py2flow.render;

import dev.py2flow.model.Flow;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Renderer lookup by format.
 */
public final class FlowRenderers {

    private FlowRenderers() {}

    public static FlowRenderer renderer(RenderFormat format, Theme theme) {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(theme, "theme");
        return all(theme).get(format);
    }

    public static String render(Flow flow, RenderFormat format) {
        return render(flow, format, Theme.LIGHT);
    }

    public static String render(Flow flow, RenderFormat format, Theme theme) {
        Objects.requireNonNull(flow, "flow");
        return renderer(format, theme).render(flow);
    }

    private static Map<RenderFormat, FlowRenderer> all(Theme theme) {
        Map<RenderFormat, FlowRenderer> renderers = new EnumMap<>(RenderFormat.class);
        var svg = new SvgRenderer(theme);
        renderers.put(RenderFormat.ASCII, new AsciiRenderer());
        renderers.put(RenderFormat.SVG, svg);
        renderers.put(RenderFormat.HTML, new HtmlRenderer(svg, theme));
        renderers.put(RenderFormat.MERMAID, new MermaidRenderer(theme));
        renderers.put(RenderFormat.PLANTUML, new PlantUmlRenderer(theme));
        return renderers;
    }
}
