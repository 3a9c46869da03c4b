package dev.py2flow.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.py2flow.model.Flow;
import dev.py2flow.serialization.FlowDocuments;

import java.io.UncheckedIOException;

/**
 * Self-contained interactive page: the SVG diagram with pan and zoom, and a
 * side panel showing the details of the clicked dataset or recipe.
 *
 * <p>The flow document is embedded as JSON so the page needs no server.</p>
 */
public final class HtmlRenderer implements FlowRenderer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SvgRenderer svg;
    private final Theme theme;

    public HtmlRenderer(SvgRenderer svg, Theme theme) {
        this.svg = svg;
        this.theme = theme;
    }

    @Override
    public RenderFormat format() {
        return RenderFormat.HTML;
    }

    @Override
    public String render(Flow flow) {
        String diagram = svg.render(flow);
        String model;
        try {
            model = MAPPER.writeValueAsString(FlowDocuments.toTree(MAPPER, flow));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
        boolean dark = theme == Theme.DARK;
        var sb = new StringBuilder();
        sb.append("<!DOCTYPE html>\n");
        sb.append("<html lang=\"en\">\n<head>\n<meta charset=\"utf-8\">\n");
        sb.append("<title>").append(Markup.xml(flow.name())).append("</title>\n");
        sb.append("<style>\n");
        sb.append("  body { margin: 0; display: flex; height: 100vh; font-family: ")
            .append(theme.fontFamily()).append("; background: ").append(theme.background())
            .append("; color: ").append(dark ? "#E0E0E0" : "#212121").append("; }\n");
        sb.append("  #canvas { flex: 1; overflow: hidden; cursor: grab; }\n");
        sb.append("  #canvas.dragging { cursor: grabbing; }\n");
        sb.append("  #canvas svg { transform-origin: 0 0; }\n");
        sb.append("  #details { width: 320px; padding: 16px; overflow-y: auto; border-left: 1px solid ")
            .append(theme.edge()).append("; font-size: 13px; }\n");
        sb.append("  #details h2 { font-size: 16px; margin-top: 0; }\n");
        sb.append("  #details pre { white-space: pre-wrap; font-size: 12px; }\n");
        sb.append("  .node { cursor: pointer; }\n");
        sb.append("  .node.selected rect, .node.selected circle { stroke-width: 4; }\n");
        sb.append("</style>\n</head>\n<body>\n");
        sb.append("<div id=\"canvas\">\n").append(diagram).append("</div>\n");
        sb.append("<aside id=\"details\"><h2>").append(Markup.xml(flow.name())).append("</h2>")
            .append("<p>%d datasets, %d recipes. Click a node for details; drag to pan, scroll to zoom.</p>"
                .formatted(flow.datasets().size(), flow.recipes().size()))
            .append("</aside>\n");
        sb.append("<script type=\"application/json\" id=\"flow-model\">")
            .append(model.replace("</", "<\\/"))
            .append("</script>\n");
        sb.append("<script>\n").append(SCRIPT).append("</script>\n");
        sb.append("</body>\n</html>\n");
        return sb.toString();
    }

    private static final String SCRIPT = """
        (function () {
          const model = JSON.parse(document.getElementById('flow-model').textContent);
          const canvas = document.getElementById('canvas');
          const svg = canvas.querySelector('svg');
          const details = document.getElementById('details');
          let scale = 1, x = 0, y = 0, drag = null;

          function apply() {
            svg.style.transform = 'translate(' + x + 'px,' + y + 'px) scale(' + scale + ')';
          }
          canvas.addEventListener('wheel', function (e) {
            e.preventDefault();
            const factor = e.deltaY < 0 ? 1.1 : 1 / 1.1;
            scale = Math.min(4, Math.max(0.2, scale * factor));
            apply();
          }, { passive: false });
          canvas.addEventListener('mousedown', function (e) {
            drag = { x: e.clientX - x, y: e.clientY - y };
            canvas.classList.add('dragging');
          });
          window.addEventListener('mousemove', function (e) {
            if (drag) { x = e.clientX - drag.x; y = e.clientY - drag.y; apply(); }
          });
          window.addEventListener('mouseup', function () {
            drag = null;
            canvas.classList.remove('dragging');
          });

          function text(value) {
            const span = document.createElement('span');
            span.textContent = value == null ? '' : String(value);
            return span.innerHTML;
          }
          function list(items) {
            return items && items.length ? items.map(text).join(', ') : '-';
          }
          function showDataset(d) {
            const fields = (d.schema || []).map(function (f) { return text(f.name) + ': ' + text(f.type); });
            details.innerHTML = '<h2>' + text(d.name) + '</h2>'
              + '<p>Dataset, ' + text(d.role) + '</p>'
              + (d.location ? '<p>Location: ' + text(d.location) + '</p>' : '')
              + (d.source_line ? '<p>Line ' + text(d.source_line) + '</p>' : '')
              + '<p>Schema: ' + (fields.length ? fields.join(', ') : 'unknown') + '</p>';
          }
          function showRecipe(r) {
            const steps = (r.steps || []).map(function (s) {
              return '<li>' + text(s.processor) + (s.columns ? ' (' + list(s.columns) + ')' : '') + '</li>';
            });
            details.innerHTML = '<h2>' + text(r.name) + '</h2>'
              + '<p>Recipe, ' + text(r.kind) + '</p>'
              + '<p>Inputs: ' + list(r.inputs) + '<br>Outputs: ' + list(r.outputs) + '</p>'
              + (steps.length ? '<ol>' + steps.join('') + '</ol>' : '')
              + (r.code ? '<pre>' + text(r.code) + '</pre>' : '');
          }
          svg.querySelectorAll('.node').forEach(function (node) {
            node.addEventListener('mousedown', function (e) { e.stopPropagation(); });
            node.addEventListener('click', function () {
              svg.querySelectorAll('.node.selected').forEach(function (n) { n.classList.remove('selected'); });
              node.classList.add('selected');
              const name = node.getAttribute('data-name');
              if (node.getAttribute('data-kind') === 'dataset') {
                showDataset(model.datasets.find(function (d) { return d.name === name; }));
              } else {
                showRecipe(model.recipes.find(function (r) { return r.name === name; }));
              }
            });
          });
        })();
        """;
}
