package dev.py2flow.render;

import dev.py2flow.SampleFlows;
import dev.py2flow.engine.CycleDetectedException;
import dev.py2flow.model.Flow;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowRenderersTest {

    private final Flow flow = SampleFlows.customerRevenue();

    @Test
    void asciiListsLayersConnectionsAndWarnings() {
        String text = FlowRenderers.render(flow, RenderFormat.ASCII);

        assertThat(text).startsWith("Flow: customer_revenue\n");
        assertThat(text).contains("Datasets: 5 (2 input, 2 intermediate, 1 output) | Recipes: 3");
        assertThat(text).contains("Layer 0\n  [IN]  customers  (3 fields)\n  [IN]  orders  (3 fields)\n");
        assertThat(text).contains("[OUT] revenue  (2 fields)");
        assertThat(text).contains("customers_clean + orders --> (JN) join_joined --> joined");
        assertThat(text).contains("  ! Line 9: could not convert 'df.plot()'");
    }

    @Test
    void compactAsciiFollowsBuildOrder() {
        String compact = new AsciiRenderer().renderCompact(flow);

        assertThat(compact.lines()).containsExactly(
            "customers --> (PR) prepare_customers_clean --> customers_clean",
            "customers_clean + orders --> (JN) join_joined --> joined",
            "joined --> (GR) group_revenue --> revenue");
    }

    @Test
    void svgHasOneGroupPerNode() {
        String svg = FlowRenderers.render(flow, RenderFormat.SVG, Theme.DARK);

        assertThat(svg).startsWith("<svg xmlns=\"http://www.w3.org/2000/svg\"");
        assertThat(svg).contains("<g class=\"node dataset input\" data-kind=\"dataset\" data-name=\"customers\">");
        assertThat(svg).contains("<g class=\"node recipe join\" data-kind=\"recipe\" data-name=\"join_joined\">");
        assertThat(svg.split("class=\"edge\"", -1)).hasSize(8);
        assertThat(svg).contains(Theme.DARK.background());
    }

    @Test
    void htmlEmbedsSvgAndModel() {
        String html = FlowRenderers.render(flow, RenderFormat.HTML);

        assertThat(html).startsWith("<!DOCTYPE html>");
        assertThat(html).contains("<title>customer_revenue</title>");
        assertThat(html).contains("<svg xmlns");
        assertThat(html).contains("<script type=\"application/json\" id=\"flow-model\">");
        assertThat(html).contains("group_revenue");
    }

    @Test
    void mermaidDeclaresNodesAndEdges() {
        String mermaid = FlowRenderers.render(flow, RenderFormat.MERMAID);

        assertThat(mermaid).startsWith("flowchart LR\n");
        assertThat(mermaid).contains("d0[\"customers\"]:::input");
        assertThat(mermaid).contains("r0((\"PR prepare_customers_clean\")):::recipe_prepare");
        assertThat(mermaid).contains("    d0 --> r0\n");
        assertThat(mermaid).contains("    r2 --> d4\n");
        assertThat(mermaid).contains("classDef output");
    }

    @Test
    void plantUmlDeclaresNodesAndEdges() {
        String uml = FlowRenderers.render(flow, RenderFormat.PLANTUML);

        assertThat(uml).startsWith("@startuml\n").endsWith("@enduml\n");
        assertThat(uml).contains("database \"orders\" as d1 <<input>>");
        assertThat(uml).contains("rectangle \"[JN] join_joined\" as r1 <<join>>");
        assertThat(uml).contains("d1 --> r1\n");
    }

    @Test
    void layeredFormatsRejectCycles() {
        Flow loop = SampleFlows.cyclic();

        assertThatThrownBy(() -> FlowRenderers.render(loop, RenderFormat.SVG))
            .isInstanceOf(CycleDetectedException.class);
        assertThat(FlowRenderers.render(loop, RenderFormat.MERMAID)).contains("r0 --> d1", "r1 --> d0");
        assertThat(FlowRenderers.render(loop, RenderFormat.PLANTUML)).contains("r1 --> d0");
    }

    @Test
    void layoutPlacesRecipesAfterTheirInputs() {
        FlowLayout layout = LayoutEngine.layout(flow);

        assertThat(layout.layers().get(0)).containsExactly("customers", "orders");
        assertThat(layout.layers().get(1)).containsExactly("prepare_customers_clean");
        assertThat(layout.layers().get(3)).containsExactly("join_joined");
        assertThat(layout.layers()).hasSize(7);
        assertThat(layout.width()).isEqualTo(2 * LayoutEngine.PADDING + 6 * LayoutEngine.LAYER_SPACING
            + LayoutEngine.DATASET_WIDTH);
    }
}
