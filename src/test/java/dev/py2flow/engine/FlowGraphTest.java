package dev.py2flow.engine;

import dev.py2flow.SampleFlows;
import dev.py2flow.model.Dataset;
import dev.py2flow.model.DatasetRole;
import dev.py2flow.model.Flow;
import dev.py2flow.model.Recipe;
import dev.py2flow.model.RecipeKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowGraphTest {

    @Test
    void sortsRecipesInDependencyOrder() {
        FlowGraph graph = SampleFlows.customerRevenue().graph();

        assertThat(graph.topologicalSort()).extracting(Recipe::name)
            .containsExactly("prepare_customers_clean", "join_joined", "group_revenue");
    }

    @Test
    void breaksTiesByCreationOrder() {
        var flow = new Flow("ties");
        flow.addDataset(Dataset.of("src", DatasetRole.INPUT));
        flow.addDataset(Dataset.of("x", DatasetRole.OUTPUT));
        flow.addDataset(Dataset.of("y", DatasetRole.OUTPUT));
        flow.addRecipe(new Recipe("sort_y", RecipeKind.SORT, List.of("src"), List.of("y"), null, null, null));
        flow.addRecipe(new Recipe("distinct_x", RecipeKind.DISTINCT, List.of("src"), List.of("x"), null, null, null));

        assertThat(flow.graph().topologicalSort()).extracting(Recipe::name).containsExactly("sort_y", "distinct_x");
    }

    @Test
    void answersNeighbourhoodQueries() {
        FlowGraph graph = SampleFlows.customerRevenue().graph();

        assertThat(graph.producer("joined")).map(Recipe::name).contains("join_joined");
        assertThat(graph.producer("orders")).isEmpty();
        assertThat(graph.consumers("orders")).extracting(Recipe::name).containsExactly("join_joined");
        assertThat(graph.roots()).extracting(Dataset::name).containsExactly("customers", "orders");
        assertThat(graph.leaves()).extracting(Dataset::name).containsExactly("revenue");
        assertThat(graph.upstream("group_revenue")).extracting(Recipe::name)
            .containsExactly("prepare_customers_clean", "join_joined");
        assertThat(graph.downstream("prepare_customers_clean")).extracting(Recipe::name)
            .containsExactly("join_joined", "group_revenue");
    }

    @Test
    void findsShortestPath() {
        FlowGraph graph = SampleFlows.customerRevenue().graph();

        assertThat(graph.path("orders", "revenue"))
            .containsExactly("orders", "join_joined", "joined", "group_revenue", "revenue");
        assertThat(graph.path("revenue", "orders")).isEmpty();
        assertThat(graph.path("orders", "orders")).containsExactly("orders");
        assertThatThrownBy(() -> graph.path("orders", "nowhere")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void acyclicFlowHasNoCycles() {
        FlowGraph graph = SampleFlows.customerRevenue().graph();

        assertThat(graph.detectCycles()).isEmpty();
        assertThat(graph.hasCycles()).isFalse();
    }

    @Test
    void reportsCycleAsClosedWalk() {
        FlowGraph graph = SampleFlows.cyclic().graph();

        List<List<FlowEdge>> cycles = graph.detectCycles();

        assertThat(cycles).singleElement().satisfies(cycle -> {
            assertThat(cycle).hasSize(4);
            assertThat(cycle.get(0).from()).isEqualTo(FlowNode.dataset("a"));
            assertThat(cycle.get(cycle.size() - 1).to()).isEqualTo(FlowNode.dataset("a"));
        });
    }

    @Test
    void topologicalSortRefusesCycles() {
        FlowGraph graph = SampleFlows.cyclic().graph();

        assertThatThrownBy(graph::topologicalSort)
            .isInstanceOf(CycleDetectedException.class)
            .hasMessageContaining("a -> prepare_b -> b -> prepare_a -> a")
            .satisfies(e -> {
                var cycle = (CycleDetectedException) e;
                assertThat(cycle.getErrorCode()).isEqualTo("CYCLE_DETECTED");
                assertThat(cycle.getCycles()).hasSize(1);
            });
    }

    @Test
    void splitsDisconnectedParts() {
        Flow flow = SampleFlows.customerRevenue();
        flow.addDataset(Dataset.of("lookup", DatasetRole.INPUT));
        flow.addDataset(Dataset.of("lookup_sorted", DatasetRole.OUTPUT));
        flow.addRecipe(new Recipe("sort_lookup_sorted", RecipeKind.SORT, List.of("lookup"), List.of("lookup_sorted"),
            null, null, null));

        List<FlowComponent> components = flow.graph().findDisconnectedSubgraphs();

        assertThat(components).hasSize(2);
        assertThat(components.get(0).datasets()).contains("customers", "revenue");
        assertThat(components.get(1).datasets()).containsExactly("lookup", "lookup_sorted");
        assertThat(components.get(1).recipes()).containsExactly("sort_lookup_sorted");
        assertThat(flow.graph().isConnected()).isFalse();
        assertThat(SampleFlows.customerRevenue().graph().isConnected()).isTrue();
    }
}
