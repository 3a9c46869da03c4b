package dev.py2flow.model;

import dev.py2flow.SampleFlows;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowTest {

    @TempDir
    Path tempDir;

    @Test
    void rejectsDuplicateNamesAndUnknownReferences() {
        var flow = new Flow("f");
        flow.addDataset(Dataset.of("a", DatasetRole.INPUT));

        assertThatThrownBy(() -> flow.addDataset(Dataset.of("a", DatasetRole.OUTPUT)))
            .hasMessage("Duplicate dataset name: a");
        assertThatThrownBy(() -> flow.addRecipe(new Recipe("prepare_b", RecipeKind.PREPARE, List.of("a"),
            List.of("b"), List.of(), null, List.of())))
            .hasMessage("Recipe 'prepare_b' references unknown dataset 'b'");
    }

    @Test
    void onlySyncRecipesMayHaveNoInput() {
        var flow = new Flow("f");
        flow.addDataset(Dataset.of("a", DatasetRole.OUTPUT));

        assertThatThrownBy(() -> flow.addRecipe(new Recipe("prepare_a", RecipeKind.PREPARE, List.of(),
            List.of("a"), List.of(), null, List.of())))
            .hasMessageContaining("has no input");
        flow.addRecipe(new Recipe("sync_a", RecipeKind.SYNC, List.of(), List.of("a"), List.of(), null, List.of()));
        assertThat(flow.recipes()).hasSize(1);
    }

    @Test
    void replaceKeepsPosition() {
        Flow flow = SampleFlows.customerRevenue();

        flow.replaceDataset(flow.dataset("orders").orElseThrow().withSchema(SampleFlows.schema("order_id")));

        assertThat(flow.datasetPosition("orders")).isEqualTo(1);
        assertThat(flow.dataset("orders").orElseThrow().fieldNames()).containsExactly("order_id");
        assertThatThrownBy(() -> flow.replaceDataset(Dataset.of("nope", DatasetRole.INPUT)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void summaryCountsRolesAndKinds() {
        Map<String, Object> summary = SampleFlows.customerRevenue().summary();

        assertThat(summary).containsEntry("total_datasets", 5).containsEntry("total_recipes", 3)
            .containsEntry("warnings", 1);
        assertThat(summary.get("datasets_by_role")).isEqualTo(Map.of("input", 2, "intermediate", 2, "output", 1));
        assertThat(summary.get("recipes_by_kind")).isEqualTo(Map.of("prepare", 1, "join", 1, "group", 1));
    }

    @Test
    void equalFlowsAreBuiltTheSameWay() {
        assertThat(SampleFlows.customerRevenue()).isEqualTo(SampleFlows.customerRevenue())
            .hasSameHashCodeAs(SampleFlows.customerRevenue());
        assertThat(SampleFlows.customerRevenue()).isNotEqualTo(SampleFlows.cyclic());
    }

    @Test
    void writesSvgFile() throws IOException {
        Path svg = SampleFlows.customerRevenue().toSvg(tempDir.resolve("flow.svg"));

        assertThat(svg).content().startsWith("<svg");
        assertThat(SampleFlows.customerRevenue().visualize("text")).startsWith("Flow: customer_revenue");
    }

    @Test
    void recipeKindsParseFromSerializedNames() {
        assertThat(RecipeKind.fromValue("top-n")).isEqualTo(RecipeKind.TOP_N);
        assertThat(RecipeKind.fromValue("custom-code").dssType()).isEqualTo("python");
        assertThatThrownBy(() -> RecipeKind.fromValue("nope")).isInstanceOf(IllegalArgumentException.class);
    }
}
