package dev.py2flow.engine;

import dev.py2flow.SampleFlows;
import dev.py2flow.model.ColumnLineage;
import dev.py2flow.model.Dataset;
import dev.py2flow.model.DatasetRole;
import dev.py2flow.model.FieldEffect;
import dev.py2flow.model.FieldRef;
import dev.py2flow.model.Flow;
import dev.py2flow.model.Recipe;
import dev.py2flow.model.RecipeKind;
import dev.py2flow.model.StepType;
import dev.py2flow.model.SubStep;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColumnLineageTracerTest {

    @Test
    void tracesAggregateBackToJoinedInput() {
        ColumnLineage lineage = ColumnLineageTracer.trace(SampleFlows.customerRevenue(), "revenue", "total_amount");

        assertThat(lineage.resolved()).isTrue();
        assertThat(lineage.origins()).containsExactly(new FieldRef("orders", "amount"));
        assertThat(lineage.chain()).singleElement().satisfies(hop -> {
            assertThat(hop.recipe()).isEqualTo("group_revenue");
            assertThat(hop.from()).containsExactly(new FieldRef("joined", "amount"));
            assertThat(hop.to()).isEqualTo(new FieldRef("revenue", "total_amount"));
        });
    }

    @Test
    void followsRenameThroughJoinKey() {
        ColumnLineage lineage = ColumnLineageTracer.trace(SampleFlows.customerRevenue(), "revenue", "customer_id");

        assertThat(lineage.resolved()).isTrue();
        assertThat(lineage.origins()).containsExactly(new FieldRef("customers", "id"));
        assertThat(lineage.chain()).singleElement().satisfies(hop -> {
            assertThat(hop.recipe()).isEqualTo("prepare_customers_clean");
            assertThat(hop.description()).isEqualTo("rename id -> customer_id");
            assertThat(hop.from()).containsExactly(new FieldRef("customers", "id"));
        });
    }

    @Test
    void fieldOnlyVariantPicksOutputCarryingField() {
        ColumnLineage lineage = SampleFlows.customerRevenue().getColumnLineage("total_amount");

        assertThat(lineage.target()).isEqualTo(new FieldRef("revenue", "total_amount"));
        assertThat(lineage.describe()).contains("origin: orders.amount");
    }

    @Test
    void inputFieldIsItsOwnOrigin() {
        ColumnLineage lineage = ColumnLineageTracer.trace(SampleFlows.customerRevenue(), "orders", "amount");

        assertThat(lineage.chain()).isEmpty();
        assertThat(lineage.origins()).containsExactly(new FieldRef("orders", "amount"));
    }

    @Test
    void opaqueStepLeavesLineageUnresolved() {
        var flow = new Flow("opaque");
        flow.addDataset(Dataset.of("raw", DatasetRole.INPUT));
        flow.addDataset(Dataset.of("renamed", DatasetRole.OUTPUT));
        flow.addRecipe(new Recipe("prepare_renamed", RecipeKind.PREPARE, List.of("raw"), List.of("renamed"),
            List.of(new SubStep(StepType.COLUMN_RENAMER, List.of("a", "b"), Map.of("mode", "positional"),
                List.of(FieldEffect.opaque("a"), FieldEffect.opaque("b")))),
            null, List.of(3)));

        ColumnLineage lineage = flow.getColumnLineage("renamed", "b");

        assertThat(lineage.resolved()).isFalse();
        assertThat(lineage.unresolvedReason()).contains("opaque step").contains("prepare_renamed");
        assertThat(lineage.describe()).contains("unresolved:");
    }

    @Test
    void customCodeLeavesLineageUnresolved() {
        var flow = new Flow("custom");
        flow.addDataset(Dataset.of("raw", DatasetRole.INPUT));
        flow.addDataset(Dataset.of("scored", DatasetRole.OUTPUT));
        flow.addRecipe(new Recipe("python_scored", RecipeKind.CUSTOM_CODE, List.of("raw"), List.of("scored"),
            List.of(SubStep.of(StepType.PYTHON_CODE, List.of())), "scored = score(raw)", List.of(5)));

        ColumnLineage lineage = ColumnLineageTracer.trace(flow, "scored", "value");

        assertThat(lineage.resolved()).isFalse();
        assertThat(lineage.unresolvedReason()).contains("Python recipe 'python_scored'");
    }

    @Test
    void fieldOnACycleIsUnresolved() {
        ColumnLineage lineage = ColumnLineageTracer.trace(SampleFlows.cyclic(), "a", "x");

        assertThat(lineage.resolved()).isFalse();
        assertThat(lineage.unresolvedReason()).contains("cycle");
        assertThat(lineage.origins()).isEmpty();
    }

    @Test
    void rejectsUnknownDataset() {
        assertThatThrownBy(() -> ColumnLineageTracer.trace(SampleFlows.customerRevenue(), "nope", "x"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown dataset: nope");
    }
}
