package dev.py2flow.engine;

import dev.py2flow.SampleFlows;
import dev.py2flow.model.Dataset;
import dev.py2flow.model.DatasetRole;
import dev.py2flow.model.Flow;
import dev.py2flow.model.Recipe;
import dev.py2flow.model.RecipeKind;
import dev.py2flow.model.Recommendation;
import dev.py2flow.model.StepType;
import dev.py2flow.model.SubStep;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FlowOptimizerTest {

    /** src -> prepare_mid -> mid -> prepare_out -> out */
    private static Flow twoPrepares() {
        var flow = new Flow("prepares");
        flow.addDataset(Dataset.of("src", DatasetRole.INPUT));
        flow.addDataset(Dataset.of("mid", DatasetRole.INTERMEDIATE));
        flow.addDataset(Dataset.of("out", DatasetRole.OUTPUT));
        flow.addRecipe(new Recipe("prepare_mid", RecipeKind.PREPARE, List.of("src"), List.of("mid"),
            List.of(SubStep.of(StepType.REMOVE_ROWS_ON_EMPTY, List.of("email"))), null, List.of(3)));
        flow.addRecipe(new Recipe("prepare_out", RecipeKind.PREPARE, List.of("mid"), List.of("out"),
            List.of(SubStep.of(StepType.COLUMN_DELETER, List.of("tmp"))), null, List.of(4)));
        return flow;
    }

    @Test
    void levelOneMergesChainedPrepareRecipes() {
        Flow original = twoPrepares();

        OptimizationResult result = FlowOptimizer.optimize(original, 1);

        Flow flow = result.flow();
        assertThat(flow.recipes()).singleElement().satisfies(recipe -> {
            assertThat(recipe.name()).isEqualTo("prepare_out");
            assertThat(recipe.inputs()).containsExactly("src");
            assertThat(recipe.outputs()).containsExactly("out");
            assertThat(recipe.steps()).extracting(SubStep::type)
                .containsExactly(StepType.REMOVE_ROWS_ON_EMPTY, StepType.COLUMN_DELETER);
            assertThat(recipe.sourceLines()).containsExactly(3, 4);
        });
        assertThat(flow.dataset("mid")).isEmpty();
        assertThat(result.recipesMerged()).isEqualTo(1);
        assertThat(result.datasetsRemoved()).isEqualTo(1);
        assertThat(result.changed()).isTrue();
        assertThat(flow.optimizationNotes()).containsExactly(
            "Merged prepare recipe 'prepare_mid' into 'prepare_out'", "Removed intermediate dataset 'mid'");
        assertThat(original.recipes()).hasSize(2);
    }

    @Test
    void levelZeroLeavesFlowUnchanged() {
        OptimizationResult result = FlowOptimizer.optimize(twoPrepares(), 0);

        assertThat(result.changed()).isFalse();
        assertThat(result.flow()).isEqualTo(twoPrepares());
    }

    @Test
    void keepsIntermediateWithSeveralReaders() {
        Flow flow = twoPrepares();
        flow.addDataset(Dataset.of("other", DatasetRole.OUTPUT));
        flow.addRecipe(new Recipe("sort_other", RecipeKind.SORT, List.of("mid"), List.of("other"), null, null, null));

        OptimizationResult result = FlowOptimizer.optimize(flow, 1);

        assertThat(result.changed()).isFalse();
        assertThat(result.flow().recipes()).hasSize(3);
    }

    @Test
    void doesNotMergeAcrossOtherRecipeKinds() {
        OptimizationResult result = FlowOptimizer.optimize(SampleFlows.customerRevenue(), 1);

        assertThat(result.changed()).isFalse();
        assertThat(result.flow()).isEqualTo(SampleFlows.customerRevenue());
    }

    @Test
    void levelTwoAddsPerformanceHints() {
        Flow flow = SampleFlows.customerRevenue();
        flow.addDataset(Dataset.of("big_orders", DatasetRole.OUTPUT));
        flow.addRecipe(new Recipe("prepare_big_orders", RecipeKind.PREPARE, List.of("joined"), List.of("big_orders"),
            List.of(SubStep.of(StepType.FILTER_ON_FORMULA, List.of("amount"))), null, List.of(8)));

        OptimizationResult result = FlowOptimizer.optimize(flow, 2);

        assertThat(result.recommendationsAdded()).isEqualTo(1);
        assertThat(result.flow().recommendations()).singleElement().satisfies(r -> {
            assertThat(r.type()).isEqualTo("PERFORMANCE");
            assertThat(r.recipe()).isEqualTo("prepare_big_orders");
            assertThat(r.message()).contains("join 'join_joined'");
        });
        assertThat(FlowOptimizer.optimize(flow, 1).flow().recommendations()).isEmpty();
    }

    @Test
    void keepsExistingRecommendationsAndWarnings() {
        Flow flow = twoPrepares();
        flow.addWarning("Line 9: could not convert 'x' (y)");
        flow.addRecommendation(new Recommendation("PYTHON_FALLBACK", null, "rewrite it", "prepare_out"));

        Flow optimized = FlowOptimizer.optimize(flow, 1).flow();

        assertThat(optimized.warnings()).containsExactly("Line 9: could not convert 'x' (y)");
        assertThat(optimized.recommendations()).extracting(Recommendation::priority).containsExactly("MEDIUM");
    }
}
