package dev.py2flow.engine;

import dev.py2flow.analyzer.AnalysisResult;
import dev.py2flow.analyzer.Operation;
import dev.py2flow.analyzer.Origin;
import dev.py2flow.analyzer.PatternAnalyzer;
import dev.py2flow.config.Py2FlowConfig;
import dev.py2flow.model.Dataset;
import dev.py2flow.model.DatasetRole;
import dev.py2flow.model.Flow;
import dev.py2flow.model.Recipe;
import dev.py2flow.model.RecipeKind;
import dev.py2flow.model.StepType;
import dev.py2flow.model.SubStep;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowBuilderTest {

    private static final String CUSTOMER_SCRIPT = """
        import pandas as pd
        customers = pd.read_csv('data/customers.csv')
        orders = pd.read_csv('data/orders.csv')
        customers = customers.dropna(subset=['email'])
        merged = customers.merge(orders, on='customer_id')
        summary = merged.groupby('region').agg({'amount': 'sum', 'customer_id': 'nunique'}).reset_index()
        summary.to_csv('output/summary.csv', index=False)
        """;

    private static Flow build(String script) {
        Py2FlowConfig config = Py2FlowConfig.defaults();
        AnalysisResult result = new PatternAnalyzer().analyze(script, config);
        return FlowBuilder.build(result, config);
    }

    @Test
    void buildsReadCleanJoinGroupWritePipeline() {
        Flow flow = build(CUSTOMER_SCRIPT);

        assertThat(flow.datasetsWithRole(DatasetRole.INPUT)).extracting(Dataset::name)
            .containsExactly("customers", "orders");
        assertThat(flow.datasetsWithRole(DatasetRole.OUTPUT)).extracting(Dataset::name)
            .containsExactly("summary");
        assertThat(flow.datasetsWithRole(DatasetRole.INTERMEDIATE)).extracting(Dataset::name)
            .containsExactly("customers_2", "orders_2", "customers_3", "merged", "summary_grouped");
        assertThat(flow.recipesOfKind(RecipeKind.JOIN)).hasSize(1);
        assertThat(flow.recipesOfKind(RecipeKind.GROUP)).hasSize(1);

        List<RecipeKind> order = flow.graph().topologicalSort().stream().map(Recipe::kind).toList();
        assertThat(order).containsExactly(RecipeKind.SYNC, RecipeKind.SYNC, RecipeKind.PREPARE, RecipeKind.JOIN,
            RecipeKind.GROUP, RecipeKind.SYNC);
        assertThat(flow.validate()).isEmpty();
        assertThat(flow.warnings()).isEmpty();
    }

    @Test
    void wiresJoinAndGroupDetails() {
        Flow flow = build(CUSTOMER_SCRIPT);

        Recipe join = flow.recipesOfKind(RecipeKind.JOIN).get(0);
        assertThat(join.name()).isEqualTo("join_merged");
        assertThat(join.inputs()).containsExactly("customers_3", "orders_2");
        assertThat(join.steps().get(0).columns()).containsExactly("customer_id");
        assertThat(join.steps().get(0).param("type")).isEqualTo("INNER");

        Recipe group = flow.recipesOfKind(RecipeKind.GROUP).get(0);
        assertThat(group.steps()).extracting(SubStep::type)
            .containsExactly(StepType.GROUP_KEYS, StepType.AGGREGATE, StepType.AGGREGATE);
        assertThat(group.steps().get(2).param("function")).isEqualTo("COUNT_DISTINCT");
        assertThat(flow.dataset("summary_grouped").orElseThrow().fieldNames())
            .containsExactly("region", "amount", "customer_id");
        assertThat(group.sourceLines()).containsExactly(6);

        Dataset output = flow.dataset("summary").orElseThrow();
        assertThat(output.location()).isEqualTo("output/summary.csv");
        assertThat(output.sourceVariable()).isEqualTo("summary");
    }

    @Test
    void reassigningVariableChainsFreshDatasets() {
        Flow flow = build("""
            import pandas as pd
            df = pd.read_csv('events.csv')
            df = df.dropna()
            df = df.drop_duplicates()
            df.to_csv('clean_events.csv')
            """);

        assertThat(flow.graph().hasCycles()).isFalse();
        assertThat(flow.recipes()).allSatisfy(r -> assertThat(r.inputs()).doesNotContainAnyElementsOf(r.outputs()));
        assertThat(flow.datasetsWithRole(DatasetRole.INTERMEDIATE)).extracting(Dataset::name)
            .containsExactly("df", "df_2", "df_3");
        assertThat(flow.graph().path("events", "clean_events")).containsExactly(
            "events", "sync_df", "df", "prepare_df_2", "df_2", "distinct_df_3", "df_3", "sync_clean_events",
            "clean_events");
    }

    @Test
    void batchesChainedPrepareStepsOfOneStatement() {
        Flow flow = build("""
            import pandas as pd
            df = pd.read_csv('events.csv')
            df = df.dropna().fillna(0)
            """);

        assertThat(flow.recipesOfKind(RecipeKind.PREPARE)).singleElement().satisfies(recipe -> {
            assertThat(recipe.steps()).extracting(SubStep::type)
                .containsExactly(StepType.REMOVE_ROWS_ON_EMPTY, StepType.FILL_EMPTY);
            assertThat(recipe.sourceLines()).containsExactly(3);
        });
        assertThat(flow.datasetsWithRole(DatasetRole.OUTPUT)).extracting(Dataset::name).containsExactly("df_2");
    }

    @Test
    void unsupportedCallBecomesWarningWhileRestIsConverted() {
        Flow flow = build("""
            import pandas as pd
            df = pd.read_csv('a.csv')
            weird = df.frobnicate(3)
            df = df.sort_values('a')
            df.to_csv('b.csv')
            """);

        assertThat(flow.recipes()).extracting(Recipe::kind)
            .containsExactly(RecipeKind.SYNC, RecipeKind.CUSTOM_CODE, RecipeKind.SORT, RecipeKind.SYNC);
        assertThat(flow.warnings()).containsExactly(
            "Line 3: could not convert 'df.frobnicate(3)' (no idiom for '.frobnicate()')");
        assertThat(flow.recipe("python_weird").orElseThrow().code()).isEqualTo("weird = df.frobnicate(3)");
    }

    @Test
    void unsupportedReassignmentStillFeedsLaterRecipes() {
        Flow flow = build("""
            import pandas as pd
            df = pd.read_csv('a.csv')
            df = df.frobnicate(3)
            df2 = df.dropna()
            df2.to_csv('b.csv')
            """);

        assertThat(flow.recipes()).extracting(Recipe::name)
            .containsExactly("sync_df", "python_df_2", "prepare_df2", "sync_b");
        assertThat(flow.warnings()).hasSize(1);
        assertThat(flow.graph().path("a", "b")).containsExactly(
            "a", "sync_df", "df", "python_df_2", "df_2", "prepare_df2", "df2", "sync_b", "b");
    }

    @Test
    void samePathReadTwiceIsOneInput() {
        Flow flow = build("""
            import pandas as pd
            a = pd.read_csv('data/events.csv')
            b = pd.read_csv('data/events.csv')
            both = pd.concat([a, b])
            both.to_csv('out.csv')
            """);

        assertThat(flow.datasetsWithRole(DatasetRole.INPUT)).extracting(Dataset::name).containsExactly("events");
        assertThat(flow.graph().consumers("events")).extracting(Recipe::name).containsExactly("sync_a", "sync_b");
        assertThat(flow.validate()).isEmpty();
    }

    @Test
    void readUsecolsBecomesSchema() {
        Flow flow = build("""
            import pandas as pd
            df = pd.read_csv('a.csv', usecols=['id', 'amount'])
            """);

        assertThat(flow.dataset("a").orElseThrow().fieldNames()).containsExactly("id", "amount");
        assertThat(flow.dataset("df").orElseThrow().fieldNames()).containsExactly("id", "amount");
    }

    @Test
    void buildIsDeterministic() {
        assertThat(build(CUSTOMER_SCRIPT)).isEqualTo(build(CUSTOMER_SCRIPT));
        assertThat(build(CUSTOMER_SCRIPT).toJson()).isEqualTo(build(CUSTOMER_SCRIPT).toJson());
    }

    @Test
    void appliesConfiguredFlowNameAndDatasetAffixes() {
        var config = new Py2FlowConfig(null, null, "sales", true, 1, null, null, "raw_", "_v1", 0);
        AnalysisResult result = new PatternAnalyzer().analyze("df = pd.read_csv('a.csv')\n", config);

        Flow flow = FlowBuilder.build(result, config);

        assertThat(flow.name()).isEqualTo("sales");
        assertThat(flow.datasets()).extracting(Dataset::name).containsExactly("raw_a_v1", "raw_df_v1");
    }

    @Test
    void rejectsUnboundVariable() {
        var filter = new Operation.Filter(new Origin(1, 4, "x = ghost.dropna()"), "ghost", "x",
            SubStep.of(StepType.REMOVE_ROWS_ON_EMPTY, List.of()));

        assertThatThrownBy(() -> new FlowBuilder(Py2FlowConfig.defaults()).build(List.of(filter)))
            .isInstanceOf(DanglingReferenceException.class)
            .hasMessageContaining("line 4")
            .hasMessageContaining("'ghost'");
    }

    @Test
    void builderIsSingleUse() {
        var builder = new FlowBuilder(Py2FlowConfig.defaults());
        builder.build(List.of());

        assertThatThrownBy(() -> builder.build(List.of())).isInstanceOf(IllegalStateException.class);
    }
}
