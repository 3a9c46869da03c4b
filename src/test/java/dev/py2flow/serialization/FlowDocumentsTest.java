package dev.py2flow.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.py2flow.Py2Flow;
import dev.py2flow.SampleFlows;
import dev.py2flow.model.Flow;
import dev.py2flow.model.Recipe;
import dev.py2flow.model.RecipeKind;
import dev.py2flow.model.Recommendation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowDocumentsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static Flow sample() {
        Flow flow = SampleFlows.customerRevenue();
        flow.addRecommendation(new Recommendation("PERFORMANCE", "LOW", "filter earlier", "join_joined"));
        flow.addOptimizationNote("Merged prepare recipe 'a' into 'b'");
        return flow;
    }

    @Test
    void jsonRoundTripKeepsEverything() {
        Flow flow = sample();

        assertThat(FlowDocuments.fromJson(FlowDocuments.toJson(flow))).isEqualTo(flow);
    }

    @Test
    void yamlRoundTripKeepsEverything() {
        Flow flow = sample();

        assertThat(Flow.fromYaml(flow.toYaml())).isEqualTo(flow);
    }

    @Test
    void writesKeysInFixedOrder() throws Exception {
        JsonNode root = MAPPER.readTree(sample().toJson());

        List<String> keys = new ArrayList<>();
        root.fieldNames().forEachRemaining(keys::add);
        assertThat(keys).containsExactly("flow_name", "total_datasets", "total_recipes", "datasets", "recipes",
            "warnings", "recommendations", "optimization_notes");
        assertThat(root.get("total_datasets").asInt()).isEqualTo(5);
        assertThat(root.get("total_recipes").asInt()).isEqualTo(3);
    }

    @Test
    void writesRecipeAndDatasetShapes() throws Exception {
        JsonNode root = MAPPER.readTree(sample().toJson());

        JsonNode customers = root.get("datasets").get(0);
        assertThat(customers.get("role").asText()).isEqualTo("input");
        assertThat(customers.get("location").asText()).isEqualTo("data/customers.csv");
        assertThat(customers.get("schema").get(0).get("name").asText()).isEqualTo("id");

        JsonNode joined = root.get("datasets").get(3);
        assertThat(joined.has("location")).isFalse();
        assertThat(joined.has("format_hint")).isFalse();

        JsonNode prepare = root.get("recipes").get(0);
        assertThat(prepare.get("kind").asText()).isEqualTo("prepare");
        JsonNode rename = prepare.get("steps").get(1);
        assertThat(rename.get("processor").asText()).isEqualTo("ColumnRenamer");
        assertThat(rename.get("effects").get(0).get("kind").asText()).isEqualTo("rename");
        assertThat(rename.get("effects").get(0).get("sources").get(0).asText()).isEqualTo("id");
        assertThat(prepare.get("source_lines").toString()).isEqualTo("[4,5]");
        assertThat(prepare.has("code")).isFalse();
    }

    @Test
    void rejectsUnparsableText() {
        assertThatThrownBy(() -> FlowDocuments.fromJson("{not json"))
            .isInstanceOf(SerializationFormatException.class)
            .satisfies(e -> assertThat(((SerializationFormatException) e).getPath()).isEqualTo("$"));
    }

    @Test
    void rejectsNonObjectDocument() {
        assertThatThrownBy(() -> FlowDocuments.fromJson("[1, 2]"))
            .isInstanceOf(SerializationFormatException.class)
            .hasMessage("$: expected an object");
    }

    @Test
    void reportsPathOfUnknownRecipeKind() {
        String json = sample().toJson().replace("\"kind\" : \"join\"", "\"kind\" : \"merge\"");

        assertThatThrownBy(() -> FlowDocuments.fromJson(json))
            .isInstanceOf(SerializationFormatException.class)
            .satisfies(e -> assertThat(((SerializationFormatException) e).getPath()).isEqualTo("$.recipes[1].kind"))
            .hasMessageContaining("merge");
    }

    @Test
    void reportsTotalsMismatch() {
        String json = sample().toJson().replace("\"total_recipes\" : 3", "\"total_recipes\" : 4");

        assertThatThrownBy(() -> FlowDocuments.fromJson(json))
            .isInstanceOf(SerializationFormatException.class)
            .hasMessage("$.total_recipes: declares 4 but the document has 3");
    }

    @Test
    void reportsDanglingRecipeReference() {
        String json = """
            {"flow_name": "f",
             "datasets": [{"name": "a", "role": "input"}],
             "recipes": [{"name": "sort_b", "kind": "sort", "inputs": ["a"], "outputs": ["b"]}]}
            """;

        assertThatThrownBy(() -> FlowDocuments.fromJson(json))
            .isInstanceOf(SerializationFormatException.class)
            .hasMessage("$.recipes[0]: Recipe 'sort_b' references unknown dataset 'b'");
    }

    @Test
    void reportsMissingRequiredField() {
        assertThatThrownBy(() -> FlowDocuments.fromYaml("datasets: []\nrecipes: []\n"))
            .isInstanceOf(SerializationFormatException.class)
            .hasMessage("$.flow_name: missing required field");
    }

    @Test
    void readsMinimalDocument() {
        Flow flow = FlowDocuments.fromYaml("""
            flow_name: tiny
            datasets:
              - name: a
                role: input
              - name: b
                role: output
            recipes:
              - name: sort_b
                kind: sort
                inputs: [a]
                outputs: [b]
                steps:
                  - processor: Sort
                    columns: [x]
                    params: {order: desc}
            """);

        assertThat(flow.recipes()).singleElement().satisfies(recipe -> {
            assertThat(recipe.steps().get(0).param("order")).isEqualTo("desc");
            assertThat(recipe.sourceLines()).isEmpty();
        });
        assertThat(flow.warnings()).isEmpty();
    }

    @Test
    void rejectsDatasetNameWithPathSeparators() {
        String json = """
            {"flow_name": "f",
             "datasets": [{"name": "a", "role": "input"}, {"name": "../../escaped", "role": "output"}],
             "recipes": []}
            """;

        assertThatThrownBy(() -> FlowDocuments.fromJson(json))
            .isInstanceOf(SerializationFormatException.class)
            .satisfies(e -> assertThat(((SerializationFormatException) e).getPath()).isEqualTo("$.datasets[1].name"))
            .hasMessageContaining("../../escaped");
    }

    @Test
    void rejectsRecipeNameWithPathSeparators() {
        String yaml = """
            flow_name: f
            datasets:
              - name: a
                role: input
              - name: b
                role: output
            recipes:
              - name: ../sort_b
                kind: sort
                inputs: [a]
                outputs: [b]
            """;

        assertThatThrownBy(() -> FlowDocuments.fromYaml(yaml))
            .isInstanceOf(SerializationFormatException.class)
            .satisfies(e -> assertThat(((SerializationFormatException) e).getPath()).isEqualTo("$.recipes[0].name"));
    }

    static Stream<Arguments> convertedScripts() {
        return Stream.of(
            Arguments.of("""
                import pandas as pd
                from sklearn.model_selection import train_test_split
                from sklearn.ensemble import RandomForestClassifier
                df = pd.read_csv('churn.csv')
                train, test = train_test_split(df, test_size=0.2)
                model = RandomForestClassifier(n_estimators=50)
                model.fit(train[['age', 'plan']], train['churned'])
                scored = model.predict(test[['age', 'plan']])
                """, RecipeKind.SPLIT),
            Arguments.of("""
                import pandas as pd
                df = pd.read_csv('orders.csv')
                df['total'] = df['price'].apply(lambda p: p * 1.2)
                df.to_csv('priced.csv')
                """, RecipeKind.SYNC),
            Arguments.of("""
                import pandas as pd
                sales = pd.read_csv('sales.csv')
                wide = sales.pivot_table(index='region', columns='month', values='amount', aggfunc='sum')
                long = pd.melt(sales, id_vars=['region'], value_vars=['q1', 'q2'])
                wide.to_parquet('wide.parquet')
                long.to_csv('long.csv')
                """, RecipeKind.PIVOT),
            Arguments.of("""
                import pandas as pd
                jan = pd.read_csv('jan.csv')
                feb = pd.read_csv('feb.csv')
                both = pd.concat([jan, feb], ignore_index=True)
                both = both.sort_values('day')
                both.to_csv('both.csv')
                """, RecipeKind.STACK));
    }

    @ParameterizedTest
    @MethodSource("convertedScripts")
    void convertedFlowsSurviveBothFormats(String script, RecipeKind expectedKind) {
        Flow flow = Py2Flow.convert(script).flow();

        assertThat(flow.recipes()).extracting(Recipe::kind).contains(expectedKind);
        assertThat(FlowDocuments.fromJson(FlowDocuments.toJson(flow))).isEqualTo(flow);
        assertThat(FlowDocuments.fromYaml(FlowDocuments.toYaml(flow))).isEqualTo(flow);
    }
}
