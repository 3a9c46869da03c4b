package dev.py2flow;

import dev.py2flow.model.Dataset;
import dev.py2flow.model.DatasetRole;
import dev.py2flow.model.FieldEffect;
import dev.py2flow.model.FieldSchema;
import dev.py2flow.model.Flow;
import dev.py2flow.model.Recipe;
import dev.py2flow.model.RecipeKind;
import dev.py2flow.model.StepType;
import dev.py2flow.model.SubStep;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Hand-built flows shared by the tests.
 */
public final class SampleFlows {

    private SampleFlows() {}

    /**
     * customers (id, name, email) is cleaned and renamed, joined with orders
     * (order_id, customer_id, amount) and summed per customer into revenue.
     */
    public static Flow customerRevenue() {
        var flow = new Flow("customer_revenue");
        flow.addDataset(new Dataset("customers", DatasetRole.INPUT, schema("id", "name", "email"), "csv",
            "data/customers.csv", "customers", 2));
        flow.addDataset(new Dataset("orders", DatasetRole.INPUT, schema("order_id", "customer_id", "amount"), "csv",
            "data/orders.csv", "orders", 3));
        flow.addDataset(new Dataset("customers_clean", DatasetRole.INTERMEDIATE,
            schema("customer_id", "name", "email"), null, null, "customers", 4));
        flow.addDataset(new Dataset("joined", DatasetRole.INTERMEDIATE,
            schema("customer_id", "name", "email", "order_id", "amount"), null, null, "joined", 6));
        flow.addDataset(new Dataset("revenue", DatasetRole.OUTPUT, schema("customer_id", "total_amount"), "csv",
            "output/revenue.csv", "revenue", 7));

        flow.addRecipe(new Recipe("prepare_customers_clean", RecipeKind.PREPARE, List.of("customers"),
            List.of("customers_clean"),
            List.of(SubStep.of(StepType.REMOVE_ROWS_ON_EMPTY, List.of("email")),
                new SubStep(StepType.COLUMN_RENAMER, List.of("id"), Map.of(),
                    List.of(FieldEffect.rename("id", "customer_id")))),
            null, List.of(4, 5)));
        flow.addRecipe(new Recipe("join_joined", RecipeKind.JOIN, List.of("customers_clean", "orders"),
            List.of("joined"),
            List.of(new SubStep(StepType.JOIN, List.of("customer_id"), Map.of("type", "INNER"), List.of())),
            null, List.of(6)));
        flow.addRecipe(new Recipe("group_revenue", RecipeKind.GROUP, List.of("joined"), List.of("revenue"),
            List.of(new SubStep(StepType.GROUP_KEYS, List.of("customer_id"), Map.of(),
                    List.of(FieldEffect.identity("customer_id"))),
                new SubStep(StepType.AGGREGATE, List.of("amount"), Map.of("function", "SUM"),
                    List.of(FieldEffect.aggregated("total_amount", List.of("amount"))))),
            null, List.of(7)));
        flow.addWarning("Line 9: could not convert 'df.plot()' (no idiom for '.plot()')");
        return flow;
    }

    /** Two prepare recipes feeding each other through a and b. */
    public static Flow cyclic() {
        var flow = new Flow("loop");
        flow.addDataset(Dataset.of("a", DatasetRole.INTERMEDIATE));
        flow.addDataset(Dataset.of("b", DatasetRole.INTERMEDIATE));
        flow.addRecipe(new Recipe("prepare_b", RecipeKind.PREPARE, List.of("a"), List.of("b"), List.of(), null,
            List.of(1)));
        flow.addRecipe(new Recipe("prepare_a", RecipeKind.PREPARE, List.of("b"), List.of("a"), List.of(), null,
            List.of(2)));
        return flow;
    }

    public static List<FieldSchema> schema(String... names) {
        return Arrays.stream(names).map(n -> new FieldSchema(n, null)).toList();
    }
}
