package dev.py2flow.analyzer;

import dev.py2flow.config.Py2FlowConfig;
import dev.py2flow.model.StepType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PatternAnalyzerTest {

    private final PatternAnalyzer analyzer = new PatternAnalyzer();

    private AnalysisResult analyze(String source) {
        return analyzer.analyze(source, Py2FlowConfig.defaults());
    }

    @Test
    void recognizesReadCleanJoinAggregateWrite() {
        AnalysisResult result = analyze("""
            import pandas as pd
            customers = pd.read_csv('data/customers.csv')
            orders = pd.read_csv('data/orders.csv')
            customers = customers.dropna(subset=['email'])
            merged = customers.merge(orders, on='customer_id')
            summary = merged.groupby('region').agg({'amount': 'sum', 'customer_id': 'nunique'}).reset_index()
            summary.to_csv('output/summary.csv', index=False)
            """);

        assertThat(result.isComplete()).isTrue();
        assertThat(result.operations()).extracting(Operation::tag).containsExactly(
            OperationTag.READ, OperationTag.READ, OperationTag.FILTER, OperationTag.JOIN,
            OperationTag.AGGREGATE, OperationTag.BIND, OperationTag.WRITE);

        var read = (Operation.Read) result.operations().get(0);
        assertThat(read.path()).isEqualTo("data/customers.csv");
        assertThat(read.format()).isEqualTo("csv");
        assertThat(read.output()).isEqualTo("customers");
        assertThat(read.origin().line()).isEqualTo(2);

        var filter = (Operation.Filter) result.operations().get(2);
        assertThat(filter.step().type()).isEqualTo(StepType.REMOVE_ROWS_ON_EMPTY);
        assertThat(filter.step().columns()).containsExactly("email");

        var join = (Operation.Join) result.operations().get(3);
        assertThat(join.left()).isEqualTo("customers");
        assertThat(join.right()).isEqualTo("orders");
        assertThat(join.leftKeys()).containsExactly("customer_id");

        var aggregate = (Operation.Aggregate) result.operations().get(4);
        assertThat(aggregate.keys()).containsExactly("region");
        assertThat(aggregate.aggregations()).containsExactly(
            new Aggregation("amount", "SUM", "amount"),
            new Aggregation("customer_id", "COUNT_DISTINCT", "customer_id"));
        assertThat(Temporaries.isTemporary(aggregate.output())).isTrue();

        var write = (Operation.Write) result.operations().get(6);
        assertThat(write.input()).isEqualTo("summary");
        assertThat(write.path()).isEqualTo("output/summary.csv");
    }

    @Test
    void recognizesRowMaskFilter() {
        AnalysisResult result = analyze("""
            import pandas as pd
            df = pd.read_parquet('users.parquet')
            adults = df[df['age'] > 30]
            """);

        assertThat(result.operations()).extracting(Operation::tag)
            .containsExactly(OperationTag.READ, OperationTag.FILTER);
        var filter = (Operation.Filter) result.operations().get(1);
        assertThat(filter.step().type()).isEqualTo(StepType.FILTER_ON_FORMULA);
        assertThat(filter.step().columns()).contains("age");
        assertThat(filter.input()).isEqualTo("df");
        assertThat(filter.output()).isEqualTo("adults");
    }

    @Test
    void skipsInspectionAndPlainPython() {
        AnalysisResult result = analyze("""
            import pandas as pd
            threshold = 10
            df = pd.read_csv('a.csv')
            print(df.head())
            df.info()
            total = df['amount'].sum()
            """);

        assertThat(result.isComplete()).isTrue();
        assertThat(result.operations()).extracting(Operation::tag).containsExactly(OperationTag.READ);
    }

    @Test
    void reportsUnsupportedCallAsGapAndKeepsGoing() {
        AnalysisResult result = analyze("""
            import pandas as pd
            df = pd.read_csv('a.csv')
            weird = df.frobnicate(3)
            df = df.drop_duplicates()
            """);

        assertThat(result.gaps()).singleElement().satisfies(gap -> {
            assertThat(gap.line()).isEqualTo(3);
            assertThat(gap.construct()).isEqualTo("df.frobnicate(3)");
            assertThat(gap.reason()).contains("frobnicate");
        });
        assertThat(result.operations()).extracting(Operation::tag)
            .containsExactly(OperationTag.READ, OperationTag.CUSTOM, OperationTag.DEDUPE);
    }

    @Test
    void unsupportedReassignmentKeepsFrameUsable() {
        AnalysisResult result = analyze("""
            import pandas as pd
            df = pd.read_csv('a.csv')
            df = df.frobnicate(3)
            df2 = df.dropna()
            df2.to_csv('b.csv')
            """);

        assertThat(result.gaps()).extracting(RecognitionGap::line).containsExactly(3);
        assertThat(result.operations()).extracting(Operation::tag)
            .containsExactly(OperationTag.READ, OperationTag.CUSTOM, OperationTag.FILTER, OperationTag.WRITE);
        assertThat(result.operations().get(1)).isInstanceOfSatisfying(Operation.Custom.class, custom -> {
            assertThat(custom.sources()).containsExactly("df");
            assertThat(custom.outputs()).containsExactly("df");
        });
    }

    @Test
    void laterUseOfUnrecognizedVariableIsAGapToo() {
        AnalysisResult result = analyze("""
            import pandas as pd
            df = pd.read_csv('a.csv')
            weird = pd.frobnicate(df)
            out = weird.drop_duplicates()
            """);

        assertThat(result.gaps()).extracting(RecognitionGap::line).containsExactly(3, 4);
        assertThat(result.gaps().get(1).reason()).contains("not converted");
    }

    @Test
    void syntaxErrorBecomesGap() {
        AnalysisResult result = analyze("""
            import pandas as pd
            df = pd.read_csv('a.csv')
            df = = 1
            df.to_csv('b.csv')
            """);

        assertThat(result.gaps()).singleElement()
            .satisfies(gap -> assertThat(gap.reason()).startsWith("syntax error"));
        assertThat(result.operations()).extracting(Operation::tag)
            .containsExactly(OperationTag.READ, OperationTag.WRITE);
    }

    @Test
    void recognizesModelTrainingAndScoring() {
        AnalysisResult result = analyze("""
            import pandas as pd
            from sklearn.linear_model import LogisticRegression
            train = pd.read_csv('train.csv')
            test = pd.read_csv('test.csv')
            model = LogisticRegression()
            model.fit(train, train)
            predictions = model.predict(test)
            """);

        assertThat(result.operations()).extracting(Operation::tag).containsExactly(
            OperationTag.READ, OperationTag.READ, OperationTag.MODEL_FIT, OperationTag.MODEL_APPLY);
        var fit = (Operation.ModelFit) result.operations().get(2);
        assertThat(fit.model()).isEqualTo("model");
        assertThat(fit.algorithm()).isEqualTo("LogisticRegression");
        var apply = (Operation.ModelApply) result.operations().get(3);
        assertThat(apply.mode()).isEqualTo(Operation.ApplyMode.SCORE);
        assertThat(apply.sources()).containsExactly("test");
    }

    @Test
    void nameIsRuleBased() {
        assertThat(analyzer.name()).isEqualTo(PatternAnalyzer.NAME).isEqualTo("rule-based");
    }
}
