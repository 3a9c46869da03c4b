package dev.py2flow.analyzer;

import dev.py2flow.model.StepType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OperationExtractorTest {

    @Test
    void readsDocumentFromTailLine() {
        String response = """
            The script loads one file and filters it.

            {"operations": [{"op": "read", "line": 2, "output": "df", "path": "a.csv", "format": "csv"}, {"op": "filter", "line": 3, "input": "df", "output": "df", "step": {"processor": "FilterOnFormula", "columns": ["age"], "params": {"expression": "age > 30"}}}]}
            """;

        ExtractionResult result = OperationExtractor.extract(response);

        assertThat(result).isInstanceOf(ExtractionResult.Success.class);
        var success = (ExtractionResult.Success) result;
        assertThat(success.operations()).extracting(Operation::tag)
            .containsExactly(OperationTag.READ, OperationTag.FILTER);
        var filter = (Operation.Filter) success.operations().get(1);
        assertThat(filter.step().type()).isEqualTo(StepType.FILTER_ON_FORMULA);
        assertThat(filter.step().param("expression")).isEqualTo("age > 30");
        assertThat(filter.origin().line()).isEqualTo(3);
        assertThat(success.gaps()).isEmpty();
    }

    @Test
    void readsMultiLineDocumentFromFencedBlock() {
        String response = """
            Here is the analysis:
            ```json
            {
              "operations": [
                {"op": "read", "line": 1, "output": "df", "path": "a.csv"},
                {"op": "sort", "line": 2, "input": "df", "output": "df", "columns": ["a", "b"], "ascending": [false]}
              ],
              "gaps": [{"line": 4, "construct": "df.plot()", "reason": "plotting"}]
            }
            ```
            Let me know if you need more.
            """;

        ExtractionResult result = OperationExtractor.extract(response);

        var success = (ExtractionResult.Success) result;
        var sort = (Operation.Sort) success.operations().get(1);
        assertThat(sort.ascending()).containsExactly(false, true);
        assertThat(success.gaps()).singleElement().satisfies(gap -> {
            assertThat(gap.line()).isEqualTo(4);
            assertThat(gap.construct()).isEqualTo("df.plot()");
        });
    }

    @Test
    void acceptsSingleStringForListFields() {
        String response = """
            {"operations": [{"op": "join", "line": 5, "left": "a", "right": "b", "output": "c", "how": "left", "on": "id"}]}
            """;

        var join = (Operation.Join) ((ExtractionResult.Success) OperationExtractor.extract(response)).operations().get(0);

        assertThat(join.leftKeys()).containsExactly("id");
        assertThat(join.rightKeys()).containsExactly("id");
    }

    @Test
    void failsOnEmptyResponse() {
        assertThat(OperationExtractor.extract("  "))
            .isEqualTo(new ExtractionResult.Failure("Empty response", null));
    }

    @Test
    void failsWithoutJson() {
        ExtractionResult result = OperationExtractor.extract("I could not analyze this script.");

        assertThat(((ExtractionResult.Failure) result).error()).isEqualTo("No JSON block found in response");
    }

    @Test
    void failsOnInvalidJson() {
        ExtractionResult result = OperationExtractor.extract("{\"operations\": [}");

        var failure = (ExtractionResult.Failure) result;
        assertThat(failure.error()).startsWith("Invalid JSON");
        assertThat(failure.malformedJson()).isEqualTo("{\"operations\": [}");
    }

    @Test
    void failsWhenOperationsMissing() {
        ExtractionResult result = OperationExtractor.extract("{\"ops\": []}");

        assertThat(((ExtractionResult.Failure) result).error()).isEqualTo("Missing or non-list 'operations' field");
    }

    @Test
    void reportsPathOfMalformedOperation() {
        ExtractionResult result = OperationExtractor.extract(
            "{\"operations\": [{\"op\": \"read\", \"output\": \"df\"}, {\"op\": \"write\", \"line\": 3}]}");

        assertThat(((ExtractionResult.Failure) result).error())
            .isEqualTo("operations[1].input: expected a non-empty string");
    }

    @Test
    void reportsUnknownTag() {
        ExtractionResult result = OperationExtractor.extract("{\"operations\": [{\"op\": \"teleport\"}]}");

        assertThat(((ExtractionResult.Failure) result).error()).startsWith("operations[0].op:");
    }
}
