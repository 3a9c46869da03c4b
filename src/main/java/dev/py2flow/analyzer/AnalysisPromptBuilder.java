package dev.py2flow.analyzer;

/**
 * Builds the prompts sent to a completion backend by the model-backed
 * analyzer: the numbered script followed by the answer format block.
 */
public final class AnalysisPromptBuilder {

    private AnalysisPromptBuilder() {}

    public static String buildAnalysisPrompt(String source) {
        var sb = new StringBuilder();
        sb.append("Convert the following pandas / scikit-learn script into a list of data-processing ")
            .append("operations, in execution order. Refer to script variables by name. ")
            .append("Report anything you cannot express as an operation as a gap.\n\n");
        sb.append("```python\n");
        String[] lines = source.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            sb.append("%4d| %s\n".formatted(i + 1, lines[i]));
        }
        sb.append("```\n\n");
        sb.append(buildFormatBlock());
        return sb.toString();
    }

    /**
     * Build the reminder prompt for a retry after extraction failure.
     */
    public static String buildReminderPrompt(String errorDetails) {
        var sb = new StringBuilder();
        sb.append("Your previous response did not include a usable JSON operations document.\n");
        sb.append("Please respond now with ONLY the JSON document on a single line.\n\n");
        sb.append("Error: ").append(errorDetails).append("\n\n");
        sb.append(buildFormatBlock());
        sb.append("\nRespond with ONLY the JSON document, nothing else.");
        return sb.toString();
    }

    private static String buildFormatBlock() {
        var sb = new StringBuilder();
        sb.append("End your response with one JSON object on the last line:\n");
        sb.append("{\"operations\": [...], \"gaps\": [{\"line\": 7, \"construct\": \"...\", \"reason\": \"...\"}]}\n\n");
        sb.append("Every operation has \"op\", \"line\" and \"text\" (the statement) plus:\n");
        sb.append("  read: output, path, format, columns\n");
        sb.append("  write: input, path, format\n");
        sb.append("  filter, derive-column: input, output, step\n");
        sb.append("  join: left, right, output, how, on | left_on + right_on\n");
        sb.append("  stack: sources, output\n");
        sb.append("  aggregate: input, output, keys, aggregations [{column, function, output}]\n");
        sb.append("  sort: input, output, columns, ascending [booleans]\n");
        sb.append("  dedupe: input, output, subset, keep\n");
        sb.append("  sample: input, output, mode (head|tail|largest|smallest|random), size, ranking_columns\n");
        sb.append("  reshape: input, output, mode (pivot|unpivot|window), step\n");
        sb.append("  split: sources, outputs, test_size\n");
        sb.append("  model-fit: sources, model, algorithm\n");
        sb.append("  model-apply: mode (score|evaluate), model, sources, output, method\n");
        sb.append("  custom: sources, outputs, function, code\n");
        sb.append("  bind: source, target\n\n");
        sb.append("A step is {\"processor\": <Dataiku processor, e.g. RemoveRowsOnEmpty, FilterOnFormula, ")
            .append("CreateColumnWithGREL, ColumnRenamer, FillEmptyWithValue>, \"columns\": [...], ")
            .append("\"params\": {string: string}, \"effects\": [{\"field\", \"kind\", \"sources\"}]}.\n");
        sb.append("Effect kinds: identity, rename, computed, aggregated, opaque.\n");
        return sb.toString();
    }
}
