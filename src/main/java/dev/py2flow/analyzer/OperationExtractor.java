package dev.py2flow.analyzer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the operations document from a model response.
 *
 * <p>The document is looked for on one of the last five lines first; when
 * the model wrote it over several lines it is taken from the last fenced
 * block instead.</p>
 */
public final class OperationExtractor {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int TAIL_LINES = 5;

    private OperationExtractor() {}

    public static ExtractionResult extract(String responseText) {
        if (responseText == null || responseText.isBlank()) {
            return new ExtractionResult.Failure("Empty response", null);
        }
        String candidate = tailCandidate(responseText);
        if (candidate == null) {
            candidate = fencedCandidate(responseText);
        }
        if (candidate == null) {
            return new ExtractionResult.Failure("No JSON block found in response", null);
        }
        candidate = stripFences(candidate);

        JsonNode node;
        try {
            node = MAPPER.readTree(candidate);
        } catch (Exception e) {
            return new ExtractionResult.Failure("Invalid JSON: " + e.getMessage(), candidate);
        }
        if (node == null || !node.isObject()) {
            return new ExtractionResult.Failure("Expected a JSON object", candidate);
        }
        JsonNode operations = node.get("operations");
        if (operations == null || !operations.isArray()) {
            return new ExtractionResult.Failure("Missing or non-list 'operations' field", candidate);
        }

        var decoded = new ArrayList<Operation>();
        var gaps = new ArrayList<RecognitionGap>();
        try {
            for (int i = 0; i < operations.size(); i++) {
                decoded.add(OperationCodec.decode(operations.get(i), "operations[%d]".formatted(i), i + 1));
            }
            JsonNode gapNodes = node.get("gaps");
            if (gapNodes != null && !gapNodes.isNull()) {
                if (!gapNodes.isArray()) {
                    return new ExtractionResult.Failure("Field 'gaps' must be a list", candidate);
                }
                for (JsonNode gap : gapNodes) {
                    gaps.add(gap(gap));
                }
            }
        } catch (IllegalArgumentException e) {
            return new ExtractionResult.Failure(e.getMessage(), candidate);
        }
        return new ExtractionResult.Success(decoded, gaps);
    }

    private static String tailCandidate(String responseText) {
        String[] lines = responseText.split("\n");
        int startIndex = Math.max(0, lines.length - TAIL_LINES);
        for (int i = lines.length - 1; i >= startIndex; i--) {
            String trimmed = stripFences(lines[i].trim());
            if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
                return trimmed;
            }
        }
        return null;
    }

    private static String fencedCandidate(String responseText) {
        int close = responseText.lastIndexOf("```");
        if (close < 0) {
            return null;
        }
        int open = responseText.lastIndexOf("```", close - 1);
        if (open < 0) {
            return null;
        }
        String block = responseText.substring(open + 3, close);
        if (block.startsWith("json")) {
            block = block.substring(4);
        }
        block = block.trim();
        return block.startsWith("{") ? block : null;
    }

    private static String stripFences(String candidate) {
        String stripped = candidate;
        if (stripped.startsWith("```json")) {
            stripped = stripped.substring(7);
        } else if (stripped.startsWith("```")) {
            stripped = stripped.substring(3);
        }
        if (stripped.endsWith("```")) {
            stripped = stripped.substring(0, stripped.length() - 3);
        }
        return stripped.trim();
    }

    private static RecognitionGap gap(JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("gaps: expected objects");
        }
        int line = node.path("line").asInt(0);
        return new RecognitionGap(0, line, node.path("construct").asText(""),
            node.path("reason").asText("not recognized by the model"));
    }
}
