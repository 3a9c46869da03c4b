package dev.py2flow.analyzer;

import java.util.List;

/**
 * Result of reading operations out of a model response.
 */
public sealed interface ExtractionResult {

    record Success(List<Operation> operations, List<RecognitionGap> gaps) implements ExtractionResult {

        public Success {
            operations = List.copyOf(operations);
            gaps = List.copyOf(gaps);
        }
    }

    record Failure(String error, String malformedJson) implements ExtractionResult {}
}
