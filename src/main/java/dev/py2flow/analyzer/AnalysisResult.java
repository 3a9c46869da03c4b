package dev.py2flow.analyzer;

import java.util.List;

/**
 * Output of an analyzer: the recognized operations in execution order plus
 * every construct that could not be recognized.
 */
public record AnalysisResult(List<Operation> operations, List<RecognitionGap> gaps) {

    public AnalysisResult {
        operations = List.copyOf(operations);
        gaps = List.copyOf(gaps);
    }

    public static AnalysisResult failed(RecognitionGap gap) {
        return new AnalysisResult(List.of(), List.of(gap));
    }

    public boolean isComplete() {
        return gaps.isEmpty();
    }
}
