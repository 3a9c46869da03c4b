package dev.py2flow;

import dev.py2flow.analyzer.RecognitionGap;
import dev.py2flow.model.Flow;

import java.util.List;
import java.util.Objects;

/**
 * A converted flow plus the constructs that could not be converted.
 */
public record ConversionResult(Flow flow, List<RecognitionGap> gaps) {

    public ConversionResult {
        Objects.requireNonNull(flow, "flow");
        gaps = List.copyOf(gaps);
    }

    public boolean isComplete() {
        return gaps.isEmpty();
    }
}
