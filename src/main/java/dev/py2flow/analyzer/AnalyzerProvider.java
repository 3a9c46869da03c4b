package dev.py2flow.analyzer;

import dev.py2flow.config.Py2FlowConfig;

/**
 * Turns source code into operation records. Implemented by the rule-based
 * {@link PatternAnalyzer} and by the model-backed {@link ModelBackedAnalyzer};
 * the flow builder does not care which one produced the operations.
 */
public interface AnalyzerProvider {

    /**
     * Analyze a script.
     *
     * @param source the script text
     * @param config conversion settings
     * @return recognized operations plus recognition gaps; never null
     */
    AnalysisResult analyze(String source, Py2FlowConfig config);

    /** Provider name as used by the {@code default_provider} option. */
    String name();
}
