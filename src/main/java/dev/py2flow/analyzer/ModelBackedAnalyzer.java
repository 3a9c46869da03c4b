package dev.py2flow.analyzer;

import dev.py2flow.backend.CompletionBackend;
import dev.py2flow.backend.CompletionResponse;
import dev.py2flow.config.Py2FlowConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Delegates recognition to a completion backend and reads the operations
 * back from its answer.
 *
 * <p>A response without a usable operations document is retried once with a
 * reminder prompt. When that also fails, or the backend reports an error,
 * the whole script becomes one recognition gap carrying the reason.</p>
 */
public final class ModelBackedAnalyzer implements AnalyzerProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ModelBackedAnalyzer.class);

    static final String WHOLE_SCRIPT = "<script>";

    private final CompletionBackend backend;
    private final String model;

    public ModelBackedAnalyzer(CompletionBackend backend) {
        this(backend, null);
    }

    /**
     * @param model backend model identifier, or null for the backend default
     */
    public ModelBackedAnalyzer(CompletionBackend backend, String model) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.model = model;
    }

    @Override
    public String name() {
        return backend.getName();
    }

    @Override
    public AnalysisResult analyze(String source, Py2FlowConfig config) {
        String resolvedModel = model != null ? model : backend.defaultModel();
        var timeout = Duration.ofSeconds(config.llmTimeoutSeconds());

        CompletionResponse response = backend.complete(AnalysisPromptBuilder.buildAnalysisPrompt(source),
            resolvedModel, timeout);
        if (!response.success()) {
            return backendFailure(response);
        }
        ExtractionResult result = OperationExtractor.extract(response.responseText());
        if (result instanceof ExtractionResult.Failure failure) {
            LOG.debug("Retrying {} after unusable response: {}", backend.getName(), failure.error());
            response = backend.complete(AnalysisPromptBuilder.buildReminderPrompt(failure.error()), resolvedModel,
                timeout);
            if (!response.success()) {
                return backendFailure(response);
            }
            result = OperationExtractor.extract(response.responseText());
        }

        if (result instanceof ExtractionResult.Success success) {
            LOG.debug("{} returned {} operation(s), {} gap(s)", backend.getName(), success.operations().size(),
                success.gaps().size());
            return new AnalysisResult(success.operations(), success.gaps());
        }
        var failure = (ExtractionResult.Failure) result;
        LOG.warn("Unusable response from {}: {}", backend.getName(), failure.error());
        return AnalysisResult.failed(new RecognitionGap(0, 0, WHOLE_SCRIPT,
            "unusable model response: " + failure.error()));
    }

    private AnalysisResult backendFailure(CompletionResponse response) {
        LOG.warn("Backend {} failed: {}", backend.getName(), response.error());
        return AnalysisResult.failed(new RecognitionGap(0, 0, WHOLE_SCRIPT,
            "model backend failed: " + response.error()));
    }
}
