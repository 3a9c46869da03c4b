package dev.py2flow;

import dev.py2flow.analyzer.AnalysisResult;
import dev.py2flow.analyzer.AnalyzerProvider;
import dev.py2flow.analyzer.ModelBackedAnalyzer;
import dev.py2flow.analyzer.PatternAnalyzer;
import dev.py2flow.backend.CompletionBackend;
import dev.py2flow.config.Py2FlowConfig;
import dev.py2flow.engine.FlowBuilder;
import dev.py2flow.engine.FlowOptimizer;
import dev.py2flow.engine.OptimizationResult;
import dev.py2flow.export.DssExporter;
import dev.py2flow.model.Flow;
import dev.py2flow.render.FlowRenderers;
import dev.py2flow.render.RenderFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Entry points of the converter.
 *
 * <p>Conversion returns the flow exactly as recognized; optimization is a
 * separate step, applied by {@link #optimize} and by the bundle export when
 * the configuration enables it.</p>
 */
public final class Py2Flow {

    private static final Logger LOG = LoggerFactory.getLogger(Py2Flow.class);

    private Py2Flow() {}

    public static ConversionResult convert(String source) {
        return convert(source, Py2FlowConfig.defaults());
    }

    /**
     * Rule-based conversion.
     *
     * @throws dev.py2flow.python.PythonSyntaxException when the source cannot be tokenized
     * @throws dev.py2flow.engine.DanglingReferenceException when an operation reads an unknown variable
     */
    public static ConversionResult convert(String source, Py2FlowConfig config) {
        return convert(source, new PatternAnalyzer(), config);
    }

    public static ConversionResult convertFile(Path script, Py2FlowConfig config) throws IOException {
        return convert(Files.readString(script, StandardCharsets.UTF_8), config);
    }

    /**
     * Conversion through a completion backend. Falls back to the rule-based
     * analyzer when there is no backend or no credential.
     */
    public static ConversionResult convertWithLlm(String source, CompletionBackend backend, String apiKey,
                                                  Py2FlowConfig config) {
        if (backend == null || apiKey == null || apiKey.isBlank()) {
            LOG.warn("No completion backend credential available, using the rule-based analyzer");
            return convert(source, config);
        }
        return convert(source, new ModelBackedAnalyzer(backend), config);
    }

    /** Conversion with any analyzer. */
    public static ConversionResult convert(String source, AnalyzerProvider analyzer, Py2FlowConfig config) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(analyzer, "analyzer");
        Objects.requireNonNull(config, "config");
        AnalysisResult analysis = analyzer.analyze(source, config);
        Flow flow = FlowBuilder.build(analysis, config);
        LOG.info("Converted '{}' with {}: {} dataset(s), {} recipe(s), {} gap(s)", flow.name(), analyzer.name(),
            flow.datasets().size(), flow.recipes().size(), analysis.gaps().size());
        return new ConversionResult(flow, analysis.gaps());
    }

    public static OptimizationResult optimize(Flow flow, Py2FlowConfig config) {
        return FlowOptimizer.optimize(flow, config.effectiveOptimizationLevel());
    }

    /**
     * Write a DSS project bundle; see {@link DssExporter#export}.
     */
    public static Path exportToDss(Flow flow, Path destination, boolean createZip, Py2FlowConfig config) {
        return new DssExporter(config).export(flow, destination, createZip);
    }

    public static String render(Flow flow, RenderFormat format) {
        return FlowRenderers.render(flow, format);
    }

    /**
     * Render in the configured {@code default_format}.
     *
     * @throws IllegalArgumentException when that format is not a diagram format
     */
    public static String render(Flow flow, Py2FlowConfig config) {
        return render(flow, RenderFormat.fromName(config.defaultFormat()));
    }
}
