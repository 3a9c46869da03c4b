package dev.py2flow.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import dev.py2flow.ConversionResult;
import dev.py2flow.Py2Flow;
import dev.py2flow.Py2FlowException;
import dev.py2flow.analyzer.RecognitionGap;
import dev.py2flow.config.Py2FlowConfig;
import dev.py2flow.engine.OptimizationResult;
import dev.py2flow.model.ColumnLineage;
import dev.py2flow.model.Flow;
import dev.py2flow.model.ValidationIssue;
import dev.py2flow.render.FlowRenderers;
import dev.py2flow.render.RenderFormat;
import dev.py2flow.render.Theme;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command line front-end: convert one script and print or write the result.
 */
@Command(
    name = "py2flow",
    mixinStandardHelpOptions = true,
    description = "Convert a pandas / scikit-learn script into a Dataiku-style flow of datasets and recipes."
)
public class Py2FlowCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_GAPS = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Python script to convert")
    private Path script;

    @Option(names = "--format",
        description = "Output format: ascii, svg, html, mermaid, plantuml, json, yaml (default: default_format of the config)")
    private String format;

    @Option(names = "--config", paramLabel = "FILE", description = "YAML or JSON file with configuration options")
    private Path configFile;

    @Option(names = {"-o", "--output"}, description = "Write the result to this file instead of stdout")
    private Path output;

    @Option(names = "--theme", defaultValue = "light", description = "Diagram theme: light or dark")
    private String theme;

    @Option(names = "--export-dss", description = "Also export a DSS project bundle into this directory")
    private Path exportDir;

    @Option(names = "--zip", description = "Archive the exported bundle as <PROJECT_KEY>.zip")
    private boolean zip;

    @Option(names = "--project-key", description = "DSS project key for the export")
    private String projectKey;

    @Option(names = "--flow-name", description = "Name of the generated flow")
    private String flowName;

    @Option(names = "--no-optimize", description = "Skip recipe merging and performance hints")
    private boolean noOptimize;

    @Option(names = "--optimization-level", description = "Optimization level 0..2 (default: 1)")
    private Integer optimizationLevel;

    @Option(names = "--lineage", paramLabel = "DATASET.FIELD",
        description = "Print the lineage of a field; a bare field name traces the last output carrying it")
    private String lineage;

    @Option(names = "--summary", description = "Print flow counts and validation issues")
    private boolean summary;

    @Option(names = "--strict", description = "Exit with code 2 when part of the script could not be converted")
    private boolean strict;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            Py2FlowConfig config = config();
            ConversionResult result = Py2Flow.convertFile(script, config);
            Flow flow = result.flow();
            if (config.optimize()) {
                OptimizationResult optimized = Py2Flow.optimize(flow, config);
                flow = optimized.flow();
            }

            String document = document(flow, config);
            if (output != null) {
                Files.writeString(output, document, StandardCharsets.UTF_8);
                out.println("Wrote " + output);
            } else {
                out.print(document);
            }
            if (summary) {
                printSummary(out, flow);
            }
            if (lineage != null) {
                out.print(lineage(flow).describe());
            }
            if (exportDir != null) {
                Path exported = Py2Flow.exportToDss(flow, exportDir, zip, config);
                out.println("Exported DSS bundle to " + exported);
            }
            for (RecognitionGap gap : result.gaps()) {
                err.println("warning: " + gap);
            }
            out.flush();
            return strict && !result.isComplete() ? EXIT_GAPS : EXIT_OK;
        } catch (IOException | Py2FlowException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private Py2FlowConfig config() throws IOException {
        Py2FlowConfig config = configFile == null ? Py2FlowConfig.defaults() : Py2FlowConfig.fromMap(
            new YAMLMapper().readValue(configFile.toFile(), new TypeReference<Map<String, Object>>() {}));
        if (projectKey != null) {
            config = config.withProjectKey(projectKey);
        }
        if (flowName != null) {
            config = config.withFlowName(flowName);
        }
        int level = optimizationLevel != null ? optimizationLevel : config.optimizationLevel();
        return config.withOptimization(!noOptimize && config.optimize() && level > 0, level);
    }

    private String document(Flow flow, Py2FlowConfig config) {
        String name = (format != null ? format : config.defaultFormat()).trim().toLowerCase(Locale.ROOT);
        if (name.equals("json")) {
            return flow.toJson() + "\n";
        }
        if (name.equals("yaml")) {
            return flow.toYaml();
        }
        return FlowRenderers.render(flow, RenderFormat.fromName(name), Theme.fromName(theme));
    }

    private ColumnLineage lineage(Flow flow) {
        int dot = lineage.indexOf('.');
        if (dot <= 0) {
            return flow.getColumnLineage(lineage);
        }
        return flow.getColumnLineage(lineage.substring(0, dot), lineage.substring(dot + 1));
    }

    private static void printSummary(PrintWriter out, Flow flow) {
        out.println();
        for (Map.Entry<String, Object> entry : flow.summary().entrySet()) {
            out.println(entry.getKey() + ": " + entry.getValue());
        }
        for (ValidationIssue issue : flow.validate()) {
            out.println("%s %s: %s".formatted(issue.severity(), issue.code(), issue.message()));
        }
    }
}
