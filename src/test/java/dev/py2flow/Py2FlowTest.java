package dev.py2flow;

import dev.py2flow.analyzer.Idiom;
import dev.py2flow.analyzer.IdiomTable;
import dev.py2flow.analyzer.Operation;
import dev.py2flow.analyzer.OperationTag;
import dev.py2flow.analyzer.PatternAnalyzer;
import dev.py2flow.backend.CompletionBackend;
import dev.py2flow.backend.CompletionResponse;
import dev.py2flow.config.Py2FlowConfig;
import dev.py2flow.engine.OptimizationResult;
import dev.py2flow.model.DatasetRole;
import dev.py2flow.model.Recipe;
import dev.py2flow.model.RecipeKind;
import dev.py2flow.render.RenderFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Py2FlowTest {

    private static final String SCRIPT = """
        import pandas as pd
        df = pd.read_csv('a.csv')
        df = df.dropna()
        df = df.fillna(0)
        df.to_csv('b.csv')
        """;

    @TempDir
    Path tempDir;

    /** Counts calls and always answers with a single read of a.csv. */
    private static final class CountingBackend implements CompletionBackend {

        int calls;

        @Override
        public CompletionResponse complete(String prompt, String model, Duration timeout) {
            calls++;
            return CompletionResponse.ok("{\"operations\": [{\"op\": \"read\", \"line\": 2, \"output\": \"df\","
                + " \"path\": \"a.csv\", \"format\": \"csv\"}]}");
        }

        @Override
        public String getName() {
            return "counting";
        }

        @Override
        public String defaultModel() {
            return null;
        }
    }

    @Test
    void convertKeepsFlowUnoptimized() {
        ConversionResult result = Py2Flow.convert(SCRIPT);

        assertThat(result.isComplete()).isTrue();
        assertThat(result.flow().name()).isEqualTo(Py2FlowConfig.DEFAULT_FLOW_NAME);
        assertThat(result.flow().recipesOfKind(RecipeKind.PREPARE)).hasSize(2);

        OptimizationResult optimized = Py2Flow.optimize(result.flow(), Py2FlowConfig.defaults());
        assertThat(optimized.flow().recipesOfKind(RecipeKind.PREPARE)).hasSize(1);
        assertThat(result.flow().recipesOfKind(RecipeKind.PREPARE)).hasSize(2);
    }

    @Test
    void convertFileReadsScript() throws IOException {
        Path script = Files.writeString(tempDir.resolve("job.py"), SCRIPT);

        ConversionResult result = Py2Flow.convertFile(script, Py2FlowConfig.defaults().withFlowName("job"));

        assertThat(result.flow().name()).isEqualTo("job");
        assertThat(result.flow().datasetsWithRole(DatasetRole.OUTPUT)).isNotEmpty();
    }

    @Test
    void missingCredentialFallsBackToRules() {
        var backend = new CountingBackend();

        ConversionResult result = Py2Flow.convertWithLlm(SCRIPT, backend, " ", Py2FlowConfig.defaults());

        assertThat(backend.calls).isZero();
        assertThat(result.flow().recipesOfKind(RecipeKind.PREPARE)).hasSize(2);
        assertThat(Py2Flow.convertWithLlm(SCRIPT, null, "key", Py2FlowConfig.defaults()).flow().recipes())
            .hasSameSizeAs(result.flow().recipes());
    }

    @Test
    void backendAnswerDrivesTheFlow() {
        var backend = new CountingBackend();

        ConversionResult result = Py2Flow.convertWithLlm(SCRIPT, backend, "secret", Py2FlowConfig.defaults());

        assertThat(backend.calls).isEqualTo(1);
        assertThat(result.flow().dataset("a")).isPresent();
        assertThat(result.flow().recipesOfKind(RecipeKind.PREPARE)).isEmpty();
    }

    @Test
    void exportAndRenderUseTheSameFlow() {
        ConversionResult result = Py2Flow.convert(SCRIPT);

        Path project = Py2Flow.exportToDss(result.flow(), tempDir, false, Py2FlowConfig.defaults());

        assertThat(project.resolve("manifest.json")).exists();
        assertThat(Py2Flow.render(result.flow(), RenderFormat.PLANTUML)).contains("@startuml");
    }

    @Test
    void renderFollowsConfiguredDefaultFormat() {
        ConversionResult result = Py2Flow.convert(SCRIPT);

        assertThat(Py2Flow.render(result.flow(), Py2FlowConfig.defaults())).startsWith("<svg");
        assertThat(Py2Flow.render(result.flow(), Py2FlowConfig.fromMap(Map.of("default_format", "mermaid"))))
            .startsWith("flowchart LR");
        assertThatThrownBy(() -> Py2Flow.render(result.flow(), Py2FlowConfig.fromMap(Map.of("default_format", "gif"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown format: gif");
    }

    @Test
    void customIdiomConvertsProjectHelper() {
        String script = """
            import pandas as pd
            events = pd.read_csv('events.csv')
            events = events.dedupe_events()
            events.to_csv('clean.csv')
            """;
        Idiom dedupeEvents = new Idiom("dedupe-events", OperationTag.DEDUPE,
            site -> site.onFrame() && site.isMethod("dedupe_events"),
            site -> Idiom.Match.frame(new Operation.Dedupe(site.origin(), site.receiverVariable(), site.output(1),
                List.of("event_id"), "last"), 1));

        assertThat(Py2Flow.convert(script).isComplete()).isFalse();

        ConversionResult result = Py2Flow.convert(script, new PatternAnalyzer(IdiomTable.standardWith(dedupeEvents)),
            Py2FlowConfig.defaults());

        assertThat(result.isComplete()).isTrue();
        assertThat(result.flow().recipes()).extracting(Recipe::kind)
            .containsExactly(RecipeKind.SYNC, RecipeKind.DISTINCT, RecipeKind.SYNC);
        assertThat(result.flow().recipesOfKind(RecipeKind.DISTINCT)).singleElement()
            .satisfies(recipe -> assertThat(recipe.steps().get(0).columns()).containsExactly("event_id"));
    }
}
