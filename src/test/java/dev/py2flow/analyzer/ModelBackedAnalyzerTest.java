package dev.py2flow.analyzer;

import dev.py2flow.backend.CompletionBackend;
import dev.py2flow.backend.CompletionResponse;
import dev.py2flow.config.Py2FlowConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ModelBackedAnalyzerTest {

    private static final String DOCUMENT =
        "{\"operations\": [{\"op\": \"read\", \"line\": 1, \"output\": \"df\", \"path\": \"a.csv\", \"format\": \"csv\"}]}";

    /** Replays canned responses and records the prompts it was sent. */
    private static final class ScriptedBackend implements CompletionBackend {

        private final Deque<CompletionResponse> responses;
        private final List<String> prompts = new ArrayList<>();
        private final List<String> models = new ArrayList<>();
        private Duration lastTimeout;

        ScriptedBackend(CompletionResponse... responses) {
            this.responses = new ArrayDeque<>(List.of(responses));
        }

        @Override
        public CompletionResponse complete(String prompt, String model, Duration timeout) {
            prompts.add(prompt);
            models.add(model);
            lastTimeout = timeout;
            return responses.removeFirst();
        }

        @Override
        public String getName() {
            return "scripted";
        }

        @Override
        public String defaultModel() {
            return "scripted-small";
        }
    }

    @Test
    void returnsOperationsFromFirstAnswer() {
        var backend = new ScriptedBackend(CompletionResponse.ok("Analysis done.\n" + DOCUMENT));
        var analyzer = new ModelBackedAnalyzer(backend);

        AnalysisResult result = analyzer.analyze("df = pd.read_csv('a.csv')\n", Py2FlowConfig.defaults());

        assertThat(result.isComplete()).isTrue();
        assertThat(result.operations()).extracting(Operation::tag).containsExactly(OperationTag.READ);
        assertThat(backend.prompts).hasSize(1);
        assertThat(backend.prompts.get(0)).contains("   1| df = pd.read_csv('a.csv')");
        assertThat(backend.models).containsExactly("scripted-small");
        assertThat(backend.lastTimeout).isEqualTo(Duration.ofSeconds(Py2FlowConfig.defaults().llmTimeoutSeconds()));
        assertThat(analyzer.name()).isEqualTo("scripted");
    }

    @Test
    void retriesOnceWithReminderAfterUnusableAnswer() {
        var backend = new ScriptedBackend(CompletionResponse.ok("Sorry, here you go: operations are a read."),
            CompletionResponse.ok(DOCUMENT));
        var analyzer = new ModelBackedAnalyzer(backend, "big-model");

        AnalysisResult result = analyzer.analyze("df = pd.read_csv('a.csv')\n", Py2FlowConfig.defaults());

        assertThat(result.operations()).hasSize(1);
        assertThat(backend.prompts).hasSize(2);
        assertThat(backend.prompts.get(1)).contains("No JSON block found in response");
        assertThat(backend.models).containsOnly("big-model");
    }

    @Test
    void secondUnusableAnswerBecomesWholeScriptGap() {
        var backend = new ScriptedBackend(CompletionResponse.ok("no idea"), CompletionResponse.ok("{\"ops\": 1}"));

        AnalysisResult result = new ModelBackedAnalyzer(backend).analyze("x = 1\n", Py2FlowConfig.defaults());

        assertThat(result.operations()).isEmpty();
        assertThat(result.gaps()).singleElement().satisfies(gap -> {
            assertThat(gap.construct()).isEqualTo(ModelBackedAnalyzer.WHOLE_SCRIPT);
            assertThat(gap.reason()).isEqualTo("unusable model response: Missing or non-list 'operations' field");
        });
    }

    @Test
    void backendFailureBecomesWholeScriptGap() {
        var backend = new ScriptedBackend(CompletionResponse.failed("HTTP 503"));

        AnalysisResult result = new ModelBackedAnalyzer(backend).analyze("x = 1\n", Py2FlowConfig.defaults());

        assertThat(result.gaps()).singleElement()
            .satisfies(gap -> assertThat(gap.reason()).isEqualTo("model backend failed: HTTP 503"));
        assertThat(backend.prompts).hasSize(1);
    }
}
