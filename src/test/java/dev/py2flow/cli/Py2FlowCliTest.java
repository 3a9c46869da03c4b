package dev.py2flow.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class Py2FlowCliTest {

    private static final String CLEAN_SCRIPT = """
        import pandas as pd
        df = pd.read_csv('events.csv')
        df = df.drop_duplicates()
        df.to_csv('clean_events.csv', index=False)
        """;

    private static final String PARTIAL_SCRIPT = """
        import pandas as pd
        df = pd.read_csv('events.csv')
        weird = df.frobnicate(3)
        df = df.drop_duplicates()
        df.to_csv('clean_events.csv', index=False)
        """;

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        var commandLine = new CommandLine(new Py2FlowCli());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private Path script(String source) throws IOException {
        return Files.writeString(tempDir.resolve("pipeline.py"), source);
    }

    @Test
    void printsConfiguredDefaultFormatWhenNoneIsGiven() throws IOException {
        int code = run(script(CLEAN_SCRIPT).toString());

        assertThat(code).isEqualTo(Py2FlowCli.EXIT_OK);
        assertThat(out.toString()).startsWith("<svg").contains("<title>converted_flow</title>");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void configFileSuppliesFormatAndFlowName() throws IOException {
        Path config = Files.writeString(tempDir.resolve("py2flow.yaml"), """
            project:
              flow_name: nightly
            output:
              format: ascii
            """);

        int code = run(script(CLEAN_SCRIPT).toString(), "--config", config.toString());

        assertThat(code).isEqualTo(Py2FlowCli.EXIT_OK);
        assertThat(out.toString()).startsWith("Flow: nightly").contains("Connections", "(DI)");
    }

    @Test
    void formatOptionOverridesConfigFile() throws IOException {
        Path config = Files.writeString(tempDir.resolve("py2flow.yaml"), "default_format: ascii\n");

        int code = run(script(CLEAN_SCRIPT).toString(), "--config", config.toString(), "--format", "mermaid");

        assertThat(code).isZero();
        assertThat(out.toString()).startsWith("flowchart LR");
    }

    @Test
    void writesJsonToOutputFile() throws IOException {
        Path target = tempDir.resolve("flow.json");

        int code = run(script(CLEAN_SCRIPT).toString(), "--format", "json", "--flow-name", "events", "-o",
            target.toString());

        assertThat(code).isZero();
        assertThat(out.toString()).contains("Wrote " + target);
        assertThat(target).content().contains("\"flow_name\" : \"events\"", "\"kind\" : \"distinct\"");
    }

    @Test
    void summaryAndLineageFollowTheDiagram() throws IOException {
        int code = run(script(CLEAN_SCRIPT).toString(), "--format", "mermaid", "--summary", "--lineage", "user_id");

        assertThat(code).isZero();
        assertThat(out.toString())
            .startsWith("flowchart LR")
            .contains("total_recipes: ", "Lineage of ");
    }

    @Test
    void gapsAreWarningsUnlessStrict() throws IOException {
        Path path = script(PARTIAL_SCRIPT);

        assertThat(run(path.toString())).isEqualTo(Py2FlowCli.EXIT_OK);
        assertThat(err.toString()).contains("warning: line 3: df.frobnicate(3)");

        assertThat(run(path.toString(), "--strict")).isEqualTo(Py2FlowCli.EXIT_GAPS);
    }

    @Test
    void exportsBundle() throws IOException {
        Path exportDir = tempDir.resolve("bundles");

        int code = run(script(CLEAN_SCRIPT).toString(), "--export-dss", exportDir.toString(), "--project-key",
            "events-demo", "--zip");

        assertThat(code).isZero();
        assertThat(exportDir.resolve("EVENTS_DEMO.zip")).exists();
        assertThat(out.toString()).contains("Exported DSS bundle to");
    }

    @Test
    void missingScriptFails() {
        int code = run(tempDir.resolve("absent.py").toString());

        assertThat(code).isEqualTo(Py2FlowCli.EXIT_FAILURE);
        assertThat(err.toString()).startsWith("Error: ");
    }

    @Test
    void unknownFormatFails() throws IOException {
        int code = run(script(CLEAN_SCRIPT).toString(), "--format", "gif");

        assertThat(code).isEqualTo(Py2FlowCli.EXIT_FAILURE);
        assertThat(err.toString()).contains("Error: Unknown format: gif");
    }
}
