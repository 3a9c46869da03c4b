package dev.py2flow.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.py2flow.SampleFlows;
import dev.py2flow.config.Py2FlowConfig;
import dev.py2flow.engine.CycleDetectedException;
import dev.py2flow.model.Dataset;
import dev.py2flow.model.DatasetRole;
import dev.py2flow.model.Flow;
import dev.py2flow.model.Recipe;
import dev.py2flow.model.RecipeKind;
import dev.py2flow.model.StepType;
import dev.py2flow.model.SubStep;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DssExporterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private DssExporter exporter(String projectKey) {
        return new DssExporter(Py2FlowConfig.defaults().withProjectKey(projectKey), BundleFileWriter.FILES, CLOCK);
    }

    @Test
    void writesProjectDirectory() throws IOException {
        Path project = exporter("sales-report").export(SampleFlows.customerRevenue(), tempDir, false);

        assertThat(project).isEqualTo(tempDir.resolve("SALES_REPORT"));
        assertThat(project.resolve("project.json")).exists();
        assertThat(project.resolve("params.json")).exists();
        assertThat(project.resolve("flow/zones.json")).exists();
        assertThat(project.resolve("README.md")).content().contains("Flow: customer_revenue");
        assertThat(project.resolve("datasets/customers.json")).exists();
        assertThat(project.resolve("recipes/join_joined.json")).exists();

        JsonNode projectJson = MAPPER.readTree(project.resolve("project.json").toFile());
        assertThat(projectJson.get("projectKey").asText()).isEqualTo("SALES_REPORT");
        assertThat(projectJson.get("counts").get("recipes").asInt()).isEqualTo(3);

        JsonNode input = MAPPER.readTree(project.resolve("datasets/customers.json").toFile());
        assertThat(input.get("type").asText()).isEqualTo("Filesystem");
        assertThat(input.get("params").get("path").asText()).isEqualTo("data/customers.csv");
        assertThat(input.get("schema").get("columns")).hasSize(3);

        JsonNode managed = MAPPER.readTree(project.resolve("datasets/joined.json").toFile());
        assertThat(managed.get("managed").asBoolean()).isTrue();
        assertThat(managed.get("params").get("path").asText()).isEqualTo("/SALES_REPORT/joined");
    }

    @Test
    void recipeDocumentsCarryDssPayloads() throws IOException {
        Path project = exporter("P").export(SampleFlows.customerRevenue(), tempDir, false);

        JsonNode join = MAPPER.readTree(project.resolve("recipes/join_joined.json").toFile());
        assertThat(join.get("type").asText()).isEqualTo("join");
        assertThat(join.get("inputs").get("main").get("items").get(1).get("ref").asText()).isEqualTo("orders");
        JsonNode condition = join.get("params").get("joins").get(0).get("on").get(0);
        assertThat(condition.get("column1").get("name").asText()).isEqualTo("customer_id");
        assertThat(join.get("customMeta").get("sourceLines").get(0).asInt()).isEqualTo(6);

        JsonNode group = MAPPER.readTree(project.resolve("recipes/group_revenue.json").toFile());
        assertThat(group.get("type").asText()).isEqualTo("grouping");
        JsonNode value = group.get("params").get("values").get(0);
        assertThat(value.get("function").asText()).isEqualTo("SUM");
        assertThat(value.get("outputName").asText()).isEqualTo("total_amount");

        JsonNode prepare = MAPPER.readTree(project.resolve("recipes/prepare_customers_clean.json").toFile());
        assertThat(prepare.get("type").asText()).isEqualTo("shaker");
        assertThat(prepare.get("params").get("steps")).hasSize(2);
    }

    @Test
    void manifestListsRecipesInBuildOrder() throws IOException {
        Path project = exporter("P").export(SampleFlows.customerRevenue(), tempDir, false);

        JsonNode manifest = MAPPER.readTree(project.resolve("manifest.json").toFile());
        assertThat(manifest.get("recipes").toString()).isEqualTo(
            "[\"recipes/prepare_customers_clean.json\",\"recipes/join_joined.json\",\"recipes/group_revenue.json\"]");
        assertThat(manifest.get("generatedOn").asLong()).isEqualTo(CLOCK.millis());
    }

    @Test
    void zipReplacesDirectory() throws IOException {
        Path zip = exporter("demo").export(SampleFlows.customerRevenue(), tempDir, true);

        assertThat(zip).isEqualTo(tempDir.resolve("DEMO.zip")).exists();
        assertThat(tempDir.resolve("DEMO")).doesNotExist();
        try (var archive = new ZipFile(zip.toFile())) {
            List<String> names = Collections.list(archive.entries()).stream().map(ZipEntry::getName).toList();
            assertThat(names).contains("project.json", "manifest.json", "README.md", "datasets/revenue.json",
                "recipes/group_revenue.json");
            assertThat(names).isSorted();
        }
    }

    @Test
    void failedWriteRemovesEverything() {
        BundleFileWriter failing = (file, content) -> {
            if (file.getFileName().toString().equals("README.md")) {
                throw new IOException("disk full");
            }
            BundleFileWriter.FILES.write(file, content);
        };
        Path destination = tempDir.resolve("out");
        var exporter = new DssExporter(Py2FlowConfig.defaults(), failing, CLOCK);

        assertThatThrownBy(() -> exporter.export(SampleFlows.customerRevenue(), destination, false))
            .isInstanceOf(BundleExportException.class)
            .hasMessageContaining("disk full")
            .satisfies(e -> {
                var failure = (BundleExportException) e;
                assertThat(failure.getErrorCode()).isEqualTo("BUNDLE_EXPORT");
                assertThat(failure.getDestination()).isEqualTo(destination);
            });
        assertThat(destination).doesNotExist();
    }

    @Test
    void cyclicFlowWritesNothing() throws IOException {
        assertThatThrownBy(() -> exporter("P").export(SampleFlows.cyclic(), tempDir, false))
            .isInstanceOf(CycleDetectedException.class);
        try (var entries = Files.list(tempDir)) {
            assertThat(entries).isEmpty();
        }
    }

    @Test
    void existingProjectIsNotOverwritten() throws IOException {
        Path existing = Files.createDirectories(tempDir.resolve("P"));
        Files.writeString(existing.resolve("keep.txt"), "mine");

        assertThatThrownBy(() -> exporter("P").export(SampleFlows.customerRevenue(), tempDir, false))
            .isInstanceOf(BundleExportException.class)
            .hasMessageContaining("already exists");
        assertThat(existing.resolve("keep.txt")).hasContent("mine");
    }

    @Test
    void nameThatLeavesTheProjectIsRejectedBeforeWriting() throws IOException {
        var flow = new Flow("escape");
        flow.addDataset(Dataset.of("events", DatasetRole.INPUT));
        flow.addDataset(Dataset.of("../../escaped", DatasetRole.OUTPUT));
        flow.addRecipe(new Recipe("sync_escaped", RecipeKind.SYNC, List.of("events"), List.of("../../escaped"),
            List.of(new SubStep(StepType.SYNC, List.of(), Map.of(), List.of())), null, List.of()));
        Path destination = tempDir.resolve("out");
        var exporter = new DssExporter(Py2FlowConfig.defaults().withOptimization(false, 0), BundleFileWriter.FILES,
            CLOCK);

        assertThatThrownBy(() -> exporter.export(flow, destination, false))
            .isInstanceOf(BundleExportException.class)
            .hasMessageContaining("../../escaped");
        assertThat(destination).doesNotExist();
        assertThat(tempDir.resolve("escaped.json")).doesNotExist();
    }
}
