package dev.py2flow.config;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class Py2FlowConfigTest {

    @Test
    void nullsAndOutOfRangeValuesFallBackToDefaults() {
        var config = new Py2FlowConfig(null, " ", null, true, 7, null, null, null, null, -5);

        assertThat(config).isEqualTo(Py2FlowConfig.defaults().withOptimization(true, 2));
        assertThat(config.optimizationLevel()).isEqualTo(2);
        assertThat(config.llmTimeoutSeconds()).isEqualTo(Py2FlowConfig.DEFAULT_LLM_TIMEOUT_SECONDS);
        assertThat(config.projectKey()).isEqualTo("CONVERTED_PROJECT");
    }

    @Test
    void projectKeyIsNormalizedForDss() {
        assertThat(Py2FlowConfig.defaults().withProjectKey("sales-2024").normalizedProjectKey())
            .isEqualTo("SALES_2024");
    }

    @Test
    void disabledOptimizationMeansLevelZero() {
        var config = Py2FlowConfig.defaults().withOptimization(false, 2);

        assertThat(config.optimizationLevel()).isEqualTo(2);
        assertThat(config.effectiveOptimizationLevel()).isZero();
    }

    @Test
    void readsFlatAndGroupedKeys() {
        Map<String, Object> options = new HashMap<>();
        options.put("project", Map.of("key", "analytics", "flow_name", "daily"));
        options.put("optimization", Map.of("enabled", "false", "level", 2));
        options.put("dataset_prefix", "stg_");
        options.put("llm_timeout_seconds", "30");

        var config = Py2FlowConfig.fromMap(options);

        assertThat(config.projectKey()).isEqualTo("analytics");
        assertThat(config.flowName()).isEqualTo("daily");
        assertThat(config.optimize()).isFalse();
        assertThat(config.optimizationLevel()).isEqualTo(2);
        assertThat(config.datasetPrefix()).isEqualTo("stg_");
        assertThat(config.llmTimeoutSeconds()).isEqualTo(30);
    }

    @Test
    void wrongTypesAndUnknownKeysKeepDefaults() {
        var config = Py2FlowConfig.fromMap(Map.of(
            "optimize", "sometimes",
            "optimization_level", 1.5,
            "project_key", 42,
            "colour", "blue"));

        assertThat(config).isEqualTo(Py2FlowConfig.defaults());
    }

    @Test
    void toMapReadsBack() {
        var config = new Py2FlowConfig("anthropic", "KEY", "flow", false, 0, "html", "s3", "a_", "_b", 45);

        assertThat(Py2FlowConfig.fromMap(config.toMap())).isEqualTo(config);
        assertThat(Py2FlowConfig.fromMap(null)).isEqualTo(Py2FlowConfig.defaults());
    }
}
