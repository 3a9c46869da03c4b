package dev.py2flow.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Conversion settings, passed explicitly to every entry point.
 *
 * @param defaultProvider    analyzer used by {@code convert}: "rule-based" or a backend name
 * @param projectKey         key of the exported DSS project
 * @param flowName           name given to converted flows
 * @param optimize           run the optimizer before export
 * @param optimizationLevel  0 (off), 1 (merge prepare recipes) or 2 (also performance hints)
 * @param defaultFormat      render format used when none is given
 * @param defaultConnection  DSS connection written into exported datasets
 * @param datasetPrefix      prepended to every generated dataset name
 * @param datasetSuffix      appended to every generated dataset name
 * @param llmTimeoutSeconds  bound on one model-backed analysis call
 */
public record Py2FlowConfig(
    String defaultProvider,
    String projectKey,
    String flowName,
    boolean optimize,
    int optimizationLevel,
    String defaultFormat,
    String defaultConnection,
    String datasetPrefix,
    String datasetSuffix,
    int llmTimeoutSeconds
) {
    public static final String DEFAULT_PROVIDER = "rule-based";
    public static final String DEFAULT_PROJECT_KEY = "CONVERTED_PROJECT";
    public static final String DEFAULT_FLOW_NAME = "converted_flow";
    public static final boolean DEFAULT_OPTIMIZE = true;
    public static final int DEFAULT_OPTIMIZATION_LEVEL = 1;
    public static final String DEFAULT_FORMAT = "svg";
    public static final String DEFAULT_CONNECTION = "filesystem_managed";
    public static final String DEFAULT_DATASET_PREFIX = "";
    public static final String DEFAULT_DATASET_SUFFIX = "";
    public static final int DEFAULT_LLM_TIMEOUT_SECONDS = 120;

    private static final Logger LOG = LoggerFactory.getLogger(Py2FlowConfig.class);

    private static final Set<String> GROUPS = Set.of("provider", "project", "optimization", "naming", "output");

    public Py2FlowConfig {
        defaultProvider = orDefault(defaultProvider, DEFAULT_PROVIDER);
        projectKey = orDefault(projectKey, DEFAULT_PROJECT_KEY);
        flowName = orDefault(flowName, DEFAULT_FLOW_NAME);
        optimizationLevel = Math.max(0, Math.min(2, optimizationLevel));
        defaultFormat = orDefault(defaultFormat, DEFAULT_FORMAT);
        defaultConnection = orDefault(defaultConnection, DEFAULT_CONNECTION);
        datasetPrefix = datasetPrefix == null ? DEFAULT_DATASET_PREFIX : datasetPrefix;
        datasetSuffix = datasetSuffix == null ? DEFAULT_DATASET_SUFFIX : datasetSuffix;
        if (llmTimeoutSeconds <= 0) {
            llmTimeoutSeconds = DEFAULT_LLM_TIMEOUT_SECONDS;
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    public static Py2FlowConfig defaults() {
        return new Py2FlowConfig(DEFAULT_PROVIDER, DEFAULT_PROJECT_KEY, DEFAULT_FLOW_NAME, DEFAULT_OPTIMIZE,
            DEFAULT_OPTIMIZATION_LEVEL, DEFAULT_FORMAT, DEFAULT_CONNECTION, DEFAULT_DATASET_PREFIX,
            DEFAULT_DATASET_SUFFIX, DEFAULT_LLM_TIMEOUT_SECONDS);
    }

    /** The project key as DSS expects it: upper case, no dashes. */
    public String normalizedProjectKey() {
        return projectKey.toUpperCase(Locale.ROOT).replace('-', '_');
    }

    /** Optimization level actually applied: 0 when optimization is off. */
    public int effectiveOptimizationLevel() {
        return optimize ? optimizationLevel : 0;
    }

    public Py2FlowConfig withProjectKey(String key) {
        return new Py2FlowConfig(defaultProvider, key, flowName, optimize, optimizationLevel, defaultFormat,
            defaultConnection, datasetPrefix, datasetSuffix, llmTimeoutSeconds);
    }

    public Py2FlowConfig withFlowName(String name) {
        return new Py2FlowConfig(defaultProvider, projectKey, name, optimize, optimizationLevel, defaultFormat,
            defaultConnection, datasetPrefix, datasetSuffix, llmTimeoutSeconds);
    }

    public Py2FlowConfig withOptimization(boolean enabled, int level) {
        return new Py2FlowConfig(defaultProvider, projectKey, flowName, enabled, level, defaultFormat,
            defaultConnection, datasetPrefix, datasetSuffix, llmTimeoutSeconds);
    }

    /**
     * Build a config from a map of options. Keys may be flat
     * ({@code project_key}) or grouped ({@code project: {key: ...}}).
     * Unknown keys are ignored; values of the wrong type keep their default.
     */
    public static Py2FlowConfig fromMap(Map<String, ?> options) {
        var flat = new LinkedHashMap<String, Object>();
        if (options != null) {
            options.forEach((key, value) -> {
                if (GROUPS.contains(key) && value instanceof Map<?, ?> group) {
                    group.forEach((inner, innerValue) -> flat.put(flatKey(key, String.valueOf(inner)), innerValue));
                } else {
                    flat.put(key, value);
                }
            });
        }
        var reader = new OptionReader(flat);
        var config = new Py2FlowConfig(
            reader.string("default_provider", DEFAULT_PROVIDER),
            reader.string("project_key", DEFAULT_PROJECT_KEY),
            reader.string("flow_name", DEFAULT_FLOW_NAME),
            reader.bool("optimize", DEFAULT_OPTIMIZE),
            reader.integer("optimization_level", DEFAULT_OPTIMIZATION_LEVEL),
            reader.string("default_format", DEFAULT_FORMAT),
            reader.string("default_connection", DEFAULT_CONNECTION),
            reader.string("dataset_prefix", DEFAULT_DATASET_PREFIX),
            reader.string("dataset_suffix", DEFAULT_DATASET_SUFFIX),
            reader.integer("llm_timeout_seconds", DEFAULT_LLM_TIMEOUT_SECONDS));
        for (String key : flat.keySet()) {
            if (!reader.consumed(key)) {
                LOG.debug("Ignoring unknown config option '{}'", key);
            }
        }
        return config;
    }

    /** Grouped option names map onto the flat ones, e.g. project.key becomes project_key. */
    private static String flatKey(String group, String key) {
        return switch (group + "." + key) {
            case "provider.default", "provider.name" -> "default_provider";
            case "provider.timeout_seconds", "provider.llm_timeout_seconds" -> "llm_timeout_seconds";
            case "project.key" -> "project_key";
            case "project.flow_name", "project.name" -> "flow_name";
            case "optimization.enabled" -> "optimize";
            case "optimization.level" -> "optimization_level";
            case "naming.prefix", "naming.dataset_prefix" -> "dataset_prefix";
            case "naming.suffix", "naming.dataset_suffix" -> "dataset_suffix";
            case "output.format", "output.default_format" -> "default_format";
            case "output.connection", "output.default_connection" -> "default_connection";
            default -> group + "." + key;
        };
    }

    /** The nested form read by {@link #fromMap}. */
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        var provider = new LinkedHashMap<String, Object>();
        provider.put("default", defaultProvider);
        provider.put("timeout_seconds", llmTimeoutSeconds);
        map.put("provider", provider);
        var project = new LinkedHashMap<String, Object>();
        project.put("key", projectKey);
        project.put("flow_name", flowName);
        map.put("project", project);
        var optimization = new LinkedHashMap<String, Object>();
        optimization.put("enabled", optimize);
        optimization.put("level", optimizationLevel);
        map.put("optimization", optimization);
        var naming = new LinkedHashMap<String, Object>();
        naming.put("prefix", datasetPrefix);
        naming.put("suffix", datasetSuffix);
        map.put("naming", naming);
        var output = new LinkedHashMap<String, Object>();
        output.put("format", defaultFormat);
        output.put("connection", defaultConnection);
        map.put("output", output);
        return map;
    }

    /** Typed reads over the flattened option map, remembering which keys were used. */
    private static final class OptionReader {

        private final Map<String, Object> options;
        private final Set<String> consumed = new HashSet<>();

        OptionReader(Map<String, Object> options) {
            this.options = options;
        }

        boolean consumed(String key) {
            return consumed.contains(key);
        }

        String string(String key, String fallback) {
            Object value = take(key);
            if (value == null) {
                return fallback;
            }
            if (value instanceof String s) {
                return s;
            }
            return wrongType(key, value, "a string", fallback);
        }

        boolean bool(String key, boolean fallback) {
            Object value = take(key);
            if (value == null) {
                return fallback;
            }
            if (value instanceof Boolean b) {
                return b;
            }
            if (value instanceof String s && (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false"))) {
                return Boolean.parseBoolean(s);
            }
            return wrongType(key, value, "a boolean", fallback);
        }

        int integer(String key, int fallback) {
            Object value = take(key);
            if (value == null) {
                return fallback;
            }
            if (value instanceof Integer || value instanceof Long || value instanceof Short) {
                return ((Number) value).intValue();
            }
            if (value instanceof String s) {
                try {
                    return Integer.parseInt(s.strip());
                } catch (NumberFormatException e) {
                    return wrongType(key, value, "an integer", fallback);
                }
            }
            return wrongType(key, value, "an integer", fallback);
        }

        private Object take(String key) {
            consumed.add(key);
            return options.get(key);
        }

        private static <T> T wrongType(String key, Object value, String expected, T fallback) {
            LOG.warn("Config option '{}' should be {} but was '{}'; using default {}", key, expected, value, fallback);
            return fallback;
        }
    }
}
