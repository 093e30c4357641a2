package org.carball.expectedqueries.config;

import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_PREFIX = "EXPECTED_QUERIES_";
    static final String PROPERTY_PREFIX = "expectedqueries.";

    /**
     * Loads configuration using the hierarchy: system properties > env vars > defaults
     */
    public RecorderConfig loadConfiguration() {
        return loadConfiguration(System.getenv(), System.getProperties());
    }

    public RecorderConfig loadConfiguration(Map<String, String> env, Properties properties) {
        log.debug("Loading recorder configuration");

        RecorderConfig.RecorderConfigBuilder builder = RecorderConfig.defaults().toBuilder();

        // 1. Apply environment variables
        applyEnvironmentVariables(builder, env);

        // 2. Apply system properties (highest priority)
        applySystemProperties(builder, properties);

        RecorderConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    private void applyEnvironmentVariables(RecorderConfig.RecorderConfigBuilder builder, Map<String, String> env) {
        apply(builder, "look-inside-subselect", env.get(ENV_PREFIX + "LOOK_INSIDE_SUBSELECT"));
        apply(builder, "classifier", env.get(ENV_PREFIX + "CLASSIFIER"));
        apply(builder, "capture-stack-traces", env.get(ENV_PREFIX + "CAPTURE_STACK_TRACES"));
        apply(builder, "stack-trace-ignore", env.get(ENV_PREFIX + "STACK_TRACE_IGNORE"));
        apply(builder, "max-stack-trace-frames", env.get(ENV_PREFIX + "MAX_STACK_TRACE_FRAMES"));
    }

    private void applySystemProperties(RecorderConfig.RecorderConfigBuilder builder, Properties properties) {
        for (String option : new String[] {"look-inside-subselect", "classifier", "capture-stack-traces",
                "stack-trace-ignore", "max-stack-trace-frames"}) {
            apply(builder, option, properties.getProperty(PROPERTY_PREFIX + option));
        }
    }

    private void apply(RecorderConfig.RecorderConfigBuilder builder, String option, String value) {
        if (value == null || value.isBlank()) {
            return;
        }

        try {
            switch (option) {
                case "look-inside-subselect":
                    builder.lookInsideSubselect(parseBoolean(value));
                    break;
                case "classifier":
                    builder.classifierMode(ClassifierMode.fromName(value));
                    break;
                case "capture-stack-traces":
                    builder.captureStackTraces(parseBoolean(value));
                    break;
                case "stack-trace-ignore":
                    builder.stackTraceIgnore(parseList(value));
                    break;
                case "max-stack-trace-frames":
                    builder.maxStackTraceFrames(Integer.parseInt(value.trim()));
                    break;
            }
        } catch (IllegalArgumentException e) {
            log.warn("Invalid value for {}: {} ({})", option, value, e.getMessage());
        }
    }

    private static boolean parseBoolean(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "true", "yes", "1", "on" -> true;
            case "false", "no", "0", "off" -> false;
            default -> throw new IllegalArgumentException("not a boolean");
        };
    }

    private static Set<String> parseList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Recorder Configuration Options:

            System Properties:
              -Dexpectedqueries.look-inside-subselect=<bool>   Attribute sub-selects to their first inner table
              -Dexpectedqueries.classifier=<regex|parser>      Classification strategy
              -Dexpectedqueries.capture-stack-traces=<bool>    Capture a stack trace per query
              -Dexpectedqueries.stack-trace-ignore=<a,b,...>   Class name prefixes trimmed from stack traces
              -Dexpectedqueries.max-stack-trace-frames=<num>   Frames kept per captured stack trace

            Environment Variables:
              EXPECTED_QUERIES_LOOK_INSIDE_SUBSELECT   Same as expectedqueries.look-inside-subselect
              EXPECTED_QUERIES_CLASSIFIER              Same as expectedqueries.classifier
              EXPECTED_QUERIES_CAPTURE_STACK_TRACES    Same as expectedqueries.capture-stack-traces
              EXPECTED_QUERIES_STACK_TRACE_IGNORE      Same as expectedqueries.stack-trace-ignore
              EXPECTED_QUERIES_MAX_STACK_TRACE_FRAMES  Same as expectedqueries.max-stack-trace-frames

            Priority Order (highest to lowest):
              1. System properties
              2. Environment variables
              3. Built-in defaults
            """;
    }
}
