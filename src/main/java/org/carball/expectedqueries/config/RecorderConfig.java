package org.carball.expectedqueries.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.Set;

@Data
@Builder(toBuilder = true)
@Slf4j
public class RecorderConfig {

    /**
     * Frames whose class name starts with one of these are trimmed from captured stack traces.
     */
    public static final Set<String> DEFAULT_STACK_TRACE_IGNORE = Set.of(
            "org.carball.expectedqueries.",
            "java.",
            "javax.",
            "jdk.",
            "sun.",
            "com.sun.proxy.",
            "org.junit.");

    // Classification
    @Builder.Default
    private boolean lookInsideSubselect = false;

    @Builder.Default
    private ClassifierMode classifierMode = ClassifierMode.REGEX;

    // Stack trace capture
    @Builder.Default
    private boolean captureStackTraces = true;

    @Builder.Default
    private Set<String> stackTraceIgnore = new LinkedHashSet<>(DEFAULT_STACK_TRACE_IGNORE);

    @Builder.Default
    private int maxStackTraceFrames = 20;

    public static RecorderConfig defaults() {
        return RecorderConfig.builder().build();
    }

    /**
     * Logs warnings for values that are legal but probably not intended.
     */
    public void validate() {
        if (captureStackTraces && (stackTraceIgnore == null || stackTraceIgnore.isEmpty())) {
            log.warn("Stack traces are captured with an empty ignore list; traces will include JDK and library frames");
        }

        if (maxStackTraceFrames <= 0) {
            log.warn("Max stack trace frames ({}) should be positive; captured traces will be empty",
                    maxStackTraceFrames);
        }
    }

    public String getConfigurationSummary() {
        return String.format("classifier=%s, lookInsideSubselect=%s, captureStackTraces=%s, "
                        + "maxStackTraceFrames=%d, stackTraceIgnore=%s",
                classifierMode, lookInsideSubselect, captureStackTraces, maxStackTraceFrames, stackTraceIgnore);
    }
}
