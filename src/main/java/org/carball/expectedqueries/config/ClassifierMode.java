package org.carball.expectedqueries.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum ClassifierMode {
    /** Lexical rules only. */
    REGEX,
    /** Full parse with JSqlParser, falling back to the lexical rules. */
    PARSER;

    public static ClassifierMode fromName(String name) {
        for (ClassifierMode mode : values()) {
            if (mode.name().equalsIgnoreCase(name == null ? "" : name.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown classifier mode: " + name
                + ". Available modes: " + Arrays.stream(values())
                .map(m -> m.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(", ")));
    }
}
