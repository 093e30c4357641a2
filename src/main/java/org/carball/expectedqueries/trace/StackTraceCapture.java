package org.carball.expectedqueries.trace;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Captures the caller's stack as text, skipping frames of ignored classes so that the
 * first line points at the code that issued the query.
 */
public class StackTraceCapture {

    private static final StackWalker WALKER = StackWalker.getInstance();

    private final Set<String> ignorePrefixes;
    private final int maxFrames;

    /**
     * @param ignorePrefixes class name prefixes to skip; {@code null} skips nothing
     */
    public StackTraceCapture(Set<String> ignorePrefixes, int maxFrames) {
        this.ignorePrefixes = ignorePrefixes == null ? Set.of() : Set.copyOf(ignorePrefixes);
        this.maxFrames = Math.max(0, maxFrames);
    }

    public String capture() {
        return WALKER.walk(frames -> frames
                .filter(frame -> !isIgnored(frame.getClassName()))
                .limit(maxFrames)
                .map(frame -> "at " + frame.toStackTraceElement())
                .collect(Collectors.joining("\n")));
    }

    boolean isIgnored(String className) {
        for (String prefix : ignorePrefixes) {
            if (className.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
