package io.github.metadoc.util;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/** Renders exceptions for log lines where a full stack trace would drown everything else. */
public final class StackTraces {

    private StackTraces() {}

    /**
     * Formats {@code th} like {@link Throwable#printStackTrace()}, keeping at most {@code depth} frames of the
     * exception and of each cause.
     */
    public static String excerpt(Throwable th, int depth) {
        var sb = new StringBuilder();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = th;
        boolean first = true;
        while (current != null && seen.add(current)) {
            if (!first) {
                sb.append("\nCaused by: ");
            }
            sb.append(current);
            var frames = current.getStackTrace();
            int shown = Math.min(depth, frames.length);
            for (int i = 0; i < shown; i++) {
                sb.append("\n\tat ").append(frames[i]);
            }
            if (frames.length > shown) {
                sb.append("\n\t... ").append(frames.length - shown).append(" more");
            }
            current = current.getCause();
            first = false;
        }
        return sb.toString();
    }
}
