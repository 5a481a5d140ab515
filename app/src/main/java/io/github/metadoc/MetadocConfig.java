package io.github.metadoc;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * Settings of one index run.
 *
 * <p>Built from {@link #defaults}, optionally overlaid with a properties file ({@link #withProperties}) and finally
 * with explicit command-line choices through the {@code with*} methods.
 */
public record MetadocConfig(
        Path target,
        List<Path> classpath,
        boolean cleanTargetFirst,
        boolean zip,
        boolean nonInteractive,
        int parallelism,
        int stackTraceDepth,
        boolean copyDocuments,
        boolean publishTermAliases) {

    public static final String PREFIX = "metadoc.";
    public static final int DEFAULT_STACK_TRACE_DEPTH = 10;

    public MetadocConfig {
        classpath = List.copyOf(classpath);
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        if (stackTraceDepth < 0) {
            throw new IllegalArgumentException("stackTraceDepth must be >= 0, got " + stackTraceDepth);
        }
    }

    public static MetadocConfig defaults(Path target, List<Path> classpath) {
        return new MetadocConfig(
                target,
                classpath,
                false,
                false,
                false,
                Runtime.getRuntime().availableProcessors(),
                DEFAULT_STACK_TRACE_DEPTH,
                true,
                false);
    }

    public static Properties loadProperties(Path file) throws IOException {
        var props = new Properties();
        try (var reader = Files.newBufferedReader(file)) {
            props.load(reader);
        }
        return props;
    }

    /** Overlays the {@code metadoc.*} keys present in {@code props}; absent keys keep their current value. */
    public MetadocConfig withProperties(Properties props) {
        return new MetadocConfig(
                target,
                classpath,
                bool(props, "cleanTargetFirst", cleanTargetFirst),
                bool(props, "zip", zip),
                bool(props, "nonInteractive", nonInteractive),
                integer(props, "parallelism", parallelism),
                integer(props, "stackTraceDepth", stackTraceDepth),
                bool(props, "copyDocuments", copyDocuments),
                bool(props, "publishTermAliases", publishTermAliases));
    }

    public MetadocConfig withCleanTargetFirst(boolean value) {
        return new MetadocConfig(
                target, classpath, value, zip, nonInteractive, parallelism, stackTraceDepth, copyDocuments,
                publishTermAliases);
    }

    public MetadocConfig withZip(boolean value) {
        return new MetadocConfig(
                target, classpath, cleanTargetFirst, value, nonInteractive, parallelism, stackTraceDepth,
                copyDocuments, publishTermAliases);
    }

    public MetadocConfig withNonInteractive(boolean value) {
        return new MetadocConfig(
                target, classpath, cleanTargetFirst, zip, value, parallelism, stackTraceDepth, copyDocuments,
                publishTermAliases);
    }

    public MetadocConfig withParallelism(int value) {
        return new MetadocConfig(
                target, classpath, cleanTargetFirst, zip, nonInteractive, value, stackTraceDepth, copyDocuments,
                publishTermAliases);
    }

    private static boolean bool(Properties props, String key, boolean fallback) {
        var raw = props.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on" -> true;
            case "false", "no", "off" -> false;
            default -> throw new IllegalArgumentException("Invalid boolean for %s%s: %s".formatted(PREFIX, key, raw));
        };
    }

    private static int integer(Properties props, String key, int fallback) {
        var raw = props.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for %s%s: %s".formatted(PREFIX, key, raw), e);
        }
    }
}
