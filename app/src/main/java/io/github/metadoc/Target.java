package io.github.metadoc;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Where a run writes its output: a plain directory, or the root of {@value #ZIP_NAME} opened as a file system. Large
 * corpora write many small records, and a single archive avoids the per-file overhead of the {@code symbol/}
 * directory.
 *
 * @param root the directory all records are resolved against
 * @param location what to report to the user
 */
public record Target(Path root, Path location, Closeable onClose) implements Closeable {

    public static final String ZIP_NAME = "metadoc.zip";

    public static Target open(Path target, boolean zip) throws IOException {
        if (!zip) {
            Files.createDirectories(target);
            return new Target(target, target, () -> {});
        }
        var out = target.resolve(ZIP_NAME).toAbsolutePath();
        Files.createDirectories(out.getParent());
        // an archive is never updated in place, every run starts a new one
        Files.deleteIfExists(out);
        var zipfs = FileSystems.newFileSystem(URI.create("jar:" + out.toUri()), Map.of("create", "true"));
        return new Target(zipfs.getPath("/"), out, zipfs);
    }

    @Override
    public void close() throws IOException {
        onClose.close();
    }
}
