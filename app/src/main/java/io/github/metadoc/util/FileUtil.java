package io.github.metadoc.util;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

public final class FileUtil {
    private static final Logger logger = LogManager.getLogger(FileUtil.class);

    private FileUtil() {}

    /**
     * Deletes {@code path} and everything beneath it. Symbolic links are removed, not followed.
     *
     * @return false if nothing existed at {@code path}
     * @throws IOException on the first entry that cannot be deleted
     */
    public static boolean deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            return false;
        }
        Files.walkFileTree(path, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, @Nullable IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
        logger.debug("Deleted {}", path);
        return true;
    }

    /**
     * Resolves a slash-separated relative name under {@code root}, refusing names that are absolute or climb out of
     * {@code root}.
     *
     * @throws IllegalArgumentException if {@code relative} does not stay inside {@code root}
     */
    public static Path resolveInside(Path root, String relative) {
        var resolved = root.resolve(relative).normalize();
        if (relative.startsWith("/") || !resolved.startsWith(root.normalize())) {
            throw new IllegalArgumentException("Path escapes %s: %s".formatted(root, relative));
        }
        return resolved;
    }
}
