package io.github.metadoc.util;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

public final class AtomicWrites {

    private AtomicWrites() {}

    /**
     * Replaces the content of {@code targetPath} with {@code bytes}.
     *
     * <p>On the default file system the bytes go to a temporary file next to the target, which is then moved over
     * the target, atomically where the file system supports it. A reader therefore sees either the old content or
     * the new content, never a truncated file. Other file systems (a zip archive opened as a file system) only
     * publish their entries when closed, so the entry is written in place.
     *
     * @throws IOException if writing or moving fails; the temporary file is removed in that case
     */
    public static void atomicOverwrite(Path targetPath, byte[] bytes) throws IOException {
        if (targetPath.getFileSystem() != FileSystems.getDefault()) {
            Files.write(
                    targetPath,
                    bytes,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
            return;
        }

        Path tempFile = Files.createTempFile(targetPath.getParent(), ".tmp-", ".part");
        try {
            Files.write(tempFile, bytes);
            try {
                Files.move(tempFile, targetPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
    }
}
