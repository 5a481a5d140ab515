package io.github.metadoc.index;

import io.github.metadoc.util.ExecutorServiceUtil;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Finds SemanticDB files under a list of classpath roots.
 *
 * <p>Directory roots are walked recursively. A {@code .jar} or {@code .zip} root is opened as a file system and its
 * entries are walked the same way; those file systems stay open until {@link #close()} so the returned paths remain
 * readable. Any other regular file is taken as-is if it has a metadata suffix.
 *
 * <p>Roots are walked in parallel. The result lists the files of each root in root order, sorted by path within a
 * root, so a run over the same input always sees the same order.
 */
public final class MetadataScanner implements Closeable {
    private static final Logger logger = LogManager.getLogger(MetadataScanner.class);

    private final ExecutorService executor;
    private final List<FileSystem> archives = new CopyOnWriteArrayList<>();

    public MetadataScanner(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * @param tick invoked once per finished root
     * @throws IOException if any root cannot be walked; no partial result is returned
     */
    public List<Path> scan(List<Path> classpath, Runnable tick) throws IOException {
        var perRoot = new ConcurrentHashMap<Integer, List<Path>>();
        var indexes = new ArrayList<Integer>(classpath.size());
        for (int i = 0; i < classpath.size(); i++) {
            indexes.add(i);
        }

        ExecutorServiceUtil.forEachParallel(executor, indexes, i -> {
            perRoot.put(i, scanRoot(classpath.get(i)));
            tick.run();
        });

        var result = new ArrayList<Path>();
        for (int i = 0; i < classpath.size(); i++) {
            result.addAll(perRoot.getOrDefault(i, List.of()));
        }
        logger.debug("Found {} metadata file(s) under {} root(s)", result.size(), classpath.size());
        return List.copyOf(result);
    }

    private List<Path> scanRoot(Path root) throws IOException {
        Path walkRoot = root;
        if (Files.isRegularFile(root) && isArchive(root)) {
            var fs = FileSystems.newFileSystem(root, (ClassLoader) null);
            archives.add(fs);
            walkRoot = fs.getPath("/");
        }

        var files = new ArrayList<Path>();
        Files.walkFileTree(walkRoot, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && DocumentParser.isMetadataFile(file)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(Comparator.comparing(Path::toString));
        logger.trace("{}: {} metadata file(s)", root, files.size());
        return files;
    }

    private static boolean isArchive(Path path) {
        var name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".jar") || name.endsWith(".zip");
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (var fs : archives) {
            try {
                fs.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        archives.clear();
        if (failure != null) {
            throw failure;
        }
    }
}
