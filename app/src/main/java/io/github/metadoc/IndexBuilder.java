package io.github.metadoc;

import io.github.metadoc.index.DocumentParser;
import io.github.metadoc.index.IndexProgress;
import io.github.metadoc.index.IndexWriter;
import io.github.metadoc.index.MetadataScanner;
import io.github.metadoc.index.NamespaceReconciler;
import io.github.metadoc.index.OccurrenceAccumulator;
import io.github.metadoc.index.SemanticdbDecodeException;
import io.github.metadoc.index.SymbolEntry;
import io.github.metadoc.semanticdb.Semanticdb;
import io.github.metadoc.util.ExecutorServiceUtil;
import io.github.metadoc.util.FileUtil;
import io.github.metadoc.util.StackTraces;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs one full build of the symbol index:
 *
 * <ol>
 *   <li>scan the classpath for SemanticDB files,
 *   <li>decode every file and feed its documents to the {@link OccurrenceAccumulator}, copying each document to the
 *       target on the way,
 *   <li>reconcile term/type siblings on the finished snapshot,
 *   <li>write one record per published symbol, then the workspace manifest.
 * </ol>
 *
 * Scanning, parsing and writing each run on a fixed pool of {@link MetadocConfig#parallelism()} threads. A phase
 * only starts once the previous one has completed. Files that fail to decode are logged and skipped; any other
 * failure aborts the run, possibly leaving a partially written target behind.
 */
public final class IndexBuilder {
    private static final Logger logger = LogManager.getLogger(IndexBuilder.class);

    static final String SCAN_TASK = "Scanning semanticdb files";
    static final String INDEX_TASK = "Building symbol index";
    static final String WRITE_TASK = "Writing symbol index";

    private final MetadocConfig config;
    private final IndexProgress progress;
    private final DocumentParser parser = new DocumentParser();

    public IndexBuilder(MetadocConfig config, IndexProgress progress) {
        this.config = config;
        this.progress = progress;
    }

    @FunctionalInterface
    private interface PhaseBody<T> {
        T run(Runnable tick) throws IOException;
    }

    public IndexSummary run() throws IOException {
        if (config.cleanTargetFirst() && FileUtil.deleteRecursively(config.target())) {
            logger.info("Deleted existing target {}", config.target());
        }

        var executor = ExecutorServiceUtil.newFixedThreadExecutor(config.parallelism(), "metadoc-");
        try (var target = Target.open(config.target(), config.zip());
                var scanner = new MetadataScanner(executor)) {
            try {
                return build(target, scanner, executor);
            } finally {
                // drain the pool before the target and the scanned archives are closed
                ExecutorServiceUtil.shutdown(executor);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private IndexSummary build(Target target, MetadataScanner scanner, ExecutorService executor) throws IOException {
        var writer = new IndexWriter(target.root());
        writer.prepare();

        List<Path> paths = phase(SCAN_TASK, config.classpath().size(), tick -> scanner.scan(config.classpath(), tick));
        var accumulator = new OccurrenceAccumulator();
        var failed = new AtomicInteger();
        var documents = new AtomicInteger();
        phase(INDEX_TASK, paths.size(), tick -> {
            ExecutorServiceUtil.forEachParallel(executor, paths, path -> {
                try {
                    indexFile(path, accumulator, writer, documents, failed);
                } finally {
                    tick.run();
                }
            });
            return null;
        });

        var entries = accumulator.snapshot();
        List<SymbolEntry> published = new NamespaceReconciler(config.publishTermAliases()).reconcile(entries);
        phase(WRITE_TASK, published.size(), tick -> {
            ExecutorServiceUtil.forEachParallel(executor, published, entry -> {
                writer.writeSymbol(entry);
                tick.run();
            });
            return null;
        });

        var filenames = accumulator.filenames();
        writer.writeWorkspace(filenames);

        var summary = new IndexSummary(
                target.location(),
                paths.size(),
                failed.get(),
                documents.get(),
                entries.size(),
                published.size(),
                filenames.size());
        if (summary.filesFailed() > 0) {
            logger.warn("Index built with {} undecodable file(s): {}", summary.filesFailed(), summary);
        } else {
            logger.info("Index built: {}", summary);
        }
        return summary;
    }

    private void indexFile(
            Path path,
            OccurrenceAccumulator accumulator,
            IndexWriter writer,
            AtomicInteger documents,
            AtomicInteger failed)
            throws IOException {
        Semanticdb.TextDocuments docs;
        try {
            docs = parser.parse(path);
        } catch (SemanticdbDecodeException | IOException e) {
            failed.incrementAndGet();
            logger.warn("Skipping {}\n{}", path, StackTraces.excerpt(e, config.stackTraceDepth()));
            return;
        }
        for (var document : docs.getDocumentsList()) {
            accumulator.accept(document);
            if (config.copyDocuments()) {
                writer.writeDocumentCopy(document);
            }
            documents.incrementAndGet();
        }
    }

    private <T> T phase(String task, int length, PhaseBody<T> body) throws IOException {
        logger.info("{} ({})", task, length);
        progress.start(task, length);
        var counter = new AtomicInteger();
        Runnable tick = () -> progress.tick(task, counter.incrementAndGet());
        boolean success = false;
        try {
            T result = body.run(tick);
            success = true;
            return result;
        } finally {
            progress.complete(task, success);
        }
    }
}
