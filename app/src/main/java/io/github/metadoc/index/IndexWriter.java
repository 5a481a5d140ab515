package io.github.metadoc.index;

import io.github.metadoc.semanticdb.Semanticdb;
import io.github.metadoc.util.AtomicWrites;
import io.github.metadoc.util.FileUtil;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Persists the index below a target root:
 *
 * <pre>
 * root/symbol/&lt;sha-512 hex of the symbol&gt;   one SymbolIndex record per published symbol
 * root/index.workspace                      the Workspace record listing every file
 * root/semanticdb/&lt;uri&gt;.semanticdb         one single-document copy per input document
 * </pre>
 *
 * Every record is replaced as a whole, see {@link AtomicWrites}. Methods may be called concurrently for distinct
 * records.
 */
public final class IndexWriter {
    private static final Logger logger = LogManager.getLogger(IndexWriter.class);

    public static final String SYMBOL_DIR = "symbol";
    public static final String SEMANTICDB_DIR = "semanticdb";
    public static final String WORKSPACE_FILE = "index.workspace";

    private final Path root;
    private final Path symbolRoot;
    private final Path semanticdbRoot;

    public IndexWriter(Path root) {
        this.root = root;
        this.symbolRoot = root.resolve(SYMBOL_DIR);
        this.semanticdbRoot = root.resolve(SEMANTICDB_DIR);
    }

    /**
     * Removes the {@code symbol/} and {@code semanticdb/} trees of an earlier run and recreates an empty
     * {@code symbol/}. Other files under the root are left alone.
     */
    public void prepare() throws IOException {
        Files.createDirectories(root);
        for (var previous : new Path[] {symbolRoot, semanticdbRoot}) {
            if (FileUtil.deleteRecursively(previous)) {
                logger.debug("Removed previous output {}", previous);
            }
        }
        Files.createDirectories(symbolRoot);
    }

    public Path symbolPath(String symbol) {
        return symbolRoot.resolve(SymbolDigest.encode(symbol));
    }

    public Path workspacePath() {
        return root.resolve(WORKSPACE_FILE);
    }

    public void writeSymbol(SymbolEntry entry) throws IOException {
        if (!entry.hasDefinition()) {
            throw new IllegalArgumentException("Refusing to publish " + entry.symbol() + " without a definition");
        }
        var out = symbolPath(entry.symbol());
        AtomicWrites.atomicOverwrite(out, IndexRecords.toProto(entry).toByteArray());
        logger.trace("Wrote {} to {}", entry.symbol(), out.getFileName());
    }

    public void writeWorkspace(Collection<String> filenames) throws IOException {
        AtomicWrites.atomicOverwrite(workspacePath(), IndexRecords.workspace(filenames).toByteArray());
        logger.debug("Wrote workspace with {} file(s)", filenames.size());
    }

    /**
     * Stores {@code document} alone in a {@code TextDocuments} message under {@code semanticdb/<uri>.semanticdb},
     * where the site fetches it on demand.
     *
     * @return false if the uri would place the copy outside {@code semanticdb/}; nothing is written then
     */
    public boolean writeDocumentCopy(Semanticdb.TextDocument document) throws IOException {
        Path out;
        try {
            out = FileUtil.resolveInside(semanticdbRoot, document.getUri() + DocumentParser.BINARY_SUFFIX);
        } catch (IllegalArgumentException e) {
            logger.warn("Not copying document with unsafe uri '{}': {}", document.getUri(), e.getMessage());
            return false;
        }
        var parent = out.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        var bytes = Semanticdb.TextDocuments.newBuilder()
                .addDocuments(document)
                .build()
                .toByteArray();
        AtomicWrites.atomicOverwrite(out, bytes);
        return true;
    }
}
