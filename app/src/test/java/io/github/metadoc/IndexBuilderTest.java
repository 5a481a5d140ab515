package io.github.metadoc;

import static io.github.metadoc.testutil.SemanticdbFixtures.document;
import static io.github.metadoc.testutil.SemanticdbFixtures.writeBinary;
import static io.github.metadoc.testutil.SemanticdbFixtures.writeJson;
import static org.junit.jupiter.api.Assertions.*;

import io.github.metadoc.index.IndexProgress;
import io.github.metadoc.index.IndexRecords;
import io.github.metadoc.index.IndexWriter;
import io.github.metadoc.index.Position;
import io.github.metadoc.index.Range;
import io.github.metadoc.index.SymbolDigest;
import io.github.metadoc.semanticdb.Semanticdb;
import io.github.metadoc.util.FileUtil;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class IndexBuilderTest {

    @TempDir
    Path tempDir;

    private Path classes;
    private Path site;

    @BeforeEach
    void setUp() throws IOException {
        classes = tempDir.resolve("classes");
        site = tempDir.resolve("site");
        var semanticdb = classes.resolve("META-INF/semanticdb");
        writeBinary(
                semanticdb,
                "A.scala.semanticdb",
                document("A.scala")
                        .definition("pkg.Foo#", 1, 6, 1, 9)
                        .reference("pkg.Bar.", 2, 2, 2, 5)
                        .build());
        writeJson(
                semanticdb,
                "B.scala.semanticdb.json",
                document("B.scala").reference("pkg.Foo#", 5, 4, 5, 7).build());
    }

    private MetadocConfig config() {
        return MetadocConfig.defaults(site, List.of(classes)).withParallelism(2);
    }

    private static List<Path> symbolFiles(Path root) throws IOException {
        try (Stream<Path> files = Files.list(root.resolve(IndexWriter.SYMBOL_DIR))) {
            return files.sorted().toList();
        }
    }

    @Test
    void testBuildsSiteFromBinaryAndJsonDocuments() throws Exception {
        var summary = new IndexBuilder(config(), IndexProgress.NO_OP).run();

        assertEquals(site, summary.target());
        assertEquals(2, summary.filesScanned());
        assertEquals(0, summary.filesFailed());
        assertEquals(2, summary.documentsIndexed());
        assertEquals(2, summary.symbolsAccumulated());
        assertEquals(1, summary.symbolsPublished());
        assertEquals(2, summary.workspaceFiles());

        var symbols = symbolFiles(site);
        assertEquals(1, symbols.size(), "pkg.Bar. has no definition and must not be published");
        assertEquals(SymbolDigest.encode("pkg.Foo#"), symbols.get(0).getFileName().toString());

        var entry = IndexRecords.readSymbolIndex(Files.readAllBytes(symbols.get(0)));
        assertEquals("pkg.Foo#", entry.symbol());
        assertEquals(new Position("A.scala", 1, 6, 1, 9), entry.definition());
        // the definition site is not a reference, so the defining file has no reference list at all
        assertFalse(entry.references().containsKey("A.scala"));
        assertEquals(Map.of("B.scala", List.of(new Range(5, 4, 5, 7))), entry.references());

        var workspace = IndexRecords.readWorkspace(Files.readAllBytes(site.resolve(IndexWriter.WORKSPACE_FILE)));
        assertEquals(List.of("A.scala", "B.scala"), workspace);
    }

    @Test
    void testCopiesDocuments() throws Exception {
        new IndexBuilder(config(), IndexProgress.NO_OP).run();

        var copy = site.resolve("semanticdb/B.scala.semanticdb");
        assertTrue(Files.isRegularFile(copy));
        var docs = Semanticdb.TextDocuments.parseFrom(Files.readAllBytes(copy));
        assertEquals(1, docs.getDocumentsCount());
        assertEquals("B.scala", docs.getDocuments(0).getUri());
    }

    @Test
    void testZipTarget() throws Exception {
        var summary = new IndexBuilder(config().withZip(true), IndexProgress.NO_OP).run();

        var zip = site.resolve(Target.ZIP_NAME).toAbsolutePath();
        assertEquals(zip, summary.target());
        assertFalse(Files.exists(site.resolve(IndexWriter.SYMBOL_DIR)));
        try (var fs = FileSystems.newFileSystem(zip, (ClassLoader) null)) {
            var root = fs.getPath("/");
            assertEquals(1, symbolFiles(root).size());
            var workspace = IndexRecords.readWorkspace(Files.readAllBytes(root.resolve(IndexWriter.WORKSPACE_FILE)));
            assertEquals(List.of("A.scala", "B.scala"), workspace);
            assertTrue(Files.exists(root.resolve("semanticdb/A.scala.semanticdb")));
        }
    }

    @Test
    void testUndecodableFileIsSkipped() throws Exception {
        var broken = classes.resolve("META-INF/semanticdb/Broken.scala.semanticdb.json");
        Files.writeString(broken, "{ this is not json");

        var summary = new IndexBuilder(config(), IndexProgress.NO_OP).run();

        assertEquals(3, summary.filesScanned());
        assertEquals(1, summary.filesFailed());
        assertEquals(1, summary.symbolsPublished());
    }

    @Test
    void testFirstDefinitionWins() throws Exception {
        writeBinary(
                classes.resolve("META-INF/semanticdb"),
                "C.scala.semanticdb",
                document("C.scala").definition("pkg.Foo#", 7, 0, 7, 3).build());

        new IndexBuilder(config().withParallelism(1), IndexProgress.NO_OP).run();

        var record = Files.readAllBytes(new IndexWriter(site).symbolPath("pkg.Foo#"));
        var entry = IndexRecords.readSymbolIndex(record);
        assertEquals("A.scala", entry.definition().filename());
    }

    private void replaceInputWithNewDocument() throws IOException {
        assertTrue(FileUtil.deleteRecursively(classes));
        writeBinary(
                classes.resolve("META-INF/semanticdb"),
                "New.scala.semanticdb",
                document("New.scala").definition("pkg.New#", 0, 6, 0, 9).build());
    }

    @Test
    void testRerunReplacesPreviousOutput() throws Exception {
        new IndexBuilder(config(), IndexProgress.NO_OP).run();
        replaceInputWithNewDocument();

        new IndexBuilder(config(), IndexProgress.NO_OP).run();

        var symbols = symbolFiles(site);
        assertEquals(1, symbols.size());
        assertEquals(SymbolDigest.encode("pkg.New#"), symbols.get(0).getFileName().toString());
        var workspace = IndexRecords.readWorkspace(Files.readAllBytes(site.resolve(IndexWriter.WORKSPACE_FILE)));
        assertEquals(List.of("New.scala"), workspace);
        assertFalse(Files.exists(site.resolve("semanticdb/A.scala.semanticdb")));
        assertTrue(Files.exists(site.resolve("semanticdb/New.scala.semanticdb")));
    }

    @Test
    void testZipRerunReplacesPreviousArchive() throws Exception {
        new IndexBuilder(config().withZip(true), IndexProgress.NO_OP).run();
        replaceInputWithNewDocument();

        new IndexBuilder(config().withZip(true), IndexProgress.NO_OP).run();

        try (var fs = FileSystems.newFileSystem(site.resolve(Target.ZIP_NAME), (ClassLoader) null)) {
            var root = fs.getPath("/");
            var symbols = symbolFiles(root);
            assertEquals(1, symbols.size());
            assertEquals(SymbolDigest.encode("pkg.New#"), symbols.get(0).getFileName().toString());
            assertFalse(Files.exists(root.resolve("semanticdb/A.scala.semanticdb")));
            var workspace = IndexRecords.readWorkspace(Files.readAllBytes(root.resolve(IndexWriter.WORKSPACE_FILE)));
            assertEquals(List.of("New.scala"), workspace);
        }
    }

    @Test
    void testCleanTargetFirst() throws Exception {
        var stale = site.resolve("stale.txt");
        Files.createDirectories(site);
        Files.writeString(stale, "left over");

        new IndexBuilder(config(), IndexProgress.NO_OP).run();
        assertTrue(Files.exists(stale), "existing files are kept unless cleaning is requested");

        new IndexBuilder(config().withCleanTargetFirst(true), IndexProgress.NO_OP).run();
        assertFalse(Files.exists(stale));
        assertTrue(Files.exists(site.resolve(IndexWriter.WORKSPACE_FILE)));
    }

    @Test
    void testMissingRootFailsRun() {
        var config = MetadocConfig.defaults(site, List.of(tempDir.resolve("does-not-exist")));

        assertThrows(IOException.class, () -> new IndexBuilder(config, IndexProgress.NO_OP).run());
    }

    @Test
    void testReportsPhasesInOrder() throws Exception {
        var events = Collections.synchronizedList(new ArrayList<String>());
        IndexProgress recorder = new IndexProgress() {
            @Override
            public void start(String task, int total) {
                events.add("start " + task + " " + total);
            }

            @Override
            public void complete(String task, boolean success) {
                events.add("complete " + task + " " + success);
            }
        };

        new IndexBuilder(config(), recorder).run();

        assertEquals(
                List.of(
                        "start " + IndexBuilder.SCAN_TASK + " 1",
                        "complete " + IndexBuilder.SCAN_TASK + " true",
                        "start " + IndexBuilder.INDEX_TASK + " 2",
                        "complete " + IndexBuilder.INDEX_TASK + " true",
                        "start " + IndexBuilder.WRITE_TASK + " 1",
                        "complete " + IndexBuilder.WRITE_TASK + " true"),
                events);
    }
}
