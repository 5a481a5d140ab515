package io.github.metadoc.cli;

import static io.github.metadoc.testutil.SemanticdbFixtures.document;
import static io.github.metadoc.testutil.SemanticdbFixtures.writeBinary;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.metadoc.Target;
import io.github.metadoc.index.IndexWriter;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

public class MetadocCliTest {

    @TempDir
    Path tempDir;

    private Path classes;
    private Path site;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws Exception {
        classes = tempDir.resolve("classes");
        site = tempDir.resolve("site");
        writeBinary(
                classes.resolve("META-INF/semanticdb"),
                "A.scala.semanticdb",
                document("A.scala").definition("pkg.Foo#", 0, 6, 0, 9).build());
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        var cmd = new CommandLine(new MetadocCli());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void testPrintsTarget() {
        int exit = run("--target", site.toString(), "--non-interactive", classes.toString());

        assertEquals(0, exit, err.toString());
        assertEquals(site.toAbsolutePath().toString(), out.toString().trim());
        assertTrue(Files.exists(site.resolve(IndexWriter.WORKSPACE_FILE)));
    }

    private static JsonNode readJson(String text) throws IOException {
        return new ObjectMapper().readTree(text);
    }

    @Test
    void testZipPrintsTargetDirectory() {
        int exit = run("--target", site.toString(), "--non-interactive", "--zip", classes.toString());

        assertEquals(0, exit, err.toString());
        assertEquals(site.toAbsolutePath().toString(), out.toString().trim());
        assertTrue(Files.isRegularFile(site.resolve(Target.ZIP_NAME)));
    }

    @Test
    void testJsonSummary() throws Exception {
        int exit = run("--target", site.toString(), "--non-interactive", "--json", classes.toString());

        assertEquals(0, exit, err.toString());
        var summary = readJson(out.toString());
        assertEquals(1, summary.get("filesScanned").asInt());
        assertEquals(1, summary.get("symbolsPublished").asInt());
        assertEquals(site.toAbsolutePath().toString(), summary.get("target").asText());
    }

    @Test
    void testJoinedClasspathEntries() throws Exception {
        var more = tempDir.resolve("more");
        writeBinary(
                more.resolve("META-INF/semanticdb"),
                "B.scala.semanticdb",
                document("B.scala").definition("pkg.Bar#", 0, 6, 0, 9).build());

        int exit = run(
                "--target",
                site.toString(),
                "--non-interactive",
                "--json",
                classes + File.pathSeparator + more);

        assertEquals(0, exit, err.toString());
        assertEquals(2, readJson(out.toString()).get("symbolsPublished").asInt());
    }

    @Test
    void testConfigFileAndOverride() throws Exception {
        var props = tempDir.resolve("metadoc.properties");
        Files.writeString(props, "metadoc.zip=true\nmetadoc.parallelism=1\n");

        var cli = new MetadocCli();
        new CommandLine(cli)
                .parseArgs("--target", site.toString(), "--config", props.toString(), "--parallelism", "3",
                        classes.toString());
        var config = cli.buildConfig();

        assertTrue(config.zip());
        assertEquals(3, config.parallelism());
        assertEquals(site.toAbsolutePath(), config.target());
    }

    @Test
    void testMissingTargetIsUsageError() {
        int exit = run(classes.toString());

        assertEquals(2, exit);
        assertTrue(err.toString().contains("--target"));
    }

    @Test
    void testMissingRootFails() {
        int exit = run("--target", site.toString(), "--non-interactive", tempDir.resolve("nope").toString());

        assertEquals(1, exit);
        assertTrue(err.toString().startsWith("metadoc: "));
    }
}
