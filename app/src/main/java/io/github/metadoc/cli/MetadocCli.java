package io.github.metadoc.cli;

import com.google.common.base.Splitter;
import io.github.metadoc.IndexBuilder;
import io.github.metadoc.MetadocConfig;
import io.github.metadoc.progress.ConsoleProgress;
import io.github.metadoc.util.Json;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "metadoc",
        mixinStandardHelpOptions = true,
        version = "metadoc 0.1.0-SNAPSHOT",
        description = "Builds a static cross-reference site index from SemanticDB files.")
public final class MetadocCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(MetadocCli.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
            names = "--target",
            required = true,
            description = "The output directory to generate the metadoc site.")
    private Path target;

    @CommandLine.Option(
            names = "--clean-target-first",
            description = "Clean the target directory before generating new site. "
                    + "All files will be deleted so be careful.")
    @Nullable
    private Boolean cleanTargetFirst;

    @CommandLine.Option(names = "--zip", description = "Experimental. Emit metadoc.zip file instead of static files.")
    @Nullable
    private Boolean zip;

    @CommandLine.Option(names = "--non-interactive", description = "Disable fancy progress bar.")
    @Nullable
    private Boolean nonInteractive;

    @CommandLine.Option(names = "--parallelism", description = "Number of worker threads.")
    @Nullable
    private Integer parallelism;

    @CommandLine.Option(names = "--config", description = "Properties file with metadoc.* settings.")
    @Nullable
    private Path configFile;

    @CommandLine.Option(names = "--json", description = "Print the run summary as JSON instead of the target path.")
    private boolean json = false;

    @CommandLine.Parameters(
            arity = "1..*",
            paramLabel = "classpath",
            description = "Directories or archives to scan, entries may be joined with the path separator.")
    private List<String> classpath = new ArrayList<>();

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MetadocCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        try {
            var config = buildConfig();
            var summary = new IndexBuilder(config, ConsoleProgress.forTerminal(config.nonInteractive())).run();
            out.println(json ? Json.toJson(summary) : config.target().toString());
            out.flush();
            return 0;
        } catch (IOException | RuntimeException e) {
            logger.error("Index run failed", e);
            err.println("metadoc: " + describe(e));
            err.flush();
            return 1;
        }
    }

    MetadocConfig buildConfig() throws IOException {
        var roots = new ArrayList<Path>();
        for (var entry : classpath) {
            for (var part : Splitter.on(File.pathSeparatorChar).omitEmptyStrings().split(entry)) {
                roots.add(Path.of(part).toAbsolutePath());
            }
        }
        var config = MetadocConfig.defaults(target.toAbsolutePath(), roots);
        if (configFile != null) {
            config = config.withProperties(MetadocConfig.loadProperties(configFile));
        }
        if (cleanTargetFirst != null) {
            config = config.withCleanTargetFirst(cleanTargetFirst);
        }
        if (zip != null) {
            config = config.withZip(zip);
        }
        if (nonInteractive != null) {
            config = config.withNonInteractive(nonInteractive);
        }
        if (parallelism != null) {
            config = config.withParallelism(parallelism);
        }
        return config;
    }

    private static String describe(Exception e) {
        var message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + message;
    }
}
