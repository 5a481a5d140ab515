package io.github.metadoc;

import java.nio.file.Path;

/** What a finished run did. */
public record IndexSummary(
        Path target,
        int filesScanned,
        int filesFailed,
        int documentsIndexed,
        int symbolsAccumulated,
        int symbolsPublished,
        int workspaceFiles) {

    @Override
    public String toString() {
        return "%d file(s) scanned, %d failed, %d document(s), %d symbol(s), %d published, %d workspace file(s) -> %s"
                .formatted(
                        filesScanned,
                        filesFailed,
                        documentsIndexed,
                        symbolsAccumulated,
                        symbolsPublished,
                        workspaceFiles,
                        target);
    }
}
