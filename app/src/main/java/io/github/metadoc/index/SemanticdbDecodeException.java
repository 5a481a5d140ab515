package io.github.metadoc.index;

import java.nio.file.Path;

/** A metadata file could not be decoded: unknown suffix, malformed bytes or malformed JSON. */
public class SemanticdbDecodeException extends Exception {

    private final Path path;

    public SemanticdbDecodeException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public SemanticdbDecodeException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
