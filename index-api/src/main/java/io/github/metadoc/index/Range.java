package io.github.metadoc.index;

/** A span inside one file, zero-based lines and characters. */
public record Range(int startLine, int startCharacter, int endLine, int endCharacter) {

    /** Attach this span to a file. */
    public Position in(String filename) {
        return new Position(filename, startLine, startCharacter, endLine, endCharacter);
    }

    @Override
    public String toString() {
        return "%d:%d-%d:%d".formatted(startLine, startCharacter, endLine, endCharacter);
    }
}
