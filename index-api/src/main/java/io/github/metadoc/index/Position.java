package io.github.metadoc.index;

/**
 * A located definition: the file that owns it plus its start and end, zero-based, as recorded by the compiler.
 */
public record Position(String filename, int startLine, int startCharacter, int endLine, int endCharacter) {

    /** The same span without the owning file. */
    public Range range() {
        return new Range(startLine, startCharacter, endLine, endCharacter);
    }

    @Override
    public String toString() {
        return "%s:%d:%d-%d:%d".formatted(filename, startLine, startCharacter, endLine, endCharacter);
    }
}
