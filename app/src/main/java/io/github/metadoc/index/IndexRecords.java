package io.github.metadoc.index;

import com.google.protobuf.InvalidProtocolBufferException;
import io.github.metadoc.schema.Metadoc;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;

/** Conversions between the index value types and the persisted protobuf records. */
public final class IndexRecords {

    private IndexRecords() {}

    public static Metadoc.SymbolIndex toProto(SymbolEntry entry) {
        var builder = Metadoc.SymbolIndex.newBuilder().setSymbol(entry.symbol());
        entry.definitionOpt().ifPresent(d -> builder.setDefinition(toProto(d)));
        entry.references().forEach((filename, ranges) -> {
            var protoRanges = Metadoc.Ranges.newBuilder();
            ranges.forEach(r -> protoRanges.addRanges(toProto(r)));
            builder.putReferences(filename, protoRanges.build());
        });
        return builder.build();
    }

    public static SymbolEntry fromProto(Metadoc.SymbolIndex index) {
        var references = new LinkedHashMap<String, List<Range>>();
        index.getReferencesMap().forEach((filename, ranges) -> {
            var list = new ArrayList<Range>(ranges.getRangesCount());
            ranges.getRangesList().forEach(r -> list.add(fromProto(r)));
            references.put(filename, list);
        });
        var definition = index.hasDefinition() ? fromProto(index.getDefinition()) : null;
        return new SymbolEntry(index.getSymbol(), definition, references);
    }

    public static Metadoc.Position toProto(Position position) {
        return Metadoc.Position.newBuilder()
                .setFilename(position.filename())
                .setStartLine(position.startLine())
                .setStartCharacter(position.startCharacter())
                .setEndLine(position.endLine())
                .setEndCharacter(position.endCharacter())
                .build();
    }

    public static Position fromProto(Metadoc.Position position) {
        return new Position(
                position.getFilename(),
                position.getStartLine(),
                position.getStartCharacter(),
                position.getEndLine(),
                position.getEndCharacter());
    }

    public static Metadoc.Range toProto(Range range) {
        return Metadoc.Range.newBuilder()
                .setStartLine(range.startLine())
                .setStartCharacter(range.startCharacter())
                .setEndLine(range.endLine())
                .setEndCharacter(range.endCharacter())
                .build();
    }

    public static Range fromProto(Metadoc.Range range) {
        return new Range(range.getStartLine(), range.getStartCharacter(), range.getEndLine(), range.getEndCharacter());
    }

    public static Metadoc.Workspace workspace(Collection<String> filenames) {
        return Metadoc.Workspace.newBuilder().addAllFilenames(filenames).build();
    }

    public static SymbolEntry readSymbolIndex(byte[] bytes) throws InvalidProtocolBufferException {
        return fromProto(Metadoc.SymbolIndex.parseFrom(bytes));
    }

    public static List<String> readWorkspace(byte[] bytes) throws InvalidProtocolBufferException {
        return List.copyOf(Metadoc.Workspace.parseFrom(bytes).getFilenamesList());
    }
}
