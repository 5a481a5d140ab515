package io.github.metadoc.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Everything known about one global symbol: at most one definition and the references to it, grouped by the file
 * they occur in. Within a file the references keep the order in which they were observed.
 *
 * <p>Instances are immutable; the reference map and its lists are unmodifiable copies.
 */
public record SymbolEntry(String symbol, @Nullable Position definition, Map<String, List<Range>> references) {

    public SymbolEntry {
        var copy = new LinkedHashMap<String, List<Range>>();
        references.forEach((filename, ranges) -> copy.put(filename, List.copyOf(ranges)));
        references = Collections.unmodifiableMap(copy);
    }

    public static SymbolEntry empty(String symbol) {
        return new SymbolEntry(symbol, null, Map.of());
    }

    public Optional<Position> definitionOpt() {
        return Optional.ofNullable(definition);
    }

    public boolean hasDefinition() {
        return definition != null;
    }

    public SymbolEntry withDefinition(@Nullable Position newDefinition) {
        return new SymbolEntry(symbol, newDefinition, references);
    }

    public SymbolEntry withReferences(Map<String, List<Range>> newReferences) {
        return new SymbolEntry(symbol, definition, newReferences);
    }

    /**
     * Appends the references of {@code other} after this entry's own, file by file. Files only {@code other} knows
     * about are added after the existing ones.
     */
    public SymbolEntry mergeReferences(Map<String, List<Range>> other) {
        if (other.isEmpty()) {
            return this;
        }
        var merged = new LinkedHashMap<String, List<Range>>();
        references.forEach((filename, ranges) -> merged.put(filename, new ArrayList<>(ranges)));
        other.forEach((filename, ranges) ->
                merged.computeIfAbsent(filename, k -> new ArrayList<>()).addAll(ranges));
        return withReferences(merged);
    }

    /** Total number of references across all files. */
    public int referenceCount() {
        return references.values().stream().mapToInt(List::size).sum();
    }
}
