package io.github.metadoc.index;

import io.github.metadoc.semanticdb.Semanticdb;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Collects the definition and reference occurrences of every global symbol across all documents of a run.
 *
 * <p>Documents may be fed from any number of threads. Each symbol owns one slot in a {@link ConcurrentHashMap}; every
 * update to a slot runs inside {@link ConcurrentHashMap#compute}, so updates to one symbol are serialized and none is
 * lost, while updates to unrelated symbols proceed independently.
 *
 * <p>The first definition recorded for a symbol is kept and later ones are ignored. References are appended to the
 * list of the file they occur in, in the order {@link #accept} visits them.
 *
 * <p>{@link #snapshot()} must only be called once every feeding thread has finished.
 */
public final class OccurrenceAccumulator {
    private static final Logger logger = LogManager.getLogger(OccurrenceAccumulator.class);

    private final ConcurrentHashMap<String, Slot> slots = new ConcurrentHashMap<>();
    private final Set<String> filenames = new ConcurrentSkipListSet<>();

    /** Mutable per-symbol state. Only touched inside {@code compute} for its key. */
    private static final class Slot {
        @Nullable
        Position definition;

        final Map<String, List<Range>> references = new LinkedHashMap<>();
    }

    /** Records every global occurrence of {@code document} and remembers its uri as a workspace file. */
    public void accept(Semanticdb.TextDocument document) {
        var uri = document.getUri();
        int skipped = 0;
        for (var occurrence : document.getOccurrencesList()) {
            var symbol = occurrence.getSymbol();
            if (Symbols.isLocal(symbol) || !occurrence.hasRange()) {
                skipped++;
                continue;
            }
            var r = occurrence.getRange();
            var range = new Range(r.getStartLine(), r.getStartCharacter(), r.getEndLine(), r.getEndCharacter());
            switch (occurrence.getRole()) {
                case DEFINITION -> addDefinition(symbol, range.in(uri));
                case REFERENCE -> addReference(symbol, uri, range);
                default -> skipped++;
            }
        }
        filenames.add(uri);
        logger.trace("{}: {} occurrence(s), {} skipped", uri, document.getOccurrencesCount(), skipped);
    }

    public void addDefinition(String symbol, Position position) {
        slots.compute(symbol, (key, slot) -> {
            var s = slot == null ? new Slot() : slot;
            if (s.definition == null) {
                s.definition = position;
            }
            // else: a second definition, e.g. the JS and JVM builds of one cross-built source; first one wins
            return s;
        });
    }

    public void addReference(String symbol, String filename, Range range) {
        slots.compute(symbol, (key, slot) -> {
            var s = slot == null ? new Slot() : slot;
            s.references.computeIfAbsent(filename, k -> new ArrayList<>()).add(range);
            return s;
        });
    }

    /** Number of distinct symbols seen so far. */
    public int size() {
        return slots.size();
    }

    /** All workspace files seen so far, sorted. */
    public List<String> filenames() {
        return List.copyOf(filenames);
    }

    /**
     * An immutable copy of all entries, ordered by symbol. Callers must make sure no thread is still feeding
     * documents; the copy is not consistent otherwise.
     */
    public Map<String, SymbolEntry> snapshot() {
        var result = new TreeMap<String, SymbolEntry>();
        slots.forEach((symbol, slot) -> result.put(symbol, new SymbolEntry(symbol, slot.definition, slot.references)));
        return Collections.unmodifiableSortedMap(result);
    }
}
