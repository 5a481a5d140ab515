package io.github.metadoc.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Joins symbols that one declaration produces in both namespaces, such as a Scala {@code object Foo} whose
 * definition is recorded on {@code pkg.Foo#} while its uses are recorded on {@code pkg.Foo.}.
 *
 * <ul>
 *   <li>A type with a definition takes over the references of its term sibling when that sibling has no definition
 *       of its own. The references are appended after the type's own references, per file.
 *   <li>A term without a definition borrows the definition of its type sibling. Since the type entry already carries
 *       the term's references, such a term is only published under its own name when {@code publishTermAliases} is
 *       set.
 *   <li>When both siblings have a definition nothing is joined; the two entries are published unchanged.
 * </ul>
 *
 * Entries that end up without a definition are not published. Runs on a finished snapshot; it never sees concurrent
 * updates.
 */
public final class NamespaceReconciler {
    private static final Logger logger = LogManager.getLogger(NamespaceReconciler.class);

    private final boolean publishTermAliases;

    public NamespaceReconciler(boolean publishTermAliases) {
        this.publishTermAliases = publishTermAliases;
    }

    /**
     * @param entries every accumulated entry, keyed by symbol
     * @return the entries to publish, in the iteration order of {@code entries}
     */
    public List<SymbolEntry> reconcile(Map<String, SymbolEntry> entries) {
        var published = new ArrayList<SymbolEntry>();
        int grafted = 0;
        int borrowed = 0;
        int dropped = 0;
        for (var entry : entries.values()) {
            if (entry.hasDefinition()) {
                var reconciled = graftTermReferences(entry, entries);
                if (reconciled != entry) {
                    grafted++;
                }
                published.add(reconciled);
                continue;
            }

            var reconciled = borrowTypeDefinition(entry, entries);
            if (!reconciled.hasDefinition()) {
                dropped++;
            } else {
                borrowed++;
                if (publishTermAliases) {
                    published.add(reconciled);
                }
            }
        }
        logger.debug(
                "Reconciled {} entries: {} published, {} took sibling references, {} borrowed a definition, "
                        + "{} without definition",
                entries.size(),
                published.size(),
                grafted,
                borrowed,
                dropped);
        return published;
    }

    /** The type-side half of the join; returns {@code entry} itself when nothing applies. */
    SymbolEntry graftTermReferences(SymbolEntry entry, Map<String, SymbolEntry> entries) {
        var descriptor = Symbols.parse(entry.symbol());
        if (descriptor.isEmpty() || !descriptor.get().isType()) {
            return entry;
        }
        var term = entries.get(descriptor.get().sibling());
        if (term == null || term.hasDefinition()) {
            return entry;
        }
        return entry.mergeReferences(term.references());
    }

    /** The term-side half of the join; returns {@code entry} itself when nothing applies. */
    SymbolEntry borrowTypeDefinition(SymbolEntry entry, Map<String, SymbolEntry> entries) {
        var descriptor = Symbols.parse(entry.symbol());
        if (descriptor.isEmpty() || !descriptor.get().isTerm()) {
            return entry;
        }
        var type = entries.get(descriptor.get().sibling());
        if (type == null || !type.hasDefinition()) {
            return entry;
        }
        return entry.withDefinition(type.definition());
    }
}
