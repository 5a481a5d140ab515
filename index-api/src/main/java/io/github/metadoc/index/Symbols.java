package io.github.metadoc.index;

import java.util.Optional;

/**
 * Helpers for the SemanticDB symbol syntax.
 *
 * <p>Global symbols end in a descriptor suffix: {@code .} for terms and packages, {@code #} for types, e.g.
 * {@code pkg.Foo#} or {@code scala/Predef.}. Anything else (for instance {@code local12}) is local to one document and
 * never leaves it.
 */
public final class Symbols {

    public static final char TERM_SUFFIX = '.';
    public static final char TYPE_SUFFIX = '#';

    private Symbols() {}

    public enum Namespace {
        TERM,
        TYPE;

        char suffix() {
            return this == TERM ? TERM_SUFFIX : TYPE_SUFFIX;
        }

        Namespace other() {
            return this == TERM ? TYPE : TERM;
        }
    }

    /**
     * The last descriptor of a global term or type symbol.
     *
     * @param owner the symbol prefix up to and including the separator before {@code name}
     * @param name the simple name, with backticks if the symbol quotes it
     */
    public record Descriptor(String owner, String name, Namespace namespace) {

        public String syntax() {
            return owner + name + namespace.suffix();
        }

        /** The symbol with the same owner and name in the other namespace. */
        public String sibling() {
            return owner + name + namespace.other().suffix();
        }

        public boolean isType() {
            return namespace == Namespace.TYPE;
        }

        public boolean isTerm() {
            return namespace == Namespace.TERM;
        }
    }

    public static boolean isGlobal(String symbol) {
        if (symbol.isEmpty()) {
            return false;
        }
        char last = symbol.charAt(symbol.length() - 1);
        return last == TERM_SUFFIX || last == TYPE_SUFFIX;
    }

    public static boolean isLocal(String symbol) {
        return !isGlobal(symbol);
    }

    /**
     * Splits a global term or type symbol into owner and name. Methods ({@code foo().}), parameters, local symbols
     * and malformed input yield empty.
     */
    public static Optional<Descriptor> parse(String symbol) {
        if (!isGlobal(symbol) || symbol.length() < 2) {
            return Optional.empty();
        }
        int end = symbol.length() - 1;
        var namespace = symbol.charAt(end) == TYPE_SUFFIX ? Namespace.TYPE : Namespace.TERM;
        char prev = symbol.charAt(end - 1);

        int start;
        if (prev == '`') {
            start = symbol.lastIndexOf('`', end - 2);
            if (start < 0) {
                return Optional.empty();
            }
        } else if (isSeparator(prev)) {
            // method disambiguator, parameter, or an empty name
            return Optional.empty();
        } else {
            int i = end - 1;
            while (i >= 0 && !isSeparator(symbol.charAt(i))) {
                i--;
            }
            start = i + 1;
        }
        return Optional.of(new Descriptor(symbol.substring(0, start), symbol.substring(start, end), namespace));
    }

    /** The sibling in the other namespace, if {@code symbol} is a global term or type. */
    public static Optional<String> sibling(String symbol) {
        return parse(symbol).map(Descriptor::sibling);
    }

    private static boolean isSeparator(char c) {
        return switch (c) {
            case '.', '#', '/', '(', ')', '[', ']', ';', '`' -> true;
            default -> false;
        };
    }
}
