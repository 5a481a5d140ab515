package io.github.metadoc.index;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;

/**
 * Maps a symbol to the file name its record is stored under. Symbols can be longer than a path segment allows and
 * contain characters no file system accepts, so the record is keyed by the SHA-512 of the UTF-8 symbol, rendered as
 * 128 lowercase hex characters. The browser computes the same digest to fetch a record.
 */
public final class SymbolDigest {

    public static final int HEX_LENGTH = 128;

    private static final HashFunction SHA_512 = Hashing.sha512();

    private SymbolDigest() {}

    public static String encode(String symbol) {
        return SHA_512.hashString(symbol, StandardCharsets.UTF_8).toString();
    }
}
