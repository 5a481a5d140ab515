package io.github.metadoc.index;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;
import io.github.metadoc.semanticdb.Semanticdb;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Decodes one SemanticDB file. The suffix selects the encoding: {@value #BINARY_SUFFIX} is the protobuf wire format,
 * {@value #JSON_SUFFIX} the protobuf JSON mapping of the same schema.
 */
public final class DocumentParser {
    private static final Logger logger = LogManager.getLogger(DocumentParser.class);

    public static final String BINARY_SUFFIX = ".semanticdb";
    public static final String JSON_SUFFIX = ".semanticdb.json";

    private final JsonFormat.Parser jsonParser = JsonFormat.parser().ignoringUnknownFields();

    public static boolean isMetadataFile(Path path) {
        var fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        var name = fileName.toString();
        return name.endsWith(BINARY_SUFFIX) || name.endsWith(JSON_SUFFIX);
    }

    /**
     * Reads and decodes {@code path}.
     *
     * @throws IOException if the file cannot be read
     * @throws SemanticdbDecodeException if the suffix is not recognized or the content does not decode
     */
    public Semanticdb.TextDocuments parse(Path path) throws IOException, SemanticdbDecodeException {
        var fileName = path.getFileName();
        var name = fileName == null ? "" : fileName.toString();
        if (name.endsWith(BINARY_SUFFIX)) {
            return parseBinary(path, Files.readAllBytes(path));
        } else if (name.endsWith(JSON_SUFFIX)) {
            return parseJson(path, Files.readAllBytes(path));
        }
        throw new SemanticdbDecodeException(path, "Unexpected filename " + name);
    }

    Semanticdb.TextDocuments parseBinary(Path path, byte[] bytes) throws SemanticdbDecodeException {
        try {
            var docs = Semanticdb.TextDocuments.parseFrom(bytes);
            logger.trace("Decoded {} document(s) from {}", docs.getDocumentsCount(), path);
            return docs;
        } catch (InvalidProtocolBufferException e) {
            throw new SemanticdbDecodeException(path, "Malformed SemanticDB payload in " + path, e);
        }
    }

    Semanticdb.TextDocuments parseJson(Path path, byte[] bytes) throws SemanticdbDecodeException {
        var builder = Semanticdb.TextDocuments.newBuilder();
        try {
            jsonParser.merge(new String(bytes, StandardCharsets.UTF_8), builder);
        } catch (InvalidProtocolBufferException | RuntimeException e) {
            // the JSON parser reports some syntax errors as unchecked Gson exceptions
            throw new SemanticdbDecodeException(path, "Malformed SemanticDB JSON in " + path, e);
        }
        return builder.build();
    }
}
