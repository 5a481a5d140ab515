package io.github.metadoc.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Machine-readable output of the command line. Paths are written as plain file system strings rather than Jackson's
 * default {@code file:} URIs, so scripts can use them directly.
 */
public final class Json {

    private static final JsonMapper MAPPER = JsonMapper.builder()
            .addModule(new SimpleModule("metadoc-paths").addSerializer(Path.class, new PathAsString()))
            .enable(SerializationFeature.INDENT_OUTPUT)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    private Json() {}

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render " + value.getClass().getSimpleName() + " as JSON", e);
        }
    }

    private static final class PathAsString extends StdSerializer<Path> {
        PathAsString() {
            super(Path.class);
        }

        @Override
        public void serialize(Path path, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(path.toString());
        }
    }
}
