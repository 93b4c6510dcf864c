package info.isaksson.erland.scltoxml.ir;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON serialization for the canonical block document and the struct type document.
 *
 * <p>Writing is deterministic: map entries are key-sorted, indentation is two spaces and every
 * document ends with a newline. Reading accepts string scalars for numbers and booleans so documents
 * written by older tooling ({@code "blockNumber": "1"}, {@code "enoSetting": "false"}) still load.
 * Invalid JSON surfaces as {@link FailureKind#MALFORMED_INPUT}.</p>
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private CanonicalJson() {}

    public static CanonicalDocument read(Path path) throws ConversionException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            CanonicalDocument doc = MAPPER.readValue(in, CanonicalDocument.class);
            if (doc == null) throw ConversionException.malformed("Canonical JSON in " + path + " is empty");
            return doc;
        } catch (JsonProcessingException e) {
            throw ConversionException.malformed("Invalid canonical JSON in " + path + ": " + e.getOriginalMessage());
        } catch (IOException e) {
            throw ConversionException.io("Could not read " + path, e);
        }
    }

    /** Parse a canonical document from a JSON string. */
    public static CanonicalDocument readFromString(String json) throws ConversionException {
        if (json == null) throw new IllegalArgumentException("json is null");
        try {
            CanonicalDocument doc = MAPPER.readValue(json, CanonicalDocument.class);
            if (doc == null) throw ConversionException.malformed("Canonical JSON is empty");
            return doc;
        } catch (JsonProcessingException e) {
            throw ConversionException.malformed("Invalid canonical JSON: " + e.getOriginalMessage());
        }
    }

    public static TypeDocument readTypeFromString(String json) throws ConversionException {
        if (json == null) throw new IllegalArgumentException("json is null");
        try {
            TypeDocument doc = MAPPER.readValue(json, TypeDocument.class);
            if (doc == null) throw ConversionException.malformed("Type JSON is empty");
            return doc;
        } catch (JsonProcessingException e) {
            throw ConversionException.malformed("Invalid type JSON: " + e.getOriginalMessage());
        }
    }

    public static void write(CanonicalDocument doc, Path path) throws ConversionException {
        writeValue(doc, path);
    }

    public static void write(TypeDocument doc, Path path) throws ConversionException {
        writeValue(doc, path);
    }

    public static String toJsonString(CanonicalDocument doc) {
        return writeString(doc);
    }

    public static String toJsonString(TypeDocument doc) {
        return writeString(doc);
    }

    private static void writeValue(Object value, Path path) throws ConversionException {
        if (path == null) throw new IllegalArgumentException("path is null");
        if (value == null) throw new IllegalArgumentException("document is null");
        try {
            Path parent = path.toAbsolutePath().normalize().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (var out = Files.newOutputStream(path)) {
                MAPPER.writer(PRETTY).writeValue(out, value);
                out.write('\n');
            }
        } catch (IOException e) {
            throw ConversionException.io("Could not write " + path, e);
        }
    }

    private static String writeString(Object value) {
        if (value == null) throw new IllegalArgumentException("document is null");
        try {
            return MAPPER.writer(PRETTY).writeValueAsString(value) + "\n";
        } catch (JsonProcessingException e) {
            // Only plain immutable model classes are written here.
            throw new IllegalStateException("Could not serialize " + value, e);
        }
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        om.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        om.disable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
