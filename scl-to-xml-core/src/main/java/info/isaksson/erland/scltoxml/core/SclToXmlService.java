package info.isaksson.erland.scltoxml.core;

import info.isaksson.erland.scltoxml.emitter.BlockXmlEmitter;
import info.isaksson.erland.scltoxml.emitter.UdtXmlEmitter;
import info.isaksson.erland.scltoxml.extract.BlockXmlExtractor;
import info.isaksson.erland.scltoxml.extract.UdtXmlExtractor;
import info.isaksson.erland.scltoxml.ir.CanonicalDocument;
import info.isaksson.erland.scltoxml.ir.CanonicalJson;
import info.isaksson.erland.scltoxml.ir.ConversionException;
import info.isaksson.erland.scltoxml.ir.ConversionWarning;
import info.isaksson.erland.scltoxml.ir.ConversionWarnings;
import info.isaksson.erland.scltoxml.ir.TypeDocument;
import info.isaksson.erland.scltoxml.scl.SclReader;
import info.isaksson.erland.scltoxml.scl.SclWriter;
import info.isaksson.erland.scltoxml.scl.UdtTextReader;
import info.isaksson.erland.scltoxml.scl.UdtTextWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Core API for converting between source text, canonical JSON and interchange XML.
 *
 * <p>CLI and other wrappers should use this class instead of re-implementing the pipeline.
 * Every conversion has a string form and a path form; the path form reads its input as UTF-8
 * and, when a destination is given, writes the produced content there.</p>
 */
public final class SclToXmlService {

    private static final Logger log = LoggerFactory.getLogger(SclToXmlService.class);

    private static final char BOM = '\uFEFF';

    private final ConverterOptions options;

    public SclToXmlService() {
        this(new ConverterOptions());
    }

    public SclToXmlService(ConverterOptions options) {
        this.options = options == null ? new ConverterOptions() : options;
    }

    public ConverterOptions options() {
        return options;
    }

    // --- program blocks ---

    /** Parse source text into a canonical document; content is the canonical JSON. */
    public ConversionResult<CanonicalDocument> textToCanonical(String text) throws ConversionException {
        SclReader.Result read = new SclReader(options.engineeringVersion).read(requireInput(text, "text"));
        return new ConversionResult<>(CanonicalJson.toJsonString(read.document), read.document, null, read.warnings);
    }

    public ConversionResult<CanonicalDocument> textToCanonical(Path input, Path output) throws ConversionException {
        log.info("Reading source text {}", input);
        return write(textToCanonical(readFile(input)), output);
    }

    /** Generate interchange XML for a canonical document. */
    public ConversionResult<CanonicalDocument> canonicalToXml(CanonicalDocument doc) throws ConversionException {
        if (doc == null) throw new IllegalArgumentException("doc must not be null");
        BlockXmlEmitter.Result emitted = new BlockXmlEmitter(options.generatorOptions()).emit(doc);
        log.debug("Generated {} with {} structured-code identities", doc.metadata, emitted.uidCount);
        return new ConversionResult<>(emitted.xml, doc, null, emitted.warnings);
    }

    public ConversionResult<CanonicalDocument> canonicalToXml(Path input, Path output) throws ConversionException {
        log.info("Reading canonical JSON {}", input);
        return write(canonicalToXml(CanonicalJson.readFromString(readFile(input))), output);
    }

    /** Read interchange XML into a canonical document; content is the canonical JSON. */
    public ConversionResult<CanonicalDocument> xmlToCanonical(String xml) throws ConversionException {
        BlockXmlExtractor.Result extracted = new BlockXmlExtractor(options.extractorOptions())
                .extract(requireInput(xml, "xml"));
        return new ConversionResult<>(CanonicalJson.toJsonString(extracted.document), extracted.document, null,
                extracted.warnings);
    }

    public ConversionResult<CanonicalDocument> xmlToCanonical(Path input, Path output) throws ConversionException {
        log.info("Reading interchange XML {}", input);
        return write(xmlToCanonical(readFile(input)), output);
    }

    /** Render a canonical document as source text. */
    public ConversionResult<CanonicalDocument> canonicalToText(CanonicalDocument doc) {
        if (doc == null) throw new IllegalArgumentException("doc must not be null");
        ConversionWarnings warnings = new ConversionWarnings();
        String text = new SclWriter().write(doc, warnings);
        return new ConversionResult<>(text, doc, null, warnings.toDeterministicList());
    }

    public ConversionResult<CanonicalDocument> canonicalToText(Path input, Path output) throws ConversionException {
        log.info("Reading canonical JSON {}", input);
        return write(canonicalToText(CanonicalJson.readFromString(readFile(input))), output);
    }

    /** Source text straight to interchange XML. */
    public ConversionResult<CanonicalDocument> textToXml(String text) throws ConversionException {
        ConversionResult<CanonicalDocument> parsed = textToCanonical(text);
        ConversionResult<CanonicalDocument> generated = canonicalToXml(parsed.document);
        return new ConversionResult<>(generated.content, generated.document, null,
                merge(parsed.warnings, generated.warnings));
    }

    public ConversionResult<CanonicalDocument> textToXml(Path input, Path output) throws ConversionException {
        log.info("Converting source text {} to XML", input);
        return write(textToXml(readFile(input)), output);
    }

    /** Interchange XML straight to source text. */
    public ConversionResult<CanonicalDocument> xmlToText(String xml) throws ConversionException {
        ConversionResult<CanonicalDocument> extracted = xmlToCanonical(xml);
        ConversionResult<CanonicalDocument> rendered = canonicalToText(extracted.document);
        return new ConversionResult<>(rendered.content, rendered.document, null,
                merge(extracted.warnings, rendered.warnings));
    }

    public ConversionResult<CanonicalDocument> xmlToText(Path input, Path output) throws ConversionException {
        log.info("Converting XML {} to source text", input);
        return write(xmlToText(readFile(input)), output);
    }

    // --- user-defined types ---

    public ConversionResult<TypeDocument> udtTextToType(String text) throws ConversionException {
        UdtTextReader.Result read = new UdtTextReader().read(requireInput(text, "text"));
        return new ConversionResult<>(CanonicalJson.toJsonString(read.document), read.document, null, read.warnings);
    }

    public ConversionResult<TypeDocument> udtTextToType(Path input, Path output) throws ConversionException {
        log.info("Reading type source {}", input);
        return write(udtTextToType(readFile(input)), output);
    }

    public ConversionResult<TypeDocument> typeToXml(TypeDocument doc) throws ConversionException {
        if (doc == null) throw new IllegalArgumentException("doc must not be null");
        String xml = new UdtXmlEmitter(options.generatorOptions()).emit(doc);
        return new ConversionResult<>(xml, doc, null, List.of());
    }

    public ConversionResult<TypeDocument> typeToXml(Path input, Path output) throws ConversionException {
        log.info("Reading type JSON {}", input);
        return write(typeToXml(CanonicalJson.readTypeFromString(readFile(input))), output);
    }

    public ConversionResult<TypeDocument> xmlToType(String xml) throws ConversionException {
        UdtXmlExtractor.Result extracted = new UdtXmlExtractor().extract(requireInput(xml, "xml"));
        return new ConversionResult<>(CanonicalJson.toJsonString(extracted.document), extracted.document, null,
                extracted.warnings);
    }

    public ConversionResult<TypeDocument> xmlToType(Path input, Path output) throws ConversionException {
        log.info("Reading type XML {}", input);
        return write(xmlToType(readFile(input)), output);
    }

    public ConversionResult<TypeDocument> typeToUdtText(TypeDocument doc) {
        if (doc == null) throw new IllegalArgumentException("doc must not be null");
        return new ConversionResult<>(new UdtTextWriter().write(doc), doc, null, List.of());
    }

    public ConversionResult<TypeDocument> typeToUdtText(Path input, Path output) throws ConversionException {
        log.info("Reading type JSON {}", input);
        return write(typeToUdtText(CanonicalJson.readTypeFromString(readFile(input))), output);
    }

    /** Type source text straight to interchange XML. */
    public ConversionResult<TypeDocument> udtTextToXml(String text) throws ConversionException {
        ConversionResult<TypeDocument> parsed = udtTextToType(text);
        ConversionResult<TypeDocument> generated = typeToXml(parsed.document);
        return new ConversionResult<>(generated.content, parsed.document, null, parsed.warnings);
    }

    public ConversionResult<TypeDocument> udtTextToXml(Path input, Path output) throws ConversionException {
        log.info("Converting type source {} to XML", input);
        return write(udtTextToXml(readFile(input)), output);
    }

    /** Type interchange XML straight to type source text. */
    public ConversionResult<TypeDocument> xmlToUdtText(String xml) throws ConversionException {
        ConversionResult<TypeDocument> extracted = xmlToType(xml);
        ConversionResult<TypeDocument> rendered = typeToUdtText(extracted.document);
        return new ConversionResult<>(rendered.content, extracted.document, null, extracted.warnings);
    }

    public ConversionResult<TypeDocument> xmlToUdtText(Path input, Path output) throws ConversionException {
        log.info("Converting type XML {} to source text", input);
        return write(xmlToUdtText(readFile(input)), output);
    }

    // --- file boundary ---

    static String readFile(Path input) throws ConversionException {
        if (input == null) throw new IllegalArgumentException("input must not be null");
        try {
            String content = Files.readString(input, StandardCharsets.UTF_8);
            return !content.isEmpty() && content.charAt(0) == BOM ? content.substring(1) : content;
        } catch (IOException e) {
            throw ConversionException.io("Could not read " + input, e);
        }
    }

    private static <D> ConversionResult<D> write(ConversionResult<D> result, Path output) throws ConversionException {
        if (output == null) return result;
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(output, result.content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw ConversionException.io("Could not write " + output, e);
        }
        log.info("Wrote {} ({} warnings)", output, result.warnings.size());
        return result.writtenTo(output);
    }

    private static String requireInput(String input, String name) {
        if (input == null) throw new IllegalArgumentException(name + " must not be null");
        return input;
    }

    private static List<ConversionWarning> merge(List<ConversionWarning> first, List<ConversionWarning> second) {
        ConversionWarnings all = new ConversionWarnings();
        all.addAll(first);
        all.addAll(second);
        return all.toDeterministicList();
    }
}
