package info.isaksson.erland.scltoxml.extract;

import info.isaksson.erland.scltoxml.ir.BlockKind;
import info.isaksson.erland.scltoxml.ir.BlockMetadata;
import info.isaksson.erland.scltoxml.ir.CanonicalDocument;
import info.isaksson.erland.scltoxml.ir.ConversionException;
import info.isaksson.erland.scltoxml.ir.ConversionWarning;
import info.isaksson.erland.scltoxml.ir.ConversionWarnings;
import info.isaksson.erland.scltoxml.ir.MemoryLayout;
import info.isaksson.erland.scltoxml.ir.Member;
import info.isaksson.erland.scltoxml.ir.SectionKind;
import info.isaksson.erland.scltoxml.ir.code.CodeToken;
import info.isaksson.erland.scltoxml.ir.xml.OpennessXml;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.attribute;
import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.child;
import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.childText;
import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.children;
import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.descendant;
import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.localName;

/**
 * Public API: read one program block from interchange XML into a {@link CanonicalDocument}.
 *
 * <p>A missing block element, {@code AttributeList} or {@code Interface/Sections} is malformed input.
 * Everything below that is best effort: unreadable members and code nodes are skipped with a
 * warning.</p>
 */
public final class BlockXmlExtractor {

    private static final Logger log = LoggerFactory.getLogger(BlockXmlExtractor.class);

    /** Extracted document plus the warnings recorded while reading it. */
    public static final class Result {
        public final CanonicalDocument document;
        public final List<ConversionWarning> warnings;

        Result(CanonicalDocument document, List<ConversionWarning> warnings) {
            this.document = document;
            this.warnings = warnings;
        }
    }

    private final ExtractorOptions options;

    public BlockXmlExtractor() {
        this(ExtractorOptions.defaults());
    }

    public BlockXmlExtractor(ExtractorOptions options) {
        this.options = options == null ? ExtractorOptions.defaults() : options;
    }

    public Result extract(String xml) throws ConversionException {
        Document dom = OpennessXml.parse(xml);
        ConversionWarnings warnings = new ConversionWarnings();

        Element root = dom.getDocumentElement();
        Element block = findBlock(root);
        if (block == null) {
            throw ConversionException.malformed("No block element (SW.Blocks.FB, FC, OB, GlobalDB or InstanceDB) found");
        }
        BlockKind kind = BlockKind.fromXmlElement(localName(block));
        Element attributes = child(block, "AttributeList");
        if (attributes == null) {
            throw ConversionException.malformed(localName(block) + " has no AttributeList");
        }
        Element sections = descendant(child(attributes, "Interface"), "Sections");
        if (sections == null) {
            throw ConversionException.malformed(localName(block) + " has no Interface/Sections");
        }
        String name = childText(attributes, "Name");
        if (name == null) {
            throw ConversionException.malformed(localName(block) + " has no Name");
        }

        Map<SectionKind, List<Member>> members = new InterfaceReader(warnings).readSections(sections);

        BlockMetadata.Builder meta = BlockMetadata.builder(name, kind);
        meta.blockNumber = integer(childText(attributes, "Number"), "Number", warnings);
        meta.programmingLanguage = childText(attributes, "ProgrammingLanguage");
        meta.memoryLayout = MemoryLayout.fromValue(childText(attributes, "MemoryLayout"));
        meta.memoryReserve = integer(childText(attributes, "MemoryReserve"), "MemoryReserve", warnings);
        meta.enoSetting = Boolean.parseBoolean(childText(attributes, "SetENOAutomatically"));
        Element engineering = child(root, "Engineering");
        meta.engineeringVersion = engineering == null ? null : attribute(engineering, "version");
        meta.author = childText(attributes, "HeaderAuthor");
        meta.family = childText(attributes, "HeaderFamily");
        meta.version = childText(attributes, "HeaderVersion");
        meta.instanceOfName = childText(attributes, "InstanceOfName");
        meta.description = multilingualText(child(block, "ObjectList"), "Comment");
        meta.title = multilingualText(child(block, "ObjectList"), "Title");
        if (kind == BlockKind.FUNCTION) {
            meta.returnType = returnType(members.get(SectionKind.RETURN));
        }

        List<String> code = kind.hasCode() ? readCode(block, warnings) : List.of();
        CanonicalDocument doc = new CanonicalDocument(meta.build(), members, code);

        List<ConversionWarning> list = warnings.toDeterministicList();
        for (ConversionWarning w : list) {
            log.warn("{}: {}", doc.metadata, w);
        }
        log.debug("Extracted {} with {} code lines", doc.metadata, code.size());
        return new Result(doc, list);
    }

    private List<String> readCode(Element block, ConversionWarnings warnings) {
        List<String> code = new ArrayList<>();
        StructuredTextReader reader = new StructuredTextReader(warnings);
        CallReflow reflow = new CallReflow(options);
        for (Element unit : compileUnits(child(block, "ObjectList"))) {
            Element source = descendant(unit, "NetworkSource");
            Element st = descendant(source, "StructuredText");
            if (st == null) {
                warnings.unsupported("UNSUPPORTED_NETWORK_SOURCE", "Compile unit has no structured text",
                        "unit", unit.getAttribute("ID"));
                continue;
            }
            for (List<CodeToken> line : reader.read(st)) {
                for (String rendered : reflow.apply(line)) {
                    code.addAll(Arrays.asList(rendered.split(StructuredTextReader.LINE_BREAK, -1)));
                }
            }
        }
        return code;
    }

    private static List<Element> compileUnits(Element objectList) {
        List<Element> out = new ArrayList<>();
        for (Element e : children(objectList)) {
            if ("SW.Blocks.CompileUnit".equals(localName(e))) out.add(e);
        }
        return out;
    }

    private static Element findBlock(Element root) {
        if (root == null) return null;
        if (BlockKind.fromXmlElement(localName(root)) != null) return root;
        for (Element e : children(root)) {
            Element found = findBlock(e);
            if (found != null) return found;
        }
        return null;
    }

    private static String returnType(List<Member> returnSection) {
        if (returnSection == null) return null;
        for (Member m : returnSection) {
            if ("Ret_Val".equals(m.name)) return m.datatype;
        }
        return null;
    }

    /** Text of the default-culture item of the {@code MultilingualText} with the composition name. */
    static String multilingualText(Element objectList, String compositionName) {
        for (Element mt : children(objectList, "MultilingualText")) {
            if (!compositionName.equals(mt.getAttribute("CompositionName"))) continue;
            String first = null;
            for (Element item : children(child(mt, "ObjectList"), "MultilingualTextItem")) {
                Element itemAttributes = child(item, "AttributeList");
                String text = childText(itemAttributes, "Text");
                if (OpennessXml.CULTURE.equals(childText(itemAttributes, "Culture"))) return text;
                if (first == null) first = text;
            }
            return first;
        }
        return null;
    }

    private static Integer integer(String value, String field, ConversionWarnings warnings) {
        if (value == null) return null;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            warnings.incomplete("NOT_A_NUMBER", "Attribute is not an integer; default used", field, value);
            return null;
        }
    }
}
