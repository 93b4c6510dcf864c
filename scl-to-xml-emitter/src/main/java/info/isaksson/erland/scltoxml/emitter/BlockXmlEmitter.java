package info.isaksson.erland.scltoxml.emitter;

import info.isaksson.erland.scltoxml.ir.BlockKind;
import info.isaksson.erland.scltoxml.ir.BlockMetadata;
import info.isaksson.erland.scltoxml.ir.CanonicalDocument;
import info.isaksson.erland.scltoxml.ir.ConversionException;
import info.isaksson.erland.scltoxml.ir.ConversionWarning;
import info.isaksson.erland.scltoxml.ir.ConversionWarnings;
import info.isaksson.erland.scltoxml.ir.DocumentValidator;
import info.isaksson.erland.scltoxml.ir.Member;
import info.isaksson.erland.scltoxml.ir.SectionKind;
import info.isaksson.erland.scltoxml.ir.code.CodeToken;
import info.isaksson.erland.scltoxml.ir.xml.OpennessXml;
import info.isaksson.erland.scltoxml.scl.CodeLineParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.append;
import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.appendText;

/**
 * Public API: generate interchange XML for one program block.
 *
 * <p>The document is validated first; invariant violations are malformed input. Every legal section
 * of the block kind is written, empty or not. Code lines are re-lexed with the configured scope
 * rules plus the block's own constant names and encoded as structured text.</p>
 */
public final class BlockXmlEmitter {

    private static final Logger log = LoggerFactory.getLogger(BlockXmlEmitter.class);

    public static final int DEFAULT_MEMORY_RESERVE = 100;
    static final String RETURN_VALUE = "Ret_Val";

    /** Generated XML plus the warnings recorded while generating it. */
    public static final class Result {
        public final String xml;
        public final List<ConversionWarning> warnings;

        /** Number of structured-code identities assigned, starting at the configured offset. */
        public final int uidCount;

        Result(String xml, List<ConversionWarning> warnings, int uidCount) {
            this.xml = xml;
            this.warnings = warnings == null ? List.of() : warnings;
            this.uidCount = uidCount;
        }
    }

    private final GeneratorOptions options;

    public BlockXmlEmitter() {
        this(GeneratorOptions.defaults());
    }

    public BlockXmlEmitter(GeneratorOptions options) {
        this.options = options == null ? GeneratorOptions.defaults() : options;
    }

    public Result emit(CanonicalDocument doc) throws ConversionException {
        if (doc == null) throw new IllegalArgumentException("doc must not be null");
        DocumentValidator.requireValid(doc);

        ConversionWarnings warnings = new ConversionWarnings();
        BlockMetadata meta = doc.metadata;
        BlockKind kind = meta.blockType;
        NodeIdCounter objectIds = NodeIdCounter.hex(0);
        NodeIdCounter uids = NodeIdCounter.decimal(options.uidStart);

        Document dom = OpennessXml.newDocument();
        Element root = dom.createElement("Document");
        dom.appendChild(root);
        ObjectListXml.appendDocumentHeader(root,
                meta.engineeringVersion != null ? meta.engineeringVersion : options.engineeringVersion);

        Element block = append(root, kind.xmlElement());
        block.setAttribute("ID", objectIds.next());

        Element attributes = append(block, "AttributeList");
        if (meta.author != null) appendText(attributes, "HeaderAuthor", meta.author);
        if (meta.family != null) appendText(attributes, "HeaderFamily", meta.family);
        if (meta.version != null) appendText(attributes, "HeaderVersion", meta.version);
        if (kind == BlockKind.INSTANCE_DB && meta.instanceOfName != null) {
            appendText(attributes, "InstanceOfName", meta.instanceOfName);
        }
        appendInterface(attributes, doc, warnings);
        appendText(attributes, "MemoryLayout", meta.memoryLayout.value());
        if (kind == BlockKind.FUNCTION_BLOCK || kind.isDataBlock()) {
            appendText(attributes, "MemoryReserve",
                    Integer.toString(meta.memoryReserve != null ? meta.memoryReserve : DEFAULT_MEMORY_RESERVE));
        }
        appendText(attributes, "Name", meta.blockName);
        appendText(attributes, "Number", Integer.toString(meta.blockNumber));
        appendText(attributes, "ProgrammingLanguage", meta.programmingLanguage);
        if (kind == BlockKind.ORGANIZATION_BLOCK) appendText(attributes, "SecondaryType", "ProgramCycle");
        if (kind.hasCode()) appendText(attributes, "SetENOAutomatically", Boolean.toString(meta.enoSetting));

        Element objects = append(block, "ObjectList");
        ObjectListXml.appendMultilingualText(objects, "Comment", meta.description, objectIds);
        if (kind.hasCode()) {
            appendCompileUnit(objects, doc, objectIds, uids);
        }
        ObjectListXml.appendMultilingualText(objects, "Title", meta.title, objectIds);

        List<ConversionWarning> list = warnings.toDeterministicList();
        for (ConversionWarning w : list) {
            log.warn("{}: {}", meta, w);
        }
        log.debug("Generated XML for {}: {} code lines, {} node identities from {}",
                meta, doc.code.size(), uids.issued(), options.uidStart);
        return new Result(OpennessXml.serialize(dom), list, uids.issued());
    }

    private void appendInterface(Element attributes, CanonicalDocument doc, ConversionWarnings warnings) {
        BlockKind kind = doc.blockKind();
        Element sections = InterfaceXmlWriter.appendInterface(attributes);
        for (SectionKind section : kind.sections()) {
            List<Member> members = doc.section(section);
            if (section == SectionKind.RETURN) {
                members = returnMembers(doc, warnings);
            }
            InterfaceXmlWriter.appendSection(sections, section.xmlName(), members);
        }
        for (Map.Entry<SectionKind, List<Member>> e : doc.sections.entrySet()) {
            if (!kind.sections().contains(e.getKey()) && !e.getValue().isEmpty()) {
                warnings.unsupported("SECTION_NOT_ALLOWED", "Section is not legal for the block kind; members dropped",
                        "section", e.getKey().xmlName(), "block", kind.code());
            }
        }
    }

    /** {@code Ret_Val} for a typed function, nothing for a void one. */
    private static List<Member> returnMembers(CanonicalDocument doc, ConversionWarnings warnings) {
        BlockMetadata meta = doc.metadata;
        List<Member> declared = doc.section(SectionKind.RETURN);
        if (!meta.hasReturnValue()) {
            if (!declared.isEmpty()) {
                warnings.unsupported("RETURN_VALUE_IGNORED", "Function returns Void; Return members dropped",
                        "block", meta.blockName);
            }
            return List.of();
        }
        for (Member m : declared) {
            if (RETURN_VALUE.equals(m.name)) {
                return List.of(new Member(RETURN_VALUE, meta.returnType, null, m.comment, false, null, m.attributes, null));
            }
        }
        return List.of(Member.of(RETURN_VALUE, meta.returnType));
    }

    private void appendCompileUnit(Element objects, CanonicalDocument doc, NodeIdCounter objectIds, NodeIdCounter uids) {
        Element unit = append(objects, "SW.Blocks.CompileUnit");
        unit.setAttribute("ID", objectIds.next());
        unit.setAttribute("CompositionName", "CompileUnits");
        Element unitAttributes = append(unit, "AttributeList");
        Element source = append(unitAttributes, "NetworkSource");

        CodeLineParser parser = new CodeLineParser(options.scopeRules.withLocalConstants(constantNames(doc)));
        List<List<CodeToken>> lines = parser.parseLines(doc.code);
        new StructuredTextXmlBuilder(uids, instanceTypes(doc)).build(source, lines);
        appendText(unitAttributes, "ProgrammingLanguage", doc.metadata.programmingLanguage);

        Element unitObjects = append(unit, "ObjectList");
        ObjectListXml.appendMultilingualText(unitObjects, "Comment", null, objectIds);
        ObjectListXml.appendMultilingualText(unitObjects, "Title", null, objectIds);
    }

    private static List<String> constantNames(CanonicalDocument doc) {
        List<String> names = new ArrayList<>();
        for (Member m : doc.section(SectionKind.CONSTANT)) {
            names.add(m.name);
        }
        return names;
    }

    private static Map<String, String> instanceTypes(CanonicalDocument doc) {
        Map<String, String> out = new HashMap<>();
        for (SectionKind section : List.of(SectionKind.STATIC, SectionKind.TEMP, SectionKind.IN_OUT)) {
            for (Member m : doc.section(section)) {
                if (!m.isStruct() && !m.isArray()) out.put(m.name.toLowerCase(Locale.ROOT), m.datatype);
            }
        }
        return out;
    }
}
