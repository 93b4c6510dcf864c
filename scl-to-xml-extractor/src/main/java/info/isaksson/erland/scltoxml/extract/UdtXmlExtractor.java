package info.isaksson.erland.scltoxml.extract;

import info.isaksson.erland.scltoxml.ir.ConversionException;
import info.isaksson.erland.scltoxml.ir.ConversionWarning;
import info.isaksson.erland.scltoxml.ir.ConversionWarnings;
import info.isaksson.erland.scltoxml.ir.Member;
import info.isaksson.erland.scltoxml.ir.TypeDocument;
import info.isaksson.erland.scltoxml.ir.TypeMetadata;
import info.isaksson.erland.scltoxml.ir.xml.OpennessXml;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.child;
import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.childText;
import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.children;
import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.descendant;

/** Reads a user-defined struct type ({@code SW.Types.PlcStruct}) from interchange XML. */
public final class UdtXmlExtractor {

    private static final Logger log = LoggerFactory.getLogger(UdtXmlExtractor.class);

    public static final class Result {
        public final TypeDocument document;
        public final List<ConversionWarning> warnings;

        Result(TypeDocument document, List<ConversionWarning> warnings) {
            this.document = document;
            this.warnings = warnings;
        }
    }

    public Result extract(String xml) throws ConversionException {
        Element root = OpennessXml.parse(xml).getDocumentElement();
        Element type = descendant(root, "SW.Types.PlcStruct");
        // Older exports use the DataTypes element name.
        if (type == null) type = descendant(root, "SW.DataTypes.PlcStruct");
        if (type == null) throw ConversionException.malformed("No PlcStruct element found");

        Element attributes = child(type, "AttributeList");
        if (attributes == null) throw ConversionException.malformed("PlcStruct has no AttributeList");
        Element sections = descendant(child(attributes, "Interface"), "Sections");
        if (sections == null) throw ConversionException.malformed("PlcStruct has no Interface/Sections");
        String name = childText(attributes, "Name");
        if (name == null) throw ConversionException.malformed("PlcStruct has no Name");

        ConversionWarnings warnings = new ConversionWarnings();
        InterfaceReader reader = new InterfaceReader(warnings);
        List<Member> members = new ArrayList<>();
        for (Element section : children(sections, "Section")) {
            members.addAll(reader.readMembers(section, section.getAttribute("Name")));
        }

        String author = childText(attributes, "Author");
        String family = childText(attributes, "Family");
        TypeMetadata meta = new TypeMetadata(name, childText(attributes, "Version"),
                author != null ? author : childText(attributes, "HeaderAuthor"),
                family != null ? family : childText(attributes, "HeaderFamily"),
                BlockXmlExtractor.multilingualText(child(type, "ObjectList"), "Comment"));

        List<ConversionWarning> list = warnings.toDeterministicList();
        for (ConversionWarning w : list) {
            log.warn("type \"{}\": {}", name, w);
        }
        log.debug("Extracted type \"{}\" with {} members", name, members.size());
        return new Result(new TypeDocument(meta, members), list);
    }
}
