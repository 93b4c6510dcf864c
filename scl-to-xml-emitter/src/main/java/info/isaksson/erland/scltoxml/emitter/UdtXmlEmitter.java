package info.isaksson.erland.scltoxml.emitter;

import info.isaksson.erland.scltoxml.ir.ConversionException;
import info.isaksson.erland.scltoxml.ir.DocumentValidator;
import info.isaksson.erland.scltoxml.ir.TypeDocument;
import info.isaksson.erland.scltoxml.ir.TypeMetadata;
import info.isaksson.erland.scltoxml.ir.xml.OpennessXml;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.append;
import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.appendText;

/** Generates interchange XML ({@code SW.Types.PlcStruct}) for a user-defined struct type. */
public final class UdtXmlEmitter {

    private static final Logger log = LoggerFactory.getLogger(UdtXmlEmitter.class);

    static final String SECTION_NAME = "None";

    private final GeneratorOptions options;

    public UdtXmlEmitter() {
        this(GeneratorOptions.defaults());
    }

    public UdtXmlEmitter(GeneratorOptions options) {
        this.options = options == null ? GeneratorOptions.defaults() : options;
    }

    public String emit(TypeDocument doc) throws ConversionException {
        if (doc == null) throw new IllegalArgumentException("doc must not be null");
        DocumentValidator.requireValid(doc);
        TypeMetadata meta = doc.metadata;
        NodeIdCounter objectIds = NodeIdCounter.hex(0);

        Document dom = OpennessXml.newDocument();
        Element root = dom.createElement("Document");
        dom.appendChild(root);
        ObjectListXml.appendDocumentHeader(root, options.engineeringVersion);

        Element type = append(root, "SW.Types.PlcStruct");
        type.setAttribute("ID", objectIds.next());
        Element attributes = append(type, "AttributeList");
        if (meta.author != null) appendText(attributes, "Author", meta.author);
        if (meta.family != null) appendText(attributes, "Family", meta.family);
        Element sections = InterfaceXmlWriter.appendInterface(attributes);
        InterfaceXmlWriter.appendSection(sections, SECTION_NAME, doc.members);
        appendText(attributes, "Name", meta.name);
        appendText(attributes, "Version", meta.version);

        Element objects = append(type, "ObjectList");
        ObjectListXml.appendMultilingualText(objects, "Comment", meta.description, objectIds);
        ObjectListXml.appendMultilingualText(objects, "Title", null, objectIds);

        log.debug("Generated XML for type \"{}\" with {} members", meta.name, doc.members.size());
        return OpennessXml.serialize(dom);
    }
}
