package info.isaksson.erland.scltoxml.emitter;

import info.isaksson.erland.scltoxml.ir.xml.OpennessXml;
import org.w3c.dom.Element;

import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.append;
import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.appendText;

/** Wrapper objects shared by block and type documents. */
final class ObjectListXml {

    private ObjectListXml() {}

    static Element appendDocumentHeader(Element root, String engineeringVersion) {
        append(root, "Engineering").setAttribute("version", engineeringVersion);
        Element info = append(root, "DocumentInfo");
        appendText(info, "ExportSetting", "None");
        return root;
    }

    /** {@code MultilingualText} with one {@code en-US} item; {@code text} may be {@code null}. */
    static Element appendMultilingualText(Element objectList, String compositionName, String text, NodeIdCounter ids) {
        Element mt = append(objectList, "MultilingualText");
        mt.setAttribute("ID", ids.next());
        mt.setAttribute("CompositionName", compositionName);
        Element items = append(mt, "ObjectList");
        Element item = append(items, "MultilingualTextItem");
        item.setAttribute("ID", ids.next());
        item.setAttribute("CompositionName", "Items");
        Element attributes = append(item, "AttributeList");
        appendText(attributes, "Culture", OpennessXml.CULTURE);
        appendText(attributes, "Text", text);
        return mt;
    }
}
