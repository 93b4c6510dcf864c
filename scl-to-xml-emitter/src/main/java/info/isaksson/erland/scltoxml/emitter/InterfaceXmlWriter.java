package info.isaksson.erland.scltoxml.emitter;

import info.isaksson.erland.scltoxml.ir.ArrayBound;
import info.isaksson.erland.scltoxml.ir.Member;
import info.isaksson.erland.scltoxml.ir.xml.OpennessXml;
import info.isaksson.erland.scltoxml.scl.DeclarationWriter;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.append;
import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.appendText;

/** Writes {@code Interface/Sections} content: sections and (recursively) their members. */
final class InterfaceXmlWriter {

    /** Member attribute carried as {@code Member@Version} instead of an {@code AttributeList} entry. */
    static final String LIB_VERSION = "LibVersion";

    private InterfaceXmlWriter() {}

    /** Appends {@code Interface/Sections} with the namespace declaration and returns {@code Sections}. */
    static Element appendInterface(Element attributeList) {
        Element iface = append(attributeList, "Interface");
        Element sections = append(iface, "Sections");
        sections.setAttribute("xmlns", OpennessXml.INTERFACE_NS);
        return sections;
    }

    static Element appendSection(Element sections, String name, List<Member> members) {
        Element section = append(sections, "Section");
        section.setAttribute("Name", name);
        for (Member m : members) {
            appendMember(section, m);
        }
        return section;
    }

    static void appendMember(Element parent, Member m) {
        Element e = append(parent, "Member");
        e.setAttribute("Name", m.name);
        e.setAttribute("Datatype", DeclarationWriter.typeText(m));
        if (m.retain) e.setAttribute("Remanence", "Retain");
        String libVersion = m.attributes.get(LIB_VERSION);
        if (libVersion != null) e.setAttribute("Version", libVersion);

        Element attributes = null;
        for (Map.Entry<String, String> a : m.attributes.entrySet()) {
            if (LIB_VERSION.equals(a.getKey())) continue;
            if (attributes == null) attributes = append(e, "AttributeList");
            Element attr = appendText(attributes, isBoolean(a.getValue()) ? "BooleanAttribute" : "StringAttribute", a.getValue());
            attr.setAttribute("Name", a.getKey());
        }
        if (m.comment != null) {
            Element comment = append(e, "Comment");
            appendText(comment, "MultiLanguageText", m.comment).setAttribute("Lang", OpennessXml.CULTURE);
        }
        if (m.isArray()) {
            Element bounds = append(e, "ArrayBounds");
            for (ArrayBound b : m.arrayBounds) {
                Element dim = append(bounds, "Dimension");
                dim.setAttribute("Lower", Integer.toString(b.lower));
                dim.setAttribute("Upper", Integer.toString(b.upper));
            }
        }
        if (m.defaultValue != null) appendText(e, "StartValue", m.defaultValue);
        for (Member nested : m.members) {
            appendMember(e, nested);
        }
    }

    private static boolean isBoolean(String value) {
        String v = value.toLowerCase(Locale.ROOT);
        return v.equals("true") || v.equals("false");
    }
}
