package info.isaksson.erland.scltoxml.extract;

import info.isaksson.erland.scltoxml.ir.ArrayBound;
import info.isaksson.erland.scltoxml.ir.ConversionWarnings;
import info.isaksson.erland.scltoxml.ir.Member;
import info.isaksson.erland.scltoxml.ir.SectionKind;
import info.isaksson.erland.scltoxml.ir.xml.OpennessXml;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.attribute;
import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.child;
import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.childText;
import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.children;

/** Reads {@code Sections/Section/Member} trees. Members recurse only under {@code Struct} datatypes. */
final class InterfaceReader {

    private static final Pattern ARRAY_TYPE = Pattern.compile("^Array\\s*\\[(.+)]\\s*of\\s+(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIMENSION = Pattern.compile("^\\s*(-?\\d+)\\s*\\.\\.\\s*(-?\\d+)\\s*$");

    private final ConversionWarnings warnings;

    InterfaceReader(ConversionWarnings warnings) {
        this.warnings = warnings;
    }

    Map<SectionKind, List<Member>> readSections(Element sections) {
        Map<SectionKind, List<Member>> out = new EnumMap<>(SectionKind.class);
        for (Element section : children(sections, "Section")) {
            String name = section.getAttribute("Name");
            SectionKind kind = SectionKind.fromXmlName(name);
            if (kind == null) {
                warnings.unsupported("UNKNOWN_SECTION", "Section is not recognized; members skipped", "section", name);
                continue;
            }
            out.put(kind, readMembers(section, name));
        }
        return out;
    }

    List<Member> readMembers(Element parent, String path) {
        List<Member> out = new ArrayList<>();
        for (Element e : children(parent, "Member")) {
            Member m = readMember(e, path);
            if (m != null) out.add(m);
        }
        return out;
    }

    private Member readMember(Element e, String path) {
        String name = attribute(e, "Name");
        String datatype = attribute(e, "Datatype");
        if (name == null || name.isBlank() || datatype == null || datatype.isBlank()) {
            warnings.incomplete("MEMBER_INCOMPLETE", "Member without Name or Datatype skipped", "path", path);
            return null;
        }
        String where = path + "/" + name;

        List<ArrayBound> bounds = List.of();
        Matcher am = ARRAY_TYPE.matcher(datatype.trim());
        if (am.matches()) {
            List<ArrayBound> parsed = parseDimensions(am.group(1));
            if (parsed != null) {
                bounds = parsed;
                datatype = am.group(2).trim();
            }
        } else {
            bounds = readArrayBounds(e);
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        Element list = child(e, "AttributeList");
        for (Element a : children(list)) {
            String key = attribute(a, "Name");
            if (key != null) attributes.put(key, a.getTextContent().trim());
        }
        String libVersion = attribute(e, "Version");
        if (libVersion != null) attributes.put("LibVersion", libVersion);

        boolean struct = Member.STRUCT.equalsIgnoreCase(datatype);
        List<Member> nested = struct ? readMembers(e, where) : List.of();
        return new Member(name, datatype, childText(e, "StartValue"), comment(e), "Retain".equals(attribute(e, "Remanence")),
                bounds, attributes, nested);
    }

    private List<ArrayBound> readArrayBounds(Element member) {
        Element bounds = child(member, "ArrayBounds");
        if (bounds == null) return List.of();
        List<ArrayBound> out = new ArrayList<>();
        for (Element dim : children(bounds, "Dimension")) {
            try {
                out.add(new ArrayBound(Integer.parseInt(dim.getAttribute("Lower").trim()),
                        Integer.parseInt(dim.getAttribute("Upper").trim())));
            } catch (NumberFormatException ex) {
                warnings.incomplete("ARRAY_BOUNDS_INVALID", "Dimension bounds are not integers", "member",
                        attribute(member, "Name"));
                return List.of();
            }
        }
        return out;
    }

    private static List<ArrayBound> parseDimensions(String dims) {
        List<ArrayBound> out = new ArrayList<>();
        for (String dim : dims.split(",")) {
            Matcher m = DIMENSION.matcher(dim);
            if (!m.matches()) return null;
            out.add(new ArrayBound(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))));
        }
        return out;
    }

    /** {@code Comment/MultiLanguageText}, preferring the default culture. */
    static String comment(Element member) {
        Element comment = child(member, "Comment");
        if (comment == null) return null;
        String first = null;
        for (Element text : children(comment, "MultiLanguageText")) {
            String value = text.getTextContent();
            if (OpennessXml.CULTURE.equals(text.getAttribute("Lang"))) return value;
            if (first == null) first = value;
        }
        return first;
    }
}
