package info.isaksson.erland.scltoxml.ir;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Checks the structural invariants of canonical documents before they are written as XML:
 * unique member names per level, {@code Struct} members exactly when nested members exist,
 * well-formed array bounds, valued member attributes, and no code in data blocks.
 */
public final class DocumentValidator {

    private DocumentValidator() {}

    public static List<String> validate(CanonicalDocument doc) {
        if (doc == null) throw new IllegalArgumentException("doc must not be null");
        List<String> violations = new ArrayList<>();
        if (doc.metadata.blockName == null || doc.metadata.blockName.isBlank()) {
            violations.add("block has no name");
        }
        for (Map.Entry<SectionKind, List<Member>> e : doc.sections.entrySet()) {
            checkMembers(e.getValue(), e.getKey().xmlName(), violations);
        }
        if (doc.blockKind().isDataBlock() && !doc.code.isEmpty()) {
            violations.add("data block " + doc.metadata.blockName + " must not carry code lines");
        }
        return violations;
    }

    public static List<String> validate(TypeDocument doc) {
        if (doc == null) throw new IllegalArgumentException("doc must not be null");
        List<String> violations = new ArrayList<>();
        if (doc.metadata.name == null || doc.metadata.name.isBlank()) {
            violations.add("type has no name");
        }
        checkMembers(doc.members, "None", violations);
        return violations;
    }

    /** Throws {@link FailureKind#MALFORMED_INPUT} naming the first violation. */
    public static void requireValid(CanonicalDocument doc) throws ConversionException {
        failOn(validate(doc));
    }

    public static void requireValid(TypeDocument doc) throws ConversionException {
        failOn(validate(doc));
    }

    private static void failOn(List<String> violations) throws ConversionException {
        if (!violations.isEmpty()) {
            throw ConversionException.malformed("Invalid document: " + String.join("; ", violations));
        }
    }

    private static void checkMembers(List<Member> members, String path, List<String> out) {
        Set<String> seen = new HashSet<>();
        for (Member m : members) {
            if (m == null) continue;
            String where = path + "/" + m.name;
            if (m.name == null || m.name.isBlank()) {
                out.add("member without name in " + path);
                continue;
            }
            if (m.datatype == null || m.datatype.isBlank()) {
                out.add(where + " has no datatype");
            }
            // Member names are case-insensitive in the control language.
            if (!seen.add(m.name.toLowerCase(Locale.ROOT))) {
                out.add("duplicate member name " + where);
            }
            for (ArrayBound b : m.arrayBounds) {
                if (b.lower > b.upper) {
                    out.add(where + " has array bound " + b + " with lower > upper");
                }
            }
            for (Map.Entry<String, String> a : m.attributes.entrySet()) {
                if (a.getKey() == null || a.getKey().isBlank() || a.getValue() == null) {
                    out.add(where + " has attribute " + a.getKey() + " without a value");
                }
            }
            if (m.isStruct() && m.members.isEmpty()) {
                out.add(where + " is a Struct without members");
            }
            if (!m.isStruct() && !m.members.isEmpty()) {
                out.add(where + " has nested members but datatype " + m.datatype);
            }
            checkMembers(m.members, where, out);
        }
    }
}
