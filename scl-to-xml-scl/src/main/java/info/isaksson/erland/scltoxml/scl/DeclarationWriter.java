package info.isaksson.erland.scltoxml.scl;

import info.isaksson.erland.scltoxml.ir.ArrayBound;
import info.isaksson.erland.scltoxml.ir.Member;
import info.isaksson.erland.scltoxml.ir.code.SclKeywords;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Writes member declarations in the form {@link DeclarationParser} reads. */
public final class DeclarationWriter {
    public static final String INDENT = "   ";

    private DeclarationWriter() {}

    public static void writeMembers(StringBuilder sb, List<Member> members, int depth) {
        for (Member m : members) {
            writeMember(sb, m, depth);
        }
    }

    public static void writeMember(StringBuilder sb, Member m, int depth) {
        String indent = INDENT.repeat(depth);
        sb.append(indent).append(name(m.name)).append(attributes(m.attributes)).append(" : ");
        if (m.isStruct()) {
            sb.append(typeText(m));
            if (m.comment != null) sb.append("   // ").append(m.comment);
            sb.append('\n');
            writeMembers(sb, m.members, depth + 1);
            sb.append(indent).append("END_STRUCT;\n");
            return;
        }
        sb.append(typeText(m));
        if (m.defaultValue != null) sb.append(" := ").append(m.defaultValue);
        sb.append(';');
        if (m.comment != null) sb.append("   // ").append(m.comment);
        sb.append('\n');
    }

    /** {@code Array[0..9, 1..2] of Int}, or the datatype alone. */
    public static String typeText(Member m) {
        if (!m.isArray()) return m.datatype;
        return "Array[" + m.arrayBounds.stream().map(ArrayBound::toString).collect(Collectors.joining(", "))
                + "] of " + m.datatype;
    }

    static String name(String name) {
        return SclKeywords.isIdentifier(name) ? name : "\"" + name + "\"";
    }

    private static String attributes(Map<String, String> attributes) {
        if (attributes.isEmpty()) return "";
        return " { " + attributes.entrySet().stream()
                .map(e -> e.getKey() + " := '" + e.getValue() + "'")
                .collect(Collectors.joining("; ")) + " }";
    }
}
