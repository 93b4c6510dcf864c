package info.isaksson.erland.scltoxml.scl;

import info.isaksson.erland.scltoxml.ir.BlockKind;
import info.isaksson.erland.scltoxml.ir.BlockMetadata;
import info.isaksson.erland.scltoxml.ir.CanonicalDocument;
import info.isaksson.erland.scltoxml.ir.ConversionWarnings;
import info.isaksson.erland.scltoxml.ir.MemoryLayout;
import info.isaksson.erland.scltoxml.ir.Member;
import info.isaksson.erland.scltoxml.ir.SectionKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link CanonicalDocument} as control-language source text.
 *
 * <p>Empty sections are omitted. Static members are split into {@code VAR} and {@code VAR RETAIN}
 * by their retain flag. Code lines are written verbatim between {@code BEGIN} and the closing
 * keyword.</p>
 */
public final class SclWriter {

    public String write(CanonicalDocument doc, ConversionWarnings warnings) {
        if (doc == null) throw new IllegalArgumentException("doc must not be null");
        if (warnings == null) warnings = new ConversionWarnings();

        BlockMetadata meta = doc.metadata;
        BlockKind kind = meta.blockType;
        StringBuilder sb = new StringBuilder();

        sb.append(kind.keyword()).append(" \"").append(meta.blockName).append('"');
        if (kind == BlockKind.FUNCTION) sb.append(" : ").append(returnType(doc));
        sb.append('\n');
        if (meta.title != null) sb.append("TITLE = ").append(meta.title).append('\n');
        sb.append("{ S7_Optimized_Access := '")
                .append(meta.memoryLayout == MemoryLayout.STANDARD ? "FALSE" : "TRUE")
                .append("' }\n");
        if (meta.author != null) sb.append("AUTHOR : ").append(meta.author).append('\n');
        if (meta.family != null) sb.append("FAMILY : ").append(meta.family).append('\n');
        if (meta.version != null) sb.append("VERSION : ").append(meta.version).append('\n');
        if (meta.description != null) {
            for (String line : meta.description.split("\n", -1)) {
                sb.append("//").append(line).append('\n');
            }
        }

        if (kind == BlockKind.INSTANCE_DB) {
            sb.append('"').append(meta.instanceOfName == null ? "" : meta.instanceOfName).append("\"\n");
        } else {
            for (Map.Entry<SectionKind, List<Member>> e : doc.sections.entrySet()) {
                SectionKind section = e.getKey();
                if (section == SectionKind.RETURN) continue;
                if (!kind.sections().contains(section)) {
                    if (!e.getValue().isEmpty()) {
                        warnings.unsupported("SECTION_NOT_ALLOWED", "Section is not legal for the block kind; members dropped",
                                "section", section.xmlName(), "block", kind.code());
                    }
                    continue;
                }
                if (section == SectionKind.STATIC) {
                    writeStatic(sb, e.getValue());
                } else {
                    writeRegion(sb, section.keyword(), e.getValue());
                }
            }
        }

        sb.append('\n').append("BEGIN\n");
        for (String line : doc.code) {
            sb.append(line).append('\n');
        }
        sb.append("END_").append(kind.keyword()).append('\n');
        return sb.toString();
    }

    private static void writeStatic(StringBuilder sb, List<Member> members) {
        List<Member> plain = new ArrayList<>();
        List<Member> retained = new ArrayList<>();
        for (Member m : members) {
            (m.retain ? retained : plain).add(m);
        }
        writeRegion(sb, "VAR", plain);
        writeRegion(sb, "VAR RETAIN", retained);
    }

    private static void writeRegion(StringBuilder sb, String keyword, List<Member> members) {
        if (members.isEmpty()) return;
        sb.append(DeclarationWriter.INDENT).append(keyword).append('\n');
        DeclarationWriter.writeMembers(sb, members, 2);
        sb.append(DeclarationWriter.INDENT).append("END_VAR\n\n");
    }

    private static String returnType(CanonicalDocument doc) {
        if (doc.metadata.hasReturnValue()) return doc.metadata.returnType;
        List<Member> ret = doc.section(SectionKind.RETURN);
        return ret.isEmpty() ? BlockMetadata.VOID : ret.get(0).datatype;
    }
}
