package info.isaksson.erland.scltoxml.scl;

import info.isaksson.erland.scltoxml.ir.TypeDocument;
import info.isaksson.erland.scltoxml.ir.TypeMetadata;

/** Writes a {@link TypeDocument} as a {@code TYPE ... END_TYPE} declaration. */
public final class UdtTextWriter {

    public String write(TypeDocument doc) {
        if (doc == null) throw new IllegalArgumentException("doc must not be null");
        TypeMetadata meta = doc.metadata;
        StringBuilder sb = new StringBuilder();
        sb.append("TYPE \"").append(meta.name).append("\"\n");
        sb.append("VERSION : ").append(meta.version).append('\n');
        if (meta.author != null) sb.append("AUTHOR : ").append(meta.author).append('\n');
        if (meta.family != null) sb.append("FAMILY : ").append(meta.family).append('\n');
        if (meta.description != null) {
            for (String line : meta.description.split("\n", -1)) {
                sb.append("   // ").append(line).append('\n');
            }
        }
        sb.append(DeclarationWriter.INDENT).append("STRUCT\n");
        DeclarationWriter.writeMembers(sb, doc.members, 2);
        sb.append(DeclarationWriter.INDENT).append("END_STRUCT;\n");
        sb.append('\n');
        sb.append("END_TYPE\n");
        return sb.toString();
    }
}
