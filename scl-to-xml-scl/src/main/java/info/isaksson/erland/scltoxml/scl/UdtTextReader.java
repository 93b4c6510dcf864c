package info.isaksson.erland.scltoxml.scl;

import info.isaksson.erland.scltoxml.ir.ConversionException;
import info.isaksson.erland.scltoxml.ir.ConversionWarning;
import info.isaksson.erland.scltoxml.ir.ConversionWarnings;
import info.isaksson.erland.scltoxml.ir.TypeDocument;
import info.isaksson.erland.scltoxml.ir.TypeMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a struct type declaration ({@code TYPE "name" ... STRUCT ... END_STRUCT; END_TYPE}).
 *
 * <p>Author and family are read from {@code AUTHOR :}/{@code FAMILY :} lines or from
 * {@code // Author:}/{@code // Family:} comments; other comment lines before {@code STRUCT}
 * form the description.</p>
 */
public final class UdtTextReader {

    private static final Logger log = LoggerFactory.getLogger(UdtTextReader.class);

    private static final Pattern TYPE_HEADER = Pattern.compile("(?im)^\\s*TYPE\\s+(?:\"([^\"]+)\"|([A-Za-z_][A-Za-z0-9_]*))");
    private static final Pattern VERSION = Pattern.compile("(?i)^VERSION\\s*:\\s*(\\S+)");
    private static final Pattern AUTHOR = Pattern.compile("(?i)^(?://\\s*)?AUTHOR\\s*:\\s*(.+)$");
    private static final Pattern FAMILY = Pattern.compile("(?i)^(?://\\s*)?FAMILY\\s*:\\s*(.+)$");

    public static final class Result {
        public final TypeDocument document;
        public final List<ConversionWarning> warnings;

        Result(TypeDocument document, List<ConversionWarning> warnings) {
            this.document = document;
            this.warnings = warnings;
        }
    }

    public Result read(String text) throws ConversionException {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        ConversionWarnings warnings = new ConversionWarnings();

        Matcher h = TYPE_HEADER.matcher(text);
        if (!h.find()) throw ConversionException.malformed("No TYPE \"name\" header found");
        String name = h.group(1) != null ? h.group(1) : h.group(2);

        String[] lines = text.substring(h.end()).split("\\r?\\n", -1);
        String version = null;
        String author = null;
        String family = null;
        List<String> description = new ArrayList<>();

        int i = 0;
        for (; i < lines.length; i++) {
            String trimmed = lines[i].trim();
            if (trimmed.isEmpty()) continue;
            if (trimmed.equalsIgnoreCase("STRUCT")) break;
            Matcher m;
            if ((m = VERSION.matcher(trimmed)).find()) {
                version = m.group(1);
            } else if ((m = AUTHOR.matcher(trimmed)).find()) {
                author = m.group(1).trim();
            } else if ((m = FAMILY.matcher(trimmed)).find()) {
                family = m.group(1).trim();
            } else if (trimmed.startsWith("//")) {
                description.add(trimmed.substring(2).trim());
            }
        }
        if (i >= lines.length) {
            throw ConversionException.malformed("Type \"" + name + "\" has no STRUCT body");
        }

        DeclarationParser.StructBody body = new DeclarationParser(warnings).parseStruct(List.of(lines), i + 1, false);
        if (!body.terminated) {
            warnings.incomplete("UNTERMINATED_STRUCT", "Type STRUCT has no END_STRUCT", "type", name);
        }
        boolean closed = false;
        for (int k = body.next; k < lines.length; k++) {
            if (lines[k].trim().toUpperCase(Locale.ROOT).startsWith("END_TYPE")) {
                closed = true;
                break;
            }
        }
        if (!closed) {
            warnings.incomplete("MISSING_END_KEYWORD", "Type is not closed by END_TYPE", "type", name);
        }

        TypeMetadata meta = new TypeMetadata(name, version, author, family,
                description.isEmpty() ? null : String.join("\n", description));
        List<ConversionWarning> list = warnings.toDeterministicList();
        log.debug("Read type \"{}\" with {} members and {} warnings", name, body.members.size(), list.size());
        return new Result(new TypeDocument(meta, body.members), list);
    }
}
