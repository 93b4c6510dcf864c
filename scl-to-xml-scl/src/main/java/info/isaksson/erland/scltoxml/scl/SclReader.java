package info.isaksson.erland.scltoxml.scl;

import info.isaksson.erland.scltoxml.ir.BlockKind;
import info.isaksson.erland.scltoxml.ir.BlockMetadata;
import info.isaksson.erland.scltoxml.ir.CanonicalDocument;
import info.isaksson.erland.scltoxml.ir.ConversionException;
import info.isaksson.erland.scltoxml.ir.ConversionWarning;
import info.isaksson.erland.scltoxml.ir.ConversionWarnings;
import info.isaksson.erland.scltoxml.ir.MemoryLayout;
import info.isaksson.erland.scltoxml.ir.Member;
import info.isaksson.erland.scltoxml.ir.SectionKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads one block of control-language source text into a {@link CanonicalDocument}.
 *
 * <p>The block kind comes from the header keyword. {@code FUNCTION_BLOCK} is tried before
 * {@code FUNCTION}, and {@code FUNCTION} only matches when followed by whitespace. Header attributes,
 * declaration regions and the code body are then read line by line. Code lines are kept verbatim
 * (trailing whitespace removed, leading and trailing blank lines dropped).</p>
 */
public final class SclReader {

    private static final Logger log = LoggerFactory.getLogger(SclReader.class);

    public static final String DEFAULT_ENGINEERING_VERSION = "V17";

    private static final String NAME_GROUP = "(?:\"([^\"]+)\"|([A-Za-z_][A-Za-z0-9_]*))";

    private static final Pattern FB_HEADER = header("FUNCTION_BLOCK");
    private static final Pattern OB_HEADER = header("ORGANIZATION_BLOCK");
    private static final Pattern DB_HEADER = header("DATA_BLOCK");
    private static final Pattern FC_HEADER = Pattern.compile(
            "(?im)^\\s*FUNCTION\\s+" + NAME_GROUP + "(?:\\s*:\\s*(\"[^\"]+\"|[^\\s;{/]+))?");

    private static final Pattern OPTIMIZED = Pattern.compile("(?i)S7_Optimized_Access\\s*:=\\s*['\"]?(\\w+)");
    private static final Pattern VERSION = Pattern.compile("(?i)^VERSION\\s*:\\s*(\\S+)");
    private static final Pattern AUTHOR = Pattern.compile("(?i)^AUTHOR\\s*:\\s*(.+)$");
    private static final Pattern FAMILY = Pattern.compile("(?i)^FAMILY\\s*:\\s*(.+)$");
    private static final Pattern TITLE = Pattern.compile("(?i)^TITLE\\s*=\\s*(.*)$");
    private static final Pattern INSTANCE_OF = Pattern.compile("^\"([^\"]+)\"\\s*;?$");
    private static final Pattern OB_NUMBER = Pattern.compile("(?i)OB_?(\\d+)");
    private static final Pattern DB_ASSIGNMENT = Pattern.compile(
            "^([A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*)\\s*:=\\s*(.+?)\\s*;$");

    private final String engineeringVersion;

    public SclReader() {
        this(DEFAULT_ENGINEERING_VERSION);
    }

    public SclReader(String engineeringVersion) {
        this.engineeringVersion = engineeringVersion == null || engineeringVersion.isBlank()
                ? DEFAULT_ENGINEERING_VERSION
                : engineeringVersion;
    }

    /** Parsed document plus the warnings recorded while reading it. */
    public static final class Result {
        public final CanonicalDocument document;
        public final List<ConversionWarning> warnings;

        Result(CanonicalDocument document, List<ConversionWarning> warnings) {
            this.document = document;
            this.warnings = warnings;
        }
    }

    public Result read(String text) throws ConversionException {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        ConversionWarnings warnings = new ConversionWarnings();

        Header header = detectHeader(text);
        if (header == null) {
            throw ConversionException.malformed(
                    "No block keyword found (expected FUNCTION_BLOCK, FUNCTION, ORGANIZATION_BLOCK or DATA_BLOCK)");
        }

        List<String> lines = Arrays.asList(text.substring(header.end).split("\\r?\\n", -1));
        BlockMetadata.Builder meta = BlockMetadata.builder(header.name, header.kind);
        meta.engineeringVersion = engineeringVersion;
        meta.returnType = header.returnType;

        Map<SectionKind, List<Member>> sections = new EnumMap<>(SectionKind.class);
        List<String> description = new ArrayList<>();
        List<String> body = new ArrayList<>();
        DeclarationParser declarations = new DeclarationParser(warnings);
        String endKeyword = "END_" + header.kind.keyword();
        boolean sawEnd = false;
        boolean inBody = false;
        boolean sawDeclarations = false;

        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            String trimmed = line.trim();
            String upper = trimmed.toUpperCase(Locale.ROOT);

            if (inBody) {
                if (upper.startsWith(endKeyword)) {
                    sawEnd = true;
                    break;
                }
                body.add(stripTrailing(line));
                i++;
                continue;
            }

            if (upper.startsWith(endKeyword)) {
                sawEnd = true;
                break;
            }
            if (upper.equals("BEGIN") || upper.startsWith("BEGIN ")) {
                inBody = true;
                i++;
                continue;
            }

            Region region = Region.of(upper);
            if (region != null) {
                sawDeclarations = true;
                List<String> regionLines = new ArrayList<>();
                int j = i + 1;
                while (j < lines.size() && !lines.get(j).trim().toUpperCase(Locale.ROOT).startsWith("END_VAR")) {
                    regionLines.add(lines.get(j));
                    j++;
                }
                if (j >= lines.size()) {
                    warnings.incomplete("UNTERMINATED_SECTION", "Declaration region has no END_VAR", "region", trimmed);
                }
                addSection(sections, header.kind, region.section, declarations.parseSection(regionLines, region.retain), warnings);
                i = j + 1;
                continue;
            }

            if (header.kind == BlockKind.GLOBAL_DB && upper.equals("STRUCT")) {
                sawDeclarations = true;
                DeclarationParser.StructBody struct = declarations.parseStruct(lines, i + 1, false);
                if (!struct.terminated) {
                    warnings.incomplete("UNTERMINATED_STRUCT", "Data block STRUCT has no END_STRUCT", "block", header.name);
                }
                addSection(sections, header.kind, SectionKind.STATIC, struct.members, warnings);
                i = struct.next;
                continue;
            }

            if (!sawDeclarations) readHeaderLine(trimmed, meta, description);
            i++;
        }

        if (!sawEnd) {
            warnings.incomplete("MISSING_END_KEYWORD", "Block is not closed by " + endKeyword, "block", header.name);
        }

        if (header.kind == BlockKind.GLOBAL_DB && meta.instanceOfName != null) {
            meta.blockType = BlockKind.INSTANCE_DB;
        }
        if (header.kind == BlockKind.ORGANIZATION_BLOCK) {
            Matcher m = OB_NUMBER.matcher(header.name);
            if (m.find()) meta.blockNumber = Integer.parseInt(m.group(1));
        }
        if (!description.isEmpty()) meta.description = String.join("\n", description);

        BlockMetadata metadata = meta.build();
        List<String> code = trimBlankLines(body);
        if (metadata.blockType.isDataBlock()) {
            applyStartValues(sections, code, warnings);
            code = List.of();
        }
        if (metadata.hasReturnValue()) {
            sections.put(SectionKind.RETURN, List.of(Member.of("Ret_Val", metadata.returnType)));
        }

        CanonicalDocument doc = new CanonicalDocument(metadata, sections, code);
        List<ConversionWarning> list = warnings.toDeterministicList();
        log.debug("Read {} with {} code lines and {} warnings", metadata, code.size(), list.size());
        return new Result(doc, list);
    }

    private static void readHeaderLine(String trimmed, BlockMetadata.Builder meta, List<String> description) {
        if (trimmed.isEmpty()) return;
        Matcher m;
        if ((m = OPTIMIZED.matcher(trimmed)).find()) {
            meta.memoryLayout = MemoryLayout.fromValue(m.group(1));
        } else if ((m = VERSION.matcher(trimmed)).find()) {
            meta.version = m.group(1);
        } else if ((m = AUTHOR.matcher(trimmed)).find()) {
            meta.author = m.group(1).trim();
        } else if ((m = FAMILY.matcher(trimmed)).find()) {
            meta.family = m.group(1).trim();
        } else if ((m = TITLE.matcher(trimmed)).find()) {
            meta.title = m.group(1).trim();
        } else if (trimmed.startsWith("//")) {
            description.add(trimmed.substring(2).trim());
        } else if (meta.blockType.isDataBlock() && (m = INSTANCE_OF.matcher(trimmed)).matches()) {
            meta.instanceOfName = m.group(1);
        }
    }

    private static void addSection(Map<SectionKind, List<Member>> sections, BlockKind kind, SectionKind section,
                                   List<Member> members, ConversionWarnings warnings) {
        if (!kind.sections().contains(section)) {
            if (!members.isEmpty()) {
                warnings.unsupported("SECTION_NOT_ALLOWED", "Section is not legal for the block kind; members dropped",
                        "section", section.xmlName(), "block", kind.code());
            }
            return;
        }
        List<Member> merged = new ArrayList<>(sections.getOrDefault(section, List.of()));
        merged.addAll(members);
        sections.put(section, merged);
    }

    /** Applies {@code name := value;} lines of a data block's BEGIN region to the declared members. */
    private static void applyStartValues(Map<SectionKind, List<Member>> sections, List<String> lines,
                                         ConversionWarnings warnings) {
        for (String line : lines) {
            String decl = DeclarationParser.splitComment(line)[0].trim();
            if (decl.isEmpty()) continue;
            Matcher m = DB_ASSIGNMENT.matcher(decl);
            List<Member> statics = sections.getOrDefault(SectionKind.STATIC, List.of());
            List<Member> updated = m.matches() ? assign(statics, m.group(1).split("\\."), 0, m.group(2)) : null;
            if (updated == null) {
                warnings.unsupported("DB_ASSIGNMENT_IGNORED", "Data block assignment does not name a declared member",
                        "line", decl);
                continue;
            }
            sections.put(SectionKind.STATIC, updated);
        }
    }

    private static List<Member> assign(List<Member> members, String[] path, int depth, String value) {
        for (int k = 0; k < members.size(); k++) {
            Member m = members.get(k);
            if (!m.name.equalsIgnoreCase(path[depth])) continue;
            Member replaced;
            if (depth == path.length - 1) {
                if (m.isStruct()) return null;
                replaced = m.withDefaultValue(value);
            } else {
                List<Member> nested = assign(m.members, path, depth + 1, value);
                if (nested == null) return null;
                replaced = m.withMembers(nested);
            }
            List<Member> out = new ArrayList<>(members);
            out.set(k, replaced);
            return out;
        }
        return null;
    }

    private static Header detectHeader(String text) {
        Matcher m = FB_HEADER.matcher(text);
        if (m.find()) return new Header(BlockKind.FUNCTION_BLOCK, name(m), null, m.end());
        m = OB_HEADER.matcher(text);
        if (m.find()) return new Header(BlockKind.ORGANIZATION_BLOCK, name(m), null, m.end());
        m = DB_HEADER.matcher(text);
        if (m.find()) return new Header(BlockKind.GLOBAL_DB, name(m), null, m.end());
        m = FC_HEADER.matcher(text);
        if (m.find()) return new Header(BlockKind.FUNCTION, name(m), m.group(3), m.end());
        return null;
    }

    private static String name(Matcher m) {
        return m.group(1) != null ? m.group(1) : m.group(2);
    }

    private static Pattern header(String keyword) {
        return Pattern.compile("(?im)^\\s*" + keyword + "\\s+" + NAME_GROUP);
    }

    private static String stripTrailing(String s) {
        return s.stripTrailing();
    }

    private static List<String> trimBlankLines(List<String> lines) {
        int from = 0;
        int to = lines.size();
        while (from < to && lines.get(from).isBlank()) from++;
        while (to > from && lines.get(to - 1).isBlank()) to--;
        return List.copyOf(lines.subList(from, to));
    }

    private static final class Header {
        final BlockKind kind;
        final String name;
        final String returnType;
        final int end;

        Header(BlockKind kind, String name, String returnType, int end) {
            this.kind = kind;
            this.name = name;
            this.returnType = returnType;
            this.end = end;
        }
    }

    /** Opening keyword of a declaration region. */
    private enum Region {
        INPUT("VAR_INPUT", SectionKind.INPUT, false),
        OUTPUT("VAR_OUTPUT", SectionKind.OUTPUT, false),
        IN_OUT("VAR_IN_OUT", SectionKind.IN_OUT, false),
        TEMP("VAR_TEMP", SectionKind.TEMP, false),
        CONSTANT("VAR CONSTANT", SectionKind.CONSTANT, false),
        RETAIN("VAR RETAIN", SectionKind.STATIC, true),
        NON_RETAIN("VAR NON_RETAIN", SectionKind.STATIC, false),
        STATIC("VAR", SectionKind.STATIC, false);

        private final Pattern pattern;
        final SectionKind section;
        final boolean retain;

        Region(String keyword, SectionKind section, boolean retain) {
            this.pattern = Pattern.compile("^" + keyword.replace(" ", "\\s+") + "(\\s.*)?$");
            this.section = section;
            this.retain = retain;
        }

        static Region of(String upperTrimmed) {
            String decl = DeclarationParser.splitComment(upperTrimmed)[0].trim();
            for (Region r : values()) {
                if (r.pattern.matcher(decl).matches()) return r;
            }
            return null;
        }
    }
}
