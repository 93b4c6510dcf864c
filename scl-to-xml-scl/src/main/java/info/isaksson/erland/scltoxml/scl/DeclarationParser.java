package info.isaksson.erland.scltoxml.scl;

import info.isaksson.erland.scltoxml.ir.ArrayBound;
import info.isaksson.erland.scltoxml.ir.ConversionWarnings;
import info.isaksson.erland.scltoxml.ir.Member;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses member declarations, one per line:
 * <pre>
 *   name [{ Key := 'value'; ... }] : datatype [:= default]; [// comment]
 *   name [{ ... }] : [Array[l..u] of] Struct [// comment]
 *      ...nested declarations...
 *   END_STRUCT;
 * </pre>
 * Lines that match neither form are skipped with a warning.
 */
public final class DeclarationParser {

    private static final Pattern NAME = Pattern.compile("^(\"[^\"]+\"|[A-Za-z_][A-Za-z0-9_]*)\\s*");
    private static final Pattern STRUCT_TYPE = Pattern.compile(
            "^(?:Array\\s*\\[(.+)]\\s*of\\s+)?Struct$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ARRAY_TYPE = Pattern.compile(
            "^Array\\s*\\[(.+)]\\s*of\\s+(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIMENSION = Pattern.compile("^\\s*(-?\\d+)\\s*\\.\\.\\s*(-?\\d+)\\s*$");
    private static final Pattern ATTRIBUTE = Pattern.compile("^\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*:=\\s*(.*?)\\s*$");

    private final ConversionWarnings warnings;

    public DeclarationParser(ConversionWarnings warnings) {
        this.warnings = warnings == null ? new ConversionWarnings() : warnings;
    }

    /** Result of parsing a struct body: the members and the index of the line after its END_STRUCT. */
    public static final class StructBody {
        public final List<Member> members;
        public final int next;
        public final boolean terminated;

        StructBody(List<Member> members, int next, boolean terminated) {
            this.members = List.copyOf(members);
            this.next = next;
            this.terminated = terminated;
        }
    }

    /** Parses all lines of a {@code VAR ... END_VAR} region (without its delimiters). */
    public List<Member> parseSection(List<String> lines, boolean retain) {
        return parse(lines, 0, false, retain).members;
    }

    /** Parses from {@code start} up to and including the matching {@code END_STRUCT}. */
    public StructBody parseStruct(List<String> lines, int start, boolean retain) {
        return parse(lines, start, true, retain);
    }

    private StructBody parse(List<String> lines, int start, boolean nested, boolean retain) {
        List<Member> out = new ArrayList<>();
        int i = start;
        while (i < lines.size()) {
            String raw = lines.get(i);
            String[] split = splitComment(raw);
            String decl = split[0].trim();
            String comment = split[1];

            if (decl.isEmpty()) {
                i++;
                continue;
            }
            if (decl.toUpperCase(Locale.ROOT).startsWith("END_STRUCT")) {
                if (nested) return new StructBody(out, i + 1, true);
                warnings.incomplete("STRAY_END_STRUCT", "END_STRUCT without matching Struct", "line", raw.trim());
                i++;
                continue;
            }

            Declaration d = Declaration.parse(decl);
            if (d == null) {
                warnings.incomplete("UNPARSED_DECLARATION", "Declaration does not match name : type", "line", raw.trim());
                i++;
                continue;
            }

            Matcher sm = STRUCT_TYPE.matcher(d.type);
            if (d.defaultValue == null && !d.terminated && sm.matches()) {
                StructBody body = parse(lines, i + 1, true, retain);
                if (!body.terminated) {
                    warnings.incomplete("UNTERMINATED_STRUCT", "Struct has no END_STRUCT", "member", d.name);
                }
                List<ArrayBound> bounds = sm.group(1) == null ? List.of() : parseBounds(sm.group(1), d.name);
                out.add(new Member(d.name, Member.STRUCT, null, comment, retain,
                        bounds == null ? List.of() : bounds, d.attributes, body.members));
                i = body.next;
                continue;
            }

            out.add(toMember(d, comment, retain));
            i++;
        }
        return new StructBody(out, i, false);
    }

    private Member toMember(Declaration d, String comment, boolean retain) {
        String datatype = d.type;
        List<ArrayBound> bounds = List.of();
        Matcher am = ARRAY_TYPE.matcher(d.type);
        if (am.matches()) {
            List<ArrayBound> parsed = parseBounds(am.group(1), d.name);
            if (parsed != null) {
                bounds = parsed;
                datatype = am.group(2).trim();
            }
        }
        return new Member(d.name, datatype, d.defaultValue, comment, retain, bounds, d.attributes, null);
    }

    /** Integer bounds, or {@code null} (and a warning) when a dimension is symbolic or open. */
    private List<ArrayBound> parseBounds(String dims, String member) {
        List<ArrayBound> out = new ArrayList<>();
        for (String dim : dims.split(",")) {
            Matcher m = DIMENSION.matcher(dim);
            if (!m.matches()) {
                warnings.unsupported("ARRAY_BOUNDS_NOT_NUMERIC",
                        "Array bounds kept as part of the datatype", "member", member);
                return null;
            }
            out.add(new ArrayBound(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))));
        }
        return out;
    }

    /** Splits a line into declaration and trailing {@code //} comment, ignoring slashes inside quotes. */
    static String[] splitComment(String line) {
        char quote = 0;
        for (int i = 0; i + 1 < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '/' && line.charAt(i + 1) == '/') {
                String comment = line.substring(i + 2).trim();
                return new String[] {line.substring(0, i), comment.isEmpty() ? null : comment};
            }
        }
        return new String[] {line, null};
    }

    static Map<String, String> parseAttributes(String body) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String part : body.split(";")) {
            Matcher m = ATTRIBUTE.matcher(part);
            if (!m.matches()) continue;
            out.put(m.group(1), unquote(m.group(2)));
        }
        return out;
    }

    private static String unquote(String v) {
        if (v.length() >= 2 && v.startsWith("'") && v.endsWith("'")) return v.substring(1, v.length() - 1);
        return v;
    }

    /** One declaration line split into its parts. */
    private static final class Declaration {
        final String name;
        final Map<String, String> attributes;
        final String type;
        final String defaultValue;
        final boolean terminated;

        private Declaration(String name, Map<String, String> attributes, String type, String defaultValue, boolean terminated) {
            this.name = name;
            this.attributes = attributes;
            this.type = type;
            this.defaultValue = defaultValue;
            this.terminated = terminated;
        }

        static Declaration parse(String decl) {
            Matcher nm = NAME.matcher(decl);
            if (!nm.find()) return null;
            String name = nm.group(1);
            if (name.startsWith("\"")) name = name.substring(1, name.length() - 1);
            String rest = decl.substring(nm.end());

            Map<String, String> attributes = Map.of();
            if (rest.startsWith("{")) {
                int close = rest.indexOf('}');
                if (close < 0) return null;
                attributes = parseAttributes(rest.substring(1, close));
                rest = rest.substring(close + 1).trim();
            }
            if (!rest.startsWith(":") || rest.startsWith(":=")) return null;
            rest = rest.substring(1).trim();

            boolean terminated = rest.endsWith(";");
            if (terminated) rest = rest.substring(0, rest.length() - 1).trim();

            String type = rest;
            String defaultValue = null;
            int assign = indexOutsideQuotes(rest, ":=");
            if (assign >= 0) {
                type = rest.substring(0, assign).trim();
                defaultValue = rest.substring(assign + 2).trim();
            }
            if (type.isEmpty()) return null;
            return new Declaration(name, attributes, type, defaultValue, terminated);
        }

        private static int indexOutsideQuotes(String s, String needle) {
            char quote = 0;
            for (int i = 0; i + needle.length() <= s.length(); i++) {
                char c = s.charAt(i);
                if (quote != 0) {
                    if (c == quote) quote = 0;
                } else if (c == '\'' || c == '"') {
                    quote = c;
                } else if (s.startsWith(needle, i)) {
                    return i;
                }
            }
            return -1;
        }
    }
}
