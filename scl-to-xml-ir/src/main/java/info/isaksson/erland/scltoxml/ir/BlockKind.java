package info.isaksson.erland.scltoxml.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Kind of program block.
 *
 * <p>The code is the short form used in the canonical document ({@code "FB"}) and in the interchange
 * XML element name ({@code SW.Blocks.FB}).</p>
 */
public enum BlockKind {
    FUNCTION_BLOCK("FB", "FUNCTION_BLOCK", true,
            List.of(SectionKind.INPUT, SectionKind.OUTPUT, SectionKind.IN_OUT,
                    SectionKind.STATIC, SectionKind.TEMP, SectionKind.CONSTANT)),
    FUNCTION("FC", "FUNCTION", true,
            List.of(SectionKind.INPUT, SectionKind.OUTPUT, SectionKind.IN_OUT,
                    SectionKind.TEMP, SectionKind.CONSTANT, SectionKind.RETURN)),
    ORGANIZATION_BLOCK("OB", "ORGANIZATION_BLOCK", true,
            List.of(SectionKind.INPUT, SectionKind.TEMP, SectionKind.CONSTANT)),
    GLOBAL_DB("GlobalDB", "DATA_BLOCK", false,
            List.of(SectionKind.STATIC)),
    INSTANCE_DB("InstanceDB", "DATA_BLOCK", false,
            List.of(SectionKind.INPUT, SectionKind.OUTPUT, SectionKind.IN_OUT, SectionKind.STATIC));

    private final String code;
    private final String keyword;
    private final boolean hasCode;
    private final List<SectionKind> sections;

    BlockKind(String code, String keyword, boolean hasCode, List<SectionKind> sections) {
        this.code = code;
        this.keyword = keyword;
        this.hasCode = hasCode;
        this.sections = sections;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** Keyword opening the block in source text; the closing keyword is {@code END_} plus this. */
    public String keyword() {
        return keyword;
    }

    /** Element name in the interchange XML. */
    public String xmlElement() {
        return "SW.Blocks." + code;
    }

    /** Whether the block carries a code body (data blocks do not). */
    public boolean hasCode() {
        return hasCode;
    }

    /** Legal sections in interchange order. */
    public List<SectionKind> sections() {
        return sections;
    }

    public boolean isDataBlock() {
        return this == GLOBAL_DB || this == INSTANCE_DB;
    }

    @JsonCreator
    public static BlockKind fromCode(String code) {
        if (code == null) return null;
        String c = code.trim();
        for (BlockKind k : values()) {
            if (k.code.equalsIgnoreCase(c) || k.name().equalsIgnoreCase(c)) return k;
        }
        // Older documents use "DB" for global data blocks.
        if (c.equalsIgnoreCase("DB")) return GLOBAL_DB;
        return null;
    }

    /** Resolves {@code SW.Blocks.FB}-style element names. */
    public static BlockKind fromXmlElement(String element) {
        if (element == null || !element.startsWith("SW.Blocks.")) return null;
        String code = element.substring("SW.Blocks.".length());
        for (BlockKind k : values()) {
            if (k.code.equals(code)) return k;
        }
        return null;
    }
}
