package info.isaksson.erland.scltoxml.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Declaration group of a block interface.
 *
 * <p>Each kind knows its name in the interchange XML ({@code Section Name="Input"}), its key in the
 * canonical JSON document and the {@code VAR_*} keyword that opens it in source text.</p>
 */
public enum SectionKind {
    INPUT("Input", "input_section", "VAR_INPUT"),
    OUTPUT("Output", "output_section", "VAR_OUTPUT"),
    IN_OUT("InOut", "in_out_section", "VAR_IN_OUT"),
    STATIC("Static", "static_section", "VAR"),
    TEMP("Temp", "temp_section", "VAR_TEMP"),
    CONSTANT("Constant", "constant_section", "VAR CONSTANT"),
    RETURN("Return", "return_section", null);

    private final String xmlName;
    private final String jsonKey;
    private final String keyword;

    SectionKind(String xmlName, String jsonKey, String keyword) {
        this.xmlName = xmlName;
        this.jsonKey = jsonKey;
        this.keyword = keyword;
    }

    public String xmlName() {
        return xmlName;
    }

    @JsonValue
    public String jsonKey() {
        return jsonKey;
    }

    /** Opening keyword in source text; {@code null} for {@link #RETURN}, which is declared in the header. */
    public String keyword() {
        return keyword;
    }

    public static SectionKind fromXmlName(String name) {
        if (name == null) return null;
        for (SectionKind k : values()) {
            if (k.xmlName.equalsIgnoreCase(name.trim())) return k;
        }
        return null;
    }

    @JsonCreator
    public static SectionKind fromJsonKey(String key) {
        if (key == null) return null;
        for (SectionKind k : values()) {
            if (k.jsonKey.equals(key.trim())) return k;
        }
        return null;
    }
}
