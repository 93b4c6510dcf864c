package info.isaksson.erland.scltoxml.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Block memory layout ({@code S7_Optimized_Access}). */
public enum MemoryLayout {
    OPTIMIZED("Optimized"),
    STANDARD("Standard");

    private final String value;

    MemoryLayout(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static MemoryLayout fromValue(String value) {
        if (value == null || value.isBlank()) return OPTIMIZED;
        String v = value.trim();
        if (v.equalsIgnoreCase("Standard") || v.equalsIgnoreCase("FALSE")) return STANDARD;
        return OPTIMIZED;
    }
}
