package info.isaksson.erland.scltoxml.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A declared interface member (or a nested struct member).
 *
 * <p>{@code datatype} is the element type; array dimensions are carried separately in
 * {@link #arrayBounds}, so {@code Array[0..9] of Int} is datatype {@code Int} with one bound.
 * Nested {@link #members} are present only when the datatype is {@code Struct}.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"name", "datatype", "default_value", "comment", "retain", "array_bounds", "attributes", "members"})
public final class Member {
    public static final String STRUCT = "Struct";

    public final String name;
    public final String datatype;

    @JsonProperty("default_value")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String defaultValue;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String comment;

    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public final boolean retain;

    @JsonProperty("array_bounds")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<ArrayBound> arrayBounds;

    /** Engine-specific attributes, e.g. {@code S7_SetPoint} or {@code LibVersion}. Insertion ordered. */
    public final Map<String, String> attributes;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<Member> members;

    @JsonCreator
    public Member(
            @JsonProperty("name") String name,
            @JsonProperty("datatype") String datatype,
            @JsonProperty("default_value") String defaultValue,
            @JsonProperty("comment") String comment,
            @JsonProperty("retain") boolean retain,
            @JsonProperty("array_bounds") List<ArrayBound> arrayBounds,
            @JsonProperty("attributes") Map<String, String> attributes,
            @JsonProperty("members") List<Member> members
    ) {
        this.name = name;
        this.datatype = datatype;
        this.defaultValue = emptyToNull(defaultValue);
        this.comment = emptyToNull(comment);
        this.retain = retain;
        this.arrayBounds = arrayBounds == null ? List.of() : List.copyOf(arrayBounds);
        this.attributes = attributes == null || attributes.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.members = members == null ? List.of() : List.copyOf(members);
    }

    public static Member of(String name, String datatype) {
        return new Member(name, datatype, null, null, false, null, null, null);
    }

    public static Member struct(String name, List<Member> members) {
        return new Member(name, STRUCT, null, null, false, null, null, members);
    }

    @JsonIgnore
    public boolean isStruct() {
        return STRUCT.equalsIgnoreCase(datatype);
    }

    @JsonIgnore
    public boolean isArray() {
        return !arrayBounds.isEmpty();
    }

    public Member withDefaultValue(String value) {
        return new Member(name, datatype, value, comment, retain, arrayBounds, attributes, members);
    }

    public Member withRetain(boolean value) {
        return new Member(name, datatype, defaultValue, comment, value, arrayBounds, attributes, members);
    }

    public Member withMembers(List<Member> nested) {
        return new Member(name, datatype, defaultValue, comment, retain, arrayBounds, attributes, nested);
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Member)) return false;
        Member that = (Member) o;
        return retain == that.retain &&
                Objects.equals(name, that.name) &&
                Objects.equals(datatype, that.datatype) &&
                Objects.equals(defaultValue, that.defaultValue) &&
                Objects.equals(comment, that.comment) &&
                Objects.equals(arrayBounds, that.arrayBounds) &&
                Objects.equals(attributes, that.attributes) &&
                Objects.equals(members, that.members);
    }

    @Override public int hashCode() {
        return Objects.hash(name, datatype, defaultValue, comment, retain, arrayBounds, attributes, members);
    }

    @Override public String toString() {
        return name + " : " + (isArray() ? "Array" + arrayBounds + " of " : "") + datatype;
    }
}
