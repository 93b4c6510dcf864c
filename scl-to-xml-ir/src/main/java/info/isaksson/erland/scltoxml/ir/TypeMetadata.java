package info.isaksson.erland.scltoxml.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Header of a user-defined struct type. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"name", "version", "author", "family", "description"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TypeMetadata {
    public static final String DEFAULT_VERSION = "0.1";

    public final String name;
    public final String version;
    public final String author;
    public final String family;
    public final String description;

    @JsonCreator
    public TypeMetadata(
            @JsonProperty("name") String name,
            @JsonProperty("version") String version,
            @JsonProperty("author") String author,
            @JsonProperty("family") String family,
            @JsonProperty("description") String description
    ) {
        this.name = name;
        this.version = version == null || version.isBlank() ? DEFAULT_VERSION : version.trim();
        this.author = blankToNull(author);
        this.family = blankToNull(family);
        this.description = blankToNull(description);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeMetadata)) return false;
        TypeMetadata that = (TypeMetadata) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(version, that.version) &&
                Objects.equals(author, that.author) &&
                Objects.equals(family, that.family) &&
                Objects.equals(description, that.description);
    }

    @Override public int hashCode() {
        return Objects.hash(name, version, author, family, description);
    }
}
