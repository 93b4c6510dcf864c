package info.isaksson.erland.scltoxml.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** A user-defined struct type (UDT): a header plus one flat or nested member list. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"metadata", "members"})
public final class TypeDocument {
    public final TypeMetadata metadata;
    public final List<Member> members;

    @JsonCreator
    public TypeDocument(
            @JsonProperty("metadata") TypeMetadata metadata,
            @JsonProperty("members") List<Member> members
    ) {
        if (metadata == null) throw new IllegalArgumentException("metadata must not be null");
        this.metadata = metadata;
        this.members = members == null ? List.of() : List.copyOf(members);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeDocument)) return false;
        TypeDocument that = (TypeDocument) o;
        return Objects.equals(metadata, that.metadata) && Objects.equals(members, that.members);
    }

    @Override public int hashCode() {
        return Objects.hash(metadata, members);
    }

    @Override public String toString() {
        return "TypeDocument{\"" + metadata.name + "\", members=" + members.size() + "}";
    }
}
