package info.isaksson.erland.scltoxml.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The pivot between source text and interchange XML: block metadata, one member list per section,
 * and the code body as ordered source lines.
 *
 * <p>Every legal section of the block kind is present (possibly empty). Sections that are not legal
 * for the kind are kept when they carry members so that nothing read from an input is silently lost;
 * writers decide what to do with them.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"metadata", "sections", "code"})
public final class CanonicalDocument {
    public final BlockMetadata metadata;

    @JsonIgnore
    public final Map<SectionKind, List<Member>> sections;

    public final List<String> code;

    public CanonicalDocument(BlockMetadata metadata, Map<SectionKind, List<Member>> sections, List<String> code) {
        if (metadata == null) throw new IllegalArgumentException("metadata must not be null");
        this.metadata = metadata;

        EnumMap<SectionKind, List<Member>> normalized = new EnumMap<>(SectionKind.class);
        for (SectionKind k : metadata.blockType.sections()) {
            normalized.put(k, List.of());
        }
        if (sections != null) {
            for (Map.Entry<SectionKind, List<Member>> e : sections.entrySet()) {
                if (e.getKey() == null) continue;
                List<Member> members = e.getValue() == null ? List.of() : List.copyOf(e.getValue());
                if (members.isEmpty() && !normalized.containsKey(e.getKey())) continue;
                normalized.put(e.getKey(), members);
            }
        }
        this.sections = Collections.unmodifiableMap(normalized);
        this.code = code == null ? List.of() : List.copyOf(code);
    }

    @JsonCreator
    static CanonicalDocument fromJson(
            @JsonProperty("metadata") BlockMetadata metadata,
            @JsonProperty("sections") Map<String, List<Member>> sections,
            @JsonProperty("code") List<String> code
    ) {
        Map<SectionKind, List<Member>> byKind = new EnumMap<>(SectionKind.class);
        if (sections != null) {
            for (Map.Entry<String, List<Member>> e : sections.entrySet()) {
                SectionKind kind = SectionKind.fromJsonKey(e.getKey());
                if (kind != null) byKind.put(kind, e.getValue());
            }
        }
        return new CanonicalDocument(metadata, byKind, code);
    }

    /** JSON view of {@link #sections}, keyed by {@link SectionKind#jsonKey()}. */
    @JsonProperty("sections")
    public Map<String, List<Member>> sectionsByKey() {
        Map<String, List<Member>> out = new LinkedHashMap<>();
        for (Map.Entry<SectionKind, List<Member>> e : sections.entrySet()) {
            out.put(e.getKey().jsonKey(), e.getValue());
        }
        return out;
    }

    /** Members of one section; empty when the section is absent. */
    public List<Member> section(SectionKind kind) {
        List<Member> members = sections.get(kind);
        return members == null ? List.of() : members;
    }

    public BlockKind blockKind() {
        return metadata.blockType;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CanonicalDocument)) return false;
        CanonicalDocument that = (CanonicalDocument) o;
        return Objects.equals(metadata, that.metadata) &&
                Objects.equals(sections, that.sections) &&
                Objects.equals(code, that.code);
    }

    @Override public int hashCode() {
        return Objects.hash(metadata, sections, code);
    }

    @Override public String toString() {
        return "CanonicalDocument{" + metadata + ", lines=" + code.size() + "}";
    }
}
